/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fortx.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Expressions.KeywordArg;
import exm.fortx.ir.Expressions.VariableRef;
import exm.fortx.ir.Node;
import exm.fortx.ir.Program.ReplacementListener;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.BlockConstruct;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.Routine;

/**
 * Builds scopes and resolves names for loaded source units.
 *
 * Resolution runs in two phases: first every module's specification
 * part is interned, so that modules can be used across files; then the
 * routines of each unit are resolved, each on its own.  When a routine
 * is replaced, only its scopes are rebuilt.
 */
public class Resolver implements ReplacementListener {

  private final Logger logger = Logging.getLogger();

  /** Module scopes of all loaded units, by lower case name */
  private final ConcurrentMap<String, Scope> moduleScopes =
                              new ConcurrentHashMap<String, Scope>();
  /** External routines of all loaded units, by lower case name */
  private final ConcurrentMap<String, Symbol> externals =
                              new ConcurrentHashMap<String, Symbol>();
  /** File scopes built in the first phase */
  private final Map<SourceUnit, Scope> fileScopes =
                     new IdentityHashMap<SourceUnit, Scope>();

  /**
   * Resolve all units from scratch
   */
  public void resolveAll(Collection<SourceUnit> units) {
    for (SourceUnit unit: units) {
      intern(unit);
    }
    for (SourceUnit unit: units) {
      attachModuleUses(unit);
    }
    for (SourceUnit unit: units) {
      resolve(unit);
    }
  }

  public Scope moduleScope(String name) {
    return moduleScopes.get(name.toLowerCase());
  }

  /**
   * First phase: module specification parts and external routine names
   */
  private void intern(SourceUnit unit) {
    FileNode root = unit.root();
    Scope fileScope = new Scope(ScopeKind.FILE, unit.path(), null, root);
    synchronized (this) {
      fileScopes.put(unit, fileScope);
    }
    for (Module m: root.modules()) {
      UnitId mid = UnitId.module(m.name());
      Scope ms = new Scope(ScopeKind.MODULE, m.name(), fileScope, m);
      declareSpec(ms, m.spec(), null);
      for (Routine r: m.routines()) {
        ms.define(Symbol.procedure(r.name(), r, ms, mid.member(r.name())));
      }
      fileScope.define(new Symbol(m.name(), SymbolKind.MODULE, null, null,
                                  null, null, m, fileScope, mid));
      Scope prev = moduleScopes.putIfAbsent(mid.toString(), ms);
      if (prev != null) {
        Logging.uniqueWarn(logger, "Module " + m.name() + " in " +
            unit.path() + " is also defined elsewhere, ignored");
      }
    }
    for (Routine r: root.routines()) {
      UnitId id = UnitId.external(r.name());
      Symbol sym = Symbol.procedure(r.name(), r, fileScope, id);
      fileScope.define(sym);
      externals.putIfAbsent(r.name().toLowerCase(), sym);
    }
  }

  /**
   * Module USE statements need every module interned first
   */
  private void attachModuleUses(SourceUnit unit) {
    for (Module m: unit.root().modules()) {
      Scope ms = moduleScopes.get(m.name().toLowerCase());
      if (ms == null || ms.node() != m) {
        continue;
      }
      for (Node n: m.spec()) {
        if (n instanceof Import) {
          // Warnings for unloaded modules are recorded when resolving
          addUse(ms, (Import)n, null, null);
        }
      }
    }
  }

  /**
   * Second phase for one unit.  Publishes a new resolution on the unit.
   */
  public void resolve(SourceUnit unit) {
    synchronized (unit) {
      Scope fileScope;
      synchronized (this) {
        fileScope = fileScopes.get(unit);
      }
      if (fileScope == null) {
        intern(unit);
        attachModuleUses(unit);
        synchronized (this) {
          fileScope = fileScopes.get(unit);
        }
      }
      FileNode root = unit.root();
      Resolution r = new Resolution(fileScope);
      r.addScope(root, fileScope);
      Context ctx = new Context(unit.path(), r, null);

      for (Module m: root.modules()) {
        UnitId mid = UnitId.module(m.name());
        Scope ms = moduleScopes.get(mid.toString());
        if (ms == null || ms.node() != m) {
          // Duplicate module: resolve privately
          ms = new Scope(ScopeKind.MODULE, m.name(), fileScope, m);
          declareSpec(ms, m.spec(), null);
        }
        r.addScope(m, ms);
        r.addUnitScope(mid, ms);
        Context mctx = new Context(unit.path(), r, mid);
        for (Node n: m.spec()) {
          if (n instanceof Import) {
            warnUnloaded((Import)n, mctx);
          } else {
            resolveRefs(n, ms, mctx, 0);
          }
        }
        for (Routine routine: m.routines()) {
          resolveRoutine(routine, ms, mid.member(routine.name()), r,
                         unit.path());
        }
      }
      for (Routine routine: root.routines()) {
        resolveRoutine(routine, fileScope, UnitId.external(routine.name()),
                       r, unit.path());
      }
      unit.setResolution(r);
      logger.debug("Resolved " + unit.path() + ": " + r.warnings().size()
                   + " warnings");
    }
  }

  /**
   * Rebuild the scopes of one routine and the routines it contains.  The
   * host scope is kept, as sibling scopes hang off it; only its procedure
   * symbol is redefined to point at the new node.  Also used for a
   * routine that was just added.
   */
  public void reresolve(SourceUnit unit, UnitId id) {
    synchronized (unit) {
      Resolution old = unit.resolution();
      if (old == null) {
        resolve(unit);
        return;
      }
      Node found = unit.find(id);
      if (!(found instanceof Routine)) {
        logger.debug("Not re-resolving " + id + ": no longer in " + unit);
        return;
      }
      Routine current = (Routine)found;
      Resolution r = old.copy();
      Scope oldScope = old.unitScope(id);
      if (oldScope != null) {
        r.removeSubtree(oldScope.node(), id);
      }

      // Ancestors were rebuilt by the replacement, rekey their scopes
      r.addScope(unit.root(), r.fileScope());
      for (UnitId uid: unit.unitIds()) {
        Scope s = r.unitScope(uid);
        Node n = unit.find(uid);
        if (s != null && n != null) {
          r.addScope(n, s);
        }
      }

      UnitId host = id.host();
      Scope hostScope = host == null ? r.fileScope() : r.unitScope(host);
      if (hostScope == null) {
        hostScope = r.fileScope();
      }
      Symbol sym = Symbol.procedure(current.name(), current, hostScope, id);
      hostScope.define(sym);
      if (host == null) {
        externals.put(current.name().toLowerCase(), sym);
      }
      resolveRoutine(current, hostScope, id, r, unit.path());
      unit.setResolution(r);
      logger.debug("Re-resolved " + id);
    }
  }

  @Override
  public void routineReplaced(SourceUnit source, UnitId id,
                              Routine oldRoutine, Routine newRoutine) {
    reresolve(source, id);
  }

  @Override
  public void routineAdded(SourceUnit source, UnitId id, Routine routine) {
    reresolve(source, id);
  }

  /**
   * Where references are being resolved
   */
  private static class Context {
    final String path;
    final Resolution resolution;
    final UnitId unit;

    Context(String path, Resolution resolution, UnitId unit) {
      this.path = path;
      this.resolution = resolution;
      this.unit = unit;
    }

    void warn(int line, String name, String msg) {
      resolution.addWarning(new ResolutionWarning(path, line, unit, name,
                                                  msg));
    }
  }

  private void resolveRoutine(Routine routine, Scope parent, UnitId id,
                              Resolution r, String path) {
    Scope scope = new Scope(ScopeKind.ROUTINE, routine.name(), parent,
                            routine);
    for (String d: routine.dummies()) {
      scope.define(new Symbol(d, SymbolKind.DUMMY, null, null, null, null,
                              null, scope, null));
    }
    String result = routine.resultVariable();
    if (result != null) {
      scope.define(new Symbol(result, SymbolKind.RESULT,
                              routine.resultType(), null, null, null,
                              routine, scope, null));
    }
    for (Routine member: routine.routines()) {
      scope.define(Symbol.procedure(member.name(), member, scope,
                                    id.member(member.name())));
    }
    Context ctx = new Context(path, r, id);
    declareSpec(scope, routine.spec(), routine);
    r.addScope(routine, scope);
    r.addUnitScope(id, scope);

    for (Node n: routine.spec()) {
      if (n instanceof Import) {
        addUse(scope, (Import)n, ctx, n);
      } else {
        resolveRefs(n, scope, ctx, 0);
      }
    }
    for (Node n: routine.body()) {
      resolveRefs(n, scope, ctx, 0);
    }
    for (Routine member: routine.routines()) {
      resolveRoutine(member, scope, id.member(member.name()), r, path);
    }
  }

  /**
   * Define the entities declared in a specification part.  Names of
   * dummies and the result variable keep their kind.
   * @param routine enclosing routine, or null
   */
  private void declareSpec(Scope scope, List<Node> spec, Routine routine) {
    for (Node n: spec) {
      if (!(n instanceof Declaration)) {
        continue;
      }
      Declaration decl = (Declaration)n;
      for (Entity e: decl.entities()) {
        SymbolKind kind;
        if (routine != null && routine.isDummy(e.name())) {
          kind = SymbolKind.DUMMY;
        } else if (routine != null && routine.resultVariable() != null &&
                   routine.resultVariable().equalsIgnoreCase(e.name())) {
          kind = SymbolKind.RESULT;
        } else if (decl.hasAttribute("parameter")) {
          kind = SymbolKind.PARAMETER;
        } else if (decl.hasAttribute("external")) {
          kind = SymbolKind.PROCEDURE;
        } else {
          kind = SymbolKind.VARIABLE;
        }
        List<Node> shape = e.shape().isEmpty() ? decl.dimensions()
                                               : e.shape();
        scope.define(new Symbol(e.name(), kind, decl.type(), shape,
                  decl.intent(), new HashSet<String>(decl.attributes()),
                  decl, scope, null));
      }
    }
  }

  /**
   * @param ctx null while interning, when no warnings are recorded
   */
  private void addUse(Scope scope, Import imp, Context ctx, Node stmt) {
    Scope module = moduleScopes.get(imp.module().toLowerCase());
    if (module != null) {
      scope.addUse(new Scope.UseAssociation(imp, module));
      return;
    }
    if (imp.isOnly()) {
      for (String s: imp.symbols()) {
        scope.define(Symbol.imported(Import.localName(s), scope,
                                     imp.module()));
      }
    } else {
      scope.addUnloadedModule(imp.module());
    }
    if (ctx != null) {
      warnUnloaded(imp, ctx);
    }
  }

  private void warnUnloaded(Import imp, Context ctx) {
    if (moduleScopes.containsKey(imp.module().toLowerCase())) {
      return;
    }
    ctx.warn(line(imp, 0), imp.module(), "module " + imp.module() +
             " is not loaded, names imported from it have unknown type");
  }

  /**
   * Resolve references in a statement or expression subtree
   * @param line line of the innermost enclosing statement with a span
   */
  private void resolveRefs(Node n, Scope scope, Context ctx, int line) {
    line = line(n, line);
    switch (n.kind()) {
      case BLOCK: {
        BlockConstruct block = (BlockConstruct)n;
        Scope bs = new Scope(ScopeKind.BLOCK, "block", scope, block);
        declareSpec(bs, block.spec(), null);
        ctx.resolution.addScope(block, bs);
        for (Node c: block.spec()) {
          if (c instanceof Import) {
            addUse(bs, (Import)c, ctx, c);
          } else {
            resolveRefs(c, bs, ctx, line);
          }
        }
        for (Node c: block.body()) {
          resolveRefs(c, bs, ctx, line);
        }
        return;
      }
      case VARIABLE: {
        String name = ((VariableRef)n).name();
        ctx.resolution.addSymbol(n, resolveData(name, scope, ctx, line));
        return;
      }
      case ARRAY_REF: {
        String name = ((ArrayRef)n).name();
        Symbol sym = scope.lookup(name);
        if (sym == null) {
          sym = resolveProcedure(name, scope, ctx, line, false);
        }
        ctx.resolution.addSymbol(n, sym);
        break;
      }
      case CALL: {
        String name = ((CallStatement)n).name();
        Symbol sym = scope.lookup(name);
        if (sym == null || sym.kind().isData()) {
          sym = resolveProcedure(name, scope, ctx, line, true);
        }
        ctx.resolution.addSymbol(n, sym);
        break;
      }
      case KEYWORD_ARG:
        resolveRefs(((KeywordArg)n).value(), scope, ctx, line);
        return;
      default:
        break;
    }
    for (Node c: n.children()) {
      resolveRefs(c, scope, ctx, line);
    }
  }

  private Symbol resolveData(String name, Scope scope, Context ctx,
                             int line) {
    Symbol sym = scope.lookup(name);
    if (sym != null) {
      return sym;
    }
    String module = scope.unloadedModule();
    if (module != null) {
      ctx.warn(line, name, "'" + name + "' assumed to come from module " +
               module + ", which is not loaded");
      return Symbol.imported(name, scope, module);
    }
    ctx.warn(line, name, "unresolved name '" + name + "'");
    return Symbol.unresolved(name, scope);
  }

  private Symbol resolveProcedure(String name, Scope scope, Context ctx,
                                  int line, boolean call) {
    if (Intrinsics.isIntrinsic(name)) {
      return Symbol.intrinsicProcedure(name);
    }
    Symbol external = externals.get(name.toLowerCase());
    if (external != null) {
      return external;
    }
    String module = scope.unloadedModule();
    if (module != null) {
      ctx.warn(line, name, "'" + name + "' assumed to come from module " +
               module + ", which is not loaded");
      return Symbol.imported(name, scope, module);
    }
    ctx.warn(line, name, (call ? "call to unresolved routine '"
                               : "unresolved name '") + name + "'");
    return Symbol.unresolved(name, scope);
  }

  private static int line(Node n, int enclosing) {
    return n.span() != null ? n.span().startLine() : enclosing;
  }

  /**
   * @return ids of all routines the resolver knows as externals
   */
  public List<String> externalNames() {
    return new ArrayList<String>(externals.keySet());
  }

  /**
   * @return names of all interned modules
   */
  public Set<String> moduleNames() {
    return new HashSet<String>(moduleScopes.keySet());
  }
}
