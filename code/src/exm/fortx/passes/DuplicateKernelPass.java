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
package exm.fortx.passes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;

import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Severity;
import exm.fortx.resolve.Symbol;
import exm.fortx.resolve.SymbolKind;
import exm.fortx.sched.Pass.RoutinePass;
import exm.fortx.sched.PassContext;
import exm.fortx.sched.PassOrder;
import exm.fortx.sched.PassResult;
import exm.fortx.sched.PassResult.NewRoutine;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Replacement;
import exm.fortx.walk.Transformer;
import exm.fortx.walk.WalkContext;

/**
 * Clone given subroutines under a suffixed name and follow every call to
 * one of them with the same call to its clone.  The clone is placed
 * right after the original, in the same module or file.
 */
public class DuplicateKernelPass extends RoutinePass {
  public static final String NAME = "duplicate-kernel";

  private final Set<String> names = new HashSet<String>();
  private final String suffix;

  public DuplicateKernelPass(List<String> names, String suffix) {
    super(NAME, PassOrder.CALLEE_FIRST);
    for (String n: names) {
      this.names.add(n.toLowerCase());
    }
    this.suffix = suffix.trim();
  }

  public static DuplicateKernelPass fromSettings(Settings settings) {
    return new DuplicateKernelPass(
        settings.getList(Settings.DUPLICATE_KERNEL_NAMES),
        settings.get(Settings.DUPLICATE_KERNEL_SUFFIX));
  }

  public String cloneName(String kernel) {
    return kernel + suffix;
  }

  @Override
  public PassResult apply(Routine routine, final PassContext context) {
    if (names.isEmpty() || context.resolution() == null) {
      return PassResult.of(routine);
    }
    final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    final Map<UnitId, NewRoutine> clones =
                          new TreeMap<UnitId, NewRoutine>();
    // Clone names to add to ONLY lists, by module
    final Map<String, Set<String>> imports =
                          new HashMap<String, Set<String>>();

    Transformer t = new Transformer(Transformer.Order.PRE,
                                    NodeFilter.statements().prune()) {
      @Override
      public Replacement transform(Node node, WalkContext walk) {
        if (node.kind() != NodeKind.CALL) {
          return Replacement.keep();
        }
        CallStatement call = (CallStatement)node;
        if (!names.contains(call.name().toLowerCase())) {
          return Replacement.keep();
        }
        UnitId kernelId = kernelId(call, context);
        if (kernelId == null) {
          diagnostics.add(new Diagnostic(NAME, Severity.WARNING,
              context.source().path(), call.span(), "cannot duplicate " +
              call.name() + " in " + context.unitId() +
              ": routine is not loaded"));
          return Replacement.keep();
        }
        Routine kernel = context.routine(kernelId);
        if (kernel.isFunction()) {
          diagnostics.add(new Diagnostic(NAME, Severity.WARNING,
              context.source().path(), call.span(), "cannot duplicate " +
              call.name() + ": not a subroutine"));
          return Replacement.keep();
        }
        String clone = cloneName(kernel.name());
        if (followedByCall(call, walk.parent(), clone)) {
          return Replacement.keep();
        }
        if (!clones.containsKey(kernelId) &&
            context.program().unit(siblingId(kernelId, clone)) == null) {
          Routine copy = (Routine)Nodes.deepCopy(kernel);
          clones.put(kernelId, new NewRoutine(kernelId, copy.withName(clone)));
        }
        UnitId host = kernelId.host();
        if (host != null && host.isModule() &&
            !host.equals(moduleOf(context.unitId()))) {
          Set<String> needed = imports.get(host.toString());
          if (needed == null) {
            needed = new HashSet<String>();
            imports.put(host.toString(), needed);
          }
          needed.add(clone);
        }
        diagnostics.add(new Diagnostic(NAME, Severity.INFO,
            context.source().path(), call.span(), "added call to " + clone +
            " in " + context.unitId()));
        return Replacement.of(ImmutableList.<Node>of(call,
                    new CallStatement(null, clone, call.args())));
      }
    };
    Routine result = t.applyTyped(routine);
    if (result == routine) {
      return new PassResult(routine, diagnostics);
    }
    result = extendOnlyLists(result, imports);
    return new PassResult(result, diagnostics,
                          new ArrayList<NewRoutine>(clones.values()));
  }

  private static UnitId siblingId(UnitId id, String name) {
    UnitId host = id.host();
    return host == null ? UnitId.external(name) : host.member(name);
  }

  /**
   * @return module holding a unit, or null for external units
   */
  private static UnitId moduleOf(UnitId id) {
    String first = id.parts().get(0);
    return first.isEmpty() ? null : UnitId.module(first);
  }

  /**
   * @return id of the called routine, or null if it isn't loaded
   */
  private static UnitId kernelId(CallStatement call, PassContext context) {
    Symbol sym = context.resolution().symbol(call);
    if (sym == null || sym.kind() != SymbolKind.PROCEDURE ||
        sym.isIntrinsic()) {
      return null;
    }
    UnitId id = sym.unitId();
    if (id == null) {
      id = UnitId.external(call.name());
    }
    return context.program().unit(id) == null ? null : id;
  }

  private static boolean followedByCall(Node node, Node parent,
                                        String name) {
    if (parent == null) {
      return false;
    }
    for (List<Node> group: parent.groups()) {
      for (int i = 0; i < group.size(); i++) {
        if (group.get(i) == node) {
          if (i + 1 >= group.size()) {
            return false;
          }
          Node next = group.get(i + 1);
          return next.kind() == NodeKind.CALL &&
                 ((CallStatement)next).name().equalsIgnoreCase(name);
        }
      }
    }
    return false;
  }

  /**
   * Add clone names to USE statements with an ONLY list for the module
   * that holds the original
   */
  private static Routine extendOnlyLists(Routine routine,
                                         Map<String, Set<String>> imports) {
    if (imports.isEmpty()) {
      return routine;
    }
    List<Node> spec = new ArrayList<Node>();
    boolean changed = false;
    for (Node n: routine.spec()) {
      if (n instanceof Import) {
        Import imp = (Import)n;
        Set<String> needed = imports.get(imp.module().toLowerCase());
        if (imp.isOnly() && needed != null) {
          List<String> symbols = new ArrayList<String>(imp.symbols());
          for (String clone: needed) {
            if (!lists(symbols, clone)) {
              symbols.add(clone);
            }
          }
          if (symbols.size() != imp.symbols().size()) {
            n = new Import(null, imp.module(), true, symbols);
            changed = true;
          }
        }
      }
      spec.add(n);
    }
    return changed ? routine.withSpec(spec) : routine;
  }

  private static boolean lists(List<String> symbols, String name) {
    for (String s: symbols) {
      if (Import.localName(s).equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }
}
