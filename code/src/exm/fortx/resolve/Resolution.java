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
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeIndex;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.UnitId;

/**
 * Resolver side tables for one source unit: the scope opened by each
 * file, module, routine and block node, and the symbol each variable,
 * array or function reference and call statement refers to.  Tables are
 * keyed by node identity.  A published resolution is not modified;
 * re-resolving a routine publishes an updated copy.
 */
public class Resolution {
  private final Scope fileScope;
  private final Map<UnitId, Scope> unitScopes;
  private final Map<Node, Scope> scopes;
  private final Map<Node, Symbol> symbols;
  private final List<ResolutionWarning> warnings;

  Resolution(Scope fileScope) {
    this.fileScope = fileScope;
    this.unitScopes = new HashMap<UnitId, Scope>();
    this.scopes = new IdentityHashMap<Node, Scope>();
    this.symbols = new IdentityHashMap<Node, Symbol>();
    this.warnings = new ArrayList<ResolutionWarning>();
  }

  private Resolution(Resolution other) {
    this.fileScope = other.fileScope;
    this.unitScopes = new HashMap<UnitId, Scope>(other.unitScopes);
    this.scopes = new IdentityHashMap<Node, Scope>(other.scopes);
    this.symbols = new IdentityHashMap<Node, Symbol>(other.symbols);
    this.warnings = new ArrayList<ResolutionWarning>(other.warnings);
  }

  Resolution copy() {
    return new Resolution(this);
  }

  void addScope(Node node, Scope scope) {
    scopes.put(node, scope);
  }

  void addUnitScope(UnitId id, Scope scope) {
    unitScopes.put(id, scope);
  }

  void addSymbol(Node ref, Symbol symbol) {
    symbols.put(ref, symbol);
  }

  void addWarning(ResolutionWarning warning) {
    warnings.add(warning);
  }

  /**
   * Drop entries for every node in a subtree, and warnings recorded
   * for the unit or units contained in it
   */
  void removeSubtree(Node root, UnitId id) {
    Deque<Node> stack = new ArrayDeque<Node>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      scopes.remove(n);
      symbols.remove(n);
      for (Node c: n.children()) {
        stack.push(c);
      }
    }
    String prefix = id.toString() + UnitId.SEPARATOR;
    Iterator<Map.Entry<UnitId, Scope>> it = unitScopes.entrySet().iterator();
    while (it.hasNext()) {
      UnitId u = it.next().getKey();
      if (u.equals(id) || u.toString().startsWith(prefix)) {
        it.remove();
      }
    }
    Iterator<ResolutionWarning> wit = warnings.iterator();
    while (wit.hasNext()) {
      UnitId u = wit.next().unit();
      if (u != null && (u.equals(id) || u.toString().startsWith(prefix))) {
        wit.remove();
      }
    }
  }

  public Scope fileScope() {
    return fileScope;
  }

  /**
   * @return scope of a module or routine, or null if unknown
   */
  public Scope unitScope(UnitId id) {
    return unitScopes.get(id);
  }

  /**
   * @param node a file, module, routine or block node
   * @return the scope it opens, or null
   */
  public Scope scope(Node node) {
    return scopes.get(node);
  }

  /**
   * @return innermost scope containing node, found through the index
   */
  public Scope enclosingScope(Node node, NodeIndex index) {
    if (node.kind().isScoping() && scopes.containsKey(node)) {
      return scopes.get(node);
    }
    for (Node a: index.ancestors(node)) {
      Scope s = scopes.get(a);
      if (s != null) {
        return s;
      }
    }
    return fileScope;
  }

  /**
   * @param ref variable reference, array reference or call statement
   * @return resolved symbol, possibly UNRESOLVED, or null if the node
   *         wasn't resolved
   */
  public Symbol symbol(Node ref) {
    return symbols.get(ref);
  }

  /**
   * @return true if node is an array reference naming a procedure
   */
  public boolean isFunctionReference(Node node) {
    if (node.kind() != NodeKind.ARRAY_REF) {
      return false;
    }
    Symbol s = symbols.get(node);
    return s != null && s.kind() == SymbolKind.PROCEDURE;
  }

  public List<ResolutionWarning> warnings() {
    return Collections.unmodifiableList(warnings);
  }
}
