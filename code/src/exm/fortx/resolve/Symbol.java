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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.fortx.ir.Intent;
import exm.fortx.ir.Node;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.UnitId;

/**
 * Resolved identity of a name.  Symbols are never modified: resolving
 * again after a change builds new ones.
 */
public class Symbol {
  private final String name;
  private final SymbolKind kind;
  /** Null if not declared or not known */
  private final TypeSpec type;
  private final List<Node> shape;
  private final Intent intent;
  private final Set<String> attributes;
  /** Declaration or routine node, null for implicit or unknown symbols */
  private final Node declaration;
  private final Scope scope;
  /** For procedures defined in loaded source, the routine's id */
  private final UnitId unitId;

  public Symbol(String name, SymbolKind kind, TypeSpec type,
                List<Node> shape, Intent intent, Set<String> attributes,
                Node declaration, Scope scope, UnitId unitId) {
    this.name = name.toLowerCase();
    this.kind = kind;
    this.type = type;
    this.shape = shape == null ? Collections.<Node>emptyList()
                               : ImmutableList.copyOf(shape);
    this.intent = intent == null ? Intent.NONE : intent;
    this.attributes = attributes == null ? Collections.<String>emptySet()
                                         : ImmutableSet.copyOf(attributes);
    this.declaration = declaration;
    this.scope = scope;
    this.unitId = unitId;
  }

  public static Symbol procedure(String name, Node routine, Scope scope,
                                 UnitId unitId) {
    return new Symbol(name, SymbolKind.PROCEDURE, null, null, null, null,
                      routine, scope, unitId);
  }

  public static Symbol intrinsicProcedure(String name) {
    return new Symbol(name, SymbolKind.PROCEDURE, null, null, null,
                      ImmutableSet.of("intrinsic"), null, null, null);
  }

  public static Symbol imported(String name, Scope scope, String module) {
    return new Symbol(name, SymbolKind.IMPORTED, null, null, null,
                      ImmutableSet.of("use:" + module.toLowerCase()), null,
                      scope, null);
  }

  public static Symbol unresolved(String name, Scope scope) {
    return new Symbol(name, SymbolKind.UNRESOLVED, null, null, null, null,
                      null, scope, null);
  }

  public String name() {
    return name;
  }

  public SymbolKind kind() {
    return kind;
  }

  public TypeSpec type() {
    return type;
  }

  public List<Node> shape() {
    return shape;
  }

  public boolean isArray() {
    return !shape.isEmpty();
  }

  public Intent intent() {
    return intent;
  }

  public Set<String> attributes() {
    return attributes;
  }

  public boolean hasAttribute(String attr) {
    return attributes.contains(attr.toLowerCase());
  }

  public Node declaration() {
    return declaration;
  }

  /** @return declaring scope, null for intrinsic procedures */
  public Scope scope() {
    return scope;
  }

  public UnitId unitId() {
    return unitId;
  }

  public boolean isResolved() {
    return kind != SymbolKind.UNRESOLVED;
  }

  public boolean isIntrinsic() {
    return kind == SymbolKind.PROCEDURE && declaration == null &&
           hasAttribute("intrinsic");
  }

  /**
   * @return copy with a different kind, e.g. a dummy once its
   *         declaration is seen
   */
  Symbol withKind(SymbolKind newKind) {
    return new Symbol(name, newKind, type, shape, intent, attributes,
                      declaration, scope, unitId);
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + " " + name +
           (scope != null ? " in " + scope.name() : "");
  }
}
