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
package exm.fortx.ir;

/**
 * Declared type of an entity: base type name plus optional kind and
 * length selectors.
 */
public class TypeSpec {
  public static final String INTEGER = "integer";
  public static final String REAL = "real";
  public static final String LOGICAL = "logical";
  public static final String COMPLEX = "complex";
  public static final String CHARACTER = "character";
  public static final String DOUBLE_PRECISION = "double precision";
  public static final String DERIVED = "type";

  private final String base;
  private final String derivedName;
  private final Node kind;
  private final Node length;

  public TypeSpec(String base, String derivedName, Node kind, Node length) {
    this.base = base.toLowerCase().replaceAll("\\s+", " ");
    this.derivedName = derivedName;
    this.kind = kind;
    this.length = length;
  }

  public static TypeSpec intrinsic(String base) {
    return new TypeSpec(base, null, null, null);
  }

  public static TypeSpec derived(String name) {
    return new TypeSpec(DERIVED, name, null, null);
  }

  /** @return base type, lower case, e.g. "real" or "double precision" */
  public String base() {
    return base;
  }

  /** @return derived type name, or null for intrinsic types */
  public String derivedName() {
    return derivedName;
  }

  /** @return kind selector expression, or null */
  public Node kind() {
    return kind;
  }

  /** @return character length selector expression, or null */
  public Node length() {
    return length;
  }

  public boolean isDerived() {
    return derivedName != null;
  }

  public String label() {
    StringBuilder sb = new StringBuilder(base);
    if (derivedName != null) {
      sb.append("(").append(derivedName.toLowerCase()).append(")");
    }
    if (kind != null) {
      sb.append(" k=").append(Nodes.sexpr(kind));
    }
    if (length != null) {
      sb.append(" l=").append(Nodes.sexpr(length));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return label();
  }
}
