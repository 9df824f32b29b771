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
 * Closed set of IR node variants
 */
public enum NodeKind {
  FILE(Category.UNIT),
  MODULE(Category.UNIT),
  ROUTINE(Category.UNIT),

  IMPORT(Category.STATEMENT),
  DECLARATION(Category.STATEMENT),
  ASSIGNMENT(Category.STATEMENT),
  LOOP(Category.STATEMENT),
  WHILE_LOOP(Category.STATEMENT),
  CONDITIONAL(Category.STATEMENT),
  CALL(Category.STATEMENT),
  BLOCK(Category.STATEMENT),
  INTRINSIC(Category.STATEMENT),
  COMMENT(Category.STATEMENT),
  PRAGMA(Category.STATEMENT),

  /** One declared name inside a declaration */
  ENTITY(Category.EXPRESSION),
  BINARY(Category.EXPRESSION),
  UNARY(Category.EXPRESSION),
  LITERAL(Category.EXPRESSION),
  VARIABLE(Category.EXPRESSION),
  ARRAY_REF(Category.EXPRESSION),
  RANGE(Category.EXPRESSION),
  PAREN(Category.EXPRESSION),
  KEYWORD_ARG(Category.EXPRESSION);

  public static enum Category {
    UNIT,
    STATEMENT,
    EXPRESSION,
  }

  private final Category category;

  private NodeKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public boolean isExpression() {
    return category == Category.EXPRESSION;
  }

  /**
   * @return true if nodes of this kind carry source spans
   */
  public boolean hasSpan() {
    return category != Category.EXPRESSION;
  }

  /**
   * @return true if nodes of this kind open a new scope
   */
  public boolean isScoping() {
    return this == FILE || this == MODULE || this == ROUTINE || this == BLOCK;
  }

  /**
   * @return true if nodes of this kind contain nested statement lists
   */
  public boolean isConstruct() {
    return this == LOOP || this == WHILE_LOOP || this == CONDITIONAL
        || this == BLOCK;
  }
}
