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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Expression nodes.  Expressions never carry source spans: they are
 * regenerated with the statement that contains them.
 */
public class Expressions {

  public static class BinaryOp extends Node {
    private final String op;
    private final List<Node> left;
    private final List<Node> right;

    /**
     * @param op symbolic operator, e.g. "+", "==" or ".and."
     */
    public BinaryOp(String op, Node left, Node right) {
      this(op, opt(left), opt(right));
    }

    private BinaryOp(String op, List<Node> left, List<Node> right) {
      super(null);
      this.op = op.toLowerCase();
      this.left = list(left);
      this.right = list(right);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BINARY;
    }

    public String op() {
      return op;
    }

    public Node left() {
      return first(left);
    }

    public Node right() {
      return first(right);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(left, right);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return op;
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new BinaryOp(op, groups.get(0), groups.get(1));
    }
  }

  public static class UnaryOp extends Node {
    private final String op;
    private final List<Node> operand;

    public UnaryOp(String op, Node operand) {
      this(op, opt(operand));
    }

    private UnaryOp(String op, List<Node> operand) {
      super(null);
      this.op = op.toLowerCase();
      this.operand = list(operand);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNARY;
    }

    public String op() {
      return op;
    }

    public Node operand() {
      return first(operand);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(operand);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return op;
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new UnaryOp(op, groups.get(0));
    }
  }

  public static enum LiteralKind {
    INTEGER,
    REAL,
    LOGICAL,
    STRING,
    /** Assumed size or length: * */
    ASSUMED,
  }

  public static class Literal extends Node {
    private final LiteralKind literalKind;
    private final String text;

    public Literal(LiteralKind literalKind, String text) {
      super(null);
      this.literalKind = literalKind;
      if (literalKind == LiteralKind.STRING) {
        this.text = text;
      } else {
        this.text = text.toLowerCase();
      }
    }

    public static Literal integer(long value) {
      return new Literal(LiteralKind.INTEGER, String.valueOf(value));
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LITERAL;
    }

    public LiteralKind literalKind() {
      return literalKind;
    }

    /** @return text as written, lower case except for strings */
    public String text() {
      return text;
    }

    @Override
    public List<List<Node>> groups() {
      return ImmutableList.of();
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return literalKind.toString().toLowerCase() + " " + text;
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Literal(literalKind, text);
    }
  }

  public static class VariableRef extends Node {
    private final String name;

    public VariableRef(String name) {
      super(null);
      this.name = name;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARIABLE;
    }

    public String name() {
      return name;
    }

    @Override
    public List<List<Node>> groups() {
      return ImmutableList.of();
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return name.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new VariableRef(name);
    }
  }

  /**
   * name(args): an array element or section, or a function reference.
   * The two are written the same; the resolver tells them apart.
   */
  public static class ArrayRef extends Node {
    private final String name;
    private final List<Node> args;

    public ArrayRef(String name, List<? extends Node> args) {
      super(null);
      this.name = name;
      this.args = list(args);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ARRAY_REF;
    }

    public String name() {
      return name;
    }

    public List<Node> args() {
      return args;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(args);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      return name.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new ArrayRef(name, groups.get(0));
    }
  }

  /**
   * Section subscript lower:upper:step, any part may be absent
   */
  public static class RangeIndex extends Node {
    private final List<Node> lower;
    private final List<Node> upper;
    private final List<Node> step;

    public RangeIndex(Node lower, Node upper, Node step) {
      this(opt(lower), opt(upper), opt(step));
    }

    private RangeIndex(List<Node> lower, List<Node> upper, List<Node> step) {
      super(null);
      this.lower = list(lower);
      this.upper = list(upper);
      this.step = list(step);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.RANGE;
    }

    public Node lower() {
      return first(lower);
    }

    public Node upper() {
      return first(upper);
    }

    public Node step() {
      return first(step);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(lower, upper, step);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new RangeIndex(groups.get(0), groups.get(1), groups.get(2));
    }
  }

  public static class Parenthesis extends Node {
    private final List<Node> inner;

    public Parenthesis(Node inner) {
      this(opt(inner));
    }

    private Parenthesis(List<Node> inner) {
      super(null);
      this.inner = list(inner);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PAREN;
    }

    public Node inner() {
      return first(inner);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(inner);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Parenthesis(groups.get(0));
    }
  }

  /**
   * keyword = value in an argument list
   */
  public static class KeywordArg extends Node {
    private final String keyword;
    private final List<Node> value;

    public KeywordArg(String keyword, Node value) {
      this(keyword, opt(value));
    }

    private KeywordArg(String keyword, List<Node> value) {
      super(null);
      this.keyword = keyword;
      this.value = list(value);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.KEYWORD_ARG;
    }

    public String keyword() {
      return keyword;
    }

    public Node value() {
      return first(value);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(value);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return keyword.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new KeywordArg(keyword, groups.get(0));
    }
  }
}
