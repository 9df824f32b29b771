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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Statement nodes
 */
public class Statements {

  /**
   * Statements that belong in a specification part but aren't modelled
   * in detail, keyed by first keyword
   */
  private static final Set<String> SPEC_KEYWORDS = new HashSet<String>(
      Arrays.asList("implicit", "save", "data", "include", "common",
                    "public", "private", "parameter", "external",
                    "intrinsic", "namelist", "equivalence", "dimension",
                    "interface", "entry"));

  /**
   * USE statement
   */
  public static class Import extends Node {
    private final String module;
    private final boolean only;
    /** Names, with renames written as local=>remote */
    private final List<String> symbols;

    public Import(SourceSpan span, String module, boolean only,
                  List<String> symbols) {
      super(span);
      this.module = module;
      this.only = only;
      this.symbols = ImmutableList.copyOf(symbols);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IMPORT;
    }

    public String module() {
      return module;
    }

    public boolean isOnly() {
      return only;
    }

    public List<String> symbols() {
      return symbols;
    }

    /**
     * @param symbol entry from {@link #symbols()}
     * @return name visible in importing scope
     */
    public static String localName(String symbol) {
      int arrow = symbol.indexOf("=>");
      return arrow < 0 ? symbol.trim() : symbol.substring(0, arrow).trim();
    }

    /**
     * @param symbol entry from {@link #symbols()}
     * @return name in the imported module
     */
    public static String remoteName(String symbol) {
      int arrow = symbol.indexOf("=>");
      return arrow < 0 ? symbol.trim() : symbol.substring(arrow + 2).trim();
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
      return module.toLowerCase() + (only ? " only " : " ") +
          StringUtils.join(symbols, ",").toLowerCase().replace(" ", "");
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Import(span, module, only, symbols);
    }
  }

  /**
   * Type declaration statement, declaring one or more entities
   */
  public static class Declaration extends Node {
    private final TypeSpec type;
    private final Intent intent;
    /** Lower case attributes other than intent and dimension */
    private final List<String> attributes;
    /** Shape from a DIMENSION attribute */
    private final List<Node> dimensions;
    private final List<Node> entities;

    public Declaration(SourceSpan span, TypeSpec type, Intent intent,
                       List<String> attributes,
                       List<? extends Node> dimensions,
                       List<? extends Node> entities) {
      super(span);
      this.type = type;
      this.intent = intent;
      List<String> attrs = new ArrayList<String>();
      for (String a: attributes) {
        attrs.add(a.toLowerCase());
      }
      this.attributes = ImmutableList.copyOf(attrs);
      this.dimensions = list(dimensions);
      this.entities = list(entities);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DECLARATION;
    }

    public TypeSpec type() {
      return type;
    }

    public Intent intent() {
      return intent;
    }

    public List<String> attributes() {
      return attributes;
    }

    public boolean hasAttribute(String attr) {
      return attributes.contains(attr.toLowerCase());
    }

    public List<Node> dimensions() {
      return dimensions;
    }

    public List<Entity> entities() {
      List<Entity> result = new ArrayList<Entity>();
      for (Node n: entities) {
        result.add((Entity)n);
      }
      return result;
    }

    public List<String> entityNames() {
      List<String> result = new ArrayList<String>();
      for (Node n: entities) {
        result.add(((Entity)n).name());
      }
      return result;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(dimensions, entities);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      return type.label() + " intent=" + intent.keyword() + " " +
             StringUtils.join(attributes, ",");
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Declaration(span, type, intent, attributes,
                             groups.get(0), groups.get(1));
    }
  }

  /**
   * One entity in a declaration, e.g. a(n) = 0
   */
  public static class Entity extends Node {
    private final String name;
    private final List<Node> shape;
    private final List<Node> init;

    public Entity(String name, List<? extends Node> shape, Node init) {
      this(name, list(shape), opt(init));
    }

    private Entity(String name, List<Node> shape, List<Node> init) {
      super(null);
      this.name = name;
      this.shape = list(shape);
      this.init = list(init);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ENTITY;
    }

    public String name() {
      return name;
    }

    public List<Node> shape() {
      return shape;
    }

    /** @return initializer, or null */
    public Node init() {
      return first(init);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(shape, init);
    }

    @Override
    public boolean isListGroup(int group) {
      return group == 0;
    }

    @Override
    public String label() {
      return name.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Entity(name, groups.get(0), groups.get(1));
    }
  }

  public static class Assignment extends Node {
    private final boolean pointer;
    private final List<Node> target;
    private final List<Node> value;

    public Assignment(SourceSpan span, boolean pointer, Node target,
                      Node value) {
      this(span, pointer, opt(target), opt(value));
    }

    private Assignment(SourceSpan span, boolean pointer, List<Node> target,
                      List<Node> value) {
      super(span);
      this.pointer = pointer;
      this.target = list(target);
      this.value = list(value);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGNMENT;
    }

    /** @return true for pointer assignment (=&gt;) */
    public boolean isPointer() {
      return pointer;
    }

    public Node target() {
      return first(target);
    }

    public Node value() {
      return first(value);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(target, value);
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    @Override
    public String label() {
      return pointer ? "=>" : "=";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Assignment(span, pointer, groups.get(0), groups.get(1));
    }
  }

  /**
   * Counted DO loop
   */
  public static class Loop extends Node {
    public static final int BODY = 3;

    private final String variable;
    private final List<Node> lower;
    private final List<Node> upper;
    private final List<Node> step;
    private final List<Node> body;

    public Loop(SourceSpan span, String variable, Node lower, Node upper,
                Node step, List<? extends Node> body) {
      this(span, variable, opt(lower), opt(upper), opt(step), list(body));
    }

    private Loop(SourceSpan span, String variable, List<Node> lower,
                 List<Node> upper, List<Node> step, List<Node> body) {
      super(span);
      this.variable = variable;
      this.lower = list(lower);
      this.upper = list(upper);
      this.step = list(step);
      this.body = list(body);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LOOP;
    }

    public String variable() {
      return variable;
    }

    public Node lower() {
      return first(lower);
    }

    public Node upper() {
      return first(upper);
    }

    /** @return step, or null if not given */
    public Node step() {
      return first(step);
    }

    public List<Node> body() {
      return body;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(lower, upper, step, body);
    }

    @Override
    public boolean isListGroup(int group) {
      return group == BODY;
    }

    @Override
    public String label() {
      return variable.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Loop(span, variable, groups.get(0), groups.get(1),
                      groups.get(2), groups.get(3));
    }
  }

  /**
   * DO WHILE loop, or endless DO loop if there is no condition
   */
  public static class WhileLoop extends Node {
    private final List<Node> condition;
    private final List<Node> body;

    public WhileLoop(SourceSpan span, Node condition,
                     List<? extends Node> body) {
      this(span, opt(condition), list(body));
    }

    private WhileLoop(SourceSpan span, List<Node> condition, List<Node> body) {
      super(span);
      this.condition = list(condition);
      this.body = list(body);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.WHILE_LOOP;
    }

    /** @return loop condition, or null for an endless loop */
    public Node condition() {
      return first(condition);
    }

    public List<Node> body() {
      return body;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(condition, body);
    }

    @Override
    public boolean isListGroup(int group) {
      return group == 1;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new WhileLoop(span, groups.get(0), groups.get(1));
    }
  }

  /**
   * IF construct or logical IF statement.  ELSE IF branches are nested
   * conditionals, alone in the else branch of the previous one.
   */
  public static class Conditional extends Node {
    private final boolean inline;
    private final boolean elseIf;
    private final List<Node> condition;
    private final List<Node> thenBody;
    private final List<Node> elseBody;

    public Conditional(SourceSpan span, boolean inline, boolean elseIf,
                       Node condition, List<? extends Node> thenBody,
                       List<? extends Node> elseBody) {
      this(span, inline, elseIf, opt(condition), list(thenBody),
           list(elseBody));
    }

    private Conditional(SourceSpan span, boolean inline, boolean elseIf,
                       List<Node> condition, List<Node> thenBody,
                       List<Node> elseBody) {
      super(span);
      this.inline = inline;
      this.elseIf = elseIf;
      this.condition = list(condition);
      this.thenBody = list(thenBody);
      this.elseBody = list(elseBody);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONDITIONAL;
    }

    /** @return true if written as a one-line logical IF */
    public boolean isInline() {
      return inline;
    }

    /** @return true if this is the ELSE IF branch of an enclosing IF */
    public boolean isElseIf() {
      return elseIf;
    }

    public Node condition() {
      return first(condition);
    }

    public List<Node> thenBody() {
      return thenBody;
    }

    public List<Node> elseBody() {
      return elseBody;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(condition, thenBody, elseBody);
    }

    @Override
    public boolean isListGroup(int group) {
      return group > 0;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Conditional(span, inline, elseIf, groups.get(0),
                             groups.get(1), groups.get(2));
    }
  }

  public static class CallStatement extends Node {
    private final String name;
    private final List<Node> args;

    public CallStatement(SourceSpan span, String name,
                         List<? extends Node> args) {
      super(span);
      this.name = name;
      this.args = list(args);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CALL;
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
      return new CallStatement(span, name, groups.get(0));
    }
  }

  /**
   * BLOCK construct with its own specification part
   */
  public static class BlockConstruct extends Node {
    private final List<Node> spec;
    private final List<Node> body;

    public BlockConstruct(SourceSpan span, List<? extends Node> spec,
                          List<? extends Node> body) {
      super(span);
      this.spec = list(spec);
      this.body = list(body);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BLOCK;
    }

    public List<Node> spec() {
      return spec;
    }

    public List<Node> body() {
      return body;
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(spec, body);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new BlockConstruct(span, groups.get(0), groups.get(1));
    }
  }

  /**
   * Any other statement, kept as text
   */
  public static class Intrinsic extends Node {
    private final String text;

    public Intrinsic(SourceSpan span, String text) {
      super(span);
      this.text = text.trim().replaceAll("\\s+", " ");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.INTRINSIC;
    }

    public String text() {
      return text;
    }

    /** @return first word after any statement label, lower case */
    public String keyword() {
      int start = 0;
      while (start < text.length() && Character.isDigit(text.charAt(start))) {
        start++;
      }
      if (start > 0 && start < text.length() && text.charAt(start) == ' ') {
        start++;
      } else {
        start = 0;
      }
      int end = start;
      while (end < text.length() &&
             (Character.isLetterOrDigit(text.charAt(end)) ||
              text.charAt(end) == '_')) {
        end++;
      }
      return text.substring(start, end).toLowerCase();
    }

    public boolean isSpecification() {
      return SPEC_KEYWORDS.contains(keyword());
    }

    @Override
    public List<List<Node>> groups() {
      return ImmutableList.of();
    }

    @Override
    public boolean isListGroup(int group) {
      return false;
    }

    /**
     * Lower case text with whitespace outside character literals removed
     */
    @Override
    public String label() {
      StringBuilder sb = new StringBuilder();
      char quote = 0;
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (quote != 0) {
          sb.append(c);
          if (c == quote) {
            quote = 0;
          }
        } else if (c == '\'' || c == '"') {
          quote = c;
          sb.append(c);
        } else if (!Character.isWhitespace(c)) {
          sb.append(Character.toLowerCase(c));
        }
      }
      return sb.toString();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Intrinsic(span, text);
    }
  }

  public static class Comment extends Node {
    private final String text;

    public Comment(SourceSpan span, String text) {
      super(span);
      this.text = text.trim();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.COMMENT;
    }

    /** @return comment text including leading ! */
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
      return text;
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Comment(span, text);
    }
  }

  /**
   * Compiler directive written as a special comment, e.g. !$acc routine seq
   */
  public static class Pragma extends Node {
    private final String text;

    public Pragma(SourceSpan span, String text) {
      super(span);
      this.text = text.trim();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PRAGMA;
    }

    /** @return directive text including leading !$ */
    public String text() {
      return text;
    }

    /** @return directive family, e.g. "acc" or "omp", lower case */
    public String family() {
      String rest = content();
      int space = rest.indexOf(' ');
      return (space < 0 ? rest : rest.substring(0, space)).toLowerCase();
    }

    /**
     * @return text after the leading !$, with whitespace normalized
     */
    public String content() {
      String rest = text.startsWith("!$") ? text.substring(2) : text;
      return rest.trim().replaceAll("\\s+", " ");
    }

    /**
     * @param words e.g. "acc routine seq"
     * @return true if the directive starts with those words, ignoring case
     */
    public boolean startsWith(String words) {
      String c = content().toLowerCase();
      String w = words.toLowerCase().trim();
      return c.equals(w) || c.startsWith(w + " ");
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
      return content().toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Pragma(span, text);
    }
  }

  /**
   * @param text trimmed comment text, starting with !
   * @param span
   * @return a Pragma for directive comments, otherwise a Comment
   */
  public static Node commentOrPragma(SourceSpan span, String text) {
    String trimmed = text.trim();
    if (trimmed.startsWith("!$") && trimmed.length() > 2 &&
        Character.isLetter(trimmed.charAt(2))) {
      return new Pragma(span, trimmed);
    }
    return new Comment(span, trimmed);
  }
}
