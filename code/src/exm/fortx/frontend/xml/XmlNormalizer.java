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
package exm.fortx.frontend.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Normalization;
import exm.fortx.frontend.Normalization.Placed;
import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Expressions.BinaryOp;
import exm.fortx.ir.Expressions.KeywordArg;
import exm.fortx.ir.Expressions.Literal;
import exm.fortx.ir.Expressions.LiteralKind;
import exm.fortx.ir.Expressions.Parenthesis;
import exm.fortx.ir.Expressions.RangeIndex;
import exm.fortx.ir.Expressions.UnaryOp;
import exm.fortx.ir.Expressions.VariableRef;
import exm.fortx.ir.Intent;
import exm.fortx.ir.LineTable;
import exm.fortx.ir.Node;
import exm.fortx.ir.SourceSpan;
import exm.fortx.ir.Statements;
import exm.fortx.ir.Statements.Assignment;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Statements.WhileLoop;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.RoutineKind;

/**
 * Maps the XML tree written by an external parser to IR.
 *
 * The format follows the Open Fortran Parser's XML output.  Program
 * units, statements and comments carry line_begin/line_end attributes;
 * {@code <statement>} elements only wrap other statements and are
 * flattened.  Elements:
 * <pre>
 *   file        module* subroutine* function* comment*
 *   module      name; header? body members?
 *   subroutine  name; header body members?
 *   function    name; header body members?
 *   header      prefix* type? arguments? result?   (line_end = last line)
 *   members     line_begin = line of CONTAINS
 *   use         name, only; symbol(name)* rename(local, remote)*
 *   declaration type intent? attribute* dimensions? variables
 *   type        name, derived; kind? length?
 *   variable    name; dimensions? initial-value?
 *   assignment  pointer; target value
 *   call        name; expressions
 *   if          inline, else-if; condition then else?
 *   loop        type = do | do-while | do-endless; variable
 *   block       body
 *   intrinsic   text
 *   comment     text
 * </pre>
 * Expressions are literal(type, value), name(id) with optional
 * subscripts, operation(type = unary | binary, operator) with operand
 * children, parenthesized, range(lower?, upper?, step?), argument(name)
 * and assumed.
 */
public class XmlNormalizer {
  private final String path;
  private final LineTable lines;

  public XmlNormalizer(String path, String text) {
    this.path = path;
    this.lines = new LineTable(text);
  }

  public FileNode normalize(Element root) throws ParseException {
    Element file = root;
    if (!file.getTagName().equals("file")) {
      file = child(root, "file");
    }
    List<Placed> units = new ArrayList<Placed>();
    int prev = 0;
    for (Element e: elements(file)) {
      Placed p = placed(programUnit(e), e, prev);
      units.add(p);
      prev = p.endLine;
    }
    int last = lines.lineCount();
    return new FileNode(lines.span(1, last),
                        Normalization.arrange(units, 0, last + 1));
  }

  private Node programUnit(Element e) throws ParseException {
    switch (e.getTagName()) {
      case "comment":
        return comment(e);
      case "module":
        return module(e);
      case "subroutine":
      case "function":
        return routine(e);
      default:
        throw unexpected(e);
    }
  }

  private Module module(Element e) throws ParseException {
    Element members = optChild(e, "members");
    int close = members != null ? lineBegin(members) : lineEnd(e);
    List<Node> spec = statements(optChild(e, "body"), headerEnd(e), close);
    return new Module(span(e), requiredAttr(e, "name"), spec,
                      members(members, lineEnd(e)));
  }

  private Node routine(Element e) throws ParseException {
    boolean function = e.getTagName().equals("function");
    Element header = optChild(e, "header");
    List<String> prefixes = new ArrayList<String>();
    List<String> dummies = new ArrayList<String>();
    String resultName = null;
    TypeSpec resultType = null;
    if (header != null) {
      for (Element h: elements(header)) {
        switch (h.getTagName()) {
          case "prefix":
            prefixes.add(requiredAttr(h, "name"));
            break;
          case "type":
            resultType = typeSpec(h);
            break;
          case "arguments":
            for (Element a: elements(h)) {
              dummies.add(requiredAttr(a, "name"));
            }
            break;
          case "result":
            resultName = requiredAttr(h, "name");
            break;
          default:
            throw unexpected(h);
        }
      }
    }
    Element members = optChild(e, "members");
    int close = members != null ? lineBegin(members) : lineEnd(e);
    List<Node> stmts = statements(optChild(e, "body"), headerEnd(e), close);
    return Normalization.routine(span(e),
        function ? RoutineKind.FUNCTION : RoutineKind.SUBROUTINE,
        requiredAttr(e, "name"), prefixes, dummies, resultName, resultType,
        stmts, members(members, lineEnd(e)));
  }

  private List<Node> members(Element members, int end)
                                                  throws ParseException {
    if (members == null) {
      return Collections.emptyList();
    }
    List<Placed> placed = new ArrayList<Placed>();
    int prev = lineBegin(members);
    for (Element m: elements(members)) {
      Placed p = placed(programUnit(m), m, prev);
      placed.add(p);
      prev = p.endLine;
    }
    return Normalization.arrange(placed, lineBegin(members), end);
  }

  /**
   * @param list element holding statements, or null for none
   * @param openLine last line of the enclosing header
   * @param closeLine first line after the list
   */
  private List<Node> statements(Element list, int openLine, int closeLine)
                                                  throws ParseException {
    List<Placed> placed = new ArrayList<Placed>();
    if (list != null) {
      addStatements(placed, list, openLine);
    }
    return Normalization.arrange(placed, openLine, closeLine);
  }

  private int addStatements(List<Placed> placed, Element list, int prev)
                                                  throws ParseException {
    for (Element e: elements(list)) {
      if (e.getTagName().equals("statement") ||
          e.getTagName().equals("specification")) {
        prev = addStatements(placed, e, prev);
      } else {
        Placed p = placed(statement(e), e, prev);
        placed.add(p);
        prev = p.endLine;
      }
    }
    return prev;
  }

  private Node statement(Element e) throws ParseException {
    SourceSpan span = span(e);
    switch (e.getTagName()) {
      case "comment":
        return comment(e);
      case "use":
        return use(e, span);
      case "declaration":
        return declaration(e, span);
      case "assignment":
        return new Assignment(span,
            Boolean.parseBoolean(e.getAttribute("pointer")),
            expr(single(child(e, "target"))), expr(single(child(e, "value"))));
      case "call":
        return new CallStatement(span, requiredAttr(e, "name"), exprs(e));
      case "if":
        return conditional(e, span);
      case "loop":
        return loop(e, span);
      case "block":
        return Normalization.block(span,
            statements(optChild(e, "body"), headerEnd(e), lineEnd(e)));
      case "intrinsic":
        return new Intrinsic(span,
            Normalization.statementText(requiredAttr(e, "text")));
      default:
        throw unexpected(e);
    }
  }

  private Node comment(Element e) throws ParseException {
    return Statements.commentOrPragma(span(e), requiredAttr(e, "text"));
  }

  private Import use(Element e, SourceSpan span) throws ParseException {
    List<String> symbols = new ArrayList<String>();
    for (Element s: elements(e)) {
      if (s.getTagName().equals("rename")) {
        symbols.add(requiredAttr(s, "local") + "=>" +
                    requiredAttr(s, "remote"));
      } else if (s.getTagName().equals("symbol")) {
        symbols.add(requiredAttr(s, "name"));
      } else {
        throw unexpected(s);
      }
    }
    return new Import(span, requiredAttr(e, "name"),
                      Boolean.parseBoolean(e.getAttribute("only")), symbols);
  }

  private Declaration declaration(Element e, SourceSpan span)
                                                throws ParseException {
    TypeSpec type = null;
    Intent intent = Intent.NONE;
    List<String> attributes = new ArrayList<String>();
    List<Node> dimensions = Collections.emptyList();
    List<Node> entities = new ArrayList<Node>();
    for (Element c: elements(e)) {
      switch (c.getTagName()) {
        case "type":
          type = typeSpec(c);
          break;
        case "intent":
          try {
            intent = Intent.fromString(requiredAttr(c, "type"));
          } catch (IllegalArgumentException ex) {
            throw error(c, ex.getMessage());
          }
          break;
        case "attribute":
          attributes.add(requiredAttr(c, "name"));
          break;
        case "dimensions":
          dimensions = exprs(c);
          break;
        case "variables":
          for (Element v: elements(c)) {
            Element shape = optChild(v, "dimensions");
            Element init = optChild(v, "initial-value");
            entities.add(new Entity(requiredAttr(v, "name"),
                shape != null ? exprs(shape)
                              : Collections.<Node>emptyList(),
                init != null ? expr(single(init)) : null));
          }
          break;
        default:
          throw unexpected(c);
      }
    }
    if (type == null) {
      throw error(e, "declaration without type");
    }
    return new Declaration(span, type, intent, attributes, dimensions,
                           entities);
  }

  private TypeSpec typeSpec(Element e) throws ParseException {
    String name = requiredAttr(e, "name");
    if (Boolean.parseBoolean(e.getAttribute("derived"))) {
      return TypeSpec.derived(name);
    }
    Element kind = optChild(e, "kind");
    Element length = optChild(e, "length");
    return Normalization.typeSpec(name,
        kind != null ? expr(single(kind)) : null,
        length != null ? expr(single(length)) : null,
        Collections.<Node>emptyList());
  }

  private Conditional conditional(Element e, SourceSpan span)
                                                throws ParseException {
    boolean inline = Boolean.parseBoolean(e.getAttribute("inline"));
    boolean elseIf = Boolean.parseBoolean(e.getAttribute("else-if"));
    Node condition = expr(single(child(e, "condition")));
    Element thenList = child(e, "then");
    Element elseList = optChild(e, "else");

    if (inline) {
      List<Element> action = elements(thenList);
      if (action.size() != 1) {
        throw error(e, "inline if needs exactly one action statement");
      }
      return new Conditional(span, true, false, condition,
          Collections.singletonList(statement(action.get(0)).withSpan(null)),
          Collections.<Node>emptyList());
    }

    int end = lineEnd(e);
    int thenEnd = elseList != null ? lineBegin(elseList) : end;
    List<Node> thenBody = statements(thenList, headerEnd(e),
                                                  thenEnd);
    List<Node> elseBody = Collections.emptyList();
    if (elseList != null) {
      List<Element> elseElems = elements(elseList);
      if (elseElems.size() == 1 && elseElems.get(0).getTagName().equals("if")
          && Boolean.parseBoolean(elseElems.get(0).getAttribute("else-if"))) {
        elseBody = Collections.<Node>singletonList(
                            conditional(elseElems.get(0), null));
      } else {
        elseBody = statements(elseList, headerEnd(elseList), end);
      }
    }
    return new Conditional(span, false, elseIf, condition, thenBody,
                           elseBody);
  }

  private Node loop(Element e, SourceSpan span)
                                              throws ParseException {
    String type = e.getAttribute("type");
    List<Node> body = statements(optChild(e, "body"),
                                              headerEnd(e), lineEnd(e));
    switch (type) {
      case "do": {
        Element step = optChild(e, "step");
        return new Loop(span, requiredAttr(e, "variable"),
            expr(single(child(e, "lower"))), expr(single(child(e, "upper"))),
            step != null ? expr(single(step)) : null, body);
      }
      case "do-while":
        return new WhileLoop(span, expr(single(child(e, "condition"))), body);
      case "do-endless":
        return new WhileLoop(span, null, body);
      default:
        throw error(e, "unknown loop type '" + type + "'");
    }
  }

  /*
   * Expressions
   */

  private List<Node> exprs(Element parent)
                                            throws ParseException {
    List<Node> result = new ArrayList<Node>();
    for (Element e: elements(parent)) {
      result.add(expr(e));
    }
    return result;
  }

  private Node expr(Element e) throws ParseException {
    switch (e.getTagName()) {
      case "literal":
        return literal(e);
      case "assumed":
        return new Literal(LiteralKind.ASSUMED,
            e.hasAttribute("value") ? e.getAttribute("value") : "*");
      case "name": {
        Element subscripts = optChild(e, "subscripts");
        if (subscripts == null) {
          return new VariableRef(requiredAttr(e, "id"));
        }
        return new ArrayRef(requiredAttr(e, "id"), exprs(subscripts));
      }
      case "parenthesized":
        return new Parenthesis(expr(single(e)));
      case "argument":
        return new KeywordArg(requiredAttr(e, "name"), expr(single(e)));
      case "range": {
        Element lower = optChild(e, "lower");
        Element upper = optChild(e, "upper");
        Element step = optChild(e, "step");
        return new RangeIndex(lower != null ? expr(single(lower)) : null,
                              upper != null ? expr(single(upper)) : null,
                              step != null ? expr(single(step)) : null);
      }
      case "operation":
        return operation(e);
      default:
        throw unexpected(e);
    }
  }

  private Node operation(Element e) throws ParseException {
    String op = Normalization.operator(requiredAttr(e, "operator"));
    List<Element> operands = elements(e);
    switch (e.getAttribute("type")) {
      case "unary":
        if (operands.size() != 1) {
          throw error(e, "unary operation needs one operand");
        }
        return new UnaryOp(op, expr(single(operands.get(0))));
      case "binary":
        if (operands.size() != 2) {
          throw error(e, "binary operation needs two operands");
        }
        return new BinaryOp(op, expr(single(operands.get(0))),
                            expr(single(operands.get(1))));
      default:
        throw error(e, "unknown operation type '" + e.getAttribute("type")
                       + "'");
    }
  }

  private Node literal(Element e) throws ParseException {
    String value = requiredAttr(e, "value");
    switch (e.getAttribute("type")) {
      case "integer":
        return new Literal(LiteralKind.INTEGER, value);
      case "real":
        return new Literal(LiteralKind.REAL, value);
      case "logical":
        return new Literal(LiteralKind.LOGICAL, value);
      case "string":
        return new Literal(LiteralKind.STRING, value);
      default:
        throw error(e, "unknown literal type '" + e.getAttribute("type")
                       + "'");
    }
  }

  /*
   * DOM helpers
   */

  static List<Element> elements(Element parent) {
    List<Element> result = new ArrayList<Element>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      org.w3c.dom.Node n = nodes.item(i);
      if (n.getNodeType() == org.w3c.dom.Node.ELEMENT_NODE) {
        result.add((Element)n);
      }
    }
    return result;
  }

  private static Element optChild(Element parent, String tag) {
    for (Element e: elements(parent)) {
      if (e.getTagName().equals(tag)) {
        return e;
      }
    }
    return null;
  }

  private Element child(Element parent, String tag) throws ParseException {
    Element e = optChild(parent, tag);
    if (e == null) {
      throw error(parent, "missing <" + tag + ">");
    }
    return e;
  }

  /**
   * @return the only child element of a wrapper
   */
  private Element single(Element wrapper) throws ParseException {
    List<Element> children = elements(wrapper);
    if (children.size() != 1) {
      throw error(wrapper, "expected one expression in <" +
                  wrapper.getTagName() + ">, got " + children.size());
    }
    return children.get(0);
  }

  private String requiredAttr(Element e, String name) throws ParseException {
    if (!e.hasAttribute(name)) {
      throw error(e, "missing attribute " + name);
    }
    return e.getAttribute(name);
  }

  /*
   * Line bookkeeping
   */

  /**
   * @return line attribute, or 0 if absent
   */
  private static int lineAttr(Element e, String name) {
    if (!e.hasAttribute(name)) {
      return 0;
    }
    try {
      return Integer.parseInt(e.getAttribute(name).trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  private static int lineBegin(Element e) {
    return lineAttr(e, "line_begin");
  }

  private static int lineEnd(Element e) {
    int end = lineAttr(e, "line_end");
    return end > 0 ? end : lineBegin(e);
  }

  private static int headerEnd(Element e) {
    Element header = optChild(e, "header");
    if (header != null && lineEnd(header) > 0) {
      return lineEnd(header);
    }
    return lineBegin(e);
  }

  /**
   * Elements without lines keep their place after the previous sibling
   */
  private static Placed placed(Node node, Element e, int prev) {
    int begin = lineBegin(e);
    if (begin <= 0) {
      return new Placed(node, prev, prev);
    }
    return new Placed(node, begin, lineEnd(e));
  }

  private SourceSpan span(Element e) {
    int begin = lineBegin(e);
    int end = lineEnd(e);
    if (begin <= 0 || end > lines.lineCount()) {
      return null;
    }
    return lines.span(begin, end);
  }

  private ParseException error(Element e, String msg) {
    return new ParseException(path, lineBegin(e), 0,
                              "<" + e.getTagName() + ">: " + msg);
  }

  private ParseException unexpected(Element e) {
    return error(e, "unexpected element");
  }
}
