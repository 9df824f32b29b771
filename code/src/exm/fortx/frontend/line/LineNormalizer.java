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
package exm.fortx.frontend.line;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Normalization;
import exm.fortx.frontend.Normalization.Placed;
import exm.fortx.frontend.line.StatementParser.LoopControl;
import exm.fortx.ir.LineTable;
import exm.fortx.ir.Node;
import exm.fortx.ir.SourceSpan;
import exm.fortx.ir.Statements;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Statements.WhileLoop;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.RoutineKind;

/**
 * Maps the classified statement tree to IR.  Statements read from
 * included files get no span, since their text isn't in this file.
 */
public class LineNormalizer {

  private static final Pattern USE_PARTS = Pattern.compile(
      "use\\s*(?:,\\s*(?:non_)?intrinsic\\s*)?(?:::)?\\s*(\\w+)\\s*" +
      "(?:,\\s*(.*))?", Pattern.CASE_INSENSITIVE);
  private static final Pattern ONLY = Pattern.compile("only\\s*:(.*)",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern PREFIX = Pattern.compile(
      "\\b(pure|elemental|recursive|impure)\\b", Pattern.CASE_INSENSITIVE);

  private final String path;
  private final LineTable lines;

  public LineNormalizer(String path, String text) {
    this.path = path;
    this.lines = new LineTable(text);
  }

  public FileNode normalize(SyntaxNode program) throws ParseException {
    if (!program.is(SyntaxNode.PROGRAM)) {
      throw unexpected(program);
    }
    List<Placed> units = new ArrayList<Placed>();
    for (SyntaxNode n: program.children()) {
      units.add(placed(programUnit(n), n));
    }
    int last = lines.lineCount();
    return new FileNode(lines.span(1, last),
                        Normalization.arrange(units, 0, last + 1));
  }

  private Node programUnit(SyntaxNode n) throws ParseException {
    if (n.is(SyntaxNode.COMMENT)) {
      return comment(n);
    } else if (n.is(SyntaxNode.MODULE)) {
      return module(n);
    } else if (n.is(SyntaxNode.SUBROUTINE_SUBPROGRAM) ||
               n.is(SyntaxNode.FUNCTION_SUBPROGRAM)) {
      return routine(n);
    }
    throw unexpected(n);
  }

  /**
   * Body and members of a module or routine, split at CONTAINS
   */
  private static class UnitParts {
    final SyntaxNode header;
    final SyntaxNode end;
    final List<SyntaxNode> body = new ArrayList<SyntaxNode>();
    final List<SyntaxNode> members = new ArrayList<SyntaxNode>();
    SyntaxNode contains = null;

    UnitParts(SyntaxNode unit) {
      List<SyntaxNode> children = unit.children();
      header = unit.first();
      end = unit.last();
      for (SyntaxNode c: children.subList(1, children.size() - 1)) {
        if (contains == null && c.is(SyntaxNode.CONTAINS_STMT)) {
          contains = c;
        } else if (contains == null) {
          body.add(c);
        } else {
          members.add(c);
        }
      }
    }

    int bodyClose() {
      return contains != null ? contains.firstLine() : end.firstLine();
    }
  }

  private Module module(SyntaxNode n) throws ParseException {
    UnitParts parts = new UnitParts(n);
    Matcher m = StatementClassifier.MODULE.matcher(parts.header.text());
    if (!m.matches()) {
      throw unexpected(parts.header);
    }
    List<Node> spec = statements(parts.body, parts.header.lastLine(),
                                 parts.bodyClose());
    return new Module(span(n), m.group(1), spec, members(parts));
  }

  private Node routine(SyntaxNode n) throws ParseException {
    UnitParts parts = new UnitParts(n);
    SyntaxNode header = parts.header;
    boolean function = n.is(SyntaxNode.FUNCTION_SUBPROGRAM);

    String name;
    String prefixText;
    String dummyText;
    String resultName = null;
    if (function) {
      Matcher m = StatementClassifier.FUNCTION.matcher(header.text());
      if (!m.matches()) {
        throw unexpected(header);
      }
      prefixText = m.group(1);
      name = m.group(2);
      dummyText = m.group(3);
      resultName = m.group(4);
    } else {
      Matcher m = StatementClassifier.SUBROUTINE.matcher(header.text());
      if (!m.matches()) {
        throw unexpected(header);
      }
      prefixText = m.group(1);
      name = m.group(2);
      dummyText = m.group(3);
    }

    List<String> prefixes = new ArrayList<String>();
    Matcher pm = PREFIX.matcher(prefixText);
    while (pm.find()) {
      prefixes.add(pm.group(1).toLowerCase());
    }
    String typeText = PREFIX.matcher(prefixText).replaceAll(" ").trim();
    TypeSpec resultType = null;
    if (!typeText.isEmpty()) {
      resultType = new StatementParser(path, header.firstLine(), typeText)
                                                          .typeSpecOnly();
    }

    List<String> dummies = new ArrayList<String>();
    if (dummyText != null) {
      for (String d: dummyText.split(",")) {
        if (!d.trim().isEmpty()) {
          dummies.add(d.trim());
        }
      }
    }

    List<Node> stmts = statements(parts.body, header.lastLine(),
                                  parts.bodyClose());
    return Normalization.routine(span(n),
        function ? RoutineKind.FUNCTION : RoutineKind.SUBROUTINE,
        name, prefixes, dummies, resultName, resultType, stmts,
        members(parts));
  }

  private List<Node> members(UnitParts parts) throws ParseException {
    if (parts.contains == null) {
      return Collections.emptyList();
    }
    List<Placed> placed = new ArrayList<Placed>();
    for (SyntaxNode m: parts.members) {
      placed.add(placed(programUnit(m), m));
    }
    return Normalization.arrange(placed, parts.contains.lastLine(),
                                 parts.end.firstLine());
  }

  /**
   * @param openLine last line of the enclosing header
   * @param closeLine first line after the list
   */
  private List<Node> statements(List<SyntaxNode> nodes, int openLine,
                                int closeLine) throws ParseException {
    List<Placed> placed = new ArrayList<Placed>(nodes.size());
    for (SyntaxNode n: nodes) {
      placed.add(placed(statement(n), n));
    }
    return Normalization.arrange(placed, openLine, closeLine);
  }

  private Node statement(SyntaxNode n) throws ParseException {
    SourceSpan span = span(n);
    String type = n.type();
    if (type.equals(SyntaxNode.COMMENT)) {
      return comment(n);
    } else if (type.equals(SyntaxNode.TYPE_DECLARATION_STMT)) {
      return parser(n).declaration(span);
    } else if (type.equals(SyntaxNode.USE_STMT)) {
      return use(n, span);
    } else if (type.equals(SyntaxNode.CALL_STMT)) {
      return parser(n).call(span);
    } else if (type.equals(SyntaxNode.ASSIGNMENT_STMT) ||
               type.equals(SyntaxNode.POINTER_ASSIGNMENT_STMT)) {
      return parser(n).assignment(span);
    } else if (type.equals(SyntaxNode.IF_CONSTRUCT)) {
      return ifConstruct(n);
    } else if (type.equals(SyntaxNode.IF_STMT)) {
      return logicalIf(n);
    } else if (type.equals(SyntaxNode.BLOCK_NONLABEL_DO_CONSTRUCT)) {
      List<SyntaxNode> children = n.children();
      return doLoop(n, doHeader(n.first().text()),
                    children.subList(1, children.size() - 1),
                    n.last().firstLine());
    } else if (type.equals(SyntaxNode.BLOCK_LABEL_DO_CONSTRUCT)) {
      return labelDoLoop(n);
    } else if (type.equals(SyntaxNode.BLOCK_CONSTRUCT)) {
      List<SyntaxNode> children = n.children();
      return Normalization.block(span,
          statements(children.subList(1, children.size() - 1),
                     n.first().lastLine(), n.last().firstLine()));
    } else if (type.equals(SyntaxNode.OTHER_STMT) ||
               type.equals(SyntaxNode.CONTINUE_STMT) ||
               type.equals(SyntaxNode.INCLUDE_STMT)) {
      String text = n.label() != null ? n.label() + " " + n.text()
                                      : n.text();
      return new Intrinsic(span, Normalization.statementText(text));
    }
    throw unexpected(n);
  }

  private Node comment(SyntaxNode n) {
    return Statements.commentOrPragma(span(n), n.text());
  }

  private Import use(SyntaxNode n, SourceSpan span) throws ParseException {
    Matcher m = USE_PARTS.matcher(n.text());
    if (!m.matches()) {
      throw new ParseException(path, n.firstLine(), 0,
                               "malformed USE statement: " + n.text());
    }
    String module = m.group(1);
    String rest = m.group(2);
    boolean only = false;
    List<String> symbols = new ArrayList<String>();
    if (rest != null) {
      Matcher om = ONLY.matcher(rest.trim());
      if (om.matches()) {
        only = true;
        rest = om.group(1);
      }
      for (String item: rest.split(",")) {
        String s = item.replaceAll("\\s+", "");
        if (!s.isEmpty()) {
          symbols.add(s);
        }
      }
    }
    return new Import(span, module, only, symbols);
  }

  private Conditional ifConstruct(SyntaxNode n) throws ParseException {
    List<Integer> heads = new ArrayList<Integer>();
    List<SyntaxNode> children = n.children();
    for (int i = 0; i < children.size(); i++) {
      SyntaxNode c = children.get(i);
      if (c.is(SyntaxNode.IF_THEN_STMT) || c.is(SyntaxNode.ELSE_IF_STMT) ||
          c.is(SyntaxNode.ELSE_STMT) || c.is(SyntaxNode.END_IF_STMT)) {
        heads.add(i);
      }
    }
    return branch(n, heads, 0, span(n), false);
  }

  /**
   * Build the conditional for the branch starting at heads[k].  ELSE IF
   * branches nest in the else part of the branch before them.
   */
  private Conditional branch(SyntaxNode n, List<Integer> heads, int k,
                     SourceSpan span, boolean elseIf) throws ParseException {
    List<SyntaxNode> children = n.children();
    SyntaxNode head = children.get(heads.get(k));
    SyntaxNode next = children.get(heads.get(k + 1));
    Node condition = condition(head);
    List<Node> thenBody = statements(
        children.subList(heads.get(k) + 1, heads.get(k + 1)),
        head.lastLine(), next.firstLine());
    List<Node> elseBody = Collections.emptyList();
    if (next.is(SyntaxNode.ELSE_IF_STMT)) {
      elseBody = Collections.<Node>singletonList(
          branch(n, heads, k + 1, null, true));
    } else if (next.is(SyntaxNode.ELSE_STMT)) {
      SyntaxNode end = children.get(heads.get(k + 2));
      elseBody = statements(
          children.subList(heads.get(k + 1) + 1, heads.get(k + 2)),
          next.lastLine(), end.firstLine());
    }
    return new Conditional(span, false, elseIf, condition, thenBody,
                           elseBody);
  }

  /**
   * @return the expression in the first parenthesis of an IF header
   */
  private Node condition(SyntaxNode stmt) throws ParseException {
    String text = stmt.text();
    int open = text.indexOf('(');
    int close = StatementClassifier.closingParen(text, open);
    if (open < 0 || close < 0) {
      throw new ParseException(path, stmt.firstLine(), 0,
                               "malformed condition: " + text);
    }
    return new StatementParser(path, stmt.firstLine(),
                        text.substring(open + 1, close)).expressionOnly();
  }

  private Conditional logicalIf(SyntaxNode n) throws ParseException {
    Node condition = condition(n);
    // Action statement shares the line, so it has no span
    Node action = statement(n.first()).withSpan(null);
    return new Conditional(span(n), true, false, condition,
                Collections.singletonList(action),
                Collections.<Node>emptyList());
  }

  /**
   * @return loop control after DO and an optional label
   */
  private static String doHeader(String text) {
    return text.trim().substring(2).trim();
  }

  private Node labelDoLoop(SyntaxNode n) throws ParseException {
    Matcher m = StatementClassifier.LABEL_DO.matcher(n.first().text());
    if (!m.matches()) {
      throw unexpected(n.first());
    }
    List<SyntaxNode> children = n.children();
    SyntaxNode last = n.last();
    List<SyntaxNode> body;
    int closeLine;
    if (last.is(SyntaxNode.END_DO_STMT) ||
        last.is(SyntaxNode.CONTINUE_STMT)) {
      // Terminal statement closes the loop and is not part of the body
      body = children.subList(1, children.size() - 1);
      closeLine = last.firstLine();
    } else {
      body = children.subList(1, children.size());
      closeLine = last.lastLine() + 1;
    }
    return doLoop(n, m.group(2).trim(), body, closeLine);
  }

  private Node doLoop(SyntaxNode n, String control, List<SyntaxNode> body,
                      int closeLine) throws ParseException {
    SyntaxNode header = n.first();
    List<Node> stmts = statements(body, header.lastLine(), closeLine);
    if (control.startsWith(",")) {
      control = control.substring(1).trim();
    }
    if (control.isEmpty()) {
      return new WhileLoop(span(n), null, stmts);
    }
    if (control.toLowerCase().startsWith("while")) {
      return new WhileLoop(span(n), condition(
          new SyntaxNode(header.type(), control, null, header.firstLine(),
                         header.lastLine(), header.included())), stmts);
    }
    LoopControl lc = new StatementParser(path, header.firstLine(),
                                         control).loopControl();
    return new Loop(span(n), lc.variable, lc.lower, lc.upper, lc.step,
                    stmts);
  }

  /*
   * Line bookkeeping
   */

  private StatementParser parser(SyntaxNode n) throws ParseException {
    return new StatementParser(path, n.firstLine(), n.text());
  }

  private Placed placed(Node node, SyntaxNode n) {
    return new Placed(node, n.firstLine(), n.lastLine());
  }

  private SourceSpan span(SyntaxNode n) {
    if (n.included()) {
      return null;
    }
    return lines.span(n.firstLine(), n.lastLine());
  }

  private FortxRuntimeError unexpected(SyntaxNode n) {
    return new FortxRuntimeError(path + ":" + n.firstLine() +
        ": unexpected syntax node " + n.type());
  }
}
