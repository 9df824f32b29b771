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
package exm.fortx.frontend.antlr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.antlr.runtime.Token;
import org.apache.commons.lang3.StringUtils;

import exm.fortx.common.exceptions.FortxRuntimeError;
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
 * Maps the tree built by the Fortran grammar to IR.
 *
 * Statement spans come from the token boundaries ANTLR records for each
 * rule.  Comments are hidden tokens, so full-line comments are collected
 * by line up front and handed out to the innermost statement list whose
 * line range holds them.  Comments after code on the same line are
 * dropped.
 */
public class AntlrNormalizer {
  private final String path;
  private final LineTable lines;
  private final List<? extends Token> tokens;

  /** Unclaimed full-line comments by line */
  private final NavigableMap<Integer, Token> comments =
                                  new TreeMap<Integer, Token>();

  public AntlrNormalizer(String path, String text,
                         List<? extends Token> tokens) {
    this.path = path;
    this.lines = new LineTable(text);
    this.tokens = tokens;
    for (Token t: tokens) {
      if (t.getType() == FortranLexer.COMMENT && isFullLine(t)) {
        comments.put(t.getLine(), t);
      }
    }
  }

  private boolean isFullLine(Token comment) {
    String line = lines.line(comment.getLine());
    int pos = Math.min(comment.getCharPositionInLine(), line.length());
    return StringUtils.isBlank(line.substring(0, pos));
  }

  public FileNode normalize(FortranTree file) {
    if (file.getType() != FortranParser.N_FILE) {
      throw unexpected(file);
    }
    List<Placed> units = new ArrayList<Placed>();
    for (FortranTree t: file.children()) {
      units.add(new Placed(programUnit(t), startLine(t), endLine(t)));
    }
    int last = lines.lineCount();
    claimComments(units, 0, last + 1);
    return new FileNode(lines.span(1, last),
                        Normalization.arrange(units, 0, last + 1));
  }

  private Node programUnit(FortranTree t) {
    switch (t.getType()) {
      case FortranParser.N_MODULE:
        return module(t);
      case FortranParser.N_SUBROUTINE:
      case FortranParser.N_FUNCTION:
        return routine(t);
      default:
        throw unexpected(t);
    }
  }

  private Module module(FortranTree t) {
    int end = endLine(t);
    String name = t.child(0).getText();
    FortranTree body = t.child(1);
    FortranTree members = t.childCount() > 2 ? t.child(2) : null;
    int containsLine = members != null ? members.getLine() : end;

    List<Node> spec = statements(body.children(), headerEndLine(t),
                                 containsLine);
    List<Node> memberNodes = Collections.emptyList();
    if (members != null) {
      memberNodes = members(members, end);
    }
    return new Module(span(t), name, spec, memberNodes);
  }

  private Node routine(FortranTree t) {
    boolean function = t.getType() == FortranParser.N_FUNCTION;
    int end = endLine(t);
    int i = 0;
    String name = t.child(i++).getText();
    FortranTree prefixTree = t.child(i++);
    FortranTree dummyTree = t.child(i++);
    FortranTree resultTree = function ? t.child(i++) : null;
    FortranTree body = t.child(i++);
    FortranTree members = i < t.childCount() ? t.child(i) : null;

    List<String> prefixes = new ArrayList<String>();
    TypeSpec resultType = null;
    for (FortranTree p: prefixTree.children()) {
      if (p.getType() == FortranParser.N_TYPE ||
          p.getType() == FortranParser.N_DERIVED) {
        resultType = typeSpec(p);
      } else {
        prefixes.add(p.getText().toLowerCase());
      }
    }
    List<String> dummies = new ArrayList<String>();
    for (FortranTree d: dummyTree.children()) {
      dummies.add(d.getText());
    }
    String resultName = null;
    if (resultTree != null && resultTree.childCount() > 0) {
      resultName = resultTree.child(0).getText();
    }

    int containsLine = members != null ? members.getLine() : end;
    List<Node> stmts = statements(body.children(), headerEndLine(t),
                                  containsLine);
    List<Node> memberNodes = Collections.emptyList();
    if (members != null) {
      memberNodes = members(members, end);
    }
    return Normalization.routine(span(t),
        function ? RoutineKind.FUNCTION : RoutineKind.SUBROUTINE,
        name, prefixes, dummies, resultName, resultType, stmts, memberNodes);
  }

  private List<Node> members(FortranTree members, int end) {
    List<Placed> placed = new ArrayList<Placed>();
    for (FortranTree m: members.children()) {
      placed.add(new Placed(routine(m), startLine(m), endLine(m)));
    }
    int containsLine = members.getLine();
    claimComments(placed, containsLine, end);
    return Normalization.arrange(placed, containsLine, end);
  }

  /**
   * Normalize one statement list
   * @param trees statement trees
   * @param openLine last line of enclosing header
   * @param closeLine first line after the list
   */
  private List<Node> statements(List<FortranTree> trees, int openLine,
                                int closeLine) {
    List<Placed> placed = new ArrayList<Placed>(trees.size());
    for (FortranTree t: trees) {
      placed.add(new Placed(statement(t), startLine(t), endLine(t)));
    }
    claimComments(placed, openLine, closeLine);
    return Normalization.arrange(placed, openLine, closeLine);
  }

  /**
   * Add comments strictly between openLine and closeLine that no
   * statement covers.  Nested lists must be normalized first, so that
   * they take their own comments.
   */
  private void claimComments(List<Placed> placed, int openLine,
                             int closeLine) {
    if (closeLine <= openLine + 1) {
      return;
    }
    List<Placed> claimed = new ArrayList<Placed>();
    Iterator<Map.Entry<Integer, Token>> it =
        comments.subMap(openLine, false, closeLine, false)
                .entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<Integer, Token> e = it.next();
      int line = e.getKey();
      if (covered(placed, line)) {
        continue;
      }
      Node comment = Statements.commentOrPragma(lines.span(line, line),
                                                e.getValue().getText());
      claimed.add(new Placed(comment, line, line));
      it.remove();
    }
    placed.addAll(claimed);
  }

  private static boolean covered(List<Placed> placed, int line) {
    for (Placed p: placed) {
      if (p.coversLine(line)) {
        return true;
      }
    }
    return false;
  }

  private Node statement(FortranTree t) {
    switch (t.getType()) {
      case FortranParser.N_DECL:
        return declaration(t);
      case FortranParser.N_USE:
        return use(t);
      case FortranParser.N_CALL:
        return call(t, span(t));
      case FortranParser.N_IF:
        return conditional(t, span(t), endLine(t), false);
      case FortranParser.N_LIF:
        return logicalIf(t);
      case FortranParser.N_DO:
        return loop(t);
      case FortranParser.N_WHILE:
        return whileLoop(t);
      case FortranParser.N_BLOCK:
        return Normalization.block(span(t),
                  statements(t.child(0).children(), headerEndLine(t),
                             endLine(t)));
      case FortranParser.N_ASSIGN:
      case FortranParser.N_PTR_ASSIGN:
        return new Assignment(span(t),
                              t.getType() == FortranParser.N_PTR_ASSIGN,
                              expr(t.child(0)), expr(t.child(1)));
      case FortranParser.N_INTRINSIC:
        return new Intrinsic(span(t),
                             Normalization.statementText(t.getText()));
      default:
        throw unexpected(t);
    }
  }

  private Declaration declaration(FortranTree t) {
    TypeSpec type = typeSpec(t.child(0));
    Intent intent = Intent.NONE;
    List<String> attributes = new ArrayList<String>();
    List<Node> dimensions = Collections.emptyList();
    for (FortranTree a: t.child(1).children()) {
      switch (a.getType()) {
        case FortranParser.N_INTENT: {
          StringBuilder sb = new StringBuilder();
          for (FortranTree word: a.children()) {
            sb.append(word.getText());
          }
          intent = Intent.fromString(sb.toString());
          break;
        }
        case FortranParser.N_DIMENSION:
          dimensions = shape(a.children());
          break;
        case FortranParser.N_ATTR:
          attributes.add(a.child(0).getText());
          break;
        default:
          throw unexpected(a);
      }
    }

    List<Node> entities = new ArrayList<Node>();
    for (FortranTree e: t.child(2).children()) {
      String name = e.child(0).getText();
      List<Node> entityShape = shape(e.child(1).children());
      FortranTree initTree = e.child(2);
      Node init = initTree.childCount() > 0 ? expr(initTree.child(0)) : null;
      entities.add(new Entity(name, entityShape, init));
    }
    return new Declaration(span(t), type, intent, attributes, dimensions,
                           entities);
  }

  private TypeSpec typeSpec(FortranTree t) {
    if (t.getType() == FortranParser.N_DERIVED) {
      return TypeSpec.derived(t.child(0).getText());
    }
    if (t.getType() != FortranParser.N_TYPE) {
      throw unexpected(t);
    }
    Node kind = null;
    Node length = null;
    List<Node> positional = new ArrayList<Node>();
    for (FortranTree sel: t.children()) {
      switch (sel.getType()) {
        case FortranParser.N_KIND:
          kind = typeParam(sel.child(0));
          break;
        case FortranParser.N_LEN:
          length = typeParam(sel.child(0));
          break;
        case FortranParser.N_SEL:
        case FortranParser.N_STARLEN:
          positional.add(typeParam(sel.child(0)));
          break;
        default:
          throw unexpected(sel);
      }
    }
    return Normalization.typeSpec(t.getText(), kind, length, positional);
  }

  private Node typeParam(FortranTree t) {
    switch (t.getType()) {
      case FortranParser.N_ASTERISK:
        return new Literal(LiteralKind.ASSUMED, "*");
      case FortranParser.N_DEFERRED:
        return new Literal(LiteralKind.ASSUMED, ":");
      default:
        return expr(t);
    }
  }

  private List<Node> shape(List<FortranTree> specs) {
    List<Node> result = new ArrayList<Node>(specs.size());
    for (FortranTree s: specs) {
      if (s.getType() == FortranParser.N_ASTERISK) {
        result.add(new Literal(LiteralKind.ASSUMED, "*"));
      } else {
        result.add(expr(s));
      }
    }
    return result;
  }

  private Import use(FortranTree t) {
    String module = t.child(0).getText();
    boolean only = false;
    List<String> symbols = new ArrayList<String>();
    if (t.childCount() > 1) {
      FortranTree list = t.child(1);
      only = list.getType() == FortranParser.N_ONLY;
      for (FortranTree item: list.children()) {
        if (item.getType() == FortranParser.N_RENAME) {
          symbols.add(item.child(0).getText() + "=>" +
                      item.child(1).getText());
        } else {
          symbols.add(item.getText());
        }
      }
    }
    return new Import(span(t), module, only, symbols);
  }

  private CallStatement call(FortranTree t, SourceSpan span) {
    String name = t.child(0).getText();
    return new CallStatement(span, name, exprs(t.children(1)));
  }

  /**
   * @param endLine line of the END IF closing the whole chain
   * @param elseIf true for an ELSE IF branch, which has no span of its own
   */
  private Conditional conditional(FortranTree t, SourceSpan span,
                                  int endLine, boolean elseIf) {
    Node condition = expr(t.child(0));
    FortranTree elseTree = t.childCount() > 2 ? t.child(2) : null;
    int thenEnd = elseTree != null ? elseTree.getLine() : endLine;
    List<Node> thenBody = statements(t.child(1).children(),
                                     headerEndLine(t), thenEnd);
    List<Node> elseBody = Collections.emptyList();
    if (elseTree != null) {
      // An else-if branch is rooted at the else token; a nested IF
      // construct inside a plain ELSE keeps its own if token
      if (elseTree.childCount() == 1 &&
          elseTree.child(0).getType() == FortranParser.N_IF &&
          !"if".equalsIgnoreCase(elseTree.child(0).getText())) {
        Node branch = conditional(elseTree.child(0), null, endLine, true);
        elseBody = Collections.singletonList(branch);
      } else {
        elseBody = statements(elseTree.children(), headerEndLine(elseTree),
                              endLine);
      }
    }
    return new Conditional(span, false, elseIf, condition, thenBody,
                           elseBody);
  }

  private Conditional logicalIf(FortranTree t) {
    Node condition = expr(t.child(0));
    // Action statement shares the line, so it has no span
    Node action = statement(t.child(1)).withSpan(null);
    return new Conditional(span(t), true, false, condition,
                Collections.singletonList(action),
                Collections.<Node>emptyList());
  }

  private Loop loop(FortranTree t) {
    String variable = t.child(0).getText();
    Node lower = expr(t.child(1).child(0));
    Node upper = expr(t.child(2).child(0));
    FortranTree stepTree = t.child(3);
    Node step = stepTree.childCount() > 0 ? expr(stepTree.child(0)) : null;
    List<Node> body = statements(t.child(4).children(), headerEndLine(t),
                                 endLine(t));
    return new Loop(span(t), variable, lower, upper, step, body);
  }

  private WhileLoop whileLoop(FortranTree t) {
    Node condition = null;
    FortranTree body = t.child(0);
    if (t.childCount() == 2) {
      condition = expr(t.child(0));
      body = t.child(1);
    }
    return new WhileLoop(span(t), condition,
        statements(body.children(), headerEndLine(t), endLine(t)));
  }

  private List<Node> exprs(List<FortranTree> trees) {
    List<Node> result = new ArrayList<Node>(trees.size());
    for (FortranTree t: trees) {
      result.add(expr(t));
    }
    return result;
  }

  private Node expr(FortranTree t) {
    switch (t.getType()) {
      case FortranParser.INT_LIT:
        return new Literal(LiteralKind.INTEGER, t.getText());
      case FortranParser.REAL_LIT:
        return new Literal(LiteralKind.REAL, t.getText());
      case FortranParser.STRING_LIT:
        return new Literal(LiteralKind.STRING, t.getText());
      case FortranParser.TRUE:
      case FortranParser.FALSE:
        return new Literal(LiteralKind.LOGICAL, t.getText());
      case FortranParser.N_ASTERISK:
        return new Literal(LiteralKind.ASSUMED, "*");
      case FortranParser.N_PAREN:
        return new Parenthesis(expr(t.child(0)));
      case FortranParser.N_VAR:
        return new VariableRef(t.child(0).getText());
      case FortranParser.N_REF:
        return new ArrayRef(t.child(0).getText(), exprs(t.children(1)));
      case FortranParser.N_UNARY:
        return new UnaryOp(Normalization.operator(t.getText()),
                           expr(t.child(0)));
      case FortranParser.N_KWARG:
        return new KeywordArg(t.child(0).getText(), expr(t.child(1)));
      case FortranParser.N_RANGE:
        return new RangeIndex(optExpr(t.child(0)), optExpr(t.child(1)),
                              optExpr(t.child(2)));
      case FortranParser.POW:
      case FortranParser.STAR:
      case FortranParser.SLASH:
      case FortranParser.PLUS:
      case FortranParser.MINUS:
      case FortranParser.CONCAT:
      case FortranParser.EQ:
      case FortranParser.NE:
      case FortranParser.LT:
      case FortranParser.LE:
      case FortranParser.GT:
      case FortranParser.GE:
      case FortranParser.AND:
      case FortranParser.OR:
      case FortranParser.EQV:
      case FortranParser.NEQV:
        return new BinaryOp(Normalization.operator(t.getText()),
                            expr(t.child(0)), expr(t.child(1)));
      default:
        throw unexpected(t);
    }
  }

  private Node optExpr(FortranTree holder) {
    return holder.childCount() > 0 ? expr(holder.child(0)) : null;
  }

  /*
   * Line bookkeeping
   */

  private SourceSpan span(FortranTree t) {
    return lines.span(startLine(t), endLine(t));
  }

  private static boolean isSeparator(Token t) {
    return t.getChannel() != Token.DEFAULT_CHANNEL ||
           t.getType() == FortranLexer.NEWLINE ||
           t.getType() == FortranLexer.SEMI ||
           t.getType() == Token.EOF;
  }

  /**
   * Rule boundaries may include trailing separators, which are trimmed
   */
  private int startLine(FortranTree t) {
    int start = t.getTokenStartIndex();
    int stop = t.getTokenStopIndex();
    if (start < 0) {
      return t.getLine();
    }
    int i = start;
    while (i < stop && isSeparator(tokens.get(i))) {
      i++;
    }
    return tokens.get(i).getLine();
  }

  private int endLine(FortranTree t) {
    int start = t.getTokenStartIndex();
    int stop = t.getTokenStopIndex();
    if (start < 0 || stop < 0) {
      return t.getLine();
    }
    int i = stop;
    while (i > start && isSeparator(tokens.get(i))) {
      i--;
    }
    return tokens.get(i).getLine();
  }

  /**
   * @return line of the statement separator ending the construct header
   */
  private int headerEndLine(FortranTree t) {
    int start = t.getTokenStartIndex();
    if (start < 0) {
      return t.getLine();
    }
    for (int i = start; i < tokens.size(); i++) {
      Token tok = tokens.get(i);
      if (tok.getChannel() == Token.DEFAULT_CHANNEL &&
          (tok.getType() == FortranLexer.NEWLINE ||
           tok.getType() == FortranLexer.SEMI)) {
        return tok.getLine();
      }
    }
    return startLine(t);
  }

  private FortxRuntimeError unexpected(FortranTree t) {
    return new FortxRuntimeError(path + ":" + t.getLine() +
        ": unexpected tree node " + t.getText() + " type " + t.getType());
  }
}
