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
import java.util.List;

import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Normalization;
import exm.fortx.frontend.line.Scanner.Token;
import exm.fortx.frontend.line.Scanner.TokenKind;
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
import exm.fortx.ir.Node;
import exm.fortx.ir.SourceSpan;
import exm.fortx.ir.Statements.Assignment;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.TypeSpec;

/**
 * Recursive descent parser for the body of one classified statement.
 * Operator precedence matches the ANTLR grammar, so both frontends
 * build the same expression trees.
 */
public class StatementParser {

  /**
   * Counted loop header: var = lower, upper[, step]
   */
  public static class LoopControl {
    public final String variable;
    public final Node lower;
    public final Node upper;
    public final Node step;

    LoopControl(String variable, Node lower, Node upper, Node step) {
      this.variable = variable;
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }
  }

  private final String path;
  private final int line;
  private final List<Token> tokens;
  private int pos = 0;

  public StatementParser(String path, int line, String text)
                                        throws ParseException {
    this.path = path;
    this.line = line;
    this.tokens = new Scanner(path, line).scan(text);
  }

  /*
   * Statements
   */

  public Declaration declaration(SourceSpan span) throws ParseException {
    TypeSpec type = typeSpec();
    Intent intent = Intent.NONE;
    List<String> attributes = new ArrayList<String>();
    List<Node> dimensions = new ArrayList<Node>();
    while (accept(TokenKind.COMMA)) {
      Token attr = expect(TokenKind.NAME);
      if (attr.isName("intent")) {
        expect(TokenKind.LPAREN);
        StringBuilder sb = new StringBuilder();
        while (peek().is(TokenKind.NAME)) {
          sb.append(next().text);
        }
        expect(TokenKind.RPAREN);
        try {
          intent = Intent.fromString(sb.toString());
        } catch (IllegalArgumentException e) {
          throw error("bad intent " + sb);
        }
      } else if (attr.isName("dimension")) {
        expect(TokenKind.LPAREN);
        dimensions = shapeList();
        expect(TokenKind.RPAREN);
      } else {
        attributes.add(attr.text);
      }
    }
    accept(TokenKind.DCOLON);

    List<Node> entities = new ArrayList<Node>();
    do {
      String name = expect(TokenKind.NAME).text;
      List<Node> shape = new ArrayList<Node>();
      if (accept(TokenKind.LPAREN)) {
        shape = shapeList();
        expect(TokenKind.RPAREN);
      }
      Node init = null;
      if (accept(TokenKind.ASSIGN) || accept(TokenKind.ARROW)) {
        init = expression();
      }
      entities.add(new Entity(name, shape, init));
    } while (accept(TokenKind.COMMA));
    expectEnd();
    return new Declaration(span, type, intent, attributes, dimensions,
                           entities);
  }

  public Assignment assignment(SourceSpan span) throws ParseException {
    Node target = designator();
    boolean pointer;
    if (accept(TokenKind.ARROW)) {
      pointer = true;
    } else {
      expect(TokenKind.ASSIGN);
      pointer = false;
    }
    Node value = expression();
    expectEnd();
    return new Assignment(span, pointer, target, value);
  }

  public CallStatement call(SourceSpan span) throws ParseException {
    expectName("call");
    String name = expect(TokenKind.NAME).text;
    List<Node> args = new ArrayList<Node>();
    if (accept(TokenKind.LPAREN)) {
      if (!peek().is(TokenKind.RPAREN)) {
        args = argList();
      }
      expect(TokenKind.RPAREN);
    }
    expectEnd();
    return new CallStatement(span, name, args);
  }

  /**
   * Parse the whole statement as "var = lower, upper[, step]"
   */
  public LoopControl loopControl() throws ParseException {
    String variable = expect(TokenKind.NAME).text;
    expect(TokenKind.ASSIGN);
    Node lower = expression();
    expect(TokenKind.COMMA);
    Node upper = expression();
    Node step = null;
    if (accept(TokenKind.COMMA)) {
      step = expression();
    }
    expectEnd();
    return new LoopControl(variable, lower, upper, step);
  }

  /**
   * Parse the whole statement as a type specification, e.g. the type
   * prefix of a function statement
   */
  public TypeSpec typeSpecOnly() throws ParseException {
    TypeSpec t = typeSpec();
    expectEnd();
    return t;
  }

  /**
   * Parse the whole statement as one expression
   */
  public Node expressionOnly() throws ParseException {
    Node e = expression();
    expectEnd();
    return e;
  }

  /*
   * Types
   */

  private TypeSpec typeSpec() throws ParseException {
    Token t = expect(TokenKind.NAME);
    String base = t.text.toLowerCase();
    if (base.equals("type")) {
      expect(TokenKind.LPAREN);
      String name = expect(TokenKind.NAME).text;
      expect(TokenKind.RPAREN);
      return TypeSpec.derived(name);
    }
    if (base.equals("double")) {
      expectName("precision");
      return TypeSpec.intrinsic(TypeSpec.DOUBLE_PRECISION);
    }
    if (base.equals("doubleprecision")) {
      return TypeSpec.intrinsic(TypeSpec.DOUBLE_PRECISION);
    }
    if (!base.equals(TypeSpec.INTEGER) && !base.equals(TypeSpec.REAL) &&
        !base.equals(TypeSpec.LOGICAL) && !base.equals(TypeSpec.COMPLEX) &&
        !base.equals(TypeSpec.CHARACTER)) {
      throw error("expected type, found " + t);
    }

    Node kind = null;
    Node length = null;
    List<Node> positional = new ArrayList<Node>();
    if (accept(TokenKind.LPAREN)) {
      do {
        if (peek().isName("kind") && peek(1).is(TokenKind.ASSIGN)) {
          pos += 2;
          kind = typeParam();
        } else if (peek().isName("len") && peek(1).is(TokenKind.ASSIGN)) {
          pos += 2;
          length = typeParam();
        } else {
          positional.add(typeParam());
        }
      } while (accept(TokenKind.COMMA));
      expect(TokenKind.RPAREN);
    } else if (peek().isOp("*")) {
      next();
      if (accept(TokenKind.LPAREN)) {
        positional.add(typeParam());
        expect(TokenKind.RPAREN);
      } else {
        positional.add(new Literal(LiteralKind.INTEGER,
                                   expect(TokenKind.INT).text));
      }
    }
    return Normalization.typeSpec(t.text, kind, length, positional);
  }

  private Node typeParam() throws ParseException {
    if (peek().isOp("*")) {
      next();
      return new Literal(LiteralKind.ASSUMED, "*");
    }
    if (accept(TokenKind.COLON)) {
      return new Literal(LiteralKind.ASSUMED, ":");
    }
    return expression();
  }

  private List<Node> shapeList() throws ParseException {
    List<Node> result = new ArrayList<Node>();
    do {
      if (peek().isOp("*") &&
          (peek(1).is(TokenKind.COMMA) || peek(1).is(TokenKind.RPAREN))) {
        next();
        result.add(new Literal(LiteralKind.ASSUMED, "*"));
      } else {
        result.add(subscript());
      }
    } while (accept(TokenKind.COMMA));
    return result;
  }

  /*
   * Expressions, lowest precedence first
   */

  public Node expression() throws ParseException {
    Node left = orExpr();
    while (peek().isOp(".eqv.") || peek().isOp(".neqv.")) {
      String op = next().text;
      left = new BinaryOp(Normalization.operator(op), left, orExpr());
    }
    return left;
  }

  private Node orExpr() throws ParseException {
    Node left = andExpr();
    while (peek().isOp(".or.")) {
      String op = next().text;
      left = new BinaryOp(Normalization.operator(op), left, andExpr());
    }
    return left;
  }

  private Node andExpr() throws ParseException {
    Node left = notExpr();
    while (peek().isOp(".and.")) {
      String op = next().text;
      left = new BinaryOp(Normalization.operator(op), left, notExpr());
    }
    return left;
  }

  private Node notExpr() throws ParseException {
    if (peek().isOp(".not.")) {
      String op = next().text;
      return new UnaryOp(Normalization.operator(op), notExpr());
    }
    return relExpr();
  }

  private Node relExpr() throws ParseException {
    Node left = concatExpr();
    if (isRelational(peek())) {
      String op = next().text;
      return new BinaryOp(Normalization.operator(op), left, concatExpr());
    }
    return left;
  }

  private static boolean isRelational(Token t) {
    if (t.kind != TokenKind.OP) {
      return false;
    }
    String op = Normalization.operator(t.text);
    return op.equals("==") || op.equals("/=") || op.equals("<") ||
           op.equals("<=") || op.equals(">") || op.equals(">=");
  }

  private Node concatExpr() throws ParseException {
    Node left = addExpr();
    while (peek().isOp("//")) {
      next();
      left = new BinaryOp("//", left, addExpr());
    }
    return left;
  }

  private Node addExpr() throws ParseException {
    Node left;
    if (peek().isOp("+") || peek().isOp("-")) {
      String op = next().text;
      left = new UnaryOp(op, multExpr());
    } else {
      left = multExpr();
    }
    while (peek().isOp("+") || peek().isOp("-")) {
      String op = next().text;
      left = new BinaryOp(op, left, multExpr());
    }
    return left;
  }

  private Node multExpr() throws ParseException {
    Node left = powExpr();
    while (peek().isOp("*") || peek().isOp("/")) {
      String op = next().text;
      left = new BinaryOp(op, left, powExpr());
    }
    return left;
  }

  private Node powExpr() throws ParseException {
    Node base = primary();
    if (peek().isOp("**")) {
      next();
      return new BinaryOp("**", base, powExpr());
    }
    return base;
  }

  private Node primary() throws ParseException {
    Token t = peek();
    switch (t.kind) {
      case INT:
        next();
        return new Literal(LiteralKind.INTEGER, t.text);
      case REAL:
        next();
        return new Literal(LiteralKind.REAL, t.text);
      case STRING:
        next();
        return new Literal(LiteralKind.STRING, t.text);
      case LOGICAL:
        next();
        return new Literal(LiteralKind.LOGICAL, t.text);
      case LPAREN: {
        next();
        Node inner = expression();
        expect(TokenKind.RPAREN);
        return new Parenthesis(inner);
      }
      case NAME:
        return designator();
      default:
        throw error("expected expression, found " + t);
    }
  }

  private Node designator() throws ParseException {
    String name = expect(TokenKind.NAME).text;
    if (accept(TokenKind.LPAREN)) {
      List<Node> args = new ArrayList<Node>();
      if (!peek().is(TokenKind.RPAREN)) {
        args = argList();
      }
      expect(TokenKind.RPAREN);
      return new ArrayRef(name, args);
    }
    return new VariableRef(name);
  }

  private List<Node> argList() throws ParseException {
    List<Node> args = new ArrayList<Node>();
    do {
      if (peek().is(TokenKind.NAME) && peek(1).is(TokenKind.ASSIGN)) {
        String keyword = next().text;
        next();
        args.add(new KeywordArg(keyword, expression()));
      } else {
        args.add(subscript());
      }
    } while (accept(TokenKind.COMMA));
    return args;
  }

  private Node subscript() throws ParseException {
    Node lower = null;
    if (!peek().is(TokenKind.COLON)) {
      lower = expression();
      if (!peek().is(TokenKind.COLON)) {
        return lower;
      }
    }
    expect(TokenKind.COLON);
    Node upper = null;
    if (!peek().is(TokenKind.COLON) && !peek().is(TokenKind.COMMA) &&
        !peek().is(TokenKind.RPAREN)) {
      upper = expression();
    }
    Node step = null;
    if (accept(TokenKind.COLON)) {
      step = expression();
    }
    return new RangeIndex(lower, upper, step);
  }

  /*
   * Token helpers
   */

  private Token peek() {
    return peek(0);
  }

  private Token peek(int ahead) {
    int i = Math.min(pos + ahead, tokens.size() - 1);
    return tokens.get(i);
  }

  private Token next() {
    Token t = peek();
    if (pos < tokens.size() - 1) {
      pos++;
    }
    return t;
  }

  private boolean accept(TokenKind kind) {
    if (peek().is(kind)) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind) throws ParseException {
    Token t = peek();
    if (!t.is(kind)) {
      throw error("expected " + kind.toString().toLowerCase() +
                  ", found " + t);
    }
    return next();
  }

  private void expectName(String name) throws ParseException {
    Token t = peek();
    if (!t.isName(name)) {
      throw error("expected " + name + ", found " + t);
    }
    next();
  }

  private void expectEnd() throws ParseException {
    if (!peek().is(TokenKind.END)) {
      throw error("unexpected " + peek());
    }
  }

  private ParseException error(String msg) {
    return new ParseException(path, line, 0, msg);
  }
}
