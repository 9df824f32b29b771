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
package exm.fortx.regen;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Expressions.BinaryOp;
import exm.fortx.ir.Expressions.KeywordArg;
import exm.fortx.ir.Expressions.Literal;
import exm.fortx.ir.Expressions.Parenthesis;
import exm.fortx.ir.Expressions.RangeIndex;
import exm.fortx.ir.Expressions.UnaryOp;
import exm.fortx.ir.Expressions.VariableRef;
import exm.fortx.ir.Intent;
import exm.fortx.ir.Node;
import exm.fortx.ir.Statements.Assignment;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Comment;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.ir.Statements.Pragma;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.Units.Routine;

/**
 * Free-form Fortran text for IR nodes that have no source text of their
 * own.  Parentheses are added wherever operator precedence requires them.
 */
public class FortranPrinter {

  /** Binding strength of primaries and parenthesized expressions */
  private static final int PRIMARY = 10;
  private static final int POWER = 8;
  private static final int RELATIONAL = 4;

  private static int precedence(String op, boolean unary) {
    if (unary) {
      return op.equals(".not.") ? 3 : 6;
    }
    if (op.equals("**")) {
      return POWER;
    } else if (op.equals("*") || op.equals("/")) {
      return 7;
    } else if (op.equals("+") || op.equals("-")) {
      return 6;
    } else if (op.equals("//")) {
      return 5;
    } else if (op.equals("==") || op.equals("/=") || op.equals("<") ||
               op.equals("<=") || op.equals(">") || op.equals(">=")) {
      return RELATIONAL;
    } else if (op.equals(".and.")) {
      return 2;
    } else if (op.equals(".or.")) {
      return 1;
    } else if (op.equals(".eqv.") || op.equals(".neqv.")) {
      return 0;
    } else {
      // Defined operator
      return -1;
    }
  }

  private static int precedence(Node expr) {
    switch (expr.kind()) {
      case BINARY:
        return precedence(((BinaryOp)expr).op(), false);
      case UNARY:
        return precedence(((UnaryOp)expr).op(), true);
      default:
        return PRIMARY;
    }
  }

  public static String expression(Node expr) {
    StringBuilder sb = new StringBuilder();
    appendExpr(sb, expr);
    return sb.toString();
  }

  private static void appendExpr(StringBuilder sb, Node expr) {
    switch (expr.kind()) {
      case BINARY: {
        BinaryOp b = (BinaryOp)expr;
        int p = precedence(b.op(), false);
        int lp = precedence(b.left());
        int rp = precedence(b.right());
        // ** groups right to left, relational operators don't chain
        boolean leftParens = lp < p || (lp == p &&
                              (p == POWER || p == RELATIONAL || p < 0));
        boolean rightParens = p == POWER ? rp < p : rp <= p;
        appendOperand(sb, b.left(), leftParens);
        sb.append(' ').append(b.op()).append(' ');
        appendOperand(sb, b.right(), rightParens);
        break;
      }
      case UNARY: {
        UnaryOp u = (UnaryOp)expr;
        sb.append(u.op());
        if (u.op().startsWith(".")) {
          sb.append(' ');
        }
        appendOperand(sb, u.operand(),
                      precedence(u.operand()) <= precedence(u.op(), true));
        break;
      }
      case LITERAL:
        sb.append(((Literal)expr).text());
        break;
      case VARIABLE:
        sb.append(((VariableRef)expr).name());
        break;
      case ARRAY_REF: {
        ArrayRef a = (ArrayRef)expr;
        sb.append(a.name()).append('(');
        appendList(sb, a.args());
        sb.append(')');
        break;
      }
      case RANGE: {
        RangeIndex r = (RangeIndex)expr;
        if (r.lower() != null) {
          appendExpr(sb, r.lower());
        }
        sb.append(':');
        if (r.upper() != null) {
          appendExpr(sb, r.upper());
        }
        if (r.step() != null) {
          sb.append(':');
          appendExpr(sb, r.step());
        }
        break;
      }
      case PAREN:
        sb.append('(');
        appendExpr(sb, ((Parenthesis)expr).inner());
        sb.append(')');
        break;
      case KEYWORD_ARG: {
        KeywordArg k = (KeywordArg)expr;
        sb.append(k.keyword()).append('=');
        appendExpr(sb, k.value());
        break;
      }
      default:
        throw new FortxRuntimeError("Not an expression: " + expr);
    }
  }

  private static void appendOperand(StringBuilder sb, Node operand,
                                    boolean parens) {
    if (parens) {
      sb.append('(');
    }
    appendExpr(sb, operand);
    if (parens) {
      sb.append(')');
    }
  }

  private static void appendList(StringBuilder sb, List<Node> exprs) {
    boolean first = true;
    for (Node e: exprs) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      appendExpr(sb, e);
    }
  }

  public static String typeSpec(TypeSpec type) {
    if (type.isDerived()) {
      return "type(" + type.derivedName() + ")";
    }
    List<String> selectors = new ArrayList<String>();
    if (type.length() != null) {
      selectors.add("len=" + expression(type.length()));
    }
    if (type.kind() != null) {
      selectors.add("kind=" + expression(type.kind()));
    }
    if (selectors.isEmpty()) {
      return type.base();
    }
    return type.base() + "(" + StringUtils.join(selectors, ", ") + ")";
  }

  /**
   * @return text of a statement that fits on one logical line
   */
  public static String statement(Node stmt) {
    switch (stmt.kind()) {
      case IMPORT:
        return importStatement((Import)stmt);
      case DECLARATION:
        return declaration((Declaration)stmt);
      case ASSIGNMENT: {
        Assignment a = (Assignment)stmt;
        return expression(a.target()) + (a.isPointer() ? " => " : " = ") +
               expression(a.value());
      }
      case CALL: {
        CallStatement c = (CallStatement)stmt;
        if (c.args().isEmpty()) {
          return "call " + c.name();
        }
        StringBuilder sb = new StringBuilder("call ");
        sb.append(c.name()).append('(');
        appendList(sb, c.args());
        sb.append(')');
        return sb.toString();
      }
      case INTRINSIC:
        return ((Intrinsic)stmt).text();
      case COMMENT:
        return ((Comment)stmt).text();
      case PRAGMA:
        return ((Pragma)stmt).text();
      default:
        throw new FortxRuntimeError("Not a simple statement: " + stmt);
    }
  }

  private static String importStatement(Import imp) {
    StringBuilder sb = new StringBuilder("use ");
    sb.append(imp.module());
    if (imp.isOnly()) {
      sb.append(", only: ");
    } else if (!imp.symbols().isEmpty()) {
      sb.append(", ");
    }
    sb.append(StringUtils.join(imp.symbols(), ", "));
    return sb.toString();
  }

  private static String declaration(Declaration decl) {
    StringBuilder sb = new StringBuilder(typeSpec(decl.type()));
    for (String attr: decl.attributes()) {
      sb.append(", ").append(attr);
    }
    if (!decl.dimensions().isEmpty()) {
      sb.append(", dimension(");
      appendList(sb, decl.dimensions());
      sb.append(')');
    }
    if (decl.intent() != Intent.NONE) {
      sb.append(", intent(").append(decl.intent().keyword()).append(')');
    }
    sb.append(" :: ");
    boolean first = true;
    for (Entity e: decl.entities()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(e.name());
      if (!e.shape().isEmpty()) {
        sb.append('(');
        appendList(sb, e.shape());
        sb.append(')');
      }
      if (e.init() != null) {
        sb.append(decl.hasAttribute("pointer") ? " => " : " = ");
        appendExpr(sb, e.init());
      }
    }
    return sb.toString();
  }

  public static String routineHeader(Routine r) {
    StringBuilder sb = new StringBuilder();
    for (String prefix: r.prefixes()) {
      sb.append(prefix).append(' ');
    }
    if (r.resultType() != null) {
      sb.append(typeSpec(r.resultType())).append(' ');
    }
    sb.append(r.routineKind().keyword()).append(' ').append(r.name());
    if (r.isFunction() || !r.dummies().isEmpty()) {
      sb.append('(').append(StringUtils.join(r.dummies(), ", ")).append(')');
    }
    if (r.resultName() != null) {
      sb.append(" result(").append(r.resultName()).append(')');
    }
    return sb.toString();
  }
}
