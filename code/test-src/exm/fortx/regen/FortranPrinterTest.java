package exm.fortx.regen;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Expressions.BinaryOp;
import exm.fortx.ir.Expressions.Literal;
import exm.fortx.ir.Expressions.LiteralKind;
import exm.fortx.ir.Expressions.RangeIndex;
import exm.fortx.ir.Expressions.UnaryOp;
import exm.fortx.ir.Expressions.VariableRef;
import exm.fortx.ir.Intent;
import exm.fortx.ir.Node;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.Units.RoutineKind;
import exm.fortx.ir.Units.Routine;

public class FortranPrinterTest {

  private static final Node A = new VariableRef("a");
  private static final Node B = new VariableRef("b");
  private static final Node C = new VariableRef("c");

  private static Node bin(String op, Node left, Node right) {
    return new BinaryOp(op, left, right);
  }

  private static String print(Node expr) {
    return FortranPrinter.expression(expr);
  }

  @Test
  public void testParenthesesFromPrecedence() {
    assertEquals("(a + b) * c", print(bin("*", bin("+", A, B), C)));
    assertEquals("a + b * c", print(bin("+", A, bin("*", B, C))));
    assertEquals("a - b - c", print(bin("-", bin("-", A, B), C)));
    assertEquals("a - (b - c)", print(bin("-", A, bin("-", B, C))));
    assertEquals("(a .or. b) .and. c",
                 print(bin(".and.", bin(".or.", A, B), C)));
  }

  @Test
  public void testPowerGroupsRight() {
    assertEquals("a ** b ** c", print(bin("**", A, bin("**", B, C))));
    assertEquals("(a ** b) ** c", print(bin("**", bin("**", A, B), C)));
  }

  @Test
  public void testRelationalDoesNotChain() {
    assertEquals("(a == b) == c", print(bin("==", bin("==", A, B), C)));
    assertEquals("a + 1 < b", print(bin("<",
        bin("+", A, new Literal(LiteralKind.INTEGER, "1")), B)));
  }

  @Test
  public void testUnary() {
    assertEquals("-(a + b)", print(new UnaryOp("-", bin("+", A, B))));
    assertEquals("a * (-b)", print(bin("*", A, new UnaryOp("-", B))));
    assertEquals("-a", print(new UnaryOp("-", A)));
    assertEquals(".not. a", print(new UnaryOp(".not.", A)));
    assertEquals(".not. (a .and. b)",
                 print(new UnaryOp(".not.", bin(".and.", A, B))));
  }

  @Test
  public void testArraySection() {
    Node section = new ArrayRef("x", Arrays.asList(
        new RangeIndex(new Literal(LiteralKind.INTEGER, "2"), null, null),
        new RangeIndex(null, null, null)));
    assertEquals("x(2:, :)", print(section));
  }

  @Test
  public void testDeclaration() {
    Declaration decl = new Declaration(null, TypeSpec.intrinsic("REAL"),
        Intent.INOUT, Arrays.asList("Allocatable"),
        Collections.<Node>emptyList(),
        Arrays.asList(new Entity("x", Arrays.asList(
                              new RangeIndex(null, null, null)), null),
                      new Entity("y", Collections.<Node>emptyList(), null)));
    assertEquals("real, allocatable, intent(inout) :: x(:), y",
                 FortranPrinter.statement(decl));
  }

  @Test
  public void testCall() {
    assertEquals("call flush_all", FortranPrinter.statement(
        new CallStatement(null, "flush_all", Collections.<Node>emptyList())));
    assertEquals("call f(a, b + c)", FortranPrinter.statement(
        new CallStatement(null, "f", Arrays.asList(A, bin("+", B, C)))));
  }

  @Test
  public void testRoutineHeader() {
    Routine f = new Routine(null, RoutineKind.FUNCTION, "scale",
        Arrays.asList("PURE"), Arrays.asList("a", "b"), "r", null,
        Collections.<Node>emptyList(), Collections.<Node>emptyList(),
        Collections.<Node>emptyList());
    assertEquals("pure function scale(a, b) result(r)",
                 FortranPrinter.routineHeader(f));

    Routine s = new Routine(null, RoutineKind.SUBROUTINE, "init",
        Collections.<String>emptyList(), Collections.<String>emptyList(),
        null, null, Collections.<Node>emptyList(),
        Collections.<Node>emptyList(), Collections.<Node>emptyList());
    assertEquals("subroutine init", FortranPrinter.routineHeader(s));
  }
}
