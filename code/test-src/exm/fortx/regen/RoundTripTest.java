package exm.fortx.regen;

import static exm.fortx.Fixtures.parseAntlr;
import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.fortx.Fixtures;
import exm.fortx.common.exceptions.RegenerationException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.FrontendSelector;
import exm.fortx.ir.Expressions.BinaryOp;
import exm.fortx.ir.Expressions.Literal;
import exm.fortx.ir.Expressions.LiteralKind;
import exm.fortx.ir.Expressions.VariableRef;
import exm.fortx.ir.Node;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.ir.Statements.Pragma;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;

public class RoundTripTest {

  private static final String TEXT = source(
      "! Driver routines",
      "MODULE Driver",
      "contains",
      "",
      "  SUBROUTINE Run(x)   ! entry point",
      "    integer, intent(in) :: x",
      "",
      "    call   start( x )",
      "  END SUBROUTINE Run",
      "end module Driver");

  private static final UnitId RUN = UnitId.parse("driver#run");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private SourceRegenerator regenerator;
  private RoundTripChecker checker;

  @Before
  public void setUp() throws Exception {
    regenerator = new SourceRegenerator();
    checker = new RoundTripChecker(new FrontendSelector(Fixtures.settings()),
                                   FrontendOptions.defaults());
  }

  private static SourceUnit unit(String text) throws Exception {
    return new SourceUnit("driver.f90", text, Frontend.ANTLR,
                          parseAntlr(text));
  }

  private static Node call(String name, String arg) {
    return new CallStatement(null, name,
                      Arrays.<Node>asList(new VariableRef(arg)));
  }

  @Test
  public void testUnchangedVerbatim() throws Exception {
    SourceUnit u = unit(TEXT);
    assertEquals(TEXT, regenerator.regenerate(u));
  }

  @Test
  public void testRewriteKeepsUntouchedText() throws Exception {
    SourceUnit u = unit(TEXT);
    Routine run = (Routine)u.find(RUN);
    List<Node> body = new ArrayList<Node>(run.body());
    body.add(call("finish", "x"));
    u.replaceRoutine(RUN, run.withBody(body));

    String text = regenerator.regenerate(u);
    assertTrue(text, text.startsWith("! Driver routines\nmodule Driver\n"));
    assertTrue(text, text.contains("\n    call   start( x )\n"));
    assertTrue(text, text.contains("\n    call finish(x)\n"));
    assertTrue(text, text.contains("\n  subroutine Run(x)\n"));
    checker.check(u, text);
  }

  @Test
  public void testSynthesizedElseIf() throws Exception {
    SourceUnit u = unit(TEXT);
    Routine run = (Routine)u.find(RUN);
    Node x = new VariableRef("x");
    Node elseIf = new Conditional(null, false, true,
        new BinaryOp(">", x, new Literal(LiteralKind.INTEGER, "1")),
        Arrays.asList(call("many", "x")),
        Arrays.asList(call("none", "x")));
    Node cond = new Conditional(null, false, false,
        new BinaryOp("==", x, new Literal(LiteralKind.INTEGER, "1")),
        Arrays.asList(call("one", "x")),
        Arrays.asList(elseIf));
    u.replaceRoutine(RUN, run.withBody(Arrays.asList(cond)));

    String text = regenerator.regenerate(u);
    assertTrue(text, text.contains(source(
        "    if (x == 1) then",
        "      call one(x)",
        "    else if (x > 1) then",
        "      call many(x)",
        "    else",
        "      call none(x)",
        "    end if")));
    checker.check(u, text);
  }

  @Test
  public void testPragmaIndentedLikeSiblings() throws Exception {
    SourceUnit u = unit(TEXT);
    Routine run = (Routine)u.find(RUN);
    List<Node> body = new ArrayList<Node>();
    body.add(new Pragma(null, "!$omp barrier"));
    body.addAll(run.body());
    u.replaceRoutine(RUN, run.withBody(body));

    String text = regenerator.regenerate(u);
    assertTrue(text, text.contains("\n    !$omp barrier\n"));
    checker.check(u, text);
  }

  @Test
  public void testLongLineWrapped() throws Exception {
    SourceUnit u = unit(TEXT);
    Routine run = (Routine)u.find(RUN);
    List<Node> args = new ArrayList<Node>();
    for (int i = 0; i < 20; i++) {
      args.add(new VariableRef("argument_number_" + i));
    }
    u.replaceRoutine(RUN, run.withBody(Arrays.<Node>asList(
                              new CallStatement(null, "wide", args))));

    String text = regenerator.regenerate(u);
    for (String line: text.split("\n")) {
      assertTrue(line, line.length() <= SourceRegenerator.MAX_LINE);
    }
    assertTrue(text, text.contains(" &\n      & "));
    checker.check(u, text);
  }

  @Test
  public void testBreakPointSkipsLiterals() {
    assertEquals(9, SourceRegenerator.breakPoint("call f(a, 'x y', b)", 14));
    assertEquals(-1, SourceRegenerator.breakPoint("'a b c'", 7));
  }

  @Test
  public void testMismatchDetected() throws Exception {
    SourceUnit u = unit(TEXT);
    Routine run = (Routine)u.find(RUN);
    u.replaceRoutine(RUN, run.withBody(Collections.<Node>emptyList()));
    exception.expect(RegenerationException.class);
    exception.expectMessage("differs");
    checker.check(u, TEXT);
  }
}
