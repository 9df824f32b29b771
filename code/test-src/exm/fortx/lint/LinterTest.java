package exm.fortx.lint;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.rules.ImplicitNoneRule;
import exm.fortx.lint.rules.MissingIntentRule;
import exm.fortx.lint.rules.NestingDepthRule;
import exm.fortx.session.ExitCode;
import exm.fortx.session.Session;

public class LinterTest {

  private static final String MISSING = source(
      "subroutine s(a, b, c)",
      "  implicit none",
      "  integer, intent(in) :: a, b",
      "  real :: c",
      "  c = a + b",
      "end subroutine s");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static List<Diagnostic> lint(Session session, String text)
                                                    throws Exception {
    session.addSource("s.f90", text);
    session.resolve();
    return session.lint();
  }

  @Test
  public void testMissingIntent() throws Exception {
    try (Session session = Fixtures.session()) {
      List<Diagnostic> ds = lint(session, MISSING);
      assertEquals(ds.toString(), 1, ds.size());
      Diagnostic d = ds.get(0);
      assertEquals(MissingIntentRule.ID, d.ruleId());
      assertEquals(Severity.ERROR, d.severity());
      assertEquals(4, d.line());
      assertEquals(4, d.span().endLine());
      assertTrue(d.message(), d.message().contains("c of s"));
      assertEquals(ExitCode.ERROR_LINT, session.report().exitCode());
    }
  }

  @Test
  public void testSuppressedOnOneLine() throws Exception {
    try (Session session = Fixtures.session()) {
      List<Diagnostic> ds = lint(session, source(
          "subroutine s(a, b)",
          "  implicit none",
          "  real :: a  ! fortx-lint: disable=MISSING-INTENT",
          "  real :: b",
          "  b = a",
          "end subroutine s"));
      assertEquals(ds.toString(), 1, ds.size());
      assertEquals(4, ds.get(0).line());
    }
  }

  @Test
  public void testMarkerOnOwnLineCoversNextStatement() throws Exception {
    try (Session session = Fixtures.session()) {
      List<Diagnostic> ds = lint(session, source(
          "subroutine s(a)",
          "  implicit none",
          "  ! fortx-lint: disable=all",
          "  real :: a",
          "  a = 1.0",
          "end subroutine s"));
      assertTrue(ds.toString(), ds.isEmpty());
    }
  }

  private static final String DEEP_NEST = source(
      "subroutine s(a, n)",
      "  implicit none",
      "  integer, intent(in) :: n",
      "  real, intent(inout) :: a",
      "  integer :: i, j, k, l",
      "  do i = 1, n",
      "    do j = 1, n",
      "      do k = 1, n",
      "        %s",
      "        do l = 1, n",
      "          a = a + 1.0",
      "          a = a * 2.0  %s",
      "        end do",
      "      end do",
      "    end do",
      "  end do",
      "end subroutine s");

  @Test
  public void testMarkerInsideLoopKeepsConstructDiagnostic()
                                                    throws Exception {
    try (Session session = Fixtures.session(Settings.RULES,
                                            NestingDepthRule.ID)) {
      List<Diagnostic> ds = lint(session, String.format(DEEP_NEST,
          "a = a - 1.0", "! fortx-lint: disable=NESTING-DEPTH"));
      assertEquals(ds.toString(), 1, ds.size());
      assertEquals(NestingDepthRule.ID, ds.get(0).ruleId());
      assertEquals(10, ds.get(0).line());
    }
  }

  @Test
  public void testMarkerOnLoopHeaderSuppresses() throws Exception {
    try (Session session = Fixtures.session(Settings.RULES,
                                            NestingDepthRule.ID)) {
      List<Diagnostic> ds = lint(session, String.format(DEEP_NEST,
          "! fortx-lint: disable=NESTING-DEPTH", ""));
      assertTrue(ds.toString(), ds.isEmpty());
    }
  }

  @Test
  public void testSuppressionBeatsEscalation() throws Exception {
    String text = source(
        "! fortx-lint: disable=IMPLICIT-NONE",
        "subroutine quiet()",
        "  x = 1",
        "end subroutine quiet",
        "subroutine loud()",
        "  x = 1",
        "end subroutine loud");
    try (Session session = Fixtures.session(
          Settings.RULE_PREFIX + ImplicitNoneRule.ID + ".severity", "error")) {
      List<Diagnostic> ds = lint(session, text);
      assertEquals(ds.toString(), 1, ds.size());
      assertEquals(Severity.ERROR, ds.get(0).severity());
      assertEquals("subroutine loud has no implicit none",
                   ds.get(0).message());
    }
  }

  @Test
  public void testSeverityOff() throws Exception {
    try (Session session = Fixtures.session(
          Settings.RULE_PREFIX + MissingIntentRule.ID + ".severity", "off")) {
      assertTrue(lint(session, MISSING).isEmpty());
      assertEquals(ExitCode.SUCCESS, session.report().exitCode());
    }
  }

  @Test
  public void testDowngradedSeverity() throws Exception {
    try (Session session = Fixtures.session(
        Settings.RULE_PREFIX + MissingIntentRule.ID + ".severity", "info")) {
      List<Diagnostic> ds = lint(session, MISSING);
      assertEquals(Severity.INFO, ds.get(0).severity());
      assertEquals(ExitCode.SUCCESS, session.report().exitCode());
    }
  }

  @Test
  public void testRuleSelection() throws Exception {
    try (Session session = Fixtures.session(Settings.RULES,
                                            ImplicitNoneRule.ID)) {
      List<Diagnostic> ds = lint(session, source(
          "subroutine s(a)",
          "  real :: a",
          "  a = 1.0",
          "end subroutine s"));
      assertEquals(1, ds.size());
      assertEquals(ImplicitNoneRule.ID, ds.get(0).ruleId());
    }
  }

  @Test
  public void testUnknownRule() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("NO-SUCH-RULE");
    RuleRegistry.standard(Fixtures.settings(Settings.RULES,
                          "IMPLICIT-NONE, NO-SUCH-RULE"));
  }

  @Test
  public void testBadSeverity() throws Exception {
    exception.expect(InvalidOptionException.class);
    Fixtures.session(Settings.RULE_PREFIX + "NESTING-DEPTH.severity",
                     "loud");
  }

  @Test
  public void testDiagnosticsSorted() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit unit = session.addSource("s.f90", source(
          "subroutine s(a)",
          "  real :: a",
          "  stop",
          "end subroutine s"));
      session.resolve();
      Linter linter = new Linter(session.ruleRegistry(), session.settings());
      List<Diagnostic> ds = linter.lint(unit);
      for (int i = 1; i < ds.size(); i++) {
        assertTrue(ds.get(i - 1).line() <= ds.get(i).line());
      }
      assertEquals(3, ds.size());
      Routine s = session.program().routine(UnitId.external("s"));
      assertEquals(s.span().startLine(), ds.get(0).line());
    }
  }
}
