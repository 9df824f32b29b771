package exm.fortx.session;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.lint.Severity;

public class SessionTest {

  private static final String LOOP = source(
      "subroutine zero(a, n)",
      "  integer, intent(in) :: n",
      "  real, intent(out) :: a(n)",
      "  integer :: i",
      "  do i = 1, n",
      "    a(i) = 0.0",
      "  end do",
      "end subroutine zero");

  private static final String CALLER = source(
      "subroutine caller(b)",
      "  real, intent(out) :: b(4)",
      "  call zero(b, 4)",
      "end subroutine caller");

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File write(String name, String text) throws Exception {
    File f = tmp.newFile(name);
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  @Test
  public void testLoadInArgumentOrder() throws Exception {
    File a = write("caller.f90", CALLER);
    File b = write("zero.f90", LOOP);
    try (Session session = Fixtures.session()) {
      List<SourceUnit> loaded = session.loadFiles(Arrays.asList(a, b));
      assertEquals(2, loaded.size());
      assertEquals(a.getPath(), session.program().sources().get(0).path());
      assertEquals(b.getPath(), session.program().sources().get(1).path());
      // Resolved across files on load
      assertEquals(Arrays.asList(UnitId.external("zero")),
          session.callGraph().callees(UnitId.external("caller")));
      assertEquals(ExitCode.SUCCESS, session.report().exitCode());
    }
  }

  @Test
  public void testParseFailureIsolated() throws Exception {
    File good = write("zero.f90", LOOP);
    File bad = write("bad.f90", source("subroutine (", "end"));
    try (Session session = Fixtures.session()) {
      List<SourceUnit> loaded = session.loadFiles(Arrays.asList(bad, good));
      assertEquals(1, loaded.size());
      assertEquals(1, session.report().parseFailures().size());
      assertEquals(ExitCode.ERROR_PARSER, session.report().exitCode());
    }
  }

  @Test
  public void testMissingFile() throws Exception {
    try (Session session = Fixtures.session()) {
      session.loadFiles(Arrays.asList(new File(tmp.getRoot(), "gone.f90")));
      assertEquals(1, session.report().ioFailures().size());
      assertEquals(ExitCode.ERROR_IO, session.report().exitCode());
    }
  }

  @Test
  public void testWriteOutputs() throws Exception {
    File zero = write("zero.f90", LOOP);
    File caller = write("caller.f90", CALLER);
    File out = tmp.newFolder("out");
    try (Session session = Fixtures.session(Settings.PASSES,
                                            "loop-pragmas")) {
      session.loadFiles(Arrays.asList(zero, caller));
      session.runPasses();
      session.writeOutputs(out);

      String rewritten = FileUtils.readFileToString(
          new File(out, "zero.f90"), StandardCharsets.UTF_8);
      assertTrue(rewritten, rewritten.contains(
          "  !$acc parallel loop\n  do i = 1, n\n"));
      assertEquals(CALLER, FileUtils.readFileToString(
          new File(out, "caller.f90"), StandardCharsets.UTF_8));
      assertTrue(session.report().regenerationFailures().isEmpty());
      assertEquals(ExitCode.SUCCESS, session.report().exitCode());
    }
  }

  @Test
  public void testLintErrorsSetExitCode() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("loose.f90", source(
          "subroutine loose(x)",
          "  implicit none",
          "  real :: x",
          "  x = 1.0",
          "end subroutine loose"));
      session.resolve();
      session.lint();
      assertEquals(1, session.report().count(
                          Severity.ERROR));
      assertEquals(ExitCode.ERROR_LINT, session.report().exitCode());
    }
  }

  @Test
  public void testSummaryListsProblems() throws Exception {
    File bad = write("bad.f90", source("subroutine (", "end"));
    try (Session session = Fixtures.session()) {
      session.loadFiles(Arrays.asList(bad));
      List<String> summary = session.report().summary();
      assertEquals(1, summary.size());
      assertTrue(summary.get(0), summary.get(0).startsWith("parse error: "));
    }
  }
}
