package exm.fortx.ui;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.fortx.common.exceptions.FortxFatal;
import exm.fortx.session.ExitCode;

public class MainTest {

  private static final String PURE_CANDIDATE = source(
      "subroutine twice(x, y)",
      "  implicit none",
      "  real, intent(in) :: x",
      "  real, intent(out) :: y",
      "  y = 2.0 * x",
      "end subroutine twice");

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testRewriteToOutputDir() throws Exception {
    File in = tmp.newFile("twice.f90");
    FileUtils.writeStringToFile(in, PURE_CANDIDATE, StandardCharsets.UTF_8);
    File out = new File(tmp.getRoot(), "out");

    ExitCode code = Main.run(new String[] {
        "-Dfortx.passes=infer-pure", "-Dfortx.workers=2",
        "-o", out.getPath(), "--lint", in.getPath()});
    assertEquals(ExitCode.SUCCESS, code);
    String text = FileUtils.readFileToString(new File(out, "twice.f90"),
                                             StandardCharsets.UTF_8);
    assertTrue(text, text.startsWith("pure subroutine twice(x, y)\n"));
  }

  @Test
  public void testSettingsFile() throws Exception {
    File in = tmp.newFile("twice.f90");
    FileUtils.writeStringToFile(in, PURE_CANDIDATE, StandardCharsets.UTF_8);
    File props = tmp.newFile("fortx.properties");
    FileUtils.writeStringToFile(props, "fortx.frontend.default=banana\n",
                                StandardCharsets.UTF_8);
    try {
      Main.run(new String[] {"-s", props.getPath(), in.getPath()});
    } catch (FortxFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
      return;
    }
    throw new AssertionError("Expected invalid settings to be rejected");
  }

  @Test
  public void testNoInputs() {
    try {
      Main.run(new String[0]);
    } catch (FortxFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
      return;
    }
    throw new AssertionError("Expected missing inputs to be rejected");
  }

  @Test
  public void testParseErrorExitCode() throws Exception {
    File in = tmp.newFile("bad.f90");
    FileUtils.writeStringToFile(in, source("subroutine (", "end"),
                                StandardCharsets.UTF_8);
    assertEquals(ExitCode.ERROR_PARSER, Main.run(new String[] {in.getPath()}));
  }
}
