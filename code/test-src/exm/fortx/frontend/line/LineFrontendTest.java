package exm.fortx.frontend.line;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.Semaphore;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.FrontendSelector;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Units.Routine;

public class LineFrontendTest {

  private static final String MAIN = source(
      "subroutine s()",
      "  integer :: x",
      "  include 'body.inc'",
      "end subroutine s");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static FrontendOptions expanding(String ...includePath) {
    return new FrontendOptions(Arrays.asList(includePath), true, "",
                               new Semaphore(1));
  }

  @Test
  public void testIncludeExpandedFromPath() throws Exception {
    File inc = tmp.newFolder("inc");
    FileUtils.writeStringToFile(new File(inc, "body.inc"),
        source("  x = 1", "  call f(x)"), StandardCharsets.UTF_8);
    File src = tmp.newFolder("src");

    Routine s = new LineFrontend().parse(
        new File(src, "s.f90").getPath(), MAIN,
        expanding(inc.getPath())).routines().get(0);
    assertEquals(2, s.body().size());
    assertEquals(NodeKind.ASSIGNMENT, s.body().get(0).kind());
    assertEquals(NodeKind.CALL, s.body().get(1).kind());
  }

  @Test
  public void testIncludeKeptWithoutExpansion() throws Exception {
    Routine s = new LineFrontend().parse("s.f90", MAIN,
        new FrontendOptions(Collections.<String>emptyList(), false, "",
                            new Semaphore(1))).routines().get(0);
    assertEquals(2, s.spec().size());
    assertEquals(NodeKind.INTRINSIC, s.spec().get(1).kind());
  }

  @Test
  public void testIncludeNotFound() throws Exception {
    exception.expect(ParseException.class);
    exception.expectMessage("body.inc");
    new LineFrontend().parse(new File(tmp.getRoot(), "s.f90").getPath(),
                             MAIN, expanding());
  }

  @Test
  public void testSelectorOverride() throws Exception {
    Settings settings = Fixtures.settings(
        Settings.FRONTEND_OVERRIDE_PREFIX + "legacy_*.f90", "line");
    FrontendSelector selector = new FrontendSelector(settings);
    assertEquals(Frontend.LINE, selector.select("src/legacy_io.f90"));
    assertEquals(Frontend.ANTLR, selector.select("src/modern.f90"));
  }
}
