package exm.fortx.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.fortx.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testDefaultsValid() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.validate();
    assertEquals("ANTLR", settings.get(Settings.FRONTEND_DEFAULT));
    assertEquals(10, settings.getInt(Settings.SCHEDULE_MAX_ROUNDS));
    assertTrue(settings.getBoolean(Settings.REGEN_CHECK_ROUNDTRIP));
    assertTrue(settings.getList(Settings.PASSES).isEmpty());
  }

  @Test
  public void testBadFrontend() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.set(Settings.FRONTEND_DEFAULT, "yacc");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("yacc");
    settings.validate();
  }

  @Test
  public void testFileOverrideChecked() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.set(Settings.FRONTEND_OVERRIDE_PREFIX + "legacy.f", "line");
    settings.set(Settings.FRONTEND_XML_COMMAND, "fparser --xml {file}");
    settings.validate();

    settings.set(Settings.FRONTEND_OVERRIDE_PREFIX + "other.f90", "gcc");
    exception.expect(InvalidOptionException.class);
    settings.validate();
  }

  @Test
  public void testZeroWorkers() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.set(Settings.WORKERS, "0");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.WORKERS);
    settings.validate();
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.set(Settings.REGEN_CHECK_ROUNDTRIP, "yes");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("true or false");
    settings.validate();
  }

  @Test
  public void testSeverityKey() throws InvalidOptionException {
    Settings settings = new Settings();
    settings.set(Settings.RULE_PREFIX + "MISSING-INTENT.severity", "Warning");
    settings.validate();
    settings.set(Settings.RULE_PREFIX + "MISSING-INTENT.severity", "fatal");
    exception.expect(InvalidOptionException.class);
    settings.validate();
  }

  @Test
  public void testLists() {
    Settings settings = new Settings();
    settings.set(Settings.PASSES, " loop-pragmas, ,infer-pure ");
    assertEquals(Arrays.asList("loop-pragmas", "infer-pure"),
                 settings.getList(Settings.PASSES));
    settings.set(Settings.INCLUDE_PATH, "/usr/include::inc");
    assertEquals(Arrays.asList("/usr/include", "inc"),
                 settings.getIncludePath());
  }

  @Test
  public void testLoad() throws Exception {
    File props = tmp.newFile("fortx.properties");
    FileUtils.writeStringToFile(props,
        "fortx.passes = routine-seq\nfortx.workers=3\n",
        StandardCharsets.UTF_8);
    Settings settings = new Settings();
    settings.load(props);
    assertEquals(Arrays.asList("routine-seq"),
                 settings.getList(Settings.PASSES));
    assertEquals(3, settings.getInt(Settings.WORKERS));
    assertFalse(settings.getBoolean(Settings.LOG_TRACE));
  }

  @Test
  public void testLoadMissing() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    new Settings().load(new File(tmp.getRoot(), "absent.properties"));
  }
}
