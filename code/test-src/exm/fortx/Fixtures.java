package exm.fortx;

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.antlr.AntlrFrontend;
import exm.fortx.frontend.line.LineFrontend;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.session.Session;

/**
 * Shared setup for tests that need a session or a parsed tree
 */
public class Fixtures {

  /**
   * @param keyValues alternating keys and values
   */
  public static Settings settings(String ...keyValues) {
    Settings settings = new Settings();
    settings.set(Settings.WORKERS, "4");
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      settings.set(keyValues[i], keyValues[i + 1]);
    }
    return settings;
  }

  public static Session session(String ...keyValues)
                                          throws InvalidOptionException {
    return new Session(settings(keyValues));
  }

  public static FileNode parseAntlr(String text) throws ParseException {
    return new AntlrFrontend().parse("test.f90", text,
                                     FrontendOptions.defaults());
  }

  public static FileNode parseLine(String text) throws ParseException {
    return new LineFrontend().parse("test.f90", text,
                                    FrontendOptions.defaults());
  }

  /**
   * Join lines with newlines, with a final newline
   */
  public static String source(String ...lines) {
    StringBuilder sb = new StringBuilder();
    for (String line: lines) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }
}
