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
package exm.fortx.ui;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.FortxFatal;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.common.exceptions.SchedulingException;
import exm.fortx.lint.Diagnostic;
import exm.fortx.session.ExitCode;
import exm.fortx.session.RunReport;
import exm.fortx.session.Session;

/**
 * Reference driver: load files, run the configured passes, optionally
 * lint, and write the rewritten sources.
 */
public class Main {
  private static final String DEFINE_FLAG = "D";
  private static final String OUTPUT_FLAG = "o";
  private static final String SETTINGS_FLAG = "s";
  private static final String INCLUDE_FLAG = "I";
  private static final String LINT_FLAG = "lint";

  public static void main(String[] args) {
    try {
      System.exit(run(args).code());
    } catch (FortxFatal e) {
      System.exit(e.exitCode);
    }
  }

  /**
   * @return exit code of the run
   * @throws FortxFatal for command line errors
   */
  static ExitCode run(String[] args) {
    Args fxArgs = processArgs(args);
    Settings settings = setupSettings(fxArgs);

    Logger logger;
    try {
      logger = Logging.setupLogging(settings.get(Settings.LOG_FILE),
                                    settings.getBoolean(Settings.LOG_TRACE));
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new FortxFatal(ExitCode.ERROR_COMMAND.code());
    }

    Session session;
    try {
      session = new Session(settings);
    } catch (InvalidOptionException ex) {
      System.err.println("Invalid settings: " + ex.getMessage());
      throw new FortxFatal(ExitCode.ERROR_COMMAND.code());
    }

    try {
      return process(logger, session, fxArgs);
    } catch (RuntimeException e) {
      reportInternalError(e);
      return ExitCode.ERROR_INTERNAL;
    } finally {
      session.close();
    }
  }

  private static ExitCode process(Logger logger, Session session,
                                  Args fxArgs) {
    List<File> files = new ArrayList<File>();
    for (String name: fxArgs.inputFiles) {
      files.add(new File(name));
    }
    session.loadFiles(files);

    boolean aborted = false;
    try {
      session.runPasses();
    } catch (InvalidOptionException e) {
      System.err.println("Invalid settings: " + e.getMessage());
      return ExitCode.ERROR_COMMAND;
    } catch (SchedulingException e) {
      // Already in the report
      logger.debug("Run aborted", e);
      aborted = true;
    }

    if (fxArgs.lint) {
      for (Diagnostic d: session.lint()) {
        System.out.println(d);
      }
    }

    RunReport report = session.report();
    if (fxArgs.outputDir != null && !aborted && report.fatal() == null) {
      File outDir = new File(fxArgs.outputDir);
      if (!outDir.isDirectory() && !outDir.mkdirs()) {
        System.err.println("Could not create output directory " + outDir);
        return ExitCode.ERROR_IO;
      }
      session.writeOutputs(outDir);
    }

    for (String line: report.summary()) {
      System.err.println(line);
    }
    return report.exitCode();
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option define = new Option(DEFINE_FLAG, true,
                               "Set a fortx.* property: -D key=value");
    define.setArgs(2);
    define.setValueSeparator('=');
    opts.addOption(define);

    opts.addOption(OUTPUT_FLAG, "output", true,
                   "Write rewritten sources to this directory");
    opts.addOption(SETTINGS_FLAG, "settings", true,
                   "Load settings from a properties file");
    opts.addOption(INCLUDE_FLAG, "include", true, "Add to include path");
    opts.addOption(new Option(null, LINT_FLAG, false,
                              "Run lint rules and print diagnostics"));
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new FortxFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1) {
      System.err.println("Expected at least one input file");
      usage(opts);
      throw new FortxFatal(ExitCode.ERROR_COMMAND.code());
    }

    List<String> inputs = new ArrayList<String>();
    for (String a: remainingArgs) {
      inputs.add(a);
    }
    List<String> includes = new ArrayList<String>();
    if (cmd.hasOption(INCLUDE_FLAG)) {
      for (String dir: cmd.getOptionValues(INCLUDE_FLAG)) {
        includes.add(dir);
      }
    }
    return new Args(inputs, cmd.getOptionValue(OUTPUT_FLAG),
                    cmd.getOptionValue(SETTINGS_FLAG),
                    cmd.getOptionProperties(DEFINE_FLAG), includes,
                    cmd.hasOption(LINT_FLAG));
  }

  /**
   * Defaults, then settings file, then system properties, then -D and -I
   */
  private static Settings setupSettings(Args fxArgs) {
    Settings settings = new Settings();
    try {
      if (fxArgs.settingsFile != null) {
        settings.load(new File(fxArgs.settingsFile));
      }
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      throw new FortxFatal(ExitCode.ERROR_COMMAND.code());
    }
    settings.loadSystemProperties();
    for (String key: fxArgs.defines.stringPropertyNames()) {
      settings.set(key, fxArgs.defines.getProperty(key));
    }
    if (!fxArgs.includes.isEmpty()) {
      List<String> path = new ArrayList<String>(settings.getIncludePath());
      path.addAll(fxArgs.includes);
      settings.set(Settings.INCLUDE_PATH, String.join(":", path));
    }
    return settings;
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("fortx [options] <file>...", opts);
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("FORTX INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }

  private static class Args {
    public final List<String> inputFiles;
    public final String outputDir;
    public final String settingsFile;
    public final Properties defines;
    public final List<String> includes;
    public final boolean lint;

    public Args(List<String> inputFiles, String outputDir,
                String settingsFile, Properties defines,
                List<String> includes, boolean lint) {
      this.inputFiles = inputFiles;
      this.outputDir = outputDir;
      this.settingsFile = settingsFile;
      this.defines = defines;
      this.includes = includes;
      this.lint = lint;
    }
  }
}
