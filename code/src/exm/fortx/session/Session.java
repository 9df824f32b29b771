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
package exm.fortx.session;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.FortxException;
import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.common.exceptions.RegenerationException;
import exm.fortx.common.exceptions.SchedulingException;
import exm.fortx.frontend.FrontendAdapter;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.FrontendSelector;
import exm.fortx.ir.Program;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Linter;
import exm.fortx.lint.RuleRegistry;
import exm.fortx.passes.PassRegistry;
import exm.fortx.regen.RoundTripChecker;
import exm.fortx.regen.SourceRegenerator;
import exm.fortx.resolve.Resolver;
import exm.fortx.sched.CallGraph;
import exm.fortx.sched.Pass;
import exm.fortx.sched.PassResultCache;
import exm.fortx.sched.ScheduleResult;
import exm.fortx.sched.Scheduler;

/**
 * One run of the toolbox: the loaded program and everything derived
 * from it.  Nothing is shared between sessions except log4j setup.
 *
 * Typical use: {@link #loadFiles(List)}, then {@link #runPasses()} and
 * {@link #lint()}, then {@link #regenerateAll()}, then check
 * {@link #report()}.
 */
public class Session implements AutoCloseable {

  private final Logger logger = Logging.getLogger();

  private final Settings settings;
  private final ExecutorService workers;
  private final Semaphore processLimiter;
  private final FrontendSelector frontends;
  private final FrontendOptions frontendOptions;

  private final Program program = new Program();
  private final Resolver resolver = new Resolver();
  private final CallGraph callGraph;
  private final PassResultCache cache = new PassResultCache();
  private final PassRegistry passRegistry;
  private final RuleRegistry ruleRegistry;

  private final SourceRegenerator regenerator = new SourceRegenerator();
  private final RoundTripChecker roundTrip;
  private final boolean checkRoundTrip;

  private final RunReport report = new RunReport();

  public Session(Settings settings) throws InvalidOptionException {
    settings.validate();
    this.settings = settings;
    this.workers = Executors.newFixedThreadPool(
                                settings.getInt(Settings.WORKERS));
    this.processLimiter = new Semaphore(
                                settings.getInt(Settings.MAX_PROCESSES));
    this.frontends = new FrontendSelector(settings);
    this.frontendOptions = FrontendOptions.fromSettings(settings,
                                                        processLimiter);
    this.callGraph = new CallGraph(program);
    this.passRegistry = PassRegistry.standard(settings);
    this.ruleRegistry = RuleRegistry.standard(settings);
    this.roundTrip = new RoundTripChecker(frontends, frontendOptions);
    this.checkRoundTrip = settings.getBoolean(Settings.REGEN_CHECK_ROUNDTRIP);

    // Scopes are rebuilt before edges are recomputed from them
    program.addListener(resolver);
    program.addListener(callGraph);
    program.addListener(cache);
  }

  /**
   * Parse files concurrently, add those that parsed to the program in
   * argument order, and resolve the program.  Files that fail to read
   * or parse are recorded in the report and left out.
   * @return units loaded
   */
  public List<SourceUnit> loadFiles(List<File> files) {
    List<Future<SourceUnit>> futures = new ArrayList<Future<SourceUnit>>();
    for (final File file: files) {
      futures.add(workers.submit(new Callable<SourceUnit>() {
        @Override
        public SourceUnit call() throws IOException, ParseException {
          String text = FileUtils.readFileToString(file,
                                                  StandardCharsets.UTF_8);
          return parseUnit(file.getPath(), text);
        }
      }));
    }

    List<SourceUnit> loaded = new ArrayList<SourceUnit>();
    for (int i = 0; i < files.size(); i++) {
      String path = files.get(i).getPath();
      try {
        loaded.add(futures.get(i).get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FortxRuntimeError("Interrupted while loading " + path, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ParseException) {
          logger.error(cause.getMessage());
          report.addParseFailure((ParseException)cause);
        } else if (cause instanceof IOException) {
          logger.error("Could not read " + path + ": " + cause.getMessage());
          report.addIoFailure(new FortxException(path, 0, 0,
                              "could not read: " + cause.getMessage(), cause));
        } else {
          throw new FortxRuntimeError("Internal error parsing " + path +
                                      ": " + cause, cause);
        }
      }
    }
    for (SourceUnit unit: loaded) {
      program.add(unit);
    }
    resolve();
    return loaded;
  }

  /**
   * Parse text and add it to the program, without resolving
   * @throws ParseException
   */
  public SourceUnit addSource(String path, String text)
                                            throws ParseException {
    SourceUnit unit = parseUnit(path, text);
    program.add(unit);
    return unit;
  }

  private SourceUnit parseUnit(String path, String text)
                                            throws ParseException {
    FrontendAdapter adapter = frontends.adapterFor(path);
    logger.debug("Parsing " + path + " with " + adapter.frontend());
    FileNode root = adapter.parse(path, text, frontendOptions);
    return new SourceUnit(path, text, adapter.frontend(), root);
  }

  /**
   * Resolve every loaded unit from scratch
   */
  public void resolve() {
    resolver.resolveAll(program.sources());
    for (SourceUnit unit: program.sources()) {
      if (unit.resolution() != null) {
        report.addResolutionWarnings(unit.resolution().warnings());
      }
    }
  }

  /**
   * Run the passes named in fortx.passes from the roots in fortx.roots
   */
  public ScheduleResult runPasses() throws InvalidOptionException,
                                           SchedulingException {
    List<UnitId> roots = new ArrayList<UnitId>();
    for (String root: settings.getList(Settings.ROOTS)) {
      roots.add(UnitId.parse(root));
    }
    return runPasses(roots, passRegistry.selected(settings));
  }

  /**
   * @param roots routines to start from, empty for all
   * @throws SchedulingException after recording it in the report
   */
  public ScheduleResult runPasses(List<UnitId> roots, List<Pass> passes)
                      throws InvalidOptionException, SchedulingException {
    if (passes.isEmpty()) {
      return new ScheduleResult();
    }
    Scheduler scheduler = new Scheduler(settings, program, callGraph, cache,
                                        workers);
    ScheduleResult result;
    try {
      result = scheduler.run(roots, passes);
    } catch (SchedulingException e) {
      logger.error(e.getMessage());
      report.setSchedulingError(e);
      throw e;
    }
    report.addSchedule(result);
    logger.debug("Passes done: " + result.executed() + " executed, " +
                 result.cacheHits() + " cached");
    return result;
  }

  /**
   * Lint all loaded units, one task per unit
   * @return diagnostics of all units, sorted
   */
  public List<Diagnostic> lint() {
    final Linter linter = new Linter(ruleRegistry, settings);
    List<Future<List<Diagnostic>>> futures =
                        new ArrayList<Future<List<Diagnostic>>>();
    for (final SourceUnit unit: program.sources()) {
      futures.add(workers.submit(new Callable<List<Diagnostic>>() {
        @Override
        public List<Diagnostic> call() {
          return linter.lint(unit);
        }
      }));
    }
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Future<List<Diagnostic>> f: futures) {
      try {
        result.addAll(f.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FortxRuntimeError("Interrupted while linting", e);
      } catch (ExecutionException e) {
        throw new FortxRuntimeError("Internal error while linting: " +
                                    e.getCause(), e.getCause());
      }
    }
    Collections.sort(result);
    report.addDiagnostics(result);
    return result;
  }

  /**
   * Text for the current tree of a unit.  If the round trip check fails,
   * the failure is reported and the original text is returned instead.
   */
  public String regenerate(SourceUnit unit) {
    String text = regenerator.regenerate(unit);
    if (!checkRoundTrip || unit.root().span() != null) {
      return text;
    }
    try {
      roundTrip.check(unit, text);
      return text;
    } catch (RegenerationException e) {
      logger.warn("Discarding rewrite of " + unit.path() + ": " +
                  e.getMessage());
      report.addRegenerationFailure(e);
      return unit.text();
    }
  }

  /**
   * @return regenerated text by path, in load order
   */
  public Map<String, String> regenerateAll() {
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (SourceUnit unit: program.sources()) {
      result.put(unit.path(), regenerate(unit));
    }
    return result;
  }

  /**
   * Write regenerated units into a directory, under their file names
   */
  public void writeOutputs(File outDir) {
    for (Map.Entry<String, String> e: regenerateAll().entrySet()) {
      File out = new File(outDir, FilenameUtils.getName(e.getKey()));
      try {
        FileUtils.writeStringToFile(out, e.getValue(),
                                    StandardCharsets.UTF_8);
        logger.debug("Wrote " + out);
      } catch (IOException ex) {
        logger.error("Could not write " + out + ": " + ex.getMessage());
        report.addIoFailure(new FortxException(out.getPath(), 0, 0,
                            "could not write: " + ex.getMessage(), ex));
      }
    }
  }

  public Settings settings() {
    return settings;
  }

  public Program program() {
    return program;
  }

  public Resolver resolver() {
    return resolver;
  }

  public CallGraph callGraph() {
    return callGraph;
  }

  public PassResultCache cache() {
    return cache;
  }

  public PassRegistry passRegistry() {
    return passRegistry;
  }

  public RuleRegistry ruleRegistry() {
    return ruleRegistry;
  }

  public RunReport report() {
    return report;
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        logger.warn("Worker threads still running at session close");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }
}
