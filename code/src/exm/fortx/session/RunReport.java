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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import exm.fortx.common.exceptions.FortxException;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.common.exceptions.RegenerationException;
import exm.fortx.common.exceptions.SchedulingException;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Severity;
import exm.fortx.resolve.ResolutionWarning;
import exm.fortx.sched.CallEdge;
import exm.fortx.sched.ScheduleResult;
import exm.fortx.sched.UnitFailure;

/**
 * Everything that went wrong, or was found, during a session
 */
public class RunReport {
  private final List<ParseException> parseFailures =
                                  new ArrayList<ParseException>();
  private final List<FortxException> ioFailures =
                                  new ArrayList<FortxException>();
  private final List<ResolutionWarning> resolutionWarnings =
                                  new ArrayList<ResolutionWarning>();
  private final List<UnitFailure> unitFailures = new ArrayList<UnitFailure>();
  private UnitFailure fatal = null;
  private SchedulingException schedulingError = null;
  private boolean timedOut = false;
  private final List<CallEdge> unresolvedEdges = new ArrayList<CallEdge>();
  private final Set<String> incomplete = new TreeSet<String>();
  private final List<RegenerationException> regenerationFailures =
                                  new ArrayList<RegenerationException>();
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  synchronized void addParseFailure(ParseException e) {
    parseFailures.add(e);
  }

  synchronized void addIoFailure(FortxException e) {
    ioFailures.add(e);
  }

  synchronized void addResolutionWarnings(List<ResolutionWarning> warnings) {
    resolutionWarnings.addAll(warnings);
  }

  synchronized void addSchedule(ScheduleResult result) {
    unitFailures.addAll(result.failures());
    if (fatal == null) {
      fatal = result.fatal();
    }
    timedOut = timedOut || result.timedOut();
    unresolvedEdges.addAll(result.unresolvedEdges());
    incomplete.addAll(result.incomplete());
    diagnostics.addAll(result.diagnostics());
  }

  synchronized void setSchedulingError(SchedulingException e) {
    schedulingError = e;
  }

  synchronized void addRegenerationFailure(RegenerationException e) {
    regenerationFailures.add(e);
  }

  synchronized void addDiagnostics(List<Diagnostic> ds) {
    diagnostics.addAll(ds);
  }

  public synchronized List<ParseException> parseFailures() {
    return new ArrayList<ParseException>(parseFailures);
  }

  public synchronized List<FortxException> ioFailures() {
    return new ArrayList<FortxException>(ioFailures);
  }

  public synchronized List<ResolutionWarning> resolutionWarnings() {
    return new ArrayList<ResolutionWarning>(resolutionWarnings);
  }

  public synchronized List<UnitFailure> unitFailures() {
    return new ArrayList<UnitFailure>(unitFailures);
  }

  /**
   * @return failure of a fatal pass that aborted the run, or null
   */
  public synchronized UnitFailure fatal() {
    return fatal;
  }

  public synchronized SchedulingException schedulingError() {
    return schedulingError;
  }

  public synchronized boolean timedOut() {
    return timedOut;
  }

  public synchronized List<CallEdge> unresolvedEdges() {
    return new ArrayList<CallEdge>(unresolvedEdges);
  }

  /**
   * @return pass:unit pairs that were not run to completion
   */
  public synchronized Set<String> incomplete() {
    return new TreeSet<String>(incomplete);
  }

  public synchronized List<RegenerationException> regenerationFailures() {
    return new ArrayList<RegenerationException>(regenerationFailures);
  }

  /**
   * @return pass and lint diagnostics, sorted
   */
  public synchronized List<Diagnostic> diagnostics() {
    List<Diagnostic> result = new ArrayList<Diagnostic>(diagnostics);
    Collections.sort(result);
    return result;
  }

  public synchronized int count(Severity severity) {
    int n = 0;
    for (Diagnostic d: diagnostics) {
      if (d.severity() == severity) {
        n++;
      }
    }
    return n;
  }

  /**
   * Most serious problem first: internal errors are thrown rather than
   * reported, so they never get here.
   */
  public synchronized ExitCode exitCode() {
    if (schedulingError != null || timedOut) {
      return ExitCode.ERROR_SCHEDULING;
    } else if (fatal != null) {
      return ExitCode.ERROR_TRANSFORM;
    } else if (!ioFailures.isEmpty()) {
      return ExitCode.ERROR_IO;
    } else if (!parseFailures.isEmpty()) {
      return ExitCode.ERROR_PARSER;
    } else if (!regenerationFailures.isEmpty()) {
      return ExitCode.ERROR_REGENERATION;
    } else if (count(Severity.ERROR) > 0) {
      return ExitCode.ERROR_LINT;
    }
    return ExitCode.SUCCESS;
  }

  /**
   * @return one line per problem, for the driver's summary
   */
  public synchronized List<String> summary() {
    List<String> lines = new ArrayList<String>();
    for (FortxException e: ioFailures) {
      lines.add("error: " + e.getMessage());
    }
    for (ParseException e: parseFailures) {
      lines.add("parse error: " + e.getMessage());
    }
    for (ResolutionWarning w: resolutionWarnings) {
      lines.add("warning: " + w);
    }
    for (UnitFailure f: unitFailures) {
      lines.add((f.isFatal() ? "fatal: " : "error: ") + f);
    }
    if (schedulingError != null) {
      lines.add("scheduling error: " + schedulingError.getMessage());
    }
    if (timedOut) {
      lines.add("timed out, " + incomplete.size() + " units incomplete");
    }
    for (RegenerationException e: regenerationFailures) {
      lines.add("rewrite discarded: " + e.getMessage());
    }
    return lines;
  }
}
