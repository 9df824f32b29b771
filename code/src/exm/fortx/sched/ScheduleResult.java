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
package exm.fortx.sched;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import exm.fortx.lint.Diagnostic;

/**
 * Everything a scheduler run produced apart from the rewritten trees
 */
public class ScheduleResult {
  private final List<UnitFailure> failures = new ArrayList<UnitFailure>();
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private final List<CallEdge> unresolvedEdges = new ArrayList<CallEdge>();
  /** "pass:unit" for units not run before an abort */
  private final Set<String> incomplete = new TreeSet<String>();
  private UnitFailure fatal = null;
  private boolean timedOut = false;
  private int executed = 0;
  private int cacheHits = 0;

  synchronized void addFailure(UnitFailure f) {
    failures.add(f);
    if (f.isFatal() && fatal == null) {
      fatal = f;
    }
  }

  synchronized void addDiagnostics(List<Diagnostic> ds) {
    diagnostics.addAll(ds);
  }

  synchronized void addUnresolvedEdges(List<CallEdge> edges) {
    unresolvedEdges.addAll(edges);
  }

  synchronized void addIncomplete(String pass, Object unit) {
    incomplete.add(pass + ":" + unit);
  }

  synchronized void setTimedOut() {
    timedOut = true;
  }

  synchronized void countExecuted() {
    executed++;
  }

  synchronized void countCacheHit() {
    cacheHits++;
  }

  public synchronized List<UnitFailure> failures() {
    return Collections.unmodifiableList(new ArrayList<UnitFailure>(failures));
  }

  /**
   * @return first fatal failure, or null
   */
  public synchronized UnitFailure fatal() {
    return fatal;
  }

  public synchronized boolean isAborted() {
    return fatal != null || timedOut;
  }

  public synchronized boolean timedOut() {
    return timedOut;
  }

  public synchronized List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(
                          new ArrayList<Diagnostic>(diagnostics));
  }

  public synchronized List<CallEdge> unresolvedEdges() {
    return Collections.unmodifiableList(
                          new ArrayList<CallEdge>(unresolvedEdges));
  }

  public synchronized Set<String> incomplete() {
    return Collections.unmodifiableSet(new TreeSet<String>(incomplete));
  }

  /**
   * @return number of times a pass actually ran on a unit
   */
  public synchronized int executed() {
    return executed;
  }

  public synchronized int cacheHits() {
    return cacheHits;
  }
}
