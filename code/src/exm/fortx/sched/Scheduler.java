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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.common.exceptions.SchedulingException;
import exm.fortx.common.exceptions.TransformException;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.Program;
import exm.fortx.ir.ProgramUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.sched.Condensation.Component;

/**
 * Runs passes over the routines of a program in call graph order.
 *
 * For each pass the call graph is condensed into strongly connected
 * components, which are grouped into levels.  Components of a level run
 * concurrently on the worker pool; a level starts when the previous one
 * has finished.  Recursive components are iterated in sorted order until
 * a round leaves every member unchanged.
 */
public class Scheduler {

  private final Logger logger = Logging.getLogger();

  private final Settings settings;
  private final Program program;
  private final CallGraph callGraph;
  private final PassResultCache cache;
  private final ExecutorService workers;
  private final int maxRounds;
  private final long timeoutMs;

  public Scheduler(Settings settings, Program program, CallGraph callGraph,
                   PassResultCache cache, ExecutorService workers)
                                          throws InvalidOptionException {
    this.settings = settings;
    this.program = program;
    this.callGraph = callGraph;
    this.cache = cache;
    this.workers = workers;
    this.maxRounds = settings.getInt(Settings.SCHEDULE_MAX_ROUNDS);
    this.timeoutMs = settings.getLong(Settings.TIMEOUT_MS);
  }

  /**
   * State of one run, shared by the worker tasks
   */
  private static class Run {
    final ScheduleResult result = new ScheduleResult();
    final long deadline;
    volatile boolean stop = false;

    Run(long deadline) {
      this.deadline = deadline;
    }

    boolean stopped() {
      return stop || result.isAborted();
    }
  }

  /**
   * @param roots routines to start from; empty for all routines
   * @param passes passes to run, in order
   * @return outcome; check {@link ScheduleResult#isAborted()}
   * @throws SchedulingException if a recursive cycle doesn't converge
   */
  public ScheduleResult run(List<UnitId> roots, List<Pass> passes)
                                            throws SchedulingException {
    long deadline = timeoutMs > 0 ? System.currentTimeMillis() + timeoutMs
                                  : Long.MAX_VALUE;
    Run run = new Run(deadline);
    List<UnitId> ids = callGraph.reachable(roots);
    logger.debug("Scheduling " + passes.size() + " passes over " +
                 ids.size() + " routines");

    List<CallEdge> unresolved = callGraph.unresolvedEdges(ids);
    for (CallEdge e: unresolved) {
      Logging.uniqueWarn(logger, "Unresolved call to " + e.name() +
             " from " + e.caller() + (e.line() > 0 ? " at line " + e.line()
                                                   : ""));
    }
    run.result.addUnresolvedEdges(unresolved);

    for (int i = 0; i < passes.size(); i++) {
      Pass pass = passes.get(i);
      runPass(run, pass, ids);
      if (run.result.isAborted()) {
        for (Pass skipped: passes.subList(i + 1, passes.size())) {
          for (UnitId id: ids) {
            run.result.addIncomplete(skipped.name(), id);
          }
        }
        break;
      }
    }
    return run.result;
  }

  private void runPass(final Run run, final Pass pass, List<UnitId> ids)
                                            throws SchedulingException {
    Map<UnitId, List<UnitId>> callees = new HashMap<UnitId, List<UnitId>>();
    for (UnitId id: ids) {
      callees.put(id, callGraph.callees(id));
    }
    final Map<UnitId, List<UnitId>> callers = invert(ids, callees);
    Condensation cond = Condensation.compute(ids, callees);
    PassOrder order = pass.readOnly() ? PassOrder.NONE : pass.order();
    List<List<Component>> levels = cond.levels(order);
    logger.debug("Pass " + pass.name() + ": " + cond.components().size() +
                 " components in " + levels.size() + " levels, order " +
                 order);

    final Set<UnitId> done = Collections.newSetFromMap(
                          new ConcurrentHashMap<UnitId, Boolean>());
    for (List<Component> level: levels) {
      List<Future<Void>> futures = new ArrayList<Future<Void>>();
      for (final Component c: level) {
        futures.add(workers.submit(new Callable<Void>() {
          @Override
          public Void call() throws SchedulingException {
            runComponent(run, pass, c, callers, done);
            return null;
          }
        }));
      }
      try {
        awaitAll(futures, run.deadline);
      } catch (TimeoutException e) {
        run.result.setTimedOut();
        cancelAll(run, futures);
        logger.warn("Timed out after " + timeoutMs + "ms in pass " +
                    pass.name());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelAll(run, futures);
        throw new SchedulingException("Interrupted while running pass " +
                                      pass.name(), e);
      } catch (ExecutionException e) {
        cancelAll(run, futures);
        Throwable cause = e.getCause();
        if (cause instanceof SchedulingException) {
          throw (SchedulingException)cause;
        }
        throw new FortxRuntimeError("Internal error in pass " +
            pass.name() + ": " + cause, cause);
      }
      if (run.result.isAborted()) {
        if (run.result.fatal() != null) {
          logger.error("Aborting run: " + run.result.fatal());
        }
        break;
      }
    }

    for (UnitId id: ids) {
      if (!done.contains(id)) {
        run.result.addIncomplete(pass.name(), id);
      }
    }
  }

  private void runComponent(Run run, Pass pass, Component c,
        Map<UnitId, List<UnitId>> callers, Set<UnitId> done)
                                            throws SchedulingException {
    if (!c.isCyclic()) {
      runUnit(run, pass, c.members().get(0), callers);
      done.add(c.members().get(0));
      return;
    }
    for (int round = 1; ; round++) {
      if (round > maxRounds) {
        throw new SchedulingException("Pass " + pass.name() + " did not " +
            "reach a fixed point on recursive routines " + c.members() +
            " within " + maxRounds + " rounds");
      }
      boolean changed = false;
      for (UnitId id: c.members()) {
        if (run.stopped()) {
          return;
        }
        String before = Nodes.fingerprint(program.routine(id));
        runUnit(run, pass, id, callers);
        String after = Nodes.fingerprint(program.routine(id));
        if (!before.equals(after)) {
          changed = true;
        }
      }
      logger.debug("Pass " + pass.name() + " on " + c + ": round " + round
                   + (changed ? " changed" : " reached fixed point"));
      if (!changed) {
        break;
      }
    }
    done.addAll(c.members());
  }

  /**
   * Run a pass on one routine, or reuse its cached result
   */
  private void runUnit(Run run, Pass pass, UnitId id,
                       Map<UnitId, List<UnitId>> callers) {
    if (run.stopped()) {
      return;
    }
    ProgramUnit unit = program.unit(id);
    ReentrantLock lock = cache.lock(id);
    lock.lock();
    try {
      Routine routine = unit.routine().withoutMembers();
      String fp = inputFingerprint(pass, id, routine, callers);
      PassResult cached = cache.get(id, pass.name(), fp);
      if (cached != null) {
        logger.debug("Cached result of " + pass.name() + " on " + id);
        run.result.countCacheHit();
        run.result.addDiagnostics(cached.diagnostics());
        return;
      }

      List<UnitId> unitCallers = callers.get(id);
      PassContext context = new PassContext(logger, settings, program,
          callGraph, id, unit.source(), unitCallers == null ?
                          Collections.<UnitId>emptyList() : unitCallers);
      PassResult r;
      try {
        r = pass.apply(routine, context);
        if (r.changed(routine) && pass.readOnly()) {
          throw new FortxRuntimeError("Read-only pass " + pass.name() +
                                      " changed " + id);
        }
      } catch (TransformException e) {
        fail(run, pass, id, e);
        return;
      } catch (RuntimeException e) {
        fail(run, pass, id, e);
        return;
      }
      run.result.countExecuted();
      run.result.addDiagnostics(r.diagnostics());

      if (r.changed(routine)) {
        for (PassResult.NewRoutine n: r.added()) {
          UnitId added = program.addRoutine(n.sibling, n.routine);
          logger.debug("Pass " + pass.name() + " added " + added);
        }
        if (r.routine() != routine) {
          program.replaceRoutine(id, r.routine());
        }
        logger.debug("Pass " + pass.name() + " rewrote " + id);
        // Passes are idempotent: running again on the output is a no-op
        Routine current = program.routine(id).withoutMembers();
        cache.put(id, pass.name(),
                  inputFingerprint(pass, id, current, callers),
                  PassResult.of(current));
      } else {
        cache.put(id, pass.name(), fp, r);
      }
    } finally {
      lock.unlock();
    }
  }

  private void fail(Run run, Pass pass, UnitId id, Exception e) {
    UnitFailure f = new UnitFailure(pass.name(), id, e,
                                    pass.fatalOnError());
    run.result.addFailure(f);
    if (f.isFatal()) {
      logger.error(f.toString());
    } else {
      logger.warn(f.toString());
    }
    if (!(e instanceof TransformException)) {
      logger.debug("Failure of " + pass.name() + " on " + id, e);
    }
  }

  /**
   * Fingerprint of everything the pass result depends on
   */
  private String inputFingerprint(Pass pass, UnitId id, Routine routine,
                                  Map<UnitId, List<UnitId>> callers) {
    List<String> parts = new ArrayList<String>();
    parts.add(Nodes.fingerprint(routine));
    if (pass.dependsOnCallees()) {
      for (UnitId callee: callGraph.callees(id)) {
        parts.add(callee + "=" + neighbourFingerprint(callee, id, routine));
      }
    }
    if (pass.dependsOnCallers()) {
      List<UnitId> cs = callers.get(id);
      if (cs != null) {
        for (UnitId caller: cs) {
          parts.add(caller + "<" + neighbourFingerprint(caller, id, routine));
        }
      }
    }
    return Nodes.combine(parts);
  }

  private String neighbourFingerprint(UnitId other, UnitId self,
                                      Routine routine) {
    if (other.equals(self)) {
      return Nodes.fingerprint(routine);
    }
    return Nodes.fingerprint(program.routine(other).withoutMembers());
  }

  private static Map<UnitId, List<UnitId>> invert(List<UnitId> ids,
                              Map<UnitId, List<UnitId>> callees) {
    Map<UnitId, List<UnitId>> callers = new HashMap<UnitId, List<UnitId>>();
    for (UnitId id: ids) {
      callers.put(id, new ArrayList<UnitId>());
    }
    for (UnitId caller: ids) {
      for (UnitId callee: callees.get(caller)) {
        List<UnitId> l = callers.get(callee);
        if (l != null) {
          l.add(caller);
        }
      }
    }
    for (List<UnitId> l: callers.values()) {
      Collections.sort(l);
    }
    return callers;
  }

  private static void awaitAll(List<Future<Void>> futures, long deadline)
      throws InterruptedException, ExecutionException, TimeoutException {
    for (Future<Void> f: futures) {
      if (deadline == Long.MAX_VALUE) {
        f.get();
      } else {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0 && !f.isDone()) {
          throw new TimeoutException();
        }
        f.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
      }
    }
  }

  /**
   * Stop outstanding work.  Units already running finish their pass.
   */
  private static void cancelAll(Run run, List<Future<Void>> futures) {
    run.stop = true;
    for (Future<Void> f: futures) {
      f.cancel(false);
    }
  }
}
