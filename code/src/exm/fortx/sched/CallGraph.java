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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.fortx.common.Logging;
import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.Program;
import exm.fortx.ir.Program.ReplacementListener;
import exm.fortx.ir.ProgramUnit;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.resolve.Resolution;
import exm.fortx.resolve.Symbol;
import exm.fortx.resolve.SymbolKind;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Visitor;
import exm.fortx.walk.WalkContext;
import exm.fortx.walk.Walker;

/**
 * Calls between routines of a program.  Edges of a routine are found on
 * first use and cached against the routine's fingerprint, so a replaced
 * routine gets its edges recomputed.  Call sites whose target isn't a
 * loaded routine are kept as unresolved edges.
 */
public class CallGraph implements ReplacementListener {

  private final Logger logger = Logging.getLogger();

  private final Program program;

  private static class Entry {
    final String fingerprint;
    final List<CallEdge> edges;

    Entry(String fingerprint, List<CallEdge> edges) {
      this.fingerprint = fingerprint;
      this.edges = edges;
    }
  }

  private final ConcurrentMap<UnitId, Entry> edges =
                        new ConcurrentHashMap<UnitId, Entry>();
  private final ConcurrentMap<UnitId, ReentrantLock> locks =
                        new ConcurrentHashMap<UnitId, ReentrantLock>();

  public CallGraph(Program program) {
    this.program = program;
  }

  /**
   * @return all call sites in a routine, contained routines excluded,
   *         in source order
   */
  public List<CallEdge> edges(UnitId caller) {
    ProgramUnit unit = program.unit(caller);
    if (unit == null || unit.isModule()) {
      return Collections.emptyList();
    }
    ReentrantLock lock = lock(caller);
    lock.lock();
    try {
      Routine routine = unit.routine().withoutMembers();
      String fp = Nodes.fingerprint(routine);
      Entry e = edges.get(caller);
      if (e != null && e.fingerprint.equals(fp)) {
        return e.edges;
      }
      List<CallEdge> computed = findEdges(caller, unit.source(), routine);
      edges.put(caller, new Entry(fp, computed));
      if (logger.isTraceEnabled()) {
        logger.trace("Call edges of " + caller + ": " + computed);
      }
      return computed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return distinct resolved callees, sorted
   */
  public List<UnitId> callees(UnitId caller) {
    Set<UnitId> result = new TreeSet<UnitId>();
    for (CallEdge e: edges(caller)) {
      if (e.isResolved()) {
        result.add(e.callee());
      }
    }
    return new ArrayList<UnitId>(result);
  }

  /**
   * @return true if the routine calls itself
   */
  public boolean callsItself(UnitId id) {
    for (CallEdge e: edges(id)) {
      if (id.equals(e.callee())) {
        return true;
      }
    }
    return false;
  }

  /**
   * Routines reachable from roots over resolved edges, roots included
   * @param roots if empty, all routines of the program
   * @return sorted ids
   */
  public List<UnitId> reachable(Collection<UnitId> roots) {
    if (roots.isEmpty()) {
      return program.routineIds();
    }
    Set<UnitId> seen = new TreeSet<UnitId>();
    Deque<UnitId> work = new ArrayDeque<UnitId>();
    for (UnitId r: roots) {
      if (program.unit(r) == null || program.unit(r).isModule()) {
        logger.warn("Root " + r + " is not a loaded routine, ignored");
        continue;
      }
      if (seen.add(r)) {
        work.push(r);
      }
    }
    while (!work.isEmpty()) {
      UnitId curr = work.pop();
      for (UnitId callee: callees(curr)) {
        if (seen.add(callee)) {
          work.push(callee);
        }
      }
    }
    return new ArrayList<UnitId>(seen);
  }

  /**
   * @return unresolved call sites of the given routines
   */
  public List<CallEdge> unresolvedEdges(Collection<UnitId> ids) {
    List<CallEdge> result = new ArrayList<CallEdge>();
    for (UnitId id: ids) {
      for (CallEdge e: edges(id)) {
        if (!e.isResolved()) {
          result.add(e);
        }
      }
    }
    return result;
  }

  public void invalidate(UnitId id) {
    edges.remove(id);
  }

  @Override
  public void routineReplaced(SourceUnit source, UnitId id,
                              Routine oldRoutine, Routine newRoutine) {
    invalidate(id);
  }

  @Override
  public void routineAdded(SourceUnit source, UnitId id, Routine routine) {
    invalidate(id);
  }

  private ReentrantLock lock(UnitId id) {
    ReentrantLock lock = locks.get(id);
    if (lock == null) {
      ReentrantLock newLock = new ReentrantLock();
      lock = locks.putIfAbsent(id, newLock);
      if (lock == null) {
        lock = newLock;
      }
    }
    return lock;
  }

  private List<CallEdge> findEdges(final UnitId caller, SourceUnit source,
                                   Routine routine) {
    final Resolution resolution = source.resolution();
    final List<CallEdge> result = new ArrayList<CallEdge>();
    Walker.preOrder(routine, NodeFilter.of(NodeKind.CALL, NodeKind.ARRAY_REF),
                    new Visitor() {
      @Override
      public void visit(Node node, WalkContext context) {
        CallEdge e = edgeFor(caller, node, resolution,
                             line(node, context));
        if (e != null) {
          result.add(e);
        }
      }
    });
    return ImmutableList.copyOf(result);
  }

  private CallEdge edgeFor(UnitId caller, Node node, Resolution resolution,
                           int line) {
    boolean isCall = node.kind() == NodeKind.CALL;
    String name = isCall ? ((CallStatement)node).name()
                         : ((ArrayRef)node).name();
    Symbol sym = resolution == null ? null : resolution.symbol(node);
    if (sym == null) {
      return isCall ? new CallEdge(caller, null, name, line) : null;
    }
    if (sym.kind() == SymbolKind.PROCEDURE) {
      if (sym.isIntrinsic()) {
        return null;
      }
      UnitId target = sym.unitId();
      if (target == null) {
        // Declared external
        target = UnitId.external(name);
      }
      if (program.unit(target) != null) {
        return new CallEdge(caller, target, name, line);
      }
      return new CallEdge(caller, null, name, line);
    }
    if (isCall) {
      // Imported from an unloaded module, or not found at all
      return new CallEdge(caller, null, name, line);
    }
    if (sym.kind() == SymbolKind.UNRESOLVED) {
      // Not declared anywhere: a call to an unknown function
      return new CallEdge(caller, null, name, line);
    }
    return null;
  }

  private static int line(Node node, WalkContext context) {
    if (node.span() != null) {
      return node.span().startLine();
    }
    for (Node a: context.ancestors()) {
      if (a.span() != null) {
        return a.span().startLine();
      }
    }
    return 0;
  }
}
