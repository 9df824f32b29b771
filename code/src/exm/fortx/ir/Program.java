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
package exm.fortx.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.Units.Routine;

/**
 * All source units loaded into a session, with an index from unit id
 * to program unit.
 */
public class Program {

  /**
   * Notified after a routine has been swapped into its source unit, or
   * added to it
   */
  public static interface ReplacementListener {
    public void routineReplaced(SourceUnit source, UnitId id,
                                Routine oldRoutine, Routine newRoutine);

    public void routineAdded(SourceUnit source, UnitId id, Routine routine);
  }

  private final Logger logger = Logging.getLogger();

  private final List<SourceUnit> sources =
                      new CopyOnWriteArrayList<SourceUnit>();
  private final ConcurrentMap<UnitId, ProgramUnit> index =
                      new ConcurrentHashMap<UnitId, ProgramUnit>();
  private final List<ReplacementListener> listeners =
                      new CopyOnWriteArrayList<ReplacementListener>();

  public synchronized void add(SourceUnit source) {
    sources.add(source);
    for (UnitId id: source.unitIds()) {
      ProgramUnit prev = index.putIfAbsent(id, new ProgramUnit(source, id));
      if (prev != null && prev.source() != source) {
        Logging.uniqueWarn(logger, "Duplicate definition of " + id + " in "
            + source.path() + " ignored, using " + prev.source().path());
      }
    }
  }

  public void addListener(ReplacementListener listener) {
    listeners.add(listener);
  }

  public List<SourceUnit> sources() {
    return Collections.unmodifiableList(sources);
  }

  /**
   * @return unit, or null if no such unit
   */
  public ProgramUnit unit(UnitId id) {
    return index.get(id);
  }

  public Routine routine(UnitId id) {
    ProgramUnit unit = index.get(id);
    if (unit == null) {
      throw new FortxRuntimeError("Unknown unit " + id);
    }
    return unit.routine();
  }

  /**
   * @return ids of all routines, sorted
   */
  public List<UnitId> routineIds() {
    List<UnitId> result = new ArrayList<UnitId>();
    for (UnitId id: index.keySet()) {
      if (!id.isModule()) {
        result.add(id);
      }
    }
    Collections.sort(result);
    return result;
  }

  /**
   * @return ids of routines in one source file, sorted
   */
  public List<UnitId> routineIds(SourceUnit source) {
    List<UnitId> result = new ArrayList<UnitId>();
    for (ProgramUnit u: index.values()) {
      if (u.source() == source && !u.isModule()) {
        result.add(u.id());
      }
    }
    Collections.sort(result);
    return result;
  }

  /**
   * Add a routine next to an existing one, unless a routine of that name
   * is already there, and notify listeners
   * @param sibling routine to insert after
   * @return id of the new or existing routine
   */
  public synchronized UnitId addRoutine(UnitId sibling, Routine routine) {
    ProgramUnit unit = index.get(sibling);
    if (unit == null) {
      throw new FortxRuntimeError("Unknown unit " + sibling);
    }
    UnitId host = sibling.host();
    UnitId id = host == null ? UnitId.external(routine.name())
                             : host.member(routine.name());
    if (index.containsKey(id)) {
      return id;
    }
    SourceUnit source = unit.source();
    source.addRoutine(sibling, routine);
    index.put(id, new ProgramUnit(source, id));
    for (Routine member: routine.routines()) {
      addMemberIds(source, id, member);
    }
    logger.debug("Added routine " + id + " to " + source.path());
    Routine current = index.get(id).routine();
    for (ReplacementListener l: listeners) {
      l.routineAdded(source, id, current);
    }
    return id;
  }

  private void addMemberIds(SourceUnit source, UnitId host, Routine member) {
    UnitId id = host.member(member.name());
    index.putIfAbsent(id, new ProgramUnit(source, id));
    for (Routine inner: member.routines()) {
      addMemberIds(source, id, inner);
    }
  }

  /**
   * Replace a routine and notify listeners
   */
  public void replaceRoutine(UnitId id, Routine replacement) {
    ProgramUnit unit = index.get(id);
    if (unit == null) {
      throw new FortxRuntimeError("Unknown unit " + id);
    }
    Routine old = unit.source().replaceRoutine(id, replacement);
    logger.debug("Replaced routine " + id + " in " + unit.source().path());
    Routine current = unit.routine();
    for (ReplacementListener l: listeners) {
      l.routineReplaced(unit.source(), id, old, current);
    }
  }
}
