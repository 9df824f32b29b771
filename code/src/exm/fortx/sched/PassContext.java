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

import java.util.List;

import org.apache.log4j.Logger;

import exm.fortx.common.Settings;
import exm.fortx.ir.Program;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.resolve.Resolution;

/**
 * What a pass may look at while processing one routine.  Other routines
 * are read through the program; only the scheduler replaces or adds
 * routines.
 */
public class PassContext {
  private final Logger logger;
  private final Settings settings;
  private final Program program;
  private final CallGraph callGraph;
  private final UnitId unitId;
  private final SourceUnit source;
  private final List<UnitId> callers;

  public PassContext(Logger logger, Settings settings, Program program,
                     CallGraph callGraph, UnitId unitId, SourceUnit source,
                     List<UnitId> callers) {
    this.logger = logger;
    this.settings = settings;
    this.program = program;
    this.callGraph = callGraph;
    this.unitId = unitId;
    this.source = source;
    this.callers = callers;
  }

  public Logger logger() {
    return logger;
  }

  public Settings settings() {
    return settings;
  }

  public Program program() {
    return program;
  }

  public UnitId unitId() {
    return unitId;
  }

  public SourceUnit source() {
    return source;
  }

  /**
   * @return resolution of the routine's source file
   */
  public Resolution resolution() {
    return source.resolution();
  }

  /**
   * @return call sites of the routine, unresolved ones included
   */
  public List<CallEdge> calls() {
    return callGraph.edges(unitId);
  }

  public List<UnitId> callees() {
    return callGraph.callees(unitId);
  }

  /**
   * @return scheduled routines calling this one, sorted
   */
  public List<UnitId> callers() {
    return callers;
  }

  /**
   * @return call sites in another routine
   */
  public List<CallEdge> callsOf(UnitId caller) {
    return callGraph.edges(caller);
  }

  /**
   * @return current version of another routine
   */
  public Routine routine(UnitId id) {
    return program.routine(id);
  }
}
