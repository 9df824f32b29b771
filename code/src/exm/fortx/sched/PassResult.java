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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;

/**
 * Outcome of a pass on one routine
 */
public class PassResult {
  private final Routine routine;
  private final List<Diagnostic> diagnostics;
  private final List<NewRoutine> added;

  /**
   * Routine a pass wants added to the program, next to an existing one
   */
  public static class NewRoutine {
    public final UnitId sibling;
    public final Routine routine;

    public NewRoutine(UnitId sibling, Routine routine) {
      this.sibling = sibling;
      this.routine = routine;
    }

    @Override
    public String toString() {
      return routine.name() + " after " + sibling;
    }
  }

  public PassResult(Routine routine, List<Diagnostic> diagnostics) {
    this(routine, diagnostics, null);
  }

  public PassResult(Routine routine, List<Diagnostic> diagnostics,
                    List<NewRoutine> added) {
    this.routine = routine;
    this.diagnostics = diagnostics == null ?
          Collections.<Diagnostic>emptyList() :
          ImmutableList.copyOf(diagnostics);
    this.added = added == null ? Collections.<NewRoutine>emptyList() :
                                 ImmutableList.copyOf(added);
  }

  public static PassResult of(Routine routine) {
    return new PassResult(routine, null);
  }

  public Routine routine() {
    return routine;
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  /**
   * @return routines to add before the rewritten routine is swapped in
   */
  public List<NewRoutine> added() {
    return added;
  }

  /**
   * @param input routine the pass was given
   */
  public boolean changed(Routine input) {
    return routine != input || !added.isEmpty();
  }
}
