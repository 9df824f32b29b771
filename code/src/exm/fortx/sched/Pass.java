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

import exm.fortx.common.exceptions.TransformException;
import exm.fortx.ir.Units.Routine;

/**
 * A transformation or analysis applied to one routine at a time
 */
public interface Pass {
  public abstract String name();

  public abstract PassOrder order();

  /**
   * @return true if a failure of this pass should abort the whole run
   */
  public abstract boolean fatalOnError();

  /**
   * @return true if the result for a routine depends on the current
   *         state of the routines it calls
   */
  public abstract boolean dependsOnCallees();

  /**
   * @return true if the result for a routine depends on the current
   *         state of its callers, as for caller-first propagation
   */
  public abstract boolean dependsOnCallers();

  /**
   * @return true if the pass never replaces the routine
   */
  public abstract boolean readOnly();

  /**
   * @param routine the current routine, without its contained routines,
   *                which are units of their own
   * @return result holding the same routine object if unchanged
   */
  public abstract PassResult apply(Routine routine, PassContext context)
                                                throws TransformException;

  /**
   * Base for passes with the usual properties: not fatal, independent of
   * other routines, and rewriting
   */
  public static abstract class RoutinePass implements Pass {
    private final String name;
    private final PassOrder order;

    protected RoutinePass(String name, PassOrder order) {
      this.name = name;
      this.order = order;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public PassOrder order() {
      return order;
    }

    @Override
    public boolean fatalOnError() {
      return false;
    }

    @Override
    public boolean dependsOnCallees() {
      return false;
    }

    @Override
    public boolean dependsOnCallers() {
      return false;
    }

    @Override
    public boolean readOnly() {
      return false;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
