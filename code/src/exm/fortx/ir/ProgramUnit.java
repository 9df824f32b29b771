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

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.Units.Routine;

/**
 * Handle on a module or routine.  The node is looked up in the owning
 * source unit each time, so the handle stays valid across rewrites.
 */
public class ProgramUnit {
  private final SourceUnit source;
  private final UnitId id;

  public ProgramUnit(SourceUnit source, UnitId id) {
    this.source = source;
    this.id = id;
  }

  public SourceUnit source() {
    return source;
  }

  public UnitId id() {
    return id;
  }

  public boolean isModule() {
    return id.isModule();
  }

  public Node node() {
    Node n = source.find(id);
    if (n == null) {
      throw new FortxRuntimeError("Unit " + id + " no longer in " + source);
    }
    return n;
  }

  public Routine routine() {
    Node n = node();
    if (!(n instanceof Routine)) {
      throw new FortxRuntimeError("Unit " + id + " is not a routine");
    }
    return (Routine)n;
  }

  @Override
  public String toString() {
    return id.toString();
  }
}
