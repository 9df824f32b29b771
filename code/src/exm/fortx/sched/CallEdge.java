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

import exm.fortx.ir.UnitId;

/**
 * A call site.  Unresolved edges have no callee id but keep the name.
 */
public class CallEdge {
  private final UnitId caller;
  private final UnitId callee;
  private final String name;
  /** Line of the calling statement, 0 if unknown */
  private final int line;

  public CallEdge(UnitId caller, UnitId callee, String name, int line) {
    this.caller = caller;
    this.callee = callee;
    this.name = name.toLowerCase();
    this.line = line;
  }

  public UnitId caller() {
    return caller;
  }

  /**
   * @return callee, or null if unresolved
   */
  public UnitId callee() {
    return callee;
  }

  public String name() {
    return name;
  }

  public int line() {
    return line;
  }

  public boolean isResolved() {
    return callee != null;
  }

  @Override
  public String toString() {
    return caller + " -> " + (callee != null ? callee.toString()
                                             : "?" + name);
  }
}
