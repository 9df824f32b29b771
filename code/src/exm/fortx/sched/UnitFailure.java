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
 * A pass failed on one unit
 */
public class UnitFailure {
  private final String pass;
  private final UnitId unit;
  private final Throwable error;
  private final boolean fatal;

  public UnitFailure(String pass, UnitId unit, Throwable error,
                     boolean fatal) {
    this.pass = pass;
    this.unit = unit;
    this.error = error;
    this.fatal = fatal;
  }

  public String pass() {
    return pass;
  }

  public UnitId unit() {
    return unit;
  }

  public Throwable error() {
    return error;
  }

  public boolean isFatal() {
    return fatal;
  }

  @Override
  public String toString() {
    return (fatal ? "fatal: " : "") + "pass " + pass + " failed on " + unit
           + ": " + error.getMessage();
  }
}
