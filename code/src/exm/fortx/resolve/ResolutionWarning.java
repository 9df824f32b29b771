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
package exm.fortx.resolve;

import exm.fortx.ir.UnitId;

/**
 * A name that could not be fully resolved.  Recorded, not thrown.
 */
public class ResolutionWarning {
  private final String file;
  private final int line;
  /** Routine or module the reference is in, null at file level */
  private final UnitId unit;
  private final String name;
  private final String message;

  public ResolutionWarning(String file, int line, UnitId unit, String name,
                           String message) {
    this.file = file;
    this.line = line;
    this.unit = unit;
    this.name = name.toLowerCase();
    this.message = message;
  }

  public String file() {
    return file;
  }

  /** @return line of the enclosing statement, or 0 if not known */
  public int line() {
    return line;
  }

  public UnitId unit() {
    return unit;
  }

  public String name() {
    return name;
  }

  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return file + (line > 0 ? ":" + line : "") + ": " + message;
  }
}
