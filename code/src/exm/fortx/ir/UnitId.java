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

import java.util.Arrays;
import java.util.List;

/**
 * Stable identifier of a module or routine, in lower case:
 * "mod" for a module, "mod#routine" for a module routine, "#routine"
 * for an external routine, and host id + "#member" for a contained
 * routine.
 */
public class UnitId implements Comparable<UnitId> {
  public static final String SEPARATOR = "#";

  private final String value;

  private UnitId(String value) {
    this.value = value;
  }

  public static UnitId parse(String value) {
    return new UnitId(value.trim().toLowerCase());
  }

  public static UnitId module(String name) {
    return new UnitId(name.toLowerCase());
  }

  public static UnitId external(String name) {
    return new UnitId(SEPARATOR + name.toLowerCase());
  }

  public UnitId member(String name) {
    return new UnitId(value + SEPARATOR + name.toLowerCase());
  }

  public boolean isModule() {
    return !value.contains(SEPARATOR);
  }

  /**
   * @return path segments; the first is the module name, or empty
   */
  public List<String> parts() {
    return Arrays.asList(value.split(SEPARATOR, -1));
  }

  /** @return local name of the unit */
  public String name() {
    int pos = value.lastIndexOf(SEPARATOR);
    return pos < 0 ? value : value.substring(pos + 1);
  }

  /**
   * @return id of the enclosing module or routine, or null if none
   */
  public UnitId host() {
    int pos = value.lastIndexOf(SEPARATOR);
    if (pos <= 0) {
      return null;
    }
    return new UnitId(value.substring(0, pos));
  }

  @Override
  public int compareTo(UnitId o) {
    return value.compareTo(o.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof UnitId))
      return false;
    return value.equals(((UnitId)obj).value);
  }

  @Override
  public String toString() {
    return value;
  }
}
