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

/**
 * Declared intent of a dummy argument
 */
public enum Intent {
  NONE(""),
  IN("in"),
  OUT("out"),
  INOUT("inout");

  private final String keyword;

  private Intent(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  public boolean writable() {
    return this != IN;
  }

  /**
   * @param text e.g. "in", "IN OUT", "inout"
   * @return matching intent
   * @throws IllegalArgumentException
   */
  public static Intent fromString(String text) {
    String canon = text.replaceAll("\\s+", "").toLowerCase();
    for (Intent i: values()) {
      if (i != NONE && i.keyword.equals(canon)) {
        return i;
      }
    }
    throw new IllegalArgumentException("Unknown intent: " + text);
  }
}
