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
package exm.fortx.lint.rules;

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;

/**
 * Numeric rule options
 */
class Limits {
  static int get(Settings settings, String key, int defaultValue)
                                          throws InvalidOptionException {
    String val = settings.get(key);
    if (val == null || val.trim().isEmpty()) {
      return defaultValue;
    }
    int result = settings.getInt(key);
    if (result < 0) {
      throw new InvalidOptionException("Expected non-negative value for "
                                       + key + " but was " + val);
    }
    return result;
  }
}
