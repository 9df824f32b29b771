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
package exm.fortx.frontend;

import exm.fortx.common.exceptions.ParseException;
import exm.fortx.ir.Units.FileNode;

/**
 * Parses one source file with a particular backend and normalizes the
 * backend's tree into IR.  Implementations hold no state between calls
 * and may be used from several threads.
 */
public interface FrontendAdapter {

  public Frontend frontend();

  /**
   * @param path file name used in diagnostics and include lookup
   * @param text full source text
   * @param options
   * @return normalized tree with spans into text
   * @throws ParseException if the backend rejected the input
   */
  public FileNode parse(String path, String text, FrontendOptions options)
                                                   throws ParseException;
}
