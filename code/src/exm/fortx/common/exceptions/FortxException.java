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
package exm.fortx.common.exceptions;

/**
 * Represents an error caused by the input being processed, e.g. source
 * that can't be parsed, or a transformation that can't be applied.
 * Thus, this should contain good error message information
 * */
public class FortxException extends Exception
{
  private final String file;
  private final int line;
  private final int column;

  public FortxException(String file, int line, int col, String message) {
    super(format(file, line, col, message));
    this.file = file;
    this.line = line;
    this.column = col;
  }

  public FortxException(String file, int line, int col, String message,
                        Throwable cause) {
    super(format(file, line, col, message), cause);
    this.file = file;
    this.line = line;
    this.column = col;
  }

  public FortxException(String message) {
    super(message);
    this.file = null;
    this.line = 0;
    this.column = 0;
  }

  public FortxException(String message, Throwable cause) {
    super(message, cause);
    this.file = null;
    this.line = 0;
    this.column = 0;
  }

  private static String format(String file, int line, int col, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append(file == null ? "<unknown>" : file);
    if (line > 0) {
      sb.append(":").append(line);
      if (col > 0) {
        sb.append(":").append(col);
      }
    }
    sb.append(": ").append(message);
    return sb.toString();
  }

  /** @return file the error relates to, or null if not known */
  public String getFile() {
    return file;
  }

  /** @return 1-based line, or 0 if not known */
  public int getLine() {
    return line;
  }

  /** @return 1-based column, or 0 if not known */
  public int getColumn() {
    return column;
  }

  private static final long serialVersionUID = 1L;
}
