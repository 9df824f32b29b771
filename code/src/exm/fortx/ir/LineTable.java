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

/**
 * Maps between 1-based line numbers and offsets in a text buffer
 */
public class LineTable {
  private final String text;
  /** Offset of first character of each line, 0-based index */
  private final int[] starts;

  public LineTable(String text) {
    this.text = text;
    int[] tmp = new int[16];
    int n = 0;
    tmp[n++] = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n' && i + 1 < text.length()) {
        if (n == tmp.length) {
          tmp = Arrays.copyOf(tmp, n * 2);
        }
        tmp[n++] = i + 1;
      }
    }
    this.starts = Arrays.copyOf(tmp, n);
  }

  public int lineCount() {
    return starts.length;
  }

  public int lineStart(int line) {
    checkLine(line);
    return starts[line - 1];
  }

  /**
   * @param line
   * @return offset just past the last character of the line,
   *         excluding any line terminator
   */
  public int lineEnd(int line) {
    checkLine(line);
    int start = starts[line - 1];
    int end;
    if (line < starts.length) {
      end = starts[line] - 1;
    } else if (text.endsWith("\n")) {
      end = text.length() - 1;
    } else {
      end = text.length();
    }
    if (end > start && text.charAt(end - 1) == '\r') {
      end--;
    }
    return end;
  }

  public String line(int line) {
    return text.substring(lineStart(line), lineEnd(line));
  }

  /**
   * @param offset
   * @return 1-based line containing offset
   */
  public int lineOf(int offset) {
    int pos = Arrays.binarySearch(starts, offset);
    if (pos >= 0) {
      return pos + 1;
    }
    return -(pos + 1);
  }

  public SourceSpan span(int startLine, int endLine) {
    return new SourceSpan(startLine, endLine,
                          lineStart(startLine), lineEnd(endLine));
  }

  private void checkLine(int line) {
    if (line < 1 || line > starts.length) {
      throw new IndexOutOfBoundsException("line " + line + " not in 1.."
                                          + starts.length);
    }
  }
}
