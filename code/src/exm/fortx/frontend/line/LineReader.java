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
package exm.fortx.frontend.line;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits free-form source into logical statements: continuation lines
 * are joined, comments after code are dropped, statements separated by
 * ';' are split apart and leading statement labels are taken off.
 * Full-line comments are kept as statements of their own.
 */
public class LineReader {

  /**
   * One statement or full-line comment
   */
  public static class LogicalLine {
    public final int firstLine;
    public final int lastLine;
    /** Statement label, or null */
    public final String label;
    /** Statement text without label, or comment text including ! */
    public final String text;
    public final boolean comment;
    /** True if read from an included file */
    public final boolean included;

    public LogicalLine(int firstLine, int lastLine, String label,
                       String text, boolean comment, boolean included) {
      this.firstLine = firstLine;
      this.lastLine = lastLine;
      this.label = label;
      this.text = text;
      this.comment = comment;
      this.included = included;
    }

    /**
     * Copy placed on the line of the include statement that pulled it in
     */
    public LogicalLine asIncluded(int line) {
      return new LogicalLine(line, line, label, text, comment, true);
    }

    @Override
    public String toString() {
      return firstLine + (lastLine != firstLine ? "-" + lastLine : "") +
             ": " + (label != null ? label + " " : "") + text;
    }
  }

  public List<LogicalLine> read(String text) {
    String[] physical = text.split("\r?\n", -1);
    List<LogicalLine> result = new ArrayList<LogicalLine>();

    StringBuilder pending = null;
    int pendingStart = 0;
    int pendingEnd = 0;
    char quote = 0;

    for (int i = 0; i < physical.length; i++) {
      int lineNo = i + 1;
      String line = physical[i];
      String trimmed = line.trim();

      if (pending == null && trimmed.startsWith("!")) {
        result.add(new LogicalLine(lineNo, lineNo, null, trimmed, true,
                                   false));
        continue;
      }
      if (trimmed.isEmpty() || (pending != null && trimmed.startsWith("!")
                                && quote == 0)) {
        // Blank line, or comment line between continued lines
        continue;
      }

      String code = line;
      if (pending != null) {
        int amp = code.indexOf('&');
        if (amp >= 0 && code.substring(0, amp).trim().isEmpty()) {
          code = code.substring(amp + 1);
        } else if (quote == 0) {
          pending.append(' ');
        }
      }

      // Strip trailing comment, tracking strings across continuations
      int end = code.length();
      for (int j = 0; j < code.length(); j++) {
        char c = code.charAt(j);
        if (quote != 0) {
          if (c == quote) {
            quote = 0;
          }
        } else if (c == '\'' || c == '"') {
          quote = c;
        } else if (c == '!') {
          end = j;
          break;
        }
      }
      code = stripRight(code.substring(0, end));

      boolean continued = code.endsWith("&");
      if (continued) {
        code = code.substring(0, code.length() - 1);
      }
      if (pending == null) {
        pending = new StringBuilder();
        pendingStart = lineNo;
      }
      pending.append(code);
      pendingEnd = lineNo;
      if (!continued) {
        split(result, pending.toString(), pendingStart, lineNo);
        pending = null;
        quote = 0;
      }
    }
    if (pending != null) {
      split(result, pending.toString(), pendingStart, pendingEnd);
    }
    return result;
  }

  /**
   * Split a joined statement at ';' outside strings
   */
  private static void split(List<LogicalLine> result, String joined,
                            int firstLine, int lastLine) {
    char quote = 0;
    int start = 0;
    for (int i = 0; i < joined.length(); i++) {
      char c = joined.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ';') {
        addStatement(result, joined.substring(start, i), firstLine,
                     lastLine);
        start = i + 1;
      }
    }
    addStatement(result, joined.substring(start), firstLine, lastLine);
  }

  private static void addStatement(List<LogicalLine> result, String stmt,
                                   int firstLine, int lastLine) {
    String s = stmt.trim();
    if (s.isEmpty()) {
      return;
    }
    String label = null;
    int digits = 0;
    while (digits < s.length() && Character.isDigit(s.charAt(digits))) {
      digits++;
    }
    if (digits > 0 && digits < s.length() &&
        Character.isWhitespace(s.charAt(digits))) {
      label = s.substring(0, digits);
      s = s.substring(digits).trim();
    }
    result.add(new LogicalLine(firstLine, lastLine, label, s, false, false));
  }

  private static String stripRight(String s) {
    int end = s.length();
    while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
      end--;
    }
    return s.substring(0, end);
  }
}
