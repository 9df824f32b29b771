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
package exm.fortx.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.fortx.ir.LineTable;
import exm.fortx.ir.SourceSpan;

/**
 * Lines marked with {@code ! fortx-lint: disable=RULE[,RULE]} or
 * {@code disable=all}.  A marker after a statement marks its own line;
 * a marker on a line by itself marks the next statement line.
 */
public class Suppressions {
  public static final String ALL = "ALL";

  static final Pattern MARKER = Pattern.compile(
          "!\\s*fortx-lint\\s*:\\s*disable\\s*=\\s*([A-Za-z0-9_\\-]+" +
          "(?:\\s*,\\s*[A-Za-z0-9_\\-]+)*)", Pattern.CASE_INSENSITIVE);

  /** Upper case rule ids by marked line */
  private final Map<Integer, Set<String>> marked =
                        new HashMap<Integer, Set<String>>();

  public static Suppressions parse(LineTable lines) {
    Suppressions s = new Suppressions();
    Set<String> pending = null;
    for (int line = 1; line <= lines.lineCount(); line++) {
      String text = lines.line(line);
      String trimmed = text.trim();
      Matcher m = MARKER.matcher(text);
      boolean hasMarker = m.find();
      boolean commentOnly = trimmed.isEmpty() || trimmed.startsWith("!");

      if (!commentOnly && pending != null) {
        s.mark(line, pending);
        pending = null;
      }
      if (hasMarker) {
        Set<String> ids = ruleIds(m.group(1));
        if (commentOnly) {
          if (pending == null) {
            pending = ids;
          } else {
            pending.addAll(ids);
          }
        } else {
          s.mark(line, ids);
        }
      }
    }
    return s;
  }

  private static Set<String> ruleIds(String list) {
    Set<String> ids = new HashSet<String>();
    for (String id: list.split(",")) {
      if (id.trim().length() > 0) {
        ids.add(id.trim().toUpperCase());
      }
    }
    return ids;
  }

  private void mark(int line, Set<String> ids) {
    Set<String> existing = marked.get(line);
    if (existing == null) {
      marked.put(line, new HashSet<String>(ids));
    } else {
      existing.addAll(ids);
    }
  }

  public boolean isMarked(int line, String ruleId) {
    Set<String> ids = marked.get(line);
    return ids != null && (ids.contains(ALL) ||
                           ids.contains(ruleId.toUpperCase()));
  }

  /**
   * @param firstLineOnly only look at the first line of the span, as for
   *        diagnostics about a whole program unit or construct
   */
  public boolean suppresses(String ruleId, SourceSpan span,
                            boolean firstLineOnly) {
    if (span == null) {
      return false;
    }
    int last = firstLineOnly ? span.startLine() : span.endLine();
    for (int line = span.startLine(); line <= last; line++) {
      if (isMarked(line, ruleId)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return marked.isEmpty();
  }
}
