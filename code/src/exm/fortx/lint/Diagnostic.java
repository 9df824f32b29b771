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

import exm.fortx.ir.SourceSpan;

/**
 * A finding reported by a rule or a pass
 */
public class Diagnostic implements Comparable<Diagnostic> {
  private final String ruleId;
  private final Severity severity;
  private final String file;
  /** Null if the node has no source position */
  private final SourceSpan span;
  private final String message;

  public Diagnostic(String ruleId, Severity severity, String file,
                    SourceSpan span, String message) {
    this.ruleId = ruleId;
    this.severity = severity;
    this.file = file;
    this.span = span;
    this.message = message;
  }

  public String ruleId() {
    return ruleId;
  }

  public Severity severity() {
    return severity;
  }

  public String file() {
    return file;
  }

  public SourceSpan span() {
    return span;
  }

  /**
   * @return first line, or 0 if unknown
   */
  public int line() {
    return span == null ? 0 : span.startLine();
  }

  public String message() {
    return message;
  }

  public Diagnostic withSeverity(Severity newSeverity) {
    return new Diagnostic(ruleId, newSeverity, file, span, message);
  }

  public Diagnostic withFile(String newFile) {
    return new Diagnostic(ruleId, severity, newFile, span, message);
  }

  @Override
  public int compareTo(Diagnostic o) {
    int c = String.valueOf(file).compareTo(String.valueOf(o.file));
    if (c != 0) {
      return c;
    }
    c = Integer.compare(line(), o.line());
    if (c != 0) {
      return c;
    }
    return ruleId.compareTo(o.ruleId);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(file == null ? "<unknown>" : file);
    if (span != null) {
      sb.append(":").append(span.startLine());
    }
    sb.append(": ").append(severity.toString().toLowerCase());
    sb.append(" [").append(ruleId).append("] ").append(message);
    return sb.toString();
  }
}
