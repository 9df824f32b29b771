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
 * Range of whole source lines that a node was parsed from.
 * Offsets index into the raw text of the source unit:
 * start is the first character of the first line, end is exclusive
 * and excludes the line terminator of the last line.
 */
public class SourceSpan {
  private final int startLine;
  private final int endLine;
  private final int startOffset;
  private final int endOffset;

  public SourceSpan(int startLine, int endLine,
                    int startOffset, int endOffset) {
    assert(startLine <= endLine) : startLine + " > " + endLine;
    assert(startOffset <= endOffset);
    this.startLine = startLine;
    this.endLine = endLine;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public int startLine() {
    return startLine;
  }

  public int endLine() {
    return endLine;
  }

  public int startOffset() {
    return startOffset;
  }

  public int endOffset() {
    return endOffset;
  }

  public boolean containsLine(int line) {
    return line >= startLine && line <= endLine;
  }

  public boolean overlaps(SourceSpan other) {
    return startLine <= other.endLine && other.startLine <= endLine;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * startLine + endLine) + startOffset;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceSpan))
      return false;
    SourceSpan other = (SourceSpan)obj;
    return startLine == other.startLine && endLine == other.endLine &&
           startOffset == other.startOffset && endOffset == other.endOffset;
  }

  @Override
  public String toString() {
    if (startLine == endLine) {
      return "L" + startLine;
    }
    return "L" + startLine + "-L" + endLine;
  }
}
