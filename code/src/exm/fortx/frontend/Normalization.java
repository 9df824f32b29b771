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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import exm.fortx.ir.LineTable;
import exm.fortx.ir.Node;
import exm.fortx.ir.Sections;
import exm.fortx.ir.Sections.Split;
import exm.fortx.ir.SourceSpan;
import exm.fortx.ir.Statements.BlockConstruct;
import exm.fortx.ir.TypeSpec;
import exm.fortx.ir.Units.Routine;
import exm.fortx.ir.Units.RoutineKind;

/**
 * Rules all frontends apply when mapping their trees to IR, so that the
 * same source gives the same IR whichever backend parsed it.
 */
public class Normalization {

  private static final Map<String, String> DOTTED_RELATIONAL =
      ImmutableMap.<String, String>builder()
        .put(".eq.", "==")
        .put(".ne.", "/=")
        .put(".lt.", "<")
        .put(".le.", "<=")
        .put(".gt.", ">")
        .put(".ge.", ">=")
        .build();

  /**
   * A statement with the lines it was parsed from.  The line range is
   * kept even when the node itself ends up without a span.
   */
  public static class Placed {
    public final Node node;
    public final int startLine;
    public final int endLine;

    public Placed(Node node, int startLine, int endLine) {
      this.node = node;
      this.startLine = startLine;
      this.endLine = endLine;
    }

    public boolean coversLine(int line) {
      return line >= startLine && line <= endLine;
    }
  }

  private static final Comparator<Placed> BY_LINE = new Comparator<Placed>() {
    @Override
    public int compare(Placed a, Placed b) {
      return Integer.compare(a.startLine, b.startLine);
    }
  };

  /**
   * @param op operator as written, any case
   * @return canonical operator: lower case, relational operators symbolic
   */
  public static String operator(String op) {
    String lower = op.trim().toLowerCase();
    String symbolic = DOTTED_RELATIONAL.get(lower);
    return symbolic != null ? symbolic : lower;
  }

  public static SourceSpan span(LineTable lines, int startLine, int endLine) {
    return lines.span(startLine, endLine);
  }

  /**
   * Order statements by line and drop the spans of any that can't be
   * regenerated from whole lines on their own: statements sharing a
   * line with a sibling, and statements on the header or end line of
   * the enclosing construct.
   * @param placed statements of one list
   * @param openLine last line of the construct header, 0 if none
   * @param closeLine line of the construct end, or past end of file
   * @return nodes in source order
   */
  public static List<Node> arrange(List<Placed> placed, int openLine,
                                   int closeLine) {
    List<Placed> sorted = new ArrayList<Placed>(placed);
    Collections.sort(sorted, BY_LINE);
    List<Node> result = new ArrayList<Node>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      Placed p = sorted.get(i);
      boolean shared = p.startLine <= openLine || p.endLine >= closeLine;
      if (i > 0 && sorted.get(i - 1).endLine >= p.startLine) {
        shared = true;
      }
      if (i + 1 < sorted.size() && sorted.get(i + 1).startLine <= p.endLine) {
        shared = true;
      }
      if (shared && p.node.span() != null) {
        result.add(p.node.withSpan(null));
      } else {
        result.add(p.node);
      }
    }
    return result;
  }

  /**
   * Build a routine, splitting its statements into specification and
   * execution parts
   */
  public static Routine routine(SourceSpan span, RoutineKind kind,
          String name, List<String> prefixes, List<String> dummies,
          String resultName, TypeSpec resultType, List<Node> statements,
          List<Node> members) {
    Split split = Sections.split(statements);
    return new Routine(span, kind, name, prefixes, dummies, resultName,
                       resultType, split.spec, split.body, members);
  }

  public static BlockConstruct block(SourceSpan span, List<Node> statements) {
    Split split = Sections.split(statements);
    return new BlockConstruct(span, split.spec, split.body);
  }

  /**
   * Type from a base type name and its selectors.  Positional selectors
   * are length then kind for character, kind otherwise.
   * @param positional selectors given without keyword, in order
   */
  public static TypeSpec typeSpec(String base, Node kind, Node length,
                                  List<Node> positional) {
    boolean character = base.trim().equalsIgnoreCase(TypeSpec.CHARACTER);
    for (Node sel: positional) {
      if (character && length == null) {
        length = sel;
      } else if (kind == null) {
        kind = sel;
      }
    }
    return new TypeSpec(base, null, kind, length);
  }

  /**
   * Text of an opaque statement, with continuation markers, comments
   * inside continued lines and repeated whitespace removed
   */
  public static String statementText(String raw) {
    String joined = raw.replaceAll("&[ \\t]*(![^\\n]*)?\\r?\\n[ \\t]*&?", " ");
    return joined.trim().replaceAll("\\s+", " ");
  }
}
