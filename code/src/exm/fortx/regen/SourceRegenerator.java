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
package exm.fortx.regen;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.LineTable;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.BlockConstruct;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Statements.WhileLoop;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.Routine;

/**
 * Turns the current tree of a source unit back into text.
 *
 * Nodes that still have a span are copied from the original text, so
 * untouched code keeps its layout, case and comments.  Other nodes are
 * printed from their fields, indented like their nearest verbatim
 * siblings, or two spaces deeper than the enclosing construct.
 */
public class SourceRegenerator {

  private final Logger logger = Logging.getLogger();

  /** Free-form line length limit */
  public static final int MAX_LINE = 132;

  private static final String INDENT = "  ";

  public String regenerate(SourceUnit unit) {
    FileNode root = unit.root();
    if (root.span() != null) {
      logger.trace("Unchanged: " + unit.path());
      return unit.text();
    }
    Emitter e = new Emitter(unit);
    e.sequence(root.body(), "");
    return e.sb.toString();
  }

  private static class Emitter {
    final SourceUnit unit;
    final LineTable lines;
    final StringBuilder sb = new StringBuilder(4096);

    Emitter(SourceUnit unit) {
      this.unit = unit;
      this.lines = unit.lines();
    }

    /**
     * Emit statements of one list, copying blank lines between
     * statements that were adjacent in the original
     */
    void sequence(List<Node> nodes, String defaultIndent) {
      String indent = indentOf(nodes, defaultIndent);
      Node prev = null;
      for (Node n: nodes) {
        if (prev != null && prev.span() != null && n.span() != null) {
          blankLines(prev.span().endLine(), n.span().startLine());
        }
        node(n, indent);
        prev = n;
      }
    }

    private String indentOf(List<Node> nodes, String defaultIndent) {
      for (Node n: nodes) {
        if (n.span() != null && n.kind() != NodeKind.COMMENT) {
          String first = lines.line(n.span().startLine());
          int i = 0;
          while (i < first.length() &&
                 (first.charAt(i) == ' ' || first.charAt(i) == '\t')) {
            i++;
          }
          return first.substring(0, i);
        }
      }
      return defaultIndent;
    }

    private void blankLines(int after, int before) {
      for (int l = after + 1; l < before; l++) {
        if (lines.line(l).trim().isEmpty()) {
          sb.append('\n');
        }
      }
    }

    void node(Node n, String indent) {
      if (n.span() != null) {
        sb.append(unit.text(n.span())).append('\n');
        return;
      }
      String inner = indent + INDENT;
      switch (n.kind()) {
        case MODULE: {
          Module m = (Module)n;
          line(indent, "module " + m.name());
          sequence(m.spec(), inner);
          members(m.members(), indent);
          line(indent, "end module " + m.name());
          break;
        }
        case ROUTINE: {
          Routine r = (Routine)n;
          line(indent, FortranPrinter.routineHeader(r));
          sequence(concat(r.spec(), r.body()), inner);
          members(r.members(), indent);
          line(indent, "end " + r.routineKind().keyword() + " " + r.name());
          break;
        }
        case BLOCK: {
          BlockConstruct b = (BlockConstruct)n;
          line(indent, "block");
          sequence(concat(b.spec(), b.body()), inner);
          line(indent, "end block");
          break;
        }
        case LOOP: {
          Loop l = (Loop)n;
          String header = "do " + l.variable() + " = " +
                FortranPrinter.expression(l.lower()) + ", " +
                FortranPrinter.expression(l.upper());
          if (l.step() != null) {
            header += ", " + FortranPrinter.expression(l.step());
          }
          line(indent, header);
          sequence(l.body(), inner);
          line(indent, "end do");
          break;
        }
        case WHILE_LOOP: {
          WhileLoop w = (WhileLoop)n;
          if (w.condition() == null) {
            line(indent, "do");
          } else {
            line(indent, "do while (" +
                 FortranPrinter.expression(w.condition()) + ")");
          }
          sequence(w.body(), inner);
          line(indent, "end do");
          break;
        }
        case CONDITIONAL:
          conditional((Conditional)n, indent);
          break;
        case FILE:
          throw new FortxRuntimeError("Nested file node");
        default:
          if (n.kind().isExpression()) {
            throw new FortxRuntimeError("Expression in statement list: " + n);
          }
          line(indent, FortranPrinter.statement(n));
      }
    }

    private void members(List<Node> members, String indent) {
      if (members.isEmpty()) {
        return;
      }
      line(indent, "contains");
      sequence(members, indent + INDENT);
    }

    private void conditional(Conditional c, String indent) {
      if (c.isInline() && c.elseBody().isEmpty() &&
          c.thenBody().size() == 1 &&
          !c.thenBody().get(0).kind().isConstruct()) {
        line(indent, "if (" + FortranPrinter.expression(c.condition()) +
                     ") " + FortranPrinter.statement(c.thenBody().get(0)));
        return;
      }
      String inner = indent + INDENT;
      line(indent, "if (" + FortranPrinter.expression(c.condition()) +
                   ") then");
      sequence(c.thenBody(), inner);
      List<Node> rest = c.elseBody();
      // ELSE IF chains are printed flat, whatever spans the branches have
      while (rest.size() == 1 && rest.get(0).kind() == NodeKind.CONDITIONAL
             && ((Conditional)rest.get(0)).isElseIf()) {
        Conditional branch = (Conditional)rest.get(0);
        line(indent, "else if (" +
             FortranPrinter.expression(branch.condition()) + ") then");
        sequence(branch.thenBody(), inner);
        rest = branch.elseBody();
      }
      if (!rest.isEmpty()) {
        line(indent, "else");
        sequence(rest, inner);
      }
      line(indent, "end if");
    }

    private void line(String indent, String text) {
      if (text.startsWith("!") ||
          indent.length() + text.length() <= MAX_LINE) {
        sb.append(indent).append(text).append('\n');
        return;
      }
      String rest = text;
      boolean first = true;
      while (true) {
        String prefix = first ? indent : indent + INDENT + "& ";
        int room = MAX_LINE - prefix.length() - 2;
        if (rest.length() <= MAX_LINE - prefix.length()) {
          sb.append(prefix).append(rest).append('\n');
          return;
        }
        int brk = breakPoint(rest, room);
        if (brk <= 0) {
          // No blank outside a literal: leave the line long
          sb.append(prefix).append(rest).append('\n');
          return;
        }
        sb.append(prefix).append(rest.substring(0, brk)).append(" &\n");
        rest = rest.substring(brk + 1);
        first = false;
      }
    }
  }

  /**
   * @return index of the last blank before limit that isn't inside a
   *         character literal, or -1
   */
  static int breakPoint(String text, int limit) {
    int best = -1;
    char quote = 0;
    for (int i = 0; i < text.length() && i < limit; i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ' ') {
        best = i;
      }
    }
    return best;
  }

  private static List<Node> concat(List<Node> a, List<Node> b) {
    List<Node> result = new ArrayList<Node>(a.size() + b.size());
    result.addAll(a);
    result.addAll(b);
    return result;
  }
}
