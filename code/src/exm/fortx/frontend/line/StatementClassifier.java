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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.line.LineReader.LogicalLine;

/**
 * Classifies logical lines by statement type and nests them into
 * constructs, giving a {@link SyntaxNode} tree rooted at a Program node.
 */
public class StatementClassifier {

  static final Pattern END = Pattern.compile(
      "end\\s*(module|subroutine|function|do|if|block)?(\\s+\\w+)?",
      Pattern.CASE_INSENSITIVE);
  static final Pattern MODULE = Pattern.compile("module\\s+(\\w+)",
      Pattern.CASE_INSENSITIVE);
  static final Pattern SUBROUTINE = Pattern.compile(
      "((?:(?:pure|elemental|recursive|impure)\\s+)*)subroutine\\s+(\\w+)" +
      "\\s*(?:\\((.*)\\))?", Pattern.CASE_INSENSITIVE);
  static final Pattern FUNCTION = Pattern.compile(
      "(.*?)\\bfunction\\s+(\\w+)\\s*\\((.*?)\\)" +
      "\\s*(?:result\\s*\\(\\s*(\\w+)\\s*\\))?", Pattern.CASE_INSENSITIVE);
  static final Pattern PREFIX_WORD = Pattern.compile(
      "\\s*(pure|elemental|recursive|impure)\\b", Pattern.CASE_INSENSITIVE);
  static final Pattern TYPE_START = Pattern.compile(
      "(integer|real|logical|complex|character|double\\s*precision)" +
      "\\s*([(*,:]|\\s\\s*\\w|$)|type\\s*\\(", Pattern.CASE_INSENSITIVE);
  static final Pattern ELSE_IF = Pattern.compile("else\\s*if\\s*\\(.*",
      Pattern.CASE_INSENSITIVE);
  static final Pattern LABEL_DO = Pattern.compile(
      "do\\s+(\\d+)\\s*,?\\s*(.*)", Pattern.CASE_INSENSITIVE);
  static final Pattern NONLABEL_DO = Pattern.compile(
      "do(\\s+\\w+\\s*=.*|\\s*while\\s*\\(.*|)", Pattern.CASE_INSENSITIVE);
  static final Pattern USE = Pattern.compile(
      "use(\\s*,\\s*(non_)?intrinsic\\s*::|\\s*::|\\s)\\s*\\w+.*",
      Pattern.CASE_INSENSITIVE);
  static final Pattern CALL = Pattern.compile("call\\s+\\w+.*",
      Pattern.CASE_INSENSITIVE);
  static final Pattern INCLUDE = Pattern.compile(
      "include\\s*(['\"])(.*)\\1", Pattern.CASE_INSENSITIVE);

  private final String path;

  public StatementClassifier(String path) {
    this.path = path;
  }

  public SyntaxNode classify(List<LogicalLine> lines) throws ParseException {
    int last = lines.isEmpty() ? 1 : lines.get(lines.size() - 1).lastLine;
    SyntaxNode program = new SyntaxNode(SyntaxNode.PROGRAM, null, null, 1,
                                        last, false);
    Deque<SyntaxNode> stack = new ArrayDeque<SyntaxNode>();
    stack.push(program);

    for (LogicalLine line: lines) {
      if (line.comment) {
        stack.peek().add(node(SyntaxNode.COMMENT, line));
        continue;
      }
      String type = statementType(line.text);
      SyntaxNode stmt = node(type, line);
      if (type.equals(SyntaxNode.IF_STMT)) {
        String action = line.text.substring(
                            closingParen(line, line.text.indexOf('(')) + 1);
        LogicalLine actionLine = new LogicalLine(line.firstLine,
            line.lastLine, null, action.trim(), false, line.included);
        String actionType = statementType(actionLine.text);
        if (isConstructStatement(actionType) ||
            actionType.equals(SyntaxNode.IF_STMT)) {
          throw error(line, "not allowed in logical IF: " + action.trim());
        }
        stmt.add(node(actionType, actionLine));
      }

      if (type.equals(SyntaxNode.MODULE_STMT)) {
        open(stack, SyntaxNode.MODULE, stmt, null);
      } else if (type.equals(SyntaxNode.SUBROUTINE_STMT)) {
        open(stack, SyntaxNode.SUBROUTINE_SUBPROGRAM, stmt, null);
      } else if (type.equals(SyntaxNode.FUNCTION_STMT)) {
        open(stack, SyntaxNode.FUNCTION_SUBPROGRAM, stmt, null);
      } else if (type.equals(SyntaxNode.IF_THEN_STMT)) {
        open(stack, SyntaxNode.IF_CONSTRUCT, stmt, null);
      } else if (type.equals(SyntaxNode.NONLABEL_DO_STMT)) {
        open(stack, SyntaxNode.BLOCK_NONLABEL_DO_CONSTRUCT, stmt, null);
      } else if (type.equals(SyntaxNode.LABEL_DO_STMT)) {
        Matcher m = LABEL_DO.matcher(line.text);
        m.matches();
        open(stack, SyntaxNode.BLOCK_LABEL_DO_CONSTRUCT, stmt, m.group(1));
      } else if (type.equals(SyntaxNode.BLOCK_STMT)) {
        open(stack, SyntaxNode.BLOCK_CONSTRUCT, stmt, null);
      } else if (type.equals(SyntaxNode.ELSE_IF_STMT) ||
                 type.equals(SyntaxNode.ELSE_STMT)) {
        expectOpen(stack, line, SyntaxNode.IF_CONSTRUCT);
        stack.peek().add(stmt);
      } else if (type.equals(SyntaxNode.END_IF_STMT)) {
        close(stack, line, stmt, SyntaxNode.IF_CONSTRUCT);
      } else if (type.equals(SyntaxNode.END_DO_STMT)) {
        if (stack.peek().is(SyntaxNode.BLOCK_LABEL_DO_CONSTRUCT)) {
          close(stack, line, stmt, SyntaxNode.BLOCK_LABEL_DO_CONSTRUCT);
        } else {
          close(stack, line, stmt, SyntaxNode.BLOCK_NONLABEL_DO_CONSTRUCT);
        }
      } else if (type.equals(SyntaxNode.END_BLOCK_STMT)) {
        close(stack, line, stmt, SyntaxNode.BLOCK_CONSTRUCT);
      } else if (type.equals(SyntaxNode.END_MODULE_STMT)) {
        close(stack, line, stmt, SyntaxNode.MODULE);
      } else if (type.equals(SyntaxNode.END_SUBROUTINE_STMT)) {
        close(stack, line, stmt, SyntaxNode.SUBROUTINE_SUBPROGRAM);
      } else if (type.equals(SyntaxNode.END_FUNCTION_STMT)) {
        close(stack, line, stmt, SyntaxNode.FUNCTION_SUBPROGRAM);
      } else if (type.equals(SyntaxNode.END_STMT)) {
        String open = stack.peek().type();
        if (!isProgramUnit(open)) {
          throw error(line, "END does not close " + stack.peek());
        }
        close(stack, line, stmt, open);
      } else {
        if (stack.peek().is(SyntaxNode.PROGRAM)) {
          throw error(line, "statement outside of a program unit: "
                            + line.text);
        }
        stack.peek().add(stmt);
        closeLabelledDos(stack, line);
      }
    }

    if (stack.size() > 1) {
      SyntaxNode open = stack.peek();
      throw new ParseException(path, open.firstLine(), 0,
                               "unterminated " + open.type());
    }
    return program;
  }

  private SyntaxNode node(String type, LogicalLine line) {
    return new SyntaxNode(type, line.text, line.label, line.firstLine,
                          line.lastLine, line.included);
  }

  private void open(Deque<SyntaxNode> stack, String constructType,
                    SyntaxNode stmt, String doLabel) {
    SyntaxNode construct = new SyntaxNode(constructType, null, doLabel,
        stmt.firstLine(), stmt.lastLine(), stmt.included());
    construct.add(stmt);
    stack.peek().add(construct);
    stack.push(construct);
  }

  private void close(Deque<SyntaxNode> stack, LogicalLine line,
                     SyntaxNode endStmt, String constructType)
                                                  throws ParseException {
    expectOpen(stack, line, constructType);
    SyntaxNode construct = stack.pop();
    construct.add(endStmt);
    construct.extendTo(endStmt.lastLine());
    if (endStmt.label() != null) {
      closeLabelledDos(stack, line);
    }
  }

  /**
   * A labelled statement terminates every labelled DO waiting for it
   */
  private void closeLabelledDos(Deque<SyntaxNode> stack, LogicalLine line) {
    if (line.label == null) {
      return;
    }
    while (stack.peek().is(SyntaxNode.BLOCK_LABEL_DO_CONSTRUCT) &&
           line.label.equals(stack.peek().label())) {
      SyntaxNode construct = stack.pop();
      construct.extendTo(line.lastLine);
    }
  }

  private void expectOpen(Deque<SyntaxNode> stack, LogicalLine line,
                          String constructType) throws ParseException {
    SyntaxNode top = stack.peek();
    if (!top.is(constructType)) {
      throw error(line, "'" + line.text + "' does not match " +
                  (top.is(SyntaxNode.PROGRAM) ? "any open construct" :
                   top.type() + " opened at line " + top.firstLine()));
    }
  }

  private static boolean isProgramUnit(String type) {
    return type.equals(SyntaxNode.MODULE) ||
           type.equals(SyntaxNode.SUBROUTINE_SUBPROGRAM) ||
           type.equals(SyntaxNode.FUNCTION_SUBPROGRAM);
  }

  private static boolean isConstructStatement(String type) {
    return !type.equals(SyntaxNode.ASSIGNMENT_STMT) &&
           !type.equals(SyntaxNode.POINTER_ASSIGNMENT_STMT) &&
           !type.equals(SyntaxNode.CALL_STMT) &&
           !type.equals(SyntaxNode.CONTINUE_STMT) &&
           !type.equals(SyntaxNode.OTHER_STMT);
  }

  /**
   * @param text statement text without label
   * @return statement type name
   */
  static String statementType(String text) {
    String s = text.trim();
    String lower = s.toLowerCase();

    Matcher end = END.matcher(s);
    if (end.matches()) {
      String kind = end.group(1);
      if (kind == null) {
        return end.group(2) == null ? SyntaxNode.END_STMT
                                    : SyntaxNode.OTHER_STMT;
      }
      switch (kind.toLowerCase()) {
        case "module":
          return SyntaxNode.END_MODULE_STMT;
        case "subroutine":
          return SyntaxNode.END_SUBROUTINE_STMT;
        case "function":
          return SyntaxNode.END_FUNCTION_STMT;
        case "do":
          return SyntaxNode.END_DO_STMT;
        case "if":
          return SyntaxNode.END_IF_STMT;
        default:
          return SyntaxNode.END_BLOCK_STMT;
      }
    }
    Matcher module = MODULE.matcher(s);
    if (module.matches() && !module.group(1).equalsIgnoreCase("procedure")) {
      return SyntaxNode.MODULE_STMT;
    }
    if (SUBROUTINE.matcher(s).matches()) {
      return SyntaxNode.SUBROUTINE_STMT;
    }
    Matcher function = FUNCTION.matcher(s);
    if (function.matches() && isFunctionPrefix(function.group(1))) {
      return SyntaxNode.FUNCTION_STMT;
    }
    if (lower.equals("contains")) {
      return SyntaxNode.CONTAINS_STMT;
    }
    if (lower.matches("if\\s*\\(.*")) {
      int close = closingParen(s, s.indexOf('('));
      if (close < 0) {
        return SyntaxNode.OTHER_STMT;
      }
      String rest = s.substring(close + 1).trim();
      if (rest.equalsIgnoreCase("then")) {
        return SyntaxNode.IF_THEN_STMT;
      }
      return rest.isEmpty() ? SyntaxNode.OTHER_STMT : SyntaxNode.IF_STMT;
    }
    if (ELSE_IF.matcher(s).matches()) {
      return SyntaxNode.ELSE_IF_STMT;
    }
    if (lower.equals("else")) {
      return SyntaxNode.ELSE_STMT;
    }
    if (LABEL_DO.matcher(s).matches()) {
      return SyntaxNode.LABEL_DO_STMT;
    }
    if (NONLABEL_DO.matcher(s).matches()) {
      return SyntaxNode.NONLABEL_DO_STMT;
    }
    if (lower.equals("block")) {
      return SyntaxNode.BLOCK_STMT;
    }
    if (USE.matcher(s).matches()) {
      return SyntaxNode.USE_STMT;
    }
    if (CALL.matcher(s).matches()) {
      return SyntaxNode.CALL_STMT;
    }
    if (INCLUDE.matcher(s).matches()) {
      return SyntaxNode.INCLUDE_STMT;
    }
    if (TYPE_START.matcher(s).lookingAt() &&
        (s.contains("::") || topLevelAssign(s) < 0)) {
      return SyntaxNode.TYPE_DECLARATION_STMT;
    }
    int assign = topLevelAssign(s);
    if (assign >= 0) {
      return s.startsWith("=>", assign) ? SyntaxNode.POINTER_ASSIGNMENT_STMT
                                        : SyntaxNode.ASSIGNMENT_STMT;
    }
    if (lower.equals("continue")) {
      return SyntaxNode.CONTINUE_STMT;
    }
    return SyntaxNode.OTHER_STMT;
  }

  private static boolean isFunctionPrefix(String prefix) {
    String rest = prefix;
    Matcher m = PREFIX_WORD.matcher(rest);
    while (m.lookingAt()) {
      rest = rest.substring(m.end());
      m = PREFIX_WORD.matcher(rest);
    }
    rest = rest.trim();
    // A type may also come after the other prefixes
    if (rest.isEmpty()) {
      return true;
    }
    if (!TYPE_START.matcher(rest).lookingAt() && !rest.matches(
        "(?i)(integer|real|logical|complex|character|double\\s*precision)")) {
      return false;
    }
    String afterType = rest.replaceFirst("(?i)^.*?\\)\\s*", "");
    return !afterType.contains("=");
  }

  /**
   * @return offset of '=' or '=>' outside parentheses and strings, or -1
   */
  static int topLevelAssign(String s) {
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == '=' && depth == 0) {
        char prev = i > 0 ? s.charAt(i - 1) : ' ';
        char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
        if (prev != '=' && prev != '<' && prev != '>' && prev != '/' &&
            next != '=') {
          return i;
        }
      }
    }
    return -1;
  }

  /**
   * @param open offset of an opening parenthesis
   * @return offset of the matching closing parenthesis, or -1
   */
  static int closingParen(String s, int open) {
    int depth = 0;
    char quote = 0;
    for (int i = open; i >= 0 && i < s.length(); i++) {
      char c = s.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private int closingParen(LogicalLine line, int open) throws ParseException {
    int close = closingParen(line.text, open);
    if (close < 0) {
      throw error(line, "unbalanced parentheses");
    }
    return close;
  }

  private ParseException error(LogicalLine line, String msg) {
    return new ParseException(path, line.firstLine, 0, msg);
  }
}
