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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.fortx.common.exceptions.ParseException;

/**
 * Tokenizer for the text of one logical statement
 */
public class Scanner {

  public static enum TokenKind {
    NAME,
    INT,
    REAL,
    STRING,
    LOGICAL,
    /** Operator, dotted operators as written */
    OP,
    ASSIGN,
    ARROW,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    DCOLON,
    END,
  }

  public static class Token {
    public final TokenKind kind;
    public final String text;
    /** Offset in statement text */
    public final int pos;

    public Token(TokenKind kind, String text, int pos) {
      this.kind = kind;
      this.text = text;
      this.pos = pos;
    }

    public boolean is(TokenKind k) {
      return kind == k;
    }

    public boolean isOp(String op) {
      return kind == TokenKind.OP && text.equalsIgnoreCase(op);
    }

    public boolean isName(String name) {
      return kind == TokenKind.NAME && text.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
      return kind == TokenKind.END ? "end of statement" : "'" + text + "'";
    }
  }

  private static final Set<String> DOT_WORDS = new HashSet<String>(
      Arrays.asList("eq", "ne", "lt", "le", "gt", "ge", "and", "or", "not",
                    "eqv", "neqv"));

  private static final String[] SYMBOL_OPS = {
    "**", "//", "/=", "==", "<=", ">=", "*", "/", "+", "-", "<", ">",
  };

  private final String path;
  private final int line;

  public Scanner(String path, int line) {
    this.path = path;
    this.line = line;
  }

  public List<Token> scan(String text) throws ParseException {
    List<Token> tokens = new ArrayList<Token>();
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      int start = i;
      if (Character.isLetter(c)) {
        while (i < n && isNameChar(text.charAt(i))) {
          i++;
        }
        tokens.add(new Token(TokenKind.NAME, text.substring(start, i), start));
      } else if (Character.isDigit(c) ||
                 (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
        i = number(tokens, text, i);
      } else if (c == '.') {
        int j = i + 1;
        while (j < n && Character.isLetter(text.charAt(j))) {
          j++;
        }
        String word = text.substring(i + 1, j).toLowerCase();
        if (j >= n || text.charAt(j) != '.') {
          throw error(start, "unexpected '.'");
        }
        j++;
        if (word.equals("true") || word.equals("false")) {
          j = kindSuffix(text, j);
          tokens.add(new Token(TokenKind.LOGICAL, text.substring(i, j), start));
        } else if (DOT_WORDS.contains(word)) {
          tokens.add(new Token(TokenKind.OP, text.substring(i, j), start));
        } else {
          throw error(start, "unknown operator ." + word + ".");
        }
        i = j;
      } else if (c == '\'' || c == '"') {
        i = string(tokens, text, i);
      } else if (text.startsWith("=>", i)) {
        tokens.add(new Token(TokenKind.ARROW, "=>", start));
        i += 2;
      } else if (text.startsWith("::", i)) {
        tokens.add(new Token(TokenKind.DCOLON, "::", start));
        i += 2;
      } else if (c == '(') {
        tokens.add(new Token(TokenKind.LPAREN, "(", start));
        i++;
      } else if (c == ')') {
        tokens.add(new Token(TokenKind.RPAREN, ")", start));
        i++;
      } else if (c == ',') {
        tokens.add(new Token(TokenKind.COMMA, ",", start));
        i++;
      } else if (c == ':') {
        tokens.add(new Token(TokenKind.COLON, ":", start));
        i++;
      } else {
        String op = symbolOp(text, i);
        if (op != null) {
          tokens.add(new Token(TokenKind.OP, op, start));
          i += op.length();
        } else if (c == '=') {
          tokens.add(new Token(TokenKind.ASSIGN, "=", start));
          i++;
        } else {
          throw error(start, "unexpected character '" + c + "'");
        }
      }
    }
    tokens.add(new Token(TokenKind.END, "", n));
    return tokens;
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static String symbolOp(String text, int i) {
    for (String op: SYMBOL_OPS) {
      if (text.startsWith(op, i)) {
        return op;
      }
    }
    return null;
  }

  private int number(List<Token> tokens, String text, int start) {
    int n = text.length();
    int i = start;
    boolean real = false;
    while (i < n && Character.isDigit(text.charAt(i))) {
      i++;
    }
    if (i < n && text.charAt(i) == '.' && !dotOperatorAt(text, i)) {
      real = true;
      i++;
      while (i < n && Character.isDigit(text.charAt(i))) {
        i++;
      }
    }
    if (i < n && "eEdD".indexOf(text.charAt(i)) >= 0) {
      int j = i + 1;
      if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
        j++;
      }
      if (j < n && Character.isDigit(text.charAt(j))) {
        while (j < n && Character.isDigit(text.charAt(j))) {
          j++;
        }
        real = true;
        i = j;
      }
    }
    i = kindSuffix(text, i);
    tokens.add(new Token(real ? TokenKind.REAL : TokenKind.INT,
                         text.substring(start, i), start));
    return i;
  }

  private static int kindSuffix(String text, int i) {
    if (i < text.length() && text.charAt(i) == '_') {
      i++;
      while (i < text.length() && isNameChar(text.charAt(i))) {
        i++;
      }
    }
    return i;
  }

  /**
   * @return true if a dotted operator or logical literal starts at i
   */
  private static boolean dotOperatorAt(String text, int i) {
    int j = i + 1;
    while (j < text.length() && Character.isLetter(text.charAt(j))) {
      j++;
    }
    if (j == i + 1 || j >= text.length() || text.charAt(j) != '.') {
      return false;
    }
    String word = text.substring(i + 1, j).toLowerCase();
    return DOT_WORDS.contains(word) || word.equals("true") ||
           word.equals("false");
  }

  private int string(List<Token> tokens, String text, int start)
                                              throws ParseException {
    char quote = text.charAt(start);
    int i = start + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == quote) {
        if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        tokens.add(new Token(TokenKind.STRING,
                             text.substring(start, i + 1), start));
        return i + 1;
      }
      i++;
    }
    throw error(start, "unterminated character literal");
  }

  private ParseException error(int pos, String msg) {
    return new ParseException(path, line, 0, msg + " at offset " + pos);
  }
}
