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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import exm.fortx.ir.Expressions.Parenthesis;
import exm.fortx.ir.Statements.Declaration;

/**
 * Whole-tree operations on IR nodes
 */
public class Nodes {

  /**
   * Copy a subtree.  The copy shares no node objects with the original
   * and carries no spans.
   */
  public static Node deepCopy(Node node) {
    List<List<Node>> groups = node.groups();
    List<List<Node>> copied = new ArrayList<List<Node>>(groups.size());
    for (List<Node> g: groups) {
      List<Node> c = new ArrayList<Node>(g.size());
      for (Node child: g) {
        c.add(deepCopy(child));
      }
      copied.add(c);
    }
    return node.rebuild(null, copied);
  }

  /**
   * Structural equivalence, as used to check regenerated source.
   * Ignores spans, comments and redundant parentheses, and compares
   * names without regard to case.  The specification and execution parts
   * of a routine or block are compared as one statement sequence, since
   * frontends may disagree on where directives between them belong.
   */
  public static boolean equivalent(Node a, Node b) {
    a = stripParens(a);
    b = stripParens(b);
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a.kind() != b.kind() || !a.label().equals(b.label())) {
      return false;
    }
    if (a.kind() == NodeKind.DECLARATION && !typesEquivalent(
        ((Declaration)a).type(), ((Declaration)b).type())) {
      return false;
    }

    List<List<Node>> ga = comparedGroups(a);
    List<List<Node>> gb = comparedGroups(b);
    if (ga.size() != gb.size()) {
      return false;
    }
    for (int i = 0; i < ga.size(); i++) {
      List<Node> la = withoutComments(ga.get(i));
      List<Node> lb = withoutComments(gb.get(i));
      if (la.size() != lb.size()) {
        return false;
      }
      for (int j = 0; j < la.size(); j++) {
        if (!equivalent(la.get(j), lb.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean typesEquivalent(TypeSpec a, TypeSpec b) {
    return equivalentOrNull(a.kind(), b.kind()) &&
           equivalentOrNull(a.length(), b.length());
  }

  private static boolean equivalentOrNull(Node a, Node b) {
    if (a == null || b == null) {
      return a == b;
    }
    return equivalent(a, b);
  }

  private static List<List<Node>> comparedGroups(Node n) {
    List<List<Node>> groups = n.groups();
    if (n.kind() == NodeKind.ROUTINE || n.kind() == NodeKind.BLOCK) {
      List<Node> stmts = new ArrayList<Node>(groups.get(0));
      stmts.addAll(groups.get(1));
      List<List<Node>> result = new ArrayList<List<Node>>();
      result.add(stmts);
      result.addAll(groups.subList(2, groups.size()));
      return result;
    }
    return groups;
  }

  private static Node stripParens(Node n) {
    while (n instanceof Parenthesis) {
      n = ((Parenthesis)n).inner();
    }
    return n;
  }

  private static List<Node> withoutComments(List<Node> nodes) {
    List<Node> result = new ArrayList<Node>(nodes.size());
    for (Node n: nodes) {
      if (n.kind() != NodeKind.COMMENT) {
        result.add(n);
      }
    }
    return result;
  }

  /**
   * Content hash of a subtree.  Spans are ignored; everything else,
   * comments included, contributes.
   * @return hex string
   */
  public static String fingerprint(Node node) {
    Hasher h = Hashing.sha256().newHasher();
    hash(h, node);
    return h.hash().toString();
  }

  /**
   * Combine fingerprints, order sensitive
   */
  public static String combine(List<String> fingerprints) {
    Hasher h = Hashing.sha256().newHasher();
    for (String fp: fingerprints) {
      h.putString(fp, StandardCharsets.UTF_8);
      h.putChar(';');
    }
    return h.hash().toString();
  }

  private static void hash(Hasher h, Node node) {
    h.putInt(node.kind().ordinal());
    h.putString(node.label(), StandardCharsets.UTF_8);
    List<List<Node>> groups = node.groups();
    h.putInt(groups.size());
    for (List<Node> g: groups) {
      h.putInt(g.size());
      for (Node child: g) {
        hash(h, child);
      }
    }
  }

  /**
   * Compact single-line form, e.g. (binary + (variable n) (literal integer 1))
   */
  public static String sexpr(Node node) {
    StringBuilder sb = new StringBuilder();
    sexpr(sb, node);
    return sb.toString();
  }

  private static void sexpr(StringBuilder sb, Node node) {
    sb.append("(").append(node.kind().toString().toLowerCase());
    String label = node.label();
    if (label.length() > 0) {
      sb.append(" ").append(label);
    }
    for (List<Node> g: node.groups()) {
      if (g.isEmpty()) {
        sb.append(" _");
      }
      for (Node child: g) {
        sb.append(" ");
        sexpr(sb, child);
      }
    }
    sb.append(")");
  }

  /**
   * Multi-line indented dump, for debugging
   */
  public static String dump(Node node) {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    dump(writer, node, 0);
    writer.flush();
    return sw.toString();
  }

  private static void dump(PrintWriter writer, Node node, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.println(node.toString());
    for (Node child: node.children()) {
      dump(writer, child, indent + 2);
    }
  }
}
