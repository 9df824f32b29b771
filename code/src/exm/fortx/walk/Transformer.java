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
package exm.fortx.walk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.Node;
import exm.fortx.ir.Nodes;

/**
 * Copy-on-write rewriting of an IR subtree.
 *
 * Subclasses return a {@link Replacement} for each node the filter
 * accepts.  A node whose children all come back as the same objects is
 * returned unchanged, span included; any other node is rebuilt and loses
 * its span.  Untouched subtrees are shared with the input tree.
 *
 * In PRE order a replacement is not descended into.  In POST order the
 * callback sees the node with its children already rewritten, while the
 * context still holds the original ancestors.
 */
public abstract class Transformer {

  public static enum Order {
    PRE,
    POST,
  }

  private final Order order;
  private final NodeFilter filter;

  protected Transformer(Order order, NodeFilter filter) {
    this.order = order;
    this.filter = filter;
  }

  protected Transformer(Order order) {
    this(order, NodeFilter.all());
  }

  public abstract Replacement transform(Node node, WalkContext context);

  /**
   * Rewrite a tree
   * @return the new root, identical to root if nothing changed
   */
  public Node apply(Node root) {
    List<Node> result = rewrite(root, new WalkContext());
    if (result.size() != 1) {
      throw new FortxRuntimeError("Root of a transformation must be " +
            "replaced by exactly one node, got " + result.size());
    }
    Node newRoot = result.get(0);
    if (newRoot == root) {
      return root;
    }
    Set<Node> seen = Collections.newSetFromMap(
                              new IdentityHashMap<Node, Boolean>());
    return unshare(newRoot, seen);
  }

  /**
   * Rewrite a tree whose root keeps its class, e.g. a routine
   */
  @SuppressWarnings("unchecked")
  public <T extends Node> T applyTyped(T root) {
    Node result = apply(root);
    if (result.getClass() != root.getClass()) {
      throw new FortxRuntimeError("Transformation replaced " + root +
                                  " with " + result);
    }
    return (T)result;
  }

  private List<Node> rewrite(Node node, WalkContext context) {
    boolean accepted = filter.accepts(node);
    if (accepted && order == Order.PRE) {
      Replacement r = transform(node, context);
      if (!r.isKeep()) {
        return r.nodes();
      }
    }

    Node current = node;
    if (filter.descendInto(node)) {
      current = rewriteChildren(node, context);
    }

    if (accepted && order == Order.POST) {
      Replacement r = transform(current, context);
      if (!r.isKeep()) {
        return r.nodes();
      }
    }
    return Collections.singletonList(current);
  }

  private Node rewriteChildren(Node node, WalkContext context) {
    List<List<Node>> groups = node.groups();
    List<List<Node>> newGroups = new ArrayList<List<Node>>(groups.size());
    boolean changed = false;
    context.push(node);
    try {
      for (int gi = 0; gi < groups.size(); gi++) {
        List<Node> group = groups.get(gi);
        List<Node> newGroup = new ArrayList<Node>(group.size());
        for (Node child: group) {
          List<Node> repl = rewrite(child, context);
          if (repl.size() != 1 || repl.get(0) != child) {
            changed = true;
          }
          if (repl.size() > 1 && !node.isListGroup(gi)) {
            throw new FortxRuntimeError("Cannot replace " + child + " in "
                + node.kind() + " with " + repl.size() + " nodes");
          }
          newGroup.addAll(repl);
        }
        newGroups.add(newGroup);
      }
    } finally {
      context.pop();
    }
    if (!changed) {
      return node;
    }
    return node.withGroups(newGroups);
  }

  /**
   * Copy the second and later occurrences of any node object, so that
   * each object occurs once in the output tree.  Parents rebuilt only to
   * hold such a copy keep their span, as their text is unchanged.
   */
  private static Node unshare(Node node, Set<Node> seen) {
    if (!seen.add(node)) {
      return Nodes.deepCopy(node);
    }
    List<List<Node>> groups = node.groups();
    List<List<Node>> newGroups = null;
    for (int gi = 0; gi < groups.size(); gi++) {
      List<Node> group = groups.get(gi);
      for (int ci = 0; ci < group.size(); ci++) {
        Node child = group.get(ci);
        Node newChild = unshare(child, seen);
        if (newChild != child) {
          if (newGroups == null) {
            newGroups = new ArrayList<List<Node>>();
            for (List<Node> g: groups) {
              newGroups.add(new ArrayList<Node>(g));
            }
          }
          newGroups.get(gi).set(ci, newChild);
        }
      }
    }
    if (newGroups == null) {
      return node;
    }
    return node.withGroups(newGroups).withSpan(node.span());
  }
}
