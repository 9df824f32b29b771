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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.ir.Units.Routine;

/**
 * Arena-style index over one tree: a dense id per node plus parent
 * lookup.  Nodes don't store parents, so context queries come here.
 * Building the index also checks that no node object appears twice.
 */
public class NodeIndex {
  private final Node root;
  private final Map<Node, Integer> ids = new IdentityHashMap<Node, Integer>();
  private final List<Node> nodes = new ArrayList<Node>();
  private final List<Node> parents = new ArrayList<Node>();

  public NodeIndex(Node root) {
    this.root = root;
    Deque<Node> stack = new ArrayDeque<Node>();
    add(root, null);
    stack.push(root);
    while (!stack.isEmpty()) {
      Node curr = stack.pop();
      List<Node> children = curr.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        Node child = children.get(i);
        add(child, curr);
        stack.push(child);
      }
    }
  }

  private void add(Node node, Node parent) {
    if (ids.containsKey(node)) {
      throw new FortxRuntimeError("Node occurs more than once in tree: "
                                  + node);
    }
    ids.put(node, nodes.size());
    nodes.add(node);
    parents.add(parent);
  }

  public Node root() {
    return root;
  }

  public int size() {
    return nodes.size();
  }

  public boolean contains(Node node) {
    return ids.containsKey(node);
  }

  /**
   * @return dense id of node, stable for this index only
   */
  public int id(Node node) {
    Integer id = ids.get(node);
    if (id == null) {
      throw new FortxRuntimeError("Node not in tree: " + node);
    }
    return id;
  }

  public Node node(int id) {
    return nodes.get(id);
  }

  /**
   * @return parent, or null for the root
   */
  public Node parent(Node node) {
    return parents.get(id(node));
  }

  /**
   * @return ancestors from the parent up to the root
   */
  public List<Node> ancestors(Node node) {
    List<Node> result = new ArrayList<Node>();
    Node curr = parent(node);
    while (curr != null) {
      result.add(curr);
      curr = parent(curr);
    }
    return result;
  }

  /**
   * @return innermost routine containing node, or null
   */
  public Routine enclosingRoutine(Node node) {
    for (Node a: ancestors(node)) {
      if (a instanceof Routine) {
        return (Routine)a;
      }
    }
    return null;
  }
}
