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
import java.util.List;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Units.Routine;

/**
 * Ancestors of the node currently being visited.  Maintained by the
 * traversal, so no parent index is needed during a walk.
 */
public class WalkContext {
  /** Outermost first */
  private final List<Node> stack = new ArrayList<Node>();

  void push(Node node) {
    stack.add(node);
  }

  void pop() {
    stack.remove(stack.size() - 1);
  }

  /**
   * @return number of ancestors of the current node
   */
  public int depth() {
    return stack.size();
  }

  /**
   * @return parent of the current node, or null at the root of the walk
   */
  public Node parent() {
    return stack.isEmpty() ? null : stack.get(stack.size() - 1);
  }

  /**
   * @return ancestors, innermost first
   */
  public List<Node> ancestors() {
    List<Node> result = new ArrayList<Node>(stack.size());
    for (int i = stack.size() - 1; i >= 0; i--) {
      result.add(stack.get(i));
    }
    return result;
  }

  /**
   * @return innermost routine containing the current node, or null
   */
  public Routine enclosingRoutine() {
    for (int i = stack.size() - 1; i >= 0; i--) {
      if (stack.get(i) instanceof Routine) {
        return (Routine)stack.get(i);
      }
    }
    return null;
  }

  /**
   * Count ancestors of the given kinds, up to the innermost routine
   */
  public int countEnclosing(NodeKind ...kinds) {
    int count = 0;
    for (int i = stack.size() - 1; i >= 0; i--) {
      Node n = stack.get(i);
      if (n.kind() == NodeKind.ROUTINE) {
        break;
      }
      for (NodeKind k: kinds) {
        if (n.kind() == k) {
          count++;
          break;
        }
      }
    }
    return count;
  }

  public boolean within(NodeKind kind) {
    for (Node n: stack) {
      if (n.kind() == kind) {
        return true;
      }
    }
    return false;
  }
}
