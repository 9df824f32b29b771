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

import exm.fortx.ir.Node;

/**
 * Depth-first traversal of IR subtrees
 */
public class Walker {

  /**
   * Visit parents before their children
   */
  public static void preOrder(Node root, NodeFilter filter,
                              Visitor visitor) {
    walk(root, filter, visitor, new WalkContext(), true);
  }

  /**
   * Visit children before their parents
   */
  public static void postOrder(Node root, NodeFilter filter,
                               Visitor visitor) {
    walk(root, filter, visitor, new WalkContext(), false);
  }

  public static void preOrder(Node root, Visitor visitor) {
    preOrder(root, NodeFilter.all(), visitor);
  }

  private static void walk(Node node, NodeFilter filter, Visitor visitor,
                           WalkContext context, boolean pre) {
    boolean accepted = filter.accepts(node);
    if (pre && accepted) {
      visitor.visit(node, context);
    }
    if (filter.descendInto(node)) {
      context.push(node);
      for (Node child: node.children()) {
        walk(child, filter, visitor, context, pre);
      }
      context.pop();
    }
    if (accepted) {
      if (!pre) {
        visitor.visit(node, context);
      }
      visitor.leave(node, context);
    }
  }
}
