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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;

/**
 * Selects the node kinds a visitor or transformer is called for.
 *
 * A plain filter only decides which nodes are handed to the callback;
 * traversal still reaches every node.  A pruning filter also stops the
 * traversal at nodes it does not accept, so that e.g. a statement-level
 * pass never walks expression trees.
 */
public class NodeFilter {
  private final Set<NodeKind> kinds;
  private final boolean prune;

  private NodeFilter(Set<NodeKind> kinds, boolean prune) {
    this.kinds = kinds;
    this.prune = prune;
  }

  public static NodeFilter all() {
    return new NodeFilter(EnumSet.allOf(NodeKind.class), false);
  }

  public static NodeFilter of(NodeKind first, NodeKind ...rest) {
    return new NodeFilter(EnumSet.of(first, rest), false);
  }

  public static NodeFilter of(Set<NodeKind> kinds) {
    if (kinds.isEmpty()) {
      return new NodeFilter(EnumSet.noneOf(NodeKind.class), false);
    }
    return new NodeFilter(EnumSet.copyOf(kinds), false);
  }

  /**
   * Program units and statements, without expressions
   */
  public static NodeFilter statements() {
    EnumSet<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
    for (NodeKind k: NodeKind.values()) {
      if (!k.isExpression()) {
        kinds.add(k);
      }
    }
    return new NodeFilter(kinds, false);
  }

  /**
   * @return filter with the same kinds that doesn't descend into
   *         subtrees rooted at other kinds
   */
  public NodeFilter prune() {
    return new NodeFilter(kinds, true);
  }

  public boolean accepts(Node node) {
    return kinds.contains(node.kind());
  }

  public boolean accepts(NodeKind kind) {
    return kinds.contains(kind);
  }

  /**
   * @return true if traversal should visit the children of node
   */
  public boolean descendInto(Node node) {
    return !prune || kinds.contains(node.kind());
  }

  public boolean isPruning() {
    return prune;
  }

  @Override
  public String toString() {
    return (prune ? "prune" : "filter") +
           Arrays.toString(kinds.toArray());
  }
}
