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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fortx.common.exceptions.FortxRuntimeError;

/**
 * Immutable IR tree element.
 *
 * Children are organised into a fixed number of ordered groups per node
 * kind.  A list group holds any number of statements; every other group
 * is an optional slot holding zero or one node.  Rewriting a node is done
 * by {@link #withGroups(List)}, which builds a fresh node of the same kind
 * with no source span: only untouched nodes keep the text they were
 * parsed from.
 *
 * Nodes have no parent pointers.  Ask the owning source unit's
 * {@link NodeIndex} for parents.
 */
public abstract class Node {
  private final SourceSpan span;

  protected Node(SourceSpan span) {
    this.span = span;
  }

  public abstract NodeKind kind();

  /**
   * @return the source lines this node was parsed from, or null if
   *         the node was synthesized or rebuilt
   */
  public SourceSpan span() {
    return span;
  }

  /**
   * @return child groups in fixed order, never null
   */
  public abstract List<List<Node>> groups();

  /**
   * @param group
   * @return true if the group may hold any number of nodes
   */
  public abstract boolean isListGroup(int group);

  /**
   * Own attributes of the node, excluding children, in canonical form.
   * Names are lower case.  Two nodes with equal kind, label and
   * equivalent children denote the same program.
   */
  public abstract String label();

  protected abstract Node rebuild(SourceSpan span, List<List<Node>> groups);

  /**
   * @param groups replacement children, same shape as {@link #groups()}
   * @return new node with no span
   */
  public Node withGroups(List<List<Node>> groups) {
    List<List<Node>> current = groups();
    if (groups.size() != current.size()) {
      throw new FortxRuntimeError(kind() + " has " + current.size() +
                                  " child groups, got " + groups.size());
    }
    for (int i = 0; i < groups.size(); i++) {
      if (!isListGroup(i) && groups.get(i).size() > 1) {
        throw new FortxRuntimeError("Slot " + i + " of " + kind() +
                                    " can hold at most one node");
      }
    }
    return rebuild(null, groups);
  }

  public Node withSpan(SourceSpan newSpan) {
    return rebuild(newSpan, groups());
  }

  /**
   * @return all children, in group order
   */
  public List<Node> children() {
    List<List<Node>> groups = groups();
    if (groups.isEmpty()) {
      return Collections.emptyList();
    }
    List<Node> result = new ArrayList<Node>();
    for (List<Node> g: groups) {
      result.addAll(g);
    }
    return result;
  }

  @Override
  public String toString() {
    String label = label();
    String s = kind().toString().toLowerCase();
    if (label.length() > 0) {
      s += " " + label;
    }
    if (span != null) {
      s += " @" + span;
    }
    return s;
  }

  /*
   * Helpers for subclasses
   */

  protected static List<Node> opt(Node node) {
    if (node == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(node);
  }

  protected static Node first(List<Node> group) {
    return group.isEmpty() ? null : group.get(0);
  }

  protected static List<Node> list(List<? extends Node> nodes) {
    if (nodes == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(nodes);
  }

  @SafeVarargs
  protected static List<List<Node>> groupsOf(List<Node> ...groups) {
    return ImmutableList.copyOf(groups);
  }
}
