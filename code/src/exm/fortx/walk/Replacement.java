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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fortx.ir.Node;

/**
 * What a {@link Transformer} does with a node
 */
public class Replacement {
  private static final Replacement KEEP = new Replacement(null);
  private static final Replacement DELETE =
          new Replacement(Collections.<Node>emptyList());

  /** Null means keep */
  private final List<Node> nodes;

  private Replacement(List<Node> nodes) {
    this.nodes = nodes;
  }

  public static Replacement keep() {
    return KEEP;
  }

  public static Replacement delete() {
    return DELETE;
  }

  public static Replacement of(Node node) {
    return new Replacement(ImmutableList.of(node));
  }

  /**
   * Several nodes are only allowed where the node sits in a statement
   * list
   */
  public static Replacement of(List<? extends Node> nodes) {
    return new Replacement(ImmutableList.<Node>copyOf(nodes));
  }

  public boolean isKeep() {
    return nodes == null;
  }

  public boolean isDelete() {
    return nodes != null && nodes.isEmpty();
  }

  /**
   * @return replacement nodes; must not be called on keep
   */
  public List<Node> nodes() {
    assert(nodes != null);
    return nodes;
  }

  @Override
  public String toString() {
    if (nodes == null) {
      return "keep";
    }
    return nodes.isEmpty() ? "delete" : "replace" + nodes;
  }
}
