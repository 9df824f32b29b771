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
package exm.fortx.sched;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.fortx.ir.UnitId;

/**
 * Strongly connected components of a call graph, found with Tarjan's
 * algorithm, and their grouping into levels that can run concurrently.
 */
public class Condensation {

  /**
   * A set of mutually recursive routines, or a single routine
   */
  public static class Component {
    /** Sorted */
    private final List<UnitId> members;
    private final boolean cyclic;

    Component(List<UnitId> members, boolean cyclic) {
      this.members = members;
      this.cyclic = cyclic;
    }

    public List<UnitId> members() {
      return members;
    }

    /**
     * @return true if more than one routine, or a routine calling itself
     */
    public boolean isCyclic() {
      return cyclic;
    }

    @Override
    public String toString() {
      return (cyclic ? "cycle" : "") + members;
    }
  }

  /** Callees before callers */
  private final List<Component> components;
  private final Map<UnitId, Component> componentOf;
  /** Edges between components, as indexes into components */
  private final List<List<Integer>> calleeComponents;

  private Condensation(List<Component> components,
                       Map<UnitId, Component> componentOf,
                       List<List<Integer>> calleeComponents) {
    this.components = components;
    this.componentOf = componentOf;
    this.calleeComponents = calleeComponents;
  }

  /**
   * @param ids routines to order
   * @param callees resolved callees of each routine; callees outside
   *                ids are ignored
   */
  public static Condensation compute(List<UnitId> ids,
                                     Map<UnitId, List<UnitId>> callees) {
    Tarjan t = new Tarjan(callees);
    List<UnitId> sorted = new ArrayList<UnitId>(ids);
    Collections.sort(sorted);
    for (UnitId id: sorted) {
      t.nodes.add(id);
    }
    for (UnitId id: sorted) {
      if (!t.index.containsKey(id)) {
        t.strongConnect(id);
      }
    }

    Map<UnitId, Integer> compIndex = new HashMap<UnitId, Integer>();
    Map<UnitId, Component> componentOf = new HashMap<UnitId, Component>();
    for (int i = 0; i < t.result.size(); i++) {
      for (UnitId id: t.result.get(i).members) {
        compIndex.put(id, i);
        componentOf.put(id, t.result.get(i));
      }
    }
    List<List<Integer>> calleeComps = new ArrayList<List<Integer>>();
    for (int i = 0; i < t.result.size(); i++) {
      List<Integer> targets = new ArrayList<Integer>();
      for (UnitId id: t.result.get(i).members) {
        for (UnitId callee: t.callees(id)) {
          Integer j = compIndex.get(callee);
          if (j != null && j != i && !targets.contains(j)) {
            targets.add(j);
          }
        }
      }
      calleeComps.add(targets);
    }
    return new Condensation(ImmutableList.copyOf(t.result), componentOf,
                            calleeComps);
  }

  /**
   * Tarjan's algorithm.  Components come out callees first.
   */
  private static class Tarjan {
    final Map<UnitId, List<UnitId>> callees;
    final Set<UnitId> nodes = new HashSet<UnitId>();
    final Map<UnitId, Integer> index = new HashMap<UnitId, Integer>();
    final Map<UnitId, Integer> lowlink = new HashMap<UnitId, Integer>();
    final List<UnitId> stack = new ArrayList<UnitId>();
    final Map<UnitId, Boolean> onStack = new HashMap<UnitId, Boolean>();
    final List<Component> result = new ArrayList<Component>();
    int next = 0;

    Tarjan(Map<UnitId, List<UnitId>> callees) {
      this.callees = callees;
    }

    List<UnitId> callees(UnitId id) {
      List<UnitId> result = new ArrayList<UnitId>();
      List<UnitId> cs = callees.get(id);
      if (cs != null) {
        for (UnitId c: cs) {
          if (nodes.contains(c)) {
            result.add(c);
          }
        }
      }
      Collections.sort(result);
      return result;
    }

    void strongConnect(UnitId v) {
      index.put(v, next);
      lowlink.put(v, next);
      next++;
      stack.add(v);
      onStack.put(v, true);

      boolean selfCall = false;
      for (UnitId w: callees(v)) {
        if (w.equals(v)) {
          selfCall = true;
        }
        if (!index.containsKey(w)) {
          strongConnect(w);
          lowlink.put(v, Math.min(lowlink.get(v), lowlink.get(w)));
        } else if (Boolean.TRUE.equals(onStack.get(w))) {
          lowlink.put(v, Math.min(lowlink.get(v), index.get(w)));
        }
      }

      if (lowlink.get(v).equals(index.get(v))) {
        List<UnitId> members = new ArrayList<UnitId>();
        UnitId w;
        do {
          w = stack.remove(stack.size() - 1);
          onStack.put(w, false);
          members.add(w);
        } while (!w.equals(v));
        Collections.sort(members);
        result.add(new Component(ImmutableList.copyOf(members),
                                 members.size() > 1 || selfCall));
      }
    }
  }

  /**
   * @return components, callees before callers
   */
  public List<Component> components() {
    return components;
  }

  public Component componentOf(UnitId id) {
    return componentOf.get(id);
  }

  /**
   * Group components into levels.  Components within a level don't call
   * each other.
   * @param order CALLEE_FIRST puts leaves in the first level,
   *              CALLER_FIRST puts routines nobody calls first,
   *              NONE puts everything in one level
   */
  public List<List<Component>> levels(PassOrder order) {
    int n = components.size();
    int[] level = new int[n];
    if (order == PassOrder.NONE) {
      List<List<Component>> single = new ArrayList<List<Component>>();
      single.add(components);
      return single;
    } else if (order == PassOrder.CALLEE_FIRST) {
      // Components are already callees first
      for (int i = 0; i < n; i++) {
        int l = 0;
        for (int j: calleeComponents.get(i)) {
          l = Math.max(l, level[j] + 1);
        }
        level[i] = l;
      }
    } else {
      for (int i = n - 1; i >= 0; i--) {
        for (int j: calleeComponents.get(i)) {
          level[j] = Math.max(level[j], level[i] + 1);
        }
      }
    }

    int max = -1;
    for (int l: level) {
      max = Math.max(max, l);
    }
    List<List<Component>> result = new ArrayList<List<Component>>();
    for (int l = 0; l <= max; l++) {
      result.add(new ArrayList<Component>());
    }
    for (int i = 0; i < n; i++) {
      result.get(level[i]).add(components.get(i));
    }
    return result;
  }
}
