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
import java.util.List;

import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.frontend.Frontend;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.Routine;
import exm.fortx.resolve.Resolution;

/**
 * One parsed source file: raw text, the current tree and the side
 * tables computed for it.  The root is replaced as a whole when a
 * routine in the file is rewritten; readers always see a complete tree.
 */
public class SourceUnit {
  private final String path;
  private final String text;
  private final LineTable lines;
  private final Frontend frontend;

  private volatile FileNode root;
  private volatile Resolution resolution;

  /** Index for current root, built on demand.  Guarded by this */
  private NodeIndex index;

  public SourceUnit(String path, String text, Frontend frontend,
                    FileNode root) {
    this.path = path;
    this.text = text;
    this.lines = new LineTable(text);
    this.frontend = frontend;
    this.root = root;
  }

  public String path() {
    return path;
  }

  /** @return the original text, unchanged by rewrites */
  public String text() {
    return text;
  }

  public String text(SourceSpan span) {
    return text.substring(span.startOffset(), span.endOffset());
  }

  public LineTable lines() {
    return lines;
  }

  public Frontend frontend() {
    return frontend;
  }

  public FileNode root() {
    return root;
  }

  public synchronized void replaceRoot(FileNode newRoot) {
    this.root = newRoot;
  }

  /**
   * @return resolver side tables, or null if not resolved yet
   */
  public Resolution resolution() {
    return resolution;
  }

  public void setResolution(Resolution resolution) {
    this.resolution = resolution;
  }

  public synchronized NodeIndex index() {
    FileNode current = root;
    if (index == null || index.root() != current) {
      index = new NodeIndex(current);
    }
    return index;
  }

  /**
   * @return ids of all modules and routines in this file, contained
   *         routines included
   */
  public List<UnitId> unitIds() {
    List<UnitId> result = new ArrayList<UnitId>();
    FileNode r = root;
    for (Module m: r.modules()) {
      UnitId mid = UnitId.module(m.name());
      result.add(mid);
      for (Routine routine: m.routines()) {
        addRoutineIds(result, mid.member(routine.name()), routine);
      }
    }
    for (Routine routine: r.routines()) {
      addRoutineIds(result, UnitId.external(routine.name()), routine);
    }
    return result;
  }

  private static void addRoutineIds(List<UnitId> result, UnitId id,
                                    Routine routine) {
    result.add(id);
    for (Routine member: routine.routines()) {
      addRoutineIds(result, id.member(member.name()), member);
    }
  }

  /**
   * @param id
   * @return current module or routine node, or null if not in this file
   */
  public Node find(UnitId id) {
    FileNode r = root;
    List<String> parts = id.parts();
    Node curr;
    int depth;
    if (parts.get(0).isEmpty()) {
      curr = r;
      depth = 1;
    } else {
      curr = findNamed(r.body(), NodeKind.MODULE, parts.get(0));
      depth = 1;
    }
    for (; curr != null && depth < parts.size(); depth++) {
      List<Node> candidates;
      if (curr instanceof FileNode) {
        candidates = ((FileNode)curr).body();
      } else if (curr instanceof Module) {
        candidates = ((Module)curr).members();
      } else {
        candidates = ((Routine)curr).members();
      }
      curr = findNamed(candidates, NodeKind.ROUTINE, parts.get(depth));
    }
    return curr;
  }

  /**
   * Swap in a new version of a routine, copying the path from the root.
   * The contained routines of the current version are kept, since they
   * are units in their own right and may have been rewritten meanwhile.
   * @return the replaced routine
   */
  public synchronized Routine replaceRoutine(UnitId id, Routine replacement) {
    List<String> parts = id.parts();
    if (parts.size() < 2) {
      throw new FortxRuntimeError("Not a routine id: " + id);
    }
    Routine[] old = new Routine[1];
    FileNode r = root;
    Node newRoot;
    if (parts.get(0).isEmpty()) {
      newRoot = replaceMember(r, 0, parts, 1, replacement, old);
    } else {
      int mi = indexOfNamed(r.body(), NodeKind.MODULE, parts.get(0), id);
      Node newModule = replaceMember(r.body().get(mi), 1, parts, 1,
                                     replacement, old);
      newRoot = replaceChild(r, 0, mi, newModule);
    }
    this.root = (FileNode)newRoot;
    return old[0];
  }

  /**
   * Insert a routine right after an existing one, in the same module,
   * host routine or file
   * @return id of the inserted routine
   */
  public synchronized UnitId addRoutine(UnitId sibling, Routine routine) {
    List<String> parts = sibling.parts();
    if (parts.size() < 2) {
      throw new FortxRuntimeError("Not a routine id: " + sibling);
    }
    UnitId host = sibling.host();
    UnitId id = host == null ? UnitId.external(routine.name())
                             : host.member(routine.name());
    if (find(id) != null) {
      throw new FortxRuntimeError("Routine " + id + " already exists in " +
                                  path);
    }
    FileNode r = root;
    Node newRoot;
    if (parts.get(0).isEmpty()) {
      newRoot = insertMember(r, 0, parts, 1, routine, sibling);
    } else {
      int mi = indexOfNamed(r.body(), NodeKind.MODULE, parts.get(0),
                            sibling);
      Node newModule = insertMember(r.body().get(mi), 1, parts, 1, routine,
                                    sibling);
      newRoot = replaceChild(r, 0, mi, newModule);
    }
    this.root = (FileNode)newRoot;
    return id;
  }

  private Node insertMember(Node container, int group, List<String> parts,
                   int depth, Routine routine, UnitId sibling) {
    List<Node> list = container.groups().get(group);
    int i = indexOfNamed(list, NodeKind.ROUTINE, parts.get(depth), sibling);
    if (depth == parts.size() - 1) {
      List<List<Node>> groups = new ArrayList<List<Node>>(container.groups());
      List<Node> g = new ArrayList<Node>(list);
      g.add(i + 1, routine);
      groups.set(group, g);
      return container.withGroups(groups);
    }
    Node updated = insertMember(list.get(i), Routine.MEMBERS, parts,
                                depth + 1, routine, sibling);
    return replaceChild(container, group, i, updated);
  }

  private Node replaceMember(Node container, int group, List<String> parts,
                   int depth, Routine replacement, Routine[] old) {
    List<Node> list = container.groups().get(group);
    UnitId id = UnitId.parse(String.join(UnitId.SEPARATOR, parts));
    int i = indexOfNamed(list, NodeKind.ROUTINE, parts.get(depth), id);
    Routine current = (Routine)list.get(i);
    Node updated;
    if (depth == parts.size() - 1) {
      old[0] = current;
      if (replacement.members() != current.members()) {
        updated = replacement.withMembers(current.members());
      } else {
        updated = replacement;
      }
    } else {
      updated = replaceMember(current, Routine.MEMBERS, parts, depth + 1,
                              replacement, old);
    }
    return replaceChild(container, group, i, updated);
  }

  private static Node replaceChild(Node container, int group, int index,
                                   Node newChild) {
    List<List<Node>> groups = new ArrayList<List<Node>>(container.groups());
    List<Node> g = new ArrayList<Node>(groups.get(group));
    g.set(index, newChild);
    groups.set(group, g);
    return container.withGroups(groups);
  }

  private static int indexOfNamed(List<Node> nodes, NodeKind kind,
                                  String name, UnitId id) {
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).kind() == kind &&
          nameOf(nodes.get(i)).equalsIgnoreCase(name)) {
        return i;
      }
    }
    throw new FortxRuntimeError("No " + kind + " " + name + " on path to "
                                + id);
  }

  private static Node findNamed(List<Node> nodes, NodeKind kind,
                                String name) {
    for (Node n: nodes) {
      if (n.kind() == kind && nameOf(n).equalsIgnoreCase(name)) {
        return n;
      }
    }
    return null;
  }

  private static String nameOf(Node n) {
    if (n instanceof Module) {
      return ((Module)n).name();
    }
    return ((Routine)n).name();
  }

  @Override
  public String toString() {
    return path;
  }
}
