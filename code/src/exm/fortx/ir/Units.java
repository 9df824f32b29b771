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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Program unit nodes: files, modules and routines
 */
public class Units {

  /**
   * Root of a parsed source file
   */
  public static class FileNode extends Node {
    private final List<Node> body;

    public FileNode(SourceSpan span, List<? extends Node> body) {
      super(span);
      this.body = list(body);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FILE;
    }

    /** @return modules, routines, comments and pragmas, in file order */
    public List<Node> body() {
      return body;
    }

    public List<Module> modules() {
      List<Module> result = new ArrayList<Module>();
      for (Node n: body) {
        if (n instanceof Module) {
          result.add((Module)n);
        }
      }
      return result;
    }

    /** @return external routines, not including module members */
    public List<Routine> routines() {
      List<Routine> result = new ArrayList<Routine>();
      for (Node n: body) {
        if (n instanceof Routine) {
          result.add((Routine)n);
        }
      }
      return result;
    }

    public FileNode withBody(List<? extends Node> newBody) {
      return new FileNode(null, newBody);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(body);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      return "";
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new FileNode(span, groups.get(0));
    }
  }

  public static class Module extends Node {
    private final String name;
    private final List<Node> spec;
    private final List<Node> members;

    public Module(SourceSpan span, String name, List<? extends Node> spec,
                  List<? extends Node> members) {
      super(span);
      this.name = name;
      this.spec = list(spec);
      this.members = list(members);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.MODULE;
    }

    public String name() {
      return name;
    }

    public List<Node> spec() {
      return spec;
    }

    /** @return routines after CONTAINS, plus interleaved comments */
    public List<Node> members() {
      return members;
    }

    public List<Routine> routines() {
      return Routine.routinesIn(members);
    }

    public Module withMembers(List<? extends Node> newMembers) {
      return new Module(null, name, spec, newMembers);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(spec, members);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      return name.toLowerCase();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Module(span, name, groups.get(0), groups.get(1));
    }
  }

  public static enum RoutineKind {
    SUBROUTINE,
    FUNCTION;

    public String keyword() {
      return toString().toLowerCase();
    }
  }

  /**
   * A subroutine or function, either external, a module member, or
   * contained in another routine
   */
  public static class Routine extends Node {
    public static final int SPEC = 0;
    public static final int BODY = 1;
    public static final int MEMBERS = 2;

    private final RoutineKind routineKind;
    private final String name;
    /** Lower case prefixes, e.g. pure, elemental, recursive */
    private final List<String> prefixes;
    private final List<String> dummies;
    /** Function result variable if given with RESULT(...) */
    private final String resultName;
    /** Type given as a function prefix */
    private final TypeSpec resultType;
    private final List<Node> spec;
    private final List<Node> body;
    private final List<Node> members;

    public Routine(SourceSpan span, RoutineKind routineKind, String name,
                   List<String> prefixes, List<String> dummies,
                   String resultName, TypeSpec resultType,
                   List<? extends Node> spec, List<? extends Node> body,
                   List<? extends Node> members) {
      super(span);
      this.routineKind = routineKind;
      this.name = name;
      this.prefixes = lowerCase(prefixes);
      this.dummies = ImmutableList.copyOf(dummies);
      this.resultName = resultName;
      this.resultType = resultType;
      this.spec = list(spec);
      this.body = list(body);
      this.members = list(members);
    }

    private static List<String> lowerCase(List<String> strings) {
      ImmutableList.Builder<String> b = ImmutableList.builder();
      for (String s: strings) {
        b.add(s.toLowerCase());
      }
      return b.build();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ROUTINE;
    }

    public RoutineKind routineKind() {
      return routineKind;
    }

    public boolean isFunction() {
      return routineKind == RoutineKind.FUNCTION;
    }

    public String name() {
      return name;
    }

    public List<String> prefixes() {
      return prefixes;
    }

    public boolean hasPrefix(String prefix) {
      return prefixes.contains(prefix.toLowerCase());
    }

    public List<String> dummies() {
      return dummies;
    }

    public boolean isDummy(String varName) {
      for (String d: dummies) {
        if (d.equalsIgnoreCase(varName)) {
          return true;
        }
      }
      return false;
    }

    public String resultName() {
      return resultName;
    }

    /**
     * @return name of the variable holding the function result,
     *         or null for subroutines
     */
    public String resultVariable() {
      if (!isFunction()) {
        return null;
      }
      return resultName != null ? resultName : name;
    }

    public TypeSpec resultType() {
      return resultType;
    }

    public List<Node> spec() {
      return spec;
    }

    public List<Node> body() {
      return body;
    }

    public List<Node> members() {
      return members;
    }

    public List<Routine> routines() {
      return routinesIn(members);
    }

    public Routine withSpec(List<? extends Node> newSpec) {
      return (Routine)withGroups(groupsOf(list(newSpec), body, members));
    }

    public Routine withBody(List<? extends Node> newBody) {
      return (Routine)withGroups(groupsOf(spec, list(newBody), members));
    }

    public Routine withMembers(List<? extends Node> newMembers) {
      return (Routine)withGroups(groupsOf(spec, body, list(newMembers)));
    }

    /**
     * @return this routine without contained routines.  The span is kept
     *         for positions in diagnostics; it still covers the members'
     *         text, so the result must not be regenerated on its own.
     */
    public Routine withoutMembers() {
      if (members.isEmpty()) {
        return this;
      }
      return (Routine)withMembers(ImmutableList.<Node>of()).withSpan(span());
    }

    /**
     * @return copy under another name; the copy has no span, so it is
     *         printed with the new name
     */
    public Routine withName(String newName) {
      return new Routine(null, routineKind, newName, prefixes, dummies,
                         resultName, resultType, spec, body, members);
    }

    public Routine withPrefix(String prefix) {
      if (hasPrefix(prefix)) {
        return this;
      }
      List<String> newPrefixes = new ArrayList<String>(prefixes);
      newPrefixes.add(prefix.toLowerCase());
      return new Routine(null, routineKind, name, newPrefixes, dummies,
                         resultName, resultType, spec, body, members);
    }

    @Override
    public List<List<Node>> groups() {
      return groupsOf(spec, body, members);
    }

    @Override
    public boolean isListGroup(int group) {
      return true;
    }

    @Override
    public String label() {
      StringBuilder sb = new StringBuilder();
      sb.append(routineKind.keyword()).append(" ").append(name.toLowerCase());
      sb.append(" [").append(StringUtils.join(prefixes, ",")).append("]");
      sb.append(" (").append(StringUtils.join(dummies, ",").toLowerCase())
        .append(")");
      if (resultName != null) {
        sb.append(" result=").append(resultName.toLowerCase());
      }
      if (resultType != null) {
        sb.append(" type=").append(resultType.label());
      }
      return sb.toString();
    }

    @Override
    protected Node rebuild(SourceSpan span, List<List<Node>> groups) {
      return new Routine(span, routineKind, name, prefixes, dummies,
                  resultName, resultType,
                  groups.get(SPEC), groups.get(BODY), groups.get(MEMBERS));
    }

    static List<Routine> routinesIn(List<Node> nodes) {
      List<Routine> result = new ArrayList<Routine>();
      for (Node n: nodes) {
        if (n instanceof Routine) {
          result.add((Routine)n);
        }
      }
      return result;
    }
  }
}
