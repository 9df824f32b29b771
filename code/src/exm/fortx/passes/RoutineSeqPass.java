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
package exm.fortx.passes;

import java.util.ArrayList;
import java.util.List;

import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Pragma;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Severity;
import exm.fortx.sched.Pass.RoutinePass;
import exm.fortx.sched.PassContext;
import exm.fortx.sched.PassOrder;
import exm.fortx.sched.PassResult;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Visitor;
import exm.fortx.walk.WalkContext;
import exm.fortx.walk.Walker;

/**
 * Mark routines that run on the device as sequential device routines.
 * A routine is marked if it is called inside a loop carrying a directive,
 * or called from a routine that is marked already.  Callers go first, so
 * marks propagate down the call tree in one pass.
 */
public class RoutineSeqPass extends RoutinePass {
  public static final String NAME = "routine-seq";
  public static final String DIRECTIVE = "!$acc routine seq";

  public RoutineSeqPass() {
    super(NAME, PassOrder.CALLER_FIRST);
  }

  @Override
  public boolean dependsOnCallers() {
    return true;
  }

  @Override
  public PassResult apply(Routine routine, PassContext context) {
    if (isMarked(routine)) {
      return PassResult.of(routine);
    }
    UnitId reason = null;
    for (UnitId caller: context.callers()) {
      Routine c = context.routine(caller).withoutMembers();
      if (isMarked(c) || callsInsideAnnotatedLoop(c, routine.name())) {
        reason = caller;
        break;
      }
    }
    if (reason == null) {
      return PassResult.of(routine);
    }

    List<Node> spec = new ArrayList<Node>(routine.spec());
    int pos = 0;
    while (pos < spec.size() && spec.get(pos).kind() == NodeKind.IMPORT) {
      pos++;
    }
    spec.add(pos, new Pragma(null, DIRECTIVE));
    List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    diagnostics.add(new Diagnostic(NAME, Severity.INFO,
        context.source().path(), routine.span(),
        "marked " + context.unitId() + " as device routine, called from "
        + reason));
    return new PassResult(routine.withSpec(spec), diagnostics);
  }

  /**
   * @return true if the routine has an "acc routine" directive in its
   *         specification part or at the top level of its body
   */
  static boolean isMarked(Routine routine) {
    for (Node n: routine.spec()) {
      if (isRoutineDirective(n)) {
        return true;
      }
    }
    for (Node n: routine.body()) {
      if (isRoutineDirective(n)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isRoutineDirective(Node n) {
    return n.kind() == NodeKind.PRAGMA &&
           ((Pragma)n).startsWith("acc routine");
  }

  /**
   * @return true if node contains a loop preceded by a directive, with a
   *         reference to name inside
   */
  static boolean callsInsideAnnotatedLoop(Node node, String name) {
    for (List<Node> group: node.groups()) {
      for (int i = 0; i < group.size(); i++) {
        Node child = group.get(i);
        if (child.kind().isExpression()) {
          continue;
        }
        boolean loop = child.kind() == NodeKind.LOOP ||
                       child.kind() == NodeKind.WHILE_LOOP;
        if (loop && i > 0 && group.get(i - 1).kind() == NodeKind.PRAGMA) {
          if (references(child, name)) {
            return true;
          }
        } else if (callsInsideAnnotatedLoop(child, name)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean references(Node subtree, final String name) {
    final boolean[] found = new boolean[1];
    Walker.preOrder(subtree, NodeFilter.of(NodeKind.CALL, NodeKind.ARRAY_REF),
                    new Visitor() {
      @Override
      public void visit(Node node, WalkContext context) {
        String n = node.kind() == NodeKind.CALL ?
                   ((CallStatement)node).name() : ((ArrayRef)node).name();
        if (n.equalsIgnoreCase(name)) {
          found[0] = true;
        }
      }
    });
    return found[0];
  }
}
