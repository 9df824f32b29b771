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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.fortx.ir.Expressions.ArrayRef;
import exm.fortx.ir.Intent;
import exm.fortx.ir.Node;
import exm.fortx.ir.Statements.Assignment;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Severity;
import exm.fortx.resolve.Intrinsics;
import exm.fortx.resolve.Resolution;
import exm.fortx.resolve.Scope;
import exm.fortx.resolve.Symbol;
import exm.fortx.resolve.SymbolKind;
import exm.fortx.sched.CallEdge;
import exm.fortx.sched.Pass.RoutinePass;
import exm.fortx.sched.PassContext;
import exm.fortx.sched.PassOrder;
import exm.fortx.sched.PassResult;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Visitor;
import exm.fortx.walk.WalkContext;
import exm.fortx.walk.Walker;

/**
 * Add the PURE prefix to routines that qualify.  Callees are processed
 * first, so purity propagates up the call graph.  Routines in a recursive
 * cycle stay impure unless something outside the cycle made them pure.
 */
public class PurityPass extends RoutinePass {
  public static final String NAME = "infer-pure";

  /** Statements with side effects */
  private static final Set<String> IMPURE_STATEMENTS = new HashSet<String>(
      Arrays.asList("print", "write", "read", "open", "close", "inquire",
                    "rewind", "backspace", "endfile", "flush", "stop",
                    "error", "pause", "save", "common", "data", "wait"));

  public PurityPass() {
    super(NAME, PassOrder.CALLEE_FIRST);
  }

  @Override
  public boolean dependsOnCallees() {
    return true;
  }

  @Override
  public PassResult apply(Routine routine, PassContext context) {
    if (isPure(routine)) {
      return PassResult.of(routine);
    }
    String reason = impurity(routine, context);
    if (reason != null) {
      context.logger().trace(context.unitId() + " not pure: " + reason);
      return PassResult.of(routine);
    }
    Diagnostic d = new Diagnostic(NAME, Severity.INFO,
        context.source().path(), routine.span(),
        "marked " + context.unitId() + " pure");
    return new PassResult(routine.withPrefix("pure"),
                          ImmutableList.of(d));
  }

  static boolean isPure(Routine routine) {
    return routine.hasPrefix("pure") || routine.hasPrefix("elemental");
  }

  /**
   * @return why the routine can't be pure, or null if it can
   */
  private String impurity(Routine routine, PassContext context) {
    Resolution resolution = context.resolution();
    Scope scope = resolution == null ? null
                : resolution.unitScope(context.unitId());
    if (scope == null) {
      return "not resolved";
    }

    for (String d: routine.dummies()) {
      Symbol s = scope.lookupLocal(d);
      Intent intent = s == null ? Intent.NONE : s.intent();
      if (intent == Intent.NONE) {
        return "dummy " + d + " has no intent";
      }
      if (routine.isFunction() && intent != Intent.IN) {
        return "function dummy " + d + " is not intent(in)";
      }
    }

    for (CallEdge e: context.calls()) {
      if (!e.isResolved()) {
        return "calls unresolved " + e.name();
      }
      if (e.callee().equals(context.unitId())) {
        return "calls itself";
      }
      if (!isPure(context.routine(e.callee()))) {
        return "calls impure " + e.callee();
      }
    }

    Checker checker = new Checker(resolution, scope);
    Walker.preOrder(routine, NodeFilter.all(), checker);
    return checker.reason;
  }

  /**
   * Looks for statements with side effects
   */
  private static class Checker extends Visitor {
    private final Resolution resolution;
    private final Scope scope;
    String reason = null;

    Checker(Resolution resolution, Scope scope) {
      this.resolution = resolution;
      this.scope = scope;
    }

    @Override
    public void visit(Node node, WalkContext context) {
      if (reason != null) {
        return;
      }
      switch (node.kind()) {
        case INTRINSIC: {
          String kw = ((Intrinsic)node).keyword();
          if (IMPURE_STATEMENTS.contains(kw)) {
            reason = kw + " statement";
          }
          break;
        }
        case DECLARATION:
          checkDeclaration((Declaration)node);
          break;
        case ASSIGNMENT:
          checkDefinition(((Assignment)node).target());
          break;
        case LOOP: {
          Symbol s = scope.lookup(((Loop)node).variable());
          if (!isLocal(s)) {
            reason = "loop variable " + ((Loop)node).variable() +
                     " is not local";
          }
          break;
        }
        case CALL:
          checkIntrinsic(((CallStatement)node).name(), node);
          break;
        case ARRAY_REF:
          checkIntrinsic(((ArrayRef)node).name(), node);
          break;
        default:
          break;
      }
    }

    private void checkDeclaration(Declaration decl) {
      if (decl.hasAttribute("parameter")) {
        return;
      }
      if (decl.hasAttribute("save")) {
        reason = "saved variable";
        return;
      }
      for (Entity e: decl.entities()) {
        if (e.init() != null) {
          reason = "initialized variable " + e.name() + " is saved";
          return;
        }
      }
    }

    private void checkDefinition(Node target) {
      Symbol s = resolution.symbol(target);
      if (!isLocal(s)) {
        reason = "assigns to non-local " + (s == null ? target : s.name());
      } else if (s.intent() == Intent.IN) {
        reason = "assigns to intent(in) " + s.name();
      }
    }

    private void checkIntrinsic(String name, Node ref) {
      Symbol s = resolution.symbol(ref);
      if (s != null && s.isIntrinsic() && !Intrinsics.isPure(name)) {
        reason = "calls impure intrinsic " + name;
      }
    }

    private boolean isLocal(Symbol s) {
      if (s == null || s.scope() == null) {
        return false;
      }
      if (s.kind() == SymbolKind.UNRESOLVED ||
          s.kind() == SymbolKind.IMPORTED) {
        return false;
      }
      return s.scope().isWithin(scope);
    }
  }
}
