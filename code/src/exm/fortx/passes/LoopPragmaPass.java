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

import com.google.common.collect.ImmutableList;

import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Pragma;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Severity;
import exm.fortx.sched.Pass.RoutinePass;
import exm.fortx.sched.PassContext;
import exm.fortx.sched.PassOrder;
import exm.fortx.sched.PassResult;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Replacement;
import exm.fortx.walk.Transformer;
import exm.fortx.walk.WalkContext;

/**
 * Put a directive in front of each outermost counted loop that doesn't
 * already have one
 */
public class LoopPragmaPass extends RoutinePass {
  public static final String NAME = "loop-pragmas";

  private final String directive;

  public LoopPragmaPass(String directive) {
    super(NAME, PassOrder.NONE);
    this.directive = directive.trim();
  }

  public static LoopPragmaPass fromSettings(Settings settings) {
    return new LoopPragmaPass(settings.get(Settings.LOOP_PRAGMA_TEXT));
  }

  @Override
  public PassResult apply(Routine routine, final PassContext context) {
    final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    Transformer t = new Transformer(Transformer.Order.PRE,
                                    NodeFilter.statements().prune()) {
      @Override
      public Replacement transform(Node node, WalkContext walk) {
        if (node.kind() != NodeKind.LOOP ||
            walk.countEnclosing(NodeKind.LOOP, NodeKind.WHILE_LOOP) > 0) {
          return Replacement.keep();
        }
        if (precededByDirective(node, walk.parent())) {
          return Replacement.keep();
        }
        diagnostics.add(new Diagnostic(NAME, Severity.INFO,
            context.source().path(), node.span(),
            "inserted " + directive + " in " + context.unitId()));
        return Replacement.of(ImmutableList.<Node>of(
                                  new Pragma(null, directive), node));
      }
    };
    return new PassResult(t.applyTyped(routine), diagnostics);
  }

  private static boolean precededByDirective(Node node, Node parent) {
    if (parent == null) {
      return false;
    }
    for (List<Node> group: parent.groups()) {
      for (int i = 0; i < group.size(); i++) {
        if (group.get(i) == node) {
          return i > 0 && group.get(i - 1).kind() == NodeKind.PRAGMA;
        }
      }
    }
    return false;
  }
}
