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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Conditional;
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
 * Delete calls to given routines.  A logical IF left without its action
 * goes too.
 */
public class RemoveCallsPass extends RoutinePass {
  public static final String NAME = "remove-calls";

  private final Set<String> names = new HashSet<String>();

  public RemoveCallsPass(List<String> names) {
    super(NAME, PassOrder.NONE);
    for (String n: names) {
      this.names.add(n.toLowerCase());
    }
  }

  public static RemoveCallsPass fromSettings(Settings settings) {
    return new RemoveCallsPass(settings.getList(Settings.REMOVE_CALLS_NAMES));
  }

  @Override
  public PassResult apply(Routine routine, final PassContext context) {
    if (names.isEmpty()) {
      return PassResult.of(routine);
    }
    final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    Transformer t = new Transformer(Transformer.Order.POST,
                                    NodeFilter.statements().prune()) {
      @Override
      public Replacement transform(Node node, WalkContext walk) {
        if (node.kind() == NodeKind.CALL) {
          CallStatement call = (CallStatement)node;
          if (names.contains(call.name().toLowerCase())) {
            diagnostics.add(new Diagnostic(NAME, Severity.INFO,
                context.source().path(), call.span(),
                "removed call to " + call.name() + " in " +
                context.unitId()));
            return Replacement.delete();
          }
        } else if (node.kind() == NodeKind.CONDITIONAL) {
          Conditional c = (Conditional)node;
          if (c.isInline() && c.thenBody().isEmpty()) {
            return Replacement.delete();
          }
        }
        return Replacement.keep();
      }
    };
    return new PassResult(t.applyTyped(routine), diagnostics);
  }
}
