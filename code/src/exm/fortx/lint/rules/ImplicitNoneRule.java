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
package exm.fortx.lint.rules;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.ir.Units.Module;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;

/**
 * Modules and external routines should say IMPLICIT NONE.  Routines
 * contained in a module or another routine inherit it from their host.
 */
public class ImplicitNoneRule extends BaseRule {
  public static final String ID = "IMPLICIT-NONE";

  public ImplicitNoneRule() {
    super(ID, Severity.WARNING);
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.ROUTINE, NodeKind.MODULE);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    List<Node> spec;
    String what;
    if (node instanceof Module) {
      spec = ((Module)node).spec();
      what = "module " + ((Module)node).name();
    } else {
      Node parent = context.parent();
      if (parent != null && parent.kind() != NodeKind.FILE) {
        return Collections.emptyList();
      }
      spec = ((Routine)node).spec();
      what = ((Routine)node).routineKind().keyword() + " " +
             ((Routine)node).name();
    }
    for (Node n: spec) {
      if (n.kind() == NodeKind.INTRINSIC &&
          ((Intrinsic)n).label().equals("implicitnone")) {
        return Collections.emptyList();
      }
    }
    return Collections.singletonList(diagnostic(node, context,
                                     what + " has no implicit none"));
  }
}
