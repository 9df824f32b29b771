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
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;
import exm.fortx.resolve.Resolution;
import exm.fortx.resolve.Symbol;
import exm.fortx.resolve.SymbolKind;

public class UnresolvedCallRule extends BaseRule {
  public static final String ID = "UNRESOLVED-CALL";

  public UnresolvedCallRule() {
    super(ID, Severity.INFO);
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.CALL);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    CallStatement call = (CallStatement)node;
    Resolution r = context.resolution();
    Symbol s = r == null ? null : r.symbol(node);
    if (s == null || s.kind() == SymbolKind.UNRESOLVED) {
      return Collections.singletonList(diagnostic(node, context,
          "call to unresolved routine " + call.name()));
    }
    if (s.kind() == SymbolKind.IMPORTED) {
      return Collections.singletonList(diagnostic(node, context,
          "call to " + call.name() + " from module " +
          s.attributes().iterator().next().substring("use:".length()) +
          ", which is not loaded"));
    }
    return Collections.emptyList();
  }
}
