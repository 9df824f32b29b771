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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.fortx.ir.Intent;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Entity;
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;

/**
 * Dummy arguments must be declared with INTENT
 */
public class MissingIntentRule extends BaseRule {
  public static final String ID = "MISSING-INTENT";

  public MissingIntentRule() {
    super(ID, Severity.ERROR);
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.DECLARATION);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    Declaration decl = (Declaration)node;
    if (decl.intent() != Intent.NONE || decl.hasAttribute("external")) {
      return Collections.emptyList();
    }
    Node parent = context.parent();
    if (!(parent instanceof Routine)) {
      return Collections.emptyList();
    }
    Routine routine = (Routine)parent;
    List<String> missing = new ArrayList<String>();
    for (Entity e: decl.entities()) {
      if (routine.isDummy(e.name())) {
        missing.add(e.name());
      }
    }
    if (missing.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.singletonList(diagnostic(node, context,
        "dummy argument" + (missing.size() > 1 ? "s " : " ") +
        StringUtils.join(missing, ", ") + " of " + routine.name() +
        " declared without intent"));
  }
}
