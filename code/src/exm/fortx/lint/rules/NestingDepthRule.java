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

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;

/**
 * Limits nesting of loops and conditionals within a routine.  Reported
 * once, at the construct that first goes too deep.
 */
public class NestingDepthRule extends BaseRule {
  public static final String ID = "NESTING-DEPTH";
  public static final String MAX_KEY = Settings.RULE_PREFIX + ID + ".max";
  public static final int DEFAULT_MAX = 3;

  private final int max;

  public NestingDepthRule(int max) {
    super(ID, Severity.WARNING);
    this.max = max;
  }

  public static NestingDepthRule fromSettings(Settings settings)
                                          throws InvalidOptionException {
    return new NestingDepthRule(Limits.get(settings, MAX_KEY, DEFAULT_MAX));
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.LOOP, NodeKind.WHILE_LOOP,
                      NodeKind.CONDITIONAL);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    if (isElseIf(node)) {
      // Same level as the IF it continues
      return Collections.emptyList();
    }
    int depth = 1;
    for (Node a: context.ancestors()) {
      if (a.kind() == NodeKind.ROUTINE) {
        break;
      }
      if (counts(a)) {
        depth++;
      }
    }
    if (depth != max + 1) {
      return Collections.emptyList();
    }
    return Collections.singletonList(diagnostic(node, context,
        "nesting depth " + depth + " exceeds " + max));
  }

  private static boolean counts(Node n) {
    switch (n.kind()) {
      case LOOP:
      case WHILE_LOOP:
        return true;
      case CONDITIONAL:
        return !isElseIf(n);
      default:
        return false;
    }
  }

  private static boolean isElseIf(Node n) {
    return n.kind() == NodeKind.CONDITIONAL && ((Conditional)n).isElseIf();
  }
}
