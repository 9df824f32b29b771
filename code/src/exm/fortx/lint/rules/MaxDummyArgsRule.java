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
import exm.fortx.ir.Units.Routine;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;

public class MaxDummyArgsRule extends BaseRule {
  public static final String ID = "MAX-DUMMY-ARGS";
  public static final String MAX_KEY = Settings.RULE_PREFIX + ID + ".max";
  public static final int DEFAULT_MAX = 50;

  private final int max;

  public MaxDummyArgsRule(int max) {
    super(ID, Severity.INFO);
    this.max = max;
  }

  public static MaxDummyArgsRule fromSettings(Settings settings)
                                          throws InvalidOptionException {
    return new MaxDummyArgsRule(Limits.get(settings, MAX_KEY, DEFAULT_MAX));
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.ROUTINE);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    Routine r = (Routine)node;
    if (r.dummies().size() <= max) {
      return Collections.emptyList();
    }
    return Collections.singletonList(diagnostic(node, context,
        r.name() + " has " + r.dummies().size() +
        " dummy arguments, more than " + max));
  }
}
