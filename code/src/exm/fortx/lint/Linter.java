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
package exm.fortx.lint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.SourceUnit;
import exm.fortx.walk.NodeFilter;
import exm.fortx.walk.Visitor;
import exm.fortx.walk.WalkContext;
import exm.fortx.walk.Walker;

/**
 * Applies the active rules of a registry to source units.  Each unit is
 * walked once; every node goes only to the rules subscribed to its kind.
 * Suppression markers win over configured severities.
 */
public class Linter {

  private final Logger logger = Logging.getLogger();

  private final RuleRegistry registry;
  private final Settings settings;
  private final Map<NodeKind, List<Rule>> dispatch =
                        new EnumMap<NodeKind, List<Rule>>(NodeKind.class);

  public Linter(RuleRegistry registry, Settings settings) {
    this.registry = registry;
    this.settings = settings;
    for (Rule rule: registry.activeRules()) {
      for (NodeKind k: rule.subscribedKinds()) {
        List<Rule> l = dispatch.get(k);
        if (l == null) {
          l = new ArrayList<Rule>();
          dispatch.put(k, l);
        }
        l.add(rule);
      }
    }
  }

  /**
   * @return diagnostics sorted by line
   */
  public List<Diagnostic> lint(final SourceUnit source) {
    final List<Diagnostic> result = new ArrayList<Diagnostic>();
    if (dispatch.isEmpty()) {
      return result;
    }
    final Suppressions suppressions = Suppressions.parse(source.lines());
    NodeFilter filter = NodeFilter.of(dispatch.keySet());
    Walker.preOrder(source.root(), filter, new Visitor() {
      @Override
      public void visit(Node node, WalkContext walk) {
        RuleContext context = new RuleContext(source, settings, walk);
        for (Rule rule: dispatch.get(node.kind())) {
          for (Diagnostic d: check(rule, node, context)) {
            if (suppressions.suppresses(d.ruleId(), d.span(),
                                        headerOnly(node))) {
              logger.trace("Suppressed: " + d);
              continue;
            }
            result.add(d.withSeverity(registry.severity(rule.id())));
          }
        }
      }
    });
    Collections.sort(result);
    logger.debug("Lint " + source.path() + ": " + result.size() +
                 " diagnostics");
    return result;
  }

  /**
   * Diagnostics on program units and constructs are suppressed only by a
   * marker on their header line, not by one on an enclosed statement
   */
  private static boolean headerOnly(Node node) {
    return node.kind().isScoping() || node.kind().isConstruct();
  }

  private List<Diagnostic> check(Rule rule, Node node, RuleContext context) {
    try {
      return rule.check(node, context);
    } catch (RuntimeException e) {
      logger.warn("Rule " + rule.id() + " failed on " + node + " in " +
                  context.source().path() + ": " + e, e);
      return Collections.emptyList();
    }
  }
}
