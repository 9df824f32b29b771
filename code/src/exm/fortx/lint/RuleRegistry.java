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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.lint.rules.BannedStatementsRule;
import exm.fortx.lint.rules.ImplicitNoneRule;
import exm.fortx.lint.rules.MaxDummyArgsRule;
import exm.fortx.lint.rules.MissingIntentRule;
import exm.fortx.lint.rules.NestingDepthRule;
import exm.fortx.lint.rules.UnresolvedCallRule;

/**
 * Rules of one session, with the severity each one reports at
 */
public class RuleRegistry {
  public static final String ALL_RULES = "all";

  private final Map<String, Rule> rules = new LinkedHashMap<String, Rule>();
  private final Map<String, Severity> severities =
                                      new HashMap<String, Severity>();
  /** Null means all rules enabled */
  private Set<String> enabled = null;

  /**
   * Built-in rules, enabled and configured from settings
   */
  public static RuleRegistry standard(Settings settings)
                                          throws InvalidOptionException {
    RuleRegistry r = new RuleRegistry();
    r.register(new MissingIntentRule());
    r.register(new ImplicitNoneRule());
    r.register(MaxDummyArgsRule.fromSettings(settings));
    r.register(NestingDepthRule.fromSettings(settings));
    r.register(BannedStatementsRule.fromSettings(settings));
    r.register(new UnresolvedCallRule());
    r.configure(settings);
    return r;
  }

  public void register(Rule rule) {
    rules.put(rule.id().toUpperCase(), rule);
  }

  /**
   * Apply fortx.rules and fortx.rule.ID.severity
   */
  public void configure(Settings settings) throws InvalidOptionException {
    List<String> ids = settings.getList(Settings.RULES);
    if (ids.size() == 1 && ids.get(0).equalsIgnoreCase(ALL_RULES)) {
      enabled = null;
    } else {
      Set<String> e = new HashSet<String>();
      for (String id: ids) {
        String upper = id.toUpperCase();
        if (!rules.containsKey(upper)) {
          throw new InvalidOptionException("Unknown rule '" + id + "' in "
              + Settings.RULES + ", expected one of: " +
              StringUtils.join(rules.keySet(), ", "));
        }
        e.add(upper);
      }
      enabled = e;
    }
    for (String id: rules.keySet()) {
      String sev = settings.get(Settings.RULE_PREFIX + id + ".severity");
      if (sev != null && sev.trim().length() > 0) {
        severities.put(id, Severity.fromString(sev));
      }
    }
  }

  public void setSeverity(String ruleId, Severity severity) {
    severities.put(ruleId.toUpperCase(), severity);
  }

  /**
   * @return configured severity, or the rule's default
   */
  public Severity severity(String ruleId) {
    String id = ruleId.toUpperCase();
    Severity s = severities.get(id);
    if (s != null) {
      return s;
    }
    Rule r = rules.get(id);
    return r == null ? Severity.OFF : r.defaultSeverity();
  }

  /**
   * @return rules that are enabled and not switched off
   */
  public List<Rule> activeRules() {
    List<Rule> result = new ArrayList<Rule>();
    for (Map.Entry<String, Rule> e: rules.entrySet()) {
      if ((enabled == null || enabled.contains(e.getKey())) &&
          severity(e.getKey()).isEnabled()) {
        result.add(e.getValue());
      }
    }
    return result;
  }

  public Rule get(String ruleId) {
    return rules.get(ruleId.toUpperCase());
  }
}
