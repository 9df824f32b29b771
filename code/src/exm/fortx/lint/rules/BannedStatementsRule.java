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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Intrinsic;
import exm.fortx.lint.Diagnostic;
import exm.fortx.lint.Rule.BaseRule;
import exm.fortx.lint.RuleContext;
import exm.fortx.lint.Severity;

/**
 * Flags statements starting with a banned keyword
 */
public class BannedStatementsRule extends BaseRule {
  public static final String ID = "BANNED-STATEMENTS";
  public static final String KEYWORDS_KEY =
                      Settings.RULE_PREFIX + ID + ".keywords";
  public static final List<String> DEFAULT_KEYWORDS =
          Collections.unmodifiableList(Arrays.asList(
                                      "stop", "print", "goto", "go to"));

  /** Lower case, without blanks */
  private final List<String> keywords = new ArrayList<String>();

  public BannedStatementsRule(List<String> keywords) {
    super(ID, Severity.WARNING);
    for (String k: keywords) {
      this.keywords.add(k.replaceAll("\\s+", "").toLowerCase());
    }
  }

  public static BannedStatementsRule fromSettings(Settings settings) {
    List<String> configured = settings.getList(KEYWORDS_KEY);
    return new BannedStatementsRule(configured.isEmpty() ? DEFAULT_KEYWORDS
                                                         : configured);
  }

  @Override
  public Set<NodeKind> subscribedKinds() {
    return EnumSet.of(NodeKind.INTRINSIC);
  }

  @Override
  public List<Diagnostic> check(Node node, RuleContext context) {
    Intrinsic stmt = (Intrinsic)node;
    String keyword = stmt.keyword();
    String compact = withoutLabel(stmt.label());
    for (String banned: keywords) {
      // Blanks are insignificant: "go to" is "goto"
      if (keyword.equals(banned) ||
          (banned.startsWith(keyword) && compact.startsWith(banned))) {
        return Collections.singletonList(diagnostic(node, context,
            "banned statement: " + stmt.text()));
      }
    }
    return Collections.emptyList();
  }

  private static String withoutLabel(String label) {
    int i = 0;
    while (i < label.length() && Character.isDigit(label.charAt(i))) {
      i++;
    }
    return label.substring(i);
  }
}
