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

import java.util.List;
import java.util.Set;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;

/**
 * A check run by the {@link Linter}.  Rules only read the tree.
 */
public interface Rule {
  /**
   * @return upper case identifier, e.g. MISSING-INTENT
   */
  public abstract String id();

  public abstract Severity defaultSeverity();

  /**
   * @return kinds of node passed to {@link #check(Node, RuleContext)}
   */
  public abstract Set<NodeKind> subscribedKinds();

  /**
   * @return findings for this node, possibly empty
   */
  public abstract List<Diagnostic> check(Node node, RuleContext context);

  public static abstract class BaseRule implements Rule {
    private final String id;
    private final Severity defaultSeverity;

    protected BaseRule(String id, Severity defaultSeverity) {
      this.id = id;
      this.defaultSeverity = defaultSeverity;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public Severity defaultSeverity() {
      return defaultSeverity;
    }

    /**
     * Diagnostic at the node, or its innermost enclosing statement if the
     * node has no span.  The linter applies the configured severity.
     */
    protected Diagnostic diagnostic(Node node, RuleContext context,
                                    String message) {
      return new Diagnostic(id, defaultSeverity, context.source().path(),
                            context.location(node), message);
    }

    @Override
    public String toString() {
      return id;
    }
  }
}
