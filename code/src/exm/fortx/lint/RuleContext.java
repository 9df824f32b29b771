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

import exm.fortx.common.Settings;
import exm.fortx.ir.Node;
import exm.fortx.ir.SourceSpan;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Units.Routine;
import exm.fortx.resolve.Resolution;
import exm.fortx.resolve.Scope;
import exm.fortx.walk.WalkContext;

/**
 * Read-only view of where a rule is being applied
 */
public class RuleContext {
  private final SourceUnit source;
  private final Settings settings;
  private final WalkContext walk;

  RuleContext(SourceUnit source, Settings settings, WalkContext walk) {
    this.source = source;
    this.settings = settings;
    this.walk = walk;
  }

  public SourceUnit source() {
    return source;
  }

  public Settings settings() {
    return settings;
  }

  /**
   * @return resolver tables, or null if the unit wasn't resolved
   */
  public Resolution resolution() {
    return source.resolution();
  }

  /**
   * @return innermost scope of the node, or null if not resolved
   */
  public Scope scope(Node node) {
    Resolution r = source.resolution();
    if (r == null) {
      return null;
    }
    Scope s = r.scope(node);
    if (s != null) {
      return s;
    }
    for (Node a: walk.ancestors()) {
      s = r.scope(a);
      if (s != null) {
        return s;
      }
    }
    return r.fileScope();
  }

  public Routine enclosingRoutine() {
    return walk.enclosingRoutine();
  }

  public Node parent() {
    return walk.parent();
  }

  /**
   * @return ancestors of the current node, innermost first
   */
  public List<Node> ancestors() {
    return walk.ancestors();
  }

  /**
   * @return span of node, or of its innermost ancestor with one
   */
  public SourceSpan location(Node node) {
    if (node.span() != null) {
      return node.span();
    }
    for (Node a: walk.ancestors()) {
      if (a.span() != null) {
        return a.span();
      }
    }
    return null;
  }
}
