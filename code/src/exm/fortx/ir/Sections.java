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
package exm.fortx.ir;

import java.util.ArrayList;
import java.util.List;

import exm.fortx.ir.Statements.Intrinsic;

/**
 * Splits the statements of a routine or block into specification and
 * execution parts.  All frontends share this so they agree on the split.
 */
public class Sections {

  public static class Split {
    public final List<Node> spec;
    public final List<Node> body;

    private Split(List<Node> spec, List<Node> body) {
      this.spec = spec;
      this.body = body;
    }
  }

  /**
   * The specification part ends with the last specification statement
   * before the first executable statement.  Comments and directives
   * after it belong to the execution part.
   */
  public static Split split(List<? extends Node> stmts) {
    int firstExec = stmts.size();
    for (int i = 0; i < stmts.size(); i++) {
      Node n = stmts.get(i);
      if (!isSpecification(n) && !isNeutral(n)) {
        firstExec = i;
        break;
      }
    }
    int lastSpec = -1;
    for (int i = 0; i < firstExec; i++) {
      if (isSpecification(stmts.get(i))) {
        lastSpec = i;
      }
    }
    return new Split(new ArrayList<Node>(stmts.subList(0, lastSpec + 1)),
                     new ArrayList<Node>(stmts.subList(lastSpec + 1,
                                                       stmts.size())));
  }

  public static boolean isSpecification(Node n) {
    switch (n.kind()) {
      case IMPORT:
      case DECLARATION:
        return true;
      case INTRINSIC:
        return ((Intrinsic)n).isSpecification();
      default:
        return false;
    }
  }

  /**
   * @return true for comments and directives, which may sit in either part
   */
  public static boolean isNeutral(Node n) {
    return n.kind() == NodeKind.COMMENT || n.kind() == NodeKind.PRAGMA;
  }
}
