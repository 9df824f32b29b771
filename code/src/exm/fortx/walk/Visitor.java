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
package exm.fortx.walk;

import exm.fortx.ir.Node;

/**
 * Read-only callback for {@link Walker}.  Implementations may only
 * accumulate state of their own; the tree is immutable.
 */
public abstract class Visitor {

  /**
   * Called for each node the filter accepts
   */
  public abstract void visit(Node node, WalkContext context);

  /**
   * Called after the children of an accepted node were walked
   */
  public void leave(Node node, WalkContext context) {
    // Nothing
  }
}
