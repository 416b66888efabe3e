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
package exm.fnp.tree;

import com.google.gson.JsonObject;

/**
 * Base of all abstract syntax tree nodes.  Nodes are immutable and compare
 * structurally.
 */
public abstract class AstNode {

  /**
   * @return name of the node as it appears as a variant tag in JSON output
   */
  public String nodeName() {
    return getClass().getSimpleName();
  }

  /**
   * Project the fields of this node to JSON.  Each node decides per field
   * whether children are wrapped in a variant tag, see {@link Json}.
   * @return a fresh JSON object with one member per field
   */
  public abstract JsonObject toJson();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
