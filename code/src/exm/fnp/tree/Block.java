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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

/**
 * Braced sequence of assignments, each terminated by a semicolon,
 * followed by exactly one result expression.
 */
public class Block extends AstNode {
  private final List<Assignment> assignments;
  private final Expression expression;

  public Block(List<Assignment> assignments, Expression expression) {
    this.assignments = ImmutableList.copyOf(assignments);
    this.expression = Preconditions.checkNotNull(expression);
  }

  public List<Assignment> getAssignments() {
    return assignments;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("assignments", Json.nodes(assignments));
    o.add("expression", Json.variant(expression));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Block)) {
      return false;
    }
    Block other = (Block)obj;
    return assignments.equals(other.assignments) &&
           expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(assignments, expression);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(nodeName())
                      .add("assignments", assignments)
                      .add("expression", expression).toString();
  }
}
