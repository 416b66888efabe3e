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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

public class Assignment extends Definition {
  private final ParametricAssignee assignee;
  private final Expression expression;

  public Assignment(ParametricAssignee assignee, Expression expression) {
    this.assignee = Preconditions.checkNotNull(assignee);
    this.expression = Preconditions.checkNotNull(expression);
  }

  public ParametricAssignee getAssignee() {
    return assignee;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("assignee", assignee.toJson());
    o.add("expression", Json.variant(expression));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment)obj;
    return assignee.equals(other.assignee) &&
           expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(assignee, expression);
  }

  @Override
  public String toString() {
    return assignee + " = " + expression;
  }
}
