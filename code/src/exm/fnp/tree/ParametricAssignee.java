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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

/**
 * Left hand side of an assignment, e.g. <code>id&lt;T, U&gt;</code>
 */
public class ParametricAssignee extends AstNode {
  private final Assignee assignee;
  private final List<String> genericVariables;

  public ParametricAssignee(Assignee assignee, List<String> genericVariables) {
    this.assignee = Preconditions.checkNotNull(assignee);
    this.genericVariables = ImmutableList.copyOf(genericVariables);
  }

  public ParametricAssignee(String id) {
    this(new Assignee(id), Collections.<String>emptyList());
  }

  public Assignee getAssignee() {
    return assignee;
  }

  public List<String> getGenericVariables() {
    return genericVariables;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("assignee", assignee.toJson());
    o.add("generic_variables", Json.ids(genericVariables));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ParametricAssignee)) {
      return false;
    }
    ParametricAssignee other = (ParametricAssignee)obj;
    return assignee.equals(other.assignee) &&
           genericVariables.equals(other.genericVariables);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(assignee, genericVariables);
  }

  @Override
  public String toString() {
    if (genericVariables.isEmpty()) {
      return assignee.toString();
    }
    return assignee + "<" + Joiner.on(", ").join(genericVariables) + ">";
  }
}
