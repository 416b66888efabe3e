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

/**
 * Function parameter with its declared type
 */
public class TypedAssignee extends AstNode {
  private final Assignee assignee;
  private final TypeInstance type;

  public TypedAssignee(Assignee assignee, TypeInstance type) {
    this.assignee = Preconditions.checkNotNull(assignee);
    this.type = Preconditions.checkNotNull(type);
  }

  public Assignee getAssignee() {
    return assignee;
  }

  public TypeInstance getType() {
    return type;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("assignee", assignee.toJson());
    o.add("type_", Json.variant(type));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypedAssignee)) {
      return false;
    }
    TypedAssignee other = (TypedAssignee)obj;
    return assignee.equals(other.assignee) && type.equals(other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(assignee, type);
  }

  @Override
  public String toString() {
    return assignee + ": " + type;
  }
}
