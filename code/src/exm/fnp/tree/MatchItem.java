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
 * One pattern of a match block: a constructor name with an optional
 * binding for its payload.
 */
public class MatchItem extends AstNode {
  private final String typeName;
  /** null if payload not bound */
  private final Assignee assignee;

  public MatchItem(String typeName, Assignee assignee) {
    this.typeName = Preconditions.checkNotNull(typeName);
    this.assignee = assignee;
  }

  public String getTypeName() {
    return typeName;
  }

  public Assignee getAssignee() {
    return assignee;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("type_name", typeName);
    o.add("assignee", Json.optionalNode(assignee));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MatchItem)) {
      return false;
    }
    MatchItem other = (MatchItem)obj;
    return typeName.equals(other.typeName) &&
           Objects.equal(assignee, other.assignee);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(typeName, assignee);
  }

  @Override
  public String toString() {
    return assignee == null ? typeName : typeName + " " + assignee;
  }
}
