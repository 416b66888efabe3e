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

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

/**
 * A bound name.  Operators bound with <code>__op__ = ...</code> are stored
 * as the bare operator.
 */
public class Assignee extends AstNode {
  private final String id;

  public Assignee(String id) {
    this.id = Preconditions.checkNotNull(id);
  }

  public String getId() {
    return id;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("id", id);
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Assignee)) {
      return false;
    }
    return id.equals(((Assignee)obj).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
