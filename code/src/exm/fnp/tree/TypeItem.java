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
 * One alternative of a union type: a constructor name and the type of
 * its payload, if it has one.
 */
public class TypeItem extends AstNode {
  private final String id;
  /** null if no payload */
  private final TypeInstance type;

  public TypeItem(String id, TypeInstance type) {
    this.id = Preconditions.checkNotNull(id);
    this.type = type;
  }

  public String getId() {
    return id;
  }

  public TypeInstance getType() {
    return type;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("id", id);
    o.add("type_", Json.optionalVariant(type));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeItem)) {
      return false;
    }
    TypeItem other = (TypeItem)obj;
    return id.equals(other.id) && Objects.equal(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, type);
  }

  @Override
  public String toString() {
    return type == null ? id : id + " " + type;
  }
}
