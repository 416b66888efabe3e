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
 * Named type, possibly instantiated with type arguments, e.g.
 * <code>Map.&lt;K, V&gt;</code>
 */
public class GenericType extends TypeInstance {
  private final String id;
  private final List<TypeInstance> typeVariables;

  public GenericType(String id, List<? extends TypeInstance> typeVariables) {
    this.id = Preconditions.checkNotNull(id);
    this.typeVariables = ImmutableList.copyOf(typeVariables);
  }

  /**
   * @param id
   * @return type name without type arguments
   */
  public static GenericType typename(String id) {
    return new GenericType(id, Collections.<TypeInstance>emptyList());
  }

  public String getId() {
    return id;
  }

  public List<TypeInstance> getTypeVariables() {
    return typeVariables;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("id", id);
    o.add("type_variables", Json.variants(typeVariables));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof GenericType)) {
      return false;
    }
    GenericType other = (GenericType)obj;
    return id.equals(other.id) && typeVariables.equals(other.typeVariables);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, typeVariables);
  }

  @Override
  public String toString() {
    if (typeVariables.isEmpty()) {
      return id;
    }
    return id + ".<" + Joiner.on(", ").join(typeVariables) + ">";
  }
}
