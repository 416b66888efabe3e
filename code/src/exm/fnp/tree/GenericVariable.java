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
 * Reference to a variable or operator, possibly instantiated with type
 * arguments, e.g. <code>map.&lt;int, bool&gt;</code>
 */
public class GenericVariable extends Expression {
  private final String id;
  private final List<TypeInstance> typeInstances;

  public GenericVariable(String id, List<? extends TypeInstance> typeInstances) {
    this.id = Preconditions.checkNotNull(id);
    this.typeInstances = ImmutableList.copyOf(typeInstances);
  }

  /**
   * @param id
   * @return variable reference without type arguments
   */
  public static GenericVariable var(String id) {
    return new GenericVariable(id, Collections.<TypeInstance>emptyList());
  }

  public String getId() {
    return id;
  }

  public List<TypeInstance> getTypeInstances() {
    return typeInstances;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("id", id);
    o.add("type_instances", Json.variants(typeInstances));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof GenericVariable)) {
      return false;
    }
    GenericVariable other = (GenericVariable)obj;
    return id.equals(other.id) && typeInstances.equals(other.typeInstances);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, typeInstances);
  }

  @Override
  public String toString() {
    if (typeInstances.isEmpty()) {
      return id;
    }
    return id + ".<" + Joiner.on(", ").join(typeInstances) + ">";
  }
}
