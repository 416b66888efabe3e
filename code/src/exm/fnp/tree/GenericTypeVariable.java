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
 * Name and type parameters introduced by a type definition or alias,
 * e.g. <code>Maybe&lt;T&gt;</code>
 */
public class GenericTypeVariable extends AstNode {
  private final String id;
  private final List<String> genericVariables;

  public GenericTypeVariable(String id, List<String> genericVariables) {
    this.id = Preconditions.checkNotNull(id);
    this.genericVariables = ImmutableList.copyOf(genericVariables);
  }

  public static GenericTypeVariable typeVariable(String id) {
    return new GenericTypeVariable(id, Collections.<String>emptyList());
  }

  public String getId() {
    return id;
  }

  public List<String> getGenericVariables() {
    return genericVariables;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("id", id);
    o.add("generic_variables", Json.ids(genericVariables));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof GenericTypeVariable)) {
      return false;
    }
    GenericTypeVariable other = (GenericTypeVariable)obj;
    return id.equals(other.id) &&
           genericVariables.equals(other.genericVariables);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, genericVariables);
  }

  @Override
  public String toString() {
    return id + "<" + Joiner.on(", ").join(genericVariables) + ">";
  }
}
