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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

public class TupleType extends TypeInstance {
  private final List<TypeInstance> types;

  public TupleType(List<? extends TypeInstance> types) {
    this.types = ImmutableList.copyOf(types);
  }

  public List<TypeInstance> getTypes() {
    return types;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("types", Json.variants(types));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TupleType)) {
      return false;
    }
    return types.equals(((TupleType)obj).types);
  }

  @Override
  public int hashCode() {
    return types.hashCode();
  }

  @Override
  public String toString() {
    if (types.size() == 1) {
      return "(" + types.get(0) + ",)";
    }
    return "(" + Joiner.on(", ").join(types) + ")";
  }
}
