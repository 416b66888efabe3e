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
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

/**
 * Type of a function, e.g. <code>(int, bool) -> int</code>
 */
public class FunctionType extends TypeInstance {
  private final List<TypeInstance> argumentTypes;
  private final TypeInstance returnType;

  public FunctionType(List<? extends TypeInstance> argumentTypes,
                      TypeInstance returnType) {
    this.argumentTypes = ImmutableList.copyOf(argumentTypes);
    this.returnType = Preconditions.checkNotNull(returnType);
  }

  public List<TypeInstance> getArgumentTypes() {
    return argumentTypes;
  }

  public TypeInstance getReturnType() {
    return returnType;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("argument_types", Json.variants(argumentTypes));
    o.add("return_type", Json.variant(returnType));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionType)) {
      return false;
    }
    FunctionType other = (FunctionType)obj;
    return argumentTypes.equals(other.argumentTypes) &&
           returnType.equals(other.returnType);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(argumentTypes, returnType);
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(argumentTypes) + ") -> " + returnType;
  }
}
