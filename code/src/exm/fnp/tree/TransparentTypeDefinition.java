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
 * <code>typealias Name&lt;T&gt; type</code>
 */
public class TransparentTypeDefinition extends Definition {
  private final GenericTypeVariable variable;
  private final TypeInstance type;

  public TransparentTypeDefinition(GenericTypeVariable variable,
                                   TypeInstance type) {
    this.variable = Preconditions.checkNotNull(variable);
    this.type = Preconditions.checkNotNull(type);
  }

  public GenericTypeVariable getVariable() {
    return variable;
  }

  public TypeInstance getType() {
    return type;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("variable", variable.toJson());
    o.add("type_", Json.variant(type));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TransparentTypeDefinition)) {
      return false;
    }
    TransparentTypeDefinition other = (TransparentTypeDefinition)obj;
    return variable.equals(other.variable) && type.equals(other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(variable, type);
  }

  @Override
  public String toString() {
    return "typealias " + variable + " " + type;
  }
}
