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
 * Anonymous function, e.g. <code>(x: int) -> int { x }</code>
 */
public class FunctionDefinition extends Expression {
  private final List<TypedAssignee> parameters;
  private final TypeInstance returnType;
  private final Block body;

  public FunctionDefinition(List<TypedAssignee> parameters,
                            TypeInstance returnType, Block body) {
    this.parameters = ImmutableList.copyOf(parameters);
    this.returnType = Preconditions.checkNotNull(returnType);
    this.body = Preconditions.checkNotNull(body);
  }

  public List<TypedAssignee> getParameters() {
    return parameters;
  }

  public TypeInstance getReturnType() {
    return returnType;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("parameters", Json.nodes(parameters));
    o.add("return_type", Json.variant(returnType));
    o.add("body", body.toJson());
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionDefinition)) {
      return false;
    }
    FunctionDefinition other = (FunctionDefinition)obj;
    return parameters.equals(other.parameters) &&
           returnType.equals(other.returnType) &&
           body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(parameters, returnType, body);
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(parameters) + ") -> " + returnType +
           " " + body;
  }
}
