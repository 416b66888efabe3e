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
 * Application of a function to arguments.  Infix and prefix operator
 * applications are also represented as calls, with the operator as a
 * {@link GenericVariable}.
 */
public class FunctionCall extends Expression {
  private final Expression function;
  private final List<Expression> arguments;

  public FunctionCall(Expression function, List<? extends Expression> arguments) {
    this.function = Preconditions.checkNotNull(function);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public Expression getFunction() {
    return function;
  }

  public List<Expression> getArguments() {
    return arguments;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("function", Json.variant(function));
    o.add("arguments", Json.variants(arguments));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionCall)) {
      return false;
    }
    FunctionCall other = (FunctionCall)obj;
    return function.equals(other.function) &&
           arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(function, arguments);
  }

  @Override
  public String toString() {
    return function + "(" + Joiner.on(", ").join(arguments) + ")";
  }
}
