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
 * Construction of a union or opaque type value, e.g.
 * <code>Cons.&lt;int&gt;{(1, t)}</code>
 */
public class ConstructorCall extends Expression {
  private final GenericConstructor constructor;
  private final List<Expression> arguments;

  public ConstructorCall(GenericConstructor constructor,
                         List<? extends Expression> arguments) {
    this.constructor = Preconditions.checkNotNull(constructor);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public GenericConstructor getConstructor() {
    return constructor;
  }

  public List<Expression> getArguments() {
    return arguments;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("constructor", constructor.toJson());
    o.add("arguments", Json.variants(arguments));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ConstructorCall)) {
      return false;
    }
    ConstructorCall other = (ConstructorCall)obj;
    return constructor.equals(other.constructor) &&
           arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(constructor, arguments);
  }

  @Override
  public String toString() {
    return constructor + "{" + Joiner.on(", ").join(arguments) + "}";
  }
}
