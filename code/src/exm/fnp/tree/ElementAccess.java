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
 * Access to a tuple element by position, e.g. <code>x.0</code>
 */
public class ElementAccess extends Expression {
  private final Expression expression;
  private final int index;

  public ElementAccess(Expression expression, int index) {
    Preconditions.checkArgument(index >= 0, "Negative index %s", index);
    this.expression = Preconditions.checkNotNull(expression);
    this.index = index;
  }

  public Expression getExpression() {
    return expression;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("expression", Json.variant(expression));
    o.addProperty("index", index);
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ElementAccess)) {
      return false;
    }
    ElementAccess other = (ElementAccess)obj;
    return index == other.index && expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(expression, index);
  }

  @Override
  public String toString() {
    return expression + "." + index;
  }
}
