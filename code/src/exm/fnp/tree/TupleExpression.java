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

public class TupleExpression extends Expression {
  private final List<Expression> expressions;

  public TupleExpression(List<? extends Expression> expressions) {
    this.expressions = ImmutableList.copyOf(expressions);
  }

  public List<Expression> getExpressions() {
    return expressions;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("expressions", Json.variants(expressions));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TupleExpression)) {
      return false;
    }
    return expressions.equals(((TupleExpression)obj).expressions);
  }

  @Override
  public int hashCode() {
    return expressions.hashCode();
  }

  @Override
  public String toString() {
    if (expressions.size() == 1) {
      return "(" + expressions.get(0) + ",)";
    }
    return "(" + Joiner.on(", ").join(expressions) + ")";
  }
}
