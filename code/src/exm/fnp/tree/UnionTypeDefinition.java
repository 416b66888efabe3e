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
 * <code>typedef Name&lt;T&gt; { A T | B }</code>
 */
public class UnionTypeDefinition extends Definition {
  private final GenericTypeVariable variable;
  private final List<TypeItem> items;

  public UnionTypeDefinition(GenericTypeVariable variable, List<TypeItem> items) {
    Preconditions.checkArgument(items.size() >= 2,
                      "Union type needs at least two items, got %s", items.size());
    this.variable = Preconditions.checkNotNull(variable);
    this.items = ImmutableList.copyOf(items);
  }

  public GenericTypeVariable getVariable() {
    return variable;
  }

  public List<TypeItem> getItems() {
    return items;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("variable", variable.toJson());
    o.add("items", Json.nodes(items));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof UnionTypeDefinition)) {
      return false;
    }
    UnionTypeDefinition other = (UnionTypeDefinition)obj;
    return variable.equals(other.variable) && items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(variable, items);
  }

  @Override
  public String toString() {
    return "typedef " + variable + " { " + Joiner.on(" | ").join(items) + " }";
  }
}
