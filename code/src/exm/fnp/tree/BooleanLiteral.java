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

import com.google.gson.JsonObject;

public class BooleanLiteral extends Expression {

  public static final BooleanLiteral TRUE = new BooleanLiteral(true);
  public static final BooleanLiteral FALSE = new BooleanLiteral(false);

  private final boolean value;

  public BooleanLiteral(boolean value) {
    this.value = value;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public String nodeName() {
    return "Boolean";
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("value", value);
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BooleanLiteral)) {
      return false;
    }
    return value == ((BooleanLiteral)obj).value;
  }

  @Override
  public int hashCode() {
    return value ? 1231 : 1237;
  }

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
