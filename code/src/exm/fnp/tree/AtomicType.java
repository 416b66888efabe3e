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

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

/**
 * Built-in scalar type
 */
public class AtomicType extends TypeInstance {

  public static enum Kind {
    INT, BOOL
  }

  public static final AtomicType INT = new AtomicType(Kind.INT);
  public static final AtomicType BOOL = new AtomicType(Kind.BOOL);

  private final Kind type;

  public AtomicType(Kind type) {
    this.type = Preconditions.checkNotNull(type);
  }

  public Kind getType() {
    return type;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("type_", type.name());
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AtomicType)) {
      return false;
    }
    return type == ((AtomicType)obj).type;
  }

  @Override
  public int hashCode() {
    return type.hashCode();
  }

  @Override
  public String toString() {
    return type.name().toLowerCase();
  }
}
