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

public class IfExpression extends Expression {
  private final Expression condition;
  private final Block trueBlock;
  private final Block falseBlock;

  public IfExpression(Expression condition, Block trueBlock, Block falseBlock) {
    this.condition = Preconditions.checkNotNull(condition);
    this.trueBlock = Preconditions.checkNotNull(trueBlock);
    this.falseBlock = Preconditions.checkNotNull(falseBlock);
  }

  public Expression getCondition() {
    return condition;
  }

  public Block getTrueBlock() {
    return trueBlock;
  }

  public Block getFalseBlock() {
    return falseBlock;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("condition", Json.variant(condition));
    o.add("true_block", trueBlock.toJson());
    o.add("false_block", falseBlock.toJson());
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IfExpression)) {
      return false;
    }
    IfExpression other = (IfExpression)obj;
    return condition.equals(other.condition) &&
           trueBlock.equals(other.trueBlock) &&
           falseBlock.equals(other.falseBlock);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(condition, trueBlock, falseBlock);
  }

  @Override
  public String toString() {
    return "if (" + condition + ") " + trueBlock + " else " + falseBlock;
  }
}
