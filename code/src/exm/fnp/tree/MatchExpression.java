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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

public class MatchExpression extends Expression {
  private final Expression subject;
  private final List<MatchBlock> blocks;

  public MatchExpression(Expression subject, List<MatchBlock> blocks) {
    this.subject = Preconditions.checkNotNull(subject);
    this.blocks = ImmutableList.copyOf(blocks);
  }

  public Expression getSubject() {
    return subject;
  }

  public List<MatchBlock> getBlocks() {
    return blocks;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("subject", Json.variant(subject));
    o.add("blocks", Json.nodes(blocks));
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MatchExpression)) {
      return false;
    }
    MatchExpression other = (MatchExpression)obj;
    return subject.equals(other.subject) && blocks.equals(other.blocks);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(subject, blocks);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(nodeName())
                      .add("subject", subject)
                      .add("blocks", blocks).toString();
  }
}
