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
 * Alternatives separated by <code>|</code> sharing one block
 */
public class MatchBlock extends AstNode {
  private final List<MatchItem> matches;
  private final Block block;

  public MatchBlock(List<MatchItem> matches, Block block) {
    Preconditions.checkArgument(!matches.isEmpty(), "Match block without patterns");
    this.matches = ImmutableList.copyOf(matches);
    this.block = Preconditions.checkNotNull(block);
  }

  public List<MatchItem> getMatches() {
    return matches;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("matches", Json.nodes(matches));
    o.add("block", block.toJson());
    return o;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MatchBlock)) {
      return false;
    }
    MatchBlock other = (MatchBlock)obj;
    return matches.equals(other.matches) && block.equals(other.block);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(matches, block);
  }

  @Override
  public String toString() {
    return Joiner.on(" | ").join(matches) + ": " + block;
  }
}
