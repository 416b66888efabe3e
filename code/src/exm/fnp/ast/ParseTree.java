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
package exm.fnp.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.apache.commons.lang3.StringUtils;

/**
 * Parse tree node built by the grammar's rewrite rules.  Adds typed
 * accessors so walkers can avoid casts.
 */
public class ParseTree extends CommonTree {

  public ParseTree(Token t) {
    super(t);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * ParseTree everywhere
   */
  public ParseTree child(int i) {
    return (ParseTree)super.getChild(i);
  }

  public ParseTree lastChild() {
    return child(childCount() - 1);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<ParseTree> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<ParseTree> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  public List<ParseTree> children(int start, int end) {
    return children().subList(start, end);
  }

  /**
   * @return line:column of the node, for messages
   */
  public String location() {
    return getLine() + ":" + (getCharPositionInLine() + 1);
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    writer.print(StringUtils.repeat(' ', indent));
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }
}
