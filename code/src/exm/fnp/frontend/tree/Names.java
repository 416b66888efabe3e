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
package exm.fnp.frontend.tree;

import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;

/**
 * Names of variables and operators as written in the source
 */
public class Names {

  /**
   * @param tree an infix or prefix operator token
   * @return operator, with a named function written __name__ unwrapped
   */
  public static String operatorName(ParseTree tree) {
    if (tree.getType() == FnParser.INFIX_ID) {
      return unwrap(tree.getText());
    }
    return tree.getText();
  }

  /**
   * @param tree name of a variable or constructor
   * @return the name, with an operator written __op__ unwrapped
   */
  public static String variableName(ParseTree tree) {
    if (tree.getType() == FnParser.OPERATOR_ID) {
      return unwrap(tree.getText());
    }
    assert(tree.getType() == FnParser.ID ||
           tree.getType() == FnParser.INFIX_ID) : tree.getText();
    return tree.getText();
  }

  /**
   * Strip the double underscores from __x__
   */
  public static String unwrap(String text) {
    assert(text.length() > 4 && text.startsWith("__") && text.endsWith("__"));
    return text.substring(2, text.length() - 2);
  }
}
