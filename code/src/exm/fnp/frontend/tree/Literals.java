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
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.common.exceptions.InvalidSyntaxException;
import exm.fnp.frontend.LogHelper;
import exm.fnp.tree.BooleanLiteral;
import exm.fnp.tree.IntegerLiteral;

public class Literals {

  /**
   * @param tree INTEGER node: optional minus followed by digits
   * @return the literal
   * @throws InvalidSyntaxException if the value does not fit in a long
   */
  public static IntegerLiteral extractIntLit(ParseTree tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.INTEGER);
    String digits = tree.lastChild().getText();
    boolean negate = tree.childCount() == 2;
    // Parse with sign so that the most negative value is accepted
    String number = negate ? "-" + digits : digits;
    return new IntegerLiteral(parseLong(tree, number));
  }

  public static BooleanLiteral extractBoolLit(ParseTree tree) {
    switch (tree.getType()) {
      case FnParser.TRUE:
        return BooleanLiteral.TRUE;
      case FnParser.FALSE:
        return BooleanLiteral.FALSE;
      default:
        throw new FnRuntimeError("Bad token: " +
                                 LogHelper.tokName(tree.getType()));
    }
  }

  /**
   * @param tree UINT token after '.'
   * @return tuple index
   * @throws InvalidSyntaxException if index is too large
   */
  public static int extractIndex(ParseTree tree) throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.UINT);
    long index = parseLong(tree, tree.getText());
    if (index > Integer.MAX_VALUE) {
      throw new InvalidSyntaxException(tree, "Element index too large: " +
                                       tree.getText());
    }
    return (int)index;
  }

  private static long parseLong(ParseTree tree, String number)
      throws InvalidSyntaxException {
    try {
      return Long.parseLong(number);
    } catch (NumberFormatException e) {
      throw new InvalidSyntaxException(tree, "Invalid integer literal: " +
                                       number);
    }
  }
}
