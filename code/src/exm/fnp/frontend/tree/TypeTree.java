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

import java.util.ArrayList;
import java.util.List;

import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.frontend.LogHelper;
import exm.fnp.tree.AtomicType;
import exm.fnp.tree.FunctionType;
import exm.fnp.tree.GenericType;
import exm.fnp.tree.TupleType;
import exm.fnp.tree.TypeInstance;

/**
 * Extract type annotations from the parse tree
 */
public class TypeTree {

  public static TypeInstance extractType(ParseTree tree) {
    switch (tree.getType()) {
      case FnParser.INT_TYPE:
        return AtomicType.INT;
      case FnParser.BOOL_TYPE:
        return AtomicType.BOOL;
      case FnParser.GENERIC_TYPE:
        return new GenericType(tree.child(0).getText(),
                               extractTypes(tree.children(1)));
      case FnParser.TUPLE_TYPE:
        return new TupleType(extractTypes(tree.children()));
      case FnParser.FN_TYPE:
        return extractFunctionType(tree);
      default:
        throw new FnRuntimeError("Unexpected token in type: " +
                                 LogHelper.tokName(tree.getType()));
    }
  }

  public static List<TypeInstance> extractTypes(List<ParseTree> trees) {
    List<TypeInstance> types = new ArrayList<TypeInstance>(trees.size());
    for (ParseTree tree: trees) {
      types.add(extractType(tree));
    }
    return types;
  }

  /**
   * A tuple on the left of the arrow lists the arguments: (a, b) -> c
   * takes two arguments.  Anything else is a single argument.
   */
  private static FunctionType extractFunctionType(ParseTree tree) {
    assert(tree.getType() == FnParser.FN_TYPE);
    assert(tree.childCount() == 2);
    ParseTree head = tree.child(0);
    List<TypeInstance> args;
    if (head.getType() == FnParser.TUPLE_TYPE) {
      args = extractTypes(head.children());
    } else {
      args = new ArrayList<TypeInstance>(1);
      args.add(extractType(head));
    }
    return new FunctionType(args, extractType(tree.child(1)));
  }
}
