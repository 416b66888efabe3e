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
package exm.fnp.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.common.exceptions.InvalidSyntaxException;
import exm.fnp.common.lang.OperatorManager;
import exm.fnp.frontend.tree.Names;
import exm.fnp.frontend.tree.TypeTree;
import exm.fnp.tree.Assignee;
import exm.fnp.tree.Assignment;
import exm.fnp.tree.Block;
import exm.fnp.tree.Definition;
import exm.fnp.tree.EmptyTypeDefinition;
import exm.fnp.tree.Expression;
import exm.fnp.tree.GenericTypeVariable;
import exm.fnp.tree.OpaqueTypeDefinition;
import exm.fnp.tree.ParametricAssignee;
import exm.fnp.tree.Program;
import exm.fnp.tree.TransparentTypeDefinition;
import exm.fnp.tree.TypeInstance;
import exm.fnp.tree.TypeItem;
import exm.fnp.tree.UnionTypeDefinition;

/**
 * Walks the parse tree produced by the ANTLR grammar and builds the AST.
 *
 * Expressions are delegated to {@link ExprWalker}, type annotations to
 * {@link TypeTree}.  Input that the grammar accepts but that is not
 * structurally valid causes an {@link InvalidSyntaxException}.  A parse
 * tree that the grammar could not have produced is an internal error.
 */
public class ASTWalker {

  private final ExprWalker exprWalker;

  public ASTWalker() {
    this.exprWalker = new ExprWalker(this);
  }

  public ExprWalker getExprWalker() {
    return exprWalker;
  }

  public Program walkProgram(ParseTree tree) throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.PROGRAM);
    LogHelper.trace(0, "program with " + tree.childCount() + " definitions");
    List<Definition> definitions = new ArrayList<Definition>();
    for (ParseTree child: tree.children()) {
      definitions.add(walkDefinition(child));
    }
    return new Program(definitions);
  }

  public Definition walkDefinition(ParseTree tree)
      throws InvalidSyntaxException {
    LogHelper.trace(2, tree);
    switch (tree.getType()) {
      case FnParser.ASSIGNMENT:
        return walkAssignment(tree);
      case FnParser.UNION_TYPE_DEF:
        return unionTypeDefinition(tree);
      case FnParser.OPAQUE_TYPE_DEF:
        return new OpaqueTypeDefinition(typeVariable(tree.child(0)),
                                        TypeTree.extractType(tree.child(1)));
      case FnParser.EMPTY_TYPE_DEF:
        return emptyTypeDefinition(tree);
      case FnParser.TYPE_ALIAS:
        return new TransparentTypeDefinition(typeVariable(tree.child(0)),
                                        TypeTree.extractType(tree.child(1)));
      default:
        throw new FnRuntimeError("Unexpected token in definition: " +
                LogHelper.tokName(tree.getType()) + " at " + tree.location());
    }
  }

  public Assignment walkAssignment(ParseTree tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.ASSIGNMENT);
    assert(tree.childCount() == 2);
    ParametricAssignee assignee = walkAssignee(tree.child(0));
    Expression expr = exprWalker.walk(tree.child(1));
    return new Assignment(assignee, expr);
  }

  /**
   * Left hand side of assignment: a name, possibly with generic
   * parameters, or an operator written __op__
   */
  public ParametricAssignee walkAssignee(ParseTree tree)
      throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.ASSIGNEE);
    ParseTree nameTree = tree.child(0);
    String id;
    if (nameTree.getType() == FnParser.OPERATOR_ID) {
      id = Names.variableName(nameTree);
      if (!OperatorManager.checkOperator(id)) {
        throw new InvalidSyntaxException(nameTree, "Invalid operator name: " +
                                         id);
      }
    } else {
      // __name__ is kept as written
      id = nameTree.getText();
    }
    List<String> params = Collections.emptyList();
    if (tree.childCount() == 2) {
      params = genericParams(tree.child(1));
    }
    return new ParametricAssignee(new Assignee(id), params);
  }

  public Block walkBlock(ParseTree tree) throws InvalidSyntaxException {
    assert(tree.getType() == FnParser.BLOCK);
    assert(tree.childCount() >= 1);
    int assignCount = tree.childCount() - 1;
    List<Assignment> assignments = new ArrayList<Assignment>(assignCount);
    for (ParseTree assign: tree.children(0, assignCount)) {
      assignments.add(walkAssignment(assign));
    }
    return new Block(assignments, exprWalker.walk(tree.lastChild()));
  }

  private UnionTypeDefinition unionTypeDefinition(ParseTree tree)
      throws InvalidSyntaxException {
    GenericTypeVariable var = typeVariable(tree.child(0));
    List<TypeItem> items = new ArrayList<TypeItem>();
    for (ParseTree itemTree: tree.children(1)) {
      assert(itemTree.getType() == FnParser.TYPE_ITEM);
      TypeInstance type = null;
      if (itemTree.childCount() == 2) {
        type = TypeTree.extractType(itemTree.child(1));
      }
      items.add(new TypeItem(itemTree.child(0).getText(), type));
    }
    if (items.size() < 2) {
      throw new InvalidSyntaxException(tree, "Union type " + var.getId() +
                                       " needs at least two alternatives");
    }
    return new UnionTypeDefinition(var, items);
  }

  private EmptyTypeDefinition emptyTypeDefinition(ParseTree tree)
      throws InvalidSyntaxException {
    GenericTypeVariable var = typeVariable(tree.child(0));
    if (!var.getGenericVariables().isEmpty()) {
      throw new InvalidSyntaxException(tree, "Empty type " + var.getId() +
                                       " cannot have type parameters");
    }
    return new EmptyTypeDefinition(var.getId());
  }

  private GenericTypeVariable typeVariable(ParseTree tree) {
    assert(tree.getType() == FnParser.GENERIC_TYPEVAR);
    List<String> params = Collections.emptyList();
    if (tree.childCount() == 2) {
      params = genericParams(tree.child(1));
    }
    return new GenericTypeVariable(tree.child(0).getText(), params);
  }

  private List<String> genericParams(ParseTree tree) {
    assert(tree.getType() == FnParser.GENERIC_PARAMS);
    List<String> params = new ArrayList<String>(tree.childCount());
    for (ParseTree param: tree.children()) {
      params.add(param.getText());
    }
    return params;
  }
}
