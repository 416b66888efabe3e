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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.common.exceptions.InvalidSyntaxException;
import exm.fnp.common.lang.OperatorManager;
import exm.fnp.common.lang.OperatorManager.Associativity;
import exm.fnp.frontend.tree.Literals;
import exm.fnp.frontend.tree.Names;
import exm.fnp.frontend.tree.TypeTree;
import exm.fnp.tree.Assignee;
import exm.fnp.tree.Block;
import exm.fnp.tree.ConstructorCall;
import exm.fnp.tree.ElementAccess;
import exm.fnp.tree.Expression;
import exm.fnp.tree.FunctionCall;
import exm.fnp.tree.FunctionDefinition;
import exm.fnp.tree.GenericConstructor;
import exm.fnp.tree.GenericVariable;
import exm.fnp.tree.IfExpression;
import exm.fnp.tree.MatchBlock;
import exm.fnp.tree.MatchExpression;
import exm.fnp.tree.MatchItem;
import exm.fnp.tree.TupleExpression;
import exm.fnp.tree.TypeInstance;
import exm.fnp.tree.TypedAssignee;

/**
 * Translates expression parse trees to AST expressions, resolving operator
 * precedence and associativity along the way.
 */
public class ExprWalker {

  private final ASTWalker astWalker;

  public ExprWalker(ASTWalker astWalker) {
    this.astWalker = astWalker;
  }

  public Expression walk(ParseTree tree) throws InvalidSyntaxException {
    switch (tree.getType()) {
      case FnParser.INFIX_CALL:
        return infixCall(tree);
      case FnParser.PREFIX_CALL:
        return prefixCall(tree);
      case FnParser.PAREN:
        return walk(tree.child(0));
      case FnParser.CALL:
        assert(tree.child(1).getType() == FnParser.ARGS);
        return new FunctionCall(walk(tree.child(0)),
                                walkList(tree.child(1).children()));
      case FnParser.ACCESS:
        return new ElementAccess(walk(tree.child(0)),
                                 Literals.extractIndex(tree.child(1)));
      case FnParser.INTEGER:
        return Literals.extractIntLit(tree);
      case FnParser.TRUE:
      case FnParser.FALSE:
        return Literals.extractBoolLit(tree);
      case FnParser.TUPLE_EXPR:
        return new TupleExpression(walkList(tree.children()));
      case FnParser.VARIABLE:
        return variable(tree.child(0));
      case FnParser.CONSTRUCTOR_CALL:
        return constructorCall(tree);
      case FnParser.IF_EXPR:
        return ifExpression(tree);
      case FnParser.MATCH_EXPR:
        return matchExpression(tree);
      case FnParser.FN_DEF:
        return functionDefinition(tree);
      default:
        throw new FnRuntimeError("Unexpected token in expression: " +
                  LogHelper.tokName(tree.getType()) + " at " + tree.location());
    }
  }

  public List<Expression> walkList(List<ParseTree> trees)
      throws InvalidSyntaxException {
    List<Expression> result = new ArrayList<Expression>(trees.size());
    for (ParseTree tree: trees) {
      result.add(walk(tree));
    }
    return result;
  }

  /**
   * The parser nests every operator chain to the right:
   * a op1 b op2 c is ^(INFIX_CALL a op1 ^(INFIX_CALL b op2 c)).
   * Walk along the chain, keeping the loosest-binding operator seen so far
   * as the root.  Each operator either becomes the new root, taking
   * everything to its left as its first argument, or is nested inside the
   * current hole of the partial tree.
   */
  private Expression infixCall(ParseTree tree) throws InvalidSyntaxException {
    String root = null;
    OperatorChain chain = new OperatorChain();
    ParseTree current = tree;
    while (current.getType() == FnParser.INFIX_CALL) {
      assert(current.childCount() == 3);
      Expression left = walk(current.child(0));
      ParseTree opTree = current.child(1);
      String op = Names.operatorName(opTree);
      Associativity assoc = OperatorManager.getAssociativity(op);
      LogHelper.trace(2, "operator " + op + " (root " + root + ")");

      if (op.equals(root) && assoc == Associativity.NONE) {
        throw new InvalidSyntaxException(opTree, "Operator " + op +
                " is not associative, chains must be parenthesized");
      }

      int rootPrec = root == null ? OperatorManager.INVALID_PRECEDENCE
                                  : OperatorManager.getPrecedence(root);
      int prec = OperatorManager.getPrecedence(op);
      boolean tie = root != null && rootPrec == prec;

      if (rootPrec < prec || (tie && assoc == Associativity.RIGHT)) {
        chain.reroot(op, left);
        root = op;
      } else {
        chain.nest(op, left);
      }
      current = current.child(2);
    }
    return chain.close(walk(current));
  }

  private Expression prefixCall(ParseTree tree) throws InvalidSyntaxException {
    assert(tree.childCount() == 2);
    ParseTree opTree = tree.child(0);
    String op = Names.operatorName(opTree);
    if (!OperatorManager.checkOperator(op)) {
      throw new InvalidSyntaxException(opTree, "Cannot use " + op +
                                       " as prefix operator");
    }
    Expression arg = walk(tree.child(1));
    return new FunctionCall(GenericVariable.var(op),
                            Collections.singletonList(arg));
  }

  private GenericVariable variable(ParseTree tree) {
    assert(tree.getType() == FnParser.GENERIC_INSTANCE);
    String id = Names.variableName(tree.child(0));
    List<TypeInstance> types = TypeTree.extractTypes(tree.children(1));
    return new GenericVariable(id, types);
  }

  private ConstructorCall constructorCall(ParseTree tree)
      throws InvalidSyntaxException {
    ParseTree instance = tree.child(0);
    assert(instance.getType() == FnParser.GENERIC_INSTANCE);
    String id = Names.variableName(instance.child(0));
    if (OperatorManager.checkOperator(id)) {
      throw new InvalidSyntaxException(instance, "Operator " + id +
                                       " cannot be used as a constructor");
    }
    GenericConstructor constructor = new GenericConstructor(id,
                      TypeTree.extractTypes(instance.children(1)));
    return new ConstructorCall(constructor, walkList(tree.children(1)));
  }

  private IfExpression ifExpression(ParseTree tree)
      throws InvalidSyntaxException {
    assert(tree.childCount() == 3);
    Expression condition = walk(tree.child(0));
    Block trueBlock = astWalker.walkBlock(tree.child(1));
    Block falseBlock = astWalker.walkBlock(tree.child(2));
    return new IfExpression(condition, trueBlock, falseBlock);
  }

  private MatchExpression matchExpression(ParseTree tree)
      throws InvalidSyntaxException {
    Expression subject = walk(tree.child(0));
    List<MatchBlock> blocks = new ArrayList<MatchBlock>();
    for (ParseTree blockTree: tree.children(1)) {
      assert(blockTree.getType() == FnParser.MATCH_BLOCK);
      int itemCount = blockTree.childCount() - 1;
      List<MatchItem> items = new ArrayList<MatchItem>(itemCount);
      for (ParseTree item: blockTree.children(0, itemCount)) {
        items.add(matchItem(item));
      }
      blocks.add(new MatchBlock(items, astWalker.walkBlock(blockTree.lastChild())));
    }
    return new MatchExpression(subject, blocks);
  }

  private MatchItem matchItem(ParseTree tree) {
    assert(tree.getType() == FnParser.MATCH_ITEM);
    Assignee binding = null;
    if (tree.childCount() == 2) {
      binding = new Assignee(tree.child(1).getText());
    }
    return new MatchItem(tree.child(0).getText(), binding);
  }

  private FunctionDefinition functionDefinition(ParseTree tree)
      throws InvalidSyntaxException {
    assert(tree.childCount() == 3);
    ParseTree params = tree.child(0);
    assert(params.getType() == FnParser.PARAMS);
    List<TypedAssignee> parameters = new ArrayList<TypedAssignee>();
    for (ParseTree param: params.children()) {
      assert(param.getType() == FnParser.TYPED_ASSIGNEE);
      parameters.add(new TypedAssignee(new Assignee(param.child(0).getText()),
                                       TypeTree.extractType(param.child(1))));
    }
    TypeInstance returnType = TypeTree.extractType(tree.child(1));
    Block body = astWalker.walkBlock(tree.child(2));
    return new FunctionDefinition(parameters, returnType, body);
  }

  /**
   * Operator expression under construction, with one hole for the next
   * operand.  Kept as a stack of (operator, left argument) frames: the hole
   * is the right argument of the innermost frame.
   */
  private static class OperatorChain {
    private final List<String> ops = new ArrayList<String>();
    private final List<Expression> lefts = new ArrayList<Expression>();

    /**
     * Fill the hole with left, then start a new tree op(result, hole)
     */
    void reroot(String op, Expression left) {
      Expression closed = close(left);
      ops.clear();
      lefts.clear();
      nest(op, closed);
    }

    /**
     * Put op(left, hole) into the hole
     */
    void nest(String op, Expression left) {
      ops.add(op);
      lefts.add(left);
    }

    Expression close(Expression operand) {
      Expression result = operand;
      for (int i = ops.size() - 1; i >= 0; i--) {
        result = new FunctionCall(GenericVariable.var(ops.get(i)),
                                  Arrays.asList(lefts.get(i), result));
      }
      return result;
    }
  }
}
