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

import static exm.fnp.tree.AtomicType.INT;
import static exm.fnp.tree.GenericType.typename;
import static exm.fnp.tree.GenericVariable.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.fnp.frontend.SourceParser.Rule;
import exm.fnp.tree.Assignee;
import exm.fnp.tree.Assignment;
import exm.fnp.tree.AstNode;
import exm.fnp.tree.Block;
import exm.fnp.tree.Definition;
import exm.fnp.tree.EmptyTypeDefinition;
import exm.fnp.tree.Expression;
import exm.fnp.tree.FunctionCall;
import exm.fnp.tree.FunctionDefinition;
import exm.fnp.tree.FunctionType;
import exm.fnp.tree.GenericType;
import exm.fnp.tree.GenericTypeVariable;
import exm.fnp.tree.GenericVariable;
import exm.fnp.tree.IntegerLiteral;
import exm.fnp.tree.OpaqueTypeDefinition;
import exm.fnp.tree.ParametricAssignee;
import exm.fnp.tree.Program;
import exm.fnp.tree.TransparentTypeDefinition;
import exm.fnp.tree.TupleExpression;
import exm.fnp.tree.TupleType;
import exm.fnp.tree.TypeInstance;
import exm.fnp.tree.TypeItem;
import exm.fnp.tree.TypedAssignee;
import exm.fnp.tree.UnionTypeDefinition;

public class ASTWalkerTest {

  private static void check(String code, Rule rule, AstNode expected) {
    assertEquals("Parsing " + code + " as " + rule.ruleName(), expected,
                 SourceParser.parse(code, rule).orElse(null));
  }

  private static void reject(String code, Rule rule) {
    assertFalse("Should not parse as " + rule.ruleName() + ": " + code,
                SourceParser.parse(code, rule).isPresent());
  }

  private static IntegerLiteral i(long value) {
    return new IntegerLiteral(value);
  }

  private static Assignment assign(String id, Expression e) {
    return new Assignment(new ParametricAssignee(id), e);
  }

  private static Assignment assign(String id, List<String> params,
                                   Expression e) {
    return new Assignment(new ParametricAssignee(new Assignee(id), params), e);
  }

  private static GenericTypeVariable typeVariable(String id, String... params) {
    return new GenericTypeVariable(id, Arrays.asList(params));
  }

  private static TupleType tuple(TypeInstance... types) {
    return new TupleType(Arrays.asList(types));
  }

  private static Program program(Definition... defs) {
    return new Program(Arrays.asList(defs));
  }

  @Test
  public void testSimpleAssignments() {
    check("a = 3", Rule.ASSIGNMENT, assign("a", i(3)));
    check("a0 = 0", Rule.ASSIGNMENT, assign("a0", i(0)));
    reject("a == 3", Rule.ASSIGNMENT);
    reject("0 = 3", Rule.ASSIGNMENT);
  }

  @Test
  public void testUnderscoreAssignees() {
    check("_ = 0", Rule.ASSIGNMENT, assign("_", i(0)));
    check("__ = 0", Rule.ASSIGNMENT, assign("__", i(0)));
    check("___ = 0", Rule.ASSIGNMENT, assign("___", i(0)));
    check("____ = 0", Rule.ASSIGNMENT, assign("____", i(0)));
    check("_____ = 0", Rule.ASSIGNMENT, assign("_____", i(0)));
    check("__a__ = 3", Rule.ASSIGNMENT, assign("__a__", i(3)));
  }

  @Test
  public void testOperatorAssignees() {
    check("__&&__ = 3", Rule.ASSIGNMENT, assign("&&", i(3)));
    check("__>__ = 3", Rule.ASSIGNMENT, assign(">", i(3)));
    check("__$__ = 3", Rule.ASSIGNMENT, assign("$", i(3)));
    check("__==__ = 4", Rule.ASSIGNMENT, assign("==", i(4)));
    reject("__$ $__ = 3", Rule.ASSIGNMENT);
    reject("__=__ = 4", Rule.ASSIGNMENT);
    reject("__.__ = 4", Rule.ASSIGNMENT);
  }

  @Test
  public void testGenericAssignees() {
    GenericVariable fT = new GenericVariable("f",
                Collections.singletonList(typename("T")));
    check("a<T> = f.<T>", Rule.ASSIGNMENT,
          assign("a", Arrays.asList("T"), fT));
    check("a<T,> = t.<T,>", Rule.ASSIGNMENT,
          assign("a", Arrays.asList("T"), new GenericVariable("t",
                Collections.singletonList(typename("T")))));
    check("a<T,U> = -4", Rule.ASSIGNMENT,
          assign("a", Arrays.asList("T", "U"), i(-4)));
    check("a<T,U> = f.<U,T>", Rule.ASSIGNMENT,
          assign("a", Arrays.asList("T", "U"), new GenericVariable("f",
                Arrays.asList(typename("U"), typename("T")))));
    check("a<T,U,> = 0", Rule.ASSIGNMENT,
          assign("a", Arrays.asList("T", "U"), i(0)));
    check("a<> = 0", Rule.ASSIGNMENT,
          assign("a", Collections.<String>emptyList(), i(0)));
  }

  @Test
  public void testBlocks() {
    check("{5}", Rule.BLOCK,
          new Block(Collections.<Assignment>emptyList(), i(5)));
    check("{a = -9; 8}", Rule.BLOCK,
          new Block(Arrays.asList(assign("a", i(-9))), i(8)));
    check("{w = x;y<T> = x.<T,T>; -8}", Rule.BLOCK,
          new Block(Arrays.asList(
              assign("w", var("x")),
              assign("y", Arrays.asList("T"), new GenericVariable("x",
                    Arrays.asList(typename("T"), typename("T"))))),
              i(-8)));
    check("{a = -9; b = -1; -2}", Rule.BLOCK,
          new Block(Arrays.asList(assign("a", i(-9)), assign("b", i(-1))),
                    i(-2)));
    check("{-2}", Rule.BLOCK,
          new Block(Collections.<Assignment>emptyList(), i(-2)));
    check("{w = x; ()}", Rule.BLOCK,
          new Block(Arrays.asList(assign("w", var("x"))),
                    new TupleExpression(Collections.<Expression>emptyList())));
    reject("{}", Rule.BLOCK);
    reject("{a = -9}", Rule.BLOCK);
    reject("{a = -9;}", Rule.BLOCK);
    reject("{; 8}", Rule.BLOCK);
    reject("{w = x;; 8}", Rule.BLOCK);
  }

  @Test
  public void testOpaqueTypeDefinitions() {
    check("typedef tuple (int, int)", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("tuple"), tuple(INT, INT)));
    check("typedef tuple ()", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("tuple"), tuple()));
    check("typedef tuple<T> (T, T)", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("tuple", "T"),
                                   tuple(typename("T"), typename("T"))));
    check("typedef tuple<T,U> (F.<U>, T)", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("tuple", "T", "U"),
              tuple(new GenericType("F", Arrays.asList(typename("U"))),
                    typename("T"))));
    check("typedef apply<T,U> T.<U>", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("apply", "T", "U"),
              new GenericType("T", Arrays.asList(typename("U")))));
    check("typedef alias<T,> T", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("alias", "T"), typename("T")));
    check("typedef Integer int", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("Integer"), INT));
    check("typedef Integer<> int", Rule.TYPE_DEF,
          new OpaqueTypeDefinition(typeVariable("Integer"), INT));
  }

  @Test
  public void testEmptyTypeDefinitions() {
    check("typedef None", Rule.TYPE_DEF, new EmptyTypeDefinition("None"));
    check("typedef None<>", Rule.TYPE_DEF, new EmptyTypeDefinition("None"));
    reject("typedef None<T>", Rule.TYPE_DEF);
  }

  @Test
  public void testUnionTypeDefinitions() {
    check("typedef Maybe<T> { Some T | None }", Rule.TYPE_DEF,
          new UnionTypeDefinition(typeVariable("Maybe", "T"), Arrays.asList(
              new TypeItem("Some", typename("T")),
              new TypeItem("None", null))));
    check("typedef Choice<T, U> { Left T | Right U }", Rule.TYPE_DEF,
          new UnionTypeDefinition(typeVariable("Choice", "T", "U"),
              Arrays.asList(new TypeItem("Left", typename("T")),
                            new TypeItem("Right", typename("U")))));
    check("typedef Error {Error1|Error2}", Rule.TYPE_DEF,
          new UnionTypeDefinition(typeVariable("Error"), Arrays.asList(
              new TypeItem("Error1", null), new TypeItem("Error2", null))));
    check("typedef Error<T> {Error1 | Error2}", Rule.TYPE_DEF,
          new UnionTypeDefinition(typeVariable("Error", "T"), Arrays.asList(
              new TypeItem("Error1", null), new TypeItem("Error2", null))));
    reject("typedef Error {Error1}", Rule.TYPE_DEF);
    reject("typedef Error {}", Rule.TYPE_DEF);
    reject("typedef Error<T> {Error1{T} | Error2}", Rule.TYPE_DEF);
  }

  @Test
  public void testTypeAliases() {
    FunctionType idType = new FunctionType(Arrays.asList(typename("T")),
                                           typename("T"));
    check("typealias int8 int", Rule.TYPE_ALIAS,
          new TransparentTypeDefinition(typeVariable("int8"), INT));
    check("typealias int8 (int,)", Rule.TYPE_ALIAS,
          new TransparentTypeDefinition(typeVariable("int8"), tuple(INT)));
    check("typealias id<T> T -> T", Rule.TYPE_ALIAS,
          new TransparentTypeDefinition(typeVariable("id", "T"), idType));
    check("typealias int8<> int", Rule.TYPE_ALIAS,
          new TransparentTypeDefinition(typeVariable("int8"), INT));
    check("typealias id<T> (T -> T)", Rule.TYPE_ALIAS,
          new TransparentTypeDefinition(typeVariable("id", "T"), idType));
    reject("typealias MaybeInt {Some int | None}", Rule.TYPE_ALIAS);
    reject("typealias int", Rule.TYPE_ALIAS);
  }

  @Test
  public void testPrograms() {
    Assignment z = assign("z", new FunctionCall(var("-"),
                          Arrays.asList(var("y"))));
    OpaqueTypeDefinition int8 = new OpaqueTypeDefinition(
                          typeVariable("int8"), INT);
    check("z = -y;", Rule.PROGRAM, program(z));
    check("z = -y", Rule.PROGRAM, program(z));
    check("z = -y; typedef int8 int", Rule.PROGRAM, program(z, int8));
    check("z = -y; typedef int8 int;", Rule.PROGRAM, program(z, int8));
    check("z = -y ; typedef int8 int ; ", Rule.PROGRAM, program(z, int8));
    check("typedef None ", Rule.PROGRAM, program(new EmptyTypeDefinition("None")));
    check("typealias int8 int", Rule.PROGRAM, program(
          new TransparentTypeDefinition(typeVariable("int8"), INT)));
    check("", Rule.PROGRAM, program());
    check("  // nothing here", Rule.PROGRAM, program());
    reject("x + 3", Rule.PROGRAM);
    reject("x = 3 4", Rule.PROGRAM);
    reject("x = 3;; y = 4", Rule.PROGRAM);
  }

  @Test
  public void testComments() {
    Program none = program(new EmptyTypeDefinition("None"));
    check("typedef /* None */ Nada", Rule.PROGRAM,
          program(new EmptyTypeDefinition("Nada")));
    reject("typedef  None /* Nada", Rule.PROGRAM);
    check("typedef  None // Nada", Rule.PROGRAM, none);
    check("typedef  None ; // Nada", Rule.PROGRAM, none);
    check("typedef // Nada \n None ;", Rule.PROGRAM, none);
    check("typedef /* Nada \n Not */ None;", Rule.PROGRAM, none);
    reject("typedef /* Nada \n Not * / // ;", Rule.PROGRAM);
    check("typedef /* Nada \n Not */ None // ;", Rule.PROGRAM, none);
    reject("typedef /* Nada \n Not */ // None;", Rule.PROGRAM);
    check("typedef /* Nada \n Not /* */ None;", Rule.PROGRAM, none);
    check("typedef /* Nada \n Not // */ None;", Rule.PROGRAM, none);
    check("x = 3 /*/ 4 // */", Rule.PROGRAM, program(assign("x", i(3))));
    check("x = 3 /-/ 4 // */", Rule.PROGRAM, program(assign("x",
          new FunctionCall(var("/-/"), Arrays.asList(i(3), i(4))))));
  }

  @Test
  public void testFunctionValuedDefinitions() {
    check("x = () -> () { 3 }", Rule.PROGRAM, program(assign("x",
          new FunctionDefinition(Collections.<TypedAssignee>emptyList(),
              tuple(), new Block(Collections.<Assignment>emptyList(), i(3))))));
    reject("x = () -> () { typedef int8 int; 3 }", Rule.PROGRAM);
    reject("x = () -> () { typealias int8 int; 3 }", Rule.PROGRAM);
  }

  @Test
  public void testWalkerRejectsStructuralErrors() {
    // Accepted by the grammar, rejected while building the tree
    reject("typedef None<T>", Rule.PROGRAM);
    reject("x = __^__{8}", Rule.PROGRAM);
    reject("x = __add__ y", Rule.PROGRAM);
  }
}
