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

import static exm.fnp.tree.AtomicType.BOOL;
import static exm.fnp.tree.AtomicType.INT;
import static exm.fnp.tree.GenericType.typename;
import static exm.fnp.tree.GenericVariable.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.fnp.tree.Assignee;
import exm.fnp.tree.Assignment;
import exm.fnp.tree.Block;
import exm.fnp.tree.BooleanLiteral;
import exm.fnp.tree.ConstructorCall;
import exm.fnp.tree.ElementAccess;
import exm.fnp.tree.Expression;
import exm.fnp.tree.FunctionCall;
import exm.fnp.tree.FunctionDefinition;
import exm.fnp.tree.GenericConstructor;
import exm.fnp.tree.GenericType;
import exm.fnp.tree.GenericVariable;
import exm.fnp.tree.IfExpression;
import exm.fnp.tree.IntegerLiteral;
import exm.fnp.tree.MatchBlock;
import exm.fnp.tree.MatchExpression;
import exm.fnp.tree.MatchItem;
import exm.fnp.tree.ParametricAssignee;
import exm.fnp.tree.TupleExpression;
import exm.fnp.tree.TupleType;
import exm.fnp.tree.TypeInstance;
import exm.fnp.tree.TypedAssignee;

public class ExprWalkerTest {

  private static final TupleExpression UNIT_EXPR =
              new TupleExpression(Collections.<Expression>emptyList());
  private static final TupleType UNIT_TYPE =
              new TupleType(Collections.<TypeInstance>emptyList());

  private static void check(String code, Expression expected) {
    assertEquals("Parsing " + code, expected,
                 SourceParser.parseExpression(code).orElse(null));
  }

  private static void reject(String code) {
    assertFalse("Should not parse: " + code,
                SourceParser.parseExpression(code).isPresent());
  }

  private static IntegerLiteral i(long value) {
    return new IntegerLiteral(value);
  }

  private static FunctionCall call(Expression fn, Expression... args) {
    return new FunctionCall(fn, Arrays.asList(args));
  }

  private static FunctionCall op(String op, Expression lhs, Expression rhs) {
    return call(var(op), lhs, rhs);
  }

  private static TupleExpression tuple(Expression... exprs) {
    return new TupleExpression(Arrays.asList(exprs));
  }

  private static Block block(Expression e, Assignment... assignments) {
    return new Block(Arrays.asList(assignments), e);
  }

  private static Assignment assign(String id, Expression e) {
    return new Assignment(new ParametricAssignee(id), e);
  }

  private static List<TypeInstance> types(TypeInstance... types) {
    return Arrays.asList(types);
  }

  @Test
  public void testIntegers() {
    check("5", i(5));
    check("0", i(0));
    check("-8", i(-8));
    check("10", i(10));
    check("-9223372036854775808", i(Long.MIN_VALUE));
    reject("05");
    reject("-07");
    reject("00");
    reject("9223372036854775808");
  }

  @Test
  public void testBooleans() {
    check("true", BooleanLiteral.TRUE);
    check("false", BooleanLiteral.FALSE);
  }

  @Test
  public void testVariables() {
    check("x", var("x"));
    check("foo", var("foo"));
    check("r2d2", var("r2d2"));
    check("f'", var("f'"));
    check("g''", var("g''"));
    reject("f'f");
    check("__^__", var("^"));
    check("__^^^__", var("^^^"));
    reject("___^__");
  }

  @Test
  public void testGenericVariables() {
    check("map.<int>", new GenericVariable("map", types(INT)));
    check("map.<int,>", new GenericVariable("map", types(INT)));
    check("map.<T>", new GenericVariable("map", types(typename("T"))));
    check("map.<f.<int>>", new GenericVariable("map",
                types(new GenericType("f", types(INT)))));
    check("map.<f.<g.<T>>>", new GenericVariable("map",
                types(new GenericType("f",
                      types(new GenericType("g", types(typename("T"))))))));
    check("map.<int,bool>", new GenericVariable("map", types(INT, BOOL)));
    check("map.<(int,int)>", new GenericVariable("map",
                types(new TupleType(types(INT, INT)))));
  }

  @Test
  public void testTuples() {
    check("()", UNIT_EXPR);
    check("(3,)", tuple(i(3)));
    check("(8,5,)", tuple(i(8), i(5)));
    check("(8,5)", tuple(i(8), i(5)));
    check("(())", UNIT_EXPR);
    check("((),)", tuple(UNIT_EXPR));
  }

  @Test
  public void testInfixOperators() {
    check("3 + 4", op("+", i(3), i(4)));
    check("3 * 4", op("*", i(3), i(4)));
    check("3 &&$& 4", op("&&$&", i(3), i(4)));
    check("3 - 4", op("-", i(3), i(4)));
    check("3 < 4", op("<", i(3), i(4)));
    check("3 | 4", op("|", i(3), i(4)));
  }

  @Test
  public void testNamedInfix() {
    check("3 __add__ 4", op("add", i(3), i(4)));
    check("3 _____ 4", op("_", i(3), i(4)));
    check("3 __f'__ 4", op("f'", i(3), i(4)));
    check("3 __f''__ 4", op("f''", i(3), i(4)));
    check("3 ______ 4", op("__", i(3), i(4)));
    check("3 _______ 4", op("___", i(3), i(4)));
    check("3 ________ 4", op("____", i(3), i(4)));
    reject("3 ____ 4");
    reject("3 __^__ 4");
  }

  @Test
  public void testPrecedence() {
    check("3 + 4 * 5", op("+", i(3), op("*", i(4), i(5))));
    check("3 * 4 + 5", op("+", op("*", i(3), i(4)), i(5)));
    check("(3 + 4) * 5", op("*", op("+", i(3), i(4)), i(5)));
    check("2 * 3 + 4 * 5", op("+", op("*", i(2), i(3)), op("*", i(4), i(5))));
    check("2 * 3 + 4 + 5",
          op("+", op("+", op("*", i(2), i(3)), i(4)), i(5)));
    check("2 + 3 + 4 * 5",
          op("+", op("+", i(2), i(3)), op("*", i(4), i(5))));
    check("2 + 3 * 4 + 5",
          op("+", op("+", i(2), op("*", i(3), i(4))), i(5)));
    check("x.0.4+1", op("+", new ElementAccess(
                  new ElementAccess(var("x"), 0), 4), i(1)));
  }

  @Test
  public void testNamedAndUnknownOperatorsBindTightest() {
    check("3 __mul__ 4 + 5", op("+", op("mul", i(3), i(4)), i(5)));
    check("2 + 3 __mul__ 4 + 5",
          op("+", op("+", i(2), op("mul", i(3), i(4))), i(5)));
    check("2 + 3 <!> 4 + 5",
          op("+", op("+", i(2), op("<!>", i(3), i(4))), i(5)));
    check("2 __add__ 3 <!> 4 __add__ 5",
          op("<!>", op("add", i(2), i(3)), op("add", i(4), i(5))));
  }

  @Test
  public void testChains() {
    check("3 + 4 + 5", op("+", op("+", i(3), i(4)), i(5)));
    check("3 + 4 + 5 + 6",
          op("+", op("+", op("+", i(3), i(4)), i(5)), i(6)));
    check("3 __add__ 4 __add__ 5 __add__ 6",
          op("add", i(3), op("add", i(4), op("add", i(5), i(6)))));
    check("x __add__ f __add__ g",
          op("add", var("x"), op("add", var("f"), var("g"))));
    check("x |> f |> g", op("|>", op("|>", var("x"), var("f")), var("g")));
    check("3 :: 4 :: t", op("::", i(3), op("::", i(4), var("t"))));
    check("a ** b ** c", op("**", var("a"), op("**", var("b"), var("c"))));
  }

  @Test
  public void testDollarAndCompose() {
    check("g $ h(x)", op("$", var("g"), call(var("h"), var("x"))));
    check("g $ h $ i(x)",
          op("$", var("g"), op("$", var("h"), call(var("i"), var("x")))));
    check("(h @ g @ f)(x)",
          call(op("@", var("h"), op("@", var("g"), var("f"))), var("x")));
  }

  @Test
  public void testMixedSameRank() {
    check("a - b + c", op("+", op("-", var("a"), var("b")), var("c")));
    check("a + b - c", op("-", op("+", var("a"), var("b")), var("c")));
    check("a << b >> c", op(">>", op("<<", var("a"), var("b")), var("c")));
    check("a <!> b <&> c",
          op("<&>", op("<!>", var("a"), var("b")), var("c")));
    check("a <!> b <&> c <!> d",
          op("<!>", op("<&>", op("<!>", var("a"), var("b")), var("c")),
             var("d")));
  }

  @Test
  public void testNonAssociative() {
    check("3 == 4", op("==", i(3), i(4)));
    reject("3 == 4 == 5");
    reject("x == y == z");
    reject("a < b < c");
    check("a < b == c", op("<", var("a"), op("==", var("b"), var("c"))));
    check("a != b <= c", op("!=", var("a"), op("<=", var("b"), var("c"))));
    check("(3 == 4) == (5 == 6)",
          op("==", op("==", i(3), i(4)), op("==", i(5), i(6))));
    check("a + b == c * d",
          op("==", op("+", var("a"), var("b")), op("*", var("c"), var("d"))));
    check("a == b && c == d", op("&&", op("==", var("a"), var("b")),
                                        op("==", var("c"), var("d"))));
  }

  @Test
  public void testDotOperators() {
    check("f . g", op(".", var("f"), var("g")));
    check("(f . g)(x)", call(op(".", var("f"), var("g")), var("x")));
    check("a ... b", op("...", var("a"), var("b")));
    check("a .. b", op("..", var("a"), var("b")));
    reject("a .>. b");
    reject("x.b");
    reject("x.0.(4)");
    reject("x.0.(4+1)");
  }

  @Test
  public void testCalls() {
    check("foo()", call(var("foo")));
    check("foo(4,)", call(var("foo"), i(4)));
    check("foo(4)", call(var("foo"), i(4)));
    check("foo(4,5)", call(var("foo"), i(4), i(5)));
    check("foo(4,5,)", call(var("foo"), i(4), i(5)));
    check("(foo)(4)", call(var("foo"), i(4)));
    check("__^__(4)", call(var("^"), i(4)));
    check("foo(4)(-5,0)", call(call(var("foo"), i(4)), i(-5), i(0)));
    check("f(1)(2)", call(call(var("f"), i(1)), i(2)));
    check("f(a)()(b)", call(call(call(var("f"), var("a"))), var("b")));
    check("f()(a, b)", call(call(var("f")), var("a"), var("b")));
    check("f(1).0(2)",
          call(new ElementAccess(call(var("f"), i(1)), 0), i(2)));
    check("foo(4)(a)(-5,bar(true))",
          call(call(call(var("foo"), i(4)), var("a")),
               i(-5), call(var("bar"), BooleanLiteral.TRUE)));
    reject("foo(,)");
  }

  @Test
  public void testElementAccess() {
    check("x.0", new ElementAccess(var("x"), 0));
    check("(a, b).1", new ElementAccess(tuple(var("a"), var("b")), 1));
    check("f(x).2", new ElementAccess(call(var("f"), var("x")), 2));
    reject("x.-1");
  }

  @Test
  public void testPrefixOperators() {
    check("++x", call(var("++"), var("x")));
    check("-x", call(var("-"), var("x")));
    check("-(9)", call(var("-"), i(9)));
    check("-9 + 1", op("+", i(-9), i(1)));
    check("- x + 1", call(var("-"), op("+", var("x"), i(1))));
    check("if (c) { -9 } else { - 9 }",
          new IfExpression(var("c"), block(i(-9)), block(i(-9))));
    check("++ (++x)", call(var("++"), call(var("++"), var("x"))));
    check("++ ++x", call(var("++"), call(var("++"), var("x"))));
    check("++++x", call(var("++++"), var("x")));
    reject("__add__ x");
  }

  @Test
  public void testConstructorCalls() {
    GenericConstructor integer = GenericConstructor.constructor("Integer");
    check("Integer{8}", new ConstructorCall(integer, Arrays.asList(i(8))));
    check("Integer{8,}", new ConstructorCall(integer, Arrays.asList(i(8))));
    check("Integer{8,9}",
          new ConstructorCall(integer, Arrays.asList(i(8), i(9))));
    check("Integer{8,9,}",
          new ConstructorCall(integer, Arrays.asList(i(8), i(9))));
    check("Cons.<U>{(f(h),map.<T,U>(f, t))}",
          new ConstructorCall(
              new GenericConstructor("Cons", types(typename("U"))),
              Arrays.asList(tuple(
                  call(var("f"), var("h")),
                  call(new GenericVariable("map",
                            types(typename("T"), typename("U"))),
                       var("f"), var("t"))))));
    reject("__^__{8}");
  }

  @Test
  public void testIf() {
    check("if (g) { 1 } else { 2 }",
          new IfExpression(var("g"), block(i(1)), block(i(2))));
    check("if (x > 0) { x = 0; true } else { x = 1; false }",
          new IfExpression(op(">", var("x"), i(0)),
              block(BooleanLiteral.TRUE, assign("x", i(0))),
              block(BooleanLiteral.FALSE, assign("x", i(1)))));
    reject("if (g) { 1 }");
  }

  @Test
  public void testMatch() {
    MatchExpression expected = new MatchExpression(call(var("maybe")),
        Arrays.asList(
            new MatchBlock(Arrays.asList(new MatchItem("Some", new Assignee("x"))),
                           block(var("t"))),
            new MatchBlock(Arrays.asList(new MatchItem("None", null)),
                           block(var("y")))));
    check("match (maybe()) { Some x: { t }, None : { y },}", expected);
    check("match (maybe()) { Some x: { t }, None : { y }}", expected);
    check("match(()) { Some x | None: { () }, }",
          new MatchExpression(UNIT_EXPR, Arrays.asList(
              new MatchBlock(Arrays.asList(
                                new MatchItem("Some", new Assignee("x")),
                                new MatchItem("None", null)),
                             block(UNIT_EXPR)))));
    reject("match (x) { }");
  }

  @Test
  public void testFunctionDefinitions() {
    Block body = block(i(9), assign("a", i(3)));
    check("() -> () { () }", new FunctionDefinition(
          Collections.<TypedAssignee>emptyList(), UNIT_TYPE, block(UNIT_EXPR)));
    FunctionDefinition oneArg = new FunctionDefinition(
          Arrays.asList(new TypedAssignee(new Assignee("x"), INT)), INT, body);
    check("(x: int) -> int { a = 3; 9 }", oneArg);
    check("(x: int,) -> int { a = 3; 9 }", oneArg);
    FunctionDefinition twoArgs = new FunctionDefinition(
          Arrays.asList(new TypedAssignee(new Assignee("x"), INT),
                        new TypedAssignee(new Assignee("y"), UNIT_TYPE)),
          INT, body);
    check("(x: int, y: ()) -> int { a = 3; 9 }", twoArgs);
    check("(x: int, y: (),) -> int { a = 3; 9 }", twoArgs);
  }

  @Test
  public void testInvalidFunctionDefinitions() {
    reject("(x: int, y: (),) { a = 3; 9 }");
    reject("(x: int,,) -> bool { a = 3; 9 }");
    reject("(,) -> bool { a = 3; 9 }");
    reject("(x, y: bool) -> bool { a = 3; 9 }");
    reject("(x: int, y: bool) -> bool { a = 3;; 9 }");
    reject("(x: int, y: bool) -> bool { a = 3 }");
  }

  @Test
  public void testTrailingInput() {
    reject("3 4");
    reject("x +");
    reject("");
  }
}
