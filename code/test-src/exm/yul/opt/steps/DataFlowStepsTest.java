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
package exm.yul.opt.steps;

import static exm.yul.opt.OptTestUtil.normalize;
import static exm.yul.opt.OptTestUtil.runSteps;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.yul.tree.Block;

/**
 * Steps that move values between variables and expressions
 */
public class DataFlowStepsTest {

  @Test
  public void testVarDeclInitializer() {
    Block result = runSteps("{ let a, b let c := 1 }",
                            new VarDeclInitializer());
    assertEquals(normalize("{ let a := 0 let b := 0 let c := 1 }"),
                 result.toString());
  }

  @Test
  public void testSplitter() {
    Block result = runSteps(
        "{ let x := calldataload(0) mstore(add(x, 1), 2) }",
        new ExpressionSplitter());
    assertEquals(normalize(
        "{ let x := calldataload(0) let expr := add(x, 1) mstore(expr, 2) }"),
        result.toString());
  }

  @Test
  public void testSplitterNested() {
    Block result = runSteps(
        "{ let x := calldataload(0) sstore(0, add(mul(x, 2), 1)) }",
        new ExpressionSplitter());
    assertEquals(normalize(
        "{ let x := calldataload(0) let expr := mul(x, 2) " +
        "let expr_1 := add(expr, 1) sstore(0, expr_1) }"),
        result.toString());
  }

  @Test
  public void testJoiner() {
    Block result = runSteps(
        "{ let x := add(calldataload(0), 2) sstore(0, x) }",
        new ExpressionJoiner());
    assertEquals(normalize("{ sstore(0, add(calldataload(0), 2)) }"),
                 result.toString());
  }

  @Test
  public void testJoinerKeepsEvaluationOrder() {
    // mload runs before x would be evaluated
    String src = "{ let x := calldataload(0) sstore(x, mload(0)) }";
    Block result = runSteps(src, new ExpressionJoiner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testJoinerSkipsAssignedVariables() {
    String src = "{ let x := calldataload(0) sstore(0, x) x := 1 }";
    Block result = runSteps(src, new ExpressionJoiner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testCommonSubexpressions() {
    Block result = runSteps(
        "{ let a := calldataload(0) let x := add(a, 1) let y := add(a, 1) " +
        "sstore(y, x) }", new CommonSubexpressionEliminator());
    assertEquals(normalize(
        "{ let a := calldataload(0) let x := add(a, 1) let y := x " +
        "sstore(x, x) }"), result.toString());
  }

  @Test
  public void testLoadResolver() {
    Block result = runSteps("{ sstore(0, 5) sstore(1, sload(0)) }",
                            new LoadResolver());
    assertEquals(normalize("{ sstore(0, 5) sstore(1, 5) }"),
                 result.toString());
  }

  @Test
  public void testLoadResolverInvalidatedByCall() {
    String src = "{ sstore(0, 5) pop(call(0, 0, 0, 0, 0, 0, 0)) " +
                 "sstore(1, sload(0)) }";
    Block result = runSteps(src, new LoadResolver());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testSSATransform() {
    Block result = runSteps(
        "{ let a := calldataload(0) a := add(a, 1) sstore(0, a) }",
        new SSATransform());
    assertEquals(normalize(
        "{ let a_1 := calldataload(0) let a := a_1 " +
        "let a_2 := add(a_1, 1) a := a_2 sstore(0, a_2) }"),
        result.toString());
  }

  @Test
  public void testSSAReverser() {
    Block result = runSteps(
        "{ let a := calldataload(0) let a_1 := add(a, 1) a := a_1 " +
        "sstore(0, a) }", new SSAReverser());
    assertEquals(normalize(
        "{ let a := calldataload(0) a := add(a, 1) let a_1 := a " +
        "sstore(0, a) }"), result.toString());
  }

  @Test
  public void testRedundantAssignEliminator() {
    Block result = runSteps(
        "{ let x := calldataload(0) x := 1 x := 2 sstore(0, x) x := 3 }",
        new RedundantAssignEliminator());
    assertEquals(normalize(
        "{ let x := calldataload(0) x := 2 sstore(0, x) }"),
        result.toString());
  }

  @Test
  public void testConditionalSimplifier() {
    String src = "{ let x := calldataload(0) " +
                 "switch x case 1 { sstore(0, x) } default { } " +
                 "if x { revert(0, 0) } sstore(1, x) }";
    Block result = runSteps(src, new ConditionalSimplifier());
    assertEquals(normalize(
        "{ let x := calldataload(0) " +
        "switch x case 1 { x := 1 sstore(0, x) } default { } " +
        "if x { revert(0, 0) } x := 0 sstore(1, x) }"), result.toString());

    Block back = runSteps(src, new ConditionalSimplifier(),
                          new ConditionalUnsimplifier());
    assertEquals(normalize(src), back.toString());
  }

  @Test
  public void testLoopInvariantCodeMotion() {
    Block result = runSteps(
        "{ let y := calldataload(0) " +
        "for { let i := 0 } lt(i, 10) { i := add(i, 1) } " +
        "{ let z := add(y, 1) let w := add(i, 1) sstore(w, z) } }",
        new LoopInvariantCodeMotion());
    assertEquals(normalize(
        "{ let y := calldataload(0) " +
        "for { let i := 0 let z := add(y, 1) } lt(i, 10) { i := add(i, 1) } " +
        "{ let w := add(i, 1) sstore(w, z) } }"), result.toString());
  }
}
