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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.yul.tree.Block;

/**
 * Steps that rearrange blocks, functions and control flow
 */
public class StructuralStepsTest {

  @Test
  public void testHoistAndGroup() {
    String src =
        "{ sstore(0, 1) { function f() { } } function g() { } sstore(1, 1) }";
    Block hoisted = runSteps(src, new FunctionHoister());
    assertEquals(normalize(
        "{ sstore(0, 1) { } sstore(1, 1) function g() { } function f() { } }"),
        hoisted.toString());
    assertFalse(FunctionGrouper.isGrouped(hoisted));

    Block grouped = runSteps(src, new FunctionHoister(),
                             new FunctionGrouper());
    assertEquals(normalize(
        "{ { sstore(0, 1) { } sstore(1, 1) } function g() { } function f() { } }"),
        grouped.toString());
    assertTrue(FunctionGrouper.isGrouped(grouped));
  }

  @Test
  public void testGroupingIdempotent() {
    String src = "{ { sstore(0, 1) } function f() { } }";
    Block result = runSteps(src, new FunctionGrouper());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testBlockFlattener() {
    Block result = runSteps(
        "{ sstore(0, 1) { sstore(1, 1) { sstore(2, 1) } } " +
        "for { } 1 { } { { break } } }", new BlockFlattener());
    assertEquals(normalize(
        "{ sstore(0, 1) sstore(1, 1) sstore(2, 1) for { } 1 { } { break } }"),
        result.toString());
  }

  @Test
  public void testForLoopInitRewriter() {
    Block result = runSteps(
        "{ for { let i := 0 } lt(i, 3) { i := add(i, 1) } { sstore(i, 1) } }",
        new ForLoopInitRewriter());
    assertEquals(normalize(
        "{ { let i := 0 for { } lt(i, 3) { i := add(i, 1) } { sstore(i, 1) } } }"),
        result.toString());
  }

  @Test
  public void testForLoopCondition() {
    String src = "{ for { } lt(calldataload(0), 3) { } { sstore(0, 1) } }";
    Block into = runSteps(src, new ForLoopConditionIntoBody());
    assertEquals(normalize(
        "{ for { } 1 { } { if iszero(lt(calldataload(0), 3)) { break } " +
        "sstore(0, 1) } }"), into.toString());

    Block back = runSteps(src, new ForLoopConditionIntoBody(),
                          new ForLoopConditionOutOfBody());
    assertEquals(normalize(src), back.toString());
  }

  @Test
  public void testForLoopConditionOutOfBodyNegates() {
    Block result = runSteps(
        "{ for { } 1 { } { if calldataload(0) { break } sstore(0, 1) } }",
        new ForLoopConditionOutOfBody());
    assertEquals(normalize(
        "{ for { } iszero(calldataload(0)) { } { sstore(0, 1) } }"),
        result.toString());
  }

  @Test
  public void testControlFlowSimplifier() {
    Block result = runSteps(
        "{ if calldataload(0) { } " +
        "switch calldataload(1) default { sstore(0, 1) } " +
        "switch calldataload(2) case 3 { sstore(1, 1) } }",
        new ControlFlowSimplifier());
    assertEquals(normalize(
        "{ { sstore(0, 1) } if eq(3, calldataload(2)) { sstore(1, 1) } }"),
        result.toString());
  }

  @Test
  public void testEmptyIfKeepsSideEffects() {
    Block result = runSteps(
        "{ function g() -> r { sstore(0, 1) } if g() { } }",
        new ControlFlowSimplifier());
    assertEquals(normalize("{ function g() -> r { sstore(0, 1) } pop(g()) }"),
                 result.toString());
  }

  @Test
  public void testStructuralSimplifier() {
    Block result = runSteps(
        "{ if 0 { sstore(0, 1) } if 1 { sstore(1, 1) } " +
        "switch 2 case 1 { sstore(2, 1) } case 2 { sstore(2, 2) } " +
        "default { sstore(2, 3) } " +
        "switch 5 case 1 { sstore(3, 1) } " +
        "for { let i := 0 } 0 { } { sstore(4, 1) } }",
        new StructuralSimplifier());
    assertEquals(normalize(
        "{ { sstore(1, 1) } { sstore(2, 2) } { let i := 0 } }"),
        result.toString());
  }

  @Test
  public void testDeadCodeEliminator() {
    Block result = runSteps(
        "{ function f() { leave sstore(0, 1) } " +
        "for { } 1 { } { break sstore(0, 3) } " +
        "revert(0, 0) sstore(0, 2) function g() { } }",
        new DeadCodeEliminator());
    assertEquals(normalize(
        "{ function f() { leave } for { } 1 { } { break } " +
        "revert(0, 0) function g() { } }"),
        result.toString());
  }

  @Test
  public void testCircularReferencesPruner() {
    Block result = runSteps(
        "{ function f() { g() } function g() { f() } function h() { } h() }",
        new CircularReferencesPruner());
    assertEquals(normalize("{ function h() { } h() }"), result.toString());
  }
}
