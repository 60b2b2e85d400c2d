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
 * Steps that inline or merge functions
 */
public class FunctionStepsTest {

  @Test
  public void testExpressionInliner() {
    Block result = runSteps(
        "{ function f(a) -> r { r := add(a, 1) } " +
        "sstore(0, f(calldataload(0))) sstore(1, f(2)) }",
        new ExpressionInliner());
    assertEquals(normalize(
        "{ function f(a) -> r { r := add(a, 1) } " +
        "sstore(0, f(calldataload(0))) sstore(1, add(2, 1)) }"),
        result.toString());
  }

  @Test
  public void testExpressionInlinerNeedsMovableBody() {
    String src = "{ function f(a) -> r { r := sload(a) } sstore(1, f(2)) }";
    Block result = runSteps(src, new ExpressionInliner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testFullInliner() {
    Block result = runSteps(
        "{ function f(a) -> r { r := add(a, 1) } let x := f(2) " +
        "sstore(0, x) }", new FullInliner());
    assertEquals(normalize(
        "{ function f(a) -> r { r := add(a, 1) } " +
        "let a_1 := 2 let r_2 := 0 { r_2 := add(a_1, 1) } let x := r_2 " +
        "sstore(0, x) }"), result.toString());
  }

  @Test
  public void testFullInlinerSkipsRecursion() {
    String src = "{ function f(a) { if a { f(sub(a, 1)) } } f(3) }";
    Block result = runSteps(src, new FullInliner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testFullInlinerSkipsLeave() {
    String src = "{ function f(a) { if a { leave } sstore(0, a) } f(3) }";
    Block result = runSteps(src, new FullInliner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testEquivalentFunctionCombiner() {
    Block result = runSteps(
        "{ function f(a) -> r { r := add(a, 1) } " +
        "function g(b) -> s { s := add(b, 1) } sstore(f(1), g(2)) }",
        new EquivalentFunctionCombiner());
    assertEquals(normalize(
        "{ function f(a) -> r { r := add(a, 1) } " +
        "function g(b) -> s { s := add(b, 1) } sstore(f(1), f(2)) }"),
        result.toString());
  }

  @Test
  public void testDifferentFunctionsNotCombined() {
    String src = "{ function f(a) -> r { r := add(a, 1) } " +
                 "function g(b) -> s { s := add(b, 2) } sstore(f(1), g(2)) }";
    Block result = runSteps(src, new EquivalentFunctionCombiner());
    assertEquals(normalize(src), result.toString());
  }
}
