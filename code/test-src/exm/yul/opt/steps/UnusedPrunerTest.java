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

import exm.yul.backends.evm.EvmDialect;
import exm.yul.tree.Block;

public class UnusedPrunerTest {

  @Test
  public void testUnusedVariablesAndFunctions() {
    Block result = runSteps(
        "{ let x := 1 let y := add(x, 2) function f() { } sstore(0, 1) }",
        new UnusedPruner());
    assertEquals(normalize("{ sstore(0, 1) }"), result.toString());
  }

  @Test
  public void testSideEffectsDiscarded() {
    Block result = runSteps(
        "{ function g() -> r { sstore(0, 1) } let y := g() }",
        new UnusedPruner());
    assertEquals("Value is only discarded",
        normalize("{ function g() -> r { sstore(0, 1) } pop(g()) }"),
        result.toString());
  }

  @Test
  public void testSideEffectFreeStatementRemoved() {
    Block result = runSteps("{ pop(mload(0)) sstore(0, 1) }",
                            new UnusedPruner());
    assertEquals(normalize("{ sstore(0, 1) }"), result.toString());
  }

  @Test
  public void testAssignedVariableKept() {
    String src = "{ let x := 1 x := calldataload(0) }";
    Block result = runSteps(src, new UnusedPruner());
    assertEquals("Declaration is needed by the assignment",
                 normalize(src), result.toString());
  }

  @Test
  public void testReservedNamesKept() {
    String src = "{ let keep := 1 function exported() { } }";
    Block result = runSteps(EvmDialect.instance(), src,
        new String[] {"keep", "exported"}, new UnusedPruner());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testRepeatsUntilNothingUnused() {
    Block result = runSteps(
        "{ function f() { } function g() { f() } let a := 1 let b := a " +
        "let c := b }", new UnusedPruner());
    assertEquals(normalize("{ }"), result.toString());
  }
}
