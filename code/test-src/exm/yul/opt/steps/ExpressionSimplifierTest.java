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

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.yul.tree.Block;

public class ExpressionSimplifierTest {

  @Test
  public void testConstantFolding() {
    Block result = runSteps("{ sstore(0, add(2, mul(3, 4))) }",
                            new ExpressionSimplifier());
    assertEquals(normalize("{ sstore(0, 14) }"), result.toString());
  }

  @Test
  public void testKnownVariable() {
    Block result = runSteps("{ let x := 5 sstore(0, sub(x, 2)) }",
                            new ExpressionSimplifier());
    assertEquals(normalize("{ let x := 5 sstore(0, 3) }"),
                 result.toString());
  }

  @Test
  public void testWrapAround() {
    Block result = runSteps("{ sstore(0, sub(0, 1)) }",
                            new ExpressionSimplifier());
    // Large values are printed in hex
    String max = "0x" + StringUtils.repeat('f', 64);
    assertEquals(normalize("{ sstore(0, " + max + ") }"), result.toString());
  }

  @Test
  public void testIdentities() {
    Block result = runSteps(
        "{ let x := calldataload(0) " +
        "sstore(0, add(x, 0)) sstore(1, mul(1, x)) sstore(2, sub(x, x)) " +
        "sstore(3, eq(x, x)) sstore(4, and(x, x)) }",
        new ExpressionSimplifier());
    assertEquals(normalize(
        "{ let x := calldataload(0) " +
        "sstore(0, x) sstore(1, x) sstore(2, 0) sstore(3, 1) sstore(4, x) }"),
        result.toString());
  }

  @Test
  public void testSideEffectsNotDropped() {
    String src = "{ sstore(0, mul(call(0, 0, 0, 0, 0, 0, 0), 0)) }";
    Block result = runSteps(src, new ExpressionSimplifier());
    assertEquals(normalize(src), result.toString());
  }

  @Test
  public void testTripleNegation() {
    Block result = runSteps(
        "{ let x := calldataload(0) sstore(0, iszero(iszero(iszero(x)))) }",
        new ExpressionSimplifier());
    assertEquals(normalize(
        "{ let x := calldataload(0) sstore(0, iszero(x)) }"),
        result.toString());
  }
}
