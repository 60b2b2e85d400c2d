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
package exm.yul.backends.evm;

import static org.junit.Assert.assertEquals;

import java.math.BigInteger;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.yul.opt.OptTestUtil;
import exm.yul.tree.Block;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Identifier;
import exm.yul.tree.Literal;

public class ConstantOptimiserTest {
  private static final String MAX_WORD = "0x" + StringUtils.repeat('f', 64);

  @Test
  public void testGasMeter() {
    EvmGasMeter runtime = new EvmGasMeter(200, false);
    // PUSH1 1: 3 gas per run, 2 bytes
    assertEquals(BigInteger.valueOf(200 * 3 + 2 * 200),
                 runtime.costs(Literal.number(1)));
    EvmGasMeter creation = new EvmGasMeter(200, true);
    assertEquals(BigInteger.valueOf(200 * 3 + 2 * 16),
                 creation.costs(Literal.number(1)));

    assertEquals(3, runtime.runtimeGas(new Identifier("x")));
    assertEquals(20006, runtime.runtimeGas(new FunctionCall("sstore",
                            Literal.zero(), Literal.zero())));
    assertEquals(33, runtime.runtimeGas(new FunctionCall("f",
                            Literal.zero())));
    assertEquals(6, runtime.codeBytes(new FunctionCall("f",
                            Literal.zero())));
    assertEquals(33, runtime.codeBytes(new Literal(Literal.LiteralKind.STRING,
                                                   "abc")));
  }

  @Test
  public void testNegatedConstant() {
    Block code = OptTestUtil.parse("{ sstore(0, " + MAX_WORD + ") }");
    int replaced = new ConstantOptimiser(EvmDialect.instance(),
                              new EvmGasMeter(200, false)).run(code);
    assertEquals(1, replaced);
    assertEquals(OptTestUtil.normalize("{ sstore(0, not(0)) }"),
                 code.toString());
  }

  @Test
  public void testShiftedConstant() {
    String value = Literal.number(BigInteger.ONE.shiftLeft(200)).getValue();
    Block code = OptTestUtil.parse("{ sstore(0, " + value + ") }");
    new ConstantOptimiser(EvmDialect.instance(),
                          new EvmGasMeter(200, false)).run(code);
    assertEquals(OptTestUtil.normalize("{ sstore(0, shl(200, 1)) }"),
                 code.toString());
  }

  @Test
  public void testOversizedLiteralLeftForAnalysis() {
    String src = "{ sstore(0, 0x1" + StringUtils.repeat('0', 64) + ") }";
    Block code = OptTestUtil.parse(src);
    int replaced = new ConstantOptimiser(EvmDialect.instance(),
                              new EvmGasMeter(200, false)).run(code);
    assertEquals(0, replaced);
    assertEquals(OptTestUtil.normalize(src), code.toString());
  }

  @Test
  public void testSmallConstantsKept() {
    String src = "{ sstore(0, 0xffff) sstore(1, \"abc\") }";
    Block code = OptTestUtil.parse(src);
    int replaced = new ConstantOptimiser(EvmDialect.instance(),
                              new EvmGasMeter(200, false)).run(code);
    assertEquals(0, replaced);
    assertEquals(OptTestUtil.normalize(src), code.toString());
  }
}
