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
package exm.yul.opt;

import static exm.yul.opt.OptTestUtil.parse;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import exm.yul.backends.evm.EvmDialect;
import exm.yul.dialect.Dialect;
import exm.yul.tree.Block;
import exm.yul.tree.YulObject;

public class StackCompressorTest {
  private final Dialect dialect = EvmDialect.instance();

  @Before
  public void resetStatistics() {
    OptimiserStatistics.reset();
  }

  /**
   * Main code declaring n literal variables and storing each of them
   */
  private static String manyVariables(int n) {
    StringBuilder sb = new StringBuilder("{ ");
    for (int i = 0; i < n; i++) {
      sb.append("let v" + i + " := " + i + " ");
    }
    for (int i = 0; i < n; i++) {
      sb.append("sstore(v" + i + ", v" + i + ") ");
    }
    sb.append("}");
    return sb.toString();
  }

  /**
   * Function with too many parameters to ever fit
   */
  private static String manyParameters(int n) {
    StringBuilder params = new StringBuilder();
    StringBuilder args = new StringBuilder();
    for (int i = 0; i < n; i++) {
      if (i > 0) {
        params.append(", ");
        args.append(", ");
      }
      params.append("p" + i);
      args.append("0");
    }
    return "{ function f(" + params + ") { sstore(p0, p" + (n - 1) + ") } " +
           "f(" + args + ") }";
  }

  @Test
  public void testStackExcess() {
    Block ast = parse(manyVariables(20));
    Map<String, Integer> excess = StackCompressor.stackExcess(dialect, ast,
                                                              true);
    assertEquals(1, excess.size());
    assertEquals(Integer.valueOf(4), excess.get(CallGraph.MAIN));

    excess = StackCompressor.stackExcess(dialect, parse(manyParameters(17)),
                                         true);
    assertEquals(Integer.valueOf(1), excess.get("f"));
    assertTrue(StackCompressor.stackExcess(dialect,
                parse(manyParameters(17)), false).isEmpty());
  }

  @Test
  public void testCompressesMainCode() {
    Block code = parse(manyVariables(20));
    YulObject object = new YulObject("test", code, null);
    assertTrue(StackCompressor.run(dialect, object, true, 16));
    assertFalse(code.toString(), code.toString().contains("let"));
    assertTrue(code.toString().contains("sstore(19, 19)"));
    assertEquals(0, OptimiserStatistics.getCount(
                        OptimiserStatistics.STACK_COMPRESSOR_FAILED));
    assertTrue(OptimiserStatistics.getCount(
                 OptimiserStatistics.STACK_COMPRESSOR_ITERATIONS) > 0);
  }

  @Test
  public void testFittingCodeUntouched() {
    String src = "{ let x := 1 sstore(x, x) }";
    Block code = parse(src);
    assertTrue(StackCompressor.run(dialect, new YulObject("test", code, null),
                                   true, 16));
    assertEquals(parse(src).toString(), code.toString());
  }

  @Test
  public void testGivesUp() {
    Block code = parse(manyParameters(17));
    String before = code.toString();
    assertFalse(StackCompressor.run(dialect,
                    new YulObject("test", code, null), true, 16));
    assertEquals(before, code.toString());
    assertEquals(1, OptimiserStatistics.getCount(
                        OptimiserStatistics.STACK_COMPRESSOR_FAILED));
  }

  @Test
  public void testFunctionsIgnoredWithoutStackOptimisation() {
    Block code = parse(manyParameters(17));
    assertTrue(StackCompressor.run(dialect,
                    new YulObject("test", code, null), false, 16));
  }
}
