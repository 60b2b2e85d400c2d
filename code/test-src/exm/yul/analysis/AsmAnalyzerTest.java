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
package exm.yul.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.yul.backends.evm.EvmDialect;
import exm.yul.backends.wasm.WasmDialect;
import exm.yul.common.exceptions.InvalidCodeException;
import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.opt.OptTestUtil;
import exm.yul.tree.Block;
import exm.yul.tree.YulObject;

public class AsmAnalyzerTest {

  @Test
  public void testValidProgram() throws Exception {
    Block code = OptTestUtil.parse(
        "{ let x := f(1) " +
        "  function f(a) -> r { r := add(a, 1) if r { leave } } " +
        "  for { let i := 0 } lt(i, x) { i := add(i, 1) } " +
        "  { if eq(i, 3) { break } continue } " +
        "  switch x case 0 { } case \"a\" { } default { sstore(0, x) } }");
    AnalysisInfo info = AsmAnalyzer.analyzeStrict(EvmDialect.instance(),
                                                  code, "test");
    assertEquals(1, info.getFunctions().size());
    assertEquals(1, info.getFunctions().get("f").parameters);
    assertEquals(1, info.getFunctions().get("f").returns);
    assertTrue(info.getVariables().contains("x"));
    assertTrue(info.getVariables().contains("i"));
  }

  @Test
  public void testErrors() {
    checkInvalid("{ sstore(0, y) }", "Identifier not found: y");
    checkInvalid("{ y := 1 }", "Assignment to undeclared variable y");
    checkInvalid("{ let x := 1 x, x := f() function f() -> a, b { } }",
                 "occurs multiple times");
    checkInvalid("{ sstore(0) }", "expects 2 argument(s)");
    checkInvalid("{ let x := 1 { let x := 2 } }", "already taken");
    checkInvalid("{ let add := 1 }", "builtin function name");
    checkInvalid("{ break }", "break outside of for loop body");
    checkInvalid("{ leave }", "leave outside of function");
    checkInvalid("{ switch 1 case 1 { } case 0x01 { } }", "Duplicate case");
    checkInvalid("{ for { function f() { } } 1 { } { } }",
                 "for loop initialisers");
    checkInvalid("{ calldataload(0) }", "must not return any");
    checkInvalid("{ let x := sstore(0, 0) }", "Expected 1 value(s)");
    checkInvalid("{ g() }", "Function not found: g");
    checkInvalid("{ let x := 1 x() }", "Attempt to call variable x");
    checkInvalid("{ function f() { } let x := f }", "used without call");
  }

  @Test
  public void testFunctionCantSeeOuterVariables() {
    checkInvalid("{ let x := 1 function f() -> r { r := x } }",
                 "Identifier not found: x");
  }

  @Test
  public void testMessagesIgnoreLocale() {
    Locale saved = Locale.getDefault();
    // Lower-cases I to a dotless i
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      checkInvalid("{ continue }", "continue outside of for loop body");
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  public void testBreakInPostIsInvalid() {
    checkInvalid("{ for { } 1 { break } { } }", "outside of for loop");
  }

  @Test
  public void testLiteralsMustFitInWord() throws Exception {
    String maxWord = "0x" + StringUtils.repeat('f', 64);
    String overWord = "0x1" + StringUtils.repeat('0', 64);
    checkInvalid("{ sstore(0, " + overWord + ") }",
                 "Number literal too large (> 256 bits)");
    checkInvalid("{ switch calldataload(0) case " + overWord + " { } }",
                 "Number literal too large");
    checkInvalid("{ sstore(0, \"" + StringUtils.repeat('a', 33) + "\") }",
                 "String literal too long (33 > 32 bytes)");

    AsmAnalyzer.analyzeStrict(EvmDialect.instance(), OptTestUtil.parse(
        "{ sstore(" + maxWord + ", \"" + StringUtils.repeat('a', 32) +
        "\") }"), "test");
  }

  @Test
  public void testLiteralWidthFollowsDialect() throws Exception {
    Block code = OptTestUtil.parse("{ let x := 0x10000000000000000 }");
    try {
      AsmAnalyzer.analyzeStrict(WasmDialect.instance(), code, "test");
      fail("65 bit literal accepted by 64 bit dialect");
    } catch (InvalidCodeException ex) {
      assertTrue(ex.getMessage(),
                 ex.getMessage().contains("(> 64 bits)"));
    }
    AsmAnalyzer.analyzeStrict(EvmDialect.instance(), code, "test");
  }

  @Test(expected=YulRuntimeError.class)
  public void testAssertCorrect() {
    Block code = OptTestUtil.parse("{ sstore(0, y) }");
    AsmAnalyzer.analyzeStrictAssertCorrect(EvmDialect.instance(),
                                      new YulObject("test", code, null));
  }

  private static void checkInvalid(String src, String expectedError) {
    Block code = OptTestUtil.parse(src);
    try {
      AsmAnalyzer.analyzeStrict(EvmDialect.instance(), code, "test");
      fail("Expected error " + expectedError + " for " + src);
    } catch (InvalidCodeException ex) {
      assertTrue("Expected " + expectedError + " in " + ex.getErrors(),
                 ex.getMessage().contains(expectedError));
    }
  }
}
