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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import exm.yul.analysis.AsmAnalyzer;
import exm.yul.backends.evm.EvmDialect;
import exm.yul.backends.evm.EvmGasMeter;
import exm.yul.backends.wasm.WasmDialect;
import exm.yul.common.Logging;
import exm.yul.common.Settings;
import exm.yul.common.exceptions.InvalidSequenceException;
import exm.yul.common.exceptions.MissingGasMeterException;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.PlainDialect;
import exm.yul.opt.OptimiserSuite.Debug;
import exm.yul.parser.Parser;
import exm.yul.tree.Block;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.YulObject;

public class OptimiserSuiteTest {
  private static final Logger logger = Logging.getYoptLogger();
  private static final Set<String> NO_RESERVED = Collections.emptySet();

  @Before
  public void resetStatistics() {
    OptimiserStatistics.reset();
  }

  @After
  public void resetSettings() {
    Settings.unset(Settings.OPT_DEFAULT_SEQUENCE);
  }

  @Test
  public void testEmptySequenceIsNoOp() throws Exception {
    Block ast = parse("{ let x := 1 function f(a) -> r { r := a } }");
    String before = ast.toString();
    suite(ast, NO_RESERVED).runSequence("", ast);
    assertEquals(before, ast.toString());
  }

  @Test
  public void testMalformedSequenceLeavesCodeUnchanged() throws Exception {
    Block ast = parse("{ let x := 1 }");
    String before = ast.toString();
    for (String bad: Arrays.asList("u(", "u)", "u((", "u()(", "u?")) {
      try {
        suite(ast, NO_RESERVED).runSequence(bad, ast);
        fail("Expected error for " + bad);
      } catch (InvalidSequenceException ex) {
        // Expected
      }
      assertEquals("Steps before the error must not run: " + bad,
                   before, ast.toString());
    }
  }

  @Test
  public void testRunSequenceAppliesSteps() throws Exception {
    Block ast = parse("{ let x := 7 sstore(0, x) }");
    suite(ast, NO_RESERVED).runSequence("mu", ast);
    assertEquals(parse("{ sstore(0, 7) }").toString(), ast.toString());
    assertEquals(1, OptimiserStatistics.getCount(
            OptimiserStatistics.STEP_RUNS_PREFIX + "Rematerialiser"));
  }

  @Test
  public void testStableLoopStopsAtFixedPoint() throws Exception {
    Block ast = parse("{ sstore(0, 1) sstore(1, 2) sstore(2, 3) }");
    FakeStepSuite suite = new FakeStepSuite(ast);
    int rounds = suite.runSequenceUntilStable(
                        Arrays.asList("RemoveFirst"), ast, 12);
    // Three rounds remove statements, the fourth makes no change
    assertEquals(4, rounds);
    assertTrue(ast.isEmpty());
    assertEquals(0, OptimiserStatistics.getCount(
                      OptimiserStatistics.STABLE_LOOP_ROUND_CAP));
  }

  @Test
  public void testStableLoopRunsAtLeastOnce() throws Exception {
    Block ast = parse("{ sstore(0, 1) }");
    FakeStepSuite suite = new FakeStepSuite(ast);
    assertEquals(1, suite.runSequenceUntilStable(
                        Arrays.asList("Nothing"), ast, 12));
    assertEquals(1, suite.runs);
  }

  @Test
  public void testStableLoopRoundCap() throws Exception {
    Block ast = parse("{ sstore(0, 1) }");
    FakeStepSuite suite = new FakeStepSuite(ast);
    int rounds = suite.runSequenceUntilStable(Arrays.asList("Grow"), ast, 5);
    assertEquals(5, rounds);
    assertEquals(6, ast.getStatements().size());
    assertEquals(1, OptimiserStatistics.getCount(
                      OptimiserStatistics.STABLE_LOOP_ROUND_CAP));
    assertEquals(5, OptimiserStatistics.getCount(
                      OptimiserStatistics.STABLE_LOOP_ROUNDS));
  }

  @Test
  public void testStableLoopCapBeforeFixedPoint() throws Exception {
    Block ast = parse("{ sstore(0, 1) sstore(1, 2) sstore(2, 3) }");
    FakeStepSuite suite = new FakeStepSuite(ast);
    assertEquals(2, suite.runSequenceUntilStable(
                        Arrays.asList("RemoveFirst"), ast, 2));
    assertEquals(1, ast.getStatements().size());
  }

  @Test
  public void testStableLoopZeroRounds() throws Exception {
    Block ast = parse("{ sstore(0, 1) }");
    FakeStepSuite suite = new FakeStepSuite(ast);
    assertEquals(0, suite.runSequenceUntilStable(
                        Arrays.asList("Grow"), ast, 0));
    assertEquals(1, ast.getStatements().size());
  }

  @Test
  public void testPrintSteps() throws Exception {
    Block ast = parse("{ let x := 1 }");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    OptimiserSuite suite = new OptimiserSuite(logger, context(ast, NO_RESERVED),
                                      Debug.PRINT_STEP, new PrintStream(out));
    suite.runSequence("du", ast);
    assertEquals("Running VarDeclInitializer\nRunning UnusedPruner\n",
                 out.toString().replace("\r\n", "\n"));
  }

  @Test
  public void testPrintChanges() throws Exception {
    Block ast = parse("{ let x := 1 }");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    OptimiserSuite suite = new OptimiserSuite(logger, context(ast, NO_RESERVED),
                                    Debug.PRINT_CHANGES, new PrintStream(out));
    suite.runSequence("ud", ast);
    String trace = out.toString();
    assertTrue(trace, trace.contains("== Running UnusedPruner changed the AST."));
    assertTrue(trace, trace.contains(
              "== Running VarDeclInitializer did not cause changes."));
  }

  @Test
  public void testDebugFromSetting() {
    assertEquals(Debug.NONE, Debug.fromSetting("none"));
    assertEquals(Debug.PRINT_STEP, Debug.fromSetting("print-step"));
    assertEquals(Debug.PRINT_CHANGES, Debug.fromSetting("Print-Changes"));
  }

  @Test
  public void testDebugFromSettingIgnoresLocale() {
    Locale saved = Locale.getDefault();
    // Upper-cases i to a dotted capital I
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertEquals(Debug.PRINT_STEP, Debug.fromSetting("print-step"));
      assertEquals(Debug.PRINT_CHANGES, Debug.fromSetting("print-changes"));
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  public void testEquivalentFunctionsCollapsed() throws Exception {
    String src =
        "{\n" +
        "  function f(a) -> r { r := add(a, 1) }\n" +
        "  function g(b) -> s { s := add(b, 1) }\n" +
        "  sstore(f(calldataload(0)), g(calldataload(32)))\n" +
        "}";
    YulObject object = optimiseEvm(src, NO_RESERVED, null);
    String result = object.getCode().toString();
    assertTrue(result, countOccurrences(result, "function ") <= 1);
    assertTrue(result, result.contains("sstore"));
    assertNotNull(object.getAnalysisInfo());
  }

  @Test
  public void testEquivalentFunctionsCustomSequence() throws Exception {
    String src =
        "{\n" +
        "  function f(a) -> r { r := add(a, 1) }\n" +
        "  function g(b) -> s { s := add(b, 1) }\n" +
        "  sstore(f(calldataload(0)), g(calldataload(32)))\n" +
        "}";
    YulObject object = optimiseEvm(src, NO_RESERVED, "vu");
    String result = object.getCode().toString();
    assertEquals(result, 1, countOccurrences(result, "function "));
    assertTrue(result, result.contains("function f("));
    assertFalse(result, result.contains("g("));
  }

  @Test
  public void testLiteralVariableEliminatedDefault() throws Exception {
    YulObject object = optimiseEvm("{ let x := 7 sstore(0, x) }",
                                   NO_RESERVED, null);
    String result = object.getCode().toString();
    assertTrue(result, result.contains("sstore(0, 7)"));
    assertFalse(result, result.contains("let"));
  }

  @Test
  public void testLiteralVariableEliminatedCustom() throws Exception {
    YulObject object = optimiseEvm("{ let x := 7 sstore(0, x) }",
                                   NO_RESERVED, "dmu");
    String result = object.getCode().toString();
    assertTrue(result, result.contains("sstore(0, 7)"));
    assertFalse(result, result.contains("let"));
  }

  @Test
  public void testReservedIdentifiersKept() throws Exception {
    String src =
        "{\n" +
        "  let keep := 1\n" +
        "  let other := 2\n" +
        "  function unused() -> r { r := 2 }\n" +
        "  function exported(x) -> y { y := add(x, 1) }\n" +
        "}";
    Set<String> reserved = new HashSet<String>(
                              Arrays.asList("keep", "exported"));
    for (String sequence: Arrays.asList(null, "dmu", "xarrscLMVculjj",
                                        "(u)")) {
      YulObject object = optimiseEvm(src, reserved, sequence);
      String result = object.getCode().toString();
      assertTrue(sequence + ": " + result, result.contains("let keep"));
      assertTrue(sequence + ": " + result,
                 result.contains("function exported("));
      assertFalse(sequence + ": " + result, result.contains("unused"));
      assertFalse(sequence + ": " + result, result.contains("other"));
    }
  }

  @Test
  public void testReservedNamesNotUsedForRenaming() throws Exception {
    // x is declared twice; the second one must not be renamed to x_1
    String src = "{ { let x := calldataload(0) sstore(0, x) } " +
                 "{ let x := calldataload(1) sstore(1, x) } }";
    Set<String> reserved = Collections.singleton("x_1");
    YulObject object = optimiseEvm(src, reserved, "");
    assertFalse(object.getCode().toString().contains("x_1"));
  }

  @Test
  public void testDefaultSequenceOverride() throws Exception {
    Settings.set(Settings.OPT_DEFAULT_SEQUENCE, "d");
    YulObject object = optimiseEvm("{ let x := 7 sstore(0, x) }",
                                   NO_RESERVED, null);
    String result = object.getCode().toString();
    // Cleanup replaces the use but nothing prunes the variable
    assertTrue(result, result.contains("let x := 7"));
    assertTrue(result, result.contains("sstore(0, 7)"));
  }

  @Test
  public void testMissingGasMeter() throws Exception {
    Block code = parse("{ { let x := 1 } { let x := 2 } }");
    String before = code.toString();
    YulObject object = new YulObject("test", code,
              AsmAnalyzer.analyzeStrict(EvmDialect.instance(), code, "test"));
    try {
      OptimiserSuite.run(EvmDialect.instance(), null, object, true,
                         NO_RESERVED, null);
      fail("Expected missing gas meter");
    } catch (MissingGasMeterException ex) {
      // Expected
    }
    assertEquals(before, code.toString());
  }

  @Test
  public void testInvalidCustomSequenceLeavesCodeUnchanged() throws Exception {
    Block code = parse("{ { let x := 1 } { let x := 2 } }");
    String before = code.toString();
    YulObject object = new YulObject("test", code,
              AsmAnalyzer.analyzeStrict(EvmDialect.instance(), code, "test"));
    try {
      OptimiserSuite.run(EvmDialect.instance(), new EvmGasMeter(200, false),
                         object, true, NO_RESERVED, "u(u");
      fail("Expected invalid sequence");
    } catch (InvalidSequenceException ex) {
      // Expected
    }
    assertEquals("Not even disambiguated", before, code.toString());
  }

  @Test
  public void testEmptyPreludeRemoved() throws Exception {
    Dialect wasm = WasmDialect.instance();
    Block code = parse("{ function f(a) -> r { r := a } }");
    YulObject object = new YulObject("test", code,
                            AsmAnalyzer.analyzeStrict(wasm, code, "test"));
    OptimiserSuite.run(wasm, null, object, true, Collections.singleton("f"),
                       null);
    assertEquals(code.toString(), 1, code.getStatements().size());
    assertEquals(StatementType.FUNCTION_DEFINITION,
                 code.getStatements().get(0).getType());
  }

  @Test
  public void testNoFinishingStep() throws Exception {
    Dialect plain = PlainDialect.instance();
    Block code = parse("{ print(input()) }");
    YulObject object = new YulObject("test", code,
                            AsmAnalyzer.analyzeStrict(plain, code, "test"));
    OptimiserSuite.run(plain, null, object, true, NO_RESERVED, null);
    assertTrue(code.toString(), code.toString().contains("print(input())"));
  }

  @Test
  public void testStepRunsCounted() throws Exception {
    optimiseEvm("{ let x := 7 sstore(0, x) }", NO_RESERVED, null);
    assertTrue(OptimiserStatistics.getCount(
          OptimiserStatistics.STEP_RUNS_PREFIX + "UnusedPruner") > 1);
  }

  @Test
  public void testStatisticsCoverOneRun() throws Exception {
    String key = OptimiserStatistics.STEP_RUNS_PREFIX + "UnusedPruner";
    optimiseEvm("{ let x := 7 sstore(0, x) }", NO_RESERVED, "u");
    long firstRun = OptimiserStatistics.getCount(key);
    assertTrue(firstRun > 0);
    optimiseEvm("{ let x := 7 sstore(0, x) }", NO_RESERVED, "u");
    assertEquals(firstRun, OptimiserStatistics.getCount(key));
  }

  @Test
  public void testStatisticsKeptOnInvalidSequence() throws Exception {
    OptimiserStatistics.increment(OptimiserStatistics.STABLE_LOOP_ROUND_CAP);
    try {
      optimiseEvm("{ sstore(0, 1) }", NO_RESERVED, "u)");
      fail("Expected invalid sequence");
    } catch (InvalidSequenceException ex) {
      // Expected
    }
    assertEquals(1, OptimiserStatistics.getCount(
                        OptimiserStatistics.STABLE_LOOP_ROUND_CAP));
  }

  private static YulObject optimiseEvm(String src, Set<String> reserved,
                               String sequence) throws Exception {
    Dialect evm = EvmDialect.instance();
    Block code = parse(src);
    YulObject object = new YulObject("test", code,
                            AsmAnalyzer.analyzeStrict(evm, code, "test"));
    OptimiserSuite.run(evm, new EvmGasMeter(200, false), object, true,
                       reserved, sequence);
    return object;
  }

  private static Block parse(String src) throws Exception {
    return Parser.parse("test", src);
  }

  private static OptimiserStepContext context(Block ast,
                                              Set<String> reserved) {
    Dialect dialect = EvmDialect.instance();
    Set<String> allReserved = new HashSet<String>(reserved);
    allReserved.addAll(dialect.fixedFunctionNames());
    return new OptimiserStepContext(dialect,
              new NameDispenser(dialect, ast, allReserved), allReserved);
  }

  private static OptimiserSuite suite(Block ast, Set<String> reserved) {
    return new OptimiserSuite(logger, context(ast, reserved), Debug.NONE,
                              null);
  }

  private static int countOccurrences(String s, String sub) {
    int count = 0;
    int i = s.indexOf(sub);
    while (i >= 0) {
      count++;
      i = s.indexOf(sub, i + sub.length());
    }
    return count;
  }

  /**
   * Suite with test steps that shrink or grow the code
   */
  private static class FakeStepSuite extends OptimiserSuite {
    private final Map<String, OptimiserStep> steps =
                                new HashMap<String, OptimiserStep>();
    int runs = 0;

    FakeStepSuite(Block ast) {
      super(logger, context(ast, NO_RESERVED), Debug.NONE, null);
      steps.put("RemoveFirst", new TestStep("RemoveFirst") {
        @Override
        void apply(Block ast) {
          List<?> stmts = ast.getStatements();
          if (!stmts.isEmpty()) {
            stmts.remove(0);
          }
        }
      });
      steps.put("Grow", new TestStep("Grow") {
        @Override
        void apply(Block ast) {
          ast.getStatements().add(new ExpressionStatement(
              new FunctionCall("sstore", Literal.zero(), Literal.zero())));
        }
      });
      steps.put("Nothing", new TestStep("Nothing") {
        @Override
        void apply(Block ast) {
          // No change
        }
      });
    }

    @Override
    protected OptimiserStep lookupStep(String stepName) {
      return steps.get(stepName);
    }

    private abstract class TestStep implements OptimiserStep {
      private final String name;

      TestStep(String name) {
        this.name = name;
      }

      @Override
      public String getStepName() {
        return name;
      }

      @Override
      public void run(Logger logger, OptimiserStepContext context,
                      Block ast) {
        runs++;
        apply(ast);
      }

      abstract void apply(Block ast);
    }
  }
}
