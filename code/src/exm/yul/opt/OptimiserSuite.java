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

import java.io.PrintStream;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.analysis.AsmAnalyzer;
import exm.yul.backends.evm.ConstantOptimiser;
import exm.yul.common.Logging;
import exm.yul.common.Settings;
import exm.yul.common.exceptions.InvalidOptionException;
import exm.yul.common.exceptions.InvalidSequenceException;
import exm.yul.common.exceptions.MissingGasMeterException;
import exm.yul.common.exceptions.UserException;
import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.FinishingStep;
import exm.yul.dialect.GasMeter;
import exm.yul.opt.StepSequence.SequenceElement;
import exm.yul.tree.Block;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.YulObject;

/**
 * Runs the whole optimiser over an object: disambiguation, a step
 * sequence, stack compression, cleanup and the dialect's finishing step.
 *
 * Step sequences are strings of step abbreviations, see
 * {@link OptimiserSteps}.  A parenthesised part is repeated until the
 * code size stops changing or the round cap is hit.
 */
public class OptimiserSuite {

  public static enum Debug {
    NONE,
    PRINT_STEP,
    PRINT_CHANGES;

    public static Debug fromSetting(String val) {
      String name = val.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      return Debug.valueOf(name);
    }
  }

  /**
   * Built-in schedule used when no custom sequence is given
   */
  public static final String DEFAULT_SEQUENCE =
      "dhfoDgvulfnTUtnIf"            // None of these make stack problems worse
      + "("
      +   "xarrscLM"                 // SSA and simplify
      +   "cCTUtTOntnfDIul"          // Structural simplification
      +   "Lcul"
      +   "Vcul jj"                  // Reverse SSA
      +   "eul"                      // Functional expression inliner
      +   "xarulrul"
      +   "xarrcL"
      +   "gvif"                     // Full inliner
      +   "CTUcarrLsTOtfDncarrIulc"
      + ")"
      + "jmuljuljul VcTOcul jmul";   // Make source short and pretty

  /**
   * Run before a custom sequence: hoist and group functions, rewrite
   * for loop init blocks.  Other steps assume these forms.
   */
  public static final String BOOTSTRAP_SEQUENCE = "hgo";

  /** Baseline for the first round of a stability loop */
  private static final long NO_CODE_SIZE = -1;

  private final Logger logger;
  private final OptimiserStepContext context;
  private final Debug debug;
  /** Where trace output goes, null for logger only */
  private final PrintStream traceOutput;

  /** Current stability loop round, 0 outside loops */
  private int round = 0;

  public OptimiserSuite(Logger logger, OptimiserStepContext context,
                        Debug debug, PrintStream traceOutput) {
    this.logger = logger;
    this.context = context;
    this.debug = debug;
    this.traceOutput = traceOutput;
  }

  public static void run(Dialect dialect, GasMeter meter, YulObject object,
        boolean optimizeStackAllocation, Set<String> externallyUsedIdentifiers,
        String customSequence) throws UserException {
    run(Logging.getYoptLogger(), null, dialect, meter, object,
        optimizeStackAllocation, externallyUsedIdentifiers, customSequence);
  }

  /**
   * Optimise object in place and refresh its analysis info
   *
   * @param traceOutput where to print trace output.  Null to only log
   * @param meter may be null if the dialect doesn't need one
   * @param customSequence replaces the default sequence, null for default
   * @throws MissingGasMeterException if the dialect needs a gas meter
   *                                  and none was given
   * @throws InvalidSequenceException if customSequence is malformed
   */
  public static void run(Logger logger, PrintStream traceOutput,
        Dialect dialect, GasMeter meter, YulObject object,
        boolean optimizeStackAllocation, Set<String> externallyUsedIdentifiers,
        String customSequence) throws UserException {
    // Check everything that can be wrong with the input before the code
    // is modified
    if (dialect.getFinishingStep() == FinishingStep.CONSTANT_OPTIMISER
        && meter == null) {
      throw new MissingGasMeterException(dialect.getName());
    }
    String mainSequence = customSequence != null ?
                              customSequence : defaultSequence();
    StepSequence.parse(mainSequence);

    // Statistics logged at the end cover this run only
    OptimiserStatistics.reset();

    Set<String> reserved = new HashSet<String>(externallyUsedIdentifiers);
    reserved.addAll(dialect.fixedFunctionNames());

    Block ast = object.getCode();
    Disambiguator.run(logger, dialect, ast, reserved);

    OptimiserStepContext context = new OptimiserStepContext(dialect,
                          new NameDispenser(dialect, ast, reserved), reserved);
    OptimiserSuite suite = new OptimiserSuite(logger, context,
                                              debugSetting(), traceOutput);

    if (customSequence != null) {
      suite.runSequence(BOOTSTRAP_SEQUENCE, ast);
    }
    suite.runSequence(mainSequence, ast);

    suite.runSequence("g", ast);

    // Failure shows up later in analysis or code generation with a
    // better message
    boolean fits = StackCompressor.run(logger, context, object,
                     optimizeStackAllocation,
                     intSetting(Settings.OPT_STACK_COMPRESSOR_MAX_ITERATIONS));
    if (!fits) {
      logger.debug("Stack compressor could not bring all functions below "
                 + "the stack limit");
    }

    suite.runSequence("fDnTOc g", ast);

    switch (dialect.getFinishingStep()) {
      case CONSTANT_OPTIMISER:
        new ConstantOptimiser(dialect, meter).run(ast);
        break;
      case REMOVE_EMPTY_PRELUDE:
        removeEmptyPrelude(logger, ast);
        break;
      case NONE:
        break;
      default:
        throw new YulRuntimeError("Unknown finishing step "
                                  + dialect.getFinishingStep());
    }

    VarNameCleaner.run(logger, context, ast);

    object.setAnalysisInfo(
            AsmAnalyzer.analyzeStrictAssertCorrect(dialect, object));
    OptimiserStatistics.log(logger);
  }

  /**
   * The first statement of grouped code is the main code block.  If it is
   * empty and only functions follow, it is dropped.
   */
  private static void removeEmptyPrelude(Logger logger, Block ast) {
    List<Statement> stmts = ast.getStatements();
    if (stmts.size() > 1) {
      Statement first = stmts.get(0);
      if (first.getType() == StatementType.BLOCK &&
          ((Block)first).getStatements().isEmpty()) {
        logger.trace("Removing empty prelude block");
        stmts.remove(0);
      }
    }
  }

  /**
   * Parse and run a sequence
   * @throws InvalidSequenceException if sequence is malformed.  The code
   *                      is unchanged in that case.
   */
  public void runSequence(String sequence, Block ast)
                                          throws InvalidSequenceException {
    StepSequence parsed = StepSequence.parse(sequence);
    for (SequenceElement elem: parsed.getElements()) {
      if (elem.isRepeatUntilStable()) {
        runSequenceUntilStable(elem.getSteps(), ast,
                               intSetting(Settings.OPT_MAX_ROUNDS));
      } else {
        runSequence(elem.getSteps(), ast);
      }
    }
  }

  /**
   * Run each named step once, in order
   */
  public void runSequence(List<String> steps, Block ast) {
    Block snapshot = null;
    if (debug == Debug.PRINT_CHANGES) {
      snapshot = ast.copy();
    }
    for (String stepName: steps) {
      OptimiserStep step = lookupStep(stepName);
      if (debug == Debug.PRINT_STEP) {
        trace("Running " + stepName);
      }
      if (logger.isDebugEnabled()) {
        logger.debug("Round: " + round + " Step: " + stepName);
      }
      step.run(logger, context, ast);
      OptimiserStatistics.increment(
                    OptimiserStatistics.STEP_RUNS_PREFIX + stepName);

      if (debug == Debug.PRINT_CHANGES) {
        if (SyntacticallyEqual.equal(snapshot, ast)) {
          trace("== Running " + stepName + " did not cause changes.");
        } else {
          trace("== Running " + stepName + " changed the AST.");
          trace(ast.toString());
          snapshot = ast.copy();
        }
      }
    }
  }

  /**
   * Repeat steps until the code size doesn't change any more, at most
   * maxRounds times
   * @return number of rounds run
   */
  public int runSequenceUntilStable(List<String> steps, Block ast,
                                    int maxRounds) {
    long codeSize = NO_CODE_SIZE;
    int rounds = 0;
    boolean stable = false;
    while (rounds < maxRounds) {
      long newSize = CodeSize.codeSizeIncludingFunctions(ast);
      if (newSize == codeSize) {
        stable = true;
        break;
      }
      codeSize = newSize;
      rounds++;
      round = rounds;
      runSequence(steps, ast);
    }
    round = 0;

    OptimiserStatistics.add(OptimiserStatistics.STABLE_LOOP_ROUNDS, rounds);
    if (!stable && maxRounds > 0) {
      OptimiserStatistics.increment(OptimiserStatistics.STABLE_LOOP_ROUND_CAP);
      logger.debug("Stopped repeating " + steps + " after " + rounds
                 + " rounds without reaching a stable code size");
    }
    return rounds;
  }

  /**
   * @throws YulRuntimeError if there is no step with that name
   */
  protected OptimiserStep lookupStep(String stepName) {
    OptimiserStep step = OptimiserSteps.allSteps().get(stepName);
    if (step == null) {
      throw new YulRuntimeError("Unknown optimiser step: " + stepName);
    }
    return step;
  }

  private void trace(String msg) {
    if (traceOutput != null) {
      traceOutput.println(msg);
    }
    logger.debug(msg);
  }

  private static String defaultSequence() {
    String override = Settings.get(Settings.OPT_DEFAULT_SEQUENCE);
    if (override != null && override.trim().length() > 0) {
      return override;
    }
    return DEFAULT_SEQUENCE;
  }

  private static int intSetting(String key) {
    try {
      return Settings.getInt(key);
    } catch (InvalidOptionException ex) {
      throw new YulRuntimeError(ex.getMessage());
    }
  }

  private static Debug debugSetting() {
    String val = Settings.get(Settings.OPT_DEBUG);
    try {
      return Debug.fromSetting(val);
    } catch (IllegalArgumentException ex) {
      throw new YulRuntimeError("Invalid value for " + Settings.OPT_DEBUG
                                + ": " + val);
    }
  }
}
