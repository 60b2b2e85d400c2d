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
package exm.yul.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.yul.analysis.AsmAnalyzer;
import exm.yul.backends.evm.EvmDialect;
import exm.yul.backends.evm.EvmGasMeter;
import exm.yul.backends.wasm.WasmDialect;
import exm.yul.common.Settings;
import exm.yul.common.exceptions.InvalidOptionException;
import exm.yul.common.exceptions.InvalidSyntaxException;
import exm.yul.common.exceptions.UserException;
import exm.yul.common.exceptions.YulFatal;
import exm.yul.common.util.Misc;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.FinishingStep;
import exm.yul.dialect.GasMeter;
import exm.yul.dialect.PlainDialect;
import exm.yul.opt.OptimiserSuite;
import exm.yul.parser.Parser;
import exm.yul.tree.Block;
import exm.yul.tree.YulObject;

/**
 * Reads a source file, optimises it and writes the result
 */
public class YoptCompiler {

  private final Logger logger;

  public YoptCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * @param dialectName evm, wasm or plain
   * @param customSequence null for the default sequence
   * @param output where to print optimised code
   * @param traceOutput where to print step trace, null for none
   * @throws YulFatal with exit code on any error
   */
  public void optimise(File inputFile, String dialectName,
        String customSequence, Set<String> reserved,
        boolean optimizeStackAllocation, PrintStream output,
        PrintStream traceOutput) {
    try {
      logger.info("yopt starting: " + Misc.timestamp());
      logSettings();
      Dialect dialect = selectDialect(dialectName);
      String source = FileUtils.readFileToString(inputFile, "UTF-8");
      YulObject object = optimise(dialect, inputFile.getPath(), source,
                  customSequence, reserved, optimizeStackAllocation,
                  traceOutput);
      output.println(object.getCode());
      output.flush();
      logger.debug("yopt done: " + Misc.timestamp());
    } catch (YulFatal e) {
      throw e;
    } catch (IOException e) {
      System.err.println("I/O error reading " + inputFile + ": " +
                         e.getMessage());
      throw new YulFatal(ExitCode.ERROR_IO.code());
    } catch (InvalidSyntaxException e) {
      System.err.println("yopt syntax error:");
      System.err.println(e.getMessage());
      throw new YulFatal(ExitCode.ERROR_PARSER.code());
    } catch (UserException e) {
      System.err.println("yopt error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new YulFatal(ExitCode.ERROR_USER.code());
    } catch (Throwable e) {
      reportInternalError(e);
      throw new YulFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Parse, check and optimise source text
   */
  public YulObject optimise(Dialect dialect, String fileName, String source,
        String customSequence, Set<String> reserved,
        boolean optimizeStackAllocation, PrintStream traceOutput)
                                                throws UserException {
    Block code = Parser.parse(fileName, source);
    YulObject object = new YulObject(fileName, code,
                        AsmAnalyzer.analyzeStrict(dialect, code, fileName));
    OptimiserSuite.run(logger, traceOutput, dialect, gasMeter(dialect),
              object, optimizeStackAllocation, reserved, customSequence);
    return object;
  }

  private void logSettings() {
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug("Setting " + key + "=" + Settings.get(key));
      }
    }
  }

  public static Dialect selectDialect(String name) throws UserException {
    if (name == null || name.equals("evm")) {
      return EvmDialect.instance();
    } else if (name.equals("wasm")) {
      return WasmDialect.instance();
    } else if (name.equals("plain")) {
      return PlainDialect.instance();
    }
    throw new UserException("Unknown dialect: " + name +
                            ", expected evm, wasm or plain");
  }

  /**
   * @return gas meter configured from settings, or null if the dialect
   *        doesn't use one
   */
  private static GasMeter gasMeter(Dialect dialect)
                                      throws InvalidOptionException {
    if (dialect.getFinishingStep() != FinishingStep.CONSTANT_OPTIMISER) {
      return null;
    }
    return new EvmGasMeter(Settings.getLong(Settings.EVM_RUNS),
                           Settings.getBoolean(Settings.EVM_CREATION));
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("YOPT INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
