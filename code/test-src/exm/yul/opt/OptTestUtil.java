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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.backends.evm.EvmDialect;
import exm.yul.common.Logging;
import exm.yul.dialect.Dialect;
import exm.yul.parser.Parser;
import exm.yul.tree.Block;

/**
 * Helpers for running single optimiser steps on source snippets
 */
public class OptTestUtil {
  public static final Logger logger = Logging.getYoptLogger();

  public static Block parse(String src) {
    try {
      return Parser.parse("test", src);
    } catch (Exception e) {
      throw new IllegalArgumentException("Bad test input: " + src, e);
    }
  }

  public static OptimiserStepContext context(Dialect dialect, Block ast,
                                             String... reserved) {
    Set<String> allReserved = new HashSet<String>(Arrays.asList(reserved));
    allReserved.addAll(dialect.fixedFunctionNames());
    return new OptimiserStepContext(dialect,
                new NameDispenser(dialect, ast, allReserved), allReserved);
  }

  /**
   * Parse, disambiguate and run steps in order with the EVM dialect
   * @return optimised code
   */
  public static Block runSteps(String src, OptimiserStep... steps) {
    return runSteps(EvmDialect.instance(), src, new String[0], steps);
  }

  public static Block runSteps(Dialect dialect, String src,
                    String[] reserved, OptimiserStep... steps) {
    Block ast = parse(src);
    Set<String> allReserved = new HashSet<String>(Arrays.asList(reserved));
    allReserved.addAll(dialect.fixedFunctionNames());
    Disambiguator.run(logger, dialect, ast, allReserved);
    OptimiserStepContext context = context(dialect, ast, reserved);
    for (OptimiserStep step: steps) {
      step.run(logger, context, ast);
    }
    return ast;
  }

  /**
   * Compare printed form of code with expected source text
   */
  public static String normalize(String src) {
    return parse(src).toString();
  }
}
