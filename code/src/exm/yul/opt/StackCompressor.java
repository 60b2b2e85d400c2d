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

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.common.Logging;
import exm.yul.dialect.Dialect;
import exm.yul.opt.steps.FunctionGrouper;
import exm.yul.opt.steps.Rematerialiser;
import exm.yul.opt.steps.UnusedPruner;
import exm.yul.tree.Block;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;
import exm.yul.tree.YulObject;

/**
 * Tries to get the number of variables in each function below the
 * dialect's stack limit by inlining variable values and pruning the
 * variables that become unused.
 *
 * The variable count of a scope is a crude estimate of the stack slots
 * it needs: every parameter, return variable and declared variable.
 */
public class StackCompressor {

  public static boolean run(Dialect dialect, YulObject object,
                   boolean optimizeStackAllocation, int maxIterations) {
    OptimiserStepContext context = new OptimiserStepContext(dialect,
          new NameDispenser(dialect, object.getCode(),
                            dialect.fixedFunctionNames()),
          dialect.fixedFunctionNames());
    return run(Logging.getYoptLogger(), context, object,
               optimizeStackAllocation, maxIterations);
  }

  /**
   * @param optimizeStackAllocation if false, only the main code is
   *          checked and compressed
   * @return true if every scope fits within the stack limit afterwards
   */
  public static boolean run(Logger logger, OptimiserStepContext context,
           YulObject object, boolean optimizeStackAllocation,
           int maxIterations) {
    Dialect dialect = context.getDialect();
    Block ast = object.getCode();
    for (int iteration = 0; iteration < maxIterations; iteration++) {
      Map<String, Integer> excess = stackExcess(dialect, ast,
                                                optimizeStackAllocation);
      if (excess.isEmpty()) {
        return true;
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Stack compressor iteration " + iteration
                   + " variables over limit: " + excess);
      }
      OptimiserStatistics.increment(
              OptimiserStatistics.STACK_COMPRESSOR_ITERATIONS);

      long sizeBefore = CodeSize.codeSizeIncludingFunctions(ast);
      compress(logger, context, ast, excess, optimizeStackAllocation);
      if (CodeSize.codeSizeIncludingFunctions(ast) == sizeBefore &&
          stackExcess(dialect, ast, optimizeStackAllocation).equals(excess)) {
        // No progress
        break;
      }
    }

    boolean fits = stackExcess(dialect, ast, optimizeStackAllocation)
                                                                .isEmpty();
    if (!fits) {
      OptimiserStatistics.increment(
              OptimiserStatistics.STACK_COMPRESSOR_FAILED);
    }
    return fits;
  }

  private static void compress(Logger logger, OptimiserStepContext context,
        Block ast, Map<String, Integer> excess,
        boolean optimizeStackAllocation) {
    Dialect dialect = context.getDialect();
    if (!optimizeStackAllocation) {
      Rematerialiser.run(dialect, mainCode(ast), false);
    } else {
      Map<String, FunctionDefinition> functions = NameCollector.functions(ast);
      for (String scope: excess.keySet()) {
        if (scope.equals(CallGraph.MAIN)) {
          Rematerialiser.run(dialect, mainCode(ast), false);
        } else {
          Rematerialiser.run(dialect, functions.get(scope).getBody(), false);
        }
      }
    }
    new UnusedPruner().run(logger, context, ast);
  }

  /**
   * Grouped code keeps main code in its first block, otherwise the whole
   * tree is used
   */
  private static Block mainCode(Block ast) {
    if (FunctionGrouper.isGrouped(ast)) {
      return (Block)ast.getStatements().get(0);
    }
    return ast;
  }

  /**
   * @return scopes with more variables than the stack limit, mapped to
   *        the number of variables over the limit.  Main code is keyed
   *        by {@link CallGraph#MAIN}
   */
  static Map<String, Integer> stackExcess(Dialect dialect, Block ast,
                                          boolean includeFunctions) {
    Map<String, Integer> result = new LinkedHashMap<String, Integer>();
    int limit = dialect.stackLimit();

    int mainVars = countVariables(ast);
    if (mainVars > limit) {
      result.put(CallGraph.MAIN, mainVars - limit);
    }
    if (includeFunctions) {
      for (FunctionDefinition def: NameCollector.functions(ast).values()) {
        int vars = def.getParameters().size() +
                   def.getReturnVariables().size() +
                   countVariables(def.getBody());
        if (vars > limit) {
          result.put(def.getName(), vars - limit);
        }
      }
    }
    return result;
  }

  /**
   * Count declared variables, not looking inside function definitions
   */
  private static int countVariables(Block code) {
    final int[] count = new int[] {0};
    TreeWalk.walk(code, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
          count[0] += ((VariableDeclaration)stmt).getVariables().size();
        }
      }
    }, false);
    return count[0];
  }
}
