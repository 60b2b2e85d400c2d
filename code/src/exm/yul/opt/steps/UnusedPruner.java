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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.tree.Block;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.VariableDeclaration;

/**
 * Remove functions and variables that are never referenced, and
 * expression statements without side effects.  Reserved names are
 * never removed.  Values with side effects are kept by discarding them
 * explicitly.
 *
 * Repeats until nothing more can be removed, since each removal can
 * make further names unused.
 */
public class UnusedPruner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "UnusedPruner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    int passes = 0;
    boolean changed;
    do {
      changed = prune(context, ast);
      passes++;
    } while (changed);
    if (logger.isTraceEnabled()) {
      logger.trace("UnusedPruner finished after " + passes + " passes");
    }
  }

  private static boolean prune(OptimiserStepContext context, Block ast) {
    Dialect dialect = context.getDialect();
    Map<String, Integer> refCounts = NameCollector.referenceCounts(ast);
    // An assignment needs its declaration even if the value is never read
    for (String assigned: NameCollector.assignedVariables(ast)) {
      Integer c = refCounts.get(assigned);
      refCounts.put(assigned, c == null ? 1 : c + 1);
    }
    boolean changed = false;
    for (Block block: OptUtil.allBlocks(ast)) {
      boolean blockChanged = false;
      List<Statement> result = new ArrayList<Statement>();
      for (Statement stmt: block.getStatements()) {
        switch (stmt.getType()) {
          case FUNCTION_DEFINITION: {
            String name = ((FunctionDefinition)stmt).getName();
            if (unused(context, refCounts, name)) {
              blockChanged = true;
            } else {
              result.add(stmt);
            }
            break;
          }
          case VARIABLE_DECLARATION: {
            VariableDeclaration decl = (VariableDeclaration)stmt;
            List<Statement> replacement = pruneDeclaration(context,
                                                    refCounts, decl);
            if (replacement == null) {
              result.add(stmt);
            } else {
              result.addAll(replacement);
              blockChanged = true;
            }
            break;
          }
          case EXPRESSION_STATEMENT:
            if (Semantics.isSideEffectFree(dialect,
                        ((ExpressionStatement)stmt).getExpression())) {
              blockChanged = true;
            } else {
              result.add(stmt);
            }
            break;
          default:
            result.add(stmt);
            break;
        }
      }
      if (blockChanged) {
        block.replaceStatements(result);
        changed = true;
      }
    }
    return changed;
  }

  /**
   * @return statements replacing the declaration, or null to keep it
   */
  private static List<Statement> pruneDeclaration(
        OptimiserStepContext context, Map<String, Integer> refCounts,
        VariableDeclaration decl) {
    for (String var: decl.getVariables()) {
      if (!unused(context, refCounts, var)) {
        return null;
      }
    }
    if (decl.getValue() == null) {
      return new ArrayList<Statement>();
    }
    if (decl.getVariables().size() != 1) {
      // Can't discard multiple values
      return Semantics.isSideEffectFree(context.getDialect(), decl.getValue())
                ? new ArrayList<Statement>() : null;
    }
    return OptUtil.discard(context.getDialect(), decl.getValue());
  }

  private static boolean unused(OptimiserStepContext context,
                                Map<String, Integer> refCounts, String name) {
    return !context.isReserved(name) &&
           NameCollector.referenceCount(refCounts, name) == 0;
  }
}
