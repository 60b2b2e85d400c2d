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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.opt.NameCollector;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.SyntacticallyEqual;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;

/**
 * Redirect calls of a function to the first function that is equal to
 * it up to renaming of its variables.  The unused duplicate is left for
 * the unused pruner.
 */
public class EquivalentFunctionCombiner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "EquivalentFunctionCombiner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    List<FunctionDefinition> representatives =
                              new ArrayList<FunctionDefinition>();
    final Map<String, String> replacements = new HashMap<String, String>();
    for (FunctionDefinition def: NameCollector.functions(ast).values()) {
      FunctionDefinition equivalent = null;
      for (FunctionDefinition rep: representatives) {
        if (SyntacticallyEqual.equivalentFunctions(rep, def)) {
          equivalent = rep;
          break;
        }
      }
      if (equivalent == null) {
        representatives.add(def);
      } else {
        replacements.put(def.getName(), equivalent.getName());
        if (logger.isTraceEnabled()) {
          logger.trace("Function " + def.getName() + " equivalent to " +
                       equivalent.getName());
        }
      }
    }

    if (replacements.isEmpty()) {
      return;
    }
    TreeWalk.walk(ast, new TreeWalker() {
      @Override
      public void visit(Expression expr) {
        if (expr.getType() == ExpressionType.FUNCTION_CALL) {
          FunctionCall call = (FunctionCall)expr;
          String replacement = replacements.get(call.getFunctionName());
          if (replacement != null) {
            call.setFunctionName(replacement);
          }
        }
      }
    });
  }
}
