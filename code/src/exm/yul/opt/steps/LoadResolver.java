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

import org.apache.log4j.Logger;

import exm.yul.dialect.BuiltinFunction;
import exm.yul.dialect.BuiltinFunction.StorageRole;
import exm.yul.dialect.Dialect;
import exm.yul.opt.DataFlowAnalyzer;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;

/**
 * Replace storage loads by the value last stored to the same slot, if
 * nothing since could have changed it.
 */
public class LoadResolver implements OptimiserStep {

  @Override
  public String getStepName() {
    return "LoadResolver";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    new Resolver(context.getDialect()).run(ast);
  }

  private static class Resolver extends DataFlowAnalyzer {
    Resolver(Dialect dialect) {
      super(dialect);
    }

    @Override
    protected Expression visitExpression(Expression expr) {
      Expression visited = super.visitExpression(expr);
      if (visited.getType() != ExpressionType.FUNCTION_CALL) {
        return visited;
      }
      FunctionCall call = (FunctionCall)visited;
      BuiltinFunction fn = dialect.builtin(call.getFunctionName());
      if (fn == null || fn.getStorageRole() != StorageRole.LOAD ||
          call.getArguments().size() != 1) {
        return visited;
      }
      Expression stored = storageValue(call.getArguments().get(0));
      return stored == null ? visited : stored.copy();
    }
  }
}
