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

import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.DataFlowAnalyzer;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.opt.SyntacticallyEqual;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;

/**
 * Replace an expression by a variable that currently holds the same
 * value.  Works best on split code, where every intermediate value has
 * a variable.
 */
public class CommonSubexpressionEliminator implements OptimiserStep {

  @Override
  public String getStepName() {
    return "CommonSubexpressionEliminator";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    new Eliminator(context.getDialect()).run(ast);
  }

  private static class Eliminator extends DataFlowAnalyzer {
    Eliminator(Dialect dialect) {
      super(dialect);
    }

    @Override
    protected Expression visitExpression(Expression expr) {
      Expression visited = super.visitExpression(expr);
      if (visited.getType() == ExpressionType.IDENTIFIER) {
        // Variable that is a copy of another variable
        Expression value = valueOf(((Identifier)visited).getName());
        if (value != null && value.getType() == ExpressionType.IDENTIFIER) {
          return value.copy();
        }
        return visited;
      } else if (visited.getType() != ExpressionType.FUNCTION_CALL ||
                 !Semantics.isMovable(dialect, visited)) {
        return visited;
      }

      // Smallest name wins so the result doesn't depend on hash order
      String match = null;
      for (Map.Entry<String, Expression> e: knownValues().entrySet()) {
        if (e.getValue().getType() == ExpressionType.FUNCTION_CALL &&
            SyntacticallyEqual.equal(e.getValue(), visited) &&
            (match == null || e.getKey().compareTo(match) < 0)) {
          match = e.getKey();
        }
      }
      return match == null ? visited : new Identifier(match);
    }
  }
}
