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

import java.util.List;

import org.apache.log4j.Logger;

import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.If;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;

/**
 * Reverse of {@link ForLoopConditionIntoBody}: a loop with a constant
 * true condition whose body starts with <code>if c { break }</code>
 * gets <code>iszero(c)</code> as its condition.
 */
public class ForLoopConditionOutOfBody implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ForLoopConditionOutOfBody";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    final String negation = context.getDialect().booleanNegationFunction();
    if (negation == null) {
      return;
    }
    TreeWalk.walk(ast, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() != StatementType.FOR_LOOP) {
          return;
        }
        ForLoop loop = (ForLoop)stmt;
        Expression cond = loop.getCondition();
        if (cond.getType() != ExpressionType.LITERAL ||
            !Boolean.TRUE.equals(((Literal)cond).truthValue())) {
          return;
        }
        List<Statement> body = loop.getBody().getStatements();
        if (body.isEmpty() || body.get(0).getType() != StatementType.IF) {
          return;
        }
        If exit = (If)body.get(0);
        List<Statement> exitBody = exit.getBody().getStatements();
        if (exitBody.size() != 1 ||
            exitBody.get(0).getType() != StatementType.BREAK) {
          return;
        }
        Expression exitCond = exit.getCondition();
        if (OptUtil.isCallTo(exitCond, negation)) {
          loop.setCondition(((FunctionCall)exitCond).getArguments().get(0));
        } else {
          loop.setCondition(new FunctionCall(negation, exitCond));
        }
        body.remove(0);
      }
    });
  }
}
