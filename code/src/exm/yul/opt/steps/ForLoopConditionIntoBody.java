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

import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Break;
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
 * Rewrite <code>for {} c {} { body }</code> to
 * <code>for {} 1 {} { if iszero(c) { break } body }</code>, so that the
 * condition is ordinary code that other steps can transform.
 */
public class ForLoopConditionIntoBody implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ForLoopConditionIntoBody";
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
        if (loop.getCondition().getType() == ExpressionType.LITERAL) {
          return;
        }
        If exit = new If(new FunctionCall(negation, loop.getCondition()),
                         new Block(new Break()));
        loop.getBody().getStatements().add(0, exit);
        loop.setCondition(Literal.number(1));
      }
    });
  }
}
