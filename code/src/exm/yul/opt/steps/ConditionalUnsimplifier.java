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

import exm.yul.dialect.Dialect;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Case;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;

/**
 * Remove the assignments {@link ConditionalSimplifier} would insert,
 * because they are implied by the condition.
 */
public class ConditionalUnsimplifier implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ConditionalUnsimplifier";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Dialect dialect = context.getDialect();
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      for (int i = 0; i < stmts.size(); i++) {
        Statement stmt = stmts.get(i);
        if (stmt.getType() == StatementType.SWITCH) {
          Switch sw = (Switch)stmt;
          if (sw.getExpression().getType() != ExpressionType.IDENTIFIER) {
            continue;
          }
          String var = ((Identifier)sw.getExpression()).getName();
          for (Case c: sw.getCases()) {
            List<Statement> body = c.getBody().getStatements();
            if (!c.isDefault() && !body.isEmpty() &&
                assignsLiteral(body.get(0), var, c.getValue())) {
              body.remove(0);
            }
          }
        } else if (stmt.getType() == StatementType.IF &&
                   i + 1 < stmts.size()) {
          If ifStmt = (If)stmt;
          if (ifStmt.getCondition().getType() == ExpressionType.IDENTIFIER &&
              Semantics.endsInTermination(dialect, ifStmt.getBody())) {
            String var = ((Identifier)ifStmt.getCondition()).getName();
            if (assignsLiteral(stmts.get(i + 1), var, Literal.zero())) {
              stmts.remove(i + 1);
            }
          }
        }
      }
    }
  }

  private static boolean assignsLiteral(Statement stmt, String var,
                                        Literal value) {
    if (stmt.getType() != StatementType.ASSIGNMENT) {
      return false;
    }
    Assignment assign = (Assignment)stmt;
    Expression assigned = assign.getValue();
    return assign.getVariableNames().size() == 1 &&
           assign.getVariableNames().get(0).equals(var) &&
           assigned.getType() == ExpressionType.LITERAL &&
           ((Literal)assigned).valueEquals(value);
  }
}
