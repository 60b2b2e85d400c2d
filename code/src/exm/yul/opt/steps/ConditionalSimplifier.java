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
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;

/**
 * Make what is known from a condition explicit as an assignment, so
 * later data flow steps can use it:
 * <ul>
 * <li><code>switch x case 3 { ... }</code> assigns <code>x := 3</code> at
 *     the start of the case</li>
 * <li><code>if x { ... revert(0, 0) }</code> is followed by
 *     <code>x := 0</code></li>
 * </ul>
 * Reversed by {@link ConditionalUnsimplifier}.
 */
public class ConditionalSimplifier implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ConditionalSimplifier";
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
            if (!c.isDefault()) {
              c.getBody().getStatements().add(0,
                      new Assignment(var, c.getValue().copy()));
            }
          }
        } else if (stmt.getType() == StatementType.IF) {
          If ifStmt = (If)stmt;
          if (ifStmt.getCondition().getType() == ExpressionType.IDENTIFIER &&
              Semantics.endsInTermination(dialect, ifStmt.getBody())) {
            String var = ((Identifier)ifStmt.getCondition()).getName();
            stmts.add(i + 1, new Assignment(var, Literal.zero()));
            i++;
          }
        }
      }
    }
  }
}
