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
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.VariableDeclaration;

/**
 * Remove assignments whose value is never read: the variable is
 * assigned again, or goes out of scope, before any read.  Only
 * straight-line code within one block is considered; any control flow
 * statement ends the search.
 */
public class RedundantAssignEliminator implements OptimiserStep {

  @Override
  public String getStepName() {
    return "RedundantAssignEliminator";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Dialect dialect = context.getDialect();
    Set<Block> loopInits = OptUtil.loopInitBlocks(ast);
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      boolean scopeEnds = !loopInits.contains(block);
      for (int i = 0; i < stmts.size(); i++) {
        Statement stmt = stmts.get(i);
        if (stmt.getType() != StatementType.ASSIGNMENT) {
          continue;
        }
        Assignment assign = (Assignment)stmt;
        if (assign.getVariableNames().size() != 1 ||
            !Semantics.isSideEffectFree(dialect, assign.getValue())) {
          continue;
        }
        String var = assign.getVariableNames().get(0);
        if (context.isReserved(var)) {
          continue;
        }
        if (isSelfAssignment(assign, var) ||
            overwrittenBeforeRead(stmts, i + 1, var, scopeEnds)) {
          stmts.remove(i);
          i--;
        }
      }
    }
  }

  private static boolean isSelfAssignment(Assignment assign, String var) {
    return assign.getValue().getType() == ExpressionType.IDENTIFIER &&
           ((Identifier)assign.getValue()).getName().equals(var);
  }

  /**
   * @param scopeEnds whether variables declared in the block die at its
   *        end
   */
  private static boolean overwrittenBeforeRead(List<Statement> stmts,
                          int start, String var, boolean scopeEnds) {
    for (int j = start; j < stmts.size(); j++) {
      Statement stmt = stmts.get(j);
      switch (stmt.getType()) {
        case FUNCTION_DEFINITION:
          // Not executed here, and can't see var
          break;
        case EXPRESSION_STATEMENT:
        case VARIABLE_DECLARATION:
          if (NameCollector.referencedVariables(stmt).contains(var)) {
            return false;
          }
          break;
        case ASSIGNMENT: {
          Assignment assign = (Assignment)stmt;
          if (NameCollector.referencedVariables(assign.getValue())
                                                    .contains(var)) {
            return false;
          }
          if (assign.getVariableNames().contains(var)) {
            return true;
          }
          break;
        }
        default:
          return false;
      }
    }
    return scopeEnds && declaredIn(stmts, var);
  }

  private static boolean declaredIn(List<Statement> stmts, String var) {
    for (Statement stmt: stmts) {
      if (stmt.getType() == StatementType.VARIABLE_DECLARATION &&
          ((VariableDeclaration)stmt).getVariables().contains(var)) {
        return true;
      }
    }
    return false;
  }
}
