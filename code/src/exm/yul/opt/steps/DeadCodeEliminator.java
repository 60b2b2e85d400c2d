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
import exm.yul.tree.Block;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Remove statements that can't be reached because an earlier statement
 * in the same block always leaves it.  Function definitions are kept,
 * since they are reachable by calls.
 */
public class DeadCodeEliminator implements OptimiserStep {

  @Override
  public String getStepName() {
    return "DeadCodeEliminator";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Dialect dialect = context.getDialect();
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      for (int i = 0; i < stmts.size(); i++) {
        if (Semantics.isTerminating(dialect, stmts.get(i))) {
          removeUnreachable(stmts, i + 1);
          break;
        }
      }
    }
  }

  private static void removeUnreachable(List<Statement> stmts, int start) {
    int i = start;
    while (i < stmts.size()) {
      if (stmts.get(i).getType() == StatementType.FUNCTION_DEFINITION) {
        i++;
      } else {
        stmts.remove(i);
      }
    }
  }
}
