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

import org.apache.log4j.Logger;

import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Splice blocks nested directly in another block into their parent.
 * Safe once names are unique, since scopes no longer matter.
 */
public class BlockFlattener implements OptimiserStep {

  @Override
  public String getStepName() {
    return "BlockFlattener";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    for (Block block: OptUtil.allBlocks(ast)) {
      if (containsBlock(block)) {
        block.replaceStatements(flatten(block.getStatements()));
      }
    }
  }

  private static boolean containsBlock(Block block) {
    for (Statement stmt: block.getStatements()) {
      if (stmt.getType() == StatementType.BLOCK) {
        return true;
      }
    }
    return false;
  }

  private static List<Statement> flatten(List<Statement> stmts) {
    List<Statement> result = new ArrayList<Statement>(stmts.size());
    for (Statement stmt: stmts) {
      if (stmt.getType() == StatementType.BLOCK) {
        result.addAll(flatten(((Block)stmt).getStatements()));
      } else {
        result.add(stmt);
      }
    }
    return result;
  }
}
