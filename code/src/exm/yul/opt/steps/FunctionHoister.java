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
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Move every function definition to the end of the top-level block.
 * Function bodies can't see enclosing variables, so with unique names
 * the move doesn't change meaning.
 */
public class FunctionHoister implements OptimiserStep {

  @Override
  public String getStepName() {
    return "FunctionHoister";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    List<Statement> hoisted = new ArrayList<Statement>();
    // Blocks are listed outer first, so definitions keep their order
    for (Block block: OptUtil.allBlocks(ast)) {
      Iterator<Statement> it = block.getStatements().iterator();
      while (it.hasNext()) {
        Statement stmt = it.next();
        if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
          hoisted.add(stmt);
          it.remove();
        }
      }
    }
    ast.getStatements().addAll(hoisted);
    if (logger.isTraceEnabled()) {
      for (Statement stmt: hoisted) {
        logger.trace("Hoisted " + ((FunctionDefinition)stmt).getName());
      }
    }
  }
}
