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
import exm.yul.tree.ForLoop;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Rewrite <code>for { init } c { post } { body }</code> to
 * <code>{ init for {} c { post } { body } }</code>.
 */
public class ForLoopInitRewriter implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ForLoopInitRewriter";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      for (int i = 0; i < stmts.size(); i++) {
        Statement stmt = stmts.get(i);
        if (stmt.getType() != StatementType.FOR_LOOP) {
          continue;
        }
        ForLoop loop = (ForLoop)stmt;
        if (loop.getPre().isEmpty()) {
          continue;
        }
        Block replacement = new Block(loop.getPre().getStatements());
        loop.getPre().getStatements().clear();
        replacement.getStatements().add(loop);
        stmts.set(i, replacement);
      }
    }
  }
}
