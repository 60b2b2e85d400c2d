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
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.VariableDeclaration;

/**
 * Give every variable declaration an explicit value:
 * <code>let a, b</code> becomes <code>let a := 0 let b := 0</code>.
 */
public class VarDeclInitializer implements OptimiserStep {

  @Override
  public String getStepName() {
    return "VarDeclInitializer";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    for (Block block: OptUtil.allBlocks(ast)) {
      if (!hasUninitialized(block)) {
        continue;
      }
      List<Statement> result = new ArrayList<Statement>();
      for (Statement stmt: block.getStatements()) {
        if (isUninitialized(stmt)) {
          for (String var: ((VariableDeclaration)stmt).getVariables()) {
            result.add(new VariableDeclaration(var, Literal.zero()));
          }
        } else {
          result.add(stmt);
        }
      }
      block.replaceStatements(result);
    }
  }

  private static boolean hasUninitialized(Block block) {
    for (Statement stmt: block.getStatements()) {
      if (isUninitialized(stmt)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isUninitialized(Statement stmt) {
    return stmt.getType() == StatementType.VARIABLE_DECLARATION &&
           ((VariableDeclaration)stmt).getValue() == null;
  }
}
