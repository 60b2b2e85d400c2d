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

import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Bring the top-level block into the form
 * <code>{ { main code } function f() {} function g() {} ... }</code>.
 * Function definitions nested deeper are left alone.
 */
public class FunctionGrouper implements OptimiserStep {

  @Override
  public String getStepName() {
    return "FunctionGrouper";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    if (isGrouped(ast)) {
      return;
    }
    Block mainCode = new Block();
    List<Statement> functions = new ArrayList<Statement>();
    for (Statement stmt: ast.getStatements()) {
      if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
        functions.add(stmt);
      } else {
        mainCode.getStatements().add(stmt);
      }
    }
    List<Statement> grouped = new ArrayList<Statement>();
    grouped.add(mainCode);
    grouped.addAll(functions);
    ast.replaceStatements(grouped);
  }

  public static boolean isGrouped(Block ast) {
    List<Statement> stmts = ast.getStatements();
    if (stmts.isEmpty() || stmts.get(0).getType() != StatementType.BLOCK) {
      return false;
    }
    for (int i = 1; i < stmts.size(); i++) {
      if (stmts.get(i).getType() != StatementType.FUNCTION_DEFINITION) {
        return false;
      }
    }
    return true;
  }
}
