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
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.VariableDeclaration;

/**
 * Undo the variable copies {@link SSATransform} introduces, once other
 * steps are done with them:
 * <pre>
 *   let a_1 := e        a := e
 *   a := a_1      -&gt;    let a_1 := a
 * </pre>
 * and likewise with <code>let a := a_1</code>.  The remaining copy is
 * usually removed by later steps.
 */
public class SSAReverser implements OptimiserStep {

  @Override
  public String getStepName() {
    return "SSAReverser";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      for (int i = 0; i + 1 < stmts.size(); i++) {
        Statement first = stmts.get(i);
        if (first.getType() != StatementType.VARIABLE_DECLARATION) {
          continue;
        }
        VariableDeclaration decl = (VariableDeclaration)first;
        if (decl.getVariables().size() != 1 || decl.getValue() == null) {
          continue;
        }
        String temp = decl.getVariables().get(0);
        Statement second = stmts.get(i + 1);
        String target = copyTarget(second, temp);
        if (target == null || target.equals(temp)) {
          continue;
        }
        Expression value = decl.getValue();
        if (second.getType() == StatementType.ASSIGNMENT) {
          ((Assignment)second).setValue(value);
        } else {
          ((VariableDeclaration)second).setValue(value);
        }
        decl.setValue(new Identifier(target));
        stmts.set(i, second);
        stmts.set(i + 1, decl);
        i++;
      }
    }
  }

  /**
   * @return variable assigned or declared from temp, or null
   */
  private static String copyTarget(Statement stmt, String temp) {
    List<String> vars;
    Expression value;
    if (stmt.getType() == StatementType.ASSIGNMENT) {
      vars = ((Assignment)stmt).getVariableNames();
      value = ((Assignment)stmt).getValue();
    } else if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
      vars = ((VariableDeclaration)stmt).getVariables();
      value = ((VariableDeclaration)stmt).getValue();
    } else {
      return null;
    }
    if (vars.size() != 1 || value == null ||
        value.getType() != ExpressionType.IDENTIFIER ||
        !((Identifier)value).getName().equals(temp)) {
      return null;
    }
    return vars.get(0);
  }
}
