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

import exm.yul.dialect.Dialect;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Case;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.If;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;

/**
 * Simplify control flow statements:
 * <ul>
 * <li>an if with an empty body only evaluates its condition</li>
 * <li>a switch with only a default case is a plain block</li>
 * <li>a switch with a single case is an if</li>
 * </ul>
 */
public class ControlFlowSimplifier implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ControlFlowSimplifier";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Dialect dialect = context.getDialect();
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> result = new ArrayList<Statement>();
      boolean changed = false;
      for (Statement stmt: block.getStatements()) {
        List<Statement> replacement = null;
        if (stmt.getType() == StatementType.IF) {
          replacement = simplifyIf(dialect, (If)stmt);
        } else if (stmt.getType() == StatementType.SWITCH) {
          replacement = simplifySwitch(dialect, (Switch)stmt);
        }
        if (replacement == null) {
          result.add(stmt);
        } else {
          result.addAll(replacement);
          changed = true;
        }
      }
      if (changed) {
        block.replaceStatements(result);
      }
    }
  }

  /**
   * @return replacement or null to keep statement
   */
  private static List<Statement> simplifyIf(Dialect dialect, If ifStmt) {
    if (!ifStmt.getBody().isEmpty()) {
      return null;
    }
    return OptUtil.discard(dialect, ifStmt.getCondition());
  }

  private static List<Statement> simplifySwitch(Dialect dialect, Switch sw) {
    List<Case> cases = sw.getCases();
    if (cases.size() != 1) {
      return null;
    }
    Case only = cases.get(0);
    if (only.isDefault()) {
      List<Statement> result = OptUtil.discard(dialect, sw.getExpression());
      if (result == null) {
        return null;
      }
      result.add(only.getBody());
      return result;
    }
    String eq = dialect.equalityFunction();
    if (eq == null) {
      return null;
    }
    List<Statement> result = new ArrayList<Statement>(1);
    result.add(new If(new FunctionCall(eq, only.getValue().copy(),
                                       sw.getExpression()),
                      only.getBody()));
    return result;
  }
}
