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
import exm.yul.tree.Case;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ForLoop;
import exm.yul.tree.If;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Switch;

/**
 * Resolve control flow with constant conditions: ifs on constants,
 * switches on constants and loops whose condition is constant false.
 */
public class StructuralSimplifier implements OptimiserStep {

  @Override
  public String getStepName() {
    return "StructuralSimplifier";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> result = new ArrayList<Statement>();
      boolean changed = false;
      for (Statement stmt: block.getStatements()) {
        Statement replacement = stmt;
        switch (stmt.getType()) {
          case IF:
            replacement = simplifyIf((If)stmt);
            break;
          case SWITCH:
            replacement = simplifySwitch((Switch)stmt);
            break;
          case FOR_LOOP:
            replacement = simplifyForLoop((ForLoop)stmt);
            break;
          default:
            break;
        }
        if (replacement != stmt) {
          changed = true;
        }
        if (replacement != null) {
          result.add(replacement);
        }
      }
      if (changed) {
        block.replaceStatements(result);
      }
    }
  }

  /**
   * @return truth value of constant condition, null if not constant
   */
  private static Boolean constantTruth(Expression cond) {
    if (cond.getType() != ExpressionType.LITERAL) {
      return null;
    }
    return ((Literal)cond).truthValue();
  }

  /**
   * @return replacement, null to remove, or the statement itself
   */
  private static Statement simplifyIf(If ifStmt) {
    Boolean truth = constantTruth(ifStmt.getCondition());
    if (truth == null) {
      return ifStmt;
    }
    return truth ? ifStmt.getBody() : null;
  }

  private static Statement simplifySwitch(Switch sw) {
    if (sw.getExpression().getType() != ExpressionType.LITERAL) {
      return sw;
    }
    Literal value = (Literal)sw.getExpression();
    Case matching = null;
    for (Case c: sw.getCases()) {
      if (!c.isDefault() && c.getValue().valueEquals(value)) {
        matching = c;
        break;
      }
    }
    if (matching == null) {
      matching = sw.getDefaultCase();
    }
    return matching == null ? null : matching.getBody();
  }

  private static Statement simplifyForLoop(ForLoop loop) {
    Boolean truth = constantTruth(loop.getCondition());
    if (truth == null || truth) {
      return loop;
    }
    // Only the initialisation ever runs
    return loop.getPre();
  }
}
