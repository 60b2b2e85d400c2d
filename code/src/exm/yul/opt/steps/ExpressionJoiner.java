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
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Reverse of {@link ExpressionSplitter}: a variable referenced exactly
 * once, right in the next statement, is replaced by its value.
 *
 * The value is only moved if no function call in the next statement is
 * executed before the variable is read, so side effects stay in order.
 */
public class ExpressionJoiner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ExpressionJoiner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Map<String, Integer> refCounts = NameCollector.referenceCounts(ast);
    Set<String> assigned = NameCollector.assignedVariables(ast);
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> stmts = block.getStatements();
      // Backwards, so that joined values can be joined again
      for (int i = stmts.size() - 2; i >= 0; i--) {
        Statement stmt = stmts.get(i);
        if (stmt.getType() != StatementType.VARIABLE_DECLARATION) {
          continue;
        }
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getVariables().size() != 1 || decl.getValue() == null) {
          continue;
        }
        String var = decl.getVariables().get(0);
        if (context.isReserved(var) || assigned.contains(var) ||
            NameCollector.referenceCount(refCounts, var) != 1) {
          continue;
        }
        if (join(stmts.get(i + 1), var, decl.getValue())) {
          stmts.remove(i);
        }
      }
    }
  }

  /**
   * Substitute value for var in statement if safe
   * @return true if substituted
   */
  private static boolean join(Statement stmt, String var, Expression value) {
    Expression expr;
    switch (stmt.getType()) {
      case EXPRESSION_STATEMENT:
        expr = ((ExpressionStatement)stmt).getExpression();
        break;
      case VARIABLE_DECLARATION:
        expr = ((VariableDeclaration)stmt).getValue();
        break;
      case ASSIGNMENT:
        expr = ((Assignment)stmt).getValue();
        break;
      case IF:
        expr = ((If)stmt).getCondition();
        break;
      case SWITCH:
        expr = ((Switch)stmt).getExpression();
        break;
      default:
        return false;
    }
    if (expr == null) {
      return false;
    }
    if (isVar(expr, var)) {
      setExpression(stmt, value);
      return true;
    }
    return expr.getType() == ExpressionType.FUNCTION_CALL &&
           joinInCall((FunctionCall)expr, var, value) == Search.JOINED;
  }

  private static enum Search {
    /** Variable was replaced */
    JOINED,
    /** Only identifiers and literals evaluated so far */
    CONTINUE,
    /** A call is executed before the variable is read */
    BLOCKED,
  }

  /**
   * Follow evaluation order of call looking for var
   */
  private static Search joinInCall(FunctionCall call, String var,
                                   Expression value) {
    List<Expression> args = call.getArguments();
    for (int i = args.size() - 1; i >= 0; i--) {
      Expression arg = args.get(i);
      if (isVar(arg, var)) {
        args.set(i, value);
        return Search.JOINED;
      } else if (arg.getType() == ExpressionType.FUNCTION_CALL) {
        Search result = joinInCall((FunctionCall)arg, var, value);
        if (result != Search.CONTINUE) {
          return result;
        }
      }
    }
    // The call itself executes now
    return Search.BLOCKED;
  }

  private static boolean isVar(Expression expr, String var) {
    return expr.getType() == ExpressionType.IDENTIFIER &&
           ((Identifier)expr).getName().equals(var);
  }

  private static void setExpression(Statement stmt, Expression value) {
    switch (stmt.getType()) {
      case EXPRESSION_STATEMENT:
        ((ExpressionStatement)stmt).setExpression(value);
        break;
      case VARIABLE_DECLARATION:
        ((VariableDeclaration)stmt).setValue(value);
        break;
      case ASSIGNMENT:
        ((Assignment)stmt).setValue(value);
        break;
      case IF:
        ((If)stmt).setCondition(value);
        break;
      case SWITCH:
        ((Switch)stmt).setExpression(value);
        break;
      default:
        throw new YulRuntimeError("Can't set expression of " +
                                  stmt.getType());
    }
  }
}
