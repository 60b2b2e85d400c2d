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
package exm.yul.opt;

import exm.yul.dialect.BuiltinFunction;
import exm.yul.dialect.Dialect;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Statement;

/**
 * Side effect properties of expressions and statements
 */
public class Semantics {

  /**
   * Movable expressions can be evaluated anywhere, any number of times,
   * or not at all, without changing the program.
   */
  public static boolean isMovable(Dialect dialect, Expression expr) {
    switch (expr.getType()) {
      case LITERAL:
      case IDENTIFIER:
        return true;
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        BuiltinFunction fn = dialect.builtin(call.getFunctionName());
        if (fn == null || !fn.isMovable()) {
          return false;
        }
        for (Expression arg: call.getArguments()) {
          if (!isMovable(dialect, arg)) {
            return false;
          }
        }
        return true;
      }
      default:
        return false;
    }
  }

  /**
   * Side effect free expressions can be removed if their value is unused.
   */
  public static boolean isSideEffectFree(Dialect dialect, Expression expr) {
    if (expr.getType() != Expression.ExpressionType.FUNCTION_CALL) {
      return true;
    }
    FunctionCall call = (FunctionCall)expr;
    BuiltinFunction fn = dialect.builtin(call.getFunctionName());
    if (fn == null || !fn.isSideEffectFree()) {
      return false;
    }
    for (Expression arg: call.getArguments()) {
      if (!isSideEffectFree(dialect, arg)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true if call may write storage or call code that does
   */
  public static boolean invalidatesStorage(Dialect dialect,
                                           FunctionCall call) {
    BuiltinFunction fn = dialect.builtin(call.getFunctionName());
    return fn == null || fn.invalidatesStorage();
  }

  /**
   * @return true if control never reaches the statement after stmt
   */
  public static boolean isTerminating(Dialect dialect, Statement stmt) {
    switch (stmt.getType()) {
      case BREAK:
      case CONTINUE:
      case LEAVE:
        return true;
      case EXPRESSION_STATEMENT: {
        Expression expr = ((ExpressionStatement)stmt).getExpression();
        if (expr.getType() != Expression.ExpressionType.FUNCTION_CALL) {
          return false;
        }
        BuiltinFunction fn = dialect.builtin(
                            ((FunctionCall)expr).getFunctionName());
        return fn != null && fn.terminates();
      }
      default:
        return false;
    }
  }

  /**
   * @return true if the block always ends in a terminating statement
   */
  public static boolean endsInTermination(Dialect dialect, Block block) {
    if (block.isEmpty()) {
      return false;
    }
    Statement last = block.getStatements().get(
                              block.getStatements().size() - 1);
    return isTerminating(dialect, last);
  }
}
