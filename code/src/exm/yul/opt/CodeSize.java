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

import exm.yul.tree.Block;
import exm.yul.tree.Case;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.If;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.Assignment;
import exm.yul.tree.VariableDeclaration;

/**
 * Rough measure of code size: one per statement except blocks and
 * function definitions, one per expression except identifiers.
 *
 * Only used to compare versions of the same code.
 */
public class CodeSize {

  public static long codeSize(Statement stmt) {
    return size(stmt, false);
  }

  public static long codeSizeIncludingFunctions(Block block) {
    return size(block, true);
  }

  public static long codeSize(Expression expr) {
    long size = expr.getType() == ExpressionType.IDENTIFIER ? 0 : 1;
    if (expr.getType() == ExpressionType.FUNCTION_CALL) {
      for (Expression arg: ((FunctionCall)expr).getArguments()) {
        size += codeSize(arg);
      }
    }
    return size;
  }

  private static long size(Statement stmt, boolean includeFunctions) {
    switch (stmt.getType()) {
      case BLOCK: {
        long size = 0;
        for (Statement child: ((Block)stmt).getStatements()) {
          size += size(child, includeFunctions);
        }
        return size;
      }
      case FUNCTION_DEFINITION:
        if (!includeFunctions) {
          return 0;
        }
        return size(((FunctionDefinition)stmt).getBody(), true);
      case EXPRESSION_STATEMENT:
        return 1 + codeSize(((ExpressionStatement)stmt).getExpression());
      case VARIABLE_DECLARATION: {
        Expression value = ((VariableDeclaration)stmt).getValue();
        return 1 + (value == null ? 0 : codeSize(value));
      }
      case ASSIGNMENT:
        return 1 + codeSize(((Assignment)stmt).getValue());
      case IF: {
        If ifStmt = (If)stmt;
        return 1 + codeSize(ifStmt.getCondition()) +
                   size(ifStmt.getBody(), includeFunctions);
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        long size = 1 + codeSize(sw.getExpression());
        for (Case c: sw.getCases()) {
          size += size(c.getBody(), includeFunctions);
        }
        return size;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        return 1 + size(loop.getPre(), includeFunctions) +
                   codeSize(loop.getCondition()) +
                   size(loop.getPost(), includeFunctions) +
                   size(loop.getBody(), includeFunctions);
      }
      default:
        assert(stmt.getType() == StatementType.BREAK ||
               stmt.getType() == StatementType.CONTINUE ||
               stmt.getType() == StatementType.LEAVE);
        return 1;
    }
  }
}
