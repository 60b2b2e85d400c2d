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

import exm.yul.opt.NameDispenser;
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
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Split nested expressions so every function call argument is a
 * variable or literal: <code>mstore(add(x, 1), 2)</code> becomes
 * <code>let _1 := add(x, 1) mstore(_1, 2)</code>.
 *
 * Arguments are evaluated right to left, so new declarations for later
 * arguments come first.  For loop conditions are left alone.
 */
public class ExpressionSplitter implements OptimiserStep {
  private static final String NAME_HINT = "expr";

  @Override
  public String getStepName() {
    return "ExpressionSplitter";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    NameDispenser dispenser = context.getDispenser();
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> result = new ArrayList<Statement>();
      for (Statement stmt: block.getStatements()) {
        splitStatement(dispenser, stmt, result);
        result.add(stmt);
      }
      if (result.size() != block.getStatements().size()) {
        block.replaceStatements(result);
      }
    }
  }

  /**
   * Split expressions of statement, appending new declarations to out
   */
  private static void splitStatement(NameDispenser dispenser, Statement stmt,
                                     List<Statement> out) {
    switch (stmt.getType()) {
      case EXPRESSION_STATEMENT: {
        ExpressionStatement es = (ExpressionStatement)stmt;
        splitArguments(dispenser, es.getExpression(), out);
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getValue() != null) {
          splitArguments(dispenser, decl.getValue(), out);
        }
        break;
      }
      case ASSIGNMENT:
        splitArguments(dispenser, ((Assignment)stmt).getValue(), out);
        break;
      case IF: {
        If ifStmt = (If)stmt;
        ifStmt.setCondition(toVariable(dispenser, ifStmt.getCondition(), out));
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        sw.setExpression(toVariable(dispenser, sw.getExpression(), out));
        break;
      }
      default:
        break;
    }
  }

  private static void splitArguments(NameDispenser dispenser, Expression expr,
                                     List<Statement> out) {
    if (expr.getType() != ExpressionType.FUNCTION_CALL) {
      return;
    }
    List<Expression> args = ((FunctionCall)expr).getArguments();
    for (int i = args.size() - 1; i >= 0; i--) {
      args.set(i, toVariable(dispenser, args.get(i), out));
    }
  }

  /**
   * @return variable or literal replacing expr
   */
  private static Expression toVariable(NameDispenser dispenser,
                                       Expression expr, List<Statement> out) {
    if (OptUtil.isIdentifierOrLiteral(expr)) {
      return expr;
    }
    splitArguments(dispenser, expr, out);
    String var = dispenser.newName(NAME_HINT);
    out.add(new VariableDeclaration(var, expr));
    return new Identifier(var);
  }
}
