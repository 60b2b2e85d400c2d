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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.ExpressionRewriter;

/**
 * Inline calls to functions of the form
 * <code>function f(a, b) -> r { r := expr }</code> where expr is movable,
 * provided every argument is a variable or a literal.
 */
public class ExpressionInliner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ExpressionInliner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    final Dialect dialect = context.getDialect();
    final Map<String, FunctionDefinition> inlinable =
                        new HashMap<String, FunctionDefinition>();
    for (FunctionDefinition def: NameCollector.functions(ast).values()) {
      if (isInlinable(dialect, def)) {
        inlinable.put(def.getName(), def);
      }
    }
    if (inlinable.isEmpty()) {
      return;
    }

    TreeWalk.rewriteExpressions(ast, new ExpressionRewriter() {
      @Override
      public Expression rewrite(Expression expr) {
        if (expr.getType() != ExpressionType.FUNCTION_CALL) {
          return expr;
        }
        FunctionCall call = (FunctionCall)expr;
        FunctionDefinition def = inlinable.get(call.getFunctionName());
        if (def == null) {
          return expr;
        }
        for (Expression arg: call.getArguments()) {
          if (!OptUtil.isIdentifierOrLiteral(arg)) {
            return expr;
          }
        }
        return substitute(def, call.getArguments());
      }
    });
  }

  private static boolean isInlinable(Dialect dialect, FunctionDefinition def) {
    List<Statement> body = def.getBody().getStatements();
    if (def.getReturnVariables().size() != 1 || body.size() != 1 ||
        body.get(0).getType() != StatementType.ASSIGNMENT) {
      return false;
    }
    Assignment assign = (Assignment)body.get(0);
    String ret = def.getReturnVariables().get(0);
    if (assign.getVariableNames().size() != 1 ||
        !assign.getVariableNames().get(0).equals(ret)) {
      return false;
    }
    Expression value = assign.getValue();
    if (!Semantics.isMovable(dialect, value)) {
      return false;
    }
    // Only parameters may be referenced
    for (String var: NameCollector.referencedVariables(value)) {
      if (!def.getParameters().contains(var)) {
        return false;
      }
    }
    return true;
  }

  private static Expression substitute(FunctionDefinition def,
                                       List<Expression> args) {
    final Map<String, Expression> params = new HashMap<String, Expression>();
    for (int i = 0; i < args.size(); i++) {
      params.put(def.getParameters().get(i), args.get(i));
    }
    Expression body =
        ((Assignment)def.getBody().getStatements().get(0)).getValue().copy();
    return TreeWalk.rewrite(body, new ExpressionRewriter() {
      @Override
      public Expression rewrite(Expression expr) {
        if (expr.getType() == ExpressionType.IDENTIFIER) {
          Expression arg = params.get(((Identifier)expr).getName());
          if (arg != null) {
            return arg.copy();
          }
        }
        return expr;
      }
    });
  }
}
