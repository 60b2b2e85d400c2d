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
package exm.yul.tree;

import java.util.List;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.tree.Expression.ExpressionType;

/**
 * Generic traversals of the program tree
 */
public class TreeWalk {

  /**
   * Pre-order walk over all statements and expressions under node
   * @param node
   * @param walker
   */
  public static void walk(Node node, TreeWalker walker) {
    walk(node, walker, true);
  }

  /**
   * @param enterFunctions if false, function definitions are visited but
   *        not their bodies
   */
  public static void walk(Node node, TreeWalker walker,
                          boolean enterFunctions) {
    if (node instanceof Expression) {
      walkExpression((Expression)node, walker);
    } else if (node instanceof Statement) {
      walkStatement((Statement)node, walker, enterFunctions);
    } else if (node instanceof Case) {
      walkStatement(((Case)node).getBody(), walker, enterFunctions);
    } else {
      throw new YulRuntimeError("Unexpected node " + node.getClass());
    }
  }

  private static void walkExpression(Expression expr, TreeWalker walker) {
    walker.visit(expr);
    if (expr.getType() == ExpressionType.FUNCTION_CALL) {
      for (Expression arg: ((FunctionCall)expr).getArguments()) {
        walkExpression(arg, walker);
      }
    }
  }

  private static void walkStatement(Statement stmt, TreeWalker walker,
                                    boolean enterFunctions) {
    walker.visit(stmt);
    switch (stmt.getType()) {
      case BLOCK:
        for (Statement child: ((Block)stmt).getStatements()) {
          walkStatement(child, walker, enterFunctions);
        }
        break;
      case EXPRESSION_STATEMENT:
        walkExpression(((ExpressionStatement)stmt).getExpression(), walker);
        break;
      case VARIABLE_DECLARATION: {
        Expression value = ((VariableDeclaration)stmt).getValue();
        if (value != null) {
          walkExpression(value, walker);
        }
        break;
      }
      case ASSIGNMENT:
        walkExpression(((Assignment)stmt).getValue(), walker);
        break;
      case IF: {
        If ifStmt = (If)stmt;
        walkExpression(ifStmt.getCondition(), walker);
        walkStatement(ifStmt.getBody(), walker, enterFunctions);
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        walkExpression(sw.getExpression(), walker);
        for (Case c: sw.getCases()) {
          walkStatement(c.getBody(), walker, enterFunctions);
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        walkStatement(loop.getPre(), walker, enterFunctions);
        walkExpression(loop.getCondition(), walker);
        walkStatement(loop.getPost(), walker, enterFunctions);
        walkStatement(loop.getBody(), walker, enterFunctions);
        break;
      }
      case FUNCTION_DEFINITION:
        if (enterFunctions) {
          walkStatement(((FunctionDefinition)stmt).getBody(), walker, true);
        }
        break;
      case BREAK:
      case CONTINUE:
      case LEAVE:
        break;
      default:
        throw new YulRuntimeError("Unknown statement type " + stmt.getType());
    }
  }

  /**
   * Replace every expression in the tree bottom-up: arguments of a call
   * are rewritten before the call itself.
   */
  public static void rewriteExpressions(Statement stmt,
                                        ExpressionRewriter rewriter) {
    switch (stmt.getType()) {
      case BLOCK:
        for (Statement child: ((Block)stmt).getStatements()) {
          rewriteExpressions(child, rewriter);
        }
        break;
      case EXPRESSION_STATEMENT: {
        ExpressionStatement es = (ExpressionStatement)stmt;
        es.setExpression(rewrite(es.getExpression(), rewriter));
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getValue() != null) {
          decl.setValue(rewrite(decl.getValue(), rewriter));
        }
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        assign.setValue(rewrite(assign.getValue(), rewriter));
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        ifStmt.setCondition(rewrite(ifStmt.getCondition(), rewriter));
        rewriteExpressions(ifStmt.getBody(), rewriter);
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        sw.setExpression(rewrite(sw.getExpression(), rewriter));
        for (Case c: sw.getCases()) {
          rewriteExpressions(c.getBody(), rewriter);
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        rewriteExpressions(loop.getPre(), rewriter);
        loop.setCondition(rewrite(loop.getCondition(), rewriter));
        rewriteExpressions(loop.getPost(), rewriter);
        rewriteExpressions(loop.getBody(), rewriter);
        break;
      }
      case FUNCTION_DEFINITION:
        rewriteExpressions(((FunctionDefinition)stmt).getBody(), rewriter);
        break;
      default:
        break;
    }
  }

  public static Expression rewrite(Expression expr,
                                   ExpressionRewriter rewriter) {
    if (expr.getType() == ExpressionType.FUNCTION_CALL) {
      List<Expression> args = ((FunctionCall)expr).getArguments();
      for (int i = 0; i < args.size(); i++) {
        args.set(i, rewrite(args.get(i), rewriter));
      }
    }
    return rewriter.rewrite(expr);
  }

  public static abstract class TreeWalker {
    public void visit(Statement stmt) {
      // Nothing
    }

    public void visit(Expression expr) {
      // Nothing
    }
  }

  public static interface ExpressionRewriter {
    /**
     * @return replacement for expr, or expr itself to keep it
     */
    public Expression rewrite(Expression expr);
  }
}
