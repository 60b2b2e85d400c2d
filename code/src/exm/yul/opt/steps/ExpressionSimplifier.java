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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.yul.dialect.BuiltinFunction;
import exm.yul.dialect.Dialect;
import exm.yul.opt.DataFlowAnalyzer;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.opt.SyntacticallyEqual;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Identifier;
import exm.yul.tree.Literal;

/**
 * Constant folding and algebraic identities on builtin operations.
 * Variables with a known constant value count as constants.  Rules that
 * drop an operand only apply if the operand is movable.
 */
public class ExpressionSimplifier implements OptimiserStep {

  @Override
  public String getStepName() {
    return "ExpressionSimplifier";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    new Simplifier(context.getDialect()).run(ast);
  }

  private static class Simplifier extends DataFlowAnalyzer {
    Simplifier(Dialect dialect) {
      super(dialect);
    }

    @Override
    protected Expression visitExpression(Expression expr) {
      Expression visited = super.visitExpression(expr);
      if (visited.getType() != ExpressionType.FUNCTION_CALL) {
        return visited;
      }
      return simplify((FunctionCall)visited);
    }

    private Expression simplify(FunctionCall call) {
      BuiltinFunction fn = dialect.builtin(call.getFunctionName());
      if (fn == null || fn.getOperation() == null) {
        return call;
      }
      List<Expression> args = call.getArguments();
      List<BigInteger> values = new ArrayList<BigInteger>(args.size());
      boolean allConstant = true;
      for (Expression arg: args) {
        BigInteger v = constantValue(arg);
        values.add(v);
        if (v == null) {
          allConstant = false;
        }
      }
      if (allConstant) {
        BigInteger result = dialect.evaluate(fn.getName(), values);
        if (result != null) {
          return Literal.number(result);
        }
        return call;
      }
      return applyIdentities(fn.getOperation(), call, values);
    }

    private Expression applyIdentities(String op, FunctionCall call,
                                       List<BigInteger> values) {
      List<Expression> args = call.getArguments();
      if (args.size() == 1) {
        // iszero(iszero(iszero(x))) -> iszero(x)
        if (op.equals("iszero") && isOperation(args.get(0), "iszero")) {
          FunctionCall inner = (FunctionCall)args.get(0);
          if (isOperation(inner.getArguments().get(0), "iszero")) {
            return inner.getArguments().get(0);
          }
        }
        return call;
      }
      if (args.size() != 2) {
        return call;
      }
      Expression a = args.get(0);
      Expression b = args.get(1);
      BigInteger va = values.get(0);
      BigInteger vb = values.get(1);
      if (op.equals("add") || op.equals("or") || op.equals("xor")) {
        if (isZero(vb)) {
          return a;
        } else if (isZero(va)) {
          return b;
        }
      } else if (op.equals("sub")) {
        if (isZero(vb)) {
          return a;
        }
      } else if (op.equals("mul")) {
        if (isOne(vb)) {
          return a;
        } else if (isOne(va)) {
          return b;
        } else if ((isZero(va) || isZero(vb)) && movable(a) && movable(b)) {
          return Literal.zero();
        }
      } else if (op.equals("and")) {
        if ((isZero(va) || isZero(vb)) && movable(a) && movable(b)) {
          return Literal.zero();
        }
      } else if (op.equals("shl") || op.equals("shr")) {
        // Shift amount comes first
        if (isZero(va)) {
          return b;
        }
      }

      if (movable(a) && SyntacticallyEqual.equal(a, b)) {
        if (op.equals("sub") || op.equals("xor")) {
          return Literal.zero();
        } else if (op.equals("eq")) {
          return Literal.number(1);
        } else if (op.equals("and") || op.equals("or")) {
          return a;
        }
      }
      return call;
    }

    private boolean isOperation(Expression expr, String op) {
      if (expr.getType() != ExpressionType.FUNCTION_CALL) {
        return false;
      }
      BuiltinFunction fn = dialect.builtin(
                              ((FunctionCall)expr).getFunctionName());
      return fn != null && op.equals(fn.getOperation());
    }

    private boolean movable(Expression expr) {
      return Semantics.isMovable(dialect, expr);
    }

    /**
     * @return value if expression is a constant or a variable with a
     *        known constant value, otherwise null
     */
    private BigInteger constantValue(Expression expr) {
      if (expr.getType() == ExpressionType.IDENTIFIER) {
        Expression known = valueOf(((Identifier)expr).getName());
        if (known == null) {
          return null;
        }
        expr = known;
      }
      if (expr.getType() == ExpressionType.LITERAL) {
        return ((Literal)expr).numericValue();
      }
      return null;
    }

    private static boolean isZero(BigInteger v) {
      return v != null && v.signum() == 0;
    }

    private static boolean isOne(BigInteger v) {
      return v != null && v.equals(BigInteger.ONE);
    }
  }
}
