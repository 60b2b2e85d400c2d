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
package exm.yul.backends.evm;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.yul.common.Logging;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.GasMeter;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Literal;
import exm.yul.tree.Literal.LiteralKind;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.ExpressionRewriter;

/**
 * Replace large number literals by a cheaper computation of the same
 * value, e.g. not(0) for the all-ones word.  A replacement is only made
 * if the gas meter says it is strictly cheaper.
 */
public class ConstantOptimiser {
  /** Smaller literals are never worth replacing */
  private static final int MIN_BITS = 16;
  private static final int MIN_SHIFT = 8;

  private final Logger logger = Logging.getYoptLogger();
  private final Dialect dialect;
  private final GasMeter meter;
  private int replaced = 0;

  public ConstantOptimiser(Dialect dialect, GasMeter meter) {
    this.dialect = dialect;
    this.meter = meter;
  }

  /**
   * @return number of literals replaced
   */
  public int run(Block ast) {
    TreeWalk.rewriteExpressions(ast, new ExpressionRewriter() {
      @Override
      public Expression rewrite(Expression expr) {
        if (expr.getType() != ExpressionType.LITERAL) {
          return expr;
        }
        return optimise((Literal)expr);
      }
    });
    if (logger.isDebugEnabled()) {
      logger.debug("Constant optimiser replaced " + replaced + " literals");
    }
    return replaced;
  }

  private Expression optimise(Literal lit) {
    if (lit.getKind() != LiteralKind.NUMBER) {
      return lit;
    }
    BigInteger value = lit.numericValue();
    if (value.bitLength() < MIN_BITS ||
        value.bitLength() > dialect.getArithmetic().getBits()) {
      return lit;
    }
    Expression best = lit;
    BigInteger bestCost = meter.costs(lit);
    for (Expression candidate: candidates(value)) {
      BigInteger cost = meter.costs(candidate);
      if (cost.compareTo(bestCost) < 0) {
        best = candidate;
        bestCost = cost;
      }
    }
    if (best != lit) {
      replaced++;
      if (logger.isTraceEnabled()) {
        logger.trace("Replacing " + lit + " with " + best);
      }
    }
    return best;
  }

  /**
   * Expressions computing value, only using builtins the dialect has
   */
  private List<Expression> candidates(BigInteger value) {
    BigInteger mask = dialect.getArithmetic().mask();
    List<Expression> result = new ArrayList<Expression>();
    if (dialect.builtin("not") != null) {
      result.add(new FunctionCall("not",
                     Literal.number(mask.subtract(value))));
    }
    int shift = value.getLowestSetBit();
    if (shift >= MIN_SHIFT && dialect.builtin("shl") != null) {
      result.add(new FunctionCall("shl", Literal.number(shift),
                     Literal.number(value.shiftRight(shift))));
    }
    if (dialect.builtin("sub") != null) {
      // 0 - c wraps around to value
      BigInteger negated = mask.subtract(value).add(BigInteger.ONE);
      result.add(new FunctionCall("sub", Literal.zero(),
                                  Literal.number(negated)));
    }
    return result;
  }
}
