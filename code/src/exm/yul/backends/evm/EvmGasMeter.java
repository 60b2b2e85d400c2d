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
import java.util.HashMap;
import java.util.Map;

import exm.yul.dialect.GasMeter;
import exm.yul.tree.Expression;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Literal;

/**
 * Rough EVM cost model: gas to evaluate an expression, weighted by the
 * expected number of runs, plus the cost of the bytes it adds to the
 * deployed code.
 */
public class EvmGasMeter implements GasMeter {
  /** Gas per byte of transaction data when deploying */
  private static final long CREATION_BYTE_GAS = 16;
  /** Gas per byte of stored code */
  private static final long RUNTIME_BYTE_GAS = 200;

  private static final long VERY_LOW_GAS = 3;
  /** Call to a user function: jumps and stack shuffling */
  private static final long FUNCTION_CALL_GAS = 30;

  private static final Map<String, Long> instructionGas =
                                          new HashMap<String, Long>();
  static {
    instructionGas.put("mul", 5L);
    instructionGas.put("div", 5L);
    instructionGas.put("mod", 5L);
    instructionGas.put("address", 2L);
    instructionGas.put("caller", 2L);
    instructionGas.put("callvalue", 2L);
    instructionGas.put("calldatasize", 2L);
    instructionGas.put("gas", 2L);
    instructionGas.put("sload", 800L);
    instructionGas.put("sstore", 20000L);
    instructionGas.put("call", 700L);
  }

  private final long runs;
  private final boolean creation;

  /**
   * @param runs expected number of times the code runs
   * @param creation true if the code only runs at creation time
   */
  public EvmGasMeter(long runs, boolean creation) {
    this.runs = runs;
    this.creation = creation;
  }

  @Override
  public BigInteger costs(Expression expression) {
    long byteGas = creation ? CREATION_BYTE_GAS : RUNTIME_BYTE_GAS;
    return BigInteger.valueOf(runs).multiply(BigInteger.valueOf(
                                              runtimeGas(expression)))
           .add(BigInteger.valueOf(codeBytes(expression) * byteGas));
  }

  long runtimeGas(Expression expr) {
    switch (expr.getType()) {
      case LITERAL:
      case IDENTIFIER:
        // PUSH or DUP
        return VERY_LOW_GAS;
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        long gas = callGas(call.getFunctionName());
        for (Expression arg: call.getArguments()) {
          gas += runtimeGas(arg);
        }
        return gas;
      }
      default:
        throw new IllegalArgumentException("Unexpected expression " + expr);
    }
  }

  long codeBytes(Expression expr) {
    switch (expr.getType()) {
      case LITERAL:
        return 1 + literalBytes((Literal)expr);
      case IDENTIFIER:
        return 1;
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        long bytes = EvmDialect.instance().builtin(call.getFunctionName())
                       != null ? 1 : 4;
        for (Expression arg: call.getArguments()) {
          bytes += codeBytes(arg);
        }
        return bytes;
      }
      default:
        throw new IllegalArgumentException("Unexpected expression " + expr);
    }
  }

  private static long callGas(String fname) {
    if (EvmDialect.instance().builtin(fname) == null) {
      return FUNCTION_CALL_GAS;
    }
    Long gas = instructionGas.get(fname);
    return gas != null ? gas : VERY_LOW_GAS;
  }

  private static long literalBytes(Literal lit) {
    BigInteger value = lit.numericValue();
    if (value == null) {
      // String literals are pushed as one word
      return 32;
    }
    return Math.max(1, (value.bitLength() + 7) / 8);
  }
}
