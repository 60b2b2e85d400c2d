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
package exm.yul.dialect;

import java.math.BigInteger;
import java.util.List;

/**
 * Evaluation of word operations on unsigned integers of fixed width,
 * used for constant folding.
 */
public class WordArithmetic {
  private final int bits;
  private final BigInteger modulus;

  public WordArithmetic(int bits) {
    this.bits = bits;
    this.modulus = BigInteger.ONE.shiftLeft(bits);
  }

  public int getBits() {
    return bits;
  }

  public BigInteger mask() {
    return modulus.subtract(BigInteger.ONE);
  }

  /**
   * @param op operation name as in {@link BuiltinFunction#getOperation()}
   * @param args argument values, all in range
   * @return result or null if not known
   */
  public BigInteger evaluate(String op, List<BigInteger> args) {
    if (op.equals("not") || op.equals("iszero")) {
      if (args.size() != 1) {
        return null;
      }
      BigInteger a = args.get(0);
      if (op.equals("not")) {
        return mask().subtract(a);
      }
      return bool(a.signum() == 0);
    }

    if (args.size() != 2) {
      return null;
    }
    BigInteger a = args.get(0);
    BigInteger b = args.get(1);
    if (op.equals("add")) {
      return a.add(b).mod(modulus);
    } else if (op.equals("sub")) {
      return a.subtract(b).mod(modulus);
    } else if (op.equals("mul")) {
      return a.multiply(b).mod(modulus);
    } else if (op.equals("div")) {
      return b.signum() == 0 ? BigInteger.ZERO : a.divide(b);
    } else if (op.equals("mod")) {
      return b.signum() == 0 ? BigInteger.ZERO : a.mod(b);
    } else if (op.equals("lt")) {
      return bool(a.compareTo(b) < 0);
    } else if (op.equals("gt")) {
      return bool(a.compareTo(b) > 0);
    } else if (op.equals("eq")) {
      return bool(a.equals(b));
    } else if (op.equals("and")) {
      return a.and(b);
    } else if (op.equals("or")) {
      return a.or(b);
    } else if (op.equals("xor")) {
      return a.xor(b);
    } else if (op.equals("shl")) {
      // shift amount first
      if (a.compareTo(BigInteger.valueOf(bits)) >= 0) {
        return BigInteger.ZERO;
      }
      return b.shiftLeft(a.intValue()).mod(modulus);
    } else if (op.equals("shr")) {
      if (a.compareTo(BigInteger.valueOf(bits)) >= 0) {
        return BigInteger.ZERO;
      }
      return b.shiftRight(a.intValue());
    }
    return null;
  }

  private static BigInteger bool(boolean b) {
    return b ? BigInteger.ONE : BigInteger.ZERO;
  }
}
