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

import java.math.BigInteger;

import exm.yul.common.exceptions.YulRuntimeError;

public class Literal extends Expression {

  public static enum LiteralKind {
    NUMBER,
    BOOLEAN,
    STRING,
  }

  /* Numbers above this are printed in hex */
  private static final int MAX_DECIMAL_BITS = 32;

  private final LiteralKind kind;
  private final String value;

  public Literal(LiteralKind kind, String value) {
    this.kind = kind;
    this.value = value;
  }

  public static Literal number(long value) {
    return number(BigInteger.valueOf(value));
  }

  public static Literal number(BigInteger value) {
    if (value.signum() < 0) {
      throw new YulRuntimeError("Negative literal " + value);
    }
    if (value.bitLength() <= MAX_DECIMAL_BITS) {
      return new Literal(LiteralKind.NUMBER, value.toString());
    }
    return new Literal(LiteralKind.NUMBER, "0x" + value.toString(16));
  }

  public static Literal zero() {
    return number(0);
  }

  @Override
  public ExpressionType getType() {
    return ExpressionType.LITERAL;
  }

  public LiteralKind getKind() {
    return kind;
  }

  /**
   * @return raw text of literal; strings are unquoted
   */
  public String getValue() {
    return value;
  }

  /**
   * @return numeric value, or null for string literals
   */
  public BigInteger numericValue() {
    switch (kind) {
      case NUMBER:
        if (value.startsWith("0x")) {
          return new BigInteger(value.substring(2), 16);
        }
        return new BigInteger(value);
      case BOOLEAN:
        return value.equals("true") ? BigInteger.ONE : BigInteger.ZERO;
      default:
        return null;
    }
  }

  /**
   * @return true if value is known to be non-zero, false if known to be
   *    zero, null if unknown
   */
  public Boolean truthValue() {
    BigInteger v = numericValue();
    if (v == null) {
      return null;
    }
    return v.signum() != 0;
  }

  /**
   * Value equality: 0x10 equals 16
   */
  public boolean valueEquals(Literal other) {
    BigInteger v1 = numericValue();
    BigInteger v2 = other.numericValue();
    if (v1 == null || v2 == null) {
      return kind == other.kind && value.equals(other.value);
    }
    return v1.equals(v2);
  }

  @Override
  public void appendTo(StringBuilder sb, int indent) {
    if (kind == LiteralKind.STRING) {
      sb.append('"');
      sb.append(value);
      sb.append('"');
    } else {
      sb.append(value);
    }
  }

  @Override
  public Literal copy() {
    return new Literal(kind, value);
  }
}
