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
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.dialect.BuiltinFunction.Property;
import exm.yul.dialect.BuiltinFunction.StorageRole;

/**
 * Describes a target: its builtin functions, the word size, and the
 * finishing step the optimiser applies for it.
 */
public abstract class Dialect {
  private final String name;
  private final WordArithmetic arithmetic;
  private final TreeMap<String, BuiltinFunction> builtins =
                            new TreeMap<String, BuiltinFunction>();

  protected Dialect(String name, int wordBits) {
    this.name = name;
    this.arithmetic = new WordArithmetic(wordBits);
  }

  public String getName() {
    return name;
  }

  public abstract FinishingStep getFinishingStep();

  /**
   * @return builtin used to discard a value, null if none
   */
  public abstract String discardFunction();

  /**
   * @return builtin testing two words for equality, null if none
   */
  public abstract String equalityFunction();

  /**
   * @return builtin returning 1 for zero and 0 otherwise, null if none
   */
  public abstract String booleanNegationFunction();

  /**
   * @return max number of variables a function can keep on stack
   */
  public int stackLimit() {
    return Integer.MAX_VALUE;
  }

  protected void addBuiltin(String fname, int params, int returns,
      StorageRole role, String operation, Property... props) {
    Set<Property> propSet = props.length == 0 ?
          EnumSet.noneOf(Property.class) : EnumSet.of(props[0], props);
    BuiltinFunction fn = new BuiltinFunction(fname, params, returns,
                                              propSet, role, operation);
    if (builtins.put(fname, fn) != null) {
      throw new YulRuntimeError("Builtin " + fname + " defined twice in " +
                                name);
    }
  }

  /**
   * Movable builtin with a word operation for constant folding
   */
  protected void addOperation(String fname, int params, String operation) {
    addBuiltin(fname, params, 1, StorageRole.NONE, operation,
               Property.MOVABLE);
  }

  /**
   * @return builtin or null if not a builtin
   */
  public BuiltinFunction builtin(String fname) {
    return builtins.get(fname);
  }

  /**
   * Names that programs may not declare: all builtins
   */
  public Set<String> fixedFunctionNames() {
    return Collections.unmodifiableSet(builtins.keySet());
  }

  public WordArithmetic getArithmetic() {
    return arithmetic;
  }

  /**
   * Evaluate builtin call with constant arguments
   * @return value or null if not foldable
   */
  public BigInteger evaluate(String fname, List<BigInteger> args) {
    BuiltinFunction fn = builtin(fname);
    if (fn == null || fn.getOperation() == null) {
      return null;
    }
    for (BigInteger arg: args) {
      if (arg.signum() < 0 || arg.bitLength() > arithmetic.getBits()) {
        return null;
      }
    }
    return arithmetic.evaluate(fn.getOperation(), args);
  }

  @Override
  public String toString() {
    return name;
  }
}
