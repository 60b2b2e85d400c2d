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

import exm.yul.dialect.BuiltinFunction.Property;
import exm.yul.dialect.BuiltinFunction.StorageRole;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.FinishingStep;

/**
 * Dialect for the Ethereum virtual machine: 256 bit words, storage,
 * memory and a stack that can only reach 16 slots deep.
 */
public class EvmDialect extends Dialect {
  public static final int STACK_REACH = 16;

  private static final EvmDialect INSTANCE = new EvmDialect();

  public static EvmDialect instance() {
    return INSTANCE;
  }

  private EvmDialect() {
    super("evm", 256);
    addOperation("add", 2, "add");
    addOperation("sub", 2, "sub");
    addOperation("mul", 2, "mul");
    addOperation("div", 2, "div");
    addOperation("mod", 2, "mod");
    addOperation("lt", 2, "lt");
    addOperation("gt", 2, "gt");
    addOperation("eq", 2, "eq");
    addOperation("iszero", 1, "iszero");
    addOperation("and", 2, "and");
    addOperation("or", 2, "or");
    addOperation("xor", 2, "xor");
    addOperation("not", 1, "not");
    addOperation("shl", 2, "shl");
    addOperation("shr", 2, "shr");

    addBuiltin("calldataload", 1, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("calldatasize", 0, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("caller", 0, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("callvalue", 0, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("address", 0, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("pop", 1, 0, StorageRole.NONE, null, Property.MOVABLE);

    addBuiltin("gas", 0, 1, StorageRole.NONE, null, Property.SIDE_EFFECT_FREE);
    addBuiltin("mload", 1, 1, StorageRole.NONE, null,
               Property.SIDE_EFFECT_FREE);
    addBuiltin("sload", 1, 1, StorageRole.LOAD, null,
               Property.SIDE_EFFECT_FREE);

    addBuiltin("mstore", 2, 0, StorageRole.NONE, null,
               Property.WRITES_MEMORY_ONLY);
    addBuiltin("mstore8", 2, 0, StorageRole.NONE, null,
               Property.WRITES_MEMORY_ONLY);
    addBuiltin("sstore", 2, 0, StorageRole.STORE, null);
    addBuiltin("log0", 2, 0, StorageRole.NONE, null);
    addBuiltin("log1", 3, 0, StorageRole.NONE, null);
    addBuiltin("call", 7, 1, StorageRole.NONE, null);

    addBuiltin("return", 2, 0, StorageRole.NONE, null, Property.TERMINATES);
    addBuiltin("revert", 2, 0, StorageRole.NONE, null, Property.TERMINATES);
    addBuiltin("stop", 0, 0, StorageRole.NONE, null, Property.TERMINATES);
    addBuiltin("invalid", 0, 0, StorageRole.NONE, null, Property.TERMINATES);
  }

  @Override
  public FinishingStep getFinishingStep() {
    return FinishingStep.CONSTANT_OPTIMISER;
  }

  @Override
  public String discardFunction() {
    return "pop";
  }

  @Override
  public String equalityFunction() {
    return "eq";
  }

  @Override
  public String booleanNegationFunction() {
    return "iszero";
  }

  @Override
  public int stackLimit() {
    return STACK_REACH;
  }
}
