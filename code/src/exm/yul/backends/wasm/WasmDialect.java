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
package exm.yul.backends.wasm;

import exm.yul.dialect.BuiltinFunction.Property;
import exm.yul.dialect.BuiltinFunction.StorageRole;
import exm.yul.dialect.Dialect;
import exm.yul.dialect.FinishingStep;

/**
 * Dialect for WebAssembly modules: 64 bit words, locals instead of a
 * limited stack.
 */
public class WasmDialect extends Dialect {
  private static final WasmDialect INSTANCE = new WasmDialect();

  public static WasmDialect instance() {
    return INSTANCE;
  }

  private WasmDialect() {
    super("wasm", 64);
    addOperation("i64.add", 2, "add");
    addOperation("i64.sub", 2, "sub");
    addOperation("i64.mul", 2, "mul");
    addOperation("i64.div_u", 2, "div");
    addOperation("i64.rem_u", 2, "mod");
    addOperation("i64.lt_u", 2, "lt");
    addOperation("i64.gt_u", 2, "gt");
    addOperation("i64.eq", 2, "eq");
    addOperation("i64.eqz", 1, "iszero");
    addOperation("i64.and", 2, "and");
    addOperation("i64.or", 2, "or");
    addOperation("i64.xor", 2, "xor");
    // Operands are value then shift, unlike the word operations
    addBuiltin("i64.shl", 2, 1, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("i64.shr_u", 2, 1, StorageRole.NONE, null, Property.MOVABLE);

    addBuiltin("drop", 1, 0, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("i64.load", 1, 1, StorageRole.NONE, null,
               Property.SIDE_EFFECT_FREE);
    addBuiltin("i64.store", 2, 0, StorageRole.NONE, null,
               Property.WRITES_MEMORY_ONLY);
    addBuiltin("unreachable", 0, 0, StorageRole.NONE, null,
               Property.TERMINATES);
  }

  @Override
  public FinishingStep getFinishingStep() {
    return FinishingStep.REMOVE_EMPTY_PRELUDE;
  }

  @Override
  public String discardFunction() {
    return "drop";
  }

  @Override
  public String equalityFunction() {
    return "i64.eq";
  }

  @Override
  public String booleanNegationFunction() {
    return "i64.eqz";
  }
}
