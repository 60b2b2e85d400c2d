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

import exm.yul.dialect.BuiltinFunction.Property;
import exm.yul.dialect.BuiltinFunction.StorageRole;

/**
 * Minimal 256 bit dialect with arithmetic and an output builtin, for
 * targets that need no finishing step.
 */
public class PlainDialect extends Dialect {
  private static final PlainDialect INSTANCE = new PlainDialect();

  public static PlainDialect instance() {
    return INSTANCE;
  }

  private PlainDialect() {
    super("plain", 256);
    addOperation("add", 2, "add");
    addOperation("sub", 2, "sub");
    addOperation("mul", 2, "mul");
    addOperation("div", 2, "div");
    addOperation("lt", 2, "lt");
    addOperation("gt", 2, "gt");
    addOperation("eq", 2, "eq");
    addOperation("iszero", 1, "iszero");
    addOperation("not", 1, "not");
    addBuiltin("pop", 1, 0, StorageRole.NONE, null, Property.MOVABLE);
    addBuiltin("print", 1, 0, StorageRole.NONE, null);
    addBuiltin("input", 0, 1, StorageRole.NONE, null);
    addBuiltin("abort", 0, 0, StorageRole.NONE, null, Property.TERMINATES);
  }

  @Override
  public FinishingStep getFinishingStep() {
    return FinishingStep.NONE;
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
}
