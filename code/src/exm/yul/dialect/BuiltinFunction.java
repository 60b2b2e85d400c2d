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

import java.util.EnumSet;
import java.util.Set;

/**
 * Description of a function provided by the target.  Builtins can't be
 * renamed or redefined by programs.
 */
public class BuiltinFunction {

  public static enum Property {
    /** Can be freely moved, duplicated or removed: no side effects and
     *  no dependence on state */
    MOVABLE,
    /** Can be removed if unused, but may read state */
    SIDE_EFFECT_FREE,
    /** Never returns control to the caller */
    TERMINATES,
    /** Only writes memory, leaves storage intact */
    WRITES_MEMORY_ONLY,
  }

  /** Role in storage tracking of the load resolver */
  public static enum StorageRole {
    NONE,
    LOAD,
    STORE,
  }

  private final String name;
  private final int parameters;
  private final int returns;
  private final EnumSet<Property> properties;
  private final StorageRole storageRole;
  /** Name of word operation for constant folding, null if none */
  private final String operation;

  public BuiltinFunction(String name, int parameters, int returns,
        Set<Property> properties, StorageRole storageRole, String operation) {
    this.name = name;
    this.parameters = parameters;
    this.returns = returns;
    this.properties = properties.isEmpty() ? EnumSet.noneOf(Property.class)
                                           : EnumSet.copyOf(properties);
    if (this.properties.contains(Property.MOVABLE)) {
      this.properties.add(Property.SIDE_EFFECT_FREE);
    }
    this.storageRole = storageRole;
    this.operation = operation;
  }

  public String getName() {
    return name;
  }

  public int getParameterCount() {
    return parameters;
  }

  public int getReturnCount() {
    return returns;
  }

  public boolean isMovable() {
    return properties.contains(Property.MOVABLE);
  }

  public boolean isSideEffectFree() {
    return properties.contains(Property.SIDE_EFFECT_FREE);
  }

  public boolean terminates() {
    return properties.contains(Property.TERMINATES);
  }

  /**
   * @return true if calling this could change storage
   */
  public boolean invalidatesStorage() {
    return !isSideEffectFree() &&
           !properties.contains(Property.WRITES_MEMORY_ONLY) &&
           storageRole != StorageRole.STORE;
  }

  public StorageRole getStorageRole() {
    return storageRole;
  }

  public String getOperation() {
    return operation;
  }

  @Override
  public String toString() {
    return name + "/" + parameters + "->" + returns;
  }
}
