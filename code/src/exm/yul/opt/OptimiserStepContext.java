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
package exm.yul.opt;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import exm.yul.dialect.Dialect;

/**
 * State shared by all steps during one optimiser run
 */
public class OptimiserStepContext {
  private final Dialect dialect;
  private final NameDispenser dispenser;
  private final Set<String> reservedIdentifiers;

  public OptimiserStepContext(Dialect dialect, NameDispenser dispenser,
                              Set<String> reservedIdentifiers) {
    this.dialect = dialect;
    this.dispenser = dispenser;
    this.reservedIdentifiers = Collections.unmodifiableSet(
                                  new TreeSet<String>(reservedIdentifiers));
  }

  public Dialect getDialect() {
    return dialect;
  }

  public NameDispenser getDispenser() {
    return dispenser;
  }

  /**
   * @return names that must not be renamed or removed
   */
  public Set<String> getReservedIdentifiers() {
    return reservedIdentifiers;
  }

  public boolean isReserved(String name) {
    return reservedIdentifiers.contains(name);
  }
}
