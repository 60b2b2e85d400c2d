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

import java.util.HashSet;
import java.util.Set;

import exm.yul.dialect.Dialect;
import exm.yul.tree.Node;

/**
 * Hands out names that are not used anywhere in the tree, not reserved
 * and not builtins.  Every name handed out is remembered as used.
 */
public class NameDispenser {
  private final Dialect dialect;
  private final Set<String> usedNames;
  private long counter = 0;

  public NameDispenser(Dialect dialect, Node ast, Set<String> reserved) {
    this.dialect = dialect;
    this.usedNames = new HashSet<String>(NameCollector.allNames(ast));
    this.usedNames.addAll(reserved);
  }

  /**
   * @param nameHint name to derive new name from
   * @return nameHint if free, otherwise nameHint_N for the next free N
   */
  public String newName(String nameHint) {
    String name = nameHint;
    while (illegalName(name)) {
      counter++;
      name = nameHint + "_" + counter;
    }
    usedNames.add(name);
    return name;
  }

  public boolean illegalName(String name) {
    return usedNames.contains(name) || dialect.builtin(name) != null;
  }
}
