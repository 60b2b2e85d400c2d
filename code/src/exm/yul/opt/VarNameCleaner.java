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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import exm.yul.tree.Block;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;

/**
 * Give variables short readable names again once optimisation is done:
 * numeric suffixes are stripped and the shortest free name is chosen,
 * separately for the main code and for each function.
 *
 * Names are only unique per function afterwards, so this can't be a
 * registered step.
 */
public class VarNameCleaner {
  private static final Pattern NUMERIC_SUFFIX = Pattern.compile("(_[0-9]+)+$");

  public static void run(Logger logger, OptimiserStepContext context,
                         Block ast) {
    Set<String> blacklist = new HashSet<String>(
                              context.getReservedIdentifiers());
    blacklist.addAll(context.getDialect().fixedFunctionNames());
    Map<String, FunctionDefinition> functions = NameCollector.functions(ast);
    blacklist.addAll(functions.keySet());

    cleanScope(logger, context, blacklist, new ArrayList<String>(), ast);
    for (FunctionDefinition def: functions.values()) {
      List<String> params = new ArrayList<String>(def.getParameters());
      params.addAll(def.getReturnVariables());
      Map<String, String> renames = cleanScope(logger, context, blacklist,
                                               params, def.getBody());
      NameSubstitution.renameAll(def.getParameters(), renames);
      NameSubstitution.renameAll(def.getReturnVariables(), renames);
    }
  }

  /**
   * Rename variables declared in code
   * @param params variables declared by the enclosing function
   * @return renames applied
   */
  private static Map<String, String> cleanScope(Logger logger, OptimiserStepContext context,
          Set<String> blacklist, List<String> params, Block code) {
    List<String> declared = new ArrayList<String>(params);
    declared.addAll(declaredInScope(code));

    Set<String> taken = new HashSet<String>();
    Map<String, String> renames = new HashMap<String, String>();
    // Reserved names keep their names
    for (String name: declared) {
      if (context.isReserved(name)) {
        taken.add(name);
      }
    }
    for (String name: declared) {
      if (context.isReserved(name)) {
        continue;
      }
      String newName = findCleanName(name, blacklist, taken);
      taken.add(newName);
      if (!newName.equals(name)) {
        renames.put(name, newName);
      }
    }
    if (logger.isTraceEnabled() && !renames.isEmpty()) {
      logger.trace("Cleaned names: " + renames);
    }
    NameSubstitution.rename(code, renames, false);
    return renames;
  }

  private static String findCleanName(String name, Set<String> blacklist,
                                      Set<String> taken) {
    String base = NUMERIC_SUFFIX.matcher(name).replaceFirst("");
    if (base.isEmpty()) {
      base = name;
    }
    String candidate = base;
    int suffix = 0;
    while (blacklist.contains(candidate) || taken.contains(candidate)) {
      suffix++;
      candidate = base + "_" + suffix;
    }
    return candidate;
  }

  /**
   * Variables declared in code, not looking into nested functions
   */
  private static List<String> declaredInScope(Block code) {
    final List<String> names = new ArrayList<String>();
    TreeWalk.walk(code, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
          names.addAll(((VariableDeclaration)stmt).getVariables());
        }
      }
    }, false);
    return names;
  }
}
