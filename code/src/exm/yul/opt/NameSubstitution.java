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

import java.util.List;
import java.util.Map;

import exm.yul.tree.Assignment;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.Node;
import exm.yul.tree.Statement;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;

/**
 * Rename declarations and references according to a flat map.  Only
 * safe on code where the renamed names are unique.
 */
public class NameSubstitution {

  /**
   * @param enterFunctions if false, only the names of nested function
   *        definitions are renamed, not their parameters or bodies
   */
  public static void rename(Node node, final Map<String, String> renames,
                            final boolean enterFunctions) {
    if (renames.isEmpty()) {
      return;
    }
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        switch (stmt.getType()) {
          case VARIABLE_DECLARATION:
            renameAll(((VariableDeclaration)stmt).getVariables(), renames);
            break;
          case ASSIGNMENT:
            renameAll(((Assignment)stmt).getVariableNames(), renames);
            break;
          case FUNCTION_DEFINITION: {
            FunctionDefinition def = (FunctionDefinition)stmt;
            def.setName(renamed(def.getName(), renames));
            if (enterFunctions) {
              renameAll(def.getParameters(), renames);
              renameAll(def.getReturnVariables(), renames);
            }
            break;
          }
          default:
            break;
        }
      }

      @Override
      public void visit(Expression expr) {
        if (expr.getType() == ExpressionType.IDENTIFIER) {
          Identifier id = (Identifier)expr;
          id.setName(renamed(id.getName(), renames));
        } else if (expr.getType() == ExpressionType.FUNCTION_CALL) {
          FunctionCall call = (FunctionCall)expr;
          call.setFunctionName(renamed(call.getFunctionName(), renames));
        }
      }
    }, enterFunctions);
  }

  public static void renameAll(List<String> names,
                               Map<String, String> renames) {
    for (int i = 0; i < names.size(); i++) {
      names.set(i, renamed(names.get(i), renames));
    }
  }

  private static String renamed(String name, Map<String, String> renames) {
    String newName = renames.get(name);
    return newName == null ? name : newName;
  }
}
