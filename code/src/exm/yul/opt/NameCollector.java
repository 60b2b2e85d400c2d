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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.yul.tree.Assignment;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.Node;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;

/**
 * Collect names declared, assigned or referenced somewhere under a node.
 * These rely on names being unique when used on disambiguated code.
 */
public class NameCollector {

  /**
   * @return every name declared or referenced, including called functions
   */
  public static Set<String> allNames(Node node) {
    final Set<String> names = new HashSet<String>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        names.addAll(declaredNames(stmt));
        if (stmt.getType() == StatementType.ASSIGNMENT) {
          names.addAll(((Assignment)stmt).getVariableNames());
        }
      }

      @Override
      public void visit(Expression expr) {
        if (expr.getType() == ExpressionType.IDENTIFIER) {
          names.add(((Identifier)expr).getName());
        } else if (expr.getType() == ExpressionType.FUNCTION_CALL) {
          names.add(((FunctionCall)expr).getFunctionName());
        }
      }
    });
    return names;
  }

  /**
   * Names declared directly by a statement, not by nested statements
   */
  public static List<String> declaredNames(Statement stmt) {
    List<String> names = new ArrayList<String>();
    if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
      names.addAll(((VariableDeclaration)stmt).getVariables());
    } else if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
      FunctionDefinition def = (FunctionDefinition)stmt;
      names.add(def.getName());
      names.addAll(def.getParameters());
      names.addAll(def.getReturnVariables());
    }
    return names;
  }

  /**
   * @return variables declared anywhere under node, including parameters
   *        and return variables
   */
  public static Set<String> declaredVariables(Node node) {
    final Set<String> names = new HashSet<String>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
          names.addAll(((VariableDeclaration)stmt).getVariables());
        } else if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
          FunctionDefinition def = (FunctionDefinition)stmt;
          names.addAll(def.getParameters());
          names.addAll(def.getReturnVariables());
        }
      }
    });
    return names;
  }

  /**
   * @return variables that are target of an assignment (not declaration)
   */
  public static Set<String> assignedVariables(Node node) {
    final Set<String> names = new HashSet<String>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.ASSIGNMENT) {
          names.addAll(((Assignment)stmt).getVariableNames());
        }
      }
    });
    return names;
  }

  /**
   * @return variables read by an expression
   */
  public static Set<String> referencedVariables(Node node) {
    final Set<String> names = new HashSet<String>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Expression expr) {
        if (expr.getType() == ExpressionType.IDENTIFIER) {
          names.add(((Identifier)expr).getName());
        }
      }
    });
    return names;
  }

  /**
   * Count references to each variable and each function.  Declarations
   * are not references.
   */
  public static Map<String, Integer> referenceCounts(Node node) {
    final Map<String, Integer> counts = new HashMap<String, Integer>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Expression expr) {
        String name;
        if (expr.getType() == ExpressionType.IDENTIFIER) {
          name = ((Identifier)expr).getName();
        } else if (expr.getType() == ExpressionType.FUNCTION_CALL) {
          name = ((FunctionCall)expr).getFunctionName();
        } else {
          return;
        }
        Integer c = counts.get(name);
        counts.put(name, c == null ? 1 : c + 1);
      }
    });
    return counts;
  }

  public static int referenceCount(Map<String, Integer> counts, String name) {
    Integer c = counts.get(name);
    return c == null ? 0 : c;
  }

  /**
   * @return all function definitions under node by name, in tree order
   */
  public static Map<String, FunctionDefinition> functions(Node node) {
    final Map<String, FunctionDefinition> functions =
                    new LinkedHashMap<String, FunctionDefinition>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
          FunctionDefinition def = (FunctionDefinition)stmt;
          functions.put(def.getName(), def);
        }
      }
    });
    return functions;
  }
}
