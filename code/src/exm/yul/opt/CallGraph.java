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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;

/**
 * Which user-defined functions call which.  Code outside of any function
 * is attributed to {@link #MAIN}, which can't clash with a function name.
 */
public class CallGraph {
  public static final String MAIN = "";

  /** Function a calls function b */
  private final SetMultimap<String, String> calls =
                              LinkedHashMultimap.create();
  private final Set<String> functions = new HashSet<String>();

  private CallGraph() {
  }

  public static CallGraph build(Block ast) {
    CallGraph graph = new CallGraph();
    graph.functions.addAll(NameCollector.functions(ast).keySet());
    graph.addCalls(MAIN, ast);
    return graph;
  }

  /**
   * Record calls made directly in code, descending into nested
   * function definitions separately
   */
  private void addCalls(final String caller, Statement code) {
    TreeWalk.walk(code, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
          FunctionDefinition def = (FunctionDefinition)stmt;
          addCalls(def.getName(), def.getBody());
        }
      }

      @Override
      public void visit(Expression expr) {
        if (expr.getType() == ExpressionType.FUNCTION_CALL) {
          String callee = ((FunctionCall)expr).getFunctionName();
          if (functions.contains(callee)) {
            calls.put(caller, callee);
          }
        }
      }
    }, false);
  }

  /**
   * @return user functions called directly by function
   */
  public Set<String> callees(String function) {
    return calls.get(function);
  }

  /**
   * @return functions reachable from the roots, including roots
   */
  public Set<String> reachableFrom(Collection<String> roots) {
    Set<String> reached = new HashSet<String>();
    Deque<String> stack = new ArrayDeque<String>(roots);
    while (!stack.isEmpty()) {
      String fn = stack.pop();
      if (reached.add(fn)) {
        stack.addAll(calls.get(fn));
      }
    }
    return reached;
  }

  /**
   * @return functions that can call themselves, directly or indirectly
   */
  public Set<String> recursiveFunctions() {
    Set<String> recursive = new HashSet<String>();
    for (String fn: functions) {
      Set<String> reached = reachableFrom(calls.get(fn));
      if (reached.contains(fn)) {
        recursive.add(fn);
      }
    }
    return recursive;
  }
}
