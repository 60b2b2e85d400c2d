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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import exm.yul.dialect.Dialect;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.Node;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;

/**
 * Small helpers shared by optimiser steps
 */
public class OptUtil {

  /**
   * @return every block under node including node itself, outer blocks
   *        before inner blocks
   */
  public static List<Block> allBlocks(Node node) {
    final List<Block> blocks = new ArrayList<Block>();
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.BLOCK) {
          blocks.add((Block)stmt);
        }
      }
    });
    return blocks;
  }

  /**
   * Loop initialisers: variables declared there live on through the loop
   * @return identity set of initialiser blocks of all loops under node
   */
  public static Set<Block> loopInitBlocks(Node node) {
    final Set<Block> result = Collections.newSetFromMap(
                                  new IdentityHashMap<Block, Boolean>());
    TreeWalk.walk(node, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.FOR_LOOP) {
          result.add(((ForLoop)stmt).getPre());
        }
      }
    });
    return result;
  }

  public static boolean isIdentifierOrLiteral(Expression expr) {
    return expr.getType() == ExpressionType.IDENTIFIER ||
           expr.getType() == ExpressionType.LITERAL;
  }

  public static boolean isCallTo(Expression expr, String fname) {
    return fname != null && expr.getType() == ExpressionType.FUNCTION_CALL &&
           ((FunctionCall)expr).getFunctionName().equals(fname);
  }

  /**
   * Statements evaluating expr for its side effects and dropping the
   * value.
   * @return list with statement, empty if the expression can be dropped
   *        entirely, or null if the dialect can't discard values
   */
  public static List<Statement> discard(Dialect dialect, Expression expr) {
    List<Statement> result = new ArrayList<Statement>(1);
    if (Semantics.isSideEffectFree(dialect, expr)) {
      return result;
    }
    String discard = dialect.discardFunction();
    if (discard == null) {
      return null;
    }
    result.add(new ExpressionStatement(new FunctionCall(discard, expr)));
    return result;
  }
}
