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
package exm.yul.opt.steps;

import java.util.Iterator;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.opt.Semantics;
import exm.yul.tree.Block;
import exm.yul.tree.ForLoop;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;

/**
 * Move declarations of movable values that don't depend on anything
 * changed by a loop from the loop body to the end of the loop
 * initialiser, so they are computed once.
 */
public class LoopInvariantCodeMotion implements OptimiserStep {

  @Override
  public String getStepName() {
    return "LoopInvariantCodeMotion";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    final Dialect dialect = context.getDialect();
    TreeWalk.walk(ast, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.FOR_LOOP) {
          hoist(dialect, (ForLoop)stmt);
        }
      }
    });
  }

  private static void hoist(Dialect dialect, ForLoop loop) {
    Set<String> assigned = NameCollector.assignedVariables(loop.getBody());
    assigned.addAll(NameCollector.assignedVariables(loop.getPost()));
    Set<String> declared = NameCollector.declaredVariables(loop.getBody());
    declared.addAll(NameCollector.declaredVariables(loop.getPost()));

    Iterator<Statement> it = loop.getBody().getStatements().iterator();
    while (it.hasNext()) {
      Statement stmt = it.next();
      if (stmt.getType() != StatementType.VARIABLE_DECLARATION) {
        continue;
      }
      VariableDeclaration decl = (VariableDeclaration)stmt;
      if (decl.getVariables().size() != 1 || decl.getValue() == null ||
          !Semantics.isMovable(dialect, decl.getValue())) {
        continue;
      }
      String var = decl.getVariables().get(0);
      if (assigned.contains(var) || !invariant(decl, assigned, declared)) {
        continue;
      }
      it.remove();
      loop.getPre().getStatements().add(decl);
      declared.remove(var);
    }
  }

  private static boolean invariant(VariableDeclaration decl,
                          Set<String> assigned, Set<String> declared) {
    for (String ref: NameCollector.referencedVariables(decl.getValue())) {
      if (assigned.contains(ref) || declared.contains(ref)) {
        return false;
      }
    }
    return true;
  }
}
