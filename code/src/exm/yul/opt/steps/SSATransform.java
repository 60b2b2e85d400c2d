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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.DataFlowAnalyzer;
import exm.yul.opt.NameCollector;
import exm.yul.opt.NameDispenser;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.VariableDeclaration;

/**
 * Move towards single assignment form.  Every computed value assigned
 * to a reassigned variable first goes into a fresh variable:
 * <code>a := e</code> becomes <code>let a_1 := e a := a_1</code>.
 * References to <code>a</code> that are known to see the value of
 * <code>a_1</code> are then replaced by <code>a_1</code>.
 */
public class SSATransform implements OptimiserStep {

  @Override
  public String getStepName() {
    return "SSATransform";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    Set<String> assigned = NameCollector.assignedVariables(ast);
    if (assigned.isEmpty()) {
      return;
    }
    NameDispenser dispenser = context.getDispenser();
    for (Block block: OptUtil.allBlocks(ast)) {
      List<Statement> result = new ArrayList<Statement>();
      boolean changed = false;
      for (Statement stmt: block.getStatements()) {
        if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
          changed |= introduceDeclaration(dispenser, assigned,
                                    (VariableDeclaration)stmt, result);
        } else if (stmt.getType() == StatementType.ASSIGNMENT &&
            !OptUtil.isIdentifierOrLiteral(((Assignment)stmt).getValue())) {
          introduceAssignment(dispenser, (Assignment)stmt, result);
          changed = true;
        } else {
          result.add(stmt);
        }
      }
      if (changed) {
        block.replaceStatements(result);
      }
    }

    new ReferenceReplacer(context.getDialect(), assigned).run(ast);
  }

  /**
   * <code>let a := e</code> to <code>let a_1 := e let a := a_1</code>
   * @return true if changed
   */
  private static boolean introduceDeclaration(NameDispenser dispenser,
          Set<String> assigned, VariableDeclaration decl,
          List<Statement> result) {
    result.add(decl);
    // Copies of variables and constants need no fresh variable
    if (decl.getValue() == null ||
        OptUtil.isIdentifierOrLiteral(decl.getValue())) {
      return false;
    }
    boolean changed = false;
    List<String> vars = decl.getVariables();
    for (int i = 0; i < vars.size(); i++) {
      String var = vars.get(i);
      if (assigned.contains(var)) {
        String fresh = dispenser.newName(var);
        vars.set(i, fresh);
        result.add(new VariableDeclaration(var, new Identifier(fresh)));
        changed = true;
      }
    }
    return changed;
  }

  /**
   * <code>a := e</code> to <code>let a_1 := e a := a_1</code>
   */
  private static void introduceAssignment(NameDispenser dispenser,
          Assignment assign, List<Statement> result) {
    List<String> fresh = new ArrayList<String>();
    for (String var: assign.getVariableNames()) {
      fresh.add(dispenser.newName(var));
    }
    result.add(new VariableDeclaration(fresh, assign.getValue()));
    for (int i = 0; i < fresh.size(); i++) {
      result.add(new Assignment(assign.getVariableNames().get(i),
                                new Identifier(fresh.get(i))));
    }
  }

  /**
   * Replace references to reassigned variables by the fresh variable
   * they currently equal
   */
  private static class ReferenceReplacer extends DataFlowAnalyzer {
    private final Set<String> assigned;

    ReferenceReplacer(Dialect dialect, Set<String> assigned) {
      super(dialect);
      this.assigned = assigned;
    }

    @Override
    protected Expression visitExpression(Expression expr) {
      Expression visited = super.visitExpression(expr);
      if (visited.getType() != ExpressionType.IDENTIFIER) {
        return visited;
      }
      String name = ((Identifier)visited).getName();
      if (!assigned.contains(name)) {
        return visited;
      }
      Expression value = valueOf(name);
      if (value != null && value.getType() == ExpressionType.IDENTIFIER) {
        return value.copy();
      }
      return visited;
    }
  }
}
