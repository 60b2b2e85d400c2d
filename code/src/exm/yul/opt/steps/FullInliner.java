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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.common.Settings;
import exm.yul.common.exceptions.InvalidOptionException;
import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.opt.CallGraph;
import exm.yul.opt.CodeSize;
import exm.yul.opt.NameCollector;
import exm.yul.opt.NameDispenser;
import exm.yul.opt.NameSubstitution;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.TreeWalk;
import exm.yul.tree.TreeWalk.TreeWalker;
import exm.yul.tree.VariableDeclaration;

/**
 * Replace calls of small functions, and of functions called only once,
 * by a renamed copy of the function body.
 *
 * Handles calls that make up a whole statement: <code>f(a)</code>,
 * <code>let x := f(a)</code> and <code>x := f(a)</code>, with variables
 * or literals as arguments.  Recursive functions, functions using
 * <code>leave</code> and functions containing function definitions are
 * never inlined.
 */
public class FullInliner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "FullInliner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    long threshold;
    try {
      threshold = Settings.getLong(Settings.OPT_FULL_INLINE_THRESHOLD);
    } catch (InvalidOptionException ex) {
      throw new YulRuntimeError(ex.getMessage(), ex);
    }

    Map<String, FunctionDefinition> candidates = findCandidates(context,
                                                      ast, threshold);
    if (candidates.isEmpty()) {
      return;
    }
    Set<Block> loopInits = OptUtil.loopInitBlocks(ast);
    NameDispenser dispenser = context.getDispenser();
    int inlined = 0;
    // Blocks created by inlining are not searched again in this run
    for (Block block: OptUtil.allBlocks(ast)) {
      if (loopInits.contains(block)) {
        continue;
      }
      List<Statement> result = new ArrayList<Statement>();
      boolean changed = false;
      for (Statement stmt: block.getStatements()) {
        FunctionCall call = inlinableCall(stmt, candidates);
        if (call == null) {
          result.add(stmt);
        } else {
          FunctionDefinition def = candidates.get(call.getFunctionName());
          inline(dispenser, stmt, call, def, result);
          changed = true;
          inlined++;
        }
      }
      if (changed) {
        block.replaceStatements(result);
      }
    }
    if (logger.isDebugEnabled() && inlined > 0) {
      logger.debug("FullInliner inlined " + inlined + " calls");
    }
  }

  private static Map<String, FunctionDefinition> findCandidates(
        OptimiserStepContext context, Block ast, long threshold) {
    Map<String, FunctionDefinition> functions = NameCollector.functions(ast);
    Set<String> recursive = CallGraph.build(ast).recursiveFunctions();
    Map<String, Integer> refCounts = NameCollector.referenceCounts(ast);

    Map<String, FunctionDefinition> candidates =
                        new HashMap<String, FunctionDefinition>();
    for (FunctionDefinition def: functions.values()) {
      String name = def.getName();
      if (recursive.contains(name) || containsLeave(def.getBody()) ||
          !NameCollector.functions(def.getBody()).isEmpty()) {
        continue;
      }
      if (CodeSize.codeSize(def.getBody()) <= threshold ||
          NameCollector.referenceCount(refCounts, name) == 1) {
        candidates.put(name, def);
      }
    }
    return candidates;
  }

  /**
   * @return call if statement consists of an inlinable call
   */
  private static FunctionCall inlinableCall(Statement stmt,
                          Map<String, FunctionDefinition> candidates) {
    Expression expr;
    switch (stmt.getType()) {
      case EXPRESSION_STATEMENT:
        expr = ((ExpressionStatement)stmt).getExpression();
        break;
      case VARIABLE_DECLARATION:
        expr = ((VariableDeclaration)stmt).getValue();
        break;
      case ASSIGNMENT:
        expr = ((Assignment)stmt).getValue();
        break;
      default:
        return null;
    }
    if (expr == null || expr.getType() != ExpressionType.FUNCTION_CALL) {
      return null;
    }
    FunctionCall call = (FunctionCall)expr;
    if (!candidates.containsKey(call.getFunctionName())) {
      return null;
    }
    for (Expression arg: call.getArguments()) {
      if (!OptUtil.isIdentifierOrLiteral(arg)) {
        return null;
      }
    }
    return call;
  }

  private static void inline(NameDispenser dispenser, Statement stmt,
        FunctionCall call, FunctionDefinition def, List<Statement> out) {
    Map<String, String> renames = new HashMap<String, String>();
    for (String var: def.getParameters()) {
      renames.put(var, dispenser.newName(var));
    }
    for (String var: def.getReturnVariables()) {
      renames.put(var, dispenser.newName(var));
    }
    for (String var: NameCollector.declaredVariables(def.getBody())) {
      renames.put(var, dispenser.newName(var));
    }

    List<Expression> args = call.getArguments();
    for (int i = 0; i < args.size(); i++) {
      out.add(new VariableDeclaration(renames.get(def.getParameters().get(i)),
                                      args.get(i)));
    }
    for (String ret: def.getReturnVariables()) {
      out.add(new VariableDeclaration(renames.get(ret), Literal.zero()));
    }
    Block body = def.getBody().copy();
    NameSubstitution.rename(body, renames, true);
    out.add(body);

    List<String> rets = def.getReturnVariables();
    if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
      List<String> vars = ((VariableDeclaration)stmt).getVariables();
      for (int i = 0; i < vars.size(); i++) {
        out.add(new VariableDeclaration(vars.get(i),
                        new Identifier(renames.get(rets.get(i)))));
      }
    } else if (stmt.getType() == StatementType.ASSIGNMENT) {
      List<String> vars = ((Assignment)stmt).getVariableNames();
      for (int i = 0; i < vars.size(); i++) {
        out.add(new Assignment(vars.get(i),
                        new Identifier(renames.get(rets.get(i)))));
      }
    }
  }

  private static boolean containsLeave(Block body) {
    final boolean[] found = new boolean[] {false};
    TreeWalk.walk(body, new TreeWalker() {
      @Override
      public void visit(Statement stmt) {
        if (stmt.getType() == StatementType.LEAVE) {
          found[0] = true;
        }
      }
    });
    return found[0];
  }
}
