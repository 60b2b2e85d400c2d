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
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.common.util.HierarchicalMap;
import exm.yul.dialect.Dialect;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Case;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Rename declarations so that every variable and function name in the
 * program is declared exactly once.  Most steps rely on this.
 *
 * The first declaration of a name keeps it, so running this on its own
 * output changes nothing.  Input must be valid code: lookups follow
 * the scoping rules and assume no shadowing.
 */
public class Disambiguator {
  private final Logger logger;
  private final NameDispenser dispenser;
  /** Names already claimed by a visited declaration */
  private final Set<String> claimed = new HashSet<String>();
  private int renamed = 0;

  private Disambiguator(Logger logger, Dialect dialect, Block ast,
                        Set<String> reserved) {
    this.logger = logger;
    this.dispenser = new NameDispenser(dialect, ast, reserved);
  }

  /**
   * Rename in place
   * @param reserved names that must not be used for renamed declarations
   * @return number of declarations renamed
   */
  public static int run(Logger logger, Dialect dialect, Block ast,
                        Set<String> reserved) {
    Disambiguator d = new Disambiguator(logger, dialect, ast, reserved);
    d.visitBlock(ast, new HierarchicalMap<String, String>(), true);
    if (logger.isDebugEnabled()) {
      logger.debug("Disambiguator renamed " + d.renamed + " declarations");
    }
    return d.renamed;
  }

  /**
   * @param newScope if false, declarations go into the scope passed in
   */
  private void visitBlock(Block block, HierarchicalMap<String, String> scope,
                          boolean newScope) {
    HierarchicalMap<String, String> blockScope =
                            newScope ? scope.makeChildMap() : scope;
    // Functions are visible throughout their block
    for (Statement stmt: block.getStatements()) {
      if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
        FunctionDefinition def = (FunctionDefinition)stmt;
        def.setName(declare(blockScope, def.getName()));
      }
    }
    for (Statement stmt: block.getStatements()) {
      visitStatement(stmt, blockScope);
    }
  }

  private void visitStatement(Statement stmt,
                              HierarchicalMap<String, String> scope) {
    switch (stmt.getType()) {
      case BLOCK:
        visitBlock((Block)stmt, scope, true);
        break;
      case EXPRESSION_STATEMENT:
        visitExpression(((ExpressionStatement)stmt).getExpression(), scope);
        break;
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        // Value is evaluated before the variables come into scope
        if (decl.getValue() != null) {
          visitExpression(decl.getValue(), scope);
        }
        declareAll(scope, decl.getVariables());
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        visitExpression(assign.getValue(), scope);
        List<String> vars = assign.getVariableNames();
        for (int i = 0; i < vars.size(); i++) {
          vars.set(i, lookup(scope, vars.get(i)));
        }
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        visitExpression(ifStmt.getCondition(), scope);
        visitBlock(ifStmt.getBody(), scope, true);
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        visitExpression(sw.getExpression(), scope);
        for (Case c: sw.getCases()) {
          visitBlock(c.getBody(), scope, true);
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        HierarchicalMap<String, String> loopScope = scope.makeChildMap();
        visitBlock(loop.getPre(), loopScope, false);
        visitExpression(loop.getCondition(), loopScope);
        visitBlock(loop.getBody(), loopScope, true);
        visitBlock(loop.getPost(), loopScope, true);
        break;
      }
      case FUNCTION_DEFINITION: {
        FunctionDefinition def = (FunctionDefinition)stmt;
        HierarchicalMap<String, String> fnScope = scope.makeChildMap();
        declareAll(fnScope, def.getParameters());
        declareAll(fnScope, def.getReturnVariables());
        visitBlock(def.getBody(), fnScope, false);
        break;
      }
      case BREAK:
      case CONTINUE:
      case LEAVE:
        break;
      default:
        throw new YulRuntimeError("Unknown statement type " + stmt.getType());
    }
  }

  private void visitExpression(Expression expr,
                               HierarchicalMap<String, String> scope) {
    if (expr.getType() == ExpressionType.IDENTIFIER) {
      Identifier id = (Identifier)expr;
      id.setName(lookup(scope, id.getName()));
    } else if (expr.getType() == ExpressionType.FUNCTION_CALL) {
      FunctionCall call = (FunctionCall)expr;
      call.setFunctionName(lookup(scope, call.getFunctionName()));
      for (Expression arg: call.getArguments()) {
        visitExpression(arg, scope);
      }
    }
  }

  private void declareAll(HierarchicalMap<String, String> scope,
                          List<String> names) {
    for (int i = 0; i < names.size(); i++) {
      names.set(i, declare(scope, names.get(i)));
    }
  }

  /**
   * @return name to use for declaration
   */
  private String declare(HierarchicalMap<String, String> scope, String name) {
    String newName;
    if (claimed.add(name)) {
      newName = name;
    } else {
      newName = dispenser.newName(name);
      claimed.add(newName);
      renamed++;
      if (logger.isTraceEnabled()) {
        logger.trace("Renamed declaration " + name + " to " + newName);
      }
    }
    scope.put(name, newName);
    return newName;
  }

  /**
   * Names not declared anywhere in scope (builtins, external names) are
   * left alone
   */
  private static String lookup(HierarchicalMap<String, String> scope,
                               String name) {
    String newName = scope.get(name);
    return newName == null ? name : newName;
  }
}
