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
package exm.yul.analysis;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.common.Logging;
import exm.yul.common.exceptions.InvalidCodeException;
import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.dialect.BuiltinFunction;
import exm.yul.dialect.Dialect;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Case;
import exm.yul.tree.Expression;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Literal;
import exm.yul.tree.Literal.LiteralKind;
import exm.yul.tree.Statement;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;
import exm.yul.tree.YulObject;
import exm.yul.tree.Statement.StatementType;

/**
 * Strict semantic analysis of a program tree:
 * - every identifier and function call resolves to a visible declaration
 * - argument and value counts match
 * - names are never redeclared while visible, and never clash with
 *   builtins
 * - break and continue only in loop bodies, leave only in functions
 */
public class AsmAnalyzer {
  private final Dialect dialect;
  private final List<String> errors = new ArrayList<String>();
  private final AnalysisInfo info = new AnalysisInfo();

  private Scope scope = null;
  private int loopDepth = 0;
  private boolean inFunction = false;

  public AsmAnalyzer(Dialect dialect) {
    this.dialect = dialect;
  }

  /**
   * Analyse user supplied code
   * @throws InvalidCodeException if any check fails
   */
  public static AnalysisInfo analyzeStrict(Dialect dialect, Block code,
                        String fileName) throws InvalidCodeException {
    AsmAnalyzer analyzer = new AsmAnalyzer(dialect);
    AnalysisInfo result = analyzer.analyze(code);
    if (!analyzer.getErrors().isEmpty()) {
      throw new InvalidCodeException(fileName, analyzer.getErrors());
    }
    return result;
  }

  /**
   * Analyse code that was produced by the compiler itself.  Any error
   * here is a bug in whatever produced the code.
   */
  public static AnalysisInfo analyzeStrictAssertCorrect(Dialect dialect,
                                                        YulObject object) {
    AsmAnalyzer analyzer = new AsmAnalyzer(dialect);
    AnalysisInfo result = analyzer.analyze(object.getCode());
    if (!analyzer.getErrors().isEmpty()) {
      Logger logger = Logging.getYoptLogger();
      logger.debug("Invalid code after optimisation:\n" + object.getCode());
      throw new YulRuntimeError("Invalid code in object " +
                object.getName() + ": " + analyzer.getErrors());
    }
    return result;
  }

  public List<String> getErrors() {
    return errors;
  }

  public AnalysisInfo analyze(Block code) {
    visitBlock(code);
    return info;
  }

  private void error(String msg) {
    errors.add(msg);
  }

  private void visitBlock(Block block) {
    scope = new Scope(scope, false);
    // Functions are visible in the whole block
    for (Statement stmt: block.getStatements()) {
      if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
        FunctionDefinition def = (FunctionDefinition)stmt;
        declare(def.getName(), new Declaration(def.getParameters().size(),
                                       def.getReturnVariables().size()));
        info.addFunction(def.getName(), def.getParameters().size(),
                         def.getReturnVariables().size());
      }
    }
    visitStatements(block.getStatements());
    scope = scope.parent;
  }

  private void visitStatements(List<Statement> stmts) {
    for (Statement stmt: stmts) {
      visitStatement(stmt);
    }
  }

  private void visitStatement(Statement stmt) {
    switch (stmt.getType()) {
      case BLOCK:
        visitBlock((Block)stmt);
        break;
      case EXPRESSION_STATEMENT: {
        Expression expr = ((ExpressionStatement)stmt).getExpression();
        int values = visitExpression(expr);
        if (values != 0 && values != -1) {
          error("Top-level expression " + expr + " returns " + values +
                " value(s), must not return any");
        }
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getValue() != null) {
          expectValues(decl.getValue(), decl.getVariables().size());
        }
        for (String var: decl.getVariables()) {
          declareVariable(var);
        }
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        Set<String> seen = new HashSet<String>();
        for (String var: assign.getVariableNames()) {
          if (!seen.add(var)) {
            error("Variable " + var + " occurs multiple times on the " +
                  "left-hand side of an assignment");
          }
          Declaration d = scope.lookup(var);
          if (d == null) {
            error("Assignment to undeclared variable " + var);
          } else if (d.isFunction()) {
            error("Assignment to function " + var);
          }
        }
        expectValues(assign.getValue(), assign.getVariableNames().size());
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        expectValues(ifStmt.getCondition(), 1);
        visitBlock(ifStmt.getBody());
        break;
      }
      case SWITCH:
        visitSwitch((Switch)stmt);
        break;
      case FOR_LOOP:
        visitForLoop((ForLoop)stmt);
        break;
      case BREAK:
      case CONTINUE:
        if (loopDepth == 0) {
          error(stmt.getType().toString().toLowerCase(Locale.ROOT) +
                " outside of for loop body");
        }
        break;
      case LEAVE:
        if (!inFunction) {
          error("leave outside of function");
        }
        break;
      case FUNCTION_DEFINITION:
        visitFunctionDefinition((FunctionDefinition)stmt);
        break;
      default:
        throw new YulRuntimeError("Unknown statement type " + stmt.getType());
    }
  }

  private void visitSwitch(Switch sw) {
    expectValues(sw.getExpression(), 1);
    Set<BigInteger> values = new HashSet<BigInteger>();
    Set<String> otherValues = new HashSet<String>();
    int defaults = 0;
    for (Case c: sw.getCases()) {
      if (c.isDefault()) {
        defaults++;
      } else {
        Literal lit = c.getValue();
        checkLiteral(lit);
        BigInteger v = lit.numericValue();
        boolean fresh = v != null ? values.add(v) :
                                    otherValues.add(lit.getValue());
        if (!fresh) {
          error("Duplicate case " + lit + " in switch");
        }
      }
      visitBlock(c.getBody());
    }
    if (defaults > 1) {
      error("Only one default case allowed in switch");
    }
  }

  private void visitForLoop(ForLoop loop) {
    Scope outer = scope;
    scope = new Scope(scope, false);
    // Pre shares the scope of condition, post and body
    for (Statement stmt: loop.getPre().getStatements()) {
      if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
        error("Functions cannot be defined in for loop initialisers");
      }
    }
    int savedDepth = loopDepth;
    loopDepth = 0;
    visitStatements(loop.getPre().getStatements());
    expectValues(loop.getCondition(), 1);
    visitBlock(loop.getPost());
    loopDepth = savedDepth + 1;
    visitBlock(loop.getBody());
    loopDepth = savedDepth;
    scope = outer;
  }

  private void visitFunctionDefinition(FunctionDefinition def) {
    Scope outer = scope;
    boolean savedInFunction = inFunction;
    int savedDepth = loopDepth;
    scope = new Scope(scope, true);
    for (String param: def.getParameters()) {
      declareVariable(param);
    }
    for (String ret: def.getReturnVariables()) {
      declareVariable(ret);
    }
    inFunction = true;
    loopDepth = 0;
    visitBlock(def.getBody());
    inFunction = savedInFunction;
    loopDepth = savedDepth;
    scope = outer;
  }

  private void expectValues(Expression expr, int expected) {
    int actual = visitExpression(expr);
    if (actual != -1 && actual != expected) {
      error("Expected " + expected + " value(s) from " + expr + " but got " +
            actual);
    }
  }

  /**
   * @return number of values produced, -1 if unknown because of earlier
   *          error
   */
  private int visitExpression(Expression expr) {
    switch (expr.getType()) {
      case LITERAL:
        checkLiteral((Literal)expr);
        return 1;
      case IDENTIFIER: {
        String name = ((Identifier)expr).getName();
        Declaration d = scope.lookup(name);
        if (d == null) {
          error("Identifier not found: " + name);
          return -1;
        } else if (d.isFunction()) {
          error("Function " + name + " used without call");
          return -1;
        }
        return 1;
      }
      case FUNCTION_CALL:
        return visitFunctionCall((FunctionCall)expr);
      default:
        throw new YulRuntimeError("Unknown expression type " + expr.getType());
    }
  }

  /**
   * Literals must fit in one word of the dialect
   */
  private void checkLiteral(Literal lit) {
    int bits = dialect.getArithmetic().getBits();
    if (lit.getKind() == LiteralKind.NUMBER) {
      if (lit.numericValue().bitLength() > bits) {
        error("Number literal too large (> " + bits + " bits): " + lit);
      }
    } else if (lit.getKind() == LiteralKind.STRING) {
      int bytes = lit.getValue().getBytes(StandardCharsets.UTF_8).length;
      if (bytes > bits / 8) {
        error("String literal too long (" + bytes + " > " + (bits / 8) +
              " bytes): " + lit);
      }
    }
  }

  private int visitFunctionCall(FunctionCall call) {
    // Arguments are evaluated right to left
    for (int i = call.getArguments().size() - 1; i >= 0; i--) {
      expectValues(call.getArguments().get(i), 1);
    }
    int params, returns;
    BuiltinFunction builtin = dialect.builtin(call.getFunctionName());
    if (builtin != null) {
      params = builtin.getParameterCount();
      returns = builtin.getReturnCount();
    } else {
      Declaration d = scope.lookup(call.getFunctionName());
      if (d == null) {
        error("Function not found: " + call.getFunctionName());
        return -1;
      } else if (!d.isFunction()) {
        error("Attempt to call variable " + call.getFunctionName());
        return -1;
      }
      params = d.parameters;
      returns = d.returns;
    }
    if (params != call.getArguments().size()) {
      error("Function " + call.getFunctionName() + " expects " + params +
            " argument(s) but got " + call.getArguments().size());
    }
    return returns;
  }

  private void declareVariable(String name) {
    if (declare(name, new Declaration())) {
      info.addVariable(name);
    }
  }

  private boolean declare(String name, Declaration d) {
    if (dialect.builtin(name) != null) {
      error("Cannot use builtin function name " + name + " as identifier");
      return false;
    }
    if (scope.lookup(name) != null) {
      error("Variable name " + name + " already taken in this scope");
      return false;
    }
    scope.declarations.put(name, d);
    return true;
  }

  private static class Declaration {
    /** -1 for variables */
    final int parameters;
    final int returns;

    Declaration() {
      this(-1, -1);
    }

    Declaration(int parameters, int returns) {
      this.parameters = parameters;
      this.returns = returns;
    }

    boolean isFunction() {
      return parameters >= 0;
    }
  }

  private static class Scope {
    final Scope parent;
    /** Variables of enclosing scopes are not visible past a function */
    final boolean functionScope;
    final Map<String, Declaration> declarations =
                              new HashMap<String, Declaration>();

    Scope(Scope parent, boolean functionScope) {
      this.parent = parent;
      this.functionScope = functionScope;
    }

    Declaration lookup(String name) {
      boolean crossedFunction = false;
      for (Scope s = this; s != null; s = s.parent) {
        Declaration d = s.declarations.get(name);
        if (d != null && (d.isFunction() || !crossedFunction)) {
          return d;
        }
        if (s.functionScope) {
          crossedFunction = true;
        }
      }
      return null;
    }
  }
}
