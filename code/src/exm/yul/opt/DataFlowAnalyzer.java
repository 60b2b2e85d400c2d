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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.dialect.BuiltinFunction;
import exm.yul.dialect.BuiltinFunction.StorageRole;
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
import exm.yul.tree.Literal;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Walks the tree in execution order, tracking the current value of
 * variables whose value is a movable expression, and the contents of
 * storage slots written with simple keys and values.
 *
 * Knowledge is dropped whenever control flow joins in a way that could
 * invalidate it.  Subclasses override {@link #visitExpression(Expression)}
 * to replace expressions based on what is known.
 *
 * Requires disambiguated code.
 */
public abstract class DataFlowAnalyzer {
  protected final Dialect dialect;

  /** Known value of variable; only movable expressions */
  private Map<String, Expression> values = new HashMap<String, Expression>();
  /** Variables referenced by each known value */
  private Map<String, Set<String>> references =
                                  new HashMap<String, Set<String>>();
  /** Storage slot contents; keys and values are identifiers or literals */
  private List<StorageEntry> storage = new ArrayList<StorageEntry>();

  protected DataFlowAnalyzer(Dialect dialect) {
    this.dialect = dialect;
  }

  public void run(Block ast) {
    visitBlock(ast);
  }

  /**
   * @return current value of variable, or null if unknown.  Must not
   *        be modified; copy before inserting into the tree.
   */
  protected Expression valueOf(String var) {
    return values.get(var);
  }

  /**
   * @return unmodifiable view of all known values
   */
  protected Map<String, Expression> knownValues() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * @return known contents of storage slot, or null
   */
  protected Expression storageValue(Expression key) {
    for (StorageEntry e: storage) {
      if (sameSlot(e.key, key)) {
        return e.value;
      }
    }
    return null;
  }

  /**
   * Visit expression, returning replacement or the same expression.
   * Arguments are visited right to left, the order they are evaluated.
   */
  protected Expression visitExpression(Expression expr) {
    if (expr.getType() == ExpressionType.FUNCTION_CALL) {
      FunctionCall call = (FunctionCall)expr;
      List<Expression> args = call.getArguments();
      for (int i = args.size() - 1; i >= 0; i--) {
        args.set(i, visitExpression(args.get(i)));
      }
      handleCallEffects(call);
    }
    return expr;
  }

  protected void visitStatement(Statement stmt) {
    switch (stmt.getType()) {
      case BLOCK:
        visitBlock((Block)stmt);
        break;
      case EXPRESSION_STATEMENT: {
        ExpressionStatement es = (ExpressionStatement)stmt;
        es.setExpression(visitExpression(es.getExpression()));
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getValue() != null) {
          decl.setValue(visitExpression(decl.getValue()));
        }
        handleAssignment(decl.getVariables(), decl.getValue(), true);
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        assign.setValue(visitExpression(assign.getValue()));
        handleAssignment(assign.getVariableNames(), assign.getValue(), false);
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        ifStmt.setCondition(visitExpression(ifStmt.getCondition()));
        State saved = saveState();
        visitBlock(ifStmt.getBody());
        restoreState(saved);
        clearValues(NameCollector.assignedVariables(ifStmt.getBody()));
        storage.clear();
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        sw.setExpression(visitExpression(sw.getExpression()));
        State saved = saveState();
        Set<String> assigned = new HashSet<String>();
        for (Case c: sw.getCases()) {
          visitBlock(c.getBody());
          restoreState(saved);
          assigned.addAll(NameCollector.assignedVariables(c.getBody()));
        }
        clearValues(assigned);
        storage.clear();
        break;
      }
      case FOR_LOOP:
        visitForLoop((ForLoop)stmt);
        break;
      case FUNCTION_DEFINITION: {
        State saved = saveState();
        values = new HashMap<String, Expression>();
        references = new HashMap<String, Set<String>>();
        storage = new ArrayList<StorageEntry>();
        visitBlock(((FunctionDefinition)stmt).getBody());
        restoreState(saved);
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

  private void visitForLoop(ForLoop loop) {
    List<Statement> pre = loop.getPre().getStatements();
    for (int i = 0; i < pre.size(); i++) {
      visitStatement(pre.get(i));
    }

    Set<String> assigned = NameCollector.assignedVariables(loop.getBody());
    assigned.addAll(NameCollector.assignedVariables(loop.getPost()));
    clearValues(assigned);
    storage.clear();

    loop.setCondition(visitExpression(loop.getCondition()));
    State saved = saveState();
    visitBlock(loop.getBody());
    restoreState(saved);
    visitBlock(loop.getPost());
    restoreState(saved);

    clearValues(assigned);
    storage.clear();
    clearValues(declaredIn(pre));
  }

  protected void visitBlock(Block block) {
    List<Statement> stmts = block.getStatements();
    for (int i = 0; i < stmts.size(); i++) {
      visitStatement(stmts.get(i));
    }
    // Variables declared here go out of scope
    clearValues(declaredIn(stmts));
  }

  private static Set<String> declaredIn(List<Statement> stmts) {
    Set<String> declared = new HashSet<String>();
    for (Statement stmt: stmts) {
      if (stmt.getType() == StatementType.VARIABLE_DECLARATION) {
        declared.addAll(((VariableDeclaration)stmt).getVariables());
      }
    }
    return declared;
  }

  /**
   * Update knowledge after variables are assigned value
   * @param value null for declaration without value
   */
  protected void handleAssignment(List<String> names, Expression value,
                                  boolean isDeclaration) {
    clearValues(names);
    if (value == null) {
      if (isDeclaration) {
        for (String name: names) {
          setValue(name, Literal.zero());
        }
      }
    } else if (names.size() == 1 && Semantics.isMovable(dialect, value)) {
      String name = names.get(0);
      Set<String> refs = NameCollector.referencedVariables(value);
      if (!refs.contains(name)) {
        values.put(name, value.copy());
        references.put(name, refs);
      }
    }
  }

  private void setValue(String name, Expression value) {
    values.put(name, value);
    references.put(name, NameCollector.referencedVariables(value));
  }

  /**
   * Forget values of variables and anything that depends on them
   */
  protected void clearValues(Collection<String> names) {
    if (names.isEmpty()) {
      return;
    }
    Set<String> toClear = new HashSet<String>(names);
    for (Entry<String, Set<String>> e: references.entrySet()) {
      for (String ref: e.getValue()) {
        if (names.contains(ref)) {
          toClear.add(e.getKey());
          break;
        }
      }
    }
    for (String name: toClear) {
      values.remove(name);
      references.remove(name);
    }

    Iterator<StorageEntry> it = storage.iterator();
    while (it.hasNext()) {
      StorageEntry e = it.next();
      if (refersTo(e.key, names) || refersTo(e.value, names)) {
        it.remove();
      }
    }
  }

  private static boolean refersTo(Expression expr, Collection<String> names) {
    return expr.getType() == ExpressionType.IDENTIFIER &&
           names.contains(((Identifier)expr).getName());
  }

  private void handleCallEffects(FunctionCall call) {
    BuiltinFunction fn = dialect.builtin(call.getFunctionName());
    if (fn != null && fn.getStorageRole() == StorageRole.STORE) {
      Expression key = call.getArguments().get(0);
      Expression value = call.getArguments().get(1);
      if (isSimple(key) && isSimple(value)) {
        Iterator<StorageEntry> it = storage.iterator();
        while (it.hasNext()) {
          if (mayAlias(it.next().key, key)) {
            it.remove();
          }
        }
        storage.add(new StorageEntry(key.copy(), value.copy()));
      } else {
        storage.clear();
      }
    } else if (Semantics.invalidatesStorage(dialect, call)) {
      storage.clear();
    }
  }

  private static boolean isSimple(Expression expr) {
    return expr.getType() == ExpressionType.IDENTIFIER ||
           expr.getType() == ExpressionType.LITERAL;
  }

  private static boolean sameSlot(Expression a, Expression b) {
    if (a.getType() == ExpressionType.LITERAL &&
        b.getType() == ExpressionType.LITERAL) {
      return ((Literal)a).valueEquals((Literal)b);
    } else if (a.getType() == ExpressionType.IDENTIFIER &&
               b.getType() == ExpressionType.IDENTIFIER) {
      return ((Identifier)a).getName().equals(((Identifier)b).getName());
    }
    return false;
  }

  /**
   * @return false only if slots are known to differ
   */
  private static boolean mayAlias(Expression a, Expression b) {
    if (a.getType() == ExpressionType.LITERAL &&
        b.getType() == ExpressionType.LITERAL) {
      return ((Literal)a).valueEquals((Literal)b);
    }
    return true;
  }

  private State saveState() {
    return new State(new HashMap<String, Expression>(values),
                     new HashMap<String, Set<String>>(references),
                     new ArrayList<StorageEntry>(storage));
  }

  private void restoreState(State state) {
    values = new HashMap<String, Expression>(state.values);
    references = new HashMap<String, Set<String>>(state.references);
    storage = new ArrayList<StorageEntry>(state.storage);
  }

  private static class State {
    final Map<String, Expression> values;
    final Map<String, Set<String>> references;
    final List<StorageEntry> storage;

    State(Map<String, Expression> values, Map<String, Set<String>> references,
          List<StorageEntry> storage) {
      this.values = values;
      this.references = references;
      this.storage = storage;
    }
  }

  private static class StorageEntry {
    final Expression key;
    final Expression value;

    StorageEntry(Expression key, Expression value) {
      this.key = key;
      this.value = value;
    }
  }
}
