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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

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
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Structural equality of trees up to consistent renaming of the names
 * declared inside the compared trees.  Names declared outside must match
 * exactly.
 *
 * An instance records the renaming as it goes, so use a fresh one for
 * each comparison.
 */
public class SyntacticallyEqual {
  private final Map<String, String> leftToRight = new HashMap<String, String>();
  private final Map<String, String> rightToLeft = new HashMap<String, String>();

  public static boolean equal(Statement a, Statement b) {
    return new SyntacticallyEqual().statementEqual(a, b);
  }

  public static boolean equal(Expression a, Expression b) {
    return new SyntacticallyEqual().expressionEqual(a, b);
  }

  /**
   * Compare two function definitions ignoring their own names
   */
  public static boolean equivalentFunctions(FunctionDefinition a,
                                            FunctionDefinition b) {
    SyntacticallyEqual eq = new SyntacticallyEqual();
    return eq.bindAll(a.getParameters(), b.getParameters()) &&
           eq.bindAll(a.getReturnVariables(), b.getReturnVariables()) &&
           eq.statementEqual(a.getBody(), b.getBody());
  }

  public boolean expressionEqual(Expression a, Expression b) {
    if (a.getType() != b.getType()) {
      return false;
    }
    switch (a.getType()) {
      case LITERAL:
        return literalEqual((Literal)a, (Literal)b);
      case IDENTIFIER:
        return nameEqual(((Identifier)a).getName(), ((Identifier)b).getName());
      case FUNCTION_CALL: {
        FunctionCall ca = (FunctionCall)a;
        FunctionCall cb = (FunctionCall)b;
        return nameEqual(ca.getFunctionName(), cb.getFunctionName()) &&
               expressionsEqual(ca.getArguments(), cb.getArguments());
      }
      default:
        return false;
    }
  }

  public boolean statementEqual(Statement a, Statement b) {
    if (a.getType() != b.getType()) {
      return false;
    }
    switch (a.getType()) {
      case BLOCK:
        return blockEqual((Block)a, (Block)b);
      case EXPRESSION_STATEMENT:
        return expressionEqual(((ExpressionStatement)a).getExpression(),
                               ((ExpressionStatement)b).getExpression());
      case VARIABLE_DECLARATION: {
        VariableDeclaration da = (VariableDeclaration)a;
        VariableDeclaration db = (VariableDeclaration)b;
        if (da.getValue() == null || db.getValue() == null) {
          if (da.getValue() != db.getValue()) {
            return false;
          }
        } else if (!expressionEqual(da.getValue(), db.getValue())) {
          return false;
        }
        return bindAll(da.getVariables(), db.getVariables());
      }
      case ASSIGNMENT: {
        Assignment aa = (Assignment)a;
        Assignment ab = (Assignment)b;
        return namesEqual(aa.getVariableNames(), ab.getVariableNames()) &&
               expressionEqual(aa.getValue(), ab.getValue());
      }
      case IF: {
        If ia = (If)a;
        If ib = (If)b;
        return expressionEqual(ia.getCondition(), ib.getCondition()) &&
               blockEqual(ia.getBody(), ib.getBody());
      }
      case SWITCH:
        return switchEqual((Switch)a, (Switch)b);
      case FOR_LOOP: {
        ForLoop fa = (ForLoop)a;
        ForLoop fb = (ForLoop)b;
        return blockEqual(fa.getPre(), fb.getPre()) &&
               expressionEqual(fa.getCondition(), fb.getCondition()) &&
               blockEqual(fa.getPost(), fb.getPost()) &&
               blockEqual(fa.getBody(), fb.getBody());
      }
      case FUNCTION_DEFINITION: {
        FunctionDefinition fa = (FunctionDefinition)a;
        FunctionDefinition fb = (FunctionDefinition)b;
        // Name bound when enclosing block was entered
        return nameEqual(fa.getName(), fb.getName()) &&
               bindAll(fa.getParameters(), fb.getParameters()) &&
               bindAll(fa.getReturnVariables(), fb.getReturnVariables()) &&
               blockEqual(fa.getBody(), fb.getBody());
      }
      case BREAK:
      case CONTINUE:
      case LEAVE:
        return true;
      default:
        return false;
    }
  }

  private boolean blockEqual(Block a, Block b) {
    List<Statement> sa = a.getStatements();
    List<Statement> sb = b.getStatements();
    if (sa.size() != sb.size()) {
      return false;
    }
    // Functions are visible before their definition
    for (int i = 0; i < sa.size(); i++) {
      if (sa.get(i).getType() == StatementType.FUNCTION_DEFINITION &&
          sb.get(i).getType() == StatementType.FUNCTION_DEFINITION) {
        if (!bind(((FunctionDefinition)sa.get(i)).getName(),
                  ((FunctionDefinition)sb.get(i)).getName())) {
          return false;
        }
      }
    }
    for (int i = 0; i < sa.size(); i++) {
      if (!statementEqual(sa.get(i), sb.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean switchEqual(Switch a, Switch b) {
    if (!expressionEqual(a.getExpression(), b.getExpression()) ||
        a.getCases().size() != b.getCases().size()) {
      return false;
    }
    for (int i = 0; i < a.getCases().size(); i++) {
      Case ca = a.getCases().get(i);
      Case cb = b.getCases().get(i);
      if (ca.isDefault() != cb.isDefault()) {
        return false;
      }
      if (!ca.isDefault() && !literalEqual(ca.getValue(), cb.getValue())) {
        return false;
      }
      if (!blockEqual(ca.getBody(), cb.getBody())) {
        return false;
      }
    }
    return true;
  }

  private static boolean literalEqual(Literal a, Literal b) {
    return a.getKind() == b.getKind() && a.valueEquals(b);
  }

  private boolean expressionsEqual(List<Expression> a, List<Expression> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!expressionEqual(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean namesEqual(List<String> a, List<String> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!nameEqual(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean nameEqual(String a, String b) {
    String boundA = leftToRight.get(a);
    String boundB = rightToLeft.get(b);
    if (boundA == null && boundB == null) {
      return a.equals(b);
    }
    return b.equals(boundA) && a.equals(boundB);
  }

  private boolean bindAll(List<String> a, List<String> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!bind(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Record that declaration a on the left corresponds to b on the right
   */
  private boolean bind(String a, String b) {
    String boundA = leftToRight.get(a);
    String boundB = rightToLeft.get(b);
    if (boundA != null || boundB != null) {
      // Redeclaration: consistent only if bound to each other already
      return b.equals(boundA) && a.equals(boundB);
    }
    leftToRight.put(a, b);
    rightToLeft.put(b, a);
    return true;
  }
}
