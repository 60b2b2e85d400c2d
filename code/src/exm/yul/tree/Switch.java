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
package exm.yul.tree;

import java.util.ArrayList;
import java.util.List;

public class Switch extends Statement {
  private Expression expression;
  private final List<Case> cases;

  public Switch(Expression expression, List<Case> cases) {
    this.expression = expression;
    this.cases = new ArrayList<Case>(cases);
  }

  @Override
  public StatementType getType() {
    return StatementType.SWITCH;
  }

  public Expression getExpression() {
    return expression;
  }

  public void setExpression(Expression expression) {
    this.expression = expression;
  }

  /**
   * @return modifiable list of cases, default case last if present
   */
  public List<Case> getCases() {
    return cases;
  }

  public Case getDefaultCase() {
    for (Case c: cases) {
      if (c.isDefault()) {
        return c;
      }
    }
    return null;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    sb.append("switch ");
    expression.appendTo(sb, indent);
    sb.append('\n');
    for (int i = 0; i < cases.size(); i++) {
      cases.get(i).appendTo(sb, indent);
    }
    // Strip final newline, added by Statement.appendTo
    sb.setLength(sb.length() - 1);
  }

  @Override
  public Switch copy() {
    List<Case> copied = new ArrayList<Case>(cases.size());
    for (Case c: cases) {
      copied.add(c.copy());
    }
    return new Switch(expression.copy(), copied);
  }
}
