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
import java.util.Collections;
import java.util.List;

/**
 * let a, b := value
 *
 * A declaration without a value initialises all variables to zero.
 */
public class VariableDeclaration extends Statement {
  private final List<String> variables;
  private Expression value;

  public VariableDeclaration(List<String> variables, Expression value) {
    this.variables = new ArrayList<String>(variables);
    this.value = value;
  }

  public VariableDeclaration(String variable, Expression value) {
    this(Collections.singletonList(variable), value);
  }

  @Override
  public StatementType getType() {
    return StatementType.VARIABLE_DECLARATION;
  }

  /**
   * @return modifiable list of declared names
   */
  public List<String> getVariables() {
    return variables;
  }

  /**
   * @return value or null if declared without initializer
   */
  public Expression getValue() {
    return value;
  }

  public void setValue(Expression value) {
    this.value = value;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    sb.append("let ");
    appendNames(sb, variables);
    if (value != null) {
      sb.append(" := ");
      value.appendTo(sb, indent);
    }
  }

  static void appendNames(StringBuilder sb, List<String> names) {
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(names.get(i));
    }
  }

  @Override
  public VariableDeclaration copy() {
    return new VariableDeclaration(variables,
                          value == null ? null : value.copy());
  }
}
