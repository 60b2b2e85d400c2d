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

public class Assignment extends Statement {
  private final List<String> variableNames;
  private Expression value;

  public Assignment(List<String> variableNames, Expression value) {
    this.variableNames = new ArrayList<String>(variableNames);
    this.value = value;
  }

  public Assignment(String variableName, Expression value) {
    this(Collections.singletonList(variableName), value);
  }

  @Override
  public StatementType getType() {
    return StatementType.ASSIGNMENT;
  }

  public List<String> getVariableNames() {
    return variableNames;
  }

  public Expression getValue() {
    return value;
  }

  public void setValue(Expression value) {
    this.value = value;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    VariableDeclaration.appendNames(sb, variableNames);
    sb.append(" := ");
    value.appendTo(sb, indent);
  }

  @Override
  public Assignment copy() {
    return new Assignment(variableNames, value.copy());
  }
}
