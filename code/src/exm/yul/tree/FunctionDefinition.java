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

/**
 * function name(a, b) -> r { body }
 *
 * Return variables start out as zero.  Function bodies cannot see
 * variables of enclosing scopes, only functions.
 */
public class FunctionDefinition extends Statement {
  private String name;
  private final List<String> parameters;
  private final List<String> returnVariables;
  private final Block body;

  public FunctionDefinition(String name, List<String> parameters,
                List<String> returnVariables, Block body) {
    this.name = name;
    this.parameters = new ArrayList<String>(parameters);
    this.returnVariables = new ArrayList<String>(returnVariables);
    this.body = body;
  }

  @Override
  public StatementType getType() {
    return StatementType.FUNCTION_DEFINITION;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<String> getParameters() {
    return parameters;
  }

  public List<String> getReturnVariables() {
    return returnVariables;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    sb.append("function ");
    sb.append(name);
    sb.append('(');
    VariableDeclaration.appendNames(sb, parameters);
    sb.append(')');
    if (!returnVariables.isEmpty()) {
      sb.append(" -> ");
      VariableDeclaration.appendNames(sb, returnVariables);
    }
    sb.append(' ');
    body.appendInline(sb, indent);
  }

  @Override
  public FunctionDefinition copy() {
    return new FunctionDefinition(name, parameters, returnVariables,
                                  body.copy());
  }
}
