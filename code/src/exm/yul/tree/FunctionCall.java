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
import java.util.Arrays;
import java.util.List;

public class FunctionCall extends Expression {
  private String functionName;
  private final List<Expression> arguments;

  public FunctionCall(String functionName, List<Expression> arguments) {
    this.functionName = functionName;
    this.arguments = new ArrayList<Expression>(arguments);
  }

  public FunctionCall(String functionName, Expression... arguments) {
    this(functionName, Arrays.asList(arguments));
  }

  @Override
  public ExpressionType getType() {
    return ExpressionType.FUNCTION_CALL;
  }

  public String getFunctionName() {
    return functionName;
  }

  public void setFunctionName(String functionName) {
    this.functionName = functionName;
  }

  /**
   * Arguments are evaluated right to left.
   * @return modifiable list of arguments
   */
  public List<Expression> getArguments() {
    return arguments;
  }

  @Override
  public void appendTo(StringBuilder sb, int indent) {
    sb.append(functionName);
    sb.append('(');
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      arguments.get(i).appendTo(sb, indent);
    }
    sb.append(')');
  }

  @Override
  public FunctionCall copy() {
    List<Expression> args = new ArrayList<Expression>(arguments.size());
    for (Expression arg: arguments) {
      args.add(arg.copy());
    }
    return new FunctionCall(functionName, args);
  }
}
