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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of analysing a block: every declared function with its
 * signature and every declared variable, in declaration order.
 */
public class AnalysisInfo {
  private final Map<String, FunctionSignature> functions =
                          new TreeMap<String, FunctionSignature>();
  private final List<String> variables = new ArrayList<String>();

  void addFunction(String name, int params, int returns) {
    functions.put(name, new FunctionSignature(params, returns));
  }

  void addVariable(String name) {
    variables.add(name);
  }

  public Map<String, FunctionSignature> getFunctions() {
    return Collections.unmodifiableMap(functions);
  }

  public List<String> getVariables() {
    return Collections.unmodifiableList(variables);
  }

  @Override
  public String toString() {
    return "functions: " + functions + " variables: " + variables;
  }

  public static class FunctionSignature {
    public final int parameters;
    public final int returns;

    public FunctionSignature(int parameters, int returns) {
      this.parameters = parameters;
      this.returns = returns;
    }

    @Override
    public String toString() {
      return parameters + "->" + returns;
    }
  }
}
