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

import exm.yul.analysis.AnalysisInfo;

/**
 * Code of one object together with the result of the latest analysis
 * of that code.  The code block is owned by the object and rewritten in
 * place by the optimiser.
 */
public class YulObject {
  private final String name;
  private final Block code;
  private AnalysisInfo analysisInfo;

  public YulObject(String name, Block code, AnalysisInfo analysisInfo) {
    this.name = name;
    this.code = code;
    this.analysisInfo = analysisInfo;
  }

  public String getName() {
    return name;
  }

  public Block getCode() {
    return code;
  }

  public AnalysisInfo getAnalysisInfo() {
    return analysisInfo;
  }

  public void setAnalysisInfo(AnalysisInfo analysisInfo) {
    this.analysisInfo = analysisInfo;
  }

  @Override
  public String toString() {
    return "object \"" + name + "\" " + code.toString();
  }
}
