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

public class Identifier extends Expression {
  private String name;

  public Identifier(String name) {
    this.name = name;
  }

  @Override
  public ExpressionType getType() {
    return ExpressionType.IDENTIFIER;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public void appendTo(StringBuilder sb, int indent) {
    sb.append(name);
  }

  @Override
  public Identifier copy() {
    return new Identifier(name);
  }
}
