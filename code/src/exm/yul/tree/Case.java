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

/**
 * One case of a switch.  A null value marks the default case.
 */
public class Case extends Node {
  private final Literal value;
  private final Block body;

  public Case(Literal value, Block body) {
    this.value = value;
    this.body = body;
  }

  public Literal getValue() {
    return value;
  }

  public boolean isDefault() {
    return value == null;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public void appendTo(StringBuilder sb, int indent) {
    indent(sb, indent);
    if (value == null) {
      sb.append("default ");
    } else {
      sb.append("case ");
      value.appendTo(sb, indent);
      sb.append(' ');
    }
    body.appendInline(sb, indent);
    sb.append('\n');
  }

  @Override
  public Case copy() {
    return new Case(value == null ? null : value.copy(), body.copy());
  }
}
