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
 * If-then construct.  There is no else branch.
 */
public class If extends Statement {
  private Expression condition;
  private final Block body;

  public If(Expression condition, Block body) {
    this.condition = condition;
    this.body = body;
  }

  @Override
  public StatementType getType() {
    return StatementType.IF;
  }

  public Expression getCondition() {
    return condition;
  }

  public void setCondition(Expression condition) {
    this.condition = condition;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    sb.append("if ");
    condition.appendTo(sb, indent);
    sb.append(' ');
    body.appendInline(sb, indent);
  }

  @Override
  public If copy() {
    return new If(condition.copy(), body.copy());
  }
}
