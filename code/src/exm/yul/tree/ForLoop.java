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
 * for { pre } condition { post } { body }
 *
 * Variables declared in pre are visible in condition, post and body.
 */
public class ForLoop extends Statement {
  private final Block pre;
  private Expression condition;
  private final Block post;
  private final Block body;

  public ForLoop(Block pre, Expression condition, Block post, Block body) {
    this.pre = pre;
    this.condition = condition;
    this.post = post;
    this.body = body;
  }

  @Override
  public StatementType getType() {
    return StatementType.FOR_LOOP;
  }

  public Block getPre() {
    return pre;
  }

  public Expression getCondition() {
    return condition;
  }

  public void setCondition(Expression condition) {
    this.condition = condition;
  }

  public Block getPost() {
    return post;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    sb.append("for ");
    pre.appendInline(sb, indent);
    sb.append(' ');
    condition.appendTo(sb, indent);
    sb.append(' ');
    post.appendInline(sb, indent);
    sb.append(' ');
    body.appendInline(sb, indent);
  }

  @Override
  public ForLoop copy() {
    return new ForLoop(pre.copy(), condition.copy(), post.copy(), body.copy());
  }
}
