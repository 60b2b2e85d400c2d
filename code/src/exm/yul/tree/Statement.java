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

public abstract class Statement extends Node {

  public static enum StatementType {
    BLOCK,
    EXPRESSION_STATEMENT,
    VARIABLE_DECLARATION,
    ASSIGNMENT,
    IF,
    SWITCH,
    FOR_LOOP,
    BREAK,
    CONTINUE,
    LEAVE,
    FUNCTION_DEFINITION,
  }

  public abstract StatementType getType();

  @Override
  public abstract Statement copy();

  /**
   * Print as a line of its own
   */
  @Override
  public void appendTo(StringBuilder sb, int indent) {
    indent(sb, indent);
    appendInline(sb, indent);
    sb.append('\n');
  }

  /**
   * Print without leading indentation or trailing newline
   * @param indent indentation of the line the statement starts on
   */
  public abstract void appendInline(StringBuilder sb, int indent);
}
