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

/**
 * Sequence of statements with its own scope.  The root of every
 * program tree is a block.
 */
public class Block extends Statement {
  private final List<Statement> statements;

  public Block() {
    this(new ArrayList<Statement>());
  }

  public Block(List<Statement> statements) {
    this.statements = new ArrayList<Statement>(statements);
  }

  public Block(Statement... statements) {
    this(Arrays.asList(statements));
  }

  @Override
  public StatementType getType() {
    return StatementType.BLOCK;
  }

  /**
   * @return modifiable list of statements
   */
  public List<Statement> getStatements() {
    return statements;
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /**
   * Replace contents of this block with those of another list.
   * Used by steps that rebuild the statement list.
   */
  public void replaceStatements(List<Statement> newStatements) {
    List<Statement> tmp = new ArrayList<Statement>(newStatements);
    statements.clear();
    statements.addAll(tmp);
  }

  @Override
  public void appendInline(StringBuilder sb, int indent) {
    if (statements.isEmpty()) {
      sb.append("{ }");
      return;
    }
    sb.append("{\n");
    for (Statement stmt: statements) {
      stmt.appendTo(sb, indent + INDENT_WIDTH);
    }
    indent(sb, indent);
    sb.append('}');
  }

  @Override
  public Block copy() {
    List<Statement> stmts = new ArrayList<Statement>(statements.size());
    for (Statement stmt: statements) {
      stmts.add(stmt.copy());
    }
    return new Block(stmts);
  }
}
