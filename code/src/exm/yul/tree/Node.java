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
 * Common superclass of everything in the program tree.
 *
 * Trees are mutable and are rewritten in place by optimiser steps.
 * The printed form produced by {@link #appendTo(StringBuilder, int)}
 * can be read back by the parser.
 */
public abstract class Node {
  public static final int INDENT_WIDTH = 4;

  /**
   * Append source text for this node
   * @param sb
   * @param indent indentation of the current line in spaces
   */
  public abstract void appendTo(StringBuilder sb, int indent);

  /**
   * @return deep copy that shares no mutable state with this node
   */
  public abstract Node copy();

  protected static void indent(StringBuilder sb, int indent) {
    for (int i = 0; i < indent; i++)
      sb.append(' ');
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(256);
    appendTo(sb, 0);
    return sb.toString();
  }
}
