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
package exm.yul.opt.steps;

import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.dialect.Dialect;
import exm.yul.opt.DataFlowAnalyzer;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.Identifier;

/**
 * Replace a variable by its current value when that is a literal or
 * another variable, or when the variable is referenced only once.
 */
public class Rematerialiser implements OptimiserStep {

  @Override
  public String getStepName() {
    return "Rematerialiser";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    run(context.getDialect(), ast, false);
  }

  /**
   * @param literalsOnly only replace variables with known literal values
   */
  public static void run(Dialect dialect, Block ast, boolean literalsOnly) {
    Map<String, Integer> refCounts = NameCollector.referenceCounts(ast);
    new Replacer(dialect, refCounts, literalsOnly).run(ast);
  }

  private static class Replacer extends DataFlowAnalyzer {
    private final Map<String, Integer> refCounts;
    private final boolean literalsOnly;

    Replacer(Dialect dialect, Map<String, Integer> refCounts,
             boolean literalsOnly) {
      super(dialect);
      this.refCounts = refCounts;
      this.literalsOnly = literalsOnly;
    }

    @Override
    protected Expression visitExpression(Expression expr) {
      Expression visited = super.visitExpression(expr);
      if (visited.getType() != ExpressionType.IDENTIFIER) {
        return visited;
      }
      String name = ((Identifier)visited).getName();
      Expression value = valueOf(name);
      if (value == null) {
        return visited;
      }
      if (value.getType() == ExpressionType.LITERAL) {
        return value.copy();
      } else if (literalsOnly) {
        return visited;
      } else if (OptUtil.isIdentifierOrLiteral(value) ||
                 NameCollector.referenceCount(refCounts, name) == 1) {
        return value.copy();
      }
      return visited;
    }
  }
}
