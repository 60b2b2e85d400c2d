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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.yul.opt.CallGraph;
import exm.yul.opt.NameCollector;
import exm.yul.opt.OptUtil;
import exm.yul.opt.OptimiserStep;
import exm.yul.opt.OptimiserStepContext;
import exm.yul.tree.Block;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;

/**
 * Remove functions that can't be reached from the main code or from a
 * reserved function, even if they call each other.
 */
public class CircularReferencesPruner implements OptimiserStep {

  @Override
  public String getStepName() {
    return "CircularReferencesPruner";
  }

  @Override
  public void run(Logger logger, OptimiserStepContext context, Block ast) {
    CallGraph graph = CallGraph.build(ast);
    List<String> roots = new ArrayList<String>();
    roots.add(CallGraph.MAIN);
    for (String fn: NameCollector.functions(ast).keySet()) {
      if (context.isReserved(fn)) {
        roots.add(fn);
      }
    }
    Set<String> reachable = graph.reachableFrom(roots);

    for (Block block: OptUtil.allBlocks(ast)) {
      Iterator<Statement> it = block.getStatements().iterator();
      while (it.hasNext()) {
        Statement stmt = it.next();
        if (stmt.getType() == StatementType.FUNCTION_DEFINITION) {
          String name = ((FunctionDefinition)stmt).getName();
          if (!reachable.contains(name)) {
            logger.trace("Pruning unreachable function " + name);
            it.remove();
          }
        }
      }
    }
  }
}
