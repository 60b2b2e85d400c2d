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
package exm.yul.opt;

import org.apache.log4j.Logger;

import exm.yul.tree.Block;

/**
 * An optimiser step: a named transformation of the whole program tree.
 *
 * Steps keep no state between runs; anything shared between steps lives
 * in the {@link OptimiserStepContext}.  After a step the tree must be
 * well-formed again and every name must still be globally unique.
 */
public interface OptimiserStep {
  public abstract String getStepName();

  public abstract void run(Logger logger, OptimiserStepContext context,
                           Block ast);
}
