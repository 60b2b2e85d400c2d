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

import java.util.Map;

import org.apache.log4j.Logger;

import exm.yul.common.util.Counters;

/**
 * Process-wide counters for the best-effort limits of the optimiser.
 * Nothing here changes what the optimiser does.  Each
 * {@link OptimiserSuite} run starts from zero.
 */
public class OptimiserStatistics {
  /** Stability loop stopped by the round limit */
  public static final String STABLE_LOOP_ROUND_CAP = "stable-loop-round-cap";
  /** Rounds executed by stability loops */
  public static final String STABLE_LOOP_ROUNDS = "stable-loop-rounds";
  /** Rematerialise and prune iterations of the stack compressor */
  public static final String STACK_COMPRESSOR_ITERATIONS =
                                        "stack-compressor-iterations";
  /** Stack compressor gave up with functions still too deep */
  public static final String STACK_COMPRESSOR_FAILED =
                                        "stack-compressor-failed";
  /** Prefix for per-step run counts */
  public static final String STEP_RUNS_PREFIX = "step-runs.";

  private static final Counters<String> counters = new Counters<String>();

  public static synchronized long increment(String key) {
    return counters.increment(key);
  }

  public static synchronized long add(String key, long incr) {
    return counters.add(key, incr);
  }

  public static synchronized long getCount(String key) {
    return counters.getCount(key);
  }

  public static synchronized void reset() {
    counters.resetAll();
  }

  public static synchronized void log(Logger logger) {
    if (!logger.isDebugEnabled()) {
      return;
    }
    for (Map.Entry<String, Long> e: counters.getCountMap().entrySet()) {
      logger.debug("Optimiser statistic " + e.getKey() + ": " + e.getValue());
    }
  }
}
