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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.yul.common.exceptions.InvalidSequenceException;

/**
 * A parsed optimiser sequence string.  Each letter names a step (see
 * {@link OptimiserSteps}), a parenthesised group is repeated until the
 * code stops shrinking, and spaces and newlines are ignored:
 * <pre>
 *   dhfoDgvulfnTUtnIf (xarrscLM cCTUtTOntnfDIul) jmul
 * </pre>
 * Groups do not nest.
 */
public class StepSequence {

  /**
   * A run of steps, either executed once or repeated until stable
   */
  public static class SequenceElement {
    private final List<String> steps;
    private final boolean repeatUntilStable;

    public SequenceElement(List<String> steps, boolean repeatUntilStable) {
      this.steps = Collections.unmodifiableList(new ArrayList<String>(steps));
      this.repeatUntilStable = repeatUntilStable;
    }

    /**
     * @return step names in order
     */
    public List<String> getSteps() {
      return steps;
    }

    public boolean isRepeatUntilStable() {
      return repeatUntilStable;
    }

    @Override
    public String toString() {
      return (repeatUntilStable ? "loop" : "run") + steps;
    }
  }

  private static enum State {
    TOP_LEVEL,
    INSIDE_LOOP,
  }

  private final List<SequenceElement> elements;

  private StepSequence(List<SequenceElement> elements) {
    this.elements = Collections.unmodifiableList(elements);
  }

  public List<SequenceElement> getElements() {
    return elements;
  }

  /**
   * Parse the whole sequence string.  Nothing is executed, so a
   * malformed sequence is rejected before it can change any code.
   * @throws InvalidSequenceException
   */
  public static StepSequence parse(String sequence)
                                  throws InvalidSequenceException {
    List<SequenceElement> elements = new ArrayList<SequenceElement>();
    List<String> current = new ArrayList<String>();
    State state = State.TOP_LEVEL;

    for (int pos = 0; pos < sequence.length(); pos++) {
      char c = sequence.charAt(pos);
      switch (c) {
        case ' ':
        case '\n':
          break;
        case '(':
          if (state == State.INSIDE_LOOP) {
            throw new InvalidSequenceException(
                      "Nested parentheses not supported", c, pos);
          }
          flush(elements, current, false);
          state = State.INSIDE_LOOP;
          break;
        case ')':
          if (state != State.INSIDE_LOOP) {
            throw new InvalidSequenceException("Unbalanced parenthesis",
                                               c, pos);
          }
          // An empty loop is kept: it still runs zero steps
          elements.add(new SequenceElement(current, true));
          current.clear();
          state = State.TOP_LEVEL;
          break;
        default: {
          String step = OptimiserSteps.stepAbbreviationToNameMap().get(c);
          if (step == null) {
            throw new InvalidSequenceException(
                  "Invalid optimisation step abbreviation", c, pos);
          }
          current.add(step);
          break;
        }
      }
    }
    if (state == State.INSIDE_LOOP) {
      throw new InvalidSequenceException("Unbalanced parenthesis", '(',
                                  InvalidSequenceException.END_OF_INPUT);
    }
    flush(elements, current, false);
    return new StepSequence(elements);
  }

  private static void flush(List<SequenceElement> elements,
                            List<String> current, boolean loop) {
    if (!current.isEmpty()) {
      elements.add(new SequenceElement(current, loop));
      current.clear();
    }
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
