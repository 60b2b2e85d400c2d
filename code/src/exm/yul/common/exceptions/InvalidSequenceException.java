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
package exm.yul.common.exceptions;

/**
 * A step sequence string could not be interpreted: unknown abbreviation,
 * nested or unbalanced parentheses.
 */
public class InvalidSequenceException extends UserException {

  /** Marks errors detected at end of input */
  public static final int END_OF_INPUT = -1;

  private final char abbreviation;
  private final int position;

  public InvalidSequenceException(String message, char abbreviation,
                                  int position) {
    super(format(message, abbreviation, position));
    this.abbreviation = abbreviation;
    this.position = position;
  }

  private static String format(String message, char abbreviation,
                               int position) {
    if (position == END_OF_INPUT) {
      return message + " (at end of sequence)";
    }
    return message + ": '" + abbreviation + "' at position " + position;
  }

  /**
   * @return offending character, undefined if position is END_OF_INPUT
   */
  public char getAbbreviation() {
    return abbreviation;
  }

  public int getPosition() {
    return position;
  }

  private static final long serialVersionUID = 1L;
}
