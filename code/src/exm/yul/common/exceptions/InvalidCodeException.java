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

import java.util.List;

/**
 * Program failed semantic analysis: undeclared names, wrong number of
 * arguments or values, invalid control flow.
 */
public class InvalidCodeException extends UserException {
  private final List<String> errors;

  public InvalidCodeException(String file, List<String> errors) {
    super(file + ": " + errors.size() + " error(s): " + join(errors));
    this.errors = errors;
  }

  private static String join(List<String> errors) {
    StringBuilder sb = new StringBuilder();
    for (String e: errors) {
      sb.append("\n  ");
      sb.append(e);
    }
    return sb.toString();
  }

  public List<String> getErrors() {
    return errors;
  }

  private static final long serialVersionUID = 1L;
}
