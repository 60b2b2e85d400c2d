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
 * Source text could not be parsed into a tree
 */
public class InvalidSyntaxException extends UserException {

  private static final long serialVersionUID = 1060914609057739598L;

  public InvalidSyntaxException(String file, int line, String message) {
    super(file, line, 0, message);
  }

}
