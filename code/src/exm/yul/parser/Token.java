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
package exm.yul.parser;

public class Token {
  private final TokenType type;
  private final String content;
  private final int line;

  public Token(TokenType type, String content, int line) {
    this.type = type;
    this.content = content;
    this.line = line;
  }

  public TokenType getType() {
    return type;
  }

  public String getContent() {
    return content;
  }

  public int getLine() {
    return line;
  }

  /**
   * @return true if this is the identifier-like keyword kw
   */
  public boolean isKeyword(String kw) {
    return type == TokenType.IDENTIFIER && content.equals(kw);
  }

  @Override
  public String toString() {
    if (type == TokenType.EOF) {
      return "end of input";
    }
    return "'" + content + "'";
  }
}
