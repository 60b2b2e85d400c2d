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

import java.util.ArrayList;
import java.util.List;

import exm.yul.common.exceptions.InvalidSyntaxException;

/**
 * Split source text into tokens.  Keywords are returned as identifiers;
 * the parser tells them apart.  Line and block comments are skipped.
 */
public class Lexer {
  private final String fileName;
  private final String input;
  private int pos = 0;
  private int line = 1;

  public Lexer(String fileName, String input) {
    this.fileName = fileName;
    this.input = input;
  }

  public List<Token> tokenize() throws InvalidSyntaxException {
    List<Token> tokens = new ArrayList<Token>();
    while (true) {
      skipWhitespaceAndComments();
      if (pos >= input.length()) {
        tokens.add(new Token(TokenType.EOF, "", line));
        return tokens;
      }
      tokens.add(nextToken());
    }
  }

  private Token nextToken() throws InvalidSyntaxException {
    char c = input.charAt(pos);
    switch (c) {
      case '{':
        pos++;
        return new Token(TokenType.LBRACE, "{", line);
      case '}':
        pos++;
        return new Token(TokenType.RBRACE, "}", line);
      case '(':
        pos++;
        return new Token(TokenType.LPAREN, "(", line);
      case ')':
        pos++;
        return new Token(TokenType.RPAREN, ")", line);
      case ',':
        pos++;
        return new Token(TokenType.COMMA, ",", line);
      case ':':
        expect(":=");
        return new Token(TokenType.ASSIGN, ":=", line);
      case '-':
        expect("->");
        return new Token(TokenType.ARROW, "->", line);
      case '"':
        return stringLiteral();
      default:
        break;
    }

    if (Character.isDigit(c)) {
      return number();
    } else if (isIdentifierStart(c)) {
      int start = pos;
      while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
        pos++;
      }
      return new Token(TokenType.IDENTIFIER, input.substring(start, pos), line);
    }
    throw new InvalidSyntaxException(fileName, line,
                                     "Unexpected character '" + c + "'");
  }

  private void expect(String text) throws InvalidSyntaxException {
    if (!input.startsWith(text, pos)) {
      throw new InvalidSyntaxException(fileName, line, "Expected " + text);
    }
    pos += text.length();
  }

  private Token number() throws InvalidSyntaxException {
    int start = pos;
    if (input.startsWith("0x", pos)) {
      pos += 2;
      while (pos < input.length() &&
             Character.digit(input.charAt(pos), 16) >= 0) {
        pos++;
      }
      if (pos == start + 2) {
        throw new InvalidSyntaxException(fileName, line,
                                         "Empty hex literal");
      }
    } else {
      while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
        pos++;
      }
    }
    if (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
      throw new InvalidSyntaxException(fileName, line,
          "Invalid number literal " + input.substring(start, pos + 1));
    }
    return new Token(TokenType.NUMBER, input.substring(start, pos), line);
  }

  private Token stringLiteral() throws InvalidSyntaxException {
    int start = ++pos;
    while (pos < input.length() && input.charAt(pos) != '"') {
      if (input.charAt(pos) == '\n') {
        break;
      }
      pos++;
    }
    if (pos >= input.length() || input.charAt(pos) != '"') {
      throw new InvalidSyntaxException(fileName, line,
                                       "Unterminated string literal");
    }
    String content = input.substring(start, pos);
    pos++;
    return new Token(TokenType.STRING, content, line);
  }

  private void skipWhitespaceAndComments() throws InvalidSyntaxException {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '\n') {
        line++;
        pos++;
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (input.startsWith("//", pos)) {
        while (pos < input.length() && input.charAt(pos) != '\n') {
          pos++;
        }
      } else if (input.startsWith("/*", pos)) {
        int end = input.indexOf("*/", pos + 2);
        if (end < 0) {
          throw new InvalidSyntaxException(fileName, line,
                                           "Unterminated comment");
        }
        for (int i = pos; i < end; i++) {
          if (input.charAt(i) == '\n') {
            line++;
          }
        }
        pos = end + 2;
      } else {
        return;
      }
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
  }
}
