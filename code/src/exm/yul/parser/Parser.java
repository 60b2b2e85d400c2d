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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.yul.common.exceptions.InvalidSyntaxException;
import exm.yul.tree.Assignment;
import exm.yul.tree.Block;
import exm.yul.tree.Break;
import exm.yul.tree.Case;
import exm.yul.tree.Continue;
import exm.yul.tree.Expression;
import exm.yul.tree.Expression.ExpressionType;
import exm.yul.tree.ExpressionStatement;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionCall;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Identifier;
import exm.yul.tree.If;
import exm.yul.tree.Leave;
import exm.yul.tree.Literal;
import exm.yul.tree.Literal.LiteralKind;
import exm.yul.tree.Statement;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

/**
 * Recursive descent parser producing a program tree from source text.
 * The input must be a single block.
 */
public class Parser {
  private static final Set<String> KEYWORDS = new HashSet<String>(
      Arrays.asList("let", "if", "switch", "case", "default", "for",
                    "break", "continue", "leave", "function",
                    "true", "false"));

  private final String fileName;
  private final List<Token> tokens;
  private int pos = 0;

  public Parser(String fileName, List<Token> tokens) {
    this.fileName = fileName;
    this.tokens = tokens;
  }

  /**
   * Parse source text holding one block
   */
  public static Block parse(String fileName, String source)
                                      throws InvalidSyntaxException {
    Lexer lexer = new Lexer(fileName, source);
    Parser parser = new Parser(fileName, lexer.tokenize());
    return parser.parseProgram();
  }

  public Block parseProgram() throws InvalidSyntaxException {
    Block block = parseBlock();
    if (cur().getType() != TokenType.EOF) {
      throw error("Expected end of input but got " + cur());
    }
    return block;
  }

  private Token cur() {
    return tokens.get(pos);
  }

  private Token peek(int offset) {
    int i = Math.min(pos + offset, tokens.size() - 1);
    return tokens.get(i);
  }

  private Token consume(TokenType type) throws InvalidSyntaxException {
    Token t = cur();
    if (t.getType() != type) {
      throw error("Expected " + type + " but got " + t);
    }
    pos++;
    return t;
  }

  private void consumeKeyword(String kw) throws InvalidSyntaxException {
    if (!cur().isKeyword(kw)) {
      throw error("Expected " + kw + " but got " + cur());
    }
    pos++;
  }

  private InvalidSyntaxException error(String msg) {
    return new InvalidSyntaxException(fileName, cur().getLine(), msg);
  }

  private Block parseBlock() throws InvalidSyntaxException {
    consume(TokenType.LBRACE);
    List<Statement> stmts = new ArrayList<Statement>();
    while (cur().getType() != TokenType.RBRACE) {
      if (cur().getType() == TokenType.EOF) {
        throw error("Unterminated block");
      }
      stmts.add(parseStatement());
    }
    consume(TokenType.RBRACE);
    return new Block(stmts);
  }

  private Statement parseStatement() throws InvalidSyntaxException {
    Token t = cur();
    if (t.getType() == TokenType.LBRACE) {
      return parseBlock();
    } else if (t.getType() != TokenType.IDENTIFIER) {
      throw error("Expected statement but got " + t);
    }

    String word = t.getContent();
    if (word.equals("let")) {
      pos++;
      List<String> names = parseNameList();
      Expression value = null;
      if (cur().getType() == TokenType.ASSIGN) {
        pos++;
        value = parseExpression();
      }
      return new VariableDeclaration(names, value);
    } else if (word.equals("if")) {
      pos++;
      Expression cond = parseExpression();
      return new If(cond, parseBlock());
    } else if (word.equals("switch")) {
      return parseSwitch();
    } else if (word.equals("for")) {
      pos++;
      Block pre = parseBlock();
      Expression cond = parseExpression();
      Block post = parseBlock();
      return new ForLoop(pre, cond, post, parseBlock());
    } else if (word.equals("break")) {
      pos++;
      return new Break();
    } else if (word.equals("continue")) {
      pos++;
      return new Continue();
    } else if (word.equals("leave")) {
      pos++;
      return new Leave();
    } else if (word.equals("function")) {
      return parseFunctionDefinition();
    }

    TokenType next = peek(1).getType();
    if (next == TokenType.COMMA || next == TokenType.ASSIGN) {
      List<String> names = parseNameList();
      consume(TokenType.ASSIGN);
      return new Assignment(names, parseExpression());
    }

    Expression expr = parseExpression();
    if (expr.getType() != ExpressionType.FUNCTION_CALL) {
      throw error("Only function calls can be used as statements");
    }
    return new ExpressionStatement(expr);
  }

  private Switch parseSwitch() throws InvalidSyntaxException {
    consumeKeyword("switch");
    Expression expr = parseExpression();
    List<Case> cases = new ArrayList<Case>();
    while (cur().isKeyword("case")) {
      pos++;
      Expression value = parseExpression();
      if (value.getType() != ExpressionType.LITERAL) {
        throw error("Case value must be a literal");
      }
      cases.add(new Case((Literal)value, parseBlock()));
    }
    if (cur().isKeyword("default")) {
      pos++;
      cases.add(new Case(null, parseBlock()));
    }
    if (cases.isEmpty()) {
      throw error("Switch needs at least one case or a default");
    }
    return new Switch(expr, cases);
  }

  private FunctionDefinition parseFunctionDefinition()
                                          throws InvalidSyntaxException {
    consumeKeyword("function");
    String name = parseName();
    consume(TokenType.LPAREN);
    List<String> params = new ArrayList<String>();
    if (cur().getType() != TokenType.RPAREN) {
      params = parseNameList();
    }
    consume(TokenType.RPAREN);
    List<String> returns = new ArrayList<String>();
    if (cur().getType() == TokenType.ARROW) {
      pos++;
      returns = parseNameList();
    }
    return new FunctionDefinition(name, params, returns, parseBlock());
  }

  private List<String> parseNameList() throws InvalidSyntaxException {
    List<String> names = new ArrayList<String>();
    names.add(parseName());
    while (cur().getType() == TokenType.COMMA) {
      pos++;
      names.add(parseName());
    }
    return names;
  }

  private String parseName() throws InvalidSyntaxException {
    Token t = consume(TokenType.IDENTIFIER);
    if (KEYWORDS.contains(t.getContent())) {
      pos--;
      throw error("Keyword " + t + " used as name");
    }
    return t.getContent();
  }

  private Expression parseExpression() throws InvalidSyntaxException {
    Token t = cur();
    switch (t.getType()) {
      case NUMBER:
        pos++;
        return new Literal(LiteralKind.NUMBER, t.getContent());
      case STRING:
        pos++;
        return new Literal(LiteralKind.STRING, t.getContent());
      case IDENTIFIER:
        break;
      default:
        throw error("Expected expression but got " + t);
    }

    if (t.isKeyword("true") || t.isKeyword("false")) {
      pos++;
      return new Literal(LiteralKind.BOOLEAN, t.getContent());
    }
    String name = parseName();
    if (cur().getType() != TokenType.LPAREN) {
      return new Identifier(name);
    }
    pos++;
    List<Expression> args = new ArrayList<Expression>();
    if (cur().getType() != TokenType.RPAREN) {
      args.add(parseExpression());
      while (cur().getType() == TokenType.COMMA) {
        pos++;
        args.add(parseExpression());
      }
    }
    consume(TokenType.RPAREN);
    return new FunctionCall(name, args);
  }
}
