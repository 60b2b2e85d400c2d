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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import exm.yul.common.exceptions.InvalidSyntaxException;
import exm.yul.tree.Block;
import exm.yul.tree.ForLoop;
import exm.yul.tree.FunctionDefinition;
import exm.yul.tree.Statement;
import exm.yul.tree.Statement.StatementType;
import exm.yul.tree.Switch;
import exm.yul.tree.VariableDeclaration;

public class ParserTest {

  @Test
  public void testStatementKinds() throws Exception {
    Block b = Parser.parse("test",
        "{\n" +
        "  let x, y := f()\n" +
        "  x := 1\n" +
        "  if x { leave }\n" +
        "  switch y case 0 { } default { sstore(0, 1) }\n" +
        "  for { let i := 0 } lt(i, 10) { i := add(i, 1) } { break continue }\n" +
        "  function f() -> a, b { }\n" +
        "  { }\n" +
        "}");
    List<Statement> stmts = b.getStatements();
    assertEquals(7, stmts.size());
    assertEquals(StatementType.VARIABLE_DECLARATION, stmts.get(0).getType());
    assertEquals(StatementType.ASSIGNMENT, stmts.get(1).getType());
    assertEquals(StatementType.IF, stmts.get(2).getType());
    assertEquals(StatementType.SWITCH, stmts.get(3).getType());
    assertEquals(StatementType.FOR_LOOP, stmts.get(4).getType());
    assertEquals(StatementType.FUNCTION_DEFINITION, stmts.get(5).getType());
    assertEquals(StatementType.BLOCK, stmts.get(6).getType());

    VariableDeclaration decl = (VariableDeclaration)stmts.get(0);
    assertEquals(2, decl.getVariables().size());
    assertEquals(2, ((Switch)stmts.get(3)).getCases().size());
    FunctionDefinition def = (FunctionDefinition)stmts.get(5);
    assertEquals("f", def.getName());
    assertEquals(2, def.getReturnVariables().size());
    ForLoop loop = (ForLoop)stmts.get(4);
    assertEquals(1, loop.getPre().getStatements().size());
  }

  @Test
  public void testPrintedFormParsesBack() throws Exception {
    String src = "{ let x := 0x10 function f(a, b) -> r { r := add(a, b) } " +
                 "sstore(x, f(1, \"abc\")) if true { } }";
    Block b = Parser.parse("test", src);
    String printed = b.toString();
    assertEquals(printed, Parser.parse("test", printed).toString());
  }

  @Test
  public void testComments() throws Exception {
    Block b = Parser.parse("test",
        "{ // line comment\n /* block\n comment */ let x := 1 }");
    assertEquals(1, b.getStatements().size());
  }

  @Test
  public void testEmptyBlock() throws Exception {
    assertEquals("{ }", Parser.parse("test", "{}").toString().trim());
  }

  @Test
  public void testErrors() {
    checkError("let x := 1", "no enclosing block");
    checkError("{ let x := 1", "unterminated");
    checkError("{ } }", "trailing input");
    checkError("{ 1 }", "literal as statement");
    checkError("{ x }", "identifier as statement");
    checkError("{ let if := 1 }", "keyword as name");
    checkError("{ switch x }", "no cases");
    checkError("{ let x := 12ab }", "bad number");
    checkError("{ let x := \"abc }", "unterminated string");
    checkError("{ /* }", "unterminated comment");
    checkError("{ let x := # }", "bad character");
  }

  @Test
  public void testErrorLine() {
    try {
      Parser.parse("prog.yul", "{\n\n  let := 1\n}");
      fail("Expected syntax error");
    } catch (InvalidSyntaxException ex) {
      assertTrue(ex.getMessage(), ex.getMessage().startsWith("prog.yul:3:"));
    }
  }

  private static void checkError(String src, String what) {
    try {
      Parser.parse("test", src);
      fail("Expected syntax error for " + what + ": " + src);
    } catch (InvalidSyntaxException ex) {
      // Expected
    }
  }
}
