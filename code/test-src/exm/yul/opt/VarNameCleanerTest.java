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

import static exm.yul.opt.OptTestUtil.context;
import static exm.yul.opt.OptTestUtil.logger;
import static exm.yul.opt.OptTestUtil.normalize;
import static exm.yul.opt.OptTestUtil.parse;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.yul.backends.evm.EvmDialect;
import exm.yul.tree.Block;

public class VarNameCleanerTest {

  @Test
  public void testSuffixesStripped() {
    Block ast = parse("{ let x_3 := 1 let y_1_2 := 2 sstore(x_3, y_1_2) " +
                      "function f(a_5) -> r_2 { r_2 := a_5 } }");
    VarNameCleaner.run(logger, context(EvmDialect.instance(), ast), ast);
    assertEquals(normalize("{ let x := 1 let y := 2 sstore(x, y) " +
                           "function f(a) -> r { r := a } }"),
                 ast.toString());
  }

  @Test
  public void testNamesPerFunction() {
    Block ast = parse("{ function f(a) -> r { r := a } " +
                      "function g(a_1) -> r_2 { r_2 := a_1 } }");
    VarNameCleaner.run(logger, context(EvmDialect.instance(), ast), ast);
    assertEquals(normalize("{ function f(a) -> r { r := a } " +
                           "function g(a) -> r { r := a } }"),
                 ast.toString());
  }

  @Test
  public void testClashesResolved() {
    Block ast = parse("{ function x() { } let x_1 := 1 let x_2 := 2 " +
                      "sstore(x_1, x_2) }");
    VarNameCleaner.run(logger, context(EvmDialect.instance(), ast), ast);
    assertEquals("Function names and builtins are never used",
        normalize("{ function x() { } let x_1 := 1 let x_2 := 2 " +
                  "sstore(x_1, x_2) }"), ast.toString());
  }

  @Test
  public void testBuiltinNamesAvoided() {
    Block ast = parse("{ let add_1 := 1 sstore(0, add_1) }");
    VarNameCleaner.run(logger, context(EvmDialect.instance(), ast), ast);
    assertEquals(normalize("{ let add_1 := 1 sstore(0, add_1) }"),
                 ast.toString());
  }

  @Test
  public void testReservedKept() {
    Block ast = parse("{ let x_1 := 1 let x_7 := 2 sstore(x_1, x_7) }");
    VarNameCleaner.run(logger, context(EvmDialect.instance(), ast, "x_1"),
                       ast);
    assertEquals(normalize("{ let x_1 := 1 let x := 2 sstore(x_1, x) }"),
                 ast.toString());
  }
}
