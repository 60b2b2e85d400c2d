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

import static exm.yul.opt.OptTestUtil.logger;
import static exm.yul.opt.OptTestUtil.normalize;
import static exm.yul.opt.OptTestUtil.parse;
import static org.junit.Assert.assertEquals;

import java.util.Collections;
import java.util.Set;

import org.junit.Test;

import exm.yul.backends.evm.EvmDialect;
import exm.yul.dialect.Dialect;
import exm.yul.tree.Block;

public class DisambiguatorTest {
  private final Dialect dialect = EvmDialect.instance();
  private final Set<String> noReserved = Collections.emptySet();

  @Test
  public void testSiblingScopes() {
    Block ast = parse("{ { let x := 1 sstore(0, x) } " +
                      "{ let x := 2 sstore(1, x) } }");
    assertEquals(1, Disambiguator.run(logger, dialect, ast, noReserved));
    assertEquals(normalize("{ { let x := 1 sstore(0, x) } " +
                           "{ let x_1 := 2 sstore(1, x_1) } }"),
                 ast.toString());
  }

  @Test
  public void testFunctions() {
    Block ast = parse("{ function f(a) -> r { r := a } " +
                      "function g(a) -> r { r := a } sstore(f(1), g(2)) }");
    assertEquals(2, Disambiguator.run(logger, dialect, ast, noReserved));
    assertEquals(normalize("{ function f(a) -> r { r := a } " +
                           "function g(a_1) -> r_2 { r_2 := a_1 } " +
                           "sstore(f(1), g(2)) }"),
                 ast.toString());
  }

  @Test
  public void testLoopScopes() {
    Block ast = parse(
        "{ for { let i := 0 } lt(i, 2) { i := add(i, 1) } { } " +
        "for { let i := 0 } lt(i, 3) { i := add(i, 1) } { } }");
    Disambiguator.run(logger, dialect, ast, noReserved);
    assertEquals(normalize(
        "{ for { let i := 0 } lt(i, 2) { i := add(i, 1) } { } " +
        "for { let i_1 := 0 } lt(i_1, 3) { i_1 := add(i_1, 1) } { } }"),
        ast.toString());
  }

  @Test
  public void testReservedNamesAvoided() {
    Block ast = parse("{ { let x := 1 } { let x := 2 } }");
    Disambiguator.run(logger, dialect, ast, Collections.singleton("x_1"));
    assertEquals(normalize("{ { let x := 1 } { let x_2 := 2 } }"),
                 ast.toString());
  }

  @Test
  public void testIdempotent() {
    Block ast = parse("{ { let x := 1 sstore(0, x) } " +
                      "{ let x := 2 sstore(1, x) } function f(x) { } }");
    Disambiguator.run(logger, dialect, ast, noReserved);
    String once = ast.toString();
    assertEquals("Unique names stay", 0,
                 Disambiguator.run(logger, dialect, ast, noReserved));
    assertEquals(once, ast.toString());
  }
}
