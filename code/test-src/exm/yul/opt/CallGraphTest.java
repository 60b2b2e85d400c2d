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

import static exm.yul.opt.OptTestUtil.parse;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.junit.Test;

public class CallGraphTest {

  @Test
  public void testCallees() {
    CallGraph graph = CallGraph.build(parse(
        "{ function f() { g() sstore(0, 1) } function g() { } f() }"));
    assertEquals(Collections.singleton("f"), graph.callees(CallGraph.MAIN));
    assertEquals("Builtins are not recorded",
                 Collections.singleton("g"), graph.callees("f"));
    assertEquals(0, graph.callees("g").size());
  }

  @Test
  public void testNestedFunctionCallsBelongToFunction() {
    CallGraph graph = CallGraph.build(parse(
        "{ function f() { function h() { g() } h() } function g() { } }"));
    assertEquals(0, graph.callees(CallGraph.MAIN).size());
    assertEquals(Collections.singleton("h"), graph.callees("f"));
    assertEquals(Collections.singleton("g"), graph.callees("h"));
  }

  @Test
  public void testReachableAndRecursive() {
    CallGraph graph = CallGraph.build(parse(
        "{ function a() { b() } function b() { a() } function c() { c() } " +
        "function d() { } function e() { a() } d() }"));
    assertEquals(new HashSet<String>(Arrays.asList(CallGraph.MAIN, "d")),
                 graph.reachableFrom(Collections.singleton(CallGraph.MAIN)));
    assertEquals(new HashSet<String>(Arrays.asList("e", "a", "b")),
                 graph.reachableFrom(Collections.singleton("e")));
    assertEquals(new HashSet<String>(Arrays.asList("a", "b", "c")),
                 graph.recursiveFunctions());
  }
}
