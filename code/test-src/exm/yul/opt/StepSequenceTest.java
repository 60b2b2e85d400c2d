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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.yul.common.exceptions.InvalidSequenceException;
import exm.yul.common.exceptions.UserException;
import exm.yul.opt.StepSequence.SequenceElement;

public class StepSequenceTest {

  @Test
  public void testEmpty() throws Exception {
    assertTrue(StepSequence.parse("").getElements().isEmpty());
    assertTrue("Whitespace only",
               StepSequence.parse(" \n ").getElements().isEmpty());
  }

  @Test
  public void testPlainAndLoop() throws Exception {
    List<SequenceElement> elems = StepSequence.parse("dm (ul) u").getElements();
    assertEquals(3, elems.size());

    assertFalse(elems.get(0).isRepeatUntilStable());
    assertEquals(Arrays.asList("VarDeclInitializer", "Rematerialiser"),
                 elems.get(0).getSteps());

    assertTrue(elems.get(1).isRepeatUntilStable());
    assertEquals(Arrays.asList("UnusedPruner", "CircularReferencesPruner"),
                 elems.get(1).getSteps());

    assertFalse(elems.get(2).isRepeatUntilStable());
    assertEquals(Arrays.asList("UnusedPruner"), elems.get(2).getSteps());
  }

  @Test
  public void testEmptyLoopAllowed() throws Exception {
    List<SequenceElement> elems = StepSequence.parse("()").getElements();
    assertEquals(1, elems.size());
    assertTrue(elems.get(0).isRepeatUntilStable());
    assertEquals(Collections.emptyList(), elems.get(0).getSteps());
  }

  @Test
  public void testDefaultSequenceParses() throws Exception {
    List<SequenceElement> elems =
          StepSequence.parse(OptimiserSuite.DEFAULT_SEQUENCE).getElements();
    assertEquals("Prefix, loop and suffix", 3, elems.size());
    assertTrue(elems.get(1).isRepeatUntilStable());
  }

  @Test
  public void testUnclosedLoop() {
    InvalidSequenceException ex = expectError("(");
    assertEquals("Unbalanced parenthesis (at end of sequence)",
                 ex.getMessage());
    assertEquals('(', ex.getAbbreviation());
    assertEquals(InvalidSequenceException.END_OF_INPUT, ex.getPosition());
  }

  @Test
  public void testUnopenedLoop() {
    InvalidSequenceException ex = expectError(")");
    assertEquals(')', ex.getAbbreviation());
    assertEquals(0, ex.getPosition());
    assertTrue(ex.getMessage().startsWith("Unbalanced parenthesis"));
  }

  @Test
  public void testNestedLoop() {
    InvalidSequenceException ex = expectError("((");
    assertEquals('(', ex.getAbbreviation());
    assertEquals(1, ex.getPosition());
    assertTrue(ex.getMessage().startsWith("Nested parentheses"));
  }

  @Test
  public void testSecondLoopUnclosed() {
    InvalidSequenceException ex = expectError("()(");
    assertEquals(InvalidSequenceException.END_OF_INPUT, ex.getPosition());
  }

  @Test
  public void testUnknownAbbreviation() {
    InvalidSequenceException ex = expectError("du?m");
    assertEquals('?', ex.getAbbreviation());
    assertEquals(2, ex.getPosition());
    assertTrue(ex.getMessage().startsWith(
                        "Invalid optimisation step abbreviation"));
  }

  @Test
  public void testTabIsNotWhitespace() {
    InvalidSequenceException ex = expectError("d\tu");
    assertEquals('\t', ex.getAbbreviation());
  }

  @Test
  public void testIsUserError() {
    assertTrue(UserException.class.isInstance(expectError(")")));
  }

  private static InvalidSequenceException expectError(String sequence) {
    try {
      StepSequence.parse(sequence);
    } catch (InvalidSequenceException ex) {
      return ex;
    }
    fail("Expected error parsing \"" + sequence + "\"");
    return null;
  }
}
