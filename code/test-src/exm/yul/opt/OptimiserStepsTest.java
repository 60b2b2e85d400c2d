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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class OptimiserStepsTest {

  @Test
  public void testTableMatchesSteps() {
    Map<String, OptimiserStep> steps = OptimiserSteps.allSteps();
    Map<String, Character> abbrevs = OptimiserSteps.stepNameToAbbreviationMap();
    assertEquals(28, steps.size());
    assertEquals("Every step has an abbreviation", steps.size(),
                 abbrevs.size());
    assertEquals(steps.keySet(), abbrevs.keySet());
  }

  @Test
  public void testMapsAreInverse() {
    Map<String, Character> toAbbrev = OptimiserSteps.stepNameToAbbreviationMap();
    Map<Character, String> toName = OptimiserSteps.stepAbbreviationToNameMap();
    assertEquals(toAbbrev.size(), toName.size());
    for (Map.Entry<String, Character> e: toAbbrev.entrySet()) {
      assertEquals(e.getKey(), toName.get(e.getValue()));
    }
    Set<Character> distinct = new HashSet<Character>(toAbbrev.values());
    assertEquals("Abbreviations are unique", toAbbrev.size(),
                 distinct.size());
  }

  @Test
  public void testStepNamesMatchKeys() {
    for (Map.Entry<String, OptimiserStep> e:
                          OptimiserSteps.allSteps().entrySet()) {
      assertEquals(e.getKey(), e.getValue().getStepName());
    }
  }

  @Test
  public void testNoReservedCharacters() {
    Set<Character> chars = OptimiserSteps.stepAbbreviationToNameMap().keySet();
    assertFalse(chars.contains(' '));
    assertFalse(chars.contains('\n'));
    assertFalse(chars.contains('('));
    assertFalse(chars.contains(')'));
  }

  @Test
  public void testNameCleanerNotRegistered() {
    assertFalse(OptimiserSteps.allSteps().containsKey("VarNameCleaner"));
  }

  @Test
  public void testLookupByAbbreviation() {
    String name = OptimiserSteps.stepAbbreviationToNameMap().get('u');
    assertEquals("UnusedPruner", name);
    OptimiserStep pruner = OptimiserSteps.allSteps().get(name);
    assertNotNull(pruner);
    assertEquals(name, pruner.getStepName());
    assertNull(OptimiserSteps.stepAbbreviationToNameMap().get('?'));
  }

  @Test
  public void testRegistryIsImmutable() {
    Map<String, OptimiserStep> steps = OptimiserSteps.allSteps();
    boolean threw = false;
    try {
      steps.remove("UnusedPruner");
    } catch (UnsupportedOperationException ex) {
      threw = true;
    }
    assertTrue(threw);
    assertSame(steps, OptimiserSteps.allSteps());
  }
}
