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
package exm.yul.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Test;

import exm.yul.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void restoreDefaults() {
    Settings.unset(Settings.OPT_MAX_ROUNDS);
    Settings.unset(Settings.OPT_DEBUG);
    Settings.unset(Settings.EVM_CREATION);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(12, Settings.getInt(Settings.OPT_MAX_ROUNDS));
    assertEquals(200, Settings.getLong(Settings.EVM_RUNS));
    assertEquals("none", Settings.get(Settings.OPT_DEBUG));
    assertFalse(Settings.getBoolean(Settings.EVM_CREATION));
    Settings.validateProperties();
  }

  @Test
  public void testOverrideAndUnset() throws InvalidOptionException {
    Settings.set(Settings.OPT_MAX_ROUNDS, "3");
    assertEquals(3, Settings.getInt(Settings.OPT_MAX_ROUNDS));
    Settings.unset(Settings.OPT_MAX_ROUNDS);
    assertEquals(12, Settings.getInt(Settings.OPT_MAX_ROUNDS));
  }

  @Test
  public void testInvalidValues() {
    checkInvalid(Settings.OPT_MAX_ROUNDS, "0");
    checkInvalid(Settings.OPT_MAX_ROUNDS, "many");
    checkInvalid(Settings.OPT_DEBUG, "verbose");
    checkInvalid(Settings.EVM_CREATION, "yes");
  }

  @Test
  public void testDebugModeCaseInsensitive() throws InvalidOptionException {
    Settings.set(Settings.OPT_DEBUG, "PRINT-STEP");
    Settings.validateProperties();
  }

  private static void checkInvalid(String key, String value) {
    Settings.set(key, value);
    try {
      Settings.validateProperties();
      fail("Expected " + key + "=" + value + " to be rejected");
    } catch (InvalidOptionException ex) {
      // Expected
    } finally {
      Settings.unset(key);
    }
  }
}
