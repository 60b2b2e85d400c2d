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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import exm.yul.common.exceptions.InvalidOptionException;

/**
 * General optimiser settings
 *
 * Defaults are set here and can be overridden by Java system properties
 * with the same key, see {@link #initYoptProperties()}.
 * */
public class Settings
{
  public static final String INPUT_FILENAME = "yopt.input_filename";
  public static final String OUTPUT_FILENAME = "yopt.output_filename";

  /* Round cap for each "(...)" loop in a step sequence */
  public static final String OPT_MAX_ROUNDS = "yopt.opt.max-rounds";
  public static final String OPT_STACK_COMPRESSOR_MAX_ITERATIONS =
                          "yopt.opt.stack-compressor-max-iterations";
  /* none, print-step or print-changes */
  public static final String OPT_DEBUG = "yopt.opt.debug";
  /* Replaces the built-in default sequence if non-empty */
  public static final String OPT_DEFAULT_SEQUENCE = "yopt.opt.default-sequence";
  /* Max code size of a function body the full inliner copies to
   * call sites that are not the only call */
  public static final String OPT_FULL_INLINE_THRESHOLD =
                          "yopt.opt.full-inline-threshold";

  public static final String EVM_RUNS = "yopt.evm.runs";
  public static final String EVM_CREATION = "yopt.evm.creation";

  public static final String LOG_FILE = "yopt.log.file";
  public static final String LOG_TRACE = "yopt.log.trace";

  public static final List<String> DEBUG_MODES =
        Collections.unmodifiableList(
            Arrays.asList("none", "print-step", "print-changes"));

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(OPT_MAX_ROUNDS, "12");
    // This is a tuning parameter, but actually just prevents infinite loops
    defaults.setProperty(OPT_STACK_COMPRESSOR_MAX_ITERATIONS, "16");
    defaults.setProperty(OPT_DEBUG, "none");
    defaults.setProperty(OPT_DEFAULT_SEQUENCE, "");
    defaults.setProperty(OPT_FULL_INLINE_THRESHOLD, "8");
    defaults.setProperty(EVM_RUNS, "200");
    defaults.setProperty(EVM_CREATION, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initYoptProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set for key so that the default applies again
   */
  public static void unset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    checkPositive(OPT_MAX_ROUNDS);
    checkPositive(OPT_STACK_COMPRESSOR_MAX_ITERATIONS);
    checkPositive(OPT_FULL_INLINE_THRESHOLD);
    checkPositive(EVM_RUNS);
    getBoolean(EVM_CREATION);
    getBoolean(LOG_TRACE);
    checkOneOf(OPT_DEBUG, DEBUG_MODES);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  private static void checkPositive(String key) throws InvalidOptionException {
    if (getLong(key) <= 0) {
      throw new InvalidOptionException("Expected positive value for option "
                                      + key + " but was " + get(key));
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase(Locale.ROOT);
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
