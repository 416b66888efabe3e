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

package exm.fnp.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.fnp.common.exceptions.InvalidOptionException;

/**
 * General fnp settings.  Defaults are set here and may be overridden
 * by Java system properties with the same key.
 * */
public class Settings
{
  /** Maximum depth of nested brackets accepted by the parser */
  public static final String MAX_NESTING = "fnp.parser.max-nesting";
  /** Pretty-print JSON output of command line tool */
  public static final String JSON_PRETTY = "fnp.json.pretty";

  public static final String LOG_FILE = "fnp.log.file";
  public static final String LOG_TRACE = "fnp.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(MAX_NESTING, "128");
    defaults.setProperty(JSON_PRETTY, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initFnpProperties() throws InvalidOptionException {
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
   * Revert a setting to its default
   */
  public static void reset(String key) {
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(JSON_PRETTY);
    getBoolean(LOG_TRACE);
    if (getInt(MAX_NESTING) <= 0) {
      throw new InvalidOptionException("Expected positive value for option "
                                        + MAX_NESTING + ": " + get(MAX_NESTING));
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
    long val = getLong(key);
    if (val < Integer.MIN_VALUE || val > Integer.MAX_VALUE) {
      throw new InvalidOptionException("Value for option " + key +
                                       " out of range: " + val);
    }
    return (int)val;
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    val = val.trim();
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + val);
    }
  }
}
