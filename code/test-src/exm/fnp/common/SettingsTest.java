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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.fnp.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void cleanup() {
    System.clearProperty(Settings.MAX_NESTING);
    System.clearProperty(Settings.JSON_PRETTY);
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(128, Settings.getInt(Settings.MAX_NESTING));
    assertFalse(Settings.getBoolean(Settings.JSON_PRETTY));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.MAX_NESTING));
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.MAX_NESTING, "64");
    assertEquals(64, Settings.getInt(Settings.MAX_NESTING));
    Settings.reset(Settings.MAX_NESTING);
    assertEquals("Reset reverts to default",
                 128, Settings.getInt(Settings.MAX_NESTING));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.JSON_PRETTY, "TRUE");
    Settings.initFnpProperties();
    assertTrue(Settings.getBoolean(Settings.JSON_PRETTY));
  }

  @Test
  public void testNonPositiveNesting() throws InvalidOptionException {
    System.setProperty(Settings.MAX_NESTING, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initFnpProperties();
  }

  @Test
  public void testBadInteger() throws InvalidOptionException {
    Settings.set(Settings.MAX_NESTING, "lots");
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.MAX_NESTING);
  }

  @Test
  public void testOutOfRangeInteger() throws InvalidOptionException {
    Settings.set(Settings.MAX_NESTING, "9999999999");
    assertEquals(9999999999L, Settings.getLong(Settings.MAX_NESTING));
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.MAX_NESTING);
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testMissingKey() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.getLong("fnp.no-such-option");
  }
}
