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
package exm.fortx.common;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import exm.fortx.common.exceptions.InvalidOptionException;

/**
 * Settings for one analysis session.
 *
 * Values come from the defaults below, optionally overridden by a
 * properties file, by Java system properties with the same key, and
 * finally by explicit calls to {@link #set(String, String)}.
 * Each session owns its own instance.
 */
public class Settings
{
  public static final String FRONTEND_DEFAULT = "fortx.frontend.default";
  /** Prefix for per-file frontend overrides: fortx.frontend.&lt;glob&gt; */
  public static final String FRONTEND_OVERRIDE_PREFIX = "fortx.frontend.";
  public static final String FRONTEND_XML_COMMAND = "fortx.frontend.xml.command";
  public static final String FRONTEND_LINE_EXPAND_INCLUDES =
                                    "fortx.frontend.line.expand-includes";
  public static final String INCLUDE_PATH = "fortx.include-path";

  public static final String PASSES = "fortx.passes";
  public static final String ROOTS = "fortx.roots";
  public static final String RULES = "fortx.rules";
  public static final String RULE_PREFIX = "fortx.rule.";

  public static final String WORKERS = "fortx.workers";
  public static final String MAX_PROCESSES = "fortx.max-processes";
  public static final String SCHEDULE_MAX_ROUNDS = "fortx.schedule.max-rounds";
  public static final String TIMEOUT_MS = "fortx.timeout-ms";

  public static final String LOOP_PRAGMA_TEXT = "fortx.pass.loop-pragmas.text";
  public static final String REMOVE_CALLS_NAMES = "fortx.pass.remove-calls.names";
  public static final String DUPLICATE_KERNEL_NAMES =
                                  "fortx.pass.duplicate-kernel.names";
  public static final String DUPLICATE_KERNEL_SUFFIX =
                                  "fortx.pass.duplicate-kernel.suffix";

  public static final String REGEN_CHECK_ROUNDTRIP = "fortx.regen.check-roundtrip";

  public static final String LOG_FILE = "fortx.log.file";
  public static final String LOG_TRACE = "fortx.log.trace";

  private static final List<String> FRONTENDS =
          Arrays.asList("antlr", "line", "xml");

  private static final List<String> SEVERITIES =
          Arrays.asList("off", "info", "warning", "error");

  private final Properties properties;

  public Settings() {
    Properties defaults = new Properties();
    defaults.setProperty(FRONTEND_DEFAULT, "ANTLR");
    defaults.setProperty(FRONTEND_XML_COMMAND, "");
    defaults.setProperty(FRONTEND_LINE_EXPAND_INCLUDES, "false");
    defaults.setProperty(INCLUDE_PATH, "");
    defaults.setProperty(PASSES, "");
    defaults.setProperty(ROOTS, "");
    defaults.setProperty(RULES, "all");
    defaults.setProperty(WORKERS,
        String.valueOf(Runtime.getRuntime().availableProcessors()));
    defaults.setProperty(MAX_PROCESSES, "2");
    defaults.setProperty(SCHEDULE_MAX_ROUNDS, "10");
    defaults.setProperty(TIMEOUT_MS, "0");
    defaults.setProperty(LOOP_PRAGMA_TEXT, "!$acc parallel loop");
    defaults.setProperty(REMOVE_CALLS_NAMES, "");
    defaults.setProperty(DUPLICATE_KERNEL_NAMES, "");
    defaults.setProperty(DUPLICATE_KERNEL_SUFFIX, "_duplicated");
    defaults.setProperty(REGEN_CHECK_ROUNDTRIP, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    this.properties = new Properties(defaults);
  }

  /**
   * Load settings from a properties file, on top of the defaults
   * @param file
   * @throws InvalidOptionException if file could not be read
   */
  public void load(File file) throws InvalidOptionException {
    InputStream in = null;
    try {
      in = FileUtils.openInputStream(file);
      properties.load(in);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not read settings file "
                                       + file + ": " + e.getMessage());
    } finally {
      if (in != null) {
        try {
          in.close();
        } catch (IOException e) {
          throw new InvalidOptionException("Error closing " + file + ": "
                                           + e.getMessage());
        }
      }
    }
  }

  /**
     Overwrite each fortx property with the system property value
     of the same name, if set
   */
  public void loadSystemProperties() {
    for (String key: System.getProperties().stringPropertyNames()) {
      if (key.startsWith("fortx.")) {
        properties.setProperty(key, System.getProperty(key));
      }
    }
  }

  public void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Comma-separated list setting
   * @param key
   * @return possibly empty list of trimmed, non-empty items
   */
  public List<String> getList(String key) {
    String val = properties.getProperty(key);
    List<String> result = new ArrayList<String>();
    if (val == null) {
      return result;
    }
    for (String item: StringUtils.split(val, ',')) {
      String trimmed = item.trim();
      if (trimmed.length() > 0) {
        result.add(trimmed);
      }
    }
    return result;
  }

  /**
   * Unix-style colon-separated list of directories
   * @return possibly empty list
   */
  public List<String> getIncludePath() {
    String path = get(INCLUDE_PATH);
    List<String> result = new ArrayList<String>();
    if (StringUtils.isBlank(path)) {
      return result;
    }
    for (String dir: path.split(":")) {
      if (dir.length() > 0) {
        result.add(dir);
      }
    }
    return result;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public void validate() throws InvalidOptionException {
    checkOneOf(FRONTEND_DEFAULT, FRONTENDS);
    getBoolean(FRONTEND_LINE_EXPAND_INCLUDES);
    getBoolean(REGEN_CHECK_ROUNDTRIP);
    getBoolean(LOG_TRACE);

    checkPositive(WORKERS);
    checkPositive(MAX_PROCESSES);
    checkPositive(SCHEDULE_MAX_ROUNDS);
    if (getLong(TIMEOUT_MS) < 0) {
      throw new InvalidOptionException("Expected non-negative value for "
                                       + TIMEOUT_MS);
    }

    if (!get(DUPLICATE_KERNEL_SUFFIX).trim().matches("[A-Za-z0-9_]+")) {
      throw new InvalidOptionException("Expected letters, digits or " +
          "underscores for " + DUPLICATE_KERNEL_SUFFIX + " but was '" +
          get(DUPLICATE_KERNEL_SUFFIX) + "'");
    }

    for (String key: getKeys()) {
      if (key.startsWith(RULE_PREFIX) && key.endsWith(".severity")) {
        checkOneOf(key, SEVERITIES);
      } else if (key.startsWith(FRONTEND_OVERRIDE_PREFIX)
              && !isReservedFrontendKey(key)) {
        checkOneOf(key, FRONTENDS);
      }
    }
  }

  /**
   * @param key
   * @return true if key is a frontend setting rather than a file override
   */
  public static boolean isReservedFrontendKey(String key) {
    return key.equals(FRONTEND_DEFAULT) ||
           key.startsWith(FRONTEND_OVERRIDE_PREFIX + "xml.") ||
           key.startsWith(FRONTEND_OVERRIDE_PREFIX + "line.");
  }

  private void checkPositive(String key) throws InvalidOptionException {
    if (getLong(key) <= 0) {
      throw new InvalidOptionException("Expected positive value for " + key
                                       + " but was " + get(key));
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  public void checkOneOf(String key, List<String> validVals)
                                            throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.trim().equalsIgnoreCase(vv)) {
        return;
      }
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: '" + StringUtils.join(validVals, "', '") +
        "' but was '" + val + "'");
  }

  public long getLong(String key) throws InvalidOptionException {
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

  public int getInt(String key) throws InvalidOptionException {
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

  public boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
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
