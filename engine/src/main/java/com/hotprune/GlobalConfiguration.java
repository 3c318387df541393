/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.hotprune;

import com.hotprune.exception.ConfigurationException;
import com.hotprune.log.LogManager;
import com.hotprune.utility.Callable;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, when
 * missing, environment variables with the same key.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("hotprune.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      if (Boolean.parseBoolean(value.toString()))
        dumpConfiguration(System.out);
      return value;
    }
  }),

  // STORAGE
  PAGE_SIZE("hotprune.pageSize", "Size in bytes of a heap page. Must be a power of 2 between 1024 and 32768", Integer.class, 8192,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          final int size = (Integer) value;
          if (size < 1024 || size > 32768 || Integer.bitCount(size) != 1)
            throw new ConfigurationException("Invalid page size " + size + ": must be a power of 2 between 1024 and 32768");
          return value;
        }
      }),

  // PRUNE
  PRUNE_MIN_FREE_PERCENT("hotprune.prune.minFreePercent",
      "Opportunistic pruning runs only when the free space of the page is below this percentage of the page size", Integer.class, 10,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          checkPercentage("hotprune.prune.minFreePercent", (Integer) value, 0);
          return value;
        }
      }),

  PRUNE_FILL_FACTOR("hotprune.prune.fillFactor", "Default fill factor (percentage) of the relations. 100 means the pages are filled completely",
      Integer.class, 100, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      checkPercentage("hotprune.prune.fillFactor", (Integer) value, 10);
      return value;
    }
  }),

  PRUNE_VERIFY_REDIRECTS("hotprune.prune.verifyRedirects",
      "Verifies after every prune that each redirect slot points to a heap-only tuple. A failed check is fatal", Boolean.class, true),

  OLD_SNAPSHOT_THRESHOLD("hotprune.oldSnapshotThreshold",
      "Time in milliseconds after which a snapshot is considered too old to protect dead tuples from removal. -1 disables the feature", Long.class,
      -1L),

  // REDO LOG
  REDO_FLUSH("hotprune.redo.flush", "Flushes the redo log on disk after every record. 0 = no flush, 1 = flush without metadata, 2 = full flush",
      Integer.class, 1, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      final int v = (Integer) value;
      if (v < 0 || v > 2)
        throw new ConfigurationException("Invalid redo flush type " + v + ": expected 0, 1 or 2");
      return value;
    }
  }),

  // FATAL ERRORS
  FATAL_HALT("hotprune.fatal.halt", "Halts the JVM when a page invariant violation is detected while pruning", Boolean.class, true),

  FATAL_EXIT_CODE("hotprune.fatal.exitCode", "Exit code used when the JVM is halted on a fatal error", Integer.class, 3),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "hotprune.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this(iKey, iDescription, iType, iDefValue, null);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final Callable<Object, Object> callback) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("HOTPRUNE configuration:");

    String lastSection = "";
    for (GlobalConfiguration v : values()) {
      final String subKey = v.key.substring(PREFIX.length());
      final int dot = subKey.indexOf('.');
      final String section = dot > -1 ? subKey.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param iKey Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String iKey) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(iKey))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> iConfig) {
    for (Map.Entry<String, Object> config : iConfig.entrySet()) {
      for (GlobalConfiguration v : values()) {
        if (v.getKey().equals(config.getKey()) || v.name().equals(config.getKey())) {
          v.setValue(config.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    String prop;

    for (GlobalConfiguration config : values()) {
      prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  /**
   * Sets the value converting it to the declared type. Invalid values raise a {@link ConfigurationException} and leave the
   * previous value untouched.
   */
  public void setValue(final Object iValue) {
    if (iValue == null)
      return;

    final Object converted;
    try {
      if (type == Boolean.class)
        converted = Boolean.parseBoolean(iValue.toString());
      else if (type == Integer.class)
        converted = Integer.parseInt(iValue.toString().trim());
      else if (type == Long.class)
        converted = Long.parseLong(iValue.toString().trim());
      else if (type == String.class)
        converted = iValue.toString();
      else
        converted = iValue;
    } catch (final NumberFormatException e) {
      throw new ConfigurationException("Invalid value '" + iValue + "' for setting `" + key + "` of type " + type.getSimpleName(), e);
    }

    Object newValue = converted;
    if (callback != null)
      try {
        newValue = callback.call(converted);
      } catch (final ConfigurationException e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, converted);
        throw e;
      }

    value = newValue;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  private static void checkPercentage(final String key, final int value, final int min) {
    if (value < min || value > 100)
      throw new ConfigurationException("Invalid value " + value + " for setting `" + key + "`: must be between " + min + " and 100");
  }
}
