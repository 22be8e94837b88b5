// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timequery.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

/**
 * Engine configuration.
 * <p>
 * On construction defaults are set for every known key. Callers may then 
 * load a properties file or override single keys. The typed getters throw
 * a {@link NumberFormatException} if the value can't be parsed and a 
 * {@link NullPointerException} if the key is unknown.
 * <p>
 * The config is read once per query execution and turned into an immutable
 * {@link net.timequery.query.QueryLimits}; nothing in here is static.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Max distinct series a statement may read. 0 disables the guard. */
  public static final String MAX_SELECT_SERIES = "query.max_select_series";
  
  /** Max buckets a GROUP BY time statement may produce. 0 disables it. */
  public static final String MAX_SELECT_BUCKETS = "query.max_select_buckets";
  
  /** Max raw points a statement may read. 0 disables the guard. */
  public static final String MAX_SELECT_POINTS = "query.max_select_points";
  
  /** Worker threads for parallel shard scans. 1 scans inline. */
  public static final String SCAN_THREADS = "query.scan_threads";
  
  /** Points buffered per shard worker before it blocks. */
  public static final String SCAN_BUFFER_SIZE = "query.scan_buffer_size";
  
  /** Per query deadline in milliseconds. 0 means none. */
  public static final String TIMEOUT_MS = "query.timeout_ms";
  
  /** Max rows per emitted series chunk. 0 emits whole series. */
  public static final String CHUNK_SIZE = "query.chunk_size";
  
  /** The properties configured to their defaults or modified by users. */
  protected final Properties properties = new Properties();

  /** Tracks the location of the file that was actually loaded. */
  private String config_location;

  /**
   * Default ctor, only defaults are set.
   */
  public Config() {
    setDefaults();
  }
  
  /**
   * Loads the given properties file then fills in defaults.
   * @param file Path to the file to load.
   * @throws FileNotFoundException if the file wasn't found.
   * @throws IOException if unable to read or parse the file.
   */
  public Config(final String file) throws FileNotFoundException, IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Copy ctor. Changes to the copy don't affect the parent.
   * @param parent The config to copy from.
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Overrides a single property.
   * @param property The name of the property to override.
   * @param value The value to store.
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The property to load.
   * @return The property value as a string or null if it doesn't exist.
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * @param property The property to load.
   * @return A parsed integer.
   * @throws NumberFormatException if the property could not be parsed.
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.getProperty(property));
  }

  /**
   * @param property The property to load.
   * @return A parsed long.
   * @throws NumberFormatException if the property could not be parsed.
   */
  public final long getLong(final String property) {
    return Long.parseLong(properties.getProperty(property));
  }

  /**
   * Returns the given property as a boolean. "1", "true" and "yes" in any
   * case are true, anything else is false.
   * @param property The property to load.
   * @return A parsed boolean.
   * @throws NullPointerException if the property was not found.
   */
  public final boolean getBoolean(final String property) {
    final String raw = properties.getProperty(property);
    if (raw == null) {
      throw new NullPointerException("No such property: " + property);
    }
    final String val = raw.trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * @param property The property to search for.
   * @return True if the property exists and is not empty.
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.getProperty(property);
    return val != null && !val.isEmpty();
  }

  /** @return The location of the loaded file, null if none was loaded. */
  public String configLocation() {
    return config_location;
  }
  
  /**
   * @return A simple string with the configured properties for debugging.
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }
    final StringBuilder response = new StringBuilder("Query Configuration:\n");
    response.append("File [").append(config_location).append("]\n");
    final Enumeration<?> e = properties.propertyNames();
    while (e.hasMoreElements()) {
      final String key = (String) e.nextElement();
      response.append("Key [").append(key).append("]  Value [")
          .append(properties.getProperty(key)).append("]\n");
    }
    return response.toString();
  }

  /**
   * Loads default entries that were not provided by a file or override.
   */
  protected void setDefaults() {
    final Map<String, String> map = Maps.newHashMap();
    map.put(MAX_SELECT_SERIES, "0");
    map.put(MAX_SELECT_BUCKETS, "0");
    map.put(MAX_SELECT_POINTS, "0");
    map.put(SCAN_THREADS, "4");
    map.put(SCAN_BUFFER_SIZE, "1024");
    map.put(TIMEOUT_MS, "0");
    map.put(CHUNK_SIZE, "0");

    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Loads the configuration from the given location.
   * @param file Path to the file to load.
   * @throws FileNotFoundException if the config file was not found.
   * @throws IOException if there was an issue reading the file.
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final InputStream stream = new FileInputStream(file)) {
      properties.clear();
      properties.load(stream);
    }
    LOG.info("Successfully loaded configuration file: " + file);
    config_location = file;
  }
  
  /**
   * Loads properties from a classpath resource on top of the current ones.
   * @param resource The resource name.
   * @throws IOException if the resource exists but can't be read.
   * @return True if the resource was found and loaded.
   */
  public boolean loadResource(final String resource) throws IOException {
    try (final InputStream stream = 
        Config.class.getClassLoader().getResourceAsStream(resource)) {
      if (stream == null) {
        LOG.debug("Unable to find resource " + resource);
        return false;
      }
      properties.load(stream);
    }
    LOG.info("Successfully loaded configuration resource: " + resource);
    config_location = resource;
    return true;
  }

}
