// This file is part of seriescache.
// Copyright (C) 2021-2022  The seriescache Authors.
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
package net.seriescache.configuration;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.seriescache.utils.DateTime;

/**
 * Cache configuration.
 * <p>
 * On initialization default values are configured for all the keys below,
 * then values from a properties file, if given or found, replace them.
 * Wherever you need a value, use the typed helper, accounting for the
 * exceptions thrown on unparseable values.
 * <p>
 * The number helpers throw {@link NumberFormatException}s if the property is
 * null or unparseable. {@link #getString(String)} returns null if the
 * property isn't found.
 * <p>
 * Keys:
 * <ul>
 * <li>{@value #MARGINS_KEY} - Factor applied to requested ranges before
 * rounding them to fragments. Default 1.2</li>
 * <li>{@value #MARGIN_ANCHOR_KEY} - START or CENTER. Default START</li>
 * <li>{@value #RETENTION_KEY} - How long unversioned entries are used
 * without revalidation. Default 14d</li>
 * <li>{@value #FRAGMENT_HOURS_KEY} - Default fragment size in hours when a
 * provider doesn't supply its own. Default 1</li>
 * <li>{@value #PREFIX_KEY} - Prefix prepended to every key. Default empty</li>
 * <li>{@value #MAX_OBJECTS_KEY} - Maximum entries kept by the in-memory
 * store. Default 1024</li>
 * </ul>
 *
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  public static final String MARGINS_KEY = "seriescache.cache.margins";
  public static final String MARGIN_ANCHOR_KEY = "seriescache.cache.margin_anchor";
  public static final String RETENTION_KEY = "seriescache.cache.retention";
  public static final String FRAGMENT_HOURS_KEY = "seriescache.cache.fragment_hours";
  public static final String PREFIX_KEY = "seriescache.cache.prefix";
  public static final String MAX_OBJECTS_KEY = "seriescache.cache.max_objects";

  /** Locations searched when auto loading. */
  public static final List<String> DEFAULT_LOCATIONS = ImmutableList.of(
      "seriescache.conf",
      "/etc/seriescache.conf",
      "/etc/seriescache/seriescache.conf");

  /** Holds default values for the config */
  protected static final Map<String, String> DEFAULTS =
      ImmutableMap.<String, String>builder()
        .put(MARGINS_KEY, "1.2")
        .put(MARGIN_ANCHOR_KEY, "START")
        .put(RETENTION_KEY, "14d")
        .put(FRAGMENT_HOURS_KEY, "1")
        .put(PREFIX_KEY, "")
        .put(MAX_OBJECTS_KEY, "1024")
        .build();

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties =
    new HashMap<String, String>();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Creates a config with the defaults only.
   */
  public Config() {
    setDefaults();
  }

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file in {@link #DEFAULT_LOCATIONS}.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   */
  public Config(final boolean auto_load_config) {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and loads the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Constructor for components that want a copy of the parent properties so
   * that local overrides don't leak back.
   * @param parent Parent configuration object to copy from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation or loading.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The property to load
   * @return The property value or null if it wasn't set.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * @param property The property to load
   * @return A parsed integer
   * @throws NumberFormatException if the property could not be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * @param property The property to load
   * @return A parsed long
   * @throws NumberFormatException if the property could not be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * @param property The property to load
   * @return A parsed double
   * @throws NumberFormatException if the property could not be parsed
   * @throws NullPointerException if the property did not exist
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean. The values "1", "true" and "yes"
   * (case insensitive) are true, anything else is false.
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }

  /**
   * Returns a human readable duration property, e.g. "14d", in milliseconds.
   * @param property The property to load
   * @return The duration in milliseconds.
   * @throws ConfigurationException if the property was missing or malformed.
   */
  public final long getDurationMs(final String property) {
    final String value = properties.get(property);
    try {
      return DateTime.parseDuration(sanitize(value));
    } catch (RuntimeException e) {
      throw new ConfigurationException("Invalid duration for " + property
          + ": " + value, e);
    }
  }

  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    if (val == null)
      return false;
    if (val.isEmpty())
      return false;
    return true;
  }

  /**
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    StringBuilder response = new StringBuilder("Cache Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS")) {
         response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file or override
   */
  protected void setDefaults() {
    for (Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
      if (!properties.containsKey(entry.getKey()))
        properties.put(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Searches {@link #DEFAULT_LOCATIONS} for a properties file. Missing files
   * are fine, the defaults are used then.
   */
  protected void loadConfig() {
    for (final String file : DEFAULT_LOCATIONS) {
      try {
        loadConfig(file);
        return;
      } catch (FileNotFoundException e) {
        LOG.debug("No configuration at " + file);
      } catch (IOException e) {
        throw new ConfigurationException("Unable to read " + file, e);
      }
    }
    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final InputStream file_stream = new FileInputStream(file)) {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    }
  }

  /**
   * Copies the properties into the hash map.
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();

    @SuppressWarnings("rawtypes")
    Enumeration e = props.propertyNames();
    while (e.hasMoreElements()) {
      String key = (String) e.nextElement();
      properties.put(key, props.getProperty(key));
    }
  }

  private static String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }
}
