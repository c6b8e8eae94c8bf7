// This file is part of ForecastDB.
// Copyright (C) 2026  The ForecastDB Authors.
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
package net.forecastdb.configuration;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.forecastdb.configuration.provider.EnvironmentProvider;
import net.forecastdb.configuration.provider.PropertiesFileProvider;
import net.forecastdb.configuration.provider.Provider;
import net.forecastdb.configuration.provider.SystemPropertiesProvider;

/**
 * A key to value configuration flattened from an ordered list of
 * providers. A {@link ConfigurationEntrySchema} must be registered for a key
 * before it can be read. On registration the providers are consulted from
 * most to least significant and the first raw value found is converted to
 * the schema type, otherwise the schema default applies. Runtime overrides
 * given via {@link #addOverride(String, Object)} trump every provider.
 * <p>
 * The default ctor loads, from least to most significant, the properties
 * file named by {@link #CONFIG_FILE_KEY} (if set in the environment or the
 * system properties), the environment and the system properties.
 * <p>
 * <b>NOTE:</b> Remember to close the configuration when shutting down
 * to release the providers.
 *
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

  /**
   * Jackson de/serializer initialized, configured and shared in order
   * to use the converter for handling type conversion.
   */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static {
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  /** Key for an optional properties file to load. */
  public static final String CONFIG_FILE_KEY = "forecastdb.config.file";

  /** Source name for runtime overrides. */
  public static final String RUNTIME_OVERRIDE_SOURCE = "RuntimeOverride";

  /** Registered schemas by key. */
  protected final Map<String, ConfigurationEntrySchema> schemas;

  /** Flattened values by key. Null values are stored as absent. */
  protected final Map<String, Object> values;

  /** Keys that have a runtime override. */
  protected final Map<String, Object> overrides;

  /** Providers from least to most significant. */
  protected final List<Provider> providers;

  /**
   * The default ctor that reads the environment and system properties,
   * preceded by a properties file if {@link #CONFIG_FILE_KEY} was set.
   * @throws ConfigurationException if the properties file could not be
   * loaded.
   */
  public Configuration() {
    this(defaultProviders());
  }

  /**
   * Ctor with an explicit list of providers.
   * @param providers A non-null list of providers ordered from least to most
   * significant.
   * @throws IllegalArgumentException if the list was null.
   */
  public Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    this.providers = ImmutableList.copyOf(providers);
    schemas = Maps.newConcurrentMap();
    values = Maps.newConcurrentMap();
    overrides = Maps.newConcurrentMap();

    register(ConfigurationEntrySchema.newBuilder()
        .setKey(CONFIG_FILE_KEY)
        .setType(String.class)
        .isNullable()
        .setSource(getClass().getName())
        .setDescription("The path to a Java properties file with "
            + "configuration overrides. Values from the environment and "
            + "system properties override those in the file."));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Initialized configuration with providers: " + providers);
    }
  }

  /**
   * Helper to register a schema builder.
   * See {@link #register(ConfigurationEntrySchema)}
   * @param builder A non-null builder.
   */
  public void register(final ConfigurationEntrySchema.Builder builder) {
    if (builder == null) {
      throw new IllegalArgumentException("Builder cannot be null.");
    }
    register(builder.build());
  }

  /**
   * Registers the config schema with the configuration and resolves its
   * value from the providers.
   *
   * @param schema A non-null schema fully configured.
   * @throws IllegalArgumentException if the given schema was null.
   * @throws ConfigurationException if the schema was already registered or
   * a provider's value could not be converted.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntrySchema extant =
        schemas.putIfAbsent(schema.getKey(), schema);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.getKey());
    }

    Object value = schema.getDefaultValue();
    for (int i = providers.size() - 1; i >= 0; i--) {
      final String setting = providers.get(i).getSetting(schema.getKey());
      if (setting == null) {
        continue;
      }
      try {
        value = schema.convert(setting);
      } catch (IllegalArgumentException e) {
        schemas.remove(schema.getKey());
        throw new ConfigurationException("Invalid value from provider "
            + providers.get(i).source() + " for key " + schema.getKey(), e);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Loaded key [" + schema.getKey() + "] from provider "
            + providers.get(i).source());
      }
      break;
    }
    store(schema.getKey(), value);
  }

  /**
   * Registers a configuration schema with the type {@link String} marked as
   * nullable.
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param description A non-null and non-empty description.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final String default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(String.class)
        .setSource(callerName())
        .isNullable()
        .setDescription(description));
  }

  /**
   * Registers a configuration schema with the type {@code int}.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final int default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(int.class)
        .setSource(callerName())
        .setDescription(description));
  }

  /**
   * Registers a configuration schema with the type {@code double}.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final double default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(double.class)
        .setSource(callerName())
        .setDescription(description));
  }

  /**
   * Registers a configuration schema with the type {@code boolean}.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final boolean default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(boolean.class)
        .setSource(callerName())
        .setDescription(description));
  }

  /**
   * Overrides the value of a registered key at runtime. The override trumps
   * every provider until removed.
   * @param key A non-null and non-empty key.
   * @param value The override. May be null if the schema is nullable.
   * @throws ConfigurationException if no schema was present for the key or
   * the value was invalid.
   */
  public void addOverride(final String key, final Object value) {
    final ConfigurationEntrySchema schema = schema(key);
    final Object converted;
    try {
      converted = schema.convert(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid override for key: " + key, e);
    }
    overrides.put(key, RUNTIME_OVERRIDE_SOURCE);
    store(key, converted);
  }

  /**
   * Removes a runtime override and resolves the key from the providers
   * again.
   * @param key A non-null and non-empty key.
   * @return True if an override was removed, false if none was present.
   */
  public boolean removeRuntimeOverride(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (overrides.remove(key) == null) {
      return false;
    }
    final ConfigurationEntrySchema schema = schemas.remove(key);
    values.remove(key);
    register(schema);
    return true;
  }

  /**
   * Returns the given config value cast to the given type (if possible).
   * Uses Jackson's {@link ObjectMapper} to handle conversion.
   *
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null class to cast to.
   * @return The value found, may be null if set to null for non-primitive
   * types.
   * @throws ConfigurationException if the key was not registered or a null
   * value was read as a primitive.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    schema(key);

    final Object value = values.get(key);
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }
    if (!type.isInstance(value)) {
      return (T) OBJECT_MAPPER.convertValue(value, type);
    }
    return (T) value;
  }

  /**
   * @param key The non-null and non-empty config key entry.
   * @return The value as a string, may be null.
   */
  public String getString(final String key) {
    final Object value = getTyped(key, Object.class);
    return value == null ? null : value.toString();
  }

  /**
   * @param key The non-null and non-empty config key entry.
   * @return The value as an integer.
   */
  public int getInt(final String key) {
    return (Integer) getTyped(key, Integer.class);
  }

  /**
   * @param key The non-null and non-empty config key entry.
   * @return The value as a double.
   */
  public double getDouble(final String key) {
    return (Double) getTyped(key, Double.class);
  }

  /**
   * @param key The non-null and non-empty config key entry.
   * @return The value as a boolean.
   */
  public boolean getBoolean(final String key) {
    return (Boolean) getTyped(key, Boolean.class);
  }

  /**
   * @param key A key to look for.
   * @return Whether or not a schema was registered for the key.
   */
  public boolean hasProperty(final String key) {
    return !Strings.isNullOrEmpty(key) && schemas.containsKey(key);
  }

  /** @return The unmodifiable list of providers, least significant first. */
  public List<Provider> providers() {
    return Collections.unmodifiableList(providers);
  }

  @Override
  public void close() throws IOException {
    IOException first = null;
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider, e);
        if (first == null) {
          first = e;
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * @param key A key.
   * @return The schema for the key.
   * @throws ConfigurationException if no schema was registered.
   */
  protected ConfigurationEntrySchema schema(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No registration found for key: "
          + key);
    }
    return schema;
  }

  /**
   * Concurrent maps reject nulls so a null value removes the key.
   * @param key The key.
   * @param value The value, may be null.
   */
  private void store(final String key, final Object value) {
    if (value == null) {
      values.remove(key);
    } else {
      values.put(key, value);
    }
  }

  /** @return The class name of whoever called one of the register helpers. */
  private static String callerName() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // 0 is getStackTrace, 1 is us, 2 is the register helper.
    return stack.length > 3 ? stack[3].getClassName() :
        Configuration.class.getName();
  }

  /** @return The default provider list. */
  private static List<Provider> defaultProviders() {
    final List<Provider> providers = Lists.newArrayListWithCapacity(3);
    String file = System.getProperty(CONFIG_FILE_KEY);
    if (Strings.isNullOrEmpty(file)) {
      file = new EnvironmentProvider().getSetting(CONFIG_FILE_KEY);
    }
    if (!Strings.isNullOrEmpty(file)) {
      providers.add(new PropertiesFileProvider(file));
    }
    providers.add(new EnvironmentProvider());
    providers.add(new SystemPropertiesProvider());
    return providers;
  }
}
