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

import com.google.common.base.Strings;

/**
 * Describes a configuration entry: its key, the type its values are
 * converted to, a default and whether nulls are allowed.
 *
 * @since 1.0
 */
public class ConfigurationEntrySchema {

  protected final String key;
  protected final Class<?> type;

  /** The class that registered the entry. */
  protected final String source;
  protected final String description;

  /** The default, already converted to {@link #type}. */
  protected final Object default_value;
  protected final boolean nullable;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if a required field was missing or the
   * default value could not be converted to the type.
   */
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.source)) {
      throw new IllegalArgumentException("Registering source cannot be "
          + "null or empty.");
    }
    key = builder.key;
    type = builder.type;
    source = builder.source;
    description = builder.description;
    nullable = builder.nullable;
    default_value = convert(builder.default_value);
  }

  /** @return The key. */
  public String getKey() {
    return key;
  }

  /** @return The type values are converted to. */
  public Class<?> getType() {
    return type;
  }

  /** @return The name of the registering class. */
  public String getSource() {
    return source;
  }

  /** @return The help text, may be null. */
  public String getDescription() {
    return description;
  }

  /** @return The converted default, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  public boolean isNullable() {
    return nullable;
  }

  /**
   * Converts the raw value, usually a string from a provider, to the schema
   * type.
   * @param value A value that may be null if nullables are allowed.
   * @return The converted value.
   * @throws IllegalArgumentException if the value was null and nulls are not
   * allowed or the value could not be converted.
   */
  public Object convert(final Object value) {
    if (value == null) {
      if (!nullable || type.isPrimitive()) {
        throw new IllegalArgumentException("Null value not allowed for key: "
            + key);
      }
      return null;
    }
    if (type.isInstance(value)) {
      return value;
    }
    try {
      return Configuration.OBJECT_MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Value [" + value + "] for key "
          + key + " could not be converted to " + type.getSimpleName(), e);
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append(key)
        .append(" (")
        .append(type.getSimpleName())
        .append(nullable ? ", nullable" : "")
        .append(") default=")
        .append(default_value)
        .append(" registered by ")
        .append(source)
        .toString();
  }

  /** @return A new builder to construct the schema with. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Collects the schema fields. Key, type and source are required, the
   * default is converted to the type when {@link #build()} is called.
   */
  public static class Builder {
    protected String key;
    protected Class<?> type;
    protected String source;
    protected String description;
    protected Object default_value;
    protected boolean nullable;

    /**
     * @param key A non-null and non-empty key, e.g.
     * {@code forecastdb.reader.delimiter}.
     * @return The builder.
     * @throws IllegalArgumentException if the key was null or empty.
     */
    public Builder setKey(final String key) {
      if (Strings.isNullOrEmpty(key)) {
        throw new IllegalArgumentException("Configuration key cannot be "
            + "null or empty.");
      }
      this.key = key;
      return this;
    }

    /**
     * @param type A non-null class. Primitive types are never nullable.
     * @return The builder.
     * @throws IllegalArgumentException if the type was null.
     */
    public Builder setType(final Class<?> type) {
      if (type == null) {
        throw new IllegalArgumentException("Configuration type cannot be "
            + "null.");
      }
      this.type = type;
      return this;
    }

    /**
     * @param source The name of the registering class.
     * @return The builder.
     * @throws IllegalArgumentException if the source was null or empty.
     */
    public Builder setSource(final String source) {
      if (Strings.isNullOrEmpty(source)) {
        throw new IllegalArgumentException("Registering source cannot be "
            + "null or empty.");
      }
      this.source = source;
      return this;
    }

    /**
     * @param description Help text for operators.
     * @return The builder.
     * @throws IllegalArgumentException if the description was null or empty.
     */
    public Builder setDescription(final String description) {
      if (Strings.isNullOrEmpty(description)) {
        throw new IllegalArgumentException("Description cannot be null or "
            + "empty.");
      }
      this.description = description;
      return this;
    }

    /**
     * @param default_value The raw default. Strings are converted like
     * provider values.
     * @return The builder.
     */
    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    /** @return The builder, allowing null values. */
    public Builder isNullable() {
      nullable = true;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
