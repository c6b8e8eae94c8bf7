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
package net.forecastdb.configuration.provider;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.forecastdb.configuration.ConfigurationException;

/**
 * Parses a Java style properties file, i.e. key = value, once at
 * construction.
 *
 * @since 1.0
 */
public class PropertiesFileProvider extends Provider {
  private static final Logger LOG =
      LoggerFactory.getLogger(PropertiesFileProvider.class);

  /** The file name. */
  private final String file_name;

  /** The entries loaded from the file. */
  private final Map<String, String> cache;

  /**
   * Loads the given file.
   * @param file_name A non-null and non-empty path to the file.
   * @throws IllegalArgumentException if the file name was null or empty.
   * @throws ConfigurationException if the file was missing or could not be
   * read.
   */
  public PropertiesFileProvider(final String file_name) {
    if (Strings.isNullOrEmpty(file_name)) {
      throw new IllegalArgumentException("File name cannot be null or "
          + "empty.");
    }
    this.file_name = file_name;

    final File file = new File(file_name);
    if (!file.exists()) {
      throw new ConfigurationException("No configuration file found at: "
          + file_name);
    }

    try (final FileInputStream file_stream = new FileInputStream(file)) {
      final Properties properties = new Properties();
      properties.load(file_stream);

      final ImmutableMap.Builder<String, String> builder =
          ImmutableMap.builder();
      for (final Entry<Object, Object> entry : properties.entrySet()) {
        builder.put((String) entry.getKey(), (String) entry.getValue());
      }
      cache = builder.build();
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read file: " + file_name, e);
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Successfully parsed file: " + file_name
          + " with " + cache.size() + " entries");
    }
  }

  @Override
  public String getSetting(final String key) {
    return cache.get(key);
  }

  @Override
  public String source() {
    return file_name;
  }

  @VisibleForTesting
  Map<String, String> cache() {
    return cache;
  }
}
