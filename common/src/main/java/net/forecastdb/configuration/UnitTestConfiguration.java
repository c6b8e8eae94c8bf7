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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import net.forecastdb.configuration.provider.Provider;

/**
 * A helper for use with Unit Testing Configuration consumers. The
 * environment and system properties are ignored, only the map given is
 * consulted.
 *
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Ctor.
   * @param settings A non-null map of raw settings.
   */
  protected UnitTestConfiguration(final Map<String, String> settings) {
    super(ImmutableList.<Provider>of(new UnitTestProvider(settings)));
  }

  /** @return A configuration without any settings. */
  public static UnitTestConfiguration getConfiguration() {
    return getConfiguration(Collections.<String, String>emptyMap());
  }

  /**
   * Returns a configuration that reads only from the given map. The map is
   * consulted when keys are registered.
   * @param settings A non-null map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a UnitTest to inject a value after the key was registered.
   * @param key A non-null and non-empty key.
   * @param value A value to inject.
   */
  public void override(final String key, final Object value) {
    addOverride(key, value);
  }

  public static class UnitTestProvider extends Provider {
    private final Map<String, String> kvs;

    public UnitTestProvider(final Map<String, String> kvs) {
      this.kvs = kvs;
    }

    @Override
    public String getSetting(final String key) {
      return kvs.get(key);
    }

    @Override
    public String source() {
      return getClass().getSimpleName();
    }
  }
}
