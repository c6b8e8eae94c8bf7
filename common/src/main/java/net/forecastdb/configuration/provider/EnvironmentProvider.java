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

/**
 * Pulls values from the environment. A key is looked up as given first,
 * then in upper case with dots replaced by underscores, e.g.
 * {@code forecastdb.reader.delimiter} falls back to
 * {@code FORECASTDB_READER_DELIMITER}.
 *
 * @since 1.0
 */
public class EnvironmentProvider extends Provider {
  public static final String SOURCE = EnvironmentProvider.class.getSimpleName();

  @Override
  public String getSetting(final String key) {
    final String value = System.getenv(key);
    if (value != null) {
      return value;
    }
    return System.getenv(toVariableName(key));
  }

  @Override
  public String source() {
    return SOURCE;
  }

  /**
   * @param key A non-null config key.
   * @return The conventional environment variable name for the key.
   */
  public static String toVariableName(final String key) {
    return key.replace('.', '_').toUpperCase();
  }
}
