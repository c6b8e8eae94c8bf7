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
 * Pulls settings from the JVM's system properties, e.g.
 * {@code -Dforecastdb.payload.assume_constant=true}.
 *
 * @since 1.0
 */
public class SystemPropertiesProvider extends Provider {
  public static final String SOURCE =
      SystemPropertiesProvider.class.getSimpleName();

  @Override
  public String getSetting(final String key) {
    return System.getProperty(key);
  }

  @Override
  public String source() {
    return SOURCE;
  }
}
