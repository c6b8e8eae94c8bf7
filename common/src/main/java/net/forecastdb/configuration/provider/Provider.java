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

import java.io.Closeable;
import java.io.IOException;

/**
 * A source of raw configuration values. Providers are consulted when a
 * schema is registered with the configuration.
 *
 * @since 1.0
 */
public abstract class Provider implements Closeable {

  /**
   * Called by the configuration to load the current value for the given key
   * when a schema is registered.
   * @param key A non-null and non-empty key.
   * @return The raw value if the provider had one for the key, null if not.
   */
  public abstract String getSetting(final String key);

  /**
   * The name of this provider.
   * @return A non-null string.
   */
  public abstract String source();

  @Override
  public void close() throws IOException {
    // no-op
  }

  @Override
  public String toString() {
    return source();
  }
}
