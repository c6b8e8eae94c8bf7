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

/**
 * Thrown when a configuration key is missing, registered twice or its value
 * fails validation.
 *
 * @since 1.0
 */
public class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = -2741630081356724158L;

  /**
   * Default ctor.
   * @param msg A message describing the issue.
   */
  public ConfigurationException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a cause.
   * @param msg A message describing the issue.
   * @param e The underlying cause.
   */
  public ConfigurationException(final String msg, final Throwable e) {
    super(msg, e);
  }
}
