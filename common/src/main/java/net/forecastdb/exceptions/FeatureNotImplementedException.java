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
package net.forecastdb.exceptions;

/**
 * Indicates that the feature at hand is not implemented for the given data
 * even though it could be. If it makes no sense to apply the feature to that
 * data at all, throw an {@link IllegalArgumentException} instead.
 * @since 1.0
 */
public class FeatureNotImplementedException extends UnsupportedOperationException {

  /** The feature that was requested. */
  private final String feature;

  /** A description of the data the feature was requested for. */
  private final String data;

  /**
   * Constructor with a message in the form
   * "{@code <feature> not currently implemented for <data>}".
   *
   * @param feature The name of the feature that was requested.
   * @param data The data or type the feature was requested for.
   */
  public FeatureNotImplementedException(final String feature,
                                        final Object data) {
    super(feature + " not currently implemented for " + data);
    this.feature = feature;
    this.data = String.valueOf(data);
  }

  /** @return The feature that was requested. */
  public String getFeature() {
    return feature;
  }

  /** @return A string description of the offending data or type. */
  public String getData() {
    return data;
  }

  static final long serialVersionUID = 1781365291;

}
