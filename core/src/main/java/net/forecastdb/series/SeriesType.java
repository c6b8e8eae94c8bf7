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
package net.forecastdb.series;

/**
 * The kinds of series the store can hold.
 *
 * @since 1.0
 */
public enum SeriesType {
  /** One trajectory per forecast issue time. */
  DETERMINISTIC,

  /** One trajectory per percentile per forecast issue time. */
  PROBABILISTIC,

  /** One trajectory per scenario per forecast issue time. */
  SCENARIOS,

  /** A single contiguous trajectory without window repetition. */
  SINGLE_TIME_SERIES
}
