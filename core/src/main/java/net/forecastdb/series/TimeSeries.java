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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A forecast series: a name, a resolution and an immutable store of windows
 * keyed by their start timestamps in ascending order.
 * <p>
 * Instances never change after construction. To replace the payload, build
 * a new series via one of the {@code withData} methods, which always mints a
 * new {@link #uuid()}.
 *
 * @since 1.0
 */
public interface TimeSeries {

  /** @return The non-null kind of series. */
  public SeriesType seriesType();

  /** @return The non-null and non-empty name of the series. */
  public String name();

  /** @return The spacing of timesteps within a window. */
  public Duration resolution();

  /** @return The number of windows in the store, at least 1. */
  public int count();

  /** @return The number of timesteps in every window. */
  public int horizon();

  /** @return The spacing of window starts or {@link Duration#ZERO} when
   * there is only one window. */
  public Duration interval();

  /** @return The start of the first window. */
  public Instant initialTimestamp();

  /** @return The start of every window in ascending order. */
  public List<Instant> initialTimes();

  /** @return The span from the first window start to the last timestep of
   * the last window. */
  public Duration totalPeriod();

  /** @return The identifier of the payload, used to rejoin it with its
   * metadata. */
  public UUID uuid();

  /** @return The name of the multiplier the owner applies when reading the
   * values. May be null. */
  public String scalingFactorMultiplier();

  /**
   * Builds the metadata describing this series.
   * @param features Optional key/value tags distinguishing this series from
   * otherwise identical ones. May be null.
   * @return The non-null metadata.
   */
  public TimeSeriesMetadata metadata(final Map<String, String> features);

}
