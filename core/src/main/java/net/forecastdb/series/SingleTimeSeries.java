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
import java.util.Collections;

import com.google.common.collect.ImmutableSortedMap;

import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.Window;
import net.forecastdb.utils.DateTime;

/**
 * A single contiguous trajectory. Stored as a store with exactly one window
 * so the accessors behave as for the other series, with a zero interval.
 *
 * @param <T> The type of payload held at each timestep.
 * @since 1.0
 */
public class SingleTimeSeries<T extends PayloadElement>
    extends AbstractTimeSeries<Window<T>> {

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if the store did not hold exactly one
   * window.
   */
  protected SingleTimeSeries(final Builder<T> builder) {
    super(builder);
    if (data.size() != 1) {
      throw new IllegalArgumentException("A single time series holds "
          + "exactly one window but got " + data.size());
    }
  }

  @Override
  public SeriesType seriesType() {
    return SeriesType.SINGLE_TIME_SERIES;
  }

  /** @return The number of timesteps. */
  public int length() {
    return horizon();
  }

  /** @return The trajectory as a window. */
  public Window<T> window() {
    return data.firstEntry().getValue();
  }

  /** @return The payload type, null if the series is empty. */
  public PayloadType payloadType() {
    return window().type();
  }

  /** @return The (timestamp, value) trajectory. */
  public ImmutableSortedMap<Instant, T> trajectory() {
    return trajectory(initialTimestamp(), resolution, window());
  }

  /**
   * Returns the sub-series of {@code length} timesteps starting at the
   * given timestamp. The result has a new identity.
   * @param start A timestamp of the series.
   * @param length A number of timesteps that fits within the series.
   * @return A new series.
   * @throws IllegalArgumentException if the start is not a timestep of the
   * series or the range does not fit.
   */
  public SingleTimeSeries<T> slice(final Instant start, final int length) {
    if (start == null) {
      throw new IllegalArgumentException("Start cannot be null.");
    }
    final Duration offset = Duration.between(initialTimestamp(), start);
    if (offset.isNegative() || !DateTime.isWholeMillis(offset) ||
        offset.toMillis() % resolution.toMillis() != 0) {
      throw new IllegalArgumentException(start + " is not a timestep of "
          + "series " + name);
    }
    final long index = offset.toMillis() / resolution.toMillis();
    if (index >= length()) {
      throw new IllegalArgumentException(start + " is past the end of "
          + "series " + name);
    }
    return SingleTimeSeries.<T>newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setInitialTimestamp(start)
        .setWindow(window().slice((int) index, length))
        .build();
  }

  /**
   * Builds a copy of this series around a new trajectory with a new
   * identity.
   * @param initial_timestamp The start of the new trajectory.
   * @param window The new trajectory.
   * @return A new series.
   */
  public SingleTimeSeries<T> withData(final Instant initial_timestamp,
                                      final Window<T> window) {
    return SingleTimeSeries.<T>newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setInitialTimestamp(initial_timestamp)
        .setWindow(window)
        .build();
  }

  @Override
  protected int windowLength(final Window<T> window) {
    return window.length();
  }

  @Override
  protected boolean sameShape(final Window<T> first, final Window<T> other) {
    return first.sameShape(other);
  }

  @Override
  protected Window<T> truncate(final Window<T> window, final int length) {
    return window.truncate(length);
  }

  /**
   * Rebuilds a series from stored metadata and its trajectory, keeping the
   * identity of the metadata.
   * @param metadata Non-null metadata of a single time series.
   * @param window The trajectory.
   * @return The series.
   */
  public static <T extends PayloadElement> SingleTimeSeries<T> fromMetadata(
      final TimeSeriesMetadata metadata,
      final Window<T> window) {
    final SingleTimeSeries<T> series = SingleTimeSeries.<T>newBuilder()
        .setMetadata(metadata)
        .setInitialTimestamp(metadata.initialTimestamp())
        .setWindow(window)
        .build();
    series.verifyAgainst(metadata);
    return series;
  }

  /** @return A new builder. */
  public static <T extends PayloadElement> Builder<T> newBuilder() {
    return new Builder<T>();
  }

  public static class Builder<T extends PayloadElement>
      extends AbstractTimeSeries.Builder<Window<T>, Builder<T>> {
    private Instant initial_timestamp;
    private Window<T> window;

    /**
     * @param initial_timestamp The timestamp of the first value.
     * @return The builder.
     */
    public Builder<T> setInitialTimestamp(final Instant initial_timestamp) {
      this.initial_timestamp = initial_timestamp;
      return this;
    }

    /**
     * @param window The trajectory.
     * @return The builder.
     */
    public Builder<T> setWindow(final Window<T> window) {
      this.window = window;
      return this;
    }

    @Override
    protected Builder<T> self() {
      return this;
    }

    @Override
    public SingleTimeSeries<T> build() {
      if (initial_timestamp != null || window != null) {
        if (initial_timestamp == null || window == null) {
          throw new IllegalArgumentException("Both the initial timestamp "
              + "and the window must be set.");
        }
        data = Collections.singletonMap(initial_timestamp, window);
      }
      return new SingleTimeSeries<T>(this);
    }
  }
}
