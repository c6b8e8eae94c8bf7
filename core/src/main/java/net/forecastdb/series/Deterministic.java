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
import java.util.Map;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.Window;

/**
 * A point forecast: one trajectory per forecast issue time.
 *
 * @param <T> The type of payload held at each timestep.
 * @since 1.0
 */
public class Deterministic<T extends PayloadElement>
    extends AbstractTimeSeries<Window<T>> {

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  protected Deterministic(final Builder<T> builder) {
    super(builder);
  }

  @Override
  public SeriesType seriesType() {
    return SeriesType.DETERMINISTIC;
  }

  /** @return The payload type of the windows, null if they are empty. */
  public PayloadType payloadType() {
    return data.firstEntry().getValue().type();
  }

  /**
   * Materializes the (timestamp, value) trajectory of a series holding a
   * single window.
   * @return The trajectory keyed by timestamp.
   * @throws IllegalStateException if the series holds more than one window.
   */
  public ImmutableSortedMap<Instant, T> toTrajectory() {
    if (count() != 1) {
      throw new IllegalStateException("Only series with a single window "
          + "can be materialized as a trajectory but " + name + " has "
          + count() + " windows");
    }
    return trajectory(initialTimestamp(), resolution,
        data.firstEntry().getValue());
  }

  /**
   * Builds a copy of this series around a new payload. Every field other
   * than the data is kept, except the identity, which is always new.
   * @param data A non-null and non-empty map of window starts to windows.
   * @return A new series.
   */
  public Deterministic<T> withData(final Map<Instant, Window<T>> data) {
    return Deterministic.<T>newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setData(data)
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
   * Rebuilds a series from stored metadata and its payload. The identity of
   * the metadata is kept so the two stay joined.
   * @param metadata Non-null metadata of a deterministic series.
   * @param data The payload.
   * @return The series.
   * @throws net.forecastdb.exceptions.IllegalDataFormatException if the
   * payload does not match the metadata.
   */
  public static <T extends PayloadElement> Deterministic<T> fromMetadata(
      final TimeSeriesMetadata metadata,
      final Map<Instant, Window<T>> data) {
    final Deterministic<T> series = Deterministic.<T>newBuilder()
        .setMetadata(metadata)
        .setData(data)
        .build();
    series.verifyAgainst(metadata);
    return series;
  }

  /**
   * Slices a contiguous series into windows. Window {@code k} starts at
   * {@code initial + k * interval} and holds {@code horizon} values. Only
   * windows that fit entirely within the source are produced.
   * @param single The non-null source series.
   * @param horizon The number of timesteps per window, at least 1 and at
   * most the length of the source.
   * @param interval The spacing of window starts, a positive multiple of
   * the source resolution.
   * @return A new deterministic series with the name, resolution and
   * multiplier of the source.
   * @throws IllegalArgumentException if the horizon or interval was invalid.
   */
  public static <T extends PayloadElement> Deterministic<T>
      fromSingleTimeSeries(final SingleTimeSeries<T> single,
                           final int horizon,
                           final Duration interval) {
    if (single == null) {
      throw new IllegalArgumentException("Source series cannot be null.");
    }
    if (horizon < 1 || horizon > single.length()) {
      throw new IllegalArgumentException("Horizon must be between 1 and "
          + single.length() + ": " + horizon);
    }
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Interval must be a positive "
          + "duration: " + interval);
    }
    final long resolution_ms = single.resolution().toMillis();
    if (interval.toMillis() % resolution_ms != 0) {
      throw new IllegalArgumentException("Interval " + interval
          + " must be a multiple of the resolution " + single.resolution());
    }
    final Window<T> source = single.window();
    // an interval past the end of the source yields a single window
    final int step = (int) Math.min(interval.toMillis() / resolution_ms,
        source.length());

    final SortedMap<Instant, Window<T>> windows = Maps.newTreeMap();
    int k = 0;
    for (int offset = 0; offset + horizon <= source.length(); offset += step) {
      windows.put(single.initialTimestamp().plus(interval.multipliedBy(k++)),
          source.slice(offset, horizon));
    }
    return Deterministic.<T>newBuilder()
        .setName(single.name())
        .setResolution(single.resolution())
        .setScalingFactorMultiplier(single.scalingFactorMultiplier())
        .setData(windows)
        .build();
  }

  /** @return A new builder. */
  public static <T extends PayloadElement> Builder<T> newBuilder() {
    return new Builder<T>();
  }

  public static class Builder<T extends PayloadElement>
      extends AbstractTimeSeries.Builder<Window<T>, Builder<T>> {

    @Override
    protected Builder<T> self() {
      return this;
    }

    @Override
    public Deterministic<T> build() {
      return new Deterministic<T>(this);
    }
  }
}
