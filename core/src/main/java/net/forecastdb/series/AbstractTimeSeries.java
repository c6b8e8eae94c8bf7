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
import java.util.Map.Entry;
import java.util.UUID;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.IllegalDataFormatException;
import net.forecastdb.utils.DateTime;

/**
 * Base for the series implementations. Holds the windowed store and derives
 * the window accessors from it. The store is validated once at construction:
 * <ul>
 * <li>It must hold at least one window.</li>
 * <li>Every window must have the same length.</li>
 * <li>Every window must have the same payload shape.</li>
 * <li>Window starts must be evenly spaced.</li>
 * </ul>
 *
 * @param <W> The type of window held in the store.
 * @since 1.0
 */
public abstract class AbstractTimeSeries<W> implements TimeSeries {

  /** The name of the series. */
  protected final String name;

  /** The spacing of timesteps within a window. */
  protected final Duration resolution;

  /** The windows keyed by start timestamp. */
  protected final ImmutableSortedMap<Instant, W> data;

  /** An optional multiplier name applied by the owner on read. */
  protected final String scaling_factor_multiplier;

  /** The payload identity. */
  protected final UUID uuid;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if the name, resolution or data was
   * missing or a window was null.
   * @throws IllegalDataFormatException if the windows differed in length or
   * shape or were not evenly spaced.
   */
  protected AbstractTimeSeries(final Builder<W, ?> builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (builder.resolution == null || builder.resolution.isNegative() ||
        builder.resolution.isZero()) {
      throw new IllegalArgumentException("Resolution must be a positive "
          + "duration: " + builder.resolution);
    }
    if (!DateTime.isWholeMillis(builder.resolution)) {
      throw new IllegalArgumentException("Resolution must be a whole number "
          + "of milliseconds: " + builder.resolution);
    }
    if (builder.data == null || builder.data.isEmpty()) {
      throw new IllegalArgumentException("Data cannot be null or empty.");
    }
    for (final Entry<Instant, ? extends W> entry : builder.data.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("Window start cannot be null.");
      }
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Window at " + entry.getKey()
            + " cannot be null.");
      }
    }
    name = builder.name;
    resolution = builder.resolution;
    data = ImmutableSortedMap.<Instant, W>copyOf(builder.data);
    scaling_factor_multiplier = builder.scaling_factor_multiplier;
    uuid = builder.uuid == null ? UUID.randomUUID() : builder.uuid;

    validateStore();
  }

  /**
   * @param window A non-null window.
   * @return The number of timesteps in the window.
   */
  protected abstract int windowLength(final W window);

  /**
   * @param first The first window in the store.
   * @param other Another window in the store.
   * @return Whether or not the windows hold payloads of the same shape.
   */
  protected abstract boolean sameShape(final W first, final W other);

  /**
   * @param window A non-null window.
   * @param length A zero or positive length.
   * @return The window truncated to at most {@code length} timesteps.
   */
  protected abstract W truncate(final W window, final int length);

  @Override
  public String name() {
    return name;
  }

  @Override
  public Duration resolution() {
    return resolution;
  }

  @Override
  public int count() {
    return data.size();
  }

  @Override
  public int horizon() {
    return windowLength(data.firstEntry().getValue());
  }

  @Override
  public Duration interval() {
    if (data.size() < 2) {
      return Duration.ZERO;
    }
    final List<Instant> keys = data.keySet().asList();
    return Duration.between(keys.get(0), keys.get(1));
  }

  @Override
  public Instant initialTimestamp() {
    return data.firstKey();
  }

  @Override
  public List<Instant> initialTimes() {
    return DateTime.initialTimes(initialTimestamp(), count(), interval());
  }

  @Override
  public Duration totalPeriod() {
    return DateTime.totalPeriod(initialTimestamp(), count(), interval(),
        Math.max(horizon(), 1), resolution);
  }

  @Override
  public UUID uuid() {
    return uuid;
  }

  @Override
  public String scalingFactorMultiplier() {
    return scaling_factor_multiplier;
  }

  /**
   * Returns the window starting at the given timestamp.
   * @param start A window start, must be one of the store's keys.
   * @return The non-null window.
   * @throws IllegalArgumentException if no window starts at the timestamp.
   */
  public W getWindow(final Instant start) {
    if (start == null) {
      throw new IllegalArgumentException("Start cannot be null.");
    }
    final W window = data.get(start);
    if (window == null) {
      throw new IllegalArgumentException("No window starts at " + start
          + " in series " + name + ". Valid starts are "
          + initialTimestamp() + " to " + data.lastKey() + " every "
          + interval());
    }
    return window;
  }

  /**
   * Returns the first {@code length} timesteps of the window starting at
   * the given timestamp. A length greater than or equal to the horizon
   * returns the full window.
   * @param start A window start, must be one of the store's keys.
   * @param length A zero or positive number of timesteps.
   * @return The non-null window.
   * @throws IllegalArgumentException if no window starts at the timestamp or
   * the length was negative.
   */
  public W getWindow(final Instant start, final int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length cannot be negative: "
          + length);
    }
    return truncate(getWindow(start), length);
  }

  /**
   * Iterates over the windows in ascending start order. Every call to
   * {@link Iterable#iterator()} starts over from the first window.
   * @return A non-null iterable of start and window pairs.
   */
  public Iterable<Entry<Instant, W>> iterateWindows() {
    return data.entrySet();
  }

  /** @return The immutable store of windows keyed by start. */
  public ImmutableSortedMap<Instant, W> windows() {
    return data;
  }

  @Override
  public TimeSeriesMetadata metadata(final Map<String, String> features) {
    return metadataBuilder(features).build();
  }

  /**
   * @param features Optional tags, may be null.
   * @return A builder populated with the fields shared by every series.
   */
  protected TimeSeriesMetadata.Builder metadataBuilder(
      final Map<String, String> features) {
    return TimeSeriesMetadata.newBuilder()
        .setType(seriesType())
        .setName(name)
        .setResolution(DateTime.durationToString(resolution))
        .setInitialTimestamp(initialTimestamp().toEpochMilli())
        .setInterval(DateTime.durationToString(interval()))
        .setCount(count())
        .setHorizon(horizon())
        .setTimeSeriesUuid(uuid.toString())
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setFeatures(features);
  }

  /**
   * Makes sure the payload this series was rebuilt with is the one the
   * metadata describes.
   * @param metadata The non-null metadata.
   * @throws IllegalDataFormatException if the type, count, horizon,
   * initial timestamp or interval differ.
   */
  protected void verifyAgainst(final TimeSeriesMetadata metadata) {
    if (metadata.getType() != seriesType()) {
      throw new IllegalDataFormatException("Metadata describes a "
          + metadata.getType() + " series but the payload is for a "
          + seriesType() + " series");
    }
    if (metadata.getCount() != count() ||
        metadata.getHorizon() != horizon() ||
        metadata.getInitialTimestamp() != initialTimestamp().toEpochMilli() ||
        !metadata.interval().equals(interval())) {
      throw new IllegalDataFormatException("Payload with count=" + count()
          + ", horizon=" + horizon() + ", initialTimestamp="
          + initialTimestamp() + ", interval=" + interval()
          + " does not match the metadata: " + metadata);
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(seriesType())
        .append(", name=")
        .append(name)
        .append(", resolution=")
        .append(resolution)
        .append(", initialTimestamp=")
        .append(initialTimestamp())
        .append(", interval=")
        .append(interval())
        .append(", count=")
        .append(count())
        .append(", horizon=")
        .append(horizon())
        .append(", uuid=")
        .append(uuid)
        .append(", scalingFactorMultiplier=")
        .append(scaling_factor_multiplier)
        .toString();
  }

  /**
   * Builds the (timestamp, value) trajectory of a single window.
   * @param start The start of the window.
   * @param resolution The spacing of timesteps.
   * @param window The window.
   * @return The trajectory keyed by timestamp.
   */
  protected static <T extends PayloadElement> ImmutableSortedMap<Instant, T>
      trajectory(final Instant start,
                 final Duration resolution,
                 final Window<T> window) {
    final ImmutableSortedMap.Builder<Instant, T> builder =
        ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < window.length(); i++) {
      builder.put(start.plus(resolution.multipliedBy(i)), window.get(i));
    }
    return builder.build();
  }

  /** Checks the shared store invariants. */
  private void validateStore() {
    final W first = data.firstEntry().getValue();
    final int horizon = windowLength(first);
    final ImmutableList<Instant> keys = data.keySet().asList();
    final Duration interval = interval();
    if (!DateTime.isWholeMillis(interval)) {
      throw new IllegalDataFormatException("Window starts must be a whole "
          + "number of milliseconds apart: " + interval);
    }
    for (int i = 0; i < keys.size(); i++) {
      final W window = data.get(keys.get(i));
      if (windowLength(window) != horizon) {
        throw new IllegalDataFormatException("Window at " + keys.get(i)
            + " has " + windowLength(window) + " timesteps but the window at "
            + keys.get(0) + " has " + horizon);
      }
      if (!sameShape(first, window)) {
        throw new IllegalDataFormatException("Window at " + keys.get(i)
            + " holds payloads of a different shape than the window at "
            + keys.get(0));
      }
      if (i > 0 &&
          !Duration.between(keys.get(i - 1), keys.get(i)).equals(interval)) {
        throw new IllegalDataFormatException("Window starts must be evenly "
            + "spaced but " + keys.get(i - 1) + " to " + keys.get(i)
            + " differs from the interval " + interval);
      }
    }
  }

  /**
   * Base builder shared by the series implementations.
   * @param <W> The type of window.
   * @param <B> The type of the implementing builder.
   */
  public abstract static class Builder<W, B extends Builder<W, B>> {
    protected String name;
    protected Duration resolution;
    protected Map<Instant, ? extends W> data;
    protected String scaling_factor_multiplier;
    protected UUID uuid;

    /**
     * @param name A non-null and non-empty name.
     * @return The builder.
     */
    public B setName(final String name) {
      this.name = name;
      return self();
    }

    /**
     * @param resolution A positive spacing of timesteps.
     * @return The builder.
     */
    public B setResolution(final Duration resolution) {
      this.resolution = resolution;
      return self();
    }

    /**
     * @param data A non-null and non-empty map of window starts to windows.
     * @return The builder.
     */
    public B setData(final Map<Instant, ? extends W> data) {
      this.data = data;
      return self();
    }

    /**
     * @param scaling_factor_multiplier An optional multiplier name.
     * @return The builder.
     */
    public B setScalingFactorMultiplier(
        final String scaling_factor_multiplier) {
      this.scaling_factor_multiplier = scaling_factor_multiplier;
      return self();
    }

    /**
     * @param uuid An explicit payload identity. If null a random one is
     * generated.
     * @return The builder.
     */
    public B setUuid(final UUID uuid) {
      this.uuid = uuid;
      return self();
    }

    /**
     * Copies the name, resolution, multiplier and identity from the
     * metadata.
     * @param metadata Non-null metadata.
     * @return The builder.
     * @throws IllegalArgumentException if the resolution or identifier could
     * not be parsed.
     */
    public B setMetadata(final TimeSeriesMetadata metadata) {
      if (metadata == null) {
        throw new IllegalArgumentException("Metadata cannot be null.");
      }
      name = metadata.getName();
      resolution = metadata.resolution();
      scaling_factor_multiplier = metadata.getScalingFactorMultiplier();
      uuid = metadata.timeSeriesUuid();
      return self();
    }

    /** @return This builder. */
    protected abstract B self();

    /** @return The series. */
    public abstract AbstractTimeSeries<W> build();
  }
}
