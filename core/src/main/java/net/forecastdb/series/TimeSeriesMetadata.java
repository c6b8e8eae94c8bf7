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
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.forecastdb.utils.DateTime;
import net.forecastdb.utils.JSON;

/**
 * Lightweight description of a series that can be indexed and serialized
 * without the payload. The {@link #getTimeSeriesUuid()} rejoins the two.
 * <p>
 * Durations are stored in their short string form, e.g. "1h", and the
 * initial timestamp in Unix epoch milliseconds.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = TimeSeriesMetadata.Builder.class)
public class TimeSeriesMetadata {
  private final SeriesType type;
  private final String name;
  private final String resolution;
  private final long initial_timestamp;
  private final String interval;
  private final int count;
  private final int horizon;
  private final String time_series_uuid;
  private final String scaling_factor_multiplier;
  private final Map<String, String> features;

  /** Only for probabilistic series. */
  private final double[] percentiles;

  /** Only for scenario series. */
  private final Integer scenario_count;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if a required field was missing or
   * could not be parsed.
   */
  protected TimeSeriesMetadata(final Builder builder) {
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.resolution)) {
      throw new IllegalArgumentException("Resolution cannot be null or "
          + "empty.");
    }
    if (Strings.isNullOrEmpty(builder.timeSeriesUuid)) {
      throw new IllegalArgumentException("Time series UUID cannot be null "
          + "or empty.");
    }
    // validate the strings now rather than on access
    DateTime.parseDuration(builder.resolution);
    if (!Strings.isNullOrEmpty(builder.interval)) {
      DateTime.parseDuration(builder.interval);
    }
    UUID.fromString(builder.timeSeriesUuid);

    type = builder.type;
    name = builder.name;
    resolution = builder.resolution;
    initial_timestamp = builder.initialTimestamp;
    interval = Strings.isNullOrEmpty(builder.interval) ?
        "0s" : builder.interval;
    count = builder.count;
    horizon = builder.horizon;
    time_series_uuid = builder.timeSeriesUuid;
    scaling_factor_multiplier = builder.scalingFactorMultiplier;
    features = builder.features == null ?
        ImmutableMap.<String, String>of() :
        ImmutableMap.copyOf(builder.features);
    percentiles = builder.percentiles == null ? null :
        Arrays.copyOf(builder.percentiles, builder.percentiles.length);
    scenario_count = builder.scenarioCount;
  }

  /** @return The kind of series. */
  public SeriesType getType() {
    return type;
  }

  /** @return The series name. */
  public String getName() {
    return name;
  }

  /** @return The resolution as a duration string. */
  public String getResolution() {
    return resolution;
  }

  /** @return The start of the first window in Unix epoch millis. */
  public long getInitialTimestamp() {
    return initial_timestamp;
  }

  /** @return The window interval as a duration string. */
  public String getInterval() {
    return interval;
  }

  /** @return The number of windows. */
  public int getCount() {
    return count;
  }

  /** @return The number of timesteps per window. */
  public int getHorizon() {
    return horizon;
  }

  /** @return The payload identifier. */
  public String getTimeSeriesUuid() {
    return time_series_uuid;
  }

  /** @return The optional multiplier name, may be null. */
  public String getScalingFactorMultiplier() {
    return scaling_factor_multiplier;
  }

  /** @return The non-null, possibly empty, feature tags. */
  public Map<String, String> getFeatures() {
    return features;
  }

  /** @return A copy of the percentiles for probabilistic series, null
   * otherwise. */
  public double[] getPercentiles() {
    return percentiles == null ? null :
        Arrays.copyOf(percentiles, percentiles.length);
  }

  /** @return The scenario count for scenario series, null otherwise. */
  public Integer getScenarioCount() {
    return scenario_count;
  }

  /** @return The parsed resolution. */
  public Duration resolution() {
    return DateTime.parseDuration(resolution);
  }

  /** @return The parsed interval. */
  public Duration interval() {
    return DateTime.parseDuration(interval);
  }

  /** @return The parsed initial timestamp. */
  public Instant initialTimestamp() {
    return Instant.ofEpochMilli(initial_timestamp);
  }

  /** @return The parsed payload identifier. */
  public UUID timeSeriesUuid() {
    return UUID.fromString(time_series_uuid);
  }

  /** @return The metadata as a JSON string. */
  public String toJson() {
    return JSON.serializeToString(this);
  }

  /**
   * @param json A non-null and non-empty JSON string.
   * @return The parsed metadata.
   * @throws IllegalArgumentException if the JSON was malformed or a required
   * field was missing.
   */
  public static TimeSeriesMetadata fromJson(final String json) {
    return JSON.parseToObject(json, TimeSeriesMetadata.class);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeSeriesMetadata other = (TimeSeriesMetadata) o;
    return type == other.type &&
        Objects.equals(name, other.name) &&
        Objects.equals(resolution, other.resolution) &&
        initial_timestamp == other.initial_timestamp &&
        Objects.equals(interval, other.interval) &&
        count == other.count &&
        horizon == other.horizon &&
        Objects.equals(time_series_uuid, other.time_series_uuid) &&
        Objects.equals(scaling_factor_multiplier,
            other.scaling_factor_multiplier) &&
        Objects.equals(features, other.features) &&
        Arrays.equals(percentiles, other.percentiles) &&
        Objects.equals(scenario_count, other.scenario_count);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, resolution, initial_timestamp, interval,
        count, horizon, time_series_uuid, scaling_factor_multiplier, features,
        Arrays.hashCode(percentiles), scenario_count);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type)
        .append(", name=")
        .append(name)
        .append(", resolution=")
        .append(resolution)
        .append(", initialTimestamp=")
        .append(initial_timestamp)
        .append(", interval=")
        .append(interval)
        .append(", count=")
        .append(count)
        .append(", horizon=")
        .append(horizon)
        .append(", timeSeriesUuid=")
        .append(time_series_uuid)
        .append(", scalingFactorMultiplier=")
        .append(scaling_factor_multiplier)
        .append(", features=")
        .append(features)
        .append(", percentiles=")
        .append(Arrays.toString(percentiles))
        .append(", scenarioCount=")
        .append(scenario_count)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private SeriesType type;
    @JsonProperty
    private String name;
    @JsonProperty
    private String resolution;
    @JsonProperty
    private long initialTimestamp;
    @JsonProperty
    private String interval;
    @JsonProperty
    private int count;
    @JsonProperty
    private int horizon;
    @JsonProperty
    private String timeSeriesUuid;
    @JsonProperty
    private String scalingFactorMultiplier;
    @JsonProperty
    private Map<String, String> features;
    @JsonProperty
    private double[] percentiles;
    @JsonProperty
    private Integer scenarioCount;

    public Builder setType(final SeriesType type) {
      this.type = type;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setResolution(final String resolution) {
      this.resolution = resolution;
      return this;
    }

    public Builder setInitialTimestamp(final long initial_timestamp) {
      initialTimestamp = initial_timestamp;
      return this;
    }

    public Builder setInterval(final String interval) {
      this.interval = interval;
      return this;
    }

    public Builder setCount(final int count) {
      this.count = count;
      return this;
    }

    public Builder setHorizon(final int horizon) {
      this.horizon = horizon;
      return this;
    }

    public Builder setTimeSeriesUuid(final String time_series_uuid) {
      timeSeriesUuid = time_series_uuid;
      return this;
    }

    public Builder setScalingFactorMultiplier(
        final String scaling_factor_multiplier) {
      scalingFactorMultiplier = scaling_factor_multiplier;
      return this;
    }

    public Builder setFeatures(final Map<String, String> features) {
      this.features = features;
      return this;
    }

    public Builder setPercentiles(final double[] percentiles) {
      this.percentiles = percentiles;
      return this;
    }

    public Builder setScenarioCount(final Integer scenario_count) {
      scenarioCount = scenario_count;
      return this;
    }

    public TimeSeriesMetadata build() {
      return new TimeSeriesMetadata(this);
    }
  }
}
