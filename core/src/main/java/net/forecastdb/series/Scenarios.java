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

import java.time.Instant;
import java.util.Map;

import net.forecastdb.data.EnsembleWindow;

/**
 * A scenario ensemble: every window holds {@link #scenarioCount()}
 * trajectories.
 *
 * @since 1.0
 */
public class Scenarios extends EnsembleSeries {

  /** The number of scenarios per window. */
  private final int scenario_count;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  protected Scenarios(final Builder builder) {
    super(builder, checkCount(builder.scenario_count));
    scenario_count = builder.scenario_count;
  }

  @Override
  public SeriesType seriesType() {
    return SeriesType.SCENARIOS;
  }

  /** @return The number of scenarios per window. */
  public int scenarioCount() {
    return scenario_count;
  }

  /**
   * Builds a copy of this series around a new payload with a new identity.
   * @param data A non-null and non-empty map of window starts to windows.
   * @return A new series.
   */
  public Scenarios withData(final Map<Instant, EnsembleWindow> data) {
    return newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setScenarioCount(scenario_count)
        .setData(data)
        .build();
  }

  @Override
  protected TimeSeriesMetadata.Builder metadataBuilder(
      final Map<String, String> features) {
    return super.metadataBuilder(features)
        .setScenarioCount(scenario_count);
  }

  /**
   * Rebuilds a series from stored metadata and its payload, keeping the
   * identity of the metadata.
   * @param metadata Non-null metadata of a scenario series.
   * @param data The payload.
   * @return The series.
   */
  public static Scenarios fromMetadata(final TimeSeriesMetadata metadata,
                                       final Map<Instant, EnsembleWindow> data) {
    if (metadata != null && metadata.getScenarioCount() == null) {
      throw new IllegalArgumentException("Metadata is missing the scenario "
          + "count.");
    }
    final Scenarios series = newBuilder()
        .setMetadata(metadata)
        .setScenarioCount(metadata.getScenarioCount())
        .setData(data)
        .build();
    series.verifyAgainst(metadata);
    return series;
  }

  /**
   * @param count The count to check.
   * @return The count.
   */
  private static int checkCount(final int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Scenario count must be at least "
          + "1: " + count);
    }
    return count;
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder
      extends AbstractTimeSeries.Builder<EnsembleWindow, Builder> {
    private int scenario_count;

    /**
     * @param scenario_count The number of scenarios per window, at least 1.
     * @return The builder.
     */
    public Builder setScenarioCount(final int scenario_count) {
      this.scenario_count = scenario_count;
      return this;
    }

    @Override
    protected Builder self() {
      return this;
    }

    @Override
    public Scenarios build() {
      return new Scenarios(this);
    }
  }
}
