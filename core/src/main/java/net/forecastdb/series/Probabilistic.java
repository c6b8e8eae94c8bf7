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
import java.util.Arrays;
import java.util.Map;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.Window;

/**
 * A percentile forecast: every window holds one trajectory per percentile,
 * in the order of {@link #percentiles()}.
 *
 * @since 1.0
 */
public class Probabilistic extends EnsembleSeries {

  /** The ascending percentile labels. */
  private final double[] percentiles;

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   */
  protected Probabilistic(final Builder builder) {
    super(builder, checkPercentiles(builder.percentiles));
    percentiles = Arrays.copyOf(builder.percentiles,
        builder.percentiles.length);
  }

  @Override
  public SeriesType seriesType() {
    return SeriesType.PROBABILISTIC;
  }

  /** @return A copy of the percentile labels. */
  public double[] percentiles() {
    return Arrays.copyOf(percentiles, percentiles.length);
  }

  /**
   * @param start A window start, must be one of the store's keys.
   * @param percentile One of the percentile labels.
   * @return The trajectory for the percentile.
   * @throws IllegalArgumentException if the window or percentile is not
   * present.
   */
  public Window<ConstantValue> getPercentile(final Instant start,
                                             final double percentile) {
    for (int i = 0; i < percentiles.length; i++) {
      if (Double.compare(percentiles[i], percentile) == 0) {
        return getMember(start, i);
      }
    }
    throw new IllegalArgumentException("No percentile " + percentile
        + " in " + Arrays.toString(percentiles));
  }

  /**
   * Builds a copy of this series around a new payload with a new identity.
   * @param data A non-null and non-empty map of window starts to windows.
   * @return A new series.
   */
  public Probabilistic withData(final Map<Instant, EnsembleWindow> data) {
    return newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .setPercentiles(percentiles)
        .setData(data)
        .build();
  }

  @Override
  protected TimeSeriesMetadata.Builder metadataBuilder(
      final Map<String, String> features) {
    return super.metadataBuilder(features)
        .setPercentiles(percentiles);
  }

  /**
   * Rebuilds a series from stored metadata and its payload, keeping the
   * identity of the metadata.
   * @param metadata Non-null metadata of a probabilistic series.
   * @param data The payload.
   * @return The series.
   */
  public static Probabilistic fromMetadata(
      final TimeSeriesMetadata metadata,
      final Map<Instant, EnsembleWindow> data) {
    final Probabilistic series = newBuilder()
        .setMetadata(metadata)
        .setPercentiles(metadata.getPercentiles())
        .setData(data)
        .build();
    series.verifyAgainst(metadata);
    return series;
  }

  /**
   * @param percentiles The labels to check.
   * @return The number of labels.
   */
  private static int checkPercentiles(final double[] percentiles) {
    if (percentiles == null || percentiles.length < 1) {
      throw new IllegalArgumentException("Percentiles cannot be null or "
          + "empty.");
    }
    for (int i = 1; i < percentiles.length; i++) {
      if (!(percentiles[i] > percentiles[i - 1])) {
        throw new IllegalArgumentException("Percentiles must be strictly "
            + "ascending: " + Arrays.toString(percentiles));
      }
    }
    return percentiles.length;
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder
      extends AbstractTimeSeries.Builder<EnsembleWindow, Builder> {
    private double[] percentiles;

    /**
     * @param percentiles Non-null strictly ascending percentile labels, one
     * per window member.
     * @return The builder.
     */
    public Builder setPercentiles(final double[] percentiles) {
      this.percentiles = percentiles;
      return this;
    }

    @Override
    protected Builder self() {
      return this;
    }

    @Override
    public Probabilistic build() {
      return new Probabilistic(this);
    }
  }
}
