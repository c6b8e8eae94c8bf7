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

import java.util.Collection;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.FeatureNotImplementedException;

/**
 * The divisor applied to every value when a series is built. Either a
 * fixed scalar or {@link #MAX}, which divides by the largest value found in
 * the data.
 *
 * @since 1.0
 */
public final class NormalizationFactor {

  /** Leaves the values as they are. */
  public static final NormalizationFactor NONE =
      new NormalizationFactor(1.0, false);

  /** Divides by the largest value of the data. */
  public static final NormalizationFactor MAX =
      new NormalizationFactor(Double.NaN, true);

  private final double factor;
  private final boolean max;

  /**
   * Ctor.
   * @param factor The scalar divisor.
   * @param max Whether or not to divide by the maximum instead.
   */
  private NormalizationFactor(final double factor, final boolean max) {
    this.factor = factor;
    this.max = max;
  }

  /**
   * @param factor A finite, non-zero divisor.
   * @return The factor.
   * @throws IllegalArgumentException if the factor was zero or not finite.
   */
  public static NormalizationFactor of(final double factor) {
    checkDivisor(factor);
    if (factor == 1.0) {
      return NONE;
    }
    return new NormalizationFactor(factor, false);
  }

  /** @return Whether or not this divides by the maximum of the data. */
  public boolean isMax() {
    return max;
  }

  /** @return The scalar divisor, NaN for {@link #MAX}. */
  public double factor() {
    return factor;
  }

  /**
   * Computes the divisor for a deterministic or single payload.
   * @param windows The non-null windows of the series.
   * @return The divisor.
   * @throws FeatureNotImplementedException if this is {@link #MAX} and the
   * payload is not made of constants.
   * @throws IllegalArgumentException if the divisor is zero.
   */
  public <T extends PayloadElement> double divisorFor(
      final Collection<Window<T>> windows) {
    if (!max) {
      return factor;
    }
    double divisor = Double.NaN;
    for (final Window<T> window : windows) {
      for (final T element : window) {
        if (!(element instanceof ConstantValue)) {
          throw new FeatureNotImplementedException("Max normalization",
              element.type());
        }
        final double value = ((ConstantValue) element).value();
        if (Double.isNaN(divisor) || value > divisor) {
          divisor = value;
        }
      }
    }
    checkDivisor(divisor);
    return divisor;
  }

  /**
   * Computes the divisor for an ensemble payload.
   * @param windows The non-null windows of the series.
   * @return The divisor.
   * @throws IllegalArgumentException if the divisor is zero.
   */
  public double divisorForEnsembles(final Collection<EnsembleWindow> windows) {
    if (!max) {
      return factor;
    }
    double divisor = Double.NaN;
    for (final EnsembleWindow window : windows) {
      final double window_max = window.max();
      if (Double.isNaN(divisor) || window_max > divisor) {
        divisor = window_max;
      }
    }
    checkDivisor(divisor);
    return divisor;
  }

  @Override
  public String toString() {
    return max ? "MAX" : Double.toString(factor);
  }

  /**
   * @param divisor The divisor to check.
   * @throws IllegalArgumentException if the divisor was zero or not finite.
   */
  private static void checkDivisor(final double divisor) {
    if (divisor == 0 || Double.isNaN(divisor) || Double.isInfinite(divisor)) {
      throw new IllegalArgumentException("Normalization divisor must be "
          + "finite and non-zero: " + divisor);
    }
  }
}
