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
package net.forecastdb.data;

import java.util.Arrays;

/**
 * A step curve made of {@code n + 1} x breakpoints and {@code n} y values
 * where segment {@code i} spans {@code [x(i), x(i + 1))} at height
 * {@code y(i)}.
 * <p>
 * Series may carry step curves but they cannot yet be shaped for storage.
 *
 * @since 1.0
 */
public final class PiecewiseStepValue implements PayloadElement {

  private final double[] x_coords;
  private final double[] y_coords;

  /**
   * Ctor that takes ownership of the arrays.
   * @param x_coords The breakpoints.
   * @param y_coords The segment heights.
   */
  private PiecewiseStepValue(final double[] x_coords,
                             final double[] y_coords) {
    this.x_coords = x_coords;
    this.y_coords = y_coords;
  }

  /**
   * @param x_coords A non-null array of at least 2 breakpoints.
   * @param y_coords A non-null array with one entry less than the breakpoints.
   * @return A new step curve.
   * @throws IllegalArgumentException if an array was null or the lengths did
   * not match.
   */
  public static PiecewiseStepValue of(final double[] x_coords,
                                      final double[] y_coords) {
    if (x_coords == null || y_coords == null) {
      throw new IllegalArgumentException("Coordinates cannot be null.");
    }
    if (x_coords.length < 2) {
      throw new IllegalArgumentException("A step curve needs at least 2 "
          + "breakpoints.");
    }
    if (x_coords.length != y_coords.length + 1) {
      throw new IllegalArgumentException("A step curve with "
          + x_coords.length + " breakpoints needs " + (x_coords.length - 1)
          + " y values but got " + y_coords.length);
    }
    return new PiecewiseStepValue(Arrays.copyOf(x_coords, x_coords.length),
        Arrays.copyOf(y_coords, y_coords.length));
  }

  /** @return A copy of the breakpoints. */
  public double[] xCoords() {
    return Arrays.copyOf(x_coords, x_coords.length);
  }

  /** @return A copy of the segment heights. */
  public double[] yCoords() {
    return Arrays.copyOf(y_coords, y_coords.length);
  }

  @Override
  public PayloadType type() {
    return PayloadType.PIECEWISE_STEP;
  }

  @Override
  public boolean sameShape(final PayloadElement other) {
    return other instanceof PiecewiseStepValue;
  }

  @Override
  public PiecewiseStepValue dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    final double[] divided = new double[y_coords.length];
    for (int i = 0; i < y_coords.length; i++) {
      divided[i] = y_coords[i] / divisor;
    }
    return new PiecewiseStepValue(x_coords, divided);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PiecewiseStepValue)) {
      return false;
    }
    final PiecewiseStepValue other = (PiecewiseStepValue) o;
    return Arrays.equals(x_coords, other.x_coords) &&
        Arrays.equals(y_coords, other.y_coords);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(x_coords) + Arrays.hashCode(y_coords);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("x=")
        .append(Arrays.toString(x_coords))
        .append(", y=")
        .append(Arrays.toString(y_coords))
        .toString();
  }
}
