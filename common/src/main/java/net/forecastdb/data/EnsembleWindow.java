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
 * A forecast window holding several constant trajectories side by side, one
 * per percentile or scenario. Stored as a {@code horizon x width} matrix
 * where row {@code i} is timestep {@code i} and column {@code j} is member
 * {@code j} of the ensemble.
 *
 * @since 1.0
 */
public final class EnsembleWindow {

  /** Row major values, horizon * width entries. */
  private final double[] values;

  /** Number of timesteps. */
  private final int horizon;

  /** Number of members. */
  private final int width;

  /**
   * Ctor that takes ownership of the array.
   * @param values Row major values.
   * @param horizon Number of rows.
   * @param width Number of columns.
   */
  private EnsembleWindow(final double[] values,
                         final int horizon,
                         final int width) {
    this.values = values;
    this.horizon = horizon;
    this.width = width;
  }

  /**
   * Copies the matrix into a new window.
   * @param matrix A non-null rectangular matrix indexed as
   * {@code [timestep][member]}.
   * @return A new window.
   * @throws IllegalArgumentException if the matrix was null or ragged.
   */
  public static EnsembleWindow of(final double[][] matrix) {
    if (matrix == null) {
      throw new IllegalArgumentException("Matrix cannot be null.");
    }
    final int width = matrix.length == 0 || matrix[0] == null ?
        0 : matrix[0].length;
    final double[] values = new double[matrix.length * width];
    for (int i = 0; i < matrix.length; i++) {
      if (matrix[i] == null || matrix[i].length != width) {
        throw new IllegalArgumentException("Timestep " + i + " has "
            + (matrix[i] == null ? 0 : matrix[i].length)
            + " members but timestep 0 has " + width);
      }
      System.arraycopy(matrix[i], 0, values, i * width, width);
    }
    return new EnsembleWindow(values, matrix.length, width);
  }

  /** @return The number of timesteps. */
  public int horizon() {
    return horizon;
  }

  /** @return The number of members (percentiles or scenarios). */
  public int width() {
    return width;
  }

  /**
   * @param step A zero based timestep.
   * @param member A zero based member index.
   * @return The value at the timestep for the member.
   * @throws IndexOutOfBoundsException if either index was out of bounds.
   */
  public double get(final int step, final int member) {
    if (step < 0 || step >= horizon || member < 0 || member >= width) {
      throw new IndexOutOfBoundsException("[" + step + ", " + member
          + "] is out of bounds for [" + horizon + ", " + width + "]");
    }
    return values[step * width + member];
  }

  /**
   * Extracts the trajectory of a single member.
   * @param member A zero based member index.
   * @return A window of constants of length {@link #horizon()}.
   */
  public Window<ConstantValue> trajectory(final int member) {
    if (member < 0 || member >= width) {
      throw new IndexOutOfBoundsException("Member " + member
          + " is out of bounds for width " + width);
    }
    final double[] trajectory = new double[horizon];
    for (int i = 0; i < horizon; i++) {
      trajectory[i] = values[i * width + member];
    }
    return Window.ofConstants(trajectory);
  }

  /** @return The largest value in the window or NaN if empty. */
  public double max() {
    double max = Double.NaN;
    for (final double value : values) {
      if (Double.isNaN(max) || value > max) {
        max = value;
      }
    }
    return max;
  }

  /**
   * @param length A zero or positive number of timesteps to keep.
   * @return A window of at most {@code length} timesteps.
   */
  public EnsembleWindow truncate(final int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length cannot be negative: "
          + length);
    }
    if (length >= horizon) {
      return this;
    }
    return new EnsembleWindow(Arrays.copyOf(values, length * width),
        length, width);
  }

  /**
   * @param divisor A non-zero divisor.
   * @return A window with every value divided by the divisor.
   */
  public EnsembleWindow dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    final double[] divided = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      divided[i] = values[i] / divisor;
    }
    return new EnsembleWindow(divided, horizon, width);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof EnsembleWindow)) {
      return false;
    }
    final EnsembleWindow other = (EnsembleWindow) o;
    return horizon == other.horizon && width == other.width &&
        Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * horizon + width) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("horizon=")
        .append(horizon)
        .append(", width=")
        .append(width)
        .append(", values=")
        .append(Arrays.toString(values))
        .toString();
  }
}
