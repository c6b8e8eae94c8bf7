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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An ordered list of (x, y) breakpoints describing a piecewise linear curve.
 * The number of points may differ from one curve to the next; the shaping
 * engine requires them to match across a series.
 *
 * @since 1.0
 */
public final class PiecewiseLinearValue implements PayloadElement {

  /** The ordered points. */
  private final ImmutableList<XYPoint> points;

  /**
   * Ctor.
   * @param points The non-null points.
   */
  private PiecewiseLinearValue(final ImmutableList<XYPoint> points) {
    this.points = points;
  }

  /**
   * @param points A non-null list of non-null points.
   * @return A new curve.
   * @throws IllegalArgumentException if the list or a point was null.
   */
  public static PiecewiseLinearValue of(final List<XYPoint> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    for (final XYPoint point : points) {
      if (point == null) {
        throw new IllegalArgumentException("Points cannot contain nulls.");
      }
    }
    return new PiecewiseLinearValue(ImmutableList.copyOf(points));
  }

  /**
   * @param points The points in order.
   * @return A new curve.
   */
  public static PiecewiseLinearValue of(final XYPoint... points) {
    return of(ImmutableList.copyOf(points));
  }

  /** @return The immutable list of points. */
  public ImmutableList<XYPoint> points() {
    return points;
  }

  /** @return The number of points in the curve. */
  public int pointCount() {
    return points.size();
  }

  @Override
  public PayloadType type() {
    return PayloadType.PIECEWISE_LINEAR;
  }

  @Override
  public boolean sameShape(final PayloadElement other) {
    return other instanceof PiecewiseLinearValue;
  }

  @Override
  public PiecewiseLinearValue dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    final ImmutableList.Builder<XYPoint> builder = ImmutableList.builder();
    for (final XYPoint point : points) {
      builder.add(new XYPoint(point.x(), point.y() / divisor));
    }
    return new PiecewiseLinearValue(builder.build());
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PiecewiseLinearValue)) {
      return false;
    }
    return points.equals(((PiecewiseLinearValue) o).points);
  }

  @Override
  public int hashCode() {
    return points.hashCode();
  }

  @Override
  public String toString() {
    return points.toString();
  }
}
