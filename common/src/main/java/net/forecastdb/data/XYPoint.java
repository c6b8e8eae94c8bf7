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

/**
 * A single breakpoint of a piecewise curve.
 *
 * @since 1.0
 */
public final class XYPoint {
  /** The number of scalar components of a point. */
  public static final int COMPONENTS = 2;

  private final double x;
  private final double y;

  /**
   * Ctor.
   * @param x The x coordinate.
   * @param y The y coordinate.
   */
  public XYPoint(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  /** @return The x coordinate. */
  public double x() {
    return x;
  }

  /** @return The y coordinate. */
  public double y() {
    return y;
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof XYPoint)) {
      return false;
    }
    final XYPoint other = (XYPoint) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
