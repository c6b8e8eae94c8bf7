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
 * A plain double value at a timestep.
 *
 * @since 1.0
 */
public final class ConstantValue implements PayloadElement {

  /** The value. */
  private final double value;

  /**
   * Ctor.
   * @param value The value.
   */
  private ConstantValue(final double value) {
    this.value = value;
  }

  /**
   * @param value The value to wrap.
   * @return A new constant.
   */
  public static ConstantValue of(final double value) {
    return new ConstantValue(value);
  }

  /** @return The value. */
  public double value() {
    return value;
  }

  @Override
  public PayloadType type() {
    return PayloadType.CONSTANT;
  }

  @Override
  public boolean sameShape(final PayloadElement other) {
    return other instanceof ConstantValue;
  }

  @Override
  public ConstantValue dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    return new ConstantValue(value / divisor);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof ConstantValue)) {
      return false;
    }
    return Double.compare(value, ((ConstantValue) o).value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return Double.toString(value);
  }
}
