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
 * A fixed length tuple of cost-style polynomial coefficients. Two coefficients
 * describe linear data (proportional term, constant term) and three describe
 * quadratic data (quadratic term, proportional term, constant term).
 *
 * @since 1.0
 */
public final class PolynomialValue implements PayloadElement {
  /** Coefficient count for linear data. */
  public static final int LINEAR = 2;

  /** Coefficient count for quadratic data. */
  public static final int QUADRATIC = 3;

  /** The coefficients in the order given. */
  private final double[] coefficients;

  /**
   * Ctor that takes ownership of the array.
   * @param coefficients A non-null array of 2 or 3 entries.
   */
  private PolynomialValue(final double[] coefficients) {
    this.coefficients = coefficients;
  }

  /**
   * @param proportional The proportional term.
   * @param constant The constant term.
   * @return A linear tuple.
   */
  public static PolynomialValue linear(final double proportional,
                                       final double constant) {
    return new PolynomialValue(new double[] { proportional, constant });
  }

  /**
   * @param quadratic The quadratic term.
   * @param proportional The proportional term.
   * @param constant The constant term.
   * @return A quadratic tuple.
   */
  public static PolynomialValue quadratic(final double quadratic,
                                          final double proportional,
                                          final double constant) {
    return new PolynomialValue(
        new double[] { quadratic, proportional, constant });
  }

  /**
   * Copies the given coefficients into a new tuple.
   * @param coefficients A non-null array of 2 or 3 coefficients.
   * @return A new tuple.
   * @throws IllegalArgumentException if the array was null or of the wrong
   * length.
   */
  public static PolynomialValue of(final double... coefficients) {
    if (coefficients == null) {
      throw new IllegalArgumentException("Coefficients cannot be null.");
    }
    if (coefficients.length != LINEAR && coefficients.length != QUADRATIC) {
      throw new IllegalArgumentException("Polynomial data must have "
          + LINEAR + " or " + QUADRATIC + " coefficients, not "
          + coefficients.length);
    }
    return new PolynomialValue(Arrays.copyOf(coefficients,
        coefficients.length));
  }

  /** @return The number of coefficients, 2 or 3. */
  public int coefficientCount() {
    return coefficients.length;
  }

  /**
   * @param index A zero based index less than {@link #coefficientCount()}.
   * @return The coefficient at the index.
   */
  public double coefficient(final int index) {
    return coefficients[index];
  }

  /** @return A copy of the coefficients. */
  public double[] coefficients() {
    return Arrays.copyOf(coefficients, coefficients.length);
  }

  @Override
  public PayloadType type() {
    return PayloadType.POLYNOMIAL;
  }

  @Override
  public boolean sameShape(final PayloadElement other) {
    return other instanceof PolynomialValue &&
        ((PolynomialValue) other).coefficients.length == coefficients.length;
  }

  @Override
  public PolynomialValue dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    final double[] divided = new double[coefficients.length];
    for (int i = 0; i < coefficients.length; i++) {
      divided[i] = coefficients[i] / divisor;
    }
    return new PolynomialValue(divided);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof PolynomialValue)) {
      return false;
    }
    return Arrays.equals(coefficients, ((PolynomialValue) o).coefficients);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coefficients);
  }

  @Override
  public String toString() {
    return Arrays.toString(coefficients);
  }
}
