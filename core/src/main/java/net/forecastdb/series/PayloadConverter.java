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
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.PiecewiseLinearValue;
import net.forecastdb.data.PolynomialValue;
import net.forecastdb.data.Window;
import net.forecastdb.data.XYPoint;
import net.forecastdb.exceptions.IllegalDataFormatException;

/**
 * Classifies raw, loosely typed window values and converts them to typed
 * payload elements. Accepted shapes per value:
 * <ul>
 * <li>A {@link Number}: a constant.</li>
 * <li>A {@code double[]} or a list of numbers with 2 or 3 entries: a
 * polynomial.</li>
 * <li>A {@code double[][]} or a list of (x, y) pairs given as
 * {@code double[]}, lists or {@link XYPoint}s: a piecewise linear curve.
 * A pair with any other arity is rejected with an
 * {@link IllegalArgumentException}.</li>
 * <li>A {@link PayloadElement}: kept as is.</li>
 * </ul>
 * Every value of the input must have the same shape.
 * <p>
 * Anything else, e.g. numeric strings, carries no structural information.
 * Such input is only converted when the converter was created with
 * {@code assume_constant} set, in which case every value is parsed as a
 * constant. The flag is a deliberate narrowing to the most common case, it
 * is never inferred from the content.
 *
 * @since 1.0
 */
public class PayloadConverter {
  private static final Logger LOG = LoggerFactory.getLogger(
      PayloadConverter.class);

  /** Whether or not untyped values are converted to constants. */
  private final boolean assume_constant;

  /**
   * Default ctor.
   * @param assume_constant Whether or not input without structural
   * information is treated as constants.
   */
  public PayloadConverter(final boolean assume_constant) {
    this.assume_constant = assume_constant;
  }

  /** @return Whether or not untyped values are converted to constants. */
  public boolean assumeConstant() {
    return assume_constant;
  }

  /**
   * Determines the single payload type of the raw input.
   * @param raw A non-null map of window starts to raw values.
   * @return The payload type.
   * @throws IllegalDataFormatException if the values differ in shape or
   * carry no structural information and constants are not assumed.
   * @throws IllegalArgumentException if a value was null or a curve point
   * did not have exactly 2 components.
   */
  public PayloadType classify(final Map<Instant, ? extends List<?>> raw) {
    if (raw == null) {
      throw new IllegalArgumentException("Raw data cannot be null.");
    }
    Shape shape = null;
    boolean untyped = false;
    for (final Entry<Instant, ? extends List<?>> entry : raw.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Window at " + entry.getKey()
            + " cannot be null.");
      }
      for (final Object value : entry.getValue()) {
        final Shape current = shapeOf(value, entry.getKey());
        if (current == null) {
          untyped = true;
        } else if (shape == null) {
          shape = current;
        } else if (!shape.equals(current)) {
          throw new IllegalDataFormatException("Mixed payload shapes: "
              + shape + " and " + current + " in window at "
              + entry.getKey());
        }
      }
    }

    if (shape != null && untyped) {
      throw new IllegalDataFormatException("Mixed payload shapes: " + shape
          + " and untyped values");
    }
    if (shape != null) {
      return shape.type;
    }
    if (!assume_constant) {
      throw new IllegalDataFormatException("Unable to determine the payload "
          + "type: the values carry no structural information. Enable "
          + "'assume constant' to treat them as constants.");
    }
    LOG.warn("No structural information in the raw data, assuming "
        + "constant values.");
    return PayloadType.CONSTANT;
  }

  /**
   * Classifies and converts the raw input.
   * @param raw A non-null map of window starts to raw values.
   * @return The typed windows in ascending start order.
   * @throws IllegalDataFormatException if the values differ in shape, carry
   * no structural information and constants are not assumed, or could not be
   * coerced to numbers.
   * @throws IllegalArgumentException if a value was null or a curve point
   * did not have exactly 2 components.
   */
  public ImmutableSortedMap<Instant, Window<PayloadElement>> convert(
      final Map<Instant, ? extends List<?>> raw) {
    final PayloadType type = classify(raw);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Converting " + raw.size() + " windows of " + type
          + " payloads");
    }
    final ImmutableSortedMap.Builder<Instant, Window<PayloadElement>> builder =
        ImmutableSortedMap.naturalOrder();
    for (final Entry<Instant, ? extends List<?>> entry : raw.entrySet()) {
      final List<PayloadElement> elements =
          Lists.newArrayListWithCapacity(entry.getValue().size());
      for (final Object value : entry.getValue()) {
        elements.add(toElement(value, type, entry.getKey()));
      }
      builder.put(entry.getKey(), Window.<PayloadElement>of(elements));
    }
    return builder.build();
  }

  /**
   * @param value A raw value.
   * @param start The window start for error messages.
   * @return The shape of the value or null if it has no structure.
   */
  private static Shape shapeOf(final Object value, final Instant start) {
    if (value == null) {
      throw new IllegalArgumentException("Null value in window at " + start);
    }
    if (value instanceof PayloadElement) {
      final PayloadElement element = (PayloadElement) value;
      return new Shape(element.type(), element instanceof PolynomialValue ?
          ((PolynomialValue) element).coefficientCount() : 0);
    }
    if (value instanceof Number) {
      return new Shape(PayloadType.CONSTANT, 0);
    }
    if (value instanceof double[]) {
      return polynomial(((double[]) value).length, start);
    }
    if (value instanceof double[][]) {
      for (final double[] point : (double[][]) value) {
        checkPointArity(point == null ? 0 : point.length, start);
      }
      return new Shape(PayloadType.PIECEWISE_LINEAR, 0);
    }
    if (value instanceof List) {
      final List<?> list = (List<?>) value;
      if (list.isEmpty()) {
        return null;
      }
      if (allNumbers(list)) {
        return polynomial(list.size(), start);
      }
      for (final Object point : list) {
        if (point instanceof XYPoint) {
          continue;
        }
        if (point instanceof double[]) {
          checkPointArity(((double[]) point).length, start);
        } else if (point instanceof List && allNumbers((List<?>) point)) {
          checkPointArity(((List<?>) point).size(), start);
        } else {
          throw new IllegalDataFormatException("Unrecognized curve point "
              + point + " in window at " + start);
        }
      }
      return new Shape(PayloadType.PIECEWISE_LINEAR, 0);
    }
    return null;
  }

  /**
   * @param value The raw value.
   * @param type The classified type.
   * @param start The window start for error messages.
   * @return The typed element.
   */
  private static PayloadElement toElement(final Object value,
                                          final PayloadType type,
                                          final Instant start) {
    if (value instanceof PayloadElement) {
      return (PayloadElement) value;
    }
    switch (type) {
    case CONSTANT:
      if (value instanceof Number) {
        return ConstantValue.of(((Number) value).doubleValue());
      }
      try {
        return ConstantValue.of(Double.parseDouble(value.toString().trim()));
      } catch (NumberFormatException e) {
        throw new IllegalDataFormatException("Value [" + value
            + "] in window at " + start + " is not a number", e);
      }
    case POLYNOMIAL:
      return PolynomialValue.of(toDoubles(value));
    case PIECEWISE_LINEAR:
      final List<XYPoint> points = Lists.newArrayList();
      if (value instanceof double[][]) {
        for (final double[] point : (double[][]) value) {
          points.add(new XYPoint(point[0], point[1]));
        }
      } else {
        for (final Object point : (List<?>) value) {
          if (point instanceof XYPoint) {
            points.add((XYPoint) point);
          } else {
            final double[] xy = toDoubles(point);
            points.add(new XYPoint(xy[0], xy[1]));
          }
        }
      }
      return PiecewiseLinearValue.of(points);
    default:
      throw new IllegalDataFormatException("Cannot convert raw value ["
          + value + "] to " + type);
    }
  }

  /**
   * @param value A double array or a list of numbers.
   * @return The values as doubles.
   */
  private static double[] toDoubles(final Object value) {
    if (value instanceof double[]) {
      return (double[]) value;
    }
    final List<?> list = (List<?>) value;
    final double[] values = new double[list.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = ((Number) list.get(i)).doubleValue();
    }
    return values;
  }

  /**
   * @param list A non-null list.
   * @return Whether or not every entry is a number.
   */
  private static boolean allNumbers(final List<?> list) {
    for (final Object entry : list) {
      if (!(entry instanceof Number)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param arity The number of coefficients.
   * @param start The window start for error messages.
   * @return The polynomial shape.
   */
  private static Shape polynomial(final int arity, final Instant start) {
    if (arity != PolynomialValue.LINEAR && arity != PolynomialValue.QUADRATIC) {
      throw new IllegalDataFormatException("Polynomial payloads need "
          + PolynomialValue.LINEAR + " or " + PolynomialValue.QUADRATIC
          + " coefficients but a value in window at " + start + " has "
          + arity);
    }
    return new Shape(PayloadType.POLYNOMIAL, arity);
  }

  /**
   * @param arity The number of components of a curve point.
   * @param start The window start for error messages.
   */
  private static void checkPointArity(final int arity, final Instant start) {
    if (arity != XYPoint.COMPONENTS) {
      throw new IllegalArgumentException("Curve points need exactly "
          + XYPoint.COMPONENTS + " components but a point in window at "
          + start + " has " + arity);
    }
  }

  /** The type and, for polynomials, the arity of a value. */
  private static final class Shape {
    private final PayloadType type;
    private final int arity;

    private Shape(final PayloadType type, final int arity) {
      this.type = type;
      this.arity = arity;
    }

    @Override
    public boolean equals(final Object o) {
      if (!(o instanceof Shape)) {
        return false;
      }
      return type == ((Shape) o).type && arity == ((Shape) o).arity;
    }

    @Override
    public int hashCode() {
      return 31 * type.hashCode() + arity;
    }

    @Override
    public String toString() {
      return arity > 0 ? type + "(" + arity + ")" : type.toString();
    }
  }
}
