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
package net.forecastdb.storage;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.PiecewiseLinearValue;
import net.forecastdb.data.PolynomialValue;
import net.forecastdb.data.Window;
import net.forecastdb.data.XYPoint;
import net.forecastdb.exceptions.FeatureNotImplementedException;
import net.forecastdb.series.Deterministic;
import net.forecastdb.series.EnsembleSeries;
import net.forecastdb.series.SingleTimeSeries;
import net.forecastdb.series.TimeSeries;

/**
 * Converts series into the dense arrays handed to the binary writer. The
 * rank grows with the payload structure:
 * <table>
 * <tr><th>Payload</th><th>One window</th><th>Full store</th></tr>
 * <tr><td>Constant</td><td>[horizon]</td><td>[horizon, count]</td></tr>
 * <tr><td>Polynomial(k)</td><td>[horizon, k]</td>
 * <td>[horizon, count, k]</td></tr>
 * <tr><td>Piecewise linear</td><td>[horizon, n_points, 2]</td>
 * <td>[horizon, count, n_points, 2]</td></tr>
 * <tr><td>Ensemble</td><td>[horizon, width]</td>
 * <td>[horizon, count, width]</td></tr>
 * </table>
 * Windows of the store are stacked along the second dimension in ascending
 * start order. Piecewise linear curves must report the same number of
 * points at every timestep of every window. Any other payload type fails
 * with a {@link FeatureNotImplementedException}.
 *
 * @since 1.0
 */
public class StorageArrayShaper {
  private static final Logger LOG = LoggerFactory.getLogger(
      StorageArrayShaper.class);

  /** Feature name used in errors. */
  public static final String FEATURE = "Storage shaping";

  /**
   * Shapes the full payload of a series. Deterministic and ensemble series
   * are shaped as a full store, single time series as one window.
   * @param series A non-null series.
   * @return The shaped array.
   * @throws IllegalArgumentException if curve point counts differ.
   * @throws FeatureNotImplementedException if the payload or series type is
   * not supported.
   */
  public ShapedArray shapeForStorage(final TimeSeries series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final ShapedArray array;
    if (series instanceof Deterministic) {
      array = shapeWindows(((Deterministic<?>) series).windows().values());
    } else if (series instanceof SingleTimeSeries) {
      array = shapeWindow(((SingleTimeSeries<?>) series).window());
    } else if (series instanceof EnsembleSeries) {
      array = shapeEnsembles(((EnsembleSeries) series).windows().values());
    } else {
      throw new FeatureNotImplementedException(FEATURE,
          series.getClass().getSimpleName());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Shaped " + series.seriesType() + " series " + series.name()
          + " into " + Arrays.toString(array.shape()));
    }
    return array;
  }

  /**
   * Shapes a single window.
   * @param window A non-null window.
   * @return The shaped array.
   * @throws IllegalArgumentException if curve point counts differ.
   * @throws FeatureNotImplementedException if the payload type is not
   * supported.
   */
  public ShapedArray shapeWindow(
      final Window<? extends PayloadElement> window) {
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    final int horizon = window.length();
    final PayloadType type = window.type() == null ?
        PayloadType.CONSTANT : window.type();
    switch (type) {
    case CONSTANT: {
      final double[] data = new double[horizon];
      for (int i = 0; i < horizon; i++) {
        data[i] = ((ConstantValue) window.get(i)).value();
      }
      return new ShapedArray(new int[] { horizon }, data);
    }
    case POLYNOMIAL: {
      final int k = coefficientCount(window.get(0));
      final double[] data = new double[horizon * k];
      for (int i = 0; i < horizon; i++) {
        copyCoefficients(window.get(i), k, data, i * k);
      }
      return new ShapedArray(new int[] { horizon, k }, data);
    }
    case PIECEWISE_LINEAR: {
      final int n = pointCount(window.get(0));
      final double[] data = new double[horizon * n * XYPoint.COMPONENTS];
      for (int i = 0; i < horizon; i++) {
        copyPoints(window.get(i), n, i, data, i * n * XYPoint.COMPONENTS);
      }
      return new ShapedArray(new int[] { horizon, n, XYPoint.COMPONENTS },
          data);
    }
    default:
      throw new FeatureNotImplementedException(FEATURE, type);
    }
  }

  /**
   * Shapes a full store of windows, stacking them along the second
   * dimension in the order given.
   * @param windows A non-null and non-empty collection of windows with the
   * same length and payload type.
   * @return The shaped array.
   * @throws IllegalArgumentException if the windows differ in length or
   * type or curve point counts differ.
   * @throws FeatureNotImplementedException if the payload type is not
   * supported.
   */
  public ShapedArray shapeWindows(
      final Collection<? extends Window<? extends PayloadElement>> windows) {
    if (windows == null || windows.isEmpty()) {
      throw new IllegalArgumentException("Windows cannot be null or empty.");
    }
    final List<Window<? extends PayloadElement>> list =
        ImmutableList.copyOf(windows);
    final int count = list.size();
    final int horizon = list.get(0).length();
    for (int j = 1; j < count; j++) {
      if (list.get(j).length() != horizon) {
        throw new IllegalArgumentException("Horizon mismatch: window " + j
            + " has " + list.get(j).length() + " timesteps but window 0 has "
            + horizon);
      }
      if (list.get(j).type() != list.get(0).type()) {
        throw new IllegalArgumentException("Payload type mismatch: window "
            + j + " holds " + list.get(j).type() + " but window 0 holds "
            + list.get(0).type());
      }
    }
    final PayloadType type = list.get(0).type() == null ?
        PayloadType.CONSTANT : list.get(0).type();

    switch (type) {
    case CONSTANT: {
      final double[] data = new double[horizon * count];
      for (int i = 0; i < horizon; i++) {
        for (int j = 0; j < count; j++) {
          data[i * count + j] = ((ConstantValue) list.get(j).get(i)).value();
        }
      }
      return new ShapedArray(new int[] { horizon, count }, data);
    }
    case POLYNOMIAL: {
      final int k = coefficientCount(list.get(0).get(0));
      final double[] data = new double[horizon * count * k];
      for (int i = 0; i < horizon; i++) {
        for (int j = 0; j < count; j++) {
          copyCoefficients(list.get(j).get(i), k, data, (i * count + j) * k);
        }
      }
      return new ShapedArray(new int[] { horizon, count, k }, data);
    }
    case PIECEWISE_LINEAR: {
      final int n = pointCount(list.get(0).get(0));
      final int stride = n * XYPoint.COMPONENTS;
      final double[] data = new double[horizon * count * stride];
      for (int i = 0; i < horizon; i++) {
        for (int j = 0; j < count; j++) {
          copyPoints(list.get(j).get(i), n, i, data, (i * count + j) * stride);
        }
      }
      return new ShapedArray(
          new int[] { horizon, count, n, XYPoint.COMPONENTS }, data);
    }
    default:
      throw new FeatureNotImplementedException(FEATURE, type);
    }
  }

  /**
   * Shapes a single ensemble window as {@code [horizon, width]}.
   * @param window A non-null window.
   * @return The shaped array.
   */
  public ShapedArray shapeEnsemble(final EnsembleWindow window) {
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    final int horizon = window.horizon();
    final int width = window.width();
    final double[] data = new double[horizon * width];
    for (int i = 0; i < horizon; i++) {
      for (int m = 0; m < width; m++) {
        data[i * width + m] = window.get(i, m);
      }
    }
    return new ShapedArray(new int[] { horizon, width }, data);
  }

  /**
   * Shapes a full store of ensemble windows as
   * {@code [horizon, count, width]}.
   * @param windows A non-null and non-empty collection of windows with the
   * same horizon and width.
   * @return The shaped array.
   * @throws IllegalArgumentException if the windows differ in horizon or
   * width.
   */
  public ShapedArray shapeEnsembles(
      final Collection<EnsembleWindow> windows) {
    if (windows == null || windows.isEmpty()) {
      throw new IllegalArgumentException("Windows cannot be null or empty.");
    }
    final List<EnsembleWindow> list = ImmutableList.copyOf(windows);
    final int count = list.size();
    final int horizon = list.get(0).horizon();
    final int width = list.get(0).width();
    for (int j = 1; j < count; j++) {
      if (list.get(j).horizon() != horizon || list.get(j).width() != width) {
        throw new IllegalArgumentException("Ensemble window " + j
            + " is [" + list.get(j).horizon() + ", " + list.get(j).width()
            + "] but window 0 is [" + horizon + ", " + width + "]");
      }
    }
    final double[] data = new double[horizon * count * width];
    for (int i = 0; i < horizon; i++) {
      for (int j = 0; j < count; j++) {
        final EnsembleWindow window = list.get(j);
        for (int m = 0; m < width; m++) {
          data[(i * count + j) * width + m] = window.get(i, m);
        }
      }
    }
    return new ShapedArray(new int[] { horizon, count, width }, data);
  }

  /**
   * @param element A polynomial.
   * @return Its coefficient count.
   */
  private static int coefficientCount(final PayloadElement element) {
    return ((PolynomialValue) element).coefficientCount();
  }

  /**
   * Copies the coefficients of a polynomial into the array.
   * @param element The polynomial.
   * @param k The expected number of coefficients.
   * @param data The destination.
   * @param offset The offset of the first coefficient.
   */
  private static void copyCoefficients(final PayloadElement element,
                                       final int k,
                                       final double[] data,
                                       final int offset) {
    final PolynomialValue polynomial = (PolynomialValue) element;
    if (polynomial.coefficientCount() != k) {
      throw new IllegalArgumentException("Number of coefficients mismatch: "
          + "expected " + k + " but got " + polynomial.coefficientCount());
    }
    for (int c = 0; c < k; c++) {
      data[offset + c] = polynomial.coefficient(c);
    }
  }

  /**
   * @param element A piecewise linear curve.
   * @return Its point count.
   */
  private static int pointCount(final PayloadElement element) {
    return ((PiecewiseLinearValue) element).pointCount();
  }

  /**
   * Copies the points of a curve into the array as x, y pairs.
   * @param element The curve.
   * @param n The expected number of points.
   * @param step The timestep for error messages.
   * @param data The destination.
   * @param offset The offset of the first x.
   */
  private static void copyPoints(final PayloadElement element,
                                 final int n,
                                 final int step,
                                 final double[] data,
                                 final int offset) {
    final PiecewiseLinearValue curve = (PiecewiseLinearValue) element;
    if (curve.pointCount() != n) {
      throw new IllegalArgumentException("Number of points (n_points) "
          + "mismatch at timestep " + step + ": expected " + n + " but got "
          + curve.pointCount());
    }
    int idx = offset;
    for (final XYPoint point : curve.points()) {
      data[idx++] = point.x();
      data[idx++] = point.y();
    }
  }
}
