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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import net.forecastdb.configuration.Configuration;
import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.TimeTable;
import net.forecastdb.data.Window;
import net.forecastdb.storage.DelimitedFileReader;
import net.forecastdb.storage.TimeSeriesReader;
import net.forecastdb.utils.DateTime;

/**
 * Entry points that build series from raw input. Every entry point divides
 * the values by the normalization factor. The scaling factor multiplier is
 * only recorded, it is applied by the owner when reading.
 * <p>
 * Construction is atomic: either a fully validated series is returned or an
 * exception is thrown.
 *
 * @since 1.0
 */
public class SeriesFactory {
  private static final Logger LOG = LoggerFactory.getLogger(
      SeriesFactory.class);

  public static final String ASSUME_CONSTANT_KEY =
      "forecastdb.payload.assume_constant";

  /** The reader used for file based input. */
  private final TimeSeriesReader reader;

  /** Converts loosely typed input. */
  private final PayloadConverter converter;

  /**
   * Ctor reading files with a {@link DelimitedFileReader}.
   * @param config A non-null config.
   */
  public SeriesFactory(final Configuration config) {
    this(config, config == null ? null : new DelimitedFileReader(config));
  }

  /**
   * Ctor with an explicit reader.
   * @param config A non-null config.
   * @param reader A non-null reader for file based input.
   */
  public SeriesFactory(final Configuration config,
                       final TimeSeriesReader reader) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    if (!config.hasProperty(ASSUME_CONSTANT_KEY)) {
      config.register(ASSUME_CONSTANT_KEY, false, "Whether or not raw "
          + "window values without structural information, e.g. numeric "
          + "strings or empty windows, are treated as constants. When false "
          + "such input is rejected.");
    }
    this.reader = reader;
    converter = new PayloadConverter(config.getBoolean(ASSUME_CONSTANT_KEY));
  }

  /** @return The converter for loosely typed input. */
  public PayloadConverter converter() {
    return converter;
  }

  /**
   * Builds a deterministic series of constants.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param data Window starts mapped to the window values.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  public Deterministic<ConstantValue> deterministic(
      final String name,
      final Duration resolution,
      final Map<Instant, double[]> data,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    final SortedMap<Instant, Window<ConstantValue>> windows =
        Maps.newTreeMap();
    for (final Entry<Instant, double[]> entry : data.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Window at " + entry.getKey()
            + " cannot be null.");
      }
      windows.put(entry.getKey(), Window.ofConstants(entry.getValue()));
    }
    return deterministicFromWindows(name, resolution, windows, factor,
        scaling_factor_multiplier);
  }

  /**
   * Builds a deterministic series from typed windows.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param data Window starts mapped to windows.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  public <T extends PayloadElement> Deterministic<T> deterministicFromWindows(
      final String name,
      final Duration resolution,
      final Map<Instant, Window<T>> data,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    final Deterministic<T> series = Deterministic.<T>newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setData(normalize(data, factor))
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Built series: " + series);
    }
    return series;
  }

  /**
   * Builds a deterministic series from loosely typed values, classified by
   * the {@link PayloadConverter}.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param data Window starts mapped to the raw values.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  public Deterministic<PayloadElement> deterministicFromRaw(
      final String name,
      final Duration resolution,
      final Map<Instant, ? extends List<?>> data,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    return deterministicFromWindows(name, resolution,
        converter.convert(data), factor, scaling_factor_multiplier);
  }

  /**
   * Builds a deterministic series of constants from tables, one per window.
   * Each table must have exactly one value column.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps. If null it is inferred from
   * the timestamps of the first table.
   * @param data Window starts mapped to tables.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   * @throws IllegalArgumentException if a table had more than one value
   * column.
   */
  public Deterministic<ConstantValue> deterministicFromTables(
      final String name,
      final Duration resolution,
      final Map<Instant, TimeTable> data,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    if (data == null || data.isEmpty()) {
      throw new IllegalArgumentException("Data cannot be null or empty.");
    }
    final SortedMap<Instant, Window<ConstantValue>> windows =
        Maps.newTreeMap();
    for (final Entry<Instant, TimeTable> entry : data.entrySet()) {
      windows.put(entry.getKey(),
          Window.ofConstants(singleColumn(entry.getValue(), entry.getKey())));
    }
    final Duration actual_resolution = resolution != null ? resolution :
        DateTime.resolutionOf(data.get(windows.firstKey()).timestamps());
    return deterministicFromWindows(name, actual_resolution, windows, factor,
        scaling_factor_multiplier);
  }

  /**
   * Builds a deterministic series of constants from a file.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param file The file to read.
   * @param owner The owning entity.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   * @throws IOException if the file could not be read.
   */
  public Deterministic<ConstantValue> deterministicFromFile(
      final String name,
      final Duration resolution,
      final Path file,
      final String owner,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) throws IOException {
    final SortedMap<Instant, double[]> raw =
        reader.read(SeriesType.DETERMINISTIC, file, owner);
    return deterministic(name, resolution, raw, factor,
        scaling_factor_multiplier);
  }

  /**
   * Builds a percentile forecast.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param data Window starts mapped to ensemble windows with one member per
   * percentile.
   * @param percentiles Strictly ascending percentile labels.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  public Probabilistic probabilistic(
      final String name,
      final Duration resolution,
      final Map<Instant, EnsembleWindow> data,
      final double[] percentiles,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    final Probabilistic series = Probabilistic.newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setPercentiles(percentiles)
        .setData(normalizeEnsembles(data, factor))
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Built series: " + series);
    }
    return series;
  }

  /**
   * Builds a scenario ensemble.
   * @param name A non-null and non-empty name.
   * @param resolution The spacing of timesteps within a window.
   * @param data Window starts mapped to ensemble windows with one member per
   * scenario.
   * @param scenario_count The number of scenarios.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  public Scenarios scenarios(
      final String name,
      final Duration resolution,
      final Map<Instant, EnsembleWindow> data,
      final int scenario_count,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    final Scenarios series = Scenarios.newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setScenarioCount(scenario_count)
        .setData(normalizeEnsembles(data, factor))
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Built series: " + series);
    }
    return series;
  }

  /**
   * Builds a single time series of constants, inferring the resolution.
   * @param name A non-null and non-empty name.
   * @param data At least two timestamps mapped to values.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   * @throws net.forecastdb.exceptions.IllegalDataFormatException if the
   * resolution was not uniform.
   */
  public SingleTimeSeries<ConstantValue> singleTimeSeries(
      final String name,
      final Map<Instant, Double> data,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    if (data == null || data.isEmpty()) {
      throw new IllegalArgumentException("Data cannot be null or empty.");
    }
    if (data.containsValue(null)) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    final SortedMap<Instant, Double> sorted = ImmutableSortedMap.copyOf(data);
    final double[] values = new double[sorted.size()];
    int i = 0;
    for (final Double value : sorted.values()) {
      values[i++] = value;
    }
    return singleTimeSeries(name, ImmutableList.copyOf(sorted.keySet()),
        values, factor, scaling_factor_multiplier);
  }

  /**
   * Builds a single time series of constants from a table with one value
   * column, inferring the resolution.
   * @param name A non-null and non-empty name.
   * @param table A table with at least two rows.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   * @throws IllegalArgumentException if the table had more than one value
   * column.
   */
  public SingleTimeSeries<ConstantValue> singleTimeSeriesFromTable(
      final String name,
      final TimeTable table,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    if (table == null) {
      throw new IllegalArgumentException("Table cannot be null.");
    }
    return singleTimeSeries(name, table.timestamps(),
        singleColumn(table, null), factor, scaling_factor_multiplier);
  }

  /**
   * Builds a single time series of constants from the owner's column of a
   * file, inferring the resolution.
   * @param name A non-null and non-empty name.
   * @param file The file to read.
   * @param owner The owning entity, names the column to read.
   * @param factor The non-null normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   * @throws IOException if the file could not be read.
   */
  public SingleTimeSeries<ConstantValue> singleTimeSeriesFromFile(
      final String name,
      final Path file,
      final String owner,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) throws IOException {
    final SortedMap<Instant, double[]> raw =
        reader.read(SeriesType.SINGLE_TIME_SERIES, file, owner);
    final SortedMap<Instant, Double> data = Maps.newTreeMap();
    for (final Entry<Instant, double[]> entry : raw.entrySet()) {
      if (entry.getValue().length != 1) {
        throw new IllegalArgumentException("Expected a single value at "
            + entry.getKey() + " but got " + entry.getValue().length);
      }
      data.put(entry.getKey(), entry.getValue()[0]);
    }
    return singleTimeSeries(name, data, factor, scaling_factor_multiplier);
  }

  /**
   * Shared single time series path.
   * @param name The name.
   * @param timestamps The ordered timestamps.
   * @param values The values, one per timestamp.
   * @param factor The normalization factor.
   * @param scaling_factor_multiplier An optional multiplier name.
   * @return The series.
   */
  private SingleTimeSeries<ConstantValue> singleTimeSeries(
      final String name,
      final List<Instant> timestamps,
      final double[] values,
      final NormalizationFactor factor,
      final String scaling_factor_multiplier) {
    final Duration resolution = DateTime.resolutionOf(timestamps);
    final Map<Instant, Window<ConstantValue>> normalized = normalize(
        ImmutableSortedMap.of(timestamps.get(0), Window.ofConstants(values)),
        factor);
    final SingleTimeSeries<ConstantValue> series =
        SingleTimeSeries.<ConstantValue>newBuilder()
        .setName(name)
        .setResolution(resolution)
        .setInitialTimestamp(timestamps.get(0))
        .setWindow(normalized.get(timestamps.get(0)))
        .setScalingFactorMultiplier(scaling_factor_multiplier)
        .build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Built series: " + series + " with resolution "
          + DateTime.durationToString(resolution));
    }
    return series;
  }

  /**
   * Divides every window by the normalization divisor.
   * @param data The windows.
   * @param factor The factor.
   * @return The normalized windows.
   */
  private static <T extends PayloadElement> Map<Instant, Window<T>> normalize(
      final Map<Instant, Window<T>> data,
      final NormalizationFactor factor) {
    if (factor == null) {
      throw new IllegalArgumentException("Normalization factor cannot be "
          + "null.");
    }
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    if (factor == NormalizationFactor.NONE) {
      return data;
    }
    final double divisor = factor.divisorFor(data.values());
    final SortedMap<Instant, Window<T>> normalized = Maps.newTreeMap();
    for (final Entry<Instant, Window<T>> entry : data.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Window at " + entry.getKey()
            + " cannot be null.");
      }
      normalized.put(entry.getKey(), entry.getValue().dividedBy(divisor));
    }
    return normalized;
  }

  /**
   * Divides every ensemble window by the normalization divisor.
   * @param data The windows.
   * @param factor The factor.
   * @return The normalized windows.
   */
  private static Map<Instant, EnsembleWindow> normalizeEnsembles(
      final Map<Instant, EnsembleWindow> data,
      final NormalizationFactor factor) {
    if (factor == null) {
      throw new IllegalArgumentException("Normalization factor cannot be "
          + "null.");
    }
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    if (factor == NormalizationFactor.NONE) {
      return data;
    }
    final double divisor = factor.divisorForEnsembles(data.values());
    final SortedMap<Instant, EnsembleWindow> normalized = Maps.newTreeMap();
    for (final Entry<Instant, EnsembleWindow> entry : data.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Window at " + entry.getKey()
            + " cannot be null.");
      }
      normalized.put(entry.getKey(), entry.getValue().dividedBy(divisor));
    }
    return normalized;
  }

  /**
   * @param table A table.
   * @param start The window start for error messages, may be null.
   * @return The values of the only column.
   * @throws IllegalArgumentException if the table had more than one value
   * column.
   */
  private static double[] singleColumn(final TimeTable table,
                                       final Instant start) {
    if (table == null) {
      throw new IllegalArgumentException("Table at " + start
          + " cannot be null.");
    }
    if (table.columnCount() != 1) {
      throw new IllegalArgumentException("Only tables with a single value "
          + "column are supported but " + (start == null ? "the table" :
            "the table at " + start) + " has " + table.columnCount() + ": "
          + table.columns());
    }
    return table.column(0);
  }
}
