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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.forecastdb.configuration.Configuration;
import net.forecastdb.exceptions.FeatureNotImplementedException;
import net.forecastdb.exceptions.IllegalDataFormatException;
import net.forecastdb.series.SeriesType;
import net.forecastdb.utils.DateTime;

/**
 * Reads series from delimited text files, optionally gzipped when the name
 * ends in {@code .gz}. The first line is a header and the first column holds
 * the timestamps, parsed with {@link DateTime#parseTimestamp(String)}.
 * <ul>
 * <li>Deterministic: every further column is an offset within the window
 * and every row is one window starting at the row's timestamp.</li>
 * <li>Single time series: the column named after the owner holds the
 * values, one per row.</li>
 * </ul>
 * Blank lines are skipped.
 *
 * @since 1.0
 */
public class DelimitedFileReader implements TimeSeriesReader {
  private static final Logger LOG = LoggerFactory.getLogger(
      DelimitedFileReader.class);

  public static final String DELIMITER_KEY = "forecastdb.reader.delimiter";
  public static final String TIMESTAMP_COLUMN_KEY =
      "forecastdb.reader.timestamp_column";

  /** The column delimiter. */
  private final String delimiter;

  /** The expected name of the first column. */
  private final String timestamp_column;

  /** Splits lines on the delimiter. */
  private final Splitter splitter;

  /**
   * Default ctor.
   * @param config A non-null config to read the delimiter and timestamp
   * column from. The keys are registered if needed.
   */
  public DelimitedFileReader(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    registerConfigs(config);
    delimiter = config.getString(DELIMITER_KEY);
    timestamp_column = config.getString(TIMESTAMP_COLUMN_KEY);
    if (Strings.isNullOrEmpty(delimiter)) {
      throw new IllegalArgumentException("Delimiter cannot be null or empty.");
    }
    splitter = Splitter.on(delimiter).trimResults();
  }

  @Override
  public SortedMap<Instant, double[]> read(final SeriesType type,
                                           final Path source,
                                           final String owner)
      throws IOException {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (type != SeriesType.DETERMINISTIC &&
        type != SeriesType.SINGLE_TIME_SERIES) {
      throw new FeatureNotImplementedException("Reading delimited files",
          type);
    }
    if (type == SeriesType.SINGLE_TIME_SERIES && Strings.isNullOrEmpty(owner)) {
      throw new IllegalArgumentException("Owner cannot be null or empty "
          + "when reading a single time series.");
    }

    try (final BufferedReader reader = open(source)) {
      String line = nextLine(reader);
      if (line == null) {
        throw new IllegalDataFormatException("No header found in " + source);
      }
      final List<String> header = splitter.splitToList(line);
      if (!Strings.isNullOrEmpty(timestamp_column) &&
          !header.get(0).equals(timestamp_column)) {
        throw new IllegalDataFormatException("The first column of " + source
            + " must be " + timestamp_column + " but was " + header.get(0));
      }

      final int value_column;
      if (type == SeriesType.SINGLE_TIME_SERIES) {
        value_column = header.indexOf(owner);
        if (value_column < 1) {
          throw new IllegalArgumentException("No column for " + owner
              + " in " + source + ": " + header);
        }
      } else {
        value_column = -1;
      }

      final SortedMap<Instant, double[]> data = Maps.newTreeMap();
      int line_number = 1;
      while ((line = reader.readLine()) != null) {
        line_number++;
        if (line.trim().isEmpty()) {
          continue;
        }
        final List<String> row = splitter.splitToList(line);
        if (row.size() != header.size()) {
          throw new IllegalDataFormatException("Line " + line_number + " of "
              + source + " has " + row.size() + " columns but the header has "
              + header.size());
        }

        final Instant timestamp;
        try {
          timestamp = DateTime.parseTimestamp(row.get(0));
        } catch (IllegalArgumentException e) {
          throw new IllegalDataFormatException("Invalid timestamp on line "
              + line_number + " of " + source, e);
        }

        final double[] values;
        if (value_column > 0) {
          values = new double[] {
              parseValue(row.get(value_column), line_number, source) };
        } else {
          values = new double[row.size() - 1];
          for (int i = 1; i < row.size(); i++) {
            values[i - 1] = parseValue(row.get(i), line_number, source);
          }
        }
        if (data.put(timestamp, values) != null) {
          throw new IllegalDataFormatException("Duplicate timestamp "
              + timestamp + " on line " + line_number + " of " + source);
        }
      }

      if (LOG.isDebugEnabled()) {
        LOG.debug("Read " + data.size() + " rows of " + type + " data for "
            + owner + " from " + source);
      }
      return data;
    }
  }

  /**
   * @param source The file.
   * @return A reader over the file, decompressing gzipped files.
   * @throws IOException if the file could not be opened.
   */
  private static BufferedReader open(final Path source) throws IOException {
    InputStream stream = Files.newInputStream(source);
    if (source.getFileName().toString().toLowerCase().endsWith(".gz")) {
      try {
        stream = new GZIPInputStream(stream);
      } catch (IOException e) {
        stream.close();
        throw e;
      }
    }
    return new BufferedReader(
        new InputStreamReader(stream, StandardCharsets.UTF_8));
  }

  /**
   * @param reader The reader.
   * @return The next non-blank line or null at the end of the stream.
   * @throws IOException if reading failed.
   */
  private static String nextLine(final BufferedReader reader)
      throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      if (!line.trim().isEmpty()) {
        return line;
      }
    }
    return null;
  }

  /**
   * @param value The raw cell.
   * @param line_number The line for error messages.
   * @param source The file for error messages.
   * @return The parsed value.
   */
  private static double parseValue(final String value,
                                   final int line_number,
                                   final Path source) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalDataFormatException("Invalid value [" + value
          + "] on line " + line_number + " of " + source, e);
    }
  }

  /**
   * Registers the reader's configuration keys if they are not present yet.
   * @param config A non-null config.
   */
  static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(DELIMITER_KEY)) {
      config.register(DELIMITER_KEY, ",", "The column delimiter of "
          + "delimited series files.");
    }
    if (!config.hasProperty(TIMESTAMP_COLUMN_KEY)) {
      config.register(TIMESTAMP_COLUMN_KEY, "DateTime", "The expected "
          + "header of the timestamp column of delimited series files. If "
          + "empty the header is not checked.");
    }
  }
}
