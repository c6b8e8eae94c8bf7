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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.SortedMap;

import net.forecastdb.series.SeriesType;

/**
 * Reads raw series values from an external source.
 *
 * @since 1.0
 */
public interface TimeSeriesReader {

  /**
   * Reads the values of one series.
   * @param type The kind of series to read.
   * @param source The non-null file to read.
   * @param owner The name of the entity owning the series, used to select
   * its values from shared files.
   * @return A non-null map of timestamps to values in ascending order. For
   * forecasts each entry is a window start and its values, for single time
   * series each entry holds one value.
   * @throws IOException if the source could not be read.
   * @throws net.forecastdb.exceptions.IllegalDataFormatException if the
   * content was malformed.
   * @throws net.forecastdb.exceptions.FeatureNotImplementedException if the
   * kind of series cannot be read.
   */
  public SortedMap<Instant, double[]> read(final SeriesType type,
                                           final Path source,
                                           final String owner)
      throws IOException;

}
