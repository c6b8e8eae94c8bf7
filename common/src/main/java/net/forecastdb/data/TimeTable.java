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

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A small time indexed table: strictly increasing timestamps down the rows
 * and one or more named value columns. Used as tabular input when building
 * series.
 *
 * @since 1.0
 */
public final class TimeTable {

  /** The row timestamps. */
  private final ImmutableList<Instant> timestamps;

  /** The column names in order. */
  private final ImmutableList<String> columns;

  /** Values indexed as [column][row]. */
  private final double[][] values;

  /**
   * Ctor for the builder.
   * @param builder A non-null builder.
   */
  private TimeTable(final Builder builder) {
    if (builder.timestamps.isEmpty()) {
      throw new IllegalArgumentException("A table needs at least one row.");
    }
    if (builder.columns.isEmpty()) {
      throw new IllegalArgumentException("A table needs at least one "
          + "value column.");
    }
    for (int i = 1; i < builder.timestamps.size(); i++) {
      if (!builder.timestamps.get(i).isAfter(builder.timestamps.get(i - 1))) {
        throw new IllegalArgumentException("Timestamps must be strictly "
            + "increasing but row " + i + " (" + builder.timestamps.get(i)
            + ") is not after row " + (i - 1));
      }
    }
    timestamps = ImmutableList.copyOf(builder.timestamps);
    columns = ImmutableList.copyOf(builder.columns.keySet());
    values = new double[columns.size()][];
    int i = 0;
    for (final double[] column : builder.columns.values()) {
      if (column.length != timestamps.size()) {
        throw new IllegalArgumentException("Column " + columns.get(i)
            + " has " + column.length + " values but the table has "
            + timestamps.size() + " rows");
      }
      values[i++] = Arrays.copyOf(column, column.length);
    }
  }

  /** @return The immutable row timestamps. */
  public ImmutableList<Instant> timestamps() {
    return timestamps;
  }

  /** @return The immutable column names. */
  public ImmutableList<String> columns() {
    return columns;
  }

  /** @return The number of rows. */
  public int rowCount() {
    return timestamps.size();
  }

  /** @return The number of value columns. */
  public int columnCount() {
    return columns.size();
  }

  /**
   * @param index A zero based column index.
   * @return A copy of the column values.
   */
  public double[] column(final int index) {
    return Arrays.copyOf(values[index], values[index].length);
  }

  /**
   * @param name The column name.
   * @return A copy of the column values.
   * @throws IllegalArgumentException if the column does not exist.
   */
  public double[] column(final String name) {
    final int index = columns.indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    return column(index);
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private final List<Instant> timestamps = Lists.newArrayList();
    private final Map<String, double[]> columns = Maps.newLinkedHashMap();

    /**
     * @param timestamps The non-null row timestamps.
     * @return The builder.
     */
    public Builder setTimestamps(final List<Instant> timestamps) {
      if (timestamps == null) {
        throw new IllegalArgumentException("Timestamps cannot be null.");
      }
      this.timestamps.clear();
      this.timestamps.addAll(timestamps);
      return this;
    }

    /**
     * Appends a value column.
     * @param name A non-null and non-empty unique name.
     * @param values The non-null column values, one per row.
     * @return The builder.
     */
    public Builder addColumn(final String name, final double... values) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Column name cannot be null or "
            + "empty.");
      }
      if (values == null) {
        throw new IllegalArgumentException("Column values cannot be null.");
      }
      if (columns.containsKey(name)) {
        throw new IllegalArgumentException("Duplicate column: " + name);
      }
      columns.put(name, values);
      return this;
    }

    /** @return The table. */
    public TimeTable build() {
      return new TimeTable(this);
    }
  }
}
