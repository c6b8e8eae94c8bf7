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
package net.forecastdb.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import net.forecastdb.exceptions.IllegalDataFormatException;

/**
 * Utility class that provides helpers for dealing with timestamps, durations
 * and the timing of forecast windows.
 * @since 1.0
 */
public class DateTime {

  /** Units tried, largest first, when expressing a resolution. */
  private static final ChronoUnit[] RESOLUTION_UNITS = new ChronoUnit[] {
      ChronoUnit.DAYS, ChronoUnit.HOURS, ChronoUnit.MINUTES, ChronoUnit.SECONDS
  };

  /**
   * Attempts to parse a timestamp from a given string. Formats accepted are:
   * <ul>
   * <li>ISO-8601 instants: {@code 2020-01-01T00:00:00Z}</li>
   * <li>ISO-8601 local date times, assumed to be UTC:
   * {@code 2020-01-01T00:00:00} or {@code 2020-01-01 00:00:00}</li>
   * <li>Unix Timestamp in seconds or milliseconds:
   * <ul><li>1355961600</li>
   * <li>1355961600000</li>
   * <li>1355961600.000</li></ul></li>
   * </ul>
   * @param datetime The string to parse.
   * @return A non-null instant.
   * @throws IllegalArgumentException if the string was null, empty or
   * malformed.
   */
  public static Instant parseTimestamp(final String datetime) {
    if (Strings.isNullOrEmpty(datetime)) {
      throw new IllegalArgumentException("Timestamp cannot be null or empty.");
    }
    final String trimmed = datetime.trim();

    if (trimmed.contains("-") || trimmed.contains(":")) {
      try {
        if (trimmed.endsWith("Z") || trimmed.endsWith("z")) {
          return Instant.parse(trimmed.toUpperCase());
        }
        return LocalDateTime.parse(trimmed.replace(' ', 'T'))
            .toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid date: " + datetime
            + ". " + e.getMessage(), e);
      }
    }

    try {
      long time;
      if (trimmed.contains(".")) {
        // [0-9]{10} seconds, a dot, then up to three digits of milliseconds
        if (!trimmed.matches("^[0-9]{10}\\.[0-9]{1,3}$")) {
          throw new IllegalArgumentException("Invalid time: " + datetime
              + ". Millisecond timestamps must be in the format "
              + "<seconds>.<ms> where the milliseconds are limited to 3 digits");
        }
        final String[] parts = trimmed.split("\\.");
        time = Long.parseLong(parts[0]) * 1000 +
            Long.parseLong(Strings.padEnd(parts[1], 3, '0'));
        return Instant.ofEpochMilli(time);
      }
      time = Long.parseLong(trimmed);
      if (time < 0) {
        throw new IllegalArgumentException("Invalid time: " + datetime
            + ". Negative timestamps are not supported.");
      }
      // ten digits or fewer are seconds, this holds until November 2286
      if (trimmed.length() <= 10) {
        time *= 1000;
      }
      return Instant.ofEpochMilli(time);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid time: " + datetime
          + ". " + e.getMessage(), e);
    }
  }

  /**
   * Parses a human-readable duration (e.g, "15m", "1h", "1d") into a
   * {@link Duration}.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days (24 hours)</li>
   * <li>{@code w}: weeks (7 days)</li></ul>
   * A zero amount is accepted to describe the interval of a series with a
   * single window.
   * @param duration The human-readable duration to parse.
   * @return A non-null, non-negative duration.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  public static Duration parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    if (unit == 0) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration, e);
    }
    final ChronoUnit units = unitsToChronoUnit(duration.substring(unit));
    if (units == ChronoUnit.WEEKS) {
      // only DAYS of the estimated units is accepted by Duration.of()
      return Duration.ofDays(interval * 7);
    }
    return Duration.of(interval, units);
  }

  /**
   * Converts the given units to a {@link ChronoUnit}.
   * @param units The units as a string, one of ms, s, m, h, d or w.
   * @return A non-null unit.
   * @throws IllegalArgumentException if the units were not recognized.
   */
  public static ChronoUnit unitsToChronoUnit(final String units) {
    if (Strings.isNullOrEmpty(units)) {
      throw new IllegalArgumentException("Units cannot be null or empty");
    }

    final String lc = units.toLowerCase();
    if (lc.equals("ms")) {
      return ChronoUnit.MILLIS;
    } else if (lc.equals("s")) {
      return ChronoUnit.SECONDS;
    } else if (lc.equals("m")) {
      return ChronoUnit.MINUTES;
    } else if (lc.equals("h")) {
      return ChronoUnit.HOURS;
    } else if (lc.equals("d")) {
      return ChronoUnit.DAYS;
    } else if (lc.equals("w")) {
      return ChronoUnit.WEEKS;
    }
    throw new IllegalArgumentException("Unrecognized unit type: " + units);
  }

  /**
   * Returns the largest of days, hours, minutes and seconds that evenly
   * divides the duration, falling back to milliseconds for sub-second
   * durations. A zero duration is reported in seconds.
   * @param duration A non-null, non-negative duration of whole milliseconds.
   * @return The unit.
   * @throws IllegalArgumentException if the duration was null, negative or
   * had a sub-millisecond remainder.
   */
  public static ChronoUnit largestWholeUnit(final Duration duration) {
    if (duration == null) {
      throw new IllegalArgumentException("Duration cannot be null.");
    }
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Duration cannot be negative: "
          + duration);
    }
    if (!isWholeMillis(duration)) {
      throw new IllegalArgumentException("Duration must be a whole number "
          + "of milliseconds: " + duration);
    }
    if (duration.isZero()) {
      return ChronoUnit.SECONDS;
    }
    final long ms = duration.toMillis();
    for (final ChronoUnit unit : RESOLUTION_UNITS) {
      if (ms % unit.getDuration().toMillis() == 0) {
        return unit;
      }
    }
    return ChronoUnit.MILLIS;
  }

  /**
   * @param duration A non-null duration.
   * @return Whether or not the duration has no sub-millisecond remainder.
   */
  public static boolean isWholeMillis(final Duration duration) {
    return duration.getNano() % 1_000_000 == 0;
  }

  /**
   * Formats the duration in its largest whole unit, e.g. 24 hours becomes
   * "1d" and 90 minutes becomes "90m". The result can be parsed with
   * {@link #parseDuration(String)}.
   * @param duration A non-null, non-negative duration.
   * @return The formatted duration.
   */
  public static String durationToString(final Duration duration) {
    final ChronoUnit unit = largestWholeUnit(duration);
    final long amount = duration.toMillis() / unit.getDuration().toMillis();
    switch (unit) {
    case DAYS:
      return amount + "d";
    case HOURS:
      return amount + "h";
    case MINUTES:
      return amount + "m";
    case SECONDS:
      return amount + "s";
    default:
      return amount + "ms";
    }
  }

  /**
   * Infers the sampling resolution of the timestamps. Every consecutive
   * difference must be the same and must be a whole number of seconds.
   * @param timestamps A non-null list of two or more ordered timestamps.
   * @return The resolution, see {@link #largestWholeUnit(Duration)} for
   * the unit it is best expressed in.
   * @throws IllegalArgumentException if fewer than two timestamps were given.
   * @throws IllegalDataFormatException if the differences were not uniform
   * or could not be expressed in whole seconds.
   */
  public static Duration resolutionOf(final List<Instant> timestamps) {
    if (timestamps == null || timestamps.size() < 2) {
      throw new IllegalArgumentException("At least two timestamps are "
          + "required to infer a resolution.");
    }
    final Set<Duration> differences = Sets.newLinkedHashSet();
    for (int i = 1; i < timestamps.size(); i++) {
      differences.add(Duration.between(timestamps.get(i - 1),
          timestamps.get(i)));
    }

    final Set<Duration> resolutions = Sets.newLinkedHashSet();
    for (final Duration difference : differences) {
      if (difference.isNegative() || difference.isZero() ||
          largestWholeUnit(difference) == ChronoUnit.MILLIS ||
          difference.getNano() % 1_000_000 != 0) {
        throw new IllegalDataFormatException("Cannot understand the "
            + "resolution of the time series: " + difference);
      }
      resolutions.add(difference);
    }

    if (resolutions.size() > 1) {
      throw new IllegalDataFormatException("Time series has non-uniform "
          + "resolution " + resolutions + ": this is currently not supported");
    }
    return resolutions.iterator().next();
  }

  /**
   * Computes the start timestamps of a run of forecast windows.
   * @param initial_timestamp The non-null start of the first window.
   * @param count The number of windows, zero or more.
   * @param interval The non-null spacing between window starts.
   * @return An empty list if count is zero, only the initial timestamp if
   * the interval is zero, otherwise {@code count} timestamps spaced by the
   * interval.
   * @throws IllegalArgumentException if the count was negative.
   */
  public static ImmutableList<Instant> initialTimes(
      final Instant initial_timestamp,
      final int count,
      final Duration interval) {
    if (count < 0) {
      throw new IllegalArgumentException("Count cannot be negative: " + count);
    }
    if (count == 0) {
      return ImmutableList.of();
    }
    if (interval.isZero()) {
      return ImmutableList.of(initial_timestamp);
    }
    final ImmutableList.Builder<Instant> builder = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      builder.add(initial_timestamp.plus(interval.multipliedBy(i)));
    }
    return builder.build();
  }

  /**
   * Computes the span from the start of the first window to the last
   * timestep of the last window.
   * @param initial_timestamp The start of the first window.
   * @param count The number of windows, one or more.
   * @param interval The spacing between window starts.
   * @param horizon The number of timesteps per window, one or more.
   * @param resolution The spacing of timesteps within a window.
   * @return The total period.
   */
  public static Duration totalPeriod(final Instant initial_timestamp,
                                     final int count,
                                     final Duration interval,
                                     final int horizon,
                                     final Duration resolution) {
    if (count < 1 || horizon < 1) {
      throw new IllegalArgumentException("Count and horizon must be at "
          + "least 1: count=" + count + ", horizon=" + horizon);
    }
    final Instant last_initial_time =
        initial_timestamp.plus(interval.multipliedBy(count - 1));
    final Instant last_timestamp =
        last_initial_time.plus(resolution.multipliedBy(horizon - 1));
    return Duration.between(initial_timestamp, last_timestamp);
  }
}
