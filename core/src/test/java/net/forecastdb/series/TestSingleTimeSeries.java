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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.util.SortedMap;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.IllegalDataFormatException;

public class TestSingleTimeSeries {
  static final Instant T0 = Instant.ofEpochSecond(1577836800L);
  static final Duration RESOLUTION = Duration.ofHours(1);

  @Test
  public void builder() throws Exception {
    final SingleTimeSeries<ConstantValue> series = series();
    assertEquals(SeriesType.SINGLE_TIME_SERIES, series.seriesType());
    assertEquals(1, series.count());
    assertEquals(6, series.length());
    assertEquals(6, series.horizon());
    assertEquals(Duration.ZERO, series.interval());
    assertEquals(T0, series.initialTimestamp());
    assertEquals(Duration.ofHours(5), series.totalPeriod());
    assertEquals(PayloadType.CONSTANT, series.payloadType());
    assertEquals(Window.ofConstants(0, 1, 2, 3, 4, 5), series.window());
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      SingleTimeSeries.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(RESOLUTION)
          .setWindow(Window.ofConstants(1))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SingleTimeSeries.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(RESOLUTION)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      SingleTimeSeries.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(RESOLUTION)
          .setData(ImmutableMap.of(
              T0, Window.ofConstants(1),
              T0.plus(RESOLUTION), Window.ofConstants(2)))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void trajectory() throws Exception {
    final SortedMap<Instant, ConstantValue> trajectory = series().trajectory();
    assertEquals(6, trajectory.size());
    assertEquals(T0, trajectory.firstKey());
    assertEquals(T0.plus(Duration.ofHours(5)), trajectory.lastKey());
    assertEquals(5, trajectory.get(trajectory.lastKey()).value(), 0.0001);
  }

  @Test
  public void getWindow() throws Exception {
    final SingleTimeSeries<ConstantValue> series = series();
    assertEquals(Window.ofConstants(0, 1), series.getWindow(T0, 2));
    try {
      series.getWindow(T0.plus(RESOLUTION));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void slice() throws Exception {
    final SingleTimeSeries<ConstantValue> series = series();
    final SingleTimeSeries<ConstantValue> slice =
        series.slice(T0.plus(Duration.ofHours(2)), 3);
    assertEquals(T0.plus(Duration.ofHours(2)), slice.initialTimestamp());
    assertEquals(Window.ofConstants(2, 3, 4), slice.window());
    assertEquals(series.name(), slice.name());
    assertNotEquals(series.uuid(), slice.uuid());

    try {
      series.slice(T0.plus(Duration.ofHours(4)), 3);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      series.slice(T0.plus(Duration.ofMinutes(30)), 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      series.slice(T0.minus(RESOLUTION), 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void sliceFarPastEnd() throws Exception {
    final SingleTimeSeries<ConstantValue> series =
        SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(Duration.ofSeconds(1))
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(0, 1, 2, 3))
        .build();

    try {
      series.slice(T0.plusSeconds(4294967297L), 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      series.slice(T0.plusSeconds(4), 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    assertEquals(Window.ofConstants(3),
        series.slice(T0.plusSeconds(3), 1).window());
  }

  @Test
  public void builderSubMillisecondResolution() throws Exception {
    try {
      SingleTimeSeries.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(Duration.ofNanos(500000))
          .setInitialTimestamp(T0)
          .setWindow(Window.ofConstants(0, 1))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void withData() throws Exception {
    final SingleTimeSeries<ConstantValue> series = series();
    final Instant start = T0.plus(Duration.ofDays(1));
    final SingleTimeSeries<ConstantValue> copy =
        series.withData(start, Window.ofConstants(7, 8));
    assertEquals(start, copy.initialTimestamp());
    assertEquals(2, copy.length());
    assertEquals(series.resolution(), copy.resolution());
    assertNotEquals(series.uuid(), copy.uuid());
  }

  @Test
  public void metadataRoundTrip() throws Exception {
    final SingleTimeSeries<ConstantValue> series = series();
    final TimeSeriesMetadata metadata = series.metadata(null);
    assertEquals(SeriesType.SINGLE_TIME_SERIES, metadata.getType());
    assertEquals("1h", metadata.getResolution());
    assertEquals("0s", metadata.getInterval());
    assertEquals(1, metadata.getCount());
    assertEquals(6, metadata.getHorizon());
    assertNull(metadata.getScalingFactorMultiplier());

    final SingleTimeSeries<ConstantValue> rebuilt =
        SingleTimeSeries.fromMetadata(metadata, series.window());
    assertEquals(series.uuid(), rebuilt.uuid());
    assertEquals(series.window(), rebuilt.window());

    try {
      SingleTimeSeries.fromMetadata(metadata, Window.ofConstants(1, 2));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  static SingleTimeSeries<ConstantValue> series() {
    return SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(RESOLUTION)
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(0, 1, 2, 3, 4, 5))
        .build();
  }
}
