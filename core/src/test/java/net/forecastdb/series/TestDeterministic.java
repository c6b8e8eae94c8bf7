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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.UUID;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.PolynomialValue;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.IllegalDataFormatException;

public class TestDeterministic {
  // Wed, 01 Jan 2020 00:00:00 UTC
  static final Instant T0 = Instant.ofEpochSecond(1577836800L);
  static final Instant T1 = T0.plus(Duration.ofHours(1));
  static final Instant T2 = T0.plus(Duration.ofHours(2));
  static final Duration RESOLUTION = Duration.ofMinutes(15);

  @Test
  public void builder() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    assertEquals(SeriesType.DETERMINISTIC, series.seriesType());
    assertEquals("load", series.name());
    assertEquals(RESOLUTION, series.resolution());
    assertEquals(3, series.count());
    assertEquals(4, series.horizon());
    assertEquals(Duration.ofHours(1), series.interval());
    assertEquals(T0, series.initialTimestamp());
    assertEquals(Lists.newArrayList(T0, T1, T2), series.initialTimes());
    assertEquals(Duration.ofMinutes(120 + 45), series.totalPeriod());
    assertEquals(PayloadType.CONSTANT, series.payloadType());
    assertNull(series.scalingFactorMultiplier());
    assertTrue(series.uuid() != null);
  }

  @Test
  public void builderKeepsUuid() throws Exception {
    final UUID uuid = UUID.randomUUID();
    final Deterministic<ConstantValue> series =
        Deterministic.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(RESOLUTION)
        .setScalingFactorMultiplier("max_active_power")
        .setUuid(uuid)
        .setData(ImmutableMap.of(T0, Window.ofConstants(1, 2)))
        .build();
    assertEquals(uuid, series.uuid());
    assertEquals("max_active_power", series.scalingFactorMultiplier());
    assertEquals(Duration.ZERO, series.interval());
    assertEquals(Lists.newArrayList(T0), series.initialTimes());
    assertEquals(RESOLUTION, series.totalPeriod());
  }

  @Test
  public void builderSortsWindows() throws Exception {
    final Map<Instant, Window<ConstantValue>> data = Maps.newLinkedHashMap();
    data.put(T2, Window.ofConstants(3));
    data.put(T0, Window.ofConstants(1));
    data.put(T1, Window.ofConstants(2));
    final Deterministic<ConstantValue> series = build(data);
    assertEquals(T0, series.initialTimestamp());
    assertEquals(Lists.newArrayList(T0, T1, T2),
        Lists.newArrayList(series.windows().keySet()));
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      Deterministic.<ConstantValue>newBuilder()
          .setResolution(RESOLUTION)
          .setData(ImmutableMap.of(T0, Window.ofConstants(1)))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.<ConstantValue>newBuilder()
          .setName("load")
          .setData(ImmutableMap.of(T0, Window.ofConstants(1)))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(Duration.ZERO)
          .setData(ImmutableMap.of(T0, Window.ofConstants(1)))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      build(ImmutableMap.<Instant, Window<ConstantValue>>of());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final Map<Instant, Window<ConstantValue>> data = Maps.newHashMap();
    data.put(T0, null);
    try {
      build(data);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void builderLengthMismatch() throws Exception {
    try {
      build(ImmutableMap.of(
          T0, Window.ofConstants(1, 2, 3),
          T1, Window.ofConstants(1, 2)));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void builderShapeMismatch() throws Exception {
    try {
      build(ImmutableMap.of(
          T0, Window.of(Lists.newArrayList(PolynomialValue.linear(1, 2))),
          T1, Window.of(Lists.newArrayList(
              PolynomialValue.quadratic(1, 2, 3)))));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void builderUnevenInterval() throws Exception {
    try {
      build(ImmutableMap.of(
          T0, Window.ofConstants(1),
          T1, Window.ofConstants(2),
          T0.plus(Duration.ofHours(3)), Window.ofConstants(3)));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void builderEmptyWindows() throws Exception {
    final Deterministic<ConstantValue> series = build(ImmutableMap.of(
        T0, Window.ofConstants(),
        T1, Window.ofConstants()));
    assertEquals(0, series.horizon());
    assertNull(series.payloadType());
    assertEquals(Duration.ofHours(1), series.totalPeriod());
  }

  @Test
  public void getWindow() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    assertEquals(Window.ofConstants(5, 6, 7, 8), series.getWindow(T1));

    try {
      series.getWindow(T0.plus(Duration.ofMinutes(30)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      series.getWindow(T0.minus(Duration.ofHours(1)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      series.getWindow(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void getWindowTruncated() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    assertEquals(Window.ofConstants(5, 6), series.getWindow(T1, 2));
    assertSame(series.getWindow(T1), series.getWindow(T1, 4));
    assertSame(series.getWindow(T1), series.getWindow(T1, 10));
    assertTrue(series.getWindow(T1, 0).isEmpty());

    try {
      series.getWindow(T1, -1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void iterateWindows() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    final Iterable<Entry<Instant, Window<ConstantValue>>> iterable =
        series.iterateWindows();

    final List<Instant> first = Lists.newArrayList();
    for (final Entry<Instant, Window<ConstantValue>> entry : iterable) {
      first.add(entry.getKey());
      assertEquals(4, entry.getValue().length());
    }
    assertEquals(Lists.newArrayList(T0, T1, T2), first);

    // restartable
    final Iterator<Entry<Instant, Window<ConstantValue>>> iterator =
        iterable.iterator();
    assertEquals(T0, iterator.next().getKey());
    assertEquals(Window.ofConstants(5, 6, 7, 8), iterator.next().getValue());
    assertEquals(T2, iterator.next().getKey());
    assertFalse(iterator.hasNext());
    assertEquals(T0, iterable.iterator().next().getKey());
  }

  @Test
  public void toTrajectory() throws Exception {
    final Deterministic<ConstantValue> series = build(ImmutableMap.of(
        T0, Window.ofConstants(1, 2, 3)));
    final SortedMap<Instant, ConstantValue> trajectory = series.toTrajectory();
    assertEquals(3, trajectory.size());
    assertEquals(1, trajectory.get(T0).value(), 0.0001);
    assertEquals(3, trajectory.get(T0.plus(RESOLUTION.multipliedBy(2)))
        .value(), 0.0001);

    try {
      constantSeries().toTrajectory();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void withData() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    final Deterministic<ConstantValue> copy = series.withData(ImmutableMap.of(
        T0, Window.ofConstants(9, 9)));
    assertEquals(series.name(), copy.name());
    assertEquals(series.resolution(), copy.resolution());
    assertNotEquals(series.uuid(), copy.uuid());
    assertEquals(1, copy.count());
    assertEquals(2, copy.horizon());
    // the source is untouched
    assertEquals(3, series.count());
  }

  @Test
  public void fromSingleTimeSeries() throws Exception {
    final SingleTimeSeries<ConstantValue> single =
        SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(Duration.ofHours(1))
        .setScalingFactorMultiplier("max_active_power")
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(0, 1, 2, 3, 4, 5, 6, 7, 8, 9))
        .build();

    final Deterministic<ConstantValue> series =
        Deterministic.fromSingleTimeSeries(single, 4, Duration.ofHours(2));
    assertEquals("load", series.name());
    assertEquals(Duration.ofHours(1), series.resolution());
    assertEquals("max_active_power", series.scalingFactorMultiplier());
    assertEquals(4, series.count());
    assertEquals(4, series.horizon());
    assertEquals(Duration.ofHours(2), series.interval());
    assertEquals(Window.ofConstants(0, 1, 2, 3), series.getWindow(T0));
    assertEquals(Window.ofConstants(2, 3, 4, 5), series.getWindow(T2));
    assertEquals(Window.ofConstants(6, 7, 8, 9),
        series.getWindow(T0.plus(Duration.ofHours(6))));

    final Deterministic<ConstantValue> whole =
        Deterministic.fromSingleTimeSeries(single, 10, Duration.ofHours(1));
    assertEquals(1, whole.count());
    assertEquals(single.window(), whole.getWindow(T0));
  }

  @Test
  public void fromSingleTimeSeriesErrors() throws Exception {
    final SingleTimeSeries<ConstantValue> single =
        SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(Duration.ofHours(1))
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(0, 1, 2, 3))
        .build();

    try {
      Deterministic.fromSingleTimeSeries(single, 5, Duration.ofHours(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.fromSingleTimeSeries(single, 0, Duration.ofHours(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.fromSingleTimeSeries(single, 2, Duration.ofMinutes(90));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.fromSingleTimeSeries(single, 2, Duration.ZERO);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Deterministic.<ConstantValue>fromSingleTimeSeries(null, 2,
          Duration.ofHours(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void metadata() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    final TimeSeriesMetadata metadata = series.metadata(
        ImmutableMap.of("zone", "north"));
    assertEquals(SeriesType.DETERMINISTIC, metadata.getType());
    assertEquals("load", metadata.getName());
    assertEquals("15m", metadata.getResolution());
    assertEquals("1h", metadata.getInterval());
    assertEquals(T0.toEpochMilli(), metadata.getInitialTimestamp());
    assertEquals(3, metadata.getCount());
    assertEquals(4, metadata.getHorizon());
    assertEquals(series.uuid().toString(), metadata.getTimeSeriesUuid());
    assertEquals("north", metadata.getFeatures().get("zone"));
    assertNull(metadata.getPercentiles());
    assertNull(metadata.getScenarioCount());
  }

  @Test
  public void fromMetadata() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    final TimeSeriesMetadata metadata = series.metadata(null);
    final Deterministic<ConstantValue> rebuilt =
        Deterministic.fromMetadata(metadata, series.windows());
    assertEquals(series.uuid(), rebuilt.uuid());
    assertEquals(series.name(), rebuilt.name());
    assertEquals(series.resolution(), rebuilt.resolution());
    assertEquals(series.windows(), rebuilt.windows());
    assertEquals(metadata, rebuilt.metadata(null));
  }

  @Test
  public void fromMetadataMismatch() throws Exception {
    final Deterministic<ConstantValue> series = constantSeries();
    final TimeSeriesMetadata metadata = series.metadata(null);

    try {
      Deterministic.fromMetadata(metadata, ImmutableMap.of(
          T0, Window.ofConstants(1, 2, 3, 4)));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }

    try {
      Deterministic.fromMetadata(metadata, ImmutableMap.of(
          T0, Window.ofConstants(1, 2),
          T1, Window.ofConstants(1, 2),
          T2, Window.ofConstants(1, 2)));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }

    final TimeSeriesMetadata single = SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(RESOLUTION)
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(1, 2, 3, 4))
        .build()
        .metadata(null);
    try {
      Deterministic.fromMetadata(single, ImmutableMap.of(
          T0, Window.ofConstants(1, 2, 3, 4)));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }

    final TimeSeriesMetadata two_hourly = TimeSeriesMetadata.newBuilder()
        .setType(SeriesType.DETERMINISTIC)
        .setName("load")
        .setResolution("15m")
        .setInitialTimestamp(T0.toEpochMilli())
        .setInterval("2h")
        .setCount(3)
        .setHorizon(4)
        .setTimeSeriesUuid(series.uuid().toString())
        .build();
    try {
      Deterministic.fromMetadata(two_hourly, series.windows());
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void builderSubMillisecondResolution() throws Exception {
    try {
      Deterministic.<ConstantValue>newBuilder()
          .setName("load")
          .setResolution(Duration.ofNanos(500000))
          .setData(ImmutableMap.of(T0, Window.ofConstants(1, 2)))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void metadataSecondResolution() throws Exception {
    final Deterministic<ConstantValue> series =
        Deterministic.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(Duration.ofSeconds(1))
        .setData(ImmutableMap.of(
            T0, Window.ofConstants(1, 2),
            T0.plusSeconds(1), Window.ofConstants(3, 4)))
        .build();
    final TimeSeriesMetadata metadata = series.metadata(null);
    assertEquals("1s", metadata.getResolution());
    assertEquals("1s", metadata.getInterval());

    final Deterministic<ConstantValue> rebuilt =
        Deterministic.fromMetadata(metadata, series.windows());
    assertEquals(Duration.ofSeconds(1), rebuilt.resolution());
    assertEquals(series.windows(), rebuilt.windows());
  }

  @Test
  public void fromSingleTimeSeriesIntervalPastEnd() throws Exception {
    final SingleTimeSeries<ConstantValue> single =
        SingleTimeSeries.<ConstantValue>newBuilder()
        .setName("load")
        .setResolution(Duration.ofSeconds(1))
        .setInitialTimestamp(T0)
        .setWindow(Window.ofConstants(0, 1, 2, 3))
        .build();

    final Deterministic<ConstantValue> series =
        Deterministic.fromSingleTimeSeries(single, 2,
            Duration.ofSeconds(4294967296L));
    assertEquals(1, series.count());
    assertEquals(2, series.horizon());
    assertEquals(Duration.ZERO, series.interval());
    assertEquals(Window.ofConstants(0, 1), series.getWindow(T0));
  }

  /** @return 3 hourly windows of 4 15 minute steps. */
  static Deterministic<ConstantValue> constantSeries() {
    return build(ImmutableSortedMap.of(
        T0, Window.ofConstants(1, 2, 3, 4),
        T1, Window.ofConstants(5, 6, 7, 8),
        T2, Window.ofConstants(9, 10, 11, 12)));
  }

  static <T extends PayloadElement> Deterministic<T> build(
      final Map<Instant, Window<T>> data) {
    return Deterministic.<T>newBuilder()
        .setName("load")
        .setResolution(RESOLUTION)
        .setData(data)
        .build();
  }
}
