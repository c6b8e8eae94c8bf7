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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.PayloadElement;
import net.forecastdb.data.PayloadType;
import net.forecastdb.data.PiecewiseLinearValue;
import net.forecastdb.data.PolynomialValue;
import net.forecastdb.data.Window;
import net.forecastdb.data.XYPoint;
import net.forecastdb.exceptions.IllegalDataFormatException;

public class TestPayloadConverter {
  static final Instant T0 = Instant.ofEpochSecond(1577836800L);
  static final Instant T1 = T0.plus(Duration.ofHours(1));

  private final PayloadConverter strict = new PayloadConverter(false);
  private final PayloadConverter lenient = new PayloadConverter(true);

  @Test
  public void ctor() throws Exception {
    assertFalse(strict.assumeConstant());
    assertTrue(lenient.assumeConstant());
  }

  @Test
  public void constants() throws Exception {
    final Map<Instant, List<?>> raw = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of(1, 2.5, 3L),
        T1, ImmutableList.of(4, 5, 6));
    assertEquals(PayloadType.CONSTANT, strict.classify(raw));
    final Map<Instant, Window<PayloadElement>> windows = strict.convert(raw);
    assertEquals(2, windows.size());
    assertEquals(ConstantValue.of(2.5), windows.get(T0).get(1));
    assertEquals(ConstantValue.of(6), windows.get(T1).get(2));
  }

  @Test
  public void polynomials() throws Exception {
    final Map<Instant, List<?>> raw = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of(new double[] { 1, 2 }, ImmutableList.of(3, 4)));
    assertEquals(PayloadType.POLYNOMIAL, strict.classify(raw));
    final Window<PayloadElement> window = strict.convert(raw).get(T0);
    assertEquals(PolynomialValue.linear(1, 2), window.get(0));
    assertEquals(PolynomialValue.linear(3, 4), window.get(1));

    final Map<Instant, List<?>> quadratic = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of(ImmutableList.of(1, 2, 3)));
    assertEquals(PolynomialValue.quadratic(1, 2, 3),
        strict.convert(quadratic).get(T0).get(0));
  }

  @Test
  public void polynomialsBadArity() throws Exception {
    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(new double[] { 1, 2, 3, 4 })));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void polynomialsMixedArity() throws Exception {
    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(new double[] { 1, 2 }),
          T1, ImmutableList.of(new double[] { 1, 2, 3 })));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void piecewiseLinear() throws Exception {
    final Map<Instant, List<?>> raw = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of(
            new double[][] { { 0, 1 }, { 10, 5 } },
            ImmutableList.of(new XYPoint(0, 2), new XYPoint(10, 6)),
            ImmutableList.of(ImmutableList.of(0, 3), new double[] { 10, 7 })));
    assertEquals(PayloadType.PIECEWISE_LINEAR, strict.classify(raw));
    final Window<PayloadElement> window = strict.convert(raw).get(T0);
    assertEquals(3, window.length());
    assertEquals(PiecewiseLinearValue.of(new XYPoint(0, 1),
        new XYPoint(10, 5)), window.get(0));
    assertEquals(PiecewiseLinearValue.of(new XYPoint(0, 2),
        new XYPoint(10, 6)), window.get(1));
    assertEquals(PiecewiseLinearValue.of(new XYPoint(0, 3),
        new XYPoint(10, 7)), window.get(2));
  }

  @Test
  public void piecewiseLinearBadPointArity() throws Exception {
    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(new double[][] { { 0, 1, 2 }, { 10, 5, 2 } })));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(ImmutableList.of(
              new double[] { 0 }, new double[] { 1 }))));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void typedElementsPassThrough() throws Exception {
    final PolynomialValue value = PolynomialValue.quadratic(1, 2, 3);
    final Map<Instant, List<?>> raw = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of(value, ImmutableList.of(4, 5, 6)));
    final Window<PayloadElement> window = strict.convert(raw).get(T0);
    assertTrue(window.get(0) == value);
    assertEquals(PolynomialValue.quadratic(4, 5, 6), window.get(1));
  }

  @Test
  public void mixedShapes() throws Exception {
    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(1, new double[] { 1, 2 })));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }

    try {
      lenient.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of(1, "2")));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void untypedStrict() throws Exception {
    try {
      strict.classify(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of("1", "2")));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }

    try {
      strict.convert(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of()));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void untypedAssumeConstant() throws Exception {
    final Map<Instant, List<?>> raw = ImmutableMap.<Instant, List<?>>of(
        T0, ImmutableList.of("1", " 2.5 "));
    assertEquals(PayloadType.CONSTANT, lenient.classify(raw));
    final Window<PayloadElement> window = lenient.convert(raw).get(T0);
    assertEquals(ConstantValue.of(1), window.get(0));
    assertEquals(ConstantValue.of(2.5), window.get(1));

    final Map<Instant, Window<PayloadElement>> empty = lenient.convert(
        ImmutableMap.<Instant, List<?>>of(T0, ImmutableList.of()));
    assertTrue(empty.get(T0).isEmpty());

    try {
      lenient.convert(ImmutableMap.<Instant, List<?>>of(
          T0, ImmutableList.of("one")));
      fail("Expected IllegalDataFormatException");
    } catch (IllegalDataFormatException e) { }
  }

  @Test
  public void nulls() throws Exception {
    try {
      strict.classify(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    final Map<Instant, List<?>> raw = Maps.newHashMap();
    raw.put(T0, null);
    try {
      strict.classify(raw);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    raw.put(T0, java.util.Arrays.asList(1, null));
    try {
      strict.classify(raw);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
