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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.PolynomialValue;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.FeatureNotImplementedException;

public class TestNormalizationFactor {

  @Test
  public void of() throws Exception {
    final NormalizationFactor factor = NormalizationFactor.of(2);
    assertEquals(2, factor.factor(), 0.0001);
    assertFalse(factor.isMax());
    assertSame(NormalizationFactor.NONE, NormalizationFactor.of(1));
    assertTrue(NormalizationFactor.MAX.isMax());
    assertEquals("MAX", NormalizationFactor.MAX.toString());

    try {
      NormalizationFactor.of(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      NormalizationFactor.of(Double.NaN);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      NormalizationFactor.of(Double.POSITIVE_INFINITY);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void divisorForScalar() throws Exception {
    final List<Window<PolynomialValue>> windows =
        ImmutableList.<Window<PolynomialValue>>of(
            Window.of(Lists.newArrayList(PolynomialValue.linear(1, 2))));
    assertEquals(4, NormalizationFactor.of(4).divisorFor(windows), 0.0001);
    assertEquals(1, NormalizationFactor.NONE.divisorFor(windows), 0.0001);
  }

  @Test
  public void divisorForMax() throws Exception {
    final List<Window<ConstantValue>> windows = Lists.<Window<ConstantValue>>newArrayList(
        Window.ofConstants(1, 2),
        Window.ofConstants(-8, 4));
    assertEquals(4, NormalizationFactor.MAX.divisorFor(windows), 0.0001);

    try {
      NormalizationFactor.MAX.divisorFor(
          ImmutableList.<Window<ConstantValue>>of(Window.ofConstants(0, 0)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void divisorForMaxNotConstant() throws Exception {
    final List<Window<PolynomialValue>> windows =
        ImmutableList.<Window<PolynomialValue>>of(
            Window.of(Lists.newArrayList(PolynomialValue.linear(1, 2))));
    try {
      NormalizationFactor.MAX.divisorFor(windows);
      fail("Expected FeatureNotImplementedException");
    } catch (FeatureNotImplementedException e) {
      assertEquals("POLYNOMIAL", e.getData());
    }
  }

  @Test
  public void divisorForEnsembles() throws Exception {
    final List<EnsembleWindow> windows = Lists.newArrayList(
        EnsembleWindow.of(new double[][] { { 1, 5 } }),
        EnsembleWindow.of(new double[][] { { 3, 2 } }));
    assertEquals(5, NormalizationFactor.MAX.divisorForEnsembles(windows),
        0.0001);
    assertEquals(2, NormalizationFactor.of(2).divisorForEnsembles(windows),
        0.0001);
  }
}
