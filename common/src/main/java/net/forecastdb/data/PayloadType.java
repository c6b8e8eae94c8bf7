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

/**
 * The closed set of values a single timestep of a series can hold.
 *
 * @since 1.0
 */
public enum PayloadType {
  /** A single double, see {@link ConstantValue}. */
  CONSTANT,

  /** A linear or quadratic coefficient tuple, see {@link PolynomialValue}. */
  POLYNOMIAL,

  /** A breakpoint curve of (x, y) points, see {@link PiecewiseLinearValue}. */
  PIECEWISE_LINEAR,

  /** A step curve, see {@link PiecewiseStepValue}. */
  PIECEWISE_STEP
}
