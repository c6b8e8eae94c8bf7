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
 * The value stored at one timestep of a forecast window. Implementations are
 * immutable and dispatched on via {@link #type()}.
 * <p>
 * Within one series every element must share the same type and, where the
 * type has a fixed size, the same size. See {@link #sameShape(PayloadElement)}.
 *
 * @since 1.0
 */
public interface PayloadElement {

  /** @return The non-null type of this element. */
  public PayloadType type();

  /**
   * Determines whether the given element may live in the same series as this
   * element. Piecewise curves only need to match in type here as their point
   * counts are validated when shaping for storage.
   * @param other A possibly null element.
   * @return True if the elements are compatible, false if not.
   */
  public boolean sameShape(final PayloadElement other);

  /**
   * Returns a copy of this element with the value components divided by the
   * given divisor. For curves only the y components are divided.
   * @param divisor A non-zero divisor.
   * @return A new element, or this element if the divisor was 1.
   */
  public PayloadElement dividedBy(final double divisor);

}
