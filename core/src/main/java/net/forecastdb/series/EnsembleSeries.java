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

import java.time.Instant;
import java.util.Map.Entry;

import net.forecastdb.data.ConstantValue;
import net.forecastdb.data.EnsembleWindow;
import net.forecastdb.data.Window;
import net.forecastdb.exceptions.IllegalDataFormatException;

/**
 * Base for series whose windows carry several trajectories side by side,
 * one per member of the ensemble.
 *
 * @since 1.0
 */
public abstract class EnsembleSeries extends AbstractTimeSeries<EnsembleWindow> {

  /**
   * Protected ctor for the builder.
   * @param builder A non-null builder.
   * @param width The number of members every window must hold.
   * @throws IllegalDataFormatException if a window had a different number
   * of members.
   */
  protected EnsembleSeries(final Builder<EnsembleWindow, ?> builder,
                           final int width) {
    super(builder);
    for (final Entry<Instant, EnsembleWindow> entry : data.entrySet()) {
      if (entry.getValue().width() != width) {
        throw new IllegalDataFormatException("Window at " + entry.getKey()
            + " has " + entry.getValue().width() + " members but " + width
            + " are expected for series " + name);
      }
    }
  }

  /** @return The number of members per window. */
  public int width() {
    return data.firstEntry().getValue().width();
  }

  /**
   * Extracts one member's trajectory from a window.
   * @param start A window start, must be one of the store's keys.
   * @param member A zero based member index.
   * @return The trajectory.
   * @throws IllegalArgumentException if no window starts at the timestamp.
   */
  public Window<ConstantValue> getMember(final Instant start,
                                         final int member) {
    return getWindow(start).trajectory(member);
  }

  @Override
  protected int windowLength(final EnsembleWindow window) {
    return window.horizon();
  }

  @Override
  protected boolean sameShape(final EnsembleWindow first,
                              final EnsembleWindow other) {
    return first.width() == other.width();
  }

  @Override
  protected EnsembleWindow truncate(final EnsembleWindow window,
                                    final int length) {
    return window.truncate(length);
  }
}
