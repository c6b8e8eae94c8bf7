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
package net.forecastdb.exceptions;

/**
 * Thrown when user supplied data violates a structural invariant that cannot
 * be reconciled, e.g. a non-uniform resolution or a payload whose shape
 * changes from one timestep to the next.
 * @since 1.0
 */
public final class IllegalDataFormatException extends RuntimeException {

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   */
  public IllegalDataFormatException(final String msg) {
    super(msg);
  }

  /**
   * Constructor.
   *
   * @param msg Message describing the problem.
   * @param cause The source exception.
   */
  public IllegalDataFormatException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  static final long serialVersionUID = 1781365290;

}
