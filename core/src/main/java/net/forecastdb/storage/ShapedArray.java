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
package net.forecastdb.storage;

import java.nio.DoubleBuffer;
import java.util.Arrays;

/**
 * A dense array of 64 bit floats with a shape, stored in row-major order:
 * the last dimension varies fastest.
 *
 * @since 1.0
 */
public final class ShapedArray {

  /** The size of each dimension. */
  private final int[] shape;

  /** The values in row-major order. */
  private final double[] data;

  /**
   * Ctor that takes ownership of the arrays.
   * @param shape A non-null, non-empty array of non-negative dimensions.
   * @param data The values, exactly the product of the dimensions long.
   * @throws IllegalArgumentException if the shape was invalid or did not
   * match the data length.
   */
  ShapedArray(final int[] shape, final double[] data) {
    if (shape == null || shape.length < 1) {
      throw new IllegalArgumentException("Shape cannot be null or empty.");
    }
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    long size = 1;
    for (final int dimension : shape) {
      if (dimension < 0) {
        throw new IllegalArgumentException("Negative dimension in shape "
            + Arrays.toString(shape));
      }
      size *= dimension;
    }
    if (size != data.length) {
      throw new IllegalArgumentException("Shape " + Arrays.toString(shape)
          + " needs " + size + " values but got " + data.length);
    }
    this.shape = shape;
    this.data = data;
  }

  /** @return The number of dimensions. */
  public int rank() {
    return shape.length;
  }

  /** @return A copy of the dimensions. */
  public int[] shape() {
    return Arrays.copyOf(shape, shape.length);
  }

  /** @return The total number of values. */
  public int size() {
    return data.length;
  }

  /**
   * @param indices One index per dimension.
   * @return The value at the indices.
   * @throws IndexOutOfBoundsException if the indices did not match the
   * shape.
   */
  public double get(final int... indices) {
    if (indices.length != shape.length) {
      throw new IndexOutOfBoundsException("Expected " + shape.length
          + " indices but got " + indices.length);
    }
    int offset = 0;
    for (int i = 0; i < shape.length; i++) {
      if (indices[i] < 0 || indices[i] >= shape[i]) {
        throw new IndexOutOfBoundsException("Index " + indices[i]
            + " out of bounds for dimension " + i + " of size " + shape[i]);
      }
      offset = offset * shape[i] + indices[i];
    }
    return data[offset];
  }

  /** @return A read-only view of the values in row-major order. */
  public DoubleBuffer asDoubleBuffer() {
    return DoubleBuffer.wrap(data).asReadOnlyBuffer();
  }

  /** @return A copy of the values in row-major order. */
  public double[] toArray() {
    return Arrays.copyOf(data, data.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof ShapedArray)) {
      return false;
    }
    final ShapedArray other = (ShapedArray) o;
    return Arrays.equals(shape, other.shape) &&
        Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("shape=")
        .append(Arrays.toString(shape))
        .append(", data=")
        .append(Arrays.toString(data))
        .toString();
  }
}
