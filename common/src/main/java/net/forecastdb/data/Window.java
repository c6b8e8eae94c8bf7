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

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.forecastdb.exceptions.IllegalDataFormatException;

/**
 * One forecast trajectory: an immutable, ordered list of payload elements,
 * one per timestep. Every element has the same shape, checked at
 * construction.
 *
 * @param <T> The type of payload element.
 * @since 1.0
 */
public final class Window<T extends PayloadElement> implements Iterable<T> {

  /** The elements in timestep order. */
  private final ImmutableList<T> elements;

  /**
   * Ctor.
   * @param elements The validated elements.
   */
  private Window(final ImmutableList<T> elements) {
    this.elements = elements;
  }

  /**
   * Creates a window from the given elements.
   * @param elements A non-null list of non-null elements.
   * @return A new window.
   * @throws IllegalArgumentException if the list or an element was null.
   * @throws IllegalDataFormatException if the elements differed in shape.
   */
  public static <T extends PayloadElement> Window<T> of(
      final List<? extends T> elements) {
    if (elements == null) {
      throw new IllegalArgumentException("Elements cannot be null.");
    }
    T first = null;
    for (int i = 0; i < elements.size(); i++) {
      final T element = elements.get(i);
      if (element == null) {
        throw new IllegalArgumentException("Null element at timestep " + i);
      }
      if (first == null) {
        first = element;
      } else if (!first.sameShape(element)) {
        throw new IllegalDataFormatException("Timestep " + i
            + " holds " + element.type() + " data of a different shape "
            + "than timestep 0 (" + first.type() + ")");
      }
    }
    return new Window<T>(ImmutableList.copyOf(elements));
  }

  /**
   * Wraps the values as a window of constants.
   * @param values A non-null array of values.
   * @return A new window.
   */
  public static Window<ConstantValue> ofConstants(final double... values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    final ImmutableList.Builder<ConstantValue> builder =
        ImmutableList.builder();
    for (final double value : values) {
      builder.add(ConstantValue.of(value));
    }
    return new Window<ConstantValue>(builder.build());
  }

  /** @return The number of timesteps in the window. */
  public int length() {
    return elements.size();
  }

  /** @return Whether or not the window has no timesteps. */
  public boolean isEmpty() {
    return elements.isEmpty();
  }

  /**
   * @param index A zero based timestep offset.
   * @return The element at the offset.
   * @throws IndexOutOfBoundsException if the index was out of bounds.
   */
  public T get(final int index) {
    return elements.get(index);
  }

  /** @return The immutable list of elements. */
  public ImmutableList<T> elements() {
    return elements;
  }

  /** @return The payload type of the window or null if it is empty. */
  public PayloadType type() {
    return elements.isEmpty() ? null : elements.get(0).type();
  }

  /**
   * Determines whether the given window can be stored alongside this one.
   * Empty windows are compatible with anything.
   * @param other A non-null window.
   * @return True if the first elements share a shape or either is empty.
   */
  public boolean sameShape(final Window<?> other) {
    if (elements.isEmpty() || other.elements.isEmpty()) {
      return true;
    }
    return elements.get(0).sameShape(other.elements.get(0));
  }

  /**
   * Returns the first {@code length} timesteps of the window. If the length
   * is greater than or equal to the window length, this window is returned.
   * @param length A zero or positive length.
   * @return A window of at most {@code length} timesteps.
   * @throws IllegalArgumentException if the length was negative.
   */
  public Window<T> truncate(final int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length cannot be negative: "
          + length);
    }
    if (length >= elements.size()) {
      return this;
    }
    return new Window<T>(elements.subList(0, length));
  }

  /**
   * Returns the timesteps in {@code [start, start + length)}.
   * @param start A zero based start offset.
   * @param length The number of timesteps to take.
   * @return A window of exactly {@code length} timesteps.
   * @throws IllegalArgumentException if the range is out of bounds.
   */
  public Window<T> slice(final int start, final int length) {
    if (start < 0 || length < 0 || start + length > elements.size()) {
      throw new IllegalArgumentException("Slice [" + start + ", "
          + (start + length) + ") is out of bounds for a window of length "
          + elements.size());
    }
    return new Window<T>(elements.subList(start, start + length));
  }

  /**
   * @param divisor A non-zero divisor.
   * @return A window with every element divided by the divisor.
   */
  @SuppressWarnings("unchecked")
  public Window<T> dividedBy(final double divisor) {
    if (divisor == 1.0) {
      return this;
    }
    final ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (final T element : elements) {
      builder.add((T) element.dividedBy(divisor));
    }
    return new Window<T>(builder.build());
  }

  @Override
  public Iterator<T> iterator() {
    return elements.iterator();
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Window)) {
      return false;
    }
    return elements.equals(((Window<?>) o).elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
