/*
 * Copyright 2025 The Rangeopt Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rangeopt.builtins;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.stream.LongStream;
import org.jspecify.annotations.Nullable;
import org.rangeopt.tree.ConstantExpression;
import org.rangeopt.tree.IterationHandle;
import org.rangeopt.tree.Truth;
import org.rangeopt.tree.TypeShape;

/**
 * The value of a call to the lazy range builtin: a descriptor of the sequence, which is never
 * materialized. Like the runtime's descriptor it only remembers the start, step, and length; two
 * calls that produce the same elements produce equal RangeValues.
 *
 * <p>A RangeValue is its own {@link IterationHandle}, so a folded call keeps the element
 * predictions the call node made.
 */
public final class RangeValue implements ConstantExpression.Shaped, IterationHandle {
  /** The name of the builtin that created this value; used when printing. */
  private final String name;

  private final long start;
  private final long step;
  private final long length;

  RangeValue(String name, long start, long step, long length) {
    Preconditions.checkArgument(step != 0 && length >= 0);
    this.name = name;
    this.start = start;
    this.step = step;
    this.length = length;
  }

  @Override
  public TypeShape typeShape() {
    return TypeShape.RANGE;
  }

  @Override
  public long length() {
    return length;
  }

  @Override
  public IterationHandle iterationHandle() {
    return this;
  }

  /** Returns the element at the given position, or null if there is no such element. */
  public @Nullable Long element(long index) {
    // Every element lies between start and the last element, so wraparound in the intermediate
    // product doesn't matter.
    return (index < 0 || index >= length) ? null : start + index * step;
  }

  @Override
  public @Nullable Long valueAt(long index) {
    return element(index);
  }

  @Override
  public LongStream values() {
    return LongStream.range(0, length).map(i -> start + i * step);
  }

  /** FALSE iff zero is one of the elements. */
  @Override
  public Truth allElementsTruth() {
    if (start % step != 0) {
      return Truth.TRUE;
    }
    // Zero would be at position -start/step, which may not fit in a long.
    BigInteger position = BigInteger.valueOf(start).divide(BigInteger.valueOf(step)).negate();
    boolean containsZero =
        position.signum() >= 0 && position.compareTo(BigInteger.valueOf(length)) < 0;
    return Truth.of(!containsZero);
  }

  /** Compares elements: the start is irrelevant when empty, and the step when at most one. */
  @Override
  public boolean equals(Object obj) {
    return obj instanceof RangeValue other
        && length == other.length
        && (length == 0 || start == other.start)
        && (length <= 1 || step == other.step);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(length);
    if (length > 0) {
      result = result * 31 + Long.hashCode(start);
    }
    if (length > 1) {
      result = result * 31 + Long.hashCode(step);
    }
    return result;
  }

  /** Prints the way the runtime does, normalizing the stop bound to just past the last element. */
  @Override
  public String toString() {
    BigInteger stop =
        BigInteger.valueOf(length)
            .multiply(BigInteger.valueOf(step))
            .add(BigInteger.valueOf(start));
    if (step != 1) {
      return String.format("%s(%s, %s, %s)", name, start, stop, step);
    } else if (start != 0) {
      return String.format("%s(%s, %s)", name, start, stop);
    } else {
      return String.format("%s(%s)", name, stop);
    }
  }
}
