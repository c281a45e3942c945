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

package org.rangeopt.tree;

import java.util.stream.LongStream;
import org.jspecify.annotations.Nullable;

/**
 * An immutable description of the elements that iterating over some value is predicted to
 * produce. Each call to {@link #values()} returns a new stream, so the sequence can be walked any
 * number of times.
 */
public interface IterationHandle {

  /** The number of elements. */
  long length();

  /** Returns the elements, in iteration order. */
  LongStream values();

  /**
   * Returns the elements at positions {@code start} (inclusive) to {@code stop} (exclusive); either
   * bound is clamped to {@code 0..length()}.
   */
  default LongStream values(long start, long stop) {
    long from = Math.max(0, start);
    long to = Math.min(length(), stop);
    return (from >= to) ? LongStream.empty() : values().skip(from).limit(to - from);
  }

  /** Returns the element at the given position, or null if there is no such element. */
  @Nullable Long valueAt(long index);

  /**
   * TRUE if every element is known to be truthy (non-zero), FALSE if at least one is known to be
   * zero.
   */
  default Truth allElementsTruth() {
    return Truth.of(values().allMatch(v -> v != 0));
  }
}
