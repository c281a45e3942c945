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

package org.rangeopt.range;

import java.util.stream.LongStream;
import org.jspecify.annotations.Nullable;
import org.rangeopt.builtins.RangeArithmetic;
import org.rangeopt.tree.IterationHandle;
import org.rangeopt.tree.Truth;

/**
 * An {@link IterationHandle} for a range whose bounds are all known. There is one subclass for
 * each form of the call; all of them just save the (low, high, step) triple, from which every
 * element is recomputed as needed.
 */
public abstract class RangeIterationHandle implements IterationHandle {
  final long low;
  final long high;
  final long step;
  private final long length;

  private RangeIterationHandle(long low, long high, long step, long length) {
    this.low = low;
    this.high = high;
    this.step = step;
    this.length = length;
  }

  /** Returns a handle for {@code range(stop)}. */
  public static RangeIterationHandle forStop(long stop) {
    return new Stop(stop);
  }

  /** Returns a handle for {@code range(low, high)}, or null if its length is too large. */
  public static @Nullable RangeIterationHandle forStartStop(long low, long high) {
    Long length = RangeArithmetic.length(low, high);
    return (length == null) ? null : new StartStop(low, high, length);
  }

  /**
   * Returns a handle for {@code range(low, high, step)}, or null if {@code step} is zero (the call
   * will raise) or its length is too large.
   */
  public static @Nullable RangeIterationHandle forStartStopStep(long low, long high, long step) {
    Long length = RangeArithmetic.length(low, high, step);
    return (length == null) ? null : new StartStopStep(low, high, step, length);
  }

  @Override
  public final long length() {
    return length;
  }

  @Override
  public final LongStream values() {
    // Elements are in bounds, so wraparound in the intermediate product doesn't matter.
    return LongStream.range(0, length).map(i -> low + i * step);
  }

  @Override
  public final @Nullable Long valueAt(long index) {
    return RangeArithmetic.element(low, high, step, index);
  }

  /** FALSE iff zero is one of the elements. */
  @Override
  public final Truth allElementsTruth() {
    boolean inBounds = (step > 0) ? (low <= 0 && 0 < high) : (high < 0 && 0 <= low);
    return Truth.of(!(inBounds && low % step == 0));
  }

  /** The handle for {@code range(stop)}. */
  static final class Stop extends RangeIterationHandle {
    Stop(long stop) {
      super(0, stop, 1, RangeArithmetic.length(stop));
    }

    @Override
    public String toString() {
      return "range(" + high + ")";
    }
  }

  /** The handle for {@code range(low, high)}. */
  static final class StartStop extends RangeIterationHandle {
    StartStop(long low, long high, long length) {
      super(low, high, 1, length);
    }

    @Override
    public String toString() {
      return "range(" + low + ", " + high + ")";
    }
  }

  /** The handle for {@code range(low, high, step)}. */
  static final class StartStopStep extends RangeIterationHandle {
    StartStopStep(long low, long high, long step, long length) {
      super(low, high, step, length);
    }

    @Override
    public String toString() {
      return "range(" + low + ", " + high + ", " + step + ")";
    }
  }
}
