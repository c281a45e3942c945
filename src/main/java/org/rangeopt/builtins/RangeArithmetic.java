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

import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import org.jspecify.annotations.Nullable;

/**
 * Static-only class that computes the lengths and elements of ranges exactly as the runtime does.
 *
 * <p>The runtime's integers are unbounded, so intermediate results are computed with BigIntegers;
 * a result that can't be represented as a long is returned as null ("unknown") rather than
 * approximated.
 */
public final class RangeArithmetic {

  private RangeArithmetic() {}

  /** The length of {@code range(stop)}. */
  public static long length(long stop) {
    return Math.max(0, stop);
  }

  /** The length of {@code range(low, high)}, or null if it doesn't fit in a long. */
  public static @Nullable Long length(long low, long high) {
    BigInteger diff = BigInteger.valueOf(high).subtract(BigInteger.valueOf(low));
    return (diff.signum() <= 0) ? Long.valueOf(0) : asLong(diff);
  }

  /**
   * The length of {@code range(low, high, step)}, or null if {@code step} is zero (the call will
   * raise) or the length doesn't fit in a long.
   */
  public static @Nullable Long length(long low, long high, long step) {
    if (step == 0) {
      return null;
    }
    BigInteger diff = BigInteger.valueOf(high).subtract(BigInteger.valueOf(low));
    // A step in the "wrong" direction gives an empty range rather than an error, so the two
    // directions are handled separately.
    BigInteger estimate;
    if (low < high) {
      estimate =
          (step < 0)
              ? BigInteger.ZERO
              : BigIntegerMath.divide(diff, BigInteger.valueOf(step), RoundingMode.CEILING);
    } else {
      estimate =
          (step > 0)
              ? BigInteger.ZERO
              : BigIntegerMath.divide(diff, BigInteger.valueOf(step), RoundingMode.CEILING);
    }
    assert estimate.signum() >= 0;
    return asLong(estimate);
  }

  /**
   * The element at position {@code index} of {@code range(low, high, step)}, or null if the range
   * has no such element (or {@code step} is zero).
   */
  public static @Nullable Long element(long low, long high, long step, long index) {
    if (step == 0 || index < 0) {
      return null;
    }
    BigInteger result =
        BigInteger.valueOf(step).multiply(BigInteger.valueOf(index)).add(BigInteger.valueOf(low));
    int cmp = result.compareTo(BigInteger.valueOf(high));
    if (step > 0 ? cmp >= 0 : cmp <= 0) {
      return null;
    }
    // result is between low and high, so it fits.
    return result.longValue();
  }

  private static @Nullable Long asLong(BigInteger n) {
    return (n.bitLength() < Long.SIZE) ? Long.valueOf(n.longValue()) : null;
  }
}
