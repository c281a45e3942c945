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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.tree.ExceptionKind;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.LanguageVersion;
import org.rangeopt.tree.SimulationException;
import org.rangeopt.tree.TypeShape;

/**
 * The {@link BuiltinSpec} for the range builtins. The eager variant produces a list of the
 * elements; the lazy variant produces a {@link RangeValue}.
 */
public final class RangeBuiltinSpec implements BuiltinSpec {

  /**
   * The eager builtin is only evaluated at compile time if its result has fewer than this many
   * elements (unless the call is known to raise), since otherwise the constant would bloat the
   * compiled program.
   */
  public static final int MAX_COMPUTED_LENGTH = 256;

  /** The eager range builtin; see {@link LanguageVersion#hasEagerRange}. */
  public static final RangeBuiltinSpec EAGER = new RangeBuiltinSpec("range", true);

  /** How the runtime's error messages refer to each argument, indexed by arity and position. */
  private static final ImmutableList<ImmutableList<String>> ARG_ROLES =
      ImmutableList.of(
          ImmutableList.of("end"),
          ImmutableList.of("start", "end"),
          ImmutableList.of("start", "end", "step"));

  private final String name;
  private final boolean materializes;

  private RangeBuiltinSpec(String name, boolean materializes) {
    this.name = name;
    this.materializes = materializes;
  }

  /** The lazy range builtin, which is named differently depending on the language version. */
  public static RangeBuiltinSpec lazy(LanguageVersion version) {
    return new RangeBuiltinSpec(version.lazyRangeName(), false);
  }

  @Override
  public String name() {
    return name;
  }

  /** True if this is the eager variant. */
  public boolean materializes() {
    return materializes;
  }

  @Override
  public boolean isCompileTimeComputable(List<? extends Expression> args) {
    checkArity(args);
    for (Expression arg : args) {
      if (!arg.isCompileTimeConstant()) {
        return false;
      }
    }
    if (!materializes) {
      return true;
    }
    long[] bounds = new long[args.size()];
    for (int i = 0; i < bounds.length; i++) {
      Long bound = args.get(i).integerValue();
      if (bound == null) {
        // We can compute the exception that will be raised.
        return true;
      }
      bounds[i] = bound;
    }
    Long length = length(bounds);
    // A null length means that the call will raise.
    return length == null || length < MAX_COMPUTED_LENGTH;
  }

  @Override
  public Object simulateCall(List<? extends Expression> args) throws SimulationException {
    checkArity(args);
    long[] bounds = new long[args.size()];
    for (int i = 0; i < bounds.length; i++) {
      Expression arg = args.get(i);
      Long bound = arg.integerValue();
      if (bound == null) {
        throw new SimulationException(
            ExceptionKind.TYPE_ERROR,
            String.format(
                "%s() integer %s argument expected, got %s.",
                name, ARG_ROLES.get(bounds.length - 1).get(i), typeName(arg.typeShape())));
      }
      bounds[i] = bound;
    }
    long low = (bounds.length == 1) ? 0 : bounds[0];
    long high = (bounds.length == 1) ? bounds[0] : bounds[1];
    long step = (bounds.length == 3) ? bounds[2] : 1;
    if (step == 0) {
      throw new SimulationException(
          ExceptionKind.VALUE_ERROR, name + "() step argument must not be zero");
    }
    Long length = RangeArithmetic.length(low, high, step);
    if (length == null || (materializes && length > Integer.MAX_VALUE)) {
      throw new SimulationException(
          ExceptionKind.OVERFLOW_ERROR, name + "() result has too many items");
    }
    if (!materializes) {
      return new RangeValue(name, low, step, length);
    }
    ImmutableList.Builder<Long> elements =
        ImmutableList.builderWithExpectedSize(length.intValue());
    for (long i = 0; i < length; i++) {
      elements.add(RangeArithmetic.element(low, high, step, i));
    }
    return elements.build();
  }

  /** Returns the length of a range with the given bounds (one, two, or three of them). */
  private static @Nullable Long length(long[] bounds) {
    return switch (bounds.length) {
      case 1 -> Long.valueOf(RangeArithmetic.length(bounds[0]));
      case 2 -> RangeArithmetic.length(bounds[0], bounds[1]);
      case 3 -> RangeArithmetic.length(bounds[0], bounds[1], bounds[2]);
      default -> throw new AssertionError();
    };
  }

  private void checkArity(List<? extends Expression> args) {
    Preconditions.checkArgument(
        args.size() >= 1 && args.size() <= 3, "%s() takes 1 to 3 arguments", name);
  }

  private static String typeName(TypeShape shape) {
    return (shape == TypeShape.UNKNOWN) ? "object" : Ascii.toLowerCase(shape.name());
  }

  @Override
  public String toString() {
    return name;
  }
}
