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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.builtins.RangeArithmetic;
import org.rangeopt.builtins.RangeBuiltinSpec;
import org.rangeopt.tree.ComputeResult;
import org.rangeopt.tree.ConstantExpression;
import org.rangeopt.tree.ExceptionKind;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.IterationExpression;
import org.rangeopt.tree.LanguageVersion;
import org.rangeopt.tree.SourceRef;
import org.rangeopt.tree.TraceCollection;
import org.rangeopt.tree.Truth;
import org.rangeopt.tree.TypeShape;
import org.rangeopt.util.StringUtil;

/**
 * A call to one of the range builtins with 1, 2, or 3 arguments. There is a subclass for each
 * number of arguments ({@link One}, {@link Two}, {@link Three}), which determines how the
 * arguments are interpreted; each can be either the eager (list-producing) or the lazy
 * (descriptor-producing) builtin, as given by its {@link Family}. The {@link Kind} combines the
 * two.
 *
 * <p>The behavior shared by all six kinds (side effects, exceptions, truth value, folding) is
 * implemented here and in {@link RangeAnalysis}; the subclasses only supply the arity-specific
 * parts (which arguments are present, and how the length and elements are computed from them).
 */
public abstract class RangeNode extends Expression.WithChildren {

  /** Which of the two range builtins is being called. */
  public enum Family {
    /** Produces a list containing all the elements. */
    EAGER,
    /** Produces a descriptor from which the elements are computed on demand. */
    LAZY
  }

  /** The six possible shapes of a RangeNode. */
  public enum Kind {
    EAGER1(Family.EAGER, 1),
    EAGER2(Family.EAGER, 2),
    EAGER3(Family.EAGER, 3),
    LAZY1(Family.LAZY, 1),
    LAZY2(Family.LAZY, 2),
    LAZY3(Family.LAZY, 3);

    public final Family family;
    public final int arity;

    Kind(Family family, int arity) {
      this.family = family;
      this.arity = arity;
    }

    public static Kind of(Family family, int arity) {
      Preconditions.checkArgument(arity >= 1 && arity <= 3, "Bad arity %s", arity);
      return values()[(family == Family.EAGER ? 0 : 3) + arity - 1];
    }
  }

  public final Kind kind;

  /** The version being compiled; the eager builtin only exists in some versions. */
  public final LanguageVersion languageVersion;

  private final RangeBuiltinSpec builtinSpec;

  RangeNode(
      Family family,
      LanguageVersion languageVersion,
      SourceRef sourceRef,
      ImmutableList<String> argNames,
      Expression... args) {
    super(sourceRef, argNames, args);
    Preconditions.checkArgument(
        family == Family.LAZY || languageVersion.hasEagerRange(),
        "Version %s has no eager range builtin",
        languageVersion);
    this.kind = Kind.of(family, args.length);
    this.languageVersion = languageVersion;
    this.builtinSpec =
        (family == Family.EAGER) ? RangeBuiltinSpec.EAGER : RangeBuiltinSpec.lazy(languageVersion);
  }

  /** Returns a new RangeNode of the given family with one, two, or three arguments. */
  public static RangeNode of(
      Family family, LanguageVersion languageVersion, SourceRef sourceRef, List<Expression> args) {
    return switch (args.size()) {
      case 1 -> new One(family, languageVersion, sourceRef, args.get(0));
      case 2 -> new Two(family, languageVersion, sourceRef, args.get(0), args.get(1));
      case 3 -> new Three(
          family, languageVersion, sourceRef, args.get(0), args.get(1), args.get(2));
      default -> throw new IllegalArgumentException("range takes 1 to 3 arguments");
    };
  }

  /** Returns a call to the eager range builtin. */
  public static RangeNode eager(
      LanguageVersion languageVersion, SourceRef sourceRef, Expression... args) {
    return of(Family.EAGER, languageVersion, sourceRef, ImmutableList.copyOf(args));
  }

  /** Returns a call to the lazy range builtin. */
  public static RangeNode lazy(
      LanguageVersion languageVersion, SourceRef sourceRef, Expression... args) {
    return of(Family.LAZY, languageVersion, sourceRef, ImmutableList.copyOf(args));
  }

  public final Family family() {
    return kind.family;
  }

  public final RangeBuiltinSpec builtinSpec() {
    return builtinSpec;
  }

  /**
   * The first argument. With a single argument this is actually the (exclusive) upper bound, and
   * the range starts at zero.
   */
  public final Expression low() {
    return child(0);
  }

  /** The second argument, or null if there are fewer than two. */
  public @Nullable Expression high() {
    return null;
  }

  /** The third argument, or null if there are fewer than three. */
  public @Nullable Expression step() {
    return null;
  }

  /** All the arguments, in order. */
  public final ImmutableList<Expression> arguments() {
    return children();
  }

  /**
   * Detaches this node's arguments so that they can be given to a replacement node; this node may
   * not be used afterwards.
   */
  final ImmutableList<Expression> releaseArguments() {
    return releaseChildren();
  }

  /** True if float constants passed to this call are coerced in an observable way. */
  final boolean coercesFloatArguments() {
    return family() == Family.EAGER && languageVersion.coercesFloatRangeArguments();
  }

  @Override
  public final TypeShape typeShape() {
    return (family() == Family.EAGER) ? TypeShape.LIST : TypeShape.RANGE;
  }

  @Override
  public final Truth truthValue() {
    return RangeAnalysis.truthValue(iterationLength());
  }

  @Override
  public final boolean mayHaveSideEffects() {
    return RangeAnalysis.mayHaveSideEffects(arguments(), coercesFloatArguments());
  }

  @Override
  public final boolean mayRaiseException(ExceptionKind exceptionKind) {
    return RangeAnalysis.mayRaiseException(
        arguments(), step(), coercesFloatArguments(), exceptionKind);
  }

  @Override
  public final boolean canPredictIterationValues() {
    return iterationLength() != null;
  }

  @Override
  public final boolean isKnownToBeIterable(@Nullable Long count) {
    return count == null || count.equals(iterationLength());
  }

  @Override
  public abstract @Nullable Long iterationLength();

  @Override
  public abstract @Nullable RangeIterationHandle iterationHandle();

  @Override
  public final ComputeResult computeExpression(TraceCollection traceCollection) {
    return ConstantFolding.computeBuiltinSpec(this, traceCollection);
  }

  @Override
  public final ComputeResult computeExpressionIter1(
      IterationExpression iterNode, TraceCollection traceCollection) {
    if (family() == Family.EAGER) {
      return StrengthReduction.computeExpressionIter1(this, iterNode, traceCollection);
    }
    // Iterating over a lazy range never raises, and there's nothing cheaper to replace it with.
    return ComputeResult.unchanged(iterNode);
  }

  /** Returns a constant for an element of this range. */
  final ConstantExpression element(long value) {
    return ConstantExpression.replacementFor(value, this);
  }

  @Override
  public String toString() {
    if (isReleased()) {
      return builtinSpec.name() + "(<moved>)";
    }
    return StringUtil.joinElements(builtinSpec.name() + "(", ")", numChildren(), this::child);
  }

  /** {@code range(low)}: the elements {@code 0} to {@code low - 1}. */
  public static final class One extends RangeNode {
    private static final ImmutableList<String> ARG_NAMES = ImmutableList.of("low");

    One(Family family, LanguageVersion languageVersion, SourceRef sourceRef, Expression low) {
      super(family, languageVersion, sourceRef, ARG_NAMES, low);
    }

    @Override
    public @Nullable Long iterationLength() {
      Long low = low().integerValue();
      return (low == null) ? null : Long.valueOf(RangeArithmetic.length(low));
    }

    /**
     * Note that this returns {@code index} itself when {@code index} equals the length, even though
     * iteration would be exhausted at that point.
     */
    @Override
    public @Nullable ConstantExpression iterationValue(long index) {
      Long length = iterationLength();
      if (length == null || index < 0 || index > length) {
        return null;
      }
      return element(index);
    }

    @Override
    public @Nullable RangeIterationHandle iterationHandle() {
      Long low = low().integerValue();
      return (low == null) ? null : RangeIterationHandle.forStop(low);
    }
  }

  /** {@code range(low, high)}: the elements {@code low} to {@code high - 1}. */
  public static final class Two extends RangeNode {
    private static final ImmutableList<String> ARG_NAMES = ImmutableList.of("low", "high");

    Two(
        Family family,
        LanguageVersion languageVersion,
        SourceRef sourceRef,
        Expression low,
        Expression high) {
      super(family, languageVersion, sourceRef, ARG_NAMES, low, high);
    }

    @Override
    public Expression high() {
      return child(1);
    }

    @Override
    public @Nullable Long iterationLength() {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      return RangeArithmetic.length(low, high);
    }

    @Override
    public @Nullable ConstantExpression iterationValue(long index) {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      Long result = RangeArithmetic.element(low, high, 1, index);
      return (result == null) ? null : element(result);
    }

    @Override
    public @Nullable RangeIterationHandle iterationHandle() {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      return RangeIterationHandle.forStartStop(low, high);
    }
  }

  /** {@code range(low, high, step)}. */
  public static final class Three extends RangeNode {
    private static final ImmutableList<String> ARG_NAMES = ImmutableList.of("low", "high", "step");

    Three(
        Family family,
        LanguageVersion languageVersion,
        SourceRef sourceRef,
        Expression low,
        Expression high,
        Expression step) {
      super(family, languageVersion, sourceRef, ARG_NAMES, low, high, step);
    }

    @Override
    public Expression high() {
      return child(1);
    }

    @Override
    public Expression step() {
      return child(2);
    }

    @Override
    public @Nullable Long iterationLength() {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      Long step = step().integerValue();
      if (step == null) {
        return null;
      }
      // A zero step will raise, so there is no length.
      return RangeArithmetic.length(low, high, step);
    }

    @Override
    public @Nullable ConstantExpression iterationValue(long index) {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      Long step = step().integerValue();
      if (step == null) {
        return null;
      }
      Long result = RangeArithmetic.element(low, high, step, index);
      return (result == null) ? null : element(result);
    }

    @Override
    public @Nullable RangeIterationHandle iterationHandle() {
      Long low = low().integerValue();
      if (low == null) {
        return null;
      }
      Long high = high().integerValue();
      if (high == null) {
        return null;
      }
      Long step = step().integerValue();
      if (step == null) {
        return null;
      }
      return RangeIterationHandle.forStartStopStep(low, high, step);
    }
  }
}
