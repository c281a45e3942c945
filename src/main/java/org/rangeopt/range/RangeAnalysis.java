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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.tree.ConstantExpression;
import org.rangeopt.tree.ExceptionKind;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.Truth;

/**
 * Static-only class implementing the analyses that are the same for every kind of {@link
 * RangeNode}.
 *
 * <p>An argument that is not known to be an integer is always treated as possibly having side
 * effects and possibly raising: the runtime will try to convert it (which may call user code), and
 * the conversion may fail.
 */
final class RangeAnalysis {

  private RangeAnalysis() {}

  /** A range is truthy iff it is non-empty. */
  static Truth truthValue(@Nullable Long length) {
    return (length == null) ? Truth.UNKNOWN : Truth.of(length > 0);
  }

  static boolean mayHaveSideEffects(List<Expression> args, boolean coercesFloatArguments) {
    for (Expression arg : args) {
      if (arg.mayHaveSideEffects()
          || arg.integerValue() == null
          || (coercesFloatArguments && isFloatConstant(arg))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Note that {@code kind} is only passed on to the arguments; the checks made by the call itself
   * don't distinguish between kinds of exception.
   */
  static boolean mayRaiseException(
      List<Expression> args,
      @Nullable Expression step,
      boolean coercesFloatArguments,
      ExceptionKind kind) {
    for (Expression arg : args) {
      if (arg.mayRaiseException(kind)
          || arg.integerValue() == null
          || (coercesFloatArguments && isFloatConstant(arg))) {
        return true;
      }
    }
    // A step of zero always raises.
    return step != null && Long.valueOf(0).equals(step.integerValue());
  }

  private static boolean isFloatConstant(Expression arg) {
    return arg.isConstantRef() && ((ConstantExpression) arg).constant() instanceof Double;
  }
}
