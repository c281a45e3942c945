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

import com.google.common.collect.ImmutableList;
import org.rangeopt.builtins.BuiltinSpec;
import org.rangeopt.tree.ComputeResult;
import org.rangeopt.tree.ExceptionKind;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.TraceCollection;

/** Replaces a call to a range builtin with its value, when that can be computed at compile time. */
final class ConstantFolding {

  private ConstantFolding() {}

  /**
   * If the node's {@link BuiltinSpec} says the call is compile-time computable, asks the trace
   * collection to compute it and replace the node by the result. Otherwise records that the call
   * may raise, and leaves the node unchanged.
   */
  static ComputeResult computeBuiltinSpec(RangeNode node, TraceCollection traceCollection) {
    BuiltinSpec builtinSpec = node.builtinSpec();
    ImmutableList<Expression> args = node.arguments();
    if (!builtinSpec.isCompileTimeComputable(args)) {
      traceCollection.onExceptionRaiseExit(ExceptionKind.BASE_EXCEPTION);
      // TODO: If the step is known to be zero, replace the call with a raise of ValueError.
      return ComputeResult.unchanged(node);
    }
    return traceCollection.getCompileTimeComputationResult(
        node,
        () -> builtinSpec.simulateCall(args),
        String.format("Built-in call to '%s' computed.", builtinSpec.name()));
  }
}
