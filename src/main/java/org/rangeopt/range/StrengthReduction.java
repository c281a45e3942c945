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
import org.rangeopt.tree.ChangeTag;
import org.rangeopt.tree.ComputeResult;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.IterationExpression;
import org.rangeopt.tree.TraceCollection;

/**
 * Replaces a call to the eager range builtin that is only used as the source of an iteration with
 * the equivalent lazy call, if the range is known to be large enough that building the list would
 * be wasteful.
 */
final class StrengthReduction {

  /** Ranges with more elements than this are iterated lazily. */
  static final long LAZY_ITERATION_THRESHOLD = 256;

  private StrengthReduction() {}

  static ComputeResult computeExpressionIter1(
      RangeNode node, IterationExpression iterNode, TraceCollection traceCollection) {
    Preconditions.checkArgument(node.family() == RangeNode.Family.EAGER);
    Preconditions.checkArgument(
        iterNode.source() == node, "%s is not iterating over %s", iterNode, node);
    if (!node.languageVersion.hasEagerRange()) {
      return ComputeResult.unchanged(iterNode);
    }
    Long length = node.iterationLength();
    if (length == null || length <= LAZY_ITERATION_THRESHOLD) {
      // Iterating over the list won't raise.
      return ComputeResult.unchanged(iterNode);
    }
    String from = node.builtinSpec().name();
    ImmutableList<Expression> args = node.releaseArguments();
    RangeNode lazy =
        RangeNode.of(RangeNode.Family.LAZY, node.languageVersion, node.sourceRef(), args);
    iterNode.replaceChild(node, lazy);
    String description =
        String.format(
            "Replaced '%s' with '%s' built-in call for iteration.",
            from, lazy.builtinSpec().name());
    traceCollection.onChange(lazy, description);
    return new ComputeResult(iterNode, ChangeTag.NEW_EXPRESSION, description);
  }
}
