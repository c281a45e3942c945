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

import com.google.common.collect.ImmutableList;

/**
 * Starts an iteration over its source expression (e.g. the implicit {@code iter()} of a for-loop).
 * When computed it gives the source a chance to optimize for being iterated; see {@link
 * Expression#computeExpressionIter1}.
 */
public final class IterationExpression extends Expression.WithChildren {
  private static final ImmutableList<String> CHILD_NAMES = ImmutableList.of("source");

  public IterationExpression(Expression source, SourceRef sourceRef) {
    super(sourceRef, CHILD_NAMES, source);
  }

  public Expression source() {
    return child(0);
  }

  @Override
  public ComputeResult computeExpression(TraceCollection traceCollection) {
    return source().computeExpressionIter1(this, traceCollection);
  }

  @Override
  public boolean mayRaiseException(ExceptionKind kind) {
    return super.mayRaiseException(kind) || !source().isKnownToBeIterable(null);
  }

  @Override
  public String toString() {
    return "iter(" + source() + ")";
  }
}
