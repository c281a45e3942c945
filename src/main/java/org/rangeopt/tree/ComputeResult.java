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

import org.jspecify.annotations.Nullable;

/**
 * The result of {@link Expression#computeExpression} or {@link Expression#computeExpressionIter1}:
 * the (possibly new) expression, plus a tag and human-readable description if anything changed.
 */
public record ComputeResult(
    Expression expression, @Nullable ChangeTag tag, @Nullable String description) {

  /** Returns a result indicating that nothing changed. */
  public static ComputeResult unchanged(Expression expression) {
    return new ComputeResult(expression, null, null);
  }

  public boolean changed() {
    return tag != null;
  }
}
