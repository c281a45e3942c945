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
import java.util.stream.IntStream;
import org.rangeopt.util.StringUtil;

/**
 * A call to a function about which nothing is known; it may have any side effect and raise any
 * exception.
 */
public final class OpaqueCall extends Expression.WithChildren {
  public final String function;

  public OpaqueCall(String function, SourceRef sourceRef, Expression... args) {
    super(sourceRef, argNames(args.length), args);
    this.function = function;
  }

  private static ImmutableList<String> argNames(int numArgs) {
    return IntStream.range(0, numArgs)
        .mapToObj(i -> "arg" + i)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public boolean mayHaveSideEffects() {
    return true;
  }

  @Override
  public boolean mayRaiseException(ExceptionKind kind) {
    return true;
  }

  @Override
  public String toString() {
    return StringUtil.joinElements(function + "(", ")", numChildren(), this::child);
  }
}
