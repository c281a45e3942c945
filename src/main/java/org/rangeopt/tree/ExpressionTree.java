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
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The root of a program tree: owns a fixed list of top-level statements, and records the language
 * version the program is compiled for.
 */
public final class ExpressionTree extends Expression.WithChildren {
  public final LanguageVersion languageVersion;

  public ExpressionTree(LanguageVersion languageVersion, Expression... statements) {
    super(SourceRef.INTERNAL, statementNames(statements.length), statements);
    this.languageVersion = languageVersion;
  }

  private static ImmutableList<String> statementNames(int numStatements) {
    return IntStream.range(0, numStatements)
        .mapToObj(i -> "statement" + i)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the top-level statement at the given index. */
  public Expression statement(int index) {
    return child(index);
  }

  @Override
  public String toString() {
    return children().stream().map(String::valueOf).collect(Collectors.joining("\n"));
  }
}
