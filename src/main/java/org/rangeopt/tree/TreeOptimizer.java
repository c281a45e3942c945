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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;

/**
 * Repeatedly visits every node of an {@link ExpressionTree} (children before parents), calling
 * {@link Expression#computeExpression} on each, until a pass makes no change. Each pass uses a new
 * {@link TraceCollection}.
 */
public final class TreeOptimizer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Guards against rewrites that never reach a fixed point. */
  public static final int MAX_PASSES = 20;

  private final ExpressionTree tree;

  private final List<String> changes = new ArrayList<>();

  private TraceCollection lastPass;

  int numPasses;

  public TreeOptimizer(ExpressionTree tree) {
    this.tree = tree;
  }

  /** Optimizes the tree; returns the number of passes that made changes. */
  public int optimize() {
    logger.atFine().log(
        "Starting optimization (%s):\n%s", tree.languageVersion, lazy(tree::toString));
    for (numPasses = 0; numPasses < MAX_PASSES; numPasses++) {
      TraceCollection traceCollection = new TraceCollection();
      traceCollection.verbose = true;
      int numChanges = visitChildren(tree, traceCollection);
      lastPass = traceCollection;
      changes.addAll(traceCollection.changes());
      logger.atFine().log("Pass %s: %s changes", numPasses, numChanges);
      if (numChanges == 0) {
        break;
      }
    }
    logger.atFine().log("Optimized:\n%s", lazy(tree::toString));
    return numPasses;
  }

  /** The descriptions of all changes made by {@link #optimize}, in order. */
  public ImmutableList<String> changes() {
    return ImmutableList.copyOf(changes);
  }

  /** The TraceCollection used by the last pass of {@link #optimize}. */
  public TraceCollection lastPass() {
    return lastPass;
  }

  private static int visitChildren(Expression node, TraceCollection traceCollection) {
    int numChanges = 0;
    // A child may be replaced while it is visited; the replacement will be visited on the next
    // pass.
    for (int i = 0; i < node.numChildren(); i++) {
      numChanges += visit(node.child(i), traceCollection);
    }
    return numChanges;
  }

  private static int visit(Expression node, TraceCollection traceCollection) {
    int numChanges = visitChildren(node, traceCollection);
    ComputeResult result = node.computeExpression(traceCollection);
    return numChanges + (result.changed() ? 1 : 0);
  }
}
