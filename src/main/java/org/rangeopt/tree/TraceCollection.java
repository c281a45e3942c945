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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * A TraceCollection accumulates what one optimization pass learns about control flow (which points
 * may exit via an exception), and performs the one-time replacement of nodes by the constants they
 * compute to.
 *
 * <p>A TraceCollection belongs to a single pass; it must not be shared between passes.
 */
public final class TraceCollection {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A compile-time simulation of some expression's evaluation. */
  @FunctionalInterface
  public interface Computation {
    /**
     * Returns the value the expression evaluates to, or throws SimulationException if it would
     * raise.
     */
    Object compute() throws SimulationException;
  }

  /** If true, the description of each change is saved; see {@link #changes}. */
  public boolean verbose;

  private final List<ExceptionKind> exceptionExits = new ArrayList<>();

  private final List<String> changes = new ArrayList<>();

  /** The result of each computation already run in this pass, keyed by (original) node. */
  private final IdentityHashMap<Expression, ComputeResult> computed = new IdentityHashMap<>();

  /** Records that execution may leave the current point by raising the given kind of exception. */
  public void onExceptionRaiseExit(ExceptionKind kind) {
    exceptionExits.add(kind);
  }

  /** The kinds passed to {@link #onExceptionRaiseExit}, in the order they were recorded. */
  public ImmutableList<ExceptionKind> exceptionExits() {
    return ImmutableList.copyOf(exceptionExits);
  }

  public boolean mayExitByException() {
    return !exceptionExits.isEmpty();
  }

  /** Records a change to the tree; the description is only saved if {@link #verbose} is set. */
  public void onChange(Expression node, String description) {
    logger.atFine().log("%s: %s", node.sourceRef(), description);
    if (verbose) {
      changes.add(description);
    }
  }

  /** The descriptions of the changes made during this pass, if {@link #verbose} was set. */
  public ImmutableList<String> changes() {
    return ImmutableList.copyOf(changes);
  }

  /**
   * Runs {@code computation} (at most once per node and pass). If it produces a value, {@code node}
   * is replaced in the tree by a constant for that value and the result reports the new constant
   * with the given description. If the computation determines that evaluation would raise, the
   * exception exit is recorded and {@code node} is left unchanged.
   */
  public ComputeResult getCompileTimeComputationResult(
      Expression node, Computation computation, String description) {
    ComputeResult previous = computed.get(node);
    if (previous != null) {
      return previous;
    }
    ComputeResult result;
    try {
      ConstantExpression constant = ConstantExpression.replacementFor(computation.compute(), node);
      if (node.parent() != null) {
        node.replaceWith(constant);
      }
      onChange(node, description);
      result = new ComputeResult(constant, ChangeTag.NEW_CONSTANT, description);
    } catch (SimulationException e) {
      logger.atFine().log("%s: computation of %s abandoned (%s)", node.sourceRef(), node, e);
      onExceptionRaiseExit(e.kind());
      result = ComputeResult.unchanged(node);
    }
    computed.put(node, result);
    return result;
  }
}
