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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * An Expression is one node of the program tree being optimized. Each Expression is owned by at
 * most one parent ({@link WithChildren}), which refers to it by slot index; replacing a node is an
 * explicit operation on the parent's slot that returns the detached node.
 *
 * <p>The analysis methods (e.g. {@link #mayHaveSideEffects}, {@link #iterationLength}) describe
 * what is statically known about the expression's runtime behavior. They never throw; the default
 * implementations answer as conservatively as possible, and subclasses override them when they can
 * do better.
 */
public abstract class Expression {

  private final SourceRef sourceRef;

  /** The node that owns this one, or null if this node is detached. */
  private @Nullable WithChildren parent;

  /** The index of this node in {@code parent}'s children; -1 if detached. */
  private int slot = -1;

  protected Expression(SourceRef sourceRef) {
    this.sourceRef = sourceRef;
  }

  public final SourceRef sourceRef() {
    return sourceRef;
  }

  /** The node that owns this one, or null if it has not been attached or has been replaced. */
  public final @Nullable WithChildren parent() {
    return parent;
  }

  /** The index of this node in its parent's children; negative if detached. */
  public final int slot() {
    return slot;
  }

  public int numChildren() {
    return 0;
  }

  /** Returns one of this node's children; {@code index} must be less than {@link #numChildren}. */
  public Expression child(int index) {
    throw new AssertionError();
  }

  /** Returns this node's children, in slot order. */
  public final ImmutableList<Expression> children() {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (int i = 0; i < numChildren(); i++) {
      result.add(child(i));
    }
    return result.build();
  }

  /**
   * Replaces this node in its parent with {@code replacement}, which must not already have a
   * parent. Returns this (now detached) node.
   */
  @CanIgnoreReturnValue
  public final Expression replaceWith(Expression replacement) {
    Preconditions.checkState(parent != null, "%s is not attached", this);
    return parent.replaceChild(slot, replacement);
  }

  /** Statically known type of this expression's value. */
  public TypeShape typeShape() {
    return TypeShape.UNKNOWN;
  }

  /** Statically known truth value of this expression's value. */
  public Truth truthValue() {
    return Truth.UNKNOWN;
  }

  /** False only if evaluating this expression is known to have no observable side effects. */
  public boolean mayHaveSideEffects() {
    return true;
  }

  /**
   * False only if evaluating this expression is known not to raise an exception of the given kind.
   */
  public boolean mayRaiseException(ExceptionKind kind) {
    return true;
  }

  /** If this expression is known to evaluate to an integer, returns it; otherwise null. */
  public @Nullable Long integerValue() {
    return null;
  }

  /** True if this is a reference to a constant (i.e. a {@link ConstantExpression}). */
  public boolean isConstantRef() {
    return false;
  }

  /** True if this expression's value is known at compile time. */
  public boolean isCompileTimeConstant() {
    return false;
  }

  /** If iterating over this expression's value is known to produce a fixed number of elements. */
  public @Nullable Long iterationLength() {
    return null;
  }

  public boolean canPredictIterationValues() {
    return false;
  }

  /**
   * If the element at the given (zero-based) position of this expression's iteration is known,
   * returns a constant expression for it; otherwise null.
   */
  public @Nullable Expression iterationValue(long index) {
    return null;
  }

  /**
   * True if this expression's value is known to be iterable and, if {@code count} is non-null, to
   * produce exactly that many elements.
   */
  public boolean isKnownToBeIterable(@Nullable Long count) {
    return false;
  }

  /** Returns a handle on the predicted elements of this expression's iteration, if there is one. */
  public @Nullable IterationHandle iterationHandle() {
    return null;
  }

  /**
   * Called by the optimizer to simplify this expression after its children have been visited. If
   * the result's expression is not this node, this node has already been replaced in the tree.
   */
  public ComputeResult computeExpression(TraceCollection traceCollection) {
    return ComputeResult.unchanged(this);
  }

  /**
   * Called by {@code iterNode} (whose source is this expression) to let this expression optimize
   * for being iterated. The default implementation just records that iteration may fail.
   */
  public ComputeResult computeExpressionIter1(
      IterationExpression iterNode, TraceCollection traceCollection) {
    if (!isKnownToBeIterable(null)) {
      traceCollection.onExceptionRaiseExit(ExceptionKind.TYPE_ERROR);
    }
    return ComputeResult.unchanged(iterNode);
  }

  @Override
  public abstract String toString();

  /** Base class for expressions that have named child expressions. */
  public abstract static class WithChildren extends Expression {
    private final ImmutableList<String> childNames;
    private final @Nullable Expression[] children;

    /** Set once the children have been moved to another node; see {@link #releaseChildren}. */
    private boolean released;

    protected WithChildren(
        SourceRef sourceRef, ImmutableList<String> childNames, Expression... children) {
      super(sourceRef);
      Preconditions.checkArgument(
          childNames.size() == children.length, "Expected %s children", childNames.size());
      this.childNames = childNames;
      this.children = new Expression[children.length];
      for (int i = 0; i < children.length; i++) {
        adopt(i, children[i]);
      }
    }

    @Override
    public final int numChildren() {
      return released ? 0 : children.length;
    }

    @Override
    public final Expression child(int index) {
      Preconditions.checkState(!released, "Children have been moved");
      return children[index];
    }

    /** Returns the child with the given name, or null if this node has no child with that name. */
    public final @Nullable Expression child(String name) {
      int index = childNames.indexOf(name);
      return (index < 0) ? null : child(index);
    }

    public final ImmutableList<String> childNames() {
      return childNames;
    }

    /** True if this node's children have been moved to another node. */
    public final boolean isReleased() {
      return released;
    }

    /**
     * Replaces the child at {@code slot} with {@code replacement}, which must not already have a
     * parent. Returns the previous child, which is now detached.
     */
    @CanIgnoreReturnValue
    public final Expression replaceChild(int slot, Expression replacement) {
      Expression old = child(slot);
      if (old == replacement) {
        return old;
      }
      old.parent = null;
      old.slot = -1;
      adopt(slot, replacement);
      return old;
    }

    /** Like {@link #replaceChild(int, Expression)}, but identifies the child by identity. */
    @CanIgnoreReturnValue
    public final Expression replaceChild(Expression old, Expression replacement) {
      Preconditions.checkArgument(old.parent == this, "%s is not a child of %s", old, this);
      return replaceChild(old.slot, replacement);
    }

    /**
     * Detaches all of this node's children so that they can be given to a new owner; this node may
     * not be used afterwards.
     */
    protected final ImmutableList<Expression> releaseChildren() {
      ImmutableList<Expression> result = children();
      for (int i = 0; i < children.length; i++) {
        children[i].parent = null;
        children[i].slot = -1;
        children[i] = null;
      }
      released = true;
      return result;
    }

    private void adopt(int slot, Expression child) {
      Preconditions.checkArgument(
          child.parent == null, "%s is already owned by %s", child, child.parent);
      child.parent = this;
      child.slot = slot;
      children[slot] = child;
    }

    @Override
    public boolean mayHaveSideEffects() {
      for (int i = 0; i < numChildren(); i++) {
        if (child(i).mayHaveSideEffects()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public boolean mayRaiseException(ExceptionKind kind) {
      for (int i = 0; i < numChildren(); i++) {
        if (child(i).mayRaiseException(kind)) {
          return true;
        }
      }
      return false;
    }
  }
}
