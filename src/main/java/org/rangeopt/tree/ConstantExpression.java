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
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.util.StringUtil;

/**
 * A reference to a compile-time constant. Integers are always represented as Longs; other supported
 * values are Doubles, Booleans, Strings, Lists of constants, and implementations of {@link Shaped}.
 */
public final class ConstantExpression extends Expression {

  /**
   * Implemented by constant values that don't have a standard Java representation (e.g. a range
   * descriptor), so that their shape and length can still be used by the analysis.
   */
  public interface Shaped {
    TypeShape typeShape();

    /** The number of elements produced by iterating over this value. */
    long length();

    /** A handle on this value's elements, or null if they aren't integers known in advance. */
    default @Nullable IterationHandle iterationHandle() {
      return null;
    }
  }

  private final Object constant;

  public ConstantExpression(Object constant, SourceRef sourceRef) {
    super(sourceRef);
    this.constant = normalize(constant);
  }

  /**
   * Returns a new constant expression for {@code constant} that replaces (or describes an element
   * of) {@code node}; it inherits {@code node}'s source reference.
   */
  public static ConstantExpression replacementFor(Object constant, Expression node) {
    return new ConstantExpression(constant, node.sourceRef());
  }

  private static Object normalize(Object constant) {
    Preconditions.checkNotNull(constant);
    if (constant instanceof Integer || constant instanceof Short || constant instanceof Byte) {
      return ((Number) constant).longValue();
    }
    return constant;
  }

  public Object constant() {
    return constant;
  }

  @Override
  public boolean isConstantRef() {
    return true;
  }

  @Override
  public boolean isCompileTimeConstant() {
    return true;
  }

  @Override
  public boolean mayHaveSideEffects() {
    return false;
  }

  @Override
  public boolean mayRaiseException(ExceptionKind kind) {
    return false;
  }

  @Override
  public @Nullable Long integerValue() {
    if (constant instanceof Long l) {
      return l;
    } else if (constant instanceof Boolean b) {
      // Booleans are integers in the source language.
      return b ? 1L : 0L;
    }
    return null;
  }

  @Override
  public TypeShape typeShape() {
    if (constant instanceof Long) {
      return TypeShape.INT;
    } else if (constant instanceof Double) {
      return TypeShape.FLOAT;
    } else if (constant instanceof Boolean) {
      return TypeShape.BOOL;
    } else if (constant instanceof String) {
      return TypeShape.STR;
    } else if (constant instanceof List) {
      return TypeShape.LIST;
    } else if (constant instanceof Shaped shaped) {
      return shaped.typeShape();
    }
    return TypeShape.UNKNOWN;
  }

  @Override
  public Truth truthValue() {
    if (constant instanceof Long l) {
      return Truth.of(l != 0);
    } else if (constant instanceof Double d) {
      return Truth.of(d != 0);
    } else if (constant instanceof Boolean b) {
      return Truth.of(b);
    }
    Long length = iterationLength();
    return (length == null) ? Truth.UNKNOWN : Truth.of(length > 0);
  }

  @Override
  public @Nullable Long iterationLength() {
    if (constant instanceof String s) {
      return (long) s.length();
    } else if (constant instanceof List<?> list) {
      return (long) list.size();
    } else if (constant instanceof Shaped shaped) {
      return shaped.length();
    }
    return null;
  }

  @Override
  public boolean canPredictIterationValues() {
    return constant instanceof List || iterationHandle() != null;
  }

  @Override
  public @Nullable Expression iterationValue(long index) {
    if (constant instanceof List<?> list) {
      return (index >= 0 && index < list.size())
          ? replacementFor(list.get((int) index), this)
          : null;
    }
    IterationHandle handle = iterationHandle();
    Long value = (handle == null) ? null : handle.valueAt(index);
    return (value == null) ? null : replacementFor(value, this);
  }

  @Override
  public @Nullable IterationHandle iterationHandle() {
    return (constant instanceof Shaped shaped) ? shaped.iterationHandle() : null;
  }

  @Override
  public boolean isKnownToBeIterable(@Nullable Long count) {
    Long length = iterationLength();
    return length != null && (count == null || count.equals(length));
  }

  @Override
  public String toString() {
    if (constant instanceof String s) {
      return StringUtil.escape(s);
    } else if (constant instanceof List<?> list) {
      return StringUtil.joinElements("[", "]", list.size(), list::get);
    } else if (constant instanceof Boolean b) {
      return b ? "True" : "False";
    }
    return String.valueOf(constant);
  }
}
