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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rangeopt.range.RangeNode.Family;
import org.rangeopt.range.RangeNode.Kind;
import org.rangeopt.tree.ConstantExpression;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.LanguageVersion;
import org.rangeopt.tree.SourceRef;
import org.rangeopt.tree.Truth;
import org.rangeopt.tree.TypeShape;
import org.rangeopt.tree.VariableRef;

@RunWith(JUnit4.class)
public class RangeNodeTest {

  private static final LanguageVersion V2 = LanguageVersion.V2_7;

  private static ConstantExpression c(Object value) {
    return new ConstantExpression(value, SourceRef.INTERNAL);
  }

  private static Long valueAt(RangeNode node, long index) {
    Expression value = node.iterationValue(index);
    return (value == null) ? null : value.integerValue();
  }

  @Test
  public void kinds() {
    assertThat(RangeNode.eager(V2, SourceRef.INTERNAL, c(1)).kind).isEqualTo(Kind.EAGER1);
    assertThat(RangeNode.eager(V2, SourceRef.INTERNAL, c(1), c(2), c(3)).kind)
        .isEqualTo(Kind.EAGER3);
    assertThat(RangeNode.lazy(V2, SourceRef.INTERNAL, c(1), c(2)).kind).isEqualTo(Kind.LAZY2);
    assertThat(Kind.of(Family.LAZY, 3)).isEqualTo(Kind.LAZY3);
    assertThat(Kind.LAZY3.arity).isEqualTo(3);
    assertThrows(IllegalArgumentException.class, () -> RangeNode.eager(V2, SourceRef.INTERNAL));
  }

  @Test
  public void eagerRequiresOlderVersion() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RangeNode.eager(LanguageVersion.V3_8, SourceRef.INTERNAL, c(1)));
    RangeNode lazy = RangeNode.lazy(LanguageVersion.V3_8, SourceRef.INTERNAL, c(1));
    assertThat(lazy.builtinSpec().name()).isEqualTo("range");
    assertThat(lazy.typeShape()).isEqualTo(TypeShape.RANGE);
  }

  @Test
  public void namedArguments() {
    ConstantExpression low = c(1);
    ConstantExpression high = c(2);
    RangeNode two = RangeNode.eager(V2, SourceRef.INTERNAL, low, high);
    assertThat(two.low()).isSameInstanceAs(low);
    assertThat(two.high()).isSameInstanceAs(high);
    assertThat(two.step()).isNull();
    assertThat(two.child("high")).isSameInstanceAs(high);
    assertThat(two.arguments()).containsExactly(low, high).inOrder();
    assertThat(two.typeShape()).isEqualTo(TypeShape.LIST);
    assertThat(two.toString()).isEqualTo("range(1, 2)");

    RangeNode one = RangeNode.lazy(V2, SourceRef.INTERNAL, c(5));
    assertThat(one.high()).isNull();
    assertThat(one.toString()).isEqualTo("xrange(5)");
  }

  @Test
  public void oneArgument() {
    RangeNode node = RangeNode.eager(V2, SourceRef.INTERNAL, c(5));
    assertThat(node.iterationLength()).isEqualTo(5L);
    assertThat(node.canPredictIterationValues()).isTrue();
    assertThat(valueAt(node, 0)).isEqualTo(0L);
    assertThat(valueAt(node, 4)).isEqualTo(4L);
    assertThat(valueAt(node, -1)).isNull();
    assertThat(valueAt(node, 6)).isNull();
    assertThat(node.truthValue()).isEqualTo(Truth.TRUE);

    RangeNode negative = RangeNode.lazy(V2, SourceRef.INTERNAL, c(-4));
    assertThat(negative.iterationLength()).isEqualTo(0L);
    assertThat(negative.truthValue()).isEqualTo(Truth.FALSE);
  }

  @Test
  public void oneArgumentAtLength() {
    // The position just past the end is still answered with its index.
    RangeNode node = RangeNode.eager(V2, SourceRef.INTERNAL, c(5));
    assertThat(valueAt(node, 5)).isEqualTo(5L);
    assertThat(valueAt(RangeNode.lazy(V2, SourceRef.INTERNAL, c(2), c(5)), 3)).isNull();
  }

  @Test
  public void twoArguments() {
    RangeNode node = RangeNode.lazy(V2, SourceRef.INTERNAL, c(2), c(5));
    assertThat(node.iterationLength()).isEqualTo(3L);
    assertThat(valueAt(node, 0)).isEqualTo(2L);
    assertThat(valueAt(node, 2)).isEqualTo(4L);
    assertThat(valueAt(node, -1)).isNull();

    RangeNode empty = RangeNode.lazy(V2, SourceRef.INTERNAL, c(5), c(2));
    assertThat(empty.iterationLength()).isEqualTo(0L);
    assertThat(empty.truthValue()).isEqualTo(Truth.FALSE);
    assertThat(valueAt(empty, 0)).isNull();
  }

  @Test
  public void threeArguments() {
    RangeNode up = RangeNode.eager(V2, SourceRef.INTERNAL, c(0), c(10), c(3));
    assertThat(up.iterationLength()).isEqualTo(4L);
    assertThat(valueAt(up, 3)).isEqualTo(9L);
    assertThat(valueAt(up, 4)).isNull();

    RangeNode down = RangeNode.eager(V2, SourceRef.INTERNAL, c(10), c(0), c(-3));
    assertThat(down.iterationLength()).isEqualTo(4L);
    assertThat(valueAt(down, 0)).isEqualTo(10L);
    assertThat(valueAt(down, 3)).isEqualTo(1L);
    assertThat(valueAt(down, 4)).isNull();

    RangeNode wrongWay = RangeNode.eager(V2, SourceRef.INTERNAL, c(0), c(10), c(-1));
    assertThat(wrongWay.iterationLength()).isEqualTo(0L);
    assertThat(wrongWay.truthValue()).isEqualTo(Truth.FALSE);
  }

  @Test
  public void zeroStep() {
    RangeNode node = RangeNode.lazy(V2, SourceRef.INTERNAL, c(0), c(10), c(0));
    assertThat(node.iterationLength()).isNull();
    assertThat(node.canPredictIterationValues()).isFalse();
    assertThat(node.iterationValue(0)).isNull();
    assertThat(node.iterationHandle()).isNull();
    assertThat(node.truthValue()).isEqualTo(Truth.UNKNOWN);
  }

  @Test
  public void unknownArguments() {
    VariableRef n = new VariableRef("n", SourceRef.INTERNAL);
    RangeNode node = RangeNode.eager(V2, SourceRef.INTERNAL, c(0), n);
    assertThat(node.iterationLength()).isNull();
    assertThat(node.iterationValue(0)).isNull();
    assertThat(node.iterationHandle()).isNull();
    assertThat(node.truthValue()).isEqualTo(Truth.UNKNOWN);
    assertThat(node.isKnownToBeIterable(null)).isTrue();
    assertThat(node.isKnownToBeIterable(3L)).isFalse();
  }

  @Test
  public void knownIterationCount() {
    RangeNode node = RangeNode.lazy(V2, SourceRef.INTERNAL, c(5));
    assertThat(node.isKnownToBeIterable(5L)).isTrue();
    assertThat(node.isKnownToBeIterable(4L)).isFalse();
  }

  @Test
  public void elementsKeepSourceRef() {
    SourceRef here = new SourceRef("loop.py", 12);
    RangeNode node = RangeNode.lazy(V2, here, c(3));
    assertThat(node.iterationValue(1).sourceRef()).isEqualTo(here);
  }

  @Test
  public void iterationHandle() {
    RangeNode node = RangeNode.eager(V2, SourceRef.INTERNAL, c(2), c(5));
    RangeIterationHandle handle = node.iterationHandle();
    assertThat(handle.length()).isEqualTo(3L);
    assertThat(handle.values().boxed().toList()).containsExactly(2L, 3L, 4L).inOrder();
    assertThat(handle.toString()).isEqualTo("range(2, 5)");
  }
}
