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

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rangeopt.tree.ChangeTag;
import org.rangeopt.tree.ComputeResult;
import org.rangeopt.tree.ConstantExpression;
import org.rangeopt.tree.IterationExpression;
import org.rangeopt.tree.LanguageVersion;
import org.rangeopt.tree.SourceRef;
import org.rangeopt.tree.TraceCollection;
import org.rangeopt.tree.VariableRef;

@RunWith(JUnit4.class)
public class StrengthReductionTest {

  private static final String DESCRIPTION =
      "Replaced 'range' with 'xrange' built-in call for iteration.";

  private TraceCollection traceCollection;

  @Before
  public void setup() {
    traceCollection = new TraceCollection();
    traceCollection.verbose = true;
  }

  private static ConstantExpression c(Object value) {
    return new ConstantExpression(value, SourceRef.INTERNAL);
  }

  @Test
  public void largeRangeBecomesLazy() {
    SourceRef here = new SourceRef("loop.py", 2);
    ConstantExpression low = c(0);
    ConstantExpression high = c(1000);
    RangeNode node = RangeNode.eager(LanguageVersion.V2_7, here, low, high);
    IterationExpression iter = new IterationExpression(node, SourceRef.INTERNAL);

    ComputeResult result = iter.computeExpression(traceCollection);

    assertThat(result.tag()).isEqualTo(ChangeTag.NEW_EXPRESSION);
    assertThat(result.description()).isEqualTo(DESCRIPTION);
    assertThat(result.expression()).isSameInstanceAs(iter);
    RangeNode lazy = (RangeNode) iter.source();
    assertThat(lazy.kind).isEqualTo(RangeNode.Kind.LAZY2);
    assertThat(lazy.arguments()).containsExactly(low, high).inOrder();
    assertThat(lazy.sourceRef()).isEqualTo(here);
    assertThat(lazy.iterationLength()).isEqualTo(1000L);
    assertThat(node.isReleased()).isTrue();
    assertThat(node.parent()).isNull();
    assertThat(node.toString()).isEqualTo("range(<moved>)");
    assertThat(iter.toString()).isEqualTo("iter(xrange(0, 1000))");
    assertThat(traceCollection.changes()).containsExactly(DESCRIPTION);
  }

  @Test
  public void threeArgumentRangeBecomesLazy() {
    ConstantExpression low = c(0);
    ConstantExpression high = c(3000);
    ConstantExpression step = c(3);
    RangeNode node = RangeNode.eager(LanguageVersion.V2_7, SourceRef.INTERNAL, low, high, step);
    IterationExpression iter = new IterationExpression(node, SourceRef.INTERNAL);

    ComputeResult result = iter.computeExpression(traceCollection);

    assertThat(result.tag()).isEqualTo(ChangeTag.NEW_EXPRESSION);
    RangeNode lazy = (RangeNode) iter.source();
    assertThat(lazy.kind).isEqualTo(RangeNode.Kind.LAZY3);
    assertThat(lazy.arguments()).containsExactly(low, high, step).inOrder();
    assertThat(lazy.step()).isSameInstanceAs(step);
    assertThat(step.parent()).isSameInstanceAs(lazy);
    assertThat(lazy.iterationLength()).isEqualTo(1000L);
    assertThat(iter.toString()).isEqualTo("iter(xrange(0, 3000, 3))");
  }

  @Test
  public void threshold() {
    IterationExpression atThreshold =
        new IterationExpression(
            RangeNode.eager(LanguageVersion.V2_7, SourceRef.INTERNAL, c(256)),
            SourceRef.INTERNAL);
    assertThat(atThreshold.computeExpression(traceCollection).changed()).isFalse();

    IterationExpression overThreshold =
        new IterationExpression(
            RangeNode.eager(LanguageVersion.V2_7, SourceRef.INTERNAL, c(10), c(267)),
            SourceRef.INTERNAL);
    assertThat(overThreshold.computeExpression(traceCollection).changed()).isTrue();
  }

  @Test
  public void smallRangeIsUnchanged() {
    RangeNode node = RangeNode.eager(LanguageVersion.V2_7, SourceRef.INTERNAL, c(10));
    IterationExpression iter = new IterationExpression(node, SourceRef.INTERNAL);

    ComputeResult result = iter.computeExpression(traceCollection);

    assertThat(result.changed()).isFalse();
    assertThat(iter.source()).isSameInstanceAs(node);
    assertThat(traceCollection.mayExitByException()).isFalse();
  }

  @Test
  public void unknownLengthIsUnchanged() {
    VariableRef n = new VariableRef("n", SourceRef.INTERNAL);
    RangeNode node = RangeNode.eager(LanguageVersion.V2_7, SourceRef.INTERNAL, n);
    IterationExpression iter = new IterationExpression(node, SourceRef.INTERNAL);

    assertThat(iter.computeExpression(traceCollection).changed()).isFalse();
    assertThat(iter.source()).isSameInstanceAs(node);
  }

  @Test
  public void lazyRangeIsUnchanged() {
    RangeNode node = RangeNode.lazy(LanguageVersion.V2_7, SourceRef.INTERNAL, c(100_000));
    IterationExpression iter = new IterationExpression(node, SourceRef.INTERNAL);

    assertThat(iter.computeExpression(traceCollection).changed()).isFalse();
    assertThat(iter.source()).isSameInstanceAs(node);
    assertThat(traceCollection.changes()).isEmpty();
  }
}
