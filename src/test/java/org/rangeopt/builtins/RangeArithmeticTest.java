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

package org.rangeopt.builtins;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RangeArithmeticTest {

  @Test
  public void lengthOfStop() {
    assertThat(RangeArithmetic.length(5)).isEqualTo(5L);
    assertThat(RangeArithmetic.length(0)).isEqualTo(0L);
    assertThat(RangeArithmetic.length(-3)).isEqualTo(0L);
  }

  @Test
  public void lengthOfStartStop() {
    assertThat(RangeArithmetic.length(2, 7)).isEqualTo(5L);
    assertThat(RangeArithmetic.length(7, 2)).isEqualTo(0L);
    assertThat(RangeArithmetic.length(0, Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
    assertThat(RangeArithmetic.length(Long.MIN_VALUE, Long.MAX_VALUE)).isNull();
  }

  @Test
  public void lengthWithStep() {
    assertThat(RangeArithmetic.length(0, 10, 3)).isEqualTo(4L);
    assertThat(RangeArithmetic.length(0, 9, 3)).isEqualTo(3L);
    assertThat(RangeArithmetic.length(10, 0, -3)).isEqualTo(4L);
    assertThat(RangeArithmetic.length(0, 10, -1)).isEqualTo(0L);
    assertThat(RangeArithmetic.length(10, 0, 1)).isEqualTo(0L);
    assertThat(RangeArithmetic.length(5, 5, 1)).isEqualTo(0L);
    assertThat(RangeArithmetic.length(0, 10, 0)).isNull();
    assertThat(RangeArithmetic.length(Long.MIN_VALUE, Long.MAX_VALUE, 3))
        .isEqualTo(6148914691236517205L);
    assertThat(RangeArithmetic.length(Long.MIN_VALUE, Long.MAX_VALUE, 2)).isNull();
    assertThat(RangeArithmetic.length(Long.MIN_VALUE, Long.MAX_VALUE, 1)).isNull();
  }

  @Test
  public void element() {
    assertThat(RangeArithmetic.element(0, 10, 3, 3)).isEqualTo(9L);
    assertThat(RangeArithmetic.element(0, 10, 3, 4)).isNull();
    assertThat(RangeArithmetic.element(10, 0, -3, 3)).isEqualTo(1L);
    assertThat(RangeArithmetic.element(10, 0, -3, 4)).isNull();
    assertThat(RangeArithmetic.element(0, 10, 1, -1)).isNull();
    assertThat(RangeArithmetic.element(0, 10, 0, 0)).isNull();
    assertThat(RangeArithmetic.element(Long.MAX_VALUE - 1, Long.MAX_VALUE, 1, 0))
        .isEqualTo(Long.MAX_VALUE - 1);
    assertThat(RangeArithmetic.element(0, Long.MAX_VALUE, Long.MAX_VALUE, 1)).isNull();
  }
}
