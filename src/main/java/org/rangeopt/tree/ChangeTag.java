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

/** Identifies the kind of change reported by a {@link ComputeResult}. */
public enum ChangeTag {
  /** The node was replaced by a constant. */
  NEW_CONSTANT("new_constant"),
  /** The tree structure changed; the optimizer should revisit the result. */
  NEW_EXPRESSION("new_expression");

  public final String tag;

  ChangeTag(String tag) {
    this.tag = tag;
  }

  @Override
  public String toString() {
    return tag;
  }
}
