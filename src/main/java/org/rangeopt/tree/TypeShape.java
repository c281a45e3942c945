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

/** What is statically known about the runtime type of an expression's value. */
public enum TypeShape {
  INT,
  FLOAT,
  BOOL,
  STR,
  /** A materialized, ordered sequence (the result of the eager range builtin). */
  LIST,
  /** A non-materialized range descriptor (the result of the lazy range builtin). */
  RANGE,
  UNKNOWN
}
