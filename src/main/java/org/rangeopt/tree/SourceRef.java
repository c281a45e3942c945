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

/**
 * The source location an expression was created from. Does not affect any analysis, but is
 * propagated to replacement nodes so that diagnostics still point at the original code.
 */
public record SourceRef(String file, int line) {

  /** Used for expressions that don't correspond to any source (e.g. in tests). */
  public static final SourceRef INTERNAL = new SourceRef("<internal>", 0);

  @Override
  public String toString() {
    return file + ":" + line;
  }
}
