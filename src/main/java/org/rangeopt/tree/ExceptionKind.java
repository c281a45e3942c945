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
 * The runtime exception classes that the analysis distinguishes. {@link #BASE_EXCEPTION} is used
 * when nothing more precise is known.
 */
public enum ExceptionKind {
  BASE_EXCEPTION("BaseException"),
  TYPE_ERROR("TypeError"),
  VALUE_ERROR("ValueError"),
  OVERFLOW_ERROR("OverflowError");

  /** The name of the corresponding runtime class. */
  public final String runtimeName;

  ExceptionKind(String runtimeName) {
    this.runtimeName = runtimeName;
  }

  @Override
  public String toString() {
    return runtimeName;
  }
}
