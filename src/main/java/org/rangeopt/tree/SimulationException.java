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
 * Thrown when simulating a call at compile time determines that the call would raise an exception
 * at runtime.
 */
public class SimulationException extends Exception {
  private final ExceptionKind kind;

  public SimulationException(ExceptionKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /** The kind of exception the call would raise. */
  public ExceptionKind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return kind + ": " + getMessage();
  }
}
