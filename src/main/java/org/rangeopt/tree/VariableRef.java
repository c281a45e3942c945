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
 * A read of a local variable whose value is not known at compile time. Reading it has no side
 * effects and (since locals are assumed to be assigned before use) cannot raise.
 */
public final class VariableRef extends Expression {
  public final String name;

  public VariableRef(String name, SourceRef sourceRef) {
    super(sourceRef);
    this.name = name;
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
  public String toString() {
    return name;
  }
}
