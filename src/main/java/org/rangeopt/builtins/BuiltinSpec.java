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

import java.util.List;
import org.rangeopt.tree.Expression;
import org.rangeopt.tree.SimulationException;

/** Decides whether a call to a builtin can be evaluated at compile time, and if so evaluates it. */
public interface BuiltinSpec {

  /** The builtin's name; used only in diagnostics. */
  String name();

  /**
   * True if a call with the given arguments is safe to evaluate at compile time (its result, or the
   * exception it raises, is fully determined and reasonably small).
   */
  boolean isCompileTimeComputable(List<? extends Expression> args);

  /**
   * Returns the value of a call with the given arguments. Should only be called if {@link
   * #isCompileTimeComputable} returned true.
   *
   * @throws SimulationException if the call would raise
   */
  Object simulateCall(List<? extends Expression> args) throws SimulationException;
}
