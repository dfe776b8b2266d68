/*
 * Copyright 2025 The Typeblocks Authors
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

package org.typeblocks.types;

/**
 * Allocates type variables for one graph. Each graph (a workspace together with all of its
 * workbenches) has its own supply, so independent graphs never share variable ids.
 *
 * <p>A VariableSupply is also the only way to return a variable to the unbound state; see {@link
 * #reset}.
 */
public final class VariableSupply {

  private int nextId;

  /** Returns a new unbound variable. */
  public TypeVariable newVariable() {
    return new TypeVariable(nextId++);
  }

  /**
   * Unbinds {@code v} and gives it a fresh id. Callers are responsible for ensuring that every
   * binding that depended on {@code v} is either also reset or replayed afterwards; this is only
   * used when re-inferring a region of the graph from scratch.
   */
  public void reset(TypeVariable v) {
    v.reset(nextId++);
  }

  /** The number of ids handed out so far. */
  public int numAllocated() {
    return nextId;
  }
}
