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

package org.typeblocks.impl;

/** A use of a variable: a node whose output is the type of the {@link Reference} it holds. */
public final class VariableNode extends Node {

  private final Reference reference;

  /** Creates a top-level node with an unbound reference named {@code name}. */
  public VariableNode(Workspace workspace, String name) {
    super(workspace, "var");
    setOutput(newVariable());
    reference = workspace.registerReference(this, name);
  }

  @Override
  public Reference reference() {
    return reference;
  }

  @Override
  public String toString() {
    return super.toString() + "(" + reference.name() + ")";
  }
}
