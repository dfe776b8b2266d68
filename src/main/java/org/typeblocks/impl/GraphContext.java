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

import org.typeblocks.types.VariableSupply;

/** The state shared by a main workspace and all of its workbenches. */
final class GraphContext {

  final Workspace.Options options;

  final BindingDirectory directory = new BindingDirectory();

  final VariableSupply supply = new VariableSupply();

  private int nextNodeId;

  GraphContext(Workspace.Options options) {
    this.options = options;
  }

  int newNodeId() {
    return nextNodeId++;
  }
}
