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

import org.typeblocks.types.TypeVariable;

/**
 * A top-level {@code let x = EXP1} statement; {@code x} is visible in the statements that follow
 * it (i.e. in NEXT).
 */
public final class LetStatementNode extends Node {

  public LetStatementNode(Workspace workspace, String name) {
    super(workspace, "let-stmt");
    setPrevious();
    addNext();
    TypeVariable value = newVariable();
    addInput("EXP1", value);
    declare("NEXT", value, name);
  }

  @Override
  public String defaultScopeInput() {
    return "NEXT";
  }

  /** The variable's type is generalized when its value is a function. */
  @Override
  boolean generalizes(Binder binder) {
    return getInput("EXP1").targetNode() instanceof LambdaNode;
  }
}
