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

import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

/** {@code fun x -> RETURN}; the argument {@code x} is visible in RETURN. */
public final class LambdaNode extends Node {

  public LambdaNode(Workspace workspace, String argName) {
    super(workspace, "fun");
    TypeVariable arg = newVariable();
    TypeVariable result = newVariable();
    addInput("RETURN", result);
    setOutput(new TypeTerm.Function(arg, result));
    declare("RETURN", arg, argName);
  }

  @Override
  public String defaultScopeInput() {
    return "RETURN";
  }
}
