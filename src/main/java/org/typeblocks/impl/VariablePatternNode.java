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

/**
 * A pattern that matches anything and binds it to a variable. The variable is visible in the
 * output of the match case that the pattern belongs to (see {@link MatchNode}).
 */
public final class VariablePatternNode extends Node {

  public VariablePatternNode(Workspace workspace, String name) {
    super(workspace, "pvar");
    TypeVariable a = newVariable();
    setOutput(new TypeTerm.Pattern(a));
    declare(null, a, name);
  }
}
