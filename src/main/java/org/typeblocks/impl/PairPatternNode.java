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

/** A pattern {@code (FIRST, SECOND)}, matching a pair whose components match the sub-patterns. */
public final class PairPatternNode extends Node {

  public PairPatternNode(Workspace workspace) {
    super(workspace, "ppair");
    TypeVariable a = newVariable();
    TypeVariable b = newVariable();
    addInput("FIRST", new TypeTerm.Pattern(a));
    addInput("SECOND", new TypeTerm.Pattern(b));
    setOutput(new TypeTerm.Pattern(new TypeTerm.Pair(a, b)));
  }
}
