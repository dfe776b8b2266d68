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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

/**
 * {@code match INPUT with PATTERN0 -> OUTPUT0 | ... }. Each pattern must match the type of INPUT,
 * every case has the same type, and the variables bound by PATTERNi are visible in OUTPUTi.
 */
public final class MatchNode extends Node {

  private final int numCases;

  public MatchNode(Workspace workspace, int numCases) {
    super(workspace, "match");
    Preconditions.checkArgument(numCases > 0);
    this.numCases = numCases;
    TypeVariable scrutinee = newVariable();
    TypeVariable result = newVariable();
    addInput("INPUT", scrutinee);
    for (int i = 0; i < numCases; i++) {
      addInput("PATTERN" + i, new TypeTerm.Pattern(scrutinee));
      addInput("OUTPUT" + i, result);
    }
    setOutput(result);
  }

  public int numCases() {
    return numCases;
  }

  /** OUTPUTi sees the binders of the pattern attached at PATTERNi. */
  @Override
  Iterable<Binder> bindersVisibleIn(Connection input) {
    List<Binder> result = new ArrayList<>();
    if (input.name.startsWith("OUTPUT")) {
      Node pattern = getInput("PATTERN" + input.name.substring("OUTPUT".length())).targetNode();
      if (pattern != null) {
        pattern.forEachInSubtree(n -> result.addAll(n.binders));
      }
    }
    return result;
  }

  @Override
  public String defaultScopeInput() {
    return "OUTPUT0";
  }
}
