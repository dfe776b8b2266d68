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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

/**
 * {@code let x a1 ... an = EXP1 in EXP2}. The arguments are visible in EXP1 and {@code x} is
 * visible in EXP2; the type of {@code x} is {@code a1 -> ... -> an -> v}, where {@code v} is the
 * type of EXP1. The number of arguments is fixed when the node is created.
 *
 * <p>If the let has arguments, or EXP1 is a function, the type of {@code x} is generalized: each
 * reference to it gets its own instance.
 */
public final class LetNode extends Node {

  private final Binder variable;

  private final ImmutableList<Binder> args;

  public LetNode(Workspace workspace, String name, String... argNames) {
    super(workspace, "let");
    TypeVariable value = newVariable();
    TypeVariable body = newVariable();
    addInput("EXP1", value);
    addInput("EXP2", body);
    setOutput(body);
    List<TypeVariable> argTypes = new ArrayList<>();
    TypeTerm varType = value;
    for (int i = argNames.length - 1; i >= 0; i--) {
      TypeVariable a = newVariable();
      argTypes.add(0, a);
      varType = new TypeTerm.Function(a, varType);
    }
    variable = declare("EXP2", varType, name);
    ImmutableList.Builder<Binder> builder = ImmutableList.builder();
    for (int i = 0; i < argNames.length; i++) {
      builder.add(declare("EXP1", argTypes.get(i), argNames[i]));
    }
    args = builder.build();
  }

  /** The binder for the variable this let introduces. */
  public Binder variable() {
    return variable;
  }

  public ImmutableList<Binder> args() {
    return args;
  }

  @Override
  public String defaultScopeInput() {
    return "EXP2";
  }

  @Override
  boolean generalizes(Binder binder) {
    return binder == variable
        && (!args.isEmpty() || getInput("EXP1").targetNode() instanceof LambdaNode);
  }
}
