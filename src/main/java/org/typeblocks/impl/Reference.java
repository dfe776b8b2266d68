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

import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeException;
import org.typeblocks.types.TypeTerm;

/**
 * A Reference is a use site of a variable. Its term is its own (the type of the {@link
 * VariableNode} that holds it); while it is bound, that term is constrained to be an instance of
 * its binder's type.
 */
public final class Reference {

  final long id;

  final VariableNode node;

  private String name;

  private @Nullable Binder binder;

  /**
   * Set if the last re-inference found the constraint between this reference and its binder
   * unsatisfiable (and so dropped it).
   */
  @Nullable TypeException typeError;

  /** True if the last re-inference instantiated this reference's binder rather than sharing it. */
  boolean instantiatedPolymorphically;

  Reference(long id, VariableNode node, String name) {
    this.id = id;
    this.node = node;
    this.name = name;
  }

  public long id() {
    return id;
  }

  public String name() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  /** The node that holds this reference. */
  public VariableNode node() {
    return node;
  }

  /** This reference's own type. */
  public TypeTerm term() {
    return node.output().term();
  }

  /** The binder this reference is bound to, or null. */
  public @Nullable Binder binder() {
    return binder;
  }

  /** Only called by {@link BindingDirectory}. */
  void setBinder(@Nullable Binder binder) {
    this.binder = binder;
  }

  public boolean isBound() {
    return binder != null;
  }

  /**
   * If the constraint between this reference and its binder could not be satisfied the last time
   * its region was re-inferred, the reason; otherwise null.
   */
  public @Nullable TypeException typeError() {
    return typeError;
  }

  @Override
  public String toString() {
    return name + "#" + id;
  }
}
