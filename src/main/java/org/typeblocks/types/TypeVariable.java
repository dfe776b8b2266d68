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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A type variable: unbound when {@link #value} is null, otherwise bound to (forwarding to) another
 * term. Variables are created by a {@link VariableSupply}, bound only by {@link Unifier}, and
 * returned to the unbound state only by {@link VariableSupply#reset}.
 */
public final class TypeVariable extends TypeTerm {

  /** Distinguishes variables when printing; reassigned each time the variable is reset. */
  private int id;

  /**
   * Null if this variable is unbound, otherwise the term it has been bound to. Written by {@link
   * Unifier}, by {@link VariableSupply#reset}, and by path compression in {@link #deref}.
   */
  @Nullable TypeTerm value;

  TypeVariable(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  /** True if this variable has been bound to another term. */
  public boolean isBound() {
    return value != null;
  }

  /** The term this variable is directly bound to, or null if it is unbound. */
  public @Nullable TypeTerm value() {
    return value;
  }

  @Override
  public TypeTerm deref() {
    if (value == null) {
      return this;
    }
    TypeTerm result = value.deref();
    if (result != value) {
      value = result;
    }
    return result;
  }

  void reset(int newId) {
    value = null;
    id = newId;
  }

  @Override
  TypeTerm withChildren(List<TypeTerm> children) {
    throw new AssertionError();
  }

  @Override
  void appendTo(StringBuilder sb, int prec) {
    TypeTerm t = follow(this);
    if (t != this) {
      t.appendTo(sb, prec);
    } else {
      sb.append("'t").append(id);
    }
  }
}
