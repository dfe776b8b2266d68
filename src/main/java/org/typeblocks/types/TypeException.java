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

/**
 * Thrown when two terms cannot be unified. The structural edit that required the unification
 * should not take effect.
 */
public class TypeException extends Exception {

  /** The reasons unification can fail. */
  public enum Kind {
    /** Two different constructors, e.g. {@code int} and {@code bool}. */
    INCONSISTENT,
    /** Binding a variable would create an infinite type. */
    OCCURS_CHECK,
    /** Same constructor, but record fields or argument counts differ. */
    ARITY_OR_SHAPE_MISMATCH
  }

  public final Kind kind;

  /** The pair of (dereferenced) terms on which unification failed. */
  public final TypeTerm left;

  public final TypeTerm right;

  public TypeException(Kind kind, TypeTerm left, TypeTerm right) {
    super(String.format("%s: %s vs %s", kind, left, right));
    this.kind = kind;
    this.left = left;
    this.right = right;
  }
}
