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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeException.Kind;

/**
 * Destructive unification over {@link TypeTerm}s. Binding a variable is the only way the sharing
 * structure of the term graph changes.
 *
 * <p>A Unifier created by {@link #withTrail} records every variable it writes (including the
 * writes done by path compression) so that {@link #rollback} can restore the terms to their state
 * when the Unifier was created. A sequence of {@link #unify} calls on one trailing Unifier
 * therefore behaves as a transaction. A Unifier created by {@link #withoutTrail} keeps whatever
 * it did, including the partial work of a unification that failed.
 */
public final class Unifier {

  /** If non-null, the variables written so far, in order. */
  private final @Nullable ArrayList<TypeVariable> trailVars;

  /** Parallel to {@link #trailVars}: the value each variable had before it was written. */
  private final @Nullable ArrayList<TypeTerm> trailValues;

  private Unifier(boolean trail) {
    this.trailVars = trail ? new ArrayList<>() : null;
    this.trailValues = trail ? new ArrayList<>() : null;
  }

  /** Returns a Unifier whose changes can be undone with {@link #rollback}. */
  public static Unifier withTrail() {
    return new Unifier(true);
  }

  /** Returns a Unifier that does not record its changes. */
  public static Unifier withoutTrail() {
    return new Unifier(false);
  }

  /**
   * Unifies {@code a} and {@code b} without leaving any trace; returns null if they are unifiable,
   * or the exception that {@link #unify} would have thrown.
   */
  public static @Nullable TypeException probe(TypeTerm a, TypeTerm b) {
    Unifier unifier = withTrail();
    try {
      unifier.unify(a, b);
      return null;
    } catch (TypeException e) {
      return e;
    } finally {
      unifier.rollback();
    }
  }

  /** True if {@code a} and {@code b} are unifiable. Does not change either of them. */
  public static boolean unifiable(TypeTerm a, TypeTerm b) {
    return probe(a, b) == null;
  }

  /**
   * Makes {@code a} and {@code b} equal by binding variables. When both sides are unbound
   * variables, {@code a} is bound to {@code b}.
   */
  public void unify(TypeTerm a, TypeTerm b) throws TypeException {
    a = find(a);
    b = find(b);
    if (a == b || a == TypeTerm.UNKNOWN || b == TypeTerm.UNKNOWN) {
      return;
    }
    if (a instanceof TypeVariable va) {
      bind(va, b);
      return;
    } else if (b instanceof TypeVariable vb) {
      bind(vb, a);
      return;
    }
    if (!a.sameConstructor(b)) {
      throw new TypeException(Kind.INCONSISTENT, a, b);
    }
    if (a instanceof TypeTerm.Record ra) {
      TypeTerm.Record rb = (TypeTerm.Record) b;
      if (!ImmutableSet.copyOf(ra.fieldNames()).equals(ImmutableSet.copyOf(rb.fieldNames()))) {
        throw new TypeException(Kind.ARITY_OR_SHAPE_MISMATCH, a, b);
      }
      for (String name : ra.fieldNames()) {
        unify(ra.field(name), rb.field(name));
      }
      return;
    }
    int n = a.numChildren();
    if (n != b.numChildren()) {
      throw new TypeException(Kind.ARITY_OR_SHAPE_MISMATCH, a, b);
    }
    for (int i = 0; i < n; i++) {
      unify(a.child(i), b.child(i));
    }
  }

  /**
   * Undoes every change made by this Unifier, most recent first. The Unifier may be reused
   * afterwards.
   */
  public void rollback() {
    if (trailVars == null) {
      throw new IllegalStateException("Unifier has no trail");
    }
    for (int i = trailVars.size() - 1; i >= 0; i--) {
      trailVars.get(i).value = trailValues.get(i);
    }
    trailVars.clear();
    trailValues.clear();
  }

  /** The number of variable writes recorded since creation or the last rollback. */
  int trailSize() {
    return (trailVars == null) ? 0 : trailVars.size();
  }

  /** Like {@link TypeTerm#deref}, but records its path compression on the trail. */
  private TypeTerm find(TypeTerm t) {
    if (!(t instanceof TypeVariable v) || v.value == null) {
      return t;
    }
    TypeTerm root = find(v.value);
    if (root != v.value) {
      write(v, root);
    }
    return root;
  }

  private void bind(TypeVariable v, TypeTerm t) throws TypeException {
    if (occursIn(v, t)) {
      throw new TypeException(Kind.OCCURS_CHECK, v, t);
    }
    write(v, t);
  }

  private boolean occursIn(TypeVariable v, TypeTerm t) {
    t = find(t);
    if (t == v) {
      return true;
    }
    for (int i = t.numChildren() - 1; i >= 0; i--) {
      if (occursIn(v, t.child(i))) {
        return true;
      }
    }
    return false;
  }

  private void write(TypeVariable v, TypeTerm value) {
    if (trailVars != null) {
      trailVars.add(v);
      trailValues.add(v.value);
    }
    v.value = value;
  }
}
