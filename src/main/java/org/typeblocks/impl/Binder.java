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
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeTerm;

/**
 * A Binder is a declaration site: a name with a type, declared by a node and visible to the nodes
 * attached below one of that node's inputs.
 *
 * <p>A Binder does not know its references; the {@link BindingDirectory} of its graph holds that
 * association and is the only code that changes a Binder's state.
 */
public final class Binder {

  /** See {@link BindingDirectory#dispose}. */
  public enum State {
    LIVE,
    PENDING_DELETION,
    DISPOSED
  }

  final long id;

  private String name;

  private @Nullable TypeTerm term;

  private @Nullable Node owner;

  /** The name of the owner's input in which this binder is visible, or null. */
  final @Nullable String scopeInput;

  /** The enclosing compound binder, if any. */
  final @Nullable Binder parent;

  /** For compound declarations (e.g. the fields of a record), the component binders. */
  final List<Binder> children = new ArrayList<>();

  State state = State.LIVE;

  Binder(
      long id,
      String name,
      TypeTerm term,
      Node owner,
      @Nullable String scopeInput,
      @Nullable Binder parent) {
    this.id = id;
    this.name = name;
    this.term = term;
    this.owner = owner;
    this.scopeInput = scopeInput;
    this.parent = parent;
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

  /** This binder's type; fails if the binder has been disposed. */
  public TypeTerm term() {
    if (term == null) {
      throw new IllegalStateException(this + " is disposed");
    }
    return term;
  }

  /**
   * Replaces the term of this binder. Only used by nodes whose declared type is rebuilt from their
   * components (e.g. a record definition after its fields change); the caller must re-infer.
   */
  void replaceTerm(TypeTerm term) {
    assert state != State.DISPOSED;
    this.term = term;
  }

  /** The node that declared this binder; null once it has been disposed. */
  public @Nullable Node owner() {
    return owner;
  }

  public @Nullable String scopeInput() {
    return scopeInput;
  }

  public @Nullable Binder parent() {
    return parent;
  }

  public ImmutableList<Binder> children() {
    return ImmutableList.copyOf(children);
  }

  public State state() {
    return state;
  }

  public boolean isLive() {
    return state == State.LIVE;
  }

  /** Releases this binder's term and owner; called only by {@link BindingDirectory}. */
  void release() {
    state = State.DISPOSED;
    term = null;
    owner = null;
  }

  @Override
  public String toString() {
    return name + "@" + id;
  }
}
