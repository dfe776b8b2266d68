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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Static methods that decide which binders are in scope at a point of the graph.
 *
 * <p>A point is identified by an <i>anchor</i>: a parent-side {@link Connection} (an input or a
 * NEXT), meaning "a node attached there", or null, meaning "a top-level node of a given workspace".
 * The binders in scope at an anchor are found by walking up: at each step the anchor's node is
 * asked which binders it makes visible in that input, and the walk continues from the input its
 * node is attached to. When the walk reaches a top-level node of a workbench it continues from the
 * workbench's anchor in the enclosing workspace, so a workbench sees exactly what is in scope
 * where it was opened. Inner binders shadow outer binders with the same name.
 */
final class ScopeResolver {

  private ScopeResolver() {}

  /**
   * Returns the anchors visited by the walk from {@code anchor}, innermost first. If {@code anchor}
   * is null the walk starts at the top level of {@code workspace}.
   */
  static List<Connection> scopeChain(@Nullable Connection anchor, Workspace workspace) {
    List<Connection> result = new ArrayList<>();
    addChain(result, anchor, workspace);
    return result;
  }

  private static void addChain(List<Connection> chain, @Nullable Connection anchor, Workspace ws) {
    if (anchor != null) {
      ws = anchor.owner.workspace;
    }
    for (; ; ) {
      for (Connection c = anchor; c != null; c = c.owner.parentInput()) {
        assert c.kind.isParentSide();
        chain.add(c);
      }
      if (!ws.isWorkbench()) {
        return;
      }
      anchor = ws.anchor();
      ws = ws.parent();
    }
  }

  /** Returns the innermost binder named {@code name} made visible by one of {@code chain}. */
  private static @Nullable Binder find(List<Connection> chain, String name) {
    for (Connection c : chain) {
      for (Binder b : c.owner.bindersVisibleIn(c)) {
        if (b.name().equals(name)) {
          return b;
        }
      }
    }
    return null;
  }

  /** Returns the binder that {@code name} refers to at {@code anchor}, or null. */
  static @Nullable Binder resolve(String name, @Nullable Connection anchor, Workspace workspace) {
    return find(scopeChain(anchor, workspace), name);
  }

  /**
   * True if {@code ref} could be used at {@code anchor}: its name must be in scope there and, if it
   * is already bound, must refer to its own binder.
   */
  static boolean resolve(Reference ref, @Nullable Connection anchor) {
    Binder b = resolve(ref.name(), anchor, ref.node.workspace);
    return b != null && (!ref.isBound() || ref.binder() == b);
  }

  /**
   * Returns the binders in scope at {@code anchor}, one per name. The iteration order of the
   * result is unspecified and may differ between calls.
   */
  static Set<Binder> visibleBinders(@Nullable Connection anchor, Workspace workspace) {
    Map<String, Binder> byName = new LinkedHashMap<>();
    for (Connection c : scopeChain(anchor, workspace)) {
      for (Binder b : c.owner.bindersVisibleIn(c)) {
        byName.putIfAbsent(b.name(), b);
      }
    }
    return new HashSet<>(byName.values());
  }

  /**
   * Checks that every reference in the subtree rooted at {@code root} would be in scope if {@code
   * root} were attached at {@code anchor} (null for "left at top level"); binders declared within
   * the subtree are considered before those outside it. Returns the binder that each currently
   * unbound reference would resolve to.
   *
   * @throws ScopeException if a bound reference would not refer to its binder, or an unbound
   *     reference's name would not refer to anything
   */
  static Map<Reference, Binder> checkAttach(Node root, @Nullable Connection anchor)
      throws ScopeException {
    List<Connection> outer = scopeChain(anchor, root.workspace);
    Map<Reference, Binder> result = new LinkedHashMap<>();
    List<Node> subtree = new ArrayList<>();
    root.forEachInSubtree(subtree::add);
    for (Node n : subtree) {
      Reference ref = n.reference();
      if (ref == null) {
        continue;
      }
      List<Connection> chain = new ArrayList<>();
      for (Node m = n; m != root; m = m.parent()) {
        chain.add(m.parentInput());
      }
      chain.addAll(outer);
      Binder b = find(chain, ref.name());
      if (b == null) {
        throw new ScopeException(ScopeException.Kind.NOT_VISIBLE, ref.name(), "is not in scope");
      } else if (ref.isBound()) {
        if (ref.binder() != b) {
          throw new ScopeException(
              ScopeException.Kind.NOT_VISIBLE, ref.name(), "would not refer to " + ref.binder());
        }
      } else {
        result.put(ref, b);
      }
    }
    return result;
  }
}
