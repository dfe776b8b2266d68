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

import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import org.typeblocks.types.TypeException;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;
import org.typeblocks.types.Unifier;

/**
 * Recomputes the types of a region of the graph from scratch.
 *
 * <p>A region is the set of nodes reachable from some seed nodes through joined Connections and
 * through reference-to-binder links (in both directions). Re-inference first returns every type
 * variable that belongs to the structure of the region's nodes and binders to the unbound state
 * (a variable that was bound gets a fresh id), then replays
 *
 * <ul>
 *   <li>the joins, visiting nodes in creation order and each node's inputs in order;
 *   <li>for each reference to a binder that is not generalized, the constraint that the reference
 *       has the binder's type; and
 *   <li>for each reference to a generalized binder (in binder creation order), the constraint that
 *       the reference has a fresh instance of the binder's type.
 * </ul>
 *
 * <p>Joins always bind the child's side to the parent's, so variables shared across a join are
 * represented on the parent side. When a subtree is detached, the variables that remain above keep
 * their representative (object and id) and the detached side gets new ones.
 *
 * <p>This is how removing a join (or a binding) is undone: the types that still follow from the
 * remaining joins are recomputed, while the parts that only followed from the removed one become
 * independent variables again.
 */
final class TypeInference {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GraphContext context;

  private final boolean strict;

  private final Set<Node> region = new LinkedHashSet<>();

  private TypeInference(GraphContext context, boolean strict) {
    this.context = context;
    this.strict = strict;
  }

  /**
   * Re-infers the region containing {@code seeds}; the first constraint that cannot be satisfied
   * is thrown, leaving the region partially inferred (the caller must re-infer it again after
   * undoing the edit that led to the failure).
   */
  static void reinferStrictly(GraphContext context, Collection<Node> seeds) throws TypeException {
    new TypeInference(context, true).run(seeds);
  }

  /**
   * Re-infers the region containing {@code seeds}, dropping (and recording on the reference) any
   * binding constraint that cannot be satisfied.
   */
  static void reinferLeniently(GraphContext context, Collection<Node> seeds) {
    try {
      new TypeInference(context, false).run(seeds);
    } catch (TypeException e) {
      throw new AssertionError(e);
    }
  }

  /** Returns the region containing {@code seeds}. */
  static Set<Node> region(GraphContext context, Collection<Node> seeds) {
    TypeInference inference = new TypeInference(context, false);
    inference.collect(seeds);
    return inference.region;
  }

  /**
   * True if the binder's type should be instantiated afresh at each reference, rather than shared
   * by them.
   */
  static boolean isGeneralizable(GraphContext context, Binder binder) {
    Node owner = binder.owner();
    return context.options.letPolymorphism()
        && owner != null
        && !owner.isDisposed()
        && binder.isLive()
        && owner.generalizes(binder);
  }

  /**
   * Returns a fresh instance of {@code binder}'s type: the variables that are free in the types of
   * the binders in scope at the binder's node are shared, the others replaced.
   */
  static TypeTerm instantiate(GraphContext context, Binder binder) {
    Node owner = binder.owner();
    Set<TypeVariable> keep = Sets.newIdentityHashSet();
    if (owner != null && !owner.isDisposed()) {
      for (Binder visible : ScopeResolver.visibleBinders(owner.parentInput(), owner.workspace)) {
        if (visible != binder) {
          keep.addAll(visible.term().freeVariables());
        }
      }
    }
    return TypeTerm.instantiate(binder.term(), keep, context.supply);
  }

  /** True if the region of {@code seeds} has a reference that was (or must be) instantiated. */
  static boolean needsReinference(GraphContext context, Collection<Node> seeds) {
    for (Node n : region(context, seeds)) {
      Reference ref = n.reference();
      if (ref != null
          && ref.isBound()
          && (ref.instantiatedPolymorphically || isGeneralizable(context, ref.binder()))) {
        return true;
      }
    }
    return false;
  }

  private void collect(Collection<Node> seeds) {
    Queue<Node> queue = new ArrayDeque<>();
    for (Node seed : seeds) {
      if (!seed.isDisposed() && region.add(seed)) {
        queue.add(seed);
      }
    }
    for (Node n = queue.poll(); n != null; n = queue.poll()) {
      List<Node> neighbors = new ArrayList<>();
      Node parent = n.parent();
      if (parent != null) {
        neighbors.add(parent);
      }
      neighbors.addAll(n.children());
      forEachBinder(
          n.binders,
          b -> {
            for (Reference ref : context.directory.referencesOf(b)) {
              neighbors.add(ref.node);
            }
          });
      Reference ref = n.reference();
      if (ref != null && ref.isBound() && ref.binder().owner() != null) {
        neighbors.add(ref.binder().owner());
      }
      for (Node neighbor : neighbors) {
        if (!neighbor.isDisposed() && region.add(neighbor)) {
          queue.add(neighbor);
        }
      }
    }
  }

  static void forEachBinder(List<Binder> binders, Consumer<Binder> consumer) {
    for (Binder b : binders) {
      consumer.accept(b);
      forEachBinder(b.children, consumer);
    }
  }

  private void run(Collection<Node> seeds) throws TypeException {
    collect(seeds);
    if (region.isEmpty()) {
      return;
    }
    logger
        .at(context.options.verbose() ? Level.INFO : Level.FINE)
        .log("Re-inferring %s (%s)", region, strict ? "strict" : "lenient");
    List<Node> nodes = new ArrayList<>(region);
    nodes.sort(Comparator.comparingInt(n -> n.id));
    // Reset. A variable that is already unbound keeps its id, so a representative that survives
    // the replay is unchanged.
    for (Node n : nodes) {
      n.forEachTerm(
          t ->
              t.forEachStructuralVariable(
                  v -> {
                    if (v.isBound()) {
                      context.supply.reset(v);
                    }
                  }));
    }
    // Joins
    Unifier unifier = Unifier.withoutTrail();
    for (Node n : nodes) {
      for (Connection input : n.inputs()) {
        Connection peer = input.peer();
        if (peer != null) {
          try {
            unifier.unify(peer.term(), input.term());
          } catch (TypeException e) {
            if (strict) {
              throw e;
            }
            logger.atWarning().withCause(e).log("Join %s -> %s no longer unifies", peer, input);
          }
        }
      }
    }
    // Binding constraints
    List<Reference> monomorphic = new ArrayList<>();
    List<Reference> polymorphic = new ArrayList<>();
    for (Node n : nodes) {
      Reference ref = n.reference();
      if (ref == null) {
        continue;
      }
      ref.typeError = null;
      ref.instantiatedPolymorphically = false;
      if (ref.isBound()) {
        (isGeneralizable(context, ref.binder()) ? polymorphic : monomorphic).add(ref);
      }
    }
    for (Reference ref : monomorphic) {
      Binder binder = ref.binder();
      Node owner = binder.owner();
      // The type of a binder whose node is gone is fixed; each reference gets its own copy.
      TypeTerm bound =
          (owner == null || owner.isDisposed())
              ? TypeTerm.clone(binder.term(), context.supply)
              : binder.term();
      constrain(ref, bound);
    }
    polymorphic.sort(
        Comparator.comparingLong((Reference r) -> r.binder().id).thenComparingLong(r -> r.id));
    for (Reference ref : polymorphic) {
      ref.instantiatedPolymorphically = true;
      constrain(ref, instantiate(context, ref.binder()));
    }
  }

  private void constrain(Reference ref, TypeTerm bound) throws TypeException {
    Unifier unifier = Unifier.withTrail();
    try {
      unifier.unify(ref.term(), bound);
    } catch (TypeException e) {
      unifier.rollback();
      if (strict) {
        throw e;
      }
      logger.atWarning().log("Dropping type constraint on %s: %s", ref, e.getMessage());
      ref.typeError = e;
    }
  }
}
