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
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeException;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.Unifier;
import org.typeblocks.util.StringUtil;

/**
 * A Workspace holds a graph of {@link Node}s and is the entry point for every edit of it.
 *
 * <p>A main workspace (created with one of the public constructors) may have any number of
 * <i>workbenches</i>: workspaces opened at an input of one of its nodes, in which nodes can be
 * built and edited separately but may only refer to the variables in scope at that input. A
 * workbench may itself have workbenches. A main workspace and all of its workbenches share one
 * {@link BindingDirectory} and one supply of type variables; nodes can only be joined to nodes in
 * the same workspace.
 *
 * <p>Each edit either takes effect completely or throws without changing the graph. Workspaces are
 * not thread-safe.
 */
public final class Workspace {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Settings for a graph; shared by a main workspace and its workbenches. */
  public static final class Options {
    public static final Options DEFAULT = builder().build();

    private final boolean letPolymorphism;
    private final boolean verbose;

    private Options(Builder builder) {
      this.letPolymorphism = builder.letPolymorphism;
      this.verbose = builder.verbose;
    }

    /**
     * If true (the default), the variable introduced by a let whose value is a function (or which
     * has arguments) has a type that is instantiated independently at each reference.
     */
    public boolean letPolymorphism() {
      return letPolymorphism;
    }

    /** If true, re-inference is logged at INFO rather than FINE. */
    public boolean verbose() {
      return verbose;
    }

    public static Builder builder() {
      return new Builder();
    }

    /** Builds an Options. */
    public static final class Builder {
      private boolean letPolymorphism = true;
      private boolean verbose;

      private Builder() {}

      @CanIgnoreReturnValue
      public Builder setLetPolymorphism(boolean letPolymorphism) {
        this.letPolymorphism = letPolymorphism;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }

  final GraphContext context;

  /** Null for a main workspace. */
  private final @Nullable Workspace parent;

  /** For a workbench, the input of a node in {@link #parent} at which it was opened. */
  private final @Nullable Connection anchor;

  private final Set<Node> nodes = new LinkedHashSet<>();

  private final List<Workspace> workbenches = new ArrayList<>();

  private boolean disposed;

  public Workspace() {
    this(Options.DEFAULT);
  }

  public Workspace(Options options) {
    this(new GraphContext(options), null, null);
  }

  private Workspace(
      GraphContext context, @Nullable Workspace parent, @Nullable Connection anchor) {
    this.context = context;
    this.parent = parent;
    this.anchor = anchor;
  }

  public Options options() {
    return context.options;
  }

  public BindingDirectory directory() {
    return context.directory;
  }

  public boolean isWorkbench() {
    return parent != null;
  }

  /** The workspace this workbench was opened from; null for a main workspace. */
  public @Nullable Workspace parent() {
    return parent;
  }

  /** The input this workbench was opened at; null for a main workspace. */
  public @Nullable Connection anchor() {
    return anchor;
  }

  public ImmutableList<Workspace> workbenches() {
    return ImmutableList.copyOf(workbenches);
  }

  public boolean isDisposed() {
    return disposed;
  }

  /** Every node in this workspace that has not been disposed. */
  public ImmutableList<Node> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  /** The nodes in this workspace that are not attached to another node. */
  public ImmutableList<Node> topLevelNodes() {
    return nodes.stream()
        .filter(n -> n.parentInput() == null)
        .collect(ImmutableList.toImmutableList());
  }

  int addNode(Node node) {
    checkLive();
    nodes.add(node);
    return context.newNodeId();
  }

  private void checkLive() {
    Preconditions.checkState(!disposed, "Workspace has been disposed");
  }

  private Level traceLevel() {
    return context.options.verbose() ? Level.INFO : Level.FINE;
  }

  /**
   * Opens a workbench at the named input of {@code node} (which must be in this workspace). Nodes
   * created in the workbench see the variables in scope at that input.
   */
  public Workspace newWorkbench(Node node, String inputName) {
    checkLive();
    Preconditions.checkArgument(
        node.workspace == this && !node.isDisposed(), "%s is not here", node);
    Connection input = node.getInput(inputName);
    Preconditions.checkArgument(input.kind.isParentSide());
    Workspace result = new Workspace(context, this, input);
    workbenches.add(result);
    logger.at(traceLevel()).log("Opened workbench at %s", input);
    return result;
  }

  /** Opens a workbench at the input in which {@code node}'s variables are visible. */
  public Workspace newWorkbench(Node node) {
    String input = node.defaultScopeInput();
    Preconditions.checkArgument(input != null, "%s declares no variables", node);
    return newWorkbench(node, input);
  }

  /**
   * Attaches the node owning {@code childSlot} to {@code parentSlot}.
   *
   * <p>Every reference in the attached subtree must be in scope at its new position: references
   * that are already bound must still refer to their binders, and unbound references are bound to
   * the binder their name refers to there. The types of the two slots are unified, as are those of
   * newly bound references and their binders.
   *
   * @throws ScopeException if a reference would be out of scope
   * @throws TypeException if the types are inconsistent; the graph is unchanged
   */
  public void connect(Connection parentSlot, Connection childSlot)
      throws TypeException, ScopeException {
    checkLive();
    Preconditions.checkArgument(
        parentSlot.kind.isParentSide() && childSlot.kind == parentSlot.kind.partner(),
        "Can't connect %s to %s",
        childSlot,
        parentSlot);
    Preconditions.checkArgument(
        parentSlot.owner.workspace == this && childSlot.owner.workspace == this,
        "%s and %s must both be in this workspace",
        parentSlot,
        childSlot);
    Node child = childSlot.owner;
    Node parentNode = parentSlot.owner;
    Preconditions.checkArgument(!child.isDisposed() && !parentNode.isDisposed());
    Preconditions.checkState(
        !parentSlot.isConnected() && !childSlot.isConnected(), "Already connected");
    Preconditions.checkArgument(
        !parentNode.isAncestorOrSelf(child), "Connecting %s would make a cycle", childSlot);
    Map<Reference, Binder> newlyBound = ScopeResolver.checkAttach(child, parentSlot);
    Unifier unifier = Unifier.withTrail();
    try {
      // The child's variables are bound to the parent's, so shared representatives stay above.
      unifier.unify(childSlot.term(), parentSlot.term());
      for (Map.Entry<Reference, Binder> entry : newlyBound.entrySet()) {
        if (!TypeInference.isGeneralizable(context, entry.getValue())) {
          unifier.unify(entry.getKey().term(), entry.getValue().term());
        }
      }
    } catch (TypeException e) {
      unifier.rollback();
      logger.at(traceLevel()).log("Rejected %s -> %s: %s", childSlot, parentSlot, e.getMessage());
      throw e;
    }
    parentSlot.link(childSlot);
    newlyBound.forEach((ref, binder) -> context.directory.addReference(binder, ref));
    logger.at(traceLevel()).log("Connected %s -> %s", childSlot, parentSlot);
    reinferOrRevert(
        List.of(child),
        () -> {
          childSlot.unlink();
          newlyBound.forEach((ref, binder) -> context.directory.removeReference(binder, ref));
        },
        List.of(child, parentNode));
  }

  /**
   * If the region of {@code seeds} depends on instantiated types, re-infers it. If that fails,
   * runs {@code undo}, re-infers the region of {@code undoSeeds}, and rethrows.
   */
  private void reinferOrRevert(List<Node> seeds, Runnable undo, List<Node> undoSeeds)
      throws TypeException {
    if (!TypeInference.needsReinference(context, seeds)) {
      return;
    }
    try {
      TypeInference.reinferStrictly(context, seeds);
    } catch (TypeException e) {
      undo.run();
      TypeInference.reinferLeniently(context, undoSeeds);
      logger.at(traceLevel()).log("Reverted edit: %s", e.getMessage());
      throw e;
    }
  }

  /**
   * Detaches {@code slot} (either side of a join) from its peer. Types that only followed from
   * the join are forgotten; references stay bound to their binders.
   */
  public void disconnect(Connection slot) {
    checkLive();
    Connection peer = slot.peer();
    Preconditions.checkState(peer != null, "%s is not connected", slot);
    slot.unlink();
    logger.at(traceLevel()).log("Disconnected %s from %s", slot, peer);
    TypeInference.reinferLeniently(context, List.of(slot.owner, peer.owner));
  }

  /**
   * Declares a new binder on {@code owner}, visible to nodes attached below {@code scopeInput}
   * (or nowhere, if it is null).
   */
  public Binder newBinder(Node owner, @Nullable String scopeInput, TypeTerm term, String name) {
    checkLive();
    Preconditions.checkArgument(StringUtil.isValidVariableName(name), "Bad name: %s", name);
    Preconditions.checkArgument(owner.workspace.context == context && !owner.isDisposed());
    return context.directory.newBinder(owner, scopeInput, term, name, null);
  }

  /** Declares a component of the compound binder {@code parent}. */
  Binder newChildBinder(Binder parent, TypeTerm term, String name) {
    Preconditions.checkArgument(StringUtil.isValidVariableName(name), "Bad name: %s", name);
    return context.directory.newBinder(parent.owner(), null, term, name, parent);
  }

  /**
   * Disposes {@code binder}, or (if it still has references) arranges for it to be disposed when
   * its last reference goes away.
   */
  public void disposeBinder(Binder binder) {
    context.directory.dispose(binder);
  }

  /** Creates an unbound reference, held by a new top-level {@link VariableNode} here. */
  public Reference newReference(String name) {
    Preconditions.checkArgument(StringUtil.isValidVariableName(name), "Bad name: %s", name);
    return new VariableNode(this, name).reference();
  }

  Reference registerReference(VariableNode node, String name) {
    return context.directory.newReference(node, name);
  }

  /**
   * Binds {@code ref} to {@code binder}, replacing any previous binding; the reference takes the
   * binder's name. If the reference is attached to another node, or is in a workbench, the binder
   * must be the one that the binder's name refers to at the reference's position.
   *
   * @throws ScopeException if the binder is not in scope; nothing is changed
   * @throws TypeException if the types are inconsistent; nothing is changed
   */
  public void bind(Reference ref, Binder binder) throws ScopeException, TypeException {
    checkLive();
    VariableNode node = ref.node;
    Preconditions.checkArgument(node.workspace.context == context && !node.isDisposed());
    if (binder.state != Binder.State.LIVE) {
      throw new DirectoryException(
          DirectoryException.Kind.BINDER_DELETING, "Can't bind to " + binder);
    }
    if (ref.binder() == binder) {
      return;
    }
    if (node.parentInput() != null || node.workspace.isWorkbench()) {
      if (ScopeResolver.resolve(binder.name(), node.parentInput(), node.workspace) != binder) {
        throw new ScopeException(
            ScopeException.Kind.NOT_VISIBLE, binder.name(), "is not in scope at " + node);
      }
    }
    Binder previous = ref.binder();
    List<Node> seeds = seedsForBinding(node, previous);
    if (previous != null) {
      // A binder pending deletion must survive until this edit is known to succeed
      context.directory.suspendReference(previous, ref);
      TypeInference.reinferLeniently(context, seeds);
    }
    boolean generalizable = TypeInference.isGeneralizable(context, binder);
    Unifier unifier = Unifier.withTrail();
    try {
      unifier.unify(
          ref.term(), generalizable ? TypeInference.instantiate(context, binder) : binder.term());
    } catch (TypeException e) {
      unifier.rollback();
      if (previous != null) {
        context.directory.restoreReference(previous, ref);
        TypeInference.reinferLeniently(context, seeds);
      }
      throw e;
    }
    context.directory.addReference(binder, ref);
    ref.instantiatedPolymorphically = generalizable;
    logger.at(traceLevel()).log("Bound %s to %s", ref, binder);
    reinferOrRevert(
        List.of(node),
        () -> {
          context.directory.removeReference(binder, ref);
          if (previous != null) {
            context.directory.restoreReference(previous, ref);
          }
        },
        ImmutableList.<Node>builder().addAll(seeds).add(binder.owner()).build());
    if (previous != null) {
      context.directory.releaseIfUnreferenced(previous);
    }
  }

  /** The nodes to re-infer after {@code node}'s reference leaves {@code previous} (if non-null). */
  private static List<Node> seedsForBinding(Node node, @Nullable Binder previous) {
    List<Node> seeds = new ArrayList<>();
    seeds.add(node);
    Node owner = (previous == null) ? null : previous.owner();
    if (owner != null) {
      seeds.add(owner);
    }
    return seeds;
  }

  /** Unbinds {@code ref}; does nothing if it is not bound. Its name is unchanged. */
  public void unbind(Reference ref) {
    checkLive();
    Binder binder = ref.binder();
    if (binder == null) {
      return;
    }
    List<Node> seeds = seedsForBinding(ref.node, binder);
    context.directory.removeReference(binder, ref);
    logger.at(traceLevel()).log("Unbound %s from %s", ref, binder);
    TypeInference.reinferLeniently(context, seeds);
  }

  /** Renames {@code binder} and every reference to it. */
  public void rename(Binder binder, String name) {
    Preconditions.checkArgument(
        context.directory.canRenameTo(binder, name), "Can't rename %s to %s", binder, name);
    context.directory.renameBinder(binder, name);
  }

  /**
   * Renames {@code ref}. If it is bound this renames its binder (and so every other reference to
   * it); otherwise it renames just this reference.
   */
  public void rename(Reference ref, String name) {
    Binder binder = ref.binder();
    if (binder != null) {
      rename(binder, name);
    } else {
      Preconditions.checkArgument(StringUtil.isValidVariableName(name), "Bad name: %s", name);
      ref.setName(name);
    }
  }

  /**
   * Returns the binders in scope at {@code anchor} (a parent-side Connection of a node in this
   * workspace), or at the top level of this workspace if {@code anchor} is null. The iteration
   * order of the result is unspecified and may differ between calls.
   */
  public Set<Binder> visibleBinders(@Nullable Connection anchor) {
    Preconditions.checkArgument(anchor == null || anchor.owner.workspace == this);
    return ScopeResolver.visibleBinders(anchor, this);
  }

  /** Returns the binders in scope at the top level of this workspace. */
  public Set<Binder> visibleBinders() {
    return visibleBinders(null);
  }

  /** True if {@code ref} could be used at {@code anchor} (null for top level). */
  public boolean canResolve(Reference ref, @Nullable Connection anchor) {
    return ScopeResolver.resolve(ref, anchor);
  }

  /** True if every reference below {@code node} would be in scope if it were attached at anchor. */
  public boolean canAttach(Node node, @Nullable Connection anchor) {
    try {
      ScopeResolver.checkAttach(node, anchor);
      return true;
    } catch (ScopeException e) {
      return false;
    }
  }

  /** Creates a top-level reference to {@code binder} in {@code target}. */
  public Reference materializeReference(Binder binder, Workspace target) {
    checkLive();
    Preconditions.checkArgument(target.context == context && !target.disposed);
    return ReferenceMaterializer.materialize(context, binder, target);
  }

  /** Creates one top-level reference in this workspace to each binder visible here. */
  public List<Reference> materializeAll() {
    checkLive();
    List<Reference> result = new ArrayList<>();
    for (Binder b : visibleBinders()) {
      result.add(ReferenceMaterializer.materialize(context, b, this));
    }
    return result;
  }

  /** A snapshot of {@code binder}'s current type. */
  public TypeTerm typeOf(Binder binder) {
    return binder.term().deepDeref();
  }

  /** A snapshot of {@code ref}'s current type. */
  public TypeTerm typeOf(Reference ref) {
    return ref.term().deepDeref();
  }

  /** A snapshot of {@code connection}'s current type. */
  public TypeTerm typeOf(Connection connection) {
    return connection.term().deepDeref();
  }

  /**
   * Disposes {@code node} and every node attached below it: detaches it from its parent, unbinds
   * its references, disposes its binders (deferring those that are still referenced from outside
   * the subtree), closes the workbenches opened on it, and re-infers what remains.
   */
  public void disposeNode(Node node) {
    Preconditions.checkArgument(node.workspace == this, "%s is not here", node);
    if (node.isDisposed()) {
      return;
    }
    Set<Node> seeds = new LinkedHashSet<>();
    Connection parentInput = node.parentInput();
    if (parentInput != null) {
      seeds.add(parentInput.owner);
      node.childSide().unlink();
    }
    Set<Node> subtree = new LinkedHashSet<>();
    node.forEachInSubtree(subtree::add);
    for (Workspace workbench : ImmutableList.copyOf(workbenches)) {
      if (subtree.contains(workbench.anchor.owner)) {
        workbench.dispose();
      }
    }
    for (Node n : subtree) {
      Reference ref = n.reference();
      if (ref != null && ref.isBound()) {
        Binder binder = ref.binder();
        Node owner = binder.owner();
        context.directory.removeReference(binder, ref);
        if (owner != null && !subtree.contains(owner)) {
          seeds.add(owner);
        }
      }
    }
    for (Node n : subtree) {
      for (Binder binder : ImmutableList.copyOf(n.binders)) {
        disposeDeclared(binder, seeds);
      }
    }
    for (Node n : subtree) {
      n.markDisposed();
      nodes.remove(n);
      Reference ref = n.reference();
      if (ref != null) {
        context.directory.unregisterReference(ref);
      }
    }
    logger.at(traceLevel()).log("Disposed %s", subtree);
    TypeInference.reinferLeniently(context, seeds);
  }

  /**
   * Disposes a binder whose node is being disposed. A binder that is still referenced keeps a copy
   * of its current type, independent of the disposed nodes.
   */
  private void disposeDeclared(Binder binder, Set<Node> seeds) {
    for (Binder child : ImmutableList.copyOf(binder.children)) {
      disposeDeclared(child, seeds);
    }
    List<Reference> refs = context.directory.referencesOf(binder);
    if (!refs.isEmpty()) {
      binder.replaceTerm(TypeTerm.clone(binder.term(), context.supply));
      refs.forEach(r -> seeds.add(r.node));
    }
    context.directory.dispose(binder);
  }

  /**
   * Disposes this workspace: its workbenches first, then every node in it. Disposing a workspace
   * twice does nothing.
   */
  public void dispose() {
    if (disposed) {
      return;
    }
    for (Workspace workbench : ImmutableList.copyOf(workbenches).reverse()) {
      workbench.dispose();
    }
    for (Node n : topLevelNodes()) {
      disposeNode(n);
    }
    disposed = true;
    if (parent != null) {
      parent.workbenches.remove(this);
    }
    logger.at(traceLevel()).log("Disposed %s", this);
  }

  @Override
  public String toString() {
    return (anchor == null) ? "workspace" : "workbench@" + anchor;
  }
}
