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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

/**
 * A Node is one block of the graph. It has a single child-side {@link Connection} (an {@link
 * Connection.Kind#OUTPUT} for expressions, a {@link Connection.Kind#PREVIOUS} for statements) and
 * any number of parent-side Connections (inputs), each of which may have one child attached.
 *
 * <p>A subclass sets up its Connections in its constructor, sharing type variables between them to
 * express its typing rule (e.g. both branches of a conditional and its result share one variable).
 * That sharing is structural: it survives every connect and disconnect, and is what re-inference
 * starts from (see {@link TypeInference}).
 *
 * <p>Nodes may also declare {@link Binder}s, each visible in one of the node's inputs, and may own
 * a {@link Reference}.
 */
public abstract class Node {

  final Workspace workspace;

  /** Unique within the graph; also the order in which re-inference visits nodes. */
  final int id;

  private final String type;

  private @Nullable Connection childSide;

  private final List<Connection> inputs = new ArrayList<>();

  /** The binders declared by this node, in declaration order. */
  final List<Binder> binders = new ArrayList<>();

  /** Incremented each time this node's presentation should be refreshed. */
  private int presentationVersion;

  private boolean disposed;

  protected Node(Workspace workspace, String type) {
    this.workspace = workspace;
    this.type = type;
    this.id = workspace.addNode(this);
  }

  public Workspace workspace() {
    return workspace;
  }

  public int id() {
    return id;
  }

  /** A short name for this kind of node, e.g. {@code "let"}. */
  public String type() {
    return type;
  }

  /** Returns a new type variable. */
  protected final TypeVariable newVariable() {
    return workspace.context.supply.newVariable();
  }

  /** Creates this node's OUTPUT Connection with the given type. */
  @CanIgnoreReturnValue
  protected final Connection setOutput(TypeTerm term) {
    Preconditions.checkState(childSide == null);
    childSide = new Connection(this, "OUTPUT", Connection.Kind.OUTPUT, term);
    return childSide;
  }

  /** Creates this node's PREVIOUS Connection. */
  @CanIgnoreReturnValue
  protected final Connection setPrevious() {
    Preconditions.checkState(childSide == null);
    childSide = new Connection(this, "PREVIOUS", Connection.Kind.PREVIOUS, TypeTerm.UNKNOWN);
    return childSide;
  }

  /** Adds an INPUT Connection with the given name and type. */
  @CanIgnoreReturnValue
  protected final Connection addInput(String name, TypeTerm term) {
    return addConnection(name, Connection.Kind.INPUT, term);
  }

  /** Adds this statement's NEXT Connection. */
  @CanIgnoreReturnValue
  protected final Connection addNext() {
    return addConnection("NEXT", Connection.Kind.NEXT, TypeTerm.UNKNOWN);
  }

  private Connection addConnection(String name, Connection.Kind kind, TypeTerm term) {
    Preconditions.checkArgument(input(name) == null, "Duplicate input %s", name);
    Connection result = new Connection(this, name, kind, term);
    inputs.add(result);
    return result;
  }

  /** Removes an input, first detaching whatever is attached to it. */
  protected final void removeInput(String name) {
    Connection input = Preconditions.checkNotNull(input(name), name);
    if (input.isConnected()) {
      workspace.disconnect(input);
    }
    inputs.remove(input);
  }

  /** Declares a new binder on this node, visible in the named input (or nowhere, if null). */
  protected final Binder declare(@Nullable String scopeInput, TypeTerm term, String name) {
    return workspace.newBinder(this, scopeInput, term, name);
  }

  /** This node's OUTPUT or PREVIOUS Connection. */
  public Connection childSide() {
    return childSide;
  }

  /** This node's OUTPUT Connection; fails if this is a statement node. */
  public Connection output() {
    Preconditions.checkState(childSide.kind == Connection.Kind.OUTPUT, "%s has no output", this);
    return childSide;
  }

  /** This node's PREVIOUS Connection; fails if this is not a statement node. */
  public Connection previous() {
    Preconditions.checkState(
        childSide.kind == Connection.Kind.PREVIOUS, "%s is not a statement", this);
    return childSide;
  }

  /** This node's NEXT Connection, or null if it is not a statement node. */
  public @Nullable Connection next() {
    return input("NEXT");
  }

  /** Returns the named input or NEXT Connection, or null if there is none. */
  public @Nullable Connection input(String name) {
    for (Connection c : inputs) {
      if (c.name.equals(name)) {
        return c;
      }
    }
    return null;
  }

  /** Returns the named input; fails if there is none. */
  public Connection getInput(String name) {
    Connection result = input(name);
    Preconditions.checkArgument(result != null, "%s has no input %s", this, name);
    return result;
  }

  /** This node's parent-side Connections, in order. */
  public ImmutableList<Connection> inputs() {
    return ImmutableList.copyOf(inputs);
  }

  /** The parent-side Connection this node is attached to, or null if it is a top-level node. */
  public @Nullable Connection parentInput() {
    return (childSide == null) ? null : childSide.peer();
  }

  /** The node this one is attached to, or null. */
  public @Nullable Node parent() {
    Connection p = parentInput();
    return (p == null) ? null : p.owner;
  }

  /** The nodes attached to this node's inputs, in input order. */
  public List<Node> children() {
    List<Node> result = new ArrayList<>();
    for (Connection input : inputs) {
      Node child = input.targetNode();
      if (child != null) {
        result.add(child);
      }
    }
    return result;
  }

  /** Calls {@code consumer} with this node and each of its descendants, parents first. */
  public void forEachInSubtree(Consumer<Node> consumer) {
    consumer.accept(this);
    for (Connection input : inputs) {
      Node child = input.targetNode();
      if (child != null) {
        child.forEachInSubtree(consumer);
      }
    }
  }

  /** True if {@code other} is this node or one of its ancestors. */
  boolean isAncestorOrSelf(Node other) {
    for (Node n = this; n != null; n = n.parent()) {
      if (n == other) {
        return true;
      }
    }
    return false;
  }

  /** The binders declared by this node. */
  public ImmutableList<Binder> binders() {
    return ImmutableList.copyOf(binders);
  }

  /** Returns the first binder declared by this node; fails if it has none. */
  public Binder binder() {
    Preconditions.checkState(!binders.isEmpty(), "%s declares no variables", this);
    return binders.get(0);
  }

  /** The reference this node owns, or null if it isn't a reference node. */
  public @Nullable Reference reference() {
    return null;
  }

  /**
   * Returns the binders that this node makes visible to nodes attached (directly or indirectly) to
   * {@code input}. The default is the binders whose scope input is {@code input}.
   */
  Iterable<Binder> bindersVisibleIn(Connection input) {
    List<Binder> result = new ArrayList<>();
    for (Binder b : binders) {
      if (input.name.equals(b.scopeInput)) {
        result.add(b);
      }
    }
    return result;
  }

  /**
   * The input that a workbench created for this node (without naming an input) is anchored at, or
   * null if this node declares no variables.
   */
  public @Nullable String defaultScopeInput() {
    return null;
  }

  /**
   * True if the type of {@code binder} (declared by this node) should be generalized, so that each
   * reference to it gets an independent instance. The default is false.
   */
  boolean generalizes(Binder binder) {
    return false;
  }

  /** True if this node allows {@code binder} to be renamed to {@code newName}. */
  boolean canRenameBinder(Binder binder, String newName) {
    return true;
  }

  /** Called after one of this node's binders has been renamed. */
  void binderRenamed(Binder binder) {
    presentationVersion++;
  }

  /** Incremented each time the way this node is displayed may have changed. */
  public int presentationVersion() {
    return presentationVersion;
  }

  /**
   * Calls {@code consumer} with each term this node owns: those of its Connections and of its
   * binders (including component binders).
   */
  void forEachTerm(Consumer<TypeTerm> consumer) {
    if (childSide != null) {
      consumer.accept(childSide.term());
    }
    for (Connection input : inputs) {
      consumer.accept(input.term());
    }
    TypeInference.forEachBinder(binders, b -> consumer.accept(b.term()));
  }

  public boolean isDisposed() {
    return disposed;
  }

  void markDisposed() {
    disposed = true;
  }

  /** Disposes this node and everything attached below it; see {@link Workspace#disposeNode}. */
  public void dispose() {
    workspace.disposeNode(this);
  }

  @Override
  public String toString() {
    return type + "#" + id;
  }
}
