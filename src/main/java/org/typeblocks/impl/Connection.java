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
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeTerm;

/**
 * A Connection is an attachment point of a {@link Node}. Each Connection owns one {@link TypeTerm}
 * (its declared type) and, while joined, refers to a peer Connection on another node.
 *
 * <p>Joins always pair a "parent side" Connection ({@link Kind#INPUT} or {@link Kind#NEXT}) with a
 * "child side" Connection ({@link Kind#OUTPUT} or {@link Kind#PREVIOUS}); following the parent side
 * of a node's child-side Connection gives the node's ancestors, which is what scoping is defined
 * on.
 *
 * <p>After a successful join the two Connections' terms dereference to the same object. Joins and
 * disjoins go through {@link Workspace#connect} and {@link Workspace#disconnect}; the peer link
 * itself is only written here.
 */
public final class Connection {

  /** The roles a Connection can play. */
  public enum Kind {
    /** A value slot of a node; joined to the OUTPUT of a child node. */
    INPUT,
    /** The value a node produces; joined to an INPUT of its parent. */
    OUTPUT,
    /** The slot for the statement that follows a statement node. */
    NEXT,
    /** A statement's link to the statement it follows. */
    PREVIOUS;

    /** The kind of Connection that this one may be joined to. */
    public Kind partner() {
      return switch (this) {
        case INPUT -> OUTPUT;
        case OUTPUT -> INPUT;
        case NEXT -> PREVIOUS;
        case PREVIOUS -> NEXT;
      };
    }

    /** True for INPUT and NEXT, the Connections that child nodes are attached to. */
    public boolean isParentSide() {
      return this == INPUT || this == NEXT;
    }
  }

  final Node owner;

  final String name;

  final Kind kind;

  private final TypeTerm term;

  private @Nullable Connection peer;

  Connection(Node owner, String name, Kind kind, TypeTerm term) {
    this.owner = owner;
    this.name = name;
    this.kind = kind;
    this.term = Preconditions.checkNotNull(term);
  }

  public Node owner() {
    return owner;
  }

  public String name() {
    return name;
  }

  public Kind kind() {
    return kind;
  }

  /** This Connection's declared type. */
  public TypeTerm term() {
    return term;
  }

  /** The Connection this one is joined to, or null. */
  public @Nullable Connection peer() {
    return peer;
  }

  public boolean isConnected() {
    return peer != null;
  }

  /** The node on the other side of this Connection, or null if it is not joined. */
  public @Nullable Node targetNode() {
    return (peer == null) ? null : peer.owner;
  }

  /** Records the peer link in both directions. */
  void link(Connection other) {
    assert peer == null && other.peer == null && other.kind == kind.partner();
    peer = other;
    other.peer = this;
  }

  /** Removes the peer link in both directions. */
  void unlink() {
    assert peer != null && peer.peer == this;
    peer.peer = null;
    peer = null;
  }

  @Override
  public String toString() {
    return owner + "." + name;
  }
}
