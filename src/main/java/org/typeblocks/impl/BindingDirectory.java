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
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.flogger.FluentLogger;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.util.StringUtil;

/**
 * The registry of binders and references for one graph (a workspace and all its workbenches). It
 * is the only owner of the association between binders and their references, and the only code
 * that changes a binder's {@link Binder.State}.
 *
 * <p>Misuse (registering something twice, removing something that isn't there, referring to a
 * binder that is going away) throws a {@link DirectoryException}.
 */
public final class BindingDirectory {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private long nextBinderId = 1;
  private long nextReferenceId = 1;

  private final Map<Long, Binder> binders = new HashMap<>();
  private final Map<Long, Reference> references = new HashMap<>();

  /** Each binder's references, in the order they were added. */
  private final ListMultimap<Binder, Reference> referencesByBinder = ArrayListMultimap.create();

  BindingDirectory() {}

  /** Creates and registers a new binder declared by {@code owner}. */
  Binder newBinder(
      Node owner,
      @Nullable String scopeInput,
      TypeTerm term,
      String name,
      @Nullable Binder parent) {
    Binder binder = new Binder(nextBinderId++, name, term, owner, scopeInput, parent);
    addBinder(binder);
    return binder;
  }

  /** Registers {@code binder} and adds it to its owner (or its enclosing compound binder). */
  void addBinder(Binder binder) {
    if (binders.putIfAbsent(binder.id, binder) != null) {
      throw new DirectoryException(
          DirectoryException.Kind.DUPLICATE_BINDER, "binder id " + binder.id + " already in use");
    }
    if (binder.parent != null) {
      binder.parent.children.add(binder);
    } else {
      binder.owner().binders.add(binder);
    }
  }

  /** Creates and registers a new, unbound reference held by {@code node}. */
  Reference newReference(VariableNode node, String name) {
    Reference ref = new Reference(nextReferenceId++, node, name);
    references.put(ref.id, ref);
    return ref;
  }

  /** Forgets an unbound reference whose node has been disposed. */
  void unregisterReference(Reference ref) {
    assert !ref.isBound();
    references.remove(ref.id);
  }

  public @Nullable Binder binder(long id) {
    return binders.get(id);
  }

  public @Nullable Reference reference(long id) {
    return references.get(id);
  }

  /** The references currently bound to {@code binder}. */
  public ImmutableList<Reference> referencesOf(Binder binder) {
    return ImmutableList.copyOf(referencesByBinder.get(binder));
  }

  public int referenceCount(Binder binder) {
    return referencesByBinder.get(binder).size();
  }

  /** Binds {@code ref} to {@code binder}; the reference takes the binder's name. */
  void addReference(Binder binder, Reference ref) {
    if (referencesByBinder.containsEntry(binder, ref)) {
      throw new DirectoryException(
          DirectoryException.Kind.DUPLICATE_REFERENCE, ref + " is already bound to " + binder);
    }
    if (binder.state != Binder.State.LIVE) {
      throw new DirectoryException(
          DirectoryException.Kind.BINDER_DELETING, binder + " is " + binder.state);
    }
    assert ref.binder() == null;
    referencesByBinder.put(binder, ref);
    ref.setBinder(binder);
    ref.setName(binder.name());
  }

  /**
   * Unbinds {@code ref} from {@code binder}. If that was the last reference to a binder that is
   * pending deletion, the binder is disposed now.
   */
  void removeReference(Binder binder, Reference ref) {
    suspendReference(binder, ref);
    releaseIfUnreferenced(binder);
  }

  /**
   * Unbinds {@code ref} from {@code binder} without disposing the binder, even if it is pending
   * deletion and this was its last reference. The caller must follow with either {@link
   * #restoreReference} or {@link #releaseIfUnreferenced}.
   */
  void suspendReference(Binder binder, Reference ref) {
    if (!referencesByBinder.remove(binder, ref)) {
      throw new DirectoryException(
          DirectoryException.Kind.REFERENCE_NOT_FOUND, ref + " is not bound to " + binder);
    }
    ref.setBinder(null);
    ref.typeError = null;
    ref.instantiatedPolymorphically = false;
  }

  /**
   * Rebinds a reference that was unbound by {@link #suspendReference}; unlike {@link
   * #addReference}, the binder may be pending deletion.
   */
  void restoreReference(Binder binder, Reference ref) {
    if (binder.state == Binder.State.DISPOSED) {
      throw new DirectoryException(
          DirectoryException.Kind.BINDER_DELETING, binder + " is " + binder.state);
    }
    assert ref.binder() == null && !referencesByBinder.containsEntry(binder, ref);
    referencesByBinder.put(binder, ref);
    ref.setBinder(binder);
  }

  /** Disposes {@code binder} if it is pending deletion and nothing refers to it any more. */
  void releaseIfUnreferenced(Binder binder) {
    if (binder.state == Binder.State.PENDING_DELETION && !referencesByBinder.containsKey(binder)) {
      release(binder);
    }
  }

  /**
   * Removes a component binder from its compound binder's components, without disposing it; used
   * when a component is dropped from the compound's type while references to it remain.
   */
  void detachChild(Binder child) {
    Binder parent = Preconditions.checkNotNull(child.parent);
    Preconditions.checkArgument(child.state != Binder.State.LIVE, "%s is still live", child);
    parent.children.remove(child);
  }

  /**
   * Disposes {@code binder} (and its component binders) if nothing refers to it; otherwise marks it
   * pending deletion, so that it is disposed when its last reference is removed. Disposing a binder
   * that has already been disposed does nothing.
   */
  void dispose(Binder binder) {
    for (Binder child : ImmutableList.copyOf(binder.children)) {
      dispose(child);
    }
    switch (binder.state) {
      case DISPOSED -> {}
      case PENDING_DELETION, LIVE -> {
        if (referencesByBinder.containsKey(binder)) {
          if (binder.state == Binder.State.LIVE) {
            logger.atFine().log(
                "Deferring disposal of %s (%d references)", binder, referenceCount(binder));
          }
          binder.state = Binder.State.PENDING_DELETION;
        } else {
          release(binder);
        }
      }
    }
  }

  private void release(Binder binder) {
    assert !referencesByBinder.containsKey(binder);
    logger.atFine().log("Disposing %s", binder);
    for (Binder child : ImmutableList.copyOf(binder.children)) {
      dispose(child);
    }
    if (binder.parent != null) {
      binder.parent.children.remove(binder);
    } else if (binder.owner() != null) {
      binder.owner().binders.remove(binder);
    }
    binders.remove(binder.id);
    binder.release();
  }

  /** True if {@code binder} may be renamed to {@code name}. */
  public boolean canRenameTo(Binder binder, String name) {
    Node owner = binder.owner();
    return owner != null
        && StringUtil.isValidVariableName(name)
        && owner.canRenameBinder(binder, name);
  }

  /**
   * Renames {@code binder} and every reference to it, then lets the binder's node know. Does
   * nothing if the name is unchanged.
   */
  void renameBinder(Binder binder, String name) {
    if (binder.name().equals(name)) {
      return;
    }
    logger.atFine().log("Renaming %s to %s", binder, name);
    binder.setName(name);
    for (Reference ref : referencesByBinder.get(binder)) {
      ref.setName(name);
    }
    Node owner = binder.owner();
    if (owner != null) {
      owner.binderRenamed(binder);
    }
  }

  /** The number of binders that have not yet been disposed. */
  public int numBinders() {
    return binders.size();
  }
}
