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

import com.google.common.flogger.FluentLogger;
import org.typeblocks.types.TypeException;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.Unifier;

/**
 * Creates reference nodes for binders, e.g. to offer the user one reference to each variable that
 * can be used in a workbench.
 *
 * <p>A materialized reference is a new top-level {@link VariableNode} in the target workspace,
 * bound to the binder. If the binder's type is generalized the reference gets its own instance of
 * it; otherwise it shares the binder's type. Materializing the same binder again gives a new
 * reference with the same name and an equivalent type.
 */
final class ReferenceMaterializer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private ReferenceMaterializer() {}

  /**
   * Returns a new reference to {@code binder} in {@code target}. A binder that is not generalized
   * shares its type with the reference; no copy is made.
   */
  static Reference materialize(GraphContext context, Binder binder, Workspace target) {
    if (!binder.isLive()) {
      throw new DirectoryException(
          DirectoryException.Kind.BINDER_DELETING, "Can't refer to " + binder);
    }
    VariableNode node = new VariableNode(target, binder.name());
    Reference ref = node.reference();
    boolean generalizable = TypeInference.isGeneralizable(context, binder);
    TypeTerm bound = generalizable ? TypeInference.instantiate(context, binder) : binder.term();
    try {
      // The reference's type is a fresh variable, so this can't fail.
      Unifier.withoutTrail().unify(ref.term(), bound);
    } catch (TypeException e) {
      throw new AssertionError(e);
    }
    context.directory.addReference(binder, ref);
    ref.instantiatedPolymorphically = generalizable;
    logger.atFine().log("Materialized %s in %s", ref, target);
    return ref;
  }
}
