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

/**
 * Thrown when the {@link BindingDirectory} is used in a way that breaks its contract. These are
 * programming errors, never the result of a rejected edit.
 */
public class DirectoryException extends IllegalStateException {

  public enum Kind {
    DUPLICATE_BINDER,
    DUPLICATE_REFERENCE,
    REFERENCE_NOT_FOUND,
    BINDER_DELETING
  }

  public final Kind kind;

  DirectoryException(Kind kind, String message) {
    super(kind + ": " + message);
    this.kind = kind;
  }
}
