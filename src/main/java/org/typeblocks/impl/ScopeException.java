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
 * Thrown when an edit would leave a reference outside the scope of the binder it refers to (or of
 * every binder with its name). The edit is not made.
 */
public class ScopeException extends Exception {

  public enum Kind {
    NOT_VISIBLE
  }

  public final Kind kind;

  /** The name of the reference that could not be resolved. */
  public final String name;

  ScopeException(Kind kind, String name, String detail) {
    super(kind + ": " + name + " " + detail);
    this.kind = kind;
    this.name = name;
  }
}
