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
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

/**
 * The expression nodes that declare no variables. Each one's typing rule is expressed entirely by
 * the terms of its Connections.
 */
public final class BasicNodes {

  private BasicNodes() {}

  /** A constant of a primitive type. */
  public static final class Literal extends Node {
    public final Object value;

    public Literal(Workspace workspace, TypeTerm.Primitive type, Object value) {
      super(workspace, "literal");
      this.value = value;
      setOutput(type);
    }

    public static Literal ofInt(Workspace workspace, int value) {
      return new Literal(workspace, (TypeTerm.Primitive) TypeTerm.INT, value);
    }

    public static Literal ofFloat(Workspace workspace, double value) {
      return new Literal(workspace, (TypeTerm.Primitive) TypeTerm.FLOAT, value);
    }

    public static Literal ofBool(Workspace workspace, boolean value) {
      return new Literal(workspace, (TypeTerm.Primitive) TypeTerm.BOOL, value);
    }

    public static Literal ofString(Workspace workspace, String value) {
      return new Literal(workspace, (TypeTerm.Primitive) TypeTerm.STRING, value);
    }
  }

  /** {@code A op B}, where both operands and the result have the same numeric type. */
  public static final class Arithmetic extends Node {
    public final String op;

    public Arithmetic(Workspace workspace, String op, TypeTerm type) {
      super(workspace, "arith");
      Preconditions.checkArgument(type == TypeTerm.INT || type == TypeTerm.FLOAT);
      this.op = op;
      addInput("A", type);
      addInput("B", type);
      setOutput(type);
    }
  }

  /** {@code A op B} for operands of any one type; the result is a bool. */
  public static final class Compare extends Node {
    public final String op;

    public Compare(Workspace workspace, String op) {
      super(workspace, "compare");
      this.op = op;
      TypeVariable a = newVariable();
      addInput("A", a);
      addInput("B", a);
      setOutput(TypeTerm.BOOL);
    }
  }

  /** {@code if IF then THEN else ELSE}. */
  public static final class Ternary extends Node {
    public Ternary(Workspace workspace) {
      super(workspace, "ternary");
      TypeVariable a = newVariable();
      addInput("IF", TypeTerm.BOOL);
      addInput("THEN", a);
      addInput("ELSE", a);
      setOutput(a);
    }
  }

  /** A list of its ADD0 ... ADDn-1 inputs; the number of inputs can be changed. */
  public static final class ListCreate extends Node {
    private final TypeVariable element;
    private int size;

    public ListCreate(Workspace workspace, int size) {
      super(workspace, "list");
      element = newVariable();
      setOutput(new TypeTerm.ListOf(element));
      resize(size);
    }

    public int size() {
      return size;
    }

    /**
     * Adds or removes inputs so that there are {@code newSize}; anything attached to a removed
     * input is detached first.
     */
    public void resize(int newSize) {
      Preconditions.checkArgument(newSize >= 0);
      for (; size < newSize; size++) {
        addInput("ADD" + size, element);
      }
      for (; size > newSize; size--) {
        removeInput("ADD" + (size - 1));
      }
    }
  }

  /** {@code (FIRST, SECOND)}. */
  public static final class PairCreate extends Node {
    public PairCreate(Workspace workspace) {
      super(workspace, "pair");
      TypeVariable a = newVariable();
      TypeVariable b = newVariable();
      addInput("FIRST", a);
      addInput("SECOND", b);
      setOutput(new TypeTerm.Pair(a, b));
    }
  }

  /** {@code fst PAIR} or {@code snd PAIR}. */
  public static final class PairSelect extends Node {
    public final boolean first;

    public PairSelect(Workspace workspace, boolean first) {
      super(workspace, first ? "fst" : "snd");
      this.first = first;
      TypeVariable a = newVariable();
      TypeVariable b = newVariable();
      addInput("PAIR", new TypeTerm.Pair(a, b));
      setOutput(first ? a : b);
    }
  }

  /** {@code FUN ARG}. */
  public static final class Apply extends Node {
    public Apply(Workspace workspace) {
      super(workspace, "apply");
      TypeVariable a = newVariable();
      TypeVariable r = newVariable();
      addInput("FUN", new TypeTerm.Function(a, r));
      addInput("ARG", a);
      setOutput(r);
    }
  }
}
