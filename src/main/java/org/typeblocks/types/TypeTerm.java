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

package org.typeblocks.types;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.typeblocks.util.StringUtil;

/**
 * A TypeTerm is a node in the mutable term graph that type inference operates on. A term is either
 * a {@link TypeVariable} (which may be unbound, or bound to another term) or a constructor: one of
 * the primitives ({@link #INT}, {@link #FLOAT}, {@link #BOOL}, {@link #STRING}), a {@link
 * Function}, {@link ListOf}, {@link Pair}, {@link Record}, {@link UserType}, {@link Pattern}, the
 * {@link #UNKNOWN} placeholder, or an {@link Error}.
 *
 * <p>Constructors are immutable; all mutation happens by binding variables, which is restricted to
 * {@link Unifier} and {@link VariableSupply}. Since variables are shared by reference, binding a
 * single variable can change the type seen by many connections at once; two terms denote the same
 * variable iff their {@link #deref} results are the same object.
 *
 * <p>The children of a constructor are exposed uniformly through {@link #numChildren} and {@link
 * #child}, which lets the generic operations (deep deref, occurs check, instantiation) be written
 * once.
 */
public abstract class TypeTerm {

  public static final TypeTerm INT = new Primitive("int");
  public static final TypeTerm FLOAT = new Primitive("float");
  public static final TypeTerm BOOL = new Primitive("bool");
  public static final TypeTerm STRING = new Primitive("string");

  /**
   * A deliberately unconstrained placeholder. Unlike a variable it never becomes bound, and it
   * unifies with anything without transferring information.
   */
  public static final TypeTerm UNKNOWN = new Unknown();

  // Precedence levels used when printing; a child printed at a lower level than its context is
  // parenthesized.
  static final int PREC_ARROW = 0;
  static final int PREC_PAIR = 1;
  static final int PREC_POSTFIX = 2;

  TypeTerm() {}

  /**
   * Returns the representative of this term: for a bound variable, the end of its chain of
   * bindings; for anything else, this term. Shortens the chain as a side effect.
   */
  public TypeTerm deref() {
    return this;
  }

  /**
   * Returns a snapshot of this term with every bound variable (at any depth) replaced by its
   * representative. Unbound variables appear in the result as themselves, so the snapshot shares
   * them with the live term graph.
   */
  public final TypeTerm deepDeref() {
    TypeTerm t = deref();
    int n = t.numChildren();
    if (n == 0) {
      return t;
    }
    ImmutableList.Builder<TypeTerm> children = ImmutableList.builderWithExpectedSize(n);
    for (int i = 0; i < n; i++) {
      children.add(t.child(i).deepDeref());
    }
    return t.withChildren(children.build());
  }

  /** True if the unbound variable {@code v} occurs anywhere in this term (after dereferencing). */
  public final boolean occurs(TypeVariable v) {
    TypeTerm t = deref();
    if (t == v) {
      return true;
    }
    for (int i = t.numChildren() - 1; i >= 0; i--) {
      if (t.child(i).occurs(v)) {
        return true;
      }
    }
    return false;
  }

  /** The number of immediate children of this term; zero for variables and primitives. */
  public int numChildren() {
    return 0;
  }

  /** Returns one of this term's immediate children; {@code i} must be less than numChildren. */
  public TypeTerm child(int i) {
    throw new IndexOutOfBoundsException(i);
  }

  /**
   * Returns a term with the same constructor as this one and the given children; {@code children}
   * must have {@link #numChildren} elements. Only called on constructors.
   */
  abstract TypeTerm withChildren(List<TypeTerm> children);

  /**
   * True if {@code other} (which must not be a variable) has the same constructor as this term, so
   * that unification can proceed by unifying their children pairwise.
   */
  boolean sameConstructor(TypeTerm other) {
    return getClass() == other.getClass();
  }

  /**
   * Calls {@code consumer} with every variable that is part of this term's own structure, without
   * following the bindings of those variables. These are the variables that a node created when it
   * set up its connections, as opposed to the ones it was later unified with.
   */
  public final void forEachStructuralVariable(Consumer<TypeVariable> consumer) {
    if (this instanceof TypeVariable v) {
      consumer.accept(v);
      return;
    }
    for (int i = 0; i < numChildren(); i++) {
      child(i).forEachStructuralVariable(consumer);
    }
  }

  /** Returns the unbound variables of this term (after dereferencing), in left-to-right order. */
  public final List<TypeVariable> freeVariables() {
    List<TypeVariable> result = new ArrayList<>();
    collectFreeVariables(result);
    return result;
  }

  private void collectFreeVariables(List<TypeVariable> result) {
    TypeTerm t = deref();
    if (t instanceof TypeVariable v) {
      if (!result.contains(v)) {
        result.add(v);
      }
      return;
    }
    for (int i = 0; i < t.numChildren(); i++) {
      t.child(i).collectFreeVariables(result);
    }
  }

  /**
   * Returns a copy of {@code term} that shares no variables with it. Each distinct unbound variable
   * of the original is replaced by one fresh variable, so aliasing inside the term is preserved.
   */
  public static TypeTerm clone(TypeTerm term, VariableSupply supply) {
    return instantiate(term, Set.of(), supply);
  }

  /**
   * Like {@link #clone}, except that the variables in {@code keep} are shared with the original
   * rather than replaced. This is how a generalized binder's type is instantiated at a reference:
   * variables that are free in the surrounding environment are kept, the others are fresh.
   */
  public static TypeTerm instantiate(
      TypeTerm term, Set<TypeVariable> keep, VariableSupply supply) {
    return instantiate(term, keep, supply, new IdentityHashMap<>());
  }

  private static TypeTerm instantiate(
      TypeTerm term,
      Set<TypeVariable> keep,
      VariableSupply supply,
      Map<TypeVariable, TypeVariable> mapping) {
    TypeTerm t = term.deref();
    if (t instanceof TypeVariable v) {
      return keep.contains(v) ? v : mapping.computeIfAbsent(v, k -> supply.newVariable());
    }
    int n = t.numChildren();
    if (n == 0) {
      return t;
    }
    List<TypeTerm> children = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      children.add(instantiate(t.child(i), keep, supply, mapping));
    }
    return t.withChildren(children);
  }

  /**
   * True if {@code a} and {@code b} are the same type up to a consistent renaming of their unbound
   * variables.
   */
  public static boolean isVariant(TypeTerm a, TypeTerm b) {
    return isVariant(a, b, new IdentityHashMap<>(), new IdentityHashMap<>());
  }

  private static boolean isVariant(
      TypeTerm a,
      TypeTerm b,
      Map<TypeVariable, TypeVariable> aToB,
      Map<TypeVariable, TypeVariable> bToA) {
    a = a.deref();
    b = b.deref();
    if (a instanceof TypeVariable va) {
      if (!(b instanceof TypeVariable vb)) {
        return false;
      }
      TypeVariable prevB = aToB.putIfAbsent(va, vb);
      TypeVariable prevA = bToA.putIfAbsent(vb, va);
      return (prevB == null || prevB == vb) && (prevA == null || prevA == va);
    } else if (b instanceof TypeVariable) {
      return false;
    }
    if (a == b) {
      return true;
    }
    if (!a.sameConstructor(b) || a.numChildren() != b.numChildren()) {
      return false;
    }
    if (a instanceof Record ra && !ra.fieldNames().equals(((Record) b).fieldNames())) {
      return false;
    }
    for (int i = 0; i < a.numChildren(); i++) {
      if (!isVariant(a.child(i), b.child(i), aToB, bToA)) {
        return false;
      }
    }
    return true;
  }

  /** True if this term's representative is an unbound variable. */
  public final boolean isVariable() {
    return deref() instanceof TypeVariable;
  }

  /** Appends a printed form of this term, parenthesizing it if it binds less tightly than prec. */
  abstract void appendTo(StringBuilder sb, int prec);

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, PREC_ARROW);
    return sb.toString();
  }

  static void appendChild(StringBuilder sb, TypeTerm child, int prec) {
    follow(child).appendTo(sb, prec);
  }

  /**
   * Like {@link #deref} but without path compression. Printing uses this, since it may happen
   * while a trailing {@link Unifier} has uncommitted bindings.
   */
  static TypeTerm follow(TypeTerm t) {
    while (t instanceof TypeVariable v && v.value != null) {
      t = v.value;
    }
    return t;
  }

  /** One of the built-in primitive types; there is a single instance of each. */
  public static final class Primitive extends TypeTerm {
    public final String name;

    private Primitive(String name) {
      this.name = name;
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return this;
    }

    @Override
    boolean sameConstructor(TypeTerm other) {
      return other == this;
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append(name);
    }
  }

  /** See {@link #UNKNOWN}. */
  private static final class Unknown extends TypeTerm {
    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return this;
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append('?');
    }
  }

  /** The type of a function from {@link #arg} to {@link #result}. */
  public static final class Function extends TypeTerm {
    public final TypeTerm arg;
    public final TypeTerm result;

    public Function(TypeTerm arg, TypeTerm result) {
      this.arg = Preconditions.checkNotNull(arg);
      this.result = Preconditions.checkNotNull(result);
    }

    @Override
    public int numChildren() {
      return 2;
    }

    @Override
    public TypeTerm child(int i) {
      return switch (i) {
        case 0 -> arg;
        case 1 -> result;
        default -> throw new IndexOutOfBoundsException(i);
      };
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new Function(children.get(0), children.get(1));
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      if (prec > PREC_ARROW) {
        sb.append('(');
      }
      appendChild(sb, arg, PREC_PAIR);
      sb.append(" -> ");
      appendChild(sb, result, PREC_ARROW);
      if (prec > PREC_ARROW) {
        sb.append(')');
      }
    }
  }

  /** The type of a list whose elements have type {@link #element}. */
  public static final class ListOf extends TypeTerm {
    public final TypeTerm element;

    public ListOf(TypeTerm element) {
      this.element = Preconditions.checkNotNull(element);
    }

    @Override
    public int numChildren() {
      return 1;
    }

    @Override
    public TypeTerm child(int i) {
      Preconditions.checkElementIndex(i, 1);
      return element;
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new ListOf(children.get(0));
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      appendChild(sb, element, PREC_POSTFIX);
      sb.append(" list");
    }
  }

  /** The type of a pair. */
  public static final class Pair extends TypeTerm {
    public final TypeTerm first;
    public final TypeTerm second;

    public Pair(TypeTerm first, TypeTerm second) {
      this.first = Preconditions.checkNotNull(first);
      this.second = Preconditions.checkNotNull(second);
    }

    @Override
    public int numChildren() {
      return 2;
    }

    @Override
    public TypeTerm child(int i) {
      return switch (i) {
        case 0 -> first;
        case 1 -> second;
        default -> throw new IndexOutOfBoundsException(i);
      };
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new Pair(children.get(0), children.get(1));
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      if (prec > PREC_PAIR) {
        sb.append('(');
      }
      appendChild(sb, first, PREC_POSTFIX);
      sb.append(" * ");
      appendChild(sb, second, PREC_POSTFIX);
      if (prec > PREC_PAIR) {
        sb.append(')');
      }
    }
  }

  /**
   * The type of a record with named fields. Field order is kept for printing but is not significant
   * for unification.
   */
  public static final class Record extends TypeTerm {
    private final ImmutableList<String> names;
    private final ImmutableList<TypeTerm> types;

    /** Creates a record type; {@code names} must be distinct and parallel to {@code types}. */
    public Record(List<String> names, List<TypeTerm> types) {
      Preconditions.checkArgument(names.size() == types.size());
      Preconditions.checkArgument(
          names.stream().distinct().count() == names.size(), "Duplicate field in %s", names);
      this.names = ImmutableList.copyOf(names);
      this.types = ImmutableList.copyOf(types);
    }

    public ImmutableList<String> fieldNames() {
      return names;
    }

    /** Returns the type of the named field, or null if there is no such field. */
    public @Nullable TypeTerm field(String name) {
      int i = names.indexOf(name);
      return (i < 0) ? null : types.get(i);
    }

    @Override
    public int numChildren() {
      return types.size();
    }

    @Override
    public TypeTerm child(int i) {
      return types.get(i);
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new Record(names, children);
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append(
          StringUtil.joinElements(
              "{",
              "}",
              "; ",
              names.size(),
              i -> names.get(i) + ": " + follow(types.get(i))));
    }
  }

  /** A named type with zero or more type arguments, e.g. one introduced by a type definition. */
  public static final class UserType extends TypeTerm {
    public final String name;
    private final ImmutableList<TypeTerm> args;

    public UserType(String name, List<TypeTerm> args) {
      this.name = Preconditions.checkNotNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    public UserType(String name, TypeTerm... args) {
      this(name, ImmutableList.copyOf(args));
    }

    @Override
    public int numChildren() {
      return args.size();
    }

    @Override
    public TypeTerm child(int i) {
      return args.get(i);
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new UserType(name, children);
    }

    @Override
    boolean sameConstructor(TypeTerm other) {
      return other instanceof UserType ut && ut.name.equals(name);
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append(name);
      if (!args.isEmpty()) {
        sb.append(StringUtil.joinElements("(", ")", args.size(), i -> follow(args.get(i))));
      }
    }
  }

  /**
   * The type of a match-pattern slot. It wraps the type of the value being matched, so a pattern
   * slot and a pattern node unify exactly when their scrutinee types do.
   */
  public static final class Pattern extends TypeTerm {
    public final TypeTerm inner;

    public Pattern(TypeTerm inner) {
      this.inner = Preconditions.checkNotNull(inner);
    }

    @Override
    public int numChildren() {
      return 1;
    }

    @Override
    public TypeTerm child(int i) {
      Preconditions.checkElementIndex(i, 1);
      return inner;
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return new Pattern(children.get(0));
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append("pattern(");
      appendChild(sb, inner, PREC_ARROW);
      sb.append(')');
    }
  }

  /** A term that records why a type could not be determined; unifies only with variables. */
  public static final class Error extends TypeTerm {
    public final String reason;

    public Error(String reason) {
      this.reason = Preconditions.checkNotNull(reason);
    }

    @Override
    TypeTerm withChildren(List<TypeTerm> children) {
      return this;
    }

    @Override
    boolean sameConstructor(TypeTerm other) {
      return false;
    }

    @Override
    void appendTo(StringBuilder sb, int prec) {
      sb.append("error(").append(reason).append(')');
    }
  }
}
