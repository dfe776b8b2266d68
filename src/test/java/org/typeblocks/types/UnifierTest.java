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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UnifierTest {

  private final VariableSupply supply = new VariableSupply();

  private static void unify(TypeTerm a, TypeTerm b) throws TypeException {
    Unifier.withoutTrail().unify(a, b);
  }

  @Test
  public void bindsVariableToConstructor() throws TypeException {
    TypeVariable v = supply.newVariable();
    unify(v, TypeTerm.INT);
    assertThat(v.deref()).isSameInstanceAs(TypeTerm.INT);
    assertThat(v.isBound()).isTrue();
  }

  @Test
  public void aliasesNestedVariables() throws TypeException {
    TypeVariable a = supply.newVariable();
    TypeVariable b = supply.newVariable();
    TypeVariable c = supply.newVariable();
    TypeTerm left = new TypeTerm.Function(new TypeTerm.ListOf(a), new TypeTerm.Pair(b, b));
    TypeTerm right =
        new TypeTerm.Function(c, new TypeTerm.Pair(TypeTerm.BOOL, supply.newVariable()));
    unify(left, right);
    assertThat(c.deref()).isInstanceOf(TypeTerm.ListOf.class);
    assertThat(((TypeTerm.ListOf) c.deref()).element.deref()).isSameInstanceAs(a);
    assertThat(b.deref()).isSameInstanceAs(TypeTerm.BOOL);
    assertThat(left.deepDeref().toString()).isEqualTo(right.deepDeref().toString());
  }

  @Test
  public void pathCompression() throws TypeException {
    TypeVariable a = supply.newVariable();
    TypeVariable b = supply.newVariable();
    TypeVariable c = supply.newVariable();
    unify(a, b);
    unify(b, c);
    assertThat(a.value()).isSameInstanceAs(b);
    assertThat(a.deref()).isSameInstanceAs(c);
    assertThat(a.value()).isSameInstanceAs(c);
  }

  @Test
  public void inconsistent() {
    TypeException e =
        assertThrows(
            TypeException.class,
            () -> unify(new TypeTerm.ListOf(TypeTerm.INT), new TypeTerm.ListOf(TypeTerm.BOOL)));
    assertThat(e.kind).isEqualTo(TypeException.Kind.INCONSISTENT);
    assertThat(e.left).isSameInstanceAs(TypeTerm.INT);
    assertThat(e.right).isSameInstanceAs(TypeTerm.BOOL);
  }

  @Test
  public void occursCheckMutatesNothing() {
    TypeVariable v = supply.newVariable();
    TypeVariable w = supply.newVariable();
    TypeTerm f = new TypeTerm.Function(v, TypeTerm.INT);
    Unifier unifier = Unifier.withTrail();
    TypeException e =
        assertThrows(
            TypeException.class,
            () -> unifier.unify(new TypeTerm.Pair(w, v), new TypeTerm.Pair(w, f)));
    assertThat(e.kind).isEqualTo(TypeException.Kind.OCCURS_CHECK);
    assertThat(v.isBound()).isFalse();
    assertThat(w.isBound()).isFalse();
  }

  @Test
  public void recordsUnifyByFieldName() throws TypeException {
    TypeVariable x = supply.newVariable();
    TypeVariable y = supply.newVariable();
    TypeTerm r1 = new TypeTerm.Record(List.of("x", "y"), List.of(x, TypeTerm.FLOAT));
    TypeTerm r2 = new TypeTerm.Record(List.of("y", "x"), List.of(y, TypeTerm.INT));
    unify(r1, r2);
    assertThat(x.deref()).isSameInstanceAs(TypeTerm.INT);
    assertThat(y.deref()).isSameInstanceAs(TypeTerm.FLOAT);
  }

  @Test
  public void recordFieldMismatch() {
    TypeTerm r1 = new TypeTerm.Record(List.of("x"), List.of(TypeTerm.INT));
    TypeTerm r2 = new TypeTerm.Record(List.of("z"), List.of(TypeTerm.INT));
    TypeException e = assertThrows(TypeException.class, () -> unify(r1, r2));
    assertThat(e.kind).isEqualTo(TypeException.Kind.ARITY_OR_SHAPE_MISMATCH);
  }

  @Test
  public void userTypes() throws TypeException {
    TypeVariable a = supply.newVariable();
    unify(new TypeTerm.UserType("tree", a), new TypeTerm.UserType("tree", TypeTerm.STRING));
    assertThat(a.deref()).isSameInstanceAs(TypeTerm.STRING);
    TypeTerm tree = new TypeTerm.UserType("tree", TypeTerm.INT);
    TypeException e =
        assertThrows(TypeException.class, () -> unify(tree, new TypeTerm.UserType("option")));
    assertThat(e.kind).isEqualTo(TypeException.Kind.INCONSISTENT);
    e =
        assertThrows(
            TypeException.class,
            () ->
                unify(
                    new TypeTerm.UserType("tree", TypeTerm.INT),
                    new TypeTerm.UserType("tree", TypeTerm.INT, TypeTerm.INT)));
    assertThat(e.kind).isEqualTo(TypeException.Kind.ARITY_OR_SHAPE_MISMATCH);
  }

  @Test
  public void patternsUnifyTheirInnerTerms() throws TypeException {
    TypeVariable a = supply.newVariable();
    unify(new TypeTerm.Pattern(a), new TypeTerm.Pattern(new TypeTerm.ListOf(TypeTerm.INT)));
    assertThat(a.deepDeref().toString()).isEqualTo("int list");
  }

  @Test
  public void unknownUnifiesWithAnything() throws TypeException {
    TypeVariable a = supply.newVariable();
    unify(TypeTerm.UNKNOWN, a);
    unify(TypeTerm.INT, TypeTerm.UNKNOWN);
    assertThat(a.isBound()).isFalse();
  }

  @Test
  public void errorsOnlyUnifyWithVariables() throws TypeException {
    TypeTerm error = new TypeTerm.Error("bad");
    TypeVariable a = supply.newVariable();
    unify(a, error);
    assertThat(a.deref()).isSameInstanceAs(error);
    assertThrows(TypeException.class, () -> unify(error, new TypeTerm.Error("bad")));
  }

  @Test
  public void probeLeavesNoTrace() throws TypeException {
    TypeVariable a = supply.newVariable();
    TypeVariable b = supply.newVariable();
    TypeVariable c = supply.newVariable();
    unify(a, b);
    unify(b, c);
    // a -> b -> c, uncompressed
    TypeTerm left = new TypeTerm.Pair(a, TypeTerm.INT);
    assertThat(Unifier.probe(left, new TypeTerm.Pair(TypeTerm.STRING, TypeTerm.BOOL))).isNotNull();
    assertThat(a.value()).isSameInstanceAs(b);
    assertThat(c.isBound()).isFalse();
    assertThat(Unifier.unifiable(left, new TypeTerm.Pair(TypeTerm.STRING, TypeTerm.INT))).isTrue();
    assertThat(a.value()).isSameInstanceAs(b);
    assertThat(c.isBound()).isFalse();
  }

  @Test
  public void rollbackUndoesEverything() throws TypeException {
    TypeVariable a = supply.newVariable();
    TypeVariable b = supply.newVariable();
    Unifier unifier = Unifier.withTrail();
    unifier.unify(new TypeTerm.Pair(a, b), new TypeTerm.Pair(TypeTerm.INT, a));
    assertThat(b.deref()).isSameInstanceAs(TypeTerm.INT);
    assertThat(unifier.trailSize()).isGreaterThan(0);
    unifier.rollback();
    assertThat(a.isBound()).isFalse();
    assertThat(b.isBound()).isFalse();
    assertThat(unifier.trailSize()).isEqualTo(0);
  }

  @Test
  public void rollbackNeedsTrail() {
    assertThrows(IllegalStateException.class, () -> Unifier.withoutTrail().rollback());
  }
}
