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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.typeblocks.impl.BasicNodes.Apply;
import org.typeblocks.impl.BasicNodes.ListCreate;
import org.typeblocks.impl.BasicNodes.Literal;
import org.typeblocks.impl.BasicNodes.PairCreate;
import org.typeblocks.impl.BasicNodes.Ternary;
import org.typeblocks.types.TypeException;
import org.typeblocks.types.TypeTerm;
import org.typeblocks.types.TypeVariable;

@RunWith(JUnit4.class)
public class ConnectionTest {

  private final Workspace ws = new Workspace();

  private void connect(Node parent, String input, Node child) throws Exception {
    ws.connect(parent.getInput(input), child.childSide());
  }

  @Test
  public void joinedConnectionsShareTheirRepresentative() throws Exception {
    Ternary ternary = new Ternary(ws);
    Apply apply = new Apply(ws);
    PairCreate pair = new PairCreate(ws);
    connect(ternary, "THEN", apply);
    connect(pair, "FIRST", ternary);
    Connection then = ternary.getInput("THEN");
    assertThat(then.term().deref()).isSameInstanceAs(apply.output().term().deref());
    assertThat(then.peer()).isSameInstanceAs(apply.output());
    assertThat(apply.output().peer()).isSameInstanceAs(then);
    assertThat(apply.parent()).isSameInstanceAs(ternary);
    assertThat(ternary.output().term().deref())
        .isSameInstanceAs(((TypeTerm.Pair) pair.output().term().deref()).first.deref());
    connect(ternary, "ELSE", Literal.ofInt(ws, 3));
    assertThat(ws.typeOf(pair.output()).toString()).matches("int \\* 't\\d+");
    assertThat(ws.typeOf(apply.output())).isSameInstanceAs(TypeTerm.INT);
  }

  @Test
  public void bindingAndDisconnectingGivesFreshVariable() throws Exception {
    LetStatementNode let = new LetStatementNode(ws, "x");
    Binder x = let.binder();
    int originalId = ((TypeVariable) ws.typeOf(x)).id();
    Literal three = Literal.ofInt(ws, 3);
    connect(let, "EXP1", three);
    assertThat(ws.typeOf(x)).isSameInstanceAs(TypeTerm.INT);
    ws.disconnect(let.getInput("EXP1"));
    TypeTerm after = ws.typeOf(x);
    assertThat(after).isInstanceOf(TypeVariable.class);
    assertThat(((TypeVariable) after).id()).isNotEqualTo(originalId);
    assertThat(three.output().isConnected()).isFalse();
  }

  @Test
  public void disconnectIsLocal() throws Exception {
    Ternary ternary = new Ternary(ws);
    Apply apply = new Apply(ws);
    connect(ternary, "THEN", Literal.ofInt(ws, 1));
    connect(ternary, "ELSE", apply);
    assertThat(ws.typeOf(apply.output())).isSameInstanceAs(TypeTerm.INT);
    TypeTerm shared = ternary.output().term().deref();
    ws.disconnect(apply.output());
    assertThat(ws.typeOf(ternary.output())).isSameInstanceAs(TypeTerm.INT);
    assertThat(ws.typeOf(ternary.getInput("ELSE"))).isSameInstanceAs(shared);
    assertThat(apply.output().term().isVariable()).isTrue();
    assertThat(apply.output().term().deref())
        .isNotSameInstanceAs(ternary.getInput("ELSE").term().deref());
  }

  @Test
  public void detachedSideGetsTheFreshVariable() throws Exception {
    Ternary ternary = new Ternary(ws);
    Apply first = new Apply(ws);
    Apply second = new Apply(ws);
    connect(ternary, "THEN", first);
    connect(ternary, "ELSE", second);
    TypeVariable shared = (TypeVariable) ternary.output().term().deref();
    int sharedId = shared.id();
    assertThat(second.output().term().deref()).isSameInstanceAs(shared);

    ws.disconnect(ternary.getInput("ELSE"));
    assertThat(ternary.output().term().deref()).isSameInstanceAs(shared);
    assertThat(ternary.getInput("ELSE").term().deref()).isSameInstanceAs(shared);
    assertThat(first.output().term().deref()).isSameInstanceAs(shared);
    assertThat(shared.id()).isEqualTo(sharedId);
    assertThat(ws.typeOf(ternary.output()).toString()).isEqualTo("'t" + sharedId);
    TypeTerm detached = second.output().term().deref();
    assertThat(detached).isNotSameInstanceAs(shared);
    assertThat(((TypeVariable) detached).id()).isNotEqualTo(sharedId);
  }

  @Test
  public void failedConnectChangesNothing() throws Exception {
    Ternary ternary = new Ternary(ws);
    ListCreate list = new ListCreate(ws, 2);
    connect(ternary, "THEN", list);
    Apply apply = new Apply(ws);
    connect(list, "ADD0", apply);
    String before = ws.typeOf(ternary.output()).toString();
    Literal flag = Literal.ofBool(ws, true);
    TypeException e =
        assertThrows(TypeException.class, () -> connect(ternary, "ELSE", flag));
    assertThat(e.kind).isEqualTo(TypeException.Kind.INCONSISTENT);
    assertThat(ternary.getInput("ELSE").isConnected()).isFalse();
    assertThat(flag.output().isConnected()).isFalse();
    assertThat(ws.typeOf(ternary.output()).toString()).isEqualTo(before);
    assertThat(ws.typeOf(apply.output()).isVariable()).isTrue();
  }

  @Test
  public void occursCheckRejectsConnect() throws Exception {
    // fun x -> x x
    LambdaNode lambda = new LambdaNode(ws, "x");
    Apply apply = new Apply(ws);
    connect(lambda, "RETURN", apply);
    connect(apply, "FUN", new VariableNode(ws, "x"));
    VariableNode arg = new VariableNode(ws, "x");
    TypeException e = assertThrows(TypeException.class, () -> connect(apply, "ARG", arg));
    assertThat(e.kind).isEqualTo(TypeException.Kind.OCCURS_CHECK);
    assertThat(apply.getInput("ARG").isConnected()).isFalse();
    assertThat(arg.reference().isBound()).isFalse();
    assertThat(ws.typeOf(lambda.binder()).toString()).matches("'t\\d+ -> 't\\d+");
  }

  @Test
  public void misuseIsRejected() throws Exception {
    Ternary ternary = new Ternary(ws);
    Literal one = Literal.ofInt(ws, 1);
    LetStatementNode stmt = new LetStatementNode(ws, "x");
    // wrong kinds
    assertThrows(
        IllegalArgumentException.class, () -> ws.connect(one.output(), ternary.output()));
    assertThrows(
        IllegalArgumentException.class, () -> ws.connect(stmt.next(), one.output()));
    // different workspace
    Workspace other = new Workspace();
    Literal elsewhere = Literal.ofInt(other, 2);
    assertThrows(
        IllegalArgumentException.class,
        () -> ws.connect(ternary.getInput("THEN"), elsewhere.output()));
    connect(ternary, "THEN", one);
    // already connected
    assertThrows(IllegalStateException.class, () -> connect(ternary, "ELSE", one));
    // cycle
    Ternary inner = new Ternary(ws);
    connect(ternary, "ELSE", inner);
    assertThrows(IllegalArgumentException.class, () -> connect(inner, "THEN", ternary));
    // nothing to disconnect
    assertThrows(IllegalStateException.class, () -> ws.disconnect(inner.getInput("THEN")));
  }

  @Test
  public void statementsCarryNoType() throws Exception {
    LetStatementNode first = new LetStatementNode(ws, "x");
    LetStatementNode second = new LetStatementNode(ws, "y");
    ws.connect(first.next(), second.previous());
    assertThat(second.parent()).isSameInstanceAs(first);
    assertThat(ws.typeOf(first.next())).isSameInstanceAs(TypeTerm.UNKNOWN);
    assertThat(ws.topLevelNodes()).containsExactly(first);
  }

  @Test
  public void resizingAListDetachesRemovedItems() throws Exception {
    ListCreate list = new ListCreate(ws, 2);
    Literal one = Literal.ofInt(ws, 1);
    connect(list, "ADD1", one);
    assertThat(ws.typeOf(list.output()).toString()).isEqualTo("int list");
    list.resize(1);
    assertThat(list.inputs()).hasSize(1);
    assertThat(one.output().isConnected()).isFalse();
    assertThat(ws.typeOf(list.output()).toString()).matches("'t\\d+ list");
    list.resize(3);
    connect(list, "ADD2", Literal.ofFloat(ws, 1.5));
    assertThrows(TypeException.class, () -> connect(list, "ADD0", Literal.ofBool(ws, false)));
    assertThat(ws.typeOf(list.output()).toString()).isEqualTo("float list");
  }

  @Test
  public void functionsFlowThroughApply() throws Exception {
    LambdaNode lambda = new LambdaNode(ws, "x");
    VariableNode x = new VariableNode(ws, "x");
    connect(lambda, "RETURN", x);
    assertThat(x.reference().binder()).isSameInstanceAs(lambda.binder());
    assertThat(TypeTerm.isVariant(ws.typeOf(lambda.output()), fn(ws.typeOf(x.output())))).isTrue();
    Apply apply = new Apply(ws);
    connect(apply, "FUN", lambda);
    connect(apply, "ARG", Literal.ofString(ws, "s"));
    assertThat(ws.typeOf(apply.output())).isSameInstanceAs(TypeTerm.STRING);
    assertThat(ws.typeOf(lambda.binder())).isSameInstanceAs(TypeTerm.STRING);
  }

  private static TypeTerm fn(TypeTerm t) {
    return new TypeTerm.Function(t, t);
  }
}
