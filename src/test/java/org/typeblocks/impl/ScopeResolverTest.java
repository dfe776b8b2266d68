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

import java.util.Set;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.typeblocks.impl.BasicNodes.Literal;
import org.typeblocks.types.TypeTerm;

@RunWith(JUnit4.class)
public class ScopeResolverTest {

  private final Workspace ws = new Workspace();

  private void connect(Node parent, String input, Node child) throws Exception {
    ws.connect(parent.getInput(input), child.childSide());
  }

  private static Set<String> names(Set<Binder> binders) {
    return binders.stream().map(Binder::name).collect(Collectors.toSet());
  }

  @Test
  public void innerBinderShadowsOuter() throws Exception {
    // let i = 1 in (let i = "s" in i)
    LetNode outer = new LetNode(ws, "i");
    LetNode inner = new LetNode(ws, "i");
    connect(outer, "EXP1", Literal.ofInt(ws, 1));
    connect(inner, "EXP1", Literal.ofString(ws, "s"));
    connect(outer, "EXP2", inner);
    VariableNode use = new VariableNode(ws, "i");
    connect(inner, "EXP2", use);
    assertThat(use.reference().binder()).isSameInstanceAs(inner.variable());
    assertThat(ws.typeOf(outer.output())).isSameInstanceAs(TypeTerm.STRING);
    assertThat(ws.visibleBinders(inner.getInput("EXP2"))).containsExactly(inner.variable());
    assertThat(ws.visibleBinders(inner.getInput("EXP1"))).containsExactly(outer.variable());
    assertThat(ws.visibleBinders(outer.getInput("EXP1"))).isEmpty();
  }

  @Test
  public void boundReferenceCannotLeaveItsScope() throws Exception {
    LetNode outer = new LetNode(ws, "i");
    LetNode inner = new LetNode(ws, "i");
    connect(outer, "EXP2", inner);
    Reference ref = ws.newReference("j");
    ws.bind(ref, inner.variable());
    assertThat(ref.name()).isEqualTo("i");
    assertThat(ws.canResolve(ref, inner.getInput("EXP2"))).isTrue();
    assertThat(ws.canResolve(ref, inner.getInput("EXP1"))).isFalse();
    assertThat(ws.canResolve(ref, outer.getInput("EXP2"))).isFalse();
    assertThat(ws.canResolve(ref, null)).isFalse();
    ScopeException e =
        assertThrows(
            ScopeException.class, () -> ws.connect(inner.getInput("EXP1"), ref.node().output()));
    assertThat(e.kind).isEqualTo(ScopeException.Kind.NOT_VISIBLE);
    assertThat(e.name).isEqualTo("i");
    assertThat(ref.node().output().isConnected()).isFalse();
    assertThat(ref.binder()).isSameInstanceAs(inner.variable());
    connect(inner, "EXP2", ref.node());
  }

  @Test
  public void unresolvedReferenceCannotBeAttached() throws Exception {
    LetNode let = new LetNode(ws, "x");
    VariableNode y = new VariableNode(ws, "y");
    assertThat(ws.canAttach(y, let.getInput("EXP2"))).isFalse();
    ScopeException e = assertThrows(ScopeException.class, () -> connect(let, "EXP2", y));
    assertThat(e.name).isEqualTo("y");
    assertThat(y.reference().isBound()).isFalse();
  }

  @Test
  public void bindChecksScopeOfAttachedReference() throws Exception {
    LetNode a = new LetNode(ws, "a");
    LetNode b = new LetNode(ws, "b");
    VariableNode use = new VariableNode(ws, "a");
    connect(a, "EXP2", use);
    assertThrows(ScopeException.class, () -> ws.bind(use.reference(), b.variable()));
    assertThat(use.reference().binder()).isSameInstanceAs(a.variable());
  }

  @Test
  public void subtreeBindersComeFirst() throws Exception {
    LetNode outer = new LetNode(ws, "f");
    // a detached "fun f -> f" can be attached anywhere
    LambdaNode lambda = new LambdaNode(ws, "f");
    VariableNode use = new VariableNode(ws, "f");
    connect(lambda, "RETURN", use);
    assertThat(ws.canAttach(lambda, outer.getInput("EXP2"))).isTrue();
    assertThat(ws.canAttach(lambda, null)).isTrue();
    connect(outer, "EXP2", lambda);
    assertThat(use.reference().binder()).isSameInstanceAs(lambda.binder());
  }

  @Test
  public void statementBindersAreVisibleToLaterStatements() throws Exception {
    LetStatementNode first = new LetStatementNode(ws, "x");
    LetStatementNode second = new LetStatementNode(ws, "y");
    LetStatementNode third = new LetStatementNode(ws, "z");
    ws.connect(first.next(), second.previous());
    ws.connect(second.next(), third.previous());
    connect(first, "EXP1", Literal.ofInt(ws, 1));
    VariableNode x = new VariableNode(ws, "x");
    connect(second, "EXP1", x);
    assertThat(ws.typeOf(second.binder())).isSameInstanceAs(TypeTerm.INT);
    assertThat(names(ws.visibleBinders(third.getInput("EXP1")))).containsExactly("x", "y");
    assertThat(names(ws.visibleBinders(first.next()))).containsExactly("x");
    assertThat(names(ws.visibleBinders(second.getInput("EXP1")))).containsExactly("x");
  }

  @Test
  public void referencesKeepBinderWhenDetached() throws Exception {
    LetStatementNode first = new LetStatementNode(ws, "x");
    LetStatementNode second = new LetStatementNode(ws, "y");
    ws.connect(first.next(), second.previous());
    connect(first, "EXP1", Literal.ofFloat(ws, 2.0));
    VariableNode x = new VariableNode(ws, "x");
    connect(second, "EXP1", x);
    ws.disconnect(second.previous());
    assertThat(x.reference().binder()).isSameInstanceAs(first.binder());
    assertThat(ws.typeOf(second.binder())).isSameInstanceAs(TypeTerm.FLOAT);
    assertThat(ws.canAttach(second, null)).isFalse();
    // x is out of scope in front of its declaration
    LetStatementNode zeroth = new LetStatementNode(ws, "w");
    assertThrows(ScopeException.class, () -> ws.connect(zeroth.next(), second.previous()));
    ws.connect(first.next(), second.previous());
  }

  @Test
  public void matchCasesSeeTheirPatternVariables() throws Exception {
    MatchNode match = new MatchNode(ws, 2);
    BasicNodes.PairCreate pair = new BasicNodes.PairCreate(ws);
    connect(pair, "FIRST", Literal.ofInt(ws, 1));
    connect(pair, "SECOND", Literal.ofBool(ws, true));
    connect(match, "INPUT", pair);
    PairPatternNode pattern = new PairPatternNode(ws);
    VariablePatternNode a = new VariablePatternNode(ws, "a");
    VariablePatternNode b = new VariablePatternNode(ws, "b");
    connect(pattern, "FIRST", a);
    connect(pattern, "SECOND", b);
    connect(match, "PATTERN0", pattern);
    VariableNode useB = new VariableNode(ws, "b");
    assertThat(ws.canAttach(useB, match.getInput("INPUT"))).isFalse();
    assertThat(ws.canAttach(useB, match.getInput("OUTPUT1"))).isFalse();
    connect(match, "OUTPUT0", useB);
    assertThat(useB.reference().binder()).isSameInstanceAs(b.binder());
    assertThat(ws.typeOf(a.binder())).isSameInstanceAs(TypeTerm.INT);
    assertThat(ws.typeOf(match.output())).isSameInstanceAs(TypeTerm.BOOL);
    assertThat(names(ws.visibleBinders(match.getInput("OUTPUT0")))).containsExactly("a", "b");
    assertThat(ws.visibleBinders(match.getInput("OUTPUT1"))).isEmpty();
    assertThat(ws.typeOf(match.getInput("PATTERN1")).toString()).isEqualTo("pattern(int * bool)");
  }
}
