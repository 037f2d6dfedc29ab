// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.protocalc.java.store;

import static com.google.common.truth.Truth.assertThat;
import static net.protocalc.java.syntax.TestUtils.LOC;
import static net.protocalc.java.syntax.TestUtils.assertContainsError;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.protocalc.java.policy.AccessPolicy;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.Substitution;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Store} and {@link StoreModel}. */
@RunWith(JUnit4.class)
public class StoreTest {

  private final List<CompileError> errors = new ArrayList<>();

  private static final Term A = Term.constant("a");
  private static final Term B = Term.constant("b");
  private static final Term K = Term.nonce("k", 0);
  private static final Term X = Term.var("x");
  private static final Term Y = Term.var("y");

  private Theory theory;
  private AccessPolicy policy;

  @Before
  public void setUp() {
    theory =
        Theory.builder(CompilerOptions.DEFAULT, errors)
            .declareSymbol("senc", 2, LOC)
            .declareSymbol("sdec", 2, LOC)
            .declareEquation(Term.apply("sdec", Term.apply("senc", X, Y), Y), X, LOC)
            .build();
    policy =
        AccessPolicy.builder(errors)
            .declareType("Client", TypeKind.PROCESS, LOC)
            .declareType("Net", TypeKind.CHANNEL, LOC)
            .declareType("Disk", TypeKind.FILESYS, LOC)
            .build();
  }

  private ImmutableMap<String, Store> stores() throws Exception {
    StoreModel model =
        StoreModel.builder(policy, errors)
            .declare("net", "Net", null, LOC)
            .declare("disk", "Disk", Term.pair(A, K), LOC)
            .build();
    assertThat(errors).isEmpty();
    return model.newStores(theory);
  }

  @Test
  public void testInstances() throws Exception {
    StoreModel model =
        StoreModel.builder(policy, errors)
            .declare("net", "Net", null, LOC)
            .declare("disk", "Disk", A, LOC)
            .build();
    assertThat(model.getInstances().get(0).isAttacker()).isTrue();
    assertThat(model.get("net").getKind()).isEqualTo(TypeKind.CHANNEL);
    assertThat(model.get("disk").isFile()).isTrue();
    assertThat(model.get("disk").getContent()).isEqualTo(A);
    assertThat(model.get("tape")).isNull();
  }

  @Test
  public void testBadInstances() throws Exception {
    StoreModel.builder(policy, errors)
        .declare("net", "Net", null, LOC)
        .declare("net", "Net", null, LOC)
        .declare("tape", "Tape", null, LOC)
        .declare("proc", "Client", null, LOC)
        .declare("disk", "Disk", X, LOC);
    assertContainsError(errors, "[DuplicateSymbol] in net: channel or file 'net' is already");
    assertContainsError(errors, "[UnknownType] in tape: type 'Tape' is not declared");
    assertContainsError(errors, "type 'Client' is a process type");
    assertContainsError(errors, "[UnboundVariable] in disk: initial content 'x' has unbound");
  }

  @Test
  public void testFilesStartWithTheirContent() throws Exception {
    ImmutableMap<String, Store> stores = stores();
    assertThat(stores.get("disk").getFacts()).containsExactly(Term.pair(A, K));
    assertThat(stores.get("net").isEmpty()).isTrue();
    assertThat(stores.get(StoreModel.ATTACKER).isEmpty()).isTrue();
  }

  @Test
  public void testInsertAndRemoveOccurrences() throws Exception {
    Store net = stores().get("net");
    net.insert(A);
    net.insert(A);
    net.remove(A);
    assertThat(net.getFacts()).containsExactly(A);
    net.remove(A);
    FactAbsentException ex = assertThrows(FactAbsentException.class, () -> net.remove(A));
    assertThat(ex.getInstance()).isEqualTo("net");
    assertThat(ex).hasMessageThat().isEqualTo("fact 'a' is not present in 'net'");
  }

  @Test
  public void testFactsAreKeptInNormalForm() throws Exception {
    Store net = stores().get("net");
    net.insert(Term.apply("sdec", Term.apply("senc", B, K), K));
    assertThat(net.getFacts()).containsExactly(B);
    net.remove(B);
    assertThat(net.isEmpty()).isTrue();
  }

  @Test
  public void testMatchConsumeOffersOneChoicePerFact() throws Exception {
    Store net = stores().get("net");
    net.insert(Term.pair(A, K));
    net.insert(Term.pair(B, K));
    net.insert(A);
    ImmutableList<Store.Choice> choices = net.matchConsume(Term.pair(X, K));
    assertThat(choices).hasSize(2);
    List<Term> bound = new ArrayList<>();
    for (Store.Choice choice : choices) {
      bound.add(choice.getSubstitution().get("x"));
    }
    assertThat(bound).containsExactly(A, B);

    net.consume(choices.get(0));
    assertThat(net.getFacts()).hasSize(2);
    assertThat(net.matchConsume(Term.pair(X, K))).hasSize(1);
  }

  @Test
  public void testMatchConsumeBlocksOnNoMatch() throws Exception {
    Store net = stores().get("net");
    net.insert(A);
    assertThat(net.matchConsume(Term.pair(X, Y))).isEmpty();
  }

  @Test
  public void testReadDoesNotConsume() throws Exception {
    Store disk = stores().get("disk");
    ImmutableList<Store.Choice> choices = disk.read(Term.pair(X, Y));
    assertThat(choices).hasSize(1);
    Substitution subst = choices.get(0).getSubstitution();
    assertThat(subst.get("x")).isEqualTo(A);
    assertThat(subst.get("y")).isEqualTo(K);
    assertThat(disk.read(Term.pair(X, Y))).hasSize(1);
    assertThat(disk.getFacts()).hasSize(1);
    assertThat(disk.read(B)).isEmpty();
  }

  @Test
  public void testReadOffersEveryMatchingFact() throws Exception {
    Store net = stores().get("net");
    net.insert(Term.pair(A, B));
    net.insert(Term.pair(B, A));
    net.insert(A);
    ImmutableList<Store.Choice> choices = net.read(Term.pair(X, Y));
    assertThat(choices).hasSize(2);
    assertThat(choices.get(0).getFact()).isEqualTo(Term.pair(A, B));
    assertThat(choices.get(0).getSubstitution().get("x")).isEqualTo(A);
    assertThat(choices.get(1).getFact()).isEqualTo(Term.pair(B, A));
    assertThat(choices.get(1).getSubstitution().get("x")).isEqualTo(B);
    assertThat(net.getFacts()).hasSize(3);
  }

  @Test
  public void testAttackerFacts() throws Exception {
    assertThat(StoreModel.leakFact(A)).isEqualTo(Term.apply(StoreModel.OUT, A));
    assertThat(StoreModel.injectFact(X).toString()).isEqualTo("In(x)");
  }
}
