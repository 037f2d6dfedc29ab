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

package net.protocalc.java.elab;

import static com.google.common.truth.Truth.assertThat;
import static net.protocalc.java.syntax.TestUtils.activeAttack;
import static net.protocalc.java.syntax.TestUtils.assertContainsError;
import static net.protocalc.java.syntax.TestUtils.attackerGrant;
import static net.protocalc.java.syntax.TestUtils.constant;
import static net.protocalc.java.syntax.TestUtils.emit;
import static net.protocalc.java.syntax.TestUtils.equation;
import static net.protocalc.java.syntax.TestUtils.function;
import static net.protocalc.java.syntax.TestUtils.grant;
import static net.protocalc.java.syntax.TestUtils.insert;
import static net.protocalc.java.syntax.TestUtils.instance;
import static net.protocalc.java.syntax.TestUtils.model;
import static net.protocalc.java.syntax.TestUtils.newNonce;
import static net.protocalc.java.syntax.TestUtils.param;
import static net.protocalc.java.syntax.TestUtils.process;
import static net.protocalc.java.syntax.TestUtils.reachable;
import static net.protocalc.java.syntax.TestUtils.seq;
import static net.protocalc.java.syntax.TestUtils.type;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.protocalc.java.ir.CompiledSystem;
import net.protocalc.java.ir.Condition;
import net.protocalc.java.ir.ProcessInstance;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.ir.TransitionGraph;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.ModelFile;
import net.protocalc.java.syntax.TestModels;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.Substitution;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests of {@link SystemCompiler}. */
@RunWith(JUnit4.class)
public class SystemCompilerTest {

  private static List<CompileError> errors(ModelFile file) {
    return assertThrows(
            CompileError.Exception.class,
            () -> SystemCompiler.compile(file, CompilerOptions.DEFAULT))
        .errors();
  }

  private static ModelFile symmetricSystem(String... processes) {
    return model(
        TestModels.symmetricDeclarations(),
        ImmutableList.copyOf(processes),
        ImmutableList.of(reachable("r", "Sent(m)")));
  }

  @Test
  public void testSymmetricHandshake() throws Exception {
    CompiledSystem system = SystemCompiler.compile(TestModels.symmetric(), CompilerOptions.DEFAULT);
    assertThat(system.getName()).isEqualTo("test.pcl");
    assertThat(system.getProcesses()).hasSize(2);
    ProcessInstance client = system.getProcess("Client");
    assertThat(client.getTemplate()).isEqualTo("Client");
    assertThat(client.getProcessType()).isEqualTo("client_ty");
    assertThat(client.getArguments()).containsExactly("ch", "net", "f", "nonces").inOrder();
    assertThat(system.getInit().toString()).isEqualTo("[new k = ~k.0, new n = ~n.1]");
    assertThat(system.getCausalEdges().toString()).isEqualTo("[Client#6 -> Server#1 via net]");
    assertThat(system.getLemmas()).hasSize(2);
  }

  @Test
  public void testServerGuardHoldsForTheHonestMessage() throws Exception {
    CompiledSystem system = SystemCompiler.compile(TestModels.symmetric(), CompilerOptions.DEFAULT);
    Theory theory = system.getTheory();
    TransitionGraph server = system.getProcess("Server").getGraph();
    int guardNode = server.indicesOf(Transition.Kind.GUARD).get(0);
    Condition condition = ((Transition.Guard) server.get(guardNode)).getConditions().get(0);
    assertThat(condition.toString()).isEqualTo("snd(sdec(r, ~k.0)) = nonce");

    Term k = system.getInit().get(0).getNonce();
    Term n = system.getStoreModel().get("nonces").getContent();
    Term msg = Term.constant("a");
    Substitution honest =
        Substitution.EMPTY
            .with("r", Term.apply("senc", Term.pair(msg, n), k))
            .with("nonce", n);
    assertThat(theory.equal(honest.apply(condition.getLHS()), honest.apply(condition.getRHS())))
        .isTrue();
    Substitution wrongKey =
        Substitution.EMPTY
            .with("r", Term.apply("senc", Term.pair(msg, n), Term.constant("k2")))
            .with("nonce", n);
    assertThat(
            theory.equal(wrongKey.apply(condition.getLHS()), wrongKey.apply(condition.getRHS())))
        .isFalse();

    // Valid is emitted only past the guard.
    int emitNode = server.indicesOf(Transition.Kind.EMIT).get(0);
    assertThat(server.getPredecessors(emitNode)).containsExactly(guardNode);
  }

  @Test
  public void testRepeatedTemplatesAreNumbered() throws Exception {
    ModelFile file =
        model(
            ImmutableList.of(
                type("P", TypeKind.PROCESS),
                type("C", TypeKind.CHANNEL),
                instance("ch", "C", null),
                process(
                    "A",
                    "P",
                    ImmutableList.of(param("ch", "C")),
                    seq(newNonce("n"), emit("E(n)")))),
            ImmutableList.of("A(ch)", "A(ch)"),
            ImmutableList.of(reachable("r", "E(x)")));
    CompiledSystem system = SystemCompiler.compile(file, CompilerOptions.DEFAULT);
    assertThat(system.getProcesses().get(0).getName()).isEqualTo("A#1");
    assertThat(system.getProcesses().get(1).getName()).isEqualTo("A#2");
    Term.Nonce first =
        system.getProcess("A#1").getGraph().transitionsOf(Transition.Fresh.class).get(0).getNonce();
    Term.Nonce second =
        system.getProcess("A#2").getGraph().transitionsOf(Transition.Fresh.class).get(0).getNonce();
    assertThat(first).isNotEqualTo(second);
  }

  @Test
  public void testNoncesAreDistinctAcrossContinuations() throws Exception {
    CompiledSystem system =
        SystemCompiler.compile(
            TestModels.symmetric(
                activeAttack(
                    "replace",
                    "send",
                    ImmutableList.of("ch", "x"),
                    seq(newNonce("y"), insert("ch", "y"))),
                attackerGrant("client_ty", "replace")),
            CompilerOptions.DEFAULT);
    TransitionGraph client = system.getProcess("Client").getGraph();
    assertThat(client.indicesOf(Transition.Kind.ALTERNATIVES)).hasSize(1);
    Set<Integer> ids = new HashSet<>();
    for (Transition.Fresh fresh : system.getInit()) {
      assertThat(ids.add(fresh.getNonce().getId())).isTrue();
    }
    for (Transition.Fresh fresh : client.transitionsOf(Transition.Fresh.class)) {
      assertThat(ids.add(fresh.getNonce().getId())).isTrue();
    }
    assertThat(ids).hasSize(4);
    // Both continuations may supply the server's reception.
    assertThat(system.getCausalEdges()).hasSize(2);
  }

  @Test
  public void testUnknownTemplate() throws Exception {
    assertContainsError(
        errors(symmetricSystem("Nope(net)")),
        "[UnknownSymbol] in system: 'Nope' is not a process template");
  }

  @Test
  public void testBadArguments() throws Exception {
    List<CompileError> errors =
        errors(
            symmetricSystem(
                "Client(net)",
                "Client(attacker, nonces)",
                "Client(k, nonces)",
                "Server(nonces, net)"));
    assertContainsError(
        errors, "[ArityMismatch] in system: process 'Client' takes 2 arguments, got 1");
    assertContainsError(
        errors,
        "[UnknownType] in system: the attacker's knowledge is not an argument; processes name"
            + " 'attacker' directly");
    assertContainsError(
        errors,
        "[UnknownSymbol] in system: argument 'k' of process 'Client' is not a channel or file"
            + " instance");
    assertContainsError(
        errors,
        "instance 'nonces' has type 'disk_ty', but parameter 'ch' of process 'Server' expects"
            + " 'net_ty'");
    assertContainsError(
        errors,
        "instance 'net' has type 'net_ty', but parameter 'f' of process 'Server' expects"
            + " 'disk_ty'");
  }

  @Test
  public void testProcessErrorsStopBeforeAnalysis() throws Exception {
    // The lemma mentions an event no process emits, but the process error comes first.
    List<CompileError> errors =
        errors(
            model(
                ImmutableList.of(
                    type("P", TypeKind.PROCESS),
                    type("C", TypeKind.CHANNEL),
                    instance("ch", "C", null),
                    grant("P", "C", "send"),
                    process(
                        "A",
                        "P",
                        ImmutableList.of(param("ch", "C")),
                        emit("E(unbound)"))),
                ImmutableList.of("A(ch)"),
                ImmutableList.of(reachable("r", "Missing()"))));
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind()).isEqualTo(CompileError.Kind.UNBOUND_VARIABLE);
  }

  @Test
  public void testDivergentTheoryIsReportedAsACompileError() throws Exception {
    List<CompileError> errors =
        errors(
            model(
                ImmutableList.of(
                    type("P", TypeKind.PROCESS),
                    type("C", TypeKind.CHANNEL),
                    function("f", 1),
                    function("g", 1),
                    equation("f(x)", "g(f(x))"),
                    constant("c"),
                    instance("ch", "C", null),
                    process(
                        "A",
                        "P",
                        ImmutableList.of(param("ch", "C")),
                        seq(insert("ch", "f(c)"), emit("Done()")))),
                ImmutableList.of("A(ch)"),
                ImmutableList.of(reachable("r", "Done()"))));
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind()).isEqualTo(CompileError.Kind.THEORY_DIVERGENCE);
    assertContainsError(
        errors,
        "[TheoryDivergence] in A: normalization of 'f(c)' did not terminate within 3000 rewrite"
            + " steps");
  }
}
