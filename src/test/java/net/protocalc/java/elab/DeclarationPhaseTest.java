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
import static net.protocalc.java.syntax.TestUtils.equation;
import static net.protocalc.java.syntax.TestUtils.freshConstant;
import static net.protocalc.java.syntax.TestUtils.function;
import static net.protocalc.java.syntax.TestUtils.grant;
import static net.protocalc.java.syntax.TestUtils.insert;
import static net.protocalc.java.syntax.TestUtils.instance;
import static net.protocalc.java.syntax.TestUtils.invoke;
import static net.protocalc.java.syntax.TestUtils.model;
import static net.protocalc.java.syntax.TestUtils.param;
import static net.protocalc.java.syntax.TestUtils.passiveAttack;
import static net.protocalc.java.syntax.TestUtils.process;
import static net.protocalc.java.syntax.TestUtils.reachable;
import static net.protocalc.java.syntax.TestUtils.ret;
import static net.protocalc.java.syntax.TestUtils.syscall;
import static net.protocalc.java.syntax.TestUtils.type;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.Term;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the checking of global declarations. */
@RunWith(JUnit4.class)
public class DeclarationPhaseTest {

  // The composition is not looked at by the declaration phase.
  private static Environment run(Declaration... decls) throws CompileError.Exception {
    List<Declaration> all =
        new ArrayList<>(
            ImmutableList.of(
                type("P", TypeKind.PROCESS),
                type("C", TypeKind.CHANNEL),
                type("D", TypeKind.FILESYS)));
    all.addAll(Arrays.asList(decls));
    return DeclarationPhase.run(
        model(all, ImmutableList.of("Main()"), ImmutableList.of(reachable("r", "Done()"))),
        CompilerOptions.DEFAULT);
  }

  private static List<CompileError> errors(Declaration... decls) {
    return assertThrows(CompileError.Exception.class, () -> run(decls)).errors();
  }

  @Test
  public void testEnvironment() throws Exception {
    Environment env =
        run(
            function("h", 1),
            equation("h(h(x))", "x"),
            constant("c"),
            freshConstant("k"),
            instance("ch", "C", null),
            instance("f", "D", "(c, k)"),
            grant("P", "C", "send"));
    assertThat(env.getFile()).isEqualTo("test.pcl");
    assertThat(env.getTheory().getEquations()).hasSize(3);
    assertThat(env.getConstant("c")).isEqualTo(Term.constant("c"));
    assertThat(env.getConstant("k")).isInstanceOf(Term.Nonce.class);
    assertThat(env.getConstant("x")).isNull();
    assertThat(env.getInit().toString()).isEqualTo("[new k = ~k.0]");
    assertThat(env.getStoreModel().get("f").getContent().toString())
        .isEqualTo("pair(c, ~k.0)");
    assertThat(env.getSyscall("send")).isSameInstanceAs(DeclarationPhase.SEND);
    assertThat(env.getSyscall("recv")).isSameInstanceAs(DeclarationPhase.RECV);
    assertThat(env.getPolicy().checkInvocation("P", "C", "send")).isTrue();
  }

  @Test
  public void testAllErrorsAreReportedTogether() throws Exception {
    List<CompileError> errors =
        errors(
            function("h", 1),
            function("h", 2),
            instance("tape", "Tape", null),
            grant("P", "C", "teleport"));
    assertThat(errors).hasSize(3);
    assertContainsError(errors, "[DuplicateSymbol] in h: 'h' is already declared at");
    assertContainsError(errors, "[UnknownType] in tape: type 'Tape' is not declared");
    assertContainsError(
        errors, "[UnknownSymbol] in allow P: 'teleport' is not a syscall or passive attack");
  }

  @Test
  public void testOneNamespace() throws Exception {
    List<CompileError> errors =
        errors(
            function("x", 0),
            constant("x"),
            instance("x", "C", null),
            syscall("x", ImmutableList.of(), ret(null)));
    assertThat(errors).hasSize(3);
    for (CompileError error : errors) {
      assertThat(error.kind()).isEqualTo(CompileError.Kind.DUPLICATE_SYMBOL);
    }
  }

  @Test
  public void testReservedNames() throws Exception {
    assertContainsError(
        errors(constant("attacker")),
        "[DuplicateSymbol] in attacker: 'attacker' is reserved for the attacker's knowledge");
    assertContainsError(errors(function("fst", 1)), "'fst' is a built-in function");
  }

  @Test
  public void testUserSyscallReplacesBuiltin() throws Exception {
    Declaration.Syscall send =
        syscall("send", ImmutableList.of("ch", "x"), insert("ch", "(x, x)"));
    Environment env = run(send);
    assertThat(env.getSyscall("send")).isSameInstanceAs(send);
    assertThat(env.getSyscall("recv")).isSameInstanceAs(DeclarationPhase.RECV);
  }

  @Test
  public void testGrants() throws Exception {
    Declaration forge = activeAttack("forge", "recv", ImmutableList.of("ch"), ret("\"x\""));
    assertContainsError(
        errors(forge, grant("P", "C", "forge")),
        "'forge' is not a syscall or passive attack");
    assertContainsError(
        errors(attackerGrant("P", "nope")),
        "[UnknownSymbol] in allow attack P: 'nope' is not an attack or syscall");
    assertContainsError(
        errors(grant("P", "Q", "send")), "[UnknownType] in allow P Q: type 'Q' is not declared");
  }

  @Test
  public void testActiveAttackSignature() throws Exception {
    assertContainsError(
        errors(activeAttack("forge", "recv", ImmutableList.of("a", "b"), ret(null))),
        "[ArityMismatch] in forge: attack 'forge' has 2 parameters but syscall 'recv' has 1");
    assertContainsError(
        errors(activeAttack("forge", "teleport", ImmutableList.of("a"), ret(null))),
        "[UnknownSymbol] in forge: attack 'forge' overrides undeclared syscall 'teleport'");
  }

  @Test
  public void testProcessSignature() throws Exception {
    List<CompileError> errors =
        errors(
            process("A", "C", ImmutableList.of(), ret(null)),
            process("B", "Nope", ImmutableList.of(), ret(null)),
            process("E", "P", ImmutableList.of(param("x", "P")), ret(null)));
    assertContainsError(errors, "[UnknownType] in A: type 'C' is not a process type");
    assertContainsError(errors, "[UnknownType] in B: type 'Nope' is not declared");
    assertContainsError(
        errors,
        "[UnknownType] in E: parameter 'x' has type 'P', which is not a declared channel or"
            + " filesys type");
  }

  @Test
  public void testGlobalTerms() throws Exception {
    assertContainsError(
        errors(instance("f", "D", "g(c)"), constant("c")),
        "[UnknownSymbol] in f: 'g/1' is not a declared function");
    assertContainsError(
        errors(function("h", 1), equation("h(x, y)", "x")),
        "[UnknownSymbol] in equation h(x, y) = x:");
  }

  @Test
  public void testRecursion() throws Exception {
    assertContainsError(
        errors(
            syscall("a", ImmutableList.of(), invoke("b()")),
            syscall("b", ImmutableList.of(), invoke("a()"))),
        "[RecursiveSyscall] in a: syscall 'a' is recursive: a -> b -> a");
    assertContainsError(
        errors(syscall("loop", ImmutableList.of(), invoke("loop()"))),
        "syscall 'loop' is recursive: loop -> loop");
  }

  @Test
  public void testRecursionUnderAnAttack() throws Exception {
    // leak calls relay and relay calls leak; the elaborator would inline them forever.
    assertContainsError(
        errors(
            syscall("relay", ImmutableList.of("x"), invoke("leak(x)")),
            passiveAttack("leak", ImmutableList.of("x"), invoke("relay(x)"))),
        "[RecursiveSyscall] in leak: attack 'leak' is recursive: leak -> relay -> leak");
  }

  @Test
  public void testCallsUnderAnAttackAreNotReplaced() throws Exception {
    // tamper replaces send and calls relay, whose call of send is then never replaced.
    Environment env =
        run(
            syscall("relay", ImmutableList.of("ch", "x"), invoke("send(ch, x)")),
            activeAttack("tamper", "send", ImmutableList.of("ch", "x"), invoke("relay(ch, x)")));
    assertThat(env.getAttacksOn("send")).hasSize(1);
  }

  @Test
  public void testAttackerGrantsMayListSyscalls() throws Exception {
    Environment env = run(attackerGrant("P", "send"));
    assertThat(env.getPolicy().attackerMayInvoke("P", "send")).isTrue();
  }
}
