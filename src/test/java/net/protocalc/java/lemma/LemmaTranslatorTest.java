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

package net.protocalc.java.lemma;

import static com.google.common.truth.Truth.assertThat;
import static net.protocalc.java.syntax.TestUtils.LOC;
import static net.protocalc.java.syntax.TestUtils.allTraces;
import static net.protocalc.java.syntax.TestUtils.assertContainsError;
import static net.protocalc.java.syntax.TestUtils.at;
import static net.protocalc.java.syntax.TestUtils.corresponds;
import static net.protocalc.java.syntax.TestUtils.existsTrace;
import static net.protocalc.java.syntax.TestUtils.expr;
import static net.protocalc.java.syntax.TestUtils.model;
import static net.protocalc.java.syntax.TestUtils.reachable;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.protocalc.java.elab.SystemCompiler;
import net.protocalc.java.ir.NormalizedLemma;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.LemmaFormula;
import net.protocalc.java.syntax.ModelFile;
import net.protocalc.java.syntax.TestModels;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests of lemma translation, on the symmetric handshake, whose processes emit {@code Sent(msg)}
 * and {@code Valid(msg)}.
 */
@RunWith(JUnit4.class)
public class LemmaTranslatorTest {

  private CompilerOptions options = CompilerOptions.DEFAULT;

  private List<String> translate(Declaration.Lemma... lemmas) throws Exception {
    List<String> result = new ArrayList<>();
    for (NormalizedLemma lemma :
        SystemCompiler.compile(handshake(lemmas), options).getLemmas()) {
      result.add(lemma.toString());
    }
    return result;
  }

  private String translateOne(Declaration.Lemma lemma) throws Exception {
    return translate(lemma).get(0);
  }

  private List<CompileError> errors(Declaration.Lemma... lemmas) {
    return assertThrows(
            CompileError.Exception.class,
            () -> SystemCompiler.compile(handshake(lemmas), options))
        .errors();
  }

  private static ModelFile handshake(Declaration.Lemma... lemmas) {
    return model(
        TestModels.symmetricDeclarations(),
        ImmutableList.of("Client(net, nonces)", "Server(net, nonces)"),
        ImmutableList.copyOf(lemmas));
  }

  private static LemmaFormula and(LemmaFormula... operands) {
    return LemmaFormula.and(LOC, ImmutableList.copyOf(operands));
  }

  private static LemmaFormula precedes(String before, String after) {
    return LemmaFormula.precedes(LOC, before, after);
  }

  @Test
  public void testReachable() throws Exception {
    assertThat(translateOne(reachable("r", "Sent(m)", "Valid(m)")))
        .isEqualTo(
            "lemma r: exists-trace exists m #i1 #i2. (Sent(m) @ #i1 & Valid(m) @ #i2 & #i1 < #i2)");
    assertThat(translateOne(reachable("one", "Valid(x)")))
        .isEqualTo("lemma one: exists-trace exists x #i1. Valid(x) @ #i1");
  }

  @Test
  public void testUnorderedReachable() throws Exception {
    options = CompilerOptions.builder().orderReachableEvents(false).build();
    assertThat(translateOne(reachable("r", "Sent(m)", "Valid(m)")))
        .isEqualTo("lemma r: exists-trace exists m #i1 #i2. (Sent(m) @ #i1 & Valid(m) @ #i2)");
  }

  @Test
  public void testIndexNamesAvoidTermVariables() throws Exception {
    assertThat(translateOne(reachable("r", "Sent(i1)")))
        .isEqualTo("lemma r: exists-trace exists i1 #i1'. Sent(i1) @ #i1'");
  }

  @Test
  public void testCorrespondence() throws Exception {
    assertThat(translateOne(corresponds("auth", "Valid(m)", "Sent(m)")))
        .isEqualTo(
            "lemma auth: all-traces forall m #i. (Valid(m) @ #i ==> exists #j. (Sent(m) @ #j &"
                + " #j < #i))");
    // Variables of the conclusion only are existential.
    assertThat(translateOne(corresponds("weak", "Valid(m)", "Sent(n2)")))
        .isEqualTo(
            "lemma weak: all-traces forall m #i. (Valid(m) @ #i ==> exists n2 #j. (Sent(n2) @ #j &"
                + " #j < #i))");
  }

  @Test
  public void testExplicitQuantifiers() throws Exception {
    LemmaFormula formula =
        LemmaFormula.forall(
            LOC,
            ImmutableList.of("m", "i"),
            LemmaFormula.implies(
                LOC,
                at("Valid(m)", "i"),
                LemmaFormula.exists(
                    LOC,
                    ImmutableList.of("j"),
                    and(at("Sent(m)", "j"), precedes("j", "i")))));
    assertThat(translateOne(allTraces("auth", formula)))
        .isEqualTo(
            "lemma auth: all-traces forall m #i. (Valid(m) @ #i ==> exists #j. (Sent(m) @ #j &"
                + " #j < #i))");
  }

  @Test
  public void testFreeVariablesAreClosedByTheTraceQuantifier() throws Exception {
    LemmaFormula formula = and(at("Sent(m)", "i"), at("Valid(m)", "j"), precedes("i", "j"));
    assertThat(translateOne(existsTrace("e", formula)))
        .isEqualTo(
            "lemma e: exists-trace exists m #i #j. (Sent(m) @ #i & Valid(m) @ #j & #i < #j)");
    assertThat(translateOne(allTraces("a", formula)))
        .isEqualTo("lemma a: all-traces forall m #i #j. (Sent(m) @ #i & Valid(m) @ #j & #i < #j)");
  }

  @Test
  public void testConstantsAreNotVariables() throws Exception {
    LemmaFormula formula =
        and(
            at("Valid(m)", "i"),
            LemmaFormula.not(LOC, LemmaFormula.equal(LOC, expr("m"), expr("(n, \"x\")"))));
    assertThat(translateOne(existsTrace("e", formula)))
        .isEqualTo(
            "lemma e: exists-trace exists m #i. (Valid(m) @ #i & not(m = pair(~n.1, \"x\")))");
  }

  @Test
  public void testOrderOnlyIndexIsFree() throws Exception {
    assertContainsError(
        errors(existsTrace("bad", and(at("Sent(m)", "i"), precedes("i", "j")))),
        "[FreeLemmaVariable] in bad: trace variable 'j' is bound neither by a quantifier nor by"
            + " an event");
  }

  @Test
  public void testUnknownEvents() throws Exception {
    List<CompileError> errors =
        errors(reachable("missing", "Recv(m)"), reachable("arity", "Sent(m, m)"));
    assertContainsError(
        errors, "[UnknownEventTag] in missing: no process emits an event 'Recv' with 1 arguments");
    assertContainsError(
        errors, "[UnknownEventTag] in arity: no process emits an event 'Sent' with 2 arguments");
  }

  @Test
  public void testUnknownEventsMayBeAllowed() throws Exception {
    options = CompilerOptions.builder().checkEventVocabulary(false).build();
    assertThat(translateOne(reachable("r", "Recv(m)")))
        .isEqualTo("lemma r: exists-trace exists m #i1. Recv(m) @ #i1");
  }

  @Test
  public void testUnknownFunction() throws Exception {
    assertContainsError(
        errors(reachable("r", "Sent(h(m))")),
        "[UnknownSymbol] in r: 'h' is not a declared function of arity 1");
    assertContainsError(
        errors(reachable("r", "Sent(senc(m))")), "'senc' is not a declared function of arity 1");
  }

  @Test
  public void testDuplicateLemma() throws Exception {
    assertContainsError(
        errors(reachable("r", "Sent(m)"), reachable("r", "Valid(m)")),
        "[DuplicateSymbol] in r: lemma 'r' is already declared");
  }

  @Test
  public void testLemmasKeepTheirOrder() throws Exception {
    assertThat(
            translate(
                reachable("b", "Valid(m)"),
                corresponds("a", "Valid(m)", "Sent(m)"),
                reachable("c", "Sent(m)")))
        .hasSize(3);
    assertThat(translate(reachable("b", "Valid(m)"), reachable("a", "Sent(m)")).get(1))
        .startsWith("lemma a:");
  }
}
