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

import net.protocalc.java.elab.SystemCompiler;
import net.protocalc.java.ir.CompiledSystem;
import net.protocalc.java.ir.NormalizedLemma;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.TestModels;
import net.protocalc.java.theory.Term;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link TraceChecker}, with the lemmas of the example models. */
@RunWith(JUnit4.class)
public class TraceCheckerTest {

  private static final Term A = Term.constant("a");
  private static final Term B = Term.constant("b");

  private CompiledSystem signature;
  private CompiledSystem symmetric;

  @Before
  public void compile() throws Exception {
    signature = SystemCompiler.compile(TestModels.signature(), CompilerOptions.DEFAULT);
    symmetric = SystemCompiler.compile(TestModels.symmetric(), CompilerOptions.DEFAULT);
  }

  private static Term.Application event(String tag, Term... args) {
    return Term.apply(tag, args);
  }

  private static boolean holds(CompiledSystem system, String lemma, Term.Application... events)
      throws Exception {
    NormalizedLemma normalized = null;
    for (NormalizedLemma l : system.getLemmas()) {
      if (l.getName().equals(lemma)) {
        normalized = l;
      }
    }
    assertThat(normalized).isNotNull();
    return new TraceChecker(system.getTheory()).holds(normalized, Trace.of(events));
  }

  @Test
  public void testIntegrity() throws Exception {
    assertThat(holds(signature, "integrity")).isTrue();
    assertThat(holds(signature, "integrity", event("MsgSend", A), event("IntegritySuccess", A)))
        .isTrue();
    assertThat(holds(signature, "integrity", event("IntegritySuccess", A))).isFalse();
    assertThat(holds(signature, "integrity", event("IntegritySuccess", A), event("MsgSend", A)))
        .isFalse();
    assertThat(holds(signature, "integrity", event("MsgSend", A), event("IntegritySuccess", B)))
        .isFalse();
  }

  @Test
  public void testEventsAreComparedModuloTheTheory() throws Exception {
    Term projected = Term.apply("fst", Term.pair(A, B));
    assertThat(
            holds(
                signature,
                "integrity",
                event("MsgSend", projected),
                event("IntegritySuccess", A)))
        .isTrue();
  }

  @Test
  public void testReachability() throws Exception {
    assertThat(holds(symmetric, "valid_reachable", event("Sent", A), event("Valid", A))).isTrue();
    assertThat(holds(symmetric, "valid_reachable", event("Valid", A), event("Sent", A))).isFalse();
    assertThat(holds(symmetric, "valid_reachable", event("Sent", A), event("Valid", B))).isFalse();
    assertThat(holds(symmetric, "valid_reachable")).isFalse();
  }

  @Test
  public void testAuthentication() throws Exception {
    assertThat(
            holds(
                symmetric,
                "valid_auth",
                event("Sent", A),
                event("Sent", B),
                event("Valid", B),
                event("Valid", A)))
        .isTrue();
    assertThat(holds(symmetric, "valid_auth", event("Sent", A), event("Valid", B))).isFalse();
  }
}
