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

package net.protocalc.java.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.theory.Term;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TraceFormulaTest {

  private static final TraceFormula SENT_M_AT_I =
      TraceFormula.event(Term.apply("Sent", Term.var("m")), "i");

  @Test
  public void testFreeVariables() {
    assertThat(SENT_M_AT_I.freeVariables()).containsExactly("m", "i").inOrder();
    TraceFormula closed =
        TraceFormula.exists(
            ImmutableList.of(TraceFormula.Var.term("m"), TraceFormula.Var.index("i")),
            SENT_M_AT_I);
    assertThat(closed.freeVariables()).isEmpty();
    assertThat(closed.toString()).isEqualTo("exists m #i. Sent(m) @ #i");
  }

  @Test
  public void testDegenerateConnectives() {
    assertThat(TraceFormula.and(ImmutableList.of())).isSameInstanceAs(TraceFormula.TRUE);
    assertThat(TraceFormula.or(ImmutableList.of())).isSameInstanceAs(TraceFormula.FALSE);
    assertThat(TraceFormula.and(ImmutableList.of(SENT_M_AT_I))).isSameInstanceAs(SENT_M_AT_I);
    assertThat(TraceFormula.exists(ImmutableList.of(), SENT_M_AT_I)).isSameInstanceAs(SENT_M_AT_I);
  }

  @Test
  public void testToString() {
    TraceFormula f =
        TraceFormula.or(
            ImmutableList.of(
                TraceFormula.not(TraceFormula.precedes("i", "j")),
                TraceFormula.equal(Term.var("m"), Term.literal("x"))));
    assertThat(f.toString()).isEqualTo("(not(#i < #j) | m = \"x\")");
  }

  @Test
  public void testUnclosedLemmaIsRejected() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                new NormalizedLemma(
                    "open",
                    Declaration.LemmaKind.EXISTS_TRACE,
                    NormalizedLemma.TraceQuantifier.EXISTS_TRACE,
                    SENT_M_AT_I,
                    Location.BUILTIN));
    assertThat(ex).hasMessageThat().contains("lemma open is not closed");
  }
}
