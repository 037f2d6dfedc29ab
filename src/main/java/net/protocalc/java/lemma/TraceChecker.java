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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.protocalc.java.ir.NormalizedLemma;
import net.protocalc.java.ir.TraceFormula;
import net.protocalc.java.theory.Substitution;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import net.protocalc.java.theory.TheoryException;

/**
 * Evaluates a normalized lemma on one finite trace.
 *
 * <p>Index variables range over the positions {@code 0..n-1} of the trace, and term variables over
 * the subterms of its (normalized) events. Term equality is equality of normal forms. A trace
 * satisfies an {@code all-traces} lemma if it is not a counterexample to it, and an {@code
 * exists-trace} lemma if it is a witness of it.
 *
 * <p>Evaluation enumerates every assignment of the quantified variables, so it is meant for the
 * short traces of tests and examples, not for proof search.
 */
public final class TraceChecker {

  private final Theory theory;

  public TraceChecker(Theory theory) {
    this.theory = theory;
  }

  /** Reports whether {@code trace} satisfies the formula of {@code lemma}. */
  public boolean holds(NormalizedLemma lemma, Trace trace) throws TheoryException {
    return new Evaluation(trace).eval(lemma.getFormula(), ImmutableMap.of(), Substitution.EMPTY);
  }

  private final class Evaluation {
    private final ImmutableList<Term> events;
    private final ImmutableList<Term> domain;

    Evaluation(Trace trace) throws TheoryException {
      ImmutableList.Builder<Term> normalized = ImmutableList.builder();
      Set<Term> subterms = new LinkedHashSet<>();
      for (Term.Application event : trace.getEvents()) {
        Term nf = theory.normalize(event);
        normalized.add(nf);
        // The event itself is not a message.
        if (nf instanceof Term.Application app) {
          for (Term arg : app.getArguments()) {
            subterms.addAll(arg.subterms());
          }
        }
      }
      this.events = normalized.build();
      this.domain = ImmutableList.copyOf(subterms);
    }

    boolean eval(TraceFormula f, Map<String, Integer> indices, Substitution subst)
        throws TheoryException {
      switch (f.kind()) {
        case TRUE:
          return true;
        case FALSE:
          return false;
        case EVENT:
          TraceFormula.Event event = (TraceFormula.Event) f;
          int i = indices.get(event.getIndex());
          return theory.normalize(subst.apply(event.getEvent())).equals(events.get(i));
        case PRECEDES:
          TraceFormula.Precedes precedes = (TraceFormula.Precedes) f;
          return indices.get(precedes.getBefore()) < indices.get(precedes.getAfter());
        case EQUAL:
          TraceFormula.Equal equal = (TraceFormula.Equal) f;
          return theory.equal(subst.apply(equal.getLHS()), subst.apply(equal.getRHS()));
        case NOT:
          return !eval(operands(f).get(0), indices, subst);
        case AND:
          for (TraceFormula operand : operands(f)) {
            if (!eval(operand, indices, subst)) {
              return false;
            }
          }
          return true;
        case OR:
          for (TraceFormula operand : operands(f)) {
            if (eval(operand, indices, subst)) {
              return true;
            }
          }
          return false;
        case IMPLIES:
          return !eval(operands(f).get(0), indices, subst)
              || eval(operands(f).get(1), indices, subst);
        case EXISTS:
        case FORALL:
          TraceFormula.Quantified q = (TraceFormula.Quantified) f;
          boolean exists = q.kind() == TraceFormula.Kind.EXISTS;
          return quantify(q.getVariables(), 0, exists, q.getBody(), indices, subst);
      }
      throw new IllegalStateException(f.kind().toString());
    }

    // Assigns vars[k:] in every possible way. Existential quantifiers stop at the first witness,
    // universal ones at the first counterexample.
    private boolean quantify(
        List<TraceFormula.Var> vars,
        int k,
        boolean exists,
        TraceFormula body,
        Map<String, Integer> indices,
        Substitution subst)
        throws TheoryException {
      if (k == vars.size()) {
        return eval(body, indices, subst);
      }
      TraceFormula.Var var = vars.get(k);
      if (var.getSort() == TraceFormula.Sort.INDEX) {
        for (int i = 0; i < events.size(); i++) {
          Map<String, Integer> inner = new HashMap<>(indices);
          inner.put(var.getName(), i);
          if (quantify(vars, k + 1, exists, body, inner, subst) == exists) {
            return exists;
          }
        }
      } else {
        for (Term value : domain) {
          if (quantify(vars, k + 1, exists, body, indices, subst.with(var.getName(), value))
              == exists) {
            return exists;
          }
        }
      }
      return !exists;
    }
  }

  private static ImmutableList<TraceFormula> operands(TraceFormula f) {
    return ((TraceFormula.Connective) f).getOperands();
  }
}
