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

package net.protocalc.java.theory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** A Substitution is an immutable finite mapping from variable names to terms. */
public final class Substitution {

  public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  private final ImmutableMap<String, Term> bindings;

  private Substitution(ImmutableMap<String, Term> bindings) {
    this.bindings = bindings;
  }

  public static Substitution of(Map<String, ? extends Term> bindings) {
    return bindings.isEmpty() ? EMPTY : new Substitution(ImmutableMap.copyOf(bindings));
  }

  public ImmutableMap<String, Term> asMap() {
    return bindings;
  }

  /** Returns the term bound to {@code variable}, or null. */
  @Nullable
  public Term get(String variable) {
    return bindings.get(variable);
  }

  public boolean isEmpty() {
    return bindings.isEmpty();
  }

  /** Returns a substitution that additionally maps {@code variable} to {@code term}. */
  public Substitution with(String variable, Term term) {
    Map<String, Term> map = new LinkedHashMap<>(bindings);
    map.put(variable, term);
    return new Substitution(ImmutableMap.copyOf(map));
  }

  /** Applies this substitution to every variable of {@code term} simultaneously. */
  public Term apply(Term term) {
    if (bindings.isEmpty() || term.isGround()) {
      return term;
    }
    switch (term.kind()) {
      case VARIABLE:
        Term bound = bindings.get(((Term.Variable) term).getName());
        return bound != null ? bound : term;
      case APPLICATION:
        Term.Application app = (Term.Application) term;
        ImmutableList.Builder<Term> args =
            ImmutableList.builderWithExpectedSize(app.getArguments().size());
        for (Term arg : app.getArguments()) {
          args.add(apply(arg));
        }
        return Term.apply(app.getSymbol(), args.build());
      default:
        return term;
    }
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Substitution && bindings.equals(((Substitution) that).bindings);
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
