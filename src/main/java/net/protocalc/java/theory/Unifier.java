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

import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Syntactic (Robinson) unification of two terms. This is not unification modulo the equational
 * theory; callers normalize both terms first, which suffices for the conservative "may these
 * correspond?" questions the compiler asks. Deciding equational unification is left to the
 * verification backend.
 */
public final class Unifier {

  private Unifier() {}

  /**
   * Returns an idempotent most general unifier of {@code a} and {@code b}, or null if the terms do
   * not unify. The variables of the two terms are shared: callers rename them apart if needed.
   */
  @Nullable
  public static Substitution unify(Term a, Term b) {
    Map<String, Term> bindings = new LinkedHashMap<>();
    if (!unify(a, b, bindings)) {
      return null;
    }
    // Resolve chains so that the result is idempotent.
    Map<String, Term> resolved = new LinkedHashMap<>();
    for (String name : bindings.keySet()) {
      resolved.put(name, resolve(Term.var(name), bindings));
    }
    return Substitution.of(resolved);
  }

  private static boolean unify(Term a, Term b, Map<String, Term> bindings) {
    a = walk(a, bindings);
    b = walk(b, bindings);
    if (a.equals(b)) {
      return true;
    }
    if (a instanceof Term.Variable va) {
      return bindVariable(va, b, bindings);
    }
    if (b instanceof Term.Variable vb) {
      return bindVariable(vb, a, bindings);
    }
    if (a instanceof Term.Application aa && b instanceof Term.Application ab) {
      if (!aa.getSymbol().equals(ab.getSymbol())) {
        return false;
      }
      for (int i = 0; i < aa.getArguments().size(); i++) {
        if (!unify(aa.getArguments().get(i), ab.getArguments().get(i), bindings)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private static boolean bindVariable(Term.Variable v, Term t, Map<String, Term> bindings) {
    if (occurs(v.getName(), t, bindings)) {
      return false;
    }
    bindings.put(v.getName(), t);
    return true;
  }

  private static Term walk(Term t, Map<String, Term> bindings) {
    while (t instanceof Term.Variable v && bindings.containsKey(v.getName())) {
      t = bindings.get(v.getName());
    }
    return t;
  }

  private static boolean occurs(String name, Term t, Map<String, Term> bindings) {
    t = walk(t, bindings);
    if (t instanceof Term.Variable v) {
      return v.getName().equals(name);
    }
    if (t instanceof Term.Application app) {
      for (Term arg : app.getArguments()) {
        if (occurs(name, arg, bindings)) {
          return true;
        }
      }
    }
    return false;
  }

  private static Term resolve(Term t, Map<String, Term> bindings) {
    t = walk(t, bindings);
    if (t instanceof Term.Application app && !app.isGround()) {
      Term[] args = new Term[app.getArguments().size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = resolve(app.getArguments().get(i), bindings);
      }
      return Term.apply(app.getSymbol(), args);
    }
    return t;
  }
}
