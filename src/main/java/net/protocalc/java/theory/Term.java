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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A Term is an immutable tree of variables, literals, constants, nonces and function
 * applications. Terms are compared structurally by {@link #equals}; equality modulo an equational
 * theory is {@link Theory#equal}.
 *
 * <p>Terms are never mutated: rewriting and substitution return new terms, so a term may be shared
 * freely between processes, transitions and lemmas.
 */
public abstract class Term {

  /** Kind of the term, for use in a switch/case. */
  public enum Kind {
    APPLICATION,
    CONSTANT,
    LITERAL,
    NONCE,
    VARIABLE,
  }

  private final Kind kind;

  private Term(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Reports whether the term contains no variables. */
  public abstract boolean isGround();

  /** Adds the names of the variables of this term to {@code result}, in left-to-right order. */
  abstract void collectVariables(Set<String> result);

  /** Returns the names of the variables of this term, in left-to-right order of first use. */
  public final ImmutableSet<String> variables() {
    Set<String> result = new LinkedHashSet<>();
    collectVariables(result);
    return ImmutableSet.copyOf(result);
  }

  /** Returns this term and all its subterms, in preorder, without duplicates. */
  public final ImmutableSet<Term> subterms() {
    ImmutableSet.Builder<Term> result = ImmutableSet.builder();
    addSubterms(this, result);
    return result.build();
  }

  private static void addSubterms(Term term, ImmutableSet.Builder<Term> result) {
    result.add(term);
    if (term instanceof Application app) {
      for (Term arg : app.getArguments()) {
        addSubterms(arg, result);
      }
    }
  }

  /** A variable: a pattern variable, an equation variable, or a process-local binding. */
  public static final class Variable extends Term {
    private final String name;

    private Variable(String name) {
      super(Kind.VARIABLE);
      this.name = Preconditions.checkNotNull(name);
    }

    public String getName() {
      return name;
    }

    @Override
    public boolean isGround() {
      return false;
    }

    @Override
    void collectVariables(Set<String> result) {
      result.add(name);
    }

    @Override
    public boolean equals(Object that) {
      return that instanceof Variable && name.equals(((Variable) that).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A public string literal, such as {@code "1"}. */
  public static final class Literal extends Term {
    private final String value;

    private Literal(String value) {
      super(Kind.LITERAL);
      this.value = Preconditions.checkNotNull(value);
    }

    public String getValue() {
      return value;
    }

    @Override
    public boolean isGround() {
      return true;
    }

    @Override
    void collectVariables(Set<String> result) {}

    @Override
    public boolean equals(Object that) {
      return that instanceof Literal && value.equals(((Literal) that).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode() ^ 0x5a5a;
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  /** A declared, non-fresh global constant, public to every participant. */
  public static final class Constant extends Term {
    private final String name;

    private Constant(String name) {
      super(Kind.CONSTANT);
      this.name = Preconditions.checkNotNull(name);
    }

    public String getName() {
      return name;
    }

    @Override
    public boolean isGround() {
      return true;
    }

    @Override
    void collectVariables(Set<String> result) {}

    @Override
    public boolean equals(Object that) {
      return that instanceof Constant && name.equals(((Constant) that).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() ^ 0x3c3c;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * A nonce: the value produced by one generation act ({@code new x}, or a fresh constant). The id
   * is unique across the whole compiled system; the label is the source name, kept for display.
   */
  public static final class Nonce extends Term {
    private final String label;
    private final int id;

    private Nonce(String label, int id) {
      super(Kind.NONCE);
      this.label = Preconditions.checkNotNull(label);
      this.id = id;
    }

    public String getLabel() {
      return label;
    }

    public int getId() {
      return id;
    }

    @Override
    public boolean isGround() {
      return true;
    }

    @Override
    void collectVariables(Set<String> result) {}

    @Override
    public boolean equals(Object that) {
      return that instanceof Nonce && id == ((Nonce) that).id;
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public String toString() {
      return "~" + label + "." + id;
    }
  }

  /** An application {@code f(t1, ..., tn)} of a function symbol to arity-many arguments. */
  public static final class Application extends Term {
    private final FunctionSymbol symbol;
    private final ImmutableList<Term> arguments;
    private final boolean ground;
    private final int hashCode;

    private Application(FunctionSymbol symbol, ImmutableList<Term> arguments) {
      super(Kind.APPLICATION);
      Preconditions.checkArgument(
          symbol.getArity() == arguments.size(),
          "%s applied to %s arguments",
          symbol,
          arguments.size());
      this.symbol = symbol;
      this.arguments = arguments;
      boolean ground = true;
      for (Term arg : arguments) {
        ground &= arg.isGround();
      }
      this.ground = ground;
      this.hashCode = Objects.hash(symbol, arguments);
    }

    public FunctionSymbol getSymbol() {
      return symbol;
    }

    public ImmutableList<Term> getArguments() {
      return arguments;
    }

    @Override
    public boolean isGround() {
      return ground;
    }

    @Override
    void collectVariables(Set<String> result) {
      if (!ground) {
        for (Term arg : arguments) {
          arg.collectVariables(result);
        }
      }
    }

    @Override
    public boolean equals(Object that) {
      if (this == that) {
        return true;
      }
      if (!(that instanceof Application)) {
        return false;
      }
      Application app = (Application) that;
      return hashCode == app.hashCode
          && symbol.equals(app.symbol)
          && arguments.equals(app.arguments);
    }

    @Override
    public int hashCode() {
      return hashCode;
    }

    @Override
    public String toString() {
      return symbol.getName() + "(" + Joiner.on(", ").join(arguments) + ")";
    }
  }

  // ==== Factories ====

  public static Variable var(String name) {
    return new Variable(name);
  }

  public static Literal literal(String value) {
    return new Literal(value);
  }

  public static Constant constant(String name) {
    return new Constant(name);
  }

  public static Nonce nonce(String label, int id) {
    return new Nonce(label, id);
  }

  public static Application apply(FunctionSymbol symbol, List<? extends Term> arguments) {
    return new Application(symbol, ImmutableList.copyOf(arguments));
  }

  public static Application apply(FunctionSymbol symbol, Term... arguments) {
    return new Application(symbol, ImmutableList.copyOf(arguments));
  }

  /** Returns the application of the undeclared symbol {@code name/args.length}. */
  public static Application apply(String name, Term... arguments) {
    return apply(FunctionSymbol.of(name, arguments.length), arguments);
  }

  public static Application pair(Term first, Term second) {
    return apply(FunctionSymbol.PAIR, first, second);
  }

  /** Encodes {@code (t1, ..., tn)}, n >= 2, as {@code pair(t1, pair(..., tn))}. */
  public static Term tuple(List<? extends Term> elements) {
    Preconditions.checkArgument(elements.size() >= 2, "tuple of %s elements", elements.size());
    Term result = elements.get(elements.size() - 1);
    for (int i = elements.size() - 2; i >= 0; i--) {
      result = pair(elements.get(i), result);
    }
    return result;
  }
}
