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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Location;

/**
 * A Theory is the closed set of function symbols and oriented equations of a model. It is built
 * once, by a {@link Builder}, during the declaration phase, and is read-only thereafter.
 *
 * <p>Terms are compared modulo the theory by normalizing them: equations are applied left to right,
 * innermost redex first, until no equation head matches. The theory author is responsible for
 * confluence; the engine does not attempt completion. Because a looping theory would make
 * normalization diverge, each normalization is bounded by a step limit proportional to the number
 * of equations, and exceeding it raises a {@code TheoryDivergence} error.
 *
 * <p>Every theory contains the built-in symbols {@code pair/2}, {@code fst/1} and {@code snd/1}
 * and the two projection equations. They are ordinary equations; the matcher does not treat pairs
 * specially.
 */
public final class Theory {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableMap<String, FunctionSymbol> symbols;
  private final ImmutableList<Equation> equations;
  private final ImmutableListMultimap<FunctionSymbol, Equation> equationsByHead;
  private final int stepLimit;

  private Theory(
      ImmutableMap<String, FunctionSymbol> symbols,
      ImmutableList<Equation> equations,
      int stepsPerEquation) {
    this.symbols = symbols;
    this.equations = equations;
    this.equationsByHead = equations.stream().collect(
        ImmutableListMultimap.toImmutableListMultimap(Equation::getHead, eq -> eq));
    this.stepLimit = stepsPerEquation * Math.max(1, equations.size());
  }

  /** Returns the declared symbol of the specified name, or null. */
  @Nullable
  public FunctionSymbol lookup(String name) {
    return symbols.get(name);
  }

  /** Returns all declared symbols, built-ins first, in declaration order. */
  public ImmutableList<FunctionSymbol> getSymbols() {
    return symbols.values().asList();
  }

  /** Returns all equations, built-ins first, in declaration order. */
  public ImmutableList<Equation> getEquations() {
    return equations;
  }

  /** Returns the maximum number of rewrite steps of a single normalization. */
  public int getStepLimit() {
    return stepLimit;
  }

  /**
   * Returns the normal form of {@code term}.
   *
   * @throws TheoryException of kind THEORY_DIVERGENCE if the step limit is exceeded
   */
  public Term normalize(Term term) throws TheoryException {
    return new Rewriter(term).rewrite();
  }

  /** Reports whether {@code a} and {@code b} have the same normal form. */
  public boolean equal(Term a, Term b) throws TheoryException {
    return a.equals(b) || normalize(a).equals(normalize(b));
  }

  /**
   * Matches {@code pattern} against {@code term} modulo the theory: both are normalized, then
   * matched syntactically. A variable occurring several times in the pattern must match equal
   * subterms. Returns the substitution of pattern variables, or null if there is none.
   */
  @Nullable
  public Substitution tryMatch(Term pattern, Term term) throws TheoryException {
    Map<String, Term> bindings = new LinkedHashMap<>();
    if (!matchSyntactically(normalize(pattern), normalize(term), bindings)) {
      return null;
    }
    return Substitution.of(bindings);
  }

  /**
   * Like {@link #tryMatch}, but for positions where a match is required.
   *
   * @throws TheoryException of kind NO_MATCH if the pattern does not match
   */
  public Substitution match(Term pattern, Term term) throws TheoryException {
    Substitution subst = tryMatch(pattern, term);
    if (subst == null) {
      throw new TheoryException(
          CompileError.Kind.NO_MATCH, String.format("'%s' does not match '%s'", pattern, term));
    }
    return subst;
  }

  // Syntactic, non-linear matching. Extends bindings; on failure its contents are unspecified.
  static boolean matchSyntactically(Term pattern, Term term, Map<String, Term> bindings) {
    switch (pattern.kind()) {
      case VARIABLE:
        String name = ((Term.Variable) pattern).getName();
        Term bound = bindings.get(name);
        if (bound == null) {
          bindings.put(name, term);
          return true;
        }
        return bound.equals(term);
      case APPLICATION:
        if (!(term instanceof Term.Application)) {
          return false;
        }
        Term.Application p = (Term.Application) pattern;
        Term.Application t = (Term.Application) term;
        if (!p.getSymbol().equals(t.getSymbol())) {
          return false;
        }
        for (int i = 0; i < p.getArguments().size(); i++) {
          if (!matchSyntactically(p.getArguments().get(i), t.getArguments().get(i), bindings)) {
            return false;
          }
        }
        return true;
      default:
        return pattern.equals(term);
    }
  }

  // A Rewriter counts the steps of one normalization. It keeps its own stack of partially
  // normalized applications, so a reduct that nests deeper at every step is bounded by the step
  // limit rather than by the Java stack.
  private final class Rewriter {
    private final Term root;
    private int steps = 0;

    Rewriter(Term root) {
      this.root = root;
    }

    Term rewrite() throws TheoryException {
      Deque<Frame> stack = new ArrayDeque<>();
      Term current = root;
      descend:
      while (true) {
        while (current instanceof Term.Application app && !app.getArguments().isEmpty()) {
          stack.push(new Frame(app));
          current = app.getArguments().get(0);
        }
        Term value = current;
        Term reduct = reduceAtRoot(value);
        while (reduct == null) {
          Frame frame = stack.peek();
          if (frame == null) {
            return value;
          }
          frame.args.add(value);
          frame.count++;
          if (frame.count < frame.app.getArguments().size()) {
            current = frame.app.getArguments().get(frame.count);
            continue descend;
          }
          stack.pop();
          value = Term.apply(frame.app.getSymbol(), frame.args.build());
          reduct = reduceAtRoot(value);
        }
        current = reduct;
      }
    }

    // Applies the first equation whose left-hand side matches at the root of a term whose
    // arguments are already normal. Returns null if none does.
    @Nullable
    private Term reduceAtRoot(Term term) throws TheoryException {
      if (!(term instanceof Term.Application app)) {
        return null;
      }
      for (Equation eq : equationsByHead.get(app.getSymbol())) {
        Map<String, Term> bindings = new HashMap<>();
        if (matchSyntactically(eq.getLHS(), app, bindings)) {
          if (++steps > stepLimit) {
            logger.atWarning().log("normalization of %s exceeded %d steps", root, stepLimit);
            throw new TheoryException(
                CompileError.Kind.THEORY_DIVERGENCE,
                String.format(
                    "normalization of '%s' did not terminate within %d rewrite steps",
                    root, stepLimit));
          }
          return Substitution.of(bindings).apply(eq.getRHS());
        }
      }
      return null;
    }
  }

  // An application whose arguments are being normalized, left to right.
  private static final class Frame {
    final Term.Application app;
    final ImmutableList.Builder<Term> args;
    int count = 0;

    Frame(Term.Application app) {
      this.app = app;
      this.args = ImmutableList.builderWithExpectedSize(app.getArguments().size());
    }
  }

  /** Returns a new builder, already containing the built-in symbols and equations. */
  public static Builder builder(CompilerOptions options, List<CompileError> errors) {
    return new Builder(options, errors);
  }

  /**
   * A Builder accumulates symbol and equation declarations. Invalid declarations are reported to
   * the error list supplied at construction and are otherwise ignored, so that all declaration
   * errors of a model can be reported together.
   */
  public static final class Builder {
    private final CompilerOptions options;
    private final List<CompileError> errors;
    private final Map<String, FunctionSymbol> symbols = new LinkedHashMap<>();
    private final ImmutableList.Builder<Equation> equations = ImmutableList.builder();

    private Builder(CompilerOptions options, List<CompileError> errors) {
      this.options = options;
      this.errors = errors;
      symbols.put(FunctionSymbol.PAIR.getName(), FunctionSymbol.PAIR);
      symbols.put(FunctionSymbol.FST.getName(), FunctionSymbol.FST);
      symbols.put(FunctionSymbol.SND.getName(), FunctionSymbol.SND);
      Term x = Term.var("x");
      Term y = Term.var("y");
      equations.add(
          new Equation(
              Term.apply(FunctionSymbol.FST, Term.pair(x, y)), x, Location.BUILTIN));
      equations.add(
          new Equation(
              Term.apply(FunctionSymbol.SND, Term.pair(x, y)), y, Location.BUILTIN));
    }

    @FormatMethod
    private void errorf(
        CompileError.Kind kind, Location loc, String decl, String format, Object... args) {
      errors.add(new CompileError(kind, loc, decl, String.format(format, args)));
    }

    /** Returns the symbol declared so far under {@code name}, or null. */
    @Nullable
    public FunctionSymbol lookup(String name) {
      return symbols.get(name);
    }

    /**
     * Declares a function symbol. Reports {@code DuplicateSymbol} if a symbol of the same name,
     * whatever its arity, has already been declared.
     */
    @CanIgnoreReturnValue
    public Builder declareSymbol(String name, int arity, Location loc) {
      FunctionSymbol previous = symbols.get(name);
      if (previous != null) {
        errorf(
            CompileError.Kind.DUPLICATE_SYMBOL,
            loc,
            name,
            "function '%s' is already declared as %s",
            name,
            previous);
        return this;
      }
      symbols.put(name, FunctionSymbol.of(name, arity));
      return this;
    }

    /**
     * Declares the equation {@code lhs = rhs}. Reports {@code UnknownSymbol} if either side applies
     * an undeclared symbol or a declared symbol at the wrong arity, {@code UnboundVariable} if the
     * right-hand side has a variable absent from the left-hand side, and {@code NoMatch} if the
     * left-hand side is not an application and so can never be matched as a rewrite head.
     */
    @CanIgnoreReturnValue
    public Builder declareEquation(Term lhs, Term rhs, Location loc) {
      String decl = "equation " + lhs + " = " + rhs;
      int before = errors.size();
      checkSymbols(lhs, loc, decl);
      checkSymbols(rhs, loc, decl);
      Set<String> unbound = Sets.difference(rhs.variables(), lhs.variables());
      for (String name : unbound) {
        errorf(
            CompileError.Kind.UNBOUND_VARIABLE,
            loc,
            decl,
            "variable '%s' of the right-hand side does not occur on the left-hand side",
            name);
      }
      if (!(lhs instanceof Term.Application)) {
        errorf(
            CompileError.Kind.NO_MATCH,
            loc,
            decl,
            "left-hand side '%s' is not a function application",
            lhs);
      }
      if (errors.size() == before) {
        equations.add(new Equation((Term.Application) lhs, rhs, loc));
      }
      return this;
    }

    private void checkSymbols(Term term, Location loc, String decl) {
      if (!(term instanceof Term.Application app)) {
        return;
      }
      FunctionSymbol declared = symbols.get(app.getSymbol().getName());
      if (declared == null) {
        errorf(
            CompileError.Kind.UNKNOWN_SYMBOL,
            loc,
            decl,
            "function '%s' is not declared",
            app.getSymbol().getName());
      } else if (!declared.equals(app.getSymbol())) {
        errorf(
            CompileError.Kind.UNKNOWN_SYMBOL,
            loc,
            decl,
            "function '%s' is declared with arity %d but used with %d arguments",
            declared.getName(),
            declared.getArity(),
            app.getArguments().size());
      }
      for (Term arg : app.getArguments()) {
        checkSymbols(arg, loc, decl);
      }
    }

    /** Returns the immutable theory. */
    public Theory build() {
      Preconditions.checkState(options.rewriteStepsPerEquation() > 0, "bad step limit");
      Theory theory =
          new Theory(
              ImmutableMap.copyOf(symbols), equations.build(), options.rewriteStepsPerEquation());
      logger.atFine().log(
          "theory closed: %d symbols, %d equations",
          theory.symbols.size(), theory.equations.size());
      return theory;
    }
  }
}
