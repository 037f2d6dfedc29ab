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
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.protocalc.java.ir.NormalizedLemma;
import net.protocalc.java.ir.TraceFormula;
import net.protocalc.java.syntax.CallExpression;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Declaration.LemmaKind;
import net.protocalc.java.syntax.Expression;
import net.protocalc.java.syntax.Identifier;
import net.protocalc.java.syntax.LemmaFormula;
import net.protocalc.java.syntax.Node;
import net.protocalc.java.syntax.NodeVisitor;
import net.protocalc.java.syntax.StringLiteral;
import net.protocalc.java.syntax.TupleExpression;
import net.protocalc.java.theory.FunctionSymbol;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;

/**
 * Translates the lemmas of a system into {@link NormalizedLemma}s: closed {@link TraceFormula}s
 * with an explicit trace quantifier.
 *
 * <ul>
 *   <li>{@code exists-trace φ}: the free term variables of φ, and the free index variables that
 *       some event atom of φ binds, are closed existentially.
 *   <li>{@code all-traces φ}: likewise, closed universally.
 *   <li>{@code reachable E1, ..., En}: {@code exists vars, i1..in. E1 @ i1 & ... & En @ in}, with
 *       {@code ik < ik+1} if {@link CompilerOptions#orderReachableEvents}.
 *   <li>{@code corresponds A ~> B}: {@code forall vars(A), i. A @ i ==> exists vars(B) \ vars(A),
 *       j. B @ j & j < i}, on all traces.
 * </ul>
 *
 * <p>In a lemma, an identifier in a term position denotes a constant or nullary function if one is
 * declared under its name, and otherwise a term variable. An index variable that is used only in
 * {@code i < j} atoms and bound by no quantifier is a {@code FreeLemmaVariable} error; an event
 * whose tag and arity no process emits is an {@code UnknownEventTag} error.
 */
public final class LemmaTranslator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Theory theory;
  private final ImmutableMap<String, Term> constants;
  private final EventVocabulary vocabulary;
  private final CompilerOptions options;
  private final List<CompileError> errors;

  // State of the lemma being translated.
  private String decl = "";
  private final Deque<Map<String, TraceFormula.Var>> quantified = new ArrayDeque<>();
  private final Set<String> freeTerms = new LinkedHashSet<>();
  private final Set<String> freeEventIndices = new LinkedHashSet<>();
  private final Map<String, Identifier> freeOrderIndices = new HashMap<>();

  public LemmaTranslator(
      Theory theory,
      ImmutableMap<String, Term> constants,
      EventVocabulary vocabulary,
      CompilerOptions options,
      List<CompileError> errors) {
    this.theory = theory;
    this.constants = constants;
    this.vocabulary = vocabulary;
    this.options = options;
    this.errors = errors;
  }

  // Formats and reports an error at the start of the specified node.
  @FormatMethod
  private void errorf(CompileError.Kind kind, Node node, String format, Object... args) {
    errors.add(new CompileError(kind, node.getStartLocation(), decl, String.format(format, args)));
  }

  /**
   * Translates every lemma, reporting {@code DuplicateSymbol} for a repeated lemma name. Lemmas
   * with errors are omitted from the result.
   */
  public ImmutableList<NormalizedLemma> translateAll(List<Declaration.Lemma> lemmas) {
    ImmutableList.Builder<NormalizedLemma> result = ImmutableList.builder();
    Set<String> names = new HashSet<>();
    for (Declaration.Lemma lemma : lemmas) {
      if (!names.add(lemma.getName())) {
        decl = lemma.getName();
        errorf(
            CompileError.Kind.DUPLICATE_SYMBOL,
            lemma,
            "lemma '%s' is already declared",
            lemma.getName());
        continue;
      }
      NormalizedLemma normalized = translate(lemma);
      if (normalized != null) {
        result.add(normalized);
      }
    }
    return result.build();
  }

  /** Translates one lemma. Returns null after reporting errors. */
  @Nullable
  public NormalizedLemma translate(Declaration.Lemma lemma) {
    decl = lemma.getName();
    quantified.clear();
    freeTerms.clear();
    freeEventIndices.clear();
    freeOrderIndices.clear();
    int errorsBefore = errors.size();

    TraceFormula formula;
    NormalizedLemma.TraceQuantifier quantifier;
    switch (lemma.getLemmaKind()) {
      case EXISTS_TRACE:
      case ALL_TRACES:
        boolean exists = lemma.getLemmaKind() == LemmaKind.EXISTS_TRACE;
        quantifier =
            exists
                ? NormalizedLemma.TraceQuantifier.EXISTS_TRACE
                : NormalizedLemma.TraceQuantifier.ALL_TRACES;
        formula = closeFormula(lemma.getFormula(), exists);
        break;
      case REACHABLE:
        quantifier = NormalizedLemma.TraceQuantifier.EXISTS_TRACE;
        formula = reachable(lemma.getEvents());
        break;
      case CORRESPONDS:
        quantifier = NormalizedLemma.TraceQuantifier.ALL_TRACES;
        formula = corresponds(lemma.getEvents().get(0), lemma.getEvents().get(1));
        break;
      default:
        throw new IllegalStateException(lemma.getLemmaKind().toString());
    }
    if (errors.size() > errorsBefore) {
      return null;
    }
    NormalizedLemma result =
        new NormalizedLemma(
            lemma.getName(), lemma.getLemmaKind(), quantifier, formula, lemma.getStartLocation());
    logger.atFine().log("%s", result);
    return result;
  }

  // ==== Formula lemmas ====

  private TraceFormula closeFormula(LemmaFormula syntax, boolean exists) {
    TraceFormula body = formula(syntax);
    for (Map.Entry<String, Identifier> e : freeOrderIndices.entrySet()) {
      if (!freeEventIndices.contains(e.getKey())) {
        errorf(
            CompileError.Kind.FREE_LEMMA_VARIABLE,
            e.getValue(),
            "trace variable '%s' is bound neither by a quantifier nor by an event",
            e.getKey());
      }
    }
    List<TraceFormula.Var> vars = new ArrayList<>();
    for (String name : freeTerms) {
      vars.add(TraceFormula.Var.term(name));
    }
    for (String name : freeEventIndices) {
      vars.add(TraceFormula.Var.index(name));
    }
    return exists ? TraceFormula.exists(vars, body) : TraceFormula.forall(vars, body);
  }

  private TraceFormula formula(LemmaFormula syntax) {
    switch (syntax.kind()) {
      case EVENT:
        LemmaFormula.Event event = (LemmaFormula.Event) syntax;
        Term.Application atom = event(event.getEvent());
        String index = event.getIndex().getName();
        if (lookup(index) == null) {
          freeEventIndices.add(index);
        }
        return atom != null ? TraceFormula.event(atom, index) : TraceFormula.FALSE;
      case PRECEDES:
        LemmaFormula.Precedes precedes = (LemmaFormula.Precedes) syntax;
        orderIndex(precedes.getBefore());
        orderIndex(precedes.getAfter());
        return TraceFormula.precedes(precedes.getBefore().getName(), precedes.getAfter().getName());
      case EQUAL:
        LemmaFormula.Equal equal = (LemmaFormula.Equal) syntax;
        Term lhs = term(equal.getLHS());
        Term rhs = term(equal.getRHS());
        return lhs != null && rhs != null ? TraceFormula.equal(lhs, rhs) : TraceFormula.FALSE;
      case NOT:
        return TraceFormula.not(
            formula(((LemmaFormula.Connective) syntax).getOperands().get(0)));
      case AND:
      case OR:
        List<TraceFormula> operands = new ArrayList<>();
        for (LemmaFormula operand : ((LemmaFormula.Connective) syntax).getOperands()) {
          operands.add(formula(operand));
        }
        return syntax.kind() == LemmaFormula.Kind.AND
            ? TraceFormula.and(operands)
            : TraceFormula.or(operands);
      case IMPLIES:
        List<LemmaFormula> parts = ((LemmaFormula.Connective) syntax).getOperands();
        return TraceFormula.implies(formula(parts.get(0)), formula(parts.get(1)));
      case EXISTS:
      case FORALL:
        return quantified((LemmaFormula.Quantified) syntax);
    }
    throw new IllegalStateException(syntax.kind().toString());
  }

  private TraceFormula quantified(LemmaFormula.Quantified syntax) {
    Set<String> indices = indexNames(syntax.getBody());
    Map<String, TraceFormula.Var> frame = new HashMap<>();
    List<TraceFormula.Var> vars = new ArrayList<>();
    for (Identifier id : syntax.getVariables()) {
      TraceFormula.Var var =
          indices.contains(id.getName())
              ? TraceFormula.Var.index(id.getName())
              : TraceFormula.Var.term(id.getName());
      frame.put(id.getName(), var);
      vars.add(var);
    }
    quantified.push(frame);
    TraceFormula body = formula(syntax.getBody());
    quantified.pop();
    return syntax.kind() == LemmaFormula.Kind.EXISTS
        ? TraceFormula.exists(vars, body)
        : TraceFormula.forall(vars, body);
  }

  // Returns the names used as trace positions in a formula.
  private static Set<String> indexNames(LemmaFormula formula) {
    Set<String> names = new HashSet<>();
    formula.accept(
        new NodeVisitor() {
          @Override
          public void visit(LemmaFormula node) {
            if (node instanceof LemmaFormula.Event event) {
              names.add(event.getIndex().getName());
            } else if (node instanceof LemmaFormula.Precedes precedes) {
              names.add(precedes.getBefore().getName());
              names.add(precedes.getAfter().getName());
            }
            super.visit(node);
          }
        });
    return names;
  }

  private void orderIndex(Identifier id) {
    if (lookup(id.getName()) == null) {
      freeOrderIndices.putIfAbsent(id.getName(), id);
    }
  }

  @Nullable
  private TraceFormula.Var lookup(String name) {
    for (Map<String, TraceFormula.Var> frame : quantified) {
      TraceFormula.Var var = frame.get(name);
      if (var != null) {
        return var;
      }
    }
    return null;
  }

  // ==== Event lists ====

  private TraceFormula reachable(List<CallExpression> events) {
    List<Term.Application> atoms = new ArrayList<>();
    for (CallExpression event : events) {
      atoms.add(event(event));
    }
    List<String> indices = new ArrayList<>();
    List<TraceFormula> conjuncts = new ArrayList<>();
    for (int k = 0; k < atoms.size(); k++) {
      String index = freshIndex("i" + (k + 1));
      indices.add(index);
      if (atoms.get(k) != null) {
        conjuncts.add(TraceFormula.event(atoms.get(k), index));
      }
    }
    if (options.orderReachableEvents()) {
      for (int k = 0; k + 1 < indices.size(); k++) {
        conjuncts.add(TraceFormula.precedes(indices.get(k), indices.get(k + 1)));
      }
    }
    List<TraceFormula.Var> vars = new ArrayList<>();
    for (String name : freeTerms) {
      vars.add(TraceFormula.Var.term(name));
    }
    for (String index : indices) {
      vars.add(TraceFormula.Var.index(index));
    }
    return TraceFormula.exists(vars, TraceFormula.and(conjuncts));
  }

  private TraceFormula corresponds(CallExpression premise, CallExpression conclusion) {
    Term.Application a = event(premise);
    Set<String> premiseVars = new LinkedHashSet<>(freeTerms);
    Term.Application b = event(conclusion);
    if (a == null || b == null) {
      return TraceFormula.FALSE;
    }
    String i = freshIndex("i");
    String j = freshIndex("j");
    List<TraceFormula.Var> outer = new ArrayList<>();
    for (String name : premiseVars) {
      outer.add(TraceFormula.Var.term(name));
    }
    outer.add(TraceFormula.Var.index(i));
    List<TraceFormula.Var> inner = new ArrayList<>();
    for (String name : freeTerms) {
      if (!premiseVars.contains(name)) {
        inner.add(TraceFormula.Var.term(name));
      }
    }
    inner.add(TraceFormula.Var.index(j));
    TraceFormula conclusionFormula =
        TraceFormula.exists(
            inner,
            TraceFormula.and(
                ImmutableList.of(TraceFormula.event(b, j), TraceFormula.precedes(j, i))));
    return TraceFormula.forall(
        outer, TraceFormula.implies(TraceFormula.event(a, i), conclusionFormula));
  }

  // Returns an index name distinct from every term variable of the lemma.
  private String freshIndex(String base) {
    String name = base;
    while (freeTerms.contains(name) || constants.containsKey(name)) {
      name = name + "'";
    }
    return name;
  }

  // ==== Terms ====

  /** Converts an event; returns null after reporting an error. */
  @Nullable
  private Term.Application event(CallExpression event) {
    List<Term> args = new ArrayList<>();
    boolean ok = true;
    for (Expression arg : event.getArguments()) {
      Term t = term(arg);
      ok &= t != null;
      args.add(t);
    }
    if (options.checkEventVocabulary()
        && !vocabulary.contains(event.getName(), event.getArguments().size())) {
      errorf(
          CompileError.Kind.UNKNOWN_EVENT_TAG,
          event,
          "no process emits an event '%s' with %d arguments",
          event.getName(),
          event.getArguments().size());
      return null;
    }
    if (!ok) {
      return null;
    }
    return Term.apply(FunctionSymbol.of(event.getName(), args.size()), args);
  }

  @Nullable
  private Term term(Expression expr) {
    switch (expr.kind()) {
      case STRING_LITERAL:
        return Term.literal(((StringLiteral) expr).getValue());
      case IDENTIFIER:
        String name = ((Identifier) expr).getName();
        if (lookup(name) == null) {
          Term constant = constants.get(name);
          if (constant != null) {
            return constant;
          }
          FunctionSymbol fn = theory.lookup(name);
          if (fn != null && fn.getArity() == 0) {
            return Term.apply(fn);
          }
          freeTerms.add(name);
        }
        return Term.var(name);
      case TUPLE:
        List<Term> elements = new ArrayList<>();
        for (Expression elem : ((TupleExpression) expr).getElements()) {
          Term t = term(elem);
          if (t == null) {
            return null;
          }
          elements.add(t);
        }
        return Term.tuple(elements);
      case CALL:
        CallExpression call = (CallExpression) expr;
        FunctionSymbol fn = theory.lookup(call.getName());
        if (fn == null || fn.getArity() != call.getArguments().size()) {
          errorf(
              CompileError.Kind.UNKNOWN_SYMBOL,
              call,
              "'%s' is not a declared function of arity %d",
              call.getName(),
              call.getArguments().size());
          return null;
        }
        List<Term> args = new ArrayList<>();
        for (Expression arg : call.getArguments()) {
          Term t = term(arg);
          if (t == null) {
            return null;
          }
          args.add(t);
        }
        return Term.apply(fn, args);
    }
    throw new IllegalStateException(expr.kind().toString());
  }
}
