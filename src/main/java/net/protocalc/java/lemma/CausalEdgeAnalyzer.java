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
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.ir.CausalEdge;
import net.protocalc.java.ir.ProcessInstance;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.ir.TransitionGraph;
import net.protocalc.java.store.StoreInstance;
import net.protocalc.java.store.StoreModel;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.theory.Substitution;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;
import net.protocalc.java.theory.TheoryException;
import net.protocalc.java.theory.Unifier;

/**
 * Derives the causal precedence constraints between the store operations of a composed system.
 *
 * <p>A consuming or reading match on an instance can only be satisfied by a fact that some
 * insertion put there (or by the initial content of a file). There is a {@link CausalEdge} from
 * each INSERT site to each CONSUME or READ site of the same instance whose terms unify, after
 * normalization and renaming the variables of the two sites apart. Facts of the attacker's
 * knowledge are supplied by the attacker, so matches on it have no producer edges.
 *
 * <p>The same site tables decide the static {@code FactAbsent} check: a REMOVE of a ground fact
 * from an instance that neither an insertion site nor the initial content can supply.
 */
public final class CausalEdgeAnalyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // A store operation of one process instance.
  private static final class Site {
    final String process;
    final int node;
    final Transition.StoreOp op;
    // The normalized term, or null if normalization diverged.
    @Nullable final Term normal;

    Site(String process, int node, Transition.StoreOp op, @Nullable Term normal) {
      this.process = process;
      this.node = node;
      this.op = op;
      this.normal = normal;
    }
  }

  private final Theory theory;
  private final StoreModel storeModel;
  private final List<CompileError> errors;
  // Sites by instance name, in process and node order.
  private final ListMultimap<String, Site> inserts = LinkedListMultimap.create();
  private final ListMultimap<String, Site> matches = LinkedListMultimap.create();
  private final ListMultimap<String, Site> removals = LinkedListMultimap.create();

  private CausalEdgeAnalyzer(Theory theory, StoreModel storeModel, List<CompileError> errors) {
    this.theory = theory;
    this.storeModel = storeModel;
    this.errors = errors;
  }

  /** Collects the store operations of {@code processes}. */
  public static CausalEdgeAnalyzer create(
      Theory theory,
      StoreModel storeModel,
      List<ProcessInstance> processes,
      List<CompileError> errors) {
    CausalEdgeAnalyzer analyzer = new CausalEdgeAnalyzer(theory, storeModel, errors);
    for (ProcessInstance process : processes) {
      analyzer.addSites(process);
    }
    return analyzer;
  }

  private void addSites(ProcessInstance process) {
    TransitionGraph graph = process.getGraph();
    for (int i : graph.indicesOf(Transition.Kind.STORE)) {
      Transition.StoreOp op = (Transition.StoreOp) graph.get(i);
      Site site = new Site(process.getName(), i, op, normalize(op, process.getName()));
      switch (op.getOp()) {
        case INSERT:
          inserts.put(op.getInstance(), site);
          break;
        case CONSUME:
        case READ:
          matches.put(op.getInstance(), site);
          break;
        case REMOVE:
          removals.put(op.getInstance(), site);
          break;
      }
    }
  }

  @Nullable
  private Term normalize(Transition.StoreOp op, String process) {
    try {
      return theory.normalize(op.getTerm());
    } catch (TheoryException ex) {
      errors.add(new CompileError(ex.getKind(), op.getLocation(), process, ex.getMessage()));
      return null;
    }
  }

  /** Returns the causal edges, by instance, then producer, then consumer. */
  public ImmutableList<CausalEdge> edges() {
    ImmutableList.Builder<CausalEdge> edges = ImmutableList.builder();
    int count = 0;
    for (String instance : matches.keySet()) {
      if (instance.equals(StoreModel.ATTACKER)) {
        continue;
      }
      for (Site producer : inserts.get(instance)) {
        for (Site consumer : matches.get(instance)) {
          if (mayUnify(producer, consumer)) {
            edges.add(
                CausalEdge.create(
                    instance, producer.process, producer.node, consumer.process, consumer.node));
            count++;
          }
        }
      }
    }
    logger.atFine().log("%d causal edges", count);
    return edges.build();
  }

  /**
   * Reports a {@code FactAbsent} error for each removal of a ground fact that no insertion site
   * and no initial content can supply.
   */
  public void checkRemovals() {
    for (Site removal : removals.values()) {
      if (removal.normal == null || !removal.normal.isGround()) {
        continue;
      }
      String instance = removal.op.getInstance();
      if (suppliedByContent(instance, removal.normal)) {
        continue;
      }
      boolean supplied = false;
      for (Site producer : inserts.get(instance)) {
        if (mayUnify(producer, removal)) {
          supplied = true;
          break;
        }
      }
      if (!supplied) {
        errors.add(
            new CompileError(
                CompileError.Kind.FACT_ABSENT,
                removal.op.getLocation(),
                removal.process,
                String.format(
                    "fact '%s' is never present in '%s': no insertion or initial content"
                        + " supplies it",
                    removal.op.getTerm(), instance)));
      }
    }
  }

  private boolean suppliedByContent(String instance, Term fact) {
    StoreInstance store = storeModel.get(instance);
    if (store == null || store.getContent() == null) {
      return false;
    }
    try {
      return theory.normalize(store.getContent()).equals(fact);
    } catch (TheoryException ex) {
      errors.add(new CompileError(ex.getKind(), store.getLocation(), instance, ex.getMessage()));
      return true; // already reported
    }
  }

  private static boolean mayUnify(Site producer, Site consumer) {
    if (producer.normal == null || consumer.normal == null) {
      return true; // unknown, keep the edge
    }
    Substitution unifier =
        Unifier.unify(rename(producer.normal, "p."), rename(consumer.normal, "c."));
    return unifier != null;
  }

  private static Term rename(Term term, String prefix) {
    Map<String, Term> renaming = new LinkedHashMap<>();
    for (String var : term.variables()) {
      renaming.put(var, Term.var(prefix + var));
    }
    return Substitution.of(renaming).apply(term);
  }
}
