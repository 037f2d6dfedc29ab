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

import com.google.common.base.Joiner;
import net.protocalc.java.store.StoreInstance;
import net.protocalc.java.theory.Equation;
import net.protocalc.java.theory.FunctionSymbol;

/**
 * Renders a {@link CompiledSystem} as stable, prover-independent text. The output depends only on
 * the system, never on hash order, so it may be compared in tests and diffed between runs.
 *
 * <p>Example:
 *
 * <pre>
 * theory
 *   symbols pair/2, fst/1, snd/1
 *   equation fst(pair(x, y)) = x
 * stores
 *   attacker
 *   ch: chan_t
 * process A = client{c=ch}: client_t
 *   0: start client -> 1
 *   1: end
 * </pre>
 */
public final class IrPrinter {

  private final StringBuilder buf = new StringBuilder();

  private IrPrinter() {}

  /** Returns the text form of {@code system}. */
  public static String print(CompiledSystem system) {
    IrPrinter printer = new IrPrinter();
    printer.printSystem(system);
    return printer.buf.toString();
  }

  /** Returns the text form of a single transition graph, one node per line. */
  public static String print(TransitionGraph graph) {
    IrPrinter printer = new IrPrinter();
    printer.printGraph(graph, "");
    return printer.buf.toString();
  }

  private void printSystem(CompiledSystem system) {
    line("system " + system.getName());
    line("theory");
    StringBuilder symbols = new StringBuilder();
    for (FunctionSymbol symbol : system.getTheory().getSymbols()) {
      if (symbols.length() > 0) {
        symbols.append(", ");
      }
      symbols.append(symbol);
    }
    line("  symbols " + symbols);
    for (Equation eq : system.getTheory().getEquations()) {
      line("  equation " + eq);
    }
    line("stores");
    for (StoreInstance instance : system.getStoreModel().getInstances()) {
      line(
          "  "
              + instance
              + (instance.getContent() != null ? " = " + instance.getContent() : ""));
    }
    if (!system.getInit().isEmpty()) {
      line("init");
      for (Transition.Fresh fresh : system.getInit()) {
        line("  " + fresh);
      }
    }
    for (ProcessInstance process : system.getProcesses()) {
      line(
          "process "
              + process.getName()
              + " = "
              + process.getTemplate()
              + process.getArguments()
              + ": "
              + process.getProcessType());
      printGraph(process.getGraph(), "  ");
    }
    if (!system.getCausalEdges().isEmpty()) {
      line("edges");
      for (CausalEdge edge : system.getCausalEdges()) {
        line("  " + edge);
      }
    }
    for (NormalizedLemma lemma : system.getLemmas()) {
      line(lemma.toString());
    }
  }

  private void printGraph(TransitionGraph graph, String indent) {
    for (int i = 0; i < graph.size(); i++) {
      StringBuilder node = new StringBuilder(indent).append(i).append(": ").append(graph.get(i));
      if (!graph.getSuccessors(i).isEmpty()) {
        node.append(" -> ").append(Joiner.on(", ").join(graph.getSuccessors(i)));
      }
      line(node.toString());
    }
  }

  private void line(String text) {
    buf.append(text).append('\n');
  }
}
