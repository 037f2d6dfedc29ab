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

package net.protocalc.java.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)} or {@link #visitAll} on child fields.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  // ==== Declarations ====

  public void visit(Declaration.Function node) {}

  public void visit(Declaration.Equation node) {
    visit(node.getLHS());
    visit(node.getRHS());
  }

  public void visit(Declaration.Type node) {}

  public void visit(Declaration.Grant node) {}

  public void visit(Declaration.AttackerGrant node) {}

  public void visit(Declaration.Syscall node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(Declaration.Attack node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(Declaration.Constant node) {}

  public void visit(Declaration.Instance node) {
    if (node.getContent() != null) {
      visit(node.getContent());
    }
  }

  public void visit(Declaration.Process node) {
    visitAll(node.getParameters());
    visitAll(node.getVariables());
    visit(node.getMain());
  }

  public void visit(Declaration.Lemma node) {
    if (node.getFormula() != null) {
      visit(node.getFormula());
    }
    visitAll(node.getEvents());
  }

  public void visit(ModelFile.Composition node) {
    visitAll(node.getProcesses());
    visitAll(node.getLemmas());
  }

  // ==== Commands ====

  public void visit(Command.Bind node) {
    visit(node.getVariable());
    visit(node.getValue());
  }

  public void visit(Command.Sequence node) {
    visitAll(node.getCommands());
  }

  public void visit(Command.Arm node) {
    visitAll(node.getGuards());
    visit(node.getBody());
  }

  public void visit(Command.Branch node) {
    visitAll(node.getArms());
  }

  public void visit(Command.Repeat node) {
    visit(node.getBody());
    visitAll(node.getUntil());
  }

  public void visit(Command.New node) {
    visit(node.getVariable());
  }

  public void visit(Command.Call node) {
    visit(node.getCall());
  }

  public void visit(Command.Emit node) {
    visit(node.getEvent());
  }

  public void visit(Command.StoreOp node) {
    visit(node.getInstance());
    visit(node.getTerm());
  }

  public void visit(Command.Return node) {
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  public void visit(Command.Skip node) {}

  public void visit(Guard node) {
    visit(node.getLHS());
    visit(node.getRHS());
  }

  // ==== Expressions ====

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(Identifier node) {}

  public void visit(StringLiteral node) {}

  public void visit(TupleExpression node) {
    visitAll(node.getElements());
  }

  // ==== Lemma formulas ====

  public void visit(LemmaFormula node) {
    switch (node.kind()) {
      case EVENT:
        LemmaFormula.Event event = (LemmaFormula.Event) node;
        visit(event.getEvent());
        visit(event.getIndex());
        break;
      case PRECEDES:
        LemmaFormula.Precedes precedes = (LemmaFormula.Precedes) node;
        visit(precedes.getBefore());
        visit(precedes.getAfter());
        break;
      case EQUAL:
        LemmaFormula.Equal equal = (LemmaFormula.Equal) node;
        visit(equal.getLHS());
        visit(equal.getRHS());
        break;
      case NOT:
      case AND:
      case OR:
      case IMPLIES:
        visitAll(((LemmaFormula.Connective) node).getOperands());
        break;
      case EXISTS:
      case FORALL:
        LemmaFormula.Quantified q = (LemmaFormula.Quantified) node;
        visitAll(q.getVariables());
        visit(q.getBody());
        break;
    }
  }
}
