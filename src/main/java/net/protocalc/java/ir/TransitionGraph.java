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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * A TransitionGraph is the control-flow graph of one process instance: an arena of {@link
 * Transition} nodes addressed by integer index, each with an ordered list of successor indices.
 * Node 0 is the START node. Loops appear as back edges; a node without successors is a terminal
 * node, either END (normal termination) or a dead end (a blocked trace).
 *
 * <p>A node with several successors denotes a nondeterministic choice: between branch arms (whose
 * guards decide), or, for an ALTERNATIVES node, between the continuations of an attacker-controlled
 * call site.
 */
public final class TransitionGraph {

  private final ImmutableList<Transition> nodes;
  private final ImmutableList<ImmutableList<Integer>> successors;

  private TransitionGraph(
      ImmutableList<Transition> nodes, ImmutableList<ImmutableList<Integer>> successors) {
    this.nodes = nodes;
    this.successors = successors;
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  public Transition get(int index) {
    return nodes.get(index);
  }

  public ImmutableList<Transition> getNodes() {
    return nodes;
  }

  /** Returns the successors of a node, in order. */
  public ImmutableList<Integer> getSuccessors(int index) {
    return successors.get(index);
  }

  /** Returns the indices of the nodes that have {@code index} as a successor. */
  public ImmutableList<Integer> getPredecessors(int index) {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = 0; i < nodes.size(); i++) {
      if (successors.get(i).contains(index)) {
        result.add(i);
      }
    }
    return result.build();
  }

  /** Returns the indices of all nodes of the specified kind, in index order. */
  public ImmutableList<Integer> indicesOf(Transition.Kind kind) {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).kind() == kind) {
        result.add(i);
      }
    }
    return result.build();
  }

  /** Returns all transitions of the specified type, in index order. */
  public <T extends Transition> ImmutableList<T> transitionsOf(Class<T> type) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Transition t : nodes) {
      if (type.isInstance(t)) {
        result.add(type.cast(t));
      }
    }
    return result.build();
  }

  /** Returns the set of nodes reachable from {@code from}, including itself. */
  public BitSet reachableFrom(int from) {
    BitSet seen = new BitSet(nodes.size());
    // Explicit stack: loop bodies and inlined calls can make paths long.
    Deque<Integer> toVisit = new ArrayDeque<>();
    toVisit.push(from);
    while (!toVisit.isEmpty()) {
      int node = toVisit.pop();
      if (seen.get(node)) {
        continue;
      }
      seen.set(node);
      for (int succ : successors.get(node)) {
        toVisit.push(succ);
      }
    }
    return seen;
  }

  /** Reports whether {@code to} is reachable from {@code from}. */
  public boolean isReachable(int from, int to) {
    return reachableFrom(from).get(to);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A Builder adds nodes and edges; the resulting graph is immutable. */
  public static final class Builder {
    private final List<Transition> nodes = new ArrayList<>();
    private final List<List<Integer>> successors = new ArrayList<>();

    private Builder() {}

    /** Adds a node and returns its index. */
    public int add(Transition transition) {
      nodes.add(Preconditions.checkNotNull(transition));
      successors.add(new ArrayList<>());
      return nodes.size() - 1;
    }

    /** Adds the edge {@code from -> to}. Successor order is the order of linking. */
    @CanIgnoreReturnValue
    public Builder link(int from, int to) {
      Preconditions.checkElementIndex(from, nodes.size());
      Preconditions.checkElementIndex(to, nodes.size());
      successors.get(from).add(to);
      return this;
    }

    /** Adds an edge from each node of {@code frontier} to {@code to}. */
    @CanIgnoreReturnValue
    public Builder linkAll(Iterable<Integer> frontier, int to) {
      for (int from : frontier) {
        link(from, to);
      }
      return this;
    }

    public int size() {
      return nodes.size();
    }

    public Transition get(int index) {
      return nodes.get(index);
    }

    public TransitionGraph build() {
      Preconditions.checkState(
          !nodes.isEmpty() && nodes.get(0).kind() == Transition.Kind.START,
          "graph must begin with a START node");
      ImmutableList.Builder<ImmutableList<Integer>> succ =
          ImmutableList.builderWithExpectedSize(successors.size());
      for (List<Integer> s : successors) {
        succ.add(ImmutableList.copyOf(s));
      }
      return new TransitionGraph(ImmutableList.copyOf(nodes), succ.build());
    }
  }
}
