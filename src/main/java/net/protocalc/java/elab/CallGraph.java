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

package net.protocalc.java.elab;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.protocalc.java.syntax.CallExpression;
import net.protocalc.java.syntax.Command;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.NodeVisitor;

/**
 * The call graph of the syscalls and attacks of a model, used to reject recursion: a call site is
 * elaborated by inlining, so every chain of calls must be finite.
 *
 * <p>A node is a body together with the context it is inlined in, as the elaborator sees it.
 * Syscall bodies are inlined in the context of their caller; attack bodies, active or passive, are
 * always inlined under attack. In normal context a call of a syscall may also be replaced by any
 * active attack on it, so there is an edge to each of them; under attack calls are never replaced.
 * Active attacks are never called directly.
 */
final class CallGraph {

  // A body, inlined in normal context or under an attack.
  private record Node(String name, boolean underAttack) {}

  // Marker pushed below the children of a node; popping it means they are all finished.
  private static final Node CHILDREN_FINISHED = new Node("<children finished>", false);

  private final Map<String, Declaration> decls = new LinkedHashMap<>();
  private final Map<String, ImmutableList<String>> calls = new LinkedHashMap<>();
  private final ImmutableListMultimap<String, Declaration.Attack> attacksOn;
  private final boolean composeAttacks;

  private CallGraph(
      Map<String, Declaration.Syscall> syscalls,
      Map<String, Declaration.Attack> attacks,
      boolean composeAttacks) {
    decls.putAll(syscalls);
    decls.putAll(attacks);
    for (Declaration.Syscall syscall : syscalls.values()) {
      calls.put(syscall.getName(), callees(syscall.getBody()));
    }
    ImmutableListMultimap.Builder<String, Declaration.Attack> byTarget =
        ImmutableListMultimap.builder();
    for (Declaration.Attack attack : attacks.values()) {
      calls.put(attack.getName(), callees(attack.getBody()));
      if (attack.isActive()) {
        byTarget.put(attack.getTarget(), attack);
      }
    }
    this.attacksOn = byTarget.build();
    this.composeAttacks = composeAttacks;
  }

  /**
   * Reports a {@code RecursiveSyscall} error for each distinct cycle among {@code syscalls} and
   * {@code attacks}. If {@code composeAttacks} is false, calls are never replaced by attacks.
   */
  static void check(
      Map<String, Declaration.Syscall> syscalls,
      Map<String, Declaration.Attack> attacks,
      boolean composeAttacks,
      List<CompileError> errors) {
    new CallGraph(syscalls, attacks, composeAttacks).findCycles(errors);
  }

  // Returns the names of the declared syscalls and attacks called in a body, in order.
  private ImmutableList<String> callees(Command body) {
    Set<String> result = new LinkedHashSet<>();
    body.accept(
        new NodeVisitor() {
          @Override
          public void visit(CallExpression call) {
            if (decls.containsKey(call.getName())) {
              result.add(call.getName());
            }
            visitAll(call.getArguments());
          }

          @Override
          public void visit(Command.Emit emit) {
            // An event tag is not a call.
            visitAll(emit.getEvent().getArguments());
          }
        });
    return ImmutableList.copyOf(result);
  }

  private List<Node> children(Node node) {
    Set<Node> result = new LinkedHashSet<>();
    for (String callee : calls.get(node.name())) {
      Declaration decl = decls.get(callee);
      if (decl instanceof Declaration.Syscall) {
        result.add(new Node(callee, node.underAttack()));
        if (composeAttacks && !node.underAttack()) {
          for (Declaration.Attack attack : attacksOn.get(callee)) {
            result.add(new Node(attack.getName(), true));
          }
        }
      } else if (!((Declaration.Attack) decl).isActive()) {
        result.add(new Node(callee, true));
      }
    }
    return new ArrayList<>(result);
  }

  private void findCycles(List<CompileError> errors) {
    Set<Node> finished = new HashSet<>();
    Set<ImmutableSortedSet<String>> reported = new HashSet<>();
    for (Declaration decl : decls.values()) {
      Node root = new Node(decl.getName(), decl instanceof Declaration.Attack);
      if (finished.contains(root)) {
        continue;
      }
      // Iterative depth-first search. The path is the chain of nodes being visited; a child
      // found on the path closes a cycle.
      List<Node> path = new ArrayList<>();
      Deque<Node> toVisit = new ArrayDeque<>();
      toVisit.push(root);
      while (!toVisit.isEmpty()) {
        Node key = toVisit.pop();
        if (key.equals(CHILDREN_FINISHED)) {
          finished.add(path.remove(path.size() - 1));
          continue;
        }
        if (finished.contains(key) || path.contains(key)) {
          continue;
        }
        path.add(key);
        toVisit.push(CHILDREN_FINISHED);
        for (Node child : children(key)) {
          int start = path.indexOf(child);
          if (start >= 0) {
            List<String> cycle = new ArrayList<>();
            for (Node member : path.subList(start, path.size())) {
              cycle.add(member.name());
            }
            if (reported.add(ImmutableSortedSet.copyOf(cycle))) {
              report(cycle, errors);
            }
          } else if (!finished.contains(child)) {
            toVisit.push(child);
          }
        }
      }
    }
  }

  private void report(List<String> cycle, List<CompileError> errors) {
    Declaration first = decls.get(cycle.get(0));
    String what = first instanceof Declaration.Syscall ? "syscall" : "attack";
    List<String> chain = new ArrayList<>(cycle);
    chain.add(cycle.get(0));
    errors.add(
        new CompileError(
            CompileError.Kind.RECURSIVE_SYSCALL,
            first.getStartLocation(),
            first.getName(),
            String.format(
                "%s '%s' is recursive: %s", what, first.getName(), Joiner.on(" -> ").join(chain))));
  }
}
