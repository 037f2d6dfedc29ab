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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.protocalc.java.ir.Condition;
import net.protocalc.java.ir.ProcessInstance;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.ir.TransitionGraph;
import net.protocalc.java.store.StoreModel;
import net.protocalc.java.syntax.CallExpression;
import net.protocalc.java.syntax.Command;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Expression;
import net.protocalc.java.syntax.Guard;
import net.protocalc.java.syntax.Identifier;
import net.protocalc.java.syntax.Node;
import net.protocalc.java.syntax.StringLiteral;
import net.protocalc.java.syntax.TupleExpression;
import net.protocalc.java.theory.FunctionSymbol;
import net.protocalc.java.theory.Term;

/**
 * Elaborates one process instance to its {@link TransitionGraph}.
 *
 * <p>The elaborator is an emitter: it keeps a <i>frontier</i>, the set of nodes whose successor is
 * the next node to be added, and walks the command tree appending transitions. A branch forks the
 * frontier and joins the exits of its arms; a loop links the frontier at the end of its body back
 * to its head; a {@code return} empties the frontier. Syscall and attack calls are inlined at the
 * call site, their locals renamed apart, and where the attacker may replace a syscall the call
 * site becomes an {@link Transition.Alternatives} choice between the honest body and each
 * applicable attack body (see {@link CallSiteComposer}).
 *
 * <p>Errors are reported to the list supplied by the caller; elaboration continues past them so
 * that all errors of a process are found in one pass.
 */
final class ProcessElaborator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The kind of body being elaborated. */
  enum BodyKind {
    PROCESS,
    SYSCALL,
    ATTACK;
  }

  /** The context of one process, syscall or attack body. */
  static final class Frame {
    final String declaration;
    final BodyKind kind;
    // Whether the body is (transitively) inside an attack body.
    final boolean underAttack;
    // Whether the body is a passive attack, which may only write to the attacker store.
    final boolean passive;
    // The IR variable receiving the result, or null if the result is not used.
    @Nullable final String result;
    // Nodes after which control returns to the caller.
    final List<Integer> returns = new ArrayList<>();

    Frame(
        String declaration,
        BodyKind kind,
        boolean underAttack,
        boolean passive,
        @Nullable String result) {
      this.declaration = declaration;
      this.kind = kind;
      this.underAttack = underAttack;
      this.passive = passive;
      this.result = result;
    }
  }

  private final Environment env;
  private final List<CompileError> errors;
  private final String instanceName;
  private final String processType;
  private final TransitionGraph.Builder graph = TransitionGraph.builder();
  private final Set<String> usedVariables = new HashSet<>();
  private final CallSiteComposer composer;
  private List<Integer> frontier = ImmutableList.of();
  private int nextOrdinal = 0;

  private ProcessElaborator(
      Environment env, String instanceName, String processType, List<CompileError> errors) {
    this.env = env;
    this.instanceName = instanceName;
    this.processType = processType;
    this.errors = errors;
    this.composer = new CallSiteComposer(env, processType);
  }

  /**
   * Elaborates the template {@code process} applied to the channel and file instances {@code
   * arguments} (formal parameter name to instance name).
   */
  static ProcessInstance elaborate(
      Environment env,
      String instanceName,
      Declaration.Process process,
      ImmutableMap<String, String> arguments,
      List<CompileError> errors) {
    ProcessElaborator elab =
        new ProcessElaborator(env, instanceName, process.getTypeName(), errors);
    TransitionGraph graph = elab.run(process, arguments);
    logger.atFine().log(
        "elaborated %s = %s%s: %d nodes", instanceName, process.getName(), arguments, graph.size());
    return new ProcessInstance(
        instanceName, process.getName(), process.getTypeName(), arguments, graph);
  }

  private TransitionGraph run(Declaration.Process process, ImmutableMap<String, String> arguments) {
    frontier = ImmutableList.of(graph.add(Transition.start(process.getName())));
    Scope scope = Scope.root();
    for (Map.Entry<String, String> arg : arguments.entrySet()) {
      scope.bind(arg.getKey(), Scope.Binding.instance(arg.getValue()));
    }
    Frame frame = new Frame(process.getName(), BodyKind.PROCESS, false, false, null);
    for (Command.Bind var : process.getVariables()) {
      command(var, scope, frame);
    }
    command(process.getMain(), scope, frame);
    if (!frontier.isEmpty()) {
      append(Transition.end());
    }
    return graph.build();
  }

  // Formats and reports an error at the start of the specified node.
  @FormatMethod
  private void errorf(
      CompileError.Kind kind, Node node, Frame frame, String format, Object... args) {
    errors.add(
        new CompileError(
            kind, node.getStartLocation(), frame.declaration, String.format(format, args)));
  }

  // Adds a node after the current frontier, which becomes that node alone.
  private int append(Transition transition) {
    int node = graph.add(transition);
    graph.linkAll(frontier, node);
    frontier = ImmutableList.of(node);
    return node;
  }

  // Returns an IR variable name for a source name, unique within this process.
  private String freshVariable(String name) {
    String candidate = name;
    for (int i = 1; !usedVariables.add(candidate); i++) {
      candidate = name + "_" + i;
    }
    return candidate;
  }

  private void bindLocal(Identifier id, Term value, Scope scope, Frame frame) {
    if (!scope.bind(id.getName(), Scope.Binding.value(value))) {
      errorf(
          CompileError.Kind.REBOUND_VARIABLE,
          id,
          frame,
          "variable '%s' is already bound in this block",
          id.getName());
    }
  }

  // ==== Commands ====

  private void command(Command cmd, Scope scope, Frame frame) {
    switch (cmd.kind()) {
      case BIND:
        bind((Command.Bind) cmd, scope, frame);
        return;
      case SEQUENCE:
        for (Command c : ((Command.Sequence) cmd).getCommands()) {
          command(c, scope, frame);
        }
        return;
      case BRANCH:
        frontier = arms(((Command.Branch) cmd).getArms(), "case", scope, frame, false);
        return;
      case REPEAT:
        repeat((Command.Repeat) cmd, scope, frame);
        return;
      case NEW:
        newNonce((Command.New) cmd, scope, frame);
        return;
      case CALL:
        call(((Command.Call) cmd).getCall(), scope, frame, false);
        return;
      case EMIT:
        emit((Command.Emit) cmd, scope, frame);
        return;
      case STORE:
        storeOp((Command.StoreOp) cmd, scope, frame);
        return;
      case RETURN:
        returnCommand((Command.Return) cmd, scope, frame);
        return;
      case SKIP:
        return;
    }
    throw new IllegalStateException(cmd.kind().toString());
  }

  private void bind(Command.Bind bind, Scope scope, Frame frame) {
    Term value = value(bind.getValue(), scope, frame, true);
    if (value == null) {
      return;
    }
    Term.Variable var = Term.var(freshVariable(bind.getVariable().getName()));
    append(Transition.bind(var, value));
    bindLocal(bind.getVariable(), var, scope, frame);
  }

  private void newNonce(Command.New cmd, Scope scope, Frame frame) {
    String name = cmd.getVariable().getName();
    Term.Variable var = Term.var(freshVariable(name));
    append(Transition.fresh(var, env.getNonces().generate(name)));
    bindLocal(cmd.getVariable(), var, scope, frame);
  }

  private void emit(Command.Emit cmd, Scope scope, Frame frame) {
    CallExpression event = cmd.getEvent();
    List<Term> args = new ArrayList<>();
    for (Expression arg : event.getArguments()) {
      Term t = value(arg, scope, frame, true);
      if (t == null) {
        return;
      }
      args.add(t);
    }
    FunctionSymbol tag = FunctionSymbol.of(event.getName(), args.size());
    append(Transition.emit(Term.apply(tag, args), nextOrdinal++));
  }

  private void returnCommand(Command.Return cmd, Scope scope, Frame frame) {
    if (frame.kind == BodyKind.PROCESS) {
      // A return at top level ends the process.
      if (cmd.getValue() != null) {
        value(cmd.getValue(), scope, frame, true);
      }
      append(Transition.end());
      frontier = ImmutableList.of();
      return;
    }
    if (cmd.getValue() != null) {
      Term value = value(cmd.getValue(), scope, frame, true);
      if (value != null && frame.result != null) {
        append(Transition.bind(Term.var(frame.result), value));
      }
    }
    frame.returns.addAll(frontier);
    frontier = ImmutableList.of();
  }

  private void storeOp(Command.StoreOp cmd, Scope scope, Frame frame) {
    String instance = instance(cmd.getInstance(), scope, frame);
    if (instance == null) {
      return;
    }
    boolean attacker = instance.equals(StoreModel.ATTACKER);
    Command.StoreOpKind op = cmd.getOp();
    if (attacker && op == Command.StoreOpKind.REMOVE) {
      errorf(
          CompileError.Kind.ACCESS_VIOLATION,
          cmd,
          frame,
          "facts cannot be removed from the attacker's knowledge");
      return;
    }
    if (frame.passive
        && !attacker
        && (op == Command.StoreOpKind.INSERT || op == Command.StoreOpKind.REMOVE)) {
      errorf(
          CompileError.Kind.ACCESS_VIOLATION,
          cmd,
          frame,
          "passive attack '%s' may only write to the attacker's knowledge, not to '%s'",
          frame.declaration,
          instance);
      return;
    }
    switch (op) {
      case INSERT:
      case REMOVE:
        Term fact = value(cmd.getTerm(), scope, frame, true);
        if (fact == null) {
          return;
        }
        if (attacker) {
          fact = StoreModel.leakFact(fact);
        }
        append(
            Transition.storeOp(op, instance, fact, ImmutableList.of(), cmd.getStartLocation()));
        return;
      case CONSUME:
      case READ:
        Map<Identifier, Term.Variable> bound = new LinkedHashMap<>();
        Term pattern = pattern(cmd.getTerm(), scope, frame, bound, new LinkedHashMap<>());
        if (pattern == null) {
          return;
        }
        if (attacker) {
          pattern = StoreModel.injectFact(pattern);
        }
        List<String> names = new ArrayList<>();
        for (Term.Variable var : bound.values()) {
          names.add(var.getName());
        }
        append(Transition.storeOp(op, instance, pattern, names, cmd.getStartLocation()));
        for (Map.Entry<Identifier, Term.Variable> e : bound.entrySet()) {
          bindLocal(e.getKey(), e.getValue(), scope, frame);
        }
        return;
    }
    throw new IllegalStateException(op.toString());
  }

  // ==== Branches and loops ====

  /**
   * Elaborates guarded arms tested in declaration order from the current frontier, and returns
   * the exits of the arm bodies. If {@code needElse}, leaves as frontier the path on which every
   * arm failed; otherwise that path is a dead end.
   *
   * <p>The failure of an arm with conditions c1..ck is encoded as k guard nodes, not c1 .. not ck,
   * from which the next arm is tested. An arm that is constant false is skipped; a constant-true
   * condition is dropped.
   */
  private List<Integer> arms(
      List<Command.Arm> arms, String label, Scope scope, Frame frame, boolean needElse) {
    List<Integer> exits = new ArrayList<>();
    for (int i = 0; i < arms.size(); i++) {
      Command.Arm arm = arms.get(i);
      List<Condition> conditions = conditions(arm, scope, frame);
      if (conditions == null) {
        // The body of an arm that never holds is not elaborated.
        logger.atWarning().log(
            "%s: %s arm %d of %s never holds", arm.getStartLocation(), label, i + 1, instanceName);
        continue;
      }
      List<Integer> test = frontier;
      append(Transition.guard(label + " " + (i + 1), conditions));
      command(arm.getBody(), scope.child(), frame);
      exits.addAll(frontier);

      if (conditions.isEmpty()) {
        if (i < arms.size() - 1) {
          logger.atWarning().log(
              "%s: %s arm %d of %s always holds; later arms are unreachable",
              arm.getStartLocation(), label, i + 1, instanceName);
        }
        frontier = ImmutableList.of();
        break;
      }
      if (i == arms.size() - 1 && !needElse) {
        frontier = ImmutableList.of();
      } else {
        List<Integer> failed = new ArrayList<>();
        for (Condition c : conditions) {
          frontier = test;
          String failure = label + " " + (i + 1) + " fails";
          failed.add(append(Transition.guard(failure, ImmutableList.of(c.negate()))));
        }
        frontier = failed;
      }
    }
    if (!needElse) {
      frontier = ImmutableList.of();
    }
    return exits;
  }

  /**
   * Returns the conditions of an arm, or null if the arm can never be taken. Only a comparison of
   * two string literals is folded: distinct literals are unequal, identical ones equal.
   */
  @Nullable
  private List<Condition> conditions(Command.Arm arm, Scope scope, Frame frame) {
    List<Condition> conditions = new ArrayList<>();
    for (Guard guard : arm.getGuards()) {
      if (guard.getLHS() instanceof StringLiteral left
          && guard.getRHS() instanceof StringLiteral right) {
        boolean same = left.getValue().equals(right.getValue());
        if (same != guard.isEqual()) {
          return null;
        }
        continue;
      }
      Term lhs = value(guard.getLHS(), scope, frame, false);
      Term rhs = value(guard.getRHS(), scope, frame, false);
      if (lhs != null && rhs != null) {
        conditions.add(guard.isEqual() ? Condition.equal(lhs, rhs) : Condition.notEqual(lhs, rhs));
      }
    }
    return conditions;
  }

  /**
   * Loop head, body, then the until arms tested from the end of the body. The path on which every
   * arm fails continues at the loop head. The until guards see the bindings of the body.
   */
  private void repeat(Command.Repeat repeat, Scope scope, Frame frame) {
    int head = append(Transition.join("repeat"));
    Scope body = scope.child();
    command(repeat.getBody(), body, frame);
    List<Integer> exits = arms(repeat.getUntil(), "until", body, frame, true);
    graph.linkAll(frontier, head);
    frontier = exits;
  }

  // ==== Calls ====

  /**
   * Elaborates a call of a syscall or passive attack at the current frontier. Returns the IR
   * variable holding its result if {@code resultUsed}, or null (also after an error).
   */
  @Nullable
  private Term call(CallExpression call, Scope scope, Frame frame, boolean resultUsed) {
    String name = call.getName();
    Declaration.Syscall syscall = env.getSyscall(name);
    Declaration.Attack attack = env.getAttack(name);
    if (syscall == null && attack == null) {
      errorf(
          CompileError.Kind.UNKNOWN_SYMBOL,
          call,
          frame,
          "'%s' is not a declared syscall or attack",
          name);
      return null;
    }
    if (attack != null && attack.isActive()) {
      errorf(
          CompileError.Kind.UNKNOWN_SYMBOL,
          call,
          frame,
          "active attack '%s' cannot be called; it may replace calls of '%s'",
          name,
          attack.getTarget());
      return null;
    }
    List<Identifier> params = syscall != null ? syscall.getParameters() : attack.getParameters();
    if (params.size() != call.getArguments().size()) {
      errorf(
          CompileError.Kind.ARITY_MISMATCH,
          call,
          frame,
          "'%s' takes %d arguments but %d were given",
          name,
          params.size(),
          call.getArguments().size());
      return null;
    }

    // Evaluate arguments, left to right.
    List<Scope.Binding> actuals = new ArrayList<>();
    String objectType = null;
    boolean ok = true;
    for (Expression arg : call.getArguments()) {
      String instance = arg instanceof Identifier id ? lookupInstance(id, scope) : null;
      if (instance != null) {
        actuals.add(Scope.Binding.instance(instance));
        if (objectType == null) {
          objectType = env.getStoreModel().get(instance).getTypeName();
        }
        continue;
      }
      Term t = value(arg, scope, frame, true);
      if (t == null) {
        ok = false;
      } else {
        actuals.add(Scope.Binding.value(t));
      }
    }
    if (!ok) {
      return null;
    }

    checkAccess(call, frame, name, syscall != null, objectType);

    String result = resultUsed ? freshVariable(name + "_result") : null;
    ImmutableList<Declaration.Attack> attacks =
        syscall != null && !frame.underAttack
            ? composer.applicableAttacks(name, objectType)
            : ImmutableList.of();
    if (attacks.isEmpty()) {
      if (syscall != null) {
        inline(syscall.getName(), params, syscall.getBody(), actuals, frame, false, false, result);
      } else {
        inline(attack.getName(), params, attack.getBody(), actuals, frame, true, true, result);
      }
    } else {
      ImmutableList<CallSiteComposer.Continuation> continuations =
          composer.continuations(syscall, attacks);
      int choice = append(composer.choice(name, continuations));
      List<Integer> exits = new ArrayList<>();
      for (CallSiteComposer.Continuation cont : continuations) {
        frontier = ImmutableList.of(choice);
        append(Transition.join(cont.toString()));
        inline(
            cont.getName(),
            cont.getParameters(),
            cont.getBody(),
            actuals,
            frame,
            cont.isAttack(),
            false,
            result);
        exits.addAll(frontier);
      }
      frontier = exits;
    }
    return result != null ? Term.var(result) : null;
  }

  private void checkAccess(
      CallExpression call, Frame frame, String op, boolean isSyscall, @Nullable String objectType) {
    boolean allowed;
    if (frame.kind == BodyKind.PROCESS && isSyscall) {
      allowed = env.getPolicy().checkInvocation(processType, objectType, op);
    } else if (frame.kind == BodyKind.PROCESS || frame.kind == BodyKind.ATTACK) {
      // Passive attacks, and calls inside attack bodies, need an attacker grant.
      allowed = env.getPolicy().attackerMayInvokeAt(processType, objectType, op);
    } else {
      // Calls inside syscall bodies were authorized with the syscall.
      allowed = true;
    }
    if (!allowed) {
      errorf(
          CompileError.Kind.ACCESS_VIOLATION,
          call,
          frame,
          "%s of type '%s' may not invoke '%s' %s",
          frame.kind == BodyKind.PROCESS ? "process" : "attack in a process",
          processType,
          op,
          objectType != null ? "on an object of type '" + objectType + "'" : "without an object");
    }
  }

  // Inlines a body: formals bound to actuals in a new scope chain, locals renamed apart.
  private void inline(
      String name,
      List<Identifier> params,
      Command body,
      List<Scope.Binding> actuals,
      Frame caller,
      boolean attack,
      boolean passive,
      @Nullable String result) {
    Scope scope = Scope.root();
    for (int i = 0; i < params.size(); i++) {
      scope.bind(params.get(i).getName(), actuals.get(i));
    }
    Frame frame =
        new Frame(
            name,
            attack ? BodyKind.ATTACK : BodyKind.SYSCALL,
            caller.underAttack || attack,
            passive,
            result);
    command(body, scope, frame);
    if (result != null && !frontier.isEmpty()) {
      // Falling off the end of a body yields "unit".
      append(Transition.bind(Term.var(result), Term.literal("unit")));
    }
    List<Integer> exits = new ArrayList<>(frontier);
    exits.addAll(frame.returns);
    frontier = exits;
  }

  // ==== Expressions ====

  // Returns the instance denoted by an identifier, or null if it does not denote one.
  @Nullable
  private String lookupInstance(Identifier id, Scope scope) {
    Scope.Binding b = scope.lookup(id.getName());
    if (b != null) {
      return b.isInstance() ? b.getInstance() : null;
    }
    return env.getStoreModel().get(id.getName()) != null ? id.getName() : null;
  }

  @Nullable
  private String instance(Identifier id, Scope scope, Frame frame) {
    String instance = lookupInstance(id, scope);
    if (instance == null) {
      errorf(
          CompileError.Kind.UNKNOWN_SYMBOL,
          id,
          frame,
          "'%s' is not a declared channel or file",
          id.getName());
    }
    return instance;
  }

  /**
   * Converts an expression to the term it denotes. Calls of syscalls and passive attacks are
   * inlined before the current command if {@code allowCalls}. Returns null after reporting an
   * error.
   */
  @Nullable
  private Term value(Expression expr, Scope scope, Frame frame, boolean allowCalls) {
    switch (expr.kind()) {
      case STRING_LITERAL:
        return Term.literal(((StringLiteral) expr).getValue());
      case IDENTIFIER:
        Identifier id = (Identifier) expr;
        Term t = lookupTerm(id, scope);
        if (t == null) {
          if (lookupInstance(id, scope) != null) {
            errorf(
                CompileError.Kind.UNKNOWN_SYMBOL,
                id,
                frame,
                "channel or file '%s' is not a term",
                id.getName());
          } else {
            errorf(
                CompileError.Kind.UNBOUND_VARIABLE,
                id,
                frame,
                "variable '%s' is not bound",
                id.getName());
          }
        }
        return t;
      case TUPLE:
        List<Term> elements = new ArrayList<>();
        for (Expression elem : ((TupleExpression) expr).getElements()) {
          Term e = value(elem, scope, frame, allowCalls);
          if (e == null) {
            return null;
          }
          elements.add(e);
        }
        return Term.tuple(elements);
      case CALL:
        CallExpression call = (CallExpression) expr;
        if (env.getSyscall(call.getName()) != null || env.getAttack(call.getName()) != null) {
          if (!allowCalls) {
            errorf(
                CompileError.Kind.UNKNOWN_SYMBOL,
                call,
                frame,
                "'%s' is a syscall or attack and cannot be called here",
                call.getName());
            return null;
          }
          return call(call, scope, frame, true);
        }
        FunctionSymbol fn = function(call, frame);
        if (fn == null) {
          return null;
        }
        List<Term> args = new ArrayList<>();
        for (Expression arg : call.getArguments()) {
          Term a = value(arg, scope, frame, allowCalls);
          if (a == null) {
            return null;
          }
          args.add(a);
        }
        return Term.apply(fn, args);
    }
    throw new IllegalStateException(expr.kind().toString());
  }

  /**
   * Converts the pattern of a consuming or reading match. Identifiers that are not bound become
   * pattern variables, recorded in {@code bound}; an identifier occurring twice denotes the same
   * variable.
   */
  @Nullable
  private Term pattern(
      Expression expr,
      Scope scope,
      Frame frame,
      Map<Identifier, Term.Variable> bound,
      Map<String, Term.Variable> byName) {
    switch (expr.kind()) {
      case STRING_LITERAL:
        return Term.literal(((StringLiteral) expr).getValue());
      case IDENTIFIER:
        Identifier id = (Identifier) expr;
        Term t = lookupTerm(id, scope);
        if (t != null) {
          return t;
        }
        Term.Variable var = byName.get(id.getName());
        if (var == null) {
          var = Term.var(freshVariable(id.getName()));
          byName.put(id.getName(), var);
          bound.put(id, var);
        }
        return var;
      case TUPLE:
        List<Term> elements = new ArrayList<>();
        for (Expression elem : ((TupleExpression) expr).getElements()) {
          Term e = pattern(elem, scope, frame, bound, byName);
          if (e == null) {
            return null;
          }
          elements.add(e);
        }
        return Term.tuple(elements);
      case CALL:
        CallExpression call = (CallExpression) expr;
        FunctionSymbol fn = function(call, frame);
        if (fn == null) {
          return null;
        }
        List<Term> args = new ArrayList<>();
        for (Expression arg : call.getArguments()) {
          Term a = pattern(arg, scope, frame, bound, byName);
          if (a == null) {
            return null;
          }
          args.add(a);
        }
        return Term.apply(fn, args);
    }
    throw new IllegalStateException(expr.kind().toString());
  }

  // Returns the term bound to an identifier: a local, a constant, or a nullary function.
  @Nullable
  private Term lookupTerm(Identifier id, Scope scope) {
    Scope.Binding b = scope.lookup(id.getName());
    if (b != null) {
      return b.isInstance() ? null : b.getValue();
    }
    Term constant = env.getConstant(id.getName());
    if (constant != null) {
      return constant;
    }
    FunctionSymbol fn = env.getTheory().lookup(id.getName());
    if (fn != null && fn.getArity() == 0) {
      return Term.apply(fn);
    }
    return null;
  }

  @Nullable
  private FunctionSymbol function(CallExpression call, Frame frame) {
    FunctionSymbol fn = env.getTheory().lookup(call.getName());
    if (fn == null) {
      errorf(
          CompileError.Kind.UNKNOWN_SYMBOL,
          call,
          frame,
          "'%s' is not a declared function, syscall or attack",
          call.getName());
      return null;
    }
    if (fn.getArity() != call.getArguments().size()) {
      errorf(
          CompileError.Kind.ARITY_MISMATCH,
          call,
          frame,
          "function '%s' takes %d arguments but %d were given",
          fn.getName(),
          fn.getArity(),
          call.getArguments().size());
      return null;
    }
    return fn;
  }
}
