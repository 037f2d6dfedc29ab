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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.ir.Transition;
import net.protocalc.java.policy.AccessPolicy;
import net.protocalc.java.store.StoreModel;
import net.protocalc.java.syntax.CallExpression;
import net.protocalc.java.syntax.Command;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Expression;
import net.protocalc.java.syntax.Identifier;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.syntax.ModelFile;
import net.protocalc.java.syntax.Node;
import net.protocalc.java.syntax.StringLiteral;
import net.protocalc.java.syntax.TupleExpression;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.FunctionSymbol;
import net.protocalc.java.theory.Term;
import net.protocalc.java.theory.Theory;

/**
 * The declaration phase checks the global declarations of a model and builds its {@link
 * Environment}: the theory, the types and grants, the channel and file instances, the constants,
 * and the tables of syscalls, attacks and process templates.
 *
 * <p>All declaration errors are collected and reported together by a single {@link
 * CompileError.Exception} at the end of the phase; a faulty declaration is otherwise ignored so
 * that checking can continue.
 *
 * <p>Functions, constants, syscalls, attacks, process templates and instances share one namespace.
 * Types have their own. The built-in syscalls {@code send(ch, x)} and {@code recv(ch)} are
 * predeclared; a user syscall of the same name replaces them.
 */
public final class DeclarationPhase {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** {@code syscall send(ch, x) { insert ch x }}. */
  static final Declaration.Syscall SEND =
      Declaration.syscall(
          Location.BUILTIN,
          "send",
          ImmutableList.of("ch", "x"),
          Command.storeOp(
              Location.BUILTIN,
              Command.StoreOpKind.INSERT,
              "ch",
              Identifier.of(Location.BUILTIN, "x")));

  /** {@code syscall recv(ch) { consume ch x; return x }}. */
  static final Declaration.Syscall RECV =
      Declaration.syscall(
          Location.BUILTIN,
          "recv",
          ImmutableList.of("ch"),
          Command.sequence(
              Location.BUILTIN,
              Command.storeOp(
                  Location.BUILTIN,
                  Command.StoreOpKind.CONSUME,
                  "ch",
                  Identifier.of(Location.BUILTIN, "x")),
              Command.returnValue(Location.BUILTIN, Identifier.of(Location.BUILTIN, "x"))));

  private final ModelFile file;
  private final CompilerOptions options;
  private final List<CompileError> errors = new ArrayList<>();
  private final NonceGenerator nonces;

  // The shared namespace, and the per-kind tables.
  private final Map<String, Declaration> globals = new LinkedHashMap<>();
  private final Map<String, FunctionSymbol> functions = new LinkedHashMap<>();
  private final Map<String, Term> constants = new LinkedHashMap<>();
  private final List<Transition.Fresh> init = new ArrayList<>();
  private final Map<String, Declaration.Syscall> syscalls = new LinkedHashMap<>();
  private final Map<String, Declaration.Attack> attacks = new LinkedHashMap<>();
  private final Map<String, Declaration.Process> processes = new LinkedHashMap<>();

  private DeclarationPhase(ModelFile file, CompilerOptions options) {
    this.file = file;
    this.options = options;
    this.nonces = NonceGenerator.create(file.getFile());
    syscalls.put(SEND.getName(), SEND);
    syscalls.put(RECV.getName(), RECV);
    for (FunctionSymbol builtin :
        ImmutableList.of(FunctionSymbol.PAIR, FunctionSymbol.FST, FunctionSymbol.SND)) {
      functions.put(builtin.getName(), builtin);
    }
  }

  /**
   * Checks the declarations of {@code file} and returns its environment.
   *
   * @throws CompileError.Exception carrying every declaration error
   */
  public static Environment run(ModelFile file, CompilerOptions options)
      throws CompileError.Exception {
    return new DeclarationPhase(file, options).run();
  }

  // Formats and reports an error at the start of the specified node.
  @FormatMethod
  private void errorf(
      CompileError.Kind kind, Node node, String decl, String format, Object... args) {
    errors.add(
        new CompileError(kind, node.getStartLocation(), decl, String.format(format, args)));
  }

  private Environment run() throws CompileError.Exception {
    // Pass 1: names.
    AccessPolicy.Builder policyBuilder = AccessPolicy.builder(errors);
    for (Declaration decl : file.getDeclarations()) {
      switch (decl.kind()) {
        case TYPE:
          policyBuilder.declareType(
              decl.getName(), ((Declaration.Type) decl).getTypeKind(), decl.getStartLocation());
          break;
        case FUNCTION:
          if (functions.containsKey(decl.getName()) && !globals.containsKey(decl.getName())) {
            errorf(
                CompileError.Kind.DUPLICATE_SYMBOL,
                decl,
                decl.getName(),
                "'%s' is a built-in function",
                decl.getName());
          } else if (claim(decl)) {
            functions.put(
                decl.getName(),
                FunctionSymbol.of(decl.getName(), ((Declaration.Function) decl).getArity()));
          }
          break;
        case CONSTANT:
          if (claim(decl)) {
            declareConstant((Declaration.Constant) decl);
          }
          break;
        case SYSCALL:
          if (claim(decl)) {
            syscalls.put(decl.getName(), (Declaration.Syscall) decl);
          }
          break;
        case ATTACK:
          if (claim(decl)) {
            attacks.put(decl.getName(), (Declaration.Attack) decl);
          }
          break;
        case PROCESS:
          if (claim(decl)) {
            processes.put(decl.getName(), (Declaration.Process) decl);
          }
          break;
        case INSTANCE:
          claim(decl);
          break;
        default:
          break;
      }
    }

    // Pass 2: the theory.
    Theory.Builder theoryBuilder = Theory.builder(options, errors);
    for (FunctionSymbol symbol : functions.values()) {
      Declaration decl = globals.get(symbol.getName());
      if (decl != null) { // not built in
        theoryBuilder.declareSymbol(symbol.getName(), symbol.getArity(), decl.getStartLocation());
      }
    }
    for (Declaration.Equation eq :
        file.getDeclarations(Declaration.Kind.EQUATION, Declaration.Equation.class)) {
      String decl = "equation " + eq.getLHS() + " = " + eq.getRHS();
      Term lhs = globalTerm(eq.getLHS(), decl, /* checkSymbols= */ false);
      Term rhs = globalTerm(eq.getRHS(), decl, /* checkSymbols= */ false);
      if (lhs != null && rhs != null) {
        theoryBuilder.declareEquation(lhs, rhs, eq.getStartLocation());
      }
    }
    Theory theory = theoryBuilder.build();

    // Pass 3: grants.
    for (Declaration decl : file.getDeclarations()) {
      if (decl instanceof Declaration.Grant grant) {
        for (String op : grant.getOperations()) {
          if (!syscalls.containsKey(op)
              && !(attacks.containsKey(op) && !attacks.get(op).isActive())) {
            errorf(
                CompileError.Kind.UNKNOWN_SYMBOL,
                grant,
                "allow " + grant.getSubject(),
                "'%s' is not a syscall or passive attack",
                op);
          }
        }
        policyBuilder.declareGrant(
            grant.getSubject(), grant.getObject(), grant.getOperations(), grant.getStartLocation());
      } else if (decl instanceof Declaration.AttackerGrant grant) {
        // Attacks the attacker may mount, and syscalls attack bodies may invoke.
        for (String op : grant.getOperations()) {
          if (!attacks.containsKey(op) && !syscalls.containsKey(op)) {
            errorf(
                CompileError.Kind.UNKNOWN_SYMBOL,
                grant,
                "allow attack " + grant.getSubject(),
                "'%s' is not an attack or syscall",
                op);
          }
        }
        policyBuilder.declareAttackerGrant(
            grant.getSubject(), grant.getOperations(), grant.getStartLocation());
      }
    }
    AccessPolicy policy = policyBuilder.build();

    // Pass 4: instances.
    StoreModel.Builder storeBuilder = StoreModel.builder(policy, errors);
    for (Declaration.Instance instance :
        file.getDeclarations(Declaration.Kind.INSTANCE, Declaration.Instance.class)) {
      if (globals.get(instance.getName()) != instance) {
        continue; // duplicate, already reported
      }
      Term content = null;
      if (instance.getContent() != null) {
        content = globalTerm(instance.getContent(), instance.getName(), /* checkSymbols= */ true);
        if (content == null) {
          continue;
        }
      }
      storeBuilder.declare(
          instance.getName(), instance.getTypeName(), content, instance.getStartLocation());
    }
    StoreModel storeModel = storeBuilder.build();

    // Pass 5: signatures of attacks and process templates.
    for (Declaration.Attack attack : attacks.values()) {
      checkAttack(attack);
    }
    for (Declaration.Process process : processes.values()) {
      checkProcess(process, policy);
    }

    CallGraph.check(syscalls, attacks, options.composeActiveAttacks(), errors);

    if (!errors.isEmpty()) {
      logger.atInfo().log("declaration phase of %s: %d errors", file.getFile(), errors.size());
      throw new CompileError.Exception(errors);
    }
    logger.atInfo().log(
        "declaration phase of %s: %d symbols, %d equations, %d syscalls, %d attacks,"
            + " %d instances, %d process templates",
        file.getFile(),
        theory.getSymbols().size(),
        theory.getEquations().size(),
        syscalls.size(),
        attacks.size(),
        storeModel.getInstances().size(),
        processes.size());
    return new Environment(
        file.getFile(),
        options,
        theory,
        policy,
        storeModel,
        nonces,
        ImmutableMap.copyOf(constants),
        ImmutableList.copyOf(init),
        ImmutableMap.copyOf(syscalls),
        ImmutableMap.copyOf(attacks),
        ImmutableMap.copyOf(processes));
  }

  // Claims a name of the shared namespace. Reports DuplicateSymbol and returns false if taken.
  private boolean claim(Declaration decl) {
    String name = decl.getName();
    if (name.equals(StoreModel.ATTACKER)) {
      errorf(
          CompileError.Kind.DUPLICATE_SYMBOL,
          decl,
          name,
          "'%s' is reserved for the attacker's knowledge",
          name);
      return false;
    }
    Declaration previous = globals.putIfAbsent(name, decl);
    if (previous != null) {
      errorf(
          CompileError.Kind.DUPLICATE_SYMBOL,
          decl,
          name,
          "'%s' is already declared at %s",
          name,
          previous.getStartLocation());
      return false;
    }
    return true;
  }

  private void declareConstant(Declaration.Constant decl) {
    if (decl.isFresh()) {
      Term.Nonce nonce = nonces.generate(decl.getName());
      init.add(Transition.fresh(Term.var(decl.getName()), nonce));
      constants.put(decl.getName(), nonce);
    } else {
      constants.put(decl.getName(), Term.constant(decl.getName()));
    }
  }

  private void checkAttack(Declaration.Attack attack) {
    if (!attack.isActive()) {
      return;
    }
    Declaration.Syscall target = syscalls.get(attack.getTarget());
    if (target == null) {
      errorf(
          CompileError.Kind.UNKNOWN_SYMBOL,
          attack,
          attack.getName(),
          "attack '%s' overrides undeclared syscall '%s'",
          attack.getName(),
          attack.getTarget());
    } else if (target.getParameters().size() != attack.getParameters().size()) {
      errorf(
          CompileError.Kind.ARITY_MISMATCH,
          attack,
          attack.getName(),
          "attack '%s' has %d parameters but syscall '%s' has %d",
          attack.getName(),
          attack.getParameters().size(),
          target.getName(),
          target.getParameters().size());
    }
  }

  private void checkProcess(Declaration.Process process, AccessPolicy policy) {
    TypeKind kind = policy.kindOf(process.getTypeName());
    if (kind != TypeKind.PROCESS) {
      errorf(
          CompileError.Kind.UNKNOWN_TYPE,
          process,
          process.getName(),
          kind == null ? "type '%s' is not declared" : "type '%s' is not a process type",
          process.getTypeName());
    }
    for (Declaration.Parameter param : process.getParameters()) {
      TypeKind paramKind = policy.kindOf(param.getTypeName());
      if (paramKind == null || paramKind == TypeKind.PROCESS) {
        errorf(
            CompileError.Kind.UNKNOWN_TYPE,
            param,
            process.getName(),
            "parameter '%s' has type '%s', which is not a declared channel or filesys type",
            param.getName(),
            param.getTypeName());
      }
    }
  }

  /**
   * Converts an expression of a global declaration to a term. An identifier denotes a constant or
   * a nullary function if one is declared under its name, and otherwise a variable. Returns null
   * after reporting an error.
   *
   * <p>Equations leave the checking of function symbols to the theory builder.
   */
  @Nullable
  private Term globalTerm(Expression expr, String decl, boolean checkSymbols) {
    switch (expr.kind()) {
      case STRING_LITERAL:
        return Term.literal(((StringLiteral) expr).getValue());
      case IDENTIFIER:
        String name = ((Identifier) expr).getName();
        Term constant = constants.get(name);
        if (constant != null) {
          return constant;
        }
        FunctionSymbol symbol = functions.get(name);
        if (symbol != null && symbol.getArity() == 0) {
          return Term.apply(symbol);
        }
        return Term.var(name);
      case TUPLE:
        List<Term> elements = new ArrayList<>();
        for (Expression elem : ((TupleExpression) expr).getElements()) {
          Term t = globalTerm(elem, decl, checkSymbols);
          if (t == null) {
            return null;
          }
          elements.add(t);
        }
        return Term.tuple(elements);
      case CALL:
        CallExpression call = (CallExpression) expr;
        FunctionSymbol fn = FunctionSymbol.of(call.getName(), call.getArguments().size());
        if (checkSymbols && !fn.equals(functions.get(call.getName()))) {
          errorf(
              CompileError.Kind.UNKNOWN_SYMBOL,
              call,
              decl,
              "'%s' is not a declared function",
              fn);
          return null;
        }
        List<Term> args = new ArrayList<>();
        for (Expression arg : call.getArguments()) {
          Term t = globalTerm(arg, decl, checkSymbols);
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
