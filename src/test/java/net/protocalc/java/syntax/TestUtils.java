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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Helpers for tests of the compiler: assertions on errors, a reader for the term syntax of models,
 * and terse factories for commands and declarations.
 */
public final class TestUtils {

  private TestUtils() {}

  /** The file name of test models. */
  public static final String FILE = "test.pcl";

  public static final Location LOC = Location.fromFileLineColumn(FILE, 1, 1);

  /**
   * Returns the first error whose string form contains the specified substring, or throws an
   * informative AssertionError if there is none.
   */
  public static CompileError assertContainsError(List<CompileError> errors, String substr) {
    for (CompileError error : errors) {
      if (error.toString().contains(substr)) {
        return error;
      }
    }
    if (errors.isEmpty()) {
      throw new AssertionError("no errors, want '" + substr + "'");
    } else {
      throw new AssertionError(
          "error '" + substr + "' not found, but got these:\n" + Joiner.on("\n").join(errors));
    }
  }

  // ==== Expressions ====

  /**
   * Reads an expression: identifiers, double-quoted literals, calls {@code f(a, b)} and tuples
   * {@code (a, b)}. Each node is located at its column on line 1.
   */
  public static Expression expr(String text) {
    ExpressionReader reader = new ExpressionReader(text);
    Expression result = reader.expression();
    reader.skipSpace();
    if (reader.pos != text.length()) {
      throw new IllegalArgumentException("trailing input in '" + text + "' at " + reader.pos);
    }
    return result;
  }

  /** Reads a call expression, such as an event {@code Sent(m)} or {@code send(ch, m)}. */
  public static CallExpression call(String text) {
    Expression e = expr(text);
    if (!(e instanceof CallExpression)) {
      throw new IllegalArgumentException("not a call: " + text);
    }
    return (CallExpression) e;
  }

  public static Identifier id(String name) {
    return Identifier.of(LOC, name);
  }

  private static final class ExpressionReader {
    private final String text;
    private int pos = 0;

    ExpressionReader(String text) {
      this.text = text;
    }

    void skipSpace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    boolean accept(char c) {
      skipSpace();
      if (pos < text.length() && text.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    void expect(char c) {
      if (!accept(c)) {
        throw new IllegalArgumentException(
            String.format("want '%c' at %d in '%s'", c, pos, text));
      }
    }

    Expression expression() {
      skipSpace();
      Location loc = LOC.at(1, pos + 1);
      if (accept('"')) {
        int end = text.indexOf('"', pos);
        String value = text.substring(pos, end);
        pos = end + 1;
        return StringLiteral.of(loc, value);
      }
      if (accept('(')) {
        List<Expression> elements = new ArrayList<>();
        do {
          elements.add(expression());
        } while (accept(','));
        expect(')');
        return elements.size() == 1 ? elements.get(0) : TupleExpression.of(loc, elements);
      }
      int start = pos;
      while (pos < text.length()
          && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      if (start == pos) {
        throw new IllegalArgumentException("want expression at " + pos + " in '" + text + "'");
      }
      String name = text.substring(start, pos);
      if (!accept('(')) {
        return Identifier.of(loc, name);
      }
      List<Expression> args = new ArrayList<>();
      if (!accept(')')) {
        do {
          args.add(expression());
        } while (accept(','));
        expect(')');
      }
      return CallExpression.of(loc, name, args);
    }
  }

  // ==== Commands ====

  public static Command.Bind bind(String variable, String value) {
    return Command.bind(LOC, variable, expr(value));
  }

  public static Command.New newNonce(String variable) {
    return Command.newNonce(LOC, variable);
  }

  public static Command.Emit emit(String event) {
    return Command.emit(LOC, call(event));
  }

  public static Command.Call invoke(String call) {
    return Command.call(LOC, call(call));
  }

  public static Command.StoreOp insert(String instance, String term) {
    return Command.storeOp(LOC, Command.StoreOpKind.INSERT, instance, expr(term));
  }

  public static Command.StoreOp remove(String instance, String term) {
    return Command.storeOp(LOC, Command.StoreOpKind.REMOVE, instance, expr(term));
  }

  public static Command.StoreOp consume(String instance, String pattern) {
    return Command.storeOp(LOC, Command.StoreOpKind.CONSUME, instance, expr(pattern));
  }

  public static Command.StoreOp read(String instance, String pattern) {
    return Command.storeOp(LOC, Command.StoreOpKind.READ, instance, expr(pattern));
  }

  public static Command.Return ret(@Nullable String value) {
    return Command.returnValue(LOC, value != null ? expr(value) : null);
  }

  public static Command seq(Command... commands) {
    return Command.sequence(LOC, commands);
  }

  public static Guard eq(String lhs, String rhs) {
    return Guard.equal(LOC, expr(lhs), expr(rhs));
  }

  public static Guard neq(String lhs, String rhs) {
    return Guard.notEqual(LOC, expr(lhs), expr(rhs));
  }

  /** An arm taking {@code body} when every guard holds. */
  public static Command.Arm arm(Command body, Guard... guards) {
    return Command.arm(LOC, Arrays.asList(guards), body);
  }

  public static Command.Branch branch(Command.Arm... arms) {
    return Command.branch(LOC, Arrays.asList(arms));
  }

  public static Command.Repeat repeat(Command body, Command.Arm... until) {
    return Command.repeat(LOC, body, Arrays.asList(until));
  }

  // ==== Declarations ====

  public static Declaration.Function function(String name, int arity) {
    return Declaration.function(LOC, name, arity);
  }

  public static Declaration.Equation equation(String lhs, String rhs) {
    return Declaration.equation(LOC, expr(lhs), expr(rhs));
  }

  public static Declaration.Type type(String name, TypeKind kind) {
    return Declaration.type(LOC, name, kind);
  }

  public static Declaration.Grant grant(
      String subject, @Nullable String object, String... operations) {
    return Declaration.grant(LOC, subject, object, Arrays.asList(operations));
  }

  public static Declaration.AttackerGrant attackerGrant(String subject, String... operations) {
    return Declaration.attackerGrant(LOC, subject, Arrays.asList(operations));
  }

  public static Declaration.Syscall syscall(String name, List<String> params, Command body) {
    return Declaration.syscall(LOC, name, params, body);
  }

  public static Declaration.Attack activeAttack(
      String name, String target, List<String> params, Command body) {
    return Declaration.activeAttack(LOC, name, target, params, body);
  }

  public static Declaration.Attack passiveAttack(
      String name, List<String> params, Command body) {
    return Declaration.passiveAttack(LOC, name, params, body);
  }

  public static Declaration.Constant constant(String name) {
    return Declaration.constant(LOC, name, false);
  }

  public static Declaration.Constant freshConstant(String name) {
    return Declaration.constant(LOC, name, true);
  }

  public static Declaration.Instance instance(
      String name, String typeName, @Nullable String content) {
    return Declaration.instance(LOC, name, typeName, content != null ? expr(content) : null);
  }

  public static Declaration.Parameter param(String name, String typeName) {
    return Declaration.parameter(LOC, name, typeName);
  }

  public static Declaration.Process process(
      String name, String typeName, List<Declaration.Parameter> params, Command main) {
    return Declaration.process(LOC, name, typeName, params, ImmutableList.of(), main);
  }

  // ==== Lemmas ====

  public static LemmaFormula.Event at(String event, String index) {
    return LemmaFormula.event(LOC, call(event), index);
  }

  public static Declaration.Lemma allTraces(String name, LemmaFormula formula) {
    return Declaration.formulaLemma(LOC, name, Declaration.LemmaKind.ALL_TRACES, formula);
  }

  public static Declaration.Lemma existsTrace(String name, LemmaFormula formula) {
    return Declaration.formulaLemma(LOC, name, Declaration.LemmaKind.EXISTS_TRACE, formula);
  }

  public static Declaration.Lemma reachable(String name, String... events) {
    List<CallExpression> calls = new ArrayList<>();
    for (String event : events) {
      calls.add(call(event));
    }
    return Declaration.reachable(LOC, name, calls);
  }

  public static Declaration.Lemma corresponds(String name, String premise, String conclusion) {
    return Declaration.corresponds(LOC, name, call(premise), call(conclusion));
  }

  /** Returns a model of {@code declarations} composing the processes of {@code system}. */
  public static ModelFile model(
      List<? extends Declaration> declarations,
      List<String> system,
      List<Declaration.Lemma> lemmas) {
    List<CallExpression> processes = new ArrayList<>();
    for (String process : system) {
      processes.add(call(process));
    }
    return ModelFile.builder(FILE)
        .addAll(declarations)
        .build(ModelFile.Composition.of(LOC, processes, lemmas));
  }
}
