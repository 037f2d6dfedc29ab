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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.ir.CausalEdge;
import net.protocalc.java.ir.CompiledSystem;
import net.protocalc.java.ir.NormalizedLemma;
import net.protocalc.java.ir.ProcessInstance;
import net.protocalc.java.lemma.CausalEdgeAnalyzer;
import net.protocalc.java.lemma.EventVocabulary;
import net.protocalc.java.lemma.LemmaTranslator;
import net.protocalc.java.store.StoreInstance;
import net.protocalc.java.syntax.CallExpression;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.CompilerOptions;
import net.protocalc.java.syntax.Declaration;
import net.protocalc.java.syntax.Expression;
import net.protocalc.java.syntax.Identifier;
import net.protocalc.java.syntax.ModelFile;
import net.protocalc.java.syntax.Node;

/**
 * The entry point of the compiler: turns a parsed {@link ModelFile} into a {@link CompiledSystem}.
 *
 * <p>Compilation runs in three phases, each of which reports all its errors at once:
 *
 * <ol>
 *   <li>declarations: theory, policy, stores, syscalls and templates ({@link DeclarationPhase});
 *   <li>processes: each process of the composition is instantiated and elaborated into a
 *       transition graph, with attacker alternatives composed at its call sites;
 *   <li>analysis: causal edges between store operations, static fact absence, and lemma
 *       translation.
 * </ol>
 */
public final class SystemCompiler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Environment env;
  private final List<CompileError> errors = new ArrayList<>();

  private SystemCompiler(Environment env) {
    this.env = env;
  }

  /**
   * Compiles {@code file} under {@code options}.
   *
   * @throws CompileError.Exception carrying the errors of the first phase that failed
   */
  public static CompiledSystem compile(ModelFile file, CompilerOptions options)
      throws CompileError.Exception {
    Environment env = DeclarationPhase.run(file, options);
    return new SystemCompiler(env).compile(file.getComposition());
  }

  @FormatMethod
  private void errorf(CompileError.Kind kind, Node node, String format, Object... args) {
    errors.add(
        new CompileError(
            kind, node.getStartLocation(), "system", String.format(format, args)));
  }

  private CompiledSystem compile(ModelFile.Composition composition)
      throws CompileError.Exception {
    ImmutableList<ProcessInstance> processes = instantiate(composition.getProcesses());
    throwIfErrors("process");

    EventVocabulary vocabulary = EventVocabulary.of(processes);
    CausalEdgeAnalyzer analyzer =
        CausalEdgeAnalyzer.create(env.getTheory(), env.getStoreModel(), processes, errors);
    ImmutableList<CausalEdge> edges = analyzer.edges();
    if (env.getOptions().detectStaticFactAbsence()) {
      analyzer.checkRemovals();
    }
    LemmaTranslator translator =
        new LemmaTranslator(
            env.getTheory(), env.getConstants(), vocabulary, env.getOptions(), errors);
    ImmutableList<NormalizedLemma> lemmas = translator.translateAll(composition.getLemmas());
    throwIfErrors("analysis");

    logger.atInfo().log(
        "compiled %s: %d processes, %d event tags, %d causal edges, %d lemmas",
        env.getFile(),
        processes.size(),
        vocabulary.getTags().size(),
        edges.size(),
        lemmas.size());
    return new CompiledSystem(
        env.getFile(),
        env.getTheory(),
        env.getStoreModel(),
        env.getInit(),
        processes,
        edges,
        lemmas);
  }

  private void throwIfErrors(String phase) throws CompileError.Exception {
    if (!errors.isEmpty()) {
      logger.atInfo().log("%s phase of %s: %d errors", phase, env.getFile(), errors.size());
      throw new CompileError.Exception(errors);
    }
  }

  // ==== Process instantiation ====

  // A template instantiated once is named after itself; otherwise its instances are
  // numbered template#1, template#2, ... in composition order.
  private ImmutableList<ProcessInstance> instantiate(List<CallExpression> calls) {
    Multiset<String> uses = HashMultiset.create();
    for (CallExpression call : calls) {
      uses.add(call.getName());
    }
    Map<String, Integer> seen = new HashMap<>();
    ImmutableList.Builder<ProcessInstance> result = ImmutableList.builder();
    for (CallExpression call : calls) {
      Declaration.Process template = env.getProcess(call.getName());
      if (template == null) {
        errorf(
            CompileError.Kind.UNKNOWN_SYMBOL,
            call,
            "'%s' is not a process template",
            call.getName());
        continue;
      }
      int k = seen.merge(call.getName(), 1, Integer::sum);
      String name = uses.count(call.getName()) > 1 ? call.getName() + "#" + k : call.getName();
      ImmutableMap<String, String> arguments = arguments(call, template);
      if (arguments != null) {
        result.add(ProcessElaborator.elaborate(env, name, template, arguments, errors));
      }
    }
    return result.build();
  }

  // Binds each formal parameter to the instance passed for it; returns null after errors.
  @Nullable
  private ImmutableMap<String, String> arguments(
      CallExpression call, Declaration.Process template) {
    List<Declaration.Parameter> params = template.getParameters();
    if (params.size() != call.getArguments().size()) {
      errorf(
          CompileError.Kind.ARITY_MISMATCH,
          call,
          "process '%s' takes %d arguments, got %d",
          template.getName(),
          params.size(),
          call.getArguments().size());
      return null;
    }
    ImmutableMap.Builder<String, String> arguments = ImmutableMap.builder();
    boolean ok = true;
    for (int i = 0; i < params.size(); i++) {
      Declaration.Parameter param = params.get(i);
      Expression arg = call.getArguments().get(i);
      StoreInstance instance =
          arg instanceof Identifier id ? env.getStoreModel().get(id.getName()) : null;
      if (instance != null && instance.isAttacker()) {
        errorf(
            CompileError.Kind.UNKNOWN_TYPE,
            arg,
            "the attacker's knowledge is not an argument; processes name '%s' directly",
            instance.getName());
        ok = false;
      } else if (instance == null) {
        errorf(
            CompileError.Kind.UNKNOWN_SYMBOL,
            arg,
            "argument '%s' of process '%s' is not a channel or file instance",
            arg,
            template.getName());
        ok = false;
      } else if (!instance.getTypeName().equals(param.getTypeName())) {
        errorf(
            CompileError.Kind.UNKNOWN_TYPE,
            arg,
            "instance '%s' has type '%s', but parameter '%s' of process '%s' expects '%s'",
            instance.getName(),
            instance.getTypeName(),
            param.getName(),
            template.getName(),
            param.getTypeName());
        ok = false;
      } else {
        arguments.put(param.getName(), instance.getName());
      }
    }
    return ok ? arguments.buildOrThrow() : null;
  }
}
