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

import com.google.common.collect.ImmutableMap;

/**
 * A ProcessInstance is one sequential thread of the composed system: a process template applied
 * to actual channel/file instances, elaborated to a transition graph.
 */
public final class ProcessInstance {

  private final String name;
  private final String template;
  private final String processType;
  private final ImmutableMap<String, String> arguments;
  private final TransitionGraph graph;

  public ProcessInstance(
      String name,
      String template,
      String processType,
      ImmutableMap<String, String> arguments,
      TransitionGraph graph) {
    this.name = name;
    this.template = template;
    this.processType = processType;
    this.arguments = arguments;
    this.graph = graph;
  }

  /** Returns the instance name, unique within the system. */
  public String getName() {
    return name;
  }

  public String getTemplate() {
    return template;
  }

  public String getProcessType() {
    return processType;
  }

  /** Returns the mapping from formal parameters to channel/file instance names. */
  public ImmutableMap<String, String> getArguments() {
    return arguments;
  }

  public TransitionGraph getGraph() {
    return graph;
  }

  @Override
  public String toString() {
    return name + " = " + template + arguments + ": " + processType;
  }
}
