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
import java.util.List;

/**
 * Syntax node for {@code f(arg, ...)}: a function application, a syscall or attack invocation, or
 * (in an emit command or lemma) an event tagged {@code f}.
 */
public final class CallExpression extends Expression {

  private final Identifier function;
  private final ImmutableList<Expression> arguments;

  CallExpression(Location location, Identifier function, ImmutableList<Expression> arguments) {
    super(location, Kind.CALL);
    this.function = function;
    this.arguments = arguments;
  }

  public static CallExpression of(Location location, String function, List<Expression> args) {
    return new CallExpression(
        location, Identifier.of(location, function), ImmutableList.copyOf(args));
  }

  /** Returns the identifier naming the callee. */
  public Identifier getFunction() {
    return function;
  }

  public String getName() {
    return function.getName();
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public String toString() {
    return function.getName() + "(" + Joiner.on(", ").join(arguments) + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
