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

/**
 * Base class for all expression nodes in the AST.
 *
 * <p>An expression denotes a term. Identifiers are resolved by the elaborator to local variables,
 * formal parameters, constants, channel/file instances or nullary function symbols. A call
 * expression denotes a function application, or, where its name is a syscall or attack, an
 * invocation that the elaborator inlines.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    CALL,
    IDENTIFIER,
    STRING_LITERAL,
    TUPLE,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Expression(Location location, Kind kind) {
    super(location);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }
}
