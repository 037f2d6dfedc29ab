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

package net.protocalc.java.theory;

import com.google.common.base.Preconditions;
import net.protocalc.java.syntax.CompileError;

/**
 * A TheoryException reports a failure of the rewriting engine: a normalization that exceeded its
 * step limit ({@link CompileError.Kind#THEORY_DIVERGENCE}), or a match that was required to succeed
 * but did not ({@link CompileError.Kind#NO_MATCH}).
 */
public final class TheoryException extends Exception {

  private final CompileError.Kind kind;

  public TheoryException(CompileError.Kind kind, String message) {
    super(message);
    Preconditions.checkArgument(
        kind == CompileError.Kind.THEORY_DIVERGENCE || kind == CompileError.Kind.NO_MATCH,
        "not a theory error: %s",
        kind);
    this.kind = kind;
  }

  public CompileError.Kind getKind() {
    return kind;
  }
}
