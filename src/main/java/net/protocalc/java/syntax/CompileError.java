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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A CompileError describes a static error found while elaborating a model: its kind, the location
 * of the offending node, the name of the enclosing declaration, and a message.
 *
 * <p>All errors are compile-time errors; the semantics of a model never faults at run time (an
 * unmatched pattern or guard merely blocks a trace). Each compiler phase accumulates errors in a
 * list and reports them together by throwing a {@link CompileError.Exception} at the end of the
 * phase.
 */
public final class CompileError {

  /** The error taxonomy. */
  public enum Kind {
    // declaration errors
    DUPLICATE_SYMBOL,
    DUPLICATE_TYPE,
    UNKNOWN_SYMBOL,
    UNKNOWN_TYPE,
    ARITY_MISMATCH,
    // scoping errors
    UNBOUND_VARIABLE,
    FREE_LEMMA_VARIABLE,
    REBOUND_VARIABLE,
    // policy errors
    ACCESS_VIOLATION,
    // theory errors
    THEORY_DIVERGENCE,
    NO_MATCH,
    // structural errors
    RECURSIVE_SYSCALL,
    UNKNOWN_EVENT_TAG,
    FACT_ABSENT;

    /** Returns the CamelCase name used in messages, e.g. "DuplicateSymbol". */
    public String displayName() {
      StringBuilder buf = new StringBuilder();
      for (String word : name().split("_")) {
        buf.append(word.charAt(0)).append(word.substring(1).toLowerCase());
      }
      return buf.toString();
    }
  }

  private final Kind kind;
  private final Location location;
  private final String declaration;
  private final String message;

  public CompileError(Kind kind, Location location, String declaration, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.location = Preconditions.checkNotNull(location);
    this.declaration = Preconditions.checkNotNull(declaration);
    this.message = Preconditions.checkNotNull(message);
  }

  public Kind kind() {
    return kind;
  }

  public Location location() {
    return location;
  }

  /** Returns the name of the declaration in which the error occurred. */
  public String declaration() {
    return declaration;
  }

  public String message() {
    return message;
  }

  /** Returns a string of the form "file:line:col: [Kind] in decl: message". */
  @Override
  public String toString() {
    return String.format("%s: [%s] in %s: %s", location, kind.displayName(), declaration, message);
  }

  /**
   * Returns a multi-line string containing one line for each error in {@code errors}, each of the
   * form "file:line:col: [Kind] in decl: message".
   */
  public static String toString(List<CompileError> errors) {
    return Joiner.on("\n").join(errors);
  }

  /** Reports whether {@code errors} contains an error of the specified kind. */
  public static boolean contains(List<CompileError> errors, Kind kind) {
    for (CompileError error : errors) {
      if (error.kind() == kind) {
        return true;
      }
    }
    return false;
  }

  /** A CompileError.Exception is an exception holding one or more compile errors. */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<CompileError> errors;

    /** Constructs an exception from a non-empty list of errors. */
    public Exception(List<CompileError> errors) {
      super(errors.isEmpty() ? "no errors" : errors.get(0).toString());
      Preconditions.checkArgument(!errors.isEmpty(), "empty error list");
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<CompileError> errors() {
      return errors;
    }

    /** Reports whether any error is of the specified kind. */
    public boolean hasKind(Kind kind) {
      return contains(errors, kind);
    }

    @Override
    public String getMessage() {
      return errors.size() == 1
          ? errors.get(0).toString()
          : errors.size() + " errors:\n" + CompileError.toString(errors);
    }
  }
}
