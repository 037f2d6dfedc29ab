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

package net.protocalc.java.policy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.syntax.TypeKind;

/**
 * The AccessPolicy holds the declared types and the {@code allow} grants of a model, and decides
 * whether an invocation is permitted.
 *
 * <p>An unauthorized invocation is a static error: the policy is a security property of the model
 * itself and is never downgraded to a warning. Attacker grants are kept in a separate table; they
 * decide where the attacker may substitute or invoke attacks.
 */
public final class AccessPolicy {

  private final ImmutableMap<String, TypeKind> types;
  private final ImmutableList<Grant> grants;
  private final ImmutableList<AttackerGrant> attackerGrants;

  private AccessPolicy(
      ImmutableMap<String, TypeKind> types,
      ImmutableList<Grant> grants,
      ImmutableList<AttackerGrant> attackerGrants) {
    this.types = types;
    this.grants = grants;
    this.attackerGrants = attackerGrants;
  }

  /** Returns the kind of the declared type {@code name}, or null if it is not declared. */
  @Nullable
  public TypeKind kindOf(String name) {
    return types.get(name);
  }

  public ImmutableMap<String, TypeKind> getTypes() {
    return types;
  }

  public ImmutableList<Grant> getGrants() {
    return grants;
  }

  public ImmutableList<AttackerGrant> getAttackerGrants() {
    return attackerGrants;
  }

  /**
   * Reports whether a process of type {@code processType} may invoke {@code op} on an object of
   * type {@code objectType} (null for calls addressed to no object). This holds iff some grant
   * registered exactly that subject and object with {@code op} among its operations.
   */
  public boolean checkInvocation(String processType, @Nullable String objectType, String op) {
    for (Grant grant : grants) {
      if (grant.allows(processType, objectType, op)) {
        return true;
      }
    }
    return false;
  }

  /** Reports whether an attacker grant for {@code subjectType} lists {@code op}. */
  public boolean attackerMayInvoke(String subjectType, String op) {
    for (AttackerGrant grant : attackerGrants) {
      if (grant.getSubjectType().equals(subjectType) && grant.getOperations().contains(op)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Reports whether the attacker may use {@code op} at a call site of a process of type {@code
   * processType} addressed to an object of type {@code objectType} (or null).
   */
  public boolean attackerMayInvokeAt(
      String processType, @Nullable String objectType, String op) {
    return attackerMayInvoke(processType, op)
        || (objectType != null && attackerMayInvoke(objectType, op));
  }

  public static Builder builder(List<CompileError> errors) {
    return new Builder(errors);
  }

  /**
   * A Builder accumulates type and grant declarations, reporting invalid ones to the error list
   * supplied at construction.
   */
  public static final class Builder {
    private final List<CompileError> errors;
    private final Map<String, TypeKind> types = new LinkedHashMap<>();
    private final List<Grant> grants = new ArrayList<>();
    private final List<AttackerGrant> attackerGrants = new ArrayList<>();

    private Builder(List<CompileError> errors) {
      this.errors = errors;
    }

    @FormatMethod
    private void errorf(
        CompileError.Kind kind, Location loc, String decl, String format, Object... args) {
      errors.add(new CompileError(kind, loc, decl, String.format(format, args)));
    }

    /** Declares a type. Reports {@code DuplicateType} if the name is taken. */
    @CanIgnoreReturnValue
    public Builder declareType(String name, TypeKind kind, Location loc) {
      TypeKind previous = types.get(name);
      if (previous != null) {
        errorf(
            CompileError.Kind.DUPLICATE_TYPE,
            loc,
            name,
            "type '%s' is already declared as a %s type",
            name,
            previous);
        return this;
      }
      types.put(name, kind);
      return this;
    }

    /**
     * Declares a grant. Reports {@code UnknownType} if the subject is not a declared type or the
     * object (when present) is not a declared type.
     */
    @CanIgnoreReturnValue
    public Builder declareGrant(
        String subject, @Nullable String object, List<String> ops, Location loc) {
      String decl = "allow " + subject + (object != null ? " " + object : "");
      boolean ok = checkType(subject, loc, decl);
      if (object != null) {
        ok &= checkType(object, loc, decl);
      }
      if (ok) {
        grants.add(new Grant(subject, object, ImmutableSet.copyOf(ops)));
      }
      return this;
    }

    /** Declares an attacker grant. Reports {@code UnknownType} for an undeclared subject. */
    @CanIgnoreReturnValue
    public Builder declareAttackerGrant(String subject, List<String> ops, Location loc) {
      if (checkType(subject, loc, "allow attack " + subject)) {
        attackerGrants.add(new AttackerGrant(subject, ImmutableSet.copyOf(ops)));
      }
      return this;
    }

    private boolean checkType(String name, Location loc, String decl) {
      if (types.containsKey(name)) {
        return true;
      }
      errorf(CompileError.Kind.UNKNOWN_TYPE, loc, decl, "type '%s' is not declared", name);
      return false;
    }

    public AccessPolicy build() {
      return new AccessPolicy(
          ImmutableMap.copyOf(types),
          ImmutableList.copyOf(grants),
          ImmutableList.copyOf(attackerGrants));
    }
  }
}
