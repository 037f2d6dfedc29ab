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

import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A Grant permits principals of a process type to invoke a set of operations (syscalls and
 * passive attacks) on objects of a channel or file type, or on no object at all.
 */
public final class Grant {

  private final String subjectType;
  @Nullable private final String objectType;
  private final ImmutableSet<String> operations;

  Grant(String subjectType, @Nullable String objectType, ImmutableSet<String> operations) {
    this.subjectType = subjectType;
    this.objectType = objectType;
    this.operations = operations;
  }

  public String getSubjectType() {
    return subjectType;
  }

  /** Returns the object type, or null if the grant covers calls addressed to no object. */
  @Nullable
  public String getObjectType() {
    return objectType;
  }

  public ImmutableSet<String> getOperations() {
    return operations;
  }

  /** Reports whether this grant allows {@code op} by {@code subject} on {@code object}. */
  public boolean allows(String subject, @Nullable String object, String op) {
    return subjectType.equals(subject)
        && Objects.equals(objectType, object)
        && operations.contains(op);
  }

  @Override
  public String toString() {
    return "allow " + subjectType + (objectType != null ? " " + objectType : "") + " " + operations;
  }
}
