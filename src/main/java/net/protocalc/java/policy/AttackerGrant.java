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

/**
 * An AttackerGrant lets the attacker use the listed attacks (and, inside attack bodies, invoke
 * the listed operations) at call sites of principals of the subject type. The subject is a process
 * type, or a channel or file type in which case the grant applies to calls addressed to objects of
 * that type.
 */
public final class AttackerGrant {

  private final String subjectType;
  private final ImmutableSet<String> operations;

  AttackerGrant(String subjectType, ImmutableSet<String> operations) {
    this.subjectType = subjectType;
    this.operations = operations;
  }

  public String getSubjectType() {
    return subjectType;
  }

  public ImmutableSet<String> getOperations() {
    return operations;
  }

  @Override
  public String toString() {
    return "allow attack " + subjectType + " " + operations;
  }
}
