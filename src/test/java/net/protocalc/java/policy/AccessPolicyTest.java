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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static net.protocalc.java.syntax.TestUtils.LOC;
import static net.protocalc.java.syntax.TestUtils.assertContainsError;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import net.protocalc.java.syntax.CompileError;
import net.protocalc.java.syntax.TypeKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link AccessPolicy}. */
@RunWith(JUnit4.class)
public class AccessPolicyTest {

  private final List<CompileError> errors = new ArrayList<>();

  private static final ImmutableList<String> SUBJECTS = ImmutableList.of("Client", "Server");
  private static final List<String> OBJECTS = Arrays.asList("Net", "Disk", null);
  private static final ImmutableList<String> OPS =
      ImmutableList.of("send", "recv", "open", "leak");

  // (subject, object, ops) rows of the grant table.
  private static final ImmutableList<Object[]> TABLE =
      ImmutableList.of(
          new Object[] {"Client", "Net", ImmutableSet.of("send", "recv")},
          new Object[] {"Client", null, ImmutableSet.of("leak")},
          new Object[] {"Server", "Disk", ImmutableSet.of("open")},
          new Object[] {"Server", "Net", ImmutableSet.of("recv")});

  private AccessPolicy.Builder types() {
    return AccessPolicy.builder(errors)
        .declareType("Client", TypeKind.PROCESS, LOC)
        .declareType("Server", TypeKind.PROCESS, LOC)
        .declareType("Net", TypeKind.CHANNEL, LOC)
        .declareType("Disk", TypeKind.FILESYS, LOC);
  }

  @SuppressWarnings("unchecked")
  private AccessPolicy tablePolicy() {
    AccessPolicy.Builder builder = types();
    for (Object[] row : TABLE) {
      ImmutableSet<String> ops = (ImmutableSet<String>) row[2];
      builder.declareGrant((String) row[0], (String) row[1], ops.asList(), LOC);
    }
    AccessPolicy policy = builder.build();
    assertThat(errors).isEmpty();
    return policy;
  }

  @SuppressWarnings("unchecked")
  private static boolean inTable(String subject, String object, String op) {
    for (Object[] row : TABLE) {
      if (row[0].equals(subject)
          && Objects.equals(row[1], object)
          && ((ImmutableSet<String>) row[2]).contains(op)) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testCheckInvocationAgreesWithTheGrants() throws Exception {
    AccessPolicy policy = tablePolicy();
    for (String subject : SUBJECTS) {
      for (String object : OBJECTS) {
        for (String op : OPS) {
          assertWithMessage("checkInvocation(%s, %s, %s)", subject, object, op)
              .that(policy.checkInvocation(subject, object, op))
              .isEqualTo(inTable(subject, object, op));
        }
      }
    }
  }

  @Test
  public void testTypeKinds() throws Exception {
    AccessPolicy policy = tablePolicy();
    assertThat(policy.kindOf("Net")).isEqualTo(TypeKind.CHANNEL);
    assertThat(policy.kindOf("Disk")).isEqualTo(TypeKind.FILESYS);
    assertThat(policy.kindOf("Client")).isEqualTo(TypeKind.PROCESS);
    assertThat(policy.kindOf("Nope")).isNull();
  }

  @Test
  public void testDuplicateType() throws Exception {
    types().declareType("Net", TypeKind.FILESYS, LOC);
    assertContainsError(
        errors, "[DuplicateType] in Net: type 'Net' is already declared as a channel type");
  }

  @Test
  public void testGrantOnUnknownTypes() throws Exception {
    AccessPolicy policy =
        types()
            .declareGrant("Intruder", "Net", ImmutableList.of("send"), LOC)
            .declareGrant("Client", "Tape", ImmutableList.of("send"), LOC)
            .declareAttackerGrant("Router", ImmutableList.of("inject"), LOC)
            .build();
    assertContainsError(
        errors, "[UnknownType] in allow Intruder Net: type 'Intruder' is not declared");
    assertContainsError(
        errors, "[UnknownType] in allow Client Tape: type 'Tape' is not declared");
    assertContainsError(errors, "in allow attack Router: type 'Router' is not declared");
    // Rejected grants grant nothing.
    assertThat(policy.getGrants()).isEmpty();
    assertThat(policy.getAttackerGrants()).isEmpty();
  }

  @Test
  public void testAttackerGrants() throws Exception {
    AccessPolicy policy =
        types()
            .declareAttackerGrant("Client", ImmutableList.of("inject"), LOC)
            .declareAttackerGrant("Disk", ImmutableList.of("tamper"), LOC)
            .build();
    assertThat(policy.attackerMayInvoke("Client", "inject")).isTrue();
    assertThat(policy.attackerMayInvoke("Server", "inject")).isFalse();
    // By process type or by the type of the object addressed.
    assertThat(policy.attackerMayInvokeAt("Client", "Net", "inject")).isTrue();
    assertThat(policy.attackerMayInvokeAt("Server", "Disk", "tamper")).isTrue();
    assertThat(policy.attackerMayInvokeAt("Server", "Net", "tamper")).isFalse();
    assertThat(policy.attackerMayInvokeAt("Server", null, "inject")).isFalse();
    // Attacker grants do not authorize honest invocations.
    assertThat(policy.checkInvocation("Client", null, "inject")).isFalse();
  }
}
