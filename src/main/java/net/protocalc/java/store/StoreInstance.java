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

package net.protocalc.java.store;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;
import net.protocalc.java.syntax.Location;
import net.protocalc.java.syntax.TypeKind;
import net.protocalc.java.theory.Term;

/**
 * A StoreInstance is a declared channel or file (or the reserved attacker knowledge store). Its
 * store is addressed exclusively by its name.
 */
public final class StoreInstance {

  private final String name;
  @Nullable private final String typeName;
  @Nullable private final TypeKind kind;
  @Nullable private final Term content;
  private final Location location;

  StoreInstance(
      String name,
      @Nullable String typeName,
      @Nullable TypeKind kind,
      @Nullable Term content,
      Location location) {
    Preconditions.checkArgument(kind != TypeKind.PROCESS, "process type for instance %s", name);
    this.name = name;
    this.typeName = typeName;
    this.kind = kind;
    this.content = content;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  /** Returns the declared type of the instance; null for the attacker store. */
  @Nullable
  public String getTypeName() {
    return typeName;
  }

  /** Returns CHANNEL or FILESYS; null for the attacker store. */
  @Nullable
  public TypeKind getKind() {
    return kind;
  }

  public boolean isFile() {
    return kind == TypeKind.FILESYS;
  }

  public boolean isAttacker() {
    return kind == null;
  }

  /** Returns the initial content fact, or null if the instance starts empty. */
  @Nullable
  public Term getContent() {
    return content;
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return isAttacker() ? name : name + ": " + typeName;
  }
}
