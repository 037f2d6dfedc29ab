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

import com.google.auto.value.AutoValue;

/**
 * A Location denotes a position within a model source file, as reported by the front end. Line and
 * column numbers are 1-based; zero means unknown.
 */
@AutoValue
public abstract class Location {

  /** The location of entities predeclared by the compiler itself, such as {@code pair}. */
  public static final Location BUILTIN = fromFileLineColumn("<builtin>", 0, 0);

  public abstract String file();

  public abstract int line();

  public abstract int column();

  public static Location fromFileLineColumn(String file, int line, int column) {
    return new AutoValue_Location(file, line, column);
  }

  public static Location fromFile(String file) {
    return fromFileLineColumn(file, 0, 0);
  }

  /** Returns a location in the same file at the specified line and column. */
  public Location at(int line, int column) {
    return fromFileLineColumn(file(), line, column);
  }

  /** Returns "file:line:col", omitting unknown components. */
  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder(file());
    if (line() != 0) {
      buf.append(':').append(line());
      if (column() != 0) {
        buf.append(':').append(column());
      }
    }
    return buf.toString();
  }
}
