/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pydecompiler.ast;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * Position of a parse-tree node: the line number (starting at 1) and column
 * offset (starting at 0) at which the parser found it.
 */
public class Pos {
  /** Position of a node that was synthesized rather than parsed. */
  public static final Pos ZERO = new Pos(0, 0);

  public final int line;
  public final int column;

  private Pos(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** Creates a Pos. */
  public static Pos of(int line, int column) {
    checkArgument(line >= 0, "negative line %s", line);
    checkArgument(column >= 0, "negative column %s", column);
    return line == 0 && column == 0 ? ZERO : new Pos(line, column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.line == ((Pos) o).line
            && this.column == ((Pos) o).column;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(line).append('.').append(column);
  }
}

// End Pos.java
