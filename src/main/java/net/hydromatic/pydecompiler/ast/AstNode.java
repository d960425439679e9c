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

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into source code, using the default indentation and
   * line length.
   *
   * <p>A statement ends with a newline; an expression does not. Parentheses
   * that the node would need because of an enclosing node are not written,
   * because a node does not know its parent.
   */
  @Override
  public final String toString() {
    // Marked final because you should override write, not toString
    return unparse(new AstWriter());
  }

  /** Converts this node into source code, with a given writer. */
  public final String unparse(AstWriter w) {
    return w.append(this).toString();
  }

  /**
   * Writes this node. Called by {@link AstWriter#append(AstNode)}, which
   * makes this node the top of the writer's ancestry stack.
   */
  abstract AstWriter write(AstWriter w);

  /**
   * Returns the binding strength of this node when it is the operand of an
   * operator, or -1 if it never needs parentheses on that account.
   */
  int precedence() {
    return op.precedence;
  }
}

// End AstNode.java
