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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context for writing an AST out as source code.
 *
 * <p>Output is a list of completed lines plus the line currently being
 * written. Indentation is written explicitly, by {@link #indent()}, at the
 * start of each line. The writer also keeps the stack of nodes currently being
 * written, so that a node can look at its parent to decide whether it needs
 * parentheses.
 *
 * <p>A writer is used for one traversal and is not thread-safe.
 */
public class AstWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(AstWriter.class);

  public static final int DEFAULT_INDENTATION = 4;
  public static final int DEFAULT_LINE_LENGTH = 100;

  private final int indentation;
  private final int lineLength;
  private final List<String> lines = new ArrayList<>();
  private final StringBuilder line = new StringBuilder();
  private final Deque<AstNode> stack = new ArrayDeque<>();
  private int currentIndentation = 0;
  private boolean unicodeLiterals = false;

  /** Creates a writer with default indentation and line length. */
  public AstWriter() {
    this(DEFAULT_INDENTATION, DEFAULT_LINE_LENGTH);
  }

  /**
   * Creates a writer.
   *
   * @param indentation Number of spaces per level of indentation
   * @param lineLength Length beyond which the writer will try to break a list
   *     over several lines (it will not always succeed)
   */
  public AstWriter(int indentation, int lineLength) {
    checkArgument(indentation >= 0, "invalid indentation %s", indentation);
    checkArgument(lineLength > 0, "invalid line length %s", lineLength);
    this.indentation = indentation;
    this.lineLength = lineLength;
  }

  /** Appends a string to the current line. */
  @CanIgnoreReturnValue
  public AstWriter append(String s) {
    line.append(s);
    return this;
  }

  /** Appends a node, making it the top of the ancestry stack while it is
   * being written. */
  @CanIgnoreReturnValue
  public AstWriter append(AstNode node) {
    stack.push(node);
    try {
      return node.write(this);
    } finally {
      stack.pop();
    }
  }

  /** Writes the indentation of the current block. */
  @CanIgnoreReturnValue
  public AstWriter indent() {
    return append(Strings.repeat(" ", currentIndentation));
  }

  /** Ends the current line. */
  @CanIgnoreReturnValue
  public AstWriter newline() {
    lines.add(line.append('\n').toString());
    line.setLength(0);
    return this;
  }

  /** Returns the length of the line currently being written. */
  public int currentLineLength() {
    return line.length();
  }

  /** Returns the current indentation, in spaces. */
  public int currentIndentation() {
    return currentIndentation;
  }

  /** Runs an action with one more level of indentation. */
  @CanIgnoreReturnValue
  public AstWriter indented(Runnable action) {
    currentIndentation += indentation;
    try {
      action.run();
    } finally {
      currentIndentation -= indentation;
    }
    return this;
  }

  /** Writes a block of statements, one level further indented. */
  @CanIgnoreReturnValue
  public AstWriter suite(List<? extends AstNode> statements) {
    return indented(() -> statements.forEach(this::append));
  }

  /** Writes an "else" clause, if there are any statements in it. */
  @CanIgnoreReturnValue
  public AstWriter orElse(List<? extends AstNode> statements) {
    if (statements.isEmpty()) {
      return this;
    }
    return indent().append("else:").newline().suite(statements);
  }

  /** Runs an action, surrounding its output with parentheses if
   * {@code condition} holds. */
  @CanIgnoreReturnValue
  public AstWriter parenthesize(boolean condition, Runnable action) {
    if (condition) {
      append("(");
    }
    action.run();
    if (condition) {
      append(")");
    }
    return this;
  }

  /** Records the state of the output, so that it can later be restored by
   * {@link #rollback(Checkpoint)}. */
  public Checkpoint checkpoint() {
    return new Checkpoint(lines.size(), line.toString());
  }

  /** Discards everything written since a checkpoint was taken. */
  public void rollback(Checkpoint checkpoint) {
    checkArgument(checkpoint.lineCount <= lines.size(),
        "checkpoint is ahead of the output");
    lines.subList(checkpoint.lineCount, lines.size()).clear();
    line.setLength(0);
    line.append(checkpoint.line);
  }

  /** Writes a list of nodes separated by commas, over several lines if
   * necessary. */
  @CanIgnoreReturnValue
  public AstWriter list(List<? extends AstNode> nodes) {
    return list(nodes, ", ", true, true, true);
  }

  /**
   * Writes a list of nodes, separated by {@code separator}.
   *
   * <p>First tries to write the whole list on the current line. If
   * {@code allowNewlines} and the line becomes longer than the line length,
   * abandons the attempt, discards its output, and writes each node on its
   * own line, one level further indented.
   *
   * @param nodes Nodes
   * @param separator Separator, e.g. ", "
   * @param allowNewlines Whether the list may be written over several lines
   * @param needParens Whether, if the list is written over several lines, to
   *     surround it with parentheses
   * @param finalSeparator Whether, if the list is written over several lines,
   *     to write a separator after the last node
   */
  @CanIgnoreReturnValue
  public AstWriter list(List<? extends AstNode> nodes, String separator,
      boolean allowNewlines, boolean needParens, boolean finalSeparator) {
    final Checkpoint checkpoint = checkpoint();
    if (inline(nodes, separator, allowNewlines)) {
      return this;
    }
    rollback(checkpoint);
    LOGGER.trace("line exceeds {} characters; writing {} nodes on "
        + "separate lines", lineLength, nodes.size());

    final String trimmedSeparator =
        CharMatcher.whitespace().trimTrailingFrom(separator);
    if (needParens) {
      append("(");
    }
    newline();
    indented(() -> {
      for (int i = 0; i < nodes.size(); i++) {
        indent().append(nodes.get(i));
        if (finalSeparator || i < nodes.size() - 1) {
          append(trimmedSeparator);
        }
        newline();
      }
    });
    indent();
    if (needParens) {
      append(")");
    }
    return this;
  }

  /** Writes nodes on the current line; returns false, having written only
   * some of them, as soon as the line becomes too long. */
  private boolean inline(List<? extends AstNode> nodes, String separator,
      boolean allowNewlines) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(separator);
      }
      append(nodes.get(i));
      if (allowNewlines && currentLineLength() > lineLength) {
        return false;
      }
    }
    return true;
  }

  /** Returns the node currently being written; null if none. */
  public @Nullable AstNode current() {
    return stack.peek();
  }

  /** Returns the parent of the node currently being written; null if the
   * current node is the root. */
  public @Nullable AstNode parent() {
    final Iterator<AstNode> iterator = stack.iterator();
    if (!iterator.hasNext()) {
      return null;
    }
    iterator.next();
    return iterator.hasNext() ? iterator.next() : null;
  }

  /** Returns the number of nodes currently being written. */
  public int depth() {
    return stack.size();
  }

  /** Returns the precedence of a node, or -1 if it is null. */
  public int precedence(@Nullable AstNode node) {
    return node == null ? -1 : node.precedence();
  }

  /** Returns the text of an operator, or throws if {@code op} is not an
   * operator of the expected kind. */
  String symbol(AstNode node, Op op, Op.Kind kind) {
    if (!op.is(kind) || op.symbol == null) {
      throw new UnparseException("cannot unparse " + op + " as "
          + kind.name().toLowerCase(Locale.ROOT) + " operator",
          node.pos);
    }
    return op.symbol;
  }

  /** Returns whether a {@code from __future__ import unicode_literals}
   * directive has been written. */
  public boolean unicodeLiterals() {
    return unicodeLiterals;
  }

  /** Records that a {@code from __future__ import unicode_literals}
   * directive has been written; native strings written from now on need a
   * "b" prefix. */
  void enableUnicodeLiterals() {
    unicodeLiterals = true;
  }

  /** Returns the completed lines. */
  public List<String> lines() {
    return ImmutableList.copyOf(lines);
  }

  @Override
  public String toString() {
    return String.join("", lines) + line;
  }

  /** State of a writer's output at a point in time. */
  public static class Checkpoint {
    final int lineCount;
    final String line;

    Checkpoint(int lineCount, String line) {
      this.lineCount = lineCount;
      this.line = line;
    }
  }
}

// End AstWriter.java
