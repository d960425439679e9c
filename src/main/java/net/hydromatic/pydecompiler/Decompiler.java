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
package net.hydromatic.pydecompiler;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.pydecompiler.ast.AstNode;
import net.hydromatic.pydecompiler.ast.AstWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts an abstract syntax tree back into source code.
 *
 * <p>The output, when parsed, yields a tree equivalent to the input. It does
 * not preserve the formatting or comments of any source the tree was
 * originally parsed from.
 *
 * <p>For example,
 *
 * <pre>{@code
 * import static net.hydromatic.pydecompiler.ast.AstBuilder.ast;
 *
 * AstNode node =
 *     ast.module(Pos.ZERO,
 *         ast.expr(
 *             ast.call(ast.name(Pos.ZERO, "f"),
 *                 ast.num(Pos.ZERO, 1))));
 * String code = Decompiler.decompile(node); // "f(1)\n"
 * }</pre>
 */
public class Decompiler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Decompiler.class);

  private Decompiler() {}

  /** Decompiles a tree with default indentation and line length. */
  public static String decompile(AstNode node) {
    return decompile(node, ImmutableMap.of());
  }

  /**
   * Decompiles a tree.
   *
   * @param node Root of the tree, usually a module
   * @param indentation Number of spaces per level of indentation
   * @param lineLength Length beyond which the decompiler will try to break
   *     a line
   * @throws IllegalArgumentException if indentation is negative or line
   *     length is not positive
   * @throws net.hydromatic.pydecompiler.ast.UnparseException if the tree
   *     contains a node that cannot be written where it occurs
   */
  public static String decompile(AstNode node, int indentation,
      int lineLength) {
    final AstWriter w = new AstWriter(indentation, lineLength);
    LOGGER.debug("decompiling {} at {} (indentation {}, line length {})",
        node.op, node.pos, indentation, lineLength);
    final String code = node.unparse(w);
    LOGGER.debug("decompiled {} into {} lines", node.op, w.lines().size());
    return code;
  }

  /** Decompiles a tree, reading indentation and line length from a map of
   * properties. */
  public static String decompile(AstNode node, Map<Prop, Object> map) {
    return decompile(node, Prop.INDENTATION.intValue(map),
        Prop.LINE_LENGTH.intValue(map));
  }
}

// End Decompiler.java
