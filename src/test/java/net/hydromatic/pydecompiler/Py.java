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

import static net.hydromatic.pydecompiler.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.pydecompiler.ast.Ast;
import net.hydromatic.pydecompiler.ast.AstNode;
import net.hydromatic.pydecompiler.ast.Pos;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Py {
  private final AstNode node;
  private final Map<Prop, Object> propMap;

  Py(AstNode node, Map<Prop, Object> propMap) {
    this.node = node;
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates a {@code Py} for a tree. */
  static Py py(AstNode node) {
    return new Py(node, ImmutableMap.of());
  }

  /** Creates a {@code Py} for a module containing some statements. */
  static Py module(Ast.Stmt... statements) {
    return py(ast.module(Pos.ZERO, statements));
  }

  /** Creates a {@code Py} for a module that consists of a single expression
   * statement. */
  static Py exp(Ast.Exp exp) {
    return module(ast.expr(exp));
  }

  static Ast.Name name(String id) {
    return ast.name(Pos.ZERO, id);
  }

  static Ast.Num num(Number n) {
    return ast.num(Pos.ZERO, n);
  }

  static Ast.Str str(String s) {
    return ast.str(Pos.ZERO, s);
  }

  static Ast.Str unicode(String s) {
    return ast.str(Pos.ZERO, s, Ast.Str.Kind.UNICODE);
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable,
      Matcher<? super Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  Py withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Py(node, map);
  }

  String decompile() {
    return Decompiler.decompile(node, propMap);
  }

  /** Checks the generated code, and that a second run generates the same
   * code. */
  @CanIgnoreReturnValue
  Py assertDecompiles(String expected) {
    final String code = decompile();
    assertThat(code, is(expected));
    assertThat(decompile(), is(code));
    return this;
  }

  @CanIgnoreReturnValue
  Py assertDecompileError(Matcher<? super Throwable> matcher) {
    assertError(this::decompile, matcher);
    return this;
  }
}

// End Py.java
