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

import static net.hydromatic.pydecompiler.Py.exp;
import static net.hydromatic.pydecompiler.Py.module;
import static net.hydromatic.pydecompiler.Py.name;
import static net.hydromatic.pydecompiler.Py.num;
import static net.hydromatic.pydecompiler.Py.py;
import static net.hydromatic.pydecompiler.Py.str;
import static net.hydromatic.pydecompiler.Py.unicode;
import static net.hydromatic.pydecompiler.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.pydecompiler.ast.Ast;
import net.hydromatic.pydecompiler.ast.Op;
import net.hydromatic.pydecompiler.ast.Pos;
import net.hydromatic.pydecompiler.ast.UnparseException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Decompiler}, mainly statements and layout. */
public class DecompilerTest {
  private static final Pos P = Pos.ZERO;

  private static Ast.Pass pass() {
    return ast.pass(P);
  }

  private static Ast.Alias alias(String name) {
    return ast.alias(P, name, null);
  }

  @Test void testExpressionStatement() {
    exp(ast.call(name("f"), num(1)))
        .assertDecompiles("f(1)\n");
    module(ast.expr(name("a")), ast.expr(name("b")))
        .assertDecompiles("a\nb\n");
    module().assertDecompiles("");
  }

  @Test void testExpressionRoot() {
    py(ast.expression(P, ast.binOp(name("a"), Op.ADD, name("b"))))
        .assertDecompiles("a + b");
    py(ast.interactive(P, ImmutableList.of(ast.pass(P))))
        .assertDecompiles("pass\n");
  }

  @Test void testToString() {
    final Ast.BinOp binOp = ast.binOp(name("a"), Op.MULT, name("b"));
    assertThat(binOp, hasToString("a * b"));
    assertThat(ast.returnStmt(P, binOp), hasToString("return a * b\n"));
  }

  @Test void testFunctionDef() {
    final Ast.Arguments args =
        ast.arguments(P, ImmutableList.of(name("a"), name("b")), "args", "kw",
            ImmutableList.of(num(1)));
    final Ast.FunctionDef f =
        ast.functionDef(P, "f", args,
            ImmutableList.of(ast.returnStmt(P, name("a"))),
            ImmutableList.of(name("deco")));
    module(f).assertDecompiles("\n"
        + "@deco\n"
        + "def f(a, b=1, *args, **kw):\n"
        + "    return a\n");

    final Ast.FunctionDef g =
        ast.functionDef(P, "g", ast.arguments(P),
            ImmutableList.of(ast.returnStmt(P, null)), ImmutableList.of());
    module(g).assertDecompiles("\n"
        + "def g():\n"
        + "    return\n");
  }

  @Test void testClassDef() {
    final Ast.ClassDef c =
        ast.classDef(P, "C", ImmutableList.of(name("object")),
            ImmutableList.of(pass()), ImmutableList.of());
    module(ast.expr(name("x")), c).assertDecompiles("x\n"
        + "\n"
        + "\n"
        + "class C(object):\n"
        + "    pass\n");
  }

  @Test void testAssign() {
    module(ast.assign(P, name("x"), num(1)))
        .assertDecompiles("x = 1\n");
    module(
        ast.assign(P, ImmutableList.of(name("a"), name("b")), name("c")))
        .assertDecompiles("a = b = c\n");
    module(
        ast.assign(P, ast.tuple(P, name("a"), name("b")),
            ast.tuple(P, name("b"), name("a"))))
        .assertDecompiles("a, b = b, a\n");
    module(ast.augAssign(P, name("x"), Op.FLOOR_DIV, num(2)))
        .assertDecompiles("x //= 2\n");
  }

  @Test void testDelete() {
    module(
        ast.delete(P,
            ImmutableList.of(name("a"),
                ast.subscript(P, name("b"), ast.index(P, num(0))))))
        .assertDecompiles("del a, b[0]\n");
  }

  @Test void testPrint() {
    module(ast.print(P, null, ImmutableList.of(name("a"), name("b")), true))
        .assertDecompiles("print a, b\n");
    module(ast.print(P, name("f"), ImmutableList.of(name("a")), false))
        .assertDecompiles("print >>f, a,\n");
    module(ast.print(P, null, ImmutableList.of(), true))
        .assertDecompiles("print\n");
    module(ast.print(P, name("f"), ImmutableList.of(), true))
        .assertDecompiles("print >>f\n");
  }

  @Test void testLoops() {
    module(
        ast.forStmt(P, name("x"), name("xs"),
            ImmutableList.of(ast.continueStmt(P)),
            ImmutableList.of(ast.breakStmt(P))))
        .assertDecompiles("for x in xs:\n"
            + "    continue\n"
            + "else:\n"
            + "    break\n");
    module(
        ast.forStmt(P, ast.tuple(P, name("k"), name("v")), name("items"),
            ImmutableList.of(pass()), ImmutableList.of()))
        .assertDecompiles("for (k, v) in items:\n"
            + "    pass\n");
    module(
        ast.whileStmt(P, name("x"), ImmutableList.of(pass()),
            ImmutableList.of()))
        .assertDecompiles("while x:\n"
            + "    pass\n");
  }

  @Test void testElifChain() {
    final Ast.If inner =
        ast.ifStmt(P, name("b"), ImmutableList.of(pass()),
            ImmutableList.of(ast.expr(name("c"))));
    module(
        ast.ifStmt(P, name("a"), ImmutableList.of(pass()),
            ImmutableList.of(inner)))
        .assertDecompiles("if a:\n"
            + "    pass\n"
            + "elif b:\n"
            + "    pass\n"
            + "else:\n"
            + "    c\n");
  }

  @Test void testLongElifChain() {
    final Ast.If third =
        ast.ifStmt(P, name("c"), ImmutableList.of(ast.expr(name("z"))),
            ImmutableList.of(ast.expr(name("w"))));
    final Ast.If second =
        ast.ifStmt(P, name("b"), ImmutableList.of(ast.expr(name("y"))),
            ImmutableList.of(third));
    module(
        ast.ifStmt(P, name("a"), ImmutableList.of(ast.expr(name("x"))),
            ImmutableList.of(second)))
        .assertDecompiles("if a:\n"
            + "    x\n"
            + "elif b:\n"
            + "    y\n"
            + "elif c:\n"
            + "    z\n"
            + "else:\n"
            + "    w\n");
  }

  @Test void testNestedIfInElseIsNotCollapsed() {
    final Ast.If inner =
        ast.ifStmt(P, name("b"), ImmutableList.of(pass()),
            ImmutableList.of());
    module(
        ast.ifStmt(P, name("a"), ImmutableList.of(pass()),
            ImmutableList.of(inner, ast.expr(name("c")))))
        .assertDecompiles("if a:\n"
            + "    pass\n"
            + "else:\n"
            + "    if b:\n"
            + "        pass\n"
            + "    c\n");
  }

  @Test void testWithFlattening() {
    final Ast.With inner =
        ast.with(P, name("b"), null, ImmutableList.of(pass()));
    module(ast.with(P, name("a"), name("x"), ImmutableList.of(inner)))
        .assertDecompiles("with a as x, b:\n"
            + "    pass\n");

    final Ast.With middle =
        ast.with(P, name("b"), null,
            ImmutableList.of(
                ast.with(P, name("c"), name("y"), ImmutableList.of(pass()))));
    module(ast.with(P, name("a"), null, ImmutableList.of(middle)))
        .assertDecompiles("with a, b, c as y:\n"
            + "    pass\n");

    // Not flattened if the body has more than one statement
    final Ast.With with2 =
        ast.with(P, name("a"), null,
            ImmutableList.of(inner, ast.expr(name("c"))));
    module(with2)
        .assertDecompiles("with a:\n"
            + "    with b:\n"
            + "        pass\n"
            + "    c\n");
  }

  @Test void testTry() {
    final Ast.ExceptHandler handler =
        ast.exceptHandler(P, name("E"), name("e"), ImmutableList.of(pass()));
    final Ast.ExceptHandler catchAll =
        ast.exceptHandler(P, null, null, ImmutableList.of(ast.raise(P, null,
            null, null)));
    final Ast.TryExcept tryExcept =
        ast.tryExcept(P, ImmutableList.of(pass()),
            ImmutableList.of(handler, catchAll),
            ImmutableList.of(ast.expr(name("x"))));
    module(tryExcept)
        .assertDecompiles("try:\n"
            + "    pass\n"
            + "except E as e:\n"
            + "    pass\n"
            + "except:\n"
            + "    raise\n"
            + "else:\n"
            + "    x\n");

    module(ast.tryFinally(P, ImmutableList.of(tryExcept),
            ImmutableList.of(ast.expr(name("y")))))
        .assertDecompiles("try:\n"
            + "    pass\n"
            + "except E as e:\n"
            + "    pass\n"
            + "except:\n"
            + "    raise\n"
            + "else:\n"
            + "    x\n"
            + "finally:\n"
            + "    y\n");

    module(ast.tryFinally(P, ImmutableList.of(pass()),
            ImmutableList.of(pass())))
        .assertDecompiles("try:\n"
            + "    pass\n"
            + "finally:\n"
            + "    pass\n");
  }

  @Test void testRaise() {
    module(ast.raise(P, name("E"), str("msg"), name("tb")))
        .assertDecompiles("raise E, 'msg', tb\n");
    module(ast.raise(P, name("E"), null, null))
        .assertDecompiles("raise E\n");
  }

  @Test void testAssert() {
    module(ast.assertStmt(P, name("x"), str("m")))
        .assertDecompiles("assert x, 'm'\n");
    module(ast.assertStmt(P, name("x"), null))
        .assertDecompiles("assert x\n");
  }

  @Test void testImport() {
    module(
        ast.importStmt(P,
            ImmutableList.of(alias("os"), ast.alias(P, "numpy", "np"))))
        .assertDecompiles("import os, numpy as np\n");
    module(ast.importFrom(P, "os.path", ImmutableList.of(alias("join")), 0))
        .assertDecompiles("from os.path import join\n");
    module(ast.importFrom(P, "pkg", ImmutableList.of(alias("x")), 1))
        .assertDecompiles("from .pkg import x\n");
    module(ast.importFrom(P, null, ImmutableList.of(alias("x")), 2))
        .assertDecompiles("from .. import x\n");
  }

  @Test void testExecGlobal() {
    module(ast.exec(P, str("code"), name("g"), name("l")))
        .assertDecompiles("exec 'code' in g, l\n");
    module(ast.exec(P, name("code"), null, null))
        .assertDecompiles("exec code\n");
    module(ast.global(P, ImmutableList.of("a", "b")))
        .assertDecompiles("global a, b\n");
  }

  @Test void testIndentation() {
    final Ast.If ifStmt =
        ast.ifStmt(P, name("a"),
            ImmutableList.of(
                ast.whileStmt(P, name("b"), ImmutableList.of(pass()),
                    ImmutableList.of())),
            ImmutableList.of());
    module(ifStmt)
        .withProp(Prop.INDENTATION, 2)
        .assertDecompiles("if a:\n"
            + "  while b:\n"
            + "    pass\n");
    module(ifStmt)
        .withProp(Prop.INDENTATION, 0)
        .assertDecompiles("if a:\n"
            + "while b:\n"
            + "pass\n");
    assertThat(Decompiler.decompile(ast.module(P, ifStmt), 3, 100),
        is("if a:\n"
            + "   while b:\n"
            + "      pass\n"));
  }

  /** A call that does not fit on the line puts each argument on its own
   * line, with no separator after the last. */
  @Test void testCallOverflow() {
    final Ast.Call call = ast.call(name("f"), name("aaaa"), name("bbbb"),
        name("cccc"));
    exp(call)
        .assertDecompiles("f(aaaa, bbbb, cccc)\n");
    exp(call)
        .withProp(Prop.LINE_LENGTH, 10)
        .assertDecompiles("f(\n"
            + "    aaaa,\n"
            + "    bbbb,\n"
            + "    cccc\n"
            + ")\n");
  }

  @Test void testOverflowInsideBlock() {
    final Ast.FunctionDef f =
        ast.functionDef(P, "f", ast.arguments(P),
            ImmutableList.of(
                ast.expr(ast.call(name("g"), name("aaaa"), name("bbbb")))),
            ImmutableList.of());
    module(f)
        .withProp(Prop.LINE_LENGTH, 12)
        .assertDecompiles("\n"
            + "def f():\n"
            + "    g(\n"
            + "        aaaa,\n"
            + "        bbbb\n"
            + "    )\n");
  }

  /** A bare tuple that does not fit gets parentheses, and a separator after
   * the last element. */
  @Test void testTupleOverflow() {
    module(
        ast.assign(P, name("x"),
            ast.tuple(P, name("aaaa"), name("bbbb"), name("cccc"))))
        .withProp(Prop.LINE_LENGTH, 10)
        .assertDecompiles("x = (\n"
            + "    aaaa,\n"
            + "    bbbb,\n"
            + "    cccc,\n"
            + ")\n");
  }

  @Test void testComprehensionOverflow() {
    final Ast.Comprehension comprehension =
        ast.comprehension(P, name("x"), name("xs"), ImmutableList.of());
    exp(ast.listComp(P, name("element"), ImmutableList.of(comprehension)))
        .withProp(Prop.LINE_LENGTH, 10)
        .assertDecompiles("[\n"
            + "    element\n"
            + "    for x in xs\n"
            + "]\n");
  }

  @Test void testImportFromOverflow() {
    module(
        ast.importFrom(P, "m", ImmutableList.of(alias("aaaa"), alias("bbbb")),
            0))
        .withProp(Prop.LINE_LENGTH, 10)
        .assertDecompiles("from m import (\n"
            + "    aaaa,\n"
            + "    bbbb,\n"
            + ")\n");
  }

  /** Lists that have no legal multi-line form are never broken, however
   * long. */
  @Test void testInlineOnlyLists() {
    module(
        ast.assign(P, ImmutableList.of(name("aaaa"), name("bbbb")),
            name("cccc")))
        .withProp(Prop.LINE_LENGTH, 5)
        .assertDecompiles("aaaa = bbbb = cccc\n");
    module(ast.importStmt(P, ImmutableList.of(alias("aaaa"), alias("bbbb"))))
        .withProp(Prop.LINE_LENGTH, 5)
        .assertDecompiles("import aaaa, bbbb\n");
    module(ast.global(P, ImmutableList.of("aaaa", "bbbb")))
        .withProp(Prop.LINE_LENGTH, 5)
        .assertDecompiles("global aaaa, bbbb\n");
    module(ast.delete(P, ImmutableList.of(name("aaaa"), name("bbbb"))))
        .withProp(Prop.LINE_LENGTH, 8)
        .assertDecompiles("del aaaa, bbbb\n");
    module(
        ast.print(P, null, ImmutableList.of(name("aaaa"), name("bbbb")), true))
        .withProp(Prop.LINE_LENGTH, 5)
        .assertDecompiles("print aaaa, bbbb\n");
    final Ast.Arguments args =
        ast.arguments(P, ImmutableList.of(name("aaaa"), name("bbbb")), null,
            null, ImmutableList.of());
    exp(ast.lambda(P, args, name("aaaa")))
        .withProp(Prop.LINE_LENGTH, 5)
        .assertDecompiles("lambda aaaa, bbbb: aaaa\n");
  }

  /** Native strings after "from __future__ import unicode_literals" get a
   * "b" prefix; native strings before it do not. */
  @Test void testUnicodeLiterals() {
    final Ast.ImportFrom future =
        ast.importFrom(P, "__future__",
            ImmutableList.of(alias("unicode_literals")), 0);
    module(future, ast.expr(str("a")), ast.expr(unicode("b")))
        .assertDecompiles("from __future__ import unicode_literals\n"
            + "b'a'\n"
            + "u'b'\n");
    module(ast.expr(str("a")), future, ast.expr(str("c")))
        .assertDecompiles("'a'\n"
            + "from __future__ import unicode_literals\n"
            + "b'c'\n");
    final Ast.ImportFrom division =
        ast.importFrom(P, "__future__", ImmutableList.of(alias("division")),
            0);
    module(division, ast.expr(str("a")))
        .assertDecompiles("from __future__ import division\n"
            + "'a'\n");
    assertThat(future.isUnicodeLiterals(), is(true));
    assertThat(division.isUnicodeLiterals(), is(false));
  }

  @Test void testDeterministic() {
    final Ast.Module module =
        ast.module(P,
            ast.importFrom(P, "__future__",
                ImmutableList.of(alias("unicode_literals")), 0),
            ast.expr(ast.call(name("f"), str("x"), name("y"))));
    final String code = Decompiler.decompile(module, 4, 8);
    assertThat(Decompiler.decompile(module, 4, 8), is(code));
    assertThat(module.toString(), is(Decompiler.decompile(module)));
  }

  @Test void testOperatorOfWrongKind() {
    exp(ast.boolOp(P, Op.ADD, ImmutableList.of(name("a"), name("b"))))
        .assertDecompileError(
            allOf(instanceOf(UnparseException.class),
                hasToString(
                    containsString("cannot unparse ADD as boolean operator"))));
    exp(ast.compare(name("a"), Op.AND, name("b")))
        .assertDecompileError(
            hasToString(
                containsString("cannot unparse AND as comparison operator")));
    module(ast.augAssign(P, name("x"), Op.EQ, num(1)))
        .assertDecompileError(
            hasToString(
                containsString("cannot unparse EQ as binary operator")));
  }

  @Test void testUnparseExceptionPosition() {
    final Pos pos = Pos.of(3, 7);
    final Ast.UnaryOp node = ast.unaryOp(pos, Op.ADD, name("a"));
    final UnparseException e =
        assertThrows(UnparseException.class, () -> Decompiler.decompile(node));
    assertThat(e.pos(), is(pos));
    assertThat(e.getMessage(), is("cannot unparse ADD as unary operator"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("3.7 Error: cannot unparse ADD as unary operator"));
    assertThat(e,
        hasToString(UnparseException.class.getName()
            + ": cannot unparse ADD as unary operator at 3.7"));
  }

  @Test void testInvalidArguments() {
    final Ast.Module module = ast.module(P, pass());
    assertThrows(IllegalArgumentException.class,
        () -> Decompiler.decompile(module, -1, 100));
    assertThrows(IllegalArgumentException.class,
        () -> Decompiler.decompile(module, 4, 0));
    assertThrows(IllegalArgumentException.class,
        () -> ast.dict(P, ImmutableList.of(name("a")), ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.num(P, 1.5f));
    assertThrows(IllegalArgumentException.class,
        () -> ast.str(P, "\u20ac"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.assign(P, ImmutableList.of(), name("a")));
    assertThrows(IllegalArgumentException.class,
        () -> ast.compare(P, name("a"), ImmutableList.of(Op.LT),
            ImmutableList.of()));
    assertThrows(NullPointerException.class,
        () -> ast.name(P, null));
  }
}

// End DecompilerTest.java
