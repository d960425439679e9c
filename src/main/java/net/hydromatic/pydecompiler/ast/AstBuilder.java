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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // modules

  public Ast.Module module(Pos pos, Iterable<? extends Ast.Stmt> body) {
    return new Ast.Module(pos, ImmutableList.copyOf(body));
  }

  public Ast.Module module(Pos pos, Ast.Stmt... body) {
    return module(pos, Arrays.asList(body));
  }

  public Ast.Interactive interactive(Pos pos,
      Iterable<? extends Ast.Stmt> body) {
    return new Ast.Interactive(pos, ImmutableList.copyOf(body));
  }

  public Ast.Expression expression(Pos pos, Ast.Exp body) {
    return new Ast.Expression(pos, body);
  }

  // statements

  public Ast.FunctionDef functionDef(Pos pos, String name, Ast.Arguments args,
      Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.Exp> decorators) {
    return new Ast.FunctionDef(pos, name, args, ImmutableList.copyOf(body),
        ImmutableList.copyOf(decorators));
  }

  public Ast.ClassDef classDef(Pos pos, String name,
      Iterable<? extends Ast.Exp> bases, Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.Exp> decorators) {
    return new Ast.ClassDef(pos, name, ImmutableList.copyOf(bases),
        ImmutableList.copyOf(body), ImmutableList.copyOf(decorators));
  }

  public Ast.Return returnStmt(Pos pos, Ast.@Nullable Exp value) {
    return new Ast.Return(pos, value);
  }

  public Ast.Delete delete(Pos pos, Iterable<? extends Ast.Exp> targets) {
    return new Ast.Delete(pos, ImmutableList.copyOf(targets));
  }

  public Ast.Assign assign(Pos pos, Iterable<? extends Ast.Exp> targets,
      Ast.Exp value) {
    return new Ast.Assign(pos, ImmutableList.copyOf(targets), value);
  }

  /** Creates an assignment to a single target, "target = value". */
  public Ast.Assign assign(Pos pos, Ast.Exp target, Ast.Exp value) {
    return assign(pos, ImmutableList.of(target), value);
  }

  public Ast.AugAssign augAssign(Pos pos, Ast.Exp target, Op op,
      Ast.Exp value) {
    return new Ast.AugAssign(pos, target, op, value);
  }

  public Ast.Print print(Pos pos, Ast.@Nullable Exp dest,
      Iterable<? extends Ast.Exp> values, boolean nl) {
    return new Ast.Print(pos, dest, ImmutableList.copyOf(values), nl);
  }

  public Ast.For forStmt(Pos pos, Ast.Exp target, Ast.Exp iter,
      Iterable<? extends Ast.Stmt> body, Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.For(pos, target, iter, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orElse));
  }

  public Ast.While whileStmt(Pos pos, Ast.Exp test,
      Iterable<? extends Ast.Stmt> body, Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.While(pos, test, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orElse));
  }

  public Ast.If ifStmt(Pos pos, Ast.Exp test,
      Iterable<? extends Ast.Stmt> body, Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.If(pos, test, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orElse));
  }

  public Ast.With with(Pos pos, Ast.Exp contextExpr,
      Ast.@Nullable Exp optionalVars, Iterable<? extends Ast.Stmt> body) {
    return new Ast.With(pos, contextExpr, optionalVars,
        ImmutableList.copyOf(body));
  }

  public Ast.Raise raise(Pos pos, Ast.@Nullable Exp type,
      Ast.@Nullable Exp inst, Ast.@Nullable Exp tback) {
    return new Ast.Raise(pos, type, inst, tback);
  }

  public Ast.TryExcept tryExcept(Pos pos, Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.ExceptHandler> handlers,
      Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.TryExcept(pos, ImmutableList.copyOf(body),
        ImmutableList.copyOf(handlers), ImmutableList.copyOf(orElse));
  }

  public Ast.TryFinally tryFinally(Pos pos, Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.Stmt> finalBody) {
    return new Ast.TryFinally(pos, ImmutableList.copyOf(body),
        ImmutableList.copyOf(finalBody));
  }

  public Ast.Assert assertStmt(Pos pos, Ast.Exp test, Ast.@Nullable Exp msg) {
    return new Ast.Assert(pos, test, msg);
  }

  public Ast.Import importStmt(Pos pos, Iterable<? extends Ast.Alias> names) {
    return new Ast.Import(pos, ImmutableList.copyOf(names));
  }

  public Ast.ImportFrom importFrom(Pos pos, @Nullable String module,
      Iterable<? extends Ast.Alias> names, int level) {
    return new Ast.ImportFrom(pos, module, ImmutableList.copyOf(names), level);
  }

  public Ast.Exec exec(Pos pos, Ast.Exp body, Ast.@Nullable Exp globals,
      Ast.@Nullable Exp locals) {
    return new Ast.Exec(pos, body, globals, locals);
  }

  public Ast.Global global(Pos pos, Iterable<String> names) {
    return new Ast.Global(pos, ImmutableList.copyOf(names));
  }

  public Ast.Expr expr(Pos pos, Ast.Exp value) {
    return new Ast.Expr(pos, value);
  }

  /** Creates an expression statement positioned at its expression. */
  public Ast.Expr expr(Ast.Exp value) {
    return expr(value.pos, value);
  }

  public Ast.Pass pass(Pos pos) {
    return new Ast.Pass(pos);
  }

  public Ast.Break breakStmt(Pos pos) {
    return new Ast.Break(pos);
  }

  public Ast.Continue continueStmt(Pos pos) {
    return new Ast.Continue(pos);
  }

  // expressions

  /** Creates a chain of "and" or "or". The operator is checked when the node
   * is written, not now. */
  public Ast.BoolOp boolOp(Pos pos, Op op, Iterable<? extends Ast.Exp> values) {
    return new Ast.BoolOp(pos, op, ImmutableList.copyOf(values));
  }

  public Ast.BinOp binOp(Pos pos, Ast.Exp left, Op op, Ast.Exp right) {
    return new Ast.BinOp(pos, left, op, right);
  }

  /** Creates a binary operator positioned at its left operand. */
  public Ast.BinOp binOp(Ast.Exp left, Op op, Ast.Exp right) {
    return binOp(left.pos, left, op, right);
  }

  public Ast.UnaryOp unaryOp(Pos pos, Op op, Ast.Exp operand) {
    return new Ast.UnaryOp(pos, op, operand);
  }

  public Ast.Lambda lambda(Pos pos, Ast.Arguments args, Ast.Exp body) {
    return new Ast.Lambda(pos, args, body);
  }

  public Ast.IfExp ifExp(Pos pos, Ast.Exp test, Ast.Exp body,
      Ast.Exp orElse) {
    return new Ast.IfExp(pos, test, body, orElse);
  }

  public Ast.Dict dict(Pos pos, Iterable<? extends Ast.Exp> keys,
      Iterable<? extends Ast.Exp> values) {
    return new Ast.Dict(pos, ImmutableList.copyOf(keys),
        ImmutableList.copyOf(values));
  }

  public Ast.SetExp set(Pos pos, Iterable<? extends Ast.Exp> elts) {
    return new Ast.SetExp(pos, ImmutableList.copyOf(elts));
  }

  public Ast.ListComp listComp(Pos pos, Ast.Exp elt,
      Iterable<? extends Ast.Comprehension> generators) {
    return new Ast.ListComp(pos, elt, ImmutableList.copyOf(generators));
  }

  public Ast.SetComp setComp(Pos pos, Ast.Exp elt,
      Iterable<? extends Ast.Comprehension> generators) {
    return new Ast.SetComp(pos, elt, ImmutableList.copyOf(generators));
  }

  public Ast.DictComp dictComp(Pos pos, Ast.Exp key, Ast.Exp value,
      Iterable<? extends Ast.Comprehension> generators) {
    return new Ast.DictComp(pos, key, value, ImmutableList.copyOf(generators));
  }

  public Ast.GeneratorExp generatorExp(Pos pos, Ast.Exp elt,
      Iterable<? extends Ast.Comprehension> generators) {
    return new Ast.GeneratorExp(pos, elt, ImmutableList.copyOf(generators));
  }

  public Ast.Yield yield(Pos pos, Ast.@Nullable Exp value) {
    return new Ast.Yield(pos, value);
  }

  public Ast.Compare compare(Pos pos, Ast.Exp left, Iterable<Op> ops,
      Iterable<? extends Ast.Exp> comparators) {
    return new Ast.Compare(pos, left, ImmutableList.copyOf(ops),
        ImmutableList.copyOf(comparators));
  }

  /** Creates a single comparison, "left op right". */
  public Ast.Compare compare(Ast.Exp left, Op op, Ast.Exp right) {
    return compare(left.pos, left, ImmutableList.of(op),
        ImmutableList.of(right));
  }

  public Ast.Call call(Pos pos, Ast.Exp func, Iterable<? extends Ast.Exp> args,
      Iterable<? extends Ast.Keyword> keywords, Ast.@Nullable Exp starArgs,
      Ast.@Nullable Exp kwArgs) {
    return new Ast.Call(pos, func, ImmutableList.copyOf(args),
        ImmutableList.copyOf(keywords), starArgs, kwArgs);
  }

  /** Creates a call with positional arguments only. */
  public Ast.Call call(Ast.Exp func, Ast.Exp... args) {
    return call(func.pos, func, Arrays.asList(args), ImmutableList.of(), null,
        null);
  }

  public Ast.Repr repr(Pos pos, Ast.Exp value) {
    return new Ast.Repr(pos, value);
  }

  /** Creates a numeric literal. The value must be an {@link Integer},
   * {@link Long}, {@link java.math.BigInteger} or {@link Double}. */
  public Ast.Num num(Pos pos, Number n) {
    return new Ast.Num(pos, n);
  }

  public Ast.Str str(Pos pos, String s, Ast.Str.Kind kind) {
    return new Ast.Str(pos, s, kind);
  }

  /** Creates a native (byte) string literal. */
  public Ast.Str str(Pos pos, String s) {
    return str(pos, s, Ast.Str.Kind.NATIVE);
  }

  public Ast.Attribute attribute(Pos pos, Ast.Exp value, String attr) {
    return new Ast.Attribute(pos, value, attr);
  }

  public Ast.Subscript subscript(Pos pos, Ast.Exp value, Ast.SliceKind slice) {
    return new Ast.Subscript(pos, value, slice);
  }

  public Ast.Name name(Pos pos, String id) {
    return new Ast.Name(pos, id);
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Exp> elts) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(elts));
  }

  public Ast.ListExp list(Pos pos, Ast.Exp... elts) {
    return list(pos, Arrays.asList(elts));
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> elts) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(elts));
  }

  public Ast.Tuple tuple(Pos pos, Ast.Exp... elts) {
    return tuple(pos, Arrays.asList(elts));
  }

  // slices

  public Ast.Ellipsis ellipsis(Pos pos) {
    return new Ast.Ellipsis(pos);
  }

  public Ast.Slice slice(Pos pos, Ast.@Nullable Exp lower,
      Ast.@Nullable Exp upper, Ast.@Nullable Exp step) {
    return new Ast.Slice(pos, lower, upper, step);
  }

  public Ast.ExtSlice extSlice(Pos pos,
      Iterable<? extends Ast.SliceKind> dims) {
    return new Ast.ExtSlice(pos, ImmutableList.copyOf(dims));
  }

  public Ast.Index index(Pos pos, Ast.Exp value) {
    return new Ast.Index(pos, value);
  }

  // miscellaneous

  public Ast.Comprehension comprehension(Pos pos, Ast.Exp target,
      Ast.Exp iter, Iterable<? extends Ast.Exp> ifs) {
    return new Ast.Comprehension(pos, target, iter, ImmutableList.copyOf(ifs));
  }

  public Ast.ExceptHandler exceptHandler(Pos pos, Ast.@Nullable Exp type,
      Ast.@Nullable Exp name, Iterable<? extends Ast.Stmt> body) {
    return new Ast.ExceptHandler(pos, type, name, ImmutableList.copyOf(body));
  }

  public Ast.Arguments arguments(Pos pos, Iterable<? extends Ast.Exp> args,
      @Nullable String vararg, @Nullable String kwarg,
      Iterable<? extends Ast.Exp> defaults) {
    return new Ast.Arguments(pos, ImmutableList.copyOf(args), vararg, kwarg,
        ImmutableList.copyOf(defaults));
  }

  /** Creates an empty parameter list. */
  public Ast.Arguments arguments(Pos pos) {
    return arguments(pos, ImmutableList.of(), null, null, ImmutableList.of());
  }

  public Ast.Keyword keyword(Pos pos, String arg, Ast.Exp value) {
    return new Ast.Keyword(pos, arg, value);
  }

  public Ast.Alias alias(Pos pos, String name, @Nullable String asName) {
    return new Ast.Alias(pos, name, asName);
  }
}

// End AstBuilder.java
