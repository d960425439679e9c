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
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import net.hydromatic.pydecompiler.util.Reprs;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Returns whether a node is an application of a boolean, binary, unary or
   * comparison operator. */
  static boolean isOperator(@Nullable AstNode node) {
    return node instanceof BoolOp
        || node instanceof BinOp
        || node instanceof UnaryOp
        || node instanceof Compare;
  }

  /** Returns whether a node is a call, attribute access or subscript, and
   * therefore binds its base more tightly than any operator. */
  static boolean isTrailer(@Nullable AstNode node) {
    return node instanceof Call
        || node instanceof Attribute
        || node instanceof Subscript;
  }

  /** Writes the decorators of a function or class definition, one per
   * line. */
  private static void decorate(AstWriter w, List<Exp> decorators) {
    for (Exp decorator : decorators) {
      w.indent().append("@").append(decorator).newline();
    }
  }

  // modules

  /** Base class for the root of a tree. */
  public abstract static class Mod extends AstNode {
    Mod(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** A module: a sequence of statements, as parsed from a file. */
  public static class Module extends Mod {
    public final List<Stmt> body;

    Module(Pos pos, ImmutableList<Stmt> body) {
      super(pos, Op.MODULE);
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      body.forEach(w::append);
      return w;
    }
  }

  /** Statements entered at an interactive prompt. */
  public static class Interactive extends Mod {
    public final List<Stmt> body;

    Interactive(Pos pos, ImmutableList<Stmt> body) {
      super(pos, Op.INTERACTIVE);
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      body.forEach(w::append);
      return w;
    }
  }

  /** A single expression, as parsed in "eval" mode. */
  public static class Expression extends Mod {
    public final Exp body;

    Expression(Pos pos, Exp body) {
      super(pos, Op.EXPRESSION);
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(body);
    }
  }

  // statements

  /** Base class for statements. Every statement writes one or more complete
   * lines. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Function definition, "def f(x): ...". */
  public static class FunctionDef extends Stmt {
    public final String name;
    public final Arguments args;
    public final List<Stmt> body;
    public final List<Exp> decorators;

    FunctionDef(Pos pos, String name, Arguments args, ImmutableList<Stmt> body,
        ImmutableList<Exp> decorators) {
      super(pos, Op.FUNCTION_DEF);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
      this.decorators = requireNonNull(decorators);
    }

    @Override AstWriter write(AstWriter w) {
      w.newline();
      decorate(w, decorators);
      w.indent().append("def ").append(name).append("(")
          .append(args)
          .append("):").newline();
      return w.suite(body);
    }
  }

  /** Class definition, "class C(Base): ...". */
  public static class ClassDef extends Stmt {
    public final String name;
    public final List<Exp> bases;
    public final List<Stmt> body;
    public final List<Exp> decorators;

    ClassDef(Pos pos, String name, ImmutableList<Exp> bases,
        ImmutableList<Stmt> body, ImmutableList<Exp> decorators) {
      super(pos, Op.CLASS_DEF);
      this.name = requireNonNull(name);
      this.bases = requireNonNull(bases);
      this.body = requireNonNull(body);
      this.decorators = requireNonNull(decorators);
    }

    @Override AstWriter write(AstWriter w) {
      w.newline().newline();
      decorate(w, decorators);
      w.indent().append("class ").append(name).append("(")
          .list(bases, ", ", true, false, true)
          .append("):").newline();
      return w.suite(body);
    }
  }

  /** "return" statement, with an optional value. */
  public static class Return extends Stmt {
    public final @Nullable Exp value;

    Return(Pos pos, @Nullable Exp value) {
      super(pos, Op.RETURN);
      this.value = value;
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("return");
      if (value != null) {
        w.append(" ").append(value);
      }
      return w.newline();
    }
  }

  /** "del" statement. */
  public static class Delete extends Stmt {
    public final List<Exp> targets;

    Delete(Pos pos, ImmutableList<Exp> targets) {
      super(pos, Op.DELETE);
      this.targets = requireNonNull(targets);
    }

    @Override AstWriter write(AstWriter w) {
      // Parentheses would turn the targets into a single tuple target
      return w.indent().append("del ")
          .list(targets, ", ", false, true, true)
          .newline();
    }
  }

  /** Assignment, "a = b = value". */
  public static class Assign extends Stmt {
    public final List<Exp> targets;
    public final Exp value;

    Assign(Pos pos, ImmutableList<Exp> targets, Exp value) {
      super(pos, Op.ASSIGN);
      checkArgument(!targets.isEmpty(), "assignment has no targets");
      this.targets = targets;
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      // A chain of targets has no legal multi-line form.
      return w.indent()
          .list(targets, " = ", false, true, true)
          .append(" = ").append(value)
          .newline();
    }
  }

  /** Augmented assignment, "a += value". */
  public static class AugAssign extends Stmt {
    public final Exp target;
    public final Op operator;
    public final Exp value;

    AugAssign(Pos pos, Exp target, Op operator, Exp value) {
      super(pos, Op.AUG_ASSIGN);
      this.target = requireNonNull(target);
      this.operator = requireNonNull(operator);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      final String symbol = w.symbol(this, operator, Op.Kind.BINARY);
      return w.indent().append(target)
          .append(" ").append(symbol).append("= ")
          .append(value)
          .newline();
    }
  }

  /** "print" statement, "print >>dest, a, b,". */
  public static class Print extends Stmt {
    public final @Nullable Exp dest;
    public final List<Exp> values;
    /** Whether to print a newline; if false, the statement ends in a
     * comma. */
    public final boolean nl;

    Print(Pos pos, @Nullable Exp dest, ImmutableList<Exp> values, boolean nl) {
      super(pos, Op.PRINT);
      this.dest = dest;
      this.values = requireNonNull(values);
      this.nl = nl;
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("print");
      if (dest != null) {
        w.append(" >>").append(dest);
        if (!values.isEmpty()) {
          w.append(",");
        }
      }
      if (!values.isEmpty()) {
        w.append(" ");
      }
      w.list(values, ", ", false, true, true);
      if (!nl) {
        w.append(",");
      }
      return w.newline();
    }
  }

  /** "for" loop, with an optional "else" clause. */
  public static class For extends Stmt {
    public final Exp target;
    public final Exp iter;
    public final List<Stmt> body;
    public final List<Stmt> orElse;

    For(Pos pos, Exp target, Exp iter, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orElse) {
      super(pos, Op.FOR);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append("for ").append(target)
          .append(" in ").append(iter)
          .append(":").newline()
          .suite(body)
          .orElse(orElse);
    }
  }

  /** "while" loop, with an optional "else" clause. */
  public static class While extends Stmt {
    public final Exp test;
    public final List<Stmt> body;
    public final List<Stmt> orElse;

    While(Pos pos, Exp test, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orElse) {
      super(pos, Op.WHILE);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append("while ").append(test)
          .append(":").newline()
          .suite(body)
          .orElse(orElse);
    }
  }

  /**
   * "if" statement.
   *
   * <p>An "else" clause that consists of just another "if" statement is
   * written as "elif", repeatedly.
   */
  public static class If extends Stmt {
    public final Exp test;
    public final List<Stmt> body;
    public final List<Stmt> orElse;

    If(Pos pos, Exp test, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orElse) {
      super(pos, Op.IF);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("if ").append(test)
          .append(":").newline()
          .suite(body);
      If node = this;
      while (node.orElse.size() == 1 && node.orElse.get(0) instanceof If) {
        node = (If) node.orElse.get(0);
        w.indent().append("elif ").append(node.test)
            .append(":").newline()
            .suite(node.body);
      }
      return w.orElse(node.orElse);
    }
  }

  /**
   * "with" statement.
   *
   * <p>A "with" whose body is just another "with" is written as a single
   * statement with several context managers, repeatedly.
   */
  public static class With extends Stmt {
    public final Exp contextExpr;
    public final @Nullable Exp optionalVars;
    public final List<Stmt> body;

    With(Pos pos, Exp contextExpr, @Nullable Exp optionalVars,
        ImmutableList<Stmt> body) {
      super(pos, Op.WITH);
      this.contextExpr = requireNonNull(contextExpr);
      this.optionalVars = optionalVars;
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("with ");
      With node = this;
      for (;;) {
        w.append(node.contextExpr);
        if (node.optionalVars != null) {
          w.append(" as ").append(node.optionalVars);
        }
        if (node.body.size() != 1 || !(node.body.get(0) instanceof With)) {
          break;
        }
        node = (With) node.body.get(0);
        w.append(", ");
      }
      return w.append(":").newline().suite(node.body);
    }
  }

  /** "raise" statement, "raise type, inst, tback". */
  public static class Raise extends Stmt {
    public final @Nullable Exp type;
    public final @Nullable Exp inst;
    public final @Nullable Exp tback;

    Raise(Pos pos, @Nullable Exp type, @Nullable Exp inst,
        @Nullable Exp tback) {
      super(pos, Op.RAISE);
      this.type = type;
      this.inst = inst;
      this.tback = tback;
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("raise");
      final List<Exp> expressions =
          Stream.of(type, inst, tback)
              .filter(Objects::nonNull)
              .collect(ImmutableList.toImmutableList());
      if (!expressions.isEmpty()) {
        w.append(" ").list(expressions, ", ", false, true, true);
      }
      return w.newline();
    }
  }

  /** "try" statement with "except" handlers and an optional "else"
   * clause. */
  public static class TryExcept extends Stmt {
    public final List<Stmt> body;
    public final List<ExceptHandler> handlers;
    public final List<Stmt> orElse;

    TryExcept(Pos pos, ImmutableList<Stmt> body,
        ImmutableList<ExceptHandler> handlers, ImmutableList<Stmt> orElse) {
      super(pos, Op.TRY_EXCEPT);
      this.body = requireNonNull(body);
      this.handlers = requireNonNull(handlers);
      this.orElse = requireNonNull(orElse);
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("try:").newline().suite(body);
      handlers.forEach(w::append);
      return w.orElse(orElse);
    }
  }

  /**
   * "try" statement with a "finally" clause.
   *
   * <p>If the body is just a {@link TryExcept}, its handlers are written as
   * part of the same statement.
   */
  public static class TryFinally extends Stmt {
    public final List<Stmt> body;
    public final List<Stmt> finalBody;

    TryFinally(Pos pos, ImmutableList<Stmt> body,
        ImmutableList<Stmt> finalBody) {
      super(pos, Op.TRY_FINALLY);
      this.body = requireNonNull(body);
      this.finalBody = requireNonNull(finalBody);
    }

    @Override AstWriter write(AstWriter w) {
      if (body.size() == 1 && body.get(0) instanceof TryExcept) {
        w.append(body.get(0));
      } else {
        w.indent().append("try:").newline().suite(body);
      }
      return w.indent().append("finally:").newline().suite(finalBody);
    }
  }

  /** "assert" statement, with an optional message. */
  public static class Assert extends Stmt {
    public final Exp test;
    public final @Nullable Exp msg;

    Assert(Pos pos, Exp test, @Nullable Exp msg) {
      super(pos, Op.ASSERT);
      this.test = requireNonNull(test);
      this.msg = msg;
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("assert ").append(test);
      if (msg != null) {
        w.append(", ").append(msg);
      }
      return w.newline();
    }
  }

  /** "import a, b as c" statement. */
  public static class Import extends Stmt {
    public final List<Alias> names;

    Import(Pos pos, ImmutableList<Alias> names) {
      super(pos, Op.IMPORT);
      checkArgument(!names.isEmpty(), "import has no names");
      this.names = names;
    }

    @Override AstWriter write(AstWriter w) {
      // "import" does not allow its names to be parenthesized
      return w.indent().append("import ")
          .list(names, ", ", false, true, true)
          .newline();
    }
  }

  /**
   * "from module import a, b as c" statement.
   *
   * <p>Writing "from __future__ import unicode_literals" changes how
   * subsequent native strings are written; see {@link Str}.
   */
  public static class ImportFrom extends Stmt {
    public final @Nullable String module;
    public final List<Alias> names;
    /** Number of leading dots, for a relative import. */
    public final int level;

    ImportFrom(Pos pos, @Nullable String module, ImmutableList<Alias> names,
        int level) {
      super(pos, Op.IMPORT_FROM);
      checkArgument(!names.isEmpty(), "import has no names");
      checkArgument(level >= 0, "negative level %s", level);
      this.module = module;
      this.names = names;
      this.level = level;
    }

    /** Returns whether this is "from __future__ import unicode_literals". */
    public boolean isUnicodeLiterals() {
      return "__future__".equals(module)
          && names.stream().anyMatch(a -> a.name.equals("unicode_literals"));
    }

    @Override AstWriter write(AstWriter w) {
      if (isUnicodeLiterals()) {
        w.enableUnicodeLiterals();
      }
      w.indent().append("from ").append(Strings.repeat(".", level));
      if (module != null) {
        w.append(module);
      }
      return w.append(" import ").list(names).newline();
    }
  }

  /** "exec" statement, "exec body in globals, locals". */
  public static class Exec extends Stmt {
    public final Exp body;
    public final @Nullable Exp globals;
    public final @Nullable Exp locals;

    Exec(Pos pos, Exp body, @Nullable Exp globals, @Nullable Exp locals) {
      super(pos, Op.EXEC);
      this.body = requireNonNull(body);
      this.globals = globals;
      this.locals = locals;
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("exec ").append(body);
      if (globals != null) {
        w.append(" in ").append(globals);
      }
      if (locals != null) {
        w.append(", ").append(locals);
      }
      return w.newline();
    }
  }

  /** "global a, b" statement. */
  public static class Global extends Stmt {
    public final List<String> names;

    Global(Pos pos, ImmutableList<String> names) {
      super(pos, Op.GLOBAL);
      checkArgument(!names.isEmpty(), "global has no names");
      this.names = names;
    }

    @Override AstWriter write(AstWriter w) {
      final List<Name> nameList =
          names.stream()
              .map(name -> new Name(pos, name))
              .collect(ImmutableList.toImmutableList());
      return w.indent().append("global ")
          .list(nameList, ", ", false, true, true)
          .newline();
    }
  }

  /** Statement that consists of an expression, typically a call. */
  public static class Expr extends Stmt {
    public final Exp value;

    Expr(Pos pos, Exp value) {
      super(pos, Op.EXPR);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append(value).newline();
    }
  }

  /** "pass" statement. */
  public static class Pass extends Stmt {
    Pass(Pos pos) {
      super(pos, Op.PASS);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append("pass").newline();
    }
  }

  /** "break" statement. */
  public static class Break extends Stmt {
    Break(Pos pos) {
      super(pos, Op.BREAK);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append("break").newline();
    }
  }

  /** "continue" statement. */
  public static class Continue extends Stmt {
    Continue(Pos pos) {
      super(pos, Op.CONTINUE);
    }

    @Override AstWriter write(AstWriter w) {
      return w.indent().append("continue").newline();
    }
  }

  // expressions

  /** Base class of expressions. An expression writes text on the current
   * line, or breaks a list over several lines if it is too long. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /**
   * Chain of "and" or "or" operators.
   *
   * <p>A nested chain is parenthesized if it binds no tighter than its
   * parent, so that "a or (b or c)" keeps its shape.
   */
  public static class BoolOp extends Exp {
    public final List<Exp> values;

    BoolOp(Pos pos, Op op, ImmutableList<Exp> values) {
      super(pos, op);
      this.values = requireNonNull(values);
    }

    @Override AstWriter write(AstWriter w) {
      final String symbol = w.symbol(this, op, Op.Kind.BOOLEAN);
      return w.parenthesize(precedence() <= w.precedence(w.parent()), () ->
          w.list(values, " " + symbol + " ", true, true, false));
    }
  }

  /** Binary operator, such as "a + b" or "a ** b". */
  public static class BinOp extends Exp {
    public final Exp left;
    public final Exp right;

    BinOp(Pos pos, Exp left, Op op, Exp right) {
      super(pos, op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override AstWriter write(AstWriter w) {
      final String symbol = w.symbol(this, op, Op.Kind.BINARY);
      return w.parenthesize(needsParens(w.parent()), () ->
          w.append(left).append(" ").append(symbol).append(" ")
              .append(right));
    }

    private boolean needsParens(@Nullable AstNode parent) {
      final int parentPrecedence = parent == null ? -1 : parent.precedence();
      if (precedence() != parentPrecedence) {
        return precedence() < parentPrecedence;
      }
      if (!(parent instanceof BinOp)) {
        return false;
      }
      // Same precedence. Parenthesize the operand on the side that the
      // operator does not associate towards: "(a ** b) ** c", "a - (b - c)".
      final BinOp binOp = (BinOp) parent;
      return op.leftAssociative ? binOp.right == this : binOp.left == this;
    }
  }

  /** Unary operator, such as "-a" or "not a". */
  public static class UnaryOp extends Exp {
    public final Exp operand;

    UnaryOp(Pos pos, Op op, Exp operand) {
      super(pos, op);
      this.operand = requireNonNull(operand);
    }

    @Override AstWriter write(AstWriter w) {
      final String symbol = w.symbol(this, op, Op.Kind.UNARY);
      return w.parenthesize(precedence() < w.precedence(w.parent()), () ->
          w.append(symbol).append(operand));
    }
  }

  /** Anonymous function, "lambda x: x + 1". */
  public static class Lambda extends Exp {
    public final Arguments args;
    public final Exp body;

    Lambda(Pos pos, Arguments args, Exp body) {
      super(pos, Op.LAMBDA);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      final AstNode parent = w.parent();
      final boolean parens = isOperator(parent)
          || isTrailer(parent)
          || parent instanceof IfExp
          || parent instanceof Comprehension;
      return w.parenthesize(parens, () -> {
        w.append("lambda");
        if (!args.isEmpty()) {
          w.append(" ");
        }
        w.append(args).append(": ").append(body);
      });
    }
  }

  /** Conditional expression, "a if test else b". */
  public static class IfExp extends Exp {
    public final Exp test;
    public final Exp body;
    public final Exp orElse;

    IfExp(Pos pos, Exp test, Exp body, Exp orElse) {
      super(pos, Op.IF_EXP);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    @Override AstWriter write(AstWriter w) {
      final AstNode parent = w.parent();
      final boolean parens = isOperator(parent)
          || isTrailer(parent)
          || parent instanceof Comprehension
          || parent instanceof IfExp
              && (((IfExp) parent).test == this
                  || ((IfExp) parent).body == this);
      return w.parenthesize(parens, () ->
          w.append(body).append(" if ").append(test)
              .append(" else ").append(orElse));
    }
  }

  /** Dictionary display, "{k: v, ...}". */
  public static class Dict extends Exp {
    public final List<Exp> keys;
    public final List<Exp> values;

    Dict(Pos pos, ImmutableList<Exp> keys, ImmutableList<Exp> values) {
      super(pos, Op.DICT);
      checkArgument(keys.size() == values.size(),
          "%s keys but %s values", keys.size(), values.size());
      this.keys = keys;
      this.values = values;
    }

    @Override AstWriter write(AstWriter w) {
      final ImmutableList.Builder<KeyValuePair> pairs = ImmutableList.builder();
      for (int i = 0; i < keys.size(); i++) {
        pairs.add(new KeyValuePair(keys.get(i).pos, keys.get(i), values.get(i)));
      }
      return w.append("{")
          .list(pairs.build(), ", ", true, false, true)
          .append("}");
    }
  }

  /** Set display, "{a, b}". */
  public static class SetExp extends Exp {
    public final List<Exp> elts;

    SetExp(Pos pos, ImmutableList<Exp> elts) {
      super(pos, Op.SET);
      this.elts = requireNonNull(elts);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("{").list(elts, ", ", true, false, true).append("}");
    }
  }

  /** List display, "[a, b]". */
  public static class ListExp extends Exp {
    public final List<Exp> elts;

    ListExp(Pos pos, ImmutableList<Exp> elts) {
      super(pos, Op.LIST);
      this.elts = requireNonNull(elts);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("[").list(elts, ", ", true, false, true).append("]");
    }
  }

  /**
   * Tuple, "(a, b)".
   *
   * <p>The parentheses are omitted directly under a statement that allows a
   * bare list (expression statement, assignment, "return") or under
   * "yield".
   */
  public static class Tuple extends Exp {
    public final List<Exp> elts;

    Tuple(Pos pos, ImmutableList<Exp> elts) {
      super(pos, Op.TUPLE);
      this.elts = requireNonNull(elts);
    }

    @Override AstWriter write(AstWriter w) {
      if (elts.isEmpty()) {
        return w.append("()");
      }
      final AstNode parent = w.parent();
      final boolean parens = !(parent instanceof Expr
          || parent instanceof Assign
          || parent instanceof AugAssign
          || parent instanceof Return
          || parent instanceof Yield);
      return w.parenthesize(parens, () -> {
        if (elts.size() == 1) {
          w.append(elts.get(0)).append(",");
        } else {
          w.list(elts, ", ", true, !parens, true);
        }
      });
    }
  }

  /** Writes a comprehension: the element followed by its "for" clauses. */
  private static AstWriter comprehension(AstWriter w, String open,
      AstNode element, List<Comprehension> generators, String close) {
    final List<AstNode> nodes = ImmutableList.<AstNode>builder()
        .add(element)
        .addAll(generators)
        .build();
    return w.append(open).list(nodes, " ", true, false, true).append(close);
  }

  /** List comprehension, "[x for x in xs]". */
  public static class ListComp extends Exp {
    public final Exp elt;
    public final List<Comprehension> generators;

    ListComp(Pos pos, Exp elt, ImmutableList<Comprehension> generators) {
      super(pos, Op.LIST_COMP);
      this.elt = requireNonNull(elt);
      this.generators = requireNonNull(generators);
    }

    @Override AstWriter write(AstWriter w) {
      return comprehension(w, "[", elt, generators, "]");
    }
  }

  /** Set comprehension, "{x for x in xs}". */
  public static class SetComp extends Exp {
    public final Exp elt;
    public final List<Comprehension> generators;

    SetComp(Pos pos, Exp elt, ImmutableList<Comprehension> generators) {
      super(pos, Op.SET_COMP);
      this.elt = requireNonNull(elt);
      this.generators = requireNonNull(generators);
    }

    @Override AstWriter write(AstWriter w) {
      return comprehension(w, "{", elt, generators, "}");
    }
  }

  /** Dictionary comprehension, "{k: v for k, v in xs}". */
  public static class DictComp extends Exp {
    public final Exp key;
    public final Exp value;
    public final List<Comprehension> generators;

    DictComp(Pos pos, Exp key, Exp value,
        ImmutableList<Comprehension> generators) {
      super(pos, Op.DICT_COMP);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
      this.generators = requireNonNull(generators);
    }

    @Override AstWriter write(AstWriter w) {
      return comprehension(w, "{", new KeyValuePair(key.pos, key, value),
          generators, "}");
    }
  }

  /** Generator expression, "(x for x in xs)". */
  public static class GeneratorExp extends Exp {
    public final Exp elt;
    public final List<Comprehension> generators;

    GeneratorExp(Pos pos, Exp elt, ImmutableList<Comprehension> generators) {
      super(pos, Op.GENERATOR_EXP);
      this.elt = requireNonNull(elt);
      this.generators = requireNonNull(generators);
    }

    @Override AstWriter write(AstWriter w) {
      return comprehension(w, "(", elt, generators, ")");
    }
  }

  /** "yield" expression, with an optional value. */
  public static class Yield extends Exp {
    public final @Nullable Exp value;

    Yield(Pos pos, @Nullable Exp value) {
      super(pos, Op.YIELD);
      this.value = value;
    }

    @Override AstWriter write(AstWriter w) {
      final AstNode parent = w.parent();
      final boolean parens = !(parent instanceof Expr
          || parent instanceof Assign
          || parent instanceof AugAssign);
      return w.parenthesize(parens, () -> {
        w.append("yield");
        if (value != null) {
          w.append(" ").append(value);
        }
      });
    }
  }

  /** Chain of comparisons, "a < b <= c". */
  public static class Compare extends Exp {
    public final Exp left;
    public final List<Op> ops;
    public final List<Exp> comparators;

    Compare(Pos pos, Exp left, ImmutableList<Op> ops,
        ImmutableList<Exp> comparators) {
      super(pos, Op.COMPARE);
      checkArgument(!ops.isEmpty(), "comparison has no operators");
      checkArgument(ops.size() == comparators.size(),
          "%s operators but %s comparators", ops.size(), comparators.size());
      this.left = requireNonNull(left);
      this.ops = ops;
      this.comparators = comparators;
    }

    @Override AstWriter write(AstWriter w) {
      final List<String> symbols =
          ops.stream()
              .map(op -> w.symbol(this, op, Op.Kind.COMPARISON))
              .collect(ImmutableList.toImmutableList());
      return w.parenthesize(precedence() <= w.precedence(w.parent()), () -> {
        w.append(left);
        for (int i = 0; i < symbols.size(); i++) {
          w.append(" ").append(symbols.get(i)).append(" ")
              .append(comparators.get(i));
        }
      });
    }
  }

  /** Function call, "f(a, k=v, *args, **kwargs)". */
  public static class Call extends Exp {
    public final Exp func;
    public final List<Exp> args;
    public final List<Keyword> keywords;
    public final @Nullable Exp starArgs;
    public final @Nullable Exp kwArgs;

    Call(Pos pos, Exp func, ImmutableList<Exp> args,
        ImmutableList<Keyword> keywords, @Nullable Exp starArgs,
        @Nullable Exp kwArgs) {
      super(pos, Op.CALL);
      this.func = requireNonNull(func);
      this.args = requireNonNull(args);
      this.keywords = requireNonNull(keywords);
      this.starArgs = starArgs;
      this.kwArgs = kwArgs;
    }

    @Override AstWriter write(AstWriter w) {
      final ImmutableList.Builder<AstNode> list = ImmutableList.builder();
      list.addAll(args);
      list.addAll(keywords);
      if (starArgs != null) {
        list.add(new StarArg(starArgs.pos, starArgs));
      }
      if (kwArgs != null) {
        list.add(new DoubleStarArg(kwArgs.pos, kwArgs));
      }
      return w.append(func)
          .append("(")
          .append(new CallArgs(pos, list.build()))
          .append(")");
    }
  }

  /** Backquoted representation, "`a`". */
  public static class Repr extends Exp {
    public final Exp value;

    Repr(Pos pos, Exp value) {
      super(pos, Op.REPR);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("`").append(value).append("`");
    }
  }

  /**
   * Numeric literal.
   *
   * <p>The parser folds "-1" into a single literal, so a negative literal
   * is grouped as if it were a unary minus: "(-1) ** 2".
   */
  public static class Num extends Exp {
    public final Number n;

    Num(Pos pos, Number n) {
      super(pos, Op.NUM);
      checkArgument(Reprs.isSupportedNumber(n), "unsupported number type %s",
          n.getClass());
      this.n = n;
    }

    boolean isNegative() {
      return Reprs.number(n).startsWith("-");
    }

    @Override int precedence() {
      return isNegative() ? Op.U_SUB.precedence : super.precedence();
    }

    @Override AstWriter write(AstWriter w) {
      final AstNode parent = w.parent();
      final boolean parens =
          isNegative() && precedence() < w.precedence(parent)
              || Reprs.isIntegral(n) && parent instanceof Attribute;
      return w.parenthesize(parens, () -> w.append(Reprs.number(n)));
    }
  }

  /**
   * String literal.
   *
   * <p>A {@link Kind#NATIVE} string written after
   * "from __future__ import unicode_literals" has a "b" prefix, so that it
   * is not read back as unicode. Strings written before the directive are
   * not affected.
   */
  public static class Str extends Exp {
    public final String s;
    public final Kind kind;

    Str(Pos pos, String s, Kind kind) {
      super(pos, Op.STR);
      this.s = requireNonNull(s);
      this.kind = requireNonNull(kind);
      checkArgument(kind == Kind.UNICODE
              || s.chars().allMatch(c -> c <= 0xff),
          "native string must contain only byte values");
    }

    @Override AstWriter write(AstWriter w) {
      if (kind == Kind.NATIVE && w.unicodeLiterals()) {
        w.append("b");
      }
      return w.append(Reprs.string(s, kind == Kind.UNICODE));
    }

    /** Kind of string. */
    public enum Kind {
      /** Native string, a sequence of bytes. */
      NATIVE,
      /** Unicode string. */
      UNICODE
    }
  }

  /** Attribute access, "a.b". */
  public static class Attribute extends Exp {
    public final Exp value;
    public final String attr;

    Attribute(Pos pos, Exp value, String attr) {
      super(pos, Op.ATTRIBUTE);
      this.value = requireNonNull(value);
      this.attr = requireNonNull(attr);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(value).append(".").append(attr);
    }
  }

  /** Subscript, "a[i]". */
  public static class Subscript extends Exp {
    public final Exp value;
    public final SliceKind slice;

    Subscript(Pos pos, Exp value, SliceKind slice) {
      super(pos, Op.SUBSCRIPT);
      this.value = requireNonNull(value);
      this.slice = requireNonNull(slice);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(value).append("[").append(slice).append("]");
    }
  }

  /** Identifier. */
  public static class Name extends Exp {
    public final String id;

    Name(Pos pos, String id) {
      super(pos, Op.NAME);
      this.id = requireNonNull(id);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(id);
    }
  }

  // slices

  /** Base class for the contents of a subscript. */
  public abstract static class SliceKind extends AstNode {
    SliceKind(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** "..." in a subscript. */
  public static class Ellipsis extends SliceKind {
    Ellipsis(Pos pos) {
      super(pos, Op.ELLIPSIS);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("...");
    }
  }

  /** Slice, "lower:upper:step", each part optional. */
  public static class Slice extends SliceKind {
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;
    public final @Nullable Exp step;

    Slice(Pos pos, @Nullable Exp lower, @Nullable Exp upper,
        @Nullable Exp step) {
      super(pos, Op.SLICE);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override AstWriter write(AstWriter w) {
      if (lower != null) {
        w.append(lower);
      }
      w.append(":");
      if (upper != null) {
        w.append(upper);
      }
      if (step != null) {
        w.append(":").append(step);
      }
      return w;
    }
  }

  /** Several dimensions of a subscript, "a[1:2, 3]". */
  public static class ExtSlice extends SliceKind {
    public final List<SliceKind> dims;

    ExtSlice(Pos pos, ImmutableList<SliceKind> dims) {
      super(pos, Op.EXT_SLICE);
      this.dims = requireNonNull(dims);
    }

    @Override AstWriter write(AstWriter w) {
      if (dims.size() == 1) {
        // "a[1:2,]"; without the comma it reads back as a plain slice
        return w.append(dims.get(0)).append(",");
      }
      return w.list(dims, ", ", true, false, true);
    }
  }

  /** Subscript by a single value, "a[i]". */
  public static class Index extends SliceKind {
    public final Exp value;

    Index(Pos pos, Exp value) {
      super(pos, Op.INDEX);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(value);
    }
  }

  // miscellaneous

  /** One "for ... in ... if ..." clause of a comprehension. */
  public static class Comprehension extends AstNode {
    public final Exp target;
    public final Exp iter;
    public final List<Exp> ifs;

    Comprehension(Pos pos, Exp target, Exp iter, ImmutableList<Exp> ifs) {
      super(pos, Op.COMPREHENSION);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.ifs = requireNonNull(ifs);
    }

    @Override AstWriter write(AstWriter w) {
      w.append("for ").append(target).append(" in ").append(iter);
      for (Exp condition : ifs) {
        w.append(" if ").append(condition);
      }
      return w;
    }
  }

  /** "except type as name:" clause of a {@link TryExcept}. */
  public static class ExceptHandler extends AstNode {
    public final @Nullable Exp type;
    public final @Nullable Exp name;
    public final List<Stmt> body;

    ExceptHandler(Pos pos, @Nullable Exp type, @Nullable Exp name,
        ImmutableList<Stmt> body) {
      super(pos, Op.EXCEPT_HANDLER);
      checkArgument(name == null || type != null,
          "handler with a name must have a type");
      this.type = type;
      this.name = name;
      this.body = requireNonNull(body);
    }

    @Override AstWriter write(AstWriter w) {
      w.indent().append("except");
      if (type != null) {
        w.append(" ").append(type);
        if (name != null) {
          w.append(" as ").append(name);
        }
      }
      return w.append(":").newline().suite(body);
    }
  }

  /**
   * Parameters of a function or lambda.
   *
   * <p>The last {@code defaults.size()} parameters have default values.
   */
  public static class Arguments extends AstNode {
    public final List<Exp> args;
    public final @Nullable String vararg;
    public final @Nullable String kwarg;
    public final List<Exp> defaults;

    Arguments(Pos pos, ImmutableList<Exp> args, @Nullable String vararg,
        @Nullable String kwarg, ImmutableList<Exp> defaults) {
      super(pos, Op.ARGUMENTS);
      checkArgument(defaults.size() <= args.size(),
          "more defaults than parameters");
      this.args = args;
      this.vararg = vararg;
      this.kwarg = kwarg;
      this.defaults = defaults;
    }

    /** Returns whether there are no parameters. */
    public boolean isEmpty() {
      return args.isEmpty() && vararg == null && kwarg == null;
    }

    @Override AstWriter write(AstWriter w) {
      final int required = args.size() - defaults.size();
      final ImmutableList.Builder<AstNode> list = ImmutableList.builder();
      list.addAll(args.subList(0, required));
      for (int i = required; i < args.size(); i++) {
        final Exp arg = args.get(i);
        list.add(new KeywordArg(arg.pos, arg, defaults.get(i - required)));
      }
      if (vararg != null) {
        list.add(new StarArg(pos, new Name(pos, vararg)));
      }
      if (kwarg != null) {
        list.add(new DoubleStarArg(pos, new Name(pos, kwarg)));
      }
      final List<AstNode> nodes = list.build();
      if (nodes.isEmpty()) {
        return w;
      }
      // A lambda's parameters must be on one line. A separator is not allowed
      // after "*args" or "**kwargs".
      return w.list(nodes, ", ", !(w.parent() instanceof Lambda), false,
          false);
    }
  }

  /** Keyword argument of a call, "k=v". */
  public static class Keyword extends AstNode {
    public final String arg;
    public final Exp value;

    Keyword(Pos pos, String arg, Exp value) {
      super(pos, Op.KEYWORD);
      this.arg = requireNonNull(arg);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(arg).append("=").append(value);
    }
  }

  /** Name in an import statement, "a.b as c". */
  public static class Alias extends AstNode {
    public final String name;
    public final @Nullable String asName;

    Alias(Pos pos, String name, @Nullable String asName) {
      super(pos, Op.ALIAS);
      this.name = requireNonNull(name);
      this.asName = asName;
    }

    @Override AstWriter write(AstWriter w) {
      w.append(name);
      if (asName != null) {
        w.append(" as ").append(asName);
      }
      return w;
    }
  }

  // synthetic nodes, created only while writing

  /** Entry "k: v" of a dictionary display or comprehension. */
  public static class KeyValuePair extends AstNode {
    public final Exp key;
    public final Exp value;

    KeyValuePair(Pos pos, Exp key, Exp value) {
      super(pos, Op.KEY_VALUE_PAIR);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(key).append(": ").append(value);
    }
  }

  /** "*args" in a call or parameter list. */
  public static class StarArg extends AstNode {
    public final Exp arg;

    StarArg(Pos pos, Exp arg) {
      super(pos, Op.STAR_ARG);
      this.arg = requireNonNull(arg);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("*").append(arg);
    }
  }

  /** "**kwargs" in a call or parameter list. */
  public static class DoubleStarArg extends AstNode {
    public final Exp arg;

    DoubleStarArg(Pos pos, Exp arg) {
      super(pos, Op.DOUBLE_STAR_ARG);
      this.arg = requireNonNull(arg);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append("**").append(arg);
    }
  }

  /** Parameter with a default value, "x=1". */
  public static class KeywordArg extends AstNode {
    public final Exp arg;
    public final Exp value;

    KeywordArg(Pos pos, Exp arg, Exp value) {
      super(pos, Op.KEYWORD_ARG);
      this.arg = requireNonNull(arg);
      this.value = requireNonNull(value);
    }

    @Override AstWriter write(AstWriter w) {
      return w.append(arg).append("=").append(value);
    }
  }

  /** Arguments of a {@link Call}, between the parentheses. */
  public static class CallArgs extends AstNode {
    public final List<AstNode> args;

    CallArgs(Pos pos, ImmutableList<AstNode> args) {
      super(pos, Op.CALL_ARGS);
      this.args = requireNonNull(args);
    }

    @Override AstWriter write(AstWriter w) {
      if (args.isEmpty()) {
        return w;
      }
      // A separator is not allowed after "*args" or "**kwargs".
      return w.list(args, ", ", true, false, false);
    }
  }
}

// End Ast.java
