// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.List;
import java.util.Optional;

/**
 * Parsed syntax tree of a Jsonnet program.
 *
 * <p>The tree models the program mostly as written, except that local variable names are resolved
 * to integer slots in the evaluation frame. Every node carries the character offset of its
 * construct in the source, which is used only for diagnostics.
 *
 * <p>Nodes are immutable once built and may be shared freely between trees and threads.
 * Consumers match on variants through {@link Visitor}, which has no default methods.
 */
public sealed interface Expr {
  int offset();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitNull(Null expr);

    R visitTrue(True expr);

    R visitFalse(False expr);

    R visitSelf(Self expr);

    R visitSuper(Super expr);

    R visitDollar(Dollar expr);

    R visitStr(Str expr);

    R visitNum(Num expr);

    R visitId(Id expr);

    R visitArr(Arr expr);

    R visitObj(Obj expr);

    R visitParened(Parened expr);

    R visitUnaryOp(UnaryOp expr);

    R visitBinaryOp(BinaryOp expr);

    R visitAssertExpr(AssertExpr expr);

    R visitLocalExpr(LocalExpr expr);

    R visitImport(Import expr);

    R visitImportStr(ImportStr expr);

    R visitError(Error expr);

    R visitApply(Apply expr);

    R visitSelect(Select expr);

    R visitLookup(Lookup expr);

    R visitSlice(Slice expr);

    R visitFunction(Function expr);

    R visitIfElse(IfElse expr);

    R visitIfSpec(IfSpec expr);

    R visitForSpec(ForSpec expr);

    R visitComp(Comp expr);

    R visitObjExtend(ObjExtend expr);
  }

  record Null(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNull(this);
    }
  }

  record True(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTrue(this);
    }
  }

  record False(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFalse(this);
    }
  }

  record Self(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSelf(this);
    }
  }

  record Super(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSuper(this);
    }
  }

  /** The outermost object of the current file, written {@code $}. */
  record Dollar(int offset) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDollar(this);
    }
  }

  record Str(int offset, String value) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStr(this);
    }
  }

  record Num(int offset, double value) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNum(this);
    }
  }

  /** Reference to the variable bound at {@code slot} of the evaluation frame. */
  record Id(int offset, int slot) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitId(this);
    }
  }

  record Arr(int offset, List<Expr> elements) implements Expr {
    public Arr {
      elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArr(this);
    }
  }

  record Obj(int offset, ObjBody body) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitObj(this);
    }
  }

  /** Explicit parentheses, kept so that offsets line up with the source. */
  record Parened(int offset, Expr inner) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitParened(this);
    }
  }

  record UnaryOp(int offset, Op op, Expr operand) implements Expr {
    public enum Op {
      PLUS("+"),
      MINUS("-"),
      BIT_NOT("~"),
      NOT("!");

      private final String symbol;

      Op(String symbol) {
        this.symbol = symbol;
      }

      public String symbol() {
        return symbol;
      }
    }

    public static Op parse(String symbol) {
      for (var op : Op.values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      throw new IllegalArgumentException("Unsupported unary op: " + symbol);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryOp(this);
    }
  }

  record BinaryOp(int offset, Expr lhs, Op op, Expr rhs) implements Expr {
    public enum Op {
      MUL("*"),
      DIV("/"),
      MOD("%"),
      ADD("+"),
      SUB("-"),
      LSHIFT("<<"),
      RSHIFT(">>"),
      LT("<"),
      GT(">"),
      LT_EQ("<="),
      GT_EQ(">="),
      IN("in"),
      EQ("=="),
      NOT_EQ("!="),
      BIT_AND("&"),
      BIT_XOR("^"),
      BIT_OR("|"),
      AND("&&"),
      OR("||");

      private final String symbol;

      Op(String symbol) {
        this.symbol = symbol;
      }

      public String symbol() {
        return symbol;
      }
    }

    public static Op parse(String symbol) {
      for (var op : Op.values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      throw new IllegalArgumentException("Unsupported binary op: " + symbol);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryOp(this);
    }
  }

  record AssertExpr(int offset, Member.AssertStmt assertion, Expr returned) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssertExpr(this);
    }
  }

  record LocalExpr(int offset, List<Bind> bindings, Expr returned) implements Expr {
    public LocalExpr {
      bindings = List.copyOf(bindings);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLocalExpr(this);
    }
  }

  record Import(int offset, String path) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImport(this);
    }
  }

  record ImportStr(int offset, String path) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImportStr(this);
    }
  }

  record Error(int offset, Expr message) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitError(this);
    }
  }

  record Apply(int offset, Expr target, Args args) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitApply(this);
    }
  }

  record Select(int offset, Expr target, String fieldName) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSelect(this);
    }
  }

  record Lookup(int offset, Expr target, Expr index) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLookup(this);
    }
  }

  record Slice(
      int offset,
      Expr target,
      Optional<Expr> start,
      Optional<Expr> end,
      Optional<Expr> stride)
      implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSlice(this);
    }
  }

  record Function(int offset, Params params, Expr body) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }
  }

  record IfElse(int offset, Expr cond, Expr then, Optional<Expr> orElse) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIfElse(this);
    }
  }

  /** A link in the generator chain of an array or object comprehension. */
  sealed interface CompSpec extends Expr {}

  record IfSpec(int offset, Expr cond) implements CompSpec {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIfSpec(this);
    }
  }

  /** Binds {@code slot} to each element of {@code iterable} in turn. */
  record ForSpec(int offset, int slot, Expr iterable) implements CompSpec {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitForSpec(this);
    }
  }

  record Comp(int offset, Expr value, ForSpec first, List<CompSpec> rest) implements Expr {
    public Comp {
      rest = List.copyOf(rest);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitComp(this);
    }
  }

  /** {@code base { ... }}: the object {@code base} extended with the fields of {@code ext}. */
  record ObjExtend(int offset, Expr base, ObjBody ext) implements Expr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitObjExtend(this);
    }
  }
}
