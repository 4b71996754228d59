// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.Optional;

/** An entry in the body of an object literal. */
public sealed interface Member {
  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitField(Field field);

    R visitBindStmt(BindStmt bindStmt);

    R visitAssertStmt(AssertStmt assertStmt);
  }

  /**
   * Whether a field is included when an object is enumerated or serialized. Hidden fields stay
   * reachable by name.
   */
  enum Visibility {
    /** Declared with {@code :}. */
    NORMAL,
    /** Declared with {@code ::}. */
    HIDDEN,
    /** Declared with {@code :::}; makes a field hidden in a base object visible again. */
    UNHIDE;

    public boolean isVisible() {
      return this != HIDDEN;
    }
  }

  /**
   * A field declaration. {@code plus} marks {@code +:} fields, which are merged with the field
   * of the same name in the base object rather than replacing it. With {@code params} present the
   * field is a method.
   */
  record Field(
      int offset,
      FieldName fieldName,
      boolean plus,
      Optional<Params> params,
      Visibility visibility,
      Expr rhs)
      implements Member {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitField(this);
    }
  }

  /** An object-local binding. */
  record BindStmt(Bind bind) implements Member {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBindStmt(this);
    }
  }

  record AssertStmt(Expr condition, Optional<Expr> message) implements Member {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssertStmt(this);
    }
  }
}
