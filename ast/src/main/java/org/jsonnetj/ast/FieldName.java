// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

/** Object key: a literal known at parse time, or an expression computed during evaluation. */
public sealed interface FieldName {
  record Fixed(String value) implements FieldName {}

  record Dyn(Expr expr) implements FieldName {}
}
