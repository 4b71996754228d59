// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

/** Failure to construct a tree node. No partially built tree is returned alongside it. */
public class AstException extends RuntimeException {
  public enum Kind {
    DUPLICATE_PARAMETER_NAME,
    DUPLICATE_LOCAL_NAME,
    DUPLICATE_STATIC_FIELD_NAME,
    UNRESOLVED_IDENTIFIER
  }

  public final Kind kind;

  /** Source offset of the offending construct, or -1 if the node was built without one. */
  public final int offset;

  public AstException(Kind kind, int offset, String message) {
    super(message);
    this.kind = kind;
    this.offset = offset;
  }
}
