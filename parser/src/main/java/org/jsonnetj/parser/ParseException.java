// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.parser;

/**
 * Syntax error located by code-point offset.
 *
 * <p>The message reads {@code filename:line:column: detail}, the same form {@link
 * SourceMap#describe} gives resolver errors, followed by the offending line with ">>>" marking the
 * error.
 */
public class ParseException extends RuntimeException {
  public final String filename;
  public final int offset;
  public final int line;
  public final int column;
  public final String detail;

  public ParseException(SourceMap sourceMap, int offset, String detail) {
    super(sourceMap.describe(offset, detail) + "\n" + sourceMap.markedLine(offset));
    var position = sourceMap.position(offset);
    this.filename = sourceMap.filename();
    this.offset = offset;
    this.line = position.line();
    this.column = position.column();
    this.detail = detail;
  }
}
