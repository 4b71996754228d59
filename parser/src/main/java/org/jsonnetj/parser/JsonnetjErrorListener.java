// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/** Turns the first lexer or parser error into a {@link ParseException}. */
class JsonnetjErrorListener extends BaseErrorListener {
  private final SourceMap sourceMap;

  JsonnetjErrorListener(SourceMap sourceMap) {
    this.sourceMap = sourceMap;
  }

  @Override
  public void syntaxError(
      Recognizer<?, ?> recognizer,
      Object offendingSymbol,
      int line,
      int charPositionInLine,
      String msg,
      RecognitionException e) {
    // Lexer errors have no offending token, only the position where the bad token starts.
    int offset =
        offendingSymbol instanceof Token token && token.getStartIndex() >= 0
            ? token.getStartIndex()
            : sourceMap.offset(line, charPositionInLine + 1);
    throw new ParseException(sourceMap, offset, "Syntax error: " + msg);
  }
}
