// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps node offsets back to line and column numbers for diagnostics.
 *
 * <p>Offsets count code points, matching the indices of the ANTLR char stream the parser reads.
 */
public class SourceMap {
  public record Position(int line, int column) {
    @Override
    public String toString() {
      return "%d:%d".formatted(line, column);
    }
  }

  private final String filename;
  private final int[] codePoints;
  private final int length;
  private final List<Integer> lineStarts;

  private SourceMap(String filename, int[] codePoints, List<Integer> lineStarts) {
    this.filename = filename;
    this.codePoints = codePoints;
    this.length = codePoints.length;
    this.lineStarts = lineStarts;
  }

  public static SourceMap of(String filename, String source) {
    List<Integer> lineStarts = new ArrayList<>();
    lineStarts.add(0);
    int[] codePoints = source.codePoints().toArray();
    for (int i = 0; i < codePoints.length; ++i) {
      if (codePoints[i] == '\n') {
        lineStarts.add(i + 1);
      }
    }
    return new SourceMap(filename, codePoints, List.copyOf(lineStarts));
  }

  public String filename() {
    return filename;
  }

  /** Returns the 1-based line and 1-based column of {@code offset}. */
  public Position position(int offset) {
    if (offset < 0 || offset > length) {
      throw new IndexOutOfBoundsException(
          "Offset %d outside of %s (length %d)".formatted(offset, filename, length));
    }
    int low = 0;
    int high = lineStarts.size() - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (lineStarts.get(mid) <= offset) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return new Position(low + 1, offset - lineStarts.get(low) + 1);
  }

  /** Returns the offset of 1-based {@code line} and 1-based {@code column}, capped at the end. */
  public int offset(int line, int column) {
    if (line < 1 || line > lineStarts.size()) {
      throw new IndexOutOfBoundsException(
          "Line %d outside of %s (%d lines)".formatted(line, filename, lineStarts.size()));
    }
    return Math.min(lineStarts.get(line - 1) + Math.max(column - 1, 0), length);
  }

  /** Returns the line containing {@code offset} with ">>>" inserted just before it. */
  public String markedLine(int offset) {
    Position position = position(offset);
    int start = lineStarts.get(position.line() - 1);
    int end = position.line() < lineStarts.size() ? lineStarts.get(position.line()) - 1 : length;
    if (end > start && codePoints[end - 1] == '\r') {
      end = Math.max(end - 1, offset);
    }
    return new String(codePoints, start, offset - start)
        + ">>>"
        + new String(codePoints, offset, Math.max(end - offset, 0));
  }

  /** Formats a diagnostic as {@code filename:line:column: message}. */
  public String describe(int offset, String message) {
    return "%s:%s: %s".formatted(filename, position(offset), message);
  }
}
