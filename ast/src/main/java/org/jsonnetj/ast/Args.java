// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.List;
import java.util.Optional;

/** Call-site arguments in source order. Positional arguments have no name. */
public record Args(List<Arg> args) {
  public record Arg(Optional<String> name, Expr value) {}

  public Args {
    args = List.copyOf(args);
  }

  public static Args of(Arg... args) {
    return new Args(List.of(args));
  }

  public static Arg positional(Expr value) {
    return new Arg(Optional.empty(), value);
  }

  public static Arg named(String name, Expr value) {
    return new Arg(Optional.of(name), value);
  }
}
