// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.Optional;

/**
 * A {@code local} binding of {@code slot}. With {@code params} present the binding is sugar for a
 * function, as in {@code local f(x) = x * 2}.
 */
public record Bind(int offset, int slot, Optional<Params> params, Expr rhs) {}
