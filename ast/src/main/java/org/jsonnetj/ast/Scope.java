// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Names visible at a point in the program, mapped to their frame slots.
 *
 * <p>A scope's depth is the number of slots bound along the path from the root, so the next
 * binding always takes slot {@code depth()}. Sibling scopes reuse the same slots.
 */
final class Scope {
  static final Scope EMPTY = new Scope(Map.of(), 0);

  private final Map<String, Integer> slots;
  private final int depth;

  private Scope(Map<String, Integer> slots, int depth) {
    this.slots = slots;
    this.depth = depth;
  }

  int depth() {
    return depth;
  }

  Optional<Integer> lookup(String name) {
    return Optional.ofNullable(slots.get(name));
  }

  /** Returns a child scope binding {@code names} to consecutive slots starting at depth. */
  Scope bind(List<String> names) {
    var childSlots = new HashMap<>(slots);
    int slot = depth;
    for (String name : names) {
      childSlots.put(name, slot++);
    }
    return new Scope(childSlots, slot);
  }
}
