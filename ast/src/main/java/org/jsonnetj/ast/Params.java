// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import static java.util.stream.Collectors.joining;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Formal parameters of a function, in declaration order.
 *
 * <p>Slots are consecutive in declaration order, starting at the first free slot of the frame
 * the function body runs in. The lookup tables an evaluator needs for binding call arguments are
 * derived once here and exposed as unmodifiable views.
 */
public final class Params {
  public record Param(String name, Optional<Expr> defaultExpr, int slot) {
    public static Param required(String name, int slot) {
      return new Param(name, Optional.empty(), slot);
    }

    public static Param withDefault(String name, Expr defaultExpr, int slot) {
      return new Param(name, Optional.of(defaultExpr), slot);
    }
  }

  public record DefaultedSlot(int slot, Expr defaultExpr) {}

  private final List<Param> entries;
  private final Map<String, Integer> nameToSlot;
  private final Set<Integer> requiredSlots;
  private final List<DefaultedSlot> defaultedSlots;
  private final Set<Integer> allSlots;

  /**
   * @throws AstException with kind {@code DUPLICATE_PARAMETER_NAME} if two entries share a name
   * @throws IllegalArgumentException if slots are not consecutive in declaration order
   */
  public Params(List<Param> entries) {
    this.entries = List.copyOf(entries);

    var names = new LinkedHashMap<String, Integer>();
    var required = new TreeSet<Integer>();
    var defaulted = new ArrayList<DefaultedSlot>();
    var all = new TreeSet<Integer>();
    for (int i = 0; i < this.entries.size(); ++i) {
      var param = this.entries.get(i);
      if (names.containsKey(param.name())) {
        throw new AstException(
            AstException.Kind.DUPLICATE_PARAMETER_NAME,
            -1,
            "Duplicate parameter name: " + param.name());
      }
      int expectedSlot = this.entries.get(0).slot() + i;
      if (param.slot() != expectedSlot) {
        throw new IllegalArgumentException(
            "Parameter '%s' has slot %d but slot %d was expected"
                .formatted(param.name(), param.slot(), expectedSlot));
      }
      names.put(param.name(), param.slot());
      all.add(param.slot());
      if (param.defaultExpr().isPresent()) {
        defaulted.add(new DefaultedSlot(param.slot(), param.defaultExpr().get()));
      } else {
        required.add(param.slot());
      }
    }

    this.nameToSlot = Collections.unmodifiableMap(names);
    this.requiredSlots = Collections.unmodifiableSortedSet(required);
    this.defaultedSlots = List.copyOf(defaulted);
    this.allSlots = Collections.unmodifiableSortedSet(all);
  }

  public static Params of(Param... entries) {
    return new Params(List.of(entries));
  }

  public List<Param> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public Map<String, Integer> nameToSlot() {
    return nameToSlot;
  }

  /** Slots of parameters that have no default and must be supplied by every call. */
  public Set<Integer> requiredSlots() {
    return requiredSlots;
  }

  public List<DefaultedSlot> defaultedSlots() {
    return defaultedSlots;
  }

  public Set<Integer> allSlots() {
    return allSlots;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Params params && entries.equals(params.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.stream()
        .map(
            p ->
                p.defaultExpr().isPresent()
                    ? "%s=%s@%d".formatted(p.name(), p.defaultExpr().get(), p.slot())
                    : "%s@%d".formatted(p.name(), p.slot()))
        .collect(joining(", ", "Params(", ")"));
  }
}
