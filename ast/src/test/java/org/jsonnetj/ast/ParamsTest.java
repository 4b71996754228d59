// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ParamsTest {

  @Test
  void requiredAndDefaultedSlotsPartitionAllSlots() throws Exception {
    var two = new Expr.Num(0, 2.0);
    var params =
        Params.of(
            Params.Param.required("a", 0),
            Params.Param.withDefault("b", two, 1),
            Params.Param.required("c", 2));

    assertEquals(3, params.size());
    assertEquals(Set.of(0, 2), params.requiredSlots());
    assertEquals(List.of(new Params.DefaultedSlot(1, two)), params.defaultedSlots());
    assertEquals(Set.of(0, 1, 2), params.allSlots());
    assertEquals(List.of(0, 1, 2), List.copyOf(params.allSlots()));
    assertEquals(Map.of("a", 0, "b", 1, "c", 2), params.nameToSlot());
    assertEquals(List.of("a", "b", "c"), List.copyOf(params.nameToSlot().keySet()));
  }

  @Test
  void slotsMayStartAboveZero() throws Exception {
    var params = Params.of(Params.Param.required("x", 3), Params.Param.required("y", 4));
    assertEquals(Set.of(3, 4), params.allSlots());
    assertEquals(Set.of(3, 4), params.requiredSlots());
    assertTrue(params.defaultedSlots().isEmpty());
  }

  @Test
  void emptyParams() throws Exception {
    var params = new Params(List.of());
    assertEquals(0, params.size());
    assertTrue(params.allSlots().isEmpty());
    assertTrue(params.nameToSlot().isEmpty());
    assertEquals("Params()", params.toString());
  }

  @Test
  void duplicateName() throws Exception {
    var e =
        assertThrows(
            AstException.class,
            () -> Params.of(Params.Param.required("x", 0), Params.Param.required("x", 1)));
    assertEquals(AstException.Kind.DUPLICATE_PARAMETER_NAME, e.kind);
    assertEquals(-1, e.offset);
    assertTrue(e.getMessage().contains("x"));
  }

  @Test
  void nonConsecutiveSlots() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () -> Params.of(Params.Param.required("a", 0), Params.Param.required("b", 2)));
  }

  @Test
  void derivedViewsAreUnmodifiable() throws Exception {
    var params = Params.of(Params.Param.required("a", 0));
    assertThrows(UnsupportedOperationException.class, () -> params.requiredSlots().add(1));
    assertThrows(UnsupportedOperationException.class, () -> params.allSlots().clear());
    assertThrows(UnsupportedOperationException.class, () -> params.nameToSlot().put("b", 1));
    assertThrows(
        UnsupportedOperationException.class,
        () -> params.entries().add(Params.Param.required("b", 1)));
  }

  @Test
  void equality() throws Exception {
    var first = Params.of(Params.Param.withDefault("a", new Expr.Null(5), 0));
    var second = Params.of(Params.Param.withDefault("a", new Expr.Null(5), 0));
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, Params.of(Params.Param.required("a", 0)));
    assertEquals("Params(a=Null[offset=5]@0)", first.toString());
  }
}
