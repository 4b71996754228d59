// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonParser;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExprJsonTest {

  @Test
  void dumpLocalBinding() throws Exception {
    var tree = Resolver.parse("<test>", "local x = 1; x + 2", List.of());
    var expected =
        JsonParser.parseString(
            """
            {
              "kind": "LocalExpr",
              "offset": 0,
              "bindings": [
                {
                  "offset": 6,
                  "slot": 0,
                  "params": null,
                  "rhs": {"kind": "Num", "offset": 10, "value": 1.0}
                }
              ],
              "returned": {
                "kind": "BinaryOp",
                "offset": 15,
                "lhs": {"kind": "Id", "offset": 13, "slot": 0},
                "op": "+",
                "rhs": {"kind": "Num", "offset": 17, "value": 2.0}
              }
            }
            """);
    assertEquals(expected, ExprJson.dump(tree.root()));
  }

  @Test
  void dumpObjectFields() throws Exception {
    var tree = Resolver.parse("<test>", "{a+: 1, [b]:: 2}", List.of("b"));
    var expected =
        JsonParser.parseString(
            """
            {
              "kind": "Obj",
              "offset": 0,
              "body": {
                "kind": "MemberList",
                "members": [
                  {
                    "kind": "Field",
                    "offset": 1,
                    "fieldName": {"kind": "Fixed", "value": "a"},
                    "plus": true,
                    "params": null,
                    "visibility": "NORMAL",
                    "rhs": {"kind": "Num", "offset": 5, "value": 1.0}
                  },
                  {
                    "kind": "Field",
                    "offset": 8,
                    "fieldName": {"kind": "Dyn", "expr": {"kind": "Id", "offset": 9, "slot": 0}},
                    "plus": false,
                    "params": null,
                    "visibility": "HIDDEN",
                    "rhs": {"kind": "Num", "offset": 14, "value": 2.0}
                  }
                ]
              }
            }
            """);
    assertEquals(expected, ExprJson.dump(tree.root()));
  }

  @Test
  void roundTrip() throws Exception {
    String source =
        """
        local lib = import 'lib.libsonnet', text = importstr 'data.txt';
        local f(a, b=a + 1) = if a > b then a else -b;
        assert f(1) < 10 : 'too big';
        {
          local helper(x) = x * 2,
          assert self.count >= 0,
          name: 'example',
          count:: f(2, b=3) tailstrict,
          visible::: super.visible,
          nested+: {inner: [x for x in std.range(1, 3) if x != 2]},
          byKey: {[k]: helper(v) for k in ['a', 'b'] for v in [1]},
          sliced: text[1:],
          stepped: text[::2],
          method(p=null):: p == null || $.name in self,
          extended: lib { override: true, missing: false },
          err: error 'not ' + @'verbatim',
          ['dyn' + 'amic']: !true && ~1 | 2 ^ 3 & 4 << 1 >> 1 % 3 / 1,
        }
        """;
    var tree = Resolver.parse("<test>", source, List.of("std"));
    var dumped = ExprJson.dump(tree.root());
    assertEquals(tree.root(), ExprJson.read(dumped));
    assertEquals(tree.root(), ExprJson.fromJson(ExprJson.toJson(tree.root())));
  }

  @Test
  void roundTripOfHandBuiltTree() throws Exception {
    var expr =
        new Expr.Function(
            0,
            Params.of(Params.Param.required("x", 0)),
            new Expr.Slice(
                12,
                new Expr.Id(11, 0),
                Optional.empty(),
                Optional.of(new Expr.Num(14, -0.5)),
                Optional.empty()));
    assertEquals(expr, ExprJson.fromJson(ExprJson.toJson(expr)));
  }

  @Test
  void stringsAreEscaped() throws Exception {
    var expr = new Expr.Str(0, "quote \" backslash \\ newline \n tab \t");
    assertEquals(expr, ExprJson.fromJson(ExprJson.toJson(expr)));
  }

  @Test
  void unknownKind() throws Exception {
    var e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ExprJson.fromJson("{\"kind\": \"Lambda\", \"offset\": 0}"));
    assertTrue(e.getMessage().contains("Lambda"));
  }

  @Test
  void unknownOperator() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ExprJson.fromJson(
                """
                {"kind": "UnaryOp", "offset": 0, "op": "?",
                 "operand": {"kind": "Null", "offset": 1}}
                """));
  }

  @Test
  void assertExprRequiresAssertStmt() throws Exception {
    var e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                ExprJson.fromJson(
                    """
                    {"kind": "AssertExpr", "offset": 0,
                     "assertion": {"kind": "BindStmt",
                                   "bind": {"offset": 6, "slot": 0, "params": null,
                                            "rhs": {"kind": "Null", "offset": 10}}},
                     "returned": {"kind": "Null", "offset": 16}}
                    """));
    assertTrue(e.getMessage().contains("Expected AssertStmt but got BindStmt"));
  }

  @Test
  void attributeOfNonObject() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExprJson.fromJson("{\"kind\": \"Arr\", \"offset\": 0, \"elements\": [7]}"));
  }

  @Test
  void missingAttribute() throws Exception {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExprJson.fromJson("{\"kind\": \"Id\", \"offset\": 0}"));
  }
}
