// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ResolverTest {

  @AfterEach
  void resetLogger() {
    Resolver.setDebugLogger((message, args) -> {});
  }

  private static Resolver.ResolvedTree resolve(String source) {
    return Resolver.parse("<test>", source, List.of());
  }

  @Test
  void localBinding() throws Exception {
    var tree = resolve("local x = 1; x + 2");
    var expected =
        new Expr.LocalExpr(
            0,
            List.of(new Bind(6, 0, Optional.empty(), new Expr.Num(10, 1.0))),
            new Expr.BinaryOp(
                15, new Expr.Id(13, 0), Expr.BinaryOp.Op.ADD, new Expr.Num(17, 2.0)));
    assertEquals(expected, tree.root());
    assertEquals(1, tree.frameSize());
  }

  @Test
  void objectWithHiddenField() throws Exception {
    var tree = resolve("{a: 1, b:: 2}");
    var expected =
        new Expr.Obj(
            0,
            new ObjBody.MemberList(
                List.of(
                    new Member.Field(
                        1,
                        new FieldName.Fixed("a"),
                        false,
                        Optional.empty(),
                        Member.Visibility.NORMAL,
                        new Expr.Num(4, 1.0)),
                    new Member.Field(
                        7,
                        new FieldName.Fixed("b"),
                        false,
                        Optional.empty(),
                        Member.Visibility.HIDDEN,
                        new Expr.Num(11, 2.0)))));
    assertEquals(expected, tree.root());
    var body = (ObjBody.MemberList) ((Expr.Obj) tree.root()).body();
    assertEquals(List.of("a"), body.visibleFieldNames());
    assertEquals(0, tree.frameSize());
  }

  @Test
  void functionWithDefault() throws Exception {
    var tree = resolve("function(a, b=2) a+b");
    var expected =
        new Expr.Function(
            0,
            Params.of(
                Params.Param.required("a", 0),
                Params.Param.withDefault("b", new Expr.Num(14, 2.0), 1)),
            new Expr.BinaryOp(18, new Expr.Id(17, 0), Expr.BinaryOp.Op.ADD, new Expr.Id(19, 1)));
    assertEquals(expected, tree.root());

    var params = ((Expr.Function) tree.root()).params();
    assertEquals(Set.of(0), params.requiredSlots());
    assertEquals(1, params.defaultedSlots().size());
    assertEquals(1, params.defaultedSlots().get(0).slot());
    assertEquals(2, tree.frameSize());
  }

  @Test
  void shadowing() throws Exception {
    var tree = resolve("local x = 1; [x, (local x = 2; x), function(x) x]");
    var elements = ((Expr.Arr) ((Expr.LocalExpr) tree.root()).returned()).elements();
    assertEquals(new Expr.Id(14, 0), elements.get(0));

    var inner = (Expr.LocalExpr) ((Expr.Parened) elements.get(1)).inner();
    assertEquals(1, inner.bindings().get(0).slot());
    assertEquals(new Expr.Id(31, 1), inner.returned());

    var function = (Expr.Function) elements.get(2);
    assertEquals(Params.of(Params.Param.required("x", 1)), function.params());
    assertEquals(new Expr.Id(47, 1), function.body());
    assertEquals(2, tree.frameSize());
  }

  @Test
  void unresolvedIdentifier() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("1 + y"));
    assertEquals(AstException.Kind.UNRESOLVED_IDENTIFIER, e.kind);
    assertEquals(4, e.offset);
    assertTrue(e.getMessage().contains("y"));
  }

  @Test
  void globalsTakeTheFirstSlots() throws Exception {
    var tree = Resolver.parse("<test>", "local a = 1; std.length(a)", List.of("std"));
    var local = (Expr.LocalExpr) tree.root();
    assertEquals(1, local.bindings().get(0).slot());

    var apply = (Expr.Apply) local.returned();
    assertEquals(new Expr.Select(16, new Expr.Id(13, 0), "length"), apply.target());
    assertEquals(Args.of(Args.positional(new Expr.Id(24, 1))), apply.args());
    assertEquals(2, tree.frameSize());
  }

  @Test
  void duplicateGlobals() throws Exception {
    assertThrows(IllegalArgumentException.class, () -> new Resolver(List.of("std", "std")));
  }

  @Test
  void duplicateParameter() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("function(x, x) x"));
    assertEquals(AstException.Kind.DUPLICATE_PARAMETER_NAME, e.kind);
    assertEquals(12, e.offset);
  }

  @Test
  void duplicateLocal() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("local a = 1, a = 2; a"));
    assertEquals(AstException.Kind.DUPLICATE_LOCAL_NAME, e.kind);
    assertEquals(13, e.offset);
  }

  @Test
  void duplicateStaticField() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("{a: 1, a: 2}"));
    assertEquals(AstException.Kind.DUPLICATE_STATIC_FIELD_NAME, e.kind);
    assertEquals(7, e.offset);
  }

  @Test
  void defaultMayReferToLaterParameter() throws Exception {
    var tree = resolve("function(a=b, b=1) a");
    var params = ((Expr.Function) tree.root()).params();
    assertEquals(Optional.of(new Expr.Id(11, 1)), params.entries().get(0).defaultExpr());
  }

  @Test
  void localBindingsAreMutuallyRecursive() throws Exception {
    var tree = resolve("local f(n) = g(n), g(n) = f(n); f(1)");
    var local = (Expr.LocalExpr) tree.root();
    var f = local.bindings().get(0);
    var g = local.bindings().get(1);
    assertEquals(0, f.slot());
    assertEquals(1, g.slot());
    assertEquals(Params.of(Params.Param.required("n", 2)), f.params().get());
    assertEquals(Params.of(Params.Param.required("n", 2)), g.params().get());
    assertEquals(new Expr.Id(13, 1), ((Expr.Apply) f.rhs()).target());
    assertEquals(new Expr.Id(26, 0), ((Expr.Apply) g.rhs()).target());
    assertEquals(3, tree.frameSize());
  }

  @Test
  void comprehension() throws Exception {
    var tree = resolve("[x + y for x in [1, 2] for y in [x] if y > 0]");
    var comp = (Expr.Comp) tree.root();
    assertEquals(
        new Expr.BinaryOp(3, new Expr.Id(1, 0), Expr.BinaryOp.Op.ADD, new Expr.Id(5, 1)),
        comp.value());
    assertEquals(0, comp.first().slot());
    assertEquals(2, comp.rest().size());

    var second = (Expr.ForSpec) comp.rest().get(0);
    assertEquals(1, second.slot());
    assertEquals(new Expr.Arr(32, List.of(new Expr.Id(33, 0))), second.iterable());

    var condition = (Expr.IfSpec) comp.rest().get(1);
    assertEquals(new Expr.Id(39, 1), ((Expr.BinaryOp) condition.cond()).lhs());
    assertEquals(2, tree.frameSize());
  }

  @Test
  void iterableCannotSeeItsOwnVariable() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("[x for x in x]"));
    assertEquals(AstException.Kind.UNRESOLVED_IDENTIFIER, e.kind);
    assertEquals(12, e.offset);
  }

  @Test
  void objectLocalsAreMutuallyRecursive() throws Exception {
    var tree = resolve("{local a = b, local b = 1, c: a}");
    var body = (ObjBody.MemberList) ((Expr.Obj) tree.root()).body();
    assertEquals(
        List.of(
            new Member.BindStmt(new Bind(7, 0, Optional.empty(), new Expr.Id(11, 1))),
            new Member.BindStmt(new Bind(20, 1, Optional.empty(), new Expr.Num(24, 1.0)))),
        body.binds());
    assertEquals(new Expr.Id(30, 0), body.fields().get(0).rhs());
  }

  @Test
  void computedFieldNameCannotSeeObjectLocals() throws Exception {
    var e = assertThrows(AstException.class, () -> resolve("{local a = 'k', [a]: 1}"));
    assertEquals(AstException.Kind.UNRESOLVED_IDENTIFIER, e.kind);
    assertEquals(17, e.offset);

    var tree = resolve("local a = 'k'; {local b = 1, [a]: b}");
    var body = (ObjBody.MemberList) ((Expr.Obj) ((Expr.LocalExpr) tree.root()).returned()).body();
    var field = body.fields().get(0);
    assertEquals(new FieldName.Dyn(new Expr.Id(30, 0)), field.fieldName());
    assertEquals(new Expr.Id(34, 1), field.rhs());
  }

  @Test
  void methodField() throws Exception {
    var tree = resolve("{f(x):: x}");
    var field = ((ObjBody.MemberList) ((Expr.Obj) tree.root()).body()).fields().get(0);
    assertEquals(Optional.of(Params.of(Params.Param.required("x", 0))), field.params());
    assertEquals(Member.Visibility.HIDDEN, field.visibility());
    assertEquals(new Expr.Id(8, 0), field.rhs());
  }

  @Test
  void objectComprehension() throws Exception {
    var tree = resolve("local xs = [1]; {local p = 1, [k]: k + p, local q = p for k in xs}");
    var objComp = (ObjBody.ObjComp) ((Expr.Obj) ((Expr.LocalExpr) tree.root()).returned()).body();

    assertEquals(new Expr.ForSpec(54, 1, new Expr.Id(63, 0)), objComp.first());
    assertEquals(2, objComp.preLocals().get(0).bind().slot());
    assertEquals(3, objComp.postLocals().get(0).bind().slot());
    assertEquals(new Expr.Id(31, 1), objComp.key());
    assertEquals(
        new Expr.BinaryOp(37, new Expr.Id(35, 1), Expr.BinaryOp.Op.ADD, new Expr.Id(39, 2)),
        objComp.value());
    assertEquals(new Expr.Id(52, 2), objComp.postLocals().get(0).bind().rhs());
    assertEquals(4, tree.frameSize());
  }

  @Test
  void comprehensionKeyCannotSeePostLocals() throws Exception {
    var tree = resolve("local q = 'outer'; {[q]: q, local q = 2 for k in [1]}");
    var objComp = (ObjBody.ObjComp) ((Expr.Obj) ((Expr.LocalExpr) tree.root()).returned()).body();
    assertEquals(new Expr.Id(21, 0), objComp.key());
    assertEquals(new Expr.Id(25, 2), objComp.value());
    assertEquals(2, objComp.postLocals().get(0).bind().slot());

    var e = assertThrows(AstException.class, () -> resolve("{[q]: 1, local q = 'k' for k in [1]}"));
    assertEquals(AstException.Kind.UNRESOLVED_IDENTIFIER, e.kind);
    assertEquals(2, e.offset);
  }

  @Test
  void comprehensionKeySeesPreLocals() throws Exception {
    var tree = resolve("{local p = 'k', [p + k]: 1, local q = p for k in ['a']}");
    var objComp = (ObjBody.ObjComp) ((Expr.Obj) tree.root()).body();
    assertEquals(
        new Expr.BinaryOp(19, new Expr.Id(17, 1), Expr.BinaryOp.Op.ADD, new Expr.Id(21, 0)),
        objComp.key());
    assertEquals(1, objComp.preLocals().get(0).bind().slot());
    assertEquals(2, objComp.postLocals().get(0).bind().slot());
    assertEquals(3, tree.frameSize());
  }

  @Test
  void assertionsAndConditionals() throws Exception {
    var tree = resolve("function(x) assert x > 0 : 'neg'; if x then self.a else null");
    var body = (Expr.AssertExpr) ((Expr.Function) tree.root()).body();
    assertEquals(new Expr.Id(19, 0), ((Expr.BinaryOp) body.assertion().condition()).lhs());
    assertEquals(Optional.of(new Expr.Str(27, "neg")), body.assertion().message());

    var ifElse = (Expr.IfElse) body.returned();
    assertEquals(new Expr.Id(37, 0), ifElse.cond());
    assertEquals(new Expr.Select(48, new Expr.Self(44), "a"), ifElse.then());
    assertEquals(Optional.of(new Expr.Null(56)), ifElse.orElse());
  }

  @Test
  void debugLogging() throws Exception {
    var messages = new ArrayList<String>();
    Resolver.setDebugLogger((message, args) -> messages.add(message.formatted(args)));
    resolve("local x = 1; function(a, b) x");
    assertEquals(List.of("Bound [x] to slots 0..0", "Bound [a, b] to slots 1..2"), messages);
  }
}
