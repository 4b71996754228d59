// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Canonical JSON rendering of slot-resolved trees, for tests and debugging.
 *
 * <p>Every node is an object whose "kind" names its variant, followed by its components in
 * declaration order. Absent optional children are rendered as JSON null. {@link #read} rebuilds a
 * tree equal to the one that was dumped.
 */
public class ExprJson {
  private static final Gson GSON =
      new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();

  private ExprJson() {}

  public static String toJson(Expr expr) {
    return GSON.toJson(dump(expr));
  }

  public static Expr fromJson(String json) {
    return read(JsonParser.parseString(json));
  }

  public static JsonElement dump(Expr expr) {
    return expr.accept(DUMPER);
  }

  private static final Dumper DUMPER = new Dumper();

  private static class Dumper
      implements Expr.Visitor<JsonElement>,
          Member.Visitor<JsonElement>,
          ObjBody.Visitor<JsonElement> {

    @Override
    public JsonElement visitNull(Expr.Null expr) {
      return createNode("Null", expr.offset());
    }

    @Override
    public JsonElement visitTrue(Expr.True expr) {
      return createNode("True", expr.offset());
    }

    @Override
    public JsonElement visitFalse(Expr.False expr) {
      return createNode("False", expr.offset());
    }

    @Override
    public JsonElement visitSelf(Expr.Self expr) {
      return createNode("Self", expr.offset());
    }

    @Override
    public JsonElement visitSuper(Expr.Super expr) {
      return createNode("Super", expr.offset());
    }

    @Override
    public JsonElement visitDollar(Expr.Dollar expr) {
      return createNode("Dollar", expr.offset());
    }

    @Override
    public JsonElement visitStr(Expr.Str expr) {
      var node = createNode("Str", expr.offset());
      node.addProperty("value", expr.value());
      return node;
    }

    @Override
    public JsonElement visitNum(Expr.Num expr) {
      var node = createNode("Num", expr.offset());
      node.addProperty("value", expr.value());
      return node;
    }

    @Override
    public JsonElement visitId(Expr.Id expr) {
      var node = createNode("Id", expr.offset());
      node.addProperty("slot", expr.slot());
      return node;
    }

    @Override
    public JsonElement visitArr(Expr.Arr expr) {
      var node = createNode("Arr", expr.offset());
      node.add("elements", dumpAll(expr.elements()));
      return node;
    }

    @Override
    public JsonElement visitObj(Expr.Obj expr) {
      var node = createNode("Obj", expr.offset());
      node.add("body", expr.body().accept(this));
      return node;
    }

    @Override
    public JsonElement visitParened(Expr.Parened expr) {
      var node = createNode("Parened", expr.offset());
      node.add("inner", expr.inner().accept(this));
      return node;
    }

    @Override
    public JsonElement visitUnaryOp(Expr.UnaryOp expr) {
      var node = createNode("UnaryOp", expr.offset());
      node.addProperty("op", expr.op().symbol());
      node.add("operand", expr.operand().accept(this));
      return node;
    }

    @Override
    public JsonElement visitBinaryOp(Expr.BinaryOp expr) {
      var node = createNode("BinaryOp", expr.offset());
      node.add("lhs", expr.lhs().accept(this));
      node.addProperty("op", expr.op().symbol());
      node.add("rhs", expr.rhs().accept(this));
      return node;
    }

    @Override
    public JsonElement visitAssertExpr(Expr.AssertExpr expr) {
      var node = createNode("AssertExpr", expr.offset());
      node.add("assertion", expr.assertion().accept(this));
      node.add("returned", expr.returned().accept(this));
      return node;
    }

    @Override
    public JsonElement visitLocalExpr(Expr.LocalExpr expr) {
      var node = createNode("LocalExpr", expr.offset());
      var bindings = new JsonArray();
      expr.bindings().forEach(b -> bindings.add(dumpBind(b)));
      node.add("bindings", bindings);
      node.add("returned", expr.returned().accept(this));
      return node;
    }

    @Override
    public JsonElement visitImport(Expr.Import expr) {
      var node = createNode("Import", expr.offset());
      node.addProperty("path", expr.path());
      return node;
    }

    @Override
    public JsonElement visitImportStr(Expr.ImportStr expr) {
      var node = createNode("ImportStr", expr.offset());
      node.addProperty("path", expr.path());
      return node;
    }

    @Override
    public JsonElement visitError(Expr.Error expr) {
      var node = createNode("Error", expr.offset());
      node.add("message", expr.message().accept(this));
      return node;
    }

    @Override
    public JsonElement visitApply(Expr.Apply expr) {
      var node = createNode("Apply", expr.offset());
      node.add("target", expr.target().accept(this));
      var args = new JsonArray();
      for (var arg : expr.args().args()) {
        var argNode = new JsonObject();
        argNode.addProperty("name", arg.name().orElse(null));
        argNode.add("value", arg.value().accept(this));
        args.add(argNode);
      }
      node.add("args", args);
      return node;
    }

    @Override
    public JsonElement visitSelect(Expr.Select expr) {
      var node = createNode("Select", expr.offset());
      node.add("target", expr.target().accept(this));
      node.addProperty("fieldName", expr.fieldName());
      return node;
    }

    @Override
    public JsonElement visitLookup(Expr.Lookup expr) {
      var node = createNode("Lookup", expr.offset());
      node.add("target", expr.target().accept(this));
      node.add("index", expr.index().accept(this));
      return node;
    }

    @Override
    public JsonElement visitSlice(Expr.Slice expr) {
      var node = createNode("Slice", expr.offset());
      node.add("target", expr.target().accept(this));
      node.add("start", dumpOptional(expr.start()));
      node.add("end", dumpOptional(expr.end()));
      node.add("stride", dumpOptional(expr.stride()));
      return node;
    }

    @Override
    public JsonElement visitFunction(Expr.Function expr) {
      var node = createNode("Function", expr.offset());
      node.add("params", dumpParams(expr.params()));
      node.add("body", expr.body().accept(this));
      return node;
    }

    @Override
    public JsonElement visitIfElse(Expr.IfElse expr) {
      var node = createNode("IfElse", expr.offset());
      node.add("cond", expr.cond().accept(this));
      node.add("then", expr.then().accept(this));
      node.add("orElse", dumpOptional(expr.orElse()));
      return node;
    }

    @Override
    public JsonElement visitIfSpec(Expr.IfSpec expr) {
      var node = createNode("IfSpec", expr.offset());
      node.add("cond", expr.cond().accept(this));
      return node;
    }

    @Override
    public JsonElement visitForSpec(Expr.ForSpec expr) {
      var node = createNode("ForSpec", expr.offset());
      node.addProperty("slot", expr.slot());
      node.add("iterable", expr.iterable().accept(this));
      return node;
    }

    @Override
    public JsonElement visitComp(Expr.Comp expr) {
      var node = createNode("Comp", expr.offset());
      node.add("value", expr.value().accept(this));
      node.add("first", expr.first().accept(this));
      node.add("rest", dumpAll(expr.rest()));
      return node;
    }

    @Override
    public JsonElement visitObjExtend(Expr.ObjExtend expr) {
      var node = createNode("ObjExtend", expr.offset());
      node.add("base", expr.base().accept(this));
      node.add("ext", expr.ext().accept(this));
      return node;
    }

    @Override
    public JsonElement visitField(Member.Field field) {
      var node = createNode("Field", field.offset());
      var fieldName = new JsonObject();
      if (field.fieldName() instanceof FieldName.Fixed fixed) {
        fieldName.addProperty("kind", "Fixed");
        fieldName.addProperty("value", fixed.value());
      } else {
        fieldName.addProperty("kind", "Dyn");
        fieldName.add("expr", ((FieldName.Dyn) field.fieldName()).expr().accept(this));
      }
      node.add("fieldName", fieldName);
      node.addProperty("plus", field.plus());
      node.add("params", field.params().map(this::dumpParams).orElse(JsonNull.INSTANCE));
      node.addProperty("visibility", field.visibility().name());
      node.add("rhs", field.rhs().accept(this));
      return node;
    }

    @Override
    public JsonElement visitBindStmt(Member.BindStmt bindStmt) {
      var node = new JsonObject();
      node.addProperty("kind", "BindStmt");
      node.add("bind", dumpBind(bindStmt.bind()));
      return node;
    }

    @Override
    public JsonElement visitAssertStmt(Member.AssertStmt assertStmt) {
      var node = new JsonObject();
      node.addProperty("kind", "AssertStmt");
      node.add("condition", assertStmt.condition().accept(this));
      node.add("message", dumpOptional(assertStmt.message()));
      return node;
    }

    @Override
    public JsonElement visitMemberList(ObjBody.MemberList memberList) {
      var node = new JsonObject();
      node.addProperty("kind", "MemberList");
      var members = new JsonArray();
      memberList.members().forEach(m -> members.add(m.accept(this)));
      node.add("members", members);
      return node;
    }

    @Override
    public JsonElement visitObjComp(ObjBody.ObjComp objComp) {
      var node = new JsonObject();
      node.addProperty("kind", "ObjComp");
      node.add("preLocals", dumpBindStmts(objComp.preLocals()));
      node.add("key", objComp.key().accept(this));
      node.add("value", objComp.value().accept(this));
      node.add("postLocals", dumpBindStmts(objComp.postLocals()));
      node.add("first", objComp.first().accept(this));
      node.add("rest", dumpAll(objComp.rest()));
      return node;
    }

    private JsonObject dumpBind(Bind bind) {
      var node = new JsonObject();
      node.addProperty("offset", bind.offset());
      node.addProperty("slot", bind.slot());
      node.add("params", bind.params().map(this::dumpParams).orElse(JsonNull.INSTANCE));
      node.add("rhs", bind.rhs().accept(this));
      return node;
    }

    private JsonArray dumpBindStmts(List<Member.BindStmt> bindStmts) {
      var array = new JsonArray();
      bindStmts.forEach(b -> array.add(dumpBind(b.bind())));
      return array;
    }

    private JsonElement dumpParams(Params params) {
      var array = new JsonArray();
      for (var param : params.entries()) {
        var node = new JsonObject();
        node.addProperty("name", param.name());
        node.add("default", dumpOptional(param.defaultExpr()));
        node.addProperty("slot", param.slot());
        array.add(node);
      }
      return array;
    }

    private JsonArray dumpAll(List<? extends Expr> exprs) {
      var array = new JsonArray();
      exprs.forEach(e -> array.add(e.accept(this)));
      return array;
    }

    private JsonElement dumpOptional(Optional<Expr> expr) {
      return expr.map(e -> e.accept(this)).orElse(JsonNull.INSTANCE);
    }

    private static JsonObject createNode(String kind, int offset) {
      var node = new JsonObject();
      node.addProperty("kind", kind);
      node.addProperty("offset", offset);
      return node;
    }
  }

  public static Expr read(JsonElement element) {
    String kind = getKind(element);
    int offset = getAttr(element, "offset").getAsInt();
    switch (kind) {
      case "Null":
        return new Expr.Null(offset);
      case "True":
        return new Expr.True(offset);
      case "False":
        return new Expr.False(offset);
      case "Self":
        return new Expr.Self(offset);
      case "Super":
        return new Expr.Super(offset);
      case "Dollar":
        return new Expr.Dollar(offset);
      case "Str":
        return new Expr.Str(offset, getAttr(element, "value").getAsString());
      case "Num":
        return new Expr.Num(offset, getAttr(element, "value").getAsDouble());
      case "Id":
        return new Expr.Id(offset, getAttr(element, "slot").getAsInt());
      case "Arr":
        return new Expr.Arr(offset, readAll(getAttr(element, "elements")));
      case "Obj":
        return new Expr.Obj(offset, readObjBody(getAttr(element, "body")));
      case "Parened":
        return new Expr.Parened(offset, read(getAttr(element, "inner")));
      case "UnaryOp":
        return new Expr.UnaryOp(
            offset,
            Expr.UnaryOp.parse(getAttr(element, "op").getAsString()),
            read(getAttr(element, "operand")));
      case "BinaryOp":
        return new Expr.BinaryOp(
            offset,
            read(getAttr(element, "lhs")),
            Expr.BinaryOp.parse(getAttr(element, "op").getAsString()),
            read(getAttr(element, "rhs")));
      case "AssertExpr":
        return new Expr.AssertExpr(
            offset,
            readAssertStmt(getAttr(element, "assertion")),
            read(getAttr(element, "returned")));
      case "LocalExpr":
        return new Expr.LocalExpr(
            offset,
            StreamSupport.stream(getAttr(element, "bindings").getAsJsonArray().spliterator(), false)
                .map(ExprJson::readBind)
                .toList(),
            read(getAttr(element, "returned")));
      case "Import":
        return new Expr.Import(offset, getAttr(element, "path").getAsString());
      case "ImportStr":
        return new Expr.ImportStr(offset, getAttr(element, "path").getAsString());
      case "Error":
        return new Expr.Error(offset, read(getAttr(element, "message")));
      case "Apply":
        return new Expr.Apply(
            offset,
            read(getAttr(element, "target")),
            new Args(
                StreamSupport.stream(getAttr(element, "args").getAsJsonArray().spliterator(), false)
                    .map(
                        arg ->
                            new Args.Arg(
                                Optional.ofNullable(getAttrOrJavaNull(arg, "name"))
                                    .map(JsonElement::getAsString),
                                read(getAttr(arg, "value"))))
                    .toList()));
      case "Select":
        return new Expr.Select(
            offset, read(getAttr(element, "target")), getAttr(element, "fieldName").getAsString());
      case "Lookup":
        return new Expr.Lookup(
            offset, read(getAttr(element, "target")), read(getAttr(element, "index")));
      case "Slice":
        return new Expr.Slice(
            offset,
            read(getAttr(element, "target")),
            readOptional(element, "start"),
            readOptional(element, "end"),
            readOptional(element, "stride"));
      case "Function":
        return new Expr.Function(
            offset, readParams(getAttr(element, "params")), read(getAttr(element, "body")));
      case "IfElse":
        return new Expr.IfElse(
            offset,
            read(getAttr(element, "cond")),
            read(getAttr(element, "then")),
            readOptional(element, "orElse"));
      case "IfSpec":
        return new Expr.IfSpec(offset, read(getAttr(element, "cond")));
      case "ForSpec":
        return new Expr.ForSpec(
            offset, getAttr(element, "slot").getAsInt(), read(getAttr(element, "iterable")));
      case "Comp":
        return new Expr.Comp(
            offset,
            read(getAttr(element, "value")),
            readForSpec(getAttr(element, "first")),
            readCompSpecs(getAttr(element, "rest")));
      case "ObjExtend":
        return new Expr.ObjExtend(
            offset, read(getAttr(element, "base")), readObjBody(getAttr(element, "ext")));
      default:
        throw new IllegalArgumentException("Unexpected expression kind: " + kind);
    }
  }

  private static ObjBody readObjBody(JsonElement element) {
    String kind = getKind(element);
    switch (kind) {
      case "MemberList":
        return new ObjBody.MemberList(
            StreamSupport.stream(getAttr(element, "members").getAsJsonArray().spliterator(), false)
                .map(ExprJson::readMember)
                .toList());
      case "ObjComp":
        return new ObjBody.ObjComp(
            readBindStmts(getAttr(element, "preLocals")),
            read(getAttr(element, "key")),
            read(getAttr(element, "value")),
            readBindStmts(getAttr(element, "postLocals")),
            readForSpec(getAttr(element, "first")),
            readCompSpecs(getAttr(element, "rest")));
      default:
        throw new IllegalArgumentException("Unexpected object body kind: " + kind);
    }
  }

  private static Member readMember(JsonElement element) {
    String kind = getKind(element);
    switch (kind) {
      case "Field":
        {
          var fieldNameElement = getAttr(element, "fieldName");
          String fieldNameKind = getKind(fieldNameElement);
          final FieldName fieldName;
          if (fieldNameKind.equals("Fixed")) {
            fieldName = new FieldName.Fixed(getAttr(fieldNameElement, "value").getAsString());
          } else if (fieldNameKind.equals("Dyn")) {
            fieldName = new FieldName.Dyn(read(getAttr(fieldNameElement, "expr")));
          } else {
            throw new IllegalArgumentException("Unexpected field name kind: " + fieldNameKind);
          }
          return new Member.Field(
              getAttr(element, "offset").getAsInt(),
              fieldName,
              getAttr(element, "plus").getAsBoolean(),
              Optional.ofNullable(getAttrOrJavaNull(element, "params")).map(ExprJson::readParams),
              Member.Visibility.valueOf(getAttr(element, "visibility").getAsString()),
              read(getAttr(element, "rhs")));
        }
      case "BindStmt":
        return new Member.BindStmt(readBind(getAttr(element, "bind")));
      case "AssertStmt":
        return new Member.AssertStmt(
            read(getAttr(element, "condition")), readOptional(element, "message"));
      default:
        throw new IllegalArgumentException("Unexpected member kind: " + kind);
    }
  }

  private static Bind readBind(JsonElement element) {
    return new Bind(
        getAttr(element, "offset").getAsInt(),
        getAttr(element, "slot").getAsInt(),
        Optional.ofNullable(getAttrOrJavaNull(element, "params")).map(ExprJson::readParams),
        read(getAttr(element, "rhs")));
  }

  private static List<Member.BindStmt> readBindStmts(JsonElement element) {
    return StreamSupport.stream(element.getAsJsonArray().spliterator(), false)
        .map(e -> new Member.BindStmt(readBind(e)))
        .toList();
  }

  private static Params readParams(JsonElement element) {
    return new Params(
        StreamSupport.stream(element.getAsJsonArray().spliterator(), false)
            .map(
                e ->
                    new Params.Param(
                        getAttr(e, "name").getAsString(),
                        readOptional(e, "default"),
                        getAttr(e, "slot").getAsInt()))
            .toList());
  }

  private static Member.AssertStmt readAssertStmt(JsonElement element) {
    if (readMember(element) instanceof Member.AssertStmt assertStmt) {
      return assertStmt;
    }
    throw new IllegalArgumentException("Expected AssertStmt but got " + getKind(element));
  }

  private static Expr.ForSpec readForSpec(JsonElement element) {
    if (read(element) instanceof Expr.ForSpec forSpec) {
      return forSpec;
    }
    throw new IllegalArgumentException("Expected ForSpec but got " + getKind(element));
  }

  private static List<Expr.CompSpec> readCompSpecs(JsonElement element) {
    return StreamSupport.stream(element.getAsJsonArray().spliterator(), false)
        .map(
            e -> {
              if (read(e) instanceof Expr.CompSpec spec) {
                return spec;
              }
              throw new IllegalArgumentException(
                  "Expected comprehension spec but got " + getKind(e));
            })
        .toList();
  }

  private static List<Expr> readAll(JsonElement element) {
    return StreamSupport.stream(element.getAsJsonArray().spliterator(), false)
        .map(ExprJson::read)
        .toList();
  }

  private static Optional<Expr> readOptional(JsonElement element, String attr) {
    return Optional.ofNullable(getAttrOrJavaNull(element, attr)).map(ExprJson::read);
  }

  private static String getKind(JsonElement element) {
    return getAttr(element, "kind").getAsString();
  }

  private static JsonElement getAttr(JsonElement element, String attr) {
    if (!element.isJsonObject()) {
      throw new IllegalArgumentException(
          "Expected JSON object with '%s' but got %s".formatted(attr, element));
    }
    var result = element.getAsJsonObject().get(attr);
    if (result == null) {
      throw new IllegalArgumentException(
          "Missing attribute '%s' in %s".formatted(attr, element.getAsJsonObject().get("kind")));
    }
    return result;
  }

  private static JsonElement getAttrOrJavaNull(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    return result == null || result.isJsonNull() ? null : result;
  }
}
