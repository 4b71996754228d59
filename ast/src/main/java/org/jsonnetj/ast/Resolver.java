// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;
import org.jsonnetj.parser.JsonnetjParser;

/**
 * Builds a slot-resolved {@link Expr} tree from the JSON AST produced by {@link JsonnetjParser}.
 *
 * <p>Every identifier is resolved to the slot of the nearest enclosing binding with that name.
 * Bindings take the next free slot of the enclosing scope: {@code local} bindings, object locals,
 * function parameters, and comprehension variables. Recognized globals occupy the first slots of
 * the root frame.
 *
 * <p>A resolver is meant for one source unit at a time and is not thread-safe.
 */
public class Resolver {
  public interface DebugLogger {
    /** Formats `message` containing printf-style "%s", "%d", etc with values from `args`. */
    void log(String message, Object... args);
  }

  static DebugLogger logger = (message, args) -> {};

  // To enable debug logging to stderr:
  // Resolver.setDebugLogger((str, args) -> System.err.printf(str + "%n", args));
  public static void setDebugLogger(DebugLogger newLogger) {
    logger = newLogger;
  }

  /**
   * A resolved tree with the number of slots its evaluation frame needs.
   *
   * @param frameSize one more than the largest slot bound anywhere in the tree
   */
  public record ResolvedTree(Expr root, int frameSize) {}

  private record ResolvedParams(Params params, Scope scope) {}

  private record ResolvedSpecs(Expr.ForSpec first, List<Expr.CompSpec> rest, Scope scope) {}

  private final List<String> globals;
  private int frameSize;

  public Resolver() {
    this(List.of());
  }

  public Resolver(List<String> globals) {
    if (new HashSet<>(globals).size() != globals.size()) {
      throw new IllegalArgumentException("Duplicate global names: " + globals);
    }
    this.globals = List.copyOf(globals);
  }

  public static ResolvedTree parse(String filename, String source, List<String> globals) {
    return new Resolver(globals).resolve(JsonnetjParser.parse(filename, source));
  }

  public List<String> globals() {
    return globals;
  }

  public ResolvedTree resolve(JsonElement element) {
    frameSize = 0;
    Scope root = bind(Scope.EMPTY, globals);
    Expr expr = parseExpression(element, root);
    return new ResolvedTree(expr, frameSize);
  }

  private Expr parseExpression(JsonElement element, Scope scope) {
    String type = getType(element);
    int offset = getOffset(element);
    switch (type) {
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

      case "Var":
        {
          String name = getAttr(element, "name").getAsString();
          int slot =
              scope
                  .lookup(name)
                  .orElseThrow(
                      () ->
                          new AstException(
                              AstException.Kind.UNRESOLVED_IDENTIFIER,
                              offset,
                              "Unknown variable: " + name));
          return new Expr.Id(offset, slot);
        }

      case "Arr":
        return new Expr.Arr(offset, parseExpressions(getAttr(element, "elements"), scope));

      case "ArrComp":
        {
          var specs = parseSpecs(getAttr(element, "specs").getAsJsonArray(), scope);
          return new Expr.Comp(
              offset,
              parseExpression(getAttr(element, "value"), specs.scope()),
              specs.first(),
              specs.rest());
        }

      case "Obj":
        return new Expr.Obj(offset, parseObjBody(getAttr(element, "body"), scope));

      case "ObjExtend":
        return new Expr.ObjExtend(
            offset,
            parseExpression(getAttr(element, "base"), scope),
            parseObjBody(getAttr(element, "body"), scope));

      case "Parened":
        return new Expr.Parened(offset, parseExpression(getAttr(element, "value"), scope));

      case "UnaryOp":
        return new Expr.UnaryOp(
            offset,
            Expr.UnaryOp.parse(getAttr(element, "op").getAsString()),
            parseExpression(getAttr(element, "operand"), scope));

      case "BinaryOp":
        return new Expr.BinaryOp(
            offset,
            parseExpression(getAttr(element, "left"), scope),
            Expr.BinaryOp.parse(getAttr(element, "op").getAsString()),
            parseExpression(getAttr(element, "right"), scope));

      case "Assert":
        return new Expr.AssertExpr(
            offset,
            parseAssertion(getAttr(element, "assertion"), scope),
            parseExpression(getAttr(element, "rest"), scope));

      case "Local":
        {
          JsonArray binds = getAttr(element, "binds").getAsJsonArray();
          Scope inner = bindLocals(scope, binds);
          var bindings = new ArrayList<Bind>();
          for (int i = 0; i < binds.size(); ++i) {
            bindings.add(parseBind(binds.get(i), inner, scope.depth() + i));
          }
          return new Expr.LocalExpr(
              offset, bindings, parseExpression(getAttr(element, "body"), inner));
        }

      case "Import":
        return new Expr.Import(offset, getAttr(element, "path").getAsString());

      case "ImportStr":
        return new Expr.ImportStr(offset, getAttr(element, "path").getAsString());

      case "Error":
        return new Expr.Error(offset, parseExpression(getAttr(element, "value"), scope));

      case "Apply":
        return new Expr.Apply(
            offset,
            parseExpression(getAttr(element, "target"), scope),
            new Args(
                StreamSupport.stream(getAttr(element, "args").getAsJsonArray().spliterator(), false)
                    .map(
                        arg ->
                            new Args.Arg(
                                Optional.ofNullable(getAttrOrJavaNull(arg, "name"))
                                    .map(JsonElement::getAsString),
                                parseExpression(getAttr(arg, "value"), scope)))
                    .toList()));

      case "Select":
        return new Expr.Select(
            offset,
            parseExpression(getAttr(element, "target"), scope),
            getAttr(element, "name").getAsString());

      case "Lookup":
        return new Expr.Lookup(
            offset,
            parseExpression(getAttr(element, "target"), scope),
            parseExpression(getAttr(element, "index"), scope));

      case "Slice":
        return new Expr.Slice(
            offset,
            parseExpression(getAttr(element, "target"), scope),
            parseOptionalExpression(element, "start", scope),
            parseOptionalExpression(element, "end", scope),
            parseOptionalExpression(element, "stride", scope));

      case "Function":
        {
          var params = parseParams(getAttr(element, "params").getAsJsonArray(), scope);
          return new Expr.Function(
              offset, params.params(), parseExpression(getAttr(element, "body"), params.scope()));
        }

      case "IfElse":
        return new Expr.IfElse(
            offset,
            parseExpression(getAttr(element, "cond"), scope),
            parseExpression(getAttr(element, "then"), scope),
            parseOptionalExpression(element, "else", scope));

      default:
        throw new IllegalArgumentException("Unexpected expression type: " + type);
    }
  }

  private ObjBody parseObjBody(JsonElement element, Scope scope) {
    String type = getType(element);
    switch (type) {
      case "MemberList":
        {
          JsonArray members = getAttr(element, "members").getAsJsonArray();
          var localBinds = new JsonArray();
          for (var member : members) {
            if (getType(member).equals("Local")) {
              localBinds.add(getAttr(member, "bind"));
            }
          }
          Scope inner = bindLocals(scope, localBinds);

          var result = new ArrayList<Member>();
          int localSlot = scope.depth();
          for (var member : members) {
            String memberType = getType(member);
            switch (memberType) {
              case "Field":
                result.add(parseField(member, scope, inner));
                break;
              case "Local":
                result.add(
                    new Member.BindStmt(parseBind(getAttr(member, "bind"), inner, localSlot++)));
                break;
              case "Assert":
                result.add(parseAssertion(member, inner));
                break;
              default:
                throw new IllegalArgumentException(
                    "Unexpected object member type: " + memberType);
            }
          }
          return new ObjBody.MemberList(result);
        }

      case "ObjComp":
        {
          var specs = parseSpecs(getAttr(element, "specs").getAsJsonArray(), scope);
          JsonArray preLocals = getAttr(element, "preLocals").getAsJsonArray();
          JsonArray postLocals = getAttr(element, "postLocals").getAsJsonArray();
          var allLocals = new JsonArray();
          allLocals.addAll(preLocals);
          allLocals.addAll(postLocals);
          Scope inner = bindLocals(specs.scope(), allLocals);
          // The key is computed before the post locals exist. Pre locals come first, so their
          // slots here match the ones in inner.
          List<String> preNames =
              getNames(preLocals, AstException.Kind.DUPLICATE_LOCAL_NAME, "local");
          Scope keyScope = specs.scope().bind(preNames);

          int localSlot = specs.scope().depth();
          var pre = new ArrayList<Member.BindStmt>();
          for (var bind : preLocals) {
            pre.add(new Member.BindStmt(parseBind(bind, inner, localSlot++)));
          }
          var post = new ArrayList<Member.BindStmt>();
          for (var bind : postLocals) {
            post.add(new Member.BindStmt(parseBind(bind, inner, localSlot++)));
          }
          return new ObjBody.ObjComp(
              pre,
              parseExpression(getAttr(element, "key"), keyScope),
              parseExpression(getAttr(element, "value"), inner),
              post,
              specs.first(),
              specs.rest());
        }

      default:
        throw new IllegalArgumentException("Unexpected object body type: " + type);
    }
  }

  // Computed field names are evaluated outside the object, so they can't see its locals.
  private Member.Field parseField(JsonElement element, Scope outer, Scope inner) {
    var nameElement = getAttr(element, "name");
    String nameType = getType(nameElement);
    final FieldName fieldName;
    switch (nameType) {
      case "Fixed":
        fieldName = new FieldName.Fixed(getAttr(nameElement, "value").getAsString());
        break;
      case "Dyn":
        fieldName = new FieldName.Dyn(parseExpression(getAttr(nameElement, "expr"), outer));
        break;
      default:
        throw new IllegalArgumentException("Unexpected field name type: " + nameType);
    }

    var paramsElement = getAttrOrJavaNull(element, "params");
    final Optional<Params> params;
    final Expr rhs;
    if (paramsElement == null) {
      params = Optional.empty();
      rhs = parseExpression(getAttr(element, "value"), inner);
    } else {
      var resolved = parseParams(paramsElement.getAsJsonArray(), inner);
      params = Optional.of(resolved.params());
      rhs = parseExpression(getAttr(element, "value"), resolved.scope());
    }

    return new Member.Field(
        getOffset(element),
        fieldName,
        getAttr(element, "plus").getAsBoolean(),
        params,
        parseVisibility(getAttr(element, "visibility").getAsString()),
        rhs);
  }

  private static Member.Visibility parseVisibility(String visibility) {
    switch (visibility) {
      case "Normal":
        return Member.Visibility.NORMAL;
      case "Hidden":
        return Member.Visibility.HIDDEN;
      case "Unhide":
        return Member.Visibility.UNHIDE;
      default:
        throw new IllegalArgumentException("Unexpected field visibility: " + visibility);
    }
  }

  private Member.AssertStmt parseAssertion(JsonElement element, Scope scope) {
    return new Member.AssertStmt(
        parseExpression(getAttr(element, "cond"), scope),
        parseOptionalExpression(element, "message", scope));
  }

  // The scope passed in already binds `slot` to this binding's name, so function bodies can
  // refer to themselves.
  private Bind parseBind(JsonElement element, Scope scope, int slot) {
    var paramsElement = getAttrOrJavaNull(element, "params");
    if (paramsElement == null) {
      return new Bind(
          getOffset(element),
          slot,
          Optional.empty(),
          parseExpression(getAttr(element, "value"), scope));
    }
    var params = parseParams(paramsElement.getAsJsonArray(), scope);
    return new Bind(
        getOffset(element),
        slot,
        Optional.of(params.params()),
        parseExpression(getAttr(element, "value"), params.scope()));
  }

  // All parameters are in scope for every default, so a default may refer to any parameter of
  // the same list.
  private ResolvedParams parseParams(JsonArray elements, Scope scope) {
    List<String> names =
        getNames(elements, AstException.Kind.DUPLICATE_PARAMETER_NAME, "parameter");
    Scope inner = bind(scope, names);
    var entries = new ArrayList<Params.Param>();
    for (int i = 0; i < elements.size(); ++i) {
      var element = elements.get(i);
      entries.add(
          new Params.Param(
              names.get(i),
              parseOptionalExpression(element, "default", inner),
              scope.depth() + i));
    }
    return new ResolvedParams(new Params(entries), inner);
  }

  private ResolvedSpecs parseSpecs(JsonArray elements, Scope scope) {
    Expr.ForSpec first = null;
    var rest = new ArrayList<Expr.CompSpec>();
    for (var element : elements) {
      String type = getType(element);
      int offset = getOffset(element);
      final Expr.CompSpec spec;
      switch (type) {
        case "ForSpec":
          {
            // The iterable is evaluated before its loop variable is bound.
            Expr iterable = parseExpression(getAttr(element, "iterable"), scope);
            int slot = scope.depth();
            scope = bind(scope, List.of(getAttr(element, "name").getAsString()));
            spec = new Expr.ForSpec(offset, slot, iterable);
            break;
          }
        case "IfSpec":
          spec = new Expr.IfSpec(offset, parseExpression(getAttr(element, "cond"), scope));
          break;
        default:
          throw new IllegalArgumentException("Unexpected comprehension spec type: " + type);
      }
      if (first == null) {
        if (!(spec instanceof Expr.ForSpec forSpec)) {
          throw new IllegalArgumentException("Comprehension must start with a for spec");
        }
        first = forSpec;
      } else {
        rest.add(spec);
      }
    }
    if (first == null) {
      throw new IllegalArgumentException("Comprehension has no specs");
    }
    return new ResolvedSpecs(first, rest, scope);
  }

  private Scope bindLocals(Scope scope, JsonArray binds) {
    return bind(scope, getNames(binds, AstException.Kind.DUPLICATE_LOCAL_NAME, "local"));
  }

  private Scope bind(Scope scope, List<String> names) {
    Scope child = scope.bind(names);
    frameSize = Math.max(frameSize, child.depth());
    if (!names.isEmpty()) {
      logger.log("Bound %s to slots %d..%d", names, scope.depth(), child.depth() - 1);
    }
    return child;
  }

  private static List<String> getNames(JsonArray elements, AstException.Kind kind, String what) {
    var names = new ArrayList<String>();
    for (var element : elements) {
      String name = getAttr(element, "name").getAsString();
      if (names.contains(name)) {
        throw new AstException(
            kind, getOffset(element), "Duplicate %s name: %s".formatted(what, name));
      }
      names.add(name);
    }
    return names;
  }

  private List<Expr> parseExpressions(JsonElement elements, Scope scope) {
    return StreamSupport.stream(elements.getAsJsonArray().spliterator(), false)
        .map(e -> parseExpression(e, scope))
        .toList();
  }

  private Optional<Expr> parseOptionalExpression(JsonElement element, String attr, Scope scope) {
    return Optional.ofNullable(getAttrOrJavaNull(element, attr))
        .map(e -> parseExpression(e, scope));
  }

  private static String getType(JsonElement element) {
    return element.getAsJsonObject().get("type").getAsString();
  }

  private static int getOffset(JsonElement element) {
    return element.getAsJsonObject().get("offset").getAsInt();
  }

  private static JsonElement getAttr(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    if (result == null) {
      throw new IllegalArgumentException(
          "Missing attribute '%s' in %s node"
              .formatted(attr, element.getAsJsonObject().get("type")));
    }
    return result;
  }

  private static JsonElement getAttrOrJavaNull(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    return result == null || result.isJsonNull() ? null : result;
  }
}
