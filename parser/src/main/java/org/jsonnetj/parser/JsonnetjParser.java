// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jsonnetj.grammar.JsonnetLexer;
import org.jsonnetj.grammar.JsonnetParser;
import org.jsonnetj.grammar.JsonnetParserBaseVisitor;

/**
 * Parses Jsonnet source into a JSON AST.
 *
 * <p>Every node of the JSON AST is an object with a "type" and the character "offset" of the
 * construct in the source. Variables are still referenced by name; slot resolution happens later.
 */
public class JsonnetjParser {
  public record ParserOutput(
      String source, JsonnetParser parser, ParseTree parseTree, JsonElement jsonAst) {}

  public static JsonElement parse(String source) {
    return parse("<string>", source);
  }

  public static JsonElement parse(String filename, String source) {
    return parseTrees(filename, source).jsonAst();
  }

  public static ParserOutput parseTrees(String source) {
    return parseTrees("<string>", source);
  }

  public static ParserOutput parseTrees(String filename, String source) {
    var sourceMap = SourceMap.of(filename, source);
    CharStream input = CharStreams.fromString(source, filename);
    JsonnetLexer lexer = new JsonnetLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(new JsonnetjErrorListener(sourceMap));

    CommonTokenStream tokens = new CommonTokenStream(lexer);
    JsonnetParser parser = new JsonnetParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(new JsonnetjErrorListener(sourceMap));

    ParseTree parseTree = parser.jsonnet();
    var visitor = new JsonnetJsonVisitor(sourceMap);
    var ast = visitor.visit(parseTree);
    return new ParserOutput(source, parser, parseTree, ast);
  }
}

class JsonnetJsonVisitor extends JsonnetParserBaseVisitor<JsonElement> {
  private final SourceMap sourceMap;

  JsonnetJsonVisitor(SourceMap sourceMap) {
    this.sourceMap = sourceMap;
  }

  @Override
  public JsonElement visitJsonnet(JsonnetParser.JsonnetContext ctx) {
    return visit(ctx.expr());
  }

  @Override
  public JsonElement visitPrimaryExpr(JsonnetParser.PrimaryExprContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public JsonElement visitSelectExpr(JsonnetParser.SelectExprContext ctx) {
    var node = createNode(ctx.DOT().getSymbol(), "Select");
    node.add("target", visit(ctx.target));
    node.addProperty("name", ctx.name.getText());
    return node;
  }

  @Override
  public JsonElement visitLookupExpr(JsonnetParser.LookupExprContext ctx) {
    var node = createNode(ctx.LBRACKET().getSymbol(), "Lookup");
    node.add("target", visit(ctx.target));
    node.add("index", visit(ctx.index));
    return node;
  }

  @Override
  public JsonElement visitSliceExpr(JsonnetParser.SliceExprContext ctx) {
    var node = createNode(ctx.LBRACKET().getSymbol(), "Slice");
    var slice = ctx.sliceSpec();
    node.add("target", visit(ctx.target));
    node.add("start", visitOrNull(slice.lower));
    node.add("end", visitOrNull(slice.upper));
    node.add("stride", visitOrNull(slice.step));
    return node;
  }

  @Override
  public JsonElement visitApplyExpr(JsonnetParser.ApplyExprContext ctx) {
    var node = createNode(ctx.LPAREN().getSymbol(), "Apply");
    node.add("target", visit(ctx.target));
    var args = new JsonArray();
    boolean seenNamed = false;
    if (ctx.args() != null) {
      for (var arg : ctx.args().arg()) {
        var argNode = new JsonObject();
        if (arg instanceof JsonnetParser.NamedArgContext named) {
          seenNamed = true;
          argNode.addProperty("name", named.ID().getText());
          argNode.add("value", visit(named.expr()));
        } else {
          if (seenNamed) {
            throw syntaxError(arg, "Positional argument after a named argument is not allowed");
          }
          argNode.add("name", JsonNull.INSTANCE);
          argNode.add("value", visit(((JsonnetParser.PositionalArgContext) arg).expr()));
        }
        args.add(argNode);
      }
    }
    node.add("args", args);
    node.addProperty("tailstrict", ctx.TAILSTRICT() != null);
    return node;
  }

  @Override
  public JsonElement visitExtendExpr(JsonnetParser.ExtendExprContext ctx) {
    var node = createNode(ctx.LBRACE().getSymbol(), "ObjExtend");
    node.add("base", visit(ctx.base));
    node.add("body", visit(ctx.objinside()));
    return node;
  }

  @Override
  public JsonElement visitUnaryExpr(JsonnetParser.UnaryExprContext ctx) {
    var node = createNode(ctx, "UnaryOp");
    node.addProperty("op", ctx.op.getText());
    node.add("operand", visit(ctx.operand));
    return node;
  }

  @Override
  public JsonElement visitBinaryExpr(JsonnetParser.BinaryExprContext ctx) {
    var node = createNode(ctx.op, "BinaryOp");
    node.add("left", visit(ctx.lhs));
    node.addProperty("op", ctx.op.getText());
    node.add("right", visit(ctx.rhs));
    return node;
  }

  @Override
  public JsonElement visitLocalExpr(JsonnetParser.LocalExprContext ctx) {
    var node = createNode(ctx, "Local");
    var binds = new JsonArray();
    for (var bind : ctx.bind()) {
      binds.add(visitBind(bind));
    }
    node.add("binds", binds);
    node.add("body", visit(ctx.body));
    return node;
  }

  @Override
  public JsonElement visitIfExpr(JsonnetParser.IfExprContext ctx) {
    var node = createNode(ctx, "IfElse");
    node.add("cond", visit(ctx.cond));
    node.add("then", visit(ctx.thenBranch));
    node.add("else", visitOrNull(ctx.elseBranch));
    return node;
  }

  @Override
  public JsonElement visitFunctionExpr(JsonnetParser.FunctionExprContext ctx) {
    var node = createNode(ctx, "Function");
    node.add("params", visitParamsOrEmpty(ctx.params()));
    node.add("body", visit(ctx.body));
    return node;
  }

  @Override
  public JsonElement visitAssertExpr(JsonnetParser.AssertExprContext ctx) {
    var node = createNode(ctx, "Assert");
    node.add("assertion", visitAssertion(ctx.assertion()));
    node.add("rest", visit(ctx.rest));
    return node;
  }

  @Override
  public JsonElement visitErrorExpr(JsonnetParser.ErrorExprContext ctx) {
    var node = createNode(ctx, "Error");
    node.add("value", visit(ctx.message));
    return node;
  }

  @Override
  public JsonElement visitNullLiteral(JsonnetParser.NullLiteralContext ctx) {
    return createNode(ctx, "Null");
  }

  @Override
  public JsonElement visitTrueLiteral(JsonnetParser.TrueLiteralContext ctx) {
    return createNode(ctx, "True");
  }

  @Override
  public JsonElement visitFalseLiteral(JsonnetParser.FalseLiteralContext ctx) {
    return createNode(ctx, "False");
  }

  @Override
  public JsonElement visitSelfLiteral(JsonnetParser.SelfLiteralContext ctx) {
    return createNode(ctx, "Self");
  }

  @Override
  public JsonElement visitSuperLiteral(JsonnetParser.SuperLiteralContext ctx) {
    return createNode(ctx, "Super");
  }

  @Override
  public JsonElement visitDollarLiteral(JsonnetParser.DollarLiteralContext ctx) {
    return createNode(ctx, "Dollar");
  }

  @Override
  public JsonElement visitStringLiteral(JsonnetParser.StringLiteralContext ctx) {
    var node = createNode(ctx, "Str");
    node.addProperty("value", unescapeStringContext(ctx.string()));
    return node;
  }

  @Override
  public JsonElement visitNumberLiteral(JsonnetParser.NumberLiteralContext ctx) {
    var node = createNode(ctx, "Num");
    node.addProperty("value", Double.parseDouble(ctx.NUMBER().getText()));
    return node;
  }

  @Override
  public JsonElement visitIdentifier(JsonnetParser.IdentifierContext ctx) {
    var node = createNode(ctx, "Var");
    node.addProperty("name", ctx.ID().getText());
    return node;
  }

  @Override
  public JsonElement visitParened(JsonnetParser.ParenedContext ctx) {
    var node = createNode(ctx, "Parened");
    node.add("value", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitObject(JsonnetParser.ObjectContext ctx) {
    var node = createNode(ctx, "Obj");
    node.add("body", visit(ctx.objinside()));
    return node;
  }

  @Override
  public JsonElement visitArray(JsonnetParser.ArrayContext ctx) {
    var node = createNode(ctx, "Arr");
    var elements = new JsonArray();
    for (var element : ctx.expr()) {
      elements.add(visit(element));
    }
    node.add("elements", elements);
    return node;
  }

  @Override
  public JsonElement visitArrayComp(JsonnetParser.ArrayCompContext ctx) {
    var node = createNode(ctx, "ArrComp");
    node.add("value", visit(ctx.expr()));
    node.add("specs", visitSpecs(ctx.forspec(), ctx.compspec()));
    return node;
  }

  @Override
  public JsonElement visitImportExpr(JsonnetParser.ImportExprContext ctx) {
    var node = createNode(ctx, "Import");
    node.addProperty("path", importPath(ctx.string()));
    return node;
  }

  @Override
  public JsonElement visitImportStrExpr(JsonnetParser.ImportStrExprContext ctx) {
    var node = createNode(ctx, "ImportStr");
    node.addProperty("path", importPath(ctx.string()));
    return node;
  }

  @Override
  public JsonElement visitObjComp(JsonnetParser.ObjCompContext ctx) {
    var node = createNode(ctx, "ObjComp");
    node.add("preLocals", visitObjLocals(ctx.pre));
    node.add("key", visit(ctx.key));
    node.add("value", visit(ctx.value));
    node.add("postLocals", visitObjLocals(ctx.post));
    node.add("specs", visitSpecs(ctx.forspec(), ctx.compspec()));
    return node;
  }

  @Override
  public JsonElement visitMemberList(JsonnetParser.MemberListContext ctx) {
    var node = createNode(ctx, "MemberList");
    var members = new JsonArray();
    for (var member : ctx.member()) {
      members.add(visitMember(member));
    }
    node.add("members", members);
    return node;
  }

  @Override
  public JsonElement visitMember(JsonnetParser.MemberContext ctx) {
    if (ctx.objlocal() != null) {
      var node = createNode(ctx, "Local");
      node.add("bind", visitBind(ctx.objlocal().bind()));
      return node;
    }
    if (ctx.assertion() != null) {
      return visitAssertion(ctx.assertion());
    }
    return visit(ctx.field());
  }

  @Override
  public JsonElement visitValueField(JsonnetParser.ValueFieldContext ctx) {
    var node = createNode(ctx, "Field");
    node.add("name", visitFieldname(ctx.fieldname()));
    node.addProperty("plus", ctx.PLUS() != null);
    node.add("params", JsonNull.INSTANCE);
    node.addProperty("visibility", visibilityName(ctx.visibility()));
    node.add("value", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitMethodField(JsonnetParser.MethodFieldContext ctx) {
    var node = createNode(ctx, "Field");
    node.add("name", visitFieldname(ctx.fieldname()));
    node.addProperty("plus", false);
    node.add("params", visitParamsOrEmpty(ctx.params()));
    node.addProperty("visibility", visibilityName(ctx.visibility()));
    node.add("value", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitFieldname(JsonnetParser.FieldnameContext ctx) {
    if (ctx.expr() != null) {
      var node = createNode("Dyn");
      node.add("expr", visit(ctx.expr()));
      return node;
    }
    var node = createNode("Fixed");
    if (ctx.ID() != null) {
      node.addProperty("value", ctx.ID().getText());
    } else {
      node.addProperty("value", unescapeStringContext(ctx.string()));
    }
    return node;
  }

  @Override
  public JsonElement visitAssertion(JsonnetParser.AssertionContext ctx) {
    var node = createNode(ctx, "Assert");
    node.add("cond", visit(ctx.cond));
    node.add("message", visitOrNull(ctx.message));
    return node;
  }

  @Override
  public JsonElement visitBind(JsonnetParser.BindContext ctx) {
    var node = createNode(ctx);
    node.addProperty("name", ctx.ID().getText());
    if (ctx.LPAREN() != null) {
      node.add("params", visitParamsOrEmpty(ctx.params()));
    } else {
      node.add("params", JsonNull.INSTANCE);
    }
    node.add("value", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitParam(JsonnetParser.ParamContext ctx) {
    var node = createNode(ctx);
    node.addProperty("name", ctx.ID().getText());
    node.add("default", visitOrNull(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitForspec(JsonnetParser.ForspecContext ctx) {
    var node = createNode(ctx, "ForSpec");
    node.addProperty("name", ctx.ID().getText());
    node.add("iterable", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitIfspec(JsonnetParser.IfspecContext ctx) {
    var node = createNode(ctx, "IfSpec");
    node.add("cond", visit(ctx.expr()));
    return node;
  }

  @Override
  public JsonElement visitCompspec(JsonnetParser.CompspecContext ctx) {
    if (ctx.forspec() != null) {
      return visitForspec(ctx.forspec());
    }
    return visitIfspec(ctx.ifspec());
  }

  private JsonArray visitParamsOrEmpty(JsonnetParser.ParamsContext ctx) {
    var params = new JsonArray();
    if (ctx != null) {
      for (var param : ctx.param()) {
        params.add(visitParam(param));
      }
    }
    return params;
  }

  private JsonArray visitObjLocals(List<JsonnetParser.ObjlocalContext> locals) {
    var binds = new JsonArray();
    for (var local : locals) {
      binds.add(visitBind(local.bind()));
    }
    return binds;
  }

  private JsonArray visitSpecs(
      JsonnetParser.ForspecContext first, List<JsonnetParser.CompspecContext> rest) {
    var specs = new JsonArray();
    specs.add(visitForspec(first));
    for (var spec : rest) {
      specs.add(visitCompspec(spec));
    }
    return specs;
  }

  private JsonElement visitOrNull(ParserRuleContext ctx) {
    return ctx == null ? JsonNull.INSTANCE : visit(ctx);
  }

  private static String visibilityName(JsonnetParser.VisibilityContext ctx) {
    if (ctx.COLON3() != null) {
      return "Unhide";
    } else if (ctx.COLON2() != null) {
      return "Hidden";
    } else {
      return "Normal";
    }
  }

  private String importPath(JsonnetParser.StringContext ctx) {
    if (ctx.TEXT_BLOCK() != null) {
      throw syntaxError(ctx, "Import path must be a string literal, not a text block");
    }
    return unescapeStringContext(ctx);
  }

  private String unescapeStringContext(JsonnetParser.StringContext ctx) {
    String str = ctx.getText();
    switch (ctx.getStart().getType()) {
      case JsonnetParser.STRING_DOUBLE:
      case JsonnetParser.STRING_SINGLE:
        return unescapeString(ctx, str.substring(1, str.length() - 1));

      case JsonnetParser.VERBATIM_DOUBLE:
        return str.substring(2, str.length() - 1).replace("\"\"", "\"");

      case JsonnetParser.VERBATIM_SINGLE:
        return str.substring(2, str.length() - 1).replace("''", "'");

      case JsonnetParser.TEXT_BLOCK:
        return stripTextBlock(ctx, str);

      default:
        throw new IllegalArgumentException("Invalid string literal: " + str);
    }
  }

  private String unescapeString(ParserRuleContext ctx, String str) {
    var sb = new StringBuilder(str.length());
    for (int i = 0; i < str.length(); i++) {
      char ch = str.charAt(i);
      if (ch == '\\') {
        i++;
        char nextChar = str.charAt(i);
        switch (nextChar) {
          case '\\':
          case '/':
          case '"':
          case '\'':
            ch = nextChar;
            break;
          case 'b':
            ch = '\b';
            break;
          case 'f':
            ch = '\f';
            break;
          case 'n':
            ch = '\n';
            break;
          case 'r':
            ch = '\r';
            break;
          case 't':
            ch = '\t';
            break;
          case 'u':
            if (i + 4 >= str.length()) {
              throw syntaxError(ctx, "Truncated unicode escape sequence in string literal");
            }
            String hex = str.substring(i + 1, i + 5);
            // Integer.parseInt alone would also accept a leading sign.
            if (!hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
              throw syntaxError(ctx, "Invalid unicode escape sequence: \\u" + hex);
            }
            ch = (char) Integer.parseInt(hex, 16);
            i += 4;
            break;
          default:
            throw syntaxError(ctx, "Unknown escape sequence in string literal: \\" + nextChar);
        }
      }
      sb.append(ch);
    }
    return sb.toString();
  }

  private String stripTextBlock(ParserRuleContext ctx, String str) {
    boolean chompFinalNewline = str.startsWith("|||-");
    String body = str.substring(str.indexOf('\n') + 1, str.lastIndexOf('\n'));
    String[] lines = body.split("\n", -1);

    String indent = null;
    for (String line : lines) {
      if (!line.isBlank()) {
        indent = leadingWhitespace(line);
        break;
      }
    }
    if (indent == null || indent.isEmpty()) {
      throw syntaxError(ctx, "Text block's first line must start with whitespace");
    }

    List<String> stripped = new ArrayList<>();
    for (String line : lines) {
      line = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
      if (line.isBlank()) {
        stripped.add("");
      } else if (line.startsWith(indent)) {
        stripped.add(line.substring(indent.length()));
      } else {
        throw syntaxError(ctx, "Text block line is less indented than the first line");
      }
    }
    return String.join("\n", stripped) + (chompFinalNewline ? "" : "\n");
  }

  private static String leadingWhitespace(String line) {
    int i = 0;
    while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
      i++;
    }
    return line.substring(0, i);
  }

  private ParseException syntaxError(ParserRuleContext ctx, String message) {
    return new ParseException(sourceMap, ctx.getStart().getStartIndex(), message);
  }

  private static JsonObject createNode(String type) {
    var node = new JsonObject();
    node.addProperty("type", type);
    return node;
  }

  private static JsonObject createNode(ParserRuleContext ctx, String type) {
    return createNode(ctx.getStart(), type);
  }

  private static JsonObject createNode(Token token, String type) {
    var node = new JsonObject();
    node.addProperty("type", type);
    node.addProperty("offset", token.getStartIndex());
    return node;
  }

  private static JsonObject createNode(ParserRuleContext ctx) {
    var node = new JsonObject();
    node.addProperty("offset", ctx.getStart().getStartIndex());
    return node;
  }
}
