// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jsonnetj.ast.AstException;
import org.jsonnetj.ast.Expr;
import org.jsonnetj.ast.ExprJson;
import org.jsonnetj.ast.Resolver;
import org.jsonnetj.parser.JsonnetjParser;
import org.jsonnetj.parser.ParseException;
import org.jsonnetj.parser.SourceMap;

public class App {
  private static final String FILENAME = "<stdin>";

  private static final Gson PRETTY_GSON =
      new GsonBuilder()
          .serializeNulls()
          .serializeSpecialFloatingPointValues()
          .setPrettyPrinting()
          .create();

  public static void main(String[] args) throws Exception {
    if (System.getenv("JSONNETJ_DEBUG") != null) {
      Resolver.setDebugLogger((message, params) -> System.err.printf(message + "\n", params));
    }

    List<String> argsList = new ArrayList<>(Arrays.asList(args));
    String stdinString = "";
    if (!argsList.contains("--version")) {
      stdinString =
          new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
              .lines()
              .collect(Collectors.joining("\n"));
    }

    int status = run(argsList, stdinString, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the command line in {@code args} against {@code source} and returns the exit status. */
  static int run(List<String> args, String source, PrintStream out, PrintStream err)
      throws Exception {
    var globals = new ArrayList<String>();
    boolean dumpParseTree = false;
    boolean dumpAst = false;
    boolean readAst = false;
    for (int i = 0; i < args.size(); ++i) {
      String arg = args.get(i);
      switch (arg) {
        case "--version":
          out.println(VersionInfo.load());
          return 0;
        case "-g":
          if (i + 1 == args.size()) {
            err.println("Missing global name after -g");
            return 2;
          }
          globals.add(args.get(++i));
          break;
        case "dump-parse-tree":
          dumpParseTree = true;
          break;
        case "dump-ast":
          dumpAst = true;
          break;
        case "read-ast":
          readAst = true;
          break;
        default:
          err.println("Unrecognized argument: " + arg);
          return 2;
      }
    }

    if (readAst) {
      // Offsets in a dumped tree point into the source it was parsed from, not into this JSON.
      try {
        Expr expr = ExprJson.read(JsonParser.parseString(source));
        out.println(PRETTY_GSON.toJson(ExprJson.dump(expr)));
        return 0;
      } catch (JsonParseException
          | IllegalArgumentException
          | IllegalStateException
          | UnsupportedOperationException
          | AstException e) {
        err.printf("%s: Invalid AST: %s\n", FILENAME, e.getMessage());
        return 1;
      }
    }

    try {
      if (dumpParseTree || dumpAst) {
        if (dumpParseTree) {
          var parserOutput = JsonnetjParser.parseTrees(FILENAME, source);
          out.println(parserOutput.parseTree().toStringTree(parserOutput.parser()));
        }
        if (dumpAst) {
          JsonElement jsonAst = JsonnetjParser.parse(FILENAME, source);
          out.println(PRETTY_GSON.toJson(jsonAst));
        }
        return 0;
      }

      var tree = Resolver.parse(FILENAME, source, globals);
      out.println(PRETTY_GSON.toJson(ExprJson.dump(tree.root())));
      return 0;
    } catch (ParseException e) {
      err.println(e.getMessage());
      return 1;
    } catch (AstException e) {
      if (e.offset >= 0) {
        err.println(SourceMap.of(FILENAME, source).describe(e.offset, e.getMessage()));
      } else {
        err.printf("%s: %s\n", FILENAME, e.getMessage());
      }
      return 1;
    }
  }
}
