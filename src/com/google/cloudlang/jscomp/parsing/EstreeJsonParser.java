/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloudlang.jscomp.parsing;

import com.google.cloudlang.ast.IR;
import com.google.cloudlang.ast.Node;
import com.google.cloudlang.ast.Token;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts the ESTree JSON produced by {@code @typescript-eslint/typescript-estree} into an AST.
 *
 * <p>Only the subset of the language the decomposition understands is accepted; anything else is
 * rejected with an {@link EstreeParseException} naming the node type and its position. Type
 * annotations are ignored, TypeScript expression wrappers such as {@code x as T} and {@code x!} are
 * unwrapped, and type-only declarations are dropped.
 */
public final class EstreeJsonParser {

  private static final ImmutableMap<String, Token> DECLARATION_KINDS =
      ImmutableMap.of("var", Token.VAR, "let", Token.LET, "const", Token.CONST);

  private static final ImmutableMap<String, Token> BINARY_OPERATORS =
      ImmutableMap.<String, Token>builder()
          .put("+", Token.ADD)
          .put("-", Token.SUB)
          .put("*", Token.MUL)
          .put("/", Token.DIV)
          .put("%", Token.MOD)
          .put("==", Token.EQ)
          .put("!=", Token.NE)
          .put("===", Token.SHEQ)
          .put("!==", Token.SHNE)
          .put("<", Token.LT)
          .put("<=", Token.LE)
          .put(">", Token.GT)
          .put(">=", Token.GE)
          .buildOrThrow();

  private static final ImmutableMap<String, Token> LOGICAL_OPERATORS =
      ImmutableMap.of("&&", Token.AND, "||", Token.OR, "??", Token.COALESCE);

  private static final ImmutableMap<String, Token> UNARY_OPERATORS =
      ImmutableMap.of("!", Token.NOT, "-", Token.NEG, "typeof", Token.TYPEOF);

  /** Expression wrappers that only carry type information. */
  private static final ImmutableSet<String> TS_EXPRESSION_WRAPPERS =
      ImmutableSet.of(
          "TSAsExpression", "TSNonNullExpression", "TSSatisfiesExpression", "TSTypeAssertion");

  /** Statements that only declare types. */
  private static final ImmutableSet<String> TS_TYPE_DECLARATIONS =
      ImmutableSet.of("TSTypeAliasDeclaration", "TSInterfaceDeclaration");

  private EstreeJsonParser() {}

  /**
   * Parses an ESTree document. The root is normally a {@code Program}, but any supported node is
   * converted so that callers can report a misplaced root themselves.
   */
  public static Node parse(String contents) throws EstreeParseException {
    JsonElement root;
    try {
      root = JsonParser.parseString(contents);
    } catch (JsonParseException ex) {
      throw new EstreeParseException("JSON parse exception: " + ex.getMessage());
    }
    if (!root.isJsonObject()) {
      throw new EstreeParseException("Expected an ESTree node object at the top level");
    }
    JsonObject node = root.getAsJsonObject();
    if (TS_TYPE_DECLARATIONS.contains(getType(node))) {
      throw unsupported(node);
    }
    return convert(node);
  }

  private static Node convert(JsonObject node) throws EstreeParseException {
    String type = getType(node);
    if (TS_EXPRESSION_WRAPPERS.contains(type)) {
      return convert(getObject(node, "expression"));
    }
    Node result;
    switch (type) {
      case "Program":
        result = IR.program(convertStatements(getArray(node, "body")));
        break;
      case "VariableDeclaration":
        result = convertVariableDeclaration(node);
        break;
      case "Identifier":
        result = IR.name(getString(node, "name"));
        break;
      case "Literal":
        result = convertLiteral(node);
        break;
      case "TemplateLiteral":
        result = convertTemplateLiteral(node);
        break;
      case "ArrowFunctionExpression":
        result = convertArrowFunction(node);
        break;
      case "BlockStatement":
        result = IR.block(convertStatements(getArray(node, "body")));
        break;
      case "ReturnStatement":
        {
          JsonObject argument = getOptionalObject(node, "argument");
          result = argument == null ? IR.returnNode() : IR.returnNode(convertExpression(argument));
          break;
        }
      case "IfStatement":
        {
          Node cond = convertExpression(getObject(node, "test"));
          Node then = convertStatement(getObject(node, "consequent"));
          JsonObject alternate = getOptionalObject(node, "alternate");
          result =
              alternate == null
                  ? IR.ifNode(cond, then)
                  : IR.ifNode(cond, then, convertStatement(alternate));
          break;
        }
      case "ExpressionStatement":
        result = IR.exprResult(convertExpression(getObject(node, "expression")));
        break;
      case "CallExpression":
        result =
            IR.call(
                convertExpression(getObject(node, "callee")),
                convertArguments(getArray(node, "arguments")));
        break;
      case "NewExpression":
        result =
            IR.newNode(
                convertExpression(getObject(node, "callee")),
                convertArguments(getArray(node, "arguments")));
        break;
      case "MemberExpression":
        result = convertMemberExpression(node);
        break;
      case "BinaryExpression":
        result = convertOperator(node, BINARY_OPERATORS);
        break;
      case "LogicalExpression":
        result = convertOperator(node, LOGICAL_OPERATORS);
        break;
      case "ConditionalExpression":
        result =
            IR.hook(
                convertExpression(getObject(node, "test")),
                convertExpression(getObject(node, "consequent")),
                convertExpression(getObject(node, "alternate")));
        break;
      case "AwaitExpression":
        result = IR.await(convertExpression(getObject(node, "argument")));
        break;
      case "UnaryExpression":
        {
          Token token = UNARY_OPERATORS.get(getString(node, "operator"));
          if (token == null) {
            throw unsupportedOperator(node);
          }
          result = IR.unaryOp(token, convertExpression(getObject(node, "argument")));
          break;
        }
      case "ArrayExpression":
        result = IR.arraylit(convertElements(node, false));
        break;
      case "ObjectExpression":
        result = IR.objectlit(convertProperties(node, false));
        break;
      case "ArrayPattern":
        result = IR.arrayPattern(convertElements(node, true));
        break;
      case "ObjectPattern":
        result = IR.objectPattern(convertProperties(node, true));
        break;
      case "ExportNamedDeclaration":
        result = convertExportSpecifiers(node);
        break;
      default:
        throw unsupported(node);
    }
    return withPosition(result, node);
  }

  private static Node convertStatement(JsonObject node) throws EstreeParseException {
    Node n = convert(node);
    if (!n.isStatement()) {
      throw new EstreeParseException(
          "Expected a statement but found " + getType(node), lineOf(node), columnOf(node));
    }
    return n;
  }

  private static Node convertExpression(JsonObject node) throws EstreeParseException {
    Node n = convert(node);
    if (!IR.mayBeExpression(n)) {
      throw new EstreeParseException(
          "Expected an expression but found " + getType(node), lineOf(node), columnOf(node));
    }
    return n;
  }

  /**
   * Converts a statement list. {@code export const f = ...} becomes the declaration followed by an
   * {@code export { f }}. Type-only declarations are dropped.
   */
  private static ImmutableList<Node> convertStatements(JsonArray body)
      throws EstreeParseException {
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    for (JsonElement element : body) {
      JsonObject statement = asObject(element);
      String type = getType(statement);
      if (TS_TYPE_DECLARATIONS.contains(type) || isTypeOnlyExport(statement)) {
        continue;
      }
      if (type.equals("ExportNamedDeclaration")) {
        JsonObject declaration = getOptionalObject(statement, "declaration");
        if (declaration != null) {
          if (TS_TYPE_DECLARATIONS.contains(getType(declaration))) {
            continue;
          }
          Node declarationNode = convertStatement(declaration);
          if (!declarationNode.isNameDeclaration()) {
            throw unsupported(declaration);
          }
          statements.add(declarationNode);
          List<Node> specs = new ArrayList<>();
          for (Node declarator : declarationNode.children()) {
            if (declarator.isName()) {
              specs.add(
                  IR.exportSpec(declarator.getString())
                      .withLinenoCharno(declarator.getLineno(), declarator.getCharno()));
            }
          }
          statements.add(
              withPosition(IR.exportSpecs(specs.toArray(new Node[0])), statement));
          continue;
        }
      }
      statements.add(convertStatement(statement));
    }
    return statements.build();
  }

  private static boolean isTypeOnlyExport(JsonObject statement) {
    return getType(statement).equals("ExportNamedDeclaration")
        && "type".equals(getOptionalString(statement, "exportKind"));
  }

  private static Node convertVariableDeclaration(JsonObject node) throws EstreeParseException {
    Token token = DECLARATION_KINDS.get(getString(node, "kind"));
    if (token == null) {
      throw new EstreeParseException(
          "Unsupported declaration kind: " + getString(node, "kind"), lineOf(node), columnOf(node));
    }
    JsonArray declarations = getArray(node, "declarations");
    if (declarations.isEmpty()) {
      throw new EstreeParseException(
          "A declaration needs at least one declarator", lineOf(node), columnOf(node));
    }
    ImmutableList.Builder<Node> declarators = ImmutableList.builder();
    for (JsonElement element : declarations) {
      JsonObject declarator = asObject(element);
      if (!getType(declarator).equals("VariableDeclarator")) {
        throw unsupported(declarator);
      }
      Node target = convertTarget(getObject(declarator, "id"));
      JsonObject init = getOptionalObject(declarator, "init");
      Node converted;
      if (init != null) {
        converted = IR.declarator(target, convertExpression(init));
      } else if (target.isDestructuringPattern()) {
        converted = new Node(Token.DESTRUCTURING_LHS, target);
      } else {
        converted = target;
      }
      declarators.add(withPosition(converted, declarator));
    }
    return IR.declaration(token, declarators.build());
  }

  /** Converts a binding target: a name or a destructuring pattern. */
  private static Node convertTarget(JsonObject node) throws EstreeParseException {
    switch (getType(node)) {
      case "Identifier":
      case "ArrayPattern":
      case "ObjectPattern":
        return convert(node);
      default:
        throw unsupported(node);
    }
  }

  private static Node convertLiteral(JsonObject node) throws EstreeParseException {
    if (node.has("regex") || node.has("bigint")) {
      throw new EstreeParseException(
          "Unsupported literal: " + getOptionalString(node, "raw"), lineOf(node), columnOf(node));
    }
    JsonElement value = node.get("value");
    if (value == null || value.isJsonNull()) {
      return IR.nullNode();
    }
    if (!value.isJsonPrimitive()) {
      throw unsupported(node);
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean() ? IR.trueNode() : IR.falseNode();
    } else if (primitive.isNumber()) {
      return IR.number(primitive.getAsDouble());
    }
    return IR.string(primitive.getAsString());
  }

  /** Only templates without substitutions are accepted; they are plain strings. */
  private static Node convertTemplateLiteral(JsonObject node) throws EstreeParseException {
    if (!getArray(node, "expressions").isEmpty()) {
      throw new EstreeParseException(
          "Template literals with substitutions are not supported", lineOf(node), columnOf(node));
    }
    JsonArray quasis = getArray(node, "quasis");
    StringBuilder sb = new StringBuilder();
    for (JsonElement quasi : quasis) {
      JsonObject value = getObject(asObject(quasi), "value");
      sb.append(getString(value, "cooked"));
    }
    return IR.string(sb.toString());
  }

  private static Node convertArrowFunction(JsonObject node) throws EstreeParseException {
    ImmutableList.Builder<Node> params = ImmutableList.builder();
    for (JsonElement element : getArray(node, "params")) {
      params.add(convertTarget(asObject(element)));
    }
    JsonObject body = getObject(node, "body");
    Node bodyNode =
        getType(body).equals("BlockStatement") ? convert(body) : convertExpression(body);
    boolean isAsync = node.has("async") && node.get("async").getAsBoolean();
    return IR.arrowFunction(IR.paramList(params.build()), bodyNode, isAsync);
  }

  private static Node[] convertArguments(JsonArray arguments) throws EstreeParseException {
    Node[] result = new Node[arguments.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = convertExpression(asObject(arguments.get(i)));
    }
    return result;
  }

  private static Node convertMemberExpression(JsonObject node) throws EstreeParseException {
    Node object = convertExpression(getObject(node, "object"));
    JsonObject property = getObject(node, "property");
    boolean computed = node.has("computed") && node.get("computed").getAsBoolean();
    if (computed) {
      return IR.getelem(object, convertExpression(property));
    }
    if (!getType(property).equals("Identifier")) {
      throw unsupported(property);
    }
    return IR.getprop(object, getString(property, "name"));
  }

  private static Node convertOperator(JsonObject node, ImmutableMap<String, Token> operators)
      throws EstreeParseException {
    Token token = operators.get(getString(node, "operator"));
    if (token == null) {
      throw unsupportedOperator(node);
    }
    return IR.binaryOp(
        token,
        convertExpression(getObject(node, "left")),
        convertExpression(getObject(node, "right")));
  }

  private static Node[] convertElements(JsonObject node, boolean isPattern)
      throws EstreeParseException {
    JsonArray elements = getArray(node, "elements");
    Node[] result = new Node[elements.size()];
    for (int i = 0; i < result.length; i++) {
      JsonElement element = elements.get(i);
      if (element.isJsonNull()) {
        throw new EstreeParseException(
            "Array holes are not supported", lineOf(node), columnOf(node));
      }
      JsonObject child = asObject(element);
      result[i] = isPattern ? convertTarget(child) : convertExpression(child);
    }
    return result;
  }

  private static Node[] convertProperties(JsonObject node, boolean isPattern)
      throws EstreeParseException {
    JsonArray properties = getArray(node, "properties");
    Node[] result = new Node[properties.size()];
    for (int i = 0; i < result.length; i++) {
      JsonObject property = asObject(properties.get(i));
      if (!getType(property).equals("Property")
          || (property.has("computed") && property.get("computed").getAsBoolean())
          || !"init".equals(getOptionalString(property, "kind"))) {
        throw unsupported(property);
      }
      String key = getPropertyKey(getObject(property, "key"));
      JsonObject value = getObject(property, "value");
      Node valueNode = isPattern ? convertTarget(value) : convertExpression(value);
      result[i] = withPosition(IR.stringKey(key, valueNode), property);
    }
    return result;
  }

  private static String getPropertyKey(JsonObject key) throws EstreeParseException {
    switch (getType(key)) {
      case "Identifier":
        return getString(key, "name");
      case "Literal":
        return key.get("value").getAsString();
      default:
        throw unsupported(key);
    }
  }

  private static Node convertExportSpecifiers(JsonObject node) throws EstreeParseException {
    if (getOptionalObject(node, "source") != null) {
      throw new EstreeParseException(
          "Re-exports from another module are not supported", lineOf(node), columnOf(node));
    }
    if (getOptionalObject(node, "declaration") != null) {
      // Only reachable when the export is not in a statement list.
      throw unsupported(node);
    }
    JsonArray specifiers = getArray(node, "specifiers");
    Node[] specs = new Node[specifiers.size()];
    for (int i = 0; i < specs.length; i++) {
      JsonObject specifier = asObject(specifiers.get(i));
      if (!getType(specifier).equals("ExportSpecifier")) {
        throw unsupported(specifier);
      }
      String local = getPropertyKey(getObject(specifier, "local"));
      JsonObject exported = getOptionalObject(specifier, "exported");
      String exportedName = exported == null ? local : getPropertyKey(exported);
      specs[i] = withPosition(IR.exportSpec(local, exportedName), specifier);
    }
    return IR.exportSpecs(specs);
  }

  private static Node withPosition(Node n, JsonObject node) {
    int lineno = lineOf(node);
    return lineno == -1 ? n : n.withLinenoCharno(lineno, columnOf(node));
  }

  private static int lineOf(JsonObject node) {
    JsonObject start = getStart(node);
    return start != null && start.has("line") ? start.get("line").getAsInt() : -1;
  }

  private static int columnOf(JsonObject node) {
    JsonObject start = getStart(node);
    return start != null && start.has("column") ? start.get("column").getAsInt() : -1;
  }

  private static @Nullable JsonObject getStart(JsonObject node) {
    JsonElement loc = node.get("loc");
    if (loc == null || !loc.isJsonObject()) {
      return null;
    }
    JsonElement start = loc.getAsJsonObject().get("start");
    return start != null && start.isJsonObject() ? start.getAsJsonObject() : null;
  }

  private static EstreeParseException unsupported(JsonObject node) {
    return new EstreeParseException(
        "Unsupported ESTree node type: " + getType(node), lineOf(node), columnOf(node));
  }

  private static EstreeParseException unsupportedOperator(JsonObject node) {
    return new EstreeParseException(
        "Unsupported operator " + getOptionalString(node, "operator") + " in " + getType(node),
        lineOf(node),
        columnOf(node));
  }

  private static String getType(JsonObject node) {
    String type = getOptionalString(node, "type");
    return type == null ? "(missing type)" : type;
  }

  private static JsonObject asObject(JsonElement element) throws EstreeParseException {
    if (element == null || !element.isJsonObject()) {
      throw new EstreeParseException("Expected an ESTree node but found " + element);
    }
    return element.getAsJsonObject();
  }

  private static JsonObject getObject(JsonObject node, String key) throws EstreeParseException {
    JsonObject child = getOptionalObject(node, key);
    if (child == null) {
      throw new EstreeParseException(
          "Missing '" + key + "' in " + getType(node), lineOf(node), columnOf(node));
    }
    return child;
  }

  private static @Nullable JsonObject getOptionalObject(JsonObject node, String key) {
    JsonElement child = node.get(key);
    return child != null && child.isJsonObject() ? child.getAsJsonObject() : null;
  }

  private static JsonArray getArray(JsonObject node, String key) throws EstreeParseException {
    JsonElement child = node.get(key);
    if (child == null || !child.isJsonArray()) {
      throw new EstreeParseException(
          "Missing '" + key + "' in " + getType(node), lineOf(node), columnOf(node));
    }
    return child.getAsJsonArray();
  }

  private static String getString(JsonObject node, String key) throws EstreeParseException {
    String value = getOptionalString(node, key);
    if (value == null) {
      throw new EstreeParseException(
          "Missing '" + key + "' in " + getType(node), lineOf(node), columnOf(node));
    }
    return value;
  }

  private static @Nullable String getOptionalString(JsonObject node, String key) {
    JsonElement value = node.get(key);
    return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
  }
}
