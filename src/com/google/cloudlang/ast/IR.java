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

package com.google.cloudlang.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node program(Node... stmts) {
    return program(ImmutableList.copyOf(stmts));
  }

  public static Node program(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Program node cannot contain %s", stmt.getToken());
    }
    return new Node(Token.PROGRAM, stmts);
  }

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Block node cannot contain %s", stmt.getToken());
    }
    return new Node(Token.BLOCK, stmts);
  }

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(lhs, value, Token.LET);
  }

  public static Node constNode(Node lhs, Node value) {
    return declaration(lhs, value, Token.CONST);
  }

  /** Creates a declaration without an initializer, e.g. {@code let x;}. */
  public static Node declaration(Node lhs, Token type) {
    checkState(type.isNameDeclaration(), type);
    checkState(lhs.isName() || lhs.isDestructuringPattern(), lhs);
    if (lhs.isDestructuringPattern()) {
      lhs = new Node(Token.DESTRUCTURING_LHS, lhs);
    }
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    return new Node(type, declarator(lhs, value));
  }

  /** Creates a declaration with several declarators, e.g. {@code const a = 1, b = 2;}. */
  public static Node declaration(Token type, List<Node> declarators) {
    checkState(type.isNameDeclaration(), type);
    checkArgument(!declarators.isEmpty(), "A declaration needs at least one declarator");
    for (Node declarator : declarators) {
      checkState(declarator.isName() || declarator.isDestructuringLhs(), declarator);
    }
    return new Node(type, declarators);
  }

  /**
   * Attaches an initializer to a declaration target. A NAME target keeps the value as its only
   * child; a pattern is wrapped in a DESTRUCTURING_LHS.
   */
  public static Node declarator(Node lhs, Node value) {
    checkState(mayBeExpression(value), value);
    if (lhs.isName()) {
      checkState(!lhs.hasChildren(), "%s already has an initializer", lhs);
      return Node.newString(Token.NAME, lhs.getString(), ImmutableList.of(value))
          .withLinenoCharno(lhs.getLineno(), lhs.getCharno());
    }
    checkState(lhs.isDestructuringPattern(), lhs);
    return new Node(Token.DESTRUCTURING_LHS, lhs, value);
  }

  public static Node arrayPattern(Node... targets) {
    for (Node target : targets) {
      checkState(target.isName() || target.isDestructuringPattern(), target);
    }
    return new Node(Token.ARRAY_PATTERN, ImmutableList.copyOf(targets));
  }

  public static Node objectPattern(Node... keys) {
    for (Node key : keys) {
      checkState(key.isStringKey(), key);
    }
    return new Node(Token.OBJECT_PATTERN, ImmutableList.copyOf(keys));
  }

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'. Use getprop for member access", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node paramList(Node... params) {
    return paramList(ImmutableList.copyOf(params));
  }

  public static Node paramList(List<Node> params) {
    for (Node param : params) {
      checkState(param.isName() || param.isDestructuringPattern(), param);
    }
    return new Node(Token.PARAM_LIST, params);
  }

  public static Node arrowFunction(Node params, Node body) {
    return arrowFunction(params, body, false);
  }

  public static Node arrowFunction(Node params, Node body, boolean isAsync) {
    checkState(params.isParamList());
    checkState(body.isBlock() || mayBeExpression(body));
    return Node.newFunction(name(""), params, body, isAsync);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isStatement());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isStatement());
    checkState(elseNode.isStatement());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target));
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    children.add(target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      children.add(arg);
    }
    return new Node(Token.CALL, children.build());
  }

  public static Node newNode(Node target, Node... args) {
    checkState(mayBeExpression(target));
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    children.add(target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      children.add(arg);
    }
    return new Node(Token.NEW, children.build());
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    return Node.newString(Token.GETPROP, prop, ImmutableList.of(target));
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(trueval));
    checkState(mayBeExpression(falseval));
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node await(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.AWAIT, expr);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node unaryOp(Token token, Node expr) {
    checkState(token.isUnaryOperator(), token);
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(token.isBinaryOperator() || token.isLogicalOperator(), token);
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(token, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node coalesce(Node expr1, Node expr2) {
    return binaryOp(Token.COALESCE, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node arraylit(Node... exprs) {
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
    }
    return new Node(Token.ARRAYLIT, ImmutableList.copyOf(exprs));
  }

  public static Node objectlit(Node... propdefs) {
    for (Node propdef : propdefs) {
      checkState(propdef.isStringKey(), propdef);
    }
    return new Node(Token.OBJECTLIT, ImmutableList.copyOf(propdefs));
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value) || value.isDestructuringPattern(), value);
    return Node.newString(Token.STRING_KEY, s, ImmutableList.of(value));
  }

  public static Node string(String s) {
    return Node.newString(Token.STRINGLIT, s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  /** Creates {@code export { a, b as c };}. */
  public static Node exportSpecs(Node... specs) {
    for (Node spec : specs) {
      checkState(spec.isExportSpec(), spec);
    }
    return new Node(Token.EXPORT, new Node(Token.EXPORT_SPECS, ImmutableList.copyOf(specs)));
  }

  public static Node exportSpec(String local) {
    return exportSpec(local, local);
  }

  public static Node exportSpec(String local, String exported) {
    return new Node(Token.EXPORT_SPEC, name(local), name(exported));
  }

  /** Creates {@code export { a, b };} for the given local names. */
  public static Node exportNames(String... names) {
    Node[] specs = new Node[names.length];
    for (int i = 0; i < names.length; i++) {
      specs[i] = exportSpec(names[i]);
    }
    return exportSpecs(specs);
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case NAME:
      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
      case ARRAYLIT:
      case OBJECTLIT:
      case CALL:
      case NEW:
      case GETPROP:
      case GETELEM:
      case HOOK:
      case AWAIT:
        return true;
      default:
        Token token = n.getToken();
        return token.isBinaryOperator() || token.isLogicalOperator() || token.isUnaryOperator();
    }
  }
}
