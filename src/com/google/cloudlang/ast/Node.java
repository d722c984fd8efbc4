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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.io.IOException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Unlike the mutable tree used by the optimizing passes, these nodes are immutable once built:
 * children are held in an {@link ImmutableList} and there are no parent pointers, so a tree can be
 * handed from one pass to the next without any pass observing another's changes.
 */
@Immutable
public final class Node {

  private final Token token;
  private final ImmutableList<Node> children;

  /** The name, string literal value or property name, depending on the token. */
  private final @Nullable String string;

  private final double number;
  private final boolean isAsync;

  /** One-indexed line, or -1 if unknown. */
  private final int lineno;

  /** Zero-indexed column, or -1 if unknown. */
  private final int charno;

  private Node(
      Token token,
      ImmutableList<Node> children,
      @Nullable String string,
      double number,
      boolean isAsync,
      int lineno,
      int charno) {
    this.token = checkNotNull(token);
    this.children = checkNotNull(children);
    this.string = string;
    this.number = number;
    this.isAsync = isAsync;
    this.lineno = lineno;
    this.charno = charno;
  }

  public Node(Token token) {
    this(token, ImmutableList.of());
  }

  public Node(Token token, Node child) {
    this(token, ImmutableList.of(child));
  }

  public Node(Token token, Node left, Node right) {
    this(token, ImmutableList.of(left, right));
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token, ImmutableList.of(left, mid, right));
  }

  public Node(Token token, Iterable<Node> children) {
    this(token, ImmutableList.copyOf(children), null, 0, false, -1, -1);
  }

  public static Node newString(Token token, String str) {
    return new Node(token, ImmutableList.of(), checkNotNull(str), 0, false, -1, -1);
  }

  public static Node newString(Token token, String str, Iterable<Node> children) {
    return new Node(token, ImmutableList.copyOf(children), checkNotNull(str), 0, false, -1, -1);
  }

  public static Node newNumber(double number) {
    return new Node(Token.NUMBER, ImmutableList.of(), null, number, false, -1, -1);
  }

  static Node newFunction(Node name, Node params, Node body, boolean isAsync) {
    return new Node(
        Token.FUNCTION, ImmutableList.of(name, params, body), null, 0, isAsync, -1, -1);
  }

  public Token getToken() {
    return token;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasOneChild() {
    return children.size() == 1;
  }

  public Node getOnlyChild() {
    checkState(hasOneChild(), "Expected one child, found %s", children.size());
    return children.get(0);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public boolean hasString() {
    return string != null;
  }

  /** Returns the name, string value or property name held by this node. */
  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  public boolean isAsyncFunction() {
    return isAsync;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  public String getLocation() {
    return lineno + ":" + charno;
  }

  /** Returns a copy of this node that carries the given source position. */
  public Node withLinenoCharno(int lineno, int charno) {
    checkArgument(lineno >= -1 && charno >= -1, "bad position %s:%s", lineno, charno);
    return new Node(token, children, string, number, isAsync, lineno, charno);
  }

  // Token predicates, in the order of the Token enum.

  public boolean isProgram() {
    return token == Token.PROGRAM;
  }

  public boolean isNameDeclaration() {
    return token.isNameDeclaration();
  }

  public boolean isDestructuringLhs() {
    return token == Token.DESTRUCTURING_LHS;
  }

  public boolean isDestructuringPattern() {
    return token == Token.ARRAY_PATTERN || token == Token.OBJECT_PATTERN;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isLiteralValue() {
    return token.isLiteralValue();
  }

  public boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isReturn() {
    return token == Token.RETURN;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isNew() {
    return token == Token.NEW;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public boolean isExport() {
    return token == Token.EXPORT;
  }

  public boolean isExportSpecs() {
    return token == Token.EXPORT_SPECS;
  }

  public boolean isExportSpec() {
    return token == Token.EXPORT_SPEC;
  }

  /** Checks whether this node is a statement according to the shapes this compiler accepts. */
  public boolean isStatement() {
    return switch (token) {
      case VAR, LET, CONST, BLOCK, RETURN, IF, EXPR_RESULT, EXPORT -> true;
      default -> false;
    };
  }

  /**
   * Checks if the subtree under this node is the same as another subtree. Source positions are
   * ignored.
   */
  public boolean isEquivalentTo(Node node) {
    if (token != node.token
        || children.size() != node.children.size()
        || !Objects.equals(string, node.string)
        || Double.compare(number, node.number) != 0
        || isAsync != node.isAsync) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(node.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ');
      sb.append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ');
      sb.append(number);
    }
    if (isAsync) {
      sb.append(" [async]");
    }
    if (lineno != -1) {
      sb.append(' ');
      sb.append(lineno);
      sb.append(':');
      sb.append(charno);
    }
    return sb.toString();
  }

  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    try {
      appendStringTree(sb);
    } catch (IOException e) {
      throw new IllegalStateException("Should not happen", e);
    }
    return sb.toString();
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node child : n.children) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
