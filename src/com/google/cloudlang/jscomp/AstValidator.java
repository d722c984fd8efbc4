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

package com.google.cloudlang.jscomp;

import com.google.cloudlang.ast.Node;
import com.google.cloudlang.ast.Token;

/**
 * This class walks the AST and validates that the structure is correct: every node has the
 * number and the kinds of children its token calls for.
 */
public final class AstValidator {

  // Possible enhancements:
  // * verify NAME and GETPROP strings are valid JavaScript identifiers.

  static final DiagnosticType AST_VALIDATION_ERROR =
      DiagnosticType.error("JSC_AST_VALIDATION_ERROR", "{0}");

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  /** Creates a validator that throws on the first violation. */
  public AstValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message + ". Reference node:\n" + n.toStringTree());
          }
        });
  }

  public void validateProgram(Node n) {
    validateNodeType(Token.PROGRAM, n);
    for (Node c : n.children()) {
      validateStatement(c);
    }
  }

  public void validateStatement(Node n) {
    switch (n.getToken()) {
      case VAR:
      case LET:
      case CONST:
        validateNameDeclaration(n);
        return;
      case BLOCK:
        for (Node c : n.children()) {
          validateStatement(c);
        }
        return;
      case RETURN:
        validateChildCountIn(n, 0, 1);
        if (n.hasChildren()) {
          validateExpression(n.getFirstChild());
        }
        return;
      case IF:
        validateChildCountIn(n, 2, 3);
        if (n.getChildCount() >= 2) {
          validateExpression(n.getFirstChild());
          validateStatement(n.getSecondChild());
          if (n.getChildCount() == 3) {
            validateStatement(n.getLastChild());
          }
        }
        return;
      case EXPR_RESULT:
        validateChildCount(n);
        if (n.hasOneChild()) {
          validateExpression(n.getFirstChild());
        }
        return;
      case EXPORT:
        validateExport(n);
        return;
      default:
        violation("Expected statement but was " + n.getToken(), n);
    }
  }

  public void validateExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
        validateName(n);
        return;

      case STRINGLIT:
        validateChildCount(n);
        validateHasString(n);
        return;

      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
        validateChildCount(n);
        return;

      case ARRAYLIT:
        for (Node c : n.children()) {
          validateExpression(c);
        }
        return;

      case OBJECTLIT:
        for (Node c : n.children()) {
          validateNodeType(Token.STRING_KEY, c);
          validateHasString(c);
          validateChildCount(c);
          if (c.hasOneChild()) {
            validateExpression(c.getFirstChild());
          }
        }
        return;

      case FUNCTION:
        validateArrowFunction(n);
        return;

      case CALL:
      case NEW:
        validateMinimumChildCount(n, 1);
        for (Node c : n.children()) {
          validateExpression(c);
        }
        return;

      case GETPROP:
        validateChildCount(n);
        validateHasString(n);
        if (n.hasOneChild()) {
          validateExpression(n.getFirstChild());
        }
        return;

      case GETELEM:
      case HOOK:
      case AWAIT:
      case NOT:
      case NEG:
      case TYPEOF:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
      case COALESCE:
        validateChildCount(n);
        for (Node c : n.children()) {
          validateExpression(c);
        }
        return;

      default:
        violation("Expected expression but was " + n.getToken(), n);
    }
  }

  private void validateNameDeclaration(Node n) {
    validateMinimumChildCount(n, 1);
    for (Node c : n.children()) {
      if (c.isName()) {
        validateHasString(c);
        validateChildCountIn(c, 0, 1);
        if (c.hasOneChild()) {
          validateExpression(c.getFirstChild());
        }
      } else if (c.isDestructuringLhs()) {
        validateChildCountIn(c, 1, 2);
        if (c.hasChildren()) {
          validatePattern(c.getFirstChild());
        }
        if (c.getChildCount() == 2) {
          validateExpression(c.getSecondChild());
        }
      } else {
        violation("Expected NAME or DESTRUCTURING_LHS but was " + c.getToken(), c);
      }
    }
  }

  private void validateArrowFunction(Node n) {
    validateChildCount(n);
    if (n.getChildCount() != 3) {
      return;
    }
    Node name = n.getFirstChild();
    validateNodeType(Token.NAME, name);
    if (name.hasString() && !name.getString().isEmpty()) {
      violation("Arrow functions cannot have a name", name);
    }

    Node params = n.getSecondChild();
    validateNodeType(Token.PARAM_LIST, params);
    for (Node param : params.children()) {
      validateTarget(param);
    }

    Node body = n.getLastChild();
    if (body.isBlock()) {
      validateStatement(body);
    } else {
      validateExpression(body);
    }
  }

  private void validatePattern(Node n) {
    switch (n.getToken()) {
      case ARRAY_PATTERN:
        for (Node c : n.children()) {
          validateTarget(c);
        }
        return;
      case OBJECT_PATTERN:
        for (Node c : n.children()) {
          validateNodeType(Token.STRING_KEY, c);
          validateHasString(c);
          validateChildCount(c);
          if (c.hasOneChild()) {
            validateTarget(c.getFirstChild());
          }
        }
        return;
      default:
        violation("Expected destructuring pattern but was " + n.getToken(), n);
    }
  }

  /** A binding target: a plain name or a nested pattern. */
  private void validateTarget(Node n) {
    if (n.isName()) {
      validateName(n);
    } else {
      validatePattern(n);
    }
  }

  private void validateExport(Node n) {
    validateChildCount(n);
    if (!n.hasOneChild()) {
      return;
    }
    Node specs = n.getFirstChild();
    validateNodeType(Token.EXPORT_SPECS, specs);
    for (Node spec : specs.children()) {
      validateNodeType(Token.EXPORT_SPEC, spec);
      validateChildCount(spec);
      for (Node c : spec.children()) {
        validateName(c);
      }
    }
  }

  private void validateName(Node n) {
    validateNodeType(Token.NAME, n);
    validateHasString(n);
    if (n.hasString() && n.getString().isEmpty()) {
      violation("Empty name", n);
    }
    validateChildCount(n, 0);
  }

  private void validateHasString(Node n) {
    if (!n.hasString()) {
      violation(n.getToken() + " has no string", n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateChildCount(Node n) {
    int expectedArity = Token.arity(n.getToken());
    if (expectedArity != -1) {
      validateChildCount(n, expectedArity);
    }
  }

  private void validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
    }
  }

  private void validateChildCountIn(Node n, int min, int max) {
    int count = n.getChildCount();
    if (count < min || count > max) {
      violation("Expected child count in [" + min + ", " + max + "], but was " + count, n);
    }
  }

  private void validateMinimumChildCount(Node n, int min) {
    if (n.getChildCount() < min) {
      violation("Expected at least " + min + " children, but was " + n.getChildCount(), n);
    }
  }
}
