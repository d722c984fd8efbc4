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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.cloudlang.ast.Node;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Finds the module-level bindings of a program and, for every top-level arrow function, the
 * bindings it references, the functions it calls and the mutable state it captures.
 *
 * <p>The analysis makes three passes over the top-level statements:
 *
 * <ol>
 *   <li>declarations: every declarator with a single name target becomes a {@link ModuleVar}.
 *   <li>closures: every single-declarator declaration initialized with an arrow function gets a
 *       {@link ClosureInfo}, unless it redeclares an earlier name.
 *   <li>exports: the local names of every {@code export { ... }} specifier.
 * </ol>
 *
 * <p>Anything the analysis does not understand (destructuring targets, unresolved names,
 * shadowing beyond one level of locals) is left out of the result rather than reported. A
 * redeclared module binding is reported as a warning.
 */
public final class ScopeAnalyzer {

  static final DiagnosticType EXPECTED_PROGRAM_NODE =
      DiagnosticType.error("JSC_EXPECTED_PROGRAM_NODE", "expected Program node");

  static final DiagnosticType DUPLICATE_MODULE_BINDING =
      DiagnosticType.warning(
          "JSC_DUPLICATE_MODULE_BINDING",
          "Module binding {0} is already declared, only its first declaration is analyzed");

  /** Constructors whose fresh instances are treated as shared mutable state. */
  private static final ImmutableSet<String> MUTABLE_CONTAINERS =
      ImmutableSet.of("Map", "Set", "Array");

  private final ErrorManager errorManager;
  private final @Nullable String sourceName;

  /** Creates an analyzer that logs its warnings to the compiler logger. */
  public ScopeAnalyzer() {
    this(new LoggerErrorManager(Compiler.logger), null);
  }

  /**
   * @param errorManager receives the warnings of the analysis
   * @param sourceName the name warnings are attributed to, or null if unknown
   */
  public ScopeAnalyzer(ErrorManager errorManager, @Nullable String sourceName) {
    this.errorManager = checkNotNull(errorManager);
    this.sourceName = sourceName;
  }

  public AnalysisResult analyze(Node root) throws AnalysisException {
    if (!root.isProgram()) {
      throw new AnalysisException(JSError.make(root, EXPECTED_PROGRAM_NODE));
    }
    ImmutableList<Node> body = root.children();

    Map<String, ModuleVar> moduleVars = collectModuleVars(body);
    ImmutableList<ClosureInfo> closures = collectClosures(body, moduleVars);
    ImmutableList<String> exports = collectExports(body);
    return AnalysisResult.create(closures, moduleVars.values(), exports);
  }

  private Map<String, ModuleVar> collectModuleVars(ImmutableList<Node> body) {
    Map<String, ModuleVar> moduleVars = new LinkedHashMap<>();
    for (Node statement : body) {
      if (!statement.isNameDeclaration()) {
        continue;
      }
      for (Node declarator : statement.children()) {
        if (!declarator.isName()) {
          // Destructuring declares several names at once and is not tracked.
          continue;
        }
        Node init = declarator.getFirstChild();
        boolean isMutableState = init != null && isMutableInit(init);
        boolean isFunction = init != null && init.isFunction();
        ModuleVar previous =
            moduleVars.putIfAbsent(
                declarator.getString(),
                ModuleVar.create(declarator.getString(), isMutableState, isFunction));
        if (previous != null) {
          JSError error = JSError.make(declarator, DUPLICATE_MODULE_BINDING, previous.getName());
          if (sourceName != null) {
            error = error.withSourceName(sourceName);
          }
          errorManager.report(error.defaultLevel(), error);
        }
      }
    }
    return moduleVars;
  }

  /** Whether {@code n} is {@code new Map(...)}, {@code new Set(...)} or {@code new Array(...)}. */
  private static boolean isMutableInit(Node n) {
    if (!n.isNew()) {
      return false;
    }
    Node callee = n.getFirstChild();
    return callee != null && callee.isName() && MUTABLE_CONTAINERS.contains(callee.getString());
  }

  private static ImmutableList<ClosureInfo> collectClosures(
      ImmutableList<Node> body, Map<String, ModuleVar> moduleVars) {
    ImmutableList.Builder<ClosureInfo> closures = ImmutableList.builder();
    // Only the first declaration of a name defines it, as in collectModuleVars.
    Set<String> declared = new HashSet<>();
    for (Node statement : body) {
      if (!statement.isNameDeclaration()) {
        continue;
      }
      Node function = getSingleArrowInitializer(statement);
      for (Node declarator : statement.children()) {
        if (declarator.isName() && declared.add(declarator.getString()) && function != null) {
          closures.add(analyzeClosure(declarator.getString(), function, moduleVars));
        }
      }
    }
    return closures.build();
  }

  /**
   * Returns the arrow function of {@code const name = (...) => ...}, or null if the statement is
   * anything else, including a declaration with more than one declarator.
   */
  private static @Nullable Node getSingleArrowInitializer(Node statement) {
    if (!statement.isNameDeclaration() || !statement.hasOneChild()) {
      return null;
    }
    Node declarator = statement.getOnlyChild();
    if (!declarator.isName() || !declarator.hasOneChild()) {
      return null;
    }
    Node init = declarator.getOnlyChild();
    return init.isFunction() ? init : null;
  }

  private static ClosureInfo analyzeClosure(
      String name, Node function, Map<String, ModuleVar> moduleVars) {
    Node params = function.getSecondChild();
    Node body = function.getLastChild();

    Set<String> bound = new LinkedHashSet<>();
    for (Node param : params.children()) {
      if (param.isName()) {
        bound.add(param.getString());
      }
    }
    collectLocals(body, bound);

    Set<String> references = new LinkedHashSet<>();
    Set<String> calls = new LinkedHashSet<>();
    collectNames(body, references, calls);

    ImmutableSet.Builder<String> freeVars = ImmutableSet.builder();
    ImmutableSet.Builder<String> capturesMutable = ImmutableSet.builder();
    for (String reference : references) {
      ModuleVar var = moduleVars.get(reference);
      if (var == null || bound.contains(reference)) {
        continue;
      }
      freeVars.add(reference);
      if (var.isMutableState()) {
        capturesMutable.add(reference);
      }
    }

    ImmutableSet.Builder<String> calledFunctions = ImmutableSet.builder();
    for (String callee : calls) {
      ModuleVar var = moduleVars.get(callee);
      if (var != null && var.isFunction() && !bound.contains(callee)) {
        calledFunctions.add(callee);
      }
    }
    return ClosureInfo.create(
        name, freeVars.build(), calledFunctions.build(), capturesMutable.build());
  }

  /**
   * Adds the names declared directly in a function body block, and those declared directly in the
   * branches of an IF statement that sits in that block. Declarations any deeper are not found.
   */
  private static void collectLocals(Node body, Set<String> locals) {
    if (!body.isBlock()) {
      return;
    }
    for (Node statement : body.children()) {
      if (statement.isNameDeclaration()) {
        addDeclaredNames(statement, locals);
      } else if (statement.isIf()) {
        for (Node branch : statement.children().subList(1, statement.getChildCount())) {
          if (branch.isNameDeclaration()) {
            addDeclaredNames(branch, locals);
          } else if (branch.isBlock()) {
            for (Node child : branch.children()) {
              if (child.isNameDeclaration()) {
                addDeclaredNames(child, locals);
              }
            }
          }
        }
      }
    }
  }

  private static void addDeclaredNames(Node declaration, Set<String> names) {
    for (Node declarator : declaration.children()) {
      if (declarator.isName()) {
        names.add(declarator.getString());
      }
    }
  }

  /**
   * Walks an expression or statement collecting every referenced name into {@code references} and
   * the callee of every direct call into {@code calls}.
   *
   * <p>Literals reference nothing. Only the object side of a member access is a reference. Nested
   * functions are opaque.
   */
  private static void collectNames(Node n, Set<String> references, Set<String> calls) {
    switch (n.getToken()) {
      case NAME:
        references.add(n.getString());
        return;

      case VAR:
      case LET:
      case CONST:
        for (Node declarator : n.children()) {
          // The declared name is a binding, only the initializer can hold references.
          Node init =
              declarator.isName() ? declarator.getFirstChild() : declarator.getSecondChild();
          if (init != null) {
            collectNames(init, references, calls);
          }
        }
        return;

      case CALL:
        Node callee = n.getFirstChild();
        if (callee.isName()) {
          calls.add(callee.getString());
        }
        collectChildren(n, references, calls);
        return;

      case GETPROP:
      case GETELEM:
        collectNames(n.getFirstChild(), references, calls);
        return;

      case STRING_KEY:
        collectNames(n.getOnlyChild(), references, calls);
        return;

      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
      case FUNCTION:
      case PARAM_LIST:
      case DESTRUCTURING_LHS:
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
      case EXPORT:
      case EXPORT_SPECS:
      case EXPORT_SPEC:
        return;

      case PROGRAM:
      case BLOCK:
      case RETURN:
      case IF:
      case EXPR_RESULT:
      case NEW:
      case HOOK:
      case AWAIT:
      case NOT:
      case NEG:
      case TYPEOF:
      case ARRAYLIT:
      case OBJECTLIT:
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
        collectChildren(n, references, calls);
        return;

      default:
        throw new IllegalStateException("Unexpected token " + n.getToken());
    }
  }

  private static void collectChildren(Node n, Set<String> references, Set<String> calls) {
    for (Node child : n.children()) {
      collectNames(child, references, calls);
    }
  }

  private static ImmutableList<String> collectExports(ImmutableList<Node> body) {
    ImmutableList.Builder<String> exports = ImmutableList.builder();
    for (Node statement : body) {
      if (!statement.isExport()) {
        continue;
      }
      Node specs = statement.getOnlyChild();
      for (Node spec : specs.children()) {
        Node local = spec.getFirstChild();
        if (local.isName()) {
          exports.add(local.getString());
        }
      }
    }
    return exports.build();
  }
}
