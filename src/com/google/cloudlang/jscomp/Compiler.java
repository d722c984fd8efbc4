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
import static com.google.common.base.Preconditions.checkState;

import com.google.cloudlang.ast.Node;
import com.google.cloudlang.jscomp.parsing.EstreeJsonParser;
import com.google.cloudlang.jscomp.parsing.EstreeParseException;
import com.google.cloudlang.jscomp.resources.Config;
import com.google.common.collect.ImmutableList;
import java.io.PrintStream;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>parses the ESTree JSON of a module and validates the resulting AST
 *   <li>analyzes the closures of the module and the state they capture
 *   <li>partitions the closures into worker groups
 *   <li>builds the resource graph of the workers
 * </ul>
 *
 * <p>A Compiler instance runs a single compilation.
 */
public class Compiler {

  /**
   * Logger for the whole com.google.cloudlang.jscomp domain - setting configuration for this
   * logger affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.cloudlang.jscomp");

  static final DiagnosticType PARSE_ERROR = DiagnosticType.error("JSC_PARSE_ERROR", "{0}");

  static final DiagnosticType DUPLICATE_GROUP_NAME =
      DiagnosticType.error("JSC_DUPLICATE_GROUP_NAME", "More than one worker group is named {0}");

  private final ErrorManager errorManager;
  private CloudLangOptions options = new CloudLangOptions();
  private boolean hasRun = false;

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler() {
    this(new LoggerErrorManager(logger));
  }

  /** Creates a Compiler that reports errors and warnings to an output stream. */
  public Compiler(PrintStream outStream) {
    this(new PrintStreamErrorManager(outStream));
  }

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  public void initOptions(CloudLangOptions options) {
    this.options = checkNotNull(options);
  }

  public CloudLangOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }

  /**
   * Compiles the ESTree JSON of a single module.
   *
   * @param sourceName the name diagnostics are attributed to, usually the input file
   */
  public Result compile(String sourceName, String estreeJson) {
    startCompilation();
    logger.fine("Parsing: " + sourceName);
    Node root;
    try {
      root = EstreeJsonParser.parse(estreeJson);
    } catch (EstreeParseException e) {
      report(
          JSError.make(sourceName, e.getLineno(), e.getCharno(), PARSE_ERROR, e.getMessage()));
      return failure(CompilationStage.PARSE);
    }
    return compileTree(root, sourceName);
  }

  /** Compiles an already built AST. */
  public Result compile(Node root) {
    startCompilation();
    return compileTree(root, null);
  }

  private void startCompilation() {
    checkState(!hasRun, "A Compiler instance can only compile once");
    hasRun = true;
  }

  private Result compileTree(Node root, @Nullable String sourceName) {
    if (root.isProgram()) {
      logger.fine("Validating AST");
      AstValidator validator =
          new AstValidator(
              (message, n) ->
                  report(
                      withSource(
                          JSError.make(n, AstValidator.AST_VALIDATION_ERROR, message),
                          sourceName)));
      validator.validateProgram(root);
      if (errorManager.hasHaltingErrors()) {
        return failure(CompilationStage.TYPE_CHECK);
      }
    }

    logger.fine("Analyzing scopes");
    AnalysisResult analysis;
    try {
      analysis = new ScopeAnalyzer(errorManager, sourceName).analyze(root);
    } catch (AnalysisException e) {
      report(withSource(e.getError(), sourceName));
      return failure(CompilationStage.COMPILE);
    }
    logger.fine(
        "Found "
            + analysis.getModuleVars().size()
            + " module bindings and "
            + analysis.getClosures().size()
            + " closures");

    logger.fine("Decomposing closures into worker groups");
    ImmutableList<WorkerGroup> groups = new Decomposer().decompose(analysis);
    for (WorkerGroup group : groups) {
      logger.finer(
          "Group "
              + group.getName()
              + ": functions="
              + group.getFunctions()
              + " state="
              + group.getOwnedState()
              + " deps="
              + group.getServiceDeps());
    }
    checkGroupNames(groups, sourceName);
    if (errorManager.hasHaltingErrors()) {
      return failure(CompilationStage.COMPILE);
    }

    logger.fine("Building worker configuration");
    Config config = new WorkerConfigBuilder(options.getProjectName()).toIr(groups, analysis);
    return Result.success(errorManager.getWarnings(), analysis, groups, config);
  }

  /** Workers are deployed and written to disk under their group name. */
  private void checkGroupNames(ImmutableList<WorkerGroup> groups, @Nullable String sourceName) {
    Set<String> names = new HashSet<>();
    Set<String> reported = new HashSet<>();
    for (WorkerGroup group : groups) {
      String name = group.getName();
      if (!names.add(name) && reported.add(name)) {
        report(withSource(JSError.make(DUPLICATE_GROUP_NAME, name), sourceName));
      }
    }
  }

  private static JSError withSource(JSError error, @Nullable String sourceName) {
    return sourceName == null || error.sourceName() != null
        ? error
        : error.withSourceName(sourceName);
  }

  private void report(JSError error) {
    errorManager.report(error.defaultLevel(), error);
  }

  private Result failure(CompilationStage stage) {
    return Result.failure(stage, errorManager.getErrors(), errorManager.getWarnings());
  }
}
