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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * CommandLineRunner translates flags into Java API calls on the Compiler.
 *
 * <p>The input is the ESTree JSON of a TypeScript module, as printed by
 * {@code @typescript-eslint/typescript-estree}. The output is the wrangler configuration of the
 * workers the module decomposes into, or one of the diagnostic views selected by flags.
 *
 * <pre>
 * cloudlang [flags] kv-store.json
 * </pre>
 *
 * This class is not thread-safe.
 */
public class CommandLineRunner {

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--js",
        usage = "The ESTree JSON file of the module to decompose. A bare argument is equivalent")
    private List<String> js = new ArrayList<>();

    @Option(
        name = "--project_name",
        usage = "Prefix of the generated key-value namespace ids")
    private String projectName = CloudLangOptions.DEFAULT_PROJECT_NAME;

    @Option(
        name = "--output_dir",
        usage = "If set, writes wrangler.<worker>.json and <worker>.ts for every worker here")
    private String outputDir = null;

    @Option(
        name = "--print_analysis",
        handler = BooleanOptionHandler.class,
        usage = "Prints the scope analysis and the worker groups as JSON instead of the config")
    private boolean printAnalysis = false;

    @Option(
        name = "--print_group_graph",
        handler = BooleanOptionHandler.class,
        usage = "Prints a dot file describing the worker groups and their dependencies")
    private boolean printGroupGraph = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for Compiler progress."
                + " Does not control errors or warnings for the module under compilation")
    private String loggingLevel = Level.WARNING.getName();

    @Argument private List<String> arguments = new ArrayList<>();
  }

  private final Flags flags = new Flags();

  private final CloudLangOptions options = new CloudLangOptions();

  private final PrintStream out;

  private final PrintStream err;

  private String inputFile;

  private boolean errors = false;

  private boolean runCompiler = false;

  protected CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  protected CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    initConfigFromFlags(args);
  }

  private void initConfigFromFlags(String[] args) {
    CmdLineParser parser = new CmdLineParser(flags);
    try {
      parser.parseArgument(args);

      List<String> inputs = new ArrayList<>(flags.js);
      inputs.addAll(flags.arguments);
      if (!flags.displayHelp) {
        if (inputs.size() != 1) {
          throw new CmdLineException(
              parser, "Expected exactly one input file but found " + inputs.size());
        }
        inputFile = inputs.get(0);
      }

      try {
        options.setLoggingLevel(Level.parse(flags.loggingLevel));
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + flags.loggingLevel);
      }
      try {
        options.setProjectName(flags.projectName);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --project_name: " + e.getMessage());
      }
      options.setOutputDirectory(flags.outputDir == null ? null : Paths.get(flags.outputDir));
      options.setPrintAnalysis(flags.printAnalysis);
      options.setPrintGroupGraph(flags.printGroupGraph);
    } catch (CmdLineException e) {
      reportError(e.getMessage());
    }

    if (flags.displayHelp) {
      parser.printUsage(out);
    } else if (errors) {
      parser.printUsage(err);
    } else {
      runCompiler = true;
    }
  }

  private void reportError(String message) {
    errors = true;
    err.println(message);
    err.flush();
  }

  /** Returns whether the flags were valid and asked for a compilation. */
  public boolean shouldRunCompiler() {
    return this.runCompiler;
  }

  /**
   * @return Whether the configuration or the compilation has errors.
   */
  public boolean hasErrors() {
    return this.errors;
  }

  /** Runs the Compiler, recording any failure in {@link #hasErrors()}. */
  public void run() {
    if (doRun() != 0) {
      errors = true;
    }
  }

  /**
   * Reads the input, compiles it and prints the requested output.
   *
   * @return 0 on success, non-zero otherwise
   */
  int doRun() {
    Compiler.setLoggingLevel(options.getLoggingLevel());

    String contents;
    try {
      contents = Files.asCharSource(new File(inputFile), UTF_8).read();
    } catch (IOException e) {
      err.println("ERROR - " + inputFile + " read error.");
      return 1;
    }

    Compiler compiler = new Compiler(err);
    compiler.initOptions(options);
    Result result = compiler.compile(inputFile, contents);
    if (!result.success) {
      for (JSError error : result.errors) {
        err.println(result.failedStage.getLabel() + ": " + error.description());
      }
      compiler.getErrorManager().generateReport();
      return 1;
    }
    if (!result.warnings.isEmpty()) {
      compiler.getErrorManager().generateReport();
    }

    if (options.shouldPrintAnalysis()) {
      out.println(AnalysisReportGenerator.generateReport(result.analysis, result.groups));
    }
    if (options.shouldPrintGroupGraph()) {
      out.print(GroupGraphDotFormatter.toDot(result.groups));
    }
    WranglerConfigGenerator generator = new WranglerConfigGenerator();
    if (!options.shouldPrintAnalysis() && !options.shouldPrintGroupGraph()) {
      out.println(generator.generate(result.config));
    }

    Path outputDirectory = options.getOutputDirectory();
    if (outputDirectory != null) {
      try {
        generator.writeWorkerFiles(result.config, outputDirectory);
      } catch (IOException e) {
        err.println("ERROR - could not write to " + outputDirectory + ": " + e.getMessage());
        return 1;
      }
    }
    out.flush();
    return 0;
  }

  /** Runs the Compiler and calls System.exit() with the exit status of the compiler. */
  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunCompiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
