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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.io.Serializable;
import java.nio.file.Path;
import java.util.logging.Level;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CloudLangOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Prefix of every derived storage namespace id, as in {@code cloudlang-store}. */
  public static final String DEFAULT_PROJECT_NAME = "cloudlang";

  private String projectName = DEFAULT_PROJECT_NAME;

  /** Where per-worker files are written. Null means nothing is written. */
  private transient @Nullable Path outputDirectory;

  private boolean printAnalysis = false;

  private boolean printGroupGraph = false;

  private Level loggingLevel = Level.WARNING;

  public CloudLangOptions() {}

  public String getProjectName() {
    return projectName;
  }

  public void setProjectName(String projectName) {
    checkArgument(!projectName.isEmpty(), "The project name must not be empty");
    this.projectName = projectName;
  }

  public @Nullable Path getOutputDirectory() {
    return outputDirectory;
  }

  public void setOutputDirectory(@Nullable Path outputDirectory) {
    this.outputDirectory = outputDirectory;
  }

  public boolean shouldPrintAnalysis() {
    return printAnalysis;
  }

  public void setPrintAnalysis(boolean printAnalysis) {
    this.printAnalysis = printAnalysis;
  }

  public boolean shouldPrintGroupGraph() {
    return printGroupGraph;
  }

  public void setPrintGroupGraph(boolean printGroupGraph) {
    this.printGroupGraph = printGroupGraph;
  }

  public Level getLoggingLevel() {
    return loggingLevel;
  }

  public void setLoggingLevel(Level loggingLevel) {
    this.loggingLevel = checkNotNull(loggingLevel);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("projectName", projectName)
        .add("outputDirectory", outputDirectory)
        .add("printAnalysis", printAnalysis)
        .add("printGroupGraph", printGroupGraph)
        .add("loggingLevel", loggingLevel)
        .toString();
  }
}
