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

import com.google.cloudlang.jscomp.resources.Config;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Compilation results */
public class Result {
  public final boolean success;
  public final ImmutableList<JSError> errors;
  public final ImmutableList<JSError> warnings;

  /** The stage that failed, or null on success. */
  public final @Nullable CompilationStage failedStage;

  public final @Nullable AnalysisResult analysis;
  public final ImmutableList<WorkerGroup> groups;
  public final @Nullable Config config;

  private Result(
      ImmutableList<JSError> errors,
      ImmutableList<JSError> warnings,
      @Nullable CompilationStage failedStage,
      @Nullable AnalysisResult analysis,
      ImmutableList<WorkerGroup> groups,
      @Nullable Config config) {
    this.success = failedStage == null;
    this.errors = errors;
    this.warnings = warnings;
    this.failedStage = failedStage;
    this.analysis = analysis;
    this.groups = groups;
    this.config = config;
  }

  static Result success(
      ImmutableList<JSError> warnings,
      AnalysisResult analysis,
      ImmutableList<WorkerGroup> groups,
      Config config) {
    return new Result(ImmutableList.of(), warnings, null, analysis, groups, config);
  }

  static Result failure(
      CompilationStage stage, ImmutableList<JSError> errors, ImmutableList<JSError> warnings) {
    checkArgument(!errors.isEmpty(), "A failed compilation must have errors");
    return new Result(errors, warnings, stage, null, ImmutableList.of(), null);
  }
}
