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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** The output of {@link ScopeAnalyzer}, consumed by {@link Decomposer}. */
@AutoValue
@Immutable
public abstract class AnalysisResult {

  public static AnalysisResult create(
      Iterable<ClosureInfo> closures, Iterable<ModuleVar> moduleVars, Iterable<String> exports) {
    return new AutoValue_AnalysisResult(
        ImmutableList.copyOf(closures),
        ImmutableList.copyOf(moduleVars),
        ImmutableList.copyOf(exports));
  }

  /** Top-level arrow functions in declaration order. */
  public abstract ImmutableList<ClosureInfo> getClosures();

  /** Module bindings in declaration order. */
  public abstract ImmutableList<ModuleVar> getModuleVars();

  /** Local names listed by export declarations, in source order. */
  public abstract ImmutableList<String> getExports();

  public final @Nullable ClosureInfo getClosure(String name) {
    for (ClosureInfo closure : getClosures()) {
      if (closure.getName().equals(name)) {
        return closure;
      }
    }
    return null;
  }

  public final @Nullable ModuleVar getModuleVar(String name) {
    for (ModuleVar var : getModuleVars()) {
      if (var.getName().equals(name)) {
        return var;
      }
    }
    return null;
  }

  public final boolean isExported(String name) {
    return getExports().contains(name);
  }
}
