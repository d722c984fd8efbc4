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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;

/**
 * What a top-level arrow function needs from module scope. All sets keep first-occurrence order.
 */
@AutoValue
@Immutable
public abstract class ClosureInfo {

  public static ClosureInfo create(
      String name,
      Iterable<String> freeVars,
      Iterable<String> calledFunctions,
      Iterable<String> capturesMutable) {
    return new AutoValue_ClosureInfo(
        name,
        ImmutableSet.copyOf(freeVars),
        ImmutableSet.copyOf(calledFunctions),
        ImmutableSet.copyOf(capturesMutable));
  }

  /** The name the function is bound to. */
  public abstract String getName();

  /** Module bindings referenced by the body that are neither parameters nor locals. */
  public abstract ImmutableSet<String> getFreeVars();

  /** Module functions the body calls directly, as in {@code f(x)} but not {@code o.f(x)}. */
  public abstract ImmutableSet<String> getCalledFunctions();

  /** The free variables that are mutable state. */
  public abstract ImmutableSet<String> getCapturesMutable();
}
