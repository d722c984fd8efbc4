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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A binding declared at module scope.
 *
 * <p>A binding is exactly one of a plain value, a function (initialized with an arrow function) or
 * mutable state (initialized with a fresh {@code Map}, {@code Set} or {@code Array}).
 */
@AutoValue
@Immutable
public abstract class ModuleVar {

  public static ModuleVar create(String name, boolean isMutableState, boolean isFunction) {
    checkArgument(
        !(isMutableState && isFunction), "%s cannot be both mutable state and a function", name);
    return new AutoValue_ModuleVar(name, isMutableState, isFunction);
  }

  public static ModuleVar plain(String name) {
    return create(name, false, false);
  }

  public static ModuleVar mutableState(String name) {
    return create(name, true, false);
  }

  public static ModuleVar function(String name) {
    return create(name, false, true);
  }

  public abstract String getName();

  public abstract boolean isMutableState();

  public abstract boolean isFunction();
}
