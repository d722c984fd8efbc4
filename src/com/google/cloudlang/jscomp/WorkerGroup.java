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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/**
 * A set of functions and the mutable state they jointly own, deployed together as one worker.
 */
@AutoValue
@Immutable
public abstract class WorkerGroup {

  public static WorkerGroup create(
      String name,
      Iterable<String> functions,
      Iterable<String> ownedState,
      Iterable<String> serviceDeps) {
    WorkerGroup group =
        new AutoValue_WorkerGroup(
            name,
            ImmutableList.copyOf(functions),
            ImmutableList.copyOf(ownedState),
            ImmutableList.copyOf(serviceDeps));
    checkArgument(
        !group.getServiceDeps().contains(name), "Group %s cannot depend on itself", name);
    return group;
  }

  public abstract String getName();

  /** Functions deployed in this group. */
  public abstract ImmutableList<String> getFunctions();

  /** Mutable-state variables this group exclusively owns. */
  public abstract ImmutableList<String> getOwnedState();

  /** Names of the other groups this group calls into. */
  public abstract ImmutableList<String> getServiceDeps();
}
