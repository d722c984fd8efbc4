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

package com.google.cloudlang.jscomp.resources;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The resource graph: every resource to deploy, in order. Never modified once built. */
@Immutable
public final class Config {
  private static final Config EMPTY = new Config(ImmutableList.of());

  @SuppressWarnings("Immutable") // Resource implementations are records of immutable values.
  private final ImmutableList<Resource> resources;

  private Config(ImmutableList<Resource> resources) {
    this.resources = resources;
  }

  public static Config of(List<? extends Resource> resources) {
    return resources.isEmpty() ? EMPTY : new Config(ImmutableList.copyOf(resources));
  }

  public static Config empty() {
    return EMPTY;
  }

  public ImmutableList<Resource> getResources() {
    return resources;
  }

  public boolean isEmpty() {
    return resources.isEmpty();
  }

  /** The resources of the given kind, in order. */
  public <T extends Resource> ImmutableList<T> getResources(Class<T> kind) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Resource resource : resources) {
      if (kind.isInstance(resource)) {
        result.add(kind.cast(resource));
      }
    }
    return result.build();
  }

  public ImmutableList<Worker> getWorkers() {
    return getResources(Worker.class);
  }

  public @Nullable Worker getWorker(String name) {
    for (Worker worker : getWorkers()) {
      if (worker.name().equals(name)) {
        return worker;
      }
    }
    return null;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Config && ((Config) o).resources.equals(resources);
  }

  @Override
  public int hashCode() {
    return resources.hashCode();
  }

  @Override
  public String toString() {
    return "Config" + resources;
  }
}
