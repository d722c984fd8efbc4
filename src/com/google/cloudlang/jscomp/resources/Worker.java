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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A compute unit: its generated handler script, the bindings its {@code Env} exposes and the routes
 * it is reachable on.
 */
public record Worker(
    String name, String script, ImmutableList<Binding> bindings, ImmutableList<String> routes)
    implements Resource {
  public Worker {
    requireNonNull(name, "name");
    requireNonNull(script, "script");
    requireNonNull(bindings, "bindings");
    requireNonNull(routes, "routes");
  }

  public static Worker create(
      String name, String script, List<? extends Binding> bindings, List<String> routes) {
    return new Worker(
        name, script, ImmutableList.<Binding>copyOf(bindings), ImmutableList.copyOf(routes));
  }

  /** The bindings of the given kind, in declaration order. */
  public <T extends Binding> ImmutableList<T> getBindings(Class<T> kind) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (Binding binding : bindings) {
      if (kind.isInstance(binding)) {
        result.add(kind.cast(binding));
      }
    }
    return result.build();
  }

  public @Nullable Binding getBinding(String bindingName) {
    for (Binding binding : bindings) {
      if (binding.name().equals(bindingName)) {
        return binding;
      }
    }
    return null;
  }
}
