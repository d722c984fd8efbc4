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

/** Binds a D1 relational database to a worker. */
public record D1Binding(String name, String databaseId) implements Binding {
  public D1Binding {
    requireNonNull(name, "name");
    requireNonNull(databaseId, "databaseId");
  }

  @Override
  public String envType() {
    return "D1Database";
  }
}
