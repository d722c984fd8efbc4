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

/** A stateful actor class and the script that defines it. */
public record DurableObject(String className, String script) implements Resource {
  public DurableObject {
    requireNonNull(className, "className");
    requireNonNull(script, "script");
  }

  @Override
  public String name() {
    return className;
  }
}
