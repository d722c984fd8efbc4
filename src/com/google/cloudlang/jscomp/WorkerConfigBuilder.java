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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.cloudlang.jscomp.resources.Binding;
import com.google.cloudlang.jscomp.resources.Config;
import com.google.cloudlang.jscomp.resources.KvBinding;
import com.google.cloudlang.jscomp.resources.ServiceBinding;
import com.google.cloudlang.jscomp.resources.Worker;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Converts {@link WorkerGroup}s into the resource graph. Each group becomes one {@link Worker} with
 * a key-value binding per owned state variable and a service binding per dependency. Only groups
 * hosting an exported function are given a route.
 */
public final class WorkerConfigBuilder {

  private final String projectName;
  private final WorkerScriptGenerator scriptGenerator;

  public WorkerConfigBuilder() {
    this(CloudLangOptions.DEFAULT_PROJECT_NAME);
  }

  public WorkerConfigBuilder(String projectName) {
    this.projectName = checkNotNull(projectName);
    this.scriptGenerator = new WorkerScriptGenerator();
  }

  public Config toIr(List<WorkerGroup> groups, AnalysisResult analysis) {
    ImmutableList.Builder<Worker> workers = ImmutableList.builder();
    for (WorkerGroup group : groups) {
      workers.add(toWorker(group, analysis));
    }
    return Config.of(workers.build());
  }

  private Worker toWorker(WorkerGroup group, AnalysisResult analysis) {
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    for (String state : group.getOwnedState()) {
      bindings.add(
          new KvBinding(WorkerScriptGenerator.bindingName(state), namespaceId(state)));
    }
    for (String dep : group.getServiceDeps()) {
      bindings.add(new ServiceBinding(WorkerScriptGenerator.bindingName(dep), dep));
    }

    ImmutableList<String> routes = ImmutableList.of();
    for (String function : group.getFunctions()) {
      if (analysis.isExported(function)) {
        routes = ImmutableList.of("/" + group.getName());
        break;
      }
    }
    return Worker.create(
        group.getName(), scriptGenerator.generate(group), bindings.build(), routes);
  }

  /** The key-value namespace backing a state variable, as in {@code cloudlang-store}. */
  String namespaceId(String state) {
    return projectName + "-" + state;
  }
}
