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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions the closures of an {@link AnalysisResult} into {@link WorkerGroup}s.
 *
 * <p>Functions that capture the same mutable state are placed in the same group, and a function
 * that captures two pieces of state forces both into one group. Every other function gets a group
 * of its own. A function calling into a function of another group makes its group depend on that
 * group.
 *
 * <p>The result is fully determined by the order of the closures in the analysis, so the same
 * program always yields the same group names, member order and dependency order.
 */
public final class Decomposer {

  private static final Joiner STATE_NAME_JOINER = Joiner.on('_');

  public Decomposer() {}

  public ImmutableList<WorkerGroup> decompose(AnalysisResult analysis) {
    List<Candidate> merged = mergeCandidates(seedCandidates(analysis));

    List<Candidate> groups = new ArrayList<>(merged);
    Set<String> absorbed = new HashSet<>();
    for (Candidate candidate : merged) {
      absorbed.addAll(candidate.functions);
    }
    for (ClosureInfo closure : analysis.getClosures()) {
      if (!absorbed.contains(closure.getName())) {
        Candidate standalone = new Candidate();
        standalone.functions.add(closure.getName());
        groups.add(standalone);
      }
    }

    Map<String, String> owners = new HashMap<>();
    Set<String> ownedState = new HashSet<>();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Candidate group : groups) {
      String name =
          group.states.isEmpty()
              ? group.functions.iterator().next()
              : groupNameOfState(ImmutableList.copyOf(group.states));
      names.add(name);
      for (String function : group.functions) {
        String previous = owners.put(function, name);
        checkState(previous == null, "%s is in both %s and %s", function, previous, name);
      }
      for (String state : group.states) {
        checkState(ownedState.add(state), "%s is owned by more than one group", state);
      }
    }

    ImmutableList<String> groupNames = names.build();
    ImmutableList.Builder<WorkerGroup> result = ImmutableList.builder();
    for (int i = 0; i < groups.size(); i++) {
      Candidate group = groups.get(i);
      String name = groupNames.get(i);
      Set<String> deps = new LinkedHashSet<>();
      for (String function : group.functions) {
        ClosureInfo closure = analysis.getClosure(function);
        checkState(closure != null, "No closure named %s", function);
        for (String callee : closure.getCalledFunctions()) {
          String owner = owners.get(callee);
          if (owner != null && !owner.equals(name)) {
            deps.add(owner);
          }
        }
      }
      result.add(WorkerGroup.create(name, group.functions, group.states, deps));
    }
    return result.build();
  }

  /** One candidate per captured state variable, holding every closure that captures it. */
  private static List<Candidate> seedCandidates(AnalysisResult analysis) {
    Set<String> capturedState = new LinkedHashSet<>();
    for (ClosureInfo closure : analysis.getClosures()) {
      capturedState.addAll(closure.getCapturesMutable());
    }

    List<Candidate> candidates = new ArrayList<>();
    for (String state : capturedState) {
      Candidate candidate = new Candidate();
      candidate.states.add(state);
      for (ClosureInfo closure : analysis.getClosures()) {
        if (closure.getCapturesMutable().contains(state)) {
          candidate.functions.add(closure.getName());
        }
      }
      candidates.add(candidate);
    }
    return candidates;
  }

  /**
   * Folds candidates into a list of disjoint groups. A candidate sharing a function with one or
   * more groups is merged into the first of them, together with any other group it bridges.
   */
  private static List<Candidate> mergeCandidates(List<Candidate> candidates) {
    List<Candidate> merged = new ArrayList<>();
    for (Candidate candidate : candidates) {
      Candidate target = null;
      for (int i = 0; i < merged.size(); ) {
        Candidate existing = merged.get(i);
        if (!existing.sharesFunctionWith(candidate)) {
          i++;
        } else if (target == null) {
          target = existing;
          i++;
        } else {
          target.addAll(existing);
          merged.remove(i);
        }
      }
      if (target == null) {
        merged.add(candidate);
      } else {
        target.addAll(candidate);
      }
    }
    return merged;
  }

  /**
   * Names a group after the state it owns. {@code store} reads better as {@code storage}, and
   * several pieces of state are joined with an underscore.
   */
  @VisibleForTesting
  static String groupNameOfState(List<String> states) {
    checkState(!states.isEmpty(), "A state group must own some state");
    List<String> names = new ArrayList<>(states.size());
    for (String state : states) {
      names.add(state.equals("store") ? "storage" : state);
    }
    return STATE_NAME_JOINER.join(names);
  }

  /** A group under construction. */
  private static final class Candidate {
    final Set<String> states = new LinkedHashSet<>();
    final Set<String> functions = new LinkedHashSet<>();

    boolean sharesFunctionWith(Candidate other) {
      for (String function : other.functions) {
        if (functions.contains(function)) {
          return true;
        }
      }
      return false;
    }

    void addAll(Candidate other) {
      states.addAll(other.states);
      functions.addAll(other.functions);
    }
  }
}
