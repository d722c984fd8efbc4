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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Decomposer}. */
@RunWith(JUnit4.class)
public final class DecomposerTest {

  private final Decomposer decomposer = new Decomposer();

  @Test
  public void testKvStore() throws Exception {
    ImmutableList<WorkerGroup> groups = decomposer.decompose(KvStoreFixture.analyzeKvStore());

    assertThat(groups)
        .containsExactly(
            WorkerGroup.create(
                "storage", ImmutableList.of("put", "get"), ImmutableList.of("store"),
                ImmutableList.of()),
            WorkerGroup.create(
                "cache", ImmutableList.of("cachedGet"), ImmutableList.of("cache"),
                ImmutableList.of("storage")),
            WorkerGroup.create(
                "handleRequest", ImmutableList.of("handleRequest"), ImmutableList.of(),
                ImmutableList.of("cache", "storage")))
        .inOrder();
  }

  @Test
  public void testIndependentClosures() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("f", ImmutableList.of("a"), ImmutableList.of()),
                closure("g", ImmutableList.of("b"), ImmutableList.of())),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(2);
    assertGroup(groups.get(0), "a", ImmutableList.of("f"), ImmutableList.of("a"));
    assertGroup(groups.get(1), "b", ImmutableList.of("g"), ImmutableList.of("b"));
    assertThat(groups.get(0).getServiceDeps()).isEmpty();
    assertThat(groups.get(1).getServiceDeps()).isEmpty();
  }

  @Test
  public void testSharedState() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("put", ImmutableList.of("store"), ImmutableList.of()),
                closure("get", ImmutableList.of("store"), ImmutableList.of())),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(1);
    assertGroup(
        groups.get(0), "storage", ImmutableList.of("put", "get"), ImmutableList.of("store"));
  }

  @Test
  public void testBridgingFunctionMergesState() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("f", ImmutableList.of("x"), ImmutableList.of()),
                closure("g", ImmutableList.of("x", "y"), ImmutableList.of())),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(1);
    assertGroup(groups.get(0), "x_y", ImmutableList.of("f", "g"), ImmutableList.of("x", "y"));
  }

  @Test
  public void testBridgeAcrossExistingGroups() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("f", ImmutableList.of("a", "c"), ImmutableList.of()),
                closure("g", ImmutableList.of("b", "c"), ImmutableList.of()),
                closure("h", ImmutableList.of("d"), ImmutableList.of())),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(2);
    assertGroup(
        groups.get(0), "a_c_b", ImmutableList.of("f", "g"), ImmutableList.of("a", "c", "b"));
    assertGroup(groups.get(1), "d", ImmutableList.of("h"), ImmutableList.of("d"));
  }

  @Test
  public void testExportedCallerDependsOnStateGroup() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("put", ImmutableList.of("store"), ImmutableList.of()),
                closure("h", ImmutableList.of(), ImmutableList.of("put"))),
            ImmutableList.of("h"));

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(2);
    WorkerGroup h = groups.get(1);
    assertGroup(h, "h", ImmutableList.of("h"), ImmutableList.of());
    assertThat(h.getServiceDeps()).containsExactly("storage");
  }

  @Test
  public void testCallsWithinAGroupAreNotDependencies() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("f", ImmutableList.of("s"), ImmutableList.of("g")),
                closure("g", ImmutableList.of("s"), ImmutableList.of())),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).getServiceDeps()).isEmpty();
  }

  @Test
  public void testCallsToUnknownFunctionsAreIgnored() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(closure("f", ImmutableList.of(), ImmutableList.of("missing"))),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertGroup(groups.get(0), "f", ImmutableList.of("f"), ImmutableList.of());
    assertThat(groups.get(0).getServiceDeps()).isEmpty();
  }

  @Test
  public void testStatelessFunctionIsNotAbsorbedIntoItsCallee() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("helper", ImmutableList.of(), ImmutableList.of()),
                closure("f", ImmutableList.of("s"), ImmutableList.of("helper"))),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    assertThat(groups).hasSize(2);
    assertGroup(groups.get(0), "s", ImmutableList.of("f"), ImmutableList.of("s"));
    assertGroup(groups.get(1), "helper", ImmutableList.of("helper"), ImmutableList.of());
    assertThat(groups.get(0).getServiceDeps()).containsExactly("helper");
  }

  @Test
  public void testNoClosures() {
    assertThat(decomposer.decompose(analysis(ImmutableList.of(), ImmutableList.of()))).isEmpty();
  }

  @Test
  public void testPartitionIsTotalAndDisjoint() throws Exception {
    AnalysisResult analysis = KvStoreFixture.analyzeKvStore();
    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    List<String> functions = new ArrayList<>();
    Set<String> states = new HashSet<>();
    for (WorkerGroup group : groups) {
      functions.addAll(group.getFunctions());
      for (String state : group.getOwnedState()) {
        assertThat(states.add(state)).isTrue();
      }
      assertThat(group.getServiceDeps()).doesNotContain(group.getName());
    }
    List<String> closures = new ArrayList<>();
    for (ClosureInfo closure : analysis.getClosures()) {
      closures.add(closure.getName());
    }
    assertThat(functions).containsExactlyElementsIn(closures);
  }

  @Test
  public void testDeterministic() throws Exception {
    assertThat(decomposer.decompose(KvStoreFixture.analyzeKvStore()))
        .isEqualTo(new Decomposer().decompose(KvStoreFixture.analyzeKvStore()));
  }

  @Test
  public void testGroupNameOfState() {
    assertThat(Decomposer.groupNameOfState(ImmutableList.of("store"))).isEqualTo("storage");
    assertThat(Decomposer.groupNameOfState(ImmutableList.of("cache"))).isEqualTo("cache");
    assertThat(Decomposer.groupNameOfState(ImmutableList.of("a", "store", "b")))
        .isEqualTo("a_storage_b");
  }

  @Test
  public void testGroupNamedAfterStateCanCollideWithFunctionGroup() {
    AnalysisResult analysis =
        analysis(
            ImmutableList.of(
                closure("put", ImmutableList.of("store"), ImmutableList.of()),
                closure("storage", ImmutableList.of(), ImmutableList.of("put"))),
            ImmutableList.of());

    ImmutableList<WorkerGroup> groups = decomposer.decompose(analysis);

    // Names are not disambiguated, so the call from storage into put looks like a self call.
    assertThat(groups)
        .containsExactly(
            WorkerGroup.create(
                "storage", ImmutableList.of("put"), ImmutableList.of("store"),
                ImmutableList.of()),
            WorkerGroup.create(
                "storage", ImmutableList.of("storage"), ImmutableList.of(), ImmutableList.of()))
        .inOrder();
  }

  private static ClosureInfo closure(
      String name, ImmutableList<String> captures, ImmutableList<String> calls) {
    ImmutableList<String> freeVars =
        ImmutableList.<String>builder().addAll(captures).addAll(calls).build();
    return ClosureInfo.create(name, freeVars, calls, captures);
  }

  private static AnalysisResult analysis(
      ImmutableList<ClosureInfo> closures, ImmutableList<String> exports) {
    Set<String> seen = new HashSet<>();
    List<ModuleVar> vars = new ArrayList<>();
    for (ClosureInfo closure : closures) {
      for (String state : closure.getCapturesMutable()) {
        if (seen.add(state)) {
          vars.add(ModuleVar.mutableState(state));
        }
      }
    }
    for (ClosureInfo closure : closures) {
      vars.add(ModuleVar.function(closure.getName()));
    }
    return AnalysisResult.create(closures, vars, exports);
  }

  private static void assertGroup(
      WorkerGroup group,
      String name,
      ImmutableList<String> functions,
      ImmutableList<String> ownedState) {
    assertThat(group.getName()).isEqualTo(name);
    assertThat(group.getFunctions()).containsExactlyElementsIn(functions).inOrder();
    assertThat(group.getOwnedState()).containsExactlyElementsIn(ownedState).inOrder();
  }
}
