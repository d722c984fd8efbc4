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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Config} and the resources it holds. */
@RunWith(JUnit4.class)
public final class ConfigTest {

  private static final Worker API =
      Worker.create(
          "api",
          "",
          ImmutableList.of(
              new KvBinding("STORE", "p-store"),
              new ServiceBinding("AUTH", "auth"),
              new KvBinding("CACHE", "p-cache")),
          ImmutableList.of("/api"));

  @Test
  public void testEmpty() {
    assertThat(Config.empty().isEmpty()).isTrue();
    assertThat(Config.of(ImmutableList.of())).isEqualTo(Config.empty());
    assertThat(Config.empty().getWorkers()).isEmpty();
  }

  @Test
  public void testResourcesByKind() {
    R2Bucket bucket = new R2Bucket("files", "weur");
    Config config = Config.of(ImmutableList.of(bucket, API));

    assertThat(config.getResources()).containsExactly(bucket, API).inOrder();
    assertThat(config.getWorkers()).containsExactly(API);
    assertThat(config.getResources(R2Bucket.class)).containsExactly(bucket);
    assertThat(config.getResources(D1Database.class)).isEmpty();
  }

  @Test
  public void testGetWorker() {
    Config config = Config.of(ImmutableList.of(API));

    assertThat(config.getWorker("api")).isSameInstanceAs(API);
    assertThat(config.getWorker("missing")).isNull();
  }

  @Test
  public void testEquality() {
    Config a = Config.of(ImmutableList.of(API));
    Config b = Config.of(ImmutableList.of(Worker.create("api", "", API.bindings(), API.routes())));

    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(Config.empty());
  }

  @Test
  public void testWorkerBindingsByKind() {
    assertThat(API.getBindings(KvBinding.class))
        .containsExactly(new KvBinding("STORE", "p-store"), new KvBinding("CACHE", "p-cache"))
        .inOrder();
    assertThat(API.getBindings(ServiceBinding.class))
        .containsExactly(new ServiceBinding("AUTH", "auth"));
    assertThat(API.getBinding("AUTH")).isEqualTo(new ServiceBinding("AUTH", "auth"));
    assertThat(API.getBinding("NOPE")).isNull();
  }

  @Test
  public void testEnvTypes() {
    assertThat(new KvBinding("A", "a").envType()).isEqualTo("KVNamespace");
    assertThat(new ServiceBinding("A", "a").envType()).isEqualTo("Fetcher");
    assertThat(new D1Binding("A", "a").envType()).isEqualTo("D1Database");
    assertThat(new R2Binding("A", "a").envType()).isEqualTo("R2Bucket");
  }

  @Test
  public void testDurableObjectIsNamedByClass() {
    assertThat(new DurableObject("Counter", "counter.ts").name()).isEqualTo("Counter");
  }

  @Test
  public void testNullsAreRejected() {
    assertThrows(NullPointerException.class, () -> new KvBinding(null, "id"));
    assertThrows(
        NullPointerException.class,
        () -> new Worker("w", null, ImmutableList.of(), ImmutableList.of()));
  }
}
