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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.cloudlang.jscomp.resources.Config;
import com.google.cloudlang.jscomp.resources.D1Binding;
import com.google.cloudlang.jscomp.resources.D1Database;
import com.google.cloudlang.jscomp.resources.DurableObject;
import com.google.cloudlang.jscomp.resources.KvBinding;
import com.google.cloudlang.jscomp.resources.R2Binding;
import com.google.cloudlang.jscomp.resources.R2Bucket;
import com.google.cloudlang.jscomp.resources.ServiceBinding;
import com.google.cloudlang.jscomp.resources.Worker;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.gson.stream.JsonWriter;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Renders a {@link Config} as wrangler-style JSON.
 *
 * <p>The document has a {@code workers} array with one object per worker, listing its key-value,
 * service, D1 and R2 bindings, its routes and its generated script. Auxiliary resources are listed
 * in top-level {@code durable_objects}, {@code r2_buckets} and {@code d1_databases} arrays, which
 * are left out when there are none. An empty config renders as {@code {}}.
 */
public final class WranglerConfigGenerator {

  private static final Logger logger = Logger.getLogger(WranglerConfigGenerator.class.getName());

  private static final String INDENT = "  ";

  public WranglerConfigGenerator() {}

  public String generate(Config config) {
    if (config.isEmpty()) {
      return "{}";
    }
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = newJsonWriter(out)) {
      jsonWriter.beginObject();
      jsonWriter.name("workers").beginArray();
      for (Worker worker : config.getWorkers()) {
        writeWorker(jsonWriter, worker);
      }
      jsonWriter.endArray();

      ImmutableList<DurableObject> durableObjects = config.getResources(DurableObject.class);
      if (!durableObjects.isEmpty()) {
        jsonWriter.name("durable_objects").beginArray();
        for (DurableObject durableObject : durableObjects) {
          jsonWriter.beginObject();
          jsonWriter.name("class_name").value(durableObject.className());
          jsonWriter.name("script").value(durableObject.script());
          jsonWriter.endObject();
        }
        jsonWriter.endArray();
      }

      ImmutableList<R2Bucket> buckets = config.getResources(R2Bucket.class);
      if (!buckets.isEmpty()) {
        jsonWriter.name("r2_buckets").beginArray();
        for (R2Bucket bucket : buckets) {
          jsonWriter.beginObject();
          jsonWriter.name("name").value(bucket.name());
          jsonWriter.name("location").value(bucket.location());
          jsonWriter.endObject();
        }
        jsonWriter.endArray();
      }

      ImmutableList<D1Database> databases = config.getResources(D1Database.class);
      if (!databases.isEmpty()) {
        jsonWriter.name("d1_databases").beginArray();
        for (D1Database database : databases) {
          jsonWriter.beginObject();
          jsonWriter.name("name").value(database.name());
          jsonWriter.name("schema").value(database.schema());
          jsonWriter.endObject();
        }
        jsonWriter.endArray();
      }
      jsonWriter.endObject();
    } catch (IOException e) {
      // A StringWriter does not throw.
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /** Renders the configuration of a single worker. */
  public String generateWorker(Worker worker) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = newJsonWriter(out)) {
      writeWorker(jsonWriter, worker);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /**
   * Writes {@code wrangler.<name>.json} and {@code <name>.ts} for every worker into {@code
   * directory}, creating it if needed.
   *
   * @return the files written, in order
   */
  public ImmutableList<Path> writeWorkerFiles(Config config, Path directory) throws IOException {
    ImmutableList.Builder<Path> written = ImmutableList.builder();
    for (Worker worker : config.getWorkers()) {
      Path configFile = directory.resolve("wrangler." + worker.name() + ".json");
      write(configFile, generateWorker(worker) + "\n");
      written.add(configFile);

      Path scriptFile = directory.resolve(scriptFileName(worker));
      write(scriptFile, worker.script());
      written.add(scriptFile);
    }
    return written.build();
  }

  private static void write(Path path, String contents) throws IOException {
    File file = path.toFile();
    Files.createParentDirs(file);
    Files.asCharSink(file, UTF_8).write(contents);
    logger.fine("Wrote " + path);
  }

  private static String scriptFileName(Worker worker) {
    return worker.name() + ".ts";
  }

  private static JsonWriter newJsonWriter(StringWriter out) {
    JsonWriter jsonWriter = new JsonWriter(out);
    jsonWriter.setIndent(INDENT);
    jsonWriter.setHtmlSafe(false);
    return jsonWriter;
  }

  private static void writeWorker(JsonWriter jsonWriter, Worker worker) throws IOException {
    jsonWriter.beginObject();
    jsonWriter.name("name").value(worker.name());
    jsonWriter.name("main").value(scriptFileName(worker));

    ImmutableList<KvBinding> kvBindings = worker.getBindings(KvBinding.class);
    if (!kvBindings.isEmpty()) {
      jsonWriter.name("kv_namespaces").beginArray();
      for (KvBinding binding : kvBindings) {
        jsonWriter.beginObject();
        jsonWriter.name("binding").value(binding.name());
        jsonWriter.name("id").value(binding.namespaceId());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    }

    ImmutableList<ServiceBinding> services = worker.getBindings(ServiceBinding.class);
    if (!services.isEmpty()) {
      jsonWriter.name("services").beginArray();
      for (ServiceBinding binding : services) {
        jsonWriter.beginObject();
        jsonWriter.name("binding").value(binding.name());
        jsonWriter.name("service").value(binding.service());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    }

    ImmutableList<D1Binding> d1Bindings = worker.getBindings(D1Binding.class);
    if (!d1Bindings.isEmpty()) {
      jsonWriter.name("d1_databases").beginArray();
      for (D1Binding binding : d1Bindings) {
        jsonWriter.beginObject();
        jsonWriter.name("binding").value(binding.name());
        jsonWriter.name("database_id").value(binding.databaseId());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    }

    ImmutableList<R2Binding> r2Bindings = worker.getBindings(R2Binding.class);
    if (!r2Bindings.isEmpty()) {
      jsonWriter.name("r2_buckets").beginArray();
      for (R2Binding binding : r2Bindings) {
        jsonWriter.beginObject();
        jsonWriter.name("binding").value(binding.name());
        jsonWriter.name("bucket_name").value(binding.bucketName());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    }

    jsonWriter.name("routes").beginArray();
    for (String route : worker.routes()) {
      jsonWriter.value(route);
    }
    jsonWriter.endArray();

    jsonWriter.name("script").value(worker.script());
    jsonWriter.endObject();
  }
}
