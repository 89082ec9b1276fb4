/*
 * Copyright (2026) The Sieve Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sieve.kernel.defaults.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.sieve.kernel.engine.Engine;
import io.sieve.kernel.engine.SketchStore;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.hadoop.conf.Configuration;

/** Default implementation of {@link Engine}. */
public class DefaultEngine implements Engine, AutoCloseable {
  private static final int DEFAULT_LOADER_THREADS = 4;

  private final SketchStore sketchStore;
  private final ExecutorService executor;

  protected DefaultEngine(SketchStore sketchStore, ExecutorService executor) {
    this.sketchStore = Objects.requireNonNull(sketchStore, "sketchStore is null");
    this.executor = executor;
  }

  @Override
  public SketchStore getSketchStore() {
    return sketchStore;
  }

  /**
   * Create an instance of {@link DefaultEngine} that keeps sketches in files under {@code
   * rootPath}.
   *
   * @param hadoopConf Hadoop configuration to use.
   * @param rootPath directory holding one file per partition sketch.
   * @return an instance of {@link DefaultEngine}.
   */
  public static DefaultEngine create(Configuration hadoopConf, String rootPath) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            DEFAULT_LOADER_THREADS,
            new ThreadFactoryBuilder()
                .setNameFormat("sieve-sketch-loader-%d")
                .setDaemon(true)
                .build());
    return new DefaultEngine(new FileSystemSketchStore(hadoopConf, rootPath, executor), executor);
  }

  /**
   * Create an instance of {@link DefaultEngine} over the given store.
   *
   * @param sketchStore the store to load sketches from.
   * @return an instance of {@link DefaultEngine}.
   */
  public static DefaultEngine create(SketchStore sketchStore) {
    return new DefaultEngine(sketchStore, null);
  }

  /** Create an instance of {@link DefaultEngine} keeping sketches on the heap. */
  public static DefaultEngine createInMemory() {
    return create(new InMemorySketchStore());
  }

  /** Stops the threads loading sketches, if this engine owns any. */
  @Override
  public void close() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }
}
