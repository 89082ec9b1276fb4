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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestFileSystemSketchStore {
  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private ExecutorService executor;
  private File root;
  private FileSystemSketchStore store;

  @Before
  public void setUp() throws Exception {
    executor = Executors.newSingleThreadExecutor();
    // The store creates the directory on first write.
    root = new File(tempFolder.getRoot(), "sketches");
    store = new FileSystemSketchStore(new Configuration(), root.getAbsolutePath(), executor);
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void storeAndLoad() throws Exception {
    UUID id = UUID.randomUUID();
    byte[] blob = "{\"version\": 1}".getBytes(StandardCharsets.UTF_8);

    store.store(id, blob);

    assertThat(new File(root, id + ".sketch")).exists();
    assertThat(store.pathOf(id)).endsWith(id + FileSystemSketchStore.SUFFIX);
    assertThat(store.load(id).get(10, TimeUnit.SECONDS)).isEqualTo(blob);
  }

  @Test
  public void emptyBlob() throws Exception {
    UUID id = UUID.randomUUID();
    store.store(id, new byte[0]);

    assertThat(store.load(id).get(10, TimeUnit.SECONDS)).isEmpty();
  }

  @Test
  public void missingBlob() {
    assertThatThrownBy(() -> store.load(UUID.randomUUID()).get(10, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(NoSuchElementException.class);
  }

  @Test
  public void blobsAreImmutable() throws Exception {
    UUID id = UUID.randomUUID();
    store.store(id, new byte[] {1, 2, 3});

    assertThatThrownBy(() -> store.store(id, new byte[] {4}))
        .isInstanceOf(FileAlreadyExistsException.class);
    assertThat(store.load(id).get(10, TimeUnit.SECONDS)).containsExactly(1, 2, 3);
  }
}
