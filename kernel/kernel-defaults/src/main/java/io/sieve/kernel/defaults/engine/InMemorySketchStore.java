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

import io.sieve.kernel.engine.SketchStore;
import java.nio.file.FileAlreadyExistsException;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** A {@link SketchStore} keeping all blobs on the heap. Loads complete immediately. */
public class InMemorySketchStore implements SketchStore {
  private final ConcurrentMap<UUID, byte[]> blobs = new ConcurrentHashMap<>();

  @Override
  public CompletableFuture<byte[]> load(UUID partitionId) {
    byte[] blob = blobs.get(partitionId);
    CompletableFuture<byte[]> result = new CompletableFuture<>();
    if (blob == null) {
      result.completeExceptionally(
          new NoSuchElementException("No sketch stored for partition " + partitionId));
    } else {
      result.complete(blob.clone());
    }
    return result;
  }

  @Override
  public void store(UUID partitionId, byte[] blob) throws FileAlreadyExistsException {
    if (blobs.putIfAbsent(partitionId, blob.clone()) != null) {
      throw new FileAlreadyExistsException("Sketch of partition " + partitionId + " exists");
    }
  }

  public int size() {
    return blobs.size();
  }
}
