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

package io.sieve.kernel.engine;

import io.sieve.kernel.annotation.Evolving;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Persists the serialized sketches of partitions, one immutable blob per partition. */
@Evolving
public interface SketchStore {

  /**
   * Loads the blob of a partition asynchronously.
   *
   * @param partitionId the partition
   * @return a future of the blob. It completes exceptionally with {@link
   *     java.util.NoSuchElementException} if the store has no blob for the partition, or with an
   *     {@link IOException} if reading failed.
   */
  CompletableFuture<byte[]> load(UUID partitionId);

  /**
   * Stores the blob of a partition. Blobs are immutable: storing a second blob for the same
   * partition replaces nothing and fails.
   *
   * @throws java.nio.file.FileAlreadyExistsException if a blob for the partition exists
   * @throws IOException if writing failed
   */
  void store(UUID partitionId, byte[] blob) throws IOException;
}
