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

package io.sieve.kernel.internal.catalog;

import io.sieve.kernel.exceptions.CorruptSketchException;
import io.sieve.kernel.exceptions.SketchUnavailableException;
import io.sieve.kernel.sketch.PartitionInfo;
import io.sieve.kernel.sketch.PartitionSketch;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A partition registered with the catalog. The sketch is decoded on first use and cached. A blob
 * that fails to decode is remembered as corrupt; a failed load from the sketch store is not, so the
 * next lookup retries it.
 */
public final class CatalogEntry {

  /** Fetches the blob of a store-backed partition. */
  @FunctionalInterface
  public interface BlobLoader {
    byte[] load(UUID partitionId) throws SketchUnavailableException;
  }

  private final UUID partitionId;
  private final byte[] blob;
  private final PartitionInfo info;
  private volatile PartitionSketch sketch;
  private volatile CorruptSketchException corruption;

  private CatalogEntry(UUID partitionId, byte[] blob, PartitionInfo info, PartitionSketch sketch) {
    this.partitionId = Objects.requireNonNull(partitionId, "partitionId is null");
    this.blob = blob;
    this.info = info;
    this.sketch = sketch;
  }

  public static CatalogEntry ofSketch(PartitionSketch sketch) {
    return new CatalogEntry(sketch.getPartitionId(), null, sketch.getInfo(), sketch);
  }

  public static CatalogEntry ofBlob(UUID partitionId, byte[] blob) {
    return new CatalogEntry(partitionId, Objects.requireNonNull(blob, "blob is null"), null, null);
  }

  /** An entry whose blob lives in the sketch store. */
  public static CatalogEntry ofInfo(PartitionInfo info) {
    return new CatalogEntry(info.getPartitionId(), null, info, null);
  }

  public UUID getPartitionId() {
    return partitionId;
  }

  /** @return the partition info if it is known without decoding the sketch */
  public Optional<PartitionInfo> getKnownInfo() {
    if (info != null) {
      return Optional.of(info);
    }
    PartitionSketch decoded = sketch;
    return decoded == null ? Optional.empty() : Optional.of(decoded.getInfo());
  }

  /**
   * @return the decoded sketch
   * @throws CorruptSketchException if the blob cannot be decoded
   * @throws SketchUnavailableException if the blob cannot be loaded from the store
   */
  public PartitionSketch getSketch(BlobLoader loader) {
    PartitionSketch decoded = sketch;
    if (decoded != null) {
      return decoded;
    }
    CorruptSketchException failure = corruption;
    if (failure != null) {
      throw failure;
    }
    byte[] bytes = blob != null ? blob : loader.load(partitionId);
    try {
      decoded = PartitionSketch.deserialize(partitionId, bytes);
    } catch (CorruptSketchException e) {
      corruption = e;
      throw e;
    }
    sketch = decoded;
    return decoded;
  }

  /** @return an estimate of the heap bytes held by this entry */
  public long memoryUsage() {
    long bytes = 64 + (blob == null ? 0 : blob.length);
    PartitionSketch decoded = sketch;
    return decoded == null ? bytes : bytes + decoded.memoryUsage();
  }
}
