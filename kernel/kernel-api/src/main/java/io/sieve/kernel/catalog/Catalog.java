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

package io.sieve.kernel.catalog;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.engine.Engine;
import io.sieve.kernel.exceptions.SieveException;
import io.sieve.kernel.expressions.Expression;
import io.sieve.kernel.internal.SieveErrors;
import io.sieve.kernel.internal.catalog.CatalogEntry;
import io.sieve.kernel.internal.catalog.SketchEvaluator;
import io.sieve.kernel.internal.logging.SieveLogger;
import io.sieve.kernel.sketch.PartitionInfo;
import io.sieve.kernel.sketch.PartitionSketch;
import java.util.*;
import java.util.concurrent.*;
import org.slf4j.LoggerFactory;

/**
 * The registry of all partitions and their sketches. Resolves an expression into the partitions
 * that may hold matching events.
 *
 * <p>Partitions are only ever added. Lookups work on a snapshot of the registered partitions and
 * run concurrently with each other and with additions.
 */
@Evolving
public class Catalog {
  private static final SieveLogger logger =
      new SieveLogger(LoggerFactory.getLogger(Catalog.class), "catalog");

  private final Engine engine;
  private final IndexSettings settings;
  private final Object writeLock = new Object();
  private final ConcurrentHashMap<UUID, CatalogEntry> entriesById = new ConcurrentHashMap<>();
  private volatile List<CatalogEntry> entries = Collections.emptyList();

  public Catalog(Engine engine, IndexSettings settings) {
    this.engine = Objects.requireNonNull(engine, "engine is null");
    this.settings = Objects.requireNonNull(settings, "settings is null");
  }

  /**
   * Registers a partition by its serialized sketch. The blob is decoded on first use.
   *
   * @throws IllegalArgumentException if the partition is already registered
   */
  public void addSketch(UUID partitionId, byte[] blob) {
    register(CatalogEntry.ofBlob(partitionId, blob.clone()));
  }

  /**
   * Registers a partition by its sketch.
   *
   * @throws IllegalArgumentException if the partition is already registered
   */
  public void addSketch(PartitionSketch sketch) {
    register(CatalogEntry.ofSketch(sketch));
  }

  /**
   * Registers a partition whose sketch is in the engine's {@link
   * io.sieve.kernel.engine.SketchStore}. The sketch is loaded on first use.
   *
   * @throws IllegalArgumentException if the partition is already registered
   */
  public void addPartition(PartitionInfo info) {
    register(CatalogEntry.ofInfo(info));
  }

  private void register(CatalogEntry entry) {
    synchronized (writeLock) {
      checkArgument(
          !entriesById.containsKey(entry.getPartitionId()),
          "Partition %s is already registered",
          entry.getPartitionId());
      List<CatalogEntry> updated = new ArrayList<>(entries.size() + 1);
      updated.addAll(entries);
      updated.add(entry);
      entriesById.put(entry.getPartitionId(), entry);
      entries = Collections.unmodifiableList(updated);
    }
    logger.debug("Registered partition {}", entry.getPartitionId());
  }

  /**
   * Determines the partitions that may hold events matching {@code expression}.
   *
   * <p>Conjunctions and disjunctions are evaluated over the partition sketches, negations never
   * exclude a partition. Candidates are ordered newest first: the reverse of registration order.
   * A partition whose sketch is corrupt or cannot be loaded is a candidate, and the failure is
   * reported in {@link CatalogLookupResult#getErrors()}.
   */
  public CatalogLookupResult resolve(Expression expression) {
    Objects.requireNonNull(expression, "expression is null");
    return logger.timeOperation(
        "resolve",
        () -> {
          List<CatalogEntry> snapshot = entries;
          List<UUID> candidates = new ArrayList<>();
          Map<UUID, SieveException> errors = new LinkedHashMap<>();
          for (int i = snapshot.size() - 1; i >= 0; i--) {
            CatalogEntry entry = snapshot.get(i);
            try {
              PartitionSketch sketch = entry.getSketch(this::loadBlob);
              if (expression.accept(new SketchEvaluator(sketch))) {
                candidates.add(entry.getPartitionId());
              }
            } catch (SieveException e) {
              logger.warn(
                  "Including partition {} without consulting its sketch: {}",
                  entry.getPartitionId(),
                  e.getMessage());
              candidates.add(entry.getPartitionId());
              errors.put(entry.getPartitionId(), e);
            }
          }
          logger.debug(
              "Resolved {} to {} of {} partitions", expression, candidates.size(), snapshot.size());
          return new CatalogLookupResult(candidates, errors);
        });
  }

  /**
   * @return the sketch of the partition, empty if it is not registered
   * @throws io.sieve.kernel.exceptions.CorruptSketchException if the sketch cannot be decoded
   * @throws io.sieve.kernel.exceptions.SketchUnavailableException if the sketch cannot be loaded
   */
  public Optional<PartitionSketch> getSketch(UUID partitionId) {
    CatalogEntry entry = entriesById.get(partitionId);
    return entry == null ? Optional.empty() : Optional.of(entry.getSketch(this::loadBlob));
  }

  /**
   * @return the info of the partition, empty if it is not registered. May decode the sketch and
   *     fail like {@link #getSketch(UUID)}.
   */
  public Optional<PartitionInfo> getPartitionInfo(UUID partitionId) {
    CatalogEntry entry = entriesById.get(partitionId);
    if (entry == null) {
      return Optional.empty();
    }
    Optional<PartitionInfo> info = entry.getKnownInfo();
    return info.isPresent() ? info : Optional.of(entry.getSketch(this::loadBlob).getInfo());
  }

  /** @return the registered partitions in registration order */
  public List<UUID> partitions() {
    List<CatalogEntry> snapshot = entries;
    List<UUID> ids = new ArrayList<>(snapshot.size());
    for (CatalogEntry entry : snapshot) {
      ids.add(entry.getPartitionId());
    }
    return ids;
  }

  public int size() {
    return entries.size();
  }

  /** @return an estimate of the heap bytes held by the registered sketches */
  public long memoryUsage() {
    long bytes = 0;
    for (CatalogEntry entry : entries) {
      bytes += entry.memoryUsage();
    }
    return bytes;
  }

  private byte[] loadBlob(UUID partitionId) {
    long timeoutMillis = settings.getSketchLoadTimeoutMillis();
    CompletableFuture<byte[]> future;
    try {
      future = engine.getSketchStore().load(partitionId);
    } catch (RuntimeException e) {
      throw SieveErrors.sketchLoadFailed(partitionId, e);
    }
    if (future == null) {
      throw SieveErrors.sketchLoadFailed(
          partitionId, new NullPointerException("sketch store returned no future"));
    }
    try {
      byte[] blob = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
      if (blob == null) {
        throw SieveErrors.sketchLoadFailed(
            partitionId, new NullPointerException("sketch store returned no blob"));
      }
      return blob;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw SieveErrors.sketchLoadTimedOut(partitionId, timeoutMillis, e);
    } catch (ExecutionException e) {
      throw SieveErrors.sketchLoadFailed(partitionId, e.getCause());
    } catch (CancellationException e) {
      throw SieveErrors.sketchLoadFailed(partitionId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw SieveErrors.sketchLoadFailed(partitionId, e);
    }
  }
}
