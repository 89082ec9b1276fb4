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

package io.sieve.kernel;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.data.TableSlice;
import io.sieve.kernel.index.PartitionIndex;
import io.sieve.kernel.index.SealedPartition;
import io.sieve.kernel.internal.SieveErrors;
import io.sieve.kernel.internal.logging.SieveLogger;
import io.sieve.kernel.sketch.PartitionSketch;
import io.sieve.kernel.sketch.PartitionSketchBuilder;
import io.sieve.kernel.types.StructType;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.LoggerFactory;

/**
 * Builds one partition of a single schema: feeds every added event into the synopses of the
 * partition sketch and into the bitmap indexes, and freezes both when the partition is sealed.
 *
 * <p>Not thread safe. The sealed results are immutable and may be shared freely.
 */
@Evolving
public final class PartitionBuilder {
  private static final SieveLogger logger =
      new SieveLogger(LoggerFactory.getLogger(PartitionBuilder.class), "partition");

  private final UUID partitionId;
  private final String schemaName;
  private final StructType schema;
  private final long capacity;
  private final PartitionSketchBuilder sketchBuilder;
  private final PartitionIndex.Builder indexBuilder;
  private long events;
  private long nextOffset = -1;
  private boolean sealed;

  private PartitionBuilder(
      UUID partitionId, String schemaName, StructType schema, IndexSettings settings) {
    this.partitionId = partitionId;
    this.schemaName = schemaName;
    this.schema = schema;
    this.capacity = settings.getPartitionMaxEvents();
    this.sketchBuilder = new PartitionSketchBuilder(partitionId, schemaName, schema, settings);
    this.indexBuilder = PartitionIndex.builder(schemaName, schema);
  }

  /** Opens a new partition with a random id. */
  public static PartitionBuilder create(
      String schemaName, StructType schema, IndexSettings settings) {
    return create(UUID.randomUUID(), schemaName, schema, settings);
  }

  public static PartitionBuilder create(
      UUID partitionId, String schemaName, StructType schema, IndexSettings settings) {
    return new PartitionBuilder(
        Objects.requireNonNull(partitionId, "partitionId is null"),
        Objects.requireNonNull(schemaName, "schemaName is null"),
        Objects.requireNonNull(schema, "schema is null"),
        Objects.requireNonNull(settings, "settings is null"));
  }

  public UUID getPartitionId() {
    return partitionId;
  }

  /** @return the number of events added so far */
  public long getEvents() {
    return events;
  }

  /** @return how many more events fit into the partition */
  public long remainingCapacity() {
    return capacity - events;
  }

  /**
   * Adds the events of a slice. Slices must be contiguous: each one starts at the id following
   * the last event of the previous one.
   *
   * @throws io.sieve.kernel.exceptions.SieveException if the partition is sealed or the slice has
   *     another schema
   * @throws io.sieve.kernel.exceptions.PartitionCapacityExceededException if the events do not fit
   * @throws IllegalArgumentException if the slice is not contiguous with the previous one
   */
  public PartitionBuilder add(TableSlice slice) {
    if (sealed) {
      throw SieveErrors.partitionAlreadySealed(schemaName);
    }
    if (!slice.getSchemaName().equals(schemaName) || !slice.getSchema().equals(schema)) {
      throw SieveErrors.schemaMismatch(schemaName, schema, slice.getSchema());
    }
    if (events + slice.getSize() > capacity) {
      throw SieveErrors.partitionCapacityExceeded(schemaName, capacity, events + slice.getSize());
    }
    if (slice.getSize() == 0) {
      return this;
    }
    if (nextOffset >= 0 && slice.getOffset() != nextOffset) {
      throw new IllegalArgumentException(
          String.format(
              "Slice starts at id %s, but partition %s continues at %s",
              slice.getOffset(), partitionId, nextOffset));
    }
    sketchBuilder.add(slice);
    indexBuilder.add(slice);
    events += slice.getSize();
    nextOffset = slice.getOffset() + slice.getSize();
    return this;
  }

  /** Freezes the partition. The builder cannot be used afterwards. */
  public SealedPartition seal() {
    if (sealed) {
      throw SieveErrors.partitionAlreadySealed(schemaName);
    }
    sealed = true;
    PartitionSketch sketch = sketchBuilder.build();
    PartitionIndex index = indexBuilder.build();
    byte[] blob = sketch.serialize();
    logger.info(
        "Sealed partition {} of schema '{}' with {} events ({} sketch bytes)",
        partitionId,
        schemaName,
        events,
        blob.length);
    return new SealedPartition(sketch, index, blob);
  }
}
