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

package io.sieve.kernel.sketch;

import io.sieve.kernel.annotation.Evolving;
import java.util.Objects;
import java.util.UUID;

/**
 * Describes a partition without its synopses: identity, schema, id range and import time bounds.
 * A catalog can register a partition from its info alone and fetch the sketch when it is first
 * needed.
 */
@Evolving
public final class PartitionInfo {
  private final UUID partitionId;
  private final String schemaName;
  private final long events;
  private final long offset;
  private final long minImportTime;
  private final long maxImportTime;

  public PartitionInfo(
      UUID partitionId,
      String schemaName,
      long events,
      long offset,
      long minImportTime,
      long maxImportTime) {
    this.partitionId = Objects.requireNonNull(partitionId, "partitionId is null");
    this.schemaName = Objects.requireNonNull(schemaName, "schemaName is null");
    this.events = events;
    this.offset = offset;
    this.minImportTime = minImportTime;
    this.maxImportTime = maxImportTime;
  }

  public UUID getPartitionId() {
    return partitionId;
  }

  public String getSchemaName() {
    return schemaName;
  }

  public long getEvents() {
    return events;
  }

  /** @return the id of the first event */
  public long getOffset() {
    return offset;
  }

  /** @return the earliest import time, in microseconds since epoch */
  public long getMinImportTime() {
    return minImportTime;
  }

  /** @return the latest import time, in microseconds since epoch */
  public long getMaxImportTime() {
    return maxImportTime;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionInfo)) {
      return false;
    }
    PartitionInfo that = (PartitionInfo) o;
    return events == that.events
        && offset == that.offset
        && minImportTime == that.minImportTime
        && maxImportTime == that.maxImportTime
        && partitionId.equals(that.partitionId)
        && schemaName.equals(that.schemaName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partitionId, schemaName, events, offset, minImportTime, maxImportTime);
  }

  @Override
  public String toString() {
    return String.format(
        "PartitionInfo{id=%s, schema=%s, events=%s, offset=%s}",
        partitionId, schemaName, events, offset);
  }
}
