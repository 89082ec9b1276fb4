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
import io.sieve.kernel.expressions.*;
import io.sieve.kernel.internal.sketch.PartitionSketchSerDe;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.synopsis.MinMaxSynopsis;
import io.sieve.kernel.synopsis.Synopsis;
import io.sieve.kernel.types.DataType;
import io.sieve.kernel.types.StringType;
import java.util.*;

/**
 * The synopses of one partition: one optional {@link Synopsis} per field, plus one per type
 * covering all fields of that type. Immutable once built; serialized to a blob with {@link
 * #serialize()}.
 */
@Evolving
public final class PartitionSketch {
  private final PartitionInfo info;
  private final List<FieldSketch> fields;
  private final Map<DataType, Synopsis> typeSynopses;
  private volatile int serializedSize = -1;

  public PartitionSketch(
      PartitionInfo info, List<FieldSketch> fields, Map<DataType, Synopsis> typeSynopses) {
    this.info = Objects.requireNonNull(info, "info is null");
    this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    this.typeSynopses = Collections.unmodifiableMap(new LinkedHashMap<>(typeSynopses));
  }

  /**
   * Decodes a blob produced by {@link #serialize()}.
   *
   * @throws io.sieve.kernel.exceptions.CorruptSketchException if the blob cannot be decoded or
   *     describes a different partition
   */
  public static PartitionSketch deserialize(UUID partitionId, byte[] blob) {
    return PartitionSketchSerDe.deserialize(partitionId, blob);
  }

  public byte[] serialize() {
    byte[] blob = PartitionSketchSerDe.serialize(this);
    serializedSize = blob.length;
    return blob;
  }

  public PartitionInfo getInfo() {
    return info;
  }

  public UUID getPartitionId() {
    return info.getPartitionId();
  }

  public String getSchemaName() {
    return info.getSchemaName();
  }

  public long getEvents() {
    return info.getEvents();
  }

  public long getOffset() {
    return info.getOffset();
  }

  public List<FieldSketch> getFields() {
    return fields;
  }

  public Map<DataType, Synopsis> getTypeSynopses() {
    return typeSynopses;
  }

  /** @return the time synopsis over the import times of the events */
  public MinMaxSynopsis<Long> getImportTimeSynopsis() {
    if (info.getEvents() == 0) {
      return MinMaxSynopsis.forTimestamps();
    }
    return MinMaxSynopsis.forTimeRange(info.getMinImportTime(), info.getMaxImportTime());
  }

  /**
   * Checks whether any event of the partition may satisfy the predicate.
   *
   * <ul>
   *   <li>A column refers to every field it matches (see {@link Column#matches(String, String)});
   *       if it matches none, no event satisfies the predicate.
   *   <li>A type extractor refers to every field of the type; likewise none means false.
   *   <li>A field is checked with its own synopsis, else with the synopsis of its type; without
   *       either it may satisfy any predicate.
   *   <li>{@code #schema} is evaluated exactly, {@code #import_time} with the time synopsis.
   * </ul>
   *
   * @return false only if no event satisfies the predicate
   */
  public boolean lookup(Predicate predicate) {
    RelationalOperator op = predicate.getOperator();
    Literal literal = predicate.getLiteral();
    Extractor extractor = predicate.getExtractor();
    if (extractor instanceof Column) {
      Column column = (Column) extractor;
      for (FieldSketch field : fields) {
        if (column.matches(info.getSchemaName(), field.getName())
            && lookupField(field, op, literal)) {
          return true;
        }
      }
      return false;
    } else if (extractor instanceof TypeExtractor) {
      DataType type = ((TypeExtractor) extractor).getType();
      for (FieldSketch field : fields) {
        if (field.getType().equals(type) && lookupField(field, op, literal)) {
          return true;
        }
      }
      return false;
    } else if (extractor == MetaExtractor.SCHEMA) {
      return ValueUtils.evaluate(info.getSchemaName(), StringType.STRING, op, literal)
          .orElse(true);
    } else if (extractor == MetaExtractor.IMPORT_TIME) {
      return getImportTimeSynopsis().lookup(op, literal);
    }
    return true;
  }

  private boolean lookupField(FieldSketch field, RelationalOperator op, Literal literal) {
    Synopsis synopsis = field.getSynopsis().orElse(typeSynopses.get(field.getType()));
    return synopsis == null || synopsis.lookup(op, literal);
  }

  /** @return the size of the serialized blob in bytes */
  public int getSerializedSize() {
    int size = serializedSize;
    if (size < 0) {
      size = serialize().length;
    }
    return size;
  }

  /** @return an estimate of the heap bytes held by this sketch */
  public long memoryUsage() {
    long bytes = 64;
    for (FieldSketch field : fields) {
      bytes += 32 + 2L * field.getName().length();
      if (field.getSynopsis().isPresent()) {
        bytes += field.getSynopsis().get().memoryUsage();
      }
    }
    for (Synopsis synopsis : typeSynopses.values()) {
      bytes += synopsis.memoryUsage();
    }
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionSketch)) {
      return false;
    }
    PartitionSketch that = (PartitionSketch) o;
    return info.equals(that.info)
        && fields.equals(that.fields)
        && typeSynopses.equals(that.typeSynopses);
  }

  @Override
  public int hashCode() {
    return Objects.hash(info, fields, typeSynopses);
  }

  @Override
  public String toString() {
    return String.format(
        "PartitionSketch{id=%s, schema=%s, events=%s, fields=%s}",
        info.getPartitionId(), info.getSchemaName(), info.getEvents(), fields.size());
  }
}
