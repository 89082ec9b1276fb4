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

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;
import static io.sieve.kernel.internal.util.Preconditions.checkState;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.data.Row;
import io.sieve.kernel.data.TableSlice;
import io.sieve.kernel.internal.logging.SieveLogger;
import io.sieve.kernel.internal.sketch.DistinctValueBuffer;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.synopsis.MinMaxSynopsis;
import io.sieve.kernel.synopsis.Synopsis;
import io.sieve.kernel.synopsis.SynopsisAttribute;
import io.sieve.kernel.types.DataType;
import io.sieve.kernel.types.StringType;
import io.sieve.kernel.types.StructField;
import io.sieve.kernel.types.StructType;
import java.util.*;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the synopses of a partition while its events arrive.
 *
 * <p>The synopsis of a field is chosen from its attributes and the settings:
 *
 * <ul>
 *   <li>{@code #skip}: none
 *   <li>{@code #synopsis=bloomfilter(n,p)}: a Bloom filter for {@code n} values at false-positive
 *       rate {@code p}
 *   <li>{@code #synopsis=minmax}: a min-max synopsis
 *   <li>a {@code <schema>.<field>} rule of {@link IndexSettings#getFieldFpRate(String, String)}: a
 *       Bloom filter at the rule's rate for strings, a min-max synopsis for ordered types
 *   <li>otherwise: a min-max synopsis for ordered types if {@link
 *       IndexSettings#isMinMaxForOrderedTypes()}, none for other types
 * </ul>
 *
 * If {@link IndexSettings#isTypeSynopsesEnabled()}, the sketch also gets one synopsis per type
 * of the schema covering all its fields: min-max for ordered types, a Bloom filter at {@link
 * IndexSettings#getStringFpRate()} for strings.
 *
 * <p>String Bloom filters that are not sized by an attribute buffer the distinct values and are
 * sized for their number in {@link #build()}.
 *
 * <p>Not thread safe.
 */
@Evolving
public final class PartitionSketchBuilder {
  private static final SieveLogger logger =
      new SieveLogger(LoggerFactory.getLogger(PartitionSketchBuilder.class), "partition");

  private final UUID partitionId;
  private final String schemaName;
  private final StructType schema;
  private final Synopsis[] fieldSynopses;
  private final DistinctValueBuffer[] fieldBuffers;
  private final Map<DataType, Synopsis> typeSynopses = new LinkedHashMap<>();
  private final Map<DataType, DistinctValueBuffer> typeBuffers = new LinkedHashMap<>();
  private long events;
  private long offset = -1;
  private long minImportTime = Long.MAX_VALUE;
  private long maxImportTime = Long.MIN_VALUE;
  private boolean built;

  public PartitionSketchBuilder(
      UUID partitionId, String schemaName, StructType schema, IndexSettings settings) {
    this.partitionId = Objects.requireNonNull(partitionId, "partitionId is null");
    this.schemaName = Objects.requireNonNull(schemaName, "schemaName is null");
    this.schema = Objects.requireNonNull(schema, "schema is null");
    this.fieldSynopses = new Synopsis[schema.length()];
    this.fieldBuffers = new DistinctValueBuffer[schema.length()];
    for (int i = 0; i < schema.length(); i++) {
      StructField field = schema.at(i);
      Optional<Double> ruleFpRate = settings.getFieldFpRate(schemaName, field.getName());
      if (!field.isSkipped()
          && !field.getSynopsisAttribute().isPresent()
          && ruleFpRate.isPresent()
          && field.getDataType() instanceof StringType) {
        fieldBuffers[i] = new DistinctValueBuffer(field.getDataType(), ruleFpRate.get());
      } else {
        fieldSynopses[i] = newFieldSynopsis(field, ruleFpRate.isPresent(), settings).orElse(null);
      }
    }
    if (settings.isTypeSynopsesEnabled()) {
      for (StructField field : schema.fields()) {
        DataType type = field.getDataType();
        if (typeSynopses.containsKey(type) || typeBuffers.containsKey(type)) {
          continue;
        }
        if (type.isMinMaxSummarizable()) {
          typeSynopses.put(type, MinMaxSynopsis.forType(type));
        } else if (type instanceof StringType) {
          typeBuffers.put(type, new DistinctValueBuffer(type, settings.getStringFpRate()));
        }
      }
    }
  }

  private static Optional<Synopsis> newFieldSynopsis(
      StructField field, boolean hasRule, IndexSettings settings) {
    if (field.isSkipped()) {
      return Optional.empty();
    }
    Optional<String> attribute = field.getSynopsisAttribute();
    if (attribute.isPresent()) {
      Optional<SynopsisAttribute> parsed =
          SynopsisAttribute.parse(attribute.get(), settings.getDefaultFpRate());
      if (!parsed.isPresent()) {
        logger.warn("Field '{}' has no synopsis", field.getName());
        return Optional.empty();
      }
      return parsed.get().newSynopsis(field.getDataType());
    }
    if ((hasRule || settings.isMinMaxForOrderedTypes())
        && field.getDataType().isMinMaxSummarizable()) {
      return Optional.of(MinMaxSynopsis.forType(field.getDataType()));
    }
    return Optional.empty();
  }

  /** Adds the events of a slice. */
  public PartitionSketchBuilder add(TableSlice slice) {
    checkState(!built, "The sketch of partition %s has already been built", partitionId);
    checkArgument(
        slice.getSchema().equals(schema), "Slice schema does not match %s", schemaName);
    if (slice.getSize() == 0) {
      return this;
    }
    if (offset < 0) {
      offset = slice.getOffset();
    }
    for (Row row : slice.getRows()) {
      for (int i = 0; i < schema.length(); i++) {
        Object value = ValueUtils.getValue(row, i);
        if (value == null) {
          continue;
        }
        if (fieldSynopses[i] != null) {
          fieldSynopses[i].add(value);
        } else if (fieldBuffers[i] != null) {
          fieldBuffers[i].add(value);
        }
        DataType type = schema.at(i).getDataType();
        Synopsis typeSynopsis = typeSynopses.get(type);
        if (typeSynopsis != null) {
          typeSynopsis.add(value);
        } else {
          DistinctValueBuffer typeBuffer = typeBuffers.get(type);
          if (typeBuffer != null) {
            typeBuffer.add(value);
          }
        }
      }
    }
    events += slice.getSize();
    minImportTime = Math.min(minImportTime, slice.getImportTime());
    maxImportTime = Math.max(maxImportTime, slice.getImportTime());
    return this;
  }

  /** Freezes the synopses into a sketch. The builder cannot be used afterwards. */
  public PartitionSketch build() {
    checkState(!built, "The sketch of partition %s has already been built", partitionId);
    built = true;
    List<FieldSketch> fields = new ArrayList<>(schema.length());
    for (int i = 0; i < schema.length(); i++) {
      StructField field = schema.at(i);
      Synopsis synopsis =
          fieldBuffers[i] != null ? fieldBuffers[i].toSynopsis() : fieldSynopses[i];
      fields.add(
          new FieldSketch(field.getName(), field.getDataType(), Optional.ofNullable(synopsis)));
    }
    Map<DataType, Synopsis> types = new LinkedHashMap<>(typeSynopses);
    for (Map.Entry<DataType, DistinctValueBuffer> entry : typeBuffers.entrySet()) {
      DistinctValueBuffer buffer = entry.getValue();
      logger.debug(
          "Sizing the {} synopsis of partition {} for {} distinct values",
          entry.getKey(),
          partitionId,
          buffer.distinctValues());
      types.put(entry.getKey(), buffer.toSynopsis());
    }
    PartitionInfo info =
        new PartitionInfo(
            partitionId,
            schemaName,
            events,
            Math.max(offset, 0),
            events == 0 ? 0 : minImportTime,
            events == 0 ? 0 : maxImportTime);
    return new PartitionSketch(info, fields, types);
  }
}
