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

package io.sieve.kernel.index;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;
import static io.sieve.kernel.internal.util.Preconditions.checkState;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.data.Row;
import io.sieve.kernel.data.TableSlice;
import io.sieve.kernel.expressions.*;
import io.sieve.kernel.ids.Ids;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.types.StructField;
import io.sieve.kernel.types.StringType;
import io.sieve.kernel.types.StructType;
import io.sieve.kernel.types.TimestampType;
import java.util.*;

/**
 * The exact indexes of one sealed partition: a {@link BitmapIndex} per field (fields marked {@code
 * #skip} are not indexed) and one over the import time of each row.
 *
 * <p>Row ids are relative to the partition: position {@code i} of a result refers to the row with
 * id {@link #getOffset()} {@code + i}.
 */
@Evolving
public final class PartitionIndex {
  private final String schemaName;
  private final StructType schema;
  private final long offset;
  private final long events;
  private final Map<String, BitmapIndex> fieldIndexes;
  private final BitmapIndex importTimeIndex;

  private PartitionIndex(
      String schemaName,
      StructType schema,
      long offset,
      long events,
      Map<String, BitmapIndex> fieldIndexes,
      BitmapIndex importTimeIndex) {
    this.schemaName = schemaName;
    this.schema = schema;
    this.offset = offset;
    this.events = events;
    this.fieldIndexes = Collections.unmodifiableMap(fieldIndexes);
    this.importTimeIndex = importTimeIndex;
  }

  public static Builder builder(String schemaName, StructType schema) {
    return new Builder(schemaName, schema);
  }

  public String getSchemaName() {
    return schemaName;
  }

  public StructType getSchema() {
    return schema;
  }

  /** @return the id of the first row of the partition */
  public long getOffset() {
    return offset;
  }

  /** @return the number of rows */
  public long getEvents() {
    return events;
  }

  /** @return the index of the field, empty if the field does not exist or is not indexed */
  public Optional<BitmapIndex> getFieldIndex(String fieldName) {
    return Optional.ofNullable(fieldIndexes.get(fieldName));
  }

  /**
   * Evaluates the expression over all rows of the partition.
   *
   * <p>The result is exact for expressions over indexed fields. Comparisons over fields that are
   * not indexed, or with literals that do not fit the field type, select all rows. A negation of
   * such an inexact result also selects all rows.
   *
   * @return the rows that satisfy the expression, a bit sequence of length {@link #getEvents()}
   * @throws IllegalStateException if intermediate results disagree in length
   */
  public Ids lookup(Expression expression) {
    return expression.accept(new Evaluator()).ids;
  }

  /** @return an estimate of the bytes held by all bitmaps of this partition */
  public long memoryUsage() {
    long bytes = importTimeIndex.memoryUsage();
    for (BitmapIndex index : fieldIndexes.values()) {
      bytes += index.memoryUsage();
    }
    return bytes;
  }

  @Override
  public String toString() {
    return String.format(
        "PartitionIndex{schema=%s, offset=%s, events=%s, indexedFields=%s}",
        schemaName, offset, events, fieldIndexes.keySet());
  }

  /** The rows selected by a subexpression and whether the selection is exact. */
  private static final class Result {
    final Ids ids;
    final boolean exact;

    Result(Ids ids, boolean exact) {
      this.ids = ids;
      this.exact = exact;
    }
  }

  private final class Evaluator implements ExpressionVisitor<Result> {
    @Override
    public Result visitConjunction(Conjunction conjunction) {
      Result result = null;
      for (Expression operand : conjunction.getChildren()) {
        Result next = operand.accept(this);
        result = result == null ? next : combine(result, next, true);
      }
      return result;
    }

    @Override
    public Result visitDisjunction(Disjunction disjunction) {
      Result result = null;
      for (Expression operand : disjunction.getChildren()) {
        Result next = operand.accept(this);
        result = result == null ? next : combine(result, next, false);
      }
      return result;
    }

    @Override
    public Result visitNegation(Negation negation) {
      Result operand = negation.getOperand().accept(this);
      if (!operand.exact) {
        return new Result(Ids.of(events, true), false);
      }
      return new Result(operand.ids.not(), true);
    }

    @Override
    public Result visitPredicate(Predicate predicate) {
      Extractor extractor = predicate.getExtractor();
      if (extractor instanceof Column) {
        return lookupFields(schema.resolve((Column) extractor, schemaName), predicate);
      } else if (extractor instanceof TypeExtractor) {
        return lookupFields(
            schema.fieldsOfType(((TypeExtractor) extractor).getType()), predicate);
      } else if (extractor == MetaExtractor.IMPORT_TIME) {
        return new Result(
            importTimeIndex.lookup(predicate.getOperator(), predicate.getLiteral()),
            importTimeIndex.isExact(predicate.getOperator(), predicate.getLiteral()));
      } else if (extractor == MetaExtractor.SCHEMA) {
        Optional<Boolean> matches =
            ValueUtils.evaluate(
                schemaName,
                StringType.STRING,
                predicate.getOperator(),
                predicate.getLiteral());
        return matches
            .map(m -> new Result(Ids.of(events, m), true))
            .orElseGet(() -> new Result(Ids.of(events, true), false));
      }
      throw new IllegalArgumentException("Unsupported extractor: " + extractor);
    }

    private Result lookupFields(List<Integer> ordinals, Predicate predicate) {
      // A field missing from the schema is null in every row.
      Result result = new Result(Ids.of(events, false), true);
      for (int ordinal : ordinals) {
        BitmapIndex index = fieldIndexes.get(schema.at(ordinal).getName());
        Result next;
        if (index == null) {
          next = new Result(Ids.of(events, true), false);
        } else {
          next =
              new Result(
                  index.lookup(predicate.getOperator(), predicate.getLiteral()),
                  index.isExact(predicate.getOperator(), predicate.getLiteral()));
        }
        result = combine(result, next, false);
      }
      return result;
    }

    private Result combine(Result left, Result right, boolean conjunction) {
      checkState(
          left.ids.size() == right.ids.size(),
          "Cannot combine bitmaps of different lengths: %s and %s",
          left.ids.size(),
          right.ids.size());
      Ids ids = conjunction ? left.ids.and(right.ids) : left.ids.or(right.ids);
      return new Result(ids, left.exact && right.exact);
    }
  }

  /** Appends the rows of table slices to the indexes of a partition that is being built. */
  public static final class Builder {
    private final String schemaName;
    private final StructType schema;
    private final Map<String, BitmapIndex> fieldIndexes = new LinkedHashMap<>();
    private final BitmapIndex importTimeIndex = new BitmapIndex(TimestampType.TIMESTAMP);
    private long offset = -1;
    private long events;

    private Builder(String schemaName, StructType schema) {
      this.schemaName = Objects.requireNonNull(schemaName, "schemaName is null");
      this.schema = Objects.requireNonNull(schema, "schema is null");
      for (StructField field : schema.fields()) {
        if (!field.isSkipped()) {
          fieldIndexes.put(field.getName(), new BitmapIndex(field.getDataType()));
        }
      }
    }

    public Builder add(TableSlice slice) {
      checkArgument(
          slice.getSchema().equals(schema), "Slice schema does not match %s", schemaName);
      if (offset < 0 && slice.getSize() > 0) {
        offset = slice.getOffset();
      }
      for (Row row : slice.getRows()) {
        for (int i = 0; i < schema.length(); i++) {
          BitmapIndex index = fieldIndexes.get(schema.at(i).getName());
          if (index != null) {
            index.pushBack(ValueUtils.getValue(row, i));
          }
        }
        importTimeIndex.pushBack(slice.getImportTime());
      }
      events += slice.getSize();
      return this;
    }

    public PartitionIndex build() {
      return new PartitionIndex(
          schemaName,
          schema,
          Math.max(offset, 0),
          events,
          new LinkedHashMap<>(fieldIndexes),
          importTimeIndex);
    }
  }
}
