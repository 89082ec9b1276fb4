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

package io.sieve.kernel.data;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A batch of events of a single schema, as handed to a partition by the ingestion pipeline. The
 * rows occupy the contiguous id range {@code [offset, offset + rows)}.
 */
@Evolving
public final class TableSlice {
  private final String schemaName;
  private final StructType schema;
  private final long offset;
  private final long importTime;
  private final List<Row> rows;

  /**
   * @param schemaName name of the schema, e.g. {@code zeek.conn}
   * @param schema layout of every row
   * @param offset id of the first row
   * @param importTime ingestion time in microseconds since epoch
   * @param rows the events; each must conform to {@code schema}
   */
  public TableSlice(
      String schemaName, StructType schema, long offset, long importTime, List<Row> rows) {
    this.schemaName = Objects.requireNonNull(schemaName, "schemaName is null");
    this.schema = Objects.requireNonNull(schema, "schema is null");
    checkArgument(offset >= 0, "offset must be non-negative: %s", offset);
    this.offset = offset;
    this.importTime = importTime;
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    for (Row row : this.rows) {
      checkArgument(
          row.getSchema().equals(schema),
          "Row schema %s does not match %s",
          row.getSchema(),
          schema);
    }
  }

  public String getSchemaName() {
    return schemaName;
  }

  public StructType getSchema() {
    return schema;
  }

  public long getOffset() {
    return offset;
  }

  public long getImportTime() {
    return importTime;
  }

  public List<Row> getRows() {
    return rows;
  }

  public int getSize() {
    return rows.size();
  }

  @Override
  public String toString() {
    return String.format(
        "TableSlice{schema=%s, offset=%s, rows=%s, importTime=%s}",
        schemaName, offset, rows.size(), importTime);
  }
}
