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

package io.sieve.kernel.internal.data;

import static java.util.Objects.requireNonNull;

import io.sieve.kernel.data.Row;
import io.sieve.kernel.types.*;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Exposes a given map of values as a {@link Row} */
public class GenericRow implements Row {
  private final StructType schema;
  private final Map<Integer, Object> ordinalToValue;

  /**
   * @param schema the schema of the row
   * @param ordinalToValue a mapping of column ordinal to objects; for each column the object must
   *     be of the return type corresponding to the data type's getter method in the Row interface
   */
  public GenericRow(StructType schema, Map<Integer, Object> ordinalToValue) {
    this.schema = requireNonNull(schema, "schema is null");
    this.ordinalToValue = requireNonNull(ordinalToValue, "ordinalToValue is null");
  }

  /** Creates a row from values listed in field order; {@code null} entries are null values. */
  public static GenericRow of(StructType schema, List<?> values) {
    if (values.size() != schema.length()) {
      throw new IllegalArgumentException(
          String.format("Expected %s values for %s, got %s", schema.length(), schema, values));
    }
    Map<Integer, Object> ordinalToValue = new HashMap<>();
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null) {
        ordinalToValue.put(i, values.get(i));
      }
    }
    return new GenericRow(schema, ordinalToValue);
  }

  @Override
  public StructType getSchema() {
    return schema;
  }

  @Override
  public boolean isNullAt(int ordinal) {
    return getValue(ordinal) == null;
  }

  @Override
  public boolean getBoolean(int ordinal) {
    throwIfUnsafeAccess(ordinal, BooleanType.class, "boolean");
    return (boolean) getValue(ordinal);
  }

  @Override
  public long getLong(int ordinal) {
    DataType dataType = dataType(ordinal);
    if (!(dataType instanceof LongType) && !(dataType instanceof TimestampType)) {
      throw unsafeAccess("long", dataType);
    }
    return ((Number) getValue(ordinal)).longValue();
  }

  @Override
  public double getDouble(int ordinal) {
    throwIfUnsafeAccess(ordinal, DoubleType.class, "double");
    return ((Number) getValue(ordinal)).doubleValue();
  }

  @Override
  public String getString(int ordinal) {
    throwIfUnsafeAccess(ordinal, StringType.class, "string");
    return (String) getValue(ordinal);
  }

  private Object getValue(int ordinal) {
    return ordinalToValue.get(ordinal);
  }

  private void throwIfUnsafeAccess(
      int ordinal, Class<? extends DataType> expDataType, String accessType) {
    DataType actualDataType = dataType(ordinal);
    if (!expDataType.isAssignableFrom(actualDataType.getClass())) {
      throw unsafeAccess(accessType, actualDataType);
    }
  }

  private static UnsupportedOperationException unsafeAccess(
      String accessType, DataType actualDataType) {
    String msg =
        String.format(
            "Trying to access a `%s` value from column of type `%s`", accessType, actualDataType);
    return new UnsupportedOperationException(msg);
  }

  private DataType dataType(int ordinal) {
    if (schema.length() <= ordinal) {
      throw new IllegalArgumentException("invalid ordinal: " + ordinal);
    }
    return schema.at(ordinal).getDataType();
  }
}
