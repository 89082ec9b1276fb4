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

package io.sieve.kernel.types;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.expressions.Column;
import java.util.*;
import java.util.stream.Collectors;

/** The flattened record type of the events in a partition: an ordered list of leaf fields. */
@Evolving
public final class StructType extends DataType {

  private final Map<String, Integer> nameToOrdinal;
  private final List<StructField> fields;
  private final List<String> fieldNames;

  public StructType() {
    this(new ArrayList<>());
  }

  public StructType(List<StructField> fields) {
    this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    this.fieldNames = fields.stream().map(StructField::getName).collect(Collectors.toList());
    this.nameToOrdinal = new HashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      Integer previous = nameToOrdinal.put(fields.get(i).getName(), i);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate field name: " + fields.get(i).getName());
      }
    }
  }

  public StructType add(StructField field) {
    final List<StructField> fieldsCopy = new ArrayList<>(fields);
    fieldsCopy.add(field);
    return new StructType(fieldsCopy);
  }

  public StructType add(String name, DataType dataType) {
    return add(new StructField(name, dataType, true /* nullable */));
  }

  public StructType add(String name, DataType dataType, FieldMetadata metadata) {
    return add(new StructField(name, dataType, true /* nullable */, metadata));
  }

  /** @return list of fields */
  public List<StructField> fields() {
    return fields;
  }

  /** @return list of field names */
  public List<String> fieldNames() {
    return fieldNames;
  }

  /** @return the number of fields */
  public int length() {
    return fields.size();
  }

  public int indexOf(String fieldName) {
    Integer ordinal = nameToOrdinal.get(fieldName);
    return ordinal == null ? -1 : ordinal;
  }

  public StructField get(String fieldName) {
    int ordinal = indexOf(fieldName);
    return ordinal < 0 ? null : fields.get(ordinal);
  }

  public StructField at(int index) {
    return fields.get(index);
  }

  /**
   * @return the ordinals of all fields the given column refers to, in field order. A column may
   *     match several fields when its path is a suffix of more than one dotted field name.
   * @see Column#matches(String, String)
   */
  public List<Integer> resolve(Column column, String schemaName) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      if (column.matches(schemaName, fields.get(i).getName())) {
        result.add(i);
      }
    }
    return result;
  }

  /** @return the ordinals of all fields whose type equals {@code dataType}. */
  public List<Integer> fieldsOfType(DataType dataType) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getDataType().equals(dataType)) {
        result.add(i);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return String.format(
        "struct(%s)", fields.stream().map(StructField::toString).collect(Collectors.joining(", ")));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return fields.equals(((StructType) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }
}
