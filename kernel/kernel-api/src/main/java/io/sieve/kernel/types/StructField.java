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
import java.util.Objects;
import java.util.Optional;

/** Represents a field of a {@link StructType} with its type attributes. */
@Evolving
public class StructField {

  private final String name;
  private final DataType dataType;
  private final boolean nullable;
  private final FieldMetadata metadata;

  public StructField(String name, DataType dataType, boolean nullable) {
    this(name, dataType, nullable, FieldMetadata.empty());
  }

  public StructField(String name, DataType dataType, boolean nullable, FieldMetadata metadata) {
    this.name = Objects.requireNonNull(name, "name is null");
    this.dataType = Objects.requireNonNull(dataType, "dataType is null");
    this.nullable = nullable;
    this.metadata = metadata == null ? FieldMetadata.empty() : metadata;
  }

  /** @return the name of this field, dotted for flattened records (e.g. {@code id.orig_h}) */
  public String getName() {
    return name;
  }

  /** @return the data type of this field */
  public DataType getDataType() {
    return dataType;
  }

  /** @return the type attributes of this field */
  public FieldMetadata getMetadata() {
    return metadata;
  }

  /** @return whether this field allows to have a {@code null} value. */
  public boolean isNullable() {
    return nullable;
  }

  /** @return the value of the {@code #synopsis} attribute, if present */
  public Optional<String> getSynopsisAttribute() {
    return metadata.get(FieldMetadata.SYNOPSIS_KEY);
  }

  /** @return whether the field carries the {@code #skip} attribute */
  public boolean isSkipped() {
    return metadata.contains(FieldMetadata.SKIP_KEY);
  }

  @Override
  public String toString() {
    return String.format(
        "StructField(name=%s,type=%s,nullable=%s,metadata=%s)", name, dataType, nullable, metadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    StructField that = (StructField) o;
    return nullable == that.nullable
        && name.equals(that.name)
        && dataType.equals(that.dataType)
        && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dataType, nullable, metadata);
  }
}
