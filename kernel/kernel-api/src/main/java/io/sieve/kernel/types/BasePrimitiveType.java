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

import java.util.*;

/** Base class for all primitive types {@link DataType}. */
public abstract class BasePrimitiveType extends DataType {
  /**
   * Create a primitive type {@link DataType}
   *
   * @param primitiveTypeName Primitive type name.
   * @return {@link DataType} for given primitive type name
   */
  public static DataType createPrimitive(String primitiveTypeName) {
    return Optional.ofNullable(Primitives.BY_NAME.get(primitiveTypeName))
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown primitive type " + primitiveTypeName));
  }

  /** Is the given type name a primitive type? */
  public static boolean isPrimitiveType(String typeName) {
    return Primitives.BY_NAME.containsKey(typeName);
  }

  public static Collection<DataType> getAllPrimitiveTypes() {
    return Primitives.BY_NAME.values();
  }

  // Initialized on first use: the subclasses' singletons are not yet assigned while this class
  // itself is being initialized.
  private static class Primitives {
    static final Map<String, DataType> BY_NAME;

    static {
      Map<String, DataType> types = new LinkedHashMap<>();
      types.put("boolean", BooleanType.BOOLEAN);
      types.put("long", LongType.LONG);
      types.put("double", DoubleType.DOUBLE);
      types.put("string", StringType.STRING);
      types.put("timestamp", TimestampType.TIMESTAMP);
      BY_NAME = Collections.unmodifiableMap(types);
    }
  }

  private final String primitiveTypeName;

  protected BasePrimitiveType(String primitiveTypeName) {
    this.primitiveTypeName = primitiveTypeName;
  }

  /** @return the name of this type as used in schemas, serialized sketches and type extractors. */
  public String getName() {
    return primitiveTypeName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BasePrimitiveType that = (BasePrimitiveType) o;
    return primitiveTypeName.equals(that.primitiveTypeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(primitiveTypeName);
  }

  @Override
  public String toString() {
    return primitiveTypeName;
  }
}
