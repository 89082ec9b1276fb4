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

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.types.StructType;

/** Represents one event: a flattened record conforming to a {@link StructType}. */
@Evolving
public interface Row {

  /** @return Schema of the record. */
  StructType getSchema();

  /**
   * @param ordinal the ordinal of the column to check
   * @return whether the column at {@code ordinal} is null
   */
  boolean isNullAt(int ordinal);

  /**
   * Return boolean value of the column located at the given ordinal. Throws error if the column at
   * given ordinal is not of boolean type.
   */
  boolean getBoolean(int ordinal);

  /**
   * Return long value of the column located at the given ordinal. Throws error if the column at
   * given ordinal is not of long or timestamp type. Timestamps are microseconds since epoch.
   */
  long getLong(int ordinal);

  /**
   * Return double value of the column located at the given ordinal. Throws error if the column at
   * given ordinal is not of double type.
   */
  double getDouble(int ordinal);

  /**
   * Return string value of the column located at the given ordinal. Throws error if the column at
   * given ordinal is not of string type.
   */
  String getString(int ordinal);
}
