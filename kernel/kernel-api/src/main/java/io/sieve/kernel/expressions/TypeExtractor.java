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

package io.sieve.kernel.expressions;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.types.DataType;
import java.util.Objects;

/** Refers to every field of a given type, written {@code :timestamp} in queries. */
@Evolving
public final class TypeExtractor implements Extractor {
  private final DataType type;

  public TypeExtractor(DataType type) {
    this.type = Objects.requireNonNull(type, "type is null");
  }

  public DataType getType() {
    return type;
  }

  @Override
  public String toString() {
    return ":" + type;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TypeExtractor && type.equals(((TypeExtractor) o).type));
  }

  @Override
  public int hashCode() {
    return Objects.hash(":", type);
  }
}
