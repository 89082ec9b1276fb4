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
import io.sieve.kernel.synopsis.Synopsis;
import io.sieve.kernel.types.DataType;
import java.util.Objects;
import java.util.Optional;

/** A field of a {@link PartitionSketch}: its name, its type and its synopsis, if any. */
@Evolving
public final class FieldSketch {
  private final String name;
  private final DataType type;
  private final Synopsis synopsis;

  public FieldSketch(String name, DataType type, Optional<Synopsis> synopsis) {
    this.name = Objects.requireNonNull(name, "name is null");
    this.type = Objects.requireNonNull(type, "type is null");
    this.synopsis = synopsis.orElse(null);
  }

  public String getName() {
    return name;
  }

  public DataType getType() {
    return type;
  }

  public Optional<Synopsis> getSynopsis() {
    return Optional.ofNullable(synopsis);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldSketch)) {
      return false;
    }
    FieldSketch that = (FieldSketch) o;
    return name.equals(that.name)
        && type.equals(that.type)
        && Objects.equals(synopsis, that.synopsis);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, synopsis);
  }

  @Override
  public String toString() {
    return name + ": " + type + (synopsis == null ? "" : " " + synopsis);
  }
}
