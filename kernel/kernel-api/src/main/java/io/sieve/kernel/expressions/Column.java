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
import java.util.Objects;

/**
 * Refers to event fields by name. Field names of flattened records are dotted paths (e.g. {@code
 * id.orig_h}); a column matches every field whose name ends with the column path on a dot
 * boundary, so {@code orig_h} and {@code id.orig_h} both match the field {@code id.orig_h}.
 */
@Evolving
public final class Column implements Extractor {
  private final String path;

  public Column(String path) {
    this.path = Objects.requireNonNull(path, "path is null");
    if (path.isEmpty()) {
      throw new IllegalArgumentException("Column path must not be empty");
    }
  }

  public String getPath() {
    return path;
  }

  /** @return whether this column refers to the field {@code fieldName}. */
  public boolean matches(String fieldName) {
    return endsWithOnDotBoundary(fieldName, path);
  }

  /**
   * @return whether this column refers to the field {@code fieldName} of the schema {@code
   *     schemaName}. The path may also be qualified with (a suffix of) the schema name, e.g.
   *     {@code conn.id.orig_h} for field {@code id.orig_h} of schema {@code zeek.conn}.
   */
  public boolean matches(String schemaName, String fieldName) {
    if (matches(fieldName)) {
      return true;
    }
    if (schemaName == null || schemaName.isEmpty()) {
      return false;
    }
    return endsWithOnDotBoundary(schemaName + "." + fieldName, path);
  }

  private static boolean endsWithOnDotBoundary(String name, String suffix) {
    if (!name.endsWith(suffix)) {
      return false;
    }
    int pos = name.length() - suffix.length();
    return pos == 0 || name.charAt(pos - 1) == '.';
  }

  @Override
  public String toString() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Column && path.equals(((Column) o).path));
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }
}
