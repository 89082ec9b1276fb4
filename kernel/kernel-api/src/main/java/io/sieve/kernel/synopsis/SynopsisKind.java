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

package io.sieve.kernel.synopsis;

import io.sieve.kernel.annotation.Evolving;

/** The closed set of {@link Synopsis} variants. */
@Evolving
public enum SynopsisKind {
  BLOOM_FILTER("bloomfilter"),
  MIN_MAX("minmax");

  private final String name;

  SynopsisKind(String name) {
    this.name = name;
  }

  /** @return the name used in schema attributes and serialized sketches */
  public String getName() {
    return name;
  }

  public static SynopsisKind fromName(String name) {
    for (SynopsisKind kind : values()) {
      if (kind.name.equals(name)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown synopsis kind: " + name);
  }
}
