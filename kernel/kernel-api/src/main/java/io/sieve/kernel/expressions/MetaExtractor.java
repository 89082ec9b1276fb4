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

/** Refers to partition metadata rather than event fields. */
@Evolving
public enum MetaExtractor implements Extractor {
  /** The name of the schema of the events, written {@code #schema}. */
  SCHEMA("#schema"),
  /** The time at which the events were imported, written {@code #import_time}. */
  IMPORT_TIME("#import_time");

  private final String name;

  MetaExtractor(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
