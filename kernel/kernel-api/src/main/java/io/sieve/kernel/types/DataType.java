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

/** Base class for all data types. */
@Evolving
public abstract class DataType {

  /**
   * Returns true iff values of this type have a total order that a min-max summary can bound.
   * String values are comparable, but an unbounded domain has no empty-range sentinel.
   */
  public boolean isMinMaxSummarizable() {
    return false;
  }

  @Override
  public abstract int hashCode();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract String toString();
}
