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

package io.sieve.kernel.ids;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import io.sieve.kernel.annotation.Evolving;

/** A half-open range {@code [first, last)} of row ids. */
@Evolving
public final class IdRange {
  private final long first;
  private final long last;

  public IdRange(long first, long last) {
    checkArgument(
        0 <= first && first <= last && last <= Ids.MAX_SIZE,
        "Invalid id range [%s, %s)",
        first,
        last);
    this.first = first;
    this.last = last;
  }

  /** @return the range {@code [id, id + 1)} */
  public static IdRange of(long id) {
    return new IdRange(id, id + 1);
  }

  public long getFirst() {
    return first;
  }

  public long getLast() {
    return last;
  }

  public long size() {
    return last - first;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IdRange)) {
      return false;
    }
    IdRange that = (IdRange) o;
    return first == that.first && last == that.last;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(first) * 31 + Long.hashCode(last);
  }

  @Override
  public String toString() {
    return "[" + first + ", " + last + ")";
  }
}
