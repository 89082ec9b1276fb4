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

package io.sieve.kernel.internal.sketch;

import io.sieve.kernel.internal.hash.ValueHasher;
import io.sieve.kernel.synopsis.BloomFilterSynopsis;
import io.sieve.kernel.types.DataType;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the hashes of the distinct values of a partition until it is sealed, then turns them
 * into a {@link BloomFilterSynopsis} sized for the observed number of distinct values.
 */
public final class DistinctValueBuffer {
  private final DataType type;
  private final double fpRate;
  private final Set<Long> hashes = new HashSet<>();

  public DistinctValueBuffer(DataType type, double fpRate) {
    this.type = Objects.requireNonNull(type, "type is null");
    this.fpRate = fpRate;
  }

  public void add(Object value) {
    hashes.add(ValueHasher.hash(value));
  }

  /** @return the number of distinct values added so far */
  public int distinctValues() {
    return hashes.size();
  }

  public BloomFilterSynopsis toSynopsis() {
    return BloomFilterSynopsis.ofHashes(type, hashes, fpRate);
  }
}
