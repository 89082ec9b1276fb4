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

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.expressions.RelationalOperator;
import io.sieve.kernel.internal.hash.BlockedBloomFilter;
import io.sieve.kernel.internal.hash.ValueHasher;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.types.DataType;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link Synopsis} backed by a {@link BlockedBloomFilter}, sized for {@code n} distinct values at
 * a false-positive probability of {@code p}. Answers {@code ==} only.
 */
@Evolving
public final class BloomFilterSynopsis extends Synopsis {
  private static final double LN2 = Math.log(2);

  private final long n;
  private final double p;
  private final BlockedBloomFilter filter;

  BloomFilterSynopsis(DataType type, long n, double p, BlockedBloomFilter filter) {
    super(type);
    this.n = n;
    this.p = p;
    this.filter = filter;
  }

  /** Creates an empty synopsis for {@code n} distinct values of {@code type}. */
  public static BloomFilterSynopsis create(DataType type, long n, double p) {
    checkArgument(n > 0, "Number of distinct values must be positive: %s", n);
    checkArgument(p > 0 && p < 1, "False-positive probability must be in (0, 1): %s", p);
    long m = optimalNumBits(n, p);
    return new BloomFilterSynopsis(
        type, n, p, new BlockedBloomFilter(m, optimalNumHashFunctions(n, m)));
  }

  /** Creates a synopsis sized for exactly the given {@link ValueHasher} hashes and adds them. */
  public static BloomFilterSynopsis ofHashes(DataType type, Collection<Long> hashes, double p) {
    BloomFilterSynopsis synopsis = create(type, Math.max(1, hashes.size()), p);
    for (long hash : hashes) {
      synopsis.filter.add(hash);
    }
    return synopsis;
  }

  /** Wraps a restored filter, e.g. when decoding a serialized sketch. */
  public static BloomFilterSynopsis restore(
      DataType type, long n, double p, BlockedBloomFilter filter) {
    return new BloomFilterSynopsis(type, n, p, Objects.requireNonNull(filter, "filter is null"));
  }

  /** @return {@code ceil(-n ln(p) / ln(2)^2)} */
  public static long optimalNumBits(long n, double p) {
    return (long) Math.ceil(-n * Math.log(p) / (LN2 * LN2));
  }

  /** @return {@code max(1, round(m / n * ln(2)))} */
  public static int optimalNumHashFunctions(long n, long m) {
    return Math.max(1, (int) Math.round((double) m / n * LN2));
  }

  public long getN() {
    return n;
  }

  public double getP() {
    return p;
  }

  /** @return the underlying filter; callers must not add to it. */
  public BlockedBloomFilter getFilter() {
    return filter;
  }

  @Override
  public SynopsisKind getKind() {
    return SynopsisKind.BLOOM_FILTER;
  }

  @Override
  public void add(Object value) {
    filter.add(ValueHasher.hash(value));
  }

  @Override
  boolean lookupScalar(RelationalOperator op, Literal literal) {
    if (op != RelationalOperator.EQUAL) {
      return true;
    }
    Optional<Object> value = ValueUtils.coerce(literal, getType());
    return !value.isPresent() || filter.lookup(ValueHasher.hash(value.get()));
  }

  @Override
  public Synopsis copy() {
    return new BloomFilterSynopsis(getType(), n, p, filter.copy());
  }

  @Override
  public long memoryUsage() {
    return filter.bitSize() / Byte.SIZE + 32;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BloomFilterSynopsis)) {
      return false;
    }
    BloomFilterSynopsis that = (BloomFilterSynopsis) o;
    return n == that.n
        && Double.compare(p, that.p) == 0
        && getType().equals(that.getType())
        && filter.equals(that.filter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getType(), n, p, filter);
  }

  @Override
  public String toString() {
    return String.format("bloomfilter(%s,%s)[%s]", n, p, getType());
  }
}
