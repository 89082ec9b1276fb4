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

package io.sieve.kernel.internal.hash;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import java.util.Arrays;

/**
 * A Bloom filter whose bits are split into 512-bit blocks. All {@code k} bits of a value live in
 * the same block, so every {@link #add} and {@link #lookup} touches a single cache line.
 *
 * <p>The upper half of the hash selects the block. The in-block bit positions are derived by
 * double hashing from a remixed hash.
 *
 * <p>Not thread safe while being built; safe to share once no more values are added.
 */
public final class BlockedBloomFilter {
  public static final int BLOCK_BITS = 512;
  public static final int WORDS_PER_BLOCK = BLOCK_BITS / Long.SIZE;

  private final long[] words;
  private final int numBlocks;
  private final int numHashFunctions;

  /**
   * @param bitSize requested number of bits, rounded up to whole blocks
   * @param numHashFunctions the number of bits set per value
   */
  public BlockedBloomFilter(long bitSize, int numHashFunctions) {
    this(new long[numBlocks(bitSize) * WORDS_PER_BLOCK], numHashFunctions);
  }

  private BlockedBloomFilter(long[] words, int numHashFunctions) {
    checkArgument(numHashFunctions > 0, "numHashFunctions must be positive: %s", numHashFunctions);
    checkArgument(
        words.length > 0 && words.length % WORDS_PER_BLOCK == 0,
        "Expected a positive multiple of %s words, got %s",
        WORDS_PER_BLOCK,
        words.length);
    this.words = words;
    this.numBlocks = words.length / WORDS_PER_BLOCK;
    this.numHashFunctions = numHashFunctions;
  }

  /** Restores a filter from the words returned by {@link #toWords()}. */
  public static BlockedBloomFilter fromWords(long[] words, int numHashFunctions) {
    return new BlockedBloomFilter(words.clone(), numHashFunctions);
  }

  public void add(long hash) {
    int offset = blockOffset(hash);
    long g = remix(hash);
    int a = (int) g;
    int b = (int) (g >>> 32) | 1;
    for (int i = 0; i < numHashFunctions; i++) {
      int pos = (a + i * b) & (BLOCK_BITS - 1);
      words[offset + (pos >>> 6)] |= 1L << pos;
    }
  }

  /** @return false if the value was never added, true if it probably was. */
  public boolean lookup(long hash) {
    int offset = blockOffset(hash);
    long g = remix(hash);
    int a = (int) g;
    int b = (int) (g >>> 32) | 1;
    for (int i = 0; i < numHashFunctions; i++) {
      int pos = (a + i * b) & (BLOCK_BITS - 1);
      if ((words[offset + (pos >>> 6)] & (1L << pos)) == 0) {
        return false;
      }
    }
    return true;
  }

  /** Adds all values of {@code other}, which must have the same shape, to this filter. */
  public void merge(BlockedBloomFilter other) {
    checkArgument(
        other.words.length == words.length && other.numHashFunctions == numHashFunctions,
        "Cannot merge Bloom filters of different shapes");
    for (int i = 0; i < words.length; i++) {
      words[i] |= other.words[i];
    }
  }

  public long bitSize() {
    return (long) words.length * Long.SIZE;
  }

  public int numBlocks() {
    return numBlocks;
  }

  public int numHashFunctions() {
    return numHashFunctions;
  }

  public long[] toWords() {
    return words.clone();
  }

  public BlockedBloomFilter copy() {
    return new BlockedBloomFilter(words.clone(), numHashFunctions);
  }

  private int blockOffset(long hash) {
    // Multiply-shift maps the upper 32 bits uniformly onto [0, numBlocks).
    return (int) (((hash >>> 32) * numBlocks) >>> 32) * WORDS_PER_BLOCK;
  }

  private static long remix(long h) {
    h ^= h >>> 33;
    h *= 0xff51afd7ed558ccdL;
    h ^= h >>> 33;
    h *= 0xc4ceb9fe1a85ec53L;
    h ^= h >>> 33;
    return h;
  }

  private static int numBlocks(long bitSize) {
    checkArgument(bitSize > 0, "bitSize must be positive: %s", bitSize);
    long blocks = (bitSize + BLOCK_BITS - 1) / BLOCK_BITS;
    checkArgument(blocks <= Integer.MAX_VALUE / WORDS_PER_BLOCK, "bitSize too large: %s", bitSize);
    return (int) blocks;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BlockedBloomFilter)) {
      return false;
    }
    BlockedBloomFilter that = (BlockedBloomFilter) o;
    return numHashFunctions == that.numHashFunctions && Arrays.equals(words, that.words);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(words) + numHashFunctions;
  }

  @Override
  public String toString() {
    return String.format("BlockedBloomFilter{bits=%s, k=%s}", bitSize(), numHashFunctions);
  }
}
