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
import java.util.Collection;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

/**
 * A set of row ids, represented as an ordered bit sequence of a given length whose set bits are
 * the members. Backed by a {@link RoaringBitmap}; ids are unsigned 32-bit integers, so the length
 * is at most {@code 2^32}.
 *
 * <p>Equality is over the decoded bits: two instances are equal iff they have the same length and
 * the same set positions, regardless of how they were built or compressed.
 *
 * <p>Binary operations treat the shorter operand as if it were padded with zeros and return a new
 * instance with the length of the longer operand.
 */
@Evolving
public final class Ids {
  public static final long MAX_SIZE = 1L << 32;

  private final RoaringBitmap bitmap;
  private long size;

  public Ids() {
    this(new RoaringBitmap(), 0);
  }

  private Ids(RoaringBitmap bitmap, long size) {
    this.bitmap = bitmap;
    this.size = size;
  }

  /** @return a sequence of {@code size} bits, all set to {@code bit} */
  public static Ids of(long size, boolean bit) {
    checkSize(size);
    RoaringBitmap bitmap = new RoaringBitmap();
    if (bit && size > 0) {
      bitmap.add(0L, size);
    }
    return new Ids(bitmap, size);
  }

  /**
   * Builds a sequence from ranges: positions covered by any range are {@code !defaultBit}, all
   * others {@code defaultBit}. The length is the maximum of {@code minSize} and the largest range
   * end. Order and overlap of the ranges do not affect the result.
   */
  public static Ids makeIds(Collection<IdRange> ranges, long minSize, boolean defaultBit) {
    checkSize(minSize);
    RoaringBitmap bitmap = new RoaringBitmap();
    long size = minSize;
    for (IdRange range : ranges) {
      if (range.size() > 0) {
        bitmap.add(range.getFirst(), range.getLast());
      }
      size = Math.max(size, range.getLast());
    }
    if (defaultBit && size > 0) {
      bitmap.flip(0L, size);
    }
    return new Ids(bitmap, size);
  }

  public static Ids makeIds(Collection<IdRange> ranges, long minSize) {
    return makeIds(ranges, minSize, false);
  }

  public static Ids makeIds(Collection<IdRange> ranges) {
    return makeIds(ranges, 0, false);
  }

  /** Appends one bit. */
  public void appendBit(boolean bit) {
    appendBits(bit, 1);
  }

  /** Appends {@code count} copies of {@code bit}. */
  public void appendBits(boolean bit, long count) {
    checkArgument(count >= 0, "count must be non-negative: %s", count);
    checkSize(size + count);
    if (bit && count > 0) {
      bitmap.add(size, size + count);
    }
    size += count;
  }

  /** @return the bit at {@code position} */
  public boolean get(long position) {
    checkArgument(0 <= position && position < size, "Position %s out of [0, %s)", position, size);
    return bitmap.contains((int) position);
  }

  /** @return the length of the bit sequence */
  public long size() {
    return size;
  }

  /** @return the number of set bits */
  public long count() {
    return bitmap.getLongCardinality();
  }

  /** @return whether every bit is set; true for the empty sequence */
  public boolean all() {
    return count() == size;
  }

  /** @return whether any bit is set */
  public boolean any() {
    return !bitmap.isEmpty();
  }

  public Ids and(Ids other) {
    return new Ids(RoaringBitmap.and(bitmap, other.bitmap), Math.max(size, other.size));
  }

  public Ids or(Ids other) {
    return new Ids(RoaringBitmap.or(bitmap, other.bitmap), Math.max(size, other.size));
  }

  public Ids xor(Ids other) {
    return new Ids(RoaringBitmap.xor(bitmap, other.bitmap), Math.max(size, other.size));
  }

  public Ids andNot(Ids other) {
    return new Ids(RoaringBitmap.andNot(bitmap, other.bitmap), Math.max(size, other.size));
  }

  /** @return the complement within the current length */
  public Ids not() {
    return new Ids(RoaringBitmap.flip(bitmap, 0L, size), size);
  }

  public Ids copy() {
    return new Ids(bitmap.clone(), size);
  }

  /** @return the set positions in ascending order */
  public PrimitiveIterator.OfLong positions() {
    final IntIterator it = bitmap.getIntIterator();
    return new PrimitiveIterator.OfLong() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public long nextLong() {
        if (!it.hasNext()) {
          throw new NoSuchElementException();
        }
        return Integer.toUnsignedLong(it.next());
      }
    };
  }

  /** Converts dense containers to run-length encoding where that is smaller. */
  public Ids runOptimize() {
    bitmap.runOptimize();
    return this;
  }

  /** @return the serialized size of the compressed representation in bytes */
  public long memoryUsage() {
    return bitmap.getLongSizeInBytes();
  }

  private static void checkSize(long size) {
    checkArgument(0 <= size && size <= MAX_SIZE, "Ids size %s out of [0, 2^32]", size);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Ids)) {
      return false;
    }
    Ids that = (Ids) o;
    return size == that.size && RoaringBitmap.xorCardinality(bitmap, that.bitmap) == 0;
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(size);
    result = 31 * result + Long.hashCode(count());
    result = 31 * result + (bitmap.isEmpty() ? -1 : bitmap.first());
    return result;
  }

  @Override
  public String toString() {
    if (size <= 64) {
      StringBuilder sb = new StringBuilder(Math.max(2, (int) size));
      for (long i = 0; i < size; i++) {
        sb.append(bitmap.contains((int) i) ? '1' : '0');
      }
      return "Ids(" + sb + ")";
    }
    return String.format("Ids{size=%s, count=%s}", size, count());
  }
}
