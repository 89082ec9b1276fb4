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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class TestBlockedBloomFilter {

  @Test
  public void sizeIsRoundedUpToWholeBlocks() {
    BlockedBloomFilter filter = new BlockedBloomFilter(513, 3);

    assertThat(filter.bitSize()).isEqualTo(1024);
    assertThat(filter.numBlocks()).isEqualTo(2);
    assertThat(filter.toWords()).hasSize(2 * BlockedBloomFilter.WORDS_PER_BLOCK);
    assertThat(new BlockedBloomFilter(1, 1).bitSize()).isEqualTo(512);
  }

  @Test
  public void noFalseNegatives() {
    BlockedBloomFilter filter = new BlockedBloomFilter(10_000, 7);
    for (long i = 0; i < 1000; i++) {
      filter.add(ValueHasher.hash(i));
    }
    for (long i = 0; i < 1000; i++) {
      assertThat(filter.lookup(ValueHasher.hash(i))).isTrue();
    }
  }

  @Test
  public void emptyFilterContainsNothing() {
    BlockedBloomFilter filter = new BlockedBloomFilter(4096, 4);
    assertThat(filter.lookup(ValueHasher.hash("anything"))).isFalse();
    assertThat(filter.lookup(0L)).isFalse();
  }

  @Test
  public void mergeIsUnion() {
    BlockedBloomFilter left = new BlockedBloomFilter(2048, 5);
    BlockedBloomFilter right = new BlockedBloomFilter(2048, 5);
    left.add(ValueHasher.hash("a"));
    right.add(ValueHasher.hash("b"));

    left.merge(right);

    assertThat(left.lookup(ValueHasher.hash("a"))).isTrue();
    assertThat(left.lookup(ValueHasher.hash("b"))).isTrue();
    assertThatThrownBy(() -> left.merge(new BlockedBloomFilter(4096, 5)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void restoredFromWordsIsEqual() {
    BlockedBloomFilter filter = new BlockedBloomFilter(4096, 6);
    for (int i = 0; i < 100; i++) {
      filter.add(ValueHasher.hash("host-" + i));
    }

    BlockedBloomFilter restored = BlockedBloomFilter.fromWords(filter.toWords(), 6);

    assertThat(restored).isEqualTo(filter);
    assertThat(restored.hashCode()).isEqualTo(filter.hashCode());
    assertThat(BlockedBloomFilter.fromWords(filter.toWords(), 5)).isNotEqualTo(filter);
  }

  @Test
  public void copyIsIndependent() {
    BlockedBloomFilter filter = new BlockedBloomFilter(1024, 3);
    BlockedBloomFilter copy = filter.copy();
    copy.add(ValueHasher.hash(42L));

    assertThat(filter.lookup(ValueHasher.hash(42L))).isFalse();
    assertThat(copy.lookup(ValueHasher.hash(42L))).isTrue();
  }

  @Test
  public void invalidShapes() {
    assertThatThrownBy(() -> new BlockedBloomFilter(0, 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BlockedBloomFilter(512, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BlockedBloomFilter.fromWords(new long[7], 3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void canonicalHashes() {
    assertThat(ValueHasher.hash(-0.0d)).isEqualTo(ValueHasher.hash(0.0d));
    assertThat(ValueHasher.hash("dns")).isEqualTo(ValueHasher.hash("dns"));
    assertThat(ValueHasher.hash(1L)).isNotEqualTo(ValueHasher.hash(2L));
    assertThat(ValueHasher.hash(true)).isNotEqualTo(ValueHasher.hash(false));
    assertThatThrownBy(() -> ValueHasher.hash(new Object()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
