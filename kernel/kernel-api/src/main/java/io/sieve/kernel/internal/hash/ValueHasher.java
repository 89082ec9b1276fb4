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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.sieve.kernel.internal.util.ValueUtils;
import java.nio.charset.StandardCharsets;

/**
 * Computes the default 64-bit hash of a value. Equal values of the same domain always hash equal;
 * {@code -0.0} and {@code 0.0} are the same value.
 */
public final class ValueHasher {
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  private ValueHasher() {}

  public static long hash(Object value) {
    Hasher hasher = HASH_FUNCTION.newHasher();
    Object canonical = ValueUtils.normalize(value);
    if (canonical instanceof Long) {
      hasher.putLong((Long) canonical);
    } else if (canonical instanceof Double) {
      hasher.putDouble((Double) canonical);
    } else if (canonical instanceof String) {
      hasher.putString((String) canonical, StandardCharsets.UTF_8);
    } else if (canonical instanceof Boolean) {
      hasher.putBoolean((Boolean) canonical);
    } else {
      throw new IllegalArgumentException(
          "Cannot hash value of " + (value == null ? "null" : value.getClass()));
    }
    return hasher.hash().asLong();
  }
}
