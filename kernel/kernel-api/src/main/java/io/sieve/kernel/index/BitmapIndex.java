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

package io.sieve.kernel.index;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.expressions.RelationalOperator;
import io.sieve.kernel.ids.Ids;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.types.DataType;
import io.sieve.kernel.types.StringType;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * An exact index of one field of a partition: maps every distinct value to the {@link Ids} of the
 * rows holding it, and keeps a mask of the rows where the field is null.
 *
 * <p>The index is append-only. Every {@link Ids} returned by a lookup has a length equal to the
 * number of rows appended so far.
 */
@Evolving
public final class BitmapIndex {
  private final DataType type;
  // Bitmaps are only extended up to their last set bit while appending; lookups pad them.
  private final TreeMap<Object, Ids> values = new TreeMap<>();
  private final Ids nulls = new Ids();
  private long size;

  public BitmapIndex(DataType type) {
    this.type = Objects.requireNonNull(type, "type is null");
  }

  public DataType getType() {
    return type;
  }

  /** @return the number of rows appended */
  public long size() {
    return size;
  }

  /** @return the number of distinct non-null values */
  public int cardinality() {
    return values.size();
  }

  /** Appends one row holding {@code value}, which is {@code null} for a null field. */
  public void pushBack(Object value) {
    if (size >= Ids.MAX_SIZE) {
      throw new IllegalStateException("Bitmap index is full");
    }
    Ids ids;
    if (value == null) {
      ids = nulls;
    } else {
      ids = values.computeIfAbsent(ValueUtils.normalize(value), v -> new Ids());
    }
    ids.appendBits(false, size - ids.size());
    ids.appendBit(true);
    size++;
  }

  /**
   * @return whether {@link #lookup} computes the exact answer for the comparison, rather than
   *     all rows as an over-approximation
   */
  public boolean isExact(RelationalOperator op, Literal literal) {
    switch (op) {
      case IN:
        for (Literal element : literal.getElements()) {
          if (!isExact(RelationalOperator.EQUAL, element)) {
            return false;
          }
        }
        return true;
      case MATCH:
        return type instanceof StringType && literal.getDataType() instanceof StringType;
      default:
        return ValueUtils.coerce(literal, type).isPresent();
    }
  }

  /** @return the rows whose value satisfies {@code value op literal}; null rows never do */
  public Ids lookup(RelationalOperator op, Literal literal) {
    switch (op) {
      case IN:
        return lookupIn(literal);
      case MATCH:
        return lookupMatch(literal);
      default:
        break;
    }
    Optional<Object> coerced = ValueUtils.coerce(literal, type);
    if (!coerced.isPresent()) {
      return Ids.of(size, true);
    }
    Object key = coerced.get();
    switch (op) {
      case EQUAL:
        return padded(values.get(key));
      case NOT_EQUAL:
        return padded(values.get(key)).not().andNot(padded(nulls));
      case LESS:
        return union(values.headMap(key, false).entrySet());
      case LESS_EQUAL:
        return union(values.headMap(key, true).entrySet());
      case GREATER:
        return union(values.tailMap(key, false).entrySet());
      case GREATER_EQUAL:
        return union(values.tailMap(key, true).entrySet());
      default:
        return Ids.of(size, true);
    }
  }

  private Ids lookupIn(Literal literal) {
    Ids result = Ids.of(size, false);
    for (Literal element : literal.getElements()) {
      result = result.or(lookup(RelationalOperator.EQUAL, element));
    }
    return result;
  }

  private Ids lookupMatch(Literal literal) {
    if (!isExact(RelationalOperator.MATCH, literal)) {
      return Ids.of(size, true);
    }
    Pattern pattern;
    try {
      pattern = Pattern.compile((String) literal.getValue());
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid pattern " + literal, e);
    }
    Ids result = Ids.of(size, false);
    for (Map.Entry<Object, Ids> entry : values.entrySet()) {
      if (pattern.matcher((String) entry.getKey()).matches()) {
        result = result.or(entry.getValue());
      }
    }
    return padded(result);
  }

  private Ids union(Collection<Map.Entry<Object, Ids>> entries) {
    Ids result = Ids.of(size, false);
    for (Map.Entry<Object, Ids> entry : entries) {
      // NaN sorts above every number but fails every ordering comparison.
      if (!ValueUtils.isNaN(entry.getKey())) {
        result = result.or(entry.getValue());
      }
    }
    return padded(result);
  }

  private Ids padded(Ids ids) {
    if (ids == null) {
      return Ids.of(size, false);
    }
    Ids copy = ids.copy();
    copy.appendBits(false, size - copy.size());
    return copy;
  }

  /** @return an estimate of the bytes held by the bitmaps of this index */
  public long memoryUsage() {
    long bytes = nulls.memoryUsage();
    for (Ids ids : values.values()) {
      bytes += ids.memoryUsage() + 16;
    }
    return bytes;
  }

  @Override
  public String toString() {
    return String.format(
        "BitmapIndex{type=%s, rows=%s, distinct=%s}", type, size, values.size());
  }
}
