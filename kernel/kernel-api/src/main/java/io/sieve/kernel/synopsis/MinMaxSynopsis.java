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

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.expressions.RelationalOperator;
import io.sieve.kernel.internal.util.ValueUtils;
import io.sieve.kernel.types.*;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks the smallest and largest value of an ordered domain. The empty synopsis holds the
 * sentinel range {@code [domain max, domain min]}, for which every lookup answers {@code false}.
 *
 * <p>The time synopsis is a {@code MinMaxSynopsis<Long>} over timestamps, see {@link
 * #forTimestamps()}.
 *
 * @param <T> the value domain
 */
@Evolving
public final class MinMaxSynopsis<T extends Comparable<T>> extends Synopsis {
  private final Class<T> valueClass;
  private final T domainMin;
  private final T domainMax;
  private T min;
  private T max;

  MinMaxSynopsis(DataType type, Class<T> valueClass, T domainMin, T domainMax, T min, T max) {
    super(type);
    this.valueClass = valueClass;
    this.domainMin = domainMin;
    this.domainMax = domainMax;
    this.min = min;
    this.max = max;
  }

  private MinMaxSynopsis(DataType type, Class<T> valueClass, T domainMin, T domainMax) {
    this(type, valueClass, domainMin, domainMax, domainMax, domainMin);
  }

  public static MinMaxSynopsis<Long> forLongs() {
    return new MinMaxSynopsis<>(LongType.LONG, Long.class, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  public static MinMaxSynopsis<Double> forDoubles() {
    return new MinMaxSynopsis<>(
        DoubleType.DOUBLE, Double.class, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
  }

  /** Creates an empty time synopsis over microseconds since epoch. */
  public static MinMaxSynopsis<Long> forTimestamps() {
    return new MinMaxSynopsis<>(
        TimestampType.TIMESTAMP, Long.class, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  /** Creates a time synopsis covering {@code [minMicros, maxMicros]}. */
  public static MinMaxSynopsis<Long> forTimeRange(long minMicros, long maxMicros) {
    MinMaxSynopsis<Long> synopsis = forTimestamps();
    synopsis.add(minMicros);
    synopsis.add(maxMicros);
    return synopsis;
  }

  public static MinMaxSynopsis<Boolean> forBooleans() {
    return new MinMaxSynopsis<>(BooleanType.BOOLEAN, Boolean.class, false, true);
  }

  /**
   * @return an empty synopsis for {@code type}
   * @throws IllegalArgumentException if the type has no total order suitable for summarizing
   */
  public static MinMaxSynopsis<?> forType(DataType type) {
    if (type instanceof LongType) {
      return forLongs();
    } else if (type instanceof DoubleType) {
      return forDoubles();
    } else if (type instanceof TimestampType) {
      return forTimestamps();
    } else if (type instanceof BooleanType) {
      return forBooleans();
    }
    throw new IllegalArgumentException("Cannot summarize values of type " + type + " by range");
  }

  /** Restores a synopsis of {@code type} with the given bounds, e.g. from a serialized sketch. */
  public static MinMaxSynopsis<?> restore(DataType type, Object min, Object max) {
    MinMaxSynopsis<?> synopsis = forType(type);
    synopsis.restoreBounds(min, max);
    return synopsis;
  }

  private void restoreBounds(Object newMin, Object newMax) {
    this.min = valueClass.cast(newMin);
    this.max = valueClass.cast(newMax);
  }

  public T getMin() {
    return min;
  }

  public T getMax() {
    return max;
  }

  /** @return whether no value has been added */
  public boolean isEmpty() {
    return min.compareTo(max) > 0;
  }

  @Override
  public SynopsisKind getKind() {
    return SynopsisKind.MIN_MAX;
  }

  @Override
  public void add(Object value) {
    if (ValueUtils.isNaN(value)) {
      return;
    }
    T v = valueClass.cast(ValueUtils.normalize(value));
    if (v.compareTo(min) < 0) {
      min = v;
    }
    if (v.compareTo(max) > 0) {
      max = v;
    }
  }

  @Override
  boolean lookupScalar(RelationalOperator op, Literal literal) {
    Optional<Object> coerced = ValueUtils.coerce(literal, getType());
    if (!coerced.isPresent()) {
      return true;
    }
    T value = valueClass.cast(coerced.get());
    switch (op) {
      case EQUAL:
        return min.compareTo(value) <= 0 && value.compareTo(max) <= 0;
      case LESS:
        return min.compareTo(value) < 0;
      case LESS_EQUAL:
        return min.compareTo(value) <= 0;
      case GREATER:
        return max.compareTo(value) > 0;
      case GREATER_EQUAL:
        return max.compareTo(value) >= 0;
      default:
        return true;
    }
  }

  @Override
  public MinMaxSynopsis<T> copy() {
    return new MinMaxSynopsis<>(getType(), valueClass, domainMin, domainMax, min, max);
  }

  @Override
  public long memoryUsage() {
    return 48;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MinMaxSynopsis)) {
      return false;
    }
    MinMaxSynopsis<?> that = (MinMaxSynopsis<?>) o;
    return getType().equals(that.getType()) && min.equals(that.min) && max.equals(that.max);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getType(), min, max);
  }

  @Override
  public String toString() {
    return String.format("minmax[%s, %s](%s)", min, max, getType());
  }
}
