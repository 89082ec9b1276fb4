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

package io.sieve.kernel.expressions;

import static io.sieve.kernel.internal.util.Preconditions.checkArgument;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.types.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * A typed literal value, the right-hand side of a {@link Predicate}.
 *
 * <p>Values are represented as follows:
 *
 * <ul>
 *   <li>{@link BooleanType}: {@link Boolean}
 *   <li>{@link LongType}: {@link Long}
 *   <li>{@link DoubleType}: {@link Double}
 *   <li>{@link StringType}: {@link String}
 *   <li>{@link TimestampType}: {@link Long} microseconds since epoch in UTC
 * </ul>
 *
 * A list literal (the operand of {@code in}) has no data type and holds its elements instead.
 */
@Evolving
public final class Literal {
  public static Literal ofBoolean(boolean value) {
    return new Literal(value, BooleanType.BOOLEAN, null);
  }

  public static Literal ofLong(long value) {
    return new Literal(value, LongType.LONG, null);
  }

  public static Literal ofDouble(double value) {
    return new Literal(value, DoubleType.DOUBLE, null);
  }

  public static Literal ofString(String value) {
    return new Literal(Objects.requireNonNull(value, "value is null"), StringType.STRING, null);
  }

  /**
   * Create a {@code timestamp} type literal expression.
   *
   * @param microsSinceEpochUTC microseconds since epoch time in UTC timezone.
   */
  public static Literal ofTimestamp(long microsSinceEpochUTC) {
    return new Literal(microsSinceEpochUTC, TimestampType.TIMESTAMP, null);
  }

  public static Literal ofTimestamp(Instant instant) {
    return ofTimestamp(ChronoUnit.MICROS.between(Instant.EPOCH, instant));
  }

  /** Create a list literal, the operand of {@link RelationalOperator#IN}. */
  public static Literal ofList(List<Literal> elements) {
    for (Literal element : elements) {
      checkArgument(!element.isList(), "List literals cannot be nested: %s", elements);
    }
    return new Literal(null, null, Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  public static Literal ofList(Literal... elements) {
    return ofList(Arrays.asList(elements));
  }

  private final Object value;
  private final DataType dataType;
  private final List<Literal> elements;

  private Literal(Object value, DataType dataType, List<Literal> elements) {
    this.value = value;
    this.dataType = dataType;
    this.elements = elements;
  }

  /** @return the literal value, {@code null} for a list literal. */
  public Object getValue() {
    return value;
  }

  /** @return the data type of the literal, {@code null} for a list literal. */
  public DataType getDataType() {
    return dataType;
  }

  public boolean isList() {
    return elements != null;
  }

  /** @return the elements of a list literal; empty for scalar literals. */
  public List<Literal> getElements() {
    return elements == null ? Collections.<Literal>emptyList() : elements;
  }

  @Override
  public String toString() {
    if (isList()) {
      return elements.stream().map(Literal::toString).collect(Collectors.joining(", ", "[", "]"));
    }
    if (dataType instanceof StringType) {
      return "\"" + value + "\"";
    }
    if (dataType instanceof TimestampType) {
      return Instant.EPOCH.plus((Long) value, ChronoUnit.MICROS).toString();
    }
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Literal)) {
      return false;
    }
    Literal that = (Literal) o;
    return Objects.equals(value, that.value)
        && Objects.equals(dataType, that.dataType)
        && Objects.equals(elements, that.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, dataType, elements);
  }
}
