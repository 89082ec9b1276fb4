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

package io.sieve.kernel.internal.util;

import io.sieve.kernel.data.Row;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.expressions.RelationalOperator;
import io.sieve.kernel.types.*;
import java.util.Optional;
import java.util.regex.Pattern;

/** Conversions between literals, row values and the value domains of the data types. */
public final class ValueUtils {
  private ValueUtils() {}

  /**
   * Coerces a scalar literal into the value domain of {@code targetType}.
   *
   * <p>A long literal is coerced into a double; a double literal with an integral value is coerced
   * into a long. All other types only coerce into themselves. NaN never coerces.
   *
   * @return the coerced value, or empty if the literal has no representation in the target domain.
   */
  public static Optional<Object> coerce(Literal literal, DataType targetType) {
    if (literal.isList()) {
      return Optional.empty();
    }
    DataType sourceType = literal.getDataType();
    Object value = literal.getValue();
    if (targetType instanceof DoubleType) {
      if (sourceType instanceof DoubleType) {
        double d = (Double) value;
        return Double.isNaN(d) ? Optional.empty() : Optional.of(normalize(d));
      }
      if (sourceType instanceof LongType) {
        return Optional.of((double) (Long) value);
      }
      return Optional.empty();
    }
    if (targetType instanceof LongType) {
      if (sourceType instanceof LongType) {
        return Optional.of(value);
      }
      if (sourceType instanceof DoubleType) {
        double d = (Double) value;
        if (d == Math.rint(d) && d >= Long.MIN_VALUE && d < 0x1p63) {
          return Optional.of((long) d);
        }
      }
      return Optional.empty();
    }
    return sourceType.equals(targetType) ? Optional.of(value) : Optional.empty();
  }

  /**
   * Canonical form of a value: {@code -0.0} becomes {@code 0.0}, all NaNs become {@link
   * Double#NaN}.
   */
  public static Object normalize(Object value) {
    if (value instanceof Double) {
      return normalize(((Double) value).doubleValue());
    }
    return value;
  }

  private static Double normalize(double value) {
    if (value == 0.0d) {
      return 0.0d;
    }
    return Double.isNaN(value) ? Double.NaN : value;
  }

  /** @return whether {@code value} is a double NaN, which compares false with everything. */
  public static boolean isNaN(Object value) {
    return value instanceof Double && ((Double) value).isNaN();
  }

  /** @return the value at {@code ordinal} of the row as a boxed object, {@code null} if null. */
  public static Object getValue(Row row, int ordinal) {
    if (row.isNullAt(ordinal)) {
      return null;
    }
    DataType dataType = row.getSchema().at(ordinal).getDataType();
    if (dataType instanceof BooleanType) {
      return row.getBoolean(ordinal);
    } else if (dataType instanceof LongType || dataType instanceof TimestampType) {
      return row.getLong(ordinal);
    } else if (dataType instanceof DoubleType) {
      return normalize(row.getDouble(ordinal));
    } else if (dataType instanceof StringType) {
      return row.getString(ordinal);
    }
    throw new UnsupportedOperationException("Unsupported data type: " + dataType);
  }

  /**
   * Evaluates {@code value op literal} exactly.
   *
   * @return the outcome, or empty if the literal cannot be compared with values of {@code type}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static Optional<Boolean> evaluate(
      Object value, DataType type, RelationalOperator op, Literal literal) {
    if (op == RelationalOperator.IN) {
      boolean conclusive = true;
      for (Literal element : literal.getElements()) {
        Optional<Boolean> result = evaluate(value, type, RelationalOperator.EQUAL, element);
        if (result.isPresent() && result.get()) {
          return result;
        }
        conclusive &= result.isPresent();
      }
      return conclusive ? Optional.of(false) : Optional.empty();
    }
    if (op == RelationalOperator.MATCH) {
      if (!(value instanceof String) || !(literal.getDataType() instanceof StringType)) {
        return Optional.empty();
      }
      Pattern pattern = Pattern.compile((String) literal.getValue());
      return Optional.of(pattern.matcher((String) value).matches());
    }
    Optional<Object> coerced = coerce(literal, type);
    if (!coerced.isPresent()) {
      return Optional.empty();
    }
    if (isNaN(value)) {
      return Optional.of(op == RelationalOperator.NOT_EQUAL);
    }
    int cmp = ((Comparable) normalize(value)).compareTo(coerced.get());
    switch (op) {
      case EQUAL:
        return Optional.of(cmp == 0);
      case NOT_EQUAL:
        return Optional.of(cmp != 0);
      case LESS:
        return Optional.of(cmp < 0);
      case LESS_EQUAL:
        return Optional.of(cmp <= 0);
      case GREATER:
        return Optional.of(cmp > 0);
      case GREATER_EQUAL:
        return Optional.of(cmp >= 0);
      default:
        return Optional.empty();
    }
  }
}
