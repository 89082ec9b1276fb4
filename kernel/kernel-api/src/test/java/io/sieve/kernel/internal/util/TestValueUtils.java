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

import static io.sieve.kernel.expressions.RelationalOperator.*;
import static org.assertj.core.api.Assertions.assertThat;

import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.expressions.RelationalOperator;
import io.sieve.kernel.types.*;
import org.junit.Test;

public class TestValueUtils {

  @Test
  public void coerceNumbers() {
    assertThat(ValueUtils.coerce(Literal.ofLong(3), DoubleType.DOUBLE)).contains(3.0d);
    assertThat(ValueUtils.coerce(Literal.ofDouble(3.0), LongType.LONG)).contains(3L);
    assertThat(ValueUtils.coerce(Literal.ofDouble(3.5), LongType.LONG)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofDouble(1e300), LongType.LONG)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofDouble(-0.0), DoubleType.DOUBLE)).contains(0.0d);
    assertThat(ValueUtils.coerce(Literal.ofDouble(Double.NaN), DoubleType.DOUBLE)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofDouble(Double.NaN), LongType.LONG)).isEmpty();
  }

  @Test
  public void coerceOtherTypesOnlyIntoThemselves() {
    assertThat(ValueUtils.coerce(Literal.ofString("x"), StringType.STRING)).contains("x");
    assertThat(ValueUtils.coerce(Literal.ofString("1"), LongType.LONG)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofLong(1), TimestampType.TIMESTAMP)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofTimestamp(5L), TimestampType.TIMESTAMP)).contains(5L);
    assertThat(ValueUtils.coerce(Literal.ofBoolean(true), LongType.LONG)).isEmpty();
    assertThat(ValueUtils.coerce(Literal.ofList(Literal.ofLong(1)), LongType.LONG)).isEmpty();
  }

  @Test
  public void normalize() {
    assertThat(ValueUtils.normalize(-0.0d)).isEqualTo(0.0d);
    assertThat(Double.doubleToRawLongBits((Double) ValueUtils.normalize(-0.0d))).isEqualTo(0L);
    assertThat(
            Double.doubleToRawLongBits(
                (Double) ValueUtils.normalize(Double.longBitsToDouble(0x7ff8000000000001L))))
        .isEqualTo(Double.doubleToRawLongBits(Double.NaN));
    assertThat(ValueUtils.normalize("a")).isEqualTo("a");
  }

  @Test
  public void evaluateComparisons() {
    assertThat(ValueUtils.evaluate(5L, LongType.LONG, LESS, Literal.ofLong(6))).contains(true);
    assertThat(ValueUtils.evaluate(5L, LongType.LONG, GREATER_EQUAL, Literal.ofDouble(5.0)))
        .contains(true);
    assertThat(ValueUtils.evaluate(5L, LongType.LONG, EQUAL, Literal.ofDouble(5.5))).isEmpty();
    assertThat(ValueUtils.evaluate(2.5, DoubleType.DOUBLE, GREATER, Literal.ofLong(2)))
        .contains(true);
    assertThat(ValueUtils.evaluate("b", StringType.STRING, LESS_EQUAL, Literal.ofString("a")))
        .contains(false);
    assertThat(ValueUtils.evaluate(-0.0, DoubleType.DOUBLE, EQUAL, Literal.ofDouble(0.0)))
        .contains(true);
  }

  @Test
  public void nanIsOnlyUnequal() {
    for (RelationalOperator op : new RelationalOperator[] {EQUAL, LESS, LESS_EQUAL, GREATER}) {
      assertThat(ValueUtils.evaluate(Double.NaN, DoubleType.DOUBLE, op, Literal.ofDouble(1.0)))
          .contains(false);
    }
    assertThat(
            ValueUtils.evaluate(Double.NaN, DoubleType.DOUBLE, NOT_EQUAL, Literal.ofDouble(1.0)))
        .contains(true);
  }

  @Test
  public void evaluateMembershipAndMatch() {
    Literal list = Literal.ofList(Literal.ofLong(1), Literal.ofLong(53));
    assertThat(ValueUtils.evaluate(53L, LongType.LONG, IN, list)).contains(true);
    assertThat(ValueUtils.evaluate(80L, LongType.LONG, IN, list)).contains(false);
    assertThat(
            ValueUtils.evaluate(
                80L, LongType.LONG, IN, Literal.ofList(Literal.ofLong(1), Literal.ofString("x"))))
        .isEmpty();

    Literal prefix = Literal.ofString("zeek\\..*");
    assertThat(ValueUtils.evaluate("zeek.conn", StringType.STRING, MATCH, prefix)).contains(true);
    Literal partial = Literal.ofString("conn");
    assertThat(ValueUtils.evaluate("zeek.conn", StringType.STRING, MATCH, partial))
        .contains(false);
    assertThat(ValueUtils.evaluate(1L, LongType.LONG, MATCH, Literal.ofString("1"))).isEmpty();
  }
}
