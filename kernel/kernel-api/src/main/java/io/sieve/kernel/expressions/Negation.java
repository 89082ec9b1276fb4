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

import io.sieve.kernel.annotation.Evolving;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Logical {@code NOT} of a single operand. */
@Evolving
public final class Negation implements Expression {
  private final Expression operand;

  public Negation(Expression operand) {
    this.operand = Objects.requireNonNull(operand, "operand is null");
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.singletonList(operand);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visitNegation(this);
  }

  @Override
  public String toString() {
    return "!" + operand;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Negation && operand.equals(((Negation) o).operand));
  }

  @Override
  public int hashCode() {
    return Objects.hash("NOT", operand);
  }
}
