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
import java.util.*;
import java.util.stream.Collectors;

/** Logical {@code OR} of one or more operands. */
@Evolving
public final class Disjunction implements Expression {
  private final List<Expression> operands;

  public Disjunction(List<? extends Expression> operands) {
    checkArgument(!operands.isEmpty(), "A disjunction requires at least one operand");
    this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
  }

  public Disjunction(Expression... operands) {
    this(Arrays.asList(operands));
  }

  @Override
  public List<Expression> getChildren() {
    return operands;
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visitDisjunction(this);
  }

  @Override
  public String toString() {
    return operands.stream().map(Object::toString).collect(Collectors.joining(" || ", "(", ")"));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Disjunction && operands.equals(((Disjunction) o).operands));
  }

  @Override
  public int hashCode() {
    return Objects.hash("OR", operands);
  }
}
