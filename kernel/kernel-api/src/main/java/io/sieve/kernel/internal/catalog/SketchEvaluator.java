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

package io.sieve.kernel.internal.catalog;

import io.sieve.kernel.expressions.*;
import io.sieve.kernel.sketch.PartitionSketch;

/**
 * Decides whether a partition may hold events matching an expression, given its sketch. Answers
 * {@code false} only if no event can match.
 */
public class SketchEvaluator implements ExpressionVisitor<Boolean> {
  private final PartitionSketch sketch;

  public SketchEvaluator(PartitionSketch sketch) {
    this.sketch = sketch;
  }

  @Override
  public Boolean visitConjunction(Conjunction conjunction) {
    for (Expression operand : conjunction.getChildren()) {
      if (!operand.accept(this)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Boolean visitDisjunction(Disjunction disjunction) {
    for (Expression operand : disjunction.getChildren()) {
      if (operand.accept(this)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Boolean visitNegation(Negation negation) {
    // The complement of an over-approximation says nothing.
    return true;
  }

  @Override
  public Boolean visitPredicate(Predicate predicate) {
    return sketch.lookup(predicate);
  }
}
