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
import java.util.List;

/**
 * Base interface for the boolean expressions evaluated against partition sketches and bitmap
 * indexes. The set of implementations is closed: {@link Conjunction}, {@link Disjunction}, {@link
 * Negation} and {@link Predicate}. Use {@link #accept(ExpressionVisitor)} to dispatch over them.
 */
@Evolving
public interface Expression {
  /** @return a list of expressions that are input to this expression. */
  List<Expression> getChildren();

  <R> R accept(ExpressionVisitor<R> visitor);
}
