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
import io.sieve.kernel.types.DataType;
import java.util.Objects;

/**
 * An approximate summary of the values of one field (or of all fields of one type) in a partition.
 *
 * <p>A lookup answers whether any summarized value may satisfy a comparison. A {@code false}
 * answer is definitive; a {@code true} answer is not. Unsupported operators and literals that
 * cannot be compared with the summarized values answer {@code true}.
 *
 * <p>Synopses are filled while a partition is built and not modified afterwards. The variants are
 * enumerated by {@link SynopsisKind}.
 */
@Evolving
public abstract class Synopsis {
  private final DataType type;

  Synopsis(DataType type) {
    this.type = Objects.requireNonNull(type, "type is null");
  }

  public abstract SynopsisKind getKind();

  /** @return the type of the summarized values */
  public DataType getType() {
    return type;
  }

  /** Adds a non-null value of {@link #getType()} to the summary. */
  public abstract void add(Object value);

  /**
   * @return false if no summarized value satisfies {@code value op literal}, true if some value
   *     may satisfy it. {@code in} is true iff the {@code ==} lookup of any element is true.
   */
  public final boolean lookup(RelationalOperator op, Literal literal) {
    if (op == RelationalOperator.IN) {
      for (Literal element : literal.getElements()) {
        if (lookupScalar(RelationalOperator.EQUAL, element)) {
          return true;
        }
      }
      return false;
    }
    return lookupScalar(op, literal);
  }

  abstract boolean lookupScalar(RelationalOperator op, Literal literal);

  public abstract Synopsis copy();

  /** @return an estimate of the heap bytes held by this synopsis */
  public abstract long memoryUsage();
}
