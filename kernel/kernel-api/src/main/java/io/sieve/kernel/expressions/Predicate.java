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
import io.sieve.kernel.types.StringType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single comparison between an extracted value and a literal, e.g. {@code src_port == 53} or
 * {@code :timestamp > 2020-01-01}.
 *
 * <ul>
 *   <li>{@link RelationalOperator#IN} requires a list literal.
 *   <li>{@link RelationalOperator#MATCH} requires a string literal holding a regular expression
 *       that must match the entire value.
 * </ul>
 */
@Evolving
public final class Predicate implements Expression {
  private final Extractor extractor;
  private final RelationalOperator op;
  private final Literal literal;
  private final Pattern pattern;

  public Predicate(Extractor extractor, RelationalOperator op, Literal literal) {
    this.extractor = Objects.requireNonNull(extractor, "extractor is null");
    this.op = Objects.requireNonNull(op, "op is null");
    this.literal = Objects.requireNonNull(literal, "literal is null");
    checkArgument(
        (op == RelationalOperator.IN) == literal.isList(),
        "Operator '%s' is incompatible with literal %s",
        op,
        literal);
    if (op == RelationalOperator.MATCH) {
      checkArgument(
          literal.getDataType() instanceof StringType,
          "Operator 'match' requires a string pattern, got %s",
          literal);
      try {
        this.pattern = Pattern.compile((String) literal.getValue());
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("Invalid pattern " + literal + ": " + e.getMessage(), e);
      }
    } else {
      this.pattern = null;
    }
  }

  /** Creates a predicate on the field(s) referred to by {@code path}. */
  public static Predicate field(String path, RelationalOperator op, Literal literal) {
    return new Predicate(new Column(path), op, literal);
  }

  public Extractor getExtractor() {
    return extractor;
  }

  public RelationalOperator getOperator() {
    return op;
  }

  public Literal getLiteral() {
    return literal;
  }

  /** @return the compiled pattern of a {@code match} predicate, {@code null} otherwise. */
  public Pattern getPattern() {
    return pattern;
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visitPredicate(this);
  }

  @Override
  public String toString() {
    return String.format("%s %s %s", extractor, op, literal);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Predicate)) {
      return false;
    }
    Predicate that = (Predicate) o;
    return extractor.equals(that.extractor) && op == that.op && literal.equals(that.literal);
  }

  @Override
  public int hashCode() {
    return Objects.hash(extractor, op, literal);
  }
}
