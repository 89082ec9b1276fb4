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
import io.sieve.kernel.internal.logging.SieveLogger;
import io.sieve.kernel.types.DataType;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.LoggerFactory;

/**
 * The parsed value of a {@code #synopsis} field attribute: {@code bloomfilter(n,p)}, {@code
 * bloomfilter(n)} or {@code minmax}.
 */
@Evolving
public final class SynopsisAttribute {
  private static final SieveLogger logger =
      new SieveLogger(LoggerFactory.getLogger(SynopsisAttribute.class), "synopsis");

  private static final Pattern BLOOM_FILTER =
      Pattern.compile("bloomfilter\\(\\s*(\\d+)\\s*(?:,\\s*([0-9.eE+-]+)\\s*)?\\)");

  private final SynopsisKind kind;
  private final long n;
  private final double p;

  private SynopsisAttribute(SynopsisKind kind, long n, double p) {
    this.kind = kind;
    this.n = n;
    this.p = p;
  }

  public static SynopsisAttribute bloomFilter(long n, double p) {
    return new SynopsisAttribute(SynopsisKind.BLOOM_FILTER, n, p);
  }

  public static SynopsisAttribute minMax() {
    return new SynopsisAttribute(SynopsisKind.MIN_MAX, 0, 0);
  }

  /**
   * Parses an attribute value. Values that do not parse, or that describe an impossible filter,
   * are logged at WARN and yield no synopsis.
   *
   * @param text the attribute value, e.g. {@code bloomfilter(1000,0.01)}
   * @param defaultFpRate the false-positive probability used when {@code p} is omitted
   */
  public static Optional<SynopsisAttribute> parse(String text, double defaultFpRate) {
    String trimmed = text == null ? "" : text.trim();
    if (trimmed.equals(SynopsisKind.MIN_MAX.getName())) {
      return Optional.of(minMax());
    }
    Matcher matcher = BLOOM_FILTER.matcher(trimmed);
    if (matcher.matches()) {
      try {
        long n = Long.parseLong(matcher.group(1));
        double p = matcher.group(2) == null ? defaultFpRate : Double.parseDouble(matcher.group(2));
        if (n > 0 && p > 0 && p < 1) {
          return Optional.of(bloomFilter(n, p));
        }
      } catch (NumberFormatException e) {
        logger.debug("Cannot parse the parameters of '{}': {}", trimmed, e.getMessage());
      }
    }
    logger.warn("Ignoring unparsable synopsis attribute '{}'", text);
    return Optional.empty();
  }

  public SynopsisKind getKind() {
    return kind;
  }

  public long getN() {
    return n;
  }

  public double getP() {
    return p;
  }

  /**
   * Creates an empty synopsis for values of {@code type}. A {@code minmax} attribute on a type
   * without a suitable order is logged at WARN and yields no synopsis.
   */
  public Optional<Synopsis> newSynopsis(DataType type) {
    switch (kind) {
      case BLOOM_FILTER:
        return Optional.of(BloomFilterSynopsis.create(type, n, p));
      case MIN_MAX:
        if (type.isMinMaxSummarizable()) {
          return Optional.of(MinMaxSynopsis.forType(type));
        }
        logger.warn("Ignoring synopsis attribute '{}' on field of type {}", this, type);
        return Optional.empty();
      default:
        throw new IllegalStateException("Unknown synopsis kind: " + kind);
    }
  }

  @Override
  public String toString() {
    return kind == SynopsisKind.MIN_MAX
        ? kind.getName()
        : String.format("%s(%s,%s)", kind.getName(), n, p);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SynopsisAttribute)) {
      return false;
    }
    SynopsisAttribute that = (SynopsisAttribute) o;
    return kind == that.kind && n == that.n && Double.compare(p, that.p) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, n, p);
  }
}
