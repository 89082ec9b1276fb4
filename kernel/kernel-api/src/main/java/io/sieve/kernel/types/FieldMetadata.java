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

package io.sieve.kernel.types;

import io.sieve.kernel.annotation.Evolving;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The type attributes attached to a {@link StructField}, e.g. {@code #synopsis=bloomfilter(1000,
 * 0.01)} or {@code #skip}. An attribute has a key and an optional value; flag attributes such as
 * {@code #skip} carry no value.
 */
@Evolving
public final class FieldMetadata {

  /** Selects the synopsis of a field, e.g. {@code bloomfilter(1000,0.01)} or {@code minmax}. */
  public static final String SYNOPSIS_KEY = "synopsis";

  /** Excludes a field from synopses and bitmap indexes. */
  public static final String SKIP_KEY = "skip";

  private static final Pattern ATTRIBUTE =
      Pattern.compile("#([A-Za-z_][\\w.-]*)(?:=((?:\\([^)]*\\)|[^#\\s(])+))?");

  private static final FieldMetadata EMPTY = new FieldMetadata(Collections.emptyMap());

  private final Map<String, String> attributes;

  private FieldMetadata(Map<String, String> attributes) {
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /** @return the attributes in declaration order; flag attributes map to {@code null}. */
  public Map<String, String> getEntries() {
    return attributes;
  }

  public boolean contains(String key) {
    return attributes.containsKey(key);
  }

  /** @return the value of the attribute, empty for an absent or flag attribute. */
  public Optional<String> get(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  /** @return the attributes in their textual form, e.g. {@code #synopsis=minmax #skip}. */
  public String toAttributeString() {
    StringJoiner joiner = new StringJoiner(" ");
    for (Map.Entry<String, String> entry : attributes.entrySet()) {
      joiner.add(
          entry.getValue() == null
              ? "#" + entry.getKey()
              : "#" + entry.getKey() + "=" + entry.getValue());
    }
    return joiner.toString();
  }

  @Override
  public String toString() {
    return toAttributeString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return attributes.equals(((FieldMetadata) o).attributes);
  }

  @Override
  public int hashCode() {
    return attributes.hashCode();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FieldMetadata empty() {
    return EMPTY;
  }

  /**
   * Parses the textual attribute form. Text between attributes that does not form an attribute is
   * ignored.
   *
   * @param text attributes such as {@code #synopsis=bloomfilter(1000, 0.01) #skip}
   */
  public static FieldMetadata fromAttributes(String text) {
    if (text == null || text.trim().isEmpty()) {
      return EMPTY;
    }
    Builder builder = builder();
    Matcher matcher = ATTRIBUTE.matcher(text);
    while (matcher.find()) {
      String value = matcher.group(2);
      builder.put(matcher.group(1), value == null ? null : value.trim());
    }
    return builder.build();
  }

  /** Builder class for {@link FieldMetadata}. */
  public static class Builder {
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public Builder put(String key, String value) {
      attributes.put(Objects.requireNonNull(key, "key is null"), value);
      return this;
    }

    public Builder putFlag(String key) {
      return put(key, null);
    }

    public Builder putSynopsis(String synopsis) {
      return put(SYNOPSIS_KEY, synopsis);
    }

    public Builder fromMetadata(FieldMetadata metadata) {
      attributes.putAll(metadata.attributes);
      return this;
    }

    public FieldMetadata build() {
      return attributes.isEmpty() ? EMPTY : new FieldMetadata(attributes);
    }
  }
}
