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

package io.sieve.kernel.config;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.internal.SieveConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The settings of the indexing and pruning components, read once from a {@link
 * ConfigurationProvider} at startup and immutable afterwards. An instance is passed explicitly to
 * every builder and to the catalog.
 */
@Evolving
public final class IndexSettings {
  private final double defaultFpRate;
  private final double stringFpRate;
  private final Map<String, Double> fieldFpRates;
  private final boolean minMaxForOrderedTypes;
  private final boolean typeSynopsesEnabled;
  private final long sketchLoadTimeoutMillis;
  private final long partitionMaxEvents;

  private IndexSettings(
      double defaultFpRate,
      double stringFpRate,
      Map<String, Double> fieldFpRates,
      boolean minMaxForOrderedTypes,
      boolean typeSynopsesEnabled,
      long sketchLoadTimeoutMillis,
      long partitionMaxEvents) {
    this.defaultFpRate = defaultFpRate;
    this.stringFpRate = stringFpRate;
    this.fieldFpRates = fieldFpRates;
    this.minMaxForOrderedTypes = minMaxForOrderedTypes;
    this.typeSynopsesEnabled = typeSynopsesEnabled;
    this.sketchLoadTimeoutMillis = sketchLoadTimeoutMillis;
    this.partitionMaxEvents = partitionMaxEvents;
  }

  /**
   * Reads and validates all settings.
   *
   * @throws io.sieve.kernel.exceptions.InvalidConfigurationValueException if a value is invalid
   * @throws io.sieve.kernel.exceptions.UnknownConfigurationException if the provider has a {@code
   *     sieve.} key that is not a known setting
   */
  public static IndexSettings from(ConfigurationProvider provider) {
    SieveConfig.validateKeys(provider);
    Map<String, Double> fieldFpRates =
        new LinkedHashMap<>(SieveConfig.FP_RATE_RULES.fromConfiguration(provider));
    double stringFpRate = SieveConfig.STRING_FP_RATE.fromConfiguration(provider);
    Double stringRule = fieldFpRates.remove(SieveConfig.STRING_TYPE_TARGET);
    return new IndexSettings(
        SieveConfig.DEFAULT_FP_RATE.fromConfiguration(provider),
        stringRule != null ? stringRule : stringFpRate,
        Collections.unmodifiableMap(fieldFpRates),
        SieveConfig.MIN_MAX_FOR_ORDERED_TYPES.fromConfiguration(provider),
        SieveConfig.TYPE_SYNOPSES_ENABLED.fromConfiguration(provider),
        SieveConfig.SKETCH_LOAD_TIMEOUT_MS.fromConfiguration(provider),
        SieveConfig.PARTITION_MAX_EVENTS.fromConfiguration(provider));
  }

  /** @return the settings with every key at its default value */
  public static IndexSettings defaults() {
    return from(MapConfigurationProvider.empty());
  }

  public double getDefaultFpRate() {
    return defaultFpRate;
  }

  /** @return the false-positive probability of the type-level string synopsis */
  public double getStringFpRate() {
    return stringFpRate;
  }

  /**
   * @return the false-positive probability configured for the field by a {@code
   *     <schema>.<field>} rule, empty if there is none
   */
  public Optional<Double> getFieldFpRate(String schemaName, String fieldName) {
    return Optional.ofNullable(fieldFpRates.get(schemaName + "." + fieldName));
  }

  public boolean isMinMaxForOrderedTypes() {
    return minMaxForOrderedTypes;
  }

  public boolean isTypeSynopsesEnabled() {
    return typeSynopsesEnabled;
  }

  public long getSketchLoadTimeoutMillis() {
    return sketchLoadTimeoutMillis;
  }

  public long getPartitionMaxEvents() {
    return partitionMaxEvents;
  }

  @Override
  public String toString() {
    return String.format(
        "IndexSettings{defaultFpRate=%s, stringFpRate=%s, fieldFpRates=%s, "
            + "minMaxForOrderedTypes=%s, typeSynopsesEnabled=%s, sketchLoadTimeoutMillis=%s, "
            + "partitionMaxEvents=%s}",
        defaultFpRate,
        stringFpRate,
        fieldFpRates,
        minMaxForOrderedTypes,
        typeSynopsesEnabled,
        sketchLoadTimeoutMillis,
        partitionMaxEvents);
  }
}
