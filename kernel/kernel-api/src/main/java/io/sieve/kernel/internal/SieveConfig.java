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

package io.sieve.kernel.internal;

import io.sieve.kernel.config.ConfigurationProvider;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/** Represents the configuration keys of Sieve and provides methods to read their values. */
public class SieveConfig<T> {

  /////////////////
  // SieveConfigs //
  /////////////////

  /** False-positive probability of Bloom filter synopses whose attribute omits it. */
  public static final SieveConfig<Double> DEFAULT_FP_RATE =
      new SieveConfig<>(
          "sieve.synopsis.defaultFpRate",
          "0.01",
          Double::parseDouble,
          value -> value > 0 && value < 1,
          "needs to be a number in the open interval (0, 1).");

  /**
   * False-positive probability of the type-level string synopsis. A {@code :string} entry of
   * {@link #FP_RATE_RULES} takes precedence.
   */
  public static final SieveConfig<Double> STRING_FP_RATE =
      new SieveConfig<>(
          "sieve.synopsis.stringFpRate",
          "0.01",
          Double::parseDouble,
          value -> value > 0 && value < 1,
          "needs to be a number in the open interval (0, 1).");

  /**
   * Comma-separated {@code target=rate} entries. A target {@code <schema>.<field>} gives a field
   * without synopsis attribute its own synopsis, a Bloom filter at that rate for strings; the
   * target {@code :string} sets the rate of the type-level string synopsis.
   */
  public static final SieveConfig<Map<String, Double>> FP_RATE_RULES =
      new SieveConfig<>(
          "sieve.synopsis.fpRateRules",
          "",
          SieveConfig::parseFpRateRules,
          SieveConfig::validFpRateRules,
          "needs to be a comma-separated list of <schema>.<field>=<rate> or :string=<rate>, "
              + "with every rate in the open interval (0, 1).");

  /** Whether fields of ordered types without a synopsis attribute get a min-max synopsis. */
  public static final SieveConfig<Boolean> MIN_MAX_FOR_ORDERED_TYPES =
      new SieveConfig<>(
          "sieve.synopsis.minMaxForOrderedTypes",
          "true",
          SieveConfig::parseBoolean,
          value -> true,
          "needs to be a boolean.");

  /** Whether sketches carry one synopsis per type, covering all fields of that type. */
  public static final SieveConfig<Boolean> TYPE_SYNOPSES_ENABLED =
      new SieveConfig<>(
          "sieve.synopsis.typeSynopses.enabled",
          "true",
          SieveConfig::parseBoolean,
          value -> true,
          "needs to be a boolean.");

  /**
   * How long the catalog waits for a sketch from the sketch store before it treats the partition
   * as a candidate.
   */
  public static final SieveConfig<Long> SKETCH_LOAD_TIMEOUT_MS =
      new SieveConfig<>(
          "sieve.catalog.sketchLoadTimeoutMs",
          "10000",
          Long::parseLong,
          value -> value > 0,
          "needs to be a positive number of milliseconds.");

  /** Maximum number of events in a partition. */
  public static final SieveConfig<Long> PARTITION_MAX_EVENTS =
      new SieveConfig<>(
          "sieve.partition.maxEvents",
          "1048576",
          Long::parseLong,
          value -> value > 0 && value <= (1L << 32),
          "needs to be a positive number not larger than 2^32.");

  /** All the valid configuration keys. */
  private static final Map<String, SieveConfig<?>> VALID_KEYS =
      Collections.unmodifiableMap(
          new HashMap<String, SieveConfig<?>>() {
            {
              addConfig(this, DEFAULT_FP_RATE);
              addConfig(this, STRING_FP_RATE);
              addConfig(this, FP_RATE_RULES);
              addConfig(this, MIN_MAX_FOR_ORDERED_TYPES);
              addConfig(this, TYPE_SYNOPSES_ENABLED);
              addConfig(this, SKETCH_LOAD_TIMEOUT_MS);
              addConfig(this, PARTITION_MAX_EVENTS);
            }
          });

  private static final String PREFIX = "sieve.";

  /** The rule target of the type-level string synopsis. */
  public static final String STRING_TYPE_TARGET = ":string";

  ///////////////////////////
  // Static Helper Methods //
  ///////////////////////////

  /**
   * Checks that every {@code sieve.} key of the provider is known. Keys outside the {@code sieve.}
   * namespace belong to other components and are ignored.
   *
   * @throws io.sieve.kernel.exceptions.UnknownConfigurationException for an unknown key
   */
  public static void validateKeys(ConfigurationProvider provider) {
    for (String key : provider.keys()) {
      if (key.startsWith(PREFIX) && !VALID_KEYS.containsKey(key)) {
        throw SieveErrors.unknownConfigurationException(key);
      }
    }
  }

  private static void addConfig(HashMap<String, SieveConfig<?>> configs, SieveConfig<?> config) {
    configs.put(config.getKey(), config);
  }

  private static Boolean parseBoolean(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true") || normalized.equals("false")) {
      return Boolean.valueOf(normalized);
    }
    throw new IllegalArgumentException("not a boolean: " + value);
  }

  private static Map<String, Double> parseFpRateRules(String value) {
    Map<String, Double> rules = new LinkedHashMap<>();
    for (String entry : value.split(",")) {
      if (entry.trim().isEmpty()) {
        continue;
      }
      int separator = entry.lastIndexOf('=');
      if (separator < 0) {
        throw new IllegalArgumentException("not a rule: " + entry);
      }
      String target = entry.substring(0, separator).trim();
      double rate = Double.parseDouble(entry.substring(separator + 1).trim());
      if (rules.put(target, rate) != null) {
        throw new IllegalArgumentException("duplicate rule for " + target);
      }
    }
    return Collections.unmodifiableMap(rules);
  }

  private static boolean validFpRateRules(Map<String, Double> rules) {
    for (Map.Entry<String, Double> rule : rules.entrySet()) {
      String target = rule.getKey();
      boolean validTarget =
          target.equals(STRING_TYPE_TARGET) || (!target.startsWith(":") && target.contains("."));
      if (!validTarget || !(rule.getValue() > 0 && rule.getValue() < 1)) {
        return false;
      }
    }
    return true;
  }

  /////////////////////////////
  // Member Fields / Methods //
  /////////////////////////////

  private final String key;
  private final String defaultValue;
  private final Function<String, T> fromString;
  private final Predicate<T> validator;
  private final String helpMessage;

  private SieveConfig(
      String key,
      String defaultValue,
      Function<String, T> fromString,
      Predicate<T> validator,
      String helpMessage) {
    this.key = key;
    this.defaultValue = defaultValue;
    this.fromString = fromString;
    this.validator = validator;
    this.helpMessage = helpMessage;
  }

  /**
   * Returns the value of the key from the given configuration, or its default.
   *
   * @throws io.sieve.kernel.exceptions.InvalidConfigurationValueException if the value is invalid
   */
  public T fromConfiguration(ConfigurationProvider provider) {
    String value = provider.getOptional(key).orElse(defaultValue);
    T parsedValue;
    try {
      parsedValue = fromString.apply(value.trim());
    } catch (IllegalArgumentException e) {
      throw SieveErrors.invalidConfigurationValueException(key, value, helpMessage);
    }
    if (!validator.test(parsedValue)) {
      throw SieveErrors.invalidConfigurationValueException(key, value, helpMessage);
    }
    return parsedValue;
  }

  public String getKey() {
    return key;
  }

  public String getDefaultValue() {
    return defaultValue;
  }
}
