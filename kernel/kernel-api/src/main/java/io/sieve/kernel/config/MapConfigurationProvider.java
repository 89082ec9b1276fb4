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
import java.util.*;

/** A {@link ConfigurationProvider} over an in-memory map. */
@Evolving
public class MapConfigurationProvider implements ConfigurationProvider {
  private final Map<String, String> configuration;

  public MapConfigurationProvider(Map<String, String> configuration) {
    this.configuration = Collections.unmodifiableMap(new HashMap<>(configuration));
  }

  public static MapConfigurationProvider empty() {
    return new MapConfigurationProvider(Collections.<String, String>emptyMap());
  }

  @Override
  public String get(String key) throws NoSuchElementException {
    if (!configuration.containsKey(key)) {
      throw new NoSuchElementException(key);
    }
    return configuration.get(key);
  }

  @Override
  public Optional<String> getOptional(String key) {
    return Optional.ofNullable(configuration.get(key));
  }

  @Override
  public Set<String> keys() {
    return configuration.keySet();
  }
}
