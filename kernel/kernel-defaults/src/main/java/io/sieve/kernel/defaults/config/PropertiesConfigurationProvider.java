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

package io.sieve.kernel.defaults.config;

import io.sieve.kernel.config.ConfigurationProvider;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/** A {@link ConfigurationProvider} over a {@code .properties} file or classpath resource. */
public class PropertiesConfigurationProvider implements ConfigurationProvider {
  private final Properties properties;

  public PropertiesConfigurationProvider(Properties properties) {
    this.properties = new Properties();
    this.properties.putAll(properties);
  }

  /** Reads the properties from a UTF-8 encoded file. */
  public static PropertiesConfigurationProvider fromFile(Path file) throws IOException {
    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      properties.load(reader);
    }
    return new PropertiesConfigurationProvider(properties);
  }

  /**
   * Reads the properties from a classpath resource.
   *
   * @throws FileNotFoundException if the resource does not exist
   */
  public static PropertiesConfigurationProvider fromResource(String resource) throws IOException {
    Properties properties = new Properties();
    ClassLoader classLoader = PropertiesConfigurationProvider.class.getClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new FileNotFoundException("Resource not found: " + resource);
      }
      properties.load(in);
    }
    return new PropertiesConfigurationProvider(properties);
  }

  @Override
  public String get(String key) throws NoSuchElementException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new NoSuchElementException(key);
    }
    return value;
  }

  @Override
  public Optional<String> getOptional(String key) {
    return Optional.ofNullable(properties.getProperty(key));
  }

  @Override
  public Set<String> keys() {
    return Collections.unmodifiableSet(properties.stringPropertyNames());
  }
}
