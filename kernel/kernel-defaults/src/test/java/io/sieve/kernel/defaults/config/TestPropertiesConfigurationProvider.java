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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.exceptions.UnknownConfigurationException;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestPropertiesConfigurationProvider {
  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void fromResource() throws Exception {
    PropertiesConfigurationProvider provider =
        PropertiesConfigurationProvider.fromResource("sieve-test.properties");

    assertThat(provider.get("sieve.synopsis.defaultFpRate")).isEqualTo("0.05");
    assertThat(provider.getOptional("sieve.partition.maxEvents")).isEmpty();
    assertThat(provider.keys()).contains("fs.defaultFS", "sieve.catalog.sketchLoadTimeoutMs");

    IndexSettings settings = IndexSettings.from(provider);
    assertThat(settings.getDefaultFpRate()).isEqualTo(0.05);
    assertThat(settings.getSketchLoadTimeoutMillis()).isEqualTo(2000L);
    assertThat(settings.getPartitionMaxEvents()).isEqualTo(1L << 20);
  }

  @Test
  public void missingResource() {
    assertThatThrownBy(() -> PropertiesConfigurationProvider.fromResource("nope.properties"))
        .isInstanceOf(FileNotFoundException.class);
  }

  @Test
  public void fromFile() throws Exception {
    Path file = tempFolder.newFile("sieve.properties").toPath();
    Files.write(
        file,
        "sieve.partition.maxEvents=64\nsieve.synopsis.typeSynopses.enabled=false\n"
            .getBytes(StandardCharsets.UTF_8));

    IndexSettings settings = IndexSettings.from(PropertiesConfigurationProvider.fromFile(file));
    assertThat(settings.getPartitionMaxEvents()).isEqualTo(64L);
    assertThat(settings.isTypeSynopsesEnabled()).isFalse();
  }

  @Test
  public void unknownKeyIsRejected() {
    Properties properties = new Properties();
    properties.setProperty("sieve.catalog.timeout", "1");
    PropertiesConfigurationProvider provider = new PropertiesConfigurationProvider(properties);

    assertThatThrownBy(() -> IndexSettings.from(provider))
        .isInstanceOf(UnknownConfigurationException.class);
    assertThatThrownBy(() -> provider.get("sieve.partition.maxEvents"))
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  public void copiesProperties() {
    Properties properties = new Properties();
    properties.setProperty("sieve.partition.maxEvents", "8");
    PropertiesConfigurationProvider provider = new PropertiesConfigurationProvider(properties);
    properties.setProperty("sieve.partition.maxEvents", "16");

    assertThat(provider.get("sieve.partition.maxEvents")).isEqualTo("8");
  }
}
