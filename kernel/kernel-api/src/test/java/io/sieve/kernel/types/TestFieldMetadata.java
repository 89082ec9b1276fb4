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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import org.junit.Test;

public class TestFieldMetadata {

  @Test
  public void parseSynopsisAndFlag() {
    FieldMetadata metadata =
        FieldMetadata.fromAttributes("#synopsis=bloomfilter(1000, 0.01) #skip");

    assertThat(metadata.get(FieldMetadata.SYNOPSIS_KEY)).contains("bloomfilter(1000, 0.01)");
    assertThat(metadata.contains(FieldMetadata.SKIP_KEY)).isTrue();
    assertThat(metadata.get(FieldMetadata.SKIP_KEY)).isEmpty();
    assertThat(metadata.getEntries()).containsOnlyKeys("synopsis", "skip");
  }

  @Test
  public void attributeStringRoundTrips() {
    FieldMetadata metadata =
        FieldMetadata.builder().putSynopsis("minmax").putFlag(FieldMetadata.SKIP_KEY).build();

    assertThat(metadata.toAttributeString()).isEqualTo("#synopsis=minmax #skip");
    assertThat(FieldMetadata.fromAttributes(metadata.toAttributeString())).isEqualTo(metadata);
  }

  @Test
  public void emptyAttributes() {
    assertThat(FieldMetadata.fromAttributes(null)).isSameAs(FieldMetadata.empty());
    assertThat(FieldMetadata.fromAttributes("   ")).isSameAs(FieldMetadata.empty());
    assertThat(FieldMetadata.builder().build().isEmpty()).isTrue();
  }

  @Test
  public void structFieldExposesAttributes() {
    StructField skipped =
        new StructField("uid", StringType.STRING, true, FieldMetadata.fromAttributes("#skip"));
    StructField summarized =
        new StructField(
            "id.orig_h",
            StringType.STRING,
            true,
            FieldMetadata.fromAttributes("#synopsis=bloomfilter(10,0.1)"));

    assertThat(skipped.isSkipped()).isTrue();
    assertThat(skipped.getSynopsisAttribute()).isEqualTo(Optional.empty());
    assertThat(summarized.isSkipped()).isFalse();
    assertThat(summarized.getSynopsisAttribute()).contains("bloomfilter(10,0.1)");
  }

  @Test
  public void structTypeRejectsDuplicateNames() {
    assertThatThrownBy(
            () -> new StructType().add("a", LongType.LONG).add("a", StringType.STRING))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate field name: a");
  }

  @Test
  public void primitiveTypesByName() {
    for (DataType type : BasePrimitiveType.getAllPrimitiveTypes()) {
      assertThat(BasePrimitiveType.createPrimitive(type.toString())).isEqualTo(type);
    }
    assertThat(TimestampType.TIMESTAMP.isMinMaxSummarizable()).isTrue();
    assertThat(StringType.STRING.isMinMaxSummarizable()).isFalse();
    assertThatThrownBy(() -> BasePrimitiveType.createPrimitive("ip"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
