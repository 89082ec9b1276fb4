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

package io.sieve.kernel.internal.sketch;

import static io.sieve.kernel.utils.SieveTestUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.exceptions.CorruptSketchException;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.internal.util.JsonUtils;
import io.sieve.kernel.sketch.PartitionSketch;
import io.sieve.kernel.sketch.PartitionSketchBuilder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import org.junit.Test;

public class TestPartitionSketchSerDe {
  private static final UUID ID = UUID.fromString("5b2c9d1e-7f0a-4e63-8c1d-2a9b3e4f5061");

  private static PartitionSketch sketch() {
    long importTime = micros("2021-06-01T00:00:00Z");
    return new PartitionSketchBuilder(ID, CONN, CONN_SCHEMA, IndexSettings.defaults())
        .add(
            slice(
                CONN,
                CONN_SCHEMA,
                1000,
                importTime,
                Arrays.asList(
                    conn("2021-05-31T23:00:00Z", "C1", "10.1.1.1", 22L, "tcp", -0.0, true),
                    conn("2021-05-31T23:10:00Z", "C2", "10.1.1.2", 3389L, "tcp", 7.5, false),
                    conn("2021-05-31T23:20:00Z", "C3", "fe80::1", 53L, "udp", null, null))))
        .build();
  }

  private static ObjectNode tree(byte[] blob) throws Exception {
    return (ObjectNode) JsonUtils.mapper().readTree(blob);
  }

  private static byte[] bytes(JsonNode node) throws Exception {
    return JsonUtils.mapper().writeValueAsBytes(node);
  }

  @Test
  public void roundTrip() {
    PartitionSketch sketch = sketch();
    PartitionSketch restored = PartitionSketch.deserialize(ID, sketch.serialize());

    assertThat(restored).isEqualTo(sketch);
    assertThat(restored.getInfo()).isEqualTo(sketch.getInfo());
    assertThat(restored.lookup(pred("orig_h", "==", Literal.ofString("fe80::1")))).isTrue();
    assertThat(restored.lookup(pred("resp_p", ">", Literal.ofLong(3389)))).isFalse();
    assertThat(restored.serialize()).isEqualTo(sketch.serialize());
  }

  @Test
  public void roundTripOfEmptySketchKeepsInfiniteBounds() {
    PartitionSketch empty =
        new PartitionSketchBuilder(ID, DNS, DNS_SCHEMA, IndexSettings.defaults()).build();

    PartitionSketch restored = PartitionSketch.deserialize(ID, empty.serialize());
    assertThat(restored).isEqualTo(empty);
    assertThat(restored.lookup(pred("rtt", "<", Literal.ofDouble(1e9)))).isFalse();
  }

  @Test
  public void layout() throws Exception {
    ObjectNode root = tree(sketch().serialize());

    assertThat(root.get("version").intValue()).isEqualTo(PartitionSketchSerDe.VERSION);
    assertThat(root.get("partitionId").textValue()).isEqualTo(ID.toString());
    assertThat(root.get("schemaName").textValue()).isEqualTo(CONN);
    assertThat(root.get("events").longValue()).isEqualTo(3);
    assertThat(root.get("offset").longValue()).isEqualTo(1000);
    assertThat(root.get("fields").size()).isEqualTo(CONN_SCHEMA.length());

    JsonNode origH = root.get("fields").get(2);
    assertThat(origH.get("name").textValue()).isEqualTo("id.orig_h");
    assertThat(origH.get("synopsis").get("kind").textValue()).isEqualTo("bloomfilter");
    assertThat(origH.get("synopsis").get("n").longValue()).isEqualTo(1000);
    assertThat(root.get("fields").get(1).has("synopsis")).isFalse();

    JsonNode duration = root.get("typeSynopses").get("double");
    assertThat(duration.get("kind").textValue()).isEqualTo("minmax");
    assertThat(duration.get("min").textValue()).isEqualTo("0.0");
    assertThat(duration.get("max").textValue()).isEqualTo("7.5");
  }

  @Test
  public void invalidJson() {
    byte[] garbage = "{\"version\": 1, \"fields\": [".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, garbage))
        .isInstanceOf(CorruptSketchException.class)
        .hasMessageContaining(ID.toString());
    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, new byte[0]))
        .isInstanceOf(CorruptSketchException.class);
  }

  @Test
  public void missingOrNonObjectBlob() {
    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, null))
        .isInstanceOf(CorruptSketchException.class)
        .hasMessageContaining(ID.toString());
    for (String json : Arrays.asList("null", "[]", "42", "\"sketch\"")) {
      byte[] blob = json.getBytes(StandardCharsets.UTF_8);
      assertThatThrownBy(() -> PartitionSketch.deserialize(ID, blob))
          .as(json)
          .isInstanceOf(CorruptSketchException.class);
    }
  }

  @Test
  public void unsupportedVersion() throws Exception {
    ObjectNode root = tree(sketch().serialize());
    root.put("version", PartitionSketchSerDe.VERSION + 1);

    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, bytes(root)))
        .isInstanceOf(CorruptSketchException.class)
        .hasMessageContaining("version 2");
  }

  @Test
  public void blobOfAnotherPartition() {
    UUID other = UUID.randomUUID();

    byte[] blob = sketch().serialize();
    CorruptSketchException e =
        catchThrowableOfType(
            () -> PartitionSketch.deserialize(other, blob), CorruptSketchException.class);

    assertThat(e).hasMessageContaining(other.toString()).hasMessageContaining(ID.toString());
    assertThat(e.getPartitionId()).isEqualTo(other);
  }

  @Test
  public void truncatedBloomFilterPayload() throws Exception {
    ObjectNode root = tree(sketch().serialize());
    ObjectNode synopsis = (ObjectNode) root.get("fields").get(2).get("synopsis");
    synopsis.put("payload", "AAAAAAAAAAA=");

    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, bytes(root)))
        .isInstanceOf(CorruptSketchException.class);
  }

  @Test
  public void synopsisTypeMustMatchField() throws Exception {
    ObjectNode root = tree(sketch().serialize());
    ArrayNode fields = (ArrayNode) root.get("fields");
    ((ObjectNode) fields.get(3).get("synopsis")).put("type", "double");

    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, bytes(root)))
        .isInstanceOf(CorruptSketchException.class);
  }

  @Test
  public void missingField() throws Exception {
    ObjectNode root = tree(sketch().serialize());
    root.remove("events");

    assertThatThrownBy(() -> PartitionSketch.deserialize(ID, bytes(root)))
        .isInstanceOf(CorruptSketchException.class)
        .hasMessageContaining("events");
  }
}
