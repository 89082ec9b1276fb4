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

package io.sieve.kernel;

import static io.sieve.kernel.utils.SieveTestUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.config.MapConfigurationProvider;
import io.sieve.kernel.data.Row;
import io.sieve.kernel.exceptions.PartitionCapacityExceededException;
import io.sieve.kernel.exceptions.SieveException;
import io.sieve.kernel.expressions.Literal;
import io.sieve.kernel.ids.Ids;
import io.sieve.kernel.index.SealedPartition;
import io.sieve.kernel.sketch.PartitionSketch;
import java.util.*;
import org.junit.Test;

public class TestPartitionBuilder {
  private static final long IMPORT_TIME = micros("2020-01-01T00:00:00Z");

  private static List<Row> connRows(int count) {
    List<Row> rows = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      rows.add(
          conn(
              "2019-12-31T23:00:00Z",
              "C" + i,
              "10.0.0." + (i % 4),
              i % 2 == 0 ? 53L : 80L,
              "udp",
              i * 1.5,
              i % 3 == 0));
    }
    return rows;
  }

  @Test
  public void sealProducesMatchingSketchIndexAndBlob() {
    UUID id = UUID.randomUUID();
    PartitionBuilder builder =
        PartitionBuilder.create(id, CONN, CONN_SCHEMA, IndexSettings.defaults())
            .add(slice(CONN, CONN_SCHEMA, 10, IMPORT_TIME, connRows(3)))
            .add(slice(CONN, CONN_SCHEMA, 13, IMPORT_TIME + 1, connRows(2)));
    assertThat(builder.getEvents()).isEqualTo(5);

    SealedPartition sealed = builder.seal();

    assertThat(sealed.getPartitionId()).isEqualTo(id);
    assertThat(sealed.getSketch().getEvents()).isEqualTo(5);
    assertThat(sealed.getSketch().getOffset()).isEqualTo(10);
    assertThat(sealed.getIndex().getEvents()).isEqualTo(5);
    assertThat(sealed.getIndex().getOffset()).isEqualTo(10);
    assertThat(PartitionSketch.deserialize(id, sealed.getSketchBlob()))
        .isEqualTo(sealed.getSketch());

    Ids port53 = sealed.getIndex().lookup(pred("id.resp_p", "==", Literal.ofLong(53)));
    Ids expected = new Ids();
    for (boolean bit : new boolean[] {true, false, true, true, false}) {
      expected.appendBit(bit);
    }
    assertThat(port53).isEqualTo(expected);
  }

  @Test
  public void sketchBlobIsACopy() {
    SealedPartition sealed =
        PartitionBuilder.create(CONN, CONN_SCHEMA, IndexSettings.defaults())
            .add(slice(CONN, CONN_SCHEMA, 0, IMPORT_TIME, connRows(1)))
            .seal();
    sealed.getSketchBlob()[0] = 'x';

    assertThat(PartitionSketch.deserialize(sealed.getPartitionId(), sealed.getSketchBlob()))
        .isEqualTo(sealed.getSketch());
  }

  @Test
  public void capacity() {
    Map<String, String> conf = new HashMap<>();
    conf.put("sieve.partition.maxEvents", "4");
    PartitionBuilder builder =
        PartitionBuilder.create(
            CONN, CONN_SCHEMA, IndexSettings.from(new MapConfigurationProvider(conf)));
    builder.add(slice(CONN, CONN_SCHEMA, 0, IMPORT_TIME, connRows(3)));
    assertThat(builder.remainingCapacity()).isEqualTo(1);

    assertThatThrownBy(() -> builder.add(slice(CONN, CONN_SCHEMA, 3, IMPORT_TIME, connRows(2))))
        .isInstanceOf(PartitionCapacityExceededException.class)
        .hasMessageContaining(CONN);
    // A rejected slice leaves the partition untouched.
    assertThat(builder.getEvents()).isEqualTo(3);
    builder.add(slice(CONN, CONN_SCHEMA, 3, IMPORT_TIME, connRows(1)));
    assertThat(builder.remainingCapacity()).isZero();
  }

  @Test
  public void rejectsOtherSchemas() {
    PartitionBuilder builder = PartitionBuilder.create(CONN, CONN_SCHEMA, IndexSettings.defaults());

    assertThatThrownBy(
            () ->
                builder.add(
                    slice(
                        DNS,
                        DNS_SCHEMA,
                        0,
                        IMPORT_TIME,
                        Collections.singletonList(
                            dns("2020-01-01T00:00:00Z", "example.com", 53L, 0.1)))))
        .isInstanceOf(SieveException.class)
        .hasMessageContaining("does not match the schema");
    assertThatThrownBy(
            () -> builder.add(slice("other.conn", CONN_SCHEMA, 0, IMPORT_TIME, connRows(1))))
        .isInstanceOf(SieveException.class);
  }

  @Test
  public void rejectsGapsBetweenSlices() {
    PartitionBuilder builder =
        PartitionBuilder.create(CONN, CONN_SCHEMA, IndexSettings.defaults())
            .add(slice(CONN, CONN_SCHEMA, 0, IMPORT_TIME, connRows(2)))
            .add(slice(CONN, CONN_SCHEMA, 99, IMPORT_TIME, Collections.<Row>emptyList()));

    assertThatThrownBy(() -> builder.add(slice(CONN, CONN_SCHEMA, 5, IMPORT_TIME, connRows(1))))
        .isInstanceOf(IllegalArgumentException.class);
    builder.add(slice(CONN, CONN_SCHEMA, 2, IMPORT_TIME, connRows(1)));
    assertThat(builder.getEvents()).isEqualTo(3);
  }

  @Test
  public void sealedPartitionIsClosed() {
    PartitionBuilder builder = PartitionBuilder.create(CONN, CONN_SCHEMA, IndexSettings.defaults());
    builder.seal();

    assertThatThrownBy(() -> builder.add(slice(CONN, CONN_SCHEMA, 0, IMPORT_TIME, connRows(1))))
        .isInstanceOf(SieveException.class)
        .hasMessageContaining("already been sealed");
    assertThatThrownBy(builder::seal).isInstanceOf(SieveException.class);
  }
}
