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

package io.sieve.kernel.defaults.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.sieve.kernel.PartitionBuilder;
import io.sieve.kernel.catalog.Catalog;
import io.sieve.kernel.catalog.CatalogLookupResult;
import io.sieve.kernel.config.IndexSettings;
import io.sieve.kernel.data.Row;
import io.sieve.kernel.data.TableSlice;
import io.sieve.kernel.exceptions.SketchUnavailableException;
import io.sieve.kernel.expressions.*;
import io.sieve.kernel.index.SealedPartition;
import io.sieve.kernel.internal.data.GenericRow;
import io.sieve.kernel.types.*;
import java.util.*;
import java.util.concurrent.RejectedExecutionException;
import org.apache.hadoop.conf.Configuration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestDefaultEngine {
  private static final String SCHEMA_NAME = "suricata.flow";
  private static final StructType SCHEMA =
      new StructType()
          .add(
              "src_ip",
              StringType.STRING,
              FieldMetadata.fromAttributes("#synopsis=bloomfilter(100)"))
          .add("dest_port", LongType.LONG)
          .add("bytes", DoubleType.DOUBLE);

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private static SealedPartition partition(long offset, long... ports) {
    List<Row> rows = new ArrayList<>();
    for (long port : ports) {
      rows.add(GenericRow.of(SCHEMA, Arrays.<Object>asList("10.0.0." + port, port, port * 10.0)));
    }
    return PartitionBuilder.create(SCHEMA_NAME, SCHEMA, IndexSettings.defaults())
        .add(new TableSlice(SCHEMA_NAME, SCHEMA, offset, 1_000_000L, rows))
        .seal();
  }

  private static void resolvesThroughStore(DefaultEngine engine) throws Exception {
    SealedPartition web = partition(0, 80, 443, 8080);
    SealedPartition dns = partition(3, 53, 53);
    Catalog catalog = new Catalog(engine, IndexSettings.defaults());
    for (SealedPartition partition : Arrays.asList(web, dns)) {
      engine.getSketchStore().store(partition.getPartitionId(), partition.getSketchBlob());
      catalog.addPartition(partition.getSketch().getInfo());
    }

    Predicate port53 =
        new Predicate(new Column("dest_port"), RelationalOperator.EQUAL, Literal.ofLong(53));
    CatalogLookupResult result = catalog.resolve(port53);
    assertThat(result.getCandidates()).containsExactly(dns.getPartitionId());
    assertThat(result.isDegraded()).isFalse();

    Predicate host =
        new Predicate(
            new Column("src_ip"), RelationalOperator.EQUAL, Literal.ofString("10.0.0.443"));
    assertThat(catalog.resolve(host).getCandidates()).containsExactly(web.getPartitionId());
    assertThat(catalog.getSketch(web.getPartitionId())).contains(web.getSketch());
  }

  @Test
  public void fileSystemEngine() throws Exception {
    String root = tempFolder.newFolder("sketches").getAbsolutePath();
    try (DefaultEngine engine = DefaultEngine.create(new Configuration(), root)) {
      assertThat(engine.getSketchStore()).isInstanceOf(FileSystemSketchStore.class);
      resolvesThroughStore(engine);
    }
  }

  @Test
  public void inMemoryEngine() throws Exception {
    try (DefaultEngine engine = DefaultEngine.createInMemory()) {
      assertThat(engine.getSketchStore()).isInstanceOf(InMemorySketchStore.class);
      resolvesThroughStore(engine);
    }
  }

  @Test
  public void sketchesSurviveTheEngine() throws Exception {
    String root = tempFolder.newFolder("sketches").getAbsolutePath();
    SealedPartition partition = partition(0, 22);
    try (DefaultEngine engine = DefaultEngine.create(new Configuration(), root)) {
      engine.getSketchStore().store(partition.getPartitionId(), partition.getSketchBlob());
    }

    try (DefaultEngine engine = DefaultEngine.create(new Configuration(), root)) {
      Catalog catalog = new Catalog(engine, IndexSettings.defaults());
      catalog.addPartition(partition.getSketch().getInfo());
      assertThat(catalog.getSketch(partition.getPartitionId())).contains(partition.getSketch());
    }
  }

  @Test
  public void closedEngineDegradesLookups() throws Exception {
    String root = tempFolder.newFolder("sketches").getAbsolutePath();
    SealedPartition partition = partition(0, 22);
    DefaultEngine engine = DefaultEngine.create(new Configuration(), root);
    engine.getSketchStore().store(partition.getPartitionId(), partition.getSketchBlob());
    Catalog catalog = new Catalog(engine, IndexSettings.defaults());
    catalog.addPartition(partition.getSketch().getInfo());
    engine.close();

    Predicate port53 =
        new Predicate(new Column("dest_port"), RelationalOperator.EQUAL, Literal.ofLong(53));
    CatalogLookupResult result = catalog.resolve(port53);

    assertThat(result.getCandidates()).containsExactly(partition.getPartitionId());
    assertThat(result.getErrors().get(partition.getPartitionId()))
        .isInstanceOf(SketchUnavailableException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
  }
}
