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

import io.sieve.kernel.engine.SketchStore;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SketchStore} based on Hadoop APIs. Each blob is the file {@code <partition id>.sketch}
 * in a root directory. Reads run on the given executor.
 */
public class FileSystemSketchStore implements SketchStore {
  private static final Logger logger = LoggerFactory.getLogger(FileSystemSketchStore.class);

  static final String SUFFIX = ".sketch";

  private final Configuration hadoopConf;
  private final Path root;
  private final Executor executor;

  public FileSystemSketchStore(Configuration hadoopConf, String rootPath, Executor executor) {
    this.hadoopConf = Objects.requireNonNull(hadoopConf, "hadoopConf is null");
    this.root = new Path(Objects.requireNonNull(rootPath, "rootPath is null"));
    this.executor = Objects.requireNonNull(executor, "executor is null");
  }

  /** @return the path of the blob of {@code partitionId} */
  public String pathOf(UUID partitionId) {
    return blobPath(partitionId).toString();
  }

  @Override
  public CompletableFuture<byte[]> load(UUID partitionId) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return read(blobPath(partitionId));
          } catch (FileNotFoundException e) {
            throw new NoSuchElementException("No sketch stored for partition " + partitionId);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        executor);
  }

  @Override
  public void store(UUID partitionId, byte[] blob) throws IOException {
    Path path = blobPath(partitionId);
    FileSystem fs = path.getFileSystem(hadoopConf);
    if (fs.exists(path)) {
      throw new FileAlreadyExistsException(path.toString());
    }
    fs.mkdirs(root);
    try (FSDataOutputStream out = fs.create(path, false /* overwrite */)) {
      out.write(blob);
    }
    logger.debug("Stored {} sketch bytes at {}", blob.length, path);
  }

  private byte[] read(Path path) throws IOException {
    FileSystem fs = path.getFileSystem(hadoopConf);
    long length = fs.getFileStatus(path).getLen();
    if (length > Integer.MAX_VALUE) {
      throw new IOException("Sketch file " + path + " is too large: " + length + " bytes");
    }
    byte[] blob = new byte[(int) length];
    try (FSDataInputStream in = fs.open(path)) {
      in.readFully(0, blob);
    }
    return blob;
  }

  private Path blobPath(UUID partitionId) {
    return new Path(root, partitionId + SUFFIX);
  }
}
