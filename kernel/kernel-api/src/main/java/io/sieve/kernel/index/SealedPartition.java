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

package io.sieve.kernel.index;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.sketch.PartitionSketch;
import java.util.Objects;
import java.util.UUID;

/** The immutable products of sealing a partition. */
@Evolving
public final class SealedPartition {
  private final PartitionSketch sketch;
  private final PartitionIndex index;
  private final byte[] sketchBlob;

  public SealedPartition(PartitionSketch sketch, PartitionIndex index, byte[] sketchBlob) {
    this.sketch = Objects.requireNonNull(sketch, "sketch is null");
    this.index = Objects.requireNonNull(index, "index is null");
    this.sketchBlob = Objects.requireNonNull(sketchBlob, "sketchBlob is null").clone();
  }

  public UUID getPartitionId() {
    return sketch.getPartitionId();
  }

  public PartitionSketch getSketch() {
    return sketch;
  }

  public PartitionIndex getIndex() {
    return index;
  }

  /** @return the serialized sketch, as registered with a catalog or a sketch store */
  public byte[] getSketchBlob() {
    return sketchBlob.clone();
  }
}
