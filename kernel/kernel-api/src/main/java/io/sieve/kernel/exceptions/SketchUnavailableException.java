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

package io.sieve.kernel.exceptions;

import io.sieve.kernel.annotation.Evolving;
import java.util.UUID;

/**
 * Thrown when the sketch of a partition could not be fetched from the {@link
 * io.sieve.kernel.engine.SketchStore} in time. Unlike {@link CorruptSketchException} this is
 * considered transient.
 */
@Evolving
public class SketchUnavailableException extends SieveException {
  private final UUID partitionId;

  public SketchUnavailableException(UUID partitionId, String message, Throwable cause) {
    super(message, cause);
    this.partitionId = partitionId;
  }

  public UUID getPartitionId() {
    return partitionId;
  }
}
