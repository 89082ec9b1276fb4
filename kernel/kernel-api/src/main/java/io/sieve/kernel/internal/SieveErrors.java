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

package io.sieve.kernel.internal;

import static java.lang.String.format;

import io.sieve.kernel.exceptions.*;
import io.sieve.kernel.types.StructType;
import java.util.UUID;

/** Contains methods to create user-facing Sieve exceptions. */
public final class SieveErrors {
  private SieveErrors() {}

  public static CorruptSketchException corruptSketch(
      UUID partitionId, String reason, Throwable cause) {
    String message = format("Failed to decode the sketch of partition %s: %s", partitionId, reason);
    return new CorruptSketchException(partitionId, message, cause);
  }

  public static CorruptSketchException unsupportedSketchVersion(
      UUID partitionId, int version, int supportedVersion) {
    String message =
        format(
            "Sketch of partition %s has version %s, but only version %s is supported.",
            partitionId, version, supportedVersion);
    return new CorruptSketchException(partitionId, message);
  }

  public static CorruptSketchException partitionIdMismatch(UUID expected, UUID actual) {
    String message =
        format("Sketch registered for partition %s describes partition %s.", expected, actual);
    return new CorruptSketchException(expected, message);
  }

  public static SketchUnavailableException sketchLoadTimedOut(
      UUID partitionId, long timeoutMillis, Throwable cause) {
    String message =
        format(
            "Loading the sketch of partition %s did not complete within %s ms.",
            partitionId, timeoutMillis);
    return new SketchUnavailableException(partitionId, message, cause);
  }

  public static SketchUnavailableException sketchLoadFailed(UUID partitionId, Throwable cause) {
    String message =
        format(
            "Loading the sketch of partition %s failed: %s",
            partitionId, cause == null ? "unknown reason" : cause.getMessage());
    return new SketchUnavailableException(partitionId, message, cause);
  }

  public static InvalidConfigurationValueException invalidConfigurationValueException(
      String key, String value, String helpMessage) {
    return new InvalidConfigurationValueException(
        format("Invalid value for configuration '%s': '%s'. %s", key, value, helpMessage));
  }

  public static UnknownConfigurationException unknownConfigurationException(String confKey) {
    return new UnknownConfigurationException(
        format("Unknown configuration was specified: %s", confKey));
  }

  public static PartitionCapacityExceededException partitionCapacityExceeded(
      String schemaName, long capacity, long requested) {
    return new PartitionCapacityExceededException(
        format(
            "Cannot add %s events to the open partition of schema '%s': capacity is %s events.",
            requested, schemaName, capacity));
  }

  public static SieveException schemaMismatch(
      String schemaName, StructType expected, StructType actual) {
    return new SieveException(
        format(
            "Table slice does not match the schema '%s' of the open partition.%n"
                + "Expected: %s%nActual: %s",
            schemaName, expected, actual));
  }

  public static SieveException partitionAlreadySealed(String schemaName) {
    return new SieveException(
        format("The open partition of schema '%s' has already been sealed.", schemaName));
  }
}
