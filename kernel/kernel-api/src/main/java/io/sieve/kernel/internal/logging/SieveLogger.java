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

package io.sieve.kernel.internal.logging;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;

/** Wraps an SLF4J {@link Logger} and prefixes every message with the component it belongs to. */
public class SieveLogger {

  private final Logger loggerImpl;
  private final String prefix;

  public SieveLogger(Logger loggerImpl, String component) {
    this.loggerImpl = loggerImpl;
    this.prefix = String.format("[%s]: ", component);
  }

  public void debug(String msg, Object... args) {
    loggerImpl.debug(prefix + msg, args);
  }

  public void info(String msg, Object... args) {
    loggerImpl.info(prefix + msg, args);
  }

  public void warn(String msg, Object... args) {
    loggerImpl.warn(prefix + msg, args);
  }

  /** Runs {@code operation} and logs its wall-clock time at DEBUG. */
  public <T> T timeOperation(String operationName, Supplier<T> operation) {
    long startNanos = System.nanoTime();
    try {
      return operation.get();
    } finally {
      if (loggerImpl.isDebugEnabled()) {
        long micros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startNanos);
        loggerImpl.debug("{}{} took {} us", prefix, operationName, micros);
      }
    }
  }
}
