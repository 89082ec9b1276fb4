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

package io.sieve.kernel.engine;

import io.sieve.kernel.annotation.Evolving;

/**
 * Interface encapsulating the clients the Sieve kernel needs to reach storage. Connectors are
 * expected to pass an implementation of this interface to the {@link
 * io.sieve.kernel.catalog.Catalog}.
 */
@Evolving
public interface Engine {

  /**
   * Get the connector provided {@link SketchStore}.
   *
   * @return An implementation of {@link SketchStore}.
   */
  SketchStore getSketchStore();
}
