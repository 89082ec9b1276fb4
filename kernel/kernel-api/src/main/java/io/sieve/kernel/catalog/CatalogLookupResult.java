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

package io.sieve.kernel.catalog;

import io.sieve.kernel.annotation.Evolving;
import io.sieve.kernel.exceptions.SieveException;
import java.util.*;

/**
 * The partitions that may hold events matching an expression, newest first, and the partitions
 * whose sketch could not be consulted. The latter are always candidates too.
 */
@Evolving
public final class CatalogLookupResult {
  private final List<UUID> candidates;
  private final Map<UUID, SieveException> errors;

  public CatalogLookupResult(List<UUID> candidates, Map<UUID, SieveException> errors) {
    this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  public List<UUID> getCandidates() {
    return candidates;
  }

  /** @return the failure per partition whose sketch was corrupt or unavailable */
  public Map<UUID, SieveException> getErrors() {
    return errors;
  }

  /** @return whether some candidates were included only because their sketch failed */
  public boolean isDegraded() {
    return !errors.isEmpty();
  }

  @Override
  public String toString() {
    return String.format(
        "CatalogLookupResult{candidates=%s, errors=%s}", candidates, errors.keySet());
  }
}
