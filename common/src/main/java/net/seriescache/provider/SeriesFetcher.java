// This file is part of seriescache.
// Copyright (C) 2021-2022  The seriescache Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.seriescache.provider;

import java.time.Instant;

import net.seriescache.data.Series;

/**
 * Fetches a series for a product over a time range from a remote provider.
 * This is the collaborator wrapped by the fragment caches.
 * <p>
 * Implementations are responsible for transport retries, timeouts and
 * cancellation. Failures should be thrown as unchecked exceptions, e.g.
 * {@link net.seriescache.exceptions.FetchException}; the caches never catch
 * them.
 *
 * @since 1.0
 */
public interface SeriesFetcher {

  /**
   * Fetches the data for {@code [start, stop)}. When
   * {@link FetchOptions#ifNewerThan()} is set, implementations should return
   * null unless the provider holds data newer than that version.
   * @param product The non-null product identifier.
   * @param start The non-null inclusive start.
   * @param stop The non-null exclusive stop.
   * @param options The non-null options.
   * @return The series or null if the provider had no (newer) data.
   */
  public Series fetch(final String product,
                      final Instant start,
                      final Instant stop,
                      final FetchOptions options);

}
