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
package net.seriescache.cache;

/**
 * A persistent key to {@link CacheEntry} mapping used by the fragment caches.
 * Eviction and storage are entirely up to the implementation.
 * <p>
 * Implementations should:
 * <ul>
 * <li>Throw {@link IllegalArgumentException} if a key was null or empty.</li>
 * <li>Return copies or immutable entries so that callers can never mutate
 * stored data.</li>
 * <li>Guarantee a consistent snapshot for multi-key reads performed while a
 * {@link CacheTransaction} is open.</li>
 * </ul>
 *
 * @since 1.0
 */
public interface CacheStore {

  /**
   * @param key A non-null and non-empty key.
   * @return The entry or null if the key was not present.
   */
  public CacheEntry get(final String key);

  /**
   * Stores or overwrites the entry under the key.
   * @param key A non-null and non-empty key.
   * @param entry A non-null entry.
   */
  public void set(final String key, final CacheEntry entry);

  /**
   * @param key A non-null and non-empty key.
   * @return True if an entry is stored under the key.
   */
  public boolean contains(final String key);

  /**
   * Opens a scoped transaction. Use with try-with-resources.
   * @return A non-null transaction that must be closed.
   */
  public CacheTransaction transaction();

}
