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
 * Converts cache entries to and from bytes for stores that persist raw
 * values.
 *
 * @since 1.0
 */
public interface CacheEntrySerdes {

  /**
   * @param entry A non-null entry.
   * @return A non-null byte array.
   */
  public byte[] serialize(final CacheEntry entry);

  /**
   * @param data A non-null byte array as produced by {@link #serialize}.
   * @return The entry.
   * @throws IllegalArgumentException if the data could not be parsed.
   */
  public CacheEntry deserialize(final byte[] data);

}
