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

import net.seriescache.utils.JSON;

/**
 * Serializes entries as UTF-8 JSON through the shared Jackson mapper. NaN
 * samples survive the round trip.
 *
 * @since 1.0
 */
public class JsonCacheEntrySerdes implements CacheEntrySerdes {

  @Override
  public byte[] serialize(final CacheEntry entry) {
    if (entry == null) {
      throw new IllegalArgumentException("Entry cannot be null.");
    }
    return JSON.serializeToBytes(entry);
  }

  @Override
  public CacheEntry deserialize(final byte[] data) {
    if (data == null || data.length < 1) {
      throw new IllegalArgumentException("Data cannot be null or empty.");
    }
    return JSON.parseToObject(data, CacheEntry.class);
  }

}
