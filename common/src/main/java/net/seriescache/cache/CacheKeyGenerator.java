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

import net.seriescache.provider.FetchOptions;

/**
 * Generates the store key for a single fragment of a product.
 *
 * @since 1.0
 */
public interface CacheKeyGenerator {

  /**
   * @param prefix The non-null cache prefix of the provider, may be empty.
   * @param product The non-null product identifier.
   * @param fragment_start The ISO-8601 start time of the fragment.
   * @param options The non-null options of the lookup, for generators that
   * segregate entries per option value.
   * @return A non-null and non-empty key.
   */
  public String name(final String prefix,
                     final String product,
                     final String fragment_start,
                     final FetchOptions options);

}
