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

import com.google.common.base.Strings;

import net.seriescache.provider.FetchOptions;

/**
 * Generates keys in the form {@code prefix/product/fragment_start}. When the
 * prefix is empty the leading separator is still present so that keys from
 * different prefixes never collide.
 *
 * @since 1.0
 */
public class DefaultCacheKeyGenerator implements CacheKeyGenerator {

  /** The separator between key components. */
  public static final char SEPARATOR = '/';

  @Override
  public String name(final String prefix,
                     final String product,
                     final String fragment_start,
                     final FetchOptions options) {
    if (Strings.isNullOrEmpty(product)) {
      throw new IllegalArgumentException("Product cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(fragment_start)) {
      throw new IllegalArgumentException("Fragment start cannot be null or empty.");
    }
    return new StringBuilder()
        .append(Strings.nullToEmpty(prefix))
        .append(SEPARATOR)
        .append(product)
        .append(SEPARATOR)
        .append(fragment_start)
        .toString();
  }

}
