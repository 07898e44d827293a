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
 * Generates keys in the form {@code prefix/product/option_value/fragment_start}
 * for providers that serve different data for the same product depending on
 * an extra fetch option, e.g. a coordinate system. Lookups without the option
 * use the default value.
 *
 * @since 1.0
 */
public class OptionCacheKeyGenerator implements CacheKeyGenerator {

  /** The name of the option segregating entries. */
  private final String option_name;

  /** The value used when the lookup doesn't carry the option. */
  private final String default_value;

  /**
   * Default ctor.
   * @param option_name The non-null and non-empty option name.
   * @param default_value The non-null and non-empty default value.
   */
  public OptionCacheKeyGenerator(final String option_name,
                                 final String default_value) {
    if (Strings.isNullOrEmpty(option_name)) {
      throw new IllegalArgumentException("Option name cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(default_value)) {
      throw new IllegalArgumentException("Default value cannot be null or empty.");
    }
    this.option_name = option_name;
    this.default_value = default_value;
  }

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
    final Object value = options == null ? null
        : options.option(option_name, default_value);
    return new StringBuilder()
        .append(Strings.nullToEmpty(prefix))
        .append(DefaultCacheKeyGenerator.SEPARATOR)
        .append(product)
        .append(DefaultCacheKeyGenerator.SEPARATOR)
        .append(value == null ? default_value : value.toString())
        .append(DefaultCacheKeyGenerator.SEPARATOR)
        .append(fragment_start)
        .toString();
  }

  /** @return The option name. */
  public String optionName() {
    return option_name;
  }
}
