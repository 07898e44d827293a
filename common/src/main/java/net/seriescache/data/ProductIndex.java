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
package net.seriescache.data;

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * A node from a provider inventory describing a single product (parameter).
 * Caches key their fragments on the {@link #uid()}.
 *
 * @since 1.0
 */
public class ProductIndex {

  /** The human readable name. */
  protected final String name;

  /** The provider this product belongs to. */
  protected final String provider;

  /** The provider unique identifier. */
  protected final String uid;

  /** Extra inventory metadata. */
  protected final Map<String, Object> meta;

  /**
   * Default ctor.
   * @param name An optional display name.
   * @param provider An optional provider name.
   * @param uid A non-null and non-empty unique identifier.
   * @param meta Optional inventory metadata.
   * @throws IllegalArgumentException if the uid was null or empty.
   */
  public ProductIndex(final String name,
                      final String provider,
                      final String uid,
                      final Map<String, Object> meta) {
    if (Strings.isNullOrEmpty(uid)) {
      throw new IllegalArgumentException("UID cannot be null or empty.");
    }
    this.name = name;
    this.provider = provider;
    this.uid = uid;
    this.meta = meta == null ? Collections.<String, Object>emptyMap()
        : ImmutableMap.copyOf(meta);
  }

  public String name() {
    return name;
  }

  public String provider() {
    return provider;
  }

  public String uid() {
    return uid;
  }

  public Map<String, Object> meta() {
    return meta;
  }

  /**
   * Resolves the product identifier used for cache keys and fetches.
   * @param product Either a string identifier or a {@link ProductIndex}.
   * @return The non-null identifier.
   * @throws IllegalArgumentException if the product was null, empty or of an
   * unsupported type.
   */
  public static String productName(final Object product) {
    if (product instanceof String) {
      if (((String) product).isEmpty()) {
        throw new IllegalArgumentException("Product cannot be empty.");
      }
      return (String) product;
    }
    if (product instanceof ProductIndex) {
      return ((ProductIndex) product).uid();
    }
    throw new IllegalArgumentException("Product must either be a String or a "
        + "ProductIndex, got " + (product == null ? "null"
            : product.getClass().getName()));
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("name=")
        .append(name)
        .append(", provider=")
        .append(provider)
        .append(", uid=")
        .append(uid)
        .toString();
  }
}
