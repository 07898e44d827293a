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

import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import net.seriescache.configuration.ConfigurationException;
import net.seriescache.data.VersionTag;

/**
 * Options for a single lookup. The cache flags are consumed by the fragment
 * caches while the remaining options are forwarded untouched to the
 * {@link SeriesFetcher}.
 * <p>
 * Options are validated when built: only the names in {@link #CACHE_OPTIONS}
 * plus the extra names declared on the builder are accepted. Anything else
 * throws a {@link ConfigurationException}.
 *
 * @since 1.0
 */
public final class FetchOptions {

  /** Bypasses the cache entirely. */
  public static final String DISABLE_CACHE = "disable_cache";

  /** Forwarded to fetchers that can go through a proxy. */
  public static final String DISABLE_PROXY = "disable_proxy";

  /** Only return data newer than the given version. Set by the caches. */
  public static final String IF_NEWER_THAN = "if_newer_than";

  /** The option names always accepted. */
  public static final Set<String> CACHE_OPTIONS =
      ImmutableSet.of(DISABLE_CACHE, DISABLE_PROXY);

  /** Options with every flag cleared. */
  public static final FetchOptions DEFAULT = newBuilder().build();

  private final boolean disable_cache;
  private final boolean disable_proxy;
  private final VersionTag if_newer_than;
  private final Map<String, Object> extras;

  private FetchOptions(final Builder builder) {
    disable_cache = builder.disable_cache;
    disable_proxy = builder.disable_proxy;
    if_newer_than = builder.if_newer_than;
    extras = builder.extras == null ? Collections.<String, Object>emptyMap()
        : ImmutableMap.copyOf(builder.extras);
  }

  /** @return Whether or not to bypass the cache. */
  public boolean disableCache() {
    return disable_cache;
  }

  /** @return Whether or not the fetcher should skip any proxy. */
  public boolean disableProxy() {
    return disable_proxy;
  }

  /** @return The version the provider data must be newer than, may be null. */
  public VersionTag ifNewerThan() {
    return if_newer_than;
  }

  /** @return The non-null, immutable pass-through options. */
  public Map<String, Object> extras() {
    return extras;
  }

  /**
   * @param name A non-null option name.
   * @return The pass-through option value or null if not set.
   */
  public Object option(final String name) {
    return extras.get(name);
  }

  /**
   * @param name A non-null option name.
   * @param default_value The value returned if the option wasn't set.
   * @return The option value or the default.
   */
  public Object option(final String name, final Object default_value) {
    final Object value = extras.get(name);
    return value == null ? default_value : value;
  }

  /**
   * @param version The version to compare against, may be null.
   * @return A copy of these options for a conditional fetch.
   */
  public FetchOptions withIfNewerThan(final VersionTag version) {
    return toBuilder().setIfNewerThan(version).build();
  }

  /** @return A copy of these options with the cache flag cleared, as
   * forwarded to the fetcher. */
  public FetchOptions withoutCacheFlags() {
    if (!disable_cache) {
      return this;
    }
    return toBuilder().setDisableCache(false).build();
  }

  /** @return A builder pre-populated with these options and accepting any of
   * the current pass-through option names. */
  public Builder toBuilder() {
    final Builder builder = new Builder(extras.keySet());
    builder.disable_cache = disable_cache;
    builder.disable_proxy = disable_proxy;
    builder.if_newer_than = if_newer_than;
    if (!extras.isEmpty()) {
      builder.extras = Maps.newHashMap(extras);
    }
    return builder;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FetchOptions)) {
      return false;
    }
    final FetchOptions other = (FetchOptions) o;
    return disable_cache == other.disable_cache
        && disable_proxy == other.disable_proxy
        && Objects.equals(if_newer_than, other.if_newer_than)
        && extras.equals(other.extras);
  }

  @Override
  public int hashCode() {
    return Objects.hash(disable_cache, disable_proxy, if_newer_than, extras);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("disable_cache=")
        .append(disable_cache)
        .append(", disable_proxy=")
        .append(disable_proxy)
        .append(", ").append(IF_NEWER_THAN).append("=")
        .append(if_newer_than)
        .append(", extras=")
        .append(extras)
        .toString();
  }

  /**
   * @param extra_options Pass-through option names accepted in addition to
   * {@link #CACHE_OPTIONS}.
   * @return A new builder.
   */
  public static Builder newBuilder(final String... extra_options) {
    return new Builder(ImmutableSet.copyOf(extra_options));
  }

  /**
   * Validates a loosely typed option map at a call boundary.
   * @param options An optional map of option names to values.
   * @param extra_options Pass-through option names accepted in addition to
   * {@link #CACHE_OPTIONS}.
   * @return The parsed options.
   * @throws ConfigurationException if an option name was not allowed or a
   * flag value was not a boolean.
   */
  public static FetchOptions fromMap(final Map<String, ?> options,
                                     final String... extra_options) {
    final Builder builder = newBuilder(extra_options);
    if (options != null) {
      for (final Entry<String, ?> entry : options.entrySet()) {
        builder.setOption(entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  public static class Builder {
    private final Set<String> allowed;
    private boolean disable_cache;
    private boolean disable_proxy;
    private VersionTag if_newer_than;
    private Map<String, Object> extras;

    Builder(final Set<String> allowed) {
      this.allowed = allowed;
    }

    public Builder setDisableCache(final boolean disable_cache) {
      this.disable_cache = disable_cache;
      return this;
    }

    public Builder setDisableProxy(final boolean disable_proxy) {
      this.disable_proxy = disable_proxy;
      return this;
    }

    public Builder setIfNewerThan(final VersionTag if_newer_than) {
      this.if_newer_than = if_newer_than;
      return this;
    }

    /**
     * Sets an option by name.
     * @param name A non-null and non-empty option name.
     * @param value The value. Flags must be booleans.
     * @return The builder.
     * @throws ConfigurationException if the name wasn't allowed or a flag
     * value wasn't a boolean.
     */
    public Builder setOption(final String name, final Object value) {
      if (Strings.isNullOrEmpty(name)) {
        throw new ConfigurationException("Option name cannot be null or empty.");
      }
      if (name.equals(DISABLE_CACHE)) {
        disable_cache = flag(name, value);
      } else if (name.equals(DISABLE_PROXY)) {
        disable_proxy = flag(name, value);
      } else if (allowed.contains(name)) {
        if (extras == null) {
          extras = Maps.newHashMap();
        }
        if (value == null) {
          extras.remove(name);
        } else {
          extras.put(name, value);
        }
      } else {
        throw new ConfigurationException("Unexpected option '" + name
            + "'. Allowed options: " + CACHE_OPTIONS + " and " + allowed);
      }
      return this;
    }

    public FetchOptions build() {
      return new FetchOptions(this);
    }

    private static boolean flag(final String name, final Object value) {
      if (value instanceof Boolean) {
        return (Boolean) value;
      }
      throw new ConfigurationException("Option '" + name
          + "' must be a boolean, got " + value);
    }
  }
}
