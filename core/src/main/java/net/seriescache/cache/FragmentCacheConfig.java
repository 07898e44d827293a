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

import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.ToIntFunction;

import com.google.common.base.Strings;

import net.seriescache.configuration.Config;
import net.seriescache.configuration.ConfigurationException;
import net.seriescache.data.TimeRange.MarginAnchor;
import net.seriescache.data.VersionTag;
import net.seriescache.stats.BlackholeStatsCollector;
import net.seriescache.stats.StatsCollector;

/**
 * Settings shared by the fragment caches. Build one with {@link #newBuilder()},
 * optionally seeding the values from a {@link Config} before overriding them
 * per instance.
 *
 * @since 1.0
 */
public class FragmentCacheConfig {

  /** Version used when no version function was given. */
  public static final VersionTag DEFAULT_VERSION = VersionTag.of(0);

  private final String prefix;
  private final CacheStore store;
  private final CacheKeyGenerator key_generator;
  private final ToIntFunction<String> fragment_hours;
  private final double cache_margins;
  private final MarginAnchor anchor;
  private final Function<String, VersionTag> version;
  private final Duration retention;
  private final Clock clock;
  private final StatsCollector stats;

  protected FragmentCacheConfig(final Builder builder) {
    if (builder.store == null) {
      throw new IllegalArgumentException("Cache store cannot be null.");
    }
    if (builder.cache_margins < 1) {
      throw new IllegalArgumentException("Cache margins must be at least 1, "
          + "got " + builder.cache_margins);
    }
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("Retention cannot be negative.");
    }
    prefix = Strings.nullToEmpty(builder.prefix);
    store = builder.store;
    key_generator = builder.key_generator == null
        ? new DefaultCacheKeyGenerator() : builder.key_generator;
    final int hours = builder.default_fragment_hours;
    fragment_hours = builder.fragment_hours == null
        ? product -> hours : builder.fragment_hours;
    cache_margins = builder.cache_margins;
    anchor = builder.anchor == null ? MarginAnchor.START : builder.anchor;
    version = builder.version == null
        ? product -> DEFAULT_VERSION : builder.version;
    retention = builder.retention;
    clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
    stats = builder.stats == null
        ? BlackholeStatsCollector.INSTANCE : builder.stats;
  }

  /** @return The key prefix, may be empty. */
  public String prefix() {
    return prefix;
  }

  /** @return The store. */
  public CacheStore store() {
    return store;
  }

  /** @return The key generator. */
  public CacheKeyGenerator keyGenerator() {
    return key_generator;
  }

  /** @return The fragment size in hours per product. */
  public ToIntFunction<String> fragmentHours() {
    return fragment_hours;
  }

  /** @return The scaling factor applied before rounding. */
  public double cacheMargins() {
    return cache_margins;
  }

  /** @return The margin anchor. */
  public MarginAnchor anchor() {
    return anchor;
  }

  /** @return The current version per product. */
  public Function<String, VersionTag> version() {
    return version;
  }

  /** @return How long a retention entry is fresh. */
  public Duration retention() {
    return retention;
  }

  /** @return The clock used for retention versions. */
  public Clock clock() {
    return clock;
  }

  /** @return The stats collector. */
  public StatsCollector stats() {
    return stats;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String prefix = "";
    private CacheStore store;
    private CacheKeyGenerator key_generator;
    private int default_fragment_hours = 1;
    private ToIntFunction<String> fragment_hours;
    private double cache_margins = 1.2;
    private MarginAnchor anchor;
    private Function<String, VersionTag> version;
    private Duration retention = Duration.ofDays(14);
    private Clock clock;
    private StatsCollector stats;

    /**
     * Copies the prefix, fragment size, margins, anchor and retention from
     * the config. Call before the per instance setters.
     * @param config A non-null config.
     * @return The builder.
     * @throws ConfigurationException if a value couldn't be parsed.
     */
    public Builder setConfig(final Config config) {
      try {
        if (config.hasProperty(Config.PREFIX_KEY)) {
          prefix = config.getString(Config.PREFIX_KEY);
        }
        if (config.hasProperty(Config.FRAGMENT_HOURS_KEY)) {
          default_fragment_hours = config.getInt(Config.FRAGMENT_HOURS_KEY);
        }
        if (config.hasProperty(Config.MARGINS_KEY)) {
          cache_margins = config.getDouble(Config.MARGINS_KEY);
        }
        if (config.hasProperty(Config.MARGIN_ANCHOR_KEY)) {
          anchor = MarginAnchor.valueOf(
              config.getString(Config.MARGIN_ANCHOR_KEY).trim().toUpperCase());
        }
      } catch (IllegalArgumentException e) {
        // NumberFormatException is an IllegalArgumentException
        throw new ConfigurationException("Invalid cache configuration: "
            + e.getMessage(), e);
      }
      if (config.hasProperty(Config.RETENTION_KEY)) {
        retention = Duration.ofMillis(config.getDurationMs(Config.RETENTION_KEY));
      }
      return this;
    }

    public Builder setPrefix(final String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder setStore(final CacheStore store) {
      this.store = store;
      return this;
    }

    public Builder setKeyGenerator(final CacheKeyGenerator key_generator) {
      this.key_generator = key_generator;
      return this;
    }

    /**
     * @param fragment_hours The fragment size in hours for every product.
     * @return The builder.
     */
    public Builder setFragmentHours(final int fragment_hours) {
      this.default_fragment_hours = fragment_hours;
      this.fragment_hours = null;
      return this;
    }

    /**
     * @param fragment_hours A function returning the fragment size in hours
     * for a product.
     * @return The builder.
     */
    public Builder setFragmentHours(final ToIntFunction<String> fragment_hours) {
      this.fragment_hours = fragment_hours;
      return this;
    }

    public Builder setCacheMargins(final double cache_margins) {
      this.cache_margins = cache_margins;
      return this;
    }

    public Builder setAnchor(final MarginAnchor anchor) {
      this.anchor = anchor;
      return this;
    }

    public Builder setVersion(final Function<String, VersionTag> version) {
      this.version = version;
      return this;
    }

    public Builder setRetention(final Duration retention) {
      this.retention = retention;
      return this;
    }

    public Builder setClock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder setStatsCollector(final StatsCollector stats) {
      this.stats = stats;
      return this;
    }

    public FragmentCacheConfig build() {
      return new FragmentCacheConfig(this);
    }
  }
}
