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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.seriescache.data.ProductIndex;
import net.seriescache.data.Series;
import net.seriescache.data.SeriesMerger;
import net.seriescache.data.TimeRange;
import net.seriescache.data.VersionTag;
import net.seriescache.provider.FetchOptions;
import net.seriescache.provider.SeriesFetcher;
import net.seriescache.utils.DateTime;

/**
 * Base for the fragment caches sitting in front of a {@link SeriesFetcher}.
 * <p>
 * A lookup is planned into fragments, the fragments are read from the store
 * within a single transaction and the implementation decides which ones must
 * be fetched. Fetched data is sliced back into fragments and written to the
 * store outside of the transaction, one write per fragment. Every collected
 * chunk is then merged and trimmed to the requested range.
 * <p>
 * Fetcher exceptions are not caught. A null result from the fetcher is a gap
 * in the data.
 *
 * @since 1.0
 */
public abstract class AbstractFragmentCache {
  private static final Logger LOG = LoggerFactory.getLogger(
      AbstractFragmentCache.class);

  public static final String FRAGMENTS_HIT = "cache.fragments.hit";
  public static final String FRAGMENTS_MISS = "cache.fragments.miss";
  public static final String FRAGMENTS_REVALIDATED = "cache.fragments.revalidated";
  public static final String FRAGMENTS_CACHED = "cache.fragments.cached";
  public static final String FETCHES = "cache.fetches";
  public static final String BYPASS = "cache.bypass";
  public static final String[] NULL_TAGS = (String[]) null;

  /** The settings. */
  protected final FragmentCacheConfig config;

  /** Where missing data comes from. */
  protected final SeriesFetcher fetcher;

  /** Cuts lookups into fragments. */
  protected final FragmentPlanner planner;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param fetcher A non-null fetcher.
   */
  protected AbstractFragmentCache(final FragmentCacheConfig config,
                                  final SeriesFetcher fetcher) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (fetcher == null) {
      throw new IllegalArgumentException("Fetcher cannot be null.");
    }
    this.config = config;
    this.fetcher = fetcher;
    planner = new FragmentPlanner(config.fragmentHours(),
        config.cacheMargins(), config.anchor());
  }

  /**
   * Looks up data with the default options.
   * @see #lookup(Object, Instant, Instant, FetchOptions)
   */
  public Series lookup(final Object product,
                       final Instant start,
                       final Instant stop) {
    return lookup(product, start, stop, FetchOptions.DEFAULT);
  }

  /**
   * Returns the product data within {@code [start, stop)}, served from the
   * store where possible.
   * @param product A non-null product name or {@link ProductIndex}.
   * @param start The non-null inclusive start.
   * @param stop The non-null exclusive stop, not before the start.
   * @param options Non-null options. When caching is disabled the fetcher is
   * called directly over the requested range and the store isn't touched.
   * @return The data, possibly empty, or null if nothing was found.
   * @throws IllegalArgumentException if the product type or range was
   * invalid.
   */
  public Series lookup(final Object product,
                       final Instant start,
                       final Instant stop,
                       final FetchOptions options) {
    final String product_name = ProductIndex.productName(product);
    final TimeRange range = new TimeRange(start, stop);
    final FetchOptions fetch_options = options == null
        ? FetchOptions.DEFAULT : options;
    if (fetch_options.disableCache()) {
      config.stats().incrementCounter(BYPASS, NULL_TAGS);
      return fetcher.fetch(product_name, start, stop,
          fetch_options.withoutCacheFlags());
    }

    final FragmentPlan plan = planner.plan(product_name, range);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Planned " + plan.starts().size() + " fragments for "
          + product_name + " over [" + range + "]");
    }
    final List<Series> chunks = lookupFragments(product_name, plan,
        fetch_options);
    if (chunks.isEmpty()) {
      return null;
    }
    final Series merged = SeriesMerger.merge(chunks);
    if (merged == null) {
      return null;
    }
    return merged.slice(start, stop);
  }

  /**
   * Resolves every planned fragment, from the store or the fetcher.
   * @param product The non-null product name.
   * @param plan The non-null plan.
   * @param options The non-null options.
   * @return A non-null, possibly empty list of chunks to merge.
   */
  protected abstract List<Series> lookupFragments(final String product,
                                                  final FragmentPlan plan,
                                                  final FetchOptions options);

  /** @return The underlying store. */
  public CacheStore cacheStore() {
    return config.store();
  }

  /** @return The settings. */
  public FragmentCacheConfig config() {
    return config;
  }

  /**
   * Reads the entries for every fragment within a single transaction.
   * @param product The product name.
   * @param fragments The fragment starts.
   * @param options The options for the key generator.
   * @return A list of entries aligned with the fragments, null where absent.
   */
  protected List<CacheEntry> readEntries(final String product,
                                         final List<Instant> fragments,
                                         final FetchOptions options) {
    final List<CacheEntry> entries = Lists.newArrayListWithCapacity(
        fragments.size());
    try (final CacheTransaction tx = config.store().transaction()) {
      for (final Instant fragment : fragments) {
        entries.add(getEntry(product, fragment, options));
      }
    }
    return entries;
  }

  /**
   * @return The entry for a single fragment or null if absent.
   */
  protected CacheEntry getEntry(final String product,
                                final Instant fragment,
                                final FetchOptions options) {
    final String key = key(product, fragment, options);
    final CacheEntry entry = config.store().get(key);
    if (LOG.isDebugEnabled()) {
      LOG.debug((entry == null ? "Miss for key [" : "Found key [") + key + "]");
    }
    return entry;
  }

  /**
   * Writes the entry for a single fragment.
   */
  protected void setEntry(final String product,
                          final Instant fragment,
                          final CacheEntry entry,
                          final FetchOptions options) {
    final String key = key(product, fragment, options);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Writing key [" + key + "] with version " + entry.version());
    }
    config.store().set(key, entry);
  }

  /**
   * Fetches a run of adjacent fragments with a single call and caches the
   * result per fragment.
   * @param product The product name.
   * @param run The non-empty, ordered fragment starts.
   * @param duration The fragment duration.
   * @param version The version to store the fragments with.
   * @param options The options of the lookup.
   * @return The fetched data or null if the fetcher returned nothing.
   */
  protected Series fetchRun(final String product,
                            final List<Instant> run,
                            final Duration duration,
                            final VersionTag version,
                            final FetchOptions options) {
    final Instant start = run.get(0);
    final Instant stop = run.get(run.size() - 1).plus(duration);
    config.stats().incrementCounter(FETCHES, NULL_TAGS);
    final Series data = fetcher.fetch(product, start, stop,
        options.withoutCacheFlags());
    if (data == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No data for " + product + " over [" + start + ", "
            + stop + ")");
      }
      return null;
    }
    addToCache(product, data, run, duration, version, options);
    return data;
  }

  /**
   * Slices the data on fragment boundaries and stores every slice, including
   * empty ones so that known gaps aren't fetched again.
   */
  protected void addToCache(final String product,
                            final Series data,
                            final List<Instant> fragments,
                            final Duration duration,
                            final VersionTag version,
                            final FetchOptions options) {
    for (final Instant fragment : fragments) {
      setEntry(product, fragment,
          new CacheEntry(data.slice(fragment, fragment.plus(duration)), version),
          options);
    }
    config.stats().incrementCounter(FRAGMENTS_CACHED, fragments.size(),
        NULL_TAGS);
  }

  private String key(final String product,
                     final Instant fragment,
                     final FetchOptions options) {
    return config.keyGenerator().name(config.prefix(), product,
        DateTime.isoFormat(fragment), options);
  }
}
