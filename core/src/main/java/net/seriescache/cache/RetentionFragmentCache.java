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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;
import net.seriescache.provider.FetchOptions;
import net.seriescache.provider.SeriesFetcher;
import net.seriescache.utils.Pair;

/**
 * A fragment cache for providers whose data may change at any time. Entries
 * are versioned with their write time in epoch milliseconds. An entry younger
 * than the retention is used as is. Older entries are revalidated one
 * fragment at a time with a conditional fetch: when the provider has nothing
 * newer, the entry's version is bumped to now and its payload reused,
 * otherwise the new data replaces it. Absent fragments are fetched in
 * contiguous runs.
 *
 * @since 1.0
 */
public class RetentionFragmentCache extends AbstractFragmentCache {
  private static final Logger LOG = LoggerFactory.getLogger(
      RetentionFragmentCache.class);

  /**
   * Default ctor.
   * @param config A non-null config. The retention and clock are used.
   * @param fetcher A non-null fetcher.
   */
  public RetentionFragmentCache(final FragmentCacheConfig config,
                                final SeriesFetcher fetcher) {
    super(config, fetcher);
  }

  @Override
  protected List<Series> lookupFragments(final String product,
                                         final FragmentPlan plan,
                                         final FetchOptions options) {
    final VersionTag now = VersionTag.ofEpochMillis(config.clock().millis());
    final long retention_ms = config.retention().toMillis();
    final List<CacheEntry> entries = readEntries(product, plan.starts(), options);

    final List<Series> chunks = Lists.newArrayList();
    final List<Instant> missing = Lists.newArrayList();
    final List<Pair<Instant, CacheEntry>> maybe_stale = Lists.newArrayList();
    for (int i = 0; i < entries.size(); i++) {
      final CacheEntry entry = entries.get(i);
      if (entry == null) {
        missing.add(plan.starts().get(i));
      } else if (entry.version() == null
          || now.value() - entry.version().value() < retention_ms) {
        chunks.add(entry.payload());
      } else {
        maybe_stale.add(new Pair<Instant, CacheEntry>(plan.starts().get(i), entry));
      }
    }
    config.stats().incrementCounter(FRAGMENTS_HIT, chunks.size(), NULL_TAGS);
    config.stats().incrementCounter(FRAGMENTS_MISS, missing.size(), NULL_TAGS);

    final Duration duration = plan.fragmentDuration();
    for (final List<Instant> run : FragmentPlanner.groupContiguous(missing, duration)) {
      final Series data = fetchRun(product, run, duration, now, options);
      if (data != null) {
        chunks.add(data);
      }
    }

    for (final Pair<Instant, CacheEntry> stale : maybe_stale) {
      chunks.add(revalidate(product, stale.getKey(), stale.getValue(),
          duration, now, options));
    }
    return chunks;
  }

  /**
   * Conditionally re-fetches a single fragment.
   * @return The new data or the cached payload if nothing changed.
   */
  private Series revalidate(final String product,
                            final Instant fragment,
                            final CacheEntry entry,
                            final Duration duration,
                            final VersionTag now,
                            final FetchOptions options) {
    config.stats().incrementCounter(FETCHES, NULL_TAGS);
    final Series data = fetcher.fetch(product, fragment, fragment.plus(duration),
        options.withoutCacheFlags().withIfNewerThan(entry.version()));
    if (data == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Fragment " + fragment + " of " + product
            + " unchanged since " + entry.version());
      }
      config.stats().incrementCounter(FRAGMENTS_REVALIDATED, NULL_TAGS);
      setEntry(product, fragment, entry.withVersion(now), options);
      return entry.payload();
    }
    addToCache(product, data, Collections.singletonList(fragment), duration,
        now, options);
    return data;
  }

}
