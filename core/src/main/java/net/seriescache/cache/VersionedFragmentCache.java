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

import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;
import net.seriescache.provider.FetchOptions;
import net.seriescache.provider.SeriesFetcher;

/**
 * A fragment cache for providers exposing a version per product, e.g. a
 * data release number. A cached fragment is used as long as its version is
 * unset or at least the product's current version. Older and absent fragments
 * are fetched in contiguous runs and stored with the current version.
 *
 * @since 1.0
 */
public class VersionedFragmentCache extends AbstractFragmentCache {
  private static final Logger LOG = LoggerFactory.getLogger(
      VersionedFragmentCache.class);

  /**
   * Default ctor.
   * @param config A non-null config. The version function is used.
   * @param fetcher A non-null fetcher.
   */
  public VersionedFragmentCache(final FragmentCacheConfig config,
                                final SeriesFetcher fetcher) {
    super(config, fetcher);
  }

  @Override
  protected List<Series> lookupFragments(final String product,
                                         final FragmentPlan plan,
                                         final FetchOptions options) {
    final VersionTag version = config.version().apply(product);
    final List<CacheEntry> entries = readEntries(product, plan.starts(), options);

    final List<Series> chunks = Lists.newArrayList();
    final List<Instant> missing = Lists.newArrayList();
    for (int i = 0; i < entries.size(); i++) {
      final CacheEntry entry = entries.get(i);
      if (entry != null && VersionTag.isUpToDate(entry.version(), version)) {
        chunks.add(entry.payload());
        continue;
      }
      if (entry != null && LOG.isDebugEnabled()) {
        LOG.debug("Outdated fragment " + plan.starts().get(i) + " of "
            + product + ": " + entry.version() + " < " + version);
      }
      missing.add(plan.starts().get(i));
    }
    config.stats().incrementCounter(FRAGMENTS_HIT, chunks.size(), NULL_TAGS);
    config.stats().incrementCounter(FRAGMENTS_MISS, missing.size(), NULL_TAGS);

    final Duration duration = plan.fragmentDuration();
    for (final List<Instant> run : FragmentPlanner.groupContiguous(missing, duration)) {
      final Series data = fetchRun(product, run, duration, version, options);
      if (data != null) {
        chunks.add(data);
      }
    }
    return chunks;
  }

}
