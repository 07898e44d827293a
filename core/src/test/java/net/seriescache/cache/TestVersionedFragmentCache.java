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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.Before;
import org.junit.Test;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.seriescache.data.MockSeries;
import net.seriescache.data.ProductIndex;
import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;
import net.seriescache.exceptions.FetchException;
import net.seriescache.provider.FetchOptions;
import net.seriescache.provider.SeriesFetcher;

public class TestVersionedFragmentCache {
  private static final String PRODUCT = "ace/mag";
  private static final Instant DAY = Instant.parse("2021-01-08T00:00:00Z");

  private GuavaCacheStore store;
  private SeriesFetcher fetcher;
  private AtomicLong version;
  private CountingStatsCollector stats;

  private static Instant hours(final int hours) {
    return DAY.plus(Duration.ofHours(hours));
  }

  @Before
  public void before() throws Exception {
    store = new GuavaCacheStore();
    version = new AtomicLong(1);
    stats = new CountingStatsCollector();
    fetcher = mock(SeriesFetcher.class);
    when(fetcher.fetch(anyString(), any(Instant.class), any(Instant.class),
        any(FetchOptions.class))).thenAnswer(new Answer<Series>() {
          @Override
          public Series answer(final InvocationOnMock invocation) throws Throwable {
            return MockSeries.minutes((Instant) invocation.getArguments()[1],
                (Instant) invocation.getArguments()[2]);
          }
        });
  }

  private FragmentCacheConfig.Builder config(final int fragment_hours) {
    return FragmentCacheConfig.newBuilder()
        .setStore(store)
        .setFragmentHours(fragment_hours)
        .setVersion(product -> VersionTag.of(version.get()))
        .setStatsCollector(stats);
  }

  private static void assertContiguousMinutes(final Series series,
                                              final Instant start,
                                              final Instant stop) {
    final long expected = Duration.between(start, stop).toMinutes();
    assertEquals(expected, series.size());
    for (int i = 0; i < series.size(); i++) {
      assertEquals(Series.toEpochNanos(start.plusSeconds(60L * i)),
          series.timestamps()[i]);
      assertEquals(start.getEpochSecond() + 60L * i, series.values()[i][0], 0.0);
    }
  }

  @Test
  public void lookupThenServedFromCache() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    final Series first = cache.lookup(PRODUCT, hours(1), hours(10));
    assertContiguousMinutes(first, hours(1), hours(10));
    verify(fetcher, times(1)).fetch(PRODUCT, DAY, hours(24), FetchOptions.DEFAULT);
    assertTrue(store.contains("/ace/mag/2021-01-08T00:00:00+00:00"));

    final Series second = cache.lookup(PRODUCT, hours(1), hours(10));
    assertEquals(first, second);
    verify(fetcher, times(1)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));

    assertEquals(1, stats.get(AbstractFragmentCache.FRAGMENTS_HIT));
    assertEquals(1, stats.get(AbstractFragmentCache.FRAGMENTS_MISS));
    assertEquals(1, stats.get(AbstractFragmentCache.FETCHES));
    assertEquals(1, stats.get(AbstractFragmentCache.FRAGMENTS_CACHED));
  }

  @Test
  public void metaTypesSurviveTheStore() throws Exception {
    final Map<String, Object> meta = Maps.newLinkedHashMap();
    meta.put(Series.FILL_VALUE_KEY, -1e31f);
    meta.put("DEPEND_N", 3L);
    meta.put("BINS", new double[] { 10, 20, 30 });
    final Series day = MockSeries.minutes(DAY, hours(24));
    doReturn(new Series(day.timestamps(), day.values(), meta, day.columns(),
        null, null)).when(fetcher).fetch(anyString(), any(Instant.class),
            any(Instant.class), any(FetchOptions.class));

    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    final Series first = cache.lookup(PRODUCT, hours(1), hours(10));
    final Series second = cache.lookup(PRODUCT, hours(1), hours(10));
    verify(fetcher, times(1)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    for (final String key : meta.keySet()) {
      assertEquals(first.meta().get(key).getClass(),
          second.meta().get(key).getClass());
    }
    assertEquals(Integer.valueOf(3), second.meta().get("DEPEND_N"));
    assertEquals(ImmutableList.of(10.0, 20.0, 30.0),
        (List<?>) second.meta().get("BINS"));
  }

  @Test
  public void partialHitsFetchContiguousRuns() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(1).build(), fetcher);
    cache.lookup(PRODUCT, hours(1), hours(3));
    verify(fetcher).fetch(eq(PRODUCT), eq(hours(1)), eq(hours(4)),
        any(FetchOptions.class));
    cache.lookup(PRODUCT, hours(5), hours(6));
    verify(fetcher).fetch(eq(PRODUCT), eq(hours(5)), eq(hours(7)),
        any(FetchOptions.class));

    // fragments 01 to 08, 04, 07 and 08 are missing
    final Series series = cache.lookup(PRODUCT, hours(1), hours(7));
    verify(fetcher).fetch(eq(PRODUCT), eq(hours(4)), eq(hours(5)),
        any(FetchOptions.class));
    verify(fetcher).fetch(eq(PRODUCT), eq(hours(7)), eq(hours(9)),
        any(FetchOptions.class));
    verify(fetcher, times(4)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
    assertContiguousMinutes(series, hours(1), hours(7));
  }

  @Test
  public void newerVersionRefetches() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    cache.lookup(PRODUCT, hours(1), hours(10));
    cache.lookup(PRODUCT, hours(1), hours(10));
    verify(fetcher, times(1)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));

    version.set(2);
    final Series series = cache.lookup(PRODUCT, hours(1), hours(10));
    assertContiguousMinutes(series, hours(1), hours(10));
    verify(fetcher, times(2)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
    assertEquals(VersionTag.of(2),
        store.get("/ace/mag/2021-01-08T00:00:00+00:00").version());

    // an older wanted version is satisfied by the newer entry
    version.set(1);
    cache.lookup(PRODUCT, hours(1), hours(10));
    verify(fetcher, times(2)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void unversionedEntryAlwaysHit() throws Exception {
    store.set("/ace/mag/2021-01-08T00:00:00+00:00",
        new CacheEntry(MockSeries.minutes(DAY, hours(24)), null));
    version.set(42);
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    final Series series = cache.lookup(PRODUCT, hours(1), hours(10));
    assertContiguousMinutes(series, hours(1), hours(10));
    verify(fetcher, never()).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void disableCache() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    final Series series = cache.lookup(PRODUCT, hours(1), hours(10),
        FetchOptions.newBuilder().setDisableCache(true).build());
    assertContiguousMinutes(series, hours(1), hours(10));
    verify(fetcher, times(1)).fetch(PRODUCT, hours(1), hours(10),
        FetchOptions.DEFAULT);
    assertEquals(0, store.size());
    assertEquals(1, stats.get(AbstractFragmentCache.BYPASS));
  }

  @Test
  public void fetcherExceptionPropagates() throws Exception {
    doThrow(new FetchException("Boom", 503)).when(fetcher).fetch(anyString(),
        any(Instant.class), any(Instant.class), any(FetchOptions.class));
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    try {
      cache.lookup(PRODUCT, hours(1), hours(10));
      fail("Expected FetchException");
    } catch (FetchException e) {
      assertEquals(503, e.getStatusCode());
    }
    assertEquals(0, store.size());
  }

  @Test
  public void nullFromFetcherIsAGap() throws Exception {
    doReturn(null).when(fetcher).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    assertNull(cache.lookup(PRODUCT, hours(1), hours(10)));
    assertEquals(0, store.size());
    assertNull(cache.lookup(PRODUCT, hours(1), hours(10)));
    verify(fetcher, times(2)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void emptyDataIsCached() throws Exception {
    doReturn(Series.newBuilder().setColumns(MockSeries.COLUMN).build())
        .when(fetcher).fetch(anyString(), any(Instant.class),
            any(Instant.class), any(FetchOptions.class));
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    Series series = cache.lookup(PRODUCT, hours(1), hours(10));
    assertNotNull(series);
    assertTrue(series.isEmpty());
    assertEquals(1, store.size());

    series = cache.lookup(PRODUCT, hours(1), hours(10));
    assertTrue(series.isEmpty());
    assertEquals(ImmutableList.of(MockSeries.COLUMN), series.columns());
    verify(fetcher, times(1)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void emptyRange() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(1).build(), fetcher);
    assertNull(cache.lookup(PRODUCT, hours(3), hours(3)));
    verify(fetcher, never()).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void productIndex() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    cache.lookup(new ProductIndex("mag", "ace", PRODUCT, null),
        hours(1), hours(10));
    cache.lookup(PRODUCT, hours(1), hours(10));
    verify(fetcher, times(1)).fetch(eq(PRODUCT), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
  }

  @Test
  public void badArguments() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24).build(), fetcher);
    try {
      cache.lookup(42, hours(1), hours(10));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      cache.lookup(PRODUCT, hours(10), hours(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new VersionedFragmentCache(config(24).build(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void prefixAndOptionKeys() throws Exception {
    final VersionedFragmentCache cache = new VersionedFragmentCache(
        config(24)
          .setPrefix("amda")
          .setKeyGenerator(new OptionCacheKeyGenerator("coordinate_system", "gse"))
          .build(), fetcher);
    cache.lookup(PRODUCT, hours(1), hours(10));
    cache.lookup(PRODUCT, hours(1), hours(10),
        FetchOptions.newBuilder("coordinate_system")
          .setOption("coordinate_system", "gsm")
          .build());
    cache.lookup(PRODUCT, hours(1), hours(10),
        FetchOptions.newBuilder("coordinate_system")
          .setOption("coordinate_system", "gse")
          .build());
    verify(fetcher, times(2)).fetch(anyString(), any(Instant.class),
        any(Instant.class), any(FetchOptions.class));
    assertTrue(store.contains("amda/ace/mag/gse/2021-01-08T00:00:00+00:00"));
    assertTrue(store.contains("amda/ace/mag/gsm/2021-01-08T00:00:00+00:00"));
    assertSame(store, cache.cacheStore());
  }
}
