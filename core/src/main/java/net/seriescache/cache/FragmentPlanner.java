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
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.ToIntFunction;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;

import net.seriescache.data.TimeRange;
import net.seriescache.data.TimeRange.MarginAnchor;

/**
 * Cuts a requested range into fixed size, time aligned fragments.
 * <p>
 * The requested range is first scaled by the cache margins to pre-fetch some
 * context around it. The scaled start is then rounded down to the last
 * fragment boundary of its day and the scaled stop is rounded up so that a
 * partial trailing fragment is always covered. Boundaries are computed in
 * UTC, counted in hours from midnight.
 *
 * @since 1.0
 */
public class FragmentPlanner {

  /** Tolerance applied when checking whether two fragments are adjacent. */
  public static final double CONTIGUITY_TOLERANCE = 1.01;

  /** Fragment size in hours per product. */
  protected final ToIntFunction<String> fragment_hours;

  /** Scaling factor applied before rounding. */
  protected final double cache_margins;

  /** Where the margin goes. */
  protected final MarginAnchor anchor;

  /**
   * Default ctor.
   * @param fragment_hours A non-null function returning the fragment size
   * in hours for a product.
   * @param cache_margins The scaling factor, e.g. 1.2.
   * @param anchor The non-null margin anchor.
   */
  public FragmentPlanner(final ToIntFunction<String> fragment_hours,
                         final double cache_margins,
                         final MarginAnchor anchor) {
    if (fragment_hours == null) {
      throw new IllegalArgumentException("Fragment hours function cannot be null.");
    }
    if (anchor == null) {
      throw new IllegalArgumentException("Anchor cannot be null.");
    }
    this.fragment_hours = fragment_hours;
    this.cache_margins = cache_margins;
    this.anchor = anchor;
  }

  /**
   * Computes the fragments for a lookup.
   * @param product The non-null product identifier.
   * @param range The non-null requested range.
   * @return The non-null plan.
   * @throws IllegalArgumentException if the product's fragment size was not
   * strictly positive.
   */
  public FragmentPlan plan(final String product, final TimeRange range) {
    final int hours = fragment_hours.applyAsInt(product);
    if (hours < 1) {
      throw new IllegalArgumentException("Fragment hours must be at least 1 "
          + "for product " + product + ", got " + hours);
    }
    final TimeRange cache_range = roundForCache(
        range.scale(cache_margins, anchor), hours);
    final Duration step = Duration.ofHours(hours);
    final List<Instant> starts = Lists.newArrayList();
    Instant fragment = cache_range.start();
    while (fragment.isBefore(cache_range.stop())) {
      starts.add(fragment);
      fragment = fragment.plus(step);
    }
    return new FragmentPlan(hours, starts);
  }

  /**
   * Rounds the start down and the stop up to fragment boundaries.
   * @param range A non-null range.
   * @param fragment_hours The fragment size in hours.
   * @return The rounded range.
   */
  public static TimeRange roundForCache(final TimeRange range,
                                        final int fragment_hours) {
    final ZonedDateTime start = range.start().atZone(ZoneOffset.UTC);
    final ZonedDateTime stop = range.stop().atZone(ZoneOffset.UTC);
    return new TimeRange(
        start.truncatedTo(ChronoUnit.DAYS)
          .plusHours(lowerHourBound(start, fragment_hours)).toInstant(),
        stop.truncatedTo(ChronoUnit.DAYS)
          .plusHours(upperHourBound(stop, fragment_hours)).toInstant());
  }

  /**
   * @param dt A non-null UTC date time.
   * @param factor The fragment size in hours.
   * @return The hour of the fragment boundary at or before the time.
   */
  @VisibleForTesting
  static int lowerHourBound(final ZonedDateTime dt, final int factor) {
    return (dt.getHour() / factor) * factor;
  }

  /**
   * Hours from midnight of the first fragment boundary strictly covering the
   * time. Always at least one fragment.
   * @param dt A non-null UTC date time.
   * @param factor The fragment size in hours.
   * @return The hour offset, possibly past 24.
   */
  @VisibleForTesting
  static int upperHourBound(final ZonedDateTime dt, final int factor) {
    final int offset = dt.equals(dt.truncatedTo(ChronoUnit.HOURS)) ? 0 : 1;
    final int buckets = (dt.getHour() + offset + factor - 1) / factor;
    return Math.max(buckets, 1) * factor;
  }

  /**
   * Groups ordered fragment starts into maximal runs of adjacent fragments so
   * that each run can be fetched with a single call.
   * @param fragments The non-null, ordered fragment starts.
   * @param duration The fragment duration.
   * @return A non-null, possibly empty list of non-empty runs.
   */
  public static List<List<Instant>> groupContiguous(final List<Instant> fragments,
                                                    final Duration duration) {
    final List<List<Instant>> runs = Lists.newArrayList();
    if (fragments.isEmpty()) {
      return runs;
    }
    final long tolerance = (long) (duration.toNanos() * CONTIGUITY_TOLERANCE);
    List<Instant> run = Lists.newArrayList(fragments.get(0));
    runs.add(run);
    for (int i = 1; i < fragments.size(); i++) {
      final Instant fragment = fragments.get(i);
      if (run.get(run.size() - 1).plusNanos(tolerance).isAfter(fragment)) {
        run.add(fragment);
      } else {
        run = Lists.newArrayList(fragment);
        runs.add(run);
      }
    }
    return runs;
  }

  /** @return The scaling factor. */
  public double cacheMargins() {
    return cache_margins;
  }

  /** @return The margin anchor. */
  public MarginAnchor anchor() {
    return anchor;
  }
}
