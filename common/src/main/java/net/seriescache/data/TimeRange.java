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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An immutable, half-open {@code [start, stop)} interval in UTC instants.
 * <p>
 * The start must be less than or equal to the stop. An empty range (start
 * equal to stop) is valid and has a zero duration.
 *
 * @since 1.0
 */
public final class TimeRange {

  /**
   * Where the extra margin goes when a range is scaled.
   */
  public static enum MarginAnchor {
    /** The start is kept and the whole margin is added after the stop. */
    START,

    /** Half of the margin is added on each edge. */
    CENTER
  }

  /** The inclusive start. */
  private final Instant start;

  /** The exclusive stop. */
  private final Instant stop;

  /**
   * Default ctor.
   * @param start The non-null inclusive start.
   * @param stop The non-null exclusive stop.
   * @throws IllegalArgumentException if either instant was null or the start
   * was after the stop.
   */
  public TimeRange(final Instant start, final Instant stop) {
    if (start == null) {
      throw new IllegalArgumentException("Start cannot be null.");
    }
    if (stop == null) {
      throw new IllegalArgumentException("Stop cannot be null.");
    }
    if (start.isAfter(stop)) {
      throw new IllegalArgumentException("Start " + start
          + " cannot be after the stop " + stop);
    }
    this.start = start;
    this.stop = stop;
  }

  /** @return The inclusive start. */
  public Instant start() {
    return start;
  }

  /** @return The exclusive stop. */
  public Instant stop() {
    return stop;
  }

  /** @return The length of the range. */
  public Duration duration() {
    return Duration.between(start, stop);
  }

  /**
   * @param instant A non-null instant.
   * @return True if the instant falls within {@code [start, stop)}.
   */
  public boolean contains(final Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(stop);
  }

  /**
   * @param other A non-null range.
   * @return True if the two ranges share at least one instant.
   */
  public boolean intersects(final TimeRange other) {
    return start.isBefore(other.stop) && other.start.isBefore(stop);
  }

  /**
   * Computes the overlapping part of both ranges.
   * @param other A non-null range.
   * @return The intersection or null if the ranges are disjoint.
   */
  public TimeRange intersect(final TimeRange other) {
    if (!intersects(other)) {
      return null;
    }
    final Instant new_start = start.isAfter(other.start) ? start : other.start;
    final Instant new_stop = stop.isBefore(other.stop) ? stop : other.stop;
    return new TimeRange(new_start, new_stop);
  }

  /**
   * Expands the range using the {@link MarginAnchor#START} anchor.
   * @param factor The scaling factor, e.g. 1.2 for a 20% margin.
   * @return A new range.
   */
  public TimeRange scale(final double factor) {
    return scale(factor, MarginAnchor.START);
  }

  /**
   * Expands (or shrinks for factors under 1) the range by
   * {@code duration * (factor - 1)} distributed according to the anchor.
   * @param factor The scaling factor, e.g. 1.2 for a 20% margin.
   * @param anchor A non-null anchor.
   * @return A new range.
   */
  public TimeRange scale(final double factor, final MarginAnchor anchor) {
    final long margin = Math.round((double) duration().toNanos() * (factor - 1));
    switch (anchor) {
    case CENTER:
      return new TimeRange(start.minusNanos(margin / 2),
          stop.plusNanos(margin - margin / 2));
    default:
      return new TimeRange(start, stop.plusNanos(margin));
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start.equals(other.start) && stop.equals(other.stop);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, stop);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start)
        .append(", stop=")
        .append(stop)
        .toString();
  }
}
