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
package net.seriescache.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Utility class with date and time helpers.
 */
public class DateTime {

  /** ISO-8601 formatter in UTC with an explicit offset, e.g.
   * {@code 2021-01-08T00:00:00+00:00}, as used in cache keys. */
  public static final DateTimeFormatter ISO_OFFSET =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx")
        .withZone(ZoneOffset.UTC);

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code n}: month (30 days)</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    double temp;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " + duration);
    }
    switch (duration.toLowerCase().charAt(duration.length() - 1)) {
      case 's':
        if (duration.toLowerCase().charAt(duration.length() - 2) == 'm') {
          return interval;
        }
        multiplier = 1; break;                        // seconds
      case 'm': multiplier = 60; break;               // minutes
      case 'h': multiplier = 3600; break;             // hours
      case 'd': multiplier = 3600 * 24; break;        // days
      case 'w': multiplier = 3600 * 24 * 7; break;    // weeks
      case 'n': multiplier = 3600 * 24 * 30; break;   // month (average)
      case 'y': multiplier = 3600 * 24 * 365; break;  // years
      default: throw new IllegalArgumentException("Invalid duration (suffix): " + duration);
    }
    multiplier *= 1000;
    temp = (double) interval * multiplier;
    if (temp > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: " + duration);
    }
    return interval * multiplier;
  }

  /**
   * @param duration The human-readable duration to parse.
   * @return The duration.
   * @see #parseDuration(String)
   */
  public static Duration parseJavaDuration(final String duration) {
    return Duration.ofMillis(parseDuration(duration));
  }

  /**
   * @param instant A non-null instant.
   * @return The instant formatted with {@link #ISO_OFFSET}.
   */
  public static String isoFormat(final Instant instant) {
    return ISO_OFFSET.format(instant);
  }
}
