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

import com.google.common.collect.ImmutableList;

/**
 * The fragments covering a lookup: the fragment size and the ordered list of
 * fragment start times.
 *
 * @since 1.0
 */
public final class FragmentPlan {

  private final int fragment_hours;
  private final List<Instant> starts;

  /**
   * Default ctor.
   * @param fragment_hours The strictly positive fragment size in hours.
   * @param starts The non-null, ordered fragment starts.
   */
  public FragmentPlan(final int fragment_hours, final List<Instant> starts) {
    this.fragment_hours = fragment_hours;
    this.starts = ImmutableList.copyOf(starts);
  }

  /** @return The fragment size in hours. */
  public int fragmentHours() {
    return fragment_hours;
  }

  /** @return The fragment size. */
  public Duration fragmentDuration() {
    return Duration.ofHours(fragment_hours);
  }

  /** @return The immutable, ordered fragment starts. */
  public List<Instant> starts() {
    return starts;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("fragment_hours=")
        .append(fragment_hours)
        .append(", starts=")
        .append(starts)
        .toString();
  }
}
