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

import java.util.Map;

import com.google.common.collect.Maps;

import net.seriescache.stats.StatsCollector;

/**
 * Keeps counters in memory, ignoring tags.
 */
public class CountingStatsCollector implements StatsCollector {
  private final Map<String, Long> counters = Maps.newHashMap();

  @Override
  public void incrementCounter(final String metric, final String... tags) {
    incrementCounter(metric, 1, tags);
  }

  @Override
  public void incrementCounter(final String metric,
                               final long amount,
                               final String... tags) {
    final Long current = counters.get(metric);
    counters.put(metric, current == null ? amount : current + amount);
  }

  @Override
  public void setGauge(final String metric,
                       final long value,
                       final String... tags) {
    counters.put(metric, value);
  }

  public long get(final String metric) {
    final Long value = counters.get(metric);
    return value == null ? 0 : value;
  }
}
