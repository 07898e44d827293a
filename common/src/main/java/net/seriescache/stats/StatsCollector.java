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
package net.seriescache.stats;

/**
 * A metric collection interface the caches report hits and misses to.
 *
 * @since 1.0
 */
public interface StatsCollector {

  /**
   * Increments a monotonically increasing counter by one.
   * @param metric The non-null and non-empty metric name.
   * @param tags An optional set of tag key, value, key, value pairs.
   */
  public void incrementCounter(final String metric,
                               final String... tags);

  /**
   * Adds the given positive amount to a monotonically increasing counter.
   * @param metric The non-null and non-empty metric name.
   * @param amount The amount to add.
   * @param tags An optional set of tag key, value, key, value pairs.
   */
  public void incrementCounter(final String metric,
                               final long amount,
                               final String... tags);

  /**
   * Sets the gauge value.
   * @param metric The non-null and non-empty metric name.
   * @param value Gauge value.
   * @param tags An optional set of tag key, value, key, value pairs.
   */
  public void setGauge(final String metric,
                       final long value,
                       final String... tags);

}
