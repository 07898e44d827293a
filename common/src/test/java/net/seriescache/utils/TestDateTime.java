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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;

import org.junit.Test;

public class TestDateTime {

  @Test
  public void parseDuration() throws Exception {
    assertEquals(10, DateTime.parseDuration("10ms"));
    assertEquals(30000, DateTime.parseDuration("30s"));
    assertEquals(600000, DateTime.parseDuration("10m"));
    assertEquals(3 * 3600000L, DateTime.parseDuration("3h"));
    assertEquals(14 * 86400000L, DateTime.parseDuration("14d"));
    assertEquals(14 * 86400000L, DateTime.parseDuration("2w"));
    assertEquals(30 * 86400000L, DateTime.parseDuration("1n"));
    assertEquals(365 * 86400000L, DateTime.parseDuration("1y"));
    assertEquals(Duration.ofHours(2), DateTime.parseJavaDuration("2h"));
  }

  @Test
  public void parseDurationErrors() throws Exception {
    final String[] bad = new String[] { null, "", "10", "0d", "d", "10q" };
    for (final String duration : bad) {
      try {
        DateTime.parseDuration(duration);
        fail("Expected IllegalArgumentException for " + duration);
      } catch (IllegalArgumentException e) { }
    }
  }

  @Test
  public void isoFormat() throws Exception {
    assertEquals("2021-01-08T00:00:00+00:00",
        DateTime.isoFormat(Instant.parse("2021-01-08T00:00:00Z")));
    assertEquals("2021-01-08T13:05:09+00:00",
        DateTime.isoFormat(Instant.parse("2021-01-08T13:05:09.123Z")));
  }
}
