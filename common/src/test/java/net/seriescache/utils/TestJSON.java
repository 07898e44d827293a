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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

import net.seriescache.cache.CacheEntry;
import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;

public class TestJSON {

  @Test
  public void cacheEntry() throws Exception {
    final Series series = Series.newBuilder()
        .setTimestamps(new long[] { 1000, 2000 })
        .setValues(new double[][] { { 1.5, Double.NaN }, { 2.5, 3.5 } })
        .addMeta("UNITS", "nT")
        .setColumns("x", "y")
        .setUnit("nT")
        .build();
    final byte[] json = JSON.serializeToBytes(
        new CacheEntry(series, VersionTag.of(7)));
    final CacheEntry parsed = JSON.parseToObject(json, CacheEntry.class);
    assertEquals(VersionTag.of(7), parsed.version());
    assertEquals(series, parsed.payload());
    assertTrue(Double.isNaN(parsed.payload().values()[0][1]));
    assertEquals("nT", parsed.payload().unit());
  }

  @Test
  public void nullVersionOmitted() throws Exception {
    final Series series = Series.newBuilder().build();
    final String json = JSON.serializeToString(new CacheEntry(series, null));
    assertEquals(-1, json.indexOf("version"));
    assertNull(JSON.parseToObject(json.getBytes(StandardCharsets.UTF_8),
        CacheEntry.class).version());
  }

  @Test
  public void errors() throws Exception {
    try {
      JSON.serializeToBytes(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      JSON.parseToObject("{not json".getBytes(StandardCharsets.UTF_8),
          CacheEntry.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      JSON.parseToObject(null, CacheEntry.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
