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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;

public class TestJsonCacheEntrySerdes {

  @Test
  public void serdes() throws Exception {
    final JsonCacheEntrySerdes serdes = new JsonCacheEntrySerdes();
    final Series series = new Series(new long[] { 1000, 2000 },
        new double[][] { { 1, Double.NaN }, { 3, 4 } }, null, null,
        new double[][] { { 10, 20 }, { 11, 21 } }, "nT");
    final byte[] data = serdes.serialize(new CacheEntry(series, VersionTag.of(3)));
    final String json = new String(data, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"version\":3"));

    final CacheEntry entry = serdes.deserialize(data);
    assertEquals(VersionTag.of(3), entry.version());
    assertEquals(series, entry.payload());
    assertTrue(entry.payload().hasRowAlignedSecondaryAxis());
    assertArrayEquals(new double[] { 11, 21 },
        entry.payload().secondaryAxis()[1], 0.0);
    assertEquals("nT", entry.payload().unit());
  }

  @Test
  public void errors() throws Exception {
    final JsonCacheEntrySerdes serdes = new JsonCacheEntrySerdes();
    try {
      serdes.serialize(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      serdes.deserialize(new byte[0]);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      serdes.deserialize("{\"version\":1}".getBytes(StandardCharsets.UTF_8));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
