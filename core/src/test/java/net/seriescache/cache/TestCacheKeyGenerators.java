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
import static org.junit.Assert.fail;

import org.junit.Test;

import net.seriescache.provider.FetchOptions;

public class TestCacheKeyGenerators {
  private static final String START = "2021-01-08T00:00:00+00:00";

  @Test
  public void defaultGenerator() throws Exception {
    final DefaultCacheKeyGenerator generator = new DefaultCacheKeyGenerator();
    assertEquals("amda/ace/mag/" + START,
        generator.name("amda", "ace/mag", START, FetchOptions.DEFAULT));
    assertEquals("/ace/mag/" + START,
        generator.name("", "ace/mag", START, FetchOptions.DEFAULT));
    assertEquals("/ace/mag/" + START,
        generator.name(null, "ace/mag", START, null));

    try {
      generator.name("amda", "", START, FetchOptions.DEFAULT);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      generator.name("amda", "ace/mag", null, FetchOptions.DEFAULT);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void optionGenerator() throws Exception {
    final OptionCacheKeyGenerator generator =
        new OptionCacheKeyGenerator("coordinate_system", "gse");
    assertEquals("coordinate_system", generator.optionName());
    assertEquals("ssc/ace/gse/" + START,
        generator.name("ssc", "ace", START, FetchOptions.DEFAULT));
    assertEquals("ssc/ace/gse/" + START,
        generator.name("ssc", "ace", START, null));
    assertEquals("ssc/ace/gsm/" + START,
        generator.name("ssc", "ace", START,
            FetchOptions.newBuilder("coordinate_system")
              .setOption("coordinate_system", "gsm")
              .build()));

    try {
      new OptionCacheKeyGenerator(null, "gse");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new OptionCacheKeyGenerator("coordinate_system", "");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
