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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestProductIndex {

  @Test
  public void productName() throws Exception {
    assertEquals("ace/mag", ProductIndex.productName("ace/mag"));
    assertEquals("ace/mag", ProductIndex.productName(
        new ProductIndex("mag", "ace", "ace/mag", null)));

    try {
      ProductIndex.productName(42);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      ProductIndex.productName(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
