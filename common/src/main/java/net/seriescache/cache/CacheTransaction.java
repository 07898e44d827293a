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

/**
 * A scoped transaction against a {@link CacheStore}. Reads performed while
 * the transaction is open see a consistent snapshot of the store.
 *
 * @since 1.0
 */
public interface CacheTransaction extends AutoCloseable {

  /** Ends the transaction. Does not throw. */
  @Override
  public void close();

}
