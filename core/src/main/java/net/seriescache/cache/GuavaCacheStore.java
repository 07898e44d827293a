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

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;

import net.seriescache.configuration.Config;

/**
 * A simple on-heap, in-memory LRU store using the Guava {@link Cache} class
 * for a configurable object limit and thread safety.
 * <p>
 * Entries are serialized through a {@link CacheEntrySerdes} so that readers
 * never share mutable state with the writer and so that the number of bytes
 * held can be tracked. The tracked size doesn't include Guava's overhead or
 * the keys.
 * <p>
 * Transactions are backed by the read side of a {@link ReentrantReadWriteLock}
 * and writes take the write side, so a batch of reads made within a
 * transaction observes a consistent snapshot. A thread holding a transaction
 * must close it before writing.
 *
 * @since 1.0
 */
public class GuavaCacheStore implements CacheStore {
  private static final Logger LOG = LoggerFactory.getLogger(GuavaCacheStore.class);

  /** Default number of objects to maintain in the store. */
  public static final int DEFAULT_MAX_OBJECTS = 1024;

  /** A counter used to track how many bytes are in the store. */
  private final AtomicLong size;

  /** The Guava cache implementation. */
  private final Cache<String, byte[]> cache;

  /** The configured maximum number of objects. */
  private final int max_objects;

  /** The serdes for entries. */
  private final CacheEntrySerdes serdes;

  /** Guards reads in transactions against concurrent writes. */
  private final ReentrantReadWriteLock lock;

  /**
   * Ctor with the default object limit and the JSON serdes.
   */
  public GuavaCacheStore() {
    this(DEFAULT_MAX_OBJECTS, new JsonCacheEntrySerdes());
  }

  /**
   * Ctor reading the object limit from the config, using the JSON serdes.
   * @param config A non-null config.
   */
  public GuavaCacheStore(final Config config) {
    this(config.hasProperty(Config.MAX_OBJECTS_KEY)
        ? config.getInt(Config.MAX_OBJECTS_KEY) : DEFAULT_MAX_OBJECTS,
        new JsonCacheEntrySerdes());
  }

  /**
   * Default ctor.
   * @param max_objects The maximum number of entries, at least 1.
   * @param serdes A non-null serdes.
   * @throws IllegalArgumentException if the limit was less than 1 or the
   * serdes was null.
   */
  public GuavaCacheStore(final int max_objects, final CacheEntrySerdes serdes) {
    if (max_objects < 1) {
      throw new IllegalArgumentException("Max objects must be at least 1.");
    }
    if (serdes == null) {
      throw new IllegalArgumentException("Serdes cannot be null.");
    }
    this.max_objects = max_objects;
    this.serdes = serdes;
    size = new AtomicLong();
    lock = new ReentrantReadWriteLock();
    cache = CacheBuilder.newBuilder()
        .maximumSize(max_objects)
        .removalListener(new Decrementer())
        .recordStats()
        .build();
  }

  @Override
  public CacheEntry get(final String key) {
    validateKey(key);
    final byte[] data = cache.getIfPresent(key);
    if (data == null) {
      return null;
    }
    return serdes.deserialize(data);
  }

  @Override
  public void set(final String key, final CacheEntry entry) {
    validateKey(key);
    if (entry == null) {
      throw new IllegalArgumentException("Entry cannot be null.");
    }
    if (lock.getReadHoldCount() > 0) {
      throw new IllegalStateException("Cannot write key [" + key
          + "] while this thread holds an open transaction.");
    }
    final byte[] data = serdes.serialize(entry);
    lock.writeLock().lock();
    try {
      // replacing a key notifies the decrementer with the old value
      cache.put(key, data);
      size.addAndGet(data.length);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean contains(final String key) {
    validateKey(key);
    return cache.getIfPresent(key) != null;
  }

  @Override
  public CacheTransaction transaction() {
    lock.readLock().lock();
    return new ReadTransaction();
  }

  /** @return The number of entries in the store. */
  public long size() {
    return cache.size();
  }

  /** @return The Guava hit/miss/eviction stats. */
  public CacheStats cacheStats() {
    return cache.stats();
  }

  /** @return The configured maximum number of objects. */
  public int maxObjects() {
    return max_objects;
  }

  /** Drops every entry. */
  public void clear() {
    lock.writeLock().lock();
    try {
      cache.invalidateAll();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @VisibleForTesting
  long bytesStored() {
    return size.get();
  }

  private static void validateKey(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
  }

  /** Releases the read lock once. */
  private class ReadTransaction implements CacheTransaction {
    private boolean closed;

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      lock.readLock().unlock();
    }
  }

  /** Super simple listener that decrements our size counter. */
  private class Decrementer implements RemovalListener<String, byte[]> {
    @Override
    public void onRemoval(final RemovalNotification<String, byte[]> notification) {
      if (notification.getValue() != null) {
        size.addAndGet(-notification.getValue().length);
      }
      if (notification.wasEvicted() && LOG.isDebugEnabled()) {
        LOG.debug("Evicted key [" + notification.getKey() + "]");
      }
    }
  }
}
