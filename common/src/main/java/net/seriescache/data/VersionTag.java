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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An opaque, totally ordered marker used to decide whether a cached fragment
 * is still valid. Versioned products use an explicit version number while
 * unversioned products store the wall clock time of the fetch in epoch
 * milliseconds.
 * <p>
 * A null tag on a cache entry means the entry never goes stale.
 *
 * @since 1.0
 */
public final class VersionTag implements Comparable<VersionTag> {

  private final long value;

  private VersionTag(final long value) {
    this.value = value;
  }

  /**
   * @param value An explicit version number.
   * @return A tag.
   */
  @JsonCreator
  public static VersionTag of(final long value) {
    return new VersionTag(value);
  }

  /**
   * @param epoch_ms A Unix epoch timestamp in milliseconds.
   * @return A tag.
   */
  public static VersionTag ofEpochMillis(final long epoch_ms) {
    return new VersionTag(epoch_ms);
  }

  /**
   * Whether or not an entry carrying {@code entry_version} satisfies the
   * {@code wanted} version.
   * @param entry_version The version stored with the entry, may be null.
   * @param wanted The version currently required, may be null.
   * @return True if the entry version is null or at least the wanted one.
   */
  public static boolean isUpToDate(final VersionTag entry_version,
                                   final VersionTag wanted) {
    if (entry_version == null || wanted == null) {
      return true;
    }
    return entry_version.compareTo(wanted) >= 0;
  }

  /** @return The raw value. */
  @JsonValue
  public long value() {
    return value;
  }

  @Override
  public int compareTo(final VersionTag other) {
    return Long.compare(value, other.value);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VersionTag)) {
      return false;
    }
    return value == ((VersionTag) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
