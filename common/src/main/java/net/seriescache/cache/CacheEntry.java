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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

import net.seriescache.data.Series;
import net.seriescache.data.VersionTag;

/**
 * A single cached fragment along with the version it was stored at. The
 * payload may be an empty series, recording that the provider had no data
 * for the fragment.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public class CacheEntry {

  /** The fragment data. */
  protected final Series payload;

  /** The version, may be null. */
  protected final VersionTag version;

  /**
   * Default ctor.
   * @param payload The non-null fragment data.
   * @param version An optional version. If null the entry is always fresh.
   * @throws IllegalArgumentException if the payload was null.
   */
  @JsonCreator
  public CacheEntry(final @JsonProperty("payload") Series payload,
                    final @JsonProperty("version") VersionTag version) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null.");
    }
    this.payload = payload;
    this.version = version;
  }

  @JsonProperty("payload")
  public Series payload() {
    return payload;
  }

  @JsonProperty("version")
  public VersionTag version() {
    return version;
  }

  /**
   * @param version The new version.
   * @return A copy of this entry with the same payload and a new version.
   */
  public CacheEntry withVersion(final VersionTag version) {
    return new CacheEntry(payload, version);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("version=")
        .append(version)
        .append(", payload=[")
        .append(payload)
        .append("]")
        .toString();
  }
}
