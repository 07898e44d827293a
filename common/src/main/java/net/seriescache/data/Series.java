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

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.seriescache.utils.JSON;
import net.seriescache.utils.JSONException;

/**
 * A time indexed numeric series as returned by a provider and stored in the
 * fragment cache.
 * <p>
 * Timestamps are epoch nanoseconds in non-decreasing order. Each timestamp
 * owns one row of {@link #values()}. The optional secondary axis is either
 * row aligned (it has exactly one row per timestamp and the same width as
 * the values, e.g. energy bins that drift with time) or shared by every row
 * (e.g. a fixed table of bins) in which case it is carried along as-is.
 * <p>
 * Metadata values are normalized to the types JSON parsing yields (Integer
 * or Long, Double, String, Boolean, List, Map) so that a series read back
 * from a store equals the one written.
 * <p>
 * Instances are treated as immutable. Slicing copies the underlying arrays,
 * rows included.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonAutoDetect(getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE,
    fieldVisibility = Visibility.NONE)
public class Series {

  /** Metadata key holding the value used by providers for missing samples. */
  public static final String FILL_VALUE_KEY = "FILLVAL";

  private static final long NANOS_PER_SECOND = 1000000000L;

  private static final TypeReference<Map<String, Object>> META_TYPE =
      new TypeReference<Map<String, Object>>() { };

  /** Epoch nanosecond timestamps. */
  protected final long[] timestamps;

  /** One row of values per timestamp. */
  protected final double[][] values;

  /** Provider metadata. */
  protected final Map<String, Object> meta;

  /** Column labels, may be empty. */
  protected final List<String> columns;

  /** Optional secondary axis. */
  protected final double[][] secondary_axis;

  /** Optional physical unit of the values. */
  protected final String unit;

  /**
   * Default ctor.
   * @param timestamps A non-null array of non-decreasing epoch nanoseconds.
   * @param values A non-null value matrix with one row per timestamp.
   * @param meta An optional metadata map.
   * @param columns An optional list of column labels.
   * @param secondary_axis An optional secondary axis.
   * @param unit An optional unit tag.
   * @throws IllegalArgumentException if the timestamps and values were null,
   * mismatched in length or the timestamps were out of order.
   */
  @JsonCreator
  public Series(final @JsonProperty("timestamps") long[] timestamps,
                final @JsonProperty("values") double[][] values,
                final @JsonProperty("meta") Map<String, Object> meta,
                final @JsonProperty("columns") List<String> columns,
                final @JsonProperty("secondaryAxis") double[][] secondary_axis,
                final @JsonProperty("unit") String unit) {
    if (timestamps == null) {
      throw new IllegalArgumentException("Timestamps cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (timestamps.length != values.length) {
      throw new IllegalArgumentException("Timestamps and values must have the "
          + "same length, got timestamps: " + timestamps.length
          + " and values: " + values.length);
    }
    for (int i = 1; i < timestamps.length; i++) {
      if (timestamps[i] < timestamps[i - 1]) {
        throw new IllegalArgumentException("Timestamps must be sorted, found "
            + timestamps[i] + " after " + timestamps[i - 1]
            + " at index " + i);
      }
    }
    this.timestamps = timestamps;
    this.values = values;
    this.meta = normalizeMeta(meta);
    this.columns = columns == null ? ImmutableList.<String>of()
        : ImmutableList.copyOf(columns);
    this.secondary_axis = secondary_axis;
    this.unit = unit;
  }

  /** @return The epoch nanosecond timestamps. Do not modify. */
  @JsonProperty("timestamps")
  public long[] timestamps() {
    return timestamps;
  }

  /** @return The value matrix. Do not modify. */
  @JsonProperty("values")
  public double[][] values() {
    return values;
  }

  /** @return The non-null, unmodifiable metadata. */
  @JsonProperty("meta")
  public Map<String, Object> meta() {
    return meta;
  }

  /** @return The non-null, unmodifiable column labels. */
  @JsonProperty("columns")
  public List<String> columns() {
    return columns;
  }

  /** @return The secondary axis, may be null. */
  @JsonProperty("secondaryAxis")
  public double[][] secondaryAxis() {
    return secondary_axis;
  }

  /** @return The unit tag of the values, may be null. */
  @JsonProperty("unit")
  public String unit() {
    return unit;
  }

  /** @return The number of samples. */
  public int size() {
    return timestamps.length;
  }

  /** @return True if the series doesn't have any samples. */
  public boolean isEmpty() {
    return timestamps.length == 0;
  }

  /** @return The number of values per row, taken from the first row or the
   * column labels if the series is empty. */
  public int width() {
    if (values.length > 0) {
      return values[0].length;
    }
    return columns.isEmpty() ? 1 : columns.size();
  }

  /** @return True if the secondary axis has a row per timestamp. */
  public boolean hasRowAlignedSecondaryAxis() {
    if (secondary_axis == null || secondary_axis.length != values.length) {
      return false;
    }
    return values.length == 0 || secondary_axis[0].length == values[0].length;
  }

  /**
   * @return The first timestamp in epoch nanoseconds.
   * @throws IllegalStateException if the series is empty.
   */
  public long firstTimestamp() {
    if (timestamps.length == 0) {
      throw new IllegalStateException("Series is empty.");
    }
    return timestamps[0];
  }

  /**
   * @return The last timestamp in epoch nanoseconds.
   * @throws IllegalStateException if the series is empty.
   */
  public long lastTimestamp() {
    if (timestamps.length == 0) {
      throw new IllegalStateException("Series is empty.");
    }
    return timestamps[timestamps.length - 1];
  }

  /**
   * Finds the left insertion point of the timestamp, i.e. the index of the
   * first sample at or after the timestamp.
   * @param timestamp An epoch nanosecond timestamp.
   * @return An index from 0 to {@link #size()} inclusive.
   */
  public int indexOf(final long timestamp) {
    int low = 0;
    int high = timestamps.length;
    while (low < high) {
      final int mid = (low + high) >>> 1;
      if (timestamps[mid] < timestamp) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * Copies the samples within the index range. Metadata, columns and unit are
   * shared with the new series.
   * @param from The inclusive start index.
   * @param to The exclusive end index.
   * @return A new series.
   */
  public Series view(final int from, final int to) {
    final double[][] axis;
    if (hasRowAlignedSecondaryAxis()) {
      axis = copyRows(secondary_axis, from, to);
    } else {
      axis = secondary_axis;
    }
    return new Series(Arrays.copyOfRange(timestamps, from, to),
        copyRows(values, from, to), meta, columns, axis, unit);
  }

  /**
   * Returns the samples within {@code [start, stop)}.
   * @param start An optional inclusive start. If null, slices from the first
   * sample.
   * @param stop An optional exclusive stop. If null, slices to the end.
   * @return A new series, possibly empty.
   */
  public Series slice(final Instant start, final Instant stop) {
    final int from = start == null ? 0 : indexOf(toEpochNanos(start));
    final int to = stop == null ? timestamps.length
        : indexOf(toEpochNanos(stop));
    return view(from, Math.max(from, to));
  }

  /**
   * Replaces the samples equal to the {@link #FILL_VALUE_KEY} metadata value
   * with NaNs.
   * @return A new series or this one if no fill value was present.
   */
  public Series replaceFillValueByNaN() {
    final Object fill = meta.get(FILL_VALUE_KEY);
    if (fill == null) {
      return this;
    }
    final double fill_value;
    if (fill instanceof Number) {
      fill_value = ((Number) fill).doubleValue();
    } else {
      try {
        fill_value = Double.parseDouble(fill.toString().trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Unparseable fill value: " + fill, e);
      }
    }
    final double[][] replaced = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      replaced[i] = Arrays.copyOf(values[i], values[i].length);
      for (int x = 0; x < replaced[i].length; x++) {
        if (replaced[i][x] == fill_value) {
          replaced[i][x] = Double.NaN;
        }
      }
    }
    return new Series(timestamps, replaced, meta, columns, secondary_axis, unit);
  }

  /**
   * @param unit An optional unit tag.
   * @return A new series sharing the data of this one with the given unit.
   */
  public Series withUnit(final String unit) {
    return new Series(timestamps, values, meta, columns, secondary_axis, unit);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Series)) {
      return false;
    }
    final Series other = (Series) o;
    return meta.equals(other.meta)
        && columns.equals(other.columns)
        && Objects.equals(unit, other.unit)
        && Arrays.equals(timestamps, other.timestamps)
        && Arrays.deepEquals(values, other.values)
        && Arrays.deepEquals(secondary_axis, other.secondary_axis);
  }

  @Override
  public int hashCode() {
    return Objects.hash(meta, columns, unit, Arrays.hashCode(timestamps),
        Arrays.deepHashCode(values), Arrays.deepHashCode(secondary_axis));
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("size=")
        .append(timestamps.length)
        .append(", columns=")
        .append(columns)
        .append(", unit=")
        .append(unit);
    if (timestamps.length > 0) {
      buf.append(", first=")
         .append(toInstant(timestamps[0]))
         .append(", last=")
         .append(toInstant(timestamps[timestamps.length - 1]));
    }
    return buf.toString();
  }

  private static double[][] copyRows(final double[][] rows,
                                     final int from,
                                     final int to) {
    final double[][] copy = new double[to - from][];
    for (int i = from; i < to; i++) {
      copy[i - from] = rows[i] == null ? null
          : Arrays.copyOf(rows[i], rows[i].length);
    }
    return copy;
  }

  /**
   * Round trips the metadata through the shared JSON mapper.
   * @param meta An optional map.
   * @return An unmodifiable map holding JSON native values.
   * @throws JSONException if a value could not be serialized.
   */
  private static Map<String, Object> normalizeMeta(
      final Map<String, Object> meta) {
    if (meta == null || meta.isEmpty()) {
      return Collections.<String, Object>emptyMap();
    }
    final ObjectMapper mapper = JSON.getMapper();
    try {
      return Collections.unmodifiableMap(
          mapper.readValue(mapper.writeValueAsBytes(meta), META_TYPE));
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * @param instant A non-null instant.
   * @return The instant in epoch nanoseconds.
   */
  public static long toEpochNanos(final Instant instant) {
    return instant.getEpochSecond() * NANOS_PER_SECOND + instant.getNano();
  }

  /**
   * @param epoch_nanos An epoch timestamp in nanoseconds.
   * @return The instant.
   */
  public static Instant toInstant(final long epoch_nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(epoch_nanos, NANOS_PER_SECOND),
        Math.floorMod(epoch_nanos, NANOS_PER_SECOND));
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for series, mostly used by providers and tests.
   */
  public static class Builder {
    private long[] timestamps;
    private double[][] values;
    private Map<String, Object> meta;
    private List<String> columns;
    private double[][] secondary_axis;
    private String unit;

    public Builder setTimestamps(final long[] timestamps) {
      this.timestamps = timestamps;
      return this;
    }

    /**
     * @param timestamps A list of instants converted to epoch nanoseconds.
     * @return The builder.
     */
    public Builder setTimestamps(final List<Instant> timestamps) {
      this.timestamps = new long[timestamps.size()];
      for (int i = 0; i < this.timestamps.length; i++) {
        this.timestamps[i] = toEpochNanos(timestamps.get(i));
      }
      return this;
    }

    public Builder setValues(final double[][] values) {
      this.values = values;
      return this;
    }

    /**
     * Sets a single column of values.
     * @param values The values, one per timestamp.
     * @return The builder.
     */
    public Builder setValues(final double[] values) {
      this.values = new double[values.length][];
      for (int i = 0; i < values.length; i++) {
        this.values[i] = new double[] { values[i] };
      }
      return this;
    }

    public Builder setMeta(final Map<String, Object> meta) {
      this.meta = meta;
      return this;
    }

    public Builder addMeta(final String key, final Object value) {
      if (meta == null) {
        meta = Maps.newLinkedHashMap();
      }
      meta.put(key, value);
      return this;
    }

    public Builder setColumns(final List<String> columns) {
      this.columns = columns;
      return this;
    }

    public Builder setColumns(final String... columns) {
      this.columns = Lists.newArrayList(columns);
      return this;
    }

    public Builder setSecondaryAxis(final double[][] secondary_axis) {
      this.secondary_axis = secondary_axis;
      return this;
    }

    public Builder setUnit(final String unit) {
      this.unit = unit;
      return this;
    }

    public Series build() {
      return new Series(timestamps == null ? new long[0] : timestamps,
          values == null ? new double[0][] : values,
          meta, columns, secondary_axis, unit);
    }
  }
}
