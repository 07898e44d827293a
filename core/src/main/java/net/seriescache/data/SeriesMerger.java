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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Merges overlapping or adjacent chunks of the same product into a single
 * series ordered by time.
 * <p>
 * Chunks are ordered by their first timestamp. A chunk entirely covered by an
 * earlier one is dropped, as is a chunk sharing its start with the next one
 * when the next one reaches at least as far. Where two remaining chunks
 * overlap, the earlier one is cut at the first sample of the later one so the
 * later chunk wins on the overlap. Metadata and columns come from the first
 * chunk kept.
 *
 * @since 1.0
 */
public final class SeriesMerger {

  private static final Comparator<Series> BY_FIRST_TIMESTAMP =
      new Comparator<Series>() {
        @Override
        public int compare(final Series a, final Series b) {
          return Long.compare(a.firstTimestamp(), b.firstTimestamp());
        }
      };

  private SeriesMerger() {
    // utility
  }

  /**
   * Merges the chunks.
   * @param chunks A possibly null list of possibly null chunks.
   * @return Null if the list was null, empty or only held nulls. An empty
   * series shaped like the first non-null chunk if none had samples.
   * Otherwise the merged series.
   */
  public static Series merge(final List<Series> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return null;
    }

    Series reference = null;
    final List<Series> sorted = Lists.newArrayListWithCapacity(chunks.size());
    for (final Series chunk : chunks) {
      if (chunk == null) {
        continue;
      }
      if (reference == null) {
        reference = chunk;
      }
      if (!chunk.isEmpty()) {
        sorted.add(chunk);
      }
    }
    if (reference == null) {
      return null;
    }
    // stable so equal starts keep their input order
    sorted.sort(BY_FIRST_TIMESTAMP);

    final List<Series> kept = Lists.newArrayListWithCapacity(sorted.size());
    for (final Series chunk : sorted) {
      if (!kept.isEmpty()
          && kept.get(kept.size() - 1).lastTimestamp() >= chunk.lastTimestamp()) {
        continue;
      }
      kept.add(chunk);
    }

    final List<Series> merged = Lists.newArrayListWithCapacity(kept.size());
    for (int i = 0; i < kept.size(); i++) {
      final Series chunk = kept.get(i);
      if (i + 1 < kept.size()) {
        final Series next = kept.get(i + 1);
        if (next.firstTimestamp() == chunk.firstTimestamp()
            && next.lastTimestamp() >= chunk.lastTimestamp()) {
          continue;
        }
      }
      merged.add(chunk);
    }

    if (merged.isEmpty()) {
      return emptyLike(reference);
    }

    final int[] lengths = new int[merged.size()];
    int total = 0;
    for (int i = 0; i < merged.size(); i++) {
      final Series chunk = merged.get(i);
      if (i + 1 < merged.size()
          && chunk.lastTimestamp() >= merged.get(i + 1).firstTimestamp()) {
        lengths[i] = chunk.indexOf(merged.get(i + 1).firstTimestamp());
      } else {
        lengths[i] = chunk.size();
      }
      total += lengths[i];
    }

    final Series first = merged.get(0);
    final boolean aligned_axis = first.hasRowAlignedSecondaryAxis();
    final long[] timestamps = new long[total];
    final double[][] values = new double[total][];
    final double[][] axis = aligned_axis ? new double[total][] : first.secondaryAxis();
    final Set<String> units = Sets.newHashSet();
    boolean missing_unit = false;

    int offset = 0;
    for (int i = 0; i < merged.size(); i++) {
      final Series chunk = merged.get(i);
      System.arraycopy(chunk.timestamps(), 0, timestamps, offset, lengths[i]);
      for (int x = 0; x < lengths[i]; x++) {
        values[offset + x] = Arrays.copyOf(chunk.values()[x],
            chunk.values()[x].length);
      }
      if (aligned_axis) {
        copyAxis(chunk, lengths[i], axis, offset);
      }
      if (chunk.unit() == null) {
        missing_unit = true;
      } else {
        units.add(chunk.unit());
      }
      offset += lengths[i];
    }

    final String unit = !missing_unit && units.size() == 1
        ? units.iterator().next() : null;
    return new Series(timestamps, values, first.meta(), first.columns(), axis, unit);
  }

  /**
   * Copies the secondary axis rows of a chunk. Chunks without a row aligned
   * axis contribute NaN rows.
   */
  private static void copyAxis(final Series chunk,
                               final int length,
                               final double[][] axis,
                               final int offset) {
    final int width = chunk.width();
    for (int x = 0; x < length; x++) {
      if (chunk.hasRowAlignedSecondaryAxis()) {
        axis[offset + x] = Arrays.copyOf(chunk.secondaryAxis()[x],
            chunk.secondaryAxis()[x].length);
      } else {
        final double[] row = new double[width];
        Arrays.fill(row, Double.NaN);
        axis[offset + x] = row;
      }
    }
  }

  private static Series emptyLike(final Series reference) {
    final double[][] axis = reference.hasRowAlignedSecondaryAxis()
        ? new double[0][] : reference.secondaryAxis();
    return new Series(new long[0], new double[0][], reference.meta(),
        reference.columns(), axis, reference.unit());
  }
}
