// Copyright 2026 The OctaOpticon Authors
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.octaopticon.physics;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Filter angles that a disk cut with a given angular resolution can physically carry.
 *
 * <p>A resolution of {@code A} splits a full turn into {@code A} equal steps. Polarizing filters
 * are symmetric under a half turn, so every step is reduced modulo 180 degrees before being
 * truncated to a whole degree.
 */
public final class ValidAngles {
  /**
   * Returns the sorted filter angles for the given resolution.
   *
   * <p>Deduplication happens on the exact angles, before truncation, so two distinct angles can
   * truncate to the same degree and both be reported (resolution 14 does that).
   *
   * @param angleResolution number of equal subdivisions of a full turn
   * @return the truncated angles in ascending order
   * @throws IllegalArgumentException if {@code angleResolution < 1}
   */
  public static List<Integer> compute(int angleResolution) {
    if (angleResolution < 1) {
      throw new IllegalArgumentException(
          "compute: angleResolution must be positive, got " + angleResolution);
    }
    TreeSet<Double> exact = new TreeSet<>();
    for (int i = 0; i < angleResolution; ++i) {
      exact.add((360.0 * i / angleResolution) % 180.0);
    }
    List<Integer> angles = new ArrayList<>(exact.size());
    for (double angle : exact) {
      angles.add((int) Math.floor(angle));
    }
    return angles;
  }

  /** Same as {@link #compute(int)} without repeated degrees, usable as a variable domain. */
  public static long[] distinct(int angleResolution) {
    return compute(angleResolution).stream().distinct().mapToLong(Integer::longValue).toArray();
  }

  private ValidAngles() {}
}
