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

/** Attenuation of polarized light through a second linear polarizer. */
public final class MalusLaw {
  /** Brightness of unattenuated light, in percent. */
  public static final int FULL_ENERGY = 100;

  /**
   * Returns {@code round(energy * cos^2(delta))}, rounded half up.
   *
   * <p>Every interface is a measurement boundary, so callers chain already rounded energies.
   *
   * @param energy incoming brightness in percent
   * @param delta angle between the two filter axes, in degrees
   */
  public static int attenuate(int energy, double delta) {
    double cos = StrictMath.cos(Math.toRadians(delta));
    return (int) Math.round(energy * cos * cos);
  }

  private MalusLaw() {}
}
