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

import java.util.Comparator;
import java.util.Objects;

/**
 * One light-physics step: light at {@code energyIn} crosses a filter pair {@code angleDelta}
 * apart.
 */
public final class Transition implements Comparable<Transition> {
  private static final Comparator<Transition> ORDER =
      Comparator.comparingInt(Transition::getEnergyIn)
          .thenComparingInt(Transition::getAngleDelta)
          .thenComparingInt(Transition::getEnergyOut);

  public Transition(int energyIn, int angleDelta, int energyOut) {
    this.energyIn = energyIn;
    this.angleDelta = angleDelta;
    this.energyOut = energyOut;
  }

  public int getEnergyIn() {
    return energyIn;
  }

  public int getAngleDelta() {
    return angleDelta;
  }

  public int getEnergyOut() {
    return energyOut;
  }

  @Override
  public int compareTo(Transition other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition that = (Transition) o;
    return energyIn == that.energyIn && angleDelta == that.angleDelta
        && energyOut == that.energyOut;
  }

  @Override
  public int hashCode() {
    return Objects.hash(energyIn, angleDelta, energyOut);
  }

  @Override
  public String toString() {
    return "(" + energyIn + ", " + angleDelta + ", " + energyOut + ")";
  }

  private final int energyIn;
  private final int angleDelta;
  private final int energyOut;
}
