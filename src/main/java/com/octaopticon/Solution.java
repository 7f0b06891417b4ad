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

package com.octaopticon;

/**
 * Result of one solve.
 *
 * <p>Value accessors are only meaningful when {@link #isSatisfied()} holds; otherwise every table
 * is empty and the accessors throw {@link IllegalStateException}.
 */
public final class Solution {
  private static final int[][][] EMPTY_3D = new int[0][][];
  private static final int[][][][] EMPTY_4D = new int[0][][][];

  /** A result without values, for {@link SolveStatus#INFEASIBLE} or {@link SolveStatus#UNKNOWN}. */
  public static Solution withoutValues(SolveStatus status, double wallTime) {
    if (status == SolveStatus.SATISFIED) {
      throw new IllegalArgumentException("withoutValues: a satisfied solution carries values");
    }
    return new Solution(status, wallTime, EMPTY_3D, new int[0][], new int[0][], EMPTY_3D,
        EMPTY_4D, EMPTY_4D);
  }

  /**
   * A satisfied result. Every array is copied.
   *
   * @param angles {@code [pizza][slice][window]} filter angles
   * @param rotations {@code [image][pizza]} sector offsets
   * @param stackOrders {@code [image][position]} disk at each stack position
   * @param correctedSectors {@code [slice][image][pizza]} physical sector under each logical one
   * @param correctedAngles {@code [image][pizza][slice][window]} rotation corrected angles
   * @param deltas {@code [slice][window][image][position - 1]} delta between adjacent positions
   */
  public static Solution satisfied(double wallTime, int[][][] angles, int[][] rotations,
      int[][] stackOrders, int[][][] correctedSectors, int[][][][] correctedAngles,
      int[][][][] deltas) {
    return new Solution(SolveStatus.SATISFIED, wallTime, copy(angles), copy(rotations),
        copy(stackOrders), copy(correctedSectors), copy(correctedAngles), copy(deltas));
  }

  private static int[][] copy(int[][] values) {
    int[][] result = new int[values.length][];
    for (int i = 0; i < values.length; ++i) {
      result[i] = values[i].clone();
    }
    return result;
  }

  private static int[][][] copy(int[][][] values) {
    int[][][] result = new int[values.length][][];
    for (int i = 0; i < values.length; ++i) {
      result[i] = copy(values[i]);
    }
    return result;
  }

  private static int[][][][] copy(int[][][][] values) {
    int[][][][] result = new int[values.length][][][];
    for (int i = 0; i < values.length; ++i) {
      result[i] = copy(values[i]);
    }
    return result;
  }

  private Solution(SolveStatus status, double wallTime, int[][][] angles, int[][] rotations,
      int[][] stackOrders, int[][][] correctedSectors, int[][][][] correctedAngles,
      int[][][][] deltas) {
    this.status = status;
    this.wallTime = wallTime;
    this.angles = angles;
    this.rotations = rotations;
    this.stackOrders = stackOrders;
    this.correctedSectors = correctedSectors;
    this.correctedAngles = correctedAngles;
    this.deltas = deltas;
  }

  public SolveStatus getStatus() {
    return status;
  }

  public boolean isSatisfied() {
    return status == SolveStatus.SATISFIED;
  }

  /** Wall-clock duration of the search, in seconds. */
  public double getWallTime() {
    return wallTime;
  }

  /** Filter angle in degrees of pizza i, slice j, window k. */
  public int angle(int i, int j, int k) {
    checkSatisfied("angle");
    return angles[i][j][k];
  }

  /** Sector offset of pizza i when reproducing image m. Always 0 for pizza 0. */
  public int rotation(int m, int i) {
    checkSatisfied("rotation");
    return rotations[m][i];
  }

  /** Pizza index stacked at position s for image m. */
  public int stackOrder(int m, int s) {
    checkSatisfied("stackOrder");
    return stackOrders[m][s];
  }

  /** Returns a copy of the stacking permutation of image m. */
  public int[] stackOrder(int m) {
    checkSatisfied("stackOrder");
    return stackOrders[m].clone();
  }

  /** Physical sector of pizza i lying under logical sector j for image m. */
  public int correctedSector(int j, int m, int i) {
    checkSatisfied("correctedSector");
    return correctedSectors[j][m][i];
  }

  /** Effective angle of pizza i at logical slice j, window k for image m. */
  public int correctedAngle(int m, int i, int j, int k) {
    checkSatisfied("correctedAngle");
    return correctedAngles[m][i][j][k];
  }

  /** Angle delta between stack positions s - 1 and s, for {@code 1 <= s < pizzas}. */
  public int delta(int j, int k, int m, int s) {
    checkSatisfied("delta");
    return deltas[j][k][m][s - 1];
  }

  /** Number of images with values, 0 when not satisfied. */
  public int getImageCount() {
    return rotations.length;
  }

  private void checkSatisfied(String methodName) {
    if (!isSatisfied()) {
      throw new IllegalStateException(methodName + ": solution is " + status);
    }
  }

  @Override
  public String toString() {
    return String.format("Solution(%s, %.3f s)", status, wallTime);
  }

  private final SolveStatus status;
  private final double wallTime;
  private final int[][][] angles;
  private final int[][] rotations;
  private final int[][] stackOrders;
  private final int[][][] correctedSectors;
  private final int[][][][] correctedAngles;
  private final int[][][][] deltas;
}
