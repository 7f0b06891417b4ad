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

import com.octaopticon.physics.MalusLaw;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a design by shining light through it directly, without the transition automaton.
 *
 * <p>The automaton snaps some energies by one percent, so reconstructed pixels are compared with
 * a tolerance.
 *
 * <p>{@link #reconstruct} and {@link #mismatches} follow the modelled geometry, where a pizza
 * turns by {@code 360 / slices} whole degrees per sector. When the slice count does not divide
 * 360 the physical disk turns by a fraction more; {@link #reconstructExact} shows what it would
 * display.
 */
public final class SolutionVerifier {
  /** Default accepted difference between target and reconstructed brightness, in percent. */
  public static final int DEFAULT_TOLERANCE = 2;

  /**
   * Effective filter angle of pizza i at logical slice j, window k while showing image m: the
   * window comes from the rotated physical sector and its axis turns with the pizza.
   */
  public static int effectiveAngle(Problem problem, Solution solution, int m, int i, int j, int k) {
    int slices = problem.getSlices();
    int rotation = solution.rotation(m, i);
    int sector = Math.floorMod(j - rotation, slices);
    return (solution.angle(i, sector, k) + (360 / slices) * rotation) % 180;
  }

  /** Same as {@link #effectiveAngle}, turned by the exact {@code 360.0 / slices} per sector. */
  public static double exactAngle(Problem problem, Solution solution, int m, int i, int j, int k) {
    int slices = problem.getSlices();
    int rotation = solution.rotation(m, i);
    int sector = Math.floorMod(j - rotation, slices);
    return (solution.angle(i, sector, k) + 360.0 / slices * rotation) % 180.0;
  }

  /** Recomputes every image, bottom of the stack first, returned as {@code [m][j][k]}. */
  public static int[][][] reconstruct(Problem problem, Solution solution) {
    return reconstruct(problem, solution, false);
  }

  /** Recomputes every image with the exact sector step of the physical disks. */
  public static int[][][] reconstructExact(Problem problem, Solution solution) {
    return reconstruct(problem, solution, true);
  }

  private static int[][][] reconstruct(Problem problem, Solution solution, boolean exact) {
    int[][][] images =
        new int[problem.getImageCount()][problem.getSlices()][problem.getWindows()];
    for (int m = 0; m < problem.getImageCount(); ++m) {
      for (int j = 0; j < problem.getSlices(); ++j) {
        for (int k = 0; k < problem.getWindows(); ++k) {
          images[m][j][k] = brightness(problem, solution, m, j, k, exact);
        }
      }
    }
    return images;
  }

  private static int brightness(
      Problem problem, Solution solution, int m, int j, int k, boolean exact) {
    int energy = MalusLaw.FULL_ENERGY;
    double below = angle(problem, solution, m, solution.stackOrder(m, 0), j, k, exact);
    for (int s = 1; s < problem.getPizzas(); ++s) {
      double above = angle(problem, solution, m, solution.stackOrder(m, s), j, k, exact);
      energy = MalusLaw.attenuate(energy, above - below);
      below = above;
    }
    return energy;
  }

  private static double angle(
      Problem problem, Solution solution, int m, int i, int j, int k, boolean exact) {
    return exact
        ? exactAngle(problem, solution, m, i, j, k)
        : effectiveAngle(problem, solution, m, i, j, k);
  }

  /**
   * Lists every inconsistency of {@code solution} with {@code problem}; empty when the design is
   * sound.
   *
   * @param tolerance accepted brightness difference, in percent
   * @throws IllegalStateException if the solution is not satisfied
   */
  public static List<String> mismatches(Problem problem, Solution solution, int tolerance) {
    List<String> errors = new ArrayList<>();
    int pizzas = problem.getPizzas();
    int slices = problem.getSlices();
    for (int m = 0; m < problem.getImageCount(); ++m) {
      if (solution.rotation(m, 0) != 0) {
        errors.add("image " + m + ": first pizza is rotated by " + solution.rotation(m, 0));
      }
      boolean[] used = new boolean[pizzas];
      for (int s = 0; s < pizzas; ++s) {
        int i = solution.stackOrder(m, s);
        if (i < 0 || i >= pizzas || used[i]) {
          errors.add("image " + m + ": stack order is not a permutation at position " + s);
          break;
        }
        used[i] = true;
      }
      for (int i = 0; i < pizzas; ++i) {
        for (int j = 0; j < slices; ++j) {
          int expected = Math.floorMod(j - solution.rotation(m, i), slices);
          if (solution.correctedSector(j, m, i) != expected) {
            errors.add("image " + m + ", pizza " + i + ": slice " + j + " maps to "
                + solution.correctedSector(j, m, i) + ", expected " + expected);
          }
          for (int k = 0; k < problem.getWindows(); ++k) {
            int angle = effectiveAngle(problem, solution, m, i, j, k);
            if (solution.correctedAngle(m, i, j, k) != angle) {
              errors.add("image " + m + ", pizza " + i + " [" + j + "][" + k
                  + "]: corrected angle " + solution.correctedAngle(m, i, j, k)
                  + ", expected " + angle);
            }
          }
        }
      }
    }
    if (!errors.isEmpty()) {
      // Brightness is meaningless on top of a broken layout.
      return errors;
    }
    int[][][] actual = reconstruct(problem, solution);
    for (int m = 0; m < problem.getImageCount(); ++m) {
      for (int j = 0; j < slices; ++j) {
        for (int k = 0; k < problem.getWindows(); ++k) {
          int expected = problem.pixel(m, j, k);
          if (Math.abs(expected - actual[m][j][k]) > tolerance) {
            errors.add("image " + m + " [" + j + "][" + k + "]: expected " + expected
                + ", got " + actual[m][j][k]);
          }
        }
      }
    }
    return errors;
  }

  public static List<String> mismatches(Problem problem, Solution solution) {
    return mismatches(problem, solution, DEFAULT_TOLERANCE);
  }

  private SolutionVerifier() {}
}
