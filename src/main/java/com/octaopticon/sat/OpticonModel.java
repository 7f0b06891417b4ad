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

package com.octaopticon.sat;

import com.octaopticon.Problem;
import com.octaopticon.Solution;
import com.octaopticon.physics.MalusLaw;
import com.octaopticon.physics.TransitionTable;
import com.octaopticon.physics.ValidAngles;

/**
 * Constraint model of an opticon.
 *
 * <p>Indices: pizza i, slice j, window k, image m, stack position s. For every image, each pizza
 * is turned by {@code rotation[m][i]} sectors and the pizzas are stacked in the order {@code
 * stackOrder[m]}. Light enters the bottom of the stack at full energy; the angle delta between two
 * vertically adjacent windows labels one step of the transition automaton, which has to end on the
 * target brightness of the pixel.
 */
public final class OpticonModel {
  private static final int HALF_TURN = 180;
  private static final int FULL_TURN = 360;

  /**
   * Allocates all variables and posts all constraints on {@code backend}.
   *
   * @param transitions table built for the problem's angle resolution and pizza count
   */
  public OpticonModel(ConstraintBackend backend, Problem problem, TransitionTable transitions) {
    if (transitions.getPizzas() != problem.getPizzas()
        || transitions.getAngleResolution() != problem.getAngleResolution()) {
      throw new IllegalArgumentException("OpticonModel: " + transitions
          + " does not match " + problem);
    }
    this.backend = backend;
    this.problem = problem;
    this.pizzas = problem.getPizzas();
    this.slices = problem.getSlices();
    this.windows = problem.getWindows();
    this.images = problem.getImageCount();

    this.angle = new int[pizzas][slices][windows];
    this.rotation = new int[images][pizzas];
    this.stackOrder = new int[images][pizzas];
    this.correctedSector = new int[slices][images][pizzas];
    this.correctedAngle = new int[images][pizzas][slices][windows];
    this.delta = new int[slices][windows][images][Math.max(0, pizzas - 1)];

    createDecisionVariables();
    addRotationCorrection();
    addAngleCorrection();
    addStackDeltas();
    addBrightnessAutomata(transitions);
  }

  private void createDecisionVariables() {
    long[] validAngles = ValidAngles.distinct(problem.getAngleResolution());
    for (int i = 0; i < pizzas; ++i) {
      for (int j = 0; j < slices; ++j) {
        for (int k = 0; k < windows; ++k) {
          angle[i][j][k] =
              backend.newIntVarFromValues(validAngles, "angle_" + i + "_" + j + "_" + k);
        }
      }
    }
    for (int m = 0; m < images; ++m) {
      for (int i = 0; i < pizzas; ++i) {
        rotation[m][i] = backend.newIntVar(0, slices - 1, "rotation_" + m + "_" + i);
      }
      // Offsets are relative to the first pizza.
      backend.addEquality(rotation[m][0], 0);
      for (int s = 0; s < pizzas; ++s) {
        stackOrder[m][s] = backend.newIntVar(0, pizzas - 1, "stack_order_" + m + "_" + s);
      }
      backend.addAllDifferent(stackOrder[m]);
    }
  }

  // correctedSector[j][m][i] == (j - rotation[m][i]) mod slices
  private void addRotationCorrection() {
    for (int j = 0; j < slices; ++j) {
      for (int m = 0; m < images; ++m) {
        for (int i = 0; i < pizzas; ++i) {
          int target = backend.newIntVar(0, slices - 1, "j_corrected_" + j + "_" + m + "_" + i);
          backend.addModuloEquality(target, rotation[m][i], -1, j + slices, slices);
          correctedSector[j][m][i] = target;
        }
      }
    }
  }

  // The window under logical sector j is read from the physical sector, then its axis turns with
  // the pizza by floor(360 / slices) degrees per sector:
  // turned == raw + degreesPerSlice * rotation, corrected == turned % 180.
  private void addAngleCorrection() {
    long degreesPerSlice = FULL_TURN / slices;
    long maxTurned = HALF_TURN - 1 + degreesPerSlice * (slices - 1);
    for (int m = 0; m < images; ++m) {
      for (int i = 0; i < pizzas; ++i) {
        for (int k = 0; k < windows; ++k) {
          int[] column = new int[slices];
          for (int j = 0; j < slices; ++j) {
            column[j] = angle[i][j][k];
          }
          for (int j = 0; j < slices; ++j) {
            String suffix = "_" + m + "_" + i + "_" + j + "_" + k;
            int raw = backend.newIntVar(0, HALF_TURN - 1, "angle_at" + suffix);
            backend.addElement(correctedSector[j][m][i], column, raw);
            int turned = backend.newIntVar(0, maxTurned, "angle_turned" + suffix);
            backend.addLinearEquality(turned, new int[] {raw, rotation[m][i]},
                new long[] {1, degreesPerSlice}, 0);
            int corrected = backend.newIntVar(0, HALF_TURN - 1, "angle_corrected" + suffix);
            backend.addModuloEquality(corrected, turned, 1, 0, HALF_TURN);
            correctedAngle[m][i][j][k] = corrected;
          }
        }
      }
    }
  }

  // delta[j][k][m][s - 1] == (stacked[s] - stacked[s - 1]) mod 180, where stacked[s] is the
  // corrected angle of the pizza at stack position s.
  private void addStackDeltas() {
    for (int m = 0; m < images; ++m) {
      for (int j = 0; j < slices; ++j) {
        for (int k = 0; k < windows; ++k) {
          int[] byPizza = new int[pizzas];
          for (int i = 0; i < pizzas; ++i) {
            byPizza[i] = correctedAngle[m][i][j][k];
          }
          int[] stacked = new int[pizzas];
          for (int s = 0; s < pizzas; ++s) {
            stacked[s] = backend.newIntVar(
                0, HALF_TURN - 1, "angle_stacked_" + m + "_" + j + "_" + k + "_" + s);
            backend.addElement(stackOrder[m][s], byPizza, stacked[s]);
          }
          for (int s = 1; s < pizzas; ++s) {
            String suffix = "_" + j + "_" + k + "_" + m + "_" + s;
            int difference =
                backend.newIntVar(-(HALF_TURN - 1), HALF_TURN - 1, "angle_diff" + suffix);
            backend.addLinearEquality(difference, new int[] {stacked[s], stacked[s - 1]},
                new long[] {1, -1}, 0);
            int d = backend.newIntVar(0, HALF_TURN - 1, "delta" + suffix);
            // Shifted by a half turn so the dividend stays non-negative.
            backend.addModuloEquality(d, difference, 1, HALF_TURN, HALF_TURN);
            delta[j][k][m][s - 1] = d;
          }
        }
      }
    }
  }

  private void addBrightnessAutomata(TransitionTable transitions) {
    if (pizzas == 1) {
      // Nothing to attenuate against, Problem already requires full brightness.
      return;
    }
    for (int m = 0; m < images; ++m) {
      for (int j = 0; j < slices; ++j) {
        for (int k = 0; k < windows; ++k) {
          backend.addAutomaton(delta[j][k][m], MalusLaw.FULL_ENERGY,
              new long[] {problem.pixel(m, j, k)}, transitions);
        }
      }
    }
  }

  /** Reads the values of the last successful solve into a {@link Solution}. */
  public Solution extract(double wallTime) {
    int[][][] angles = new int[pizzas][slices][windows];
    for (int i = 0; i < pizzas; ++i) {
      for (int j = 0; j < slices; ++j) {
        for (int k = 0; k < windows; ++k) {
          angles[i][j][k] = valueOf(angle[i][j][k]);
        }
      }
    }
    int[][] rotations = new int[images][pizzas];
    int[][] stackOrders = new int[images][pizzas];
    for (int m = 0; m < images; ++m) {
      for (int i = 0; i < pizzas; ++i) {
        rotations[m][i] = valueOf(rotation[m][i]);
        stackOrders[m][i] = valueOf(stackOrder[m][i]);
      }
    }
    int[][][] correctedSectors = new int[slices][images][pizzas];
    for (int j = 0; j < slices; ++j) {
      for (int m = 0; m < images; ++m) {
        for (int i = 0; i < pizzas; ++i) {
          correctedSectors[j][m][i] = valueOf(correctedSector[j][m][i]);
        }
      }
    }
    int[][][][] correctedAngles = new int[images][pizzas][slices][windows];
    for (int m = 0; m < images; ++m) {
      for (int i = 0; i < pizzas; ++i) {
        for (int j = 0; j < slices; ++j) {
          for (int k = 0; k < windows; ++k) {
            correctedAngles[m][i][j][k] = valueOf(correctedAngle[m][i][j][k]);
          }
        }
      }
    }
    int[][][][] deltas = new int[slices][windows][images][Math.max(0, pizzas - 1)];
    for (int j = 0; j < slices; ++j) {
      for (int k = 0; k < windows; ++k) {
        for (int m = 0; m < images; ++m) {
          for (int s = 1; s < pizzas; ++s) {
            deltas[j][k][m][s - 1] = valueOf(delta[j][k][m][s - 1]);
          }
        }
      }
    }
    return Solution.satisfied(
        wallTime, angles, rotations, stackOrders, correctedSectors, correctedAngles, deltas);
  }

  private int valueOf(int var) {
    return (int) backend.value(var);
  }

  private final ConstraintBackend backend;
  private final Problem problem;
  private final int pizzas;
  private final int slices;
  private final int windows;
  private final int images;

  // Variable handles.
  private final int[][][] angle;
  private final int[][] rotation;
  private final int[][] stackOrder;
  private final int[][][] correctedSector;
  private final int[][][][] correctedAngle;
  private final int[][][][] delta;
}
