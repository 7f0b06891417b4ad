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

import java.util.Arrays;

/** Human readable listing of a design, one image at a time. */
public final class SolutionReport {
  /**
   * Formats the rotations, sector mappings and corrected angles of every image.
   *
   * @throws IllegalStateException if the solution is not satisfied
   */
  public static String format(Problem problem, Solution solution) {
    StringBuilder sb = new StringBuilder();
    for (int m = 0; m < problem.getImageCount(); ++m) {
      sb.append(String.format("offsets to reconstruct image %d: %s, stack order %s%n", m,
          rotationsOf(problem, solution, m), Arrays.toString(solution.stackOrder(m))));
      for (int i = 0; i < problem.getPizzas(); ++i) {
        sb.append(String.format("    pizza %d, rotation %d%n", i, solution.rotation(m, i)));
        for (int j = 0; j < problem.getSlices(); ++j) {
          sb.append(
              String.format("        %d -> %d%n", j, solution.correctedSector(j, m, i)));
        }
        sb.append("    corrected angles:\n");
        for (int j = 0; j < problem.getSlices(); ++j) {
          for (int k = 0; k < problem.getWindows(); ++k) {
            sb.append(String.format("            %d -> %d%n",
                solution.angle(i, j, k), solution.correctedAngle(m, i, j, k)));
          }
        }
      }
    }
    return sb.toString();
  }

  private static String rotationsOf(Problem problem, Solution solution, int m) {
    int[] rotations = new int[problem.getPizzas()];
    for (int i = 0; i < rotations.length; ++i) {
      rotations[i] = solution.rotation(m, i);
    }
    return Arrays.toString(rotations);
  }

  private SolutionReport() {}
}
