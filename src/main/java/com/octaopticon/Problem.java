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

/**
 * Immutable input: the disk geometry and the target images to reproduce.
 *
 * <p>Images are indexed {@code images[m][j][k]}: image m, sector (slice) j, window k. Values are
 * brightness percentages in [0, 100].
 */
public final class Problem {
  /**
   * Creates a problem.
   *
   * @param pizzas number of stacked disks
   * @param slices sectors per disk
   * @param windows windows per sector
   * @param angleResolution equal subdivisions of a full turn available for filter angles
   * @param images target images, each {@code slices x windows}
   * @throws InvalidProblemException if a count is not positive or an image is malformed
   */
  public Problem(int pizzas, int slices, int windows, int angleResolution, int[][][] images) {
    checkPositive("pizzas", pizzas);
    checkPositive("slices", slices);
    checkPositive("windows", windows);
    checkPositive("angleResolution", angleResolution);
    if (images == null || images.length == 0) {
      throw new InvalidProblemException("Problem", "at least one image is required");
    }
    this.pizzas = pizzas;
    this.slices = slices;
    this.windows = windows;
    this.angleResolution = angleResolution;
    this.images = new int[images.length][slices][windows];
    for (int m = 0; m < images.length; ++m) {
      copyImage(m, images[m]);
    }
  }

  private static void checkPositive(String name, int value) {
    if (value < 1) {
      throw new InvalidProblemException("Problem", name + " must be positive, got " + value);
    }
  }

  private void copyImage(int m, int[][] image) {
    if (image == null || image.length != slices) {
      throw new InvalidProblemException(
          "Problem", "image " + m + " must have " + slices + " slices");
    }
    for (int j = 0; j < slices; ++j) {
      if (image[j] == null || image[j].length != windows) {
        throw new InvalidProblemException("Problem",
            "image " + m + ", slice " + j + " must have " + windows + " windows");
      }
      for (int k = 0; k < windows; ++k) {
        int value = image[j][k];
        if (value < 0 || value > MalusLaw.FULL_ENERGY) {
          throw new InvalidProblemException("Problem",
              "image " + m + " [" + j + "][" + k + "] = " + value + " is outside [0, 100]");
        }
        // Without a second filter nothing attenuates the light.
        if (pizzas == 1 && value != MalusLaw.FULL_ENERGY) {
          throw new InvalidProblemException("Problem",
              "a single pizza only shows full brightness, image " + m + " [" + j + "][" + k
                  + "] = " + value);
        }
        images[m][j][k] = value;
      }
    }
  }

  public int getPizzas() {
    return pizzas;
  }

  public int getSlices() {
    return slices;
  }

  public int getWindows() {
    return windows;
  }

  public int getAngleResolution() {
    return angleResolution;
  }

  public int getImageCount() {
    return images.length;
  }

  /** Target brightness of image m at sector j, window k. */
  public int pixel(int m, int j, int k) {
    return images[m][j][k];
  }

  /** Returns a copy of the images. */
  public int[][][] getImages() {
    int[][][] copy = new int[images.length][slices][];
    for (int m = 0; m < images.length; ++m) {
      for (int j = 0; j < slices; ++j) {
        copy[m][j] = images[m][j].clone();
      }
    }
    return copy;
  }

  @Override
  public String toString() {
    return "Problem(pizzas=" + pizzas + ", slices=" + slices + ", windows=" + windows
        + ", angleResolution=" + angleResolution + ", images=" + images.length + ")";
  }

  private final int pizzas;
  private final int slices;
  private final int windows;
  private final int angleResolution;
  private final int[][][] images;
}
