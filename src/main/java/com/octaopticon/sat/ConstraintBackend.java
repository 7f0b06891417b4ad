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

import com.octaopticon.SolveStatus;
import com.octaopticon.physics.TransitionTable;

/**
 * Integer constraint solver capability the opticon model is written against.
 *
 * <p>Variables are referred to by the handle returned at creation. A backend holds one model and
 * is used for a single solve.
 */
public interface ConstraintBackend {
  /** Creates a variable with domain [lb, ub] and returns its handle. */
  int newIntVar(long lb, long ub, String name);

  /** Creates a variable whose domain is exactly {@code values}. */
  int newIntVarFromValues(long[] values, String name);

  /** Adds {@code var == value}. */
  void addEquality(int var, long value);

  /** Adds {@code target == sum(coeffs[i] * vars[i]) + offset}. */
  void addLinearEquality(int target, int[] vars, long[] coeffs, long offset);

  /**
   * Adds {@code target == (coeff * var + offset) % modulus}.
   *
   * <p>The dividend is affine in a single variable; sums go through {@link #addLinearEquality}
   * first. Callers keep the dividend non-negative, so the result is the usual representative in
   * [0, modulus).
   */
  void addModuloEquality(int target, int var, long coeff, long offset, long modulus);

  /** Adds {@code target == array[index]}. */
  void addElement(int index, int[] array, int target);

  /** Adds pairwise difference of {@code vars}. */
  void addAllDifferent(int[] vars);

  /**
   * Forces the values of {@code sequence} to label a path of {@code table}, from {@code
   * startingState} to one of {@code finalStates}. States are energies, labels angle deltas.
   */
  void addAutomaton(int[] sequence, long startingState, long[] finalStates, TransitionTable table);

  /**
   * Runs the search.
   *
   * @throws ModelInvalidException if the posted model is malformed
   */
  SolveStatus solve(SolverOptions options);

  /** Value of {@code var} in the solution found by the last {@link #solve}. */
  long value(int var);

  /** Wall-clock seconds spent in the last {@link #solve}. */
  double wallTime();
}
