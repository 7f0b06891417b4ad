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
import com.octaopticon.SolutionReport;
import com.octaopticon.SolveStatus;
import com.octaopticon.physics.TransitionTable;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds and solves the opticon model of a {@link Problem}.
 *
 * <p>Every call works on a fresh backend; nothing is shared between calls, so distinct problems
 * can be solved concurrently from several threads. An {@link SolveStatus#UNKNOWN} outcome is final
 * and never retried.
 */
public final class OpticonSolver {
  private static final Logger logger = Logger.getLogger(OpticonSolver.class.getName());

  /** Solves with the CP-SAT backend. */
  public OpticonSolver() {
    this(CpSatBackend::new);
  }

  /** Solves with backends obtained from {@code backendFactory}, one per call. */
  public OpticonSolver(Supplier<? extends ConstraintBackend> backendFactory) {
    this.backendFactory = backendFactory;
  }

  public Solution solve(Problem problem) {
    return solve(problem, SolverOptions.defaults());
  }

  /**
   * Solves {@code problem} within {@code options.getMaxTimeInSeconds()}.
   *
   * @throws ModelInvalidException if the solver rejects the generated model
   */
  public Solution solve(Problem problem, SolverOptions options) {
    logger.info("Solving " + problem + " with " + options);
    TransitionTable transitions =
        TransitionTable.build(problem.getAngleResolution(), problem.getPizzas());
    logger.fine(() -> "Transition table: " + transitions.size() + " transitions");

    ConstraintBackend backend = backendFactory.get();
    OpticonModel model = new OpticonModel(backend, problem, transitions);
    SolveStatus status = backend.solve(options);
    double wallTime = backend.wallTime();
    logger.info(String.format("%s in %.3f s", status, wallTime));

    if (status != SolveStatus.SATISFIED) {
      return Solution.withoutValues(status, wallTime);
    }
    Solution solution = model.extract(wallTime);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(SolutionReport.format(problem, solution));
    }
    return solution;
  }

  private final Supplier<? extends ConstraintBackend> backendFactory;
}
