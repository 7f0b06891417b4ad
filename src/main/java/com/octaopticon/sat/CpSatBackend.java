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

import com.google.ortools.Loader;
import com.google.ortools.sat.AutomatonConstraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.util.Domain;
import com.octaopticon.SolveStatus;
import com.octaopticon.physics.Transition;
import com.octaopticon.physics.TransitionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/** {@link ConstraintBackend} backed by the OR-Tools CP-SAT solver. */
public final class CpSatBackend implements ConstraintBackend {
  private static final Logger logger = Logger.getLogger(CpSatBackend.class.getName());

  public CpSatBackend() {
    Loader.loadNativeLibraries();
    this.model = new CpModel();
    this.solver = new CpSolver();
    this.variables = new ArrayList<>();
  }

  @Override
  public int newIntVar(long lb, long ub, String name) {
    return register(model.newIntVar(lb, ub, name));
  }

  @Override
  public int newIntVarFromValues(long[] values, String name) {
    return register(model.newIntVarFromDomain(Domain.fromValues(values), name));
  }

  private int register(IntVar var) {
    variables.add(var);
    return variables.size() - 1;
  }

  @Override
  public void addEquality(int var, long value) {
    model.addEquality(variables.get(var), value);
  }

  @Override
  public void addLinearEquality(int target, int[] vars, long[] coeffs, long offset) {
    if (vars.length != coeffs.length) {
      throw new CpModel.MismatchedArrayLengths("addLinearEquality", "vars", "coeffs");
    }
    LinearExprBuilder sum = LinearExpr.newBuilder();
    for (int i = 0; i < vars.length; ++i) {
      sum.addTerm(variables.get(vars[i]), coeffs[i]);
    }
    sum.add(offset);
    model.addEquality(variables.get(target), sum);
  }

  @Override
  public void addModuloEquality(int target, int var, long coeff, long offset, long modulus) {
    // CP-SAT only accepts an affine expression of one variable as the dividend.
    LinearExprBuilder dividend =
        LinearExpr.newBuilder().addTerm(variables.get(var), coeff).add(offset);
    model.addModuloEquality(variables.get(target), dividend, modulus);
  }

  @Override
  public void addElement(int index, int[] array, int target) {
    model.addElement(variables.get(index), toIntVars(array), variables.get(target));
  }

  @Override
  public void addAllDifferent(int[] vars) {
    model.addAllDifferent(toIntVars(vars));
  }

  @Override
  public void addAutomaton(
      int[] sequence, long startingState, long[] finalStates, TransitionTable table) {
    AutomatonConstraint automaton =
        model.addAutomaton(toIntVars(sequence), startingState, finalStates);
    for (Transition t : table.getTransitions()) {
      automaton.addTransition(t.getEnergyIn(), t.getEnergyOut(), t.getAngleDelta());
    }
  }

  private IntVar[] toIntVars(int[] handles) {
    IntVar[] vars = new IntVar[handles.length];
    for (int i = 0; i < handles.length; ++i) {
      vars[i] = variables.get(handles[i]);
    }
    return vars;
  }

  @Override
  public SolveStatus solve(SolverOptions options) {
    options.applyTo(solver.getParameters());
    if (options.isLogSearchProgress()) {
      solver.setLogCallback(logger::info);
    }
    logger.fine(() -> "Model: " + variables.size() + " variables, " + model.modelStats());
    CpSolverStatus status = solver.solve(model);
    logger.fine(solver::responseStats);
    switch (status) {
      case OPTIMAL:
      case FEASIBLE:
        return SolveStatus.SATISFIED;
      case INFEASIBLE:
        return SolveStatus.INFEASIBLE;
      case UNKNOWN:
        return SolveStatus.UNKNOWN;
      case MODEL_INVALID:
        String reason = model.validate();
        throw new ModelInvalidException(
            "solve", reason.isEmpty() ? solver.getSolutionInfo() : reason);
      default:
        throw new IllegalStateException("solve: unexpected solver status " + status);
    }
  }

  @Override
  public long value(int var) {
    return solver.value(variables.get(var));
  }

  @Override
  public double wallTime() {
    return solver.wallTime();
  }

  private final CpModel model;
  private final CpSolver solver;
  private final List<IntVar> variables;
}
