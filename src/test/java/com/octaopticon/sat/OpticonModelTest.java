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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.octaopticon.Problem;
import com.octaopticon.Solution;
import com.octaopticon.SolveStatus;
import com.octaopticon.physics.TransitionTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests the constraints posted by the opticon model, without a real solver. */
public final class OpticonModelTest {
  /** Records every call, answers {@link #value} from {@link #values}. */
  static final class RecordingBackend implements ConstraintBackend {
    final List<String> names = new ArrayList<>();
    final List<long[]> domains = new ArrayList<>();
    final Map<Integer, Long> equalities = new HashMap<>();
    final List<long[]> moduloOffsets = new ArrayList<>();
    final List<long[]> moduloDividends = new ArrayList<>();
    final List<int[]> linearTerms = new ArrayList<>();
    final List<long[]> linearCoeffs = new ArrayList<>();
    final List<Integer> linearTargets = new ArrayList<>();
    final List<int[]> elements = new ArrayList<>();
    final List<int[]> allDifferents = new ArrayList<>();
    final List<int[]> automata = new ArrayList<>();
    final List<Long> finalStates = new ArrayList<>();
    final Map<Integer, Long> values = new HashMap<>();

    @Override
    public int newIntVar(long lb, long ub, String name) {
      names.add(name);
      domains.add(new long[] {lb, ub});
      return names.size() - 1;
    }

    @Override
    public int newIntVarFromValues(long[] domain, String name) {
      names.add(name);
      domains.add(domain.clone());
      return names.size() - 1;
    }

    @Override
    public void addEquality(int var, long value) {
      equalities.put(var, value);
    }

    @Override
    public void addLinearEquality(int target, int[] vars, long[] coeffs, long offset) {
      assertThat(offset).isEqualTo(0L);
      linearTargets.add(target);
      linearTerms.add(vars.clone());
      linearCoeffs.add(coeffs.clone());
    }

    @Override
    public void addModuloEquality(int target, int var, long coeff, long offset, long modulus) {
      moduloOffsets.add(new long[] {target, offset, modulus});
      moduloDividends.add(new long[] {var, coeff, offset});
    }

    long lowerBound(int var) {
      long[] domain = domains.get(var);
      return domain[0];
    }

    long upperBound(int var) {
      long[] domain = domains.get(var);
      return domain[domain.length - 1];
    }

    @Override
    public void addElement(int index, int[] array, int target) {
      elements.add(array.clone());
    }

    @Override
    public void addAllDifferent(int[] vars) {
      allDifferents.add(vars.clone());
    }

    @Override
    public void addAutomaton(
        int[] sequence, long startingState, long[] finals, TransitionTable table) {
      assertThat(startingState).isEqualTo(100L);
      assertThat(finals).hasLength(1);
      automata.add(sequence.clone());
      finalStates.add(finals[0]);
    }

    @Override
    public SolveStatus solve(SolverOptions options) {
      return SolveStatus.SATISFIED;
    }

    @Override
    public long value(int var) {
      return values.getOrDefault(var, 0L);
    }

    @Override
    public double wallTime() {
      return 0.25;
    }
  }

  private static Problem problem(int pizzas) {
    int[][][] images = new int[2][4][2];
    for (int j = 0; j < 4; ++j) {
      images[0][j][0] = 100;
      images[1][j][1] = pizzas == 1 ? 100 : 0;
      images[1][j][0] = 100;
      images[0][j][1] = 100;
    }
    return new Problem(pizzas, 4, 2, 8, images);
  }

  @Test
  public void testModel_constraintCounts() {
    System.out.println("testModel_constraintCounts");
    RecordingBackend backend = new RecordingBackend();
    Problem problem = problem(3);
    new OpticonModel(backend, problem, TransitionTable.build(8, 3));

    // One fixed rotation and one permutation per image.
    assertThat(backend.equalities).hasSize(2);
    assertThat(backend.equalities.values()).containsExactly(0L, 0L);
    assertThat(backend.allDifferents).hasSize(2);
    assertThat(backend.allDifferents.get(0)).hasLength(3);
    // Sector correction (4 * 2 * 3) + angle correction (2 * 3 * 4 * 2) + deltas (2 * 4 * 2 * 2).
    assertThat(backend.moduloOffsets).hasSize(24 + 48 + 32);
    // Turned angles and stacked differences feed the last two.
    assertThat(backend.linearTargets).hasSize(48 + 32);
    // Sector lookups + stack position lookups.
    assertThat(backend.elements).hasSize(48 + 48);
    assertThat(backend.automata).hasSize(16);
    for (int[] sequence : backend.automata) {
      assertThat(sequence).hasLength(2);
    }
    assertThat(backend.finalStates).containsAtLeast(0L, 100L);
  }

  @Test
  public void testModel_domains() {
    System.out.println("testModel_domains");
    RecordingBackend backend = new RecordingBackend();
    new OpticonModel(backend, problem(2), TransitionTable.build(8, 2));
    int angle = backend.names.indexOf("angle_1_3_1");
    assertThat(backend.domains.get(angle)).asList().containsExactly(0L, 45L, 90L, 135L).inOrder();
    int rotation = backend.names.indexOf("rotation_1_1");
    assertThat(backend.domains.get(rotation)).asList().containsExactly(0L, 3L).inOrder();
    int order = backend.names.indexOf("stack_order_0_1");
    assertThat(backend.domains.get(order)).asList().containsExactly(0L, 1L).inOrder();
    assertThat(backend.equalities).containsKey(backend.names.indexOf("rotation_0_0"));
    assertThat(backend.equalities).containsKey(backend.names.indexOf("rotation_1_0"));
  }

  @Test
  public void testModel_moduloDividendsStayNonNegative() {
    System.out.println("testModel_moduloDividendsStayNonNegative");
    RecordingBackend backend = new RecordingBackend();
    new OpticonModel(backend, problem(2), TransitionTable.build(8, 2));
    for (long[] modulo : backend.moduloOffsets) {
      String name = backend.names.get((int) modulo[0]);
      if (name.startsWith("j_corrected_")) {
        int j = Integer.parseInt(name.split("_")[2]);
        assertThat(modulo[1]).isEqualTo(j + 4L);
        assertThat(modulo[2]).isEqualTo(4L);
      } else if (name.startsWith("delta_")) {
        assertThat(modulo[1]).isEqualTo(180L);
        assertThat(modulo[2]).isEqualTo(180L);
      } else {
        assertThat(name).startsWith("angle_corrected_");
        assertThat(modulo[2]).isEqualTo(180L);
      }
    }
  }

  @Test
  public void testModel_sumsAreBoundedBeforeModulo() {
    System.out.println("testModel_sumsAreBoundedBeforeModulo");
    RecordingBackend backend = new RecordingBackend();
    new OpticonModel(backend, problem(3), TransitionTable.build(8, 3));
    // Every sum is stored in a variable wide enough for all of its terms.
    for (int c = 0; c < backend.linearTargets.size(); ++c) {
      int[] vars = backend.linearTerms.get(c);
      long[] coeffs = backend.linearCoeffs.get(c);
      long min = 0;
      long max = 0;
      for (int t = 0; t < vars.length; ++t) {
        long a = coeffs[t] * backend.lowerBound(vars[t]);
        long b = coeffs[t] * backend.upperBound(vars[t]);
        min += Math.min(a, b);
        max += Math.max(a, b);
      }
      int target = backend.linearTargets.get(c);
      assertThat(backend.lowerBound(target)).isAtMost(min);
      assertThat(backend.upperBound(target)).isAtLeast(max);
    }
    // Each modulo reads one variable, and its dividend cannot go negative.
    for (long[] dividend : backend.moduloDividends) {
      int var = (int) dividend[0];
      long a = dividend[1] * backend.lowerBound(var);
      long b = dividend[1] * backend.upperBound(var);
      assertThat(Math.min(a, b) + dividend[2]).isAtLeast(0L);
    }
  }

  @Test
  public void testModel_singlePizzaHasNoAutomaton() {
    System.out.println("testModel_singlePizzaHasNoAutomaton");
    RecordingBackend backend = new RecordingBackend();
    new OpticonModel(backend, problem(1), TransitionTable.build(8, 1));
    assertThat(backend.automata).isEmpty();
    assertThat(backend.allDifferents).hasSize(2);
  }

  @Test
  public void testModel_rejectsForeignTransitionTable() {
    System.out.println("testModel_rejectsForeignTransitionTable");
    assertThrows(IllegalArgumentException.class,
        () -> new OpticonModel(new RecordingBackend(), problem(3), TransitionTable.build(8, 2)));
    assertThrows(IllegalArgumentException.class,
        () -> new OpticonModel(new RecordingBackend(), problem(3), TransitionTable.build(4, 3)));
  }

  @Test
  public void testExtract_readsEveryTable() {
    System.out.println("testExtract_readsEveryTable");
    RecordingBackend backend = new RecordingBackend();
    Problem problem = problem(2);
    OpticonModel model = new OpticonModel(backend, problem, TransitionTable.build(8, 2));
    backend.values.put(backend.names.indexOf("angle_1_2_0"), 135L);
    backend.values.put(backend.names.indexOf("rotation_1_1"), 3L);
    backend.values.put(backend.names.indexOf("stack_order_1_0"), 1L);
    backend.values.put(backend.names.indexOf("j_corrected_2_1_1"), 3L);
    backend.values.put(backend.names.indexOf("angle_corrected_0_1_2_1"), 45L);
    backend.values.put(backend.names.indexOf("delta_3_1_1_1"), 90L);

    Solution solution = model.extract(backend.wallTime());
    assertThat(solution.getStatus()).isEqualTo(SolveStatus.SATISFIED);
    assertThat(solution.getWallTime()).isEqualTo(0.25);
    assertThat(solution.getImageCount()).isEqualTo(2);
    assertThat(solution.angle(1, 2, 0)).isEqualTo(135);
    assertThat(solution.rotation(1, 1)).isEqualTo(3);
    assertThat(solution.stackOrder(1, 0)).isEqualTo(1);
    assertThat(solution.correctedSector(2, 1, 1)).isEqualTo(3);
    assertThat(solution.correctedAngle(0, 1, 2, 1)).isEqualTo(45);
    assertThat(solution.delta(3, 1, 1, 1)).isEqualTo(90);
    assertThat(solution.delta(3, 1, 0, 1)).isEqualTo(0);
  }
}
