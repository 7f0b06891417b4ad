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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Finite automaton over brightness levels.
 *
 * <p>States are energies in [0, 100], labels are angle deltas from {@link ValidAngles}. Starting
 * from full energy, every frontier energy is pushed through every valid delta, once per interface
 * of a stack of the given depth.
 *
 * <p>Rounding to whole percents can split one physical energy into two neighbouring integers.
 * When a freshly computed energy is new to the current round but one of its direct neighbours is
 * not, it snaps onto that neighbour (the upper one first). This is a heuristic over rounding
 * artifacts, not exact physics. Each (energy, delta) pair is decided once and reused in later
 * rounds, so the automaton stays deterministic.
 */
public final class TransitionTable {
  /**
   * Builds the table for a stack of {@code pizzas} disks.
   *
   * @param angleResolution resolution passed to {@link ValidAngles}
   * @param pizzas stack depth; a single disk has no interface and yields an empty table
   */
  public static TransitionTable build(int angleResolution, int pizzas) {
    if (pizzas < 1) {
      throw new IllegalArgumentException("build: pizzas must be positive, got " + pizzas);
    }
    long[] deltas = ValidAngles.distinct(angleResolution);
    Map<Long, Integer> decided = new HashMap<>();
    NavigableSet<Transition> transitions = new TreeSet<>(Collections.reverseOrder());
    NavigableSet<Integer> frontier = new TreeSet<>();
    frontier.add(MalusLaw.FULL_ENERGY);
    for (int round = 1; round < pizzas; ++round) {
      frontier = step(frontier, deltas, decided, transitions);
    }
    return new TransitionTable(angleResolution, pizzas, new ArrayList<>(transitions));
  }

  private static NavigableSet<Integer> step(NavigableSet<Integer> frontier, long[] deltas,
      Map<Long, Integer> decided, NavigableSet<Transition> transitions) {
    NavigableSet<Integer> next = new TreeSet<>();
    for (int energy : frontier.descendingSet()) {
      for (long delta : deltas) {
        long key = energy * 1000L + delta;
        Integer out = decided.get(key);
        if (out == null) {
          out = snap(MalusLaw.attenuate(energy, delta), next);
          decided.put(key, out);
        }
        next.add(out);
        transitions.add(new Transition(energy, (int) delta, out));
      }
    }
    return next;
  }

  private static int snap(int energy, NavigableSet<Integer> discovered) {
    if (discovered.contains(energy)) {
      return energy;
    }
    if (discovered.contains(energy + 1)) {
      return energy + 1;
    }
    if (discovered.contains(energy - 1)) {
      return energy - 1;
    }
    return energy;
  }

  private TransitionTable(int angleResolution, int pizzas, List<Transition> transitions) {
    this.angleResolution = angleResolution;
    this.pizzas = pizzas;
    this.transitions = Collections.unmodifiableList(transitions);
  }

  /** Transitions sorted in reverse (descending energy in, then delta, then energy out). */
  public List<Transition> getTransitions() {
    return transitions;
  }

  public boolean isEmpty() {
    return transitions.isEmpty();
  }

  public int size() {
    return transitions.size();
  }

  /** Every energy some transition leads to. */
  public NavigableSet<Integer> finalEnergies() {
    NavigableSet<Integer> energies = new TreeSet<>();
    for (Transition t : transitions) {
      energies.add(t.getEnergyOut());
    }
    return energies;
  }

  public int getAngleResolution() {
    return angleResolution;
  }

  public int getPizzas() {
    return pizzas;
  }

  @Override
  public String toString() {
    return "TransitionTable(A=" + angleResolution + ", P=" + pizzas + ", " + transitions + ")";
  }

  private final int angleResolution;
  private final int pizzas;
  private final List<Transition> transitions;
}
