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

import com.google.ortools.sat.SatParameters;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests solver option handling. */
public final class SolverOptionsTest {
  @Test
  public void testDefaults() {
    System.out.println("testDefaults");
    SolverOptions options = SolverOptions.defaults();
    SatParameters.Builder parameters = SatParameters.newBuilder();
    options.applyTo(parameters);
    assertThat(parameters.getMaxTimeInSeconds())
        .isEqualTo(SolverOptions.DEFAULT_MAX_TIME_IN_SECONDS);
    assertThat(parameters.hasNumWorkers()).isFalse();
    assertThat(parameters.getLogSearchProgress()).isFalse();
    assertThat(parameters.getLogToStdout()).isFalse();
  }

  @Test
  public void testApplyTo_extraParametersOverride() {
    System.out.println("testApplyTo_extraParametersOverride");
    SolverOptions options = SolverOptions.newBuilder()
        .setMaxTimeInSeconds(5.0)
        .setNumWorkers(4)
        .setExtraParameters("random_seed: 7 num_workers: 2")
        .build();
    SatParameters.Builder parameters = SatParameters.newBuilder();
    options.applyTo(parameters);
    assertThat(parameters.getMaxTimeInSeconds()).isEqualTo(5.0);
    assertThat(parameters.getRandomSeed()).isEqualTo(7);
    assertThat(parameters.getNumWorkers()).isEqualTo(2);
  }

  @Test
  public void testFromProperties() {
    System.out.println("testFromProperties");
    Properties properties = new Properties();
    properties.setProperty(SolverOptions.MAX_TIME_KEY, " 2.5 ");
    properties.setProperty(SolverOptions.NUM_WORKERS_KEY, "3");
    properties.setProperty(SolverOptions.LOG_SEARCH_KEY, "true");
    properties.setProperty(SolverOptions.PARAMETERS_KEY, "linearization_level: 2");
    SolverOptions options = SolverOptions.fromProperties(properties);
    assertThat(options.getMaxTimeInSeconds()).isEqualTo(2.5);
    assertThat(options.getNumWorkers()).isEqualTo(3);
    assertThat(options.isLogSearchProgress()).isTrue();
    assertThat(options.getExtraParameters().getLinearizationLevel()).isEqualTo(2);
  }

  @Test
  public void testFromProperties_emptyKeepsDefaults() {
    System.out.println("testFromProperties_emptyKeepsDefaults");
    SolverOptions options = SolverOptions.fromProperties(new Properties());
    assertThat(options.getMaxTimeInSeconds())
        .isEqualTo(SolverOptions.DEFAULT_MAX_TIME_IN_SECONDS);
    assertThat(options.getNumWorkers()).isEqualTo(0);
  }

  @Test
  public void testInvalidValues() {
    System.out.println("testInvalidValues");
    assertThrows(IllegalArgumentException.class,
        () -> SolverOptions.newBuilder().setMaxTimeInSeconds(0));
    assertThrows(IllegalArgumentException.class,
        () -> SolverOptions.newBuilder().setNumWorkers(-1));
    assertThrows(IllegalArgumentException.class,
        () -> SolverOptions.newBuilder().setExtraParameters("no_such_field: 1"));
    Properties properties = new Properties();
    properties.setProperty(SolverOptions.NUM_WORKERS_KEY, "many");
    assertThrows(IllegalArgumentException.class, () -> SolverOptions.fromProperties(properties));
  }
}
