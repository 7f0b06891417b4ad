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

import com.google.ortools.sat.SatParameters;
import com.google.protobuf.TextFormat;
import java.util.Properties;

/**
 * Search settings for one solve.
 *
 * <p>Options are applied onto the solver's {@link SatParameters.Builder}. Extra parameters given in
 * protobuf text format (for instance {@code "random_seed: 3 linearization_level: 2"}) are merged
 * last and override the dedicated fields.
 */
public final class SolverOptions {
  /** Property key for {@link Builder#setMaxTimeInSeconds(double)}. */
  public static final String MAX_TIME_KEY = "opticon.solver.maxTimeInSeconds";
  /** Property key for {@link Builder#setNumWorkers(int)}. */
  public static final String NUM_WORKERS_KEY = "opticon.solver.numWorkers";
  /** Property key for {@link Builder#setLogSearchProgress(boolean)}. */
  public static final String LOG_SEARCH_KEY = "opticon.solver.logSearchProgress";
  /** Property key for {@link Builder#setExtraParameters(String)}. */
  public static final String PARAMETERS_KEY = "opticon.solver.parameters";

  public static final double DEFAULT_MAX_TIME_IN_SECONDS = 60.0;

  public static Builder newBuilder() {
    return new Builder();
  }

  public static SolverOptions defaults() {
    return newBuilder().build();
  }

  /** Reads the {@code opticon.solver.*} keys; missing keys keep their defaults. */
  public static SolverOptions fromProperties(Properties properties) {
    Builder builder = newBuilder();
    String maxTime = properties.getProperty(MAX_TIME_KEY);
    if (maxTime != null) {
      builder.setMaxTimeInSeconds(parseDouble(MAX_TIME_KEY, maxTime));
    }
    String workers = properties.getProperty(NUM_WORKERS_KEY);
    if (workers != null) {
      builder.setNumWorkers(parseInt(NUM_WORKERS_KEY, workers));
    }
    String log = properties.getProperty(LOG_SEARCH_KEY);
    if (log != null) {
      builder.setLogSearchProgress(Boolean.parseBoolean(log.trim()));
    }
    String extra = properties.getProperty(PARAMETERS_KEY);
    if (extra != null) {
      builder.setExtraParameters(extra);
    }
    return builder.build();
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + ": not a number: " + value, e);
    }
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + ": not an integer: " + value, e);
    }
  }

  /** Builder for {@link SolverOptions}. */
  public static final class Builder {
    private double maxTimeInSeconds = DEFAULT_MAX_TIME_IN_SECONDS;
    private int numWorkers;
    private boolean logSearchProgress;
    private SatParameters extraParameters = SatParameters.getDefaultInstance();

    private Builder() {}

    /** Wall-clock budget of the search. */
    public Builder setMaxTimeInSeconds(double maxTimeInSeconds) {
      if (!(maxTimeInSeconds > 0)) {
        throw new IllegalArgumentException(
            "setMaxTimeInSeconds: must be positive, got " + maxTimeInSeconds);
      }
      this.maxTimeInSeconds = maxTimeInSeconds;
      return this;
    }

    /** Parallel search workers, 0 lets the solver pick. */
    public Builder setNumWorkers(int numWorkers) {
      if (numWorkers < 0) {
        throw new IllegalArgumentException("setNumWorkers: must be >= 0, got " + numWorkers);
      }
      this.numWorkers = numWorkers;
      return this;
    }

    /** Forwards the solver's search log to the backend logger. */
    public Builder setLogSearchProgress(boolean logSearchProgress) {
      this.logSearchProgress = logSearchProgress;
      return this;
    }

    /**
     * Parses {@code SatParameters} in protobuf text format.
     *
     * @throws IllegalArgumentException if the text does not parse
     */
    public Builder setExtraParameters(String text) {
      SatParameters.Builder parsed = SatParameters.newBuilder();
      try {
        TextFormat.merge(text, parsed);
      } catch (TextFormat.ParseException e) {
        throw new IllegalArgumentException("setExtraParameters: " + e.getMessage(), e);
      }
      this.extraParameters = parsed.build();
      return this;
    }

    public SolverOptions build() {
      return new SolverOptions(this);
    }
  }

  private SolverOptions(Builder builder) {
    this.maxTimeInSeconds = builder.maxTimeInSeconds;
    this.numWorkers = builder.numWorkers;
    this.logSearchProgress = builder.logSearchProgress;
    this.extraParameters = builder.extraParameters;
  }

  /** Copies these options onto the solver parameters. */
  public void applyTo(SatParameters.Builder parameters) {
    parameters.setMaxTimeInSeconds(maxTimeInSeconds);
    if (numWorkers > 0) {
      parameters.setNumWorkers(numWorkers);
    }
    parameters.setLogSearchProgress(logSearchProgress);
    parameters.setLogToStdout(false);
    parameters.mergeFrom(extraParameters);
  }

  public double getMaxTimeInSeconds() {
    return maxTimeInSeconds;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  public boolean isLogSearchProgress() {
    return logSearchProgress;
  }

  public SatParameters getExtraParameters() {
    return extraParameters;
  }

  @Override
  public String toString() {
    return "SolverOptions(maxTimeInSeconds=" + maxTimeInSeconds + ", numWorkers=" + numWorkers
        + ", logSearchProgress=" + logSearchProgress + ")";
  }

  private final double maxTimeInSeconds;
  private final int numWorkers;
  private final boolean logSearchProgress;
  private final SatParameters extraParameters;
}
