/*
 * Copyright (c) 2024-2025 The roaview Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.roaview.modules.dataprocessing.baselinecorrection;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable settings of the asymmetric least squares baseline fit.
 *
 * <ul>
 *   <li>lambda: smoothness. Larger values give stiffer, straighter baselines. Typical values
 *   range from 1e2 to 1e9.</li>
 *   <li>p: asymmetry in (0, 1). Small values (e.g. 0.01) let the baseline follow the low points
 *   and ignore peaks above it.</li>
 *   <li>iterations: maximum number of reweighting iterations.</li>
 *   <li>tolerance: optional relative change of the baseline between two iterations below which
 *   the iteration stops early.</li>
 *   <li>minDelta: optional absolute change below which the iteration stops early.</li>
 *   <li>startWavenumber: no baseline is fitted below this wavenumber, those points stay 0.</li>
 * </ul>
 */
public final class BaselineParameters {

  public static final String LAMBDA_KEY = "baseline.lambda";
  public static final String P_KEY = "baseline.p";
  public static final String ITERATIONS_KEY = "baseline.iterations";
  public static final String TOLERANCE_KEY = "baseline.tolerance";
  public static final String MIN_DELTA_KEY = "baseline.minDelta";
  public static final String START_WAVENUMBER_KEY = "baseline.startWavenumber";

  public static final String DEFAULTS_RESOURCE = "/baseline-defaults.properties";

  private static final BaselineParameters DEFAULTS = new BaselineParameters(1e5, 0.01, 10, null,
      null, 0d);

  private final double lambda;
  private final double p;
  private final int iterations;
  private final @Nullable Double tolerance;
  private final @Nullable Double minDelta;
  private final double startWavenumber;

  public BaselineParameters(double lambda, double p, int iterations) {
    this(lambda, p, iterations, null, null, 0d);
  }

  public BaselineParameters(double lambda, double p, int iterations, @Nullable Double tolerance,
      @Nullable Double minDelta, double startWavenumber) {
    checkArgument(lambda > 0 && Double.isFinite(lambda), "lambda must be > 0 but was %s", lambda);
    checkArgument(p > 0 && p < 1, "p must be in (0, 1) but was %s", p);
    checkArgument(iterations > 0, "iterations must be > 0 but was %s", iterations);
    checkArgument(tolerance == null || tolerance >= 0, "tolerance must be >= 0 but was %s",
        tolerance);
    checkArgument(minDelta == null || minDelta >= 0, "minDelta must be >= 0 but was %s",
        minDelta);
    checkArgument(!Double.isNaN(startWavenumber), "start wavenumber is NaN");
    this.lambda = lambda;
    this.p = p;
    this.iterations = iterations;
    this.tolerance = tolerance;
    this.minDelta = minDelta;
    this.startWavenumber = startWavenumber;
  }

  /**
   * lambda 1e5, p 0.01, 10 iterations, no early stop, fit from wavenumber 0.
   */
  public static @NotNull BaselineParameters defaults() {
    return DEFAULTS;
  }

  /**
   * Reads {@link #DEFAULTS_RESOURCE} from the class path. Falls back to {@link #defaults()} if the
   * resource is missing.
   */
  public static @NotNull BaselineParameters loadDefaults() {
    try (InputStream in = BaselineParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        return DEFAULTS;
      }
      final Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
    }
  }

  /**
   * Missing keys keep their default value. Blank tolerance or minDelta disable the early stop.
   *
   * @throws IllegalArgumentException if a value cannot be parsed or is out of range
   */
  public static @NotNull BaselineParameters fromProperties(@NotNull Properties properties) {
    final double lambda = parseDouble(properties, LAMBDA_KEY, DEFAULTS.lambda);
    final double p = parseDouble(properties, P_KEY, DEFAULTS.p);
    final int iterations = parseInt(properties, ITERATIONS_KEY, DEFAULTS.iterations);
    final Double tolerance = parseOptionalDouble(properties, TOLERANCE_KEY);
    final Double minDelta = parseOptionalDouble(properties, MIN_DELTA_KEY);
    final double start = parseDouble(properties, START_WAVENUMBER_KEY, DEFAULTS.startWavenumber);
    return new BaselineParameters(lambda, p, iterations, tolerance, minDelta, start);
  }

  private static double parseDouble(Properties properties, String key, double defaultValue) {
    final Double value = parseOptionalDouble(properties, key);
    return value == null ? defaultValue : value;
  }

  private static @Nullable Double parseOptionalDouble(Properties properties, String key) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
    }
  }

  private static int parseInt(Properties properties, String key, int defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
    }
  }

  public double getLambda() {
    return lambda;
  }

  public double getP() {
    return p;
  }

  public int getIterations() {
    return iterations;
  }

  public @Nullable Double getTolerance() {
    return tolerance;
  }

  public @Nullable Double getMinDelta() {
    return minDelta;
  }

  public double getStartWavenumber() {
    return startWavenumber;
  }

  public @NotNull BaselineParameters withStartWavenumber(double start) {
    return new BaselineParameters(lambda, p, iterations, tolerance, minDelta, start);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BaselineParameters that)) {
      return false;
    }
    return Double.compare(that.lambda, lambda) == 0 && Double.compare(that.p, p) == 0
        && iterations == that.iterations && Double.compare(that.startWavenumber, startWavenumber) == 0
        && Objects.equals(tolerance, that.tolerance) && Objects.equals(minDelta, that.minDelta);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lambda, p, iterations, tolerance, minDelta, startWavenumber);
  }

  @Override
  public String toString() {
    return "BaselineParameters{lambda=" + lambda + ", p=" + p + ", iterations=" + iterations
        + ", tolerance=" + tolerance + ", minDelta=" + minDelta + ", startWavenumber="
        + startWavenumber + "}";
  }
}
