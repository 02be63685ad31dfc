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

package io.github.roaview.modules.dataprocessing.baselinecorrection.asls;

import static com.google.common.base.Preconditions.checkArgument;

import io.github.roaview.modules.dataprocessing.baselinecorrection.BaselineParameters;
import io.github.roaview.modules.dataprocessing.baselinecorrection.BaselineSolver;
import io.github.roaview.modules.dataprocessing.baselinecorrection.DegenerateSpectrumException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.util.MathArrays;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Asymmetric least squares baseline (Eilers and Boelens, 2005). Iteratively solves
 * <pre>(W + lambda * D'D) z = W y</pre>
 * where D is the second difference operator and W holds weights p for points above the current
 * baseline and 1-p for points below. Small p makes the baseline follow the lower envelope and
 * ignore peaks.
 * <p>
 * If a linear solve fails numerically the previous estimate is kept and the iteration continues.
 * Only inputs that cannot be fitted at all raise {@link DegenerateSpectrumException}.
 */
public class AslsBaselineSolver implements BaselineSolver {

  private static final Logger logger = Logger.getLogger(AslsBaselineSolver.class.getName());

  /**
   * Weights are kept in [EPS, 1-EPS], also used to guard the relative change.
   */
  public static final double EPS = 1e-8;

  public static final int MIN_NUMBER_OF_VALUES = 3;

  @Override
  public double @NotNull [] fit(double @NotNull [] intensities,
      @NotNull BaselineParameters parameters) {
    return fit(intensities, parameters.getLambda(), parameters.getP(), parameters.getIterations(),
        parameters.getTolerance(), parameters.getMinDelta());
  }

  /**
   * @param y          intensities
   * @param lambda     smoothness
   * @param p          asymmetry
   * @param iterations maximum number of iterations
   * @param tolerance  relative change for an early stop or null
   * @param minDelta   absolute change for an early stop or null
   * @return the baseline, same length as y
   */
  public double @NotNull [] fit(double @NotNull [] y, double lambda, double p, int iterations,
      @Nullable Double tolerance, @Nullable Double minDelta) {
    checkArgument(lambda > 0, "lambda must be > 0 but was %s", lambda);
    checkArgument(p > 0 && p < 1, "p must be in (0, 1) but was %s", p);
    checkArgument(iterations > 0, "iterations must be > 0 but was %s", iterations);
    checkFittable(y);
    final int n = y.length;
    final PentadiagonalSystem penalty = PentadiagonalSystem.secondDifferencePenalty(n, lambda);

    final double[] w = new double[n];
    Arrays.fill(w, 1d);
    final double[] wy = new double[n];

    double[] z = y.clone();
    for (int k = 0; k < iterations; k++) {
      for (int i = 0; i < n; i++) {
        wy[i] = w[i] * y[i];
      }

      final double[] previous = z;
      z = solveOrKeep(penalty, w, wy, previous, k);

      for (int i = 0; i < n; i++) {
        final double weight = y[i] > z[i] ? p : 1d - p;
        w[i] = Math.min(1d - EPS, Math.max(EPS, weight));
      }

      if (k > 0) {
        final double delta = MathArrays.distance(z, previous);
        final double relative = delta / (MathArrays.safeNorm(previous) + EPS);
        if ((tolerance != null && relative < tolerance) || (minDelta != null
            && delta < minDelta)) {
          final int done = k + 1;
          logger.finest(() -> "AsLS converged after " + done + " iterations");
          break;
        }
      }
    }
    return z;
  }

  private static double[] solveOrKeep(PentadiagonalSystem penalty, double[] w, double[] wy,
      double[] previous, int iteration) {
    try {
      final double[] z = penalty.solve(w, wy);
      for (double v : z) {
        if (!Double.isFinite(v)) {
          logger.fine(() -> "AsLS iteration " + iteration
              + " produced non-finite values, keeping previous estimate");
          return previous;
        }
      }
      return z;
    } catch (NonPositiveDefiniteMatrixException e) {
      logger.log(Level.FINE,
          "AsLS iteration " + iteration + " hit a singular system, keeping previous estimate", e);
      return previous;
    }
  }

  private static void checkFittable(double[] y) {
    if (y.length < MIN_NUMBER_OF_VALUES) {
      throw new DegenerateSpectrumException(
          "AsLS needs at least " + MIN_NUMBER_OF_VALUES + " values but got " + y.length, y.length);
    }
    for (int i = 0; i < y.length; i++) {
      if (!Double.isFinite(y[i])) {
        throw new DegenerateSpectrumException(
            "Intensity at index " + i + " is not finite: " + y[i], y.length);
      }
    }
  }
}
