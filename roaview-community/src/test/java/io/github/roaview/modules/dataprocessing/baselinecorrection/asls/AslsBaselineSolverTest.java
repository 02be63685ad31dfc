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

import io.github.roaview.modules.dataprocessing.baselinecorrection.BaselineParameters;
import io.github.roaview.modules.dataprocessing.baselinecorrection.DegenerateSpectrumException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AslsBaselineSolverTest {

  private final AslsBaselineSolver solver = new AslsBaselineSolver();

  @Test
  void testSparsePeaksOnZeroFloor() {
    final double[] y = {0, 0, 0, 5, 0, 0, 0, 5, 0, 0, 0};
    final double[] z = solver.fit(y, new BaselineParameters(1e5, 0.01, 10));

    Assertions.assertEquals(y.length, z.length);
    for (double v : z) {
      Assertions.assertTrue(Math.abs(v) < 0.5, "baseline value " + v + " should be close to 0");
    }
  }

  @Test
  void testBaselineStaysNearFloorForSmallP() {
    final int n = 150;
    final double floor = 10d;
    final double spike = 40d;
    final double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = i % 15 == 7 ? floor + spike : floor;
    }

    final double[] z = solver.fit(y, 1e4, 0.001, 20, null, null);

    double maxDeviation = 0d;
    for (double v : z) {
      maxDeviation = Math.max(maxDeviation, Math.abs(v - floor));
    }
    Assertions.assertTrue(maxDeviation < spike / 2, "max deviation was " + maxDeviation);
  }

  @Test
  void testLargerLambdaGivesSmootherBaseline() {
    final int n = 200;
    final double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = i % 20;
    }

    final double rough = curvature(solver.fit(y, 1e1, 0.05, 10, null, null));
    final double medium = curvature(solver.fit(y, 1e3, 0.05, 10, null, null));
    final double stiff = curvature(solver.fit(y, 1e5, 0.05, 10, null, null));

    Assertions.assertTrue(rough > medium, rough + " should be larger than " + medium);
    Assertions.assertTrue(medium > stiff, medium + " should be larger than " + stiff);
  }

  @Test
  void testFitIsDeterministic() {
    final double[] y = new double[80];
    for (int i = 0; i < y.length; i++) {
      y[i] = 100 * Math.exp(-i / 40d) + (i % 11 == 0 ? 30 : 0);
    }
    final BaselineParameters parameters = new BaselineParameters(1e3, 0.02, 15);
    Assertions.assertArrayEquals(solver.fit(y, parameters), solver.fit(y.clone(), parameters), 0d);
  }

  @Test
  void testToleranceStopsAfterSecondIteration() {
    final double[] y = new double[60];
    for (int i = 0; i < y.length; i++) {
      y[i] = 0.5 * i + (i % 9 == 4 ? 20 : 0);
    }

    final double[] twoIterations = solver.fit(y, 1e4, 0.01, 2, null, null);
    final double[] relativeStop = solver.fit(y, 1e4, 0.01, 50, 1e9, null);
    final double[] absoluteStop = solver.fit(y, 1e4, 0.01, 50, null, 1e9);

    Assertions.assertArrayEquals(twoIterations, relativeStop, 0d);
    Assertions.assertArrayEquals(twoIterations, absoluteStop, 0d);
  }

  @Test
  void testMinimumLengthIsAccepted() {
    final double[] z = solver.fit(new double[]{1, 4, 2}, new BaselineParameters(10, 0.1, 5));
    Assertions.assertEquals(3, z.length);
    for (double v : z) {
      Assertions.assertTrue(Double.isFinite(v));
    }
  }

  @Test
  void testDegenerateInputIsRejected() {
    final BaselineParameters parameters = BaselineParameters.defaults();
    final DegenerateSpectrumException tooShort = Assertions.assertThrows(
        DegenerateSpectrumException.class, () -> solver.fit(new double[]{1, 2}, parameters));
    Assertions.assertEquals(2, tooShort.getNumberOfValues());

    Assertions.assertThrows(DegenerateSpectrumException.class,
        () -> solver.fit(new double[0], parameters));
    Assertions.assertThrows(DegenerateSpectrumException.class,
        () -> solver.fit(new double[]{1, Double.NaN, 2, 3}, parameters));
  }

  @Test
  void testIllConditionedSystemIsRecovered() {
    final double[] y = new double[20];
    for (int i = 0; i < y.length; i++) {
      y[i] = i % 4;
    }

    final double[] z = Assertions.assertDoesNotThrow(() -> solver.fit(y, 1e18, 0.01, 5, null,
        null));
    // every solve fails, so the estimate stays at its starting point, a copy of y
    Assertions.assertArrayEquals(y, z, 0d);
    Assertions.assertNotSame(y, z);
  }

  private static double curvature(double[] z) {
    double sum = 0d;
    for (int i = 2; i < z.length; i++) {
      final double d2 = z[i] - 2 * z[i - 1] + z[i - 2];
      sum += d2 * d2;
    }
    return Math.sqrt(sum);
  }
}
