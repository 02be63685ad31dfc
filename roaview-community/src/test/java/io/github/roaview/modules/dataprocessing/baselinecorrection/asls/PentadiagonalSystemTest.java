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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PentadiagonalSystemTest {

  @Test
  void testSecondDifferencePenaltyEntries() {
    final PentadiagonalSystem penalty = PentadiagonalSystem.secondDifferencePenalty(5, 1d);
    final double[][] expected = {
        {1, -2, 1, 0, 0},
        {-2, 5, -4, 1, 0},
        {1, -4, 6, -4, 1},
        {0, 1, -4, 5, -2},
        {0, 0, 1, -2, 1}};
    for (int i = 0; i < 5; i++) {
      for (int j = 0; j < 5; j++) {
        Assertions.assertEquals(expected[i][j], penalty.getEntry(i, j), 0d, "entry " + i + "," + j);
      }
    }
  }

  @Test
  void testPenaltyNeedsThreePoints() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> PentadiagonalSystem.secondDifferencePenalty(2, 1d));
    Assertions.assertEquals(3, PentadiagonalSystem.secondDifferencePenalty(3, 1d).getDimension());
  }

  @Test
  void testSolveMatchesDenseLu() {
    final int n = 40;
    final PentadiagonalSystem penalty = PentadiagonalSystem.secondDifferencePenalty(n, 250d);
    final double[] shift = new double[n];
    final double[] rhs = new double[n];
    for (int i = 0; i < n; i++) {
      shift[i] = i % 3 == 0 ? 0.01 : 0.99;
      rhs[i] = Math.sin(i / 4d) * 10 + i;
    }

    final RealMatrix dense = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      for (int j = Math.max(0, i - 2); j <= Math.min(n - 1, i + 2); j++) {
        dense.setEntry(i, j, penalty.getEntry(i, j));
      }
      dense.addToEntry(i, i, shift[i]);
    }
    final double[] expected = new LUDecomposition(dense).getSolver()
        .solve(new ArrayRealVector(rhs)).toArray();

    final double[] actual = penalty.solve(shift, rhs);
    Assertions.assertArrayEquals(expected, actual, 1e-6);
  }

  @Test
  void testSolveDoesNotModifyMatrix() {
    final PentadiagonalSystem penalty = PentadiagonalSystem.secondDifferencePenalty(6, 2d);
    final double before = penalty.getEntry(2, 2);
    penalty.solve(new double[]{1, 1, 1, 1, 1, 1}, new double[]{1, 2, 3, 4, 5, 6});
    Assertions.assertEquals(before, penalty.getEntry(2, 2));
  }

  @Test
  void testSingularAndIndefiniteSystemsAreRejected() {
    final PentadiagonalSystem singular = new PentadiagonalSystem(new double[]{1, 0, 1},
        new double[]{0, 0}, new double[]{0});
    Assertions.assertThrows(NonPositiveDefiniteMatrixException.class,
        () -> singular.solve(new double[]{1, 1, 1}));

    final PentadiagonalSystem indefinite = new PentadiagonalSystem(new double[]{1, -1, 1},
        new double[]{0, 0}, new double[]{0});
    Assertions.assertThrows(NonPositiveDefiniteMatrixException.class,
        () -> indefinite.solve(new double[]{1, 1, 1}));
  }
}
