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

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Symmetric matrix with bandwidth 2, stored as its main diagonal and the two upper diagonals.
 * Systems are solved by a banded LDL<sup>T</sup> factorization in O(n).
 */
public class PentadiagonalSystem {

  /**
   * Pivots at or below this fraction of the corresponding diagonal element are treated as zero.
   */
  public static final double RELATIVE_PIVOT_THRESHOLD = 1e-14;

  private final double[] diagonal;
  private final double[] upper1;
  private final double[] upper2;

  /**
   * @param diagonal entries (i, i), length n
   * @param upper1   entries (i, i+1), at least n-1 values
   * @param upper2   entries (i, i+2), at least n-2 values
   */
  public PentadiagonalSystem(double @NotNull [] diagonal, double @NotNull [] upper1,
      double @NotNull [] upper2) {
    final int n = diagonal.length;
    if (upper1.length < Math.max(0, n - 1)) {
      throw new DimensionMismatchException(upper1.length, n - 1);
    }
    if (upper2.length < Math.max(0, n - 2)) {
      throw new DimensionMismatchException(upper2.length, n - 2);
    }
    this.diagonal = diagonal.clone();
    this.upper1 = upper1.clone();
    this.upper2 = upper2.clone();
  }

  /**
   * Builds lambda * D<sup>T</sup>D where D is the (n-2) x n second difference operator with rows
   * [1, -2, 1].
   */
  public static @NotNull PentadiagonalSystem secondDifferencePenalty(int n, double lambda) {
    if (n < 3) {
      throw new IllegalArgumentException("Second differences need at least 3 points, got " + n);
    }
    final double[] d0 = new double[n];
    final double[] d1 = new double[n - 1];
    final double[] d2 = new double[n - 2];
    final double[] row = {1d, -2d, 1d};
    for (int r = 0; r < n - 2; r++) {
      for (int a = 0; a < 3; a++) {
        d0[r + a] += lambda * row[a] * row[a];
      }
      d1[r] += lambda * row[0] * row[1];
      d1[r + 1] += lambda * row[1] * row[2];
      d2[r] += lambda * row[0] * row[2];
    }
    return new PentadiagonalSystem(d0, d1, d2);
  }

  public int getDimension() {
    return diagonal.length;
  }

  public double getEntry(int row, int column) {
    final int i = Math.min(row, column);
    return switch (Math.abs(row - column)) {
      case 0 -> diagonal[i];
      case 1 -> upper1[i];
      case 2 -> upper2[i];
      default -> 0d;
    };
  }

  public double @NotNull [] solve(double @NotNull [] rhs) {
    return solve(null, rhs);
  }

  /**
   * Solves (this + diag(shift)) * x = rhs without modifying this matrix.
   *
   * @param shift values added to the main diagonal or null
   * @throws NonPositiveDefiniteMatrixException if a pivot is not positive or not finite
   */
  public double @NotNull [] solve(double @Nullable [] shift, double @NotNull [] rhs) {
    final int n = diagonal.length;
    if (rhs.length != n) {
      throw new DimensionMismatchException(rhs.length, n);
    }
    if (shift != null && shift.length != n) {
      throw new DimensionMismatchException(shift.length, n);
    }

    // A = L D L^T with unit lower L, sub diagonals l1 (i+1, i) and l2 (i+2, i)
    final double[] d = new double[n];
    final double[] l1 = new double[n];
    final double[] l2 = new double[n];
    for (int i = 0; i < n; i++) {
      final double aii = diagonal[i] + (shift != null ? shift[i] : 0d);
      double pivot = aii;
      if (i >= 1) {
        pivot -= l1[i - 1] * l1[i - 1] * d[i - 1];
      }
      if (i >= 2) {
        pivot -= l2[i - 2] * l2[i - 2] * d[i - 2];
      }
      final double threshold = RELATIVE_PIVOT_THRESHOLD * Math.abs(aii);
      if (!(pivot > threshold) || !Double.isFinite(pivot)) {
        throw new NonPositiveDefiniteMatrixException(pivot, i, threshold);
      }
      d[i] = pivot;

      if (i + 1 < n) {
        double a = upper1[i];
        if (i >= 1) {
          a -= l2[i - 1] * l1[i - 1] * d[i - 1];
        }
        l1[i] = a / pivot;
      }
      if (i + 2 < n) {
        l2[i] = upper2[i] / pivot;
      }
    }

    final double[] x = new double[n];
    // forward substitution, L u = rhs
    for (int i = 0; i < n; i++) {
      double u = rhs[i];
      if (i >= 1) {
        u -= l1[i - 1] * x[i - 1];
      }
      if (i >= 2) {
        u -= l2[i - 2] * x[i - 2];
      }
      x[i] = u;
    }
    for (int i = 0; i < n; i++) {
      x[i] /= d[i];
    }
    // back substitution, L^T x = v
    for (int i = n - 1; i >= 0; i--) {
      if (i + 1 < n) {
        x[i] -= l1[i] * x[i + 1];
      }
      if (i + 2 < n) {
        x[i] -= l2[i] * x[i + 2];
      }
    }
    return x;
  }
}
