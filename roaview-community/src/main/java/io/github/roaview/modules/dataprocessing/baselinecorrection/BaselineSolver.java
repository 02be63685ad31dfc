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

import org.jetbrains.annotations.NotNull;

/**
 * Fits a smooth background under an intensity series. Implementations must be pure functions of
 * their input so that fits of different channels may run independently.
 */
@FunctionalInterface
public interface BaselineSolver {

  /**
   * @param intensities intensities of one channel, already cut to the fitted wavenumber range
   * @param parameters  fit settings, the start wavenumber is not used here
   * @return baseline with the same length as the input
   * @throws DegenerateSpectrumException if the input is too short or contains non-finite values
   */
  double @NotNull [] fit(double @NotNull [] intensities, @NotNull BaselineParameters parameters);
}
