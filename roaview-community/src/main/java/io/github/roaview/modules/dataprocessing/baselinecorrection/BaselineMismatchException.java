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

/**
 * Thrown when a cached baseline does not fit the spectrum it should be attached to. This happens
 * if the UID function maps spectra with different wavenumber axes to the same key.
 */
public class BaselineMismatchException extends IllegalStateException {

  private final String uid;
  private final int expectedNumberOfValues;
  private final int actualNumberOfValues;

  public BaselineMismatchException(String uid, String channel, int expectedNumberOfValues,
      int actualNumberOfValues) {
    super("Cached baseline " + channel + " of " + uid + " has " + actualNumberOfValues
        + " values but the spectrum has " + expectedNumberOfValues);
    this.uid = uid;
    this.expectedNumberOfValues = expectedNumberOfValues;
    this.actualNumberOfValues = actualNumberOfValues;
  }

  public String getUid() {
    return uid;
  }

  /**
   * @return number of values of the spectrum
   */
  public int getExpectedNumberOfValues() {
    return expectedNumberOfValues;
  }

  /**
   * @return number of values of the cached baseline
   */
  public int getActualNumberOfValues() {
    return actualNumberOfValues;
  }
}
