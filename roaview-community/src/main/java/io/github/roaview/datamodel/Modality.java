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

package io.github.roaview.datamodel;

import org.jetbrains.annotations.NotNull;

/**
 * The four acquisition configurations of the dual-camera ROA instrument. Every modality yields a
 * Raman and an ROA channel in a spectrum entry.
 */
public enum Modality {

  SCP("SCP"), DCPI("DCPI"), DCPII("DCPII"), SCPc("SCPc");

  private final String label;

  Modality(String label) {
    this.label = label;
  }

  public @NotNull String getLabel() {
    return label;
  }

  /**
   * @return the channel name of the Raman intensities, e.g. "SCP Raman"
   */
  public @NotNull String getRamanColumn() {
    return label + " Raman";
  }

  public @NotNull String getRoaColumn() {
    return label + " ROA";
  }

  @Override
  public String toString() {
    return label;
  }
}
