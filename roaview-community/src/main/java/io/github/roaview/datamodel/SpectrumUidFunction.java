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
 * Derives the stable cache key of a spectrum entry.
 */
@FunctionalInterface
public interface SpectrumUidFunction {

  /**
   * Builds the key from the identity only: raw files by path, camera, cycle and normalization;
   * derived spectra by derivation kind, experiment, camera, cycle range and normalization.
   */
  SpectrumUidFunction IDENTITY_BASED = entry -> {
    final SpectrumIdentity identity = entry.getIdentity();
    if (identity instanceof RawFileIdentity raw) {
      return "raw|" + raw.path() + "|" + raw.camera() + "|" + raw.cycle() + "|norm="
          + raw.normalized();
    }
    final DerivedIdentity derived = (DerivedIdentity) identity;
    return derived.kind().getUidPrefix() + "|" + derived.experiment() + "|" + derived.camera()
        + "|" + derived.firstCycle() + "-" + derived.lastCycle() + "|norm=" + derived.normalized();
  };

  @NotNull String uid(@NotNull SpectrumEntry entry);
}
