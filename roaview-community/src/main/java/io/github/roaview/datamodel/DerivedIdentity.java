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

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Identity of a spectrum computed from several cycles, e.g. an average over a cycle range. Derived
 * spectra have no source file, the derivation kind and the cycle range identify them instead.
 */
public record DerivedIdentity(@NotNull DerivationKind kind, @NotNull String experiment,
                              @NotNull String camera, int firstCycle, int lastCycle,
                              boolean normalized) implements SpectrumIdentity {

  public DerivedIdentity {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(experiment, "experiment");
    Objects.requireNonNull(camera, "camera");
    if (lastCycle < firstCycle) {
      throw new IllegalArgumentException(
          "Cycle range " + firstCycle + "-" + lastCycle + " is reversed");
    }
  }

  @Override
  public @NotNull DerivedIdentity withNormalized(boolean normalized) {
    return new DerivedIdentity(kind, experiment, camera, firstCycle, lastCycle, normalized);
  }
}
