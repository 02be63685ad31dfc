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

import io.github.roaview.datamodel.SpectrumEntry;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * @param entries     all input entries in input order, corrected where a baseline was available
 * @param missingUids UIDs of entries that had neither an attached nor a cached baseline. These
 *                    entries are returned unchanged.
 */
public record BaselineSubtractionResult(@NotNull List<SpectrumEntry> entries,
                                        @NotNull List<String> missingUids) {

  public BaselineSubtractionResult {
    entries = List.copyOf(entries);
    missingUids = List.copyOf(missingUids);
  }

  public boolean isComplete() {
    return missingUids.isEmpty();
  }
}
