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

import com.google.common.collect.ImmutableMap;
import io.github.roaview.datamodel.Modality;
import io.github.roaview.datamodel.SpectrumEntry;
import io.github.roaview.datamodel.SpectrumUidFunction;
import io.github.roaview.modules.dataprocessing.baselinecorrection.asls.AslsBaselineSolver;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes, caches, attaches and subtracts fluorescence baselines of spectrum entries. No plotting
 * or file access happens here.
 * <p>
 * The cache maps the UID of an entry to one baseline per fitted Raman channel. A UID is either
 * absent or computed: {@link #create} moves it to computed and replaces the whole record,
 * {@link #clear} moves it back to absent. {@link #subtract} only reads the cache, so the same
 * baseline can be subtracted from any entry with the same UID.
 * <p>
 * The UID is derived from identity metadata, not from intensities. A cached baseline is therefore
 * served for any entry with the same identity, even if its intensities were changed without a
 * change of identity. Normalization sets a flag in the identity and is safe.
 * <p>
 * Entries are values. All operations return new entries and leave their arguments untouched.
 * Cache access is guarded by a lock, so the manager may be shared between a UI thread and
 * worker tasks.
 */
public class BaselineManager {

  private static final Logger logger = Logger.getLogger(BaselineManager.class.getName());

  private final SpectrumUidFunction uidFunction;
  private final BaselineSolver solver;
  private final Map<String, Map<String, double[]>> cache = new HashMap<>();
  private final ReentrantLock cacheLock = new ReentrantLock();

  public BaselineManager() {
    this(SpectrumUidFunction.IDENTITY_BASED, new AslsBaselineSolver());
  }

  public BaselineManager(@NotNull SpectrumUidFunction uidFunction,
      @NotNull BaselineSolver solver) {
    this.uidFunction = Objects.requireNonNull(uidFunction, "uidFunction");
    this.solver = Objects.requireNonNull(solver, "solver");
  }

  /**
   * Fits baselines for all enabled modalities and attaches them to copies of the entries.
   * Previously attached baselines are dropped and the cache record of each UID is replaced, not
   * merged. Disabled modalities and modalities without a Raman channel in the entry are skipped.
   *
   * @param entries    spectra to fit
   * @param modalities enabled state per modality, missing modalities count as disabled
   * @param parameters fit settings
   * @return the entries with attached baselines, in input order
   * @throws DegenerateSpectrumException if a channel cannot be fitted
   */
  public @NotNull List<SpectrumEntry> create(@NotNull List<SpectrumEntry> entries,
      @NotNull Map<Modality, Boolean> modalities, @NotNull BaselineParameters parameters) {
    final List<SpectrumEntry> result = new ArrayList<>(entries.size());
    for (SpectrumEntry entry : entries) {
      result.add(create(entry, modalities, parameters));
    }
    logger.fine(() -> "Created baselines for " + entries.size() + " spectra with " + parameters);
    return result;
  }

  /**
   * Single entry variant of {@link #create(List, Map, BaselineParameters)}.
   */
  public @NotNull SpectrumEntry create(@NotNull SpectrumEntry entry,
      @NotNull Map<Modality, Boolean> modalities, @NotNull BaselineParameters parameters) {
    final String uid = uidFunction.uid(entry);
    final Map<String, double[]> baselines = computeBaselines(entry, uid, modalities, parameters);

    cacheLock.lock();
    try {
      cache.put(uid, baselines);
    } finally {
      cacheLock.unlock();
    }
    return entry.withBaselines(baselines);
  }

  private Map<String, double[]> computeBaselines(SpectrumEntry entry, String uid,
      Map<Modality, Boolean> modalities, BaselineParameters parameters) {
    final int n = entry.getNumberOfValues();
    final int start = entry.indexOfWavenumber(parameters.getStartWavenumber());

    final Map<String, double[]> baselines = new LinkedHashMap<>();
    for (Modality modality : Modality.values()) {
      if (!Boolean.TRUE.equals(modalities.get(modality))) {
        continue;
      }
      final String column = modality.getRamanColumn();
      final double[] y = entry.getChannel(column);
      if (y == null) {
        continue;
      }
      if (start > 0 && n - start < AslsBaselineSolver.MIN_NUMBER_OF_VALUES) {
        logger.warning(
            () -> "Skipping " + column + " of " + uid + ": only " + (n - start)
                + " points above wavenumber " + parameters.getStartWavenumber());
        continue;
      }

      final double[] tail = start == 0 ? y : Arrays.copyOfRange(y, start, n);
      final double[] fitted = solver.fit(tail, parameters);
      if (fitted.length != tail.length) {
        throw new IllegalStateException(
            "Solver returned " + fitted.length + " values for " + tail.length + " intensities");
      }
      // points below the start wavenumber stay exactly 0
      final double[] baseline = new double[n];
      System.arraycopy(fitted, 0, baseline, start, fitted.length);
      baselines.put(column, baseline);
    }
    return baselines;
  }

  /**
   * Subtracts the attached baseline of each entry from its channels. Entries without an attached
   * baseline get the cached one of their UID first. Entries with neither are returned unchanged
   * and reported in {@link BaselineSubtractionResult#missingUids()}. The cache is kept.
   *
   * @throws BaselineMismatchException if a cached baseline does not match its entry. No entry of
   *                                    the batch is returned in that case.
   */
  public @NotNull BaselineSubtractionResult subtract(@NotNull List<SpectrumEntry> entries,
      @NotNull BaselineSubtractionMode mode) {
    final List<SpectrumEntry> result = new ArrayList<>(entries.size());
    final List<String> missing = new ArrayList<>();
    for (SpectrumEntry entry : entries) {
      final SpectrumEntry attached = attachCachedIfMissing(entry);
      final Map<String, double[]> baselines = attached.getBaselines();
      if (baselines == null) {
        missing.add(uidFunction.uid(entry));
        result.add(entry);
        continue;
      }
      result.add(subtract(attached, baselines, mode));
    }
    if (!missing.isEmpty()) {
      logger.warning(() -> "No baseline available for " + missing.size()
          + " spectra, left unchanged: " + missing);
    }
    return new BaselineSubtractionResult(result, missing);
  }

  private static SpectrumEntry subtract(SpectrumEntry entry, Map<String, double[]> baselines,
      BaselineSubtractionMode mode) {
    final Map<String, double[]> channels = entry.getChannels();
    for (Entry<String, double[]> e : baselines.entrySet()) {
      final double[] y = channels.get(e.getKey());
      if (y == null) {
        continue;
      }
      final double[] z = e.getValue();
      final double offset = mode == BaselineSubtractionMode.TO_REFERENCE ? min(z) : 0d;
      for (int i = 0; i < y.length; i++) {
        y[i] = y[i] - z[i] + offset;
      }
    }
    return entry.withChannels(channels);
  }

  private static double min(double[] values) {
    double min = Double.POSITIVE_INFINITY;
    for (double v : values) {
      min = Math.min(min, v);
    }
    return min;
  }

  /**
   * Attaches the cached baseline of the entry's UID if the entry has none attached. An attached
   * empty map counts as attached, an empty cache record is not attached.
   *
   * @throws BaselineMismatchException if the cached baseline has a different length than the
   *                                    entry
   */
  public @NotNull SpectrumEntry attachCachedIfMissing(@NotNull SpectrumEntry entry) {
    if (entry.hasBaselines()) {
      return entry;
    }
    final String uid = uidFunction.uid(entry);
    final Map<String, double[]> cached = getCachedBaselines(uid);
    if (cached == null || cached.isEmpty()) {
      return entry;
    }
    for (Entry<String, double[]> e : cached.entrySet()) {
      if (e.getValue().length != entry.getNumberOfValues()) {
        throw new BaselineMismatchException(uid, e.getKey(), entry.getNumberOfValues(),
            e.getValue().length);
      }
    }
    return entry.withBaselines(cached);
  }

  /**
   * Removes all cached baselines.
   */
  public void clear() {
    cacheLock.lock();
    try {
      final int size = cache.size();
      cache.clear();
      logger.fine(() -> "Cleared " + size + " cached baselines");
    } finally {
      cacheLock.unlock();
    }
  }

  /**
   * Drops the cache records of the given entries so that they cannot be attached again, and
   * returns the entries without attached baselines.
   */
  public @NotNull List<SpectrumEntry> clear(@NotNull List<SpectrumEntry> entries) {
    final List<SpectrumEntry> result = new ArrayList<>(entries.size());
    cacheLock.lock();
    try {
      for (SpectrumEntry entry : entries) {
        cache.remove(uidFunction.uid(entry));
        result.add(entry.withoutBaselines());
      }
    } finally {
      cacheLock.unlock();
    }
    return result;
  }

  /**
   * @return true if any entry has an attached baseline map that is not empty or a cache record
   */
  public boolean hasAny(@NotNull List<SpectrumEntry> entries) {
    for (SpectrumEntry entry : entries) {
      final Map<String, double[]> attached = entry.getBaselines();
      if (attached != null && !attached.isEmpty()) {
        return true;
      }
      if (isCached(uidFunction.uid(entry))) {
        return true;
      }
    }
    return false;
  }

  public boolean isCached(@NotNull String uid) {
    cacheLock.lock();
    try {
      return cache.containsKey(uid);
    } finally {
      cacheLock.unlock();
    }
  }

  /**
   * @return copies of the cached baselines of a UID, or null if nothing is cached
   */
  public @Nullable Map<String, double[]> getCachedBaselines(@NotNull String uid) {
    cacheLock.lock();
    try {
      final Map<String, double[]> cached = cache.get(uid);
      if (cached == null) {
        return null;
      }
      final ImmutableMap.Builder<String, double[]> copy = ImmutableMap.builder();
      cached.forEach((channel, values) -> copy.put(channel, values.clone()));
      return copy.build();
    } finally {
      cacheLock.unlock();
    }
  }

  public int getNumberOfCachedSpectra() {
    cacheLock.lock();
    try {
      return cache.size();
    } finally {
      cacheLock.unlock();
    }
  }

  public @NotNull SpectrumUidFunction getUidFunction() {
    return uidFunction;
  }
}
