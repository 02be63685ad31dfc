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

package io.github.roaview.modules.dataprocessing.selection;

import io.github.roaview.datamodel.DerivationKind;
import io.github.roaview.datamodel.DerivedIdentity;
import io.github.roaview.datamodel.Modality;
import io.github.roaview.datamodel.RawFileIdentity;
import io.github.roaview.datamodel.SpectrumEntry;
import io.github.roaview.datamodel.SpectrumIdentity;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.jetbrains.annotations.NotNull;

/**
 * Derives the spectra that are shown and fitted from loaded cycle files: averages over a cycle
 * range, summed cycle-to-cycle differences, normalized spectra and merged camera pairs. All derived
 * spectra carry a {@link DerivedIdentity} or a changed normalization flag, so their baseline cache
 * keys never collide with the ones of their sources.
 */
public final class SpectrumSelectionUtils {

  private SpectrumSelectionUtils() {
  }

  /**
   * Point-wise mean of all channels.
   *
   * @param entries spectra of one camera on the same wavenumber grid
   * @throws IllegalArgumentException if entries is empty, the grids differ or a channel is missing
   */
  public static @NotNull SpectrumEntry average(@NotNull List<SpectrumEntry> entries) {
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("Cannot average an empty selection");
    }
    final Map<String, double[]> sum = sumChannels(entries);
    for (double[] values : sum.values()) {
      for (int i = 0; i < values.length; i++) {
        values[i] /= entries.size();
      }
    }
    final SpectrumEntry first = entries.get(0);
    final DerivedIdentity identity = derivedIdentity(DerivationKind.AVERAGE, entries);
    return new SpectrumEntry(identity, first.getWavenumbers(), sum);
  }

  /**
   * Differences between consecutive cycles of one camera. The first cycle is compared against
   * zero intensities.
   *
   * @param entries raw cycle spectra of a single camera and experiment
   * @return delta spectra by cycle
   */
  public static @NotNull NavigableMap<Integer, SpectrumEntry> cycleDeltas(
      @NotNull Collection<SpectrumEntry> entries) {
    final NavigableMap<Integer, SpectrumEntry> byCycle = new TreeMap<>();
    String camera = null;
    for (SpectrumEntry entry : entries) {
      final RawFileIdentity raw = requireRaw(entry);
      if (camera != null && !camera.equals(raw.camera())) {
        throw new IllegalArgumentException(
            "Cycle deltas need a single camera, got " + camera + " and " + raw.camera());
      }
      camera = raw.camera();
      if (byCycle.put(raw.cycle(), entry) != null) {
        throw new IllegalArgumentException("Duplicate cycle " + raw.cycle());
      }
    }

    final NavigableMap<Integer, SpectrumEntry> deltas = new TreeMap<>();
    SpectrumEntry previous = null;
    for (Entry<Integer, SpectrumEntry> e : byCycle.entrySet()) {
      final SpectrumEntry current = e.getValue();
      final Map<String, double[]> channels = current.getChannels();
      if (previous != null) {
        requireSameGrid(previous, current);
        for (Entry<String, double[]> channel : channels.entrySet()) {
          final double[] before = previous.getChannel(channel.getKey());
          if (before == null) {
            continue;
          }
          final double[] values = channel.getValue();
          for (int i = 0; i < values.length; i++) {
            values[i] -= before[i];
          }
        }
      }
      final RawFileIdentity raw = (RawFileIdentity) current.getIdentity();
      final int firstCycle = previous == null ? raw.cycle() : byCycle.lowerKey(raw.cycle());
      final DerivedIdentity identity = new DerivedIdentity(DerivationKind.DELTA,
          raw.experiment(), raw.camera(), firstCycle, raw.cycle(), raw.normalized());
      deltas.put(e.getKey(), new SpectrumEntry(identity, current.getWavenumbers(), channels));
      previous = current;
    }
    return deltas;
  }

  /**
   * Sums the cycle deltas of the selected cycles into one spectrum.
   *
   * @param entries        raw cycle spectra of a single camera, all cycles of the experiment
   * @param selectedCycles cycles to sum, cycles without a spectrum are ignored
   * @throws IllegalArgumentException if none of the selected cycles has a spectrum
   */
  public static @NotNull SpectrumEntry summateCycleDeltas(
      @NotNull Collection<SpectrumEntry> entries, @NotNull Collection<Integer> selectedCycles) {
    final NavigableMap<Integer, SpectrumEntry> deltas = cycleDeltas(entries);
    final List<SpectrumEntry> selected = new TreeSet<>(selectedCycles).stream()
        .filter(deltas::containsKey).map(deltas::get).toList();
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("None of the cycles " + selectedCycles + " is present");
    }
    final Map<String, double[]> sum = sumChannels(selected);
    final DerivedIdentity first = (DerivedIdentity) selected.get(0).getIdentity();
    final DerivedIdentity last = (DerivedIdentity) selected.get(selected.size() - 1)
        .getIdentity();
    final DerivedIdentity identity = new DerivedIdentity(DerivationKind.SUM, first.experiment(),
        first.camera(), first.lastCycle(), last.lastCycle(), first.normalized());
    return new SpectrumEntry(identity, selected.get(0).getWavenumbers(), sum);
  }

  /**
   * Scales the Raman and ROA channel of every modality by the maximum absolute Raman intensity of
   * that modality. Modalities with an all-zero Raman channel are left as they are. Attached
   * baselines are dropped because they no longer match the intensities.
   */
  public static @NotNull SpectrumEntry normalize(@NotNull SpectrumEntry entry) {
    final Map<String, double[]> channels = entry.getChannels();
    for (Modality modality : Modality.values()) {
      final double[] raman = channels.get(modality.getRamanColumn());
      if (raman == null) {
        continue;
      }
      double max = 0d;
      for (double v : raman) {
        max = Math.max(max, Math.abs(v));
      }
      if (max == 0d) {
        continue;
      }
      scale(raman, 1d / max);
      final double[] roa = channels.get(modality.getRoaColumn());
      if (roa != null) {
        scale(roa, 1d / max);
      }
    }
    return new SpectrumEntry(entry.getIdentity().withNormalized(true), entry.getWavenumbers(),
        channels);
  }

  /**
   * Combines the spectra of camera A and B. Both are linearly interpolated onto the union of their
   * wavenumber axes, with 0 outside of each axis, and averaged. Only channels present in both
   * spectra are merged.
   */
  public static @NotNull SpectrumEntry mergeCameras(@NotNull SpectrumEntry a,
      @NotNull SpectrumEntry b) {
    final double[] xa = a.getWavenumbers();
    final double[] xb = b.getWavenumbers();
    final TreeSet<Double> union = new TreeSet<>();
    Arrays.stream(xa).forEach(union::add);
    Arrays.stream(xb).forEach(union::add);
    final double[] x = union.stream().mapToDouble(Double::doubleValue).toArray();

    final Set<String> columns = new LinkedHashSet<>(a.getChannelNames());
    columns.retainAll(b.getChannelNames());
    final Map<String, double[]> merged = new LinkedHashMap<>();
    for (String column : columns) {
      final double[] ya = interpolate(xa, a.getChannel(column), x);
      final double[] yb = interpolate(xb, b.getChannel(column), x);
      final double[] mean = new double[x.length];
      for (int i = 0; i < x.length; i++) {
        mean[i] = (ya[i] + yb[i]) / 2d;
      }
      merged.put(column, mean);
    }

    final SpectrumIdentity ia = a.getIdentity();
    final SpectrumIdentity ib = b.getIdentity();
    final int[] range = cycleRange(List.of(a, b));
    final DerivedIdentity identity = new DerivedIdentity(DerivationKind.MERGE, ia.experiment(),
        ia.camera() + ib.camera(), range[0], range[1], ia.normalized() && ib.normalized());
    return new SpectrumEntry(identity, x, merged);
  }

  private static void scale(double[] values, double factor) {
    for (int i = 0; i < values.length; i++) {
      values[i] *= factor;
    }
  }

  private static double[] interpolate(double[] x, double[] y, double[] target) {
    final double[] result = new double[target.length];
    if (x.length == 0) {
      return result;
    }
    if (x.length == 1) {
      for (int i = 0; i < target.length; i++) {
        result[i] = target[i] == x[0] ? y[0] : 0d;
      }
      return result;
    }
    final PolynomialSplineFunction f = new LinearInterpolator().interpolate(x, y);
    for (int i = 0; i < target.length; i++) {
      result[i] = f.isValidPoint(target[i]) ? f.value(target[i]) : 0d;
    }
    return result;
  }

  private static Map<String, double[]> sumChannels(List<SpectrumEntry> entries) {
    final SpectrumEntry first = entries.get(0);
    final Map<String, double[]> sum = first.getChannels();
    for (SpectrumEntry other : entries.subList(1, entries.size())) {
      requireSameGrid(first, other);
      if (!other.getIdentity().camera().equals(first.getIdentity().camera())) {
        throw new IllegalArgumentException(
            "Cannot combine cameras " + first.getIdentity().camera() + " and "
                + other.getIdentity().camera());
      }
      for (Entry<String, double[]> e : sum.entrySet()) {
        if (!other.hasChannel(e.getKey())) {
          throw new IllegalArgumentException("Spectrum " + other + " lacks channel " + e.getKey());
        }
        final double[] values = other.getChannel(e.getKey());
        final double[] target = e.getValue();
        for (int i = 0; i < target.length; i++) {
          target[i] += values[i];
        }
      }
    }
    return sum;
  }

  private static DerivedIdentity derivedIdentity(DerivationKind kind,
      List<SpectrumEntry> entries) {
    final SpectrumIdentity first = entries.get(0).getIdentity();
    final int[] range = cycleRange(entries);
    final boolean normalized = entries.stream().allMatch(e -> e.getIdentity().normalized());
    return new DerivedIdentity(kind, first.experiment(), first.camera(), range[0], range[1],
        normalized);
  }

  private static int[] cycleRange(List<SpectrumEntry> entries) {
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (SpectrumEntry entry : entries) {
      final SpectrumIdentity identity = entry.getIdentity();
      if (identity instanceof RawFileIdentity raw) {
        min = Math.min(min, raw.cycle());
        max = Math.max(max, raw.cycle());
      } else if (identity instanceof DerivedIdentity derived) {
        min = Math.min(min, derived.firstCycle());
        max = Math.max(max, derived.lastCycle());
      }
    }
    return new int[]{min, max};
  }

  private static RawFileIdentity requireRaw(SpectrumEntry entry) {
    if (entry.getIdentity() instanceof RawFileIdentity raw) {
      return raw;
    }
    throw new IllegalArgumentException("Expected a raw cycle spectrum but got " + entry);
  }

  private static void requireSameGrid(SpectrumEntry a, SpectrumEntry b) {
    if (!Arrays.equals(a.getWavenumbers(), b.getWavenumbers())) {
      throw new IllegalArgumentException(
          "Spectra " + a.getIdentity() + " and " + b.getIdentity()
              + " are not on the same wavenumber grid");
    }
  }
}
