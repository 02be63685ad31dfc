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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One measurement record: a strictly increasing wavenumber axis, named intensity channels aligned
 * to that axis and, after a baseline was created or attached, one baseline per fitted channel.
 * <p>
 * Entries are immutable. All arrays are copied on the way in and on the way out, operations that
 * change intensities or baselines return a new entry.
 */
public final class SpectrumEntry {

  private final double[] wavenumbers;
  private final Map<String, double[]> channels;
  private final SpectrumIdentity identity;
  private final @Nullable Map<String, double[]> baselines;

  public SpectrumEntry(@NotNull SpectrumIdentity identity, double @NotNull [] wavenumbers,
      @NotNull Map<String, double[]> channels) {
    this(identity, wavenumbers, channels, null);
  }

  public SpectrumEntry(@NotNull SpectrumIdentity identity, double @NotNull [] wavenumbers,
      @NotNull Map<String, double[]> channels, @Nullable Map<String, double[]> baselines) {
    this.identity = Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(wavenumbers, "wavenumbers");
    for (int i = 1; i < wavenumbers.length; i++) {
      if (!(wavenumbers[i] > wavenumbers[i - 1])) {
        throw new IllegalArgumentException(
            "Wavenumbers must be strictly increasing, violated at index " + i);
      }
    }
    this.wavenumbers = wavenumbers.clone();
    this.channels = copyAligned(channels, wavenumbers.length, "channel");
    this.baselines = baselines == null ? null
        : copyAligned(baselines, wavenumbers.length, "baseline");
  }

  private static Map<String, double[]> copyAligned(Map<String, double[]> source, int length,
      String what) {
    final Map<String, double[]> copy = new LinkedHashMap<>();
    for (Entry<String, double[]> e : source.entrySet()) {
      final double[] values = Objects.requireNonNull(e.getValue(), what + " " + e.getKey());
      if (values.length != length) {
        throw new IllegalArgumentException(
            "Length of " + what + " " + e.getKey() + " is " + values.length + " but axis has "
                + length + " values");
      }
      copy.put(e.getKey(), values.clone());
    }
    return Collections.unmodifiableMap(copy);
  }

  public @NotNull SpectrumIdentity getIdentity() {
    return identity;
  }

  public int getNumberOfValues() {
    return wavenumbers.length;
  }

  public double[] getWavenumbers() {
    return wavenumbers.clone();
  }

  /**
   * @return index of the first wavenumber that is greater or equal to the given value. Equals
   * {@link #getNumberOfValues()} if all wavenumbers are smaller.
   */
  public int indexOfWavenumber(double wavenumber) {
    final int index = Arrays.binarySearch(wavenumbers, wavenumber);
    return index >= 0 ? index : -index - 1;
  }

  public @NotNull Set<String> getChannelNames() {
    return channels.keySet();
  }

  public boolean hasChannel(@NotNull String name) {
    return channels.containsKey(name);
  }

  public double @Nullable [] getChannel(@NotNull String name) {
    final double[] values = channels.get(name);
    return values == null ? null : values.clone();
  }

  /**
   * @return copies of all channels in column order
   */
  public @NotNull Map<String, double[]> getChannels() {
    return deepCopy(channels);
  }

  /**
   * @return true if a baseline map is attached, even if it is empty
   */
  public boolean hasBaselines() {
    return baselines != null;
  }

  /**
   * @return copies of the attached baselines or null if none are attached
   */
  public @Nullable Map<String, double[]> getBaselines() {
    return baselines == null ? null : deepCopy(baselines);
  }

  public double @Nullable [] getBaseline(@NotNull String channel) {
    if (baselines == null) {
      return null;
    }
    final double[] values = baselines.get(channel);
    return values == null ? null : values.clone();
  }

  public @NotNull SpectrumEntry withChannels(@NotNull Map<String, double[]> newChannels) {
    return new SpectrumEntry(identity, wavenumbers, newChannels, baselines);
  }

  public @NotNull SpectrumEntry withBaselines(@NotNull Map<String, double[]> newBaselines) {
    return new SpectrumEntry(identity, wavenumbers, channels, newBaselines);
  }

  public @NotNull SpectrumEntry withoutBaselines() {
    if (baselines == null) {
      return this;
    }
    return new SpectrumEntry(identity, wavenumbers, channels, null);
  }

  public @NotNull SpectrumEntry withIdentity(@NotNull SpectrumIdentity newIdentity) {
    return new SpectrumEntry(newIdentity, wavenumbers, channels, baselines);
  }

  private static Map<String, double[]> deepCopy(Map<String, double[]> source) {
    final Map<String, double[]> copy = new LinkedHashMap<>();
    source.forEach((k, v) -> copy.put(k, v.clone()));
    return copy;
  }

  @Override
  public String toString() {
    return "SpectrumEntry{" + identity + ", " + wavenumbers.length + " points, channels="
        + channels.keySet() + (baselines != null ? ", baselines=" + baselines.keySet() : "") + "}";
  }
}
