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

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumEntryTest {

  private static final RawFileIdentity RAW = new RawFileIdentity("/data/lysozyme_A-3_out.txt",
      "lysozyme", "A", 3, false);

  @Test
  void testRejectsUnsortedAxis() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SpectrumEntry(RAW, new double[]{1, 3, 2}, Map.of()));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SpectrumEntry(RAW, new double[]{1, 1, 2}, Map.of()));
  }

  @Test
  void testRejectsMisalignedChannel() {
    final IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SpectrumEntry(RAW, new double[]{1, 2, 3},
            Map.of("SCP Raman", new double[]{1, 2})));
    Assertions.assertTrue(e.getMessage().contains("SCP Raman"));
  }

  @Test
  void testArraysAreCopied() {
    final double[] raman = {5, 6, 7};
    final Map<String, double[]> channels = new LinkedHashMap<>();
    channels.put("SCP Raman", raman);
    final SpectrumEntry entry = new SpectrumEntry(RAW, new double[]{1, 2, 3}, channels);

    raman[0] = -1;
    entry.getChannel("SCP Raman")[1] = -1;
    entry.getChannels().get("SCP Raman")[2] = -1;

    Assertions.assertArrayEquals(new double[]{5, 6, 7}, entry.getChannel("SCP Raman"));
  }

  @Test
  void testBaselineAttachment() {
    final SpectrumEntry entry = new SpectrumEntry(RAW, new double[]{1, 2, 3},
        Map.of("SCP Raman", new double[]{5, 6, 7}));
    Assertions.assertFalse(entry.hasBaselines());
    Assertions.assertNull(entry.getBaselines());

    final SpectrumEntry attached = entry.withBaselines(Map.of("SCP Raman", new double[]{1, 1, 1}));
    Assertions.assertTrue(attached.hasBaselines());
    Assertions.assertArrayEquals(new double[]{1, 1, 1}, attached.getBaseline("SCP Raman"));
    Assertions.assertFalse(entry.hasBaselines());
    Assertions.assertFalse(attached.withoutBaselines().hasBaselines());

    Assertions.assertThrows(IllegalArgumentException.class,
        () -> entry.withBaselines(Map.of("SCP Raman", new double[]{1})));
  }

  @Test
  void testIndexOfWavenumber() {
    final SpectrumEntry entry = new SpectrumEntry(RAW, new double[]{100, 110, 120, 130},
        Map.of());
    Assertions.assertEquals(0, entry.indexOfWavenumber(50));
    Assertions.assertEquals(0, entry.indexOfWavenumber(100));
    Assertions.assertEquals(2, entry.indexOfWavenumber(115));
    Assertions.assertEquals(2, entry.indexOfWavenumber(120));
    Assertions.assertEquals(4, entry.indexOfWavenumber(500));
  }

  @Test
  void testUidDependsOnIdentityOnly() {
    final SpectrumUidFunction uid = SpectrumUidFunction.IDENTITY_BASED;
    final SpectrumEntry a = new SpectrumEntry(RAW, new double[]{1, 2, 3},
        Map.of("SCP Raman", new double[]{5, 6, 7}));
    final SpectrumEntry b = a.withChannels(Map.of("SCP Raman", new double[]{0, 0, 0}));

    Assertions.assertEquals("raw|/data/lysozyme_A-3_out.txt|A|3|norm=false", uid.uid(a));
    Assertions.assertEquals(uid.uid(a), uid.uid(b));
    Assertions.assertNotEquals(uid.uid(a), uid.uid(a.withIdentity(RAW.withNormalized(true))));

    final SpectrumEntry average = a.withIdentity(
        new DerivedIdentity(DerivationKind.AVERAGE, "lysozyme", "A", 1, 5, false));
    Assertions.assertEquals("avg|lysozyme|A|1-5|norm=false", uid.uid(average));
  }

  @Test
  void testModalityColumns() {
    Assertions.assertEquals("DCPII Raman", Modality.DCPII.getRamanColumn());
    Assertions.assertEquals("SCPc ROA", Modality.SCPc.getRoaColumn());
  }
}
