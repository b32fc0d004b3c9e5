/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.rubypressure.fitting;

import com.twentyn.rubypressure.SyntheticSpectra;
import com.twentyn.rubypressure.spectrum.Spectrum;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class WaveletPeakFinderTest {
  private final WaveletPeakFinder finder = new WaveletPeakFinder();

  @Test
  public void testFindsBothLinesTallestFirst() throws Exception {
    List<Pair<Double, Double>> peaks = finder.findPeaks(SyntheticSpectra.standard());
    assertTrue("At least two candidates: " + peaks, peaks.size() >= 2);
    assertEquals("R1 is the tallest", 694.2, peaks.get(0).getLeft(), 0.1);
    assertEquals("R1 height", 1.0, peaks.get(0).getRight(), 0.05);
    assertEquals("R2 is second", 692.8, peaks.get(1).getLeft(), 0.15);
    for (int i = 1; i < peaks.size(); i++) {
      assertTrue("Sorted by height", peaks.get(i).getRight() <= peaks.get(i - 1).getRight());
    }
  }

  @Test
  public void testFlatSpectrumHasNoCandidates() throws Exception {
    double[] x = SyntheticSpectra.grid(690.0, 700.0, SyntheticSpectra.STEP);
    assertTrue("No peaks in a zero spectrum", finder.findPeaks(new Spectrum(x, new double[x.length])).isEmpty());
  }

  @Test
  public void testTinySpectrumHasNoCandidates() throws Exception {
    assertTrue(finder.findPeaks(new Spectrum(new double[]{1, 2}, new double[]{0, 5})).isEmpty());
  }

  @Test
  public void testWidestWidthFollowsSampling() throws Exception {
    assertEquals("Samples per half nanometer, plus one", 11, finder.widestWidth(SyntheticSpectra.standard()));
  }

  @Test
  public void testRickerIsSymmetricWithPositiveCenter() throws Exception {
    double[] kernel = WaveletPeakFinder.ricker(21, 3.0);
    assertEquals("Symmetric", kernel[0], kernel[20], 1e-15);
    assertEquals("Symmetric", kernel[7], kernel[13], 1e-15);
    assertTrue("Positive center", kernel[10] > 0.0);
    assertTrue("Negative side lobes", kernel[5] < 0.0);
  }

  @Test
  public void testConvolutionWithUnitKernel() throws Exception {
    double[] signal = {1.0, 2.0, 3.0};
    assertEquals(2.0, WaveletPeakFinder.convolve(signal, new double[]{0.0, 1.0, 0.0})[1], 0.0);
    assertEquals("Beyond the ends counts as zero", 3.0,
        WaveletPeakFinder.convolve(signal, new double[]{1.0, 1.0, 1.0})[0], 0.0);
  }
}
