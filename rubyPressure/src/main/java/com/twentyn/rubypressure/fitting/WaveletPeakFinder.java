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

import com.twentyn.rubypressure.spectrum.Spectrum;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds candidate peaks in a spectrum with a continuous wavelet transform.
 *
 * The y-values are convolved with Ricker (Mexican hat) wavelets of a few widths derived from the sampling density.
 * Local maxima of the widest transform seed ridge lines that are followed down to the narrowest width, moving at
 * most a quarter width per step.  A ridge is kept when it spans at least half of the widths and its strongest
 * coefficient exceeds the local noise, taken as a low percentile of the narrowest transform around it.
 */
public class WaveletPeakFinder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WaveletPeakFinder.class);

  // Characteristic width of a ruby line, in nm.
  private static final double DEFAULT_LINE_WIDTH = 0.5;
  private static final double[] WIDTH_FRACTIONS = {0.5, 0.75, 1.0};
  private static final double NOISE_PERCENTILE = 10.0;
  private static final double MIN_SNR = 1.0;

  private final double lineWidth;

  public WaveletPeakFinder() {
    this(DEFAULT_LINE_WIDTH);
  }

  public WaveletPeakFinder(double lineWidth) {
    this.lineWidth = lineWidth;
  }

  /**
   * The widest wavelet, in samples: the number of samples per line width, plus one.
   */
  int widestWidth(Spectrum spectrum) {
    double span = spectrum.maxX() - spectrum.minX();
    if (span <= 0.0) {
      return 1;
    }
    return (int) (lineWidth / (span / spectrum.size())) + 1;
  }

  /**
   * @return candidate (x, y) peaks, tallest first
   */
  public List<Pair<Double, Double>> findPeaks(Spectrum spectrum) {
    List<Pair<Double, Double>> peaks = new ArrayList<>();
    int n = spectrum.size();
    if (n < 3) {
      return peaks;
    }
    double[] y = spectrum.getY();

    int widest = widestWidth(spectrum);
    double[] widths = new double[WIDTH_FRACTIONS.length];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = FastMath.max(1.0, WIDTH_FRACTIONS[i] * widest);
    }
    double[][] transform = new double[widths.length][];
    for (int i = 0; i < widths.length; i++) {
      transform[i] = convolve(y, ricker(FastMath.min(10 * (int) FastMath.ceil(widths[i]), n), widths[i]));
    }

    int narrowest = 0;
    int noiseWindow = FastMath.max(1, (int) FastMath.ceil(n / 20.0));
    Percentile percentile = new Percentile(NOISE_PERCENTILE);
    double[] magnitude = new double[n];
    for (int i = 0; i < n; i++) {
      magnitude[i] = FastMath.abs(transform[narrowest][i]);
    }

    List<Integer> accepted = new ArrayList<>();
    for (int seed : localMaxima(transform[widths.length - 1])) {
      int position = seed;
      int length = 1;
      double strongest = transform[widths.length - 1][seed];
      for (int row = widths.length - 2; row >= 0; row--) {
        int maxMove = FastMath.max(1, (int) FastMath.ceil(widths[row] / 4.0));
        int next = nearestMaximum(transform[row], position, maxMove);
        if (next < 0) {
          break;
        }
        position = next;
        length++;
        strongest = FastMath.max(strongest, transform[row][next]);
      }
      if (length * 2 < widths.length) {
        continue;
      }

      int from = FastMath.max(0, position - noiseWindow), to = FastMath.min(n, position + noiseWindow + 1);
      double noise = percentile.evaluate(magnitude, from, to - from);
      double snr = noise > 0.0 ? strongest / noise : (strongest > 0.0 ? Double.POSITIVE_INFINITY : 0.0);
      if (snr < MIN_SNR) {
        LOGGER.debug("Dropping candidate at x = %.4f, snr %.3f", spectrum.getX(position), snr);
        continue;
      }
      if (!accepted.contains(position)) {
        accepted.add(position);
      }
    }

    for (int index : accepted) {
      peaks.add(Pair.of(spectrum.getX(index), spectrum.getY(index)));
    }
    peaks.sort(Comparator.comparing(Pair<Double, Double>::getRight).reversed());
    LOGGER.debug("Wavelet search with widths %s found %d candidates: %s", Arrays.toString(widths), peaks.size(), peaks);
    return peaks;
  }

  /**
   * Ricker wavelet sampled at the given number of points, normalized as in the usual CWT definition.
   */
  static double[] ricker(int points, double width) {
    double amplitude = 2.0 / (FastMath.sqrt(3.0 * width) * FastMath.pow(FastMath.PI, 0.25));
    double[] kernel = new double[points];
    double center = (points - 1) / 2.0;
    for (int i = 0; i < points; i++) {
      double t = (i - center) / width;
      kernel[i] = amplitude * (1.0 - t * t) * FastMath.exp(-t * t / 2.0);
    }
    return kernel;
  }

  /**
   * Convolution trimmed to the signal's length and centered on it; samples beyond the ends count as zero.
   */
  static double[] convolve(double[] signal, double[] kernel) {
    int n = signal.length, m = kernel.length, half = (m - 1) / 2;
    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      for (int j = 0; j < m; j++) {
        int index = i + half - j;
        if (index >= 0 && index < n) {
          sum += signal[index] * kernel[j];
        }
      }
      result[i] = sum;
    }
    return result;
  }

  static List<Integer> localMaxima(double[] values) {
    List<Integer> maxima = new ArrayList<>();
    for (int i = 1; i < values.length - 1; i++) {
      if (values[i] > values[i - 1] && values[i] >= values[i + 1] && values[i] > 0.0) {
        maxima.add(i);
      }
    }
    return maxima;
  }

  private static int nearestMaximum(double[] values, int position, int maxMove) {
    int best = -1;
    for (int move = 0; move <= maxMove && best < 0; move++) {
      for (int candidate : new int[]{position - move, position + move}) {
        if (candidate < 1 || candidate > values.length - 2) {
          continue;
        }
        if (values[candidate] > values[candidate - 1] && values[candidate] >= values[candidate + 1]
            && (best < 0 || values[candidate] > values[best])) {
          best = candidate;
        }
      }
    }
    return best;
  }
}
