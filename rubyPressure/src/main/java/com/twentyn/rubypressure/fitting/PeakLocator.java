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

import com.twentyn.rubypressure.calibration.RubyConstants;
import com.twentyn.rubypressure.spectrum.CurveModel;
import com.twentyn.rubypressure.spectrum.Spectrum;
import com.twentyn.rubypressure.spectrum.WeightingPolicy;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Locates R1 and R2 on a background-free spectrum.
 *
 * Candidate lines come from a {@link WaveletPeakFinder}.  The tallest candidate is R1; the second tallest is taken
 * as R2 only if it lies between {@link #MIN_SEPARATION} and {@link #MAX_SEPARATION} nm below R1, otherwise R2 is
 * placed a fixed fraction below R1 at half its height.  The chosen {@link PeakShape} is then fitted twice on windows
 * around both lines: first with sigmas inversely proportional to the signal, which favours the line tops, then from
 * that result with the configured weighting to get the final parameters and their covariance.
 */
public class PeakLocator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakLocator.class);

  public static final String STAGE = "peak fitting";

  public static final double MIN_SEPARATION = 1.0;
  public static final double MAX_SEPARATION = 3.0;
  // Relative offset of a synthesized R2 below R1.
  private static final double R2_RELATIVE_OFFSET = 0.002;
  // Floor of |y| in the first-pass sigmas, relative to the largest |y|.
  private static final double SIGNAL_FLOOR = 1e-3;

  private final PeakShape peakShape;
  private final WeightingPolicy weighting;
  private final WaveletPeakFinder finder;
  private final CurveFitter fitter;

  public PeakLocator(PeakShape peakShape) {
    this(peakShape, WeightingPolicy.EQUAL, new WaveletPeakFinder());
  }

  public PeakLocator(PeakShape peakShape, WeightingPolicy weighting, WaveletPeakFinder finder) {
    this.peakShape = peakShape;
    this.weighting = weighting;
    this.finder = finder;
    this.fitter = new CurveFitter(STAGE, peakShape.getName());
  }

  public PeakShape getPeakShape() {
    return peakShape;
  }

  /**
   * Rough positions and heights of R1 and R2 from the wavelet candidates, as {r1x, r1y, r2x, r2y}.
   */
  double[] initialGuess(Spectrum spectrum) {
    List<Pair<Double, Double>> candidates = finder.findPeaks(spectrum);
    if (candidates.isEmpty()) {
      double maxY = spectrum.maxY();
      LOGGER.warn("No peak candidates found, starting from the ambient line positions");
      return new double[]{RubyConstants.R1_0.getNominal(), maxY, RubyConstants.R2_0.getNominal(), maxY / 2.0};
    }

    double r1x = candidates.get(0).getLeft(), r1y = candidates.get(0).getRight();
    if (candidates.size() > 1) {
      double r2x = candidates.get(1).getLeft();
      if (r1x - MAX_SEPARATION < r2x && r2x < r1x - MIN_SEPARATION) {
        return new double[]{r1x, r1y, r2x, candidates.get(1).getRight()};
      }
      LOGGER.warn("Second candidate at %.3f nm is not a plausible R2 for R1 at %.3f nm, synthesizing one", r2x, r1x);
    } else {
      LOGGER.warn("Only one peak candidate found at %.3f nm, synthesizing R2", r1x);
    }
    return new double[]{r1x, r1y, r1x * (1.0 - R2_RELATIVE_OFFSET), r1y / 2.0};
  }

  public PeakFit locate(Spectrum signal) throws InsufficientDataException, FitConvergenceException {
    if (signal.isEmpty()) {
      throw new InsufficientDataException(STAGE, peakShape.getName(), peakShape.getShape().getParameterCount() + 1, 0);
    }
    double[] guess = initialGuess(signal);
    LOGGER.debug("Initial guess: R1 at %.4f (%.4g), R2 at %.4f (%.4g)", guess[0], guess[1], guess[2], guess[3]);

    CurveModel start = new CurveModel(peakShape.getShape(),
        peakShape.initialParameters(guess[0], guess[1], guess[2], guess[3]));
    Spectrum windowed = peakShape.focus(signal.withCurve(start), guess[0], guess[2]).withWeighting(weighting);
    Spectrum focused = windowed.focused();

    double[] y = focused.getY();
    double maxAbs = 0.0;
    for (double value : y) {
      maxAbs = FastMath.max(maxAbs, FastMath.abs(value));
    }
    double[] sigmas = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      sigmas[i] = maxAbs == 0.0 ? 1.0 : 1.0 / FastMath.max(FastMath.abs(y[i]), SIGNAL_FLOOR * maxAbs);
    }
    CurveModel firstPass = fitter.fit(start, focused.getX(), y, sigmas);

    Spectrum refocused = windowed.withCurve(firstPass).focused();
    CurveModel fitted = fitter.fit(firstPass, refocused.getX(), refocused.getY(), refocused.residualWeights());

    PeakResult r1 = new PeakResult(fitted.getParameter(peakShape.getR1PositionIndex()),
        fitted.getParameter(peakShape.getR1HeightIndex()));
    PeakResult r2 = new PeakResult(fitted.getParameter(peakShape.getR2PositionIndex()),
        fitted.getParameter(peakShape.getR2HeightIndex()));
    LOGGER.info("%s fit located R1 at %s nm and R2 at %s nm", peakShape.getName(), r1.getPosition(), r2.getPosition());
    return new PeakFit(r1, r2, fitted, windowed.withCurve(fitted));
  }
}
