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

import com.twentyn.rubypressure.spectrum.CurveModel;
import com.twentyn.rubypressure.spectrum.Spectrum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a background estimate: the fitted continuum, the spectrum it was fitted on, and the signal left
 * after subtracting it.
 */
public class BackgroundFit {
  private final CurveModel background;
  private final Spectrum backgroundSpectrum;
  private final Spectrum signal;
  private final List<Double> meanSquaredErrors;
  private final int iterations;

  public BackgroundFit(CurveModel background, Spectrum backgroundSpectrum, Spectrum signal,
                       List<Double> meanSquaredErrors, int iterations) {
    this.background = background;
    this.backgroundSpectrum = backgroundSpectrum;
    this.signal = signal;
    this.meanSquaredErrors = Collections.unmodifiableList(new ArrayList<>(meanSquaredErrors));
    this.iterations = iterations;
  }

  public CurveModel getBackground() {
    return background;
  }

  /**
   * The input spectrum carrying the background curve and the focus and weighting of the last fit.
   */
  public Spectrum getBackgroundSpectrum() {
    return backgroundSpectrum;
  }

  /**
   * The input samples minus the background, focused on the whole domain.
   */
  public Spectrum getSignal() {
    return signal;
  }

  /**
   * Mean squared error of the seed curve followed by that of every accepted iteration; never increasing.
   */
  public List<Double> getMeanSquaredErrors() {
    return meanSquaredErrors;
  }

  public int getIterations() {
    return iterations;
  }
}
