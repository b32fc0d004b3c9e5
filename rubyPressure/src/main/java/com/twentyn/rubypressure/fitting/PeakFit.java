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

/**
 * Both ruby lines as located by a {@link PeakLocator}, with the fitted model and the spectrum it was fitted on.
 */
public class PeakFit {
  private final PeakResult r1;
  private final PeakResult r2;
  private final CurveModel curve;
  private final Spectrum spectrum;

  public PeakFit(PeakResult r1, PeakResult r2, CurveModel curve, Spectrum spectrum) {
    this.r1 = r1;
    this.r2 = r2;
    this.curve = curve;
    this.spectrum = spectrum;
  }

  public PeakResult getR1() {
    return r1;
  }

  public PeakResult getR2() {
    return r2;
  }

  public CurveModel getCurve() {
    return curve;
  }

  /**
   * The signal spectrum carrying the fitted curve, focused on the fit windows.
   */
  public Spectrum getSpectrum() {
    return spectrum;
  }
}
