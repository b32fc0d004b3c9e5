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

package com.twentyn.rubypressure.spectrum;

import org.apache.commons.math3.util.FastMath;

/**
 * Sum of two pseudo-Voigt lobes, parameters (a1, mu1, w1, eta1, a2, mu2, w2, eta2).  Each lobe mixes a Gaussian and
 * a Lorentzian sharing amplitude a, center mu and full width at half maximum w, in the proportion eta : (1 - eta).
 */
public class TwoPseudoVoigtsShape extends AbstractCurveShape {
  private static final double FWHM_TO_SIGMA = 1.0 / FastMath.sqrt(8.0 * FastMath.log(2.0));

  public TwoPseudoVoigtsShape() {
    super("Two pseudo-Voigts", "a1", "mu1", "w1", "eta1", "a2", "mu2", "w2", "eta2");
  }

  static double pseudoVoigt(double x, double amplitude, double center, double width, double eta) {
    return eta * gaussian(x, amplitude, center, width * FWHM_TO_SIGMA)
        + (1.0 - eta) * lorentzian(x, amplitude, center, width / 2.0);
  }

  @Override
  public double value(double x, double[] p) {
    return pseudoVoigt(x, p[0], p[1], p[2], p[3]) + pseudoVoigt(x, p[4], p[5], p[6], p[7]);
  }
}
