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
 * Two Gaussian lobes plus a third, correcting lobe centered half-way between them, parameters
 * (a1, mu1, si1, a2, mu2, si2, a, si).  The extra lobe absorbs the intensity filling the valley between R1 and R2
 * in broadened spectra.  Its width is hypot(si, {@link #MIN_MIDDLE_WIDTH}): when the data holds no middle lobe, a
 * tends to zero and si is left unconstrained, and the floor keeps it from collapsing onto a single sample.
 */
public class CamelShape extends AbstractCurveShape {
  // nm, the sampling step of a typical spectrometer.
  public static final double MIN_MIDDLE_WIDTH = 0.05;

  public CamelShape() {
    super("Camel", "a1", "mu1", "si1", "a2", "mu2", "si2", "a", "si");
  }

  static double middleWidth(double si) {
    return FastMath.sqrt(si * si + MIN_MIDDLE_WIDTH * MIN_MIDDLE_WIDTH);
  }

  @Override
  public double value(double x, double[] p) {
    return gaussian(x, p[0], p[1], p[2]) + gaussian(x, p[3], p[4], p[5])
        + gaussian(x, p[6], (p[1] + p[4]) / 2.0, middleWidth(p[7]));
  }

  @Override
  public double[] gradient(double x, double[] p) {
    double[] gradient = new double[8];
    addGaussianGradient(gradient, 0, x, p[0], p[1], p[2]);
    addGaussianGradient(gradient, 3, x, p[3], p[4], p[5]);

    // The middle lobe depends on both centers through its own center (mu1 + mu2) / 2.
    double width = middleWidth(p[7]);
    double[] middle = new double[3];
    addGaussianGradient(middle, 0, x, p[6], (p[1] + p[4]) / 2.0, width);
    gradient[6] = middle[0];
    gradient[1] += middle[1] / 2.0;
    gradient[4] += middle[1] / 2.0;
    gradient[7] = middle[2] * p[7] / width;
    return gradient;
  }
}
